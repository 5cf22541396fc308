/*
 * Copyright 2021 TiKV Project Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */
package org.meshcore.common.store;

import java.time.Clock;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.meshcore.common.exception.CasConflictException;
import org.meshcore.common.exception.DependencyUnavailableException;

/**
 * In-process {@link KvStore}. Expiry is evaluated lazily against the supplied clock, so an expired
 * key behaves as absent from the moment its deadline passes. Processes sharing one instance see the
 * same data, which is how several mesh sessions are wired together in a single JVM.
 */
public class MemoryKvStore implements KvStore {

  private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
  private final Clock clock;
  private final AtomicBoolean available = new AtomicBoolean(true);

  public MemoryKvStore(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock is null");
  }

  /** Simulates the backend going away; every call then throws until it is made available again. */
  public void setAvailable(boolean available) {
    this.available.set(available);
  }

  @Override
  public void put(String key, String value, long ttl) {
    checkAvailable();
    entries.put(key, Entry.ofValue(value, deadline(ttl)));
  }

  @Override
  public Optional<String> get(String key) {
    checkAvailable();
    Entry entry = live(key);
    if (entry == null || entry.value == null) {
      return Optional.empty();
    }
    return Optional.of(entry.value);
  }

  @Override
  public void delete(String key) {
    checkAvailable();
    entries.remove(key);
  }

  @Override
  public void compareAndSet(String key, Optional<String> prevValue, String value, long ttl) {
    checkAvailable();
    long now = clock.millis();
    long deadline = deadline(ttl);
    entries.compute(
        key,
        (k, current) -> {
          Optional<String> currentValue =
              current == null || current.isExpired(now) || current.value == null
                  ? Optional.empty()
                  : Optional.of(current.value);
          if (!currentValue.equals(prevValue)) {
            throw new CasConflictException(key, prevValue, currentValue);
          }
          return Entry.ofValue(value, deadline);
        });
  }

  @Override
  public boolean setAdd(String key, String member) {
    checkAvailable();
    long now = clock.millis();
    boolean[] added = new boolean[1];
    entries.compute(
        key,
        (k, current) -> {
          Entry next =
              current == null || current.isExpired(now) || current.members == null
                  ? Entry.ofMembers(Collections.<String>emptySet(), 0)
                  : current;
          Set<String> members = new HashSet<>(next.members);
          added[0] = members.add(member);
          return Entry.ofMembers(members, next.expireAt);
        });
    return added[0];
  }

  @Override
  public boolean setRemove(String key, String member) {
    checkAvailable();
    long now = clock.millis();
    boolean[] removed = new boolean[1];
    entries.computeIfPresent(
        key,
        (k, current) -> {
          if (current.isExpired(now) || current.members == null) {
            return current.isExpired(now) ? null : current;
          }
          Set<String> members = new HashSet<>(current.members);
          removed[0] = members.remove(member);
          return members.isEmpty() ? null : Entry.ofMembers(members, current.expireAt);
        });
    return removed[0];
  }

  @Override
  public Set<String> setMembers(String key) {
    checkAvailable();
    Entry entry = live(key);
    if (entry == null || entry.members == null) {
      return Collections.emptySet();
    }
    return Collections.unmodifiableSet(entry.members);
  }

  @Override
  public boolean expire(String key, long ttl) {
    checkAvailable();
    long now = clock.millis();
    long deadline = deadline(ttl);
    boolean[] found = new boolean[1];
    entries.computeIfPresent(
        key,
        (k, current) -> {
          if (current.isExpired(now)) {
            return null;
          }
          found[0] = true;
          return current.withExpireAt(deadline);
        });
    return found[0];
  }

  @Override
  public void ping() {
    checkAvailable();
  }

  @Override
  public void close() {
    entries.clear();
  }

  private Entry live(String key) {
    Entry entry = entries.get(key);
    if (entry == null) {
      return null;
    }
    if (entry.isExpired(clock.millis())) {
      entries.remove(key, entry);
      return null;
    }
    return entry;
  }

  private long deadline(long ttl) {
    return ttl > 0 ? clock.millis() + ttl * 1000 : 0;
  }

  private void checkAvailable() {
    if (!available.get()) {
      throw new DependencyUnavailableException("key-value store is not reachable");
    }
  }

  // Immutable; replaced as a whole on every write.
  private static final class Entry {
    private final String value;
    private final Set<String> members;
    private final long expireAt;

    private Entry(String value, Set<String> members, long expireAt) {
      this.value = value;
      this.members = members;
      this.expireAt = expireAt;
    }

    static Entry ofValue(String value, long expireAt) {
      return new Entry(value, null, expireAt);
    }

    static Entry ofMembers(Set<String> members, long expireAt) {
      return new Entry(null, members, expireAt);
    }

    Entry withExpireAt(long expireAt) {
      return new Entry(value, members, expireAt);
    }

    boolean isExpired(long now) {
      return expireAt > 0 && now >= expireAt;
    }
  }
}
