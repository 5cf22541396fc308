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

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * A key-value store shared by every mesh process. Single-key operations are atomic; nothing spans
 * multiple keys. Every operation throws {@link
 * org.meshcore.common.exception.DependencyUnavailableException} when the backend cannot be
 * reached.
 */
public interface KvStore extends AutoCloseable {

  /**
   * Put a key-value pair.
   *
   * @param key key
   * @param value value
   * @param ttl the ttl of the key (in seconds), 0 means the key will never be outdated
   */
  void put(String key, String value, long ttl);

  /**
   * Put a key-value pair.
   *
   * @see #put(String, String, long)
   * @param key key
   * @param value value
   * @param duration the duration of the key, 0 means the key will never be outdated
   * @param timeUnit the time unit of duration
   */
  default void put(String key, String value, long duration, TimeUnit timeUnit) {
    put(key, value, timeUnit.toSeconds(duration));
  }

  /**
   * Get the value of a key.
   *
   * @param key key
   * @return the value, or Optional.empty() if the key is absent or expired
   */
  Optional<String> get(String key);

  /**
   * Delete a key of any kind.
   *
   * @param key key
   */
  void delete(String key);

  /**
   * Put a key-value pair if prevValue matches the current value. This API is atomic.
   *
   * @param key key
   * @param prevValue expected current value, Optional.empty() if the key must be absent
   * @param value new value
   * @param ttl TTL of key (in seconds), 0 means the key will never be outdated.
   * @throws org.meshcore.common.exception.CasConflictException if the current value differs
   */
  void compareAndSet(String key, Optional<String> prevValue, String value, long ttl);

  /**
   * Add a member to the set stored at key, creating the set if needed.
   *
   * @return true if the member was not present before
   */
  boolean setAdd(String key, String member);

  /**
   * Remove a member from the set stored at key.
   *
   * @return true if the member was present
   */
  boolean setRemove(String key, String member);

  /** Members of the set stored at key, empty if the key is absent or expired. */
  Set<String> setMembers(String key);

  /**
   * Reset the TTL of an existing key.
   *
   * @param ttl TTL in seconds, 0 means the key will never be outdated.
   * @return false if the key does not exist
   */
  boolean expire(String key, long ttl);

  /** Round trip to the backend. Throws if it cannot be reached. */
  void ping();

  @Override
  void close();
}
