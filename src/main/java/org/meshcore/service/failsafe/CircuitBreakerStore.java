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
package org.meshcore.service.failsafe;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.meshcore.common.exception.CasConflictException;
import org.meshcore.common.store.KvStore;
import org.meshcore.common.util.BackOffFunction;
import org.meshcore.common.util.BackOffer;
import org.meshcore.common.util.ConcreteBackOffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Breaker records under {@code mesh:circuit:{appId}}. Every update is a compare-and-set against the
 * value it was computed from, retried on conflict, so concurrent writers in any process never lose
 * an update.
 */
public class CircuitBreakerStore {
  private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerStore.class);

  public static final String CIRCUIT_KEY_PREFIX = "mesh:circuit:";

  private static final Gson gson = new Gson();

  private final KvStore store;
  private final int casMaxAttempts;

  public CircuitBreakerStore(KvStore store, int casMaxAttempts) {
    this.store = store;
    this.casMaxAttempts = casMaxAttempts;
  }

  public static String circuitKey(String appId) {
    return CIRCUIT_KEY_PREFIX + appId;
  }

  public CircuitBreakerRecord read(String appId) {
    return decode(appId, store.get(circuitKey(appId)));
  }

  /**
   * Applies mutation atomically.
   *
   * @return the record before and after the update; both are equal if mutation changed nothing
   * @throws org.meshcore.common.exception.DependencyUnavailableException if the store is
   *     unreachable or contention outlasts the attempt limit
   */
  public Update update(String appId, UnaryOperator<CircuitBreakerRecord> mutation) {
    String key = circuitKey(appId);
    BackOffer backOffer = ConcreteBackOffer.newCasBackOff(casMaxAttempts);
    while (true) {
      Optional<String> raw = store.get(key);
      CircuitBreakerRecord previous = decode(appId, raw);
      CircuitBreakerRecord next = mutation.apply(previous);
      if (next.equals(previous)) {
        return new Update(previous, next);
      }
      try {
        store.compareAndSet(key, raw, gson.toJson(next), 0);
        return new Update(previous, next);
      } catch (CasConflictException e) {
        backOffer.doBackOff(BackOffFunction.BackOffFuncType.BoStoreCas, e);
      }
    }
  }

  private CircuitBreakerRecord decode(String appId, Optional<String> raw) {
    if (!raw.isPresent()) {
      return CircuitBreakerRecord.CLOSED;
    }
    try {
      CircuitBreakerRecord record = gson.fromJson(raw.get(), CircuitBreakerRecord.class);
      return record == null ? CircuitBreakerRecord.CLOSED : record;
    } catch (JsonParseException e) {
      logger.warn(
          String.format("unreadable breaker record for [%s], treating as closed", appId), e);
      return CircuitBreakerRecord.CLOSED;
    }
  }

  public static final class Update {
    private final CircuitBreakerRecord previous;
    private final CircuitBreakerRecord current;

    Update(CircuitBreakerRecord previous, CircuitBreakerRecord current) {
      this.previous = previous;
      this.current = current;
    }

    public CircuitBreakerRecord getPrevious() {
      return previous;
    }

    public CircuitBreakerRecord getCurrent() {
      return current;
    }

    public boolean isTransition() {
      return previous.getState() != current.getState();
    }
  }
}
