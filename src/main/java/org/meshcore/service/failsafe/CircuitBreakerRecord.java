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

import com.google.common.base.MoreObjects;
import java.util.Objects;

/** Shared breaker state of one app id. {@code openedAt} is epoch millis, 0 when never opened. */
public final class CircuitBreakerRecord {
  public static final CircuitBreakerRecord CLOSED =
      new CircuitBreakerRecord(CircuitBreaker.State.CLOSED, 0, 0);

  private final CircuitBreaker.State state;
  private final int consecutiveFailures;
  private final long openedAt;

  public CircuitBreakerRecord(CircuitBreaker.State state, int consecutiveFailures, long openedAt) {
    this.state = state;
    this.consecutiveFailures = consecutiveFailures;
    this.openedAt = openedAt;
  }

  public CircuitBreaker.State getState() {
    return state == null ? CircuitBreaker.State.CLOSED : state;
  }

  public int getConsecutiveFailures() {
    return consecutiveFailures;
  }

  public long getOpenedAt() {
    return openedAt;
  }

  CircuitBreakerRecord withFailures(int consecutiveFailures) {
    return new CircuitBreakerRecord(getState(), consecutiveFailures, openedAt);
  }

  CircuitBreakerRecord transitTo(CircuitBreaker.State next, long openedAt) {
    return new CircuitBreakerRecord(next, consecutiveFailures, openedAt);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CircuitBreakerRecord)) {
      return false;
    }
    CircuitBreakerRecord that = (CircuitBreakerRecord) o;
    return consecutiveFailures == that.consecutiveFailures
        && openedAt == that.openedAt
        && getState() == that.getState();
  }

  @Override
  public int hashCode() {
    return Objects.hash(getState(), consecutiveFailures, openedAt);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("state", getState())
        .add("consecutiveFailures", consecutiveFailures)
        .add("openedAt", openedAt)
        .toString();
  }
}
