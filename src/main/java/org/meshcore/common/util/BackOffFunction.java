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
package org.meshcore.common.util;

import java.util.concurrent.ThreadLocalRandom;

public class BackOffFunction {
  private final int base;
  private final int cap;
  private final BackOffer.BackOffStrategy strategy;
  private long lastSleep;
  private int attempts;

  private BackOffFunction(int base, int cap, BackOffer.BackOffStrategy strategy) {
    this.base = base;
    this.cap = cap;
    this.strategy = strategy;
    lastSleep = base;
  }

  public static BackOffFunction create(int base, int cap, BackOffer.BackOffStrategy strategy) {
    return new BackOffFunction(base, cap, strategy);
  }

  int getAttempts() {
    return attempts;
  }

  /**
   * Exponential back off with optional jitter. Without jitter the n-th sleep (zero based) is {@code
   * min(cap, base * 2^n)}.
   */
  long getSleepMs() {
    long sleep = 0;
    long v = expo(base, cap, attempts);
    switch (strategy) {
      case NoJitter:
        sleep = v;
        break;
      case FullJitter:
        sleep = v > 0 ? ThreadLocalRandom.current().nextLong(v) : 0;
        break;
      case EqualJitter:
        sleep = v / 2 > 0 ? v / 2 + ThreadLocalRandom.current().nextLong(v / 2) : v;
        break;
    }

    attempts++;
    lastSleep = sleep;
    return lastSleep;
  }

  private long expo(int base, int cap, int n) {
    return (long) Math.min(cap, base * Math.pow(2.0d, n));
  }

  public enum BackOffFuncType {
    // retry of a failed invocation against a target service
    BoInvokeRetry,
    // contention on a compare-and-set in the shared store
    BoStoreCas
  }
}
