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

public interface BackOffer {

  /**
   * doBackOff sleeps a while base on the BackOffType and records the error. Once the attempt limit
   * is reached it throws an exception to the caller instead of sleeping.
   */
  void doBackOff(BackOffFunction.BackOffFuncType funcType, Exception err);

  /**
   * canRetryAfterSleep sleeps a while base on the BackOffType. It returns false without sleeping
   * if the attempt limit has been reached.
   */
  boolean canRetryAfterSleep(BackOffFunction.BackOffFuncType funcType);

  /** Number of back offs done so far for the given type. */
  int getAttempts(BackOffFunction.BackOffFuncType funcType);

  // Back off strategies
  enum BackOffStrategy {
    // NoJitter makes the backoff sequence strict exponential.
    NoJitter,
    // FullJitter applies random factors to strict exponential.
    FullJitter,
    // EqualJitter is also randomized, but prevents very short sleeps.
    EqualJitter
  }
}
