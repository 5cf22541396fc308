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

import java.io.Closeable;

/** Per app id fault isolation. */
public interface CircuitBreaker extends Closeable {

  enum State {
    CLOSED,
    OPEN,
    HALF_OPEN;
  }

  /**
   * Every call asks this before touching the network. Returns false while the circuit is open and
   * the reset window has not elapsed. Once it has, the circuit moves to half-open and calls are let
   * through as probes.
   *
   * @param appId target app id
   * @return whether the call should be attempted
   */
  boolean isCallAllowed(String appId);

  /** Invoked after a successful call. Resets the failure count and closes a half-open circuit. */
  void recordSuccess(String appId);

  /**
   * Invoked after a call failed for good. Opens the circuit once the failure threshold is reached,
   * or immediately when half-open.
   */
  void recordFailure(String appId);

  State getState(String appId);

  @Override
  void close();
}
