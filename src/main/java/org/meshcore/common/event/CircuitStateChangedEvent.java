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
package org.meshcore.common.event;

/**
 * Broadcast of a breaker transition. Receivers overwrite their local view of {@code appId} with
 * the carried state.
 */
public class CircuitStateChangedEvent extends MeshEvent {
  private final String appId;
  private final String newState;
  private final String previousState;
  private final int consecutiveFailures;
  private final long openedAt;

  public CircuitStateChangedEvent(
      String appId,
      String newState,
      String previousState,
      int consecutiveFailures,
      long openedAt,
      long timestamp) {
    super(timestamp);
    this.appId = appId;
    this.newState = newState;
    this.previousState = previousState;
    this.consecutiveFailures = consecutiveFailures;
    this.openedAt = openedAt;
  }

  public String getAppId() {
    return appId;
  }

  public String getNewState() {
    return newState;
  }

  public String getPreviousState() {
    return previousState;
  }

  public int getConsecutiveFailures() {
    return consecutiveFailures;
  }

  public long getOpenedAt() {
    return openedAt;
  }
}
