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

import org.meshcore.common.endpoint.Endpoint;

public class EndpointDegradedEvent extends MeshEvent {
  public enum DegradedReason {
    MISSED_HEARTBEAT,
    HIGH_LOAD,
    HIGH_CONNECTION_COUNT
  }

  private final String instanceId;
  private final String appId;
  private final DegradedReason reason;
  private final double loadPercent;
  private final int currentConnections;

  public EndpointDegradedEvent(Endpoint endpoint, DegradedReason reason, long timestamp) {
    super(timestamp);
    this.instanceId = endpoint.getInstanceId();
    this.appId = endpoint.getAppId();
    this.reason = reason;
    this.loadPercent = endpoint.getLoadPercent();
    this.currentConnections = endpoint.getCurrentConnections();
  }

  public String getInstanceId() {
    return instanceId;
  }

  public String getAppId() {
    return appId;
  }

  public DegradedReason getReason() {
    return reason;
  }

  public double getLoadPercent() {
    return loadPercent;
  }

  public int getCurrentConnections() {
    return currentConnections;
  }
}
