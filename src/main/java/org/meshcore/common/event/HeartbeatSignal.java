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

import java.util.ArrayList;
import java.util.List;
import org.meshcore.common.endpoint.EndpointStatus;

/**
 * Liveness signal a service instance publishes on {@link MeshTopics#HEARTBEAT}. Only {@code
 * instanceId} is mandatory; absent fields fall back to configured defaults on auto-registration.
 */
public class HeartbeatSignal {
  private String instanceId;
  private String appId;
  private List<String> serviceNames = new ArrayList<>();
  private String host;
  private Integer port;
  private EndpointStatus status;
  private double loadPercent;
  private int currentConnections;
  private Integer maxConnections;
  private List<String> issues;

  public String getInstanceId() {
    return instanceId;
  }

  public HeartbeatSignal setInstanceId(String instanceId) {
    this.instanceId = instanceId;
    return this;
  }

  public String getAppId() {
    return appId;
  }

  public HeartbeatSignal setAppId(String appId) {
    this.appId = appId;
    return this;
  }

  public List<String> getServiceNames() {
    return serviceNames;
  }

  public HeartbeatSignal setServiceNames(List<String> serviceNames) {
    this.serviceNames = serviceNames;
    return this;
  }

  public String getHost() {
    return host;
  }

  public HeartbeatSignal setHost(String host) {
    this.host = host;
    return this;
  }

  public Integer getPort() {
    return port;
  }

  public HeartbeatSignal setPort(Integer port) {
    this.port = port;
    return this;
  }

  public EndpointStatus getStatus() {
    return status;
  }

  public HeartbeatSignal setStatus(EndpointStatus status) {
    this.status = status;
    return this;
  }

  public double getLoadPercent() {
    return loadPercent;
  }

  public HeartbeatSignal setLoadPercent(double loadPercent) {
    this.loadPercent = loadPercent;
    return this;
  }

  public int getCurrentConnections() {
    return currentConnections;
  }

  public HeartbeatSignal setCurrentConnections(int currentConnections) {
    this.currentConnections = currentConnections;
    return this;
  }

  public Integer getMaxConnections() {
    return maxConnections;
  }

  public HeartbeatSignal setMaxConnections(Integer maxConnections) {
    this.maxConnections = maxConnections;
    return this;
  }

  public List<String> getIssues() {
    return issues;
  }

  public HeartbeatSignal setIssues(List<String> issues) {
    this.issues = issues;
    return this;
  }
}
