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
package org.meshcore.registry;

import java.util.ArrayList;
import java.util.List;
import org.meshcore.common.endpoint.EndpointStatus;
import org.meshcore.common.event.HeartbeatSignal;

/**
 * A heartbeat. The identity fields ({@code appId}, {@code serviceNames}, {@code host}, {@code
 * port}, {@code maxConnections}) are only used to auto-register an unknown instance.
 */
public class HeartbeatRequest {
  private String instanceId;
  private EndpointStatus status = EndpointStatus.HEALTHY;
  private double loadPercent;
  private int currentConnections;
  private List<String> issues = new ArrayList<>();

  private String appId;
  private List<String> serviceNames = new ArrayList<>();
  private String host;
  private Integer port;
  private Integer maxConnections;

  public static HeartbeatRequest of(
      String instanceId, EndpointStatus status, double loadPercent, int currentConnections) {
    return new HeartbeatRequest()
        .setInstanceId(instanceId)
        .setStatus(status)
        .setLoadPercent(loadPercent)
        .setCurrentConnections(currentConnections);
  }

  public static HeartbeatRequest fromSignal(HeartbeatSignal signal) {
    HeartbeatRequest request =
        of(
                signal.getInstanceId(),
                signal.getStatus() == null ? EndpointStatus.HEALTHY : signal.getStatus(),
                signal.getLoadPercent(),
                signal.getCurrentConnections())
            .setAppId(signal.getAppId())
            .setHost(signal.getHost())
            .setPort(signal.getPort())
            .setMaxConnections(signal.getMaxConnections())
            .setIssues(signal.getIssues());
    if (signal.getServiceNames() != null) {
      request.setServiceNames(signal.getServiceNames());
    }
    return request;
  }

  public String getInstanceId() {
    return instanceId;
  }

  public HeartbeatRequest setInstanceId(String instanceId) {
    this.instanceId = instanceId;
    return this;
  }

  public EndpointStatus getStatus() {
    return status;
  }

  public HeartbeatRequest setStatus(EndpointStatus status) {
    this.status = status;
    return this;
  }

  public double getLoadPercent() {
    return loadPercent;
  }

  public HeartbeatRequest setLoadPercent(double loadPercent) {
    this.loadPercent = loadPercent;
    return this;
  }

  public int getCurrentConnections() {
    return currentConnections;
  }

  public HeartbeatRequest setCurrentConnections(int currentConnections) {
    this.currentConnections = currentConnections;
    return this;
  }

  public List<String> getIssues() {
    return issues;
  }

  /** Replaces, not appends to, the issues stored with the endpoint. */
  public HeartbeatRequest setIssues(List<String> issues) {
    this.issues = issues == null ? new ArrayList<String>() : new ArrayList<>(issues);
    return this;
  }

  public String getAppId() {
    return appId;
  }

  public HeartbeatRequest setAppId(String appId) {
    this.appId = appId;
    return this;
  }

  public List<String> getServiceNames() {
    return serviceNames;
  }

  public HeartbeatRequest setServiceNames(List<String> serviceNames) {
    this.serviceNames = new ArrayList<>(serviceNames);
    return this;
  }

  public String getHost() {
    return host;
  }

  public HeartbeatRequest setHost(String host) {
    this.host = host;
    return this;
  }

  public Integer getPort() {
    return port;
  }

  public HeartbeatRequest setPort(Integer port) {
    this.port = port;
    return this;
  }

  public Integer getMaxConnections() {
    return maxConnections;
  }

  public HeartbeatRequest setMaxConnections(Integer maxConnections) {
    this.maxConnections = maxConnections;
    return this;
  }
}
