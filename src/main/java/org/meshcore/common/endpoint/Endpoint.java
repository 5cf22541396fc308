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
package org.meshcore.common.endpoint;

import com.google.common.base.MoreObjects;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One registered service instance. Timestamps are epoch milliseconds so the record serializes to
 * plain JSON.
 */
public class Endpoint {
  private String instanceId;
  private String appId;
  private List<String> serviceNames = new ArrayList<>();
  private String host;
  private int port;
  private EndpointStatus status = EndpointStatus.HEALTHY;
  private int maxConnections;
  private int currentConnections;
  private double loadPercent;
  private long lastHeartbeatAt;
  private long registeredAt;
  private List<String> issues = new ArrayList<>();

  public Endpoint() {}

  public Endpoint(Endpoint other) {
    this.instanceId = other.instanceId;
    this.appId = other.appId;
    this.serviceNames = new ArrayList<>(other.getServiceNames());
    this.host = other.host;
    this.port = other.port;
    this.status = other.status;
    this.maxConnections = other.maxConnections;
    this.currentConnections = other.currentConnections;
    this.loadPercent = other.loadPercent;
    this.lastHeartbeatAt = other.lastHeartbeatAt;
    this.registeredAt = other.registeredAt;
    this.issues = new ArrayList<>(other.getIssues());
  }

  public String getInstanceId() {
    return instanceId;
  }

  public Endpoint setInstanceId(String instanceId) {
    this.instanceId = instanceId;
    return this;
  }

  public String getAppId() {
    return appId;
  }

  public Endpoint setAppId(String appId) {
    this.appId = appId;
    return this;
  }

  public List<String> getServiceNames() {
    return serviceNames == null ? Collections.<String>emptyList() : serviceNames;
  }

  public Endpoint setServiceNames(Collection<String> serviceNames) {
    this.serviceNames =
        serviceNames == null ? new ArrayList<String>() : new ArrayList<>(serviceNames);
    return this;
  }

  public boolean servesService(String serviceName) {
    for (String name : getServiceNames()) {
      if (name.equalsIgnoreCase(serviceName)) {
        return true;
      }
    }
    return false;
  }

  public String getHost() {
    return host;
  }

  public Endpoint setHost(String host) {
    this.host = host;
    return this;
  }

  public int getPort() {
    return port;
  }

  public Endpoint setPort(int port) {
    this.port = port;
    return this;
  }

  public EndpointStatus getStatus() {
    return status;
  }

  public Endpoint setStatus(EndpointStatus status) {
    this.status = status;
    return this;
  }

  public int getMaxConnections() {
    return maxConnections;
  }

  public Endpoint setMaxConnections(int maxConnections) {
    this.maxConnections = maxConnections;
    return this;
  }

  public int getCurrentConnections() {
    return currentConnections;
  }

  public Endpoint setCurrentConnections(int currentConnections) {
    this.currentConnections = currentConnections;
    return this;
  }

  public double getLoadPercent() {
    return loadPercent;
  }

  public Endpoint setLoadPercent(double loadPercent) {
    this.loadPercent = loadPercent;
    return this;
  }

  public long getLastHeartbeatAt() {
    return lastHeartbeatAt;
  }

  public Endpoint setLastHeartbeatAt(long lastHeartbeatAt) {
    this.lastHeartbeatAt = lastHeartbeatAt;
    return this;
  }

  public long getRegisteredAt() {
    return registeredAt;
  }

  public Endpoint setRegisteredAt(long registeredAt) {
    this.registeredAt = registeredAt;
    return this;
  }

  public List<String> getIssues() {
    return issues == null ? Collections.<String>emptyList() : issues;
  }

  public Endpoint setIssues(Collection<String> issues) {
    this.issues = issues == null ? new ArrayList<String>() : new ArrayList<>(issues);
    return this;
  }

  /** Weight used by the weighted algorithms: the lower the load the higher the weight. */
  public int effectiveWeight() {
    return (int) Math.max(100 - Math.round(loadPercent), 1);
  }

  public String getAddress() {
    return host + ":" + port;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Endpoint)) {
      return false;
    }
    Endpoint that = (Endpoint) o;
    return port == that.port
        && maxConnections == that.maxConnections
        && currentConnections == that.currentConnections
        && Double.compare(that.loadPercent, loadPercent) == 0
        && lastHeartbeatAt == that.lastHeartbeatAt
        && registeredAt == that.registeredAt
        && Objects.equals(instanceId, that.instanceId)
        && Objects.equals(appId, that.appId)
        && Objects.equals(getServiceNames(), that.getServiceNames())
        && Objects.equals(host, that.host)
        && status == that.status
        && Objects.equals(getIssues(), that.getIssues());
  }

  @Override
  public int hashCode() {
    return Objects.hash(instanceId, appId, host, port, status, lastHeartbeatAt);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("instanceId", instanceId)
        .add("appId", appId)
        .add("address", getAddress())
        .add("status", status)
        .add("load", loadPercent)
        .add("connections", currentConnections)
        .toString();
  }
}
