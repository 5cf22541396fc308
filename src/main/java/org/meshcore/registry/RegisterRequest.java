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
import java.util.Collection;
import java.util.List;

public class RegisterRequest {
  private String instanceId;
  private String appId;
  private String host;
  private int port;
  private List<String> serviceNames = new ArrayList<>();
  private Integer maxConnections;

  public static RegisterRequest of(String appId, String host, int port) {
    return new RegisterRequest().setAppId(appId).setHost(host).setPort(port);
  }

  public String getInstanceId() {
    return instanceId;
  }

  /** Optional. A fresh id is generated when absent. */
  public RegisterRequest setInstanceId(String instanceId) {
    this.instanceId = instanceId;
    return this;
  }

  public String getAppId() {
    return appId;
  }

  public RegisterRequest setAppId(String appId) {
    this.appId = appId;
    return this;
  }

  public String getHost() {
    return host;
  }

  public RegisterRequest setHost(String host) {
    this.host = host;
    return this;
  }

  public int getPort() {
    return port;
  }

  public RegisterRequest setPort(int port) {
    this.port = port;
    return this;
  }

  public List<String> getServiceNames() {
    return serviceNames;
  }

  public RegisterRequest setServiceNames(Collection<String> serviceNames) {
    this.serviceNames = new ArrayList<>(serviceNames);
    return this;
  }

  public Integer getMaxConnections() {
    return maxConnections;
  }

  public RegisterRequest setMaxConnections(Integer maxConnections) {
    this.maxConnections = maxConnections;
    return this;
  }
}
