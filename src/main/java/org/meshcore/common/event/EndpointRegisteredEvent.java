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
import org.meshcore.common.endpoint.Endpoint;

public class EndpointRegisteredEvent extends MeshEvent {
  private final String instanceId;
  private final String appId;
  private final List<String> serviceNames;
  private final String host;
  private final int port;

  public EndpointRegisteredEvent(Endpoint endpoint, long timestamp) {
    super(timestamp);
    this.instanceId = endpoint.getInstanceId();
    this.appId = endpoint.getAppId();
    this.serviceNames = new ArrayList<>(endpoint.getServiceNames());
    this.host = endpoint.getHost();
    this.port = endpoint.getPort();
  }

  public String getInstanceId() {
    return instanceId;
  }

  public String getAppId() {
    return appId;
  }

  public List<String> getServiceNames() {
    return serviceNames;
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }
}
