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

import java.util.Collections;
import java.util.List;
import org.meshcore.common.endpoint.Endpoint;

public class EndpointsResult {
  private final String appId;
  private final List<Endpoint> endpoints;
  private final int healthyCount;
  private final int totalCount;

  public EndpointsResult(String appId, List<Endpoint> endpoints, int healthyCount, int totalCount) {
    this.appId = appId;
    this.endpoints = Collections.unmodifiableList(endpoints);
    this.healthyCount = healthyCount;
    this.totalCount = totalCount;
  }

  public String getAppId() {
    return appId;
  }

  public List<Endpoint> getEndpoints() {
    return endpoints;
  }

  public int getHealthyCount() {
    return healthyCount;
  }

  public int getTotalCount() {
    return totalCount;
  }
}
