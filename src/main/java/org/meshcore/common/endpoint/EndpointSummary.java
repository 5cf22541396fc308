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
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/** Counts of endpoints by status. */
public class EndpointSummary {
  private final int totalEndpoints;
  private final int healthyCount;
  private final int degradedCount;
  private final int unavailableCount;
  private final int shuttingDownCount;
  private final int uniqueAppIds;

  private EndpointSummary(
      int totalEndpoints,
      int healthyCount,
      int degradedCount,
      int unavailableCount,
      int shuttingDownCount,
      int uniqueAppIds) {
    this.totalEndpoints = totalEndpoints;
    this.healthyCount = healthyCount;
    this.degradedCount = degradedCount;
    this.unavailableCount = unavailableCount;
    this.shuttingDownCount = shuttingDownCount;
    this.uniqueAppIds = uniqueAppIds;
  }

  public static EndpointSummary of(Collection<Endpoint> endpoints) {
    int healthy = 0;
    int degraded = 0;
    int unavailable = 0;
    int shuttingDown = 0;
    Set<String> appIds = new HashSet<>();
    for (Endpoint endpoint : endpoints) {
      appIds.add(endpoint.getAppId());
      switch (endpoint.getStatus()) {
        case HEALTHY:
          healthy++;
          break;
        case DEGRADED:
          degraded++;
          break;
        case UNAVAILABLE:
          unavailable++;
          break;
        case SHUTTING_DOWN:
          shuttingDown++;
          break;
      }
    }
    return new EndpointSummary(
        endpoints.size(), healthy, degraded, unavailable, shuttingDown, appIds.size());
  }

  public int getTotalEndpoints() {
    return totalEndpoints;
  }

  public int getHealthyCount() {
    return healthyCount;
  }

  public int getDegradedCount() {
    return degradedCount;
  }

  public int getUnavailableCount() {
    return unavailableCount;
  }

  public int getShuttingDownCount() {
    return shuttingDownCount;
  }

  public int getUniqueAppIds() {
    return uniqueAppIds;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("total", totalEndpoints)
        .add("healthy", healthyCount)
        .add("degraded", degradedCount)
        .add("unavailable", unavailableCount)
        .add("shuttingDown", shuttingDownCount)
        .add("appIds", uniqueAppIds)
        .toString();
  }
}
