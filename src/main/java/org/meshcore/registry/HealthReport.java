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

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import org.meshcore.common.endpoint.Endpoint;
import org.meshcore.common.endpoint.EndpointStatus;
import org.meshcore.common.endpoint.EndpointSummary;

public class HealthReport {
  private final EndpointStatus status;
  private final boolean storeConnected;
  private final EndpointSummary summary;
  private final Duration uptime;
  private final List<Endpoint> endpoints;

  public HealthReport(
      EndpointStatus status,
      boolean storeConnected,
      EndpointSummary summary,
      Duration uptime,
      List<Endpoint> endpoints) {
    this.status = status;
    this.storeConnected = storeConnected;
    this.summary = summary;
    this.uptime = uptime;
    this.endpoints = Collections.unmodifiableList(endpoints);
  }

  public EndpointStatus getStatus() {
    return status;
  }

  public boolean isStoreConnected() {
    return storeConnected;
  }

  public EndpointSummary getSummary() {
    return summary;
  }

  public Duration getUptime() {
    return uptime;
  }

  /** Uptime as {@code "1d 2h 3m"}. */
  public String getUptimeText() {
    return formatUptime(uptime);
  }

  /** Empty unless the endpoints were asked for. */
  public List<Endpoint> getEndpoints() {
    return endpoints;
  }

  static String formatUptime(Duration uptime) {
    long minutes = uptime.toMinutes();
    return String.format("%dd %dh %dm", minutes / (24 * 60), (minutes / 60) % 24, minutes % 60);
  }
}
