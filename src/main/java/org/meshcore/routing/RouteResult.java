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
package org.meshcore.routing;

import com.google.common.base.MoreObjects;
import java.util.Collections;
import java.util.List;
import org.meshcore.common.endpoint.Endpoint;

public class RouteResult {
  private final String appId;
  private final Endpoint primary;
  private final List<Endpoint> alternates;
  private final LoadBalancerAlgorithm algorithm;

  public RouteResult(
      String appId, Endpoint primary, List<Endpoint> alternates, LoadBalancerAlgorithm algorithm) {
    this.appId = appId;
    this.primary = primary;
    this.alternates = Collections.unmodifiableList(alternates);
    this.algorithm = algorithm;
  }

  public String getAppId() {
    return appId;
  }

  public Endpoint getPrimary() {
    return primary;
  }

  public List<Endpoint> getAlternates() {
    return alternates;
  }

  public LoadBalancerAlgorithm getAlgorithm() {
    return algorithm;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("appId", appId)
        .add("primary", primary)
        .add("alternates", alternates.size())
        .add("algorithm", algorithm)
        .toString();
  }
}
