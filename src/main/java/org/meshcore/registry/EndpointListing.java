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
import java.util.Map;
import org.meshcore.common.endpoint.Endpoint;
import org.meshcore.common.endpoint.EndpointSummary;

/** Administrative view: endpoints grouped by app id, with status counts. */
public class EndpointListing {
  private final Map<String, List<Endpoint>> endpointsByAppId;
  private final EndpointSummary summary;

  public EndpointListing(Map<String, List<Endpoint>> endpointsByAppId, EndpointSummary summary) {
    this.endpointsByAppId = Collections.unmodifiableMap(endpointsByAppId);
    this.summary = summary;
  }

  public Map<String, List<Endpoint>> getEndpointsByAppId() {
    return endpointsByAppId;
  }

  public List<Endpoint> getEndpoints(String appId) {
    List<Endpoint> endpoints = endpointsByAppId.get(appId);
    return endpoints == null ? Collections.<Endpoint>emptyList() : endpoints;
  }

  public EndpointSummary getSummary() {
    return summary;
  }
}
