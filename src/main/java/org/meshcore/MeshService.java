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
package org.meshcore;

import org.meshcore.common.endpoint.EndpointStatus;
import org.meshcore.registry.DeregisterReason;
import org.meshcore.registry.EndpointListing;
import org.meshcore.registry.EndpointsResult;
import org.meshcore.registry.HealthReport;
import org.meshcore.registry.HeartbeatRequest;
import org.meshcore.registry.HeartbeatResult;
import org.meshcore.registry.RegisterRequest;
import org.meshcore.registry.RegistryService;
import org.meshcore.routing.LoadBalancerAlgorithm;
import org.meshcore.routing.RouteResult;
import org.meshcore.routing.Router;
import org.meshcore.routing.ServiceMappingTable;

/** The routing and registry API, over the same registry and router the invocation path uses. */
public class MeshService {
  private final RegistryService registry;
  private final Router router;
  private final ServiceMappingTable mappings;

  public MeshService(RegistryService registry, Router router, ServiceMappingTable mappings) {
    this.registry = registry;
    this.router = router;
    this.mappings = mappings;
  }

  public String register(RegisterRequest request) {
    return registry.register(request);
  }

  public void deregister(String instanceId) {
    registry.deregister(instanceId, DeregisterReason.GRACEFUL);
  }

  public void deregister(String instanceId, DeregisterReason reason) {
    registry.deregister(instanceId, reason);
  }

  public HeartbeatResult heartbeat(HeartbeatRequest request) {
    return registry.heartbeat(request);
  }

  public EndpointsResult getEndpoints(String appId) {
    return registry.getEndpoints(appId, null, true);
  }

  public EndpointsResult getEndpoints(String appId, String serviceName, boolean healthyOnly) {
    return registry.getEndpoints(appId, serviceName, healthyOnly);
  }

  public EndpointListing listEndpoints() {
    return registry.listEndpoints(null, null);
  }

  public EndpointListing listEndpoints(String appIdPrefix, EndpointStatus statusFilter) {
    return registry.listEndpoints(appIdPrefix, statusFilter);
  }

  public RouteResult getRoute(String appId) {
    return router.resolve(appId);
  }

  public RouteResult getRoute(String appId, String serviceName, LoadBalancerAlgorithm algorithm) {
    return router.resolve(appId, serviceName, algorithm);
  }

  public ServiceMappingTable.MappingsResult getMappings(String serviceNamePrefix) {
    return mappings.getMappings(serviceNamePrefix);
  }

  public HealthReport getHealth(boolean includeEndpoints) {
    return registry.getHealth(includeEndpoints);
  }
}
