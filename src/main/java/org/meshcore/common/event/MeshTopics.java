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

public final class MeshTopics {
  public static final String ENDPOINT_REGISTERED = "mesh.endpoint.registered";
  public static final String ENDPOINT_DEREGISTERED = "mesh.endpoint.deregistered";
  public static final String ENDPOINT_HEALTH_CHECK_FAILED = "mesh.endpoint.health_check_failed";
  public static final String ENDPOINT_DEGRADED = "mesh.endpoint.degraded";
  public static final String CIRCUIT_CHANGED = "mesh.circuit.changed";

  // inbound
  public static final String HEARTBEAT = "mesh.heartbeat";
  public static final String MAPPINGS_FULL = "mesh.mappings.full";

  private MeshTopics() {}
}
