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

package org.meshcore.common;

public class ConfigUtils {
  public static final String MESH_CONFIGURATION_FILENAME = "mesh.properties";
  public static final String MESH_PREFIX = "mesh.";

  public static final String MESH_ENDPOINT_TTL_SECONDS = "mesh.endpoint.ttl_seconds";
  public static final String MESH_HEARTBEAT_INTERVAL_SECONDS = "mesh.heartbeat.interval_seconds";
  public static final String MESH_DEGRADATION_THRESHOLD_SECONDS =
      "mesh.degradation.threshold_seconds";

  public static final String MESH_LOAD_BALANCER_DEFAULT = "mesh.load_balancer.default";
  public static final String MESH_LOAD_THRESHOLD_PERCENT =
      "mesh.load_balancer.load_threshold_percent";
  public static final String MESH_LOAD_BALANCING_STATE_MAX_APP_IDS =
      "mesh.load_balancer.state_max_app_ids";
  public static final String MESH_LOAD_BALANCING_STATE_IDLE_SECONDS =
      "mesh.load_balancer.state_idle_seconds";
  public static final String MESH_ROUTE_MAX_TOP_ENDPOINTS = "mesh.route.max_top_endpoints";

  public static final String MESH_CIRCUIT_BREAK_ENABLE = "mesh.circuit_break.enable";
  public static final String MESH_CIRCUIT_BREAK_THRESHOLD = "mesh.circuit_break.threshold";
  public static final String MESH_CIRCUIT_BREAK_RESET_SECONDS = "mesh.circuit_break.reset_seconds";
  public static final String MESH_CIRCUIT_BREAK_LOCAL_CACHE_TTL_IN_MS =
      "mesh.circuit_break.local_cache_ttl_in_ms";
  public static final String MESH_CIRCUIT_BREAK_CAS_MAX_ATTEMPTS =
      "mesh.circuit_break.cas_max_attempts";

  public static final String MESH_INVOKE_MAX_RETRIES = "mesh.invoke.max_retries";
  public static final String MESH_INVOKE_RETRY_DELAY_IN_MS = "mesh.invoke.retry_delay_in_ms";
  public static final String MESH_INVOKE_CONNECT_TIMEOUT_IN_MS =
      "mesh.invoke.connect_timeout_in_ms";
  public static final String MESH_INVOKE_SOCKET_TIMEOUT_IN_MS = "mesh.invoke.socket_timeout_in_ms";
  public static final String MESH_INVOKE_CONCURRENCY = "mesh.invoke.concurrency";

  public static final String MESH_ENDPOINT_CACHE_TTL_SECONDS = "mesh.endpoint_cache.ttl_seconds";
  public static final String MESH_ENDPOINT_CACHE_MAX_SIZE = "mesh.endpoint_cache.max_size";

  public static final String MESH_HEALTH_CHECK_ENABLE = "mesh.health_check.enable";
  public static final String MESH_HEALTH_CHECK_INTERVAL_SECONDS =
      "mesh.health_check.interval_seconds";
  public static final String MESH_HEALTH_CHECK_TIMEOUT_IN_MS = "mesh.health_check.timeout_in_ms";
  public static final String MESH_HEALTH_CHECK_FAILURE_THRESHOLD =
      "mesh.health_check.failure_threshold";
  public static final String MESH_HEALTH_CHECK_STARTUP_DELAY_SECONDS =
      "mesh.health_check.startup_delay_seconds";
  public static final String MESH_HEALTH_CHECK_PATH = "mesh.health_check.path";

  public static final String MESH_DEFAULT_APP_ID = "mesh.default_app_id";
  public static final String MESH_DEFAULT_PORT = "mesh.default_port";
  public static final String MESH_DEFAULT_MAX_CONNECTIONS = "mesh.default_max_connections";

  public static final String MESH_STORE_ETCD_ENDPOINTS = "mesh.store.etcd_endpoints";
  public static final String MESH_STORE_TIMEOUT_IN_MS = "mesh.store.timeout_in_ms";
  public static final String MESH_BUS_MESSAGE_TTL_SECONDS = "mesh.bus.message_ttl_seconds";

  public static final String MESH_METRICS_ENABLE = "mesh.metrics.enable";
  public static final String MESH_METRICS_PORT = "mesh.metrics.port";

  public static final int DEF_ENDPOINT_TTL_SECONDS = 90;
  public static final int DEF_HEARTBEAT_INTERVAL_SECONDS = 30;
  public static final int DEF_DEGRADATION_THRESHOLD_SECONDS = 60;

  public static final String DEF_LOAD_BALANCER = "ROUND_ROBIN";
  public static final int DEF_LOAD_THRESHOLD_PERCENT = 80;
  public static final int DEF_LOAD_BALANCING_STATE_MAX_APP_IDS = 1000;
  public static final int DEF_LOAD_BALANCING_STATE_IDLE_SECONDS = 600;
  public static final int DEF_ROUTE_MAX_TOP_ENDPOINTS = 2;

  public static final boolean DEF_CIRCUIT_BREAK_ENABLE = true;
  public static final int DEF_CIRCUIT_BREAK_THRESHOLD = 5;
  public static final int DEF_CIRCUIT_BREAK_RESET_SECONDS = 30;
  public static final int DEF_CIRCUIT_BREAK_LOCAL_CACHE_TTL_IN_MS = 1000;
  public static final int DEF_CIRCUIT_BREAK_CAS_MAX_ATTEMPTS = 16;

  public static final int DEF_INVOKE_MAX_RETRIES = 3;
  public static final int DEF_INVOKE_RETRY_DELAY_IN_MS = 100;
  public static final int DEF_INVOKE_CONNECT_TIMEOUT_IN_MS = 5000;
  public static final int DEF_INVOKE_SOCKET_TIMEOUT_IN_MS = 30000;
  public static final int DEF_INVOKE_CONCURRENCY = 16;

  public static final int DEF_ENDPOINT_CACHE_TTL_SECONDS = 5;
  public static final int DEF_ENDPOINT_CACHE_MAX_SIZE = 1000;

  public static final boolean DEF_HEALTH_CHECK_ENABLE = false;
  public static final int DEF_HEALTH_CHECK_INTERVAL_SECONDS = 60;
  public static final int DEF_HEALTH_CHECK_TIMEOUT_IN_MS = 5000;
  public static final int DEF_HEALTH_CHECK_FAILURE_THRESHOLD = 3;
  public static final int DEF_HEALTH_CHECK_STARTUP_DELAY_SECONDS = 10;
  public static final String DEF_HEALTH_CHECK_PATH = "/health";

  public static final String DEF_DEFAULT_APP_ID = "default";
  public static final int DEF_DEFAULT_PORT = 80;
  public static final int DEF_DEFAULT_MAX_CONNECTIONS = 1000;

  public static final String DEF_STORE_ETCD_ENDPOINTS = "";
  public static final int DEF_STORE_TIMEOUT_IN_MS = 3000;
  public static final int DEF_BUS_MESSAGE_TTL_SECONDS = 10;

  public static final boolean DEF_METRICS_ENABLE = false;
  public static final int DEF_METRICS_PORT = 3140;
}
