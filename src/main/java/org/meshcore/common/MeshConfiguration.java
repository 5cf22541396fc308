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

import static org.meshcore.common.ConfigUtils.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import org.meshcore.routing.LoadBalancerAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MeshConfiguration implements Serializable {
  private static final long serialVersionUID = -8249218263532843108L;

  private static final Logger logger = LoggerFactory.getLogger(MeshConfiguration.class);
  private static final ConcurrentHashMap<String, String> settings = new ConcurrentHashMap<>();

  static {
    // priority: system properties > config file > default
    loadFromSystemProperties();
    loadFromConfigurationFile();
    loadFromDefaultProperties();
    listAll();
  }

  private static void loadFromSystemProperties() {
    for (Map.Entry<Object, Object> prop : System.getProperties().entrySet()) {
      String key = String.valueOf(prop.getKey());
      if (key.startsWith(MESH_PREFIX)) {
        set(key, String.valueOf(prop.getValue()));
      }
    }
  }

  private static void loadFromConfigurationFile() {
    try (InputStream input =
        MeshConfiguration.class.getClassLoader().getResourceAsStream(MESH_CONFIGURATION_FILENAME)) {
      Properties properties = new Properties();

      if (input == null) {
        logger.warn("Unable to find " + MESH_CONFIGURATION_FILENAME);
        return;
      }

      logger.info("loading " + MESH_CONFIGURATION_FILENAME);
      properties.load(input);
      for (String key : properties.stringPropertyNames()) {
        if (key.startsWith(MESH_PREFIX)) {
          setIfMissing(key, properties.getProperty(key));
        }
      }
    } catch (IOException e) {
      logger.error("load config file error", e);
    }
  }

  private static void loadFromDefaultProperties() {
    setIfMissing(MESH_ENDPOINT_TTL_SECONDS, DEF_ENDPOINT_TTL_SECONDS);
    setIfMissing(MESH_HEARTBEAT_INTERVAL_SECONDS, DEF_HEARTBEAT_INTERVAL_SECONDS);
    setIfMissing(MESH_DEGRADATION_THRESHOLD_SECONDS, DEF_DEGRADATION_THRESHOLD_SECONDS);
    setIfMissing(MESH_LOAD_BALANCER_DEFAULT, DEF_LOAD_BALANCER);
    setIfMissing(MESH_LOAD_THRESHOLD_PERCENT, DEF_LOAD_THRESHOLD_PERCENT);
    setIfMissing(MESH_LOAD_BALANCING_STATE_MAX_APP_IDS, DEF_LOAD_BALANCING_STATE_MAX_APP_IDS);
    setIfMissing(MESH_LOAD_BALANCING_STATE_IDLE_SECONDS, DEF_LOAD_BALANCING_STATE_IDLE_SECONDS);
    setIfMissing(MESH_ROUTE_MAX_TOP_ENDPOINTS, DEF_ROUTE_MAX_TOP_ENDPOINTS);
    setIfMissing(MESH_CIRCUIT_BREAK_ENABLE, DEF_CIRCUIT_BREAK_ENABLE);
    setIfMissing(MESH_CIRCUIT_BREAK_THRESHOLD, DEF_CIRCUIT_BREAK_THRESHOLD);
    setIfMissing(MESH_CIRCUIT_BREAK_RESET_SECONDS, DEF_CIRCUIT_BREAK_RESET_SECONDS);
    setIfMissing(MESH_CIRCUIT_BREAK_LOCAL_CACHE_TTL_IN_MS, DEF_CIRCUIT_BREAK_LOCAL_CACHE_TTL_IN_MS);
    setIfMissing(MESH_CIRCUIT_BREAK_CAS_MAX_ATTEMPTS, DEF_CIRCUIT_BREAK_CAS_MAX_ATTEMPTS);
    setIfMissing(MESH_INVOKE_MAX_RETRIES, DEF_INVOKE_MAX_RETRIES);
    setIfMissing(MESH_INVOKE_RETRY_DELAY_IN_MS, DEF_INVOKE_RETRY_DELAY_IN_MS);
    setIfMissing(MESH_INVOKE_CONNECT_TIMEOUT_IN_MS, DEF_INVOKE_CONNECT_TIMEOUT_IN_MS);
    setIfMissing(MESH_INVOKE_SOCKET_TIMEOUT_IN_MS, DEF_INVOKE_SOCKET_TIMEOUT_IN_MS);
    setIfMissing(MESH_INVOKE_CONCURRENCY, DEF_INVOKE_CONCURRENCY);
    setIfMissing(MESH_ENDPOINT_CACHE_TTL_SECONDS, DEF_ENDPOINT_CACHE_TTL_SECONDS);
    setIfMissing(MESH_ENDPOINT_CACHE_MAX_SIZE, DEF_ENDPOINT_CACHE_MAX_SIZE);
    setIfMissing(MESH_HEALTH_CHECK_ENABLE, DEF_HEALTH_CHECK_ENABLE);
    setIfMissing(MESH_HEALTH_CHECK_INTERVAL_SECONDS, DEF_HEALTH_CHECK_INTERVAL_SECONDS);
    setIfMissing(MESH_HEALTH_CHECK_TIMEOUT_IN_MS, DEF_HEALTH_CHECK_TIMEOUT_IN_MS);
    setIfMissing(MESH_HEALTH_CHECK_FAILURE_THRESHOLD, DEF_HEALTH_CHECK_FAILURE_THRESHOLD);
    setIfMissing(MESH_HEALTH_CHECK_STARTUP_DELAY_SECONDS, DEF_HEALTH_CHECK_STARTUP_DELAY_SECONDS);
    setIfMissing(MESH_HEALTH_CHECK_PATH, DEF_HEALTH_CHECK_PATH);
    setIfMissing(MESH_DEFAULT_APP_ID, DEF_DEFAULT_APP_ID);
    setIfMissing(MESH_DEFAULT_PORT, DEF_DEFAULT_PORT);
    setIfMissing(MESH_DEFAULT_MAX_CONNECTIONS, DEF_DEFAULT_MAX_CONNECTIONS);
    setIfMissing(MESH_STORE_ETCD_ENDPOINTS, DEF_STORE_ETCD_ENDPOINTS);
    setIfMissing(MESH_STORE_TIMEOUT_IN_MS, DEF_STORE_TIMEOUT_IN_MS);
    setIfMissing(MESH_BUS_MESSAGE_TTL_SECONDS, DEF_BUS_MESSAGE_TTL_SECONDS);
    setIfMissing(MESH_METRICS_ENABLE, DEF_METRICS_ENABLE);
    setIfMissing(MESH_METRICS_PORT, DEF_METRICS_PORT);
  }

  public static void listAll() {
    logger.info("static configurations are:" + new ArrayList<>(settings.entrySet()).toString());
  }

  private static void set(String key, String value) {
    if (key == null) {
      throw new NullPointerException("null key");
    }
    if (value == null) {
      throw new NullPointerException("null value for " + key);
    }
    settings.put(key, value);
  }

  private static void setIfMissing(String key, int value) {
    setIfMissing(key, String.valueOf(value));
  }

  private static void setIfMissing(String key, boolean value) {
    setIfMissing(key, String.valueOf(value));
  }

  private static void setIfMissing(String key, String value) {
    if (key == null) {
      throw new NullPointerException("null key");
    }
    if (value == null) {
      throw new NullPointerException("null value for " + key);
    }
    settings.putIfAbsent(key, value);
  }

  private static Optional<String> getOption(String key) {
    return Optional.ofNullable(settings.get(key));
  }

  private static String get(String key) {
    Optional<String> option = getOption(key);
    if (!option.isPresent()) {
      throw new NoSuchElementException(key);
    }
    return option.get();
  }

  public static int getInt(String key) {
    return Integer.parseInt(get(key).trim());
  }

  private static boolean getBoolean(String key) {
    return Boolean.parseBoolean(get(key).trim());
  }

  private static List<URI> getEtcdEndpoints(String key) {
    return strToURI(get(key));
  }

  private static List<URI> strToURI(String addressStr) {
    Objects.requireNonNull(addressStr);
    List<URI> uris = new ArrayList<>();
    for (String addr : addressStr.split(",")) {
      addr = addr.trim();
      if (addr.isEmpty()) {
        continue;
      }
      uris.add(URI.create(addr.contains("://") ? addr : "http://" + addr));
    }
    Collections.sort(uris);
    return uris;
  }

  private static LoadBalancerAlgorithm getLoadBalancer(String key) {
    return LoadBalancerAlgorithm.fromString(get(key).toUpperCase(Locale.ROOT));
  }

  private int endpointTtlSeconds = getInt(MESH_ENDPOINT_TTL_SECONDS);
  private int heartbeatIntervalSeconds = getInt(MESH_HEARTBEAT_INTERVAL_SECONDS);
  private int degradationThresholdSeconds = getInt(MESH_DEGRADATION_THRESHOLD_SECONDS);

  private LoadBalancerAlgorithm defaultLoadBalancer = getLoadBalancer(MESH_LOAD_BALANCER_DEFAULT);
  private int loadThresholdPercent = getInt(MESH_LOAD_THRESHOLD_PERCENT);
  private int loadBalancingStateMaxAppIds = getInt(MESH_LOAD_BALANCING_STATE_MAX_APP_IDS);
  private int loadBalancingStateIdleSeconds = getInt(MESH_LOAD_BALANCING_STATE_IDLE_SECONDS);
  private int maxTopEndpointsReturned = getInt(MESH_ROUTE_MAX_TOP_ENDPOINTS);

  private boolean circuitBreakEnable = getBoolean(MESH_CIRCUIT_BREAK_ENABLE);
  private int circuitBreakThreshold = getInt(MESH_CIRCUIT_BREAK_THRESHOLD);
  private int circuitBreakResetSeconds = getInt(MESH_CIRCUIT_BREAK_RESET_SECONDS);
  private int circuitBreakLocalCacheTtlInMs = getInt(MESH_CIRCUIT_BREAK_LOCAL_CACHE_TTL_IN_MS);
  private int circuitBreakCasMaxAttempts = getInt(MESH_CIRCUIT_BREAK_CAS_MAX_ATTEMPTS);

  private int maxRetries = getInt(MESH_INVOKE_MAX_RETRIES);
  private int retryDelayInMs = getInt(MESH_INVOKE_RETRY_DELAY_IN_MS);
  private int connectTimeoutInMs = getInt(MESH_INVOKE_CONNECT_TIMEOUT_IN_MS);
  private int socketTimeoutInMs = getInt(MESH_INVOKE_SOCKET_TIMEOUT_IN_MS);
  private int invokeConcurrency = getInt(MESH_INVOKE_CONCURRENCY);

  private int endpointCacheTtlSeconds = getInt(MESH_ENDPOINT_CACHE_TTL_SECONDS);
  private int endpointCacheMaxSize = getInt(MESH_ENDPOINT_CACHE_MAX_SIZE);

  private boolean healthCheckEnable = getBoolean(MESH_HEALTH_CHECK_ENABLE);
  private int healthCheckIntervalSeconds = getInt(MESH_HEALTH_CHECK_INTERVAL_SECONDS);
  private int healthCheckTimeoutInMs = getInt(MESH_HEALTH_CHECK_TIMEOUT_IN_MS);
  private int healthCheckFailureThreshold = getInt(MESH_HEALTH_CHECK_FAILURE_THRESHOLD);
  private int healthCheckStartupDelaySeconds = getInt(MESH_HEALTH_CHECK_STARTUP_DELAY_SECONDS);
  private String healthCheckPath = get(MESH_HEALTH_CHECK_PATH);

  private String defaultAppId = get(MESH_DEFAULT_APP_ID);
  private int defaultPort = getInt(MESH_DEFAULT_PORT);
  private int defaultMaxConnections = getInt(MESH_DEFAULT_MAX_CONNECTIONS);

  private List<URI> etcdEndpoints = getEtcdEndpoints(MESH_STORE_ETCD_ENDPOINTS);
  private int storeTimeoutInMs = getInt(MESH_STORE_TIMEOUT_IN_MS);
  private int busMessageTtlSeconds = getInt(MESH_BUS_MESSAGE_TTL_SECONDS);

  private boolean metricsEnable = getBoolean(MESH_METRICS_ENABLE);
  private int metricsPort = getInt(MESH_METRICS_PORT);

  public static MeshConfiguration createDefault() {
    return new MeshConfiguration();
  }

  public int getEndpointTtlSeconds() {
    return endpointTtlSeconds;
  }

  public MeshConfiguration setEndpointTtlSeconds(int endpointTtlSeconds) {
    this.endpointTtlSeconds = endpointTtlSeconds;
    return this;
  }

  public int getHeartbeatIntervalSeconds() {
    return heartbeatIntervalSeconds;
  }

  public MeshConfiguration setHeartbeatIntervalSeconds(int heartbeatIntervalSeconds) {
    this.heartbeatIntervalSeconds = heartbeatIntervalSeconds;
    return this;
  }

  public int getDegradationThresholdSeconds() {
    return degradationThresholdSeconds;
  }

  public MeshConfiguration setDegradationThresholdSeconds(int degradationThresholdSeconds) {
    this.degradationThresholdSeconds = degradationThresholdSeconds;
    return this;
  }

  public LoadBalancerAlgorithm getDefaultLoadBalancer() {
    return defaultLoadBalancer;
  }

  public MeshConfiguration setDefaultLoadBalancer(LoadBalancerAlgorithm defaultLoadBalancer) {
    this.defaultLoadBalancer = defaultLoadBalancer;
    return this;
  }

  public int getLoadThresholdPercent() {
    return loadThresholdPercent;
  }

  public MeshConfiguration setLoadThresholdPercent(int loadThresholdPercent) {
    this.loadThresholdPercent = loadThresholdPercent;
    return this;
  }

  public int getLoadBalancingStateMaxAppIds() {
    return loadBalancingStateMaxAppIds;
  }

  public MeshConfiguration setLoadBalancingStateMaxAppIds(int loadBalancingStateMaxAppIds) {
    this.loadBalancingStateMaxAppIds = loadBalancingStateMaxAppIds;
    return this;
  }

  public int getLoadBalancingStateIdleSeconds() {
    return loadBalancingStateIdleSeconds;
  }

  public MeshConfiguration setLoadBalancingStateIdleSeconds(int loadBalancingStateIdleSeconds) {
    this.loadBalancingStateIdleSeconds = loadBalancingStateIdleSeconds;
    return this;
  }

  public int getMaxTopEndpointsReturned() {
    return maxTopEndpointsReturned;
  }

  public MeshConfiguration setMaxTopEndpointsReturned(int maxTopEndpointsReturned) {
    this.maxTopEndpointsReturned = maxTopEndpointsReturned;
    return this;
  }

  public boolean isCircuitBreakEnable() {
    return circuitBreakEnable;
  }

  public MeshConfiguration setCircuitBreakEnable(boolean circuitBreakEnable) {
    this.circuitBreakEnable = circuitBreakEnable;
    return this;
  }

  public int getCircuitBreakThreshold() {
    return circuitBreakThreshold;
  }

  public MeshConfiguration setCircuitBreakThreshold(int circuitBreakThreshold) {
    this.circuitBreakThreshold = circuitBreakThreshold;
    return this;
  }

  public int getCircuitBreakResetSeconds() {
    return circuitBreakResetSeconds;
  }

  public MeshConfiguration setCircuitBreakResetSeconds(int circuitBreakResetSeconds) {
    this.circuitBreakResetSeconds = circuitBreakResetSeconds;
    return this;
  }

  public int getCircuitBreakLocalCacheTtlInMs() {
    return circuitBreakLocalCacheTtlInMs;
  }

  public MeshConfiguration setCircuitBreakLocalCacheTtlInMs(int circuitBreakLocalCacheTtlInMs) {
    this.circuitBreakLocalCacheTtlInMs = circuitBreakLocalCacheTtlInMs;
    return this;
  }

  public int getCircuitBreakCasMaxAttempts() {
    return circuitBreakCasMaxAttempts;
  }

  public MeshConfiguration setCircuitBreakCasMaxAttempts(int circuitBreakCasMaxAttempts) {
    this.circuitBreakCasMaxAttempts = circuitBreakCasMaxAttempts;
    return this;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public MeshConfiguration setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
    return this;
  }

  public int getRetryDelayInMs() {
    return retryDelayInMs;
  }

  public MeshConfiguration setRetryDelayInMs(int retryDelayInMs) {
    this.retryDelayInMs = retryDelayInMs;
    return this;
  }

  public int getConnectTimeoutInMs() {
    return connectTimeoutInMs;
  }

  public MeshConfiguration setConnectTimeoutInMs(int connectTimeoutInMs) {
    this.connectTimeoutInMs = connectTimeoutInMs;
    return this;
  }

  public int getSocketTimeoutInMs() {
    return socketTimeoutInMs;
  }

  public MeshConfiguration setSocketTimeoutInMs(int socketTimeoutInMs) {
    this.socketTimeoutInMs = socketTimeoutInMs;
    return this;
  }

  public int getInvokeConcurrency() {
    return invokeConcurrency;
  }

  public MeshConfiguration setInvokeConcurrency(int invokeConcurrency) {
    this.invokeConcurrency = invokeConcurrency;
    return this;
  }

  public int getEndpointCacheTtlSeconds() {
    return endpointCacheTtlSeconds;
  }

  public MeshConfiguration setEndpointCacheTtlSeconds(int endpointCacheTtlSeconds) {
    this.endpointCacheTtlSeconds = endpointCacheTtlSeconds;
    return this;
  }

  public int getEndpointCacheMaxSize() {
    return endpointCacheMaxSize;
  }

  public MeshConfiguration setEndpointCacheMaxSize(int endpointCacheMaxSize) {
    this.endpointCacheMaxSize = endpointCacheMaxSize;
    return this;
  }

  public boolean isHealthCheckEnable() {
    return healthCheckEnable;
  }

  public MeshConfiguration setHealthCheckEnable(boolean healthCheckEnable) {
    this.healthCheckEnable = healthCheckEnable;
    return this;
  }

  public int getHealthCheckIntervalSeconds() {
    return healthCheckIntervalSeconds;
  }

  public MeshConfiguration setHealthCheckIntervalSeconds(int healthCheckIntervalSeconds) {
    this.healthCheckIntervalSeconds = healthCheckIntervalSeconds;
    return this;
  }

  public int getHealthCheckTimeoutInMs() {
    return healthCheckTimeoutInMs;
  }

  public MeshConfiguration setHealthCheckTimeoutInMs(int healthCheckTimeoutInMs) {
    this.healthCheckTimeoutInMs = healthCheckTimeoutInMs;
    return this;
  }

  public int getHealthCheckFailureThreshold() {
    return healthCheckFailureThreshold;
  }

  public MeshConfiguration setHealthCheckFailureThreshold(int healthCheckFailureThreshold) {
    this.healthCheckFailureThreshold = healthCheckFailureThreshold;
    return this;
  }

  public int getHealthCheckStartupDelaySeconds() {
    return healthCheckStartupDelaySeconds;
  }

  public MeshConfiguration setHealthCheckStartupDelaySeconds(int healthCheckStartupDelaySeconds) {
    this.healthCheckStartupDelaySeconds = healthCheckStartupDelaySeconds;
    return this;
  }

  public String getHealthCheckPath() {
    return healthCheckPath;
  }

  public MeshConfiguration setHealthCheckPath(String healthCheckPath) {
    this.healthCheckPath = healthCheckPath;
    return this;
  }

  public String getDefaultAppId() {
    return defaultAppId;
  }

  public MeshConfiguration setDefaultAppId(String defaultAppId) {
    this.defaultAppId = defaultAppId;
    return this;
  }

  public int getDefaultPort() {
    return defaultPort;
  }

  public MeshConfiguration setDefaultPort(int defaultPort) {
    this.defaultPort = defaultPort;
    return this;
  }

  public int getDefaultMaxConnections() {
    return defaultMaxConnections;
  }

  public MeshConfiguration setDefaultMaxConnections(int defaultMaxConnections) {
    this.defaultMaxConnections = defaultMaxConnections;
    return this;
  }

  public List<URI> getEtcdEndpoints() {
    return etcdEndpoints;
  }

  /** Comma separated host:port list; empty keeps the shared state in this process. */
  public MeshConfiguration setEtcdEndpoints(String etcdEndpoints) {
    this.etcdEndpoints = strToURI(etcdEndpoints);
    return this;
  }

  public int getStoreTimeoutInMs() {
    return storeTimeoutInMs;
  }

  public MeshConfiguration setStoreTimeoutInMs(int storeTimeoutInMs) {
    this.storeTimeoutInMs = storeTimeoutInMs;
    return this;
  }

  public int getBusMessageTtlSeconds() {
    return busMessageTtlSeconds;
  }

  public MeshConfiguration setBusMessageTtlSeconds(int busMessageTtlSeconds) {
    this.busMessageTtlSeconds = busMessageTtlSeconds;
    return this;
  }

  public boolean isMetricsEnable() {
    return metricsEnable;
  }

  public MeshConfiguration setMetricsEnable(boolean metricsEnable) {
    this.metricsEnable = metricsEnable;
    return this;
  }

  public int getMetricsPort() {
    return metricsPort;
  }

  public MeshConfiguration setMetricsPort(int metricsPort) {
    this.metricsPort = metricsPort;
    return this;
  }
}
