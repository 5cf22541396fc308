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
package org.meshcore.common.store;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.meshcore.common.MeshConfiguration;
import org.meshcore.common.endpoint.Endpoint;
import org.meshcore.common.endpoint.EndpointStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Endpoint records plus two indexes on top of a {@link KvStore}:
 *
 * <ul>
 *   <li>{@code mesh:endpoint:{instanceId}}: the endpoint as JSON, expiring after the endpoint TTL
 *   <li>{@code mesh:appid:{appId}}: instance ids registered under an app id, TTL refreshed on every
 *       heartbeat of a member
 *   <li>{@code mesh:endpoint-index}: every instance id ever seen, without TTL
 * </ul>
 *
 * <p>Index members whose endpoint record has expired are removed when a read runs into them.
 */
public class EndpointStore {
  private static final Logger logger = LoggerFactory.getLogger(EndpointStore.class);

  public static final String ENDPOINT_KEY_PREFIX = "mesh:endpoint:";
  public static final String APP_ID_KEY_PREFIX = "mesh:appid:";
  public static final String GLOBAL_INDEX_KEY = "mesh:endpoint-index";

  private static final Comparator<Endpoint> STABLE_ORDER =
      Comparator.comparingLong(Endpoint::getRegisteredAt).thenComparing(Endpoint::getInstanceId);

  private static final Gson gson = new Gson();

  private final KvStore store;
  private final Clock clock;
  private final long ttlMs;
  private final long degradationThresholdMs;

  public EndpointStore(KvStore store, MeshConfiguration conf, Clock clock) {
    this.store = store;
    this.clock = clock;
    this.ttlMs = conf.getEndpointTtlSeconds() * 1000L;
    this.degradationThresholdMs = conf.getDegradationThresholdSeconds() * 1000L;
  }

  public static String endpointKey(String instanceId) {
    return ENDPOINT_KEY_PREFIX + instanceId;
  }

  public static String appIdKey(String appId) {
    return APP_ID_KEY_PREFIX + appId;
  }

  /** Writes the record and (re)links it into both indexes, refreshing the TTLs. */
  public void save(Endpoint endpoint, long ttlSeconds) {
    String appIdKey = appIdKey(endpoint.getAppId());
    store.put(endpointKey(endpoint.getInstanceId()), gson.toJson(endpoint), ttlSeconds);
    store.setAdd(appIdKey, endpoint.getInstanceId());
    store.expire(appIdKey, ttlSeconds);
    store.setAdd(GLOBAL_INDEX_KEY, endpoint.getInstanceId());
  }

  public void remove(Endpoint endpoint) {
    store.delete(endpointKey(endpoint.getInstanceId()));
    store.setRemove(appIdKey(endpoint.getAppId()), endpoint.getInstanceId());
    store.setRemove(GLOBAL_INDEX_KEY, endpoint.getInstanceId());
  }

  /** The stored record as written, without expiry filtering or status derivation. */
  public Optional<Endpoint> findRaw(String instanceId) {
    Optional<String> json = store.get(endpointKey(instanceId));
    if (!json.isPresent()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(gson.fromJson(json.get(), Endpoint.class));
    } catch (JsonParseException e) {
      logger.warn(String.format("dropping unreadable endpoint record [%s]", instanceId), e);
      return Optional.empty();
    }
  }

  /** A live endpoint with its effective status, or empty if unknown or expired. */
  public Optional<Endpoint> find(String instanceId) {
    long now = clock.millis();
    Optional<Endpoint> endpoint = findRaw(instanceId);
    if (!endpoint.isPresent() || isExpired(endpoint.get(), now)) {
      return Optional.empty();
    }
    return Optional.of(withEffectiveStatus(endpoint.get(), now));
  }

  public List<Endpoint> findByAppId(String appId) {
    String key = appIdKey(appId);
    return load(key, store.setMembers(key));
  }

  public List<Endpoint> findAll() {
    return load(GLOBAL_INDEX_KEY, store.setMembers(GLOBAL_INDEX_KEY));
  }

  public Set<String> appIdMembers(String appId) {
    return store.setMembers(appIdKey(appId));
  }

  public Set<String> globalIndexMembers() {
    return store.setMembers(GLOBAL_INDEX_KEY);
  }

  public void ping() {
    store.ping();
  }

  private List<Endpoint> load(String indexKey, Set<String> instanceIds) {
    List<Endpoint> endpoints = new ArrayList<>(instanceIds.size());
    for (String instanceId : instanceIds) {
      Optional<Endpoint> endpoint = find(instanceId);
      if (endpoint.isPresent()) {
        endpoints.add(endpoint.get());
      } else {
        logger.debug(String.format("removing stale member [%s] from %s", instanceId, indexKey));
        store.setRemove(indexKey, instanceId);
      }
    }
    endpoints.sort(STABLE_ORDER);
    return endpoints;
  }

  private boolean isExpired(Endpoint endpoint, long now) {
    return now - endpoint.getLastHeartbeatAt() > ttlMs;
  }

  // A healthy record that has missed heartbeats for too long reads as degraded.
  private Endpoint withEffectiveStatus(Endpoint endpoint, long now) {
    if (endpoint.getStatus() == EndpointStatus.HEALTHY
        && now - endpoint.getLastHeartbeatAt() > degradationThresholdMs) {
      endpoint.setStatus(EndpointStatus.DEGRADED);
    }
    return endpoint;
  }

  public boolean isPastDegradationThreshold(Endpoint endpoint) {
    return clock.millis() - endpoint.getLastHeartbeatAt() > degradationThresholdMs;
  }
}
