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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import org.meshcore.common.MeshConfiguration;
import org.meshcore.common.endpoint.Endpoint;
import org.meshcore.common.endpoint.EndpointStatus;
import org.meshcore.common.endpoint.EndpointSummary;
import org.meshcore.common.event.EndpointDegradedEvent.DegradedReason;
import org.meshcore.common.event.MeshEventPublisher;
import org.meshcore.common.exception.DependencyUnavailableException;
import org.meshcore.common.exception.EndpointNotFoundException;
import org.meshcore.common.store.EndpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registration, heartbeats and lookups over the {@link EndpointStore}. Store failures propagate as
 * {@link DependencyUnavailableException}; nothing is retried here.
 */
public class RegistryService {
  private static final Logger logger = LoggerFactory.getLogger(RegistryService.class);

  private final EndpointStore store;
  private final MeshEventPublisher publisher;
  private final MeshConfiguration conf;
  private final Clock clock;
  private final long startedAt;

  public RegistryService(
      EndpointStore store, MeshEventPublisher publisher, MeshConfiguration conf, Clock clock) {
    this.store = store;
    this.publisher = publisher;
    this.conf = conf;
    this.clock = clock;
    this.startedAt = clock.millis();
  }

  /**
   * Registers an endpoint, or overwrites the one with the same instance id.
   *
   * @return the instance id
   */
  public String register(RegisterRequest request) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(request.getAppId()), "appId is empty");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(request.getHost()), "host is empty");
    Preconditions.checkArgument(
        request.getPort() > 0 && request.getPort() <= 65535, "invalid port %s", request.getPort());

    String instanceId =
        Strings.isNullOrEmpty(request.getInstanceId())
            ? UUID.randomUUID().toString()
            : request.getInstanceId();
    long now = clock.millis();
    Endpoint endpoint =
        new Endpoint()
            .setInstanceId(instanceId)
            .setAppId(request.getAppId())
            .setServiceNames(request.getServiceNames())
            .setHost(request.getHost())
            .setPort(request.getPort())
            .setStatus(EndpointStatus.HEALTHY)
            .setMaxConnections(
                request.getMaxConnections() == null
                    ? conf.getDefaultMaxConnections()
                    : request.getMaxConnections())
            .setRegisteredAt(now)
            .setLastHeartbeatAt(now);

    unlinkIfMoved(endpoint);
    store.save(endpoint, conf.getEndpointTtlSeconds());
    logger.info(
        String.format(
            "registered endpoint [%s] of [%s] at %s",
            instanceId, endpoint.getAppId(), endpoint.getAddress()));
    publisher.endpointRegistered(endpoint);
    return instanceId;
  }

  /** @throws EndpointNotFoundException if the instance is unknown or expired */
  public void deregister(String instanceId, DeregisterReason reason) {
    Optional<Endpoint> endpoint = store.find(instanceId);
    if (!endpoint.isPresent()) {
      throw EndpointNotFoundException.forInstance(instanceId);
    }
    store.remove(endpoint.get());
    logger.info(
        String.format(
            "deregistered endpoint [%s] of [%s], reason %s",
            instanceId, endpoint.get().getAppId(), reason));
    publisher.endpointDeregistered(endpoint.get(), reason);
  }

  /**
   * Refreshes an endpoint. An unknown instance is registered on the fly when the request names its
   * app id.
   *
   * @throws EndpointNotFoundException if the instance is unknown and no app id is given
   * @throws IllegalArgumentException if the load is outside 0 to 100 or the connection count is
   *     negative
   */
  public HeartbeatResult heartbeat(HeartbeatRequest request) {
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(request.getInstanceId()), "instanceId is empty");
    Preconditions.checkArgument(
        request.getLoadPercent() >= 0 && request.getLoadPercent() <= 100,
        "invalid load %s of [%s]",
        request.getLoadPercent(),
        request.getInstanceId());
    Preconditions.checkArgument(
        request.getCurrentConnections() >= 0,
        "invalid connection count %s of [%s]",
        request.getCurrentConnections(),
        request.getInstanceId());
    long now = clock.millis();
    Optional<Endpoint> existing = store.findRaw(request.getInstanceId());
    if (existing.isPresent() && !isLive(existing.get(), now)) {
      existing = Optional.empty();
    }

    Endpoint endpoint;
    boolean autoRegistered = false;
    if (existing.isPresent()) {
      endpoint = new Endpoint(existing.get());
    } else {
      if (Strings.isNullOrEmpty(request.getAppId())) {
        throw EndpointNotFoundException.forInstance(request.getInstanceId());
      }
      endpoint = autoRegistration(request, now);
      autoRegistered = true;
    }

    endpoint
        .setStatus(request.getStatus() == null ? EndpointStatus.HEALTHY : request.getStatus())
        .setLoadPercent(request.getLoadPercent())
        .setCurrentConnections(request.getCurrentConnections())
        .setIssues(request.getIssues())
        .setLastHeartbeatAt(now);
    if (request.getMaxConnections() != null) {
      endpoint.setMaxConnections(request.getMaxConnections());
    }
    if (!endpoint.getIssues().isEmpty()) {
      logger.debug(
          String.format(
              "endpoint [%s] reports issues: %s", endpoint.getInstanceId(), endpoint.getIssues()));
    }

    store.save(endpoint, conf.getEndpointTtlSeconds());

    if (autoRegistered) {
      logger.info(
          String.format(
              "auto-registered endpoint [%s] of [%s] at %s from heartbeat",
              endpoint.getInstanceId(), endpoint.getAppId(), endpoint.getAddress()));
      publisher.endpointRegistered(endpoint);
    }
    publishDegradation(existing.orElse(null), endpoint);
    return new HeartbeatResult(
        conf.getHeartbeatIntervalSeconds(), conf.getEndpointTtlSeconds(), autoRegistered);
  }

  public EndpointsResult getEndpoints(String appId, String serviceName, boolean healthyOnly) {
    List<Endpoint> matching = new ArrayList<>();
    for (Endpoint endpoint : store.findByAppId(appId)) {
      if (serviceName == null || endpoint.servesService(serviceName)) {
        matching.add(endpoint);
      }
    }
    List<Endpoint> endpoints = new ArrayList<>(matching.size());
    int healthy = 0;
    for (Endpoint endpoint : matching) {
      boolean isHealthy = endpoint.getStatus() == EndpointStatus.HEALTHY;
      if (isHealthy) {
        healthy++;
      }
      if (isHealthy || !healthyOnly) {
        endpoints.add(endpoint);
      }
    }
    return new EndpointsResult(appId, endpoints, healthy, matching.size());
  }

  /**
   * @param appIdPrefix case-insensitive app id prefix, null for all
   * @param statusFilter applied after reading from the store, null for all
   */
  public EndpointListing listEndpoints(String appIdPrefix, EndpointStatus statusFilter) {
    String prefix = appIdPrefix == null ? "" : appIdPrefix.toLowerCase(Locale.ROOT);
    Map<String, List<Endpoint>> byAppId = new TreeMap<>();
    List<Endpoint> selected = new ArrayList<>();
    for (Endpoint endpoint : store.findAll()) {
      if (!endpoint.getAppId().toLowerCase(Locale.ROOT).startsWith(prefix)) {
        continue;
      }
      if (statusFilter != null && endpoint.getStatus() != statusFilter) {
        continue;
      }
      selected.add(endpoint);
      byAppId.computeIfAbsent(endpoint.getAppId(), k -> new ArrayList<>()).add(endpoint);
    }
    return new EndpointListing(byAppId, EndpointSummary.of(selected));
  }

  /** Never throws on a store outage; the outage is part of the report. */
  public HealthReport getHealth(boolean includeEndpoints) {
    boolean storeConnected = true;
    List<Endpoint> endpoints = Collections.emptyList();
    try {
      store.ping();
      endpoints = store.findAll();
    } catch (DependencyUnavailableException e) {
      logger.warn("endpoint store unavailable during health check", e);
      storeConnected = false;
    }

    EndpointSummary summary = EndpointSummary.of(endpoints);
    EndpointStatus status;
    if (!storeConnected || summary.getUnavailableCount() > summary.getHealthyCount()) {
      status = EndpointStatus.UNAVAILABLE;
    } else if (summary.getDegradedCount() > 0 || summary.getUnavailableCount() > 0) {
      status = EndpointStatus.DEGRADED;
    } else {
      status = EndpointStatus.HEALTHY;
    }
    Duration uptime = Duration.ofMillis(Math.max(0, clock.millis() - startedAt));
    return new HealthReport(
        status,
        storeConnected,
        summary,
        uptime,
        includeEndpoints ? endpoints : Collections.<Endpoint>emptyList());
  }

  private boolean isLive(Endpoint endpoint, long now) {
    return now - endpoint.getLastHeartbeatAt() <= conf.getEndpointTtlSeconds() * 1000L;
  }

  private Endpoint autoRegistration(HeartbeatRequest request, long now) {
    return new Endpoint()
        .setInstanceId(request.getInstanceId())
        .setAppId(request.getAppId())
        .setServiceNames(request.getServiceNames())
        .setHost(Strings.isNullOrEmpty(request.getHost()) ? request.getAppId() : request.getHost())
        .setPort(request.getPort() == null ? conf.getDefaultPort() : request.getPort())
        .setMaxConnections(conf.getDefaultMaxConnections())
        .setRegisteredAt(now);
  }

  // A re-registration under another app id must leave the old app id index.
  private void unlinkIfMoved(Endpoint endpoint) {
    Optional<Endpoint> previous = store.findRaw(endpoint.getInstanceId());
    if (previous.isPresent() && !previous.get().getAppId().equals(endpoint.getAppId())) {
      store.remove(previous.get());
    }
  }

  private void publishDegradation(Endpoint previous, Endpoint current) {
    if (isHighLoad(current) && (previous == null || !isHighLoad(previous))) {
      logger.info(
          String.format(
              "endpoint [%s] load %.1f%% is above threshold",
              current.getInstanceId(), current.getLoadPercent()));
      publisher.endpointDegraded(current, DegradedReason.HIGH_LOAD);
    }
    if (isHighConnectionCount(current) && (previous == null || !isHighConnectionCount(previous))) {
      logger.info(
          String.format(
              "endpoint [%s] has %d of %d connections",
              current.getInstanceId(),
              current.getCurrentConnections(),
              current.getMaxConnections()));
      publisher.endpointDegraded(current, DegradedReason.HIGH_CONNECTION_COUNT);
    }
  }

  private boolean isHighLoad(Endpoint endpoint) {
    return endpoint.getLoadPercent() > conf.getLoadThresholdPercent();
  }

  private boolean isHighConnectionCount(Endpoint endpoint) {
    return endpoint.getMaxConnections() > 0
        && endpoint.getCurrentConnections() * 100L
            > (long) endpoint.getMaxConnections() * conf.getLoadThresholdPercent();
  }
}
