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
package org.meshcore.health;

import io.prometheus.client.Counter;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import org.meshcore.common.MeshConfiguration;
import org.meshcore.common.endpoint.Endpoint;
import org.meshcore.common.event.EndpointDegradedEvent.DegradedReason;
import org.meshcore.common.event.MeshEventPublisher;
import org.meshcore.common.exception.DependencyUnavailableException;
import org.meshcore.common.exception.EndpointNotFoundException;
import org.meshcore.common.store.EndpointStore;
import org.meshcore.registry.DeregisterReason;
import org.meshcore.registry.RegistryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One sweep over all registered endpoints, meant to be scheduled at a fixed rate.
 *
 * <p>Every endpoint is probed concurrently. Consecutive failures are counted in memory of this
 * worker only; reaching the threshold deregisters the endpoint. A threshold of 0 turns probing off
 * and leaves TTL expiry as the only way out. The sweep also reports, once per episode, endpoints
 * that have missed heartbeats past the degradation threshold.
 */
public class HealthCheckWorker implements Runnable {
  private static final Logger logger = LoggerFactory.getLogger(HealthCheckWorker.class);

  public static final Counter HEALTH_CHECK_REMOVALS =
      Counter.build()
          .name("mesh_client_health_check_removals")
          .help("endpoints deregistered after failing health checks.")
          .register();

  private final EndpointStore store;
  private final RegistryService registry;
  private final MeshEventPublisher publisher;
  private final EndpointProbe probe;
  private final ExecutorService probePool;
  private final int failureThreshold;
  private final Map<String, Integer> failures = new ConcurrentHashMap<>();
  private final Set<String> missedHeartbeatReported = ConcurrentHashMap.newKeySet();

  public HealthCheckWorker(
      MeshConfiguration conf,
      EndpointStore store,
      RegistryService registry,
      MeshEventPublisher publisher,
      EndpointProbe probe,
      ExecutorService probePool) {
    this.store = store;
    this.registry = registry;
    this.publisher = publisher;
    this.probe = probe;
    this.probePool = probePool;
    this.failureThreshold = conf.getHealthCheckFailureThreshold();
  }

  @Override
  public void run() {
    try {
      sweep();
    } catch (DependencyUnavailableException e) {
      logger.warn("endpoint store unavailable, skipping health check round", e);
    } catch (Exception e) {
      logger.error("health check round failed", e);
    }
  }

  public int getFailureCount(String instanceId) {
    return failures.getOrDefault(instanceId, 0);
  }

  private void sweep() {
    List<Endpoint> endpoints = store.findAll();
    Set<String> live = new HashSet<>();
    for (Endpoint endpoint : endpoints) {
      live.add(endpoint.getInstanceId());
    }
    failures.keySet().retainAll(live);
    missedHeartbeatReported.retainAll(live);

    reportMissedHeartbeats(endpoints);
    if (failureThreshold <= 0) {
      return;
    }

    Map<Endpoint, CompletableFuture<String>> probes = new HashMap<>();
    for (Endpoint endpoint : endpoints) {
      probes.put(endpoint, CompletableFuture.supplyAsync(() -> probeOnce(endpoint), probePool));
    }
    for (Map.Entry<Endpoint, CompletableFuture<String>> entry : probes.entrySet()) {
      String error = entry.getValue().join();
      if (error == null) {
        onSuccess(entry.getKey());
      } else {
        onFailure(entry.getKey(), error);
      }
    }
  }

  // null when healthy, the failure otherwise
  private String probeOnce(Endpoint endpoint) {
    try {
      probe.probe(endpoint);
      return null;
    } catch (Exception e) {
      return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
  }

  private void onSuccess(Endpoint endpoint) {
    Integer previous = failures.remove(endpoint.getInstanceId());
    if (previous != null) {
      logger.info(
          String.format(
              "endpoint [%s] at %s recovers after %d failed checks",
              endpoint.getInstanceId(), endpoint.getAddress(), previous));
    }
  }

  private void onFailure(Endpoint endpoint, String error) {
    int count = failures.merge(endpoint.getInstanceId(), 1, Integer::sum);
    logger.warn(
        String.format(
            "health check %d/%d of endpoint [%s] at %s failed: %s",
            count, failureThreshold, endpoint.getInstanceId(), endpoint.getAddress(), error));
    if (count < failureThreshold) {
      return;
    }
    publisher.endpointHealthCheckFailed(endpoint, count, error);
    try {
      registry.deregister(endpoint.getInstanceId(), DeregisterReason.HEALTH_CHECK_FAILED);
      HEALTH_CHECK_REMOVALS.inc();
    } catch (EndpointNotFoundException e) {
      logger.debug(String.format("endpoint [%s] already gone", endpoint.getInstanceId()));
    } finally {
      failures.remove(endpoint.getInstanceId());
    }
  }

  private void reportMissedHeartbeats(List<Endpoint> endpoints) {
    for (Endpoint endpoint : endpoints) {
      String instanceId = endpoint.getInstanceId();
      if (!store.isPastDegradationThreshold(endpoint)) {
        missedHeartbeatReported.remove(instanceId);
      } else if (missedHeartbeatReported.add(instanceId)) {
        logger.info(
            String.format(
                "endpoint [%s] of [%s] missed its heartbeats", instanceId, endpoint.getAppId()));
        publisher.endpointDegraded(endpoint, DegradedReason.MISSED_HEARTBEAT);
      }
    }
  }
}
