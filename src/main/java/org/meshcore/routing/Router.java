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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Predicate;
import org.meshcore.common.MeshConfiguration;
import org.meshcore.common.endpoint.Endpoint;
import org.meshcore.common.exception.EndpointNotFoundException;
import org.meshcore.common.store.EndpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves an app id to a primary endpoint plus alternates.
 *
 * <p>Candidates are narrowed by liveness and then by load. A filter that would leave nothing is
 * skipped, so a degraded or busy endpoint is returned rather than no route at all. Endpoints marked
 * unavailable or shutting down are never routed to.
 */
public class Router {
  private static final Logger logger = LoggerFactory.getLogger(Router.class);

  private final EndpointStore endpointStore;
  private final LoadBalancerAlgorithm defaultAlgorithm;
  private final double loadThresholdPercent;
  private final int maxAlternates;
  private final Map<LoadBalancerAlgorithm, LoadBalancer> balancers =
      new EnumMap<>(LoadBalancerAlgorithm.class);

  public Router(
      EndpointStore endpointStore,
      MeshConfiguration conf,
      LoadBalancingState state,
      Random random) {
    this.endpointStore = endpointStore;
    this.defaultAlgorithm = conf.getDefaultLoadBalancer();
    this.loadThresholdPercent = conf.getLoadThresholdPercent();
    this.maxAlternates = conf.getMaxTopEndpointsReturned();
    balancers.put(LoadBalancerAlgorithm.ROUND_ROBIN, new RoundRobinLoadBalancer(state));
    balancers.put(LoadBalancerAlgorithm.LEAST_CONNECTIONS, new LeastConnectionsLoadBalancer());
    balancers.put(LoadBalancerAlgorithm.RANDOM, new RandomLoadBalancer(random));
    balancers.put(LoadBalancerAlgorithm.WEIGHTED, new WeightedLoadBalancer(random));
    balancers.put(
        LoadBalancerAlgorithm.WEIGHTED_ROUND_ROBIN, new WeightedRoundRobinLoadBalancer(state));
  }

  public RouteResult resolve(String appId) {
    return resolve(appId, null, null);
  }

  /** Primary endpoint for appId with the default algorithm. */
  public Endpoint resolveEndpoint(String appId) {
    return resolve(appId).getPrimary();
  }

  /**
   * @param appId target app id
   * @param serviceName if not null, only endpoints serving it are considered
   * @param algorithm null for the configured default
   * @throws EndpointNotFoundException if no routable endpoint exists
   */
  public RouteResult resolve(String appId, String serviceName, LoadBalancerAlgorithm algorithm) {
    Preconditions.checkNotNull(appId, "appId is null");
    LoadBalancerAlgorithm selected = algorithm == null ? defaultAlgorithm : algorithm;

    List<Endpoint> candidates = new ArrayList<>();
    for (Endpoint endpoint : endpointStore.findByAppId(appId)) {
      if (!endpoint.getStatus().isRoutable()) {
        continue;
      }
      if (serviceName != null && !endpoint.servesService(serviceName)) {
        continue;
      }
      candidates.add(endpoint);
    }
    if (candidates.isEmpty()) {
      throw EndpointNotFoundException.forAppId(appId);
    }

    candidates =
        filterOrKeep(
            appId, "liveness", candidates, e -> !endpointStore.isPastDegradationThreshold(e));
    candidates =
        filterOrKeep(appId, "load", candidates, e -> e.getLoadPercent() <= loadThresholdPercent);

    List<Endpoint> ordered = balancers.get(selected).select(appId, candidates);
    Endpoint primary = ordered.get(0);
    List<Endpoint> alternates =
        new ArrayList<>(ordered.subList(1, Math.min(ordered.size(), 1 + maxAlternates)));
    if (logger.isDebugEnabled()) {
      logger.debug(
          String.format(
              "route [%s] via %s -> %s, %d alternates",
              appId, selected, primary.getAddress(), alternates.size()));
    }
    return new RouteResult(appId, primary, alternates, selected);
  }

  private List<Endpoint> filterOrKeep(
      String appId, String filter, List<Endpoint> candidates, Predicate<Endpoint> keep) {
    List<Endpoint> kept = new ArrayList<>(candidates.size());
    for (Endpoint endpoint : candidates) {
      if (keep.test(endpoint)) {
        kept.add(endpoint);
      }
    }
    if (kept.isEmpty()) {
      logger.debug(
          String.format(
              "%s filter leaves no endpoint for [%s], keeping all %d",
              filter, appId, candidates.size()));
      return candidates;
    }
    return kept;
  }
}
