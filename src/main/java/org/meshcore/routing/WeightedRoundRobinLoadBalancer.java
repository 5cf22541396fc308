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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.meshcore.common.endpoint.Endpoint;

/**
 * Smooth weighted round-robin, as nginx does it. Each round every candidate gains its effective
 * weight, the candidate with the highest current weight wins and pays back the sum of all weights.
 * Over a full cycle each endpoint is picked in proportion to its weight, interleaved rather than in
 * bursts.
 */
public class WeightedRoundRobinLoadBalancer implements LoadBalancer {
  private final LoadBalancingState state;

  public WeightedRoundRobinLoadBalancer(LoadBalancingState state) {
    this.state = state;
  }

  @Override
  public List<Endpoint> select(String appId, List<Endpoint> candidates) {
    LoadBalancingState.AppState appState = state.get(appId);
    Endpoint chosen = null;
    synchronized (appState) {
      Map<String, Long> weights = appState.currentWeights;
      Set<String> live = new HashSet<>();
      long total = 0;
      long best = Long.MIN_VALUE;
      for (Endpoint endpoint : candidates) {
        int effective = endpoint.effectiveWeight();
        long current = weights.getOrDefault(endpoint.getInstanceId(), 0L) + effective;
        weights.put(endpoint.getInstanceId(), current);
        live.add(endpoint.getInstanceId());
        total += effective;
        if (current > best) {
          best = current;
          chosen = endpoint;
        }
      }
      weights.keySet().retainAll(live);
      weights.put(chosen.getInstanceId(), best - total);
    }

    List<Endpoint> rest = new ArrayList<>(candidates);
    rest.remove(chosen);
    rest.sort(Comparator.comparingInt(Endpoint::effectiveWeight).reversed());
    List<Endpoint> ordered = new ArrayList<>(candidates.size());
    ordered.add(chosen);
    ordered.addAll(rest);
    return ordered;
  }
}
