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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.Test;
import org.meshcore.common.endpoint.Endpoint;

public class LoadBalancerTest {
  private static Endpoint endpoint(String id, double load, int connections) {
    return new Endpoint()
        .setInstanceId(id)
        .setAppId("orders")
        .setHost(id)
        .setPort(80)
        .setLoadPercent(load)
        .setCurrentConnections(connections);
  }

  private static Map<String, Integer> pick(LoadBalancer balancer, List<Endpoint> endpoints, int n) {
    Map<String, Integer> counts = new HashMap<>();
    for (int i = 0; i < n; i++) {
      List<Endpoint> ordered = balancer.select("orders", endpoints);
      assertEquals(endpoints.size(), ordered.size());
      assertEquals(new HashSet<>(endpoints), new HashSet<>(ordered));
      counts.merge(ordered.get(0).getInstanceId(), 1, Integer::sum);
    }
    return counts;
  }

  @Test
  public void roundRobinTest() {
    LoadBalancer balancer = new RoundRobinLoadBalancer(new LoadBalancingState(10, 0));
    List<Endpoint> endpoints =
        Arrays.asList(endpoint("a", 0, 0), endpoint("b", 0, 0), endpoint("c", 0, 0));
    List<String> primaries = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      primaries.add(balancer.select("orders", endpoints).get(0).getInstanceId());
    }
    assertEquals(Arrays.asList("a", "b", "c", "a", "b", "c"), primaries);
    List<Endpoint> ordered = balancer.select("orders", endpoints);
    assertEquals("b", ordered.get(1).getInstanceId());
    assertEquals("c", ordered.get(2).getInstanceId());
  }

  @Test
  public void roundRobinCountersArePerAppIdTest() {
    LoadBalancer balancer = new RoundRobinLoadBalancer(new LoadBalancingState(10, 0));
    List<Endpoint> endpoints = Arrays.asList(endpoint("a", 0, 0), endpoint("b", 0, 0));
    assertEquals("a", balancer.select("orders", endpoints).get(0).getInstanceId());
    assertEquals("a", balancer.select("billing", endpoints).get(0).getInstanceId());
    assertEquals("b", balancer.select("orders", endpoints).get(0).getInstanceId());
  }

  @Test
  public void leastConnectionsTest() {
    LoadBalancer balancer = new LeastConnectionsLoadBalancer();
    List<Endpoint> ordered =
        balancer.select(
            "orders",
            Arrays.asList(endpoint("a", 0, 7), endpoint("b", 0, 2), endpoint("c", 0, 2)));
    assertEquals("b", ordered.get(0).getInstanceId());
    assertEquals("c", ordered.get(1).getInstanceId());
    assertEquals("a", ordered.get(2).getInstanceId());
  }

  @Test
  public void smoothWeightedRoundRobinTest() {
    LoadBalancer balancer = new WeightedRoundRobinLoadBalancer(new LoadBalancingState(10, 0));
    List<Endpoint> endpoints = Arrays.asList(endpoint("idle", 0, 0), endpoint("busy", 50, 0));
    Map<String, Integer> counts = pick(balancer, endpoints, 150);
    assertEquals(100, (int) counts.get("idle"));
    assertEquals(50, (int) counts.get("busy"));
  }

  @Test
  public void smoothWeightedRoundRobinInterleavesTest() {
    LoadBalancer balancer = new WeightedRoundRobinLoadBalancer(new LoadBalancingState(10, 0));
    List<Endpoint> endpoints = Arrays.asList(endpoint("idle", 0, 0), endpoint("busy", 50, 0));
    List<String> primaries = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      primaries.add(balancer.select("orders", endpoints).get(0).getInstanceId());
    }
    assertEquals(Arrays.asList("idle", "busy", "idle"), primaries);
  }

  @Test
  public void weightedRoundRobinForgetsRemovedEndpointsTest() {
    LoadBalancingState state = new LoadBalancingState(10, 0);
    LoadBalancer balancer = new WeightedRoundRobinLoadBalancer(state);
    pick(balancer, Arrays.asList(endpoint("a", 0, 0), endpoint("b", 0, 0)), 3);
    pick(balancer, Arrays.asList(endpoint("a", 0, 0)), 1);
    assertEquals(1, state.get("orders").currentWeights.size());
  }

  @Test
  public void weightedTest() {
    LoadBalancer balancer = new WeightedLoadBalancer(new Random(42));
    List<Endpoint> endpoints = Arrays.asList(endpoint("idle", 0, 0), endpoint("full", 99.6, 0));
    Map<String, Integer> counts = pick(balancer, endpoints, 2000);
    // weights 100 and 1
    assertTrue(counts.get("idle") > 1900);
    List<Endpoint> ordered = balancer.select("orders", endpoints);
    if (ordered.get(0).getInstanceId().equals("full")) {
      assertEquals("idle", ordered.get(1).getInstanceId());
    }
  }

  @Test
  public void randomTest() {
    LoadBalancer balancer = new RandomLoadBalancer(new Random(7));
    List<Endpoint> endpoints =
        Arrays.asList(endpoint("a", 0, 0), endpoint("b", 0, 0), endpoint("c", 0, 0));
    Map<String, Integer> counts = pick(balancer, endpoints, 300);
    assertEquals(3, counts.size());
  }

  @Test
  public void effectiveWeightTest() {
    assertEquals(100, endpoint("a", 0, 0).effectiveWeight());
    assertEquals(50, endpoint("a", 50, 0).effectiveWeight());
    assertEquals(1, endpoint("a", 100, 0).effectiveWeight());
    assertEquals(1, endpoint("a", 250, 0).effectiveWeight());
  }

  @Test
  public void stateIsBoundedTest() {
    LoadBalancingState state = new LoadBalancingState(2, 0);
    LoadBalancer balancer = new RoundRobinLoadBalancer(state);
    List<Endpoint> endpoints = Arrays.asList(endpoint("a", 0, 0));
    for (int i = 0; i < 50; i++) {
      balancer.select("app-" + i, endpoints);
    }
    assertTrue(state.size() <= 2);
    state.clear();
    assertEquals(0, state.size());
  }
}
