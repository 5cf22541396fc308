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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.meshcore.BaseMeshTest;
import org.meshcore.MeshService;
import org.meshcore.common.endpoint.Endpoint;
import org.meshcore.common.endpoint.EndpointStatus;
import org.meshcore.common.event.HeartbeatSignal;
import org.meshcore.common.event.MeshTopics;
import org.meshcore.common.event.ServiceMappingsSnapshot;
import org.meshcore.common.store.MemoryKvStore;
import org.meshcore.health.EndpointProbe;
import org.meshcore.registry.RegisterRequest;
import org.meshcore.routing.LoadBalancerAlgorithm;
import org.meshcore.routing.RouteResult;
import org.meshcore.service.failsafe.CircuitBreaker;

public class MeshSessionTest extends BaseMeshTest {
  private MeshSession first;
  private MeshSession second;

  @Before
  public void setUp() {
    MeshConfiguration conf = createConfiguration().setCircuitBreakLocalCacheTtlInMs(60000);
    first = new MeshSession(conf, kvStore, bus, clock, new NoopProbe());
    second = new MeshSession(conf, kvStore, bus, clock, new NoopProbe());
  }

  @After
  public void tearDown() {
    first.close();
    second.close();
  }

  @Test
  public void sessionsShareRegistryTest() {
    MeshService service = first.getMeshService();
    String id = service.register(RegisterRequest.of("orders", "10.0.0.5", 8080));

    RouteResult route = second.getMeshService().getRoute("orders");
    assertEquals(id, route.getPrimary().getInstanceId());
    assertTrue(second.getInvocationClient().isServiceAvailable("orders"));

    second.getMeshService().deregister(id);
    assertFalse(first.getEndpointStore().find(id).isPresent());
  }

  @Test
  public void circuitStateConvergesTest() {
    assertEquals(CircuitBreaker.State.CLOSED, second.getCircuitBreaker().getState("orders"));
    for (int i = 0; i < 5; i++) {
      first.getCircuitBreaker().recordFailure("orders");
    }
    assertEquals(CircuitBreaker.State.OPEN, second.getCircuitBreaker().getState("orders"));
    assertFalse(second.getCircuitBreaker().isCallAllowed("orders"));
  }

  @Test
  public void heartbeatSignalReachesRegistryTest() {
    bus.publish(
        MeshTopics.HEARTBEAT,
        new Gson().toJson(new HeartbeatSignal().setInstanceId("i-1").setAppId("search")));
    Endpoint endpoint = first.getEndpointStore().find("i-1").get();
    assertEquals("search", endpoint.getAppId());
    assertEquals(1, first.getMeshService().getEndpoints("search").getTotalCount());
  }

  @Test
  public void facadeTest() {
    MeshService service = first.getMeshService();
    service.register(RegisterRequest.of("orders", "10.0.0.5", 8080).setInstanceId("o-1"));
    service.register(RegisterRequest.of("auth", "10.0.0.6", 8080).setInstanceId("a-1"));
    first
        .getMappings()
        .apply(new ServiceMappingsSnapshot(ImmutableMap.of("checkout", "orders"), 1));

    assertEquals(2, service.listEndpoints().getSummary().getTotalEndpoints());
    assertEquals("orders", service.getMappings("check").getMappings().get("checkout"));
    assertEquals(
        "o-1",
        service
            .getRoute("orders", null, LoadBalancerAlgorithm.LEAST_CONNECTIONS)
            .getPrimary()
            .getInstanceId());
    assertEquals(EndpointStatus.HEALTHY, service.getHealth(false).getStatus());
    assertEquals(1, service.getEndpoints("auth", null, true).getTotalCount());
  }

  @Test
  public void closedSessionIgnoresBusTest() {
    int heartbeatHandlers = bus.subscriberCount(MeshTopics.HEARTBEAT);
    int circuitHandlers = bus.subscriberCount(MeshTopics.CIRCUIT_CHANGED);
    MeshSession closed =
        new MeshSession(
            createConfiguration(), new MemoryKvStore(clock), bus, clock, new NoopProbe());
    assertEquals(heartbeatHandlers + 1, bus.subscriberCount(MeshTopics.HEARTBEAT));
    closed.close();
    assertEquals(heartbeatHandlers, bus.subscriberCount(MeshTopics.HEARTBEAT));
    assertEquals(circuitHandlers, bus.subscriberCount(MeshTopics.CIRCUIT_CHANGED));
    assertEquals(2, bus.subscriberCount(MeshTopics.MAPPINGS_FULL));

    bus.publish(
        MeshTopics.HEARTBEAT,
        new Gson().toJson(new HeartbeatSignal().setInstanceId("i-9").setAppId("search")));
    assertFalse(closed.getEndpointStore().find("i-9").isPresent());
    assertTrue(first.getEndpointStore().find("i-9").isPresent());
  }

  @Test
  public void createWithoutEtcdTest() {
    MeshSession session = MeshSession.create(createConfiguration().setEtcdEndpoints(""));
    try {
      assertTrue(session.getKvStore() instanceof MemoryKvStore);
      session.getMeshService().register(RegisterRequest.of("orders", "10.0.0.5", 8080));
      assertEquals(1, session.getMeshService().getEndpoints("orders").getTotalCount());
    } finally {
      session.close();
    }
  }

  @Test
  public void closeIsIdempotentTest() {
    first.close();
    first.close();
  }

  private static class NoopProbe implements EndpointProbe {
    @Override
    public void probe(Endpoint endpoint) {}

    @Override
    public void close() {}
  }
}
