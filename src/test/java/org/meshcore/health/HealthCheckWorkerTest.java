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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.gson.Gson;
import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.After;
import org.junit.Test;
import org.meshcore.BaseMeshTest;
import org.meshcore.common.MeshConfiguration;
import org.meshcore.common.endpoint.Endpoint;
import org.meshcore.common.event.EndpointDegradedEvent;
import org.meshcore.common.event.EndpointDeregisteredEvent;
import org.meshcore.common.event.EndpointHealthCheckFailedEvent;
import org.meshcore.common.event.MeshEventPublisher;
import org.meshcore.common.event.MeshTopics;
import org.meshcore.common.store.EndpointStore;
import org.meshcore.registry.DeregisterReason;
import org.meshcore.registry.HeartbeatRequest;
import org.meshcore.registry.RegistryService;

public class HealthCheckWorkerTest extends BaseMeshTest {
  private final Gson gson = new Gson();
  private final ExecutorService probePool = MoreExecutors.newDirectExecutorService();
  private final FakeProbe probe = new FakeProbe();
  private RegistryService registry;
  private EndpointStore store;

  @After
  public void tearDown() {
    probePool.shutdownNow();
  }

  private HealthCheckWorker createWorker(int failureThreshold) {
    MeshConfiguration conf = createConfiguration().setHealthCheckFailureThreshold(failureThreshold);
    registry = createRegistry(conf);
    store = createEndpointStore(conf);
    return new HealthCheckWorker(
        conf, store, registry, new MeshEventPublisher(bus, clock), probe, probePool);
  }

  @Test
  public void removedAfterConsecutiveFailuresTest() {
    HealthCheckWorker worker = createWorker(3);
    registry.register(endpoint("bad", "orders", "bad-host"));
    registry.register(endpoint("good", "orders", "good-host"));
    probe.failing.add("bad-host");

    worker.run();
    worker.run();
    assertEquals(2, worker.getFailureCount("bad"));
    assertTrue(store.find("bad").isPresent());

    worker.run();
    assertFalse(store.find("bad").isPresent());
    assertTrue(store.find("good").isPresent());
    assertEquals(0, worker.getFailureCount("bad"));

    List<String> failed = bus.payloads(MeshTopics.ENDPOINT_HEALTH_CHECK_FAILED);
    assertEquals(1, failed.size());
    EndpointHealthCheckFailedEvent event =
        gson.fromJson(failed.get(0), EndpointHealthCheckFailedEvent.class);
    assertEquals(3, event.getConsecutiveFailures());
    assertEquals("connection refused", event.getLastError());
    EndpointDeregisteredEvent deregistered =
        gson.fromJson(
            bus.payloads(MeshTopics.ENDPOINT_DEREGISTERED).get(0),
            EndpointDeregisteredEvent.class);
    assertEquals(DeregisterReason.HEALTH_CHECK_FAILED, deregistered.getReason());
  }

  @Test
  public void successResetsFailureCountTest() {
    HealthCheckWorker worker = createWorker(3);
    registry.register(endpoint("flaky", "orders", "flaky-host"));
    probe.failing.add("flaky-host");
    worker.run();
    worker.run();
    probe.failing.clear();
    worker.run();
    assertEquals(0, worker.getFailureCount("flaky"));
    probe.failing.add("flaky-host");
    worker.run();
    worker.run();
    assertTrue(store.find("flaky").isPresent());
    assertEquals(2, worker.getFailureCount("flaky"));
  }

  @Test
  public void zeroThresholdDisablesProbingTest() {
    HealthCheckWorker worker = createWorker(0);
    registry.register(endpoint("bad", "orders", "bad-host"));
    probe.failing.add("bad-host");
    for (int i = 0; i < 5; i++) {
      worker.run();
    }
    assertEquals(0, probe.calls.get());
    assertTrue(store.find("bad").isPresent());
  }

  @Test
  public void missedHeartbeatReportedOncePerEpisodeTest() {
    HealthCheckWorker worker = createWorker(3);
    registry.register(endpoint("quiet", "orders", "h1"));
    clock.advanceSeconds(61);
    worker.run();
    worker.run();
    List<String> degraded = bus.payloads(MeshTopics.ENDPOINT_DEGRADED);
    assertEquals(1, degraded.size());
    assertEquals(
        EndpointDegradedEvent.DegradedReason.MISSED_HEARTBEAT,
        gson.fromJson(degraded.get(0), EndpointDegradedEvent.class).getReason());

    registry.heartbeat(HeartbeatRequest.of("quiet", null, 0, 0));
    worker.run();
    clock.advanceSeconds(61);
    worker.run();
    assertEquals(2, bus.payloads(MeshTopics.ENDPOINT_DEGRADED).size());
  }

  @Test
  public void countersOfVanishedEndpointsAreDroppedTest() {
    HealthCheckWorker worker = createWorker(3);
    registry.register(endpoint("gone", "orders", "gone-host"));
    probe.failing.add("gone-host");
    worker.run();
    assertEquals(1, worker.getFailureCount("gone"));
    registry.deregister("gone", DeregisterReason.GRACEFUL);
    worker.run();
    assertEquals(0, worker.getFailureCount("gone"));
  }

  @Test
  public void storeOutageDoesNotEscapeTest() {
    HealthCheckWorker worker = createWorker(3);
    registry.register(endpoint("a", "orders", "h1"));
    kvStore.setAvailable(false);
    worker.run();
    kvStore.setAvailable(true);
    worker.run();
    assertTrue(store.find("a").isPresent());
  }

  private static class FakeProbe implements EndpointProbe {
    final Set<String> failing = ConcurrentHashMap.newKeySet();
    final AtomicInteger calls = new AtomicInteger();

    @Override
    public void probe(Endpoint endpoint) throws IOException {
      calls.incrementAndGet();
      if (failing.contains(endpoint.getHost())) {
        throw new IOException("connection refused");
      }
    }

    @Override
    public void close() {}
  }
}
