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
package org.meshcore.common.event;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.google.gson.Gson;
import java.util.List;
import java.util.function.Consumer;
import org.junit.Test;
import org.meshcore.common.endpoint.Endpoint;
import org.meshcore.registry.DeregisterReason;
import org.meshcore.util.MutableClock;
import org.meshcore.util.RecordingBus;

public class MeshEventPublisherTest {
  private final MutableClock clock = new MutableClock();
  private final Endpoint endpoint =
      new Endpoint().setInstanceId("i-1").setAppId("orders").setHost("h1").setPort(80);

  @Test
  public void payloadTest() {
    RecordingBus bus = new RecordingBus();
    MeshEventPublisher publisher = new MeshEventPublisher(bus, clock);
    publisher.endpointDeregistered(endpoint, DeregisterReason.HEALTH_CHECK_FAILED);

    List<String> payloads = bus.payloads(MeshTopics.ENDPOINT_DEREGISTERED);
    assertEquals(1, payloads.size());
    EndpointDeregisteredEvent event =
        new Gson().fromJson(payloads.get(0), EndpointDeregisteredEvent.class);
    assertEquals("i-1", event.getInstanceId());
    assertEquals("orders", event.getAppId());
    assertEquals(DeregisterReason.HEALTH_CHECK_FAILED, event.getReason());
    assertEquals(clock.millis(), event.getTimestamp());
  }

  @Test
  public void publishFailureIsNotPropagatedTest() {
    MessageBus broken =
        new MessageBus() {
          @Override
          public void publish(String topic, String payload) {
            throw new IllegalStateException("bus down");
          }

          @Override
          public Subscription subscribe(String topic, Consumer<String> handler) {
            return () -> {};
          }

          @Override
          public void close() {}
        };
    MeshEventPublisher publisher = new MeshEventPublisher(broken, clock);
    publisher.endpointRegistered(endpoint);
    publisher.circuitStateChanged("orders", "OPEN", "CLOSED", 5, clock.millis());
  }

  @Test
  public void failingHandlerDoesNotStopDeliveryTest() {
    MemoryMessageBus bus = new MemoryMessageBus();
    StringBuilder received = new StringBuilder();
    bus.subscribe(
        "t",
        p -> {
          throw new IllegalStateException("handler bug");
        });
    bus.subscribe("t", received::append);
    bus.publish("t", "payload");
    assertTrue(received.toString().equals("payload"));
  }

  @Test
  public void closedSubscriptionStopsDeliveryTest() {
    MemoryMessageBus bus = new MemoryMessageBus();
    StringBuilder received = new StringBuilder();
    Consumer<String> handler = received::append;
    MessageBus.Subscription first = bus.subscribe("t", handler);
    bus.subscribe("t", handler);
    bus.publish("t", "a");
    assertEquals("aa", received.toString());

    first.close();
    first.close();
    assertEquals(1, bus.subscriberCount("t"));
    bus.publish("t", "b");
    assertEquals("aab", received.toString());
  }
}
