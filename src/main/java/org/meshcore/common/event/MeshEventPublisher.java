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

import com.google.gson.Gson;
import java.time.Clock;
import org.meshcore.common.endpoint.Endpoint;
import org.meshcore.registry.DeregisterReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes lifecycle events. Publishing is best effort: a failure is logged and never propagated
 * to the state change that triggered it.
 */
public class MeshEventPublisher {
  private static final Logger logger = LoggerFactory.getLogger(MeshEventPublisher.class);
  private static final Gson gson = new Gson();

  private final MessageBus bus;
  private final Clock clock;

  public MeshEventPublisher(MessageBus bus, Clock clock) {
    this.bus = bus;
    this.clock = clock;
  }

  public void endpointRegistered(Endpoint endpoint) {
    publish(MeshTopics.ENDPOINT_REGISTERED, new EndpointRegisteredEvent(endpoint, clock.millis()));
  }

  public void endpointDeregistered(Endpoint endpoint, DeregisterReason reason) {
    publish(
        MeshTopics.ENDPOINT_DEREGISTERED,
        new EndpointDeregisteredEvent(endpoint, reason, clock.millis()));
  }

  public void endpointHealthCheckFailed(Endpoint endpoint, int failures, String lastError) {
    publish(
        MeshTopics.ENDPOINT_HEALTH_CHECK_FAILED,
        new EndpointHealthCheckFailedEvent(endpoint, failures, lastError, clock.millis()));
  }

  public void endpointDegraded(Endpoint endpoint, EndpointDegradedEvent.DegradedReason reason) {
    publish(
        MeshTopics.ENDPOINT_DEGRADED, new EndpointDegradedEvent(endpoint, reason, clock.millis()));
  }

  public void circuitStateChanged(
      String appId, String newState, String previousState, int failures, long openedAt) {
    publish(
        MeshTopics.CIRCUIT_CHANGED,
        new CircuitStateChangedEvent(
            appId, newState, previousState, failures, openedAt, clock.millis()));
  }

  private void publish(String topic, Object event) {
    try {
      bus.publish(topic, gson.toJson(event));
    } catch (RuntimeException e) {
      logger.warn(String.format("failed to publish event on %s", topic), e);
    }
  }
}
