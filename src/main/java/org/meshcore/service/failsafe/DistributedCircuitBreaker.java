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
package org.meshcore.service.failsafe;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.prometheus.client.Counter;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.meshcore.common.MeshConfiguration;
import org.meshcore.common.event.CircuitStateChangedEvent;
import org.meshcore.common.event.MeshEventPublisher;
import org.meshcore.common.event.MeshTopics;
import org.meshcore.common.event.MessageBus;
import org.meshcore.common.exception.DependencyUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Circuit breaker whose state lives in a {@link CircuitBreakerStore} shared by all processes.
 *
 * <p>Reads go through a short-lived local view so the call path usually avoids a store round
 * trip. Every transition is broadcast on {@link MeshTopics#CIRCUIT_CHANGED}; received broadcasts
 * overwrite the local view, so other processes converge without waiting for their view to expire.
 */
public class DistributedCircuitBreaker implements CircuitBreaker {
  private static final Logger logger = LoggerFactory.getLogger(DistributedCircuitBreaker.class);
  private static final Gson gson = new Gson();

  public static final Counter CIRCUIT_TRANSITIONS =
      Counter.build()
          .name("mesh_client_circuit_breaker_transitions")
          .help("circuit breaker state transitions.")
          .labelNames("from", "to")
          .register();

  private final boolean enable;
  private final int threshold;
  private final long resetWindowMs;
  private final CircuitBreakerStore store;
  private final MeshEventPublisher publisher;
  private final Clock clock;
  private final Cache<String, CircuitBreakerRecord> localView;
  private final MessageBus.Subscription subscription;

  public DistributedCircuitBreaker(
      MeshConfiguration conf,
      CircuitBreakerStore store,
      MessageBus bus,
      MeshEventPublisher publisher,
      Clock clock) {
    this.enable = conf.isCircuitBreakEnable();
    this.threshold = conf.getCircuitBreakThreshold();
    this.resetWindowMs = conf.getCircuitBreakResetSeconds() * 1000L;
    this.store = store;
    this.publisher = publisher;
    this.clock = clock;
    this.localView =
        CacheBuilder.newBuilder()
            .expireAfterWrite(conf.getCircuitBreakLocalCacheTtlInMs(), TimeUnit.MILLISECONDS)
            .build();
    this.subscription = bus.subscribe(MeshTopics.CIRCUIT_CHANGED, this::onStateChanged);
  }

  @Override
  public boolean isCallAllowed(String appId) {
    if (!enable) {
      return true;
    }
    CircuitBreakerRecord record;
    try {
      record = view(appId);
    } catch (DependencyUnavailableException e) {
      logger.warn(String.format("breaker state of [%s] unavailable, allowing call", appId), e);
      return true;
    }
    if (record.getState() != State.OPEN) {
      return true;
    }
    if (!isAfterResetWindow(record)) {
      return false;
    }
    // Probes racing here are all let through; only the first one moves the record.
    try {
      update(appId, this::open2HalfOpen);
    } catch (DependencyUnavailableException e) {
      logger.warn(String.format("failed to half-open circuit of [%s]", appId), e);
    }
    return true;
  }

  @Override
  public void recordSuccess(String appId) {
    if (!enable) {
      return;
    }
    update(
        appId,
        current -> {
          CircuitBreakerRecord next = current.withFailures(0);
          if (current.getState() == State.HALF_OPEN) {
            next = next.transitTo(State.CLOSED, 0);
          }
          return next;
        });
  }

  @Override
  public void recordFailure(String appId) {
    if (!enable) {
      return;
    }
    update(
        appId,
        current -> {
          CircuitBreakerRecord next = current.withFailures(current.getConsecutiveFailures() + 1);
          switch (current.getState()) {
            case CLOSED:
              if (next.getConsecutiveFailures() >= threshold) {
                next = next.transitTo(State.OPEN, clock.millis());
              }
              break;
            case HALF_OPEN:
              next = next.transitTo(State.OPEN, clock.millis());
              break;
            case OPEN:
              break;
          }
          return next;
        });
  }

  @Override
  public State getState(String appId) {
    return view(appId).getState();
  }

  /** Drops the local view of every app id; the next read goes to the store. */
  public void invalidateLocalView() {
    localView.invalidateAll();
  }

  private CircuitBreakerRecord view(String appId) {
    CircuitBreakerRecord record = localView.getIfPresent(appId);
    if (record == null) {
      record = store.read(appId);
      localView.put(appId, record);
    }
    return record;
  }

  private boolean isAfterResetWindow(CircuitBreakerRecord record) {
    return clock.millis() >= record.getOpenedAt() + resetWindowMs;
  }

  private CircuitBreakerRecord open2HalfOpen(CircuitBreakerRecord current) {
    if (current.getState() == State.OPEN && isAfterResetWindow(current)) {
      return current.transitTo(State.HALF_OPEN, current.getOpenedAt());
    }
    return current;
  }

  private void update(String appId, UnaryOperator<CircuitBreakerRecord> fn) {
    CircuitBreakerStore.Update update = store.update(appId, fn);
    CircuitBreakerRecord current = update.getCurrent();
    localView.put(appId, current);
    if (!update.isTransition()) {
      return;
    }
    State from = update.getPrevious().getState();
    State to = current.getState();
    logger.info(
        String.format(
            "[%s] %s => %s, consecutive failures %d",
            appId, from, to, current.getConsecutiveFailures()));
    CIRCUIT_TRANSITIONS.labels(from.name(), to.name()).inc();
    publisher.circuitStateChanged(
        appId, to.name(), from.name(), current.getConsecutiveFailures(), current.getOpenedAt());
  }

  private void onStateChanged(String payload) {
    CircuitStateChangedEvent event;
    try {
      event = gson.fromJson(payload, CircuitStateChangedEvent.class);
    } catch (JsonParseException e) {
      logger.warn("ignoring malformed circuit broadcast: " + payload, e);
      return;
    }
    if (event == null || event.getAppId() == null || event.getNewState() == null) {
      logger.warn("ignoring incomplete circuit broadcast: " + payload);
      return;
    }
    State state;
    try {
      state = State.valueOf(event.getNewState());
    } catch (IllegalArgumentException e) {
      logger.warn("ignoring circuit broadcast with unknown state: " + payload, e);
      return;
    }
    localView.put(
        event.getAppId(),
        new CircuitBreakerRecord(state, event.getConsecutiveFailures(), event.getOpenedAt()));
    logger.debug(String.format("circuit of [%s] is now %s", event.getAppId(), state));
  }

  @Override
  public void close() {
    subscription.close();
    localView.invalidateAll();
  }
}
