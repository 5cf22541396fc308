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
package org.meshcore;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.meshcore.common.event.HeartbeatSignal;
import org.meshcore.common.event.MeshTopics;
import org.meshcore.common.event.MessageBus;
import org.meshcore.common.event.ServiceMappingsSnapshot;
import org.meshcore.common.exception.MeshException;
import org.meshcore.registry.HeartbeatRequest;
import org.meshcore.registry.RegistryService;
import org.meshcore.routing.ServiceMappingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds heartbeat signals and mapping snapshots from the bus into the registry and router. Closing
 * it releases every bus subscription it took.
 */
public class MeshSignalConsumer implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(MeshSignalConsumer.class);
  private static final Gson gson = new Gson();

  private final RegistryService registry;
  private final ServiceMappingTable mappings;
  private final List<MessageBus.Subscription> subscriptions = new CopyOnWriteArrayList<>();

  public MeshSignalConsumer(RegistryService registry, ServiceMappingTable mappings) {
    this.registry = registry;
    this.mappings = mappings;
  }

  public MeshSignalConsumer subscribe(MessageBus bus) {
    subscriptions.add(bus.subscribe(MeshTopics.HEARTBEAT, this::onHeartbeat));
    subscriptions.add(bus.subscribe(MeshTopics.MAPPINGS_FULL, this::onMappings));
    return this;
  }

  @Override
  public void close() {
    for (MessageBus.Subscription subscription : subscriptions) {
      subscription.close();
    }
    subscriptions.clear();
  }

  void onHeartbeat(String payload) {
    HeartbeatSignal signal;
    try {
      signal = gson.fromJson(payload, HeartbeatSignal.class);
    } catch (JsonParseException e) {
      logger.warn("ignoring malformed heartbeat signal: " + payload, e);
      return;
    }
    if (signal == null || signal.getInstanceId() == null) {
      logger.warn("ignoring heartbeat signal without instance id: " + payload);
      return;
    }
    try {
      registry.heartbeat(HeartbeatRequest.fromSignal(signal));
    } catch (MeshException | IllegalArgumentException e) {
      logger.warn(
          String.format("failed to apply heartbeat of [%s]: %s", signal.getInstanceId(), e));
    }
  }

  void onMappings(String payload) {
    ServiceMappingsSnapshot snapshot;
    try {
      snapshot = gson.fromJson(payload, ServiceMappingsSnapshot.class);
    } catch (JsonParseException e) {
      logger.warn("ignoring malformed mappings snapshot: " + payload, e);
      return;
    }
    mappings.apply(snapshot == null ? new ServiceMappingsSnapshot() : snapshot);
  }
}
