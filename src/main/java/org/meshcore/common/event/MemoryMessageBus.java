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

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link MessageBus}. Delivery is synchronous on the publishing thread; a failing
 * handler is logged and does not stop delivery to the others.
 */
public class MemoryMessageBus implements MessageBus {
  private static final Logger logger = LoggerFactory.getLogger(MemoryMessageBus.class);

  private final ConcurrentMap<String, List<Consumer<String>>> handlers = new ConcurrentHashMap<>();

  @Override
  public void publish(String topic, String payload) {
    List<Consumer<String>> subscribers = handlers.get(topic);
    if (subscribers == null) {
      return;
    }
    for (Consumer<String> handler : subscribers) {
      try {
        handler.accept(payload);
      } catch (RuntimeException e) {
        logger.warn(String.format("handler for topic %s failed", topic), e);
      }
    }
  }

  @Override
  public Subscription subscribe(String topic, Consumer<String> handler) {
    // a fresh wrapper per call, so the same handler subscribed twice is removed one at a time
    Consumer<String> registered = handler::accept;
    handlers.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(registered);
    return () -> {
      List<Consumer<String>> subscribers = handlers.get(topic);
      if (subscribers != null) {
        subscribers.remove(registered);
      }
    };
  }

  /** Number of live handlers on topic. */
  public int subscriberCount(String topic) {
    List<Consumer<String>> subscribers = handlers.get(topic);
    return subscribers == null ? 0 : subscribers.size();
  }

  @Override
  public void close() {
    handlers.clear();
  }
}
