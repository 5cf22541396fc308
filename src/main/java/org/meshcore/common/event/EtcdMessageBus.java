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

import com.google.common.annotations.VisibleForTesting;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.options.WatchOption;
import io.etcd.jetcd.watch.WatchEvent;
import io.etcd.jetcd.watch.WatchResponse;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.meshcore.common.store.KvStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MessageBus} on etcd. A published payload is written under {@code mesh:bus:{topic}/} as a
 * fresh key on a short lease, and subscribers watch that prefix for puts. Delivery happens on the
 * watch thread of the client; a subscriber only sees payloads published after it subscribed.
 */
public class EtcdMessageBus implements MessageBus {
  private static final Logger logger = LoggerFactory.getLogger(EtcdMessageBus.class);

  public static final String BUS_KEY_PREFIX = "mesh:bus:";

  private final KvStore store;
  private final Client client;
  private final long messageTtlSeconds;
  private final Set<Watch.Watcher> watchers = ConcurrentHashMap.newKeySet();

  /**
   * @param store where payloads are written, usually an {@link
   *     org.meshcore.common.store.EtcdKvStore} on the same client
   * @param client client whose watch service delivers the payloads
   * @param messageTtlSeconds how long a payload key outlives its delivery
   */
  public EtcdMessageBus(KvStore store, Client client, long messageTtlSeconds) {
    this.store = store;
    this.client = client;
    this.messageTtlSeconds = messageTtlSeconds;
  }

  @Override
  public void publish(String topic, String payload) {
    store.put(messageKey(topic, UUID.randomUUID().toString()), payload, messageTtlSeconds);
  }

  @Override
  public Subscription subscribe(String topic, Consumer<String> handler) {
    ByteSequence prefix = ByteSequence.from(topicPrefix(topic), StandardCharsets.UTF_8);
    Watch.Watcher watcher =
        client
            .getWatchClient()
            .watch(
                prefix,
                WatchOption.newBuilder().withPrefix(prefix).build(),
                Watch.listener(
                    resp -> deliver(topic, resp, handler),
                    e -> logger.warn(String.format("watch on topic %s failed", topic), e)));
    watchers.add(watcher);
    return () -> {
      if (watchers.remove(watcher)) {
        watcher.close();
      }
    };
  }

  @Override
  public void close() {
    for (Watch.Watcher watcher : watchers) {
      watcher.close();
    }
    watchers.clear();
  }

  private static void deliver(String topic, WatchResponse resp, Consumer<String> handler) {
    for (WatchEvent event : resp.getEvents()) {
      if (event.getEventType() != WatchEvent.EventType.PUT) {
        continue;
      }
      try {
        handler.accept(event.getKeyValue().getValue().toString(StandardCharsets.UTF_8));
      } catch (RuntimeException e) {
        logger.warn(String.format("handler for topic %s failed", topic), e);
      }
    }
  }

  @VisibleForTesting
  static String topicPrefix(String topic) {
    return BUS_KEY_PREFIX + topic + "/";
  }

  @VisibleForTesting
  static String messageKey(String topic, String messageId) {
    return topicPrefix(topic) + messageId;
  }
}
