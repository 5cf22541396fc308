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

import java.util.function.Consumer;

/** A pub/sub channel shared by every mesh process. Payloads are JSON strings. */
public interface MessageBus extends AutoCloseable {

  void publish(String topic, String payload);

  /**
   * Registers a handler for every payload published on topic from now on.
   *
   * @return handle that stops delivery to this handler when closed
   */
  Subscription subscribe(String topic, Consumer<String> handler);

  @Override
  void close();

  /** A registered handler. Closing it twice is a no-op. */
  interface Subscription extends AutoCloseable {
    @Override
    void close();
  }
}
