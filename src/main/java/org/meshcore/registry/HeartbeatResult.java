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
package org.meshcore.registry;

public class HeartbeatResult {
  private final int nextHeartbeatSeconds;
  private final int ttlSeconds;
  private final boolean autoRegistered;

  public HeartbeatResult(int nextHeartbeatSeconds, int ttlSeconds, boolean autoRegistered) {
    this.nextHeartbeatSeconds = nextHeartbeatSeconds;
    this.ttlSeconds = ttlSeconds;
    this.autoRegistered = autoRegistered;
  }

  public int getNextHeartbeatSeconds() {
    return nextHeartbeatSeconds;
  }

  public int getTtlSeconds() {
    return ttlSeconds;
  }

  /** True if this heartbeat created the endpoint. */
  public boolean isAutoRegistered() {
    return autoRegistered;
  }
}
