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

import java.util.UUID;

public abstract class MeshEvent {
  private final String eventId;
  private final long timestamp;

  protected MeshEvent(long timestamp) {
    this.eventId = UUID.randomUUID().toString();
    this.timestamp = timestamp;
  }

  public String getEventId() {
    return eventId;
  }

  public long getTimestamp() {
    return timestamp;
  }
}
