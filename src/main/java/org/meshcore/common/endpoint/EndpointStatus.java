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
package org.meshcore.common.endpoint;

public enum EndpointStatus {
  HEALTHY,
  DEGRADED,
  UNAVAILABLE,
  SHUTTING_DOWN;

  /** Statuses the router never picks, even when every candidate has one. */
  public boolean isRoutable() {
    return this == HEALTHY || this == DEGRADED;
  }
}
