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

import java.util.HashMap;
import java.util.Map;

/**
 * Full service-name to app-id table published on {@link MeshTopics#MAPPINGS_FULL}. A version of 0
 * means unversioned.
 */
public class ServiceMappingsSnapshot {
  private Map<String, String> mappings = new HashMap<>();
  private long version;

  public ServiceMappingsSnapshot() {}

  public ServiceMappingsSnapshot(Map<String, String> mappings, long version) {
    this.mappings = mappings;
    this.version = version;
  }

  public Map<String, String> getMappings() {
    return mappings;
  }

  public long getVersion() {
    return version;
  }
}
