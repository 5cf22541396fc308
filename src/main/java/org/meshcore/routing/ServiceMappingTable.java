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
package org.meshcore.routing;

import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.meshcore.common.event.ServiceMappingsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service name to app id table, replaced as a whole by each accepted snapshot. A name that is not
 * mapped resolves to the default app id.
 */
public class ServiceMappingTable {
  private static final Logger logger = LoggerFactory.getLogger(ServiceMappingTable.class);

  private final String defaultAppId;
  private final Set<String> knownServiceNames = new HashSet<>();
  private volatile Map<String, String> mappings = ImmutableMap.of();
  private volatile long version;

  public ServiceMappingTable(String defaultAppId) {
    this.defaultAppId = defaultAppId;
  }

  /**
   * Replaces the table. An empty snapshot rebinds every service name seen so far to the default app
   * id. A versioned snapshot not newer than the current table is ignored; an unversioned one always
   * applies and bumps the version by one.
   *
   * @return false if the snapshot was stale
   */
  public synchronized boolean apply(ServiceMappingsSnapshot snapshot) {
    long incoming = snapshot.getVersion();
    if (incoming > 0 && incoming <= version) {
      logger.info(
          String.format("ignoring stale mappings snapshot v%d, current is v%d", incoming, version));
      return false;
    }

    Map<String, String> incomingMappings = snapshot.getMappings();
    ImmutableMap.Builder<String, String> next = ImmutableMap.builder();
    if (incomingMappings == null || incomingMappings.isEmpty()) {
      for (String serviceName : knownServiceNames) {
        next.put(serviceName, defaultAppId);
      }
      logger.info(
          String.format(
              "empty mappings snapshot, %d services reset to [%s]",
              knownServiceNames.size(), defaultAppId));
    } else {
      next.putAll(incomingMappings);
      knownServiceNames.addAll(incomingMappings.keySet());
    }
    mappings = next.build();
    version = incoming > 0 ? incoming : version + 1;
    logger.info(
        String.format("service mappings now at v%d with %d entries", version, mappings.size()));
    return true;
  }

  public String resolve(String serviceName) {
    String appId = mappings.get(serviceName);
    return appId == null ? defaultAppId : appId;
  }

  public MappingsResult getMappings(String serviceNamePrefix) {
    Map<String, String> current = mappings;
    Map<String, String> filtered = new TreeMap<>();
    String prefix = serviceNamePrefix == null ? "" : serviceNamePrefix.toLowerCase(Locale.ROOT);
    for (Map.Entry<String, String> entry : current.entrySet()) {
      if (entry.getKey().toLowerCase(Locale.ROOT).startsWith(prefix)) {
        filtered.put(entry.getKey(), entry.getValue());
      }
    }
    return new MappingsResult(filtered, version, defaultAppId);
  }

  public long getVersion() {
    return version;
  }

  public String getDefaultAppId() {
    return defaultAppId;
  }

  public static class MappingsResult {
    private final Map<String, String> mappings;
    private final long version;
    private final String defaultAppId;

    MappingsResult(Map<String, String> mappings, long version, String defaultAppId) {
      this.mappings = ImmutableMap.copyOf(mappings);
      this.version = version;
      this.defaultAppId = defaultAppId;
    }

    public Map<String, String> getMappings() {
      return mappings;
    }

    public long getVersion() {
      return version;
    }

    public String getDefaultAppId() {
      return defaultAppId;
    }
  }
}
