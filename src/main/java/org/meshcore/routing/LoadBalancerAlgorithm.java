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

import java.util.Locale;

public enum LoadBalancerAlgorithm {
  ROUND_ROBIN,
  LEAST_CONNECTIONS,
  RANDOM,
  WEIGHTED,
  WEIGHTED_ROUND_ROBIN;

  /** Accepts both {@code WEIGHTED_ROUND_ROBIN} and {@code WeightedRoundRobin} spellings. */
  public static LoadBalancerAlgorithm fromString(String name) {
    String normalized = name.trim().replace("_", "").replace("-", "").toUpperCase(Locale.ROOT);
    for (LoadBalancerAlgorithm algorithm : values()) {
      if (algorithm.name().replace("_", "").equals(normalized)) {
        return algorithm;
      }
    }
    throw new IllegalArgumentException("unknown load balancer algorithm: " + name);
  }
}
