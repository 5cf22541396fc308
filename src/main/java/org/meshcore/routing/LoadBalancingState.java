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

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.meshcore.common.MeshConfiguration;

/**
 * Per app id state of the stateful balancers. Entries are evicted after being idle, and the number
 * of app ids tracked is capped, so app ids that stop receiving traffic do not pin memory.
 */
public class LoadBalancingState {
  private final Cache<String, AppState> states;

  public LoadBalancingState(MeshConfiguration conf) {
    this(conf.getLoadBalancingStateMaxAppIds(), conf.getLoadBalancingStateIdleSeconds());
  }

  public LoadBalancingState(int maxAppIds, int idleSeconds) {
    CacheBuilder<Object, Object> builder = CacheBuilder.newBuilder();
    if (maxAppIds > 0) {
      builder.maximumSize(maxAppIds);
    }
    if (idleSeconds > 0) {
      builder.expireAfterAccess(idleSeconds, TimeUnit.SECONDS);
    }
    this.states = builder.build();
  }

  AppState get(String appId) {
    return states.asMap().computeIfAbsent(appId, k -> new AppState());
  }

  public long size() {
    return states.size();
  }

  public void clear() {
    states.invalidateAll();
  }

  static final class AppState {
    final AtomicLong counter = new AtomicLong();
    // instanceId -> current weight, guarded by this
    final Map<String, Long> currentWeights = new HashMap<>();
  }
}
