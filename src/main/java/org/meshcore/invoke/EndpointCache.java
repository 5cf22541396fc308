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
package org.meshcore.invoke;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.meshcore.common.MeshConfiguration;
import org.meshcore.common.endpoint.Endpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Short-lived app id to endpoint cache in front of the router. Local to this process. */
public class EndpointCache {
  private static final Logger logger = LoggerFactory.getLogger(EndpointCache.class);

  private final Cache<String, Endpoint> cache;

  public EndpointCache(MeshConfiguration conf) {
    this(conf.getEndpointCacheTtlSeconds(), conf.getEndpointCacheMaxSize());
  }

  public EndpointCache(int ttlSeconds, int maxSize) {
    this.cache =
        CacheBuilder.newBuilder()
            .expireAfterWrite(ttlSeconds, TimeUnit.SECONDS)
            .maximumSize(maxSize)
            .build();
  }

  /** Cached endpoint for appId, resolved and cached on a miss. Resolver exceptions propagate. */
  public Endpoint get(String appId, Function<String, Endpoint> resolver) {
    Endpoint endpoint = cache.getIfPresent(appId);
    if (endpoint == null) {
      endpoint = resolver.apply(appId);
      cache.put(appId, endpoint);
    }
    return endpoint;
  }

  public Endpoint getIfPresent(String appId) {
    return cache.getIfPresent(appId);
  }

  public void invalidate(String appId) {
    logger.debug(String.format("invalidate cached endpoint of [%s]", appId));
    cache.invalidate(appId);
  }

  public void invalidateAll() {
    cache.invalidateAll();
  }

  public long size() {
    return cache.size();
  }
}
