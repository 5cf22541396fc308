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
package org.meshcore;

import org.meshcore.common.MeshConfiguration;
import org.meshcore.common.event.MeshEventPublisher;
import org.meshcore.common.store.EndpointStore;
import org.meshcore.common.store.MemoryKvStore;
import org.meshcore.registry.RegisterRequest;
import org.meshcore.registry.RegistryService;
import org.meshcore.util.MutableClock;
import org.meshcore.util.RecordingBus;

public class BaseMeshTest {
  protected final MutableClock clock = new MutableClock();
  protected final MemoryKvStore kvStore = new MemoryKvStore(clock);
  protected final RecordingBus bus = new RecordingBus();

  protected MeshConfiguration createConfiguration() {
    return MeshConfiguration.createDefault()
        .setEndpointTtlSeconds(90)
        .setHeartbeatIntervalSeconds(30)
        .setDegradationThresholdSeconds(60)
        .setLoadThresholdPercent(80)
        .setCircuitBreakThreshold(5)
        .setCircuitBreakResetSeconds(30)
        .setMaxRetries(3)
        .setRetryDelayInMs(1)
        .setConnectTimeoutInMs(1000)
        .setSocketTimeoutInMs(2000)
        .setHealthCheckEnable(false)
        .setMetricsEnable(false);
  }

  protected EndpointStore createEndpointStore(MeshConfiguration conf) {
    return new EndpointStore(kvStore, conf, clock);
  }

  protected RegistryService createRegistry(MeshConfiguration conf) {
    return new RegistryService(
        createEndpointStore(conf), new MeshEventPublisher(bus, clock), conf, clock);
  }

  protected static RegisterRequest endpoint(String instanceId, String appId, String host) {
    return RegisterRequest.of(appId, host, 80).setInstanceId(instanceId);
  }
}
