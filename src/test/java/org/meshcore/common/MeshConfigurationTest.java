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
package org.meshcore.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectOutputStream;
import org.junit.Test;
import org.meshcore.routing.LoadBalancerAlgorithm;

public class MeshConfigurationTest {

  @Test
  public void configFileTest() {
    MeshConfiguration conf = MeshConfiguration.createDefault();
    assertEquals(512, conf.getLoadBalancingStateMaxAppIds());
    assertFalse(conf.isHealthCheckEnable());
  }

  @Test
  public void defaultValueTest() {
    MeshConfiguration conf = MeshConfiguration.createDefault();
    assertEquals(ConfigUtils.DEF_ENDPOINT_TTL_SECONDS, conf.getEndpointTtlSeconds());
    assertEquals(ConfigUtils.DEF_CIRCUIT_BREAK_THRESHOLD, conf.getCircuitBreakThreshold());
    assertEquals(ConfigUtils.DEF_INVOKE_RETRY_DELAY_IN_MS, conf.getRetryDelayInMs());
    assertEquals(LoadBalancerAlgorithm.ROUND_ROBIN, conf.getDefaultLoadBalancer());
    assertEquals(ConfigUtils.DEF_DEFAULT_APP_ID, conf.getDefaultAppId());
    assertTrue(conf.isCircuitBreakEnable());
  }

  @Test
  public void setterTest() {
    MeshConfiguration conf = MeshConfiguration.createDefault();
    assertEquals(
        MeshConfiguration.getInt(ConfigUtils.MESH_INVOKE_MAX_RETRIES), conf.getMaxRetries());
    conf.setMaxRetries(7).setDefaultLoadBalancer(LoadBalancerAlgorithm.WEIGHTED_ROUND_ROBIN);
    assertEquals(7, conf.getMaxRetries());
    assertEquals(LoadBalancerAlgorithm.WEIGHTED_ROUND_ROBIN, conf.getDefaultLoadBalancer());
  }

  @Test
  public void algorithmNameTest() {
    assertEquals(
        LoadBalancerAlgorithm.WEIGHTED_ROUND_ROBIN,
        LoadBalancerAlgorithm.fromString("WeightedRoundRobin"));
    assertEquals(
        LoadBalancerAlgorithm.LEAST_CONNECTIONS,
        LoadBalancerAlgorithm.fromString("least_connections"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void unknownAlgorithmTest() {
    LoadBalancerAlgorithm.fromString("fastest");
  }

  @Test
  public void serializeTest() throws IOException {
    MeshConfiguration conf = MeshConfiguration.createDefault();
    try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
        ObjectOutputStream oos = new ObjectOutputStream(baos)) {
      oos.writeObject(conf);
      oos.flush();
    }
  }
}
