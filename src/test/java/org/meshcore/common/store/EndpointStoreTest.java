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
package org.meshcore.common.store;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import org.junit.Test;
import org.meshcore.BaseMeshTest;
import org.meshcore.common.MeshConfiguration;
import org.meshcore.common.endpoint.Endpoint;
import org.meshcore.common.endpoint.EndpointStatus;

public class EndpointStoreTest extends BaseMeshTest {
  private final MeshConfiguration conf = createConfiguration();
  private final EndpointStore store = createEndpointStore(conf);

  private Endpoint newEndpoint(String instanceId, String appId) {
    return new Endpoint()
        .setInstanceId(instanceId)
        .setAppId(appId)
        .setHost("10.0.0.1")
        .setPort(8080)
        .setServiceNames(Arrays.asList("orders"))
        .setRegisteredAt(clock.millis())
        .setLastHeartbeatAt(clock.millis());
  }

  @Test
  public void saveAndFindTest() {
    Endpoint endpoint =
        newEndpoint("i-1", "orders").setLoadPercent(12.5).setIssues(Arrays.asList("slow disk"));
    store.save(endpoint, 90);

    Endpoint found = store.find("i-1").get();
    assertEquals(endpoint, found);
    assertEquals(1, store.findByAppId("orders").size());
    assertTrue(store.appIdMembers("orders").contains("i-1"));
    assertTrue(store.globalIndexMembers().contains("i-1"));
  }

  @Test
  public void expiredEndpointIsNotReturnedTest() {
    store.save(newEndpoint("i-1", "orders"), 90);
    clock.advanceSeconds(91);
    assertFalse(store.find("i-1").isPresent());
    assertTrue(store.findByAppId("orders").isEmpty());
    assertTrue(store.findAll().isEmpty());
  }

  @Test
  public void staleIndexMembersAreRemovedOnReadTest() {
    store.save(newEndpoint("i-1", "orders"), 90);
    store.save(newEndpoint("i-2", "orders"), 90);
    // a record that disappears without going through remove()
    kvStore.delete(EndpointStore.endpointKey("i-1"));

    assertEquals(2, store.globalIndexMembers().size());
    assertEquals(1, store.findAll().size());
    assertEquals(new HashSet<>(Arrays.asList("i-2")), store.globalIndexMembers());
    assertEquals(1, store.findByAppId("orders").size());
    assertEquals(new HashSet<>(Arrays.asList("i-2")), store.appIdMembers("orders"));
  }

  @Test
  public void globalIndexIsSupersetOfAppIdIndexesTest() {
    store.save(newEndpoint("a-1", "auth"), 90);
    store.save(newEndpoint("a-2", "auth"), 30);
    store.save(newEndpoint("o-1", "orders"), 90);
    clock.advanceSeconds(31);
    store.findByAppId("auth");
    store.remove(store.find("o-1").get());

    Set<String> union = new HashSet<>(store.appIdMembers("auth"));
    union.addAll(store.appIdMembers("orders"));
    assertTrue(store.globalIndexMembers().containsAll(union));
  }

  @Test
  public void appIdIndexExpiresWithoutHeartbeatsTest() {
    store.save(newEndpoint("i-1", "orders"), 90);
    clock.advanceSeconds(91);
    assertTrue(store.appIdMembers("orders").isEmpty());
  }

  @Test
  public void healthyReadsAsDegradedAfterMissedHeartbeatsTest() {
    store.save(newEndpoint("i-1", "orders"), 90);
    store.save(newEndpoint("i-2", "orders").setStatus(EndpointStatus.SHUTTING_DOWN), 90);
    clock.advanceSeconds(61);
    assertEquals(EndpointStatus.DEGRADED, store.find("i-1").get().getStatus());
    assertEquals(EndpointStatus.SHUTTING_DOWN, store.find("i-2").get().getStatus());
    // stored value is untouched
    assertEquals(EndpointStatus.HEALTHY, store.findRaw("i-1").get().getStatus());
  }

  @Test
  public void removeTest() {
    Endpoint endpoint = newEndpoint("i-1", "orders");
    store.save(endpoint, 90);
    store.remove(endpoint);
    assertFalse(store.find("i-1").isPresent());
    assertTrue(store.appIdMembers("orders").isEmpty());
    assertTrue(store.globalIndexMembers().isEmpty());
  }
}
