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
import static org.junit.Assert.fail;

import io.etcd.jetcd.Client;
import java.util.Optional;
import java.util.UUID;
import org.junit.After;
import org.junit.Test;
import org.meshcore.common.MeshConfiguration;
import org.meshcore.common.exception.CasConflictException;
import org.meshcore.common.exception.DependencyUnavailableException;
import org.meshcore.util.EtcdTestSupport;

public class EtcdKvStoreTest {
  private EtcdKvStore store;

  @After
  public void tearDown() {
    if (store != null) {
      store.close();
    }
  }

  @Test
  public void memberKeyLayoutTest() {
    String key = EndpointStore.appIdKey("orders");
    assertEquals("mesh:appid:orders/_member/i-1", EtcdKvStore.memberKey(key, "i-1"));
    assertEquals("i-1", EtcdKvStore.memberOf(key, EtcdKvStore.memberKey(key, "i-1")));
    // members may contain the separator characters themselves
    assertEquals("a/b:c", EtcdKvStore.memberOf(key, EtcdKvStore.memberKey(key, "a/b:c")));
    try {
      EtcdKvStore.memberOf(key, "mesh:appid:payments/_member/i-1");
      fail();
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test
  public void unreachableClusterTest() {
    MeshConfiguration conf =
        MeshConfiguration.createDefault()
            .setEtcdEndpoints("127.0.0.1:" + EtcdTestSupport.closedPort())
            .setStoreTimeoutInMs(500);
    store = EtcdKvStore.create(conf);
    try {
      store.get("k");
      fail();
    } catch (DependencyUnavailableException e) {
      // expected
    }
    try {
      store.ping();
      fail();
    } catch (DependencyUnavailableException e) {
      // expected
    }
  }

  @Test
  public void createWithoutEndpointsTest() {
    try {
      EtcdKvStore.create(MeshConfiguration.createDefault().setEtcdEndpoints(""));
      fail();
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test
  public void compareAndSetTest() {
    Client client = EtcdTestSupport.clientOrSkip();
    store = new EtcdKvStore(client, 5000);
    String key = "mesh:test:" + UUID.randomUUID();
    try {
      store.compareAndSet(key, Optional.empty(), "v1", 0);
      store.compareAndSet(key, Optional.of("v1"), "v2", 0);
      assertEquals(Optional.of("v2"), store.get(key));
      try {
        store.compareAndSet(key, Optional.of("v1"), "v3", 0);
        fail();
      } catch (CasConflictException e) {
        assertEquals(Optional.of("v2"), e.getPrevValue());
      }
      try {
        store.compareAndSet(key, Optional.empty(), "v3", 0);
        fail();
      } catch (CasConflictException e) {
        assertEquals(Optional.of("v2"), e.getPrevValue());
      }
    } finally {
      store.delete(key);
      client.close();
    }
  }

  @Test
  public void setTest() {
    Client client = EtcdTestSupport.clientOrSkip();
    store = new EtcdKvStore(client, 5000);
    String key = "mesh:test:" + UUID.randomUUID();
    try {
      assertTrue(store.setAdd(key, "a"));
      assertFalse(store.setAdd(key, "a"));
      assertTrue(store.setAdd(key, "b"));
      assertEquals(2, store.setMembers(key).size());
      assertTrue(store.setRemove(key, "a"));
      assertFalse(store.setRemove(key, "a"));
      assertEquals(1, store.setMembers(key).size());
      assertTrue(store.expire(key, 60));
      assertFalse(store.expire(key + ":missing", 60));
      store.delete(key);
      assertTrue(store.setMembers(key).isEmpty());
    } finally {
      client.close();
    }
  }

  @Test
  public void ttlTest() throws InterruptedException {
    Client client = EtcdTestSupport.clientOrSkip();
    store = new EtcdKvStore(client, 5000);
    String key = "mesh:test:" + UUID.randomUUID();
    try {
      store.put(key, "v", 2);
      store.put(key + ":forever", "v", 0);
      assertEquals(Optional.of("v"), store.get(key));
      long deadline = System.currentTimeMillis() + 10000;
      while (store.get(key).isPresent() && System.currentTimeMillis() < deadline) {
        Thread.sleep(200);
      }
      assertFalse(store.get(key).isPresent());
      assertTrue(store.get(key + ":forever").isPresent());
    } finally {
      store.delete(key + ":forever");
      client.close();
    }
  }
}
