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

import java.util.Optional;
import org.junit.Test;
import org.meshcore.common.exception.CasConflictException;
import org.meshcore.common.exception.DependencyUnavailableException;
import org.meshcore.util.MutableClock;

public class MemoryKvStoreTest {
  private final MutableClock clock = new MutableClock();
  private final MemoryKvStore store = new MemoryKvStore(clock);

  @Test
  public void ttlTest() {
    store.put("k1", "v1", 10);
    store.put("k2", "v2", 0);
    clock.advanceSeconds(9);
    assertEquals(Optional.of("v1"), store.get("k1"));
    clock.advanceSeconds(1);
    assertFalse(store.get("k1").isPresent());
    clock.advanceSeconds(100000);
    assertEquals(Optional.of("v2"), store.get("k2"));
  }

  @Test
  public void expireTest() {
    store.put("k", "v", 10);
    clock.advanceSeconds(5);
    assertTrue(store.expire("k", 10));
    clock.advanceSeconds(9);
    assertTrue(store.get("k").isPresent());
    assertFalse(store.expire("missing", 10));
  }

  @Test
  public void compareAndSetTest() {
    store.compareAndSet("k", Optional.empty(), "v1", 0);
    store.compareAndSet("k", Optional.of("v1"), "v2", 0);
    assertEquals(Optional.of("v2"), store.get("k"));
    try {
      store.compareAndSet("k", Optional.of("v1"), "v3", 0);
      fail();
    } catch (CasConflictException e) {
      assertEquals(Optional.of("v2"), e.getPrevValue());
      assertEquals(Optional.of("v1"), e.getExpectedPrevValue());
    }
    assertEquals(Optional.of("v2"), store.get("k"));
  }

  @Test
  public void compareAndSetOnExpiredKeyTest() {
    store.put("k", "v1", 1);
    clock.advanceSeconds(2);
    store.compareAndSet("k", Optional.empty(), "v2", 0);
    assertEquals(Optional.of("v2"), store.get("k"));
  }

  @Test
  public void setTest() {
    assertTrue(store.setAdd("s", "a"));
    assertFalse(store.setAdd("s", "a"));
    assertTrue(store.setAdd("s", "b"));
    assertEquals(2, store.setMembers("s").size());
    assertTrue(store.setRemove("s", "a"));
    assertFalse(store.setRemove("s", "a"));
    assertEquals(1, store.setMembers("s").size());

    store.expire("s", 5);
    store.setAdd("s", "c");
    clock.advanceSeconds(5);
    assertTrue(store.setMembers("s").isEmpty());
    assertTrue(store.setMembers("missing").isEmpty());
  }

  @Test
  public void deleteTest() {
    store.put("k", "v", 0);
    store.setAdd("s", "a");
    store.delete("k");
    store.delete("s");
    assertFalse(store.get("k").isPresent());
    assertTrue(store.setMembers("s").isEmpty());
  }

  @Test
  public void unavailableTest() {
    store.setAvailable(false);
    try {
      store.ping();
      fail();
    } catch (DependencyUnavailableException e) {
      // expected
    }
    try {
      store.get("k");
      fail();
    } catch (DependencyUnavailableException e) {
      // expected
    }
    store.setAvailable(true);
    store.ping();
  }
}
