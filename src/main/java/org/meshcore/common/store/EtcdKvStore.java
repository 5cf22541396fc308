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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.common.exception.EtcdException;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.meshcore.common.MeshConfiguration;
import org.meshcore.common.exception.CasConflictException;
import org.meshcore.common.exception.DependencyUnavailableException;
import org.meshcore.common.exception.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link KvStore} on an etcd cluster.
 *
 * <p>A TTL is an etcd lease granted for the write; the key goes away with the lease, so nothing
 * has to revoke it. A set is stored as one key per member under {@code {key}/_member/}, so adding
 * and removing a member are single-key writes. A set's TTL is carried by the leases of its member
 * keys, and a member added to a leased set joins the lease already in use.
 */
public class EtcdKvStore implements KvStore {
  private static final Logger logger = LoggerFactory.getLogger(EtcdKvStore.class);

  static final String SET_MEMBER_SEPARATOR = "/_member/";
  private static final String PING_KEY = "mesh:ping";

  private final Client client;
  private final KV kv;
  private final long timeoutMs;
  private final boolean ownsClient;

  public static EtcdKvStore create(MeshConfiguration conf) {
    Preconditions.checkArgument(!conf.getEtcdEndpoints().isEmpty(), "no etcd endpoints configured");
    logger.info("connecting key-value store to " + conf.getEtcdEndpoints());
    Client client =
        Client.builder()
            .endpoints(conf.getEtcdEndpoints())
            .executorService(
                Executors.newCachedThreadPool(
                    new ThreadFactoryBuilder()
                        .setNameFormat("etcd-conn-manager-pool-%d")
                        .setDaemon(true)
                        .build()))
            .build();
    return new EtcdKvStore(client, conf.getStoreTimeoutInMs(), true);
  }

  /** Wraps a client owned by the caller; {@link #close()} leaves it open. */
  public EtcdKvStore(Client client, long timeoutMs) {
    this(client, timeoutMs, false);
  }

  private EtcdKvStore(Client client, long timeoutMs, boolean ownsClient) {
    this.client = client;
    this.kv = client.getKVClient();
    this.timeoutMs = timeoutMs;
    this.ownsClient = ownsClient;
  }

  public Client getClient() {
    return client;
  }

  @Override
  public void put(String key, String value, long ttl) {
    PutOption option = putOption(grantLease(ttl));
    await("put " + key, () -> kv.put(bytes(key), bytes(value), option));
  }

  @Override
  public Optional<String> get(String key) {
    GetResponse resp = await("get " + key, () -> kv.get(bytes(key)));
    if (resp.getKvs().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(string(resp.getKvs().get(0).getValue()));
  }

  @Override
  public void delete(String key) {
    ByteSequence members = bytes(membersPrefix(key));
    await(
        "delete " + key,
        () ->
            kv.txn()
                .Then(
                    Op.delete(bytes(key), DeleteOption.DEFAULT),
                    Op.delete(members, DeleteOption.newBuilder().withPrefix(members).build()))
                .commit());
  }

  @Override
  public void compareAndSet(String key, Optional<String> prevValue, String value, long ttl) {
    ByteSequence k = bytes(key);
    Cmp cmp =
        prevValue.isPresent()
            ? new Cmp(k, Cmp.Op.EQUAL, CmpTarget.value(bytes(prevValue.get())))
            : new Cmp(k, Cmp.Op.EQUAL, CmpTarget.version(0));
    PutOption option = putOption(grantLease(ttl));
    TxnResponse resp =
        await(
            "compare-and-set " + key,
            () ->
                kv.txn()
                    .If(cmp)
                    .Then(Op.put(k, bytes(value), option))
                    .Else(Op.get(k, GetOption.DEFAULT))
                    .commit());
    if (resp.isSucceeded()) {
      return;
    }
    Optional<String> current = Optional.empty();
    List<GetResponse> gets = resp.getGetResponses();
    if (!gets.isEmpty() && !gets.get(0).getKvs().isEmpty()) {
      current = Optional.of(string(gets.get(0).getKvs().get(0).getValue()));
    }
    throw new CasConflictException(key, prevValue, current);
  }

  @Override
  public boolean setAdd(String key, String member) {
    ByteSequence memberKey = bytes(memberKey(key, member));
    PutOption option = putOption(currentSetLease(key));
    TxnResponse resp =
        await(
            "add member to " + key,
            () ->
                kv.txn()
                    .If(new Cmp(memberKey, Cmp.Op.EQUAL, CmpTarget.version(0)))
                    .Then(Op.put(memberKey, bytes(member), option))
                    .commit());
    return resp.isSucceeded();
  }

  @Override
  public boolean setRemove(String key, String member) {
    return await("remove member from " + key, () -> kv.delete(bytes(memberKey(key, member))))
            .getDeleted()
        > 0;
  }

  @Override
  public Set<String> setMembers(String key) {
    List<KeyValue> kvs = scanMembers(key, false);
    if (kvs.isEmpty()) {
      return Collections.emptySet();
    }
    Set<String> members = new HashSet<>();
    for (KeyValue entry : kvs) {
      members.add(memberOf(key, string(entry.getKey())));
    }
    return Collections.unmodifiableSet(members);
  }

  @Override
  public boolean expire(String key, long ttl) {
    GetResponse plain = await("get " + key, () -> kv.get(bytes(key)));
    List<KeyValue> members = scanMembers(key, false);
    if (plain.getKvs().isEmpty() && members.isEmpty()) {
      return false;
    }
    PutOption option = putOption(grantLease(ttl));
    if (!plain.getKvs().isEmpty()) {
      reput(plain.getKvs().get(0), option);
    }
    for (KeyValue member : members) {
      reput(member, option);
    }
    return true;
  }

  @Override
  public void ping() {
    GetOption countOnly = GetOption.newBuilder().withCountOnly(true).build();
    await("ping", () -> kv.get(bytes(PING_KEY), countOnly));
  }

  @Override
  public void close() {
    if (ownsClient) {
      client.close();
    }
  }

  // Only rewrites the key if nobody touched it since it was read.
  private void reput(KeyValue current, PutOption option) {
    ByteSequence k = current.getKey();
    await(
        "refresh ttl of " + string(k),
        () ->
            kv.txn()
                .If(new Cmp(k, Cmp.Op.EQUAL, CmpTarget.modRevision(current.getModRevision())))
                .Then(Op.put(k, current.getValue(), option))
                .commit());
  }

  private List<KeyValue> scanMembers(String key, boolean firstOnly) {
    ByteSequence prefix = bytes(membersPrefix(key));
    GetOption.Builder option = GetOption.newBuilder().withPrefix(prefix);
    if (firstOnly) {
      option.withLimit(1);
    }
    GetOption built = option.build();
    return await("scan members of " + key, () -> kv.get(prefix, built)).getKvs();
  }

  private long currentSetLease(String key) {
    List<KeyValue> first = scanMembers(key, true);
    return first.isEmpty() ? 0 : first.get(0).getLease();
  }

  private long grantLease(long ttl) {
    if (ttl <= 0) {
      return 0;
    }
    return await("grant lease", () -> client.getLeaseClient().grant(ttl)).getID();
  }

  private static PutOption putOption(long leaseId) {
    return leaseId == 0 ? PutOption.DEFAULT : PutOption.newBuilder().withLeaseId(leaseId).build();
  }

  private <T> T await(String what, Supplier<CompletableFuture<T>> call) {
    try {
      return call.get().get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OperationCancelledException("interrupted during " + what, e);
    } catch (ExecutionException e) {
      throw new DependencyUnavailableException("key-value store failed to " + what, e.getCause());
    } catch (TimeoutException e) {
      throw new DependencyUnavailableException(
          String.format("key-value store did not %s within %dms", what, timeoutMs), e);
    } catch (EtcdException e) {
      throw new DependencyUnavailableException("key-value store failed to " + what, e);
    }
  }

  @VisibleForTesting
  static String membersPrefix(String key) {
    return key + SET_MEMBER_SEPARATOR;
  }

  @VisibleForTesting
  static String memberKey(String key, String member) {
    return membersPrefix(key) + member;
  }

  @VisibleForTesting
  static String memberOf(String key, String storedKey) {
    String prefix = membersPrefix(key);
    Preconditions.checkArgument(
        storedKey.startsWith(prefix), "%s is not a member key of %s", storedKey, key);
    return storedKey.substring(prefix.length());
  }

  static ByteSequence bytes(String s) {
    return ByteSequence.from(s, StandardCharsets.UTF_8);
  }

  static String string(ByteSequence bs) {
    return bs.toString(StandardCharsets.UTF_8);
  }
}
