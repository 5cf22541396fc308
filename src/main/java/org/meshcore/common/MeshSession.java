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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.meshcore.MeshService;
import org.meshcore.MeshSignalConsumer;
import org.meshcore.common.event.EtcdMessageBus;
import org.meshcore.common.event.MemoryMessageBus;
import org.meshcore.common.event.MeshEventPublisher;
import org.meshcore.common.event.MessageBus;
import org.meshcore.common.store.EndpointStore;
import org.meshcore.common.store.EtcdKvStore;
import org.meshcore.common.store.KvStore;
import org.meshcore.common.store.MemoryKvStore;
import org.meshcore.health.EndpointProbe;
import org.meshcore.health.HealthCheckWorker;
import org.meshcore.health.HttpEndpointProbe;
import org.meshcore.invoke.EndpointCache;
import org.meshcore.invoke.InvocationClient;
import org.meshcore.registry.RegistryService;
import org.meshcore.routing.LoadBalancingState;
import org.meshcore.routing.Router;
import org.meshcore.routing.ServiceMappingTable;
import org.meshcore.service.failsafe.CircuitBreakerStore;
import org.meshcore.service.failsafe.DistributedCircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MeshSession wires one mesh process: the shared store and bus it is given, plus the caches,
 * pools and background worker it owns.
 *
 * <p>Several sessions built over the same {@link KvStore} and {@link MessageBus} behave like
 * separate mesh processes sharing one backend.
 */
public class MeshSession implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(MeshSession.class);

  private final MeshConfiguration conf;
  private final KvStore kvStore;
  private final MessageBus bus;
  private final MetricsServer metricsServer;
  private final ExecutorService invokePool;
  private final ExecutorService probePool;
  private final ScheduledExecutorService healthCheckScheduler;
  private final EndpointProbe probe;

  private final EndpointStore endpointStore;
  private final MeshEventPublisher publisher;
  private final DistributedCircuitBreaker circuitBreaker;
  private final ServiceMappingTable mappings;
  private final Router router;
  private final RegistryService registry;
  private final InvocationClient invocationClient;
  private final HealthCheckWorker healthCheckWorker;
  private final MeshService meshService;
  private final MeshSignalConsumer signalConsumer;
  private volatile boolean ownsBackend = false;
  private volatile boolean isClosed = false;

  /**
   * Session over the etcd cluster named by {@code mesh.store.etcd_endpoints}, or over a store and
   * bus private to this session when none is configured. Either way the session closes them.
   */
  public static MeshSession create(MeshConfiguration conf) {
    Clock clock = Clock.systemUTC();
    KvStore kvStore;
    MessageBus bus;
    if (conf.getEtcdEndpoints().isEmpty()) {
      logger.warn("no etcd endpoints configured, mesh state stays in this process");
      kvStore = new MemoryKvStore(clock);
      bus = new MemoryMessageBus();
    } else {
      EtcdKvStore etcd = EtcdKvStore.create(conf);
      kvStore = etcd;
      bus = new EtcdMessageBus(etcd, etcd.getClient(), conf.getBusMessageTtlSeconds());
    }
    MeshSession session = new MeshSession(conf, kvStore, bus, clock);
    session.ownsBackend = true;
    return session;
  }

  public MeshSession(MeshConfiguration conf, KvStore kvStore, MessageBus bus, Clock clock) {
    this(conf, kvStore, bus, clock, new HttpEndpointProbe(conf));
  }

  public MeshSession(
      MeshConfiguration conf, KvStore kvStore, MessageBus bus, Clock clock, EndpointProbe probe) {
    // may throw - metrics server not up
    this.metricsServer = MetricsServer.getInstance(conf);

    this.conf = conf;
    this.kvStore = kvStore;
    this.bus = bus;
    this.probe = probe;
    this.invokePool =
        Executors.newFixedThreadPool(
            conf.getInvokeConcurrency(),
            new ThreadFactoryBuilder().setNameFormat("mesh-invoke-%d").setDaemon(true).build());
    this.probePool =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("mesh-probe-%d").setDaemon(true).build());
    this.healthCheckScheduler =
        Executors.newSingleThreadScheduledExecutor(
            new BasicThreadFactory.Builder()
                .namingPattern("mesh-health-check-%d")
                .daemon(true)
                .build());

    this.endpointStore = new EndpointStore(kvStore, conf, clock);
    this.publisher = new MeshEventPublisher(bus, clock);
    this.circuitBreaker =
        new DistributedCircuitBreaker(
            conf,
            new CircuitBreakerStore(kvStore, conf.getCircuitBreakCasMaxAttempts()),
            bus,
            publisher,
            clock);
    this.mappings = new ServiceMappingTable(conf.getDefaultAppId());
    this.router = new Router(endpointStore, conf, new LoadBalancingState(conf), new Random());
    this.registry = new RegistryService(endpointStore, publisher, conf, clock);
    this.invocationClient =
        new InvocationClient(
            conf, router, circuitBreaker, new EndpointCache(conf), mappings, invokePool);
    this.healthCheckWorker =
        new HealthCheckWorker(conf, endpointStore, registry, publisher, probe, probePool);
    this.meshService = new MeshService(registry, router, mappings);
    this.signalConsumer = new MeshSignalConsumer(registry, mappings).subscribe(bus);

    if (conf.isHealthCheckEnable()) {
      long interval = conf.getHealthCheckIntervalSeconds();
      healthCheckScheduler.scheduleAtFixedRate(
          healthCheckWorker,
          conf.getHealthCheckStartupDelaySeconds(),
          interval,
          TimeUnit.SECONDS);
      logger.info(
          String.format(
              "health check worker scheduled every %ds after %ds",
              interval, conf.getHealthCheckStartupDelaySeconds()));
    }
    logger.info("mesh session started");
  }

  public MeshConfiguration getConf() {
    return conf;
  }

  public MeshService getMeshService() {
    return meshService;
  }

  public InvocationClient getInvocationClient() {
    return invocationClient;
  }

  public RegistryService getRegistry() {
    return registry;
  }

  public Router getRouter() {
    return router;
  }

  public DistributedCircuitBreaker getCircuitBreaker() {
    return circuitBreaker;
  }

  public ServiceMappingTable getMappings() {
    return mappings;
  }

  public HealthCheckWorker getHealthCheckWorker() {
    return healthCheckWorker;
  }

  public EndpointStore getEndpointStore() {
    return endpointStore;
  }

  public MessageBus getBus() {
    return bus;
  }

  public KvStore getKvStore() {
    return kvStore;
  }

  @Override
  public synchronized void close() {
    if (isClosed) {
      return;
    }
    isClosed = true;
    signalConsumer.close();
    healthCheckScheduler.shutdownNow();
    probePool.shutdownNow();
    invokePool.shutdown();
    try {
      if (!invokePool.awaitTermination(conf.getSocketTimeoutInMs(), TimeUnit.MILLISECONDS)) {
        invokePool.shutdownNow();
      }
    } catch (InterruptedException e) {
      invokePool.shutdownNow();
      Thread.currentThread().interrupt();
    }
    invocationClient.close();
    probe.close();
    circuitBreaker.close();
    if (metricsServer != null) {
      metricsServer.close();
    }
    if (ownsBackend) {
      bus.close();
      kvStore.close();
    }
    logger.info("mesh session closed");
  }
}
