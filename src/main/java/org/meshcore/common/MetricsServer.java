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

import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Gauge;
import io.prometheus.client.exporter.HTTPServer;
import io.prometheus.client.hotspot.DefaultExports;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves {@code /metrics} for every session of the JVM. The first session with metrics enabled
 * starts it and the last one to close stops it; all of them must agree on {@code
 * mesh.metrics.port}. Port 0 binds a free port, see {@link #getPort()}.
 *
 * <p>The mesh collectors (names starting with {@value #MESH_METRIC_PREFIX}) live in the default
 * registry next to the JVM collectors.
 */
public class MetricsServer {
  private static final Logger logger = LoggerFactory.getLogger(MetricsServer.class);

  public static final String MESH_METRIC_PREFIX = "mesh_client_";

  public static final Gauge OPEN_SESSIONS =
      Gauge.build()
          .name("mesh_client_open_sessions")
          .help("mesh sessions sharing the metrics server.")
          .register();

  private static MetricsServer instance = null;
  private static int refCount = 0;

  private final int configuredPort;
  private final HTTPServer server;

  public static MetricsServer getInstance(MeshConfiguration conf) {
    if (!conf.isMetricsEnable()) {
      return null;
    }

    synchronized (MetricsServer.class) {
      int port = conf.getMetricsPort();
      if (instance == null) {
        instance = new MetricsServer(port);
      } else if (port != instance.configuredPort) {
        throw new IllegalArgumentException(
            String.format(
                "sessions of one JVM must share %s, got %d while serving on %d",
                ConfigUtils.MESH_METRICS_PORT, port, instance.configuredPort));
      }
      refCount++;
      OPEN_SESSIONS.set(refCount);
      return instance;
    }
  }

  private MetricsServer(int port) {
    this.configuredPort = port;
    DefaultExports.initialize();
    try {
      this.server =
          new HTTPServer.Builder()
              .withPort(port)
              .withDaemonThreads(true)
              .withRegistry(CollectorRegistry.defaultRegistry)
              .build();
    } catch (IOException e) {
      logger.error(String.format("metrics server failed to bind port %d", port), e);
      throw new IllegalStateException("metrics server not up", e);
    }
    logger.info(
        String.format(
            "metrics server is up on %d, mesh metrics %s", server.getPort(), meshMetricNames()));
  }

  /** Names of the mesh metric families currently registered. */
  public static List<String> meshMetricNames() {
    List<String> names = new ArrayList<>();
    Enumeration<Collector.MetricFamilySamples> families =
        CollectorRegistry.defaultRegistry.metricFamilySamples();
    while (families.hasMoreElements()) {
      String name = families.nextElement().name;
      if (name.startsWith(MESH_METRIC_PREFIX)) {
        names.add(name);
      }
    }
    Collections.sort(names);
    return names;
  }

  public int getPort() {
    return server.getPort();
  }

  public void close() {
    synchronized (MetricsServer.class) {
      if (refCount == 0 || instance != this) {
        return;
      }
      refCount--;
      OPEN_SESSIONS.set(refCount);
      if (refCount == 0) {
        int port = server.getPort();
        server.close();
        instance = null;
        logger.info(String.format("metrics server on %d is stopped", port));
      }
    }
  }
}
