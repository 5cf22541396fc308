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
package org.meshcore.health;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.meshcore.common.MeshConfiguration;
import org.meshcore.common.endpoint.Endpoint;

public class HttpEndpointProbeTest {
  private HttpServer server;
  private volatile int status = 200;
  private volatile String lastPath;
  private HttpEndpointProbe probe;
  private Endpoint endpoint;

  @Before
  public void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/",
        exchange -> {
          lastPath = exchange.getRequestURI().getPath();
          exchange.sendResponseHeaders(status, -1);
          exchange.close();
        });
    server.start();
    probe =
        new HttpEndpointProbe(
            MeshConfiguration.createDefault()
                .setHealthCheckPath("healthz")
                .setHealthCheckTimeoutInMs(2000));
    endpoint = new Endpoint().setHost("127.0.0.1").setPort(server.getAddress().getPort());
  }

  @After
  public void tearDown() {
    probe.close();
    server.stop(0);
  }

  @Test
  public void healthyTest() throws IOException {
    probe.probe(endpoint);
    assertEquals("/healthz", lastPath);
  }

  @Test
  public void plainHttpOnEveryPortTest() {
    Endpoint tls = new Endpoint().setHost("orders.internal").setPort(443);
    assertEquals(
        "http://orders.internal:443/healthz", HttpEndpointProbe.healthUrl(tls, "/healthz"));
  }

  @Test
  public void unhealthyStatusTest() {
    status = 503;
    try {
      probe.probe(endpoint);
      fail();
    } catch (IOException e) {
      assertEquals("health check returned status 503", e.getMessage());
    }
  }
}
