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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.junit.Test;
import org.meshcore.BaseMeshTest;
import org.meshcore.common.exception.UpstreamException;
import org.meshcore.invoke.InvocationClient;
import org.meshcore.registry.RegisterRequest;

public class MetricsServerTest extends BaseMeshTest {

  private static String scrape(int port) throws IOException {
    try (CloseableHttpClient http = HttpClients.createDefault();
        CloseableHttpResponse resp =
            http.execute(new HttpGet(String.format("http://127.0.0.1:%d/metrics", port)))) {
      assertEquals(200, resp.getStatusLine().getStatusCode());
      return EntityUtils.toString(resp.getEntity(), StandardCharsets.UTF_8);
    }
  }

  @Test
  public void disabledTest() {
    assertNull(MetricsServer.getInstance(createConfiguration().setMetricsEnable(false)));
  }

  @Test
  public void scrapeMeshMetricsTest() throws IOException {
    MeshConfiguration conf = createConfiguration().setMetricsEnable(true).setMetricsPort(0);
    MeshSession session = new MeshSession(conf, kvStore, bus, clock);
    try {
      session.getMeshService().register(RegisterRequest.of("orders", "127.0.0.1", 1));
      try {
        session.getInvocationClient().invokeRaw("orders", "work", new byte[0]);
        fail();
      } catch (UpstreamException e) {
        // nothing listens on port 1
      }
      MetricsServer server = MetricsServer.getInstance(conf);
      try {
        String body = scrape(server.getPort());
        assertTrue(body.contains("mesh_client_invoke_duration"));
        assertTrue(body.contains("result=\"failure\""));
        assertTrue(body.contains("mesh_client_open_sessions 2.0"));
        assertTrue(MetricsServer.meshMetricNames().contains("mesh_client_invoke_duration"));
      } finally {
        server.close();
      }
    } finally {
      session.close();
    }
  }

  @Test
  public void sharedAcrossSessionsTest() throws IOException {
    MeshConfiguration conf = createConfiguration().setMetricsEnable(true).setMetricsPort(0);
    MetricsServer first = MetricsServer.getInstance(conf);
    MetricsServer second = MetricsServer.getInstance(conf);
    assertSame(first, second);
    try {
      MetricsServer.getInstance(createConfiguration().setMetricsEnable(true).setMetricsPort(1));
      fail();
    } catch (IllegalArgumentException e) {
      // expected
    }
    int port = first.getPort();
    InvocationClient.INVOKE_DURATION.labels("invoke", "success").observe(0.01);

    first.close();
    assertTrue(scrape(port).contains("mesh_client_invoke_duration_bucket"));
    second.close();
    second.close();
    try {
      scrape(port);
      fail();
    } catch (IOException e) {
      // stopped
    }
  }
}
