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

import java.io.IOException;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.meshcore.common.MeshConfiguration;
import org.meshcore.common.endpoint.Endpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** GETs the health path of an endpoint; any 2xx is healthy. */
public class HttpEndpointProbe implements EndpointProbe {
  private static final Logger logger = LoggerFactory.getLogger(HttpEndpointProbe.class);

  private final String path;
  private final CloseableHttpClient httpClient;

  public HttpEndpointProbe(MeshConfiguration conf) {
    String configured = conf.getHealthCheckPath();
    this.path = configured.startsWith("/") ? configured : "/" + configured;
    int timeout = conf.getHealthCheckTimeoutInMs();
    this.httpClient =
        HttpClients.custom()
            .setDefaultRequestConfig(
                RequestConfig.custom()
                    .setConnectTimeout(timeout)
                    .setConnectionRequestTimeout(timeout)
                    .setSocketTimeout(timeout)
                    .build())
            .disableAutomaticRetries()
            .build();
  }

  @Override
  public void probe(Endpoint endpoint) throws IOException {
    HttpGet get = new HttpGet(healthUrl(endpoint, path));
    try (CloseableHttpResponse resp = httpClient.execute(get)) {
      int status = resp.getStatusLine().getStatusCode();
      EntityUtils.consumeQuietly(resp.getEntity());
      if (status < 200 || status >= 300) {
        throw new IOException(String.format("health check returned status %d", status));
      }
    }
  }

  static String healthUrl(Endpoint endpoint, String path) {
    return String.format("http://%s:%d%s", endpoint.getHost(), endpoint.getPort(), path);
  }

  @Override
  public void close() {
    try {
      httpClient.close();
    } catch (IOException e) {
      logger.warn("failed to close probe http client", e);
    }
  }
}
