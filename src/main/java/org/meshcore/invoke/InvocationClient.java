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
package org.meshcore.invoke;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.meshcore.common.MeshConfiguration;
import org.meshcore.common.endpoint.Endpoint;
import org.meshcore.common.exception.CircuitOpenException;
import org.meshcore.common.exception.DependencyUnavailableException;
import org.meshcore.common.exception.EndpointNotFoundException;
import org.meshcore.common.exception.MeshException;
import org.meshcore.common.exception.OperationCancelledException;
import org.meshcore.common.exception.UpstreamException;
import org.meshcore.common.util.BackOffFunction;
import org.meshcore.common.util.BackOffer;
import org.meshcore.common.util.ConcreteBackOffer;
import org.meshcore.common.util.HistogramUtils;
import org.meshcore.routing.Router;
import org.meshcore.routing.ServiceMappingTable;
import org.meshcore.service.failsafe.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The call path of every outbound inter-service request.
 *
 * <p>A call is rejected up front while the target's circuit is open. Otherwise an endpoint is taken
 * from the {@link EndpointCache} (resolved through the {@link Router} on a miss) and the method is
 * POSTed to it. 2xx and 4xx responses are delivered. 408, 429, 5xx and connection failures drop
 * the cached endpoint and are retried after {@code retryDelay * 2^n} ms, up to {@code maxRetries}
 * times; what is still failing after that counts against the circuit. Any other status (1xx, 3xx)
 * fails at once and counts against the circuit too; redirects are not followed.
 *
 * <p>An interrupted caller, or a cancelled {@link #invokeAsync} future, stops the call before its
 * next attempt with an {@link OperationCancelledException}; that outcome is not counted in the
 * circuit.
 *
 * <p>{@link #invokeRaw} is the same path without the circuit breaker, for optional targets whose
 * absence must not trip it.
 */
public class InvocationClient implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(InvocationClient.class);

  public static final Histogram INVOKE_DURATION =
      HistogramUtils.buildDuration()
          .name("mesh_client_invoke_duration")
          .help("duration of invocations including retries.")
          .labelNames("type", "result")
          .register();

  public static final Counter INVOKE_RETRIES =
      Counter.build()
          .name("mesh_client_invoke_retries")
          .help("invocation retries after transient failures.")
          .labelNames("type")
          .register();

  private static final String TYPE_BREAKER = "invoke";
  private static final String TYPE_RAW = "raw";

  private final Router router;
  private final CircuitBreaker breaker;
  private final EndpointCache endpointCache;
  private final ServiceMappingTable mappings;
  private final ExecutorService invokePool;
  private final CloseableHttpClient httpClient;
  private final JsonMapper jsonMapper = new JsonMapper();
  private final boolean breakerEnabled;
  private final int maxRetries;
  private final int retryDelayInMs;

  public InvocationClient(
      MeshConfiguration conf,
      Router router,
      CircuitBreaker breaker,
      EndpointCache endpointCache,
      ServiceMappingTable mappings,
      ExecutorService invokePool) {
    this.router = router;
    this.breaker = breaker;
    this.endpointCache = endpointCache;
    this.mappings = mappings;
    this.invokePool = invokePool;
    this.breakerEnabled = conf.isCircuitBreakEnable();
    this.maxRetries = conf.getMaxRetries();
    this.retryDelayInMs = conf.getRetryDelayInMs();

    PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
    connectionManager.setMaxTotal(Math.max(conf.getInvokeConcurrency() * 4, 20));
    connectionManager.setDefaultMaxPerRoute(Math.max(conf.getInvokeConcurrency(), 2));
    RequestConfig requestConfig =
        RequestConfig.custom()
            .setConnectTimeout(conf.getConnectTimeoutInMs())
            .setConnectionRequestTimeout(conf.getConnectTimeoutInMs())
            .setSocketTimeout(conf.getSocketTimeoutInMs())
            .build();
    this.httpClient =
        HttpClients.custom()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(requestConfig)
            .disableAutomaticRetries()
            .disableRedirectHandling()
            .build();
  }

  /**
   * POSTs body to {@code /{method}} of an endpoint of appId.
   *
   * @return the response, with a 2xx or 4xx status
   * @throws CircuitOpenException if the circuit of appId is open
   * @throws UpstreamException if the call still failed after all retries
   * @throws EndpointNotFoundException if appId had no endpoint on any attempt
   * @throws DependencyUnavailableException if the endpoint store is unreachable
   * @throws OperationCancelledException if the calling thread is interrupted
   */
  public InvocationResponse invoke(String appId, String method, byte[] body) {
    return doInvoke(appId, method, body, true);
  }

  /** {@link #invoke} without the circuit breaker: never rejected by it, never counted in it. */
  public InvocationResponse invokeRaw(String appId, String method, byte[] body) {
    return doInvoke(appId, method, body, false);
  }

  /** Invokes the app id the service name is currently mapped to. */
  public InvocationResponse invokeService(String serviceName, String method, byte[] body) {
    return invoke(mappings.resolve(serviceName), method, body);
  }

  /**
   * {@link #invoke} on the invoke pool. Cancelling the returned future interrupts the call, which
   * then makes no further attempt.
   */
  public CompletableFuture<InvocationResponse> invokeAsync(
      String appId, String method, byte[] body) {
    CompletableFuture<InvocationResponse> result = new CompletableFuture<>();
    Future<?> task =
        invokePool.submit(
            () -> {
              try {
                result.complete(invoke(appId, method, body));
              } catch (Throwable e) {
                result.completeExceptionally(e);
              }
            });
    // CompletableFuture.cancel does not interrupt, the pool task has to be cancelled as well
    result.whenComplete(
        (response, e) -> {
          if (result.isCancelled()) {
            task.cancel(true);
          }
        });
    return result;
  }

  /**
   * Sends request as JSON and reads the response as responseType.
   *
   * @throws UpstreamException with TERMINAL_UPSTREAM kind if the final status is not 2xx or the
   *     body cannot be read
   */
  public <T> T invokeJson(String appId, String method, Object request, Class<T> responseType) {
    byte[] body;
    try {
      body = jsonMapper.writeValueAsBytes(request);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("request is not serializable to JSON", e);
    }
    InvocationResponse response = invoke(appId, method, body);
    if (!response.isSuccessStatus()) {
      throw UpstreamException.httpError(appId, method, response.getStatusCode());
    }
    if (responseType == Void.class || response.getBody().length == 0) {
      return null;
    }
    try {
      return jsonMapper.readValue(response.getBody(), responseType);
    } catch (IOException e) {
      throw UpstreamException.malformedResponse(appId, method, response.getStatusCode(), e);
    }
  }

  /** Whether a call to appId would currently be attempted: circuit not open and a route exists. */
  public boolean isServiceAvailable(String appId) {
    if (breakerEnabled && !breaker.isCallAllowed(appId)) {
      return false;
    }
    try {
      endpointCache.get(appId, router::resolveEndpoint);
      return true;
    } catch (EndpointNotFoundException e) {
      return false;
    }
  }

  private InvocationResponse doInvoke(String appId, String method, byte[] body, boolean guarded) {
    boolean useBreaker = guarded && breakerEnabled;
    if (useBreaker && !breaker.isCallAllowed(appId)) {
      throw new CircuitOpenException(appId, method);
    }

    String type = guarded ? TYPE_BREAKER : TYPE_RAW;
    long start = System.nanoTime();
    String result = "failure";
    BackOffer backOffer = ConcreteBackOffer.newInvokeBackOff(maxRetries, retryDelayInMs);
    MeshException last = null;
    int attempts = 0;
    try {
      while (true) {
        checkCancelled(appId, method, last);
        attempts++;
        try {
          Endpoint endpoint = endpointCache.get(appId, router::resolveEndpoint);
          InvocationResponse response = execute(appId, endpoint, method, body, attempts);
          if (useBreaker) {
            recordSuccess(appId);
          }
          result = "success";
          return response;
        } catch (UpstreamException e) {
          // an interrupted socket surfaces as a connection failure
          checkCancelled(appId, method, e);
          if (!e.isRetryable()) {
            logger.warn(String.format("invoke [%s] %s failed: %s", appId, method, e.getMessage()));
            if (useBreaker) {
              recordFailure(appId);
            }
            throw e;
          }
          last = e;
        } catch (EndpointNotFoundException e) {
          last = e;
        }
        endpointCache.invalidate(appId);
        logger.debug(String.format("attempt %d failed: %s", attempts, last.getMessage()));
        if (!backOffer.canRetryAfterSleep(BackOffFunction.BackOffFuncType.BoInvokeRetry)) {
          break;
        }
        INVOKE_RETRIES.labels(type).inc();
      }
    } catch (OperationCancelledException e) {
      result = "cancelled";
      logger.info(
          String.format("invoke [%s] %s cancelled after %d attempts", appId, method, attempts));
      throw e;
    } finally {
      INVOKE_DURATION.labels(type, result).observe((System.nanoTime() - start) / 1e9);
    }

    logger.warn(
        String.format(
            "invoke [%s] %s failed after %d attempts: %s",
            appId, method, attempts, last.getMessage()));
    if (last instanceof EndpointNotFoundException) {
      throw (EndpointNotFoundException) last;
    }
    if (useBreaker) {
      recordFailure(appId);
    }
    throw UpstreamException.retriesExhausted(appId, method, attempts, (UpstreamException) last);
  }

  private InvocationResponse execute(
      String appId, Endpoint endpoint, String method, byte[] body, int attempt) {
    String url = buildUrl(endpoint, method);
    HttpPost post = new HttpPost(url);
    post.setEntity(
        new ByteArrayEntity(body == null ? new byte[0] : body, ContentType.APPLICATION_JSON));
    try (CloseableHttpResponse resp = httpClient.execute(post)) {
      int status = resp.getStatusLine().getStatusCode();
      HttpEntity entity = resp.getEntity();
      byte[] content = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
      if (isTransientStatus(status)) {
        throw UpstreamException.transientStatus(appId, method, status);
      }
      if (!isDeliverableStatus(status)) {
        throw UpstreamException.httpError(appId, method, status);
      }
      if (logger.isDebugEnabled()) {
        logger.debug(String.format("POST %s -> %d (attempt %d)", url, status, attempt));
      }
      return new InvocationResponse(status, content, endpoint.getAddress(), attempt);
    } catch (IOException e) {
      throw UpstreamException.connectionFailure(appId, method, e);
    }
  }

  static String buildUrl(Endpoint endpoint, String method) {
    String path = method.startsWith("/") ? method.substring(1) : method;
    return String.format("http://%s:%d/%s", endpoint.getHost(), endpoint.getPort(), path);
  }

  static boolean isTransientStatus(int status) {
    return status == 408 || status == 429 || status >= 500;
  }

  static boolean isDeliverableStatus(int status) {
    return (status >= 200 && status < 300) || (status >= 400 && status < 500);
  }

  private static void checkCancelled(String appId, String method, Throwable cause) {
    if (Thread.currentThread().isInterrupted()) {
      throw new OperationCancelledException(
          String.format("invoke [%s] %s cancelled", appId, method), cause);
    }
  }

  // Breaker bookkeeping failures are logged, not thrown.
  private void recordSuccess(String appId) {
    try {
      breaker.recordSuccess(appId);
    } catch (DependencyUnavailableException e) {
      logger.warn(String.format("failed to record success for [%s]", appId), e);
    }
  }

  private void recordFailure(String appId) {
    try {
      breaker.recordFailure(appId);
    } catch (DependencyUnavailableException e) {
      logger.warn(String.format("failed to record failure for [%s]", appId), e);
    }
  }

  @Override
  public void close() {
    try {
      httpClient.close();
    } catch (IOException e) {
      logger.warn("failed to close http client", e);
    }
  }
}
