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
package org.meshcore.common.util;

import com.google.common.base.Preconditions;
import io.prometheus.client.Histogram;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.meshcore.common.exception.DependencyUnavailableException;
import org.meshcore.common.exception.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ConcreteBackOffer implements BackOffer {
  private static final Logger logger = LoggerFactory.getLogger(ConcreteBackOffer.class);

  private static final int CAS_BASE_IN_MS = 1;
  private static final int CAS_CAP_IN_MS = 50;

  private final int maxAttempts;
  private final int invokeBaseInMs;
  private final Map<BackOffFunction.BackOffFuncType, BackOffFunction> backOffFunctionMap;
  private final List<Exception> errors;
  private long totalSleep;

  public static final Histogram BACKOFF_DURATION =
      HistogramUtils.buildDuration()
          .name("mesh_client_backoff_duration")
          .help("backoff duration.")
          .labelNames("type")
          .register();

  private ConcreteBackOffer(int maxAttempts, int invokeBaseInMs) {
    Preconditions.checkArgument(maxAttempts >= 0, "Max attempts cannot be less than 0.");
    Preconditions.checkArgument(invokeBaseInMs >= 0, "Retry delay cannot be less than 0.");
    this.maxAttempts = maxAttempts;
    this.invokeBaseInMs = invokeBaseInMs;
    this.errors = new ArrayList<>();
    this.backOffFunctionMap = new HashMap<>();
  }

  /** Back off for invocation retries: {@code retryDelayInMs * 2^n} before the n-th retry. */
  public static ConcreteBackOffer newInvokeBackOff(int maxRetries, int retryDelayInMs) {
    return new ConcreteBackOffer(maxRetries, retryDelayInMs);
  }

  public static ConcreteBackOffer newCasBackOff(int maxAttempts) {
    return new ConcreteBackOffer(maxAttempts, 0);
  }

  private BackOffFunction createBackOffFunc(BackOffFunction.BackOffFuncType funcType) {
    BackOffFunction backOffFunction = null;
    switch (funcType) {
      case BoInvokeRetry:
        backOffFunction =
            BackOffFunction.create(invokeBaseInMs, Integer.MAX_VALUE, BackOffStrategy.NoJitter);
        break;
      case BoStoreCas:
        backOffFunction =
            BackOffFunction.create(CAS_BASE_IN_MS, CAS_CAP_IN_MS, BackOffStrategy.EqualJitter);
        break;
    }
    return backOffFunction;
  }

  @Override
  public void doBackOff(BackOffFunction.BackOffFuncType funcType, Exception err) {
    logger.debug(
        String.format(
            "%s, retry later(totalSleep %dms, maxAttempts %d)",
            err.getMessage(), totalSleep, maxAttempts));
    errors.add(err);
    if (!canRetryAfterSleep(funcType)) {
      logThrowError(err);
    }
  }

  @Override
  public boolean canRetryAfterSleep(BackOffFunction.BackOffFuncType funcType) {
    BackOffFunction backOffFunction =
        backOffFunctionMap.computeIfAbsent(funcType, this::createBackOffFunc);
    if (backOffFunction.getAttempts() >= maxAttempts) {
      return false;
    }

    Histogram.Timer backOffTimer = BACKOFF_DURATION.labels(funcType.name()).startTimer();
    long sleep = backOffFunction.getSleepMs();
    totalSleep += sleep;
    try {
      Thread.sleep(sleep);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OperationCancelledException("interrupted during back off", e);
    } finally {
      backOffTimer.observeDuration();
    }
    return true;
  }

  @Override
  public int getAttempts(BackOffFunction.BackOffFuncType funcType) {
    BackOffFunction backOffFunction = backOffFunctionMap.get(funcType);
    return backOffFunction == null ? 0 : backOffFunction.getAttempts();
  }

  public long getTotalSleep() {
    return totalSleep;
  }

  private void logThrowError(Exception err) {
    StringBuilder errMsg = new StringBuilder();
    for (int i = 0; i < errors.size(); i++) {
      Exception curErr = errors.get(i);
      // Print only last 3 errors for non-DEBUG log levels.
      if (logger.isDebugEnabled() || i >= errors.size() - 3) {
        errMsg.append("\n").append(i).append(".").append(curErr.toString());
      }
    }
    logger.warn(errMsg.toString());
    throw new DependencyUnavailableException("retry is exhausted.", err);
  }
}
