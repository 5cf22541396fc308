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

package org.meshcore.common.exception;

/** Failure reported by, or on the way to, a target service. */
public class UpstreamException extends MeshException {

  private static final long serialVersionUID = 5561012996233875405L;

  /** Status code used when no HTTP response was received. */
  public static final int NO_STATUS = -1;

  private final String appId;
  private final String method;
  private final int statusCode;

  private UpstreamException(
      ErrorKind kind, String appId, String method, int statusCode, String msg, Throwable e) {
    super(kind, msg, e);
    this.appId = appId;
    this.method = method;
    this.statusCode = statusCode;
  }

  public static UpstreamException transientStatus(String appId, String method, int statusCode) {
    return new UpstreamException(
        ErrorKind.TRANSIENT_UPSTREAM,
        appId,
        method,
        statusCode,
        String.format("transient status %d from [%s] %s", statusCode, appId, method),
        null);
  }

  public static UpstreamException connectionFailure(String appId, String method, Throwable e) {
    return new UpstreamException(
        ErrorKind.TRANSIENT_UPSTREAM,
        appId,
        method,
        NO_STATUS,
        String.format("connection failure to [%s] %s: %s", appId, method, e.getMessage()),
        e);
  }

  public static UpstreamException retriesExhausted(
      String appId, String method, int attempts, UpstreamException last) {
    return new UpstreamException(
        ErrorKind.TERMINAL_UPSTREAM,
        appId,
        method,
        last == null ? NO_STATUS : last.getStatusCode(),
        String.format(
            "failed to invoke [%s] %s after %d attempts%s",
            appId, method, attempts, last == null ? "" : ": " + last.getMessage()),
        last);
  }

  public static UpstreamException httpError(String appId, String method, int statusCode) {
    return new UpstreamException(
        ErrorKind.TERMINAL_UPSTREAM,
        appId,
        method,
        statusCode,
        String.format("[%s] %s responded with status %d", appId, method, statusCode),
        null);
  }

  public static UpstreamException malformedResponse(
      String appId, String method, int statusCode, Throwable e) {
    return new UpstreamException(
        ErrorKind.TERMINAL_UPSTREAM,
        appId,
        method,
        statusCode,
        String.format("unreadable response from [%s] %s: %s", appId, method, e.getMessage()),
        e);
  }

  public String getAppId() {
    return appId;
  }

  public String getMethod() {
    return method;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean isRetryable() {
    return getKind() == ErrorKind.TRANSIENT_UPSTREAM;
  }
}
