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

import java.nio.charset.StandardCharsets;

public class InvocationResponse {
  private final int statusCode;
  private final byte[] body;
  private final String endpointAddress;
  private final int attempts;

  public InvocationResponse(int statusCode, byte[] body, String endpointAddress, int attempts) {
    this.statusCode = statusCode;
    this.body = body;
    this.endpointAddress = endpointAddress;
    this.attempts = attempts;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public byte[] getBody() {
    return body;
  }

  public String getBodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  /** host:port that answered. */
  public String getEndpointAddress() {
    return endpointAddress;
  }

  /** Number of attempts, 1 if the first call went through. */
  public int getAttempts() {
    return attempts;
  }

  public boolean isSuccessStatus() {
    return statusCode >= 200 && statusCode < 300;
  }

  public boolean isClientError() {
    return statusCode >= 400 && statusCode < 500;
  }
}
