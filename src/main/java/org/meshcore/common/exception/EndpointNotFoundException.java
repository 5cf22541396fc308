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

public class EndpointNotFoundException extends MeshException {

  private static final long serialVersionUID = -2291482460937271610L;

  public EndpointNotFoundException(String msg) {
    super(ErrorKind.NOT_FOUND, msg);
  }

  public static EndpointNotFoundException forInstance(String instanceId) {
    return new EndpointNotFoundException(String.format("endpoint [%s] not found", instanceId));
  }

  public static EndpointNotFoundException forAppId(String appId) {
    return new EndpointNotFoundException(
        String.format("no endpoints available for app [%s]", appId));
  }
}
