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
import org.meshcore.common.endpoint.Endpoint;

public interface EndpointProbe extends AutoCloseable {
  /**
   * A lightweight liveness check with its own short timeout.
   *
   * @throws IOException if the endpoint did not answer, or answered unhealthy
   */
  void probe(Endpoint endpoint) throws IOException;

  @Override
  void close();
}
