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
package org.meshcore.routing;

import java.util.List;
import org.meshcore.common.endpoint.Endpoint;

public interface LoadBalancer {
  /**
   * Orders candidates by preference for the next call to appId.
   *
   * @param appId app id the candidates are registered under
   * @param candidates non-empty list, in stable order
   * @return every candidate exactly once, the chosen one first
   */
  List<Endpoint> select(String appId, List<Endpoint> candidates);
}
