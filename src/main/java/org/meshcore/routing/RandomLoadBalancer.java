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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.meshcore.common.endpoint.Endpoint;

public class RandomLoadBalancer implements LoadBalancer {
  private final Random random;

  public RandomLoadBalancer(Random random) {
    this.random = random;
  }

  @Override
  public List<Endpoint> select(String appId, List<Endpoint> candidates) {
    List<Endpoint> ordered = new ArrayList<>(candidates);
    Collections.shuffle(ordered, random);
    return ordered;
  }
}
