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

import io.prometheus.client.Histogram;

public class HistogramUtils {
  private static final double[] DURATION_BUCKETS =
      new double[] {
        0.001D, 0.002D, 0.005D, 0.010D, 0.020D,
        0.030D, 0.050D, 0.080D, 0.10D, 0.150D,
        0.200D, 0.3D, 0.5D, 0.8D, 1D,
        2.5D, 5D, 7.5D, 10D, 30D,
      };

  public static Histogram.Builder buildDuration() {
    return Histogram.build().buckets(DURATION_BUCKETS);
  }
}
