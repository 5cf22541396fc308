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

import java.util.Optional;

public class CasConflictException extends RuntimeException {

  private static final long serialVersionUID = -1370263919264707018L;

  private final String key;
  private final Optional<String> expectedPrevValue;
  private final Optional<String> prevValue;

  public CasConflictException(
      String key, Optional<String> expectedPrevValue, Optional<String> prevValue) {
    super(
        String.format(
            "key=%s expectedPrevValue=%s prevValue=%s", key, expectedPrevValue, prevValue));
    this.key = key;
    this.expectedPrevValue = expectedPrevValue;
    this.prevValue = prevValue;
  }

  public String getKey() {
    return this.key;
  }

  public Optional<String> getExpectedPrevValue() {
    return this.expectedPrevValue;
  }

  public Optional<String> getPrevValue() {
    return this.prevValue;
  }
}
