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

public class DependencyUnavailableException extends MeshException {

  private static final long serialVersionUID = 8094317785202645104L;

  public DependencyUnavailableException(String msg) {
    super(ErrorKind.DEPENDENCY_UNAVAILABLE, msg);
  }

  public DependencyUnavailableException(String msg, Throwable e) {
    super(ErrorKind.DEPENDENCY_UNAVAILABLE, msg, e);
  }
}
