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

public class MeshException extends RuntimeException {

  private static final long serialVersionUID = 3620125834710539372L;

  private final ErrorKind kind;

  public MeshException(ErrorKind kind, String msg) {
    super(msg);
    this.kind = kind;
  }

  public MeshException(ErrorKind kind, String msg, Throwable e) {
    super(msg, e);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }
}
