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

/**
 * Thrown on a thread whose work was interrupted, either directly or by cancelling the future it
 * was running. The interrupt flag is restored before this is thrown.
 */
public class OperationCancelledException extends MeshException {

  private static final long serialVersionUID = -5179034251647207417L;

  public OperationCancelledException(String msg) {
    super(ErrorKind.CANCELLED, msg);
  }

  public OperationCancelledException(String msg, Throwable e) {
    super(ErrorKind.CANCELLED, msg, e);
  }
}
