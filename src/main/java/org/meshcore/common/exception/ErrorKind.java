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

/** Classification every failure surfaced by the mesh falls into. */
public enum ErrorKind {
  /** Unknown app id, instance id or service name. */
  NOT_FOUND,
  /** The backing store cannot be reached. Never retried. */
  DEPENDENCY_UNAVAILABLE,
  /** The breaker for the target app id is open. Never retried. */
  CIRCUIT_OPEN,
  /** Retryable HTTP or transport failure from the target service. */
  TRANSIENT_UPSTREAM,
  /** Non-retryable failure, including transient ones after retries are exhausted. */
  TERMINAL_UPSTREAM,
  /** The calling thread was interrupted or its future cancelled. Never retried. */
  CANCELLED
}
