// This file is part of tsbridge.
// Copyright (C) 2026  The tsbridge Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tsbridge.exceptions;

/**
 * Thrown when a backend call did not complete before the caller's deadline.
 * The outcome of the call is unknown: a write may or may not have been 
 * applied by the backend so callers must not treat this as a confirmed 
 * failure.
 * 
 * @since 1.0
 */
public class ExecutionTimeoutException extends QueryExecutionException {
  private static final long serialVersionUID = -3321509412871905623L;

  /** The status code used for timeouts. */
  public static final int STATUS_CODE = 408;
  
  /** The deadline that expired in milliseconds. */
  private final long timeout_ms;
  
  /**
   * Default ctor.
   * @param msg A non-null message to be given.
   * @param timeout_ms The deadline that expired in milliseconds.
   */
  public ExecutionTimeoutException(final String msg, final long timeout_ms) {
    this(msg, timeout_ms, null);
  }
  
  /**
   * Ctor with the original cause.
   * @param msg A non-null message to be given.
   * @param timeout_ms The deadline that expired in milliseconds.
   * @param e The original exception, may be null.
   */
  public ExecutionTimeoutException(final String msg, 
                                   final long timeout_ms,
                                   final Throwable e) {
    super(msg, STATUS_CODE, e);
    this.timeout_ms = timeout_ms;
  }
  
  /** @return The deadline that expired in milliseconds. */
  public long timeoutMs() {
    return timeout_ms;
  }
}
