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
package net.tsbridge.query;

/**
 * Sends a compiled query to the backend and returns the raw output. Every 
 * call accepts a deadline in milliseconds.
 * 
 * @param <T> The type of compiled query.
 * @param <R> The type of raw result.
 * 
 * @since 1.0
 */
public interface QueryExecutor<T, R> {

  /**
   * Executes the query, blocking until the backend responds or the 
   * deadline expires.
   * @param compiled The non-null compiled query.
   * @param timeout_ms The deadline in milliseconds.
   * @return The raw output.
   * @throws net.tsbridge.exceptions.ExecutionTimeoutException if the 
   * deadline expired. The outcome is unknown in this case.
   * @throws net.tsbridge.exceptions.QueryExecutionException if the backend
   * failed.
   */
  public R execute(final T compiled, final long timeout_ms);
}
