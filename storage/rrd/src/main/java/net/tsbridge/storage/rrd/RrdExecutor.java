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
package net.tsbridge.storage.rrd;

import net.tsbridge.query.QueryExecutor;

/**
 * Runs rrdtool commands and returns their raw text output. Implementations
 * must honor the deadline and raise 
 * {@link net.tsbridge.exceptions.ExecutionTimeoutException} when it 
 * expires, leaving the outcome of the command unknown.
 * 
 * @since 1.0
 */
public interface RrdExecutor extends QueryExecutor<RrdCommand, String> {

  /**
   * Executes the command.
   * @param command The non-null command.
   * @param timeout_ms The deadline in milliseconds.
   * @return The output, never null.
   * @throws RrdFileNotFoundException if the archive did not exist.
   * @throws net.tsbridge.exceptions.QueryExecutionException if the 
   * command failed.
   */
  @Override
  public String execute(final RrdCommand command, final long timeout_ms);
  
  /** @return A descriptive name for logs and exceptions. */
  public String endpoint();
  
  /** Releases processes or sockets held by the executor. */
  public void shutdown();
}
