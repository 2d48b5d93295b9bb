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
 * Thrown when backend output does not match the expected grammar. The raw 
 * output is kept for debugging. Parsers never return partial structures.
 * 
 * @since 1.0
 */
public class OutputParseException extends RuntimeException {
  private static final long serialVersionUID = -8817364398153690255L;
  
  /** The raw output that failed to parse. */
  private final String raw_output;
  
  /**
   * Default ctor.
   * @param msg A non-null message.
   * @param raw_output The raw output that failed to parse.
   */
  public OutputParseException(final String msg, final String raw_output) {
    this(msg, raw_output, null);
  }
  
  /**
   * Ctor with a cause.
   * @param msg A non-null message.
   * @param raw_output The raw output that failed to parse.
   * @param cause The original exception.
   */
  public OutputParseException(final String msg, 
                              final String raw_output, 
                              final Throwable cause) {
    super(msg, cause);
    this.raw_output = raw_output;
  }
  
  /** @return The raw output that failed to parse. */
  public String rawOutput() {
    return raw_output;
  }
}
