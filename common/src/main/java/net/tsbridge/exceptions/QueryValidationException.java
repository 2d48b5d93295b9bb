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
 * Thrown when a query or write is malformed, e.g. an operator given a value
 * of the wrong type. Always raised before any backend is contacted.
 * 
 * @since 1.0
 */
public class QueryValidationException extends IllegalArgumentException {
  private static final long serialVersionUID = 4413625170952138830L;

  /** The offending field, may be null. */
  private final String field;
  
  /**
   * Ctor with a message and the field at fault.
   * @param msg A non-null message.
   * @param field The offending field, may be null.
   */
  public QueryValidationException(final String msg, final String field) {
    super(msg);
    this.field = field;
  }
  
  /**
   * Ctor with a cause.
   * @param msg A non-null message.
   * @param field The offending field, may be null.
   * @param cause The original exception.
   */
  public QueryValidationException(final String msg, 
                                  final String field, 
                                  final Throwable cause) {
    super(msg, cause);
    this.field = field;
  }
  
  /** @return The offending field, may be null. */
  public String field() {
    return field;
  }
}
