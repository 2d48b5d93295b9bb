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
package net.tsbridge.utils;

/**
 * Thrown when the JSON or YAML mapper fails with an IO error.
 * 
 * @since 1.0
 */
public class SerdesException extends RuntimeException {
  private static final long serialVersionUID = -2264474651582563540L;

  /**
   * Ctor with a cause.
   * @param cause A non-null cause.
   */
  public SerdesException(final Throwable cause) {
    super(cause);
  }
  
  /**
   * Ctor with a message and cause.
   * @param msg A non-null message.
   * @param cause A non-null cause.
   */
  public SerdesException(final String msg, final Throwable cause) {
    super(msg, cause);
  }
}
