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
 * Thrown by a compiler or writer when asked to emit an operation its backend
 * cannot express and the driver does not emulate it.
 * 
 * @since 1.0
 */
public class UnsupportedQueryOperationException extends RuntimeException {
  private static final long serialVersionUID = 5031188045914785370L;

  /** The driver that rejected the operation. */
  private final String driver;
  
  /** The operation that was rejected. */
  private final String operation;
  
  /**
   * Default ctor.
   * @param driver The non-null name of the driver.
   * @param operation The non-null name of the operation.
   */
  public UnsupportedQueryOperationException(final String driver, 
                                            final String operation) {
    this(driver, operation, null);
  }
  
  /**
   * Ctor with additional detail.
   * @param driver The non-null name of the driver.
   * @param operation The non-null name of the operation.
   * @param detail An optional detail appended to the message.
   */
  public UnsupportedQueryOperationException(final String driver, 
                                            final String operation,
                                            final String detail) {
    super("The " + driver + " driver does not support the operation [" 
        + operation + "]" + (detail == null ? "" : ": " + detail));
    this.driver = driver;
    this.operation = operation;
  }
  
  /** @return The driver that rejected the operation. */
  public String driver() {
    return driver;
  }
  
  /** @return The operation that was rejected. */
  public String operation() {
    return operation;
  }
}
