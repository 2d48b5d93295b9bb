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
 * Arithmetic operators for math transformations.
 * 
 * @since 1.0
 */
public enum MathOperator {
  ADD("+"),
  SUBTRACT("-"),
  MULTIPLY("*"),
  DIVIDE("/");
  
  private final String symbol;
  
  private MathOperator(final String symbol) {
    this.symbol = symbol;
  }
  
  /** @return The infix symbol. */
  public String symbol() {
    return symbol;
  }
  
  /**
   * @param symbol The non-null symbol, e.g. "*".
   * @return The operator.
   * @throws IllegalArgumentException if the symbol is unknown.
   */
  public static MathOperator fromSymbol(final String symbol) {
    for (final MathOperator op : values()) {
      if (op.symbol.equals(symbol == null ? null : symbol.trim())) {
        return op;
      }
    }
    throw new IllegalArgumentException("Unknown math operator: " + symbol);
  }
}
