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
 * Operators for a {@link Filter}.
 * 
 * @since 1.0
 */
public enum FilterOperator {
  EQUALS("="),
  NOT_EQUALS("!="),
  REGEX("=~"),
  NOT_REGEX("!~"),
  GREATER_THAN(">"),
  LESS_THAN("<"),
  IN("in"),
  NOT_IN("not in");
  
  private final String symbol;
  
  private FilterOperator(final String symbol) {
    this.symbol = symbol;
  }
  
  /** @return The display symbol of the operator. */
  public String symbol() {
    return symbol;
  }
  
  /** @return True if the operator requires a list of values. */
  public boolean requiresList() {
    return this == IN || this == NOT_IN;
  }
  
  /** @return True if the operator treats the value as a regular expression. */
  public boolean isRegex() {
    return this == REGEX || this == NOT_REGEX;
  }
  
  /** @return True if the operator compares numerically. */
  public boolean isNumeric() {
    return this == GREATER_THAN || this == LESS_THAN;
  }
  
  /**
   * Parses an operator from its symbol or enum name, case insensitive.
   * @param operator The non-null operator.
   * @return The operator.
   * @throws IllegalArgumentException if the operator is unknown.
   */
  public static FilterOperator parse(final String operator) {
    if (operator == null) {
      throw new IllegalArgumentException("Operator cannot be null.");
    }
    final String trimmed = operator.trim();
    for (final FilterOperator op : values()) {
      if (op.symbol.equalsIgnoreCase(trimmed) || 
          op.name().equalsIgnoreCase(trimmed)) {
        return op;
      }
    }
    if (trimmed.equals("==")) {
      return EQUALS;
    }
    throw new IllegalArgumentException("Unknown filter operator: " + operator);
  }
}
