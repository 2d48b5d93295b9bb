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

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.tsbridge.exceptions.UnsupportedQueryOperationException;
import net.tsbridge.query.Filter;
import net.tsbridge.query.FilterOperator;

/**
 * A label predicate evaluated against the label maps decoded from RRD 
 * file names. Only equality, regular expression and set membership are 
 * supported since the values are only available as strings.
 * 
 * @since 1.0
 */
public class TagCondition {
  private final String key;
  private final FilterOperator operator;
  private final List<String> values;
  
  /** Compiled for the regex operators. */
  private final Pattern pattern;
  
  /**
   * Default ctor.
   * @param key The non-null and non-empty label key.
   * @param operator The non-null operator.
   * @param values The non-null values. Scalar operators use the first one.
   * @throws IllegalArgumentException if a required argument was missing.
   * @throws UnsupportedQueryOperationException if the operator requires 
   * a numeric comparison.
   */
  public TagCondition(final String key, 
                      final FilterOperator operator, 
                      final List<String> values) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (operator == null) {
      throw new IllegalArgumentException("Operator cannot be null.");
    }
    if (operator.isNumeric()) {
      throw new UnsupportedQueryOperationException(RrdDriver.NAME, 
          operator.symbol(), "label conditions only compare strings");
    }
    if (values == null || values.isEmpty()) {
      throw new IllegalArgumentException("Values cannot be null or empty.");
    }
    this.key = key;
    this.operator = operator;
    this.values = ImmutableList.copyOf(values);
    pattern = operator.isRegex() ? Pattern.compile(values.get(0)) : null;
  }
  
  /**
   * Converts a query filter.
   * @param filter A non-null filter.
   * @return The condition.
   * @throws UnsupportedQueryOperationException for numeric comparisons.
   */
  public static TagCondition fromFilter(final Filter filter) {
    return new TagCondition(filter.getKey(), filter.getOperator(), 
        filter.getStringValues());
  }
  
  /**
   * Evaluates the condition. A missing label compares as the empty string.
   * @param labels The non-null decoded labels.
   * @return True if the labels satisfy the condition.
   */
  public boolean matches(final Map<String, String> labels) {
    final String value = Strings.nullToEmpty(labels.get(key));
    switch (operator) {
    case EQUALS:
      return value.equals(values.get(0));
    case NOT_EQUALS:
      return !value.equals(values.get(0));
    case REGEX:
      return pattern.matcher(value).find();
    case NOT_REGEX:
      return !pattern.matcher(value).find();
    case IN:
      return values.contains(value);
    case NOT_IN:
      return !values.contains(value);
    default:
      throw new UnsupportedQueryOperationException(RrdDriver.NAME, 
          operator.symbol());
    }
  }
  
  /**
   * Evaluates all conditions conjunctively.
   * @param conditions The conditions, may be null or empty.
   * @param labels The non-null decoded labels.
   * @return True if every condition matched.
   */
  public static boolean matchesAll(final List<TagCondition> conditions, 
                                   final Map<String, String> labels) {
    if (conditions == null) {
      return true;
    }
    for (final TagCondition condition : conditions) {
      if (!condition.matches(labels)) {
        return false;
      }
    }
    return true;
  }
  
  public String getKey() {
    return key;
  }
  
  public FilterOperator getOperator() {
    return operator;
  }
  
  public List<String> getValues() {
    return values;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final TagCondition that = (TagCondition) o;
    return Objects.equal(key, that.key)
        && operator == that.operator
        && Objects.equal(values, that.values);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(key, operator, values);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append(key)
        .append(" ")
        .append(operator.symbol())
        .append(" ")
        .append(operator.requiresList() ? values : values.get(0))
        .toString();
  }
}
