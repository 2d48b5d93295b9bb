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

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tsbridge.data.TagValue;
import net.tsbridge.exceptions.QueryValidationException;

/**
 * A predicate on a label: key, operator and value. The {@code in} and 
 * {@code not in} operators take a list of values while every other operator
 * takes exactly one scalar.
 * 
 * @since 1.0
 */
public class Filter extends Validatable {
  private final String key;
  private final FilterOperator operator;
  private final List<TagValue> values;
  private final boolean is_list;
  
  protected Filter(final Builder builder) {
    key = builder.key;
    operator = builder.operator;
    values = builder.values == null ? ImmutableList.<TagValue>of() : 
      ImmutableList.copyOf(builder.values);
    is_list = builder.is_list;
    validate();
  }
  
  /** @return The label key. */
  public String getKey() {
    return key;
  }
  
  /** @return The operator. */
  public FilterOperator getOperator() {
    return operator;
  }
  
  /** @return The values, a single entry for scalar operators. */
  public List<TagValue> getValues() {
    return values;
  }
  
  /** @return The scalar value for scalar operators, the first value for 
   * list operators. */
  public TagValue getValue() {
    return values.get(0);
  }
  
  /** @return The values rendered as strings. */
  public List<String> getStringValues() {
    final List<String> strings = Lists.newArrayListWithCapacity(values.size());
    for (final TagValue value : values) {
      strings.add(value.asString());
    }
    return strings;
  }
  
  /** @return True if the value was given as a list. */
  public boolean isList() {
    return is_list;
  }
  
  @Override
  public void validate() {
    if (Strings.isNullOrEmpty(key)) {
      throw new QueryValidationException("Filter key cannot be null or "
          + "empty.", "key");
    }
    if (operator == null) {
      throw new QueryValidationException("Filter operator cannot be null "
          + "for key [" + key + "]", "operator");
    }
    if (values.isEmpty()) {
      throw new QueryValidationException("Filter on [" + key 
          + "] must have at least one value.", key);
    }
    for (final TagValue value : values) {
      if (value.isNull()) {
        throw new QueryValidationException("Filter on [" + key 
            + "] cannot have a null value.", key);
      }
    }
    if (operator.requiresList()) {
      if (!is_list) {
        throw new QueryValidationException("Operator [" + operator.symbol() 
            + "] on [" + key + "] requires a list of values.", key);
      }
      return;
    }
    if (is_list) {
      throw new QueryValidationException("Operator [" + operator.symbol() 
          + "] on [" + key + "] requires a scalar value, not a list: " 
          + values, key);
    }
    if (operator.isNumeric() && !values.get(0).isNumeric()) {
      throw new QueryValidationException("Operator [" + operator.symbol() 
          + "] on [" + key + "] requires a numeric value: " + values.get(0), 
          key);
    }
    if (operator.isRegex()) {
      if (values.get(0).type() != TagValue.ValueType.STRING) {
        throw new QueryValidationException("Operator [" + operator.symbol() 
            + "] on [" + key + "] requires a string value: " + values.get(0), 
            key);
      }
      try {
        Pattern.compile(values.get(0).asString());
      } catch (PatternSyntaxException e) {
        throw new QueryValidationException("Invalid regular expression for [" 
            + key + "]: " + values.get(0).asString(), key, e);
      }
    }
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final Filter that = (Filter) o;
    return Objects.equal(key, that.key)
        && operator == that.operator
        && is_list == that.is_list
        && Objects.equal(values, that.values);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(key, operator, values, is_list);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append(key)
        .append(" ")
        .append(operator == null ? null : operator.symbol())
        .append(" ")
        .append(is_list ? values.toString() : 
          values.isEmpty() ? "null" : values.get(0).asString())
        .toString();
  }
  
  /**
   * Shortcut for an equality filter.
   * @param key The label key.
   * @param value The value.
   * @return The filter.
   */
  public static Filter equal(final String key, final String value) {
    return newBuilder().setKey(key).setOperator(FilterOperator.EQUALS)
        .setValue(value).build();
  }
  
  /**
   * Shortcut for an {@code in} filter.
   * @param key The label key.
   * @param values The values.
   * @return The filter.
   */
  public static Filter in(final String key, final String... values) {
    return newBuilder().setKey(key).setOperator(FilterOperator.IN)
        .setStringValues(Arrays.asList(values)).build();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private String key;
    private FilterOperator operator;
    private List<TagValue> values;
    private boolean is_list;
    
    public Builder setKey(final String key) {
      this.key = key;
      return this;
    }
    
    public Builder setOperator(final FilterOperator operator) {
      this.operator = operator;
      return this;
    }
    
    public Builder setValue(final TagValue value) {
      values = Lists.newArrayList(value == null ? TagValue.nullValue() : value);
      is_list = false;
      return this;
    }
    
    public Builder setValue(final String value) {
      return setValue(TagValue.of(value));
    }
    
    public Builder setValues(final List<TagValue> values) {
      this.values = values == null ? null : Lists.newArrayList(values);
      is_list = true;
      return this;
    }
    
    public Builder setStringValues(final List<String> values) {
      final List<TagValue> converted = Lists.newArrayList();
      for (final String value : values) {
        converted.add(TagValue.of(value));
      }
      return setValues(converted);
    }
    
    /**
     * Accepts a value in loose form: lists become list values and scalars 
     * are converted via {@link TagValue#from(Object)}.
     * @param value The value.
     * @return The builder.
     */
    public Builder setRawValue(final Object value) {
      if (value instanceof List) {
        final List<TagValue> converted = Lists.newArrayList();
        for (final Object entry : (List<?>) value) {
          converted.add(TagValue.from(entry));
        }
        return setValues(converted);
      }
      if (value instanceof Object[]) {
        return setRawValue(Arrays.asList((Object[]) value));
      }
      return setValue(TagValue.from(value));
    }
    
    public Filter build() {
      return new Filter(this);
    }
  }
}
