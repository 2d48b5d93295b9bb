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
package net.tsbridge.data;

import java.util.Locale;

import com.google.common.base.Objects;

/**
 * A tagged union over the scalar types accepted by filters and writes: 
 * integers, floating point numbers, strings, booleans and null. Instances 
 * are immutable.
 * 
 * @since 1.0
 */
public final class TagValue {

  /** The type of value held. */
  public static enum ValueType {
    INT,
    FLOAT,
    STRING,
    BOOL,
    NULL
  }
  
  /** The shared null value. */
  private static final TagValue NULL = new TagValue(ValueType.NULL, 0, 0, null);
  
  /** The shared true value. */
  private static final TagValue TRUE = new TagValue(ValueType.BOOL, 1, 1, null);
  
  /** The shared false value. */
  private static final TagValue FALSE = new TagValue(ValueType.BOOL, 0, 0, null);
  
  private final ValueType type;
  private final long long_value;
  private final double double_value;
  private final String string_value;
  
  private TagValue(final ValueType type, 
                   final long long_value, 
                   final double double_value, 
                   final String string_value) {
    this.type = type;
    this.long_value = long_value;
    this.double_value = double_value;
    this.string_value = string_value;
  }
  
  /**
   * @param value An integer value.
   * @return An {@link ValueType#INT} value.
   */
  public static TagValue of(final long value) {
    return new TagValue(ValueType.INT, value, value, null);
  }
  
  /**
   * @param value A floating point value.
   * @return A {@link ValueType#FLOAT} value.
   */
  public static TagValue of(final double value) {
    return new TagValue(ValueType.FLOAT, (long) value, value, null);
  }
  
  /**
   * @param value A string, may be null in which case the null value is 
   * returned.
   * @return A {@link ValueType#STRING} value or the null value.
   */
  public static TagValue of(final String value) {
    if (value == null) {
      return NULL;
    }
    return new TagValue(ValueType.STRING, 0, 0, value);
  }
  
  /**
   * @param value A boolean.
   * @return A {@link ValueType#BOOL} value.
   */
  public static TagValue of(final boolean value) {
    return value ? TRUE : FALSE;
  }
  
  /** @return The null value. */
  public static TagValue nullValue() {
    return NULL;
  }
  
  /**
   * Converts a boxed Java object into a tag value. Integral numbers map to
   * {@link ValueType#INT}, other numbers to {@link ValueType#FLOAT}.
   * @param value The value to convert, may be null.
   * @return A non-null tag value.
   * @throws IllegalArgumentException if the type isn't supported.
   */
  public static TagValue from(final Object value) {
    if (value == null) {
      return NULL;
    }
    if (value instanceof TagValue) {
      return (TagValue) value;
    }
    if (value instanceof Long || value instanceof Integer || 
        value instanceof Short || value instanceof Byte) {
      return of(((Number) value).longValue());
    }
    if (value instanceof Number) {
      return of(((Number) value).doubleValue());
    }
    if (value instanceof Boolean) {
      return of((boolean) (Boolean) value);
    }
    if (value instanceof CharSequence) {
      return of(value.toString());
    }
    throw new IllegalArgumentException("Unsupported value type: " 
        + value.getClass());
  }
  
  /** @return The non-null type of the value. */
  public ValueType type() {
    return type;
  }
  
  /** @return True if the value is an integer or float. */
  public boolean isNumeric() {
    return type == ValueType.INT || type == ValueType.FLOAT;
  }
  
  /** @return True if this is the null value. */
  public boolean isNull() {
    return type == ValueType.NULL;
  }
  
  /**
   * @return The value as a long. Floats are truncated, booleans are 1 or 0.
   * @throws IllegalStateException if the value is a string or null.
   */
  public long asLong() {
    if (type == ValueType.STRING || type == ValueType.NULL) {
      throw new IllegalStateException("Value of type " + type 
          + " is not numeric.");
    }
    return long_value;
  }
  
  /**
   * @return The value as a double. Booleans are 1 or 0.
   * @throws IllegalStateException if the value is a string or null.
   */
  public double asDouble() {
    if (type == ValueType.STRING || type == ValueType.NULL) {
      throw new IllegalStateException("Value of type " + type 
          + " is not numeric.");
    }
    return double_value;
  }
  
  /**
   * @return The boolean value.
   * @throws IllegalStateException if the value is not a boolean.
   */
  public boolean asBoolean() {
    if (type != ValueType.BOOL) {
      throw new IllegalStateException("Value of type " + type 
          + " is not a boolean.");
    }
    return long_value == 1;
  }
  
  /** @return The value rendered as a string, null for the null value. */
  public String asString() {
    switch (type) {
    case STRING:
      return string_value;
    case INT:
      return Long.toString(long_value);
    case FLOAT:
      return formatDouble(double_value);
    case BOOL:
      return long_value == 1 ? "true" : "false";
    default:
      return null;
    }
  }
  
  /**
   * Formats a double without exponents or trailing zeros where possible, 
   * e.g. 1.0 becomes "1" and 0.5 stays "0.5".
   * @param value The value to format.
   * @return A non-null string.
   */
  public static String formatDouble(final double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return Double.toString(value);
    }
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    final String formatted = String.format(Locale.ROOT, "%.12f", value);
    int end = formatted.length();
    while (end > 0 && formatted.charAt(end - 1) == '0') {
      end--;
    }
    return formatted.substring(0, end);
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final TagValue that = (TagValue) o;
    return type == that.type
        && long_value == that.long_value
        && Double.compare(double_value, that.double_value) == 0
        && Objects.equal(string_value, that.string_value);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(type, long_value, double_value, string_value);
  }
  
  @Override
  public String toString() {
    return type + ":" + asString();
  }
}
