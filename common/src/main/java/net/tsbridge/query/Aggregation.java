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

import java.util.Locale;

import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.tsbridge.data.TagValue;

/**
 * An aggregation: a function and, for percentiles, the percentile in 
 * (0, 100].
 * 
 * @since 1.0
 */
public final class Aggregation {
  /** The percentile used when none or an invalid one is given. */
  public static final double DEFAULT_PERCENTILE = 50;
  
  private final AggregationFunction function;
  private final double percentile;
  
  private Aggregation(final AggregationFunction function, 
                      final double percentile) {
    if (function == null) {
      throw new IllegalArgumentException("Function cannot be null.");
    }
    this.function = function;
    this.percentile = percentile;
  }
  
  /**
   * @param function The non-null function. Percentiles default to 50.
   * @return The aggregation.
   */
  public static Aggregation of(final AggregationFunction function) {
    return new Aggregation(function, 
        function == AggregationFunction.PERCENTILE ? DEFAULT_PERCENTILE : 0);
  }
  
  /**
   * @param percentile The percentile in (0, 100].
   * @return A percentile aggregation.
   * @throws IllegalArgumentException if the percentile is out of range.
   */
  public static Aggregation percentile(final double percentile) {
    if (percentile <= 0 || percentile > 100) {
      throw new IllegalArgumentException("Percentile must be in (0, 100]: " 
          + percentile);
    }
    return new Aggregation(AggregationFunction.PERCENTILE, percentile);
  }
  
  /**
   * Parses names like "avg", "mean", "sum" or "percentile_95". A percentile
   * without a number or with a non-numeric suffix falls back to 50.
   * @param name The non-null and non-empty name.
   * @return The aggregation.
   * @throws IllegalArgumentException if the function is unknown.
   */
  public static Aggregation parse(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Aggregation cannot be null or empty.");
    }
    final String lower = name.trim().toLowerCase(Locale.ROOT);
    if (lower.equals("mean")) {
      return of(AggregationFunction.AVG);
    }
    if (lower.startsWith("percentile")) {
      final String suffix = lower.substring("percentile".length());
      double percentile = DEFAULT_PERCENTILE;
      if (suffix.startsWith("_") && suffix.length() > 1) {
        try {
          final double parsed = Double.parseDouble(suffix.substring(1));
          if (parsed > 0 && parsed <= 100) {
            percentile = parsed;
          }
        } catch (NumberFormatException e) {
          percentile = DEFAULT_PERCENTILE;
        }
      }
      return new Aggregation(AggregationFunction.PERCENTILE, percentile);
    }
    try {
      return of(AggregationFunction.valueOf(lower.toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown aggregation: " + name, e);
    }
  }
  
  /** @return The function. */
  public AggregationFunction function() {
    return function;
  }
  
  /** @return The percentile, only meaningful for percentiles. */
  public double percentile() {
    return percentile;
  }
  
  /** @return The canonical lower case name, e.g. "percentile_95". */
  public String name() {
    if (function == AggregationFunction.PERCENTILE) {
      return "percentile_" + TagValue.formatDouble(percentile);
    }
    return function.name().toLowerCase(Locale.ROOT);
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final Aggregation that = (Aggregation) o;
    return function == that.function 
        && Double.compare(percentile, that.percentile) == 0;
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(function, percentile);
  }
  
  @Override
  public String toString() {
    return name();
  }
}
