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

import java.util.List;
import java.util.Map;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/**
 * A named series in a result: the metric key, the alias requested by the
 * caller, the labels identifying the series and the ordered points.
 * 
 * @since 1.0
 */
public class TimeSeries {
  private final String metric;
  private final String alias;
  private final ImmutableSortedMap<String, String> labels;
  private final List<TimeSeriesValue> values;
  
  protected TimeSeries(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.metric)) {
      throw new IllegalArgumentException("Metric cannot be null or empty.");
    }
    metric = builder.metric;
    alias = Strings.isNullOrEmpty(builder.alias) ? builder.metric : 
      builder.alias;
    labels = builder.labels == null ? ImmutableSortedMap.<String, String>of() :
      ImmutableSortedMap.copyOf(builder.labels);
    values = builder.values == null ? ImmutableList.<TimeSeriesValue>of() : 
      ImmutableList.copyOf(builder.values);
  }
  
  /** @return The metric key. */
  public String metric() {
    return metric;
  }
  
  /** @return The alias or the metric key if none was given. */
  public String alias() {
    return alias;
  }
  
  /** @return The labels identifying the series. */
  public Map<String, String> labels() {
    return labels;
  }
  
  /** @return The points in timestamp order. */
  public List<TimeSeriesValue> values() {
    return values;
  }
  
  /** @return The minimum non-null value or null if there are none. */
  public Double min() {
    Double min = null;
    for (final TimeSeriesValue value : values) {
      if (value.value() != null && (min == null || value.value() < min)) {
        min = value.value();
      }
    }
    return min;
  }
  
  /** @return The maximum non-null value or null if there are none. */
  public Double max() {
    Double max = null;
    for (final TimeSeriesValue value : values) {
      if (value.value() != null && (max == null || value.value() > max)) {
        max = value.value();
      }
    }
    return max;
  }
  
  /** @return The average of the non-null values or null if there are none. */
  public Double avg() {
    double sum = 0;
    int count = 0;
    for (final TimeSeriesValue value : values) {
      if (value.value() != null) {
        sum += value.value();
        count++;
      }
    }
    return count == 0 ? null : sum / count;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final TimeSeries that = (TimeSeries) o;
    return Objects.equal(metric, that.metric)
        && Objects.equal(alias, that.alias)
        && Objects.equal(labels, that.labels)
        && Objects.equal(values, that.values);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(metric, alias, labels, values);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("metric=")
        .append(metric)
        .append(", alias=")
        .append(alias)
        .append(", labels=")
        .append(labels)
        .append(", values=")
        .append(values.size())
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  /**
   * @param series A non-null series to copy.
   * @return A builder populated from the series.
   */
  public static Builder newBuilder(final TimeSeries series) {
    return new Builder()
        .setMetric(series.metric)
        .setAlias(series.alias)
        .setLabels(series.labels)
        .setValues(series.values);
  }
  
  public static class Builder {
    private String metric;
    private String alias;
    private Map<String, String> labels;
    private List<TimeSeriesValue> values;
    
    public Builder setMetric(final String metric) {
      this.metric = metric;
      return this;
    }
    
    public Builder setAlias(final String alias) {
      this.alias = alias;
      return this;
    }
    
    public Builder setLabels(final Map<String, String> labels) {
      this.labels = labels;
      return this;
    }
    
    public Builder setValues(final List<TimeSeriesValue> values) {
      this.values = values;
      return this;
    }
    
    public TimeSeries build() {
      return new TimeSeries(this);
    }
  }
}
