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

import java.util.Map;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSortedMap;

/**
 * An immutable point to write: a metric, its label set, a numeric or 
 * boolean value and a timestamp in Unix epoch seconds. Every writer accepts
 * this record and owns its wire encoding.
 * 
 * @since 1.0
 */
public class TimeSeriesDatum {
  private final MetricIdentifier metric;
  private final ImmutableSortedMap<String, String> labels;
  private final TagValue value;
  private final long timestamp;
  
  protected TimeSeriesDatum(final Builder builder) {
    if (builder.metric == null) {
      throw new IllegalArgumentException("Metric cannot be null.");
    }
    if (builder.value == null || 
        !(builder.value.isNumeric() || 
            builder.value.type() == TagValue.ValueType.BOOL)) {
      throw new IllegalArgumentException("Value must be numeric or boolean: " 
          + builder.value);
    }
    if (builder.timestamp < 0) {
      throw new IllegalArgumentException("Timestamp cannot be negative: " 
          + builder.timestamp);
    }
    metric = builder.metric;
    labels = builder.labels == null ? ImmutableSortedMap.<String, String>of() :
      ImmutableSortedMap.copyOf(builder.labels);
    for (final Map.Entry<String, String> entry : labels.entrySet()) {
      if (entry.getValue() == null) {
        throw new IllegalArgumentException("Value for label [" 
            + entry.getKey() + "] cannot be null.");
      }
    }
    value = builder.value;
    timestamp = builder.timestamp;
  }
  
  /** @return The non-null metric. */
  public MetricIdentifier metric() {
    return metric;
  }
  
  /** @return The labels sorted by key. */
  public Map<String, String> labels() {
    return labels;
  }
  
  /** @return The numeric or boolean value. */
  public TagValue value() {
    return value;
  }
  
  /** @return The timestamp in Unix epoch seconds. */
  public long timestamp() {
    return timestamp;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final TimeSeriesDatum that = (TimeSeriesDatum) o;
    return timestamp == that.timestamp
        && Objects.equal(metric, that.metric)
        && Objects.equal(labels, that.labels)
        && Objects.equal(value, that.value);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(metric, labels, value, timestamp);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("metric=")
        .append(metric.key())
        .append(", labels=")
        .append(labels)
        .append(", value=")
        .append(value)
        .append(", timestamp=")
        .append(timestamp)
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private MetricIdentifier metric;
    private Map<String, String> labels;
    private TagValue value;
    private long timestamp = -1;
    
    public Builder setMetric(final MetricIdentifier metric) {
      this.metric = metric;
      return this;
    }
    
    public Builder setLabels(final Map<String, String> labels) {
      this.labels = labels;
      return this;
    }
    
    public Builder setValue(final TagValue value) {
      this.value = value;
      return this;
    }
    
    public Builder setValue(final double value) {
      this.value = TagValue.of(value);
      return this;
    }
    
    public Builder setValue(final long value) {
      this.value = TagValue.of(value);
      return this;
    }
    
    public Builder setTimestamp(final long timestamp) {
      this.timestamp = timestamp;
      return this;
    }
    
    /** @return The datum, defaulting the timestamp to now if not set. */
    public TimeSeriesDatum build() {
      if (timestamp < 0) {
        timestamp = System.currentTimeMillis() / 1000;
      }
      return new TimeSeriesDatum(this);
    }
  }
}
