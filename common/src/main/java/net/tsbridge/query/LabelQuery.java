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

import java.util.List;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.data.TimeRange;
import net.tsbridge.exceptions.QueryValidationException;

/**
 * A label discovery query. When the label is null the query lists the 
 * label names used by the metrics, otherwise it lists the values of the
 * label, optionally restricted by filters.
 * 
 * @since 1.0
 */
public class LabelQuery extends Validatable {
  private final String label;
  private final List<MetricIdentifier> metrics;
  private final List<Filter> filters;
  private final TimeRange range;
  
  protected LabelQuery(final Builder builder) {
    label = builder.label;
    metrics = builder.metrics == null ? ImmutableList.<MetricIdentifier>of() :
      ImmutableList.copyOf(builder.metrics);
    filters = builder.filters == null ? ImmutableList.<Filter>of() : 
      ImmutableList.copyOf(builder.filters);
    range = builder.range;
    validate();
  }
  
  /** @return The label to list values for or null to list names. */
  public String getLabel() {
    return label;
  }
  
  /** @return True if the query lists label names. */
  public boolean isNameQuery() {
    return label == null;
  }
  
  /** @return The metrics to search. */
  public List<MetricIdentifier> getMetrics() {
    return metrics;
  }
  
  /** @return The filters, may be empty. */
  public List<Filter> getFilters() {
    return filters;
  }
  
  /** @return The optional time range. */
  public TimeRange getTimeRange() {
    return range;
  }
  
  @Override
  public void validate() {
    if (metrics.isEmpty()) {
      throw new QueryValidationException("A label query requires at least "
          + "one metric.", "metrics");
    }
    if (label != null && label.isEmpty()) {
      throw new QueryValidationException("Label cannot be empty.", "label");
    }
    validateCollection(filters, "filter");
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final LabelQuery that = (LabelQuery) o;
    return Objects.equal(label, that.label)
        && Objects.equal(metrics, that.metrics)
        && Objects.equal(filters, that.filters)
        && Objects.equal(range, that.range);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(label, metrics, filters, range);
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private String label;
    private List<MetricIdentifier> metrics;
    private List<Filter> filters;
    private TimeRange range;
    
    public Builder setLabel(final String label) {
      this.label = label;
      return this;
    }
    
    public Builder setMetrics(final List<MetricIdentifier> metrics) {
      this.metrics = metrics;
      return this;
    }
    
    public Builder addMetric(final MetricIdentifier metric) {
      if (metrics == null) {
        metrics = Lists.newArrayList();
      }
      metrics.add(metric);
      return this;
    }
    
    public Builder setFilters(final List<Filter> filters) {
      this.filters = filters;
      return this;
    }
    
    public Builder addFilter(final Filter filter) {
      if (filters == null) {
        filters = Lists.newArrayList();
      }
      filters.add(filter);
      return this;
    }
    
    public Builder setTimeRange(final TimeRange range) {
      this.range = range;
      return this;
    }
    
    public LabelQuery build() {
      return new LabelQuery(this);
    }
  }
}
