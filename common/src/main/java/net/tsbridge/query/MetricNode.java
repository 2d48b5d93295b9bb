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
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.exceptions.QueryValidationException;

/**
 * One requested stream in a query: a metric along with its filters, the
 * ordered transformation pipeline, the aggregations, an alias, an optional
 * limit, a sort order and a fill policy. The pipeline order is the 
 * execution order.
 * 
 * @since 1.0
 */
public class MetricNode extends Validatable {
  private final MetricIdentifier metric;
  private final List<Filter> filters;
  private final List<Transformation> pipeline;
  private final List<Aggregation> aggregations;
  private final String alias;
  private final Integer limit;
  private final SortOrder sort;
  private final FillPolicy fill;
  private final ConsolidationFunction consolidation;
  
  protected MetricNode(final Builder builder) {
    metric = builder.metric;
    filters = builder.filters == null ? ImmutableList.<Filter>of() : 
      ImmutableList.copyOf(builder.filters);
    pipeline = builder.pipeline == null ? ImmutableList.<Transformation>of() :
      ImmutableList.copyOf(builder.pipeline);
    aggregations = builder.aggregations == null ? 
        ImmutableList.<Aggregation>of() : 
          ImmutableList.copyOf(builder.aggregations);
    alias = builder.alias;
    limit = builder.limit;
    sort = builder.sort == null ? SortOrder.ASC : builder.sort;
    fill = builder.fill == null ? FillPolicy.NONE : builder.fill;
    consolidation = builder.consolidation;
    validate();
  }
  
  /** @return The metric. */
  public MetricIdentifier getMetric() {
    return metric;
  }
  
  /** @return The filters, may be empty. */
  public List<Filter> getFilters() {
    return filters;
  }
  
  /** @return The pipeline in execution order, may be empty. */
  public List<Transformation> getPipeline() {
    return pipeline;
  }
  
  /** @return The aggregations in request order, may be empty. */
  public List<Aggregation> getAggregations() {
    return aggregations;
  }
  
  /** @return The alias or the metric key if none was given. */
  public String getAlias() {
    return Strings.isNullOrEmpty(alias) ? metric.key() : alias;
  }
  
  /** @return True if the caller gave an explicit alias. */
  public boolean hasAlias() {
    return !Strings.isNullOrEmpty(alias);
  }
  
  /** @return The optional limit on the number of series, may be null. */
  public Integer getLimit() {
    return limit;
  }
  
  /** @return The sort order, defaults to ascending. */
  public SortOrder getSort() {
    return sort;
  }
  
  /** @return The fill policy, defaults to {@link FillPolicy#NONE}. */
  public FillPolicy getFill() {
    return fill;
  }
  
  /** @return The requested consolidation function, may be null. */
  public ConsolidationFunction getConsolidation() {
    return consolidation;
  }
  
  /** @return The first rate transformation in the pipeline or null. */
  public Transformation rateTransformation() {
    for (final Transformation transformation : pipeline) {
      if (transformation.getType() == TransformationType.RATE) {
        return transformation;
      }
    }
    return null;
  }
  
  /** @return The labels of all group-by steps in order, may be empty. */
  public List<String> groupByLabels() {
    final List<String> labels = Lists.newArrayList();
    for (final Transformation transformation : pipeline) {
      if (transformation.getType() == TransformationType.GROUP_BY) {
        for (final String label : transformation.getLabels()) {
          if (!labels.contains(label)) {
            labels.add(label);
          }
        }
      }
    }
    return labels;
  }
  
  /** @return The math steps in pipeline order, may be empty. */
  public List<Transformation> mathTransformations() {
    final List<Transformation> math = Lists.newArrayList();
    for (final Transformation transformation : pipeline) {
      if (transformation.getType() == TransformationType.MATH) {
        math.add(transformation);
      }
    }
    return math;
  }
  
  @Override
  public void validate() {
    if (metric == null) {
      throw new QueryValidationException("Metric cannot be null.", "metric");
    }
    if (limit != null && limit <= 0) {
      throw new QueryValidationException("Limit must be greater than zero: " 
          + limit, "limit");
    }
    validateCollection(filters, "filter");
    validateCollection(pipeline, "transformation");
    final List<String> keys = Lists.newArrayList();
    for (final Filter filter : filters) {
      keys.add(filter.getKey());
    }
    keys.addAll(groupByLabels());
    metric.validateLabels(keys);
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final MetricNode that = (MetricNode) o;
    return Objects.equal(metric, that.metric)
        && Objects.equal(filters, that.filters)
        && Objects.equal(pipeline, that.pipeline)
        && Objects.equal(aggregations, that.aggregations)
        && Objects.equal(alias, that.alias)
        && Objects.equal(limit, that.limit)
        && sort == that.sort
        && fill == that.fill
        && consolidation == that.consolidation;
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(metric, filters, pipeline, aggregations, alias, 
        limit, sort, fill, consolidation);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("metric=")
        .append(metric == null ? null : metric.key())
        .append(", filters=")
        .append(filters)
        .append(", pipeline=")
        .append(pipeline)
        .append(", aggregations=")
        .append(aggregations)
        .append(", alias=")
        .append(alias)
        .append(", limit=")
        .append(limit)
        .append(", sort=")
        .append(sort)
        .append(", fill=")
        .append(fill)
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private MetricIdentifier metric;
    private List<Filter> filters;
    private List<Transformation> pipeline;
    private List<Aggregation> aggregations;
    private String alias;
    private Integer limit;
    private SortOrder sort;
    private FillPolicy fill;
    private ConsolidationFunction consolidation;
    
    public Builder setMetric(final MetricIdentifier metric) {
      this.metric = metric;
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
    
    public Builder setPipeline(final List<Transformation> pipeline) {
      this.pipeline = pipeline;
      return this;
    }
    
    public Builder addTransformation(final Transformation transformation) {
      if (pipeline == null) {
        pipeline = Lists.newArrayList();
      }
      pipeline.add(transformation);
      return this;
    }
    
    public Builder setAggregations(final List<Aggregation> aggregations) {
      this.aggregations = aggregations;
      return this;
    }
    
    public Builder addAggregation(final Aggregation aggregation) {
      if (aggregations == null) {
        aggregations = Lists.newArrayList();
      }
      aggregations.add(aggregation);
      return this;
    }
    
    public Builder setAlias(final String alias) {
      this.alias = alias;
      return this;
    }
    
    public Builder setLimit(final Integer limit) {
      this.limit = limit;
      return this;
    }
    
    public Builder setSort(final SortOrder sort) {
      this.sort = sort;
      return this;
    }
    
    public Builder setFill(final FillPolicy fill) {
      this.fill = fill;
      return this;
    }
    
    public Builder setConsolidation(final ConsolidationFunction consolidation) {
      this.consolidation = consolidation;
      return this;
    }
    
    public MetricNode build() {
      return new MetricNode(this);
    }
  }
}
