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
package net.tsbridge.storage.prometheus;

import com.google.common.base.Objects;

import net.tsbridge.query.Aggregation;
import net.tsbridge.query.CompiledQuery;
import net.tsbridge.query.MetricNode;

/**
 * A compiled PromQL range query: the expression text, possibly suffixed 
 * with comment annotations, plus the window and step sent as request 
 * parameters. One is produced per stream and aggregation.
 * 
 * @since 1.0
 */
public class PromQuery implements CompiledQuery {
  private final MetricNode stream;
  private final Aggregation aggregation;
  private final String alias;
  private final String query;
  private final long start;
  private final long end;
  private final long step;
  
  protected PromQuery(final Builder builder) {
    if (builder.stream == null) {
      throw new IllegalArgumentException("Stream cannot be null.");
    }
    if (builder.query == null || builder.query.isEmpty()) {
      throw new IllegalArgumentException("Query cannot be null or empty.");
    }
    if (builder.step <= 0) {
      throw new IllegalArgumentException("Step must be greater than zero: " 
          + builder.step);
    }
    stream = builder.stream;
    aggregation = builder.aggregation;
    alias = builder.alias == null ? builder.stream.getAlias() : builder.alias;
    query = builder.query;
    start = builder.start;
    end = builder.end;
    step = builder.step;
  }
  
  @Override
  public String driver() {
    return PrometheusDriver.NAME;
  }
  
  @Override
  public String alias() {
    return alias;
  }
  
  /** @return The stream this query was compiled from. */
  public MetricNode stream() {
    return stream;
  }
  
  /** @return The aggregation applied, null if none. */
  public Aggregation aggregation() {
    return aggregation;
  }
  
  /** @return The PromQL expression including any comment annotations. */
  public String query() {
    return query;
  }
  
  /** @return The start in epoch seconds. */
  public long start() {
    return start;
  }
  
  /** @return The end in epoch seconds. */
  public long end() {
    return end;
  }
  
  /** @return The step in seconds. */
  public long step() {
    return step;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final PromQuery that = (PromQuery) o;
    return Objects.equal(query, that.query)
        && Objects.equal(alias, that.alias)
        && Objects.equal(aggregation, that.aggregation)
        && start == that.start
        && end == that.end
        && step == that.step;
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(query, alias, aggregation, start, end, step);
  }
  
  @Override
  public String toString() {
    return query;
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private MetricNode stream;
    private Aggregation aggregation;
    private String alias;
    private String query;
    private long start;
    private long end;
    private long step;
    
    public Builder setStream(final MetricNode stream) {
      this.stream = stream;
      return this;
    }
    
    public Builder setAggregation(final Aggregation aggregation) {
      this.aggregation = aggregation;
      return this;
    }
    
    public Builder setAlias(final String alias) {
      this.alias = alias;
      return this;
    }
    
    public Builder setQuery(final String query) {
      this.query = query;
      return this;
    }
    
    public Builder setStart(final long start) {
      this.start = start;
      return this;
    }
    
    public Builder setEnd(final long end) {
      this.end = end;
      return this;
    }
    
    public Builder setStep(final long step) {
      this.step = step;
      return this;
    }
    
    public PromQuery build() {
      return new PromQuery(this);
    }
  }
}
