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
package net.tsbridge.storage.influxdb;

import com.google.common.base.Objects;

import net.tsbridge.query.Aggregation;
import net.tsbridge.query.CompiledQuery;
import net.tsbridge.query.MetricNode;

/**
 * A compiled Flux script for one stream and aggregation along with the 
 * window and window step it was compiled for.
 * 
 * @since 1.0
 */
public class FluxQuery implements CompiledQuery {
  private final MetricNode stream;
  private final Aggregation aggregation;
  private final String alias;
  private final String flux;
  private final long start;
  private final long end;
  private final long step;
  
  protected FluxQuery(final Builder builder) {
    if (builder.stream == null) {
      throw new IllegalArgumentException("Stream cannot be null.");
    }
    if (builder.flux == null || builder.flux.isEmpty()) {
      throw new IllegalArgumentException("Flux cannot be null or empty.");
    }
    stream = builder.stream;
    aggregation = builder.aggregation;
    alias = builder.alias == null ? builder.stream.getAlias() : builder.alias;
    flux = builder.flux;
    start = builder.start;
    end = builder.end;
    step = builder.step;
  }
  
  @Override
  public String driver() {
    return InfluxDriver.NAME;
  }

  @Override
  public String alias() {
    return alias;
  }
  
  /** @return The stream this query was compiled from. */
  public MetricNode stream() {
    return stream;
  }
  
  /** @return The aggregation, null if the raw series are requested. */
  public Aggregation aggregation() {
    return aggregation;
  }
  
  /** @return The Flux script. */
  public String flux() {
    return flux;
  }
  
  public long start() {
    return start;
  }
  
  public long end() {
    return end;
  }
  
  /** @return The aggregation window in seconds. */
  public long step() {
    return step;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final FluxQuery that = (FluxQuery) o;
    return Objects.equal(flux, that.flux)
        && Objects.equal(alias, that.alias)
        && Objects.equal(aggregation, that.aggregation)
        && start == that.start
        && end == that.end
        && step == that.step;
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(flux, alias, aggregation, start, end, step);
  }
  
  @Override
  public String toString() {
    return flux;
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private MetricNode stream;
    private Aggregation aggregation;
    private String alias;
    private String flux;
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
    
    public Builder setFlux(final String flux) {
      this.flux = flux;
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
    
    public FluxQuery build() {
      return new FluxQuery(this);
    }
  }
}
