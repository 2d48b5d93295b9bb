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

import net.tsbridge.data.Resolution;
import net.tsbridge.data.TimeRange;
import net.tsbridge.exceptions.QueryValidationException;

/**
 * The root of a data query: an optional time range (the last hour when 
 * absent), an optional resolution and one or more streams.
 * 
 * @since 1.0
 */
public class DataQuery extends Validatable {
  /** The default window in seconds when no range is given. */
  public static final long DEFAULT_WINDOW = 3600;
  
  private final TimeRange range;
  private final Resolution resolution;
  private final List<MetricNode> streams;
  
  protected DataQuery(final Builder builder) {
    range = builder.range;
    resolution = builder.resolution == null ? Resolution.auto() : 
      builder.resolution;
    streams = builder.streams == null ? ImmutableList.<MetricNode>of() : 
      ImmutableList.copyOf(builder.streams);
    validate();
  }
  
  /** @return The time range, may be null meaning the last hour. */
  public TimeRange getTimeRange() {
    return range;
  }
  
  /** @return The resolution, never null. */
  public Resolution getResolution() {
    return resolution;
  }
  
  /** @return The streams in request order. */
  public List<MetricNode> getStreams() {
    return streams;
  }
  
  @Override
  public void validate() {
    if (streams.isEmpty()) {
      throw new QueryValidationException("A query must have at least one "
          + "stream.", "streams");
    }
    validateCollection(streams, "stream");
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final DataQuery that = (DataQuery) o;
    return Objects.equal(range, that.range)
        && Objects.equal(resolution, that.resolution)
        && Objects.equal(streams, that.streams);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(range, resolution, streams);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("range=")
        .append(range)
        .append(", resolution=")
        .append(resolution)
        .append(", streams=")
        .append(streams)
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private TimeRange range;
    private Resolution resolution;
    private List<MetricNode> streams;
    
    public Builder setTimeRange(final TimeRange range) {
      this.range = range;
      return this;
    }
    
    public Builder setResolution(final Resolution resolution) {
      this.resolution = resolution;
      return this;
    }
    
    public Builder setStreams(final List<MetricNode> streams) {
      this.streams = streams;
      return this;
    }
    
    public Builder addStream(final MetricNode stream) {
      if (streams == null) {
        streams = Lists.newArrayList();
      }
      streams.add(stream);
      return this;
    }
    
    public DataQuery build() {
      return new DataQuery(this);
    }
  }
}
