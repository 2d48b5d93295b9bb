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

import net.tsbridge.data.Resolution;
import net.tsbridge.data.TimeRange;
import net.tsbridge.data.TimeSeries;

/**
 * The universal result: the series in output order along with the time
 * range and resolution that were actually honored.
 * 
 * @since 1.0
 */
public class QueryResult {
  private final List<TimeSeries> series;
  private final TimeRange range;
  private final Resolution resolution;
  
  /**
   * Default ctor.
   * @param series The series, may be null.
   * @param range The time range honored, may be null.
   * @param resolution The resolution honored, may be null.
   */
  public QueryResult(final List<TimeSeries> series, 
                     final TimeRange range, 
                     final Resolution resolution) {
    this.series = series == null ? ImmutableList.<TimeSeries>of() : 
      ImmutableList.copyOf(series);
    this.range = range;
    this.resolution = resolution == null ? Resolution.auto() : resolution;
  }
  
  /** @return The non-null list of series. */
  public List<TimeSeries> series() {
    return series;
  }
  
  /** @return The time range, may be null. */
  public TimeRange timeRange() {
    return range;
  }
  
  /** @return The non-null resolution. */
  public Resolution resolution() {
    return resolution;
  }
  
  /**
   * @param alias The alias to look for.
   * @return The first series with the alias or null if not found.
   */
  public TimeSeries get(final String alias) {
    for (final TimeSeries ts : series) {
      if (Objects.equal(ts.alias(), alias)) {
        return ts;
      }
    }
    return null;
  }
  
  /** @return True if no series were returned. */
  public boolean isEmpty() {
    return series.isEmpty();
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final QueryResult that = (QueryResult) o;
    return Objects.equal(series, that.series)
        && Objects.equal(range, that.range)
        && Objects.equal(resolution, that.resolution);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(series, range, resolution);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("series=")
        .append(series.size())
        .append(", range=")
        .append(range)
        .append(", resolution=")
        .append(resolution)
        .toString();
  }
}
