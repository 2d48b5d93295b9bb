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

import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.tsbridge.utils.DateTime;

/**
 * A query or write window in Unix epoch seconds. At least one of start, 
 * end or duration must be given to the builder and the missing values are
 * derived. When only a duration is given the range is "relative": it ends 
 * now and backends that support relative windows may use the duration 
 * directly.
 * 
 * @since 1.0
 */
public class TimeRange {
  /** Allowed drift in seconds when all three values are given. */
  public static final long TOLERANCE = 1;
  
  private final long start;
  private final long end;
  private final long duration;
  private final String relative;
  
  protected TimeRange(final Builder builder) {
    final long now = builder.now > 0 ? builder.now : 
      DateTime.currentTimeSeconds();
    long duration_seconds = -1;
    if (!Strings.isNullOrEmpty(builder.duration)) {
      duration_seconds = DateTime.parseDurationSeconds(builder.duration);
    } else if (builder.duration_seconds > 0) {
      duration_seconds = builder.duration_seconds;
    }
    
    if (builder.start == null && builder.end == null && duration_seconds < 0) {
      throw new IllegalArgumentException("At least one of start, end or "
          + "duration must be set.");
    }
    
    if (builder.start != null && builder.end != null) {
      if (builder.start > builder.end) {
        throw new IllegalArgumentException("Start " + builder.start 
            + " cannot be after the end " + builder.end);
      }
      if (duration_seconds >= 0 && 
          Math.abs((builder.end - builder.start) - duration_seconds) > TOLERANCE) {
        throw new IllegalArgumentException("Duration " + duration_seconds 
            + "s does not match the difference between start and end " 
            + (builder.end - builder.start) + "s");
      }
      start = builder.start;
      end = builder.end;
    } else if (builder.start != null) {
      start = builder.start;
      end = duration_seconds >= 0 ? builder.start + duration_seconds : now;
      if (start > end) {
        throw new IllegalArgumentException("Start " + start 
            + " cannot be after the end " + end);
      }
    } else if (builder.end != null) {
      if (duration_seconds < 0) {
        throw new IllegalArgumentException("A start or duration must be "
            + "given with the end.");
      }
      end = builder.end;
      start = builder.end - duration_seconds;
    } else {
      end = now;
      start = now - duration_seconds;
    }
    duration = end - start;
    relative = builder.start == null && builder.end == null ? 
        (Strings.isNullOrEmpty(builder.duration) ? 
            duration_seconds + "s" : builder.duration) : null;
  }
  
  /** @return The start in epoch seconds. */
  public long getStart() {
    return start;
  }
  
  /** @return The end in epoch seconds. */
  public long getEnd() {
    return end;
  }
  
  /** @return The duration in seconds. */
  public long getDuration() {
    return duration;
  }
  
  /** @return True if the range was built from a duration only. */
  public boolean isRelative() {
    return relative != null;
  }
  
  /** @return The original duration string for relative ranges, null 
   * otherwise. */
  public String relativeDuration() {
    return relative;
  }
  
  /**
   * @param minutes The number of minutes.
   * @return A relative range ending now.
   */
  public static TimeRange lastMinutes(final int minutes) {
    return newBuilder().setDuration(minutes + "m").build();
  }
  
  /**
   * @param hours The number of hours.
   * @return A relative range ending now.
   */
  public static TimeRange lastHours(final int hours) {
    return newBuilder().setDuration(hours + "h").build();
  }
  
  /**
   * @param days The number of days.
   * @return A relative range ending now.
   */
  public static TimeRange lastDays(final int days) {
    return newBuilder().setDuration(days + "d").build();
  }
  
  /**
   * @param start The start in epoch seconds.
   * @param end The end in epoch seconds.
   * @return An absolute range.
   */
  public static TimeRange between(final long start, final long end) {
    return newBuilder().setStart(start).setEnd(end).build();
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final TimeRange that = (TimeRange) o;
    return start == that.start 
        && end == that.end 
        && Objects.equal(relative, that.relative);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(start, end, relative);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("start=")
        .append(start)
        .append(", end=")
        .append(end)
        .append(", relative=")
        .append(relative)
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private Long start;
    private Long end;
    private String duration;
    private long duration_seconds = -1;
    private long now;
    
    public Builder setStart(final long start) {
      this.start = start;
      return this;
    }
    
    public Builder setEnd(final long end) {
      this.end = end;
      return this;
    }
    
    /**
     * @param duration A duration such as "1h" or "15m".
     * @return The builder.
     */
    public Builder setDuration(final String duration) {
      this.duration = duration;
      return this;
    }
    
    public Builder setDurationSeconds(final long duration_seconds) {
      this.duration_seconds = duration_seconds;
      return this;
    }
    
    /**
     * Overrides the clock, used by tests.
     * @param now The current epoch seconds.
     * @return The builder.
     */
    public Builder setNow(final long now) {
      this.now = now;
      return this;
    }
    
    public TimeRange build() {
      return new TimeRange(this);
    }
  }
}
