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
 * A sampling granularity in seconds. A null granularity means "auto", i.e.
 * the backend picks.
 * 
 * @since 1.0
 */
public class Resolution {
  private static final Resolution AUTO = new Resolution(null);
  
  private final Long seconds;
  
  private Resolution(final Long seconds) {
    if (seconds != null && seconds <= 0) {
      throw new IllegalArgumentException("Resolution must be greater than "
          + "zero: " + seconds);
    }
    this.seconds = seconds;
  }
  
  /** @return The automatic resolution. */
  public static Resolution auto() {
    return AUTO;
  }
  
  public static Resolution seconds(final long seconds) {
    return new Resolution(seconds);
  }
  
  public static Resolution minutes(final long minutes) {
    return new Resolution(minutes * 60);
  }
  
  public static Resolution hours(final long hours) {
    return new Resolution(hours * 3600);
  }
  
  /**
   * Parses an interval such as "5m" into a resolution. Null or empty strings
   * as well as "auto" return the automatic resolution.
   * @param interval The interval to parse.
   * @return A non-null resolution.
   * @throws IllegalArgumentException if the interval was malformed.
   */
  public static Resolution parse(final String interval) {
    if (Strings.isNullOrEmpty(interval) || interval.equalsIgnoreCase("auto")) {
      return AUTO;
    }
    return new Resolution(DateTime.parseDurationSeconds(interval));
  }
  
  /** @return The seconds or null if automatic. */
  public Long getSeconds() {
    return seconds;
  }
  
  /** @return True if the backend should pick the resolution. */
  public boolean isAuto() {
    return seconds == null;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    return Objects.equal(seconds, ((Resolution) o).seconds);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(seconds);
  }
  
  @Override
  public String toString() {
    return seconds == null ? "auto" : seconds + "s";
  }
}
