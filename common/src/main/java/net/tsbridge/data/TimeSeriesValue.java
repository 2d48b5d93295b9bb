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

/**
 * A single point in a result: a timestamp in epoch seconds and a nullable
 * value. Null means the backend had no sample for the timestamp.
 * 
 * @since 1.0
 */
public final class TimeSeriesValue {
  private final long timestamp;
  private final Double value;
  
  /**
   * Default ctor.
   * @param timestamp The timestamp in Unix epoch seconds.
   * @param value The value, may be null.
   */
  public TimeSeriesValue(final long timestamp, final Double value) {
    this.timestamp = timestamp;
    this.value = value;
  }
  
  /** @return The timestamp in Unix epoch seconds. */
  public long timestamp() {
    return timestamp;
  }
  
  /** @return The value, may be null. */
  public Double value() {
    return value;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final TimeSeriesValue that = (TimeSeriesValue) o;
    return timestamp == that.timestamp && Objects.equal(value, that.value);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(timestamp, value);
  }
  
  @Override
  public String toString() {
    return timestamp + "=" + value;
  }
}
