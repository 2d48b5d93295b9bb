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

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.tsbridge.utils.DateTime;

/**
 * A downsampling rule for archival backends: keep samples consolidated to
 * {@code resolution} seconds for {@code retention} seconds using the given
 * aggregator.
 * 
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = RetentionPolicy.Builder.class)
public class RetentionPolicy {
  /** The default aggregator when none is given. */
  public static final String DEFAULT_AGGREGATOR = "avg";
  
  private final String name;
  private final long resolution;
  private final long retention;
  private final String aggregator;
  
  protected RetentionPolicy(final Builder builder) {
    if (builder.resolution <= 0) {
      throw new IllegalArgumentException("Resolution must be greater than "
          + "zero: " + builder.resolution);
    }
    if (builder.retention < builder.resolution) {
      throw new IllegalArgumentException("Retention " + builder.retention 
          + " must be greater than or equal to the resolution " 
          + builder.resolution);
    }
    resolution = builder.resolution;
    retention = builder.retention;
    aggregator = Strings.isNullOrEmpty(builder.aggregator) ? 
        DEFAULT_AGGREGATOR : builder.aggregator.toLowerCase(Locale.ROOT);
    name = Strings.isNullOrEmpty(builder.name) ? 
        resolution + "s_" + retention + "s" : builder.name;
  }
  
  /**
   * Parses a policy in the form {@code <resolution>:<retention>[:<aggregator>]}
   * where the first two fields are seconds or durations like {@code 1m}.
   * @param policy The non-null and non-empty policy string.
   * @return The parsed policy.
   * @throws IllegalArgumentException if the string was malformed.
   */
  public static RetentionPolicy parse(final String policy) {
    if (Strings.isNullOrEmpty(policy)) {
      throw new IllegalArgumentException("Policy cannot be null or empty.");
    }
    final String[] parts = policy.trim().split(":");
    if (parts.length < 2 || parts.length > 3) {
      throw new IllegalArgumentException("Invalid retention policy, must "
          + "be <resolution>:<retention>[:<aggregator>]: " + policy);
    }
    return newBuilder()
        .setResolution(toSeconds(parts[0]))
        .setRetention(toSeconds(parts[1]))
        .setAggregator(parts.length == 3 ? parts[2] : null)
        .build();
  }
  
  /** @return The name of the policy. */
  public String getName() {
    return name;
  }
  
  /** @return The resolution in seconds. */
  public long getResolution() {
    return resolution;
  }
  
  /** @return The retention in seconds. */
  public long getRetention() {
    return retention;
  }
  
  /** @return The lower case aggregator, e.g. "avg". */
  public String getAggregator() {
    return aggregator;
  }
  
  /** @return The number of rows needed to hold the retention. */
  public long rows() {
    return retention / resolution;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final RetentionPolicy that = (RetentionPolicy) o;
    return resolution == that.resolution
        && retention == that.retention
        && Objects.equal(aggregator, that.aggregator)
        && Objects.equal(name, that.name);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(name, resolution, retention, aggregator);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("name=")
        .append(name)
        .append(", resolution=")
        .append(resolution)
        .append(", retention=")
        .append(retention)
        .append(", aggregator=")
        .append(aggregator)
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  private static long toSeconds(final String value) {
    final String trimmed = value.trim();
    if (!trimmed.isEmpty() && 
        Character.isDigit(trimmed.charAt(trimmed.length() - 1))) {
      return Long.parseLong(trimmed);
    }
    return DateTime.parseDurationSeconds(trimmed);
  }
  
  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "set")
  public static class Builder {
    @JsonProperty
    private String name;
    @JsonProperty
    private long resolution;
    @JsonProperty
    private long retention;
    @JsonProperty
    private String aggregator;
    
    public Builder setName(final String name) {
      this.name = name;
      return this;
    }
    
    public Builder setResolution(final long resolution) {
      this.resolution = resolution;
      return this;
    }
    
    public Builder setRetention(final long retention) {
      this.retention = retention;
      return this;
    }
    
    public Builder setAggregator(final String aggregator) {
      this.aggregator = aggregator;
      return this;
    }
    
    public RetentionPolicy build() {
      return new RetentionPolicy(this);
    }
  }
}
