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
package net.tsbridge.storage.rrd;

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tsbridge.data.MetricType;
import net.tsbridge.data.RetentionPolicy;
import net.tsbridge.data.TagValue;
import net.tsbridge.exceptions.UnsupportedQueryOperationException;
import net.tsbridge.query.ConsolidationFunction;

/**
 * Static helpers that build the rrdtool commands used for writes and 
 * introspection. Export commands are rendered by {@link RrdXportQuery}.
 * 
 * @since 1.0
 */
public final class RrdCommandBuilder {
  /** The x-files factor used for every archive. */
  public static final String XFF = "0.5";
  
  /** The value written for unknown samples. */
  public static final String UNKNOWN = "U";
  
  private RrdCommandBuilder() { }
  
  /**
   * Builds the create command for a new archive. The step is the smallest
   * policy resolution and every data source gets a heartbeat of twice the
   * step.
   * @param path The non-null relative path.
   * @param data_sources The non-empty data source names and types, in 
   * order.
   * @param policies The non-empty retention policies.
   * @return The create command.
   * @throws IllegalArgumentException if a resolution was not a multiple of
   * the step or an argument was missing.
   * @throws UnsupportedQueryOperationException if a data source type has 
   * no rrdtool equivalent.
   */
  public static RrdCommand create(final String path, 
                                  final Map<String, MetricType> data_sources,
                                  final List<RetentionPolicy> policies) {
    if (Strings.isNullOrEmpty(path)) {
      throw new IllegalArgumentException("Path cannot be null or empty.");
    }
    if (data_sources == null || data_sources.isEmpty()) {
      throw new IllegalArgumentException("At least one data source is "
          + "required.");
    }
    if (policies == null || policies.isEmpty()) {
      throw new IllegalArgumentException("At least one retention policy is "
          + "required.");
    }
    long step = Long.MAX_VALUE;
    for (final RetentionPolicy policy : policies) {
      step = Math.min(step, policy.getResolution());
    }
    
    final List<String> arguments = Lists.newArrayList();
    for (final Entry<String, MetricType> entry : data_sources.entrySet()) {
      arguments.add("DS:" + entry.getKey() + ":" + dsType(entry.getValue()) 
          + ":" + (step * 2) + ":" + UNKNOWN + ":" + UNKNOWN);
    }
    for (final RetentionPolicy policy : policies) {
      if (policy.getResolution() % step != 0) {
        throw new IllegalArgumentException("Resolution " 
            + policy.getResolution() + " of policy " + policy.getName() 
            + " is not a multiple of the step " + step);
      }
      arguments.add("RRA:" 
          + ConsolidationFunction.fromAggregator(policy.getAggregator()) 
          + ":" + XFF 
          + ":" + (policy.getResolution() / step)
          + ":" + policy.rows());
    }
    return new RrdCommand(RrdCommandType.CREATE, path, 
        ImmutableList.of("--step", Long.toString(step), "--no-overwrite"), 
        arguments);
  }
  
  /**
   * Builds an update for one timestamp.
   * @param path The non-null relative path.
   * @param timestamp The Unix epoch timestamp in seconds.
   * @param values The non-empty values in data source order.
   * @return The update command.
   */
  public static RrdCommand update(final String path, 
                                  final long timestamp, 
                                  final List<TagValue> values) {
    if (Strings.isNullOrEmpty(path)) {
      throw new IllegalArgumentException("Path cannot be null or empty.");
    }
    if (values == null || values.isEmpty()) {
      throw new IllegalArgumentException("At least one value is required.");
    }
    final StringBuilder buf = new StringBuilder()
        .append(timestamp);
    for (final TagValue value : values) {
      buf.append(':')
         .append(formatValue(value));
    }
    return new RrdCommand(RrdCommandType.UPDATE, path, null, 
        ImmutableList.of(buf.toString()));
  }
  
  /**
   * @param path The non-null relative path.
   * @return The info command.
   */
  public static RrdCommand info(final String path) {
    return pathCommand(RrdCommandType.INFO, path);
  }
  
  /**
   * @param path The non-null relative path.
   * @return The command returning the timestamp of the last update.
   */
  public static RrdCommand last(final String path) {
    return pathCommand(RrdCommandType.LAST, path);
  }
  
  /**
   * @param path The non-null relative path.
   * @return The command returning the first timestamp of the first archive.
   */
  public static RrdCommand first(final String path) {
    return pathCommand(RrdCommandType.FIRST, path);
  }
  
  /**
   * @param path The non-null relative path.
   * @return The command that flushes pending rrdcached updates.
   */
  public static RrdCommand flush(final String path) {
    return pathCommand(RrdCommandType.FLUSHCACHED, path);
  }
  
  /**
   * @param directory The non-null relative directory.
   * @return A recursive listing of the directory.
   */
  public static RrdCommand list(final String directory) {
    if (Strings.isNullOrEmpty(directory)) {
      throw new IllegalArgumentException("Directory cannot be null or empty.");
    }
    return new RrdCommand(RrdCommandType.LIST, null, 
        ImmutableList.of("--recursive"), ImmutableList.of(directory));
  }
  
  /**
   * @param value A non-null value.
   * @return The rrdtool representation, {@code U} for nulls and NaNs.
   */
  static String formatValue(final TagValue value) {
    switch (value.type()) {
    case INT:
      return Long.toString(value.asLong());
    case FLOAT:
      final double v = value.asDouble();
      return Double.isNaN(v) || Double.isInfinite(v) ? UNKNOWN : 
        TagValue.formatDouble(v);
    case BOOL:
      return value.asBoolean() ? "1" : "0";
    case NULL:
      return UNKNOWN;
    default:
      throw new IllegalArgumentException("Archives only store numeric "
          + "values: " + value);
    }
  }
  
  /**
   * @param type A non-null metric type.
   * @return The rrdtool data source type.
   * @throws UnsupportedQueryOperationException for histograms and 
   * summaries.
   */
  static String dsType(final MetricType type) {
    switch (type) {
    case COUNTER:
      return "COUNTER";
    case GAUGE:
      return "GAUGE";
    default:
      throw new UnsupportedQueryOperationException(RrdDriver.NAME, 
          type.name(), "archives only hold counters and gauges");
    }
  }
  
  private static RrdCommand pathCommand(final RrdCommandType type, 
                                        final String path) {
    if (Strings.isNullOrEmpty(path)) {
      throw new IllegalArgumentException("Path cannot be null or empty.");
    }
    return new RrdCommand(type, path, null, null);
  }
}
