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

import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import net.tsbridge.data.Resolution;
import net.tsbridge.data.TagValue;
import net.tsbridge.data.TimeRange;
import net.tsbridge.exceptions.UnsupportedQueryOperationException;
import net.tsbridge.query.Aggregation;
import net.tsbridge.query.DataQuery;
import net.tsbridge.query.Filter;
import net.tsbridge.query.MetricNode;
import net.tsbridge.query.QueryCompiler;
import net.tsbridge.query.Transformation;
import net.tsbridge.utils.DateTime;

/**
 * Compiles streams into PromQL. The selector is the metric key with a 
 * brace block of label matchers. A rate or delta step wraps the selector 
 * in a range function, aggregations wrap that (with a {@code by} clause 
 * for group-by steps) and math steps are appended as arithmetic in 
 * pipeline order, e.g. {@code (max by (host) (rate(m{dc="lax"}[5m]))) * 8}.
 * <p>
 * PromQL evaluates one aggregation per expression so a stream with several
 * aggregations yields one query each, aliased {@code <alias>_<aggregation>}.
 * Limits and the requested window have no PromQL syntax and are appended 
 * as comments; the window itself is sent as request parameters.
 * 
 * @since 1.0
 */
public class PromQlCompiler implements QueryCompiler<PromQuery> {
  private static final Logger LOG = LoggerFactory.getLogger(
      PromQlCompiler.class);
  
  /** Target number of points per series when no resolution is given. */
  public static final int MAX_POINTS = 250;
  
  /** Characters escaped when a value is embedded in a regex alternation. */
  private static final String REGEX_META = "\\.^$|?*+()[]{}";
  
  private final String default_rate_interval;
  
  /**
   * Default ctor.
   * @param default_rate_interval The range used for rate and delta steps 
   * without an interval when the query has no resolution, e.g. "5m".
   * @throws IllegalArgumentException if the interval is null, empty or 
   * malformed.
   */
  public PromQlCompiler(final String default_rate_interval) {
    if (Strings.isNullOrEmpty(default_rate_interval)) {
      throw new IllegalArgumentException("Default rate interval cannot be "
          + "null or empty.");
    }
    this.default_rate_interval = toDuration(default_rate_interval);
  }
  
  @Override
  public List<PromQuery> compile(final DataQuery query) {
    final TimeRange range = query.getTimeRange() != null ? 
        query.getTimeRange() : TimeRange.newBuilder()
          .setDurationSeconds(DataQuery.DEFAULT_WINDOW)
          .build();
    final long step = query.getResolution().isAuto() ? 
        Math.max(1, range.getDuration() / MAX_POINTS) : 
          query.getResolution().getSeconds();
    
    final List<PromQuery> compiled = Lists.newArrayList();
    for (final MetricNode stream : query.getStreams()) {
      final String comments = comments(stream, query.getTimeRange());
      final String expression = applyRange(stream, 
          selector(stream.getMetric().key(), stream.getFilters()), 
          query.getResolution());
      final List<String> group_by = stream.groupByLabels();
      
      if (stream.getAggregations().isEmpty()) {
        if (!group_by.isEmpty()) {
          throw new UnsupportedQueryOperationException(PrometheusDriver.NAME, 
              "group by", "grouping requires an aggregation");
        }
        compiled.add(PromQuery.newBuilder()
            .setStream(stream)
            .setQuery(applyMath(stream, expression) + comments)
            .setStart(range.getStart())
            .setEnd(range.getEnd())
            .setStep(step)
            .build());
        continue;
      }
      
      for (final Aggregation aggregation : stream.getAggregations()) {
        compiled.add(PromQuery.newBuilder()
            .setStream(stream)
            .setAggregation(aggregation)
            .setAlias(stream.getAggregations().size() == 1 ? 
                stream.getAlias() : 
                  stream.getAlias() + "_" + aggregation.name())
            .setQuery(applyMath(stream, 
                aggregate(aggregation, group_by, expression)) + comments)
            .setStart(range.getStart())
            .setEnd(range.getEnd())
            .setStep(step)
            .build());
      }
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Compiled PromQL: " + compiled);
    }
    return compiled;
  }
  
  /**
   * Renders a label selector.
   * @param metric The non-null metric name.
   * @param filters The filters, may be empty in which case no braces are
   * written.
   * @return The selector.
   */
  public static String selector(final String metric, 
                                final List<Filter> filters) {
    if (filters == null || filters.isEmpty()) {
      return metric;
    }
    final List<String> matchers = Lists.newArrayListWithCapacity(
        filters.size());
    for (final Filter filter : filters) {
      matchers.add(matcher(filter));
    }
    return metric + "{" + Joiner.on(',').join(matchers) + "}";
  }
  
  /**
   * Renders a single label matcher. Numeric comparisons have no label 
   * matcher and fall back to equality.
   * @param filter The non-null filter.
   * @return The matcher.
   */
  static String matcher(final Filter filter) {
    final String key = filter.getKey();
    switch (filter.getOperator()) {
    case NOT_EQUALS:
      return key + "!=" + quote(filter.getValue().asString());
    case REGEX:
      return key + "=~" + quote(filter.getValue().asString());
    case NOT_REGEX:
      return key + "!~" + quote(filter.getValue().asString());
    case IN:
      return key + "=~" + quote(alternation(filter.getStringValues()));
    case NOT_IN:
      return key + "!~" + quote(alternation(filter.getStringValues()));
    case GREATER_THAN:
    case LESS_THAN:
      if (LOG.isDebugEnabled()) {
        LOG.debug("No label matcher for [" + filter.getOperator().symbol() 
            + "] on " + key + ", using equality.");
      }
      return key + "=" + quote(filter.getValue().asString());
    default:
      return key + "=" + quote(filter.getValue().asString());
    }
  }
  
  /**
   * Converts a duration to PromQL syntax. Months have no PromQL unit and 
   * become 30 days.
   * @param duration The non-null duration, e.g. "5m".
   * @return The PromQL duration.
   * @throws IllegalArgumentException if the duration was malformed.
   */
  static String toDuration(final String duration) {
    DateTime.parseDuration(duration);
    final String units = DateTime.getDurationUnits(duration);
    final int interval = DateTime.getDurationInterval(duration);
    if (units.equals("n")) {
      return (interval * 30) + "d";
    }
    return interval + units;
  }
  
  /** @return The regex anchored alternation of the values. */
  static String alternation(final List<String> values) {
    final List<String> escaped = Lists.newArrayListWithCapacity(values.size());
    for (final String value : values) {
      final StringBuilder buf = new StringBuilder();
      for (int i = 0; i < value.length(); i++) {
        final char c = value.charAt(i);
        if (REGEX_META.indexOf(c) >= 0) {
          buf.append('\\');
        }
        buf.append(c);
      }
      escaped.add(buf.toString());
    }
    return "^(" + Joiner.on('|').join(escaped) + ")$";
  }
  
  /** @return The value as a double quoted PromQL string. */
  static String quote(final String value) {
    return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
  
  private String applyRange(final MetricNode stream, 
                            final String selector, 
                            final Resolution resolution) {
    String expression = selector;
    boolean applied = false;
    for (final Transformation step : stream.getPipeline()) {
      final String function;
      switch (step.getType()) {
      case RATE:
        function = "rate";
        break;
      case DELTA:
        function = "delta";
        break;
      default:
        continue;
      }
      if (applied) {
        throw new UnsupportedQueryOperationException(PrometheusDriver.NAME, 
            function, "only one rate or delta step per stream is supported");
      }
      final String interval;
      if (!Strings.isNullOrEmpty(step.getInterval())) {
        interval = toDuration(step.getInterval());
      } else if (!resolution.isAuto()) {
        interval = resolution.getSeconds() + "s";
      } else {
        interval = default_rate_interval;
      }
      expression = function + "(" + expression + "[" + interval + "])";
      applied = true;
    }
    return expression;
  }
  
  private static String aggregate(final Aggregation aggregation, 
                                  final List<String> group_by, 
                                  final String expression) {
    final StringBuilder buf = new StringBuilder();
    switch (aggregation.function()) {
    case AVG:
    case SUM:
    case MIN:
    case MAX:
    case COUNT:
    case STDDEV:
      buf.append(aggregation.function().name().toLowerCase(Locale.ROOT));
      break;
    case MEDIAN:
    case PERCENTILE:
      buf.append("quantile");
      break;
    default:
      throw new UnsupportedQueryOperationException(PrometheusDriver.NAME, 
          aggregation.name(), "PromQL has no such aggregation operator");
    }
    if (!group_by.isEmpty()) {
      buf.append(" by (")
         .append(Joiner.on(',').join(group_by))
         .append(") ");
    }
    buf.append('(');
    switch (aggregation.function()) {
    case MEDIAN:
      buf.append("0.5, ");
      break;
    case PERCENTILE:
      buf.append(TagValue.formatDouble(aggregation.percentile() / 100))
         .append(", ");
      break;
    default:
      break;
    }
    return buf.append(expression)
              .append(')')
              .toString();
  }
  
  private static String applyMath(final MetricNode stream, 
                                  final String expression) {
    String result = expression;
    for (final Transformation step : stream.mathTransformations()) {
      result = "(" + result + ") " + step.getOperator().symbol() + " " 
          + step.getOperandString();
    }
    return result;
  }
  
  private static String comments(final MetricNode stream, 
                                 final TimeRange range) {
    final StringBuilder buf = new StringBuilder();
    if (stream.getLimit() != null) {
      buf.append(" # limit: ")
         .append(stream.getLimit());
    }
    if (range != null) {
      if (range.isRelative()) {
        buf.append(" # relative time: ")
           .append(range.relativeDuration());
      } else {
        buf.append(" # time range: ")
           .append(DateTime.toRfc3339(range.getStart()))
           .append(" to ")
           .append(DateTime.toRfc3339(range.getEnd()));
      }
    }
    return buf.toString();
  }
}
