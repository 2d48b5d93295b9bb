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

import java.util.Collection;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.data.TagValue;
import net.tsbridge.data.TimeRange;
import net.tsbridge.exceptions.UnsupportedQueryOperationException;
import net.tsbridge.query.Aggregation;
import net.tsbridge.query.DataQuery;
import net.tsbridge.query.FillPolicy;
import net.tsbridge.query.Filter;
import net.tsbridge.query.MetricNode;
import net.tsbridge.query.QueryCompiler;
import net.tsbridge.query.SortOrder;
import net.tsbridge.query.Transformation;
import net.tsbridge.utils.DateTime;

/**
 * Compiles streams into Flux scripts for InfluxDB 2. Each metric is a 
 * measurement holding its samples in a single field and the labels are 
 * tags. Pipeline steps are piped in order after the filters, then the 
 * aggregation window, the fill, the sort and a named yield, e.g.
 * <pre>
 * from(bucket: "metrics")
 *   |&gt; range(start: -3600s)
 *   |&gt; filter(fn: (r) =&gt; r["_measurement"] == "net.bytes.in")
 *   |&gt; filter(fn: (r) =&gt; r["_field"] == "value")
 *   |&gt; aggregateWindow(every: 14s, fn: mean, createEmpty: false)
 *   |&gt; sort(columns: ["_time"], desc: false)
 *   |&gt; yield(name: "net.bytes.in")
 * </pre>
 * A stream with several aggregations yields one script each, aliased 
 * {@code <alias>_<aggregation>}.
 * 
 * @since 1.0
 */
public class FluxCompiler implements QueryCompiler<FluxQuery> {
  private static final Logger LOG = LoggerFactory.getLogger(
      FluxCompiler.class);
  
  /** Target number of points per series when no resolution is given. */
  public static final int MAX_POINTS = 250;
  
  /** The field samples are written to and read from by default. */
  public static final String DEFAULT_FIELD = "value";
  
  static final String PIPE = "\n  |> ";
  
  private final String bucket;
  private final String field;
  
  /**
   * Ctor using the default field.
   * @param bucket The non-null and non-empty bucket.
   */
  public FluxCompiler(final String bucket) {
    this(bucket, DEFAULT_FIELD);
  }
  
  /**
   * Default ctor.
   * @param bucket The non-null and non-empty bucket.
   * @param field The non-null and non-empty field name.
   */
  public FluxCompiler(final String bucket, final String field) {
    if (Strings.isNullOrEmpty(bucket)) {
      throw new IllegalArgumentException("Bucket cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(field)) {
      throw new IllegalArgumentException("Field cannot be null or empty.");
    }
    this.bucket = bucket;
    this.field = field;
  }
  
  @Override
  public List<FluxQuery> compile(final DataQuery query) {
    final TimeRange range = query.getTimeRange() != null ? 
        query.getTimeRange() : TimeRange.newBuilder()
          .setDurationSeconds(DataQuery.DEFAULT_WINDOW)
          .build();
    final long step = query.getResolution().isAuto() ? 
        Math.max(1, range.getDuration() / MAX_POINTS) : 
          query.getResolution().getSeconds();
    
    final List<FluxQuery> compiled = Lists.newArrayList();
    for (final MetricNode stream : query.getStreams()) {
      final String source = source(stream, range);
      if (stream.getAggregations().isEmpty()) {
        compiled.add(FluxQuery.newBuilder()
            .setStream(stream)
            .setFlux(finish(stream, source, stream.getAlias()))
            .setStart(range.getStart())
            .setEnd(range.getEnd())
            .setStep(step)
            .build());
        continue;
      }
      
      for (final Aggregation aggregation : stream.getAggregations()) {
        final String alias = stream.getAggregations().size() == 1 ? 
            stream.getAlias() : stream.getAlias() + "_" + aggregation.name();
        final StringBuilder buf = new StringBuilder(source)
            .append(PIPE)
            .append(window(aggregation, step, stream.getFill()));
        if (stream.getFill() == FillPolicy.PREVIOUS) {
          buf.append(PIPE).append("fill(usePrevious: true)");
        } else if (stream.getFill() == FillPolicy.ZERO) {
          buf.append(PIPE).append("fill(value: 0.0)");
        }
        compiled.add(FluxQuery.newBuilder()
            .setStream(stream)
            .setAggregation(aggregation)
            .setAlias(alias)
            .setFlux(finish(stream, buf.toString(), alias))
            .setStart(range.getStart())
            .setEnd(range.getEnd())
            .setStep(step)
            .build());
      }
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Compiled Flux: " + compiled);
    }
    return compiled;
  }
  
  /**
   * Builds a script listing the tag keys of the given measurements.
   * @param metrics The metrics to restrict to, may be empty.
   * @param filters Filters the series must match, may be empty.
   * @param range An optional range, may be null for the server default.
   * @return The Flux script.
   */
  public String tagKeys(final Collection<MetricIdentifier> metrics, 
                        final List<Filter> filters, 
                        final TimeRange range) {
    return new StringBuilder("import \"influxdata/influxdb/schema\"\n\n")
        .append("schema.tagKeys(bucket: ")
        .append(quote(bucket))
        .append(", predicate: ")
        .append(predicate(metrics, filters))
        .append(schemaRange(range))
        .append(')')
        .toString();
  }
  
  /**
   * Builds a script listing the values of a tag.
   * @param tag The non-null tag name.
   * @param metrics The metrics to restrict to, may be empty.
   * @param filters Filters the series must match, may be empty.
   * @param range An optional range, may be null for the server default.
   * @return The Flux script.
   */
  public String tagValues(final String tag,
                          final Collection<MetricIdentifier> metrics, 
                          final List<Filter> filters, 
                          final TimeRange range) {
    return new StringBuilder("import \"influxdata/influxdb/schema\"\n\n")
        .append("schema.tagValues(bucket: ")
        .append(quote(bucket))
        .append(", tag: ")
        .append(quote(tag))
        .append(", predicate: ")
        .append(predicate(metrics, filters))
        .append(schemaRange(range))
        .append(')')
        .toString();
  }
  
  /** @return The bucket queried. */
  public String bucket() {
    return bucket;
  }
  
  /** @return The field queried. */
  public String field() {
    return field;
  }
  
  /**
   * Renders the predicate body of a filter.
   * @param filter The non-null filter.
   * @return A boolean Flux expression over the row {@code r}.
   */
  static String expression(final Filter filter) {
    final String column = column(filter.getKey());
    switch (filter.getOperator()) {
    case NOT_EQUALS:
      return column + " != " + quote(filter.getValue().asString());
    case REGEX:
      return column + " =~ " + regex(filter.getValue().asString());
    case NOT_REGEX:
      return column + " !~ " + regex(filter.getValue().asString());
    case GREATER_THAN:
      return "float(v: " + column + ") > " + number(filter.getValue());
    case LESS_THAN:
      return "float(v: " + column + ") < " + number(filter.getValue());
    case IN:
      return "contains(value: " + column + ", set: " 
          + set(filter.getStringValues()) + ")";
    case NOT_IN:
      return "not contains(value: " + column + ", set: " 
          + set(filter.getStringValues()) + ")";
    default:
      return column + " == " + quote(filter.getValue().asString());
    }
  }
  
  /** @return The value as a double quoted Flux string. */
  static String quote(final String value) {
    return "\"" + value.replace("\\", "\\\\")
                       .replace("\"", "\\\"")
                       .replace("${", "\\${") + "\"";
  }
  
  /** @return The pattern as a Flux regex literal. */
  static String regex(final String pattern) {
    return "/" + pattern.replace("/", "\\/") + "/";
  }
  
  /** @return A float literal, Flux does not mix ints and floats. */
  static String floatLiteral(final double value) {
    final String formatted = TagValue.formatDouble(value);
    return formatted.indexOf('.') < 0 ? formatted + ".0" : formatted;
  }
  
  private String source(final MetricNode stream, final TimeRange range) {
    final StringBuilder buf = new StringBuilder()
        .append("from(bucket: ")
        .append(quote(bucket))
        .append(')')
        .append(PIPE)
        .append("range(")
        .append(rangeArguments(range))
        .append(')')
        .append(PIPE)
        .append("filter(fn: (r) => r[\"_measurement\"] == ")
        .append(quote(stream.getMetric().key()))
        .append(')')
        .append(PIPE)
        .append("filter(fn: (r) => r[\"_field\"] == ")
        .append(quote(field))
        .append(')');
    for (final Filter filter : stream.getFilters()) {
      buf.append(PIPE)
         .append("filter(fn: (r) => ")
         .append(expression(filter))
         .append(')');
    }
    for (final Transformation step : stream.getPipeline()) {
      buf.append(PIPE);
      switch (step.getType()) {
      case RATE:
        buf.append("derivative(unit: 1s, nonNegative: true)");
        break;
      case DELTA:
        buf.append("difference(nonNegative: false)");
        break;
      case MATH:
        buf.append("map(fn: (r) => ({ r with _value: r._value ")
           .append(step.getOperator().symbol())
           .append(' ')
           .append(floatLiteral(step.getOperand()))
           .append(" }))");
        break;
      case GROUP_BY:
        buf.append("group(columns: ")
           .append(set(step.getLabels()))
           .append(')');
        break;
      default:
        throw new UnsupportedQueryOperationException(InfluxDriver.NAME, 
            step.getType().name(), "unknown pipeline step");
      }
    }
    return buf.toString();
  }
  
  private static String window(final Aggregation aggregation, 
                               final long step, 
                               final FillPolicy fill) {
    final String fn;
    switch (aggregation.function()) {
    case AVG:
      fn = "mean";
      break;
    case SUM:
    case MIN:
    case MAX:
    case MEDIAN:
    case COUNT:
    case STDDEV:
    case FIRST:
    case LAST:
      fn = aggregation.function().name().toLowerCase(Locale.ROOT);
      break;
    case PERCENTILE:
      fn = "(column, tables=<-) => tables |> quantile(q: " 
          + floatLiteral(aggregation.percentile() / 100) 
          + ", column: column)";
      break;
    default:
      throw new UnsupportedQueryOperationException(InfluxDriver.NAME, 
          aggregation.name(), "use a rate pipeline step instead");
    }
    return "aggregateWindow(every: " + step + "s, fn: " + fn 
        + ", createEmpty: " + (fill != null && fill != FillPolicy.NONE) + ")";
  }
  
  private static String finish(final MetricNode stream, 
                               final String flux, 
                               final String alias) {
    return new StringBuilder(flux)
        .append(PIPE)
        .append("sort(columns: [\"_time\"], desc: ")
        .append(stream.getSort() == SortOrder.DESC)
        .append(')')
        .append(PIPE)
        .append("yield(name: ")
        .append(quote(alias))
        .append(')')
        .toString();
  }
  
  private static String rangeArguments(final TimeRange range) {
    if (range.isRelative()) {
      return "start: -" + range.getDuration() + "s";
    }
    return "start: " + DateTime.toRfc3339(range.getStart()) 
        + ", stop: " + DateTime.toRfc3339(range.getEnd());
  }
  
  private static String schemaRange(final TimeRange range) {
    if (range == null) {
      return "";
    }
    return ", " + rangeArguments(range);
  }
  
  private static String predicate(final Collection<MetricIdentifier> metrics, 
                                  final List<Filter> filters) {
    final List<String> clauses = Lists.newArrayList();
    if (metrics != null && !metrics.isEmpty()) {
      final List<String> measurements = Lists.newArrayList();
      for (final MetricIdentifier metric : metrics) {
        measurements.add("r._measurement == " + quote(metric.key()));
      }
      clauses.add(measurements.size() == 1 ? measurements.get(0) : 
        "(" + Joiner.on(" or ").join(measurements) + ")");
    }
    if (filters != null) {
      for (final Filter filter : filters) {
        clauses.add(expression(filter));
      }
    }
    if (clauses.isEmpty()) {
      return "(r) => true";
    }
    return "(r) => " + Joiner.on(" and ").join(clauses);
  }
  
  private static String column(final String key) {
    return "r[" + quote(key) + "]";
  }
  
  private static String set(final List<String> values) {
    final List<String> quoted = Lists.newArrayListWithCapacity(values.size());
    for (final String value : values) {
      quoted.add(quote(value));
    }
    return "[" + Joiner.on(", ").join(quoted) + "]";
  }
  
  private static String number(final TagValue value) {
    return floatLiteral(value.asDouble());
  }
}
