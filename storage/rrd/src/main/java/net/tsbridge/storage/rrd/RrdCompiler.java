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
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tsbridge.data.TagValue;
import net.tsbridge.data.TimeRange;
import net.tsbridge.exceptions.QueryExecutionException;
import net.tsbridge.exceptions.UnsupportedQueryOperationException;
import net.tsbridge.query.Aggregation;
import net.tsbridge.query.AggregationFunction;
import net.tsbridge.query.ConsolidationFunction;
import net.tsbridge.query.DataQuery;
import net.tsbridge.query.Filter;
import net.tsbridge.query.MetricNode;
import net.tsbridge.query.QueryCompiler;
import net.tsbridge.query.Transformation;
import net.tsbridge.query.TransformationType;
import net.tsbridge.storage.rrd.RrdXportQuery.Cdef;
import net.tsbridge.storage.rrd.RrdXportQuery.Def;
import net.tsbridge.storage.rrd.RrdXportQuery.Vdef;
import net.tsbridge.storage.rrd.RrdXportQuery.Xport;

/**
 * Compiles a data query into a single {@code xport} command graph.
 * <p>
 * Variables are allocated in three disjoint bands in traversal order:
 * raw references {@code v1, v2, ...}, aggregations {@code agg1000, ...} 
 * and math steps {@code math2000, ...}. The counters continue across 
 * streams so a query with several streams never reuses a name.
 * <p>
 * The archives have no label index so group-by and the rate aggregation
 * are rejected. Rate and delta pipeline steps, and any math following 
 * them, run in {@link RrdPostProcessor} after the export.
 * 
 * @since 1.0
 */
public class RrdCompiler implements QueryCompiler<RrdXportQuery> {
  private static final Logger LOG = LoggerFactory.getLogger(RrdCompiler.class);
  
  /** The data source name written by {@link RrdWriter}. */
  public static final String DATA_SOURCE = "value";
  
  public static final int RAW_BAND = 1;
  public static final int AGGREGATION_BAND = 1000;
  public static final int MATH_BAND = 2000;
  
  private final LabelStrategy strategy;
  
  /**
   * Default ctor.
   * @param strategy The non-null strategy used to resolve archives.
   */
  public RrdCompiler(final LabelStrategy strategy) {
    if (strategy == null) {
      throw new IllegalArgumentException("Strategy cannot be null.");
    }
    this.strategy = strategy;
  }
  
  @Override
  public List<RrdXportQuery> compile(final DataQuery query) {
    return ImmutableList.of(compileQuery(query));
  }
  
  /**
   * Compiles every stream of the query into one graph.
   * @param query The non-null query.
   * @return The graph.
   * @throws UnsupportedQueryOperationException if the query used an 
   * operation archives cannot evaluate.
   * @throws QueryExecutionException with a 404 status if a stream 
   * matched no archives.
   */
  public RrdXportQuery compileQuery(final DataQuery query) {
    if (query == null) {
      throw new IllegalArgumentException("Query cannot be null.");
    }
    query.validate();
    final RrdXportQuery.Builder builder = RrdXportQuery.newBuilder()
        .setQuery(query);
    setWindow(query, builder);
    
    final Counters counters = new Counters();
    for (int i = 0; i < query.getStreams().size(); i++) {
      compileStream(i, query.getStreams().get(i), builder, counters);
    }
    final RrdXportQuery compiled = builder.build();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Compiled RRD query: " + compiled);
    }
    return compiled;
  }
  
  /**
   * @param pipeline A non-null pipeline.
   * @return The index of the first step that must run after the export, 
   * or the size of the pipeline if all steps run in rrdtool.
   */
  public static int firstClientStep(final List<Transformation> pipeline) {
    for (int i = 0; i < pipeline.size(); i++) {
      final TransformationType type = pipeline.get(i).getType();
      if (type == TransformationType.RATE || type == TransformationType.DELTA) {
        return i;
      }
    }
    return pipeline.size();
  }
  
  private void setWindow(final DataQuery query, 
                         final RrdXportQuery.Builder builder) {
    final TimeRange range = query.getTimeRange();
    if (range == null) {
      builder.setStart("end-" + DataQuery.DEFAULT_WINDOW + "s")
             .setEnd("now");
    } else if (range.isRelative()) {
      builder.setStart("end-" + range.getDuration() + "s")
             .setEnd("now");
    } else {
      builder.setStart(Long.toString(range.getStart()))
             .setEnd(Long.toString(range.getEnd()));
    }
    if (!query.getResolution().isAuto()) {
      builder.setStep(query.getResolution().getSeconds());
    }
  }
  
  private void compileStream(final int index, 
                             final MetricNode stream, 
                             final RrdXportQuery.Builder builder,
                             final Counters counters) {
    if (!stream.groupByLabels().isEmpty()) {
      throw new UnsupportedQueryOperationException(RrdDriver.NAME, 
          "group_by", "archives cannot be joined on labels");
    }
    for (final Aggregation aggregation : stream.getAggregations()) {
      if (aggregation.function() == AggregationFunction.RATE) {
        throw new UnsupportedQueryOperationException(RrdDriver.NAME, 
            aggregation.name(), "use a rate transformation instead");
      }
    }
    final List<TagCondition> conditions = Lists.newArrayListWithCapacity(
        stream.getFilters().size());
    for (final Filter filter : stream.getFilters()) {
      conditions.add(TagCondition.fromFilter(filter));
    }
    
    final String key = stream.getMetric().key();
    final List<LabelIndexEntry> entries = 
        strategy.findFilenames(stream.getMetric(), conditions);
    if (entries.isEmpty()) {
      throw new QueryExecutionException("No RRD files found for " + key, 404);
    }
    final ConsolidationFunction cf = stream.getConsolidation() == null ? 
        ConsolidationFunction.AVERAGE : stream.getConsolidation();
    
    final List<Output> references = Lists.newArrayListWithCapacity(
        entries.size());
    for (final LabelIndexEntry entry : entries) {
      final String name = "v" + counters.raw++;
      builder.addElement(new Def(name, entry.path(), DATA_SOURCE, cf));
      references.add(new Output(name, stream.getAlias(), entry.labels()));
    }
    
    List<Output> outputs;
    if (stream.getAggregations().isEmpty()) {
      outputs = references;
    } else {
      final Map<String, String> shared = sharedLabels(references);
      outputs = Lists.newArrayListWithCapacity(
          stream.getAggregations().size());
      for (final Aggregation aggregation : stream.getAggregations()) {
        final String alias = stream.getAggregations().size() == 1 ? 
            stream.getAlias() : stream.getAlias() + "_" + aggregation.name();
        outputs.add(new Output(
            aggregate(aggregation, references, builder, counters), 
            alias, shared));
      }
    }
    
    final int server_steps = firstClientStep(stream.getPipeline());
    for (final Output output : outputs) {
      for (int i = 0; i < server_steps; i++) {
        final Transformation step = stream.getPipeline().get(i);
        if (step.getType() != TransformationType.MATH) {
          continue;
        }
        final String name = "math" + counters.math++;
        builder.addElement(new Cdef(name, output.variable + "," 
            + TagValue.formatDouble(step.getOperand()) + "," 
            + step.getOperator().symbol()));
        output.variable = name;
      }
      builder.addElement(new Xport(output.variable, output.legend(), index, 
          key, output.alias, output.labels));
    }
  }
  
  private String aggregate(final Aggregation aggregation, 
                           final List<Output> references,
                           final RrdXportQuery.Builder builder, 
                           final Counters counters) {
    switch (aggregation.function()) {
    case SUM:
      return cdef(sum(references), builder, counters);
    case AVG:
      return cdef(average(references), builder, counters);
    case MIN:
      return cdef(pairwise(references, "MIN"), builder, counters);
    case MAX:
      return cdef(pairwise(references, "MAX"), builder, counters);
    case COUNT:
      final StringBuilder buf = new StringBuilder();
      for (int i = 0; i < references.size(); i++) {
        if (i > 0) {
          buf.append(',');
        }
        buf.append(references.get(i).variable)
           .append(",UN,0,1,IF");
        if (i > 0) {
          buf.append(",+");
        }
      }
      return cdef(buf.toString(), builder, counters);
    case FIRST:
      return summary("FIRST", references, builder, counters);
    case LAST:
      return summary("LAST", references, builder, counters);
    case STDDEV:
      return summary("STDEV", references, builder, counters);
    case MEDIAN:
      return summary(TagValue.formatDouble(Aggregation.DEFAULT_PERCENTILE) 
          + ",PERCENT", references, builder, counters);
    case PERCENTILE:
      return summary(TagValue.formatDouble(aggregation.percentile()) 
          + ",PERCENT", references, builder, counters);
    default:
      throw new UnsupportedQueryOperationException(RrdDriver.NAME, 
          aggregation.name());
    }
  }
  
  /**
   * Emits a VDEF over the single reference, or over the averaged 
   * references, and a CDEF broadcasting the VDEF value across every row
   * so it can be exported.
   */
  private String summary(final String operator, 
                         final List<Output> references,
                         final RrdXportQuery.Builder builder, 
                         final Counters counters) {
    final String input = references.size() == 1 ? 
        references.get(0).variable : 
          cdef(average(references), builder, counters);
    final String vdef = "agg" + counters.aggregation++;
    builder.addElement(new Vdef(vdef, input + "," + operator));
    return cdef(input + ",POP," + vdef, builder, counters);
  }
  
  private String cdef(final String rpn, 
                      final RrdXportQuery.Builder builder, 
                      final Counters counters) {
    final String name = "agg" + counters.aggregation++;
    builder.addElement(new Cdef(name, rpn));
    return name;
  }
  
  private static String sum(final List<Output> references) {
    return pairwise(references, "+");
  }
  
  private static String average(final List<Output> references) {
    return references.size() == 1 ? references.get(0).variable : 
      sum(references) + "," + references.size() + ",/";
  }
  
  private static String pairwise(final List<Output> references, 
                                 final String operator) {
    final StringBuilder buf = new StringBuilder(references.get(0).variable);
    for (int i = 1; i < references.size(); i++) {
      buf.append(',')
         .append(references.get(i).variable)
         .append(',')
         .append(operator);
    }
    return buf.toString();
  }
  
  /** @return The labels with the same value in every reference. */
  private static Map<String, String> sharedLabels(
      final List<Output> references) {
    final Map<String, String> shared = 
        new TreeMap<>(references.get(0).labels);
    for (int i = 1; i < references.size(); i++) {
      final Map<String, String> labels = references.get(i).labels;
      shared.entrySet().removeIf(entry -> 
          !entry.getValue().equals(labels.get(entry.getKey())));
    }
    return shared;
  }
  
  /** A variable destined for export. */
  private static class Output {
    private String variable;
    private final String alias;
    private final Map<String, String> labels;
    
    Output(final String variable, 
           final String alias, 
           final Map<String, String> labels) {
      this.variable = variable;
      this.alias = alias;
      this.labels = labels;
    }
    
    String legend() {
      if (labels.isEmpty()) {
        return alias;
      }
      final StringBuilder buf = new StringBuilder(alias).append('{');
      boolean first = true;
      for (final Entry<String, String> entry : labels.entrySet()) {
        if (!first) {
          buf.append(',');
        }
        first = false;
        buf.append(entry.getKey())
           .append('=')
           .append(entry.getValue());
      }
      return buf.append('}').toString();
    }
  }
  
  /** Band counters shared across the streams of one query. */
  private static class Counters {
    private int raw = RAW_BAND;
    private int aggregation = AGGREGATION_BAND;
    private int math = MATH_BAND;
  }
}
