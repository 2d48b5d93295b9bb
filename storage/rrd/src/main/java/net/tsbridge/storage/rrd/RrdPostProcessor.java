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

import java.util.Collections;
import java.util.List;

import com.google.common.collect.Lists;

import net.tsbridge.data.TimeSeries;
import net.tsbridge.data.TimeSeriesValue;
import net.tsbridge.exceptions.OutputParseException;
import net.tsbridge.query.FillPolicy;
import net.tsbridge.query.MetricNode;
import net.tsbridge.query.QueryResult;
import net.tsbridge.query.SortOrder;
import net.tsbridge.query.Transformation;
import net.tsbridge.query.TransformationType;
import net.tsbridge.storage.rrd.RrdXportQuery.Xport;

/**
 * Applies the parts of a stream rrdtool cannot evaluate to the exported 
 * series: rate and delta steps with any math after them, the fill policy,
 * the sort order and the series limit. Also binds each exported column to
 * the metric, alias and labels it was compiled from.
 * 
 * @since 1.0
 */
public class RrdPostProcessor {
  
  /**
   * Processes the parsed export.
   * @param query The non-null compiled query.
   * @param parsed The non-null parsed export in column order.
   * @return The final result.
   * @throws OutputParseException if the column count did not match the 
   * exports of the query.
   */
  public QueryResult process(final RrdXportQuery query, 
                             final QueryResult parsed) {
    final List<Xport> outputs = query.outputs();
    if (outputs.size() != parsed.series().size()) {
      throw new OutputParseException("Expected " + outputs.size() 
          + " exported columns but found " + parsed.series().size(), 
          parsed.toString());
    }
    
    final List<MetricNode> streams = query.query().getStreams();
    final List<TimeSeries> results = Lists.newArrayList();
    final int[] per_stream = new int[streams.size()];
    for (int i = 0; i < outputs.size(); i++) {
      final Xport output = outputs.get(i);
      final MetricNode stream = streams.get(output.stream());
      if (stream.getLimit() != null && 
          per_stream[output.stream()] >= stream.getLimit()) {
        continue;
      }
      per_stream[output.stream()]++;
      
      List<TimeSeriesValue> values = parsed.series().get(i).values();
      final List<Transformation> pipeline = stream.getPipeline();
      for (int x = RrdCompiler.firstClientStep(pipeline); 
          x < pipeline.size(); x++) {
        values = apply(pipeline.get(x), values);
      }
      values = fill(stream.getFill(), values);
      if (stream.getSort() == SortOrder.DESC) {
        values = Lists.newArrayList(values);
        Collections.reverse(values);
      }
      results.add(TimeSeries.newBuilder()
          .setMetric(output.metric())
          .setAlias(output.alias())
          .setLabels(output.labels())
          .setValues(values)
          .build());
    }
    return new QueryResult(results, parsed.timeRange(), parsed.resolution());
  }
  
  /**
   * Applies one pipeline step. Group-by never reaches this point as the 
   * compiler rejects it.
   */
  static List<TimeSeriesValue> apply(final Transformation step, 
                                     final List<TimeSeriesValue> values) {
    final List<TimeSeriesValue> result = 
        Lists.newArrayListWithCapacity(values.size());
    switch (step.getType()) {
    case RATE:
    case DELTA:
      for (int i = 0; i < values.size(); i++) {
        final TimeSeriesValue current = values.get(i);
        if (i == 0 || current.value() == null || 
            values.get(i - 1).value() == null) {
          result.add(new TimeSeriesValue(current.timestamp(), null));
          continue;
        }
        final TimeSeriesValue previous = values.get(i - 1);
        double delta = current.value() - previous.value();
        if (step.getType() == TransformationType.RATE) {
          final long elapsed = current.timestamp() - previous.timestamp();
          if (elapsed <= 0) {
            result.add(new TimeSeriesValue(current.timestamp(), null));
            continue;
          }
          delta /= elapsed;
        }
        result.add(new TimeSeriesValue(current.timestamp(), delta));
      }
      return result;
    case MATH:
      for (final TimeSeriesValue value : values) {
        result.add(new TimeSeriesValue(value.timestamp(), 
            value.value() == null ? null : math(step, value.value())));
      }
      return result;
    default:
      return values;
    }
  }
  
  static List<TimeSeriesValue> fill(final FillPolicy fill, 
                                    final List<TimeSeriesValue> values) {
    if (fill == null || fill == FillPolicy.NONE || fill == FillPolicy.NULL) {
      return values;
    }
    final List<TimeSeriesValue> result = 
        Lists.newArrayListWithCapacity(values.size());
    Double last = null;
    for (final TimeSeriesValue value : values) {
      if (value.value() != null) {
        last = value.value();
        result.add(value);
      } else if (fill == FillPolicy.ZERO) {
        result.add(new TimeSeriesValue(value.timestamp(), 0.0));
      } else {
        result.add(new TimeSeriesValue(value.timestamp(), last));
      }
    }
    return result;
  }
  
  private static Double math(final Transformation step, final double value) {
    switch (step.getOperator()) {
    case ADD:
      return value + step.getOperand();
    case SUBTRACT:
      return value - step.getOperand();
    case MULTIPLY:
      return value * step.getOperand();
    case DIVIDE:
      return value / step.getOperand();
    default:
      throw new IllegalStateException("Unknown operator: " 
          + step.getOperator());
    }
  }
}
