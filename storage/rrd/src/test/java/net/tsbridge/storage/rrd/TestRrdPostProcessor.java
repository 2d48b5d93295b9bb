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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.data.Resolution;
import net.tsbridge.data.TimeRange;
import net.tsbridge.data.TimeSeries;
import net.tsbridge.data.TimeSeriesValue;
import net.tsbridge.exceptions.OutputParseException;
import net.tsbridge.exceptions.QueryValidationException;
import net.tsbridge.query.ConsolidationFunction;
import net.tsbridge.query.DataQuery;
import net.tsbridge.query.FillPolicy;
import net.tsbridge.query.MathOperator;
import net.tsbridge.query.MetricNode;
import net.tsbridge.query.QueryResult;
import net.tsbridge.query.SortOrder;
import net.tsbridge.query.Transformation;
import net.tsbridge.storage.rrd.RrdXportQuery.Def;
import net.tsbridge.storage.rrd.RrdXportQuery.Xport;

public class TestRrdPostProcessor {
  private static final MetricIdentifier METRIC = MetricIdentifier.newBuilder()
      .setNamespace("net")
      .setName("bytes_in")
      .addLabel("host")
      .build();
  
  private final RrdPostProcessor processor = new RrdPostProcessor();

  @Test
  public void bindsOutputs() throws Exception {
    final RrdXportQuery query = query(MetricNode.newBuilder()
        .setMetric(METRIC)
        .setAlias("in")
        .build(), 2);
    final QueryResult result = processor.process(query, parsed(
        values(1.0, 2.0), values(3.0, 4.0)));
    assertEquals(2, result.series().size());
    final TimeSeries series = result.series().get(1);
    assertEquals("net.bytes_in", series.metric());
    assertEquals("in", series.alias());
    assertEquals(ImmutableMap.of("host", "h1"), series.labels());
    assertEquals(values(3.0, 4.0), series.values());
    assertEquals(TimeRange.between(0, 120), result.timeRange());
  }
  
  @Test
  public void limit() throws Exception {
    final RrdXportQuery query = query(MetricNode.newBuilder()
        .setMetric(METRIC)
        .setLimit(1)
        .build(), 3);
    final QueryResult result = processor.process(query, parsed(
        values(1.0), values(2.0), values(3.0)));
    assertEquals(1, result.series().size());
    assertEquals(ImmutableMap.of("host", "h0"), 
        result.series().get(0).labels());
  }
  
  @Test
  public void clientSideRateAndMath() throws Exception {
    final RrdXportQuery query = query(MetricNode.newBuilder()
        .setMetric(METRIC)
        .addTransformation(Transformation.math(MathOperator.MULTIPLY, 8))
        .addTransformation(Transformation.rate())
        .addTransformation(Transformation.math(MathOperator.DIVIDE, 2))
        .build(), 1);
    final QueryResult result = processor.process(query, parsed(
        values(0.0, 600.0, 1800.0, null, 2400.0)));
    final List<TimeSeriesValue> values = result.series().get(0).values();
    assertEquals(5, values.size());
    assertNull(values.get(0).value());
    assertEquals(5.0, values.get(1).value(), 0.0001);
    assertEquals(10.0, values.get(2).value(), 0.0001);
    assertNull(values.get(3).value());
    assertNull(values.get(4).value());
  }
  
  @Test
  public void delta() throws Exception {
    final List<TimeSeriesValue> values = RrdPostProcessor.apply(
        Transformation.delta(), values(1.0, 4.0, 2.0));
    assertNull(values.get(0).value());
    assertEquals(3.0, values.get(1).value(), 0.0001);
    assertEquals(-2.0, values.get(2).value(), 0.0001);
  }
  
  @Test
  public void math() throws Exception {
    assertEquals(values(0.5, null), RrdPostProcessor.apply(
        Transformation.math(MathOperator.DIVIDE, 2), values(1.0, null)));
    try {
      RrdPostProcessor.apply(Transformation.math(MathOperator.DIVIDE, 0), 
          values(1.0, null));
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }
    
    assertEquals(values(3.0, null), RrdPostProcessor.apply(
        Transformation.math(MathOperator.ADD, 2), values(1.0, null)));
    assertEquals(values(-1.0), RrdPostProcessor.apply(
        Transformation.math(MathOperator.SUBTRACT, 2), values(1.0)));
  }
  
  @Test
  public void fill() throws Exception {
    assertEquals(values(0.0, 1.0, 0.0, 2.0), RrdPostProcessor.fill(
        FillPolicy.ZERO, values(null, 1.0, null, 2.0)));
    assertEquals(values(null, 1.0, 1.0, 2.0), RrdPostProcessor.fill(
        FillPolicy.PREVIOUS, values(null, 1.0, null, 2.0)));
    assertEquals(values(null, 1.0), RrdPostProcessor.fill(
        FillPolicy.NULL, values(null, 1.0)));
    assertEquals(values(null, 1.0), RrdPostProcessor.fill(
        FillPolicy.NONE, values(null, 1.0)));
  }
  
  @Test
  public void descending() throws Exception {
    final RrdXportQuery query = query(MetricNode.newBuilder()
        .setMetric(METRIC)
        .setSort(SortOrder.DESC)
        .setFill(FillPolicy.PREVIOUS)
        .build(), 1);
    final List<TimeSeriesValue> values = processor.process(query, 
        parsed(values(1.0, null, 3.0))).series().get(0).values();
    assertEquals(120L, values.get(0).timestamp());
    assertEquals(3.0, values.get(0).value(), 0.0001);
    assertEquals(1.0, values.get(1).value(), 0.0001);
    assertEquals(0L, values.get(2).timestamp());
  }
  
  @Test
  public void columnMismatch() throws Exception {
    final RrdXportQuery query = query(MetricNode.newBuilder()
        .setMetric(METRIC)
        .build(), 2);
    try {
      processor.process(query, parsed(values(1.0)));
      fail("Expected OutputParseException");
    } catch (OutputParseException e) { }
  }
  
  /** Builds a raw export of the given number of archives for one stream. */
  private static RrdXportQuery query(final MetricNode stream, 
                                     final int archives) {
    final RrdXportQuery.Builder builder = RrdXportQuery.newBuilder()
        .setQuery(DataQuery.newBuilder().addStream(stream).build())
        .setStart("end-3600s")
        .setEnd("now");
    for (int i = 0; i < archives; i++) {
      builder.addElement(new Def("v" + (i + 1), "net/bytes_in/host=h" + i 
          + ".rrd", RrdCompiler.DATA_SOURCE, ConsolidationFunction.AVERAGE));
    }
    for (int i = 0; i < archives; i++) {
      builder.addElement(new Xport("v" + (i + 1), stream.getAlias(), 0, 
          stream.getMetric().key(), stream.getAlias(), 
          ImmutableMap.of("host", "h" + i)));
    }
    return builder.build();
  }
  
  @SafeVarargs
  private static QueryResult parsed(final List<TimeSeriesValue>... columns) {
    final List<TimeSeries> series = Lists.newArrayList();
    for (final List<TimeSeriesValue> column : columns) {
      series.add(TimeSeries.newBuilder()
          .setMetric("legend")
          .setValues(column)
          .build());
    }
    return new QueryResult(series, TimeRange.between(0, 120), 
        Resolution.seconds(60));
  }
  
  /** Values spaced 60 seconds apart starting at 0. */
  private static List<TimeSeriesValue> values(final Double... values) {
    final List<TimeSeriesValue> result = Lists.newArrayList();
    for (int i = 0; i < values.length; i++) {
      result.add(new TimeSeriesValue(i * 60L, values[i]));
    }
    return Collections.unmodifiableList(result);
  }
}
