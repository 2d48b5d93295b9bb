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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.data.TimeRange;
import net.tsbridge.data.TimeSeries;
import net.tsbridge.data.TimeSeriesValue;
import net.tsbridge.exceptions.OutputParseException;
import net.tsbridge.exceptions.RemoteQueryExecutionException;
import net.tsbridge.query.Aggregation;
import net.tsbridge.query.DataQuery;
import net.tsbridge.query.MetricNode;

public class TestPrometheusResultParser {
  private static final String MATRIX = "{\"status\":\"success\",\"data\":{"
      + "\"resultType\":\"matrix\",\"result\":["
      + "{\"metric\":{\"__name__\":\"net.bytes.in\",\"host\":\"web01\"},"
      + "\"values\":[[1700000000,\"1.5\"],[1700000060,\"NaN\"],"
      + "[1700000120.5,\"3\"]]},"
      + "{\"metric\":{\"__name__\":\"net.bytes.in\",\"host\":\"web02\"},"
      + "\"values\":[[1700000000,\"+Inf\"]]}]}}";
  
  private final PrometheusResultParser parser = new PrometheusResultParser();
  
  @Test
  public void matrix() throws Exception {
    final List<TimeSeries> series = parser.parse(MATRIX);
    assertEquals(2, series.size());
    TimeSeries ts = series.get(0);
    assertEquals("net.bytes.in", ts.metric());
    assertEquals(ImmutableMap.of("host", "web01"), ts.labels());
    assertEquals(Arrays.asList(
        new TimeSeriesValue(1700000000, 1.5),
        new TimeSeriesValue(1700000060, null),
        new TimeSeriesValue(1700000120, 3.0)), ts.values());
    
    ts = series.get(1);
    assertEquals(ImmutableMap.of("host", "web02"), ts.labels());
    assertEquals(Double.POSITIVE_INFINITY, ts.values().get(0).value(), 0);
  }
  
  @Test
  public void matrixWithQuery() throws Exception {
    final MetricIdentifier metric = MetricIdentifier.newBuilder()
        .setNamespace("net")
        .setName("bytes.in")
        .build();
    final PromQuery query = new PromQlCompiler("5m").compile(
        DataQuery.newBuilder()
          .setTimeRange(TimeRange.between(1700000000, 1700003600))
          .addStream(MetricNode.newBuilder()
              .setMetric(metric)
              .addAggregation(Aggregation.parse("max"))
              .addAggregation(Aggregation.parse("min"))
              .build())
          .build()).get(1);
    final String raw = "{\"status\":\"success\",\"data\":{"
        + "\"resultType\":\"matrix\",\"result\":[{\"metric\":{},"
        + "\"values\":[[1700000000,\"42\"]]}]}}";
    final TimeSeries ts = parser.parse(raw, query).get(0);
    assertEquals("net.bytes.in", ts.metric());
    assertEquals("net.bytes.in_min", ts.alias());
    assertTrue(ts.labels().isEmpty());
    assertEquals(42, ts.values().get(0).value(), 0.0001);
  }
  
  @Test
  public void vector() throws Exception {
    final String raw = "{\"status\":\"success\",\"data\":{"
        + "\"resultType\":\"vector\",\"result\":["
        + "{\"metric\":{\"host\":\"web01\"},\"value\":[1700000000,\"-Inf\"]},"
        + "{\"metric\":{\"host\":\"web02\"},\"value\":[1700000000,\"0.25\"]}"
        + "]}}";
    final List<TimeSeries> series = parser.parse(raw);
    assertEquals(2, series.size());
    assertEquals("value", series.get(0).metric());
    assertEquals(Double.NEGATIVE_INFINITY, 
        series.get(0).values().get(0).value(), 0);
    assertEquals(0.25, series.get(1).values().get(0).value(), 0.0001);
  }
  
  @Test
  public void scalar() throws Exception {
    final String raw = "{\"status\":\"success\",\"data\":{"
        + "\"resultType\":\"scalar\",\"result\":[1700000000,\"2\"]}}";
    final List<TimeSeries> series = parser.parse(raw);
    assertEquals(1, series.size());
    assertEquals(new TimeSeriesValue(1700000000, 2.0), 
        series.get(0).values().get(0));
  }
  
  @Test
  public void empty() throws Exception {
    final String raw = "{\"status\":\"success\",\"data\":{"
        + "\"resultType\":\"matrix\",\"result\":[]}}";
    assertTrue(parser.parse(raw).isEmpty());
  }
  
  @Test
  public void labels() throws Exception {
    assertEquals(Arrays.asList("__name__", "host", "ifName"), 
        parser.parseLabels("{\"status\":\"success\",\"data\":"
            + "[\"__name__\",\"host\",\"ifName\"]}"));
    assertTrue(parser.parseLabels("{\"status\":\"success\",\"data\":[]}")
        .isEmpty());
    try {
      parser.parseLabels("{\"status\":\"success\",\"data\":{}}");
      fail("Expected OutputParseException");
    } catch (OutputParseException e) { }
  }
  
  @Test
  public void errorStatus() throws Exception {
    try {
      parser.parse("{\"status\":\"error\",\"errorType\":\"bad_data\","
          + "\"error\":\"parse error at char 5\"}");
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertTrue(e.getMessage().contains("bad_data"));
      assertTrue(e.getMessage().contains("parse error at char 5"));
      assertEquals(PrometheusDriver.NAME, e.remoteEndpoint());
    }
  }
  
  @Test
  public void malformed() throws Exception {
    try {
      parser.parse("");
      fail("Expected OutputParseException");
    } catch (OutputParseException e) { }
    
    try {
      parser.parse("{\"status\":\"success\",\"data\":");
      fail("Expected OutputParseException");
    } catch (OutputParseException e) { }
    
    try {
      parser.parse("{\"status\":\"success\"}");
      fail("Expected OutputParseException");
    } catch (OutputParseException e) { }
    
    try {
      parser.parse("{\"status\":\"success\",\"data\":{"
          + "\"resultType\":\"string\",\"result\":[]}}");
      fail("Expected OutputParseException");
    } catch (OutputParseException e) { }
    
    try {
      parser.parse("{\"status\":\"success\",\"data\":{"
          + "\"resultType\":\"matrix\",\"result\":[{\"metric\":{}}]}}");
      fail("Expected OutputParseException");
    } catch (OutputParseException e) { }
    
    try {
      parser.parse("{\"status\":\"success\",\"data\":{"
          + "\"resultType\":\"vector\",\"result\":["
          + "{\"metric\":{},\"value\":[1700000000,\"abc\"]}]}}");
      fail("Expected OutputParseException");
    } catch (OutputParseException e) {
      assertTrue(e.rawOutput().contains("abc"));
    }
  }
  
  @Test
  public void value() throws Exception {
    assertNull(PrometheusResultParser.value("NaN"));
    assertEquals(1.5, PrometheusResultParser.value("1.5"), 0.0001);
    assertEquals(1e-3, PrometheusResultParser.value("1e-03"), 0.0000001);
  }
}
