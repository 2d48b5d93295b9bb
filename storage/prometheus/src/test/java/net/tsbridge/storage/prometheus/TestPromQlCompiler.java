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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.data.Resolution;
import net.tsbridge.data.TagValue;
import net.tsbridge.data.TimeRange;
import net.tsbridge.exceptions.UnsupportedQueryOperationException;
import net.tsbridge.query.Aggregation;
import net.tsbridge.query.DataQuery;
import net.tsbridge.query.Filter;
import net.tsbridge.query.FilterOperator;
import net.tsbridge.query.MathOperator;
import net.tsbridge.query.MetricNode;
import net.tsbridge.query.Transformation;

public class TestPromQlCompiler {
  private static final MetricIdentifier METRIC = MetricIdentifier.newBuilder()
      .setNamespace("net")
      .setName("bytes.in")
      .addLabel("host")
      .addLabel("ifName")
      .addLabel("dc")
      .build();
  private static final TimeRange RANGE = TimeRange.between(1700000000, 
      1700003600);
  private static final String COMMENT = 
      " # time range: 2023-11-14T22:13:20Z to 2023-11-14T23:13:20Z";
  
  private final PromQlCompiler compiler = new PromQlCompiler("5m");
  
  @Test
  public void ctor() throws Exception {
    try {
      new PromQlCompiler(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new PromQlCompiler("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new PromQlCompiler("5 minutes");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void selectorOnly() throws Exception {
    final List<PromQuery> compiled = compiler.compile(query(
        MetricNode.newBuilder().setMetric(METRIC)));
    assertEquals(1, compiled.size());
    final PromQuery query = compiled.get(0);
    assertEquals("net.bytes.in" + COMMENT, query.query());
    assertEquals("net.bytes.in", query.alias());
    assertNull(query.aggregation());
    assertEquals(1700000000, query.start());
    assertEquals(1700003600, query.end());
    assertEquals(14, query.step());
    assertEquals(PrometheusDriver.NAME, query.driver());
  }
  
  @Test
  public void inFilter() throws Exception {
    final PromQuery query = compiler.compile(query(MetricNode.newBuilder()
        .setMetric(METRIC)
        .addFilter(Filter.in("ifName", "eth0", "eth1")))).get(0);
    assertEquals("net.bytes.in{ifName=~\"^(eth0|eth1)$\"}" + COMMENT, 
        query.query());
  }
  
  @Test
  public void matchers() throws Exception {
    assertEquals("host=\"web01\"", 
        PromQlCompiler.matcher(Filter.equal("host", "web01")));
    assertEquals("host!=\"web01\"", PromQlCompiler.matcher(filter("host", 
        FilterOperator.NOT_EQUALS, "web01")));
    assertEquals("host=~\"web.*\"", PromQlCompiler.matcher(filter("host", 
        FilterOperator.REGEX, "web.*")));
    assertEquals("host!~\"web.*\"", PromQlCompiler.matcher(filter("host", 
        FilterOperator.NOT_REGEX, "web.*")));
    assertEquals("host!~\"^(a|b)$\"", PromQlCompiler.matcher(
        Filter.newBuilder()
          .setKey("host")
          .setOperator(FilterOperator.NOT_IN)
          .setStringValues(Arrays.asList("a", "b"))
          .build()));
    
    // numeric comparisons fall back to equality
    assertEquals("dc=\"5\"", PromQlCompiler.matcher(Filter.newBuilder()
        .setKey("dc")
        .setOperator(FilterOperator.GREATER_THAN)
        .setValue(TagValue.of(5L))
        .build()));
    assertEquals("dc=\"2.5\"", PromQlCompiler.matcher(Filter.newBuilder()
        .setKey("dc")
        .setOperator(FilterOperator.LESS_THAN)
        .setValue(TagValue.of(2.5))
        .build()));
  }
  
  @Test
  public void escaping() throws Exception {
    assertEquals("host=\"a\\\"b\\\\c\"", 
        PromQlCompiler.matcher(Filter.equal("host", "a\"b\\c")));
    assertEquals("host=~\"^(web\\\\.01|db\\\\(1\\\\))$\"", 
        PromQlCompiler.matcher(Filter.in("host", "web.01", "db(1)")));
  }
  
  @Test
  public void selector() throws Exception {
    assertEquals("net.bytes.in", PromQlCompiler.selector("net.bytes.in", 
        null));
    assertEquals("net.bytes.in", PromQlCompiler.selector("net.bytes.in", 
        Arrays.<Filter>asList()));
    assertEquals("net.bytes.in{host=\"web01\",dc=\"lax\"}", 
        PromQlCompiler.selector("net.bytes.in", Arrays.asList(
            Filter.equal("host", "web01"), Filter.equal("dc", "lax"))));
  }
  
  @Test
  public void rateWithAggregations() throws Exception {
    final List<PromQuery> compiled = compiler.compile(query(
        MetricNode.newBuilder()
          .setMetric(METRIC)
          .addFilter(Filter.equal("ifName", "eth0"))
          .addTransformation(Transformation.rate())
          .addAggregation(Aggregation.parse("max"))
          .addAggregation(Aggregation.parse("min"))
          .addAggregation(Aggregation.parse("avg"))));
    assertEquals(3, compiled.size());
    assertEquals("max(rate(net.bytes.in{ifName=\"eth0\"}[5m]))" + COMMENT, 
        compiled.get(0).query());
    assertEquals("min(rate(net.bytes.in{ifName=\"eth0\"}[5m]))" + COMMENT, 
        compiled.get(1).query());
    assertEquals("avg(rate(net.bytes.in{ifName=\"eth0\"}[5m]))" + COMMENT, 
        compiled.get(2).query());
    assertEquals("net.bytes.in_max", compiled.get(0).alias());
    assertEquals("net.bytes.in_min", compiled.get(1).alias());
    assertEquals("net.bytes.in_avg", compiled.get(2).alias());
    assertEquals(Aggregation.parse("avg"), compiled.get(2).aggregation());
  }
  
  @Test
  public void singleAggregationKeepsAlias() throws Exception {
    final PromQuery query = compiler.compile(query(MetricNode.newBuilder()
        .setMetric(METRIC)
        .setAlias("in")
        .addAggregation(Aggregation.parse("mean")))).get(0);
    assertEquals("avg(net.bytes.in)" + COMMENT, query.query());
    assertEquals("in", query.alias());
  }
  
  @Test
  public void rateIntervals() throws Exception {
    PromQuery query = compiler.compile(query(MetricNode.newBuilder()
        .setMetric(METRIC)
        .addTransformation(Transformation.rate("1h")))).get(0);
    assertEquals("rate(net.bytes.in[1h])" + COMMENT, query.query());
    
    query = compiler.compile(query(MetricNode.newBuilder()
        .setMetric(METRIC)
        .addTransformation(Transformation.rate("2n")))).get(0);
    assertEquals("rate(net.bytes.in[60d])" + COMMENT, query.query());
    
    query = compiler.compile(DataQuery.newBuilder()
        .setTimeRange(RANGE)
        .setResolution(Resolution.seconds(60))
        .addStream(MetricNode.newBuilder()
            .setMetric(METRIC)
            .addTransformation(Transformation.rate())
            .build())
        .build()).get(0);
    assertEquals("rate(net.bytes.in[60s])" + COMMENT, query.query());
    assertEquals(60, query.step());
    
    query = new PromQlCompiler("10m").compile(query(MetricNode.newBuilder()
        .setMetric(METRIC)
        .addTransformation(Transformation.delta()))).get(0);
    assertEquals("delta(net.bytes.in[10m])" + COMMENT, query.query());
  }
  
  @Test
  public void groupBy() throws Exception {
    final List<PromQuery> compiled = compiler.compile(query(
        MetricNode.newBuilder()
          .setMetric(METRIC)
          .addTransformation(Transformation.rate("5m"))
          .addTransformation(Transformation.groupBy("host", "dc"))
          .addAggregation(Aggregation.parse("sum"))
          .addAggregation(Aggregation.parse("percentile_95"))));
    assertEquals("sum by (host,dc) (rate(net.bytes.in[5m]))" + COMMENT, 
        compiled.get(0).query());
    assertEquals("quantile by (host,dc) (0.95, rate(net.bytes.in[5m]))" 
        + COMMENT, compiled.get(1).query());
    assertEquals("net.bytes.in_percentile_95", compiled.get(1).alias());
  }
  
  @Test
  public void aggregationFunctions() throws Exception {
    assertEquals("count(net.bytes.in)" + COMMENT, 
        aggregated("count").query());
    assertEquals("stddev(net.bytes.in)" + COMMENT, 
        aggregated("stddev").query());
    assertEquals("quantile(0.5, net.bytes.in)" + COMMENT, 
        aggregated("median").query());
    assertEquals("quantile(0.5, net.bytes.in)" + COMMENT, 
        aggregated("percentile").query());
    assertEquals("quantile(0.5, net.bytes.in)" + COMMENT, 
        aggregated("percentile_abc").query());
    assertEquals("quantile(0.999, net.bytes.in)" + COMMENT, 
        aggregated("percentile_99.9").query());
  }
  
  @Test
  public void math() throws Exception {
    final PromQuery query = compiler.compile(query(MetricNode.newBuilder()
        .setMetric(METRIC)
        .addTransformation(Transformation.rate())
        .addTransformation(Transformation.math(MathOperator.MULTIPLY, 8))
        .addTransformation(Transformation.math(MathOperator.ADD, 1.5))
        .addAggregation(Aggregation.parse("avg")))).get(0);
    assertEquals("((avg(rate(net.bytes.in[5m]))) * 8) + 1.5" + COMMENT, 
        query.query());
  }
  
  @Test
  public void comments() throws Exception {
    PromQuery query = compiler.compile(DataQuery.newBuilder()
        .setTimeRange(TimeRange.lastHours(2))
        .addStream(MetricNode.newBuilder()
            .setMetric(METRIC)
            .setLimit(10)
            .build())
        .build()).get(0);
    assertEquals("net.bytes.in # limit: 10 # relative time: 2h", 
        query.query());
    assertEquals(7200, query.end() - query.start());
    assertEquals(28, query.step());
    
    // no range means the last hour without a comment
    query = compiler.compile(DataQuery.newBuilder()
        .addStream(MetricNode.newBuilder()
            .setMetric(METRIC)
            .build())
        .build()).get(0);
    assertEquals("net.bytes.in", query.query());
    assertEquals(DataQuery.DEFAULT_WINDOW, query.end() - query.start());
  }
  
  @Test
  public void minimumStep() throws Exception {
    final PromQuery query = compiler.compile(DataQuery.newBuilder()
        .setTimeRange(TimeRange.between(1700000000, 1700000060))
        .addStream(MetricNode.newBuilder()
            .setMetric(METRIC)
            .build())
        .build()).get(0);
    assertEquals(1, query.step());
  }
  
  @Test
  public void multipleStreams() throws Exception {
    final List<PromQuery> compiled = compiler.compile(DataQuery.newBuilder()
        .setTimeRange(RANGE)
        .addStream(MetricNode.newBuilder()
            .setMetric(METRIC)
            .setAlias("a")
            .build())
        .addStream(MetricNode.newBuilder()
            .setMetric(METRIC)
            .setAlias("b")
            .addFilter(Filter.equal("host", "web01"))
            .build())
        .build());
    assertEquals(2, compiled.size());
    assertEquals("a", compiled.get(0).alias());
    assertEquals("b", compiled.get(1).alias());
    assertEquals("net.bytes.in{host=\"web01\"}" + COMMENT, 
        compiled.get(1).query());
  }
  
  @Test
  public void deterministic() throws Exception {
    final DataQuery query = query(MetricNode.newBuilder()
        .setMetric(METRIC)
        .addFilter(Filter.in("ifName", "eth0", "eth1"))
        .addFilter(Filter.equal("dc", "lax"))
        .addTransformation(Transformation.rate("1m"))
        .addTransformation(Transformation.groupBy("host"))
        .addAggregation(Aggregation.parse("max"))
        .addAggregation(Aggregation.parse("sum")));
    assertEquals(compiler.compile(query), compiler.compile(query));
    assertEquals(compiler.compile(query).toString(), 
        new PromQlCompiler("5m").compile(query).toString());
  }
  
  @Test
  public void unsupported() throws Exception {
    try {
      aggregated("first");
      fail("Expected UnsupportedQueryOperationException");
    } catch (UnsupportedQueryOperationException e) {
      assertEquals(PrometheusDriver.NAME, e.driver());
      assertEquals("first", e.operation());
    }
    
    try {
      aggregated("last");
      fail("Expected UnsupportedQueryOperationException");
    } catch (UnsupportedQueryOperationException e) { }
    
    try {
      compiler.compile(query(MetricNode.newBuilder()
          .setMetric(METRIC)
          .addTransformation(Transformation.groupBy("host"))));
      fail("Expected UnsupportedQueryOperationException");
    } catch (UnsupportedQueryOperationException e) {
      assertEquals("group by", e.operation());
    }
    
    try {
      compiler.compile(query(MetricNode.newBuilder()
          .setMetric(METRIC)
          .addTransformation(Transformation.rate())
          .addTransformation(Transformation.delta())));
      fail("Expected UnsupportedQueryOperationException");
    } catch (UnsupportedQueryOperationException e) {
      assertEquals("delta", e.operation());
    }
  }
  
  @Test
  public void toDuration() throws Exception {
    assertEquals("30s", PromQlCompiler.toDuration("30s"));
    assertEquals("5m", PromQlCompiler.toDuration("5m"));
    assertEquals("2w", PromQlCompiler.toDuration("2w"));
    assertEquals("1y", PromQlCompiler.toDuration("1y"));
    assertEquals("30d", PromQlCompiler.toDuration("1n"));
    try {
      PromQlCompiler.toDuration("5x");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void streamIsKept() throws Exception {
    final MetricNode stream = MetricNode.newBuilder()
        .setMetric(METRIC)
        .build();
    final PromQuery query = compiler.compile(DataQuery.newBuilder()
        .setTimeRange(RANGE)
        .addStream(stream)
        .build()).get(0);
    assertSame(stream, query.stream());
  }
  
  private PromQuery aggregated(final String aggregation) {
    return compiler.compile(query(MetricNode.newBuilder()
        .setMetric(METRIC)
        .addAggregation(Aggregation.parse(aggregation)))).get(0);
  }
  
  private static Filter filter(final String key, 
                               final FilterOperator operator, 
                               final String value) {
    return Filter.newBuilder()
        .setKey(key)
        .setOperator(operator)
        .setValue(value)
        .build();
  }
  
  private static DataQuery query(final MetricNode.Builder stream) {
    return DataQuery.newBuilder()
        .setTimeRange(RANGE)
        .addStream(stream.build())
        .build();
  }
}
