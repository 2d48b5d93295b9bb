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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.data.Resolution;
import net.tsbridge.data.TimeRange;
import net.tsbridge.exceptions.QueryExecutionException;
import net.tsbridge.exceptions.UnsupportedQueryOperationException;
import net.tsbridge.query.Aggregation;
import net.tsbridge.query.AggregationFunction;
import net.tsbridge.query.ConsolidationFunction;
import net.tsbridge.query.DataQuery;
import net.tsbridge.query.Filter;
import net.tsbridge.query.MathOperator;
import net.tsbridge.query.MetricNode;
import net.tsbridge.query.Transformation;
import net.tsbridge.storage.rrd.RrdXportQuery.Xport;

public class TestRrdCompiler {
  private static final MetricIdentifier BYTES_IN = MetricIdentifier.newBuilder()
      .setNamespace("net")
      .setName("bytes_in")
      .addLabel("host")
      .addLabel("ifName")
      .build();
  private static final MetricIdentifier CPU = MetricIdentifier.newBuilder()
      .setNamespace("sys")
      .setName("cpu")
      .build();
  
  private LabelStrategy strategy;
  private RrdCompiler compiler;
  
  @Before
  public void before() throws Exception {
    strategy = mock(LabelStrategy.class);
    when(strategy.findFilenames(eq(BYTES_IN), anyList())).thenReturn(
        Arrays.asList(
            new LabelIndexEntry("net", "bytes_in", 
                ImmutableMap.of("host", "a", "ifName", "eth0"), 
                "net/bytes_in/host=a,ifName=eth0.rrd"),
            new LabelIndexEntry("net", "bytes_in", 
                ImmutableMap.of("host", "b", "ifName", "eth0"), 
                "net/bytes_in/host=b,ifName=eth0.rrd")));
    when(strategy.findFilenames(eq(CPU), anyList())).thenReturn(
        Arrays.asList(new LabelIndexEntry("sys", "cpu", 
            Collections.<String, String>emptyMap(), "sys/cpu/_default.rrd")));
    compiler = new RrdCompiler(strategy);
  }
  
  @Test
  public void raw() throws Exception {
    final RrdXportQuery query = compiler.compileQuery(query(
        MetricNode.newBuilder()
          .setMetric(BYTES_IN)
          .addFilter(Filter.equal("ifName", "eth0"))
          .build()));
    assertEquals("xport --json --start end-3600s --end now "
        + "DEF:v1=net/bytes_in/host=a,ifName=eth0.rrd:value:AVERAGE "
        + "DEF:v2=net/bytes_in/host=b,ifName=eth0.rrd:value:AVERAGE "
        + "XPORT:v1:net.bytes_in{host=a,ifName=eth0} "
        + "XPORT:v2:net.bytes_in{host=b,ifName=eth0}", query.toString());
    assertEquals("rrd", query.driver());
    assertEquals("net.bytes_in", query.alias());
    
    final List<Xport> outputs = query.outputs();
    assertEquals(2, outputs.size());
    assertEquals(0, outputs.get(0).stream());
    assertEquals("net.bytes_in", outputs.get(0).metric());
    assertEquals(ImmutableMap.of("host", "b", "ifName", "eth0"), 
        outputs.get(1).labels());
    verify(strategy).findFilenames(eq(BYTES_IN), eq(Arrays.asList(
        TagCondition.fromFilter(Filter.equal("ifName", "eth0")))));
  }
  
  @Test
  public void windowAndStep() throws Exception {
    RrdXportQuery query = compiler.compileQuery(DataQuery.newBuilder()
        .setTimeRange(TimeRange.between(1700000000L, 1700003600L))
        .setResolution(Resolution.seconds(60))
        .addStream(MetricNode.newBuilder().setMetric(CPU).build())
        .build());
    assertEquals("1700000000", query.start());
    assertEquals("1700003600", query.end());
    assertEquals(60L, (long) query.step());
    assertEquals(Arrays.asList("--json", "--start", "1700000000", "--end", 
        "1700003600", "--step", "60"), query.toCommand().options());
    
    query = compiler.compileQuery(DataQuery.newBuilder()
        .setTimeRange(TimeRange.lastHours(2))
        .addStream(MetricNode.newBuilder().setMetric(CPU).build())
        .build());
    assertEquals("end-7200s", query.start());
    assertEquals("now", query.end());
  }
  
  @Test
  public void consolidation() throws Exception {
    final RrdXportQuery query = compiler.compileQuery(query(
        MetricNode.newBuilder()
          .setMetric(CPU)
          .setConsolidation(ConsolidationFunction.MAX)
          .setAlias("cpu")
          .build()));
    assertEquals("DEF:v1=sys/cpu/_default.rrd:value:MAX", 
        query.elements().get(0).render());
    assertEquals("XPORT:v1:cpu", query.elements().get(1).render());
  }
  
  @Test
  public void aggregation() throws Exception {
    final RrdXportQuery query = compiler.compileQuery(query(
        MetricNode.newBuilder()
          .setMetric(BYTES_IN)
          .setAlias("in")
          .addAggregation(Aggregation.of(AggregationFunction.SUM))
          .build()));
    assertEquals(Arrays.asList("v1", "v2", "agg1000"), query.variables());
    assertEquals("CDEF:agg1000=v1,v2,+", query.elements().get(2).render());
    assertEquals("XPORT:agg1000:in{ifName=eth0}", 
        query.elements().get(3).render());
    assertEquals(ImmutableMap.of("ifName", "eth0"), 
        query.outputs().get(0).labels());
  }
  
  @Test
  public void multipleAggregations() throws Exception {
    final RrdXportQuery query = compiler.compileQuery(query(
        MetricNode.newBuilder()
          .setMetric(BYTES_IN)
          .setAlias("in")
          .addAggregation(Aggregation.of(AggregationFunction.AVG))
          .addAggregation(Aggregation.of(AggregationFunction.MAX))
          .addAggregation(Aggregation.of(AggregationFunction.MIN))
          .addAggregation(Aggregation.of(AggregationFunction.COUNT))
          .build()));
    final List<String> rendered = render(query);
    assertTrue(rendered.contains("CDEF:agg1000=v1,v2,+,2,/"));
    assertTrue(rendered.contains("CDEF:agg1001=v1,v2,MAX"));
    assertTrue(rendered.contains("CDEF:agg1002=v1,v2,MIN"));
    assertTrue(rendered.contains("CDEF:agg1003=v1,UN,0,1,IF,v2,UN,0,1,IF,+"));
    
    final List<Xport> outputs = query.outputs();
    assertEquals(4, outputs.size());
    assertEquals("in_avg", outputs.get(0).alias());
    assertEquals("in_max", outputs.get(1).alias());
    assertEquals("in_min", outputs.get(2).alias());
    assertEquals("in_count", outputs.get(3).alias());
    assertEquals("in_avg,in_max,in_min,in_count", query.alias());
  }
  
  @Test
  public void summaryAggregations() throws Exception {
    RrdXportQuery query = compiler.compileQuery(query(
        MetricNode.newBuilder()
          .setMetric(BYTES_IN)
          .addAggregation(Aggregation.percentile(95))
          .build()));
    assertEquals(Arrays.asList(
        "DEF:v1=net/bytes_in/host=a,ifName=eth0.rrd:value:AVERAGE",
        "DEF:v2=net/bytes_in/host=b,ifName=eth0.rrd:value:AVERAGE",
        "CDEF:agg1000=v1,v2,+,2,/",
        "VDEF:agg1001=agg1000,95,PERCENT",
        "CDEF:agg1002=agg1000,POP,agg1001",
        "XPORT:agg1002:net.bytes_in{ifName=eth0}"), render(query));
    
    query = compiler.compileQuery(query(
        MetricNode.newBuilder()
          .setMetric(CPU)
          .addAggregation(Aggregation.of(AggregationFunction.STDDEV))
          .addAggregation(Aggregation.of(AggregationFunction.MEDIAN))
          .addAggregation(Aggregation.of(AggregationFunction.LAST))
          .build()));
    final List<String> rendered = render(query);
    assertTrue(rendered.contains("VDEF:agg1000=v1,STDEV"));
    assertTrue(rendered.contains("CDEF:agg1001=v1,POP,agg1000"));
    assertTrue(rendered.contains("VDEF:agg1002=v1,50,PERCENT"));
    assertTrue(rendered.contains("VDEF:agg1004=v1,LAST"));
  }
  
  @Test
  public void serverSideMath() throws Exception {
    final RrdXportQuery query = compiler.compileQuery(query(
        MetricNode.newBuilder()
          .setMetric(CPU)
          .addTransformation(Transformation.math(MathOperator.MULTIPLY, 8))
          .addTransformation(Transformation.math(MathOperator.DIVIDE, 1.5))
          .build()));
    assertEquals(Arrays.asList(
        "DEF:v1=sys/cpu/_default.rrd:value:AVERAGE",
        "CDEF:math2000=v1,8,*",
        "CDEF:math2001=math2000,1.5,/",
        "XPORT:math2001:sys.cpu"), render(query));
  }
  
  @Test
  public void mathAfterRateStaysClientSide() throws Exception {
    final MetricNode stream = MetricNode.newBuilder()
        .setMetric(CPU)
        .addTransformation(Transformation.math(MathOperator.MULTIPLY, 8))
        .addTransformation(Transformation.rate())
        .addTransformation(Transformation.math(MathOperator.DIVIDE, 2))
        .build();
    assertEquals(1, RrdCompiler.firstClientStep(stream.getPipeline()));
    
    final RrdXportQuery query = compiler.compileQuery(query(stream));
    assertEquals(Arrays.asList(
        "DEF:v1=sys/cpu/_default.rrd:value:AVERAGE",
        "CDEF:math2000=v1,8,*",
        "XPORT:math2000:sys.cpu"), render(query));
  }
  
  @Test
  public void bandsAreDisjoint() throws Exception {
    final RrdXportQuery query = compiler.compileQuery(DataQuery.newBuilder()
        .addStream(MetricNode.newBuilder()
            .setMetric(BYTES_IN)
            .addAggregation(Aggregation.of(AggregationFunction.SUM))
            .addTransformation(Transformation.math(MathOperator.MULTIPLY, 8))
            .build())
        .addStream(MetricNode.newBuilder()
            .setMetric(CPU)
            .addAggregation(Aggregation.of(AggregationFunction.MAX))
            .addTransformation(Transformation.math(MathOperator.MULTIPLY, 2))
            .build())
        .build());
    assertEquals(Arrays.asList("v1", "v2", "agg1000", "math2000", 
        "v3", "agg1001", "math2001"), query.variables());
    final Set<String> unique = Sets.newHashSet(query.variables());
    assertEquals(query.variables().size(), unique.size());
    assertEquals(1, query.outputs().get(1).stream());
  }
  
  @Test
  public void deterministic() throws Exception {
    final DataQuery query = query(MetricNode.newBuilder()
        .setMetric(BYTES_IN)
        .addAggregation(Aggregation.of(AggregationFunction.AVG))
        .addAggregation(Aggregation.percentile(99))
        .build());
    assertEquals(compiler.compileQuery(query).toString(), 
        compiler.compileQuery(query).toString());
    assertEquals(1, compiler.compile(query).size());
  }
  
  @Test
  public void unsupported() throws Exception {
    try {
      compiler.compileQuery(query(MetricNode.newBuilder()
          .setMetric(BYTES_IN)
          .addTransformation(Transformation.groupBy("host"))
          .build()));
      fail("Expected UnsupportedQueryOperationException");
    } catch (UnsupportedQueryOperationException e) { }
    
    try {
      compiler.compileQuery(query(MetricNode.newBuilder()
          .setMetric(BYTES_IN)
          .addAggregation(Aggregation.of(AggregationFunction.RATE))
          .build()));
      fail("Expected UnsupportedQueryOperationException");
    } catch (UnsupportedQueryOperationException e) { }
  }
  
  @Test
  public void noArchives() throws Exception {
    when(strategy.findFilenames(eq(CPU), anyList()))
      .thenReturn(Collections.<LabelIndexEntry>emptyList());
    try {
      compiler.compileQuery(query(MetricNode.newBuilder()
          .setMetric(CPU)
          .build()));
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(404, e.getStatusCode());
      assertEquals("No RRD files found for sys.cpu", e.getMessage());
    }
  }
  
  @Test
  public void ctor() throws Exception {
    try {
      new RrdCompiler(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      compiler.compileQuery(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    verify(strategy, never())
      .findFilenames(any(MetricIdentifier.class), anyList());
  }
  
  private static DataQuery query(final MetricNode stream) {
    return DataQuery.newBuilder().addStream(stream).build();
  }
  
  private static List<String> render(final RrdXportQuery query) {
    final List<String> rendered = Lists.newArrayList();
    for (final RrdXportQuery.Element element : query.elements()) {
      rendered.add(element.render());
    }
    return rendered;
  }
}
