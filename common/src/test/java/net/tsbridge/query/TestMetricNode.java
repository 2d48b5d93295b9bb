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
package net.tsbridge.query;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.data.Resolution;
import net.tsbridge.data.TimeRange;
import net.tsbridge.exceptions.QueryValidationException;
import net.tsbridge.exceptions.UndefinedLabelException;

public class TestMetricNode {
  private static final MetricIdentifier METRIC = MetricIdentifier.newBuilder()
      .setNamespace("net")
      .setName("bytes.in")
      .setLabels(Arrays.asList("host", "ifName"))
      .build();
  
  @Test
  public void defaults() throws Exception {
    final MetricNode node = MetricNode.newBuilder()
        .setMetric(METRIC)
        .build();
    assertEquals("net.bytes.in", node.getAlias());
    assertFalse(node.hasAlias());
    assertEquals(SortOrder.ASC, node.getSort());
    assertEquals(FillPolicy.NONE, node.getFill());
    assertNull(node.getLimit());
    assertNull(node.getConsolidation());
    assertTrue(node.getFilters().isEmpty());
    assertTrue(node.getPipeline().isEmpty());
    assertTrue(node.getAggregations().isEmpty());
    assertNull(node.rateTransformation());
  }
  
  @Test
  public void pipelineHelpers() throws Exception {
    final MetricNode node = MetricNode.newBuilder()
        .setMetric(METRIC)
        .setAlias("traffic")
        .addFilter(Filter.equal("host", "web01"))
        .addTransformation(Transformation.rate("1m"))
        .addTransformation(Transformation.groupBy("host"))
        .addTransformation(Transformation.math(MathOperator.MULTIPLY, 8))
        .addTransformation(Transformation.groupBy("ifName", "host"))
        .addTransformation(Transformation.math(MathOperator.DIVIDE, 1024))
        .addAggregation(Aggregation.parse("max"))
        .setLimit(10)
        .setSort(SortOrder.DESC)
        .setFill(FillPolicy.ZERO)
        .build();
    assertEquals("traffic", node.getAlias());
    assertEquals("1m", node.rateTransformation().getInterval());
    assertEquals(Arrays.asList("host", "ifName"), node.groupByLabels());
    assertEquals(2, node.mathTransformations().size());
    assertEquals(MathOperator.MULTIPLY, 
        node.mathTransformations().get(0).getOperator());
    assertEquals(5, node.getPipeline().size());
  }
  
  @Test
  public void undeclaredLabels() throws Exception {
    try {
      MetricNode.newBuilder()
          .setMetric(METRIC)
          .addFilter(Filter.equal("dc", "lax"))
          .build();
      fail("Expected UndefinedLabelException");
    } catch (UndefinedLabelException e) { }
    
    try {
      MetricNode.newBuilder()
          .setMetric(METRIC)
          .addTransformation(Transformation.groupBy("dc"))
          .build();
      fail("Expected UndefinedLabelException");
    } catch (UndefinedLabelException e) { }
  }
  
  @Test
  public void invalid() throws Exception {
    try {
      MetricNode.newBuilder().build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }
    
    try {
      MetricNode.newBuilder().setMetric(METRIC).setLimit(0).build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }
  }
  
  @Test
  public void dataQuery() throws Exception {
    final MetricNode node = MetricNode.newBuilder()
        .setMetric(METRIC)
        .build();
    final DataQuery query = DataQuery.newBuilder()
        .setTimeRange(TimeRange.lastHours(1))
        .setResolution(Resolution.minutes(5))
        .addStream(node)
        .build();
    assertEquals(300, (long) query.getResolution().getSeconds());
    assertEquals(1, query.getStreams().size());
    
    assertTrue(DataQuery.newBuilder().addStream(node).build()
        .getResolution().isAuto());
    
    try {
      DataQuery.newBuilder().build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }
  }
  
  @Test
  public void labelQuery() throws Exception {
    LabelQuery query = LabelQuery.newBuilder()
        .addMetric(METRIC)
        .build();
    assertTrue(query.isNameQuery());
    
    query = LabelQuery.newBuilder()
        .addMetric(METRIC)
        .setLabel("host")
        .addFilter(Filter.equal("ifName", "eth0"))
        .build();
    assertFalse(query.isNameQuery());
    assertEquals("host", query.getLabel());
    
    try {
      LabelQuery.newBuilder().setLabel("host").build();
      fail("Expected QueryValidationException");
    } catch (QueryValidationException e) { }
  }
  
  @Test
  public void results() throws Exception {
    final LabelQueryResult result = new LabelQueryResult("host", 
        Arrays.asList("b", "a", "b"));
    assertEquals(Arrays.asList("a", "b"), 
        Arrays.asList(result.values().toArray()));
    
    final QueryResult empty = new QueryResult(null, null, null);
    assertTrue(empty.isEmpty());
    assertTrue(empty.resolution().isAuto());
    assertNull(empty.get("x"));
  }
}
