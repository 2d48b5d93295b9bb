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
package net.tsbridge.data;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import net.tsbridge.exceptions.QueryValidationException;
import net.tsbridge.exceptions.UndefinedLabelException;
import net.tsbridge.utils.YAML;

public class TestMetricIdentifier {

  @Test
  public void builder() throws Exception {
    final MetricIdentifier metric = MetricIdentifier.newBuilder()
        .setNamespace("net")
        .setName("bytes.in")
        .setUnit("bytes")
        .setType(MetricType.COUNTER)
        .addLabel("host")
        .addLabel("ifName")
        .addRetentionPolicy(RetentionPolicy.parse("60:172800"))
        .build();
    assertEquals("net", metric.getNamespace());
    assertEquals("bytes.in", metric.getName());
    assertEquals("net.bytes.in", metric.key());
    assertEquals("bytes", metric.getUnit());
    assertEquals(MetricType.COUNTER, metric.getType());
    assertEquals(Arrays.asList("host", "ifName"), metric.getLabels());
    assertTrue(metric.hasLabel("host"));
    assertFalse(metric.hasLabel("dc"));
    assertEquals(1, metric.getRetentionPolicies().size());
  }
  
  @Test
  public void builderDefaultsAndErrors() throws Exception {
    final MetricIdentifier metric = MetricIdentifier.newBuilder()
        .setNamespace("sys")
        .setName("cpu")
        .build();
    assertEquals(MetricType.GAUGE, metric.getType());
    assertTrue(metric.getLabels().isEmpty());
    
    try {
      MetricIdentifier.newBuilder().setName("cpu").build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      MetricIdentifier.newBuilder().setNamespace("sys").build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      MetricIdentifier.newBuilder()
        .setNamespace("sys")
        .setName("cpu")
        .addLabel("host")
        .addLabel("host")
        .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void validateLabels() throws Exception {
    final MetricIdentifier metric = MetricIdentifier.newBuilder()
        .setNamespace("net")
        .setName("bytes")
        .setLabels(Arrays.asList("host", "ifName"))
        .build();
    metric.validateLabels(Arrays.asList("host"));
    metric.validateLabels(Collections.<String>emptyList());
    
    try {
      metric.validateLabels(Arrays.asList("host", "dc"));
      fail("Expected UndefinedLabelException");
    } catch (UndefinedLabelException e) {
      assertEquals("net.bytes", e.metric());
      assertEquals(Arrays.asList("dc"), e.undefinedLabels());
      assertEquals(Arrays.asList("host", "ifName"), e.allowedLabels());
      assertEquals("Undefined label(s): dc. Allowed labels for net.bytes: "
          + "host, ifName", e.getMessage());
      assertTrue(e instanceof QueryValidationException);
    }
  }
  
  @Test
  public void yaml() throws Exception {
    final String yaml = "namespace: net\n"
        + "name: bytes.in\n"
        + "unit: bytes\n"
        + "type: COUNTER\n"
        + "labels: [host, ifName]\n"
        + "aggregations: [avg, max]\n"
        + "retention_policies:\n"
        + "  - resolution: 60\n"
        + "    retention: 172800\n"
        + "    aggregator: max\n";
    final MetricIdentifier metric = 
        YAML.parseToObject(yaml, MetricIdentifier.class);
    assertEquals("net.bytes.in", metric.key());
    assertEquals(MetricType.COUNTER, metric.getType());
    assertEquals(Arrays.asList("host", "ifName"), metric.getLabels());
    assertEquals(Arrays.asList("avg", "max"), metric.getAggregations());
    assertEquals(2880, metric.getRetentionPolicies().get(0).rows());
    assertEquals("max", metric.getRetentionPolicies().get(0).getAggregator());
  }
  
  @Test
  public void ordering() throws Exception {
    final MetricIdentifier a = MetricIdentifier.newBuilder()
        .setNamespace("a").setName("z").build();
    final MetricIdentifier b = MetricIdentifier.newBuilder()
        .setNamespace("b").setName("a").build();
    assertTrue(a.compareTo(b) < 0);
    assertEquals(a, MetricIdentifier.newBuilder()
        .setNamespace("a").setName("z").build());
  }
}
