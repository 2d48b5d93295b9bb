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
import static org.junit.Assert.fail;

import java.util.Locale;

import org.junit.Test;

public class TestAggregation {

  @Test
  public void parse() throws Exception {
    assertEquals(AggregationFunction.AVG, Aggregation.parse("avg").function());
    assertEquals(AggregationFunction.AVG, Aggregation.parse("mean").function());
    assertEquals(AggregationFunction.MAX, Aggregation.parse("MAX").function());
    assertEquals(AggregationFunction.STDDEV, 
        Aggregation.parse("stddev").function());
    
    Aggregation agg = Aggregation.parse("percentile_95");
    assertEquals(AggregationFunction.PERCENTILE, agg.function());
    assertEquals(95, agg.percentile(), 0.001);
    assertEquals("percentile_95", agg.name());
    
    agg = Aggregation.parse("percentile");
    assertEquals(50, agg.percentile(), 0.001);
    agg = Aggregation.parse("percentile_abc");
    assertEquals(50, agg.percentile(), 0.001);
    agg = Aggregation.parse("percentile_99.9");
    assertEquals("percentile_99.9", agg.name());
  }
  
  @Test
  public void parseTurkishLocale() throws Exception {
    final Locale locale = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      assertEquals(AggregationFunction.MIN, Aggregation.parse("min").function());
      assertEquals(AggregationFunction.MIN, Aggregation.parse("MIN").function());
      assertEquals("min", Aggregation.parse("min").name());
      assertEquals(AggregationFunction.PERCENTILE, 
          Aggregation.parse("PERCENTILE_99").function());
    } finally {
      Locale.setDefault(locale);
    }
  }
  
  @Test
  public void parseErrors() throws Exception {
    String[] bad = new String[] { null, "", "average", "p95" };
    for (final String name : bad) {
      try {
        Aggregation.parse(name);
        fail("Expected IllegalArgumentException for " + name);
      } catch (IllegalArgumentException e) { }
    }
  }
  
  @Test
  public void percentileBounds() throws Exception {
    try {
      Aggregation.percentile(0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      Aggregation.percentile(101);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    assertEquals(Aggregation.percentile(90), Aggregation.parse("percentile_90"));
  }
  
  @Test
  public void consolidation() throws Exception {
    assertEquals(ConsolidationFunction.AVERAGE, 
        ConsolidationFunction.fromAggregator("avg"));
    assertEquals(ConsolidationFunction.MAX, 
        ConsolidationFunction.fromAggregator("max"));
    assertEquals(ConsolidationFunction.LAST, 
        ConsolidationFunction.fromAggregator("LAST"));
  }
}
