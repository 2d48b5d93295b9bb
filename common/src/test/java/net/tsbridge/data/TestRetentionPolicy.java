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
import static org.junit.Assert.fail;

import org.junit.Test;

public class TestRetentionPolicy {

  @Test
  public void builder() throws Exception {
    final RetentionPolicy policy = RetentionPolicy.newBuilder()
        .setResolution(60)
        .setRetention(172800)
        .build();
    assertEquals(60, policy.getResolution());
    assertEquals(172800, policy.getRetention());
    assertEquals(RetentionPolicy.DEFAULT_AGGREGATOR, policy.getAggregator());
    assertEquals(2880, policy.rows());
    assertEquals("60s_172800s", policy.getName());
  }
  
  @Test
  public void invariants() throws Exception {
    try {
      RetentionPolicy.newBuilder().setResolution(0).setRetention(60).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      RetentionPolicy.newBuilder().setResolution(60).setRetention(30).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void parse() throws Exception {
    RetentionPolicy policy = RetentionPolicy.parse("300:1209600");
    assertEquals(300, policy.getResolution());
    assertEquals(4032, policy.rows());
    
    policy = RetentionPolicy.parse("1h:365d:max");
    assertEquals(3600, policy.getResolution());
    assertEquals(31536000, policy.getRetention());
    assertEquals("max", policy.getAggregator());
    
    String[] bad = new String[] { null, "", "60", "60:120:avg:extra", 
        "x:120" };
    for (final String spec : bad) {
      try {
        RetentionPolicy.parse(spec);
        fail("Expected IllegalArgumentException for " + spec);
      } catch (IllegalArgumentException e) { }
    }
  }
}
