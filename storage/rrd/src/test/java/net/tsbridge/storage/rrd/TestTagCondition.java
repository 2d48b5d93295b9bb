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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import net.tsbridge.data.TagValue;
import net.tsbridge.exceptions.UnsupportedQueryOperationException;
import net.tsbridge.query.Filter;
import net.tsbridge.query.FilterOperator;

public class TestTagCondition {
  private static final Map<String, String> LABELS = 
      ImmutableMap.of("host", "web01", "ifName", "eth0");

  @Test
  public void equality() throws Exception {
    assertTrue(TagCondition.fromFilter(Filter.equal("host", "web01"))
        .matches(LABELS));
    assertFalse(TagCondition.fromFilter(Filter.equal("host", "web02"))
        .matches(LABELS));
    assertTrue(new TagCondition("host", FilterOperator.NOT_EQUALS, 
        Arrays.asList("web02")).matches(LABELS));
  }
  
  @Test
  public void missingLabelIsEmpty() throws Exception {
    assertTrue(TagCondition.fromFilter(Filter.equal("dc", ""))
        .matches(LABELS));
    assertTrue(new TagCondition("dc", FilterOperator.NOT_EQUALS, 
        Arrays.asList("lax")).matches(LABELS));
  }
  
  @Test
  public void regex() throws Exception {
    assertTrue(new TagCondition("ifName", FilterOperator.REGEX, 
        Arrays.asList("^eth")).matches(LABELS));
    assertTrue(new TagCondition("ifName", FilterOperator.REGEX, 
        Arrays.asList("th")).matches(LABELS));
    assertFalse(new TagCondition("ifName", FilterOperator.NOT_REGEX, 
        Arrays.asList("eth\\d")).matches(LABELS));
  }
  
  @Test
  public void in() throws Exception {
    assertTrue(TagCondition.fromFilter(Filter.in("ifName", "eth0", "eth1"))
        .matches(LABELS));
    assertFalse(new TagCondition("ifName", FilterOperator.NOT_IN, 
        Arrays.asList("eth0", "eth1")).matches(LABELS));
  }
  
  @Test
  public void matchesAll() throws Exception {
    assertTrue(TagCondition.matchesAll(null, LABELS));
    assertTrue(TagCondition.matchesAll(
        Collections.<TagCondition>emptyList(), LABELS));
    assertFalse(TagCondition.matchesAll(Arrays.asList(
        TagCondition.fromFilter(Filter.equal("host", "web01")),
        TagCondition.fromFilter(Filter.equal("ifName", "eth1"))), LABELS));
  }
  
  @Test
  public void numericRejected() throws Exception {
    try {
      TagCondition.fromFilter(Filter.newBuilder()
          .setKey("speed")
          .setOperator(FilterOperator.GREATER_THAN)
          .setValue(TagValue.of(1000L))
          .build());
      fail("Expected UnsupportedQueryOperationException");
    } catch (UnsupportedQueryOperationException e) { }
  }
  
  @Test
  public void ctorErrors() throws Exception {
    try {
      new TagCondition(null, FilterOperator.EQUALS, Arrays.asList("a"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new TagCondition("host", null, Arrays.asList("a"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new TagCondition("host", FilterOperator.EQUALS, 
          Collections.<String>emptyList());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void equalsAndString() throws Exception {
    final TagCondition a = TagCondition.fromFilter(Filter.in("ifName", "eth0"));
    final TagCondition b = new TagCondition("ifName", FilterOperator.IN, 
        Arrays.asList("eth0"));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertEquals("ifName in [eth0]", a.toString());
  }
}
