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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class TestTimeRange {
  private static final long NOW = 1704067200L;
  
  @Test
  public void durationOnly() throws Exception {
    final TimeRange range = TimeRange.newBuilder()
        .setDuration("1h")
        .setNow(NOW)
        .build();
    assertEquals(NOW - 3600, range.getStart());
    assertEquals(NOW, range.getEnd());
    assertEquals(3600, range.getDuration());
    assertTrue(range.isRelative());
    assertEquals("1h", range.relativeDuration());
  }
  
  @Test
  public void startOnly() throws Exception {
    final TimeRange range = TimeRange.newBuilder()
        .setStart(NOW - 60)
        .setNow(NOW)
        .build();
    assertEquals(NOW - 60, range.getStart());
    assertEquals(NOW, range.getEnd());
    assertFalse(range.isRelative());
    assertNull(range.relativeDuration());
  }
  
  @Test
  public void endOnly() throws Exception {
    try {
      TimeRange.newBuilder().setEnd(NOW).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void nothingSet() throws Exception {
    try {
      TimeRange.newBuilder().build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void startAndDuration() throws Exception {
    final TimeRange range = TimeRange.newBuilder()
        .setStart(NOW)
        .setDurationSeconds(600)
        .build();
    assertEquals(NOW, range.getStart());
    assertEquals(NOW + 600, range.getEnd());
  }
  
  @Test
  public void endAndDuration() throws Exception {
    final TimeRange range = TimeRange.newBuilder()
        .setEnd(NOW)
        .setDuration("10m")
        .build();
    assertEquals(NOW - 600, range.getStart());
    assertEquals(NOW, range.getEnd());
    assertFalse(range.isRelative());
  }
  
  @Test
  public void allThree() throws Exception {
    TimeRange range = TimeRange.newBuilder()
        .setStart(NOW - 600)
        .setEnd(NOW)
        .setDurationSeconds(601)
        .build();
    assertEquals(600, range.getDuration());
    
    try {
      TimeRange.newBuilder()
          .setStart(NOW - 600)
          .setEnd(NOW)
          .setDurationSeconds(900)
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void startAfterEnd() throws Exception {
    try {
      TimeRange.between(NOW, NOW - 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void helpers() throws Exception {
    assertEquals(300, TimeRange.lastMinutes(5).getDuration());
    assertEquals(7200, TimeRange.lastHours(2).getDuration());
    assertEquals(86400, TimeRange.lastDays(1).getDuration());
    assertTrue(TimeRange.lastHours(2).isRelative());
    
    final TimeRange range = TimeRange.between(NOW - 60, NOW);
    assertEquals(NOW - 60, range.getStart());
    assertEquals(NOW, range.getEnd());
    assertEquals(range, TimeRange.between(NOW - 60, NOW));
  }
}
