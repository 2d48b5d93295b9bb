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
package net.tsbridge.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.data.TimeSeriesDatum;
import net.tsbridge.exceptions.UndefinedLabelException;
import net.tsbridge.storage.TimeSeriesWriter;
import net.tsbridge.storage.WriteStatus;
import net.tsbridge.storage.WriteStatus.WriteState;

public class TestAggregateWriter {
  private static final MetricIdentifier METRIC = MetricIdentifier.newBuilder()
      .setNamespace("sys")
      .setName("cpu")
      .addLabel("host")
      .build();
  private static final TimeSeriesDatum DATUM = TimeSeriesDatum.newBuilder()
      .setMetric(METRIC)
      .setLabels(ImmutableMap.of("host", "web01"))
      .setValue(42.5)
      .build();
  
  private TimeSeriesWriter rrd;
  private TimeSeriesWriter influx;
  private AggregateWriter writer;
  
  @Before
  public void before() throws Exception {
    rrd = mock(TimeSeriesWriter.class);
    influx = mock(TimeSeriesWriter.class);
    writer = new AggregateWriter(Arrays.asList("rrd", "influxdb"), 
        Arrays.asList(rrd, influx));
  }
  
  @Test
  public void ctor() throws Exception {
    try {
      new AggregateWriter(Arrays.<String>asList(), 
          Arrays.<TimeSeriesWriter>asList());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new AggregateWriter(Arrays.asList("rrd"), Arrays.asList(rrd, influx));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void writeAllOk() throws Exception {
    when(rrd.write(anyList(), anyLong()))
      .thenReturn(Arrays.asList(WriteStatus.ok(), WriteStatus.ok()));
    when(influx.write(anyList(), anyLong()))
      .thenReturn(Arrays.asList(WriteStatus.ok(), WriteStatus.ok()));
    
    final List<WriteStatus> statuses = writer.write(
        Arrays.asList(DATUM, DATUM), 1000);
    assertEquals(2, statuses.size());
    assertSame(WriteStatus.OK, statuses.get(0));
    assertSame(WriteStatus.OK, statuses.get(1));
    verify(rrd).write(anyList(), anyLong());
    verify(influx).write(anyList(), anyLong());
  }
  
  @Test
  public void writeSingle() throws Exception {
    when(rrd.write(anyList(), anyLong()))
      .thenReturn(Arrays.asList(WriteStatus.ok()));
    when(influx.write(anyList(), anyLong()))
      .thenReturn(Arrays.asList(WriteStatus.retry("Throttled")));
    
    final WriteStatus status = writer.write(DATUM, 1000);
    assertEquals(WriteState.RETRY, status.state());
    assertEquals("influxdb: RETRY Throttled", status.message());
  }
  
  @Test
  public void writeMergesPerPoint() throws Exception {
    final Exception ex = new IllegalStateException("Boo!");
    when(rrd.write(anyList(), anyLong()))
      .thenReturn(Arrays.asList(WriteStatus.ok(), 
          WriteStatus.error("Disk full", ex), 
          WriteStatus.retry("Locked")));
    when(influx.write(anyList(), anyLong()))
      .thenReturn(Arrays.asList(WriteStatus.ok(), 
          WriteStatus.rejected("Bad field"), 
          WriteStatus.unknown("Timeout", null)));
    
    final List<WriteStatus> statuses = writer.write(
        Arrays.asList(DATUM, DATUM, DATUM), 1000);
    assertEquals(WriteState.OK, statuses.get(0).state());
    
    assertEquals(WriteState.REJECTED, statuses.get(1).state());
    assertEquals("rrd: ERROR Disk full; influxdb: REJECTED Bad field", 
        statuses.get(1).message());
    
    assertEquals(WriteState.UNKNOWN, statuses.get(2).state());
    assertEquals("rrd: RETRY Locked; influxdb: UNKNOWN Timeout", 
        statuses.get(2).message());
  }
  
  @Test
  public void writeDelegateThrows() throws Exception {
    final RuntimeException ex = new IllegalStateException("Boo!");
    when(rrd.write(anyList(), anyLong())).thenThrow(ex);
    when(influx.write(anyList(), anyLong()))
      .thenReturn(Arrays.asList(WriteStatus.ok()));
    
    final WriteStatus status = writer.write(DATUM, 1000);
    assertEquals(WriteState.ERROR, status.state());
    assertSame(ex, status.exception());
    assertTrue(status.message().startsWith("rrd: ERROR"));
    verify(influx).write(anyList(), anyLong());
  }
  
  @Test
  public void writeValidationThrows() throws Exception {
    when(rrd.write(anyList(), anyLong())).thenThrow(
        new UndefinedLabelException("sys.cpu", Arrays.asList("dc"), 
            Arrays.asList("host")));
    try {
      writer.write(DATUM, 1000);
      fail("Expected UndefinedLabelException");
    } catch (UndefinedLabelException e) { }
    verify(influx, never()).write(anyList(), anyLong());
  }
  
  @Test
  public void writeDeadlineExpired() throws Exception {
    when(rrd.write(anyList(), anyLong())).thenAnswer(invocation -> {
      Thread.sleep(30);
      return Arrays.asList(WriteStatus.ok());
    });
    
    final WriteStatus status = writer.write(DATUM, 10);
    assertEquals(WriteState.RETRY, status.state());
    assertTrue(status.message().startsWith("influxdb: RETRY"));
    assertNull(status.exception());
    verify(influx, never()).write(anyList(), anyLong());
  }
  
  @Test
  public void writeStatusCountMismatch() throws Exception {
    when(rrd.write(anyList(), anyLong()))
      .thenReturn(Arrays.asList(WriteStatus.ok(), WriteStatus.ok()));
    try {
      writer.write(DATUM, 1000);
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
  }
}
