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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.longThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.File;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.ArgumentCaptor;

import com.google.common.collect.ImmutableMap;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.data.MetricType;
import net.tsbridge.data.RetentionPolicy;
import net.tsbridge.data.TimeSeriesDatum;
import net.tsbridge.exceptions.ExecutionTimeoutException;
import net.tsbridge.exceptions.RemoteQueryExecutionException;
import net.tsbridge.exceptions.UndefinedLabelException;
import net.tsbridge.storage.WriteStatus;
import net.tsbridge.storage.WriteStatus.WriteState;

public class TestRrdWriter {
  private static final MetricIdentifier METRIC = MetricIdentifier.newBuilder()
      .setNamespace("net")
      .setName("bytes_in")
      .setType(MetricType.COUNTER)
      .addLabel("host")
      .build();
  private static final List<RetentionPolicy> DEFAULTS = Arrays.asList(
      RetentionPolicy.parse("60:172800"));
  private static final String PATH = "net/bytes_in/host=a.rrd";
  
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();
  
  private LabelStrategy strategy;
  private RrdExecutor executor;
  private RrdWriter writer;
  
  @Before
  public void before() throws Exception {
    strategy = new FilenameLabelStrategy(folder.getRoot().getAbsolutePath(), 
        null, false);
    executor = mock(RrdExecutor.class);
    when(executor.endpoint()).thenReturn("rrdtool");
    writer = new RrdWriter(strategy, executor, 
        folder.getRoot().getAbsolutePath(), DEFAULTS);
  }
  
  @Test
  public void write() throws Exception {
    final WriteStatus status = writer.write(datum(METRIC, 42), 1000);
    assertSame(WriteStatus.OK, status);
    verify(executor, times(1)).execute(
        eq(RrdCommandBuilder.update(PATH, 1700000000L, 
            Arrays.asList(datum(METRIC, 42).value()))), within(1000));
  }
  
  @Test
  public void writeCreatesMissingArchive() throws Exception {
    when(executor.execute(any(RrdCommand.class), anyLong()))
      .thenThrow(new RrdFileNotFoundException("opening '" + PATH 
          + "': No such file or directory", "rrdtool"))
      .thenReturn("")
      .thenReturn("");
    
    assertEquals(WriteState.OK, writer.write(datum(METRIC, 42), 1000).state());
    verify(executor, times(2)).execute(eq(RrdCommandBuilder.update(PATH, 
        1700000000L, Arrays.asList(datum(METRIC, 42).value()))), within(1000));
    verify(executor, times(1)).execute(eq(RrdCommandBuilder.create(PATH, 
        ImmutableMap.of("value", MetricType.COUNTER), DEFAULTS)), within(1000));
    assertTrue(new File(folder.getRoot(), "net/bytes_in").isDirectory());
  }
  
  @Test
  public void writeCreatesWithMetricPolicies() throws Exception {
    final MetricIdentifier metric = MetricIdentifier.newBuilder()
        .setNamespace("net")
        .setName("bytes_in")
        .addLabel("host")
        .addRetentionPolicy(RetentionPolicy.parse("300:1209600"))
        .build();
    when(executor.execute(any(RrdCommand.class), anyLong()))
      .thenThrow(new RrdFileNotFoundException("No such file", "rrdtool"))
      .thenReturn("");
    
    assertEquals(WriteState.OK, writer.write(datum(metric, 1), 1000).state());
    verify(executor).execute(eq(RrdCommandBuilder.create(PATH, 
        ImmutableMap.of("value", MetricType.GAUGE), 
        metric.getRetentionPolicies())), within(1000));
  }
  
  @Test
  public void writeTimeout() throws Exception {
    when(executor.execute(any(RrdCommand.class), anyLong()))
      .thenThrow(new ExecutionTimeoutException("Timed out", 1000));
    final WriteStatus status = writer.write(datum(METRIC, 42), 1000);
    assertEquals(WriteState.UNKNOWN, status.state());
    assertTrue(status.exception() instanceof ExecutionTimeoutException);
  }
  
  @Test
  public void writeError() throws Exception {
    when(executor.execute(any(RrdCommand.class), anyLong()))
      .thenThrow(new RemoteQueryExecutionException("ERROR: illegal attempt "
          + "to update using time 1700000000", "rrdtool", 500));
    final WriteStatus status = writer.write(datum(METRIC, 42), 1000);
    assertEquals(WriteState.ERROR, status.state());
    assertTrue(status.message().contains("illegal attempt"));
  }
  
  @Test
  public void writeUnsupportedType() throws Exception {
    final MetricIdentifier metric = MetricIdentifier.newBuilder()
        .setNamespace("net")
        .setName("bytes_in")
        .setType(MetricType.HISTOGRAM)
        .addLabel("host")
        .build();
    when(executor.execute(any(RrdCommand.class), anyLong()))
      .thenThrow(new RrdFileNotFoundException("No such file", "rrdtool"));
    assertEquals(WriteState.REJECTED, 
        writer.write(datum(metric, 1), 1000).state());
    verify(executor, times(1)).execute(any(RrdCommand.class), anyLong());
  }
  
  @Test
  public void writeUndefinedLabel() throws Exception {
    try {
      writer.write(TimeSeriesDatum.newBuilder()
          .setMetric(METRIC)
          .setLabels(ImmutableMap.of("dc", "lax"))
          .setValue(1L)
          .setTimestamp(1700000000L)
          .build(), 1000);
      fail("Expected UndefinedLabelException");
    } catch (UndefinedLabelException e) { }
    verify(executor, never()).execute(any(RrdCommand.class), anyLong());
  }
  
  @Test
  public void writeBatch() throws Exception {
    when(executor.execute(any(RrdCommand.class), anyLong()))
      .thenReturn("")
      .thenThrow(new ExecutionTimeoutException("Timed out", 1000))
      .thenReturn("");
    final List<WriteStatus> statuses = writer.write(Arrays.asList(
        datum(METRIC, 1), datum(METRIC, 2), datum(METRIC, 3)), 1000);
    assertEquals(3, statuses.size());
    assertEquals(WriteState.OK, statuses.get(0).state());
    assertEquals(WriteState.UNKNOWN, statuses.get(1).state());
    assertEquals(WriteState.OK, statuses.get(2).state());
  }
  
  @Test
  public void writeBatchUndefinedLabel() throws Exception {
    final TimeSeriesDatum undeclared = TimeSeriesDatum.newBuilder()
        .setMetric(METRIC)
        .setLabels(ImmutableMap.of("dc", "lax"))
        .setValue(1L)
        .setTimestamp(1700000000L)
        .build();
    try {
      writer.write(Arrays.asList(datum(METRIC, 1), undeclared, 
          datum(METRIC, 3)), 1000);
      fail("Expected UndefinedLabelException");
    } catch (UndefinedLabelException e) { }
    verify(executor, never()).execute(any(RrdCommand.class), anyLong());
  }
  
  @Test
  public void writeSharesDeadline() throws Exception {
    when(executor.execute(any(RrdCommand.class), anyLong()))
      .thenAnswer(invocation -> {
        Thread.sleep(50);
        throw new RrdFileNotFoundException("No such file", "rrdtool");
      })
      .thenReturn("")
      .thenReturn("");
    
    assertEquals(WriteState.OK, writer.write(datum(METRIC, 42), 1000).state());
    final ArgumentCaptor<Long> timeouts = ArgumentCaptor.forClass(Long.class);
    verify(executor, times(3)).execute(any(RrdCommand.class), 
        timeouts.capture());
    assertEquals(1000, (long) timeouts.getAllValues().get(0), 50);
    assertTrue(timeouts.getAllValues().get(1) <= 950);
    assertTrue(timeouts.getAllValues().get(2) <= 950);
  }
  
  @Test
  public void writeBatchDeadlineExpired() throws Exception {
    when(executor.execute(any(RrdCommand.class), anyLong()))
      .thenAnswer(invocation -> {
        Thread.sleep(30);
        return "";
      });
    final List<WriteStatus> statuses = writer.write(Arrays.asList(
        datum(METRIC, 1), datum(METRIC, 2)), 10);
    assertEquals(WriteState.OK, statuses.get(0).state());
    assertEquals(WriteState.RETRY, statuses.get(1).state());
    verify(executor, times(1)).execute(any(RrdCommand.class), anyLong());
  }
  
  @Test
  public void ctor() throws Exception {
    try {
      new RrdWriter(null, executor, null, DEFAULTS);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new RrdWriter(strategy, null, null, DEFAULTS);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new RrdWriter(strategy, executor, null, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  private static TimeSeriesDatum datum(final MetricIdentifier metric, 
                                       final long value) {
    return TimeSeriesDatum.newBuilder()
        .setMetric(metric)
        .setLabels(ImmutableMap.of("host", "a"))
        .setValue(value)
        .setTimestamp(1700000000L)
        .build();
  }
  
  /** Matches a timeout taken from a deadline of the given length. */
  private static long within(final long timeout_ms) {
    return longThat(timeout -> timeout > 0 && timeout <= timeout_ms);
  }
}
