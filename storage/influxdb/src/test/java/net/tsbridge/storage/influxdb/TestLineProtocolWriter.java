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
package net.tsbridge.storage.influxdb;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.data.TagValue;
import net.tsbridge.data.TimeSeriesDatum;
import net.tsbridge.exceptions.UndefinedLabelException;

public class TestLineProtocolWriter {
  private static final MetricIdentifier METRIC = MetricIdentifier.newBuilder()
      .setNamespace("net")
      .setName("bytes.in")
      .addLabel("host")
      .addLabel("rack id")
      .build();
  
  private final LineProtocolWriter writer = new LineProtocolWriter();
  
  @Test
  public void ctor() throws Exception {
    try {
      new LineProtocolWriter("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void format() throws Exception {
    assertEquals("net.bytes.in,host=web01,rack\\ id=a\\,b\\=c "
        + "value=1.5 1700000000", writer.format(datum(
            ImmutableMap.of("rack id", "a,b=c", "host", "web01"), 
            TagValue.of(1.5))));
  }
  
  @Test
  public void formatTypes() throws Exception {
    assertEquals("net.bytes.in value=42i 1700000000", writer.format(
        datum(null, TagValue.of(42L))));
    assertEquals("net.bytes.in value=2 1700000000", writer.format(
        datum(null, TagValue.of(2.0))));
    assertEquals("net.bytes.in value=true 1700000000", writer.format(
        datum(null, TagValue.of(true))));
  }
  
  @Test
  public void formatEmptyTagValue() throws Exception {
    assertEquals("net.bytes.in,host=web01 value=1 1700000000", writer.format(
        datum(ImmutableMap.of("host", "web01", "rack id", ""),
            TagValue.of(1.0))));
  }
  
  @Test
  public void formatCustomField() throws Exception {
    assertEquals("net.bytes.in samples=1 1700000000", 
        new LineProtocolWriter("samples").format(
            datum(null, TagValue.of(1.0))));
  }
  
  @Test
  public void escapeMeasurement() throws Exception {
    final MetricIdentifier metric = MetricIdentifier.newBuilder()
        .setNamespace("my ns")
        .setName("a,b=c")
        .build();
    assertEquals("my\\ ns.a\\,b=c value=1i 10", writer.format(
        TimeSeriesDatum.newBuilder()
          .setMetric(metric)
          .setValue(1L)
          .setTimestamp(10)
          .build()));
  }
  
  @Test
  public void undeclaredLabel() throws Exception {
    try {
      writer.format(datum(ImmutableMap.of("dc", "lax"), TagValue.of(1.0)));
      fail("Expected UndefinedLabelException");
    } catch (UndefinedLabelException e) { }
  }
  
  @Test
  public void notRepresentable() throws Exception {
    try {
      writer.format(datum(null, TagValue.of(Double.NaN)));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      writer.format(datum(null, TagValue.of(Double.POSITIVE_INFINITY)));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void fieldValue() throws Exception {
    assertEquals("\"say \\\"hi\\\" c:\\\\\"", LineProtocolWriter.fieldValue(
        TagValue.of("say \"hi\" c:\\")));
    assertEquals("-7i", LineProtocolWriter.fieldValue(TagValue.of(-7L)));
    assertEquals("0.25", LineProtocolWriter.fieldValue(TagValue.of(0.25)));
    try {
      LineProtocolWriter.fieldValue(TagValue.nullValue());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  private static TimeSeriesDatum datum(final Map<String, String> labels, 
                                       final TagValue value) {
    return TimeSeriesDatum.newBuilder()
        .setMetric(METRIC)
        .setLabels(labels)
        .setValue(value)
        .setTimestamp(1700000000)
        .build();
  }
}
