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

import java.util.Map.Entry;

import com.google.common.base.Strings;

import net.tsbridge.data.TagValue;
import net.tsbridge.data.TimeSeriesDatum;

/**
 * Renders data points in the InfluxDB line protocol, 
 * {@code measurement,tag=value field=value timestamp}, with the metric key
 * as the measurement and the timestamp in seconds. Datum labels are 
 * sorted so tags are written in key order.
 * 
 * @since 1.0
 */
public class LineProtocolWriter {
  
  private final String field;
  
  /** Ctor writing to the default field. */
  public LineProtocolWriter() {
    this(FluxCompiler.DEFAULT_FIELD);
  }
  
  /**
   * Default ctor.
   * @param field The non-null and non-empty field name.
   */
  public LineProtocolWriter(final String field) {
    if (Strings.isNullOrEmpty(field)) {
      throw new IllegalArgumentException("Field cannot be null or empty.");
    }
    this.field = field;
  }
  
  /**
   * Formats a single point.
   * @param datum The non-null datum.
   * @return The line without a trailing newline.
   * @throws IllegalArgumentException if the value is null, NaN or infinite
   * as line protocol cannot represent them.
   * @throws net.tsbridge.exceptions.UndefinedLabelException if the datum 
   * uses labels its metric did not declare.
   */
  public String format(final TimeSeriesDatum datum) {
    datum.metric().validateLabels(datum.labels().keySet());
    final StringBuilder buf = new StringBuilder()
        .append(escapeMeasurement(datum.metric().key()));
    for (final Entry<String, String> tag : datum.labels().entrySet()) {
      // empty tag values are invalid and mean "unset"
      if (Strings.isNullOrEmpty(tag.getValue())) {
        continue;
      }
      buf.append(',')
         .append(escapeTag(tag.getKey()))
         .append('=')
         .append(escapeTag(tag.getValue()));
    }
    return buf.append(' ')
              .append(escapeTag(field))
              .append('=')
              .append(fieldValue(datum.value()))
              .append(' ')
              .append(datum.timestamp())
              .toString();
  }
  
  /**
   * @param value A non-null value.
   * @return The value in line protocol syntax.
   */
  static String fieldValue(final TagValue value) {
    switch (value.type()) {
    case INT:
      return value.asLong() + "i";
    case FLOAT:
      if (Double.isNaN(value.asDouble()) || 
          Double.isInfinite(value.asDouble())) {
        throw new IllegalArgumentException("Line protocol cannot represent " 
            + value.asDouble());
      }
      return TagValue.formatDouble(value.asDouble());
    case BOOL:
      return value.asBoolean() ? "true" : "false";
    case STRING:
      return "\"" + value.asString().replace("\\", "\\\\")
          .replace("\"", "\\\"") + "\"";
    default:
      throw new IllegalArgumentException("Null values cannot be written.");
    }
  }
  
  static String escapeMeasurement(final String measurement) {
    return measurement.replace(",", "\\,").replace(" ", "\\ ");
  }
  
  static String escapeTag(final String tag) {
    return tag.replace(",", "\\,").replace("=", "\\=").replace(" ", "\\ ");
  }
}
