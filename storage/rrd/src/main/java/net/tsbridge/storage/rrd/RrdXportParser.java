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

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import net.tsbridge.data.Resolution;
import net.tsbridge.data.TimeRange;
import net.tsbridge.data.TimeSeries;
import net.tsbridge.data.TimeSeriesValue;
import net.tsbridge.exceptions.OutputParseException;
import net.tsbridge.query.QueryResult;
import net.tsbridge.query.ResultParser;
import net.tsbridge.utils.JSON;

/**
 * Parses the JSON written by {@code rrdtool xport --json}. rrdtool emits 
 * unquoted keys and single quoted strings which the shared lenient mapper
 * accepts. Each legend becomes one series named after the legend; rows 
 * are timestamped {@code start + i * step} unless they carry the time as
 * an extra leading column. NaN and null values become null.
 * 
 * @since 1.0
 */
public class RrdXportParser implements ResultParser<String> {

  @Override
  public List<TimeSeries> parse(final String raw) {
    return parseResult(raw).series();
  }
  
  /**
   * Parses the output including the window honored by rrdtool.
   * @param raw The raw output.
   * @return The result.
   * @throws OutputParseException if the output was not an xport document.
   */
  public QueryResult parseResult(final String raw) {
    if (Strings.isNullOrEmpty(raw)) {
      throw new OutputParseException("Empty rrdtool xport output", raw);
    }
    final JsonNode root;
    try {
      root = JSON.parseToTree(raw);
    } catch (IllegalArgumentException e) {
      throw new OutputParseException("Invalid rrdtool xport JSON", raw, e);
    }
    final JsonNode meta = root.get("meta");
    if (meta == null || !meta.has("start") || !meta.has("end") || 
        !meta.has("step") || !meta.path("legend").isArray()) {
      throw new OutputParseException("Missing xport meta block", raw);
    }
    final long start = meta.get("start").asLong();
    final long end = meta.get("end").asLong();
    final long step = meta.get("step").asLong();
    if (step <= 0) {
      throw new OutputParseException("Invalid xport step " + step, raw);
    }
    
    final JsonNode legend = meta.get("legend");
    final List<String> names = Lists.newArrayListWithCapacity(legend.size());
    final List<List<TimeSeriesValue>> values = 
        Lists.newArrayListWithCapacity(legend.size());
    for (final JsonNode name : legend) {
      names.add(name.asText());
      values.add(Lists.<TimeSeriesValue>newArrayList());
    }
    
    final JsonNode data = root.path("data");
    if (!data.isArray()) {
      throw new OutputParseException("Missing xport data block", raw);
    }
    long timestamp = start;
    for (final JsonNode row : data) {
      if (!row.isArray()) {
        throw new OutputParseException("Xport row was not an array: " + row, 
            raw);
      }
      final int offset;
      if (row.size() == names.size()) {
        offset = 0;
      } else if (row.size() == names.size() + 1) {
        offset = 1;
        timestamp = row.get(0).asLong();
      } else {
        throw new OutputParseException("Xport row had " + row.size() 
            + " columns but " + names.size() + " legends", raw);
      }
      for (int i = 0; i < names.size(); i++) {
        values.get(i).add(new TimeSeriesValue(timestamp, 
            toValue(row.get(i + offset), raw)));
      }
      timestamp += step;
    }
    
    final List<TimeSeries> series = Lists.newArrayListWithCapacity(
        names.size());
    for (int i = 0; i < names.size(); i++) {
      series.add(TimeSeries.newBuilder()
          .setMetric(names.get(i))
          .setAlias(names.get(i))
          .setValues(values.get(i))
          .build());
    }
    return new QueryResult(series, TimeRange.between(start, end), 
        Resolution.seconds(step));
  }
  
  private static Double toValue(final JsonNode node, final String raw) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      final double value = node.asDouble();
      return Double.isNaN(value) ? null : value;
    }
    final String text = node.asText();
    if (text.equalsIgnoreCase("nan") || text.isEmpty()) {
      return null;
    }
    try {
      final double value = Double.parseDouble(text);
      return Double.isNaN(value) ? null : value;
    } catch (NumberFormatException e) {
      throw new OutputParseException("Invalid xport value: " + text, raw, e);
    }
  }
}
