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
import java.util.Map;
import java.util.SortedMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.Maps;

import net.tsbridge.exceptions.OutputParseException;

/**
 * Parses the line oriented text of {@code rrdtool info}. The five header 
 * lines are matched as a block before any other line is read and every 
 * remaining line must be a data source, archive or preparation cell line.
 * Any deviation rejects the whole document.
 * 
 * @since 1.0
 */
public class RrdInfoParser {
  
  private static final Pattern HEADER = Pattern.compile(
      "\\Afilename\\s*=\\s*\"([^\"]+)\"\\R"
      + "rrd_version\\s*=\\s*\"([^\"]+)\"\\R"
      + "step\\s*=\\s*(\\d+)\\R"
      + "last_update\\s*=\\s*(\\d+)\\R"
      + "header_size\\s*=\\s*(\\d+)(?:\\R|\\z)");
  
  private static final Pattern DS_LINE = Pattern.compile(
      "^ds\\[([^\\]]+)\\]\\.([a-z_]+)\\s*=\\s*(.+)$");
  
  private static final Pattern RRA_LINE = Pattern.compile(
      "^rra\\[(\\d+)\\]\\.([a-z_]+)\\s*=\\s*(.+)$");
  
  private static final Pattern CDP_LINE = Pattern.compile(
      "^rra\\[(\\d+)\\]\\.cdp_prep\\[(\\d+)\\]\\.([a-z_]+)\\s*=\\s*(.+)$");
  
  /**
   * Parses the output.
   * @param output The raw output.
   * @return The parsed info.
   * @throws OutputParseException if the output was empty or did not 
   * follow the grammar.
   */
  public RrdInfo parse(final String output) {
    if (Strings.isNullOrEmpty(output)) {
      throw new OutputParseException("Empty rrdtool info output", output);
    }
    final String trimmed = output.trim();
    final Matcher header = HEADER.matcher(trimmed);
    if (!header.lookingAt()) {
      throw new OutputParseException("Malformed rrdtool info header", output);
    }
    
    final Map<String, Map<String, Object>> data_sources = Maps.newTreeMap();
    final SortedMap<Integer, Map<String, Object>> rra_fields = 
        Maps.newTreeMap();
    final SortedMap<Integer, SortedMap<Integer, Map<String, Object>>> cdp = 
        Maps.newTreeMap();
    
    final List<String> lines = Splitter.onPattern("\\R")
        .splitToList(trimmed.substring(header.end()));
    for (final String raw : lines) {
      final String line = raw.trim();
      if (line.isEmpty()) {
        continue;
      }
      Matcher matcher = CDP_LINE.matcher(line);
      if (matcher.matches()) {
        final int rra = Integer.parseInt(matcher.group(1));
        rra_fields.computeIfAbsent(rra, k -> Maps.newTreeMap());
        cdp.computeIfAbsent(rra, k -> Maps.newTreeMap())
          .computeIfAbsent(Integer.parseInt(matcher.group(2)), 
              k -> Maps.newTreeMap())
          .put(matcher.group(3), scalar(matcher.group(4), output));
        continue;
      }
      matcher = RRA_LINE.matcher(line);
      if (matcher.matches()) {
        rra_fields.computeIfAbsent(Integer.parseInt(matcher.group(1)), 
            k -> Maps.newTreeMap())
          .put(matcher.group(2), scalar(matcher.group(3), output));
        continue;
      }
      matcher = DS_LINE.matcher(line);
      if (matcher.matches()) {
        data_sources.computeIfAbsent(matcher.group(1), k -> Maps.newTreeMap())
          .put(matcher.group(2), scalar(matcher.group(3), output));
        continue;
      }
      throw new OutputParseException("Unexpected line in rrdtool info "
          + "output: " + line, output);
    }
    
    final SortedMap<Integer, RraInfo> archives = Maps.newTreeMap();
    for (final Map.Entry<Integer, Map<String, Object>> entry : 
        rra_fields.entrySet()) {
      final SortedMap<Integer, Map<String, Object>> cells = 
          cdp.get(entry.getKey());
      archives.put(entry.getKey(), new RraInfo(entry.getValue(), 
          cells == null ? Maps.<Integer, Map<String, Object>>newTreeMap() : 
            cells));
    }
    return new RrdInfo(
        header.group(1), 
        header.group(2), 
        Long.parseLong(header.group(3)), 
        Long.parseLong(header.group(4)), 
        Long.parseLong(header.group(5)), 
        data_sources, 
        archives);
  }
  
  /**
   * Coerces a value: quoted strings are unquoted, {@code NaN} becomes 
   * {@link Double#NaN}, values with a decimal point or exponent become 
   * Doubles and everything else a Long.
   * @param value The raw value.
   * @param output The whole document for errors.
   * @return The typed value.
   * @throws OutputParseException if the value was not a number.
   */
  static Object scalar(final String value, final String output) {
    final String trimmed = value.trim();
    if (trimmed.length() >= 2 && trimmed.startsWith("\"") && 
        trimmed.endsWith("\"")) {
      return trimmed.substring(1, trimmed.length() - 1);
    }
    if (trimmed.equalsIgnoreCase("NaN") || trimmed.equalsIgnoreCase("-nan")) {
      return Double.NaN;
    }
    try {
      if (trimmed.indexOf('.') >= 0 || trimmed.indexOf('e') >= 0 || 
          trimmed.indexOf('E') >= 0) {
        return Double.parseDouble(trimmed);
      }
      return Long.parseLong(trimmed);
    } catch (NumberFormatException e) {
      throw new OutputParseException("Invalid value in rrdtool info output: " 
          + value, output, e);
    }
  }
}
