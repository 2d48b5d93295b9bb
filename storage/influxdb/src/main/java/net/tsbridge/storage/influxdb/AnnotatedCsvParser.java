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

import java.io.StringReader;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import com.univocity.parsers.csv.UnescapedQuoteHandling;

import net.tsbridge.data.TimeSeries;
import net.tsbridge.data.TimeSeriesValue;
import net.tsbridge.exceptions.OutputParseException;
import net.tsbridge.exceptions.RemoteQueryExecutionException;
import net.tsbridge.query.ResultParser;
import net.tsbridge.utils.DateTime;

/**
 * Parses the annotated CSV returned by Flux queries. Annotation rows start
 * with {@code #}, a header row names the columns and a blank line or a new
 * header starts another table. Rows are grouped into a series per 
 * {@code (result, table)} pair. Columns starting with an underscore are 
 * Flux's own, the remaining columns apart from {@code result} and 
 * {@code table} are the series labels.
 * 
 * @since 1.0
 */
public class AnnotatedCsvParser implements ResultParser<String> {
  
  public static final String TIME = "_time";
  public static final String VALUE = "_value";
  public static final String MEASUREMENT = "_measurement";
  static final String RESULT = "result";
  static final String TABLE = "table";
  static final String ERROR = "error";
  static final String DEFAULT_ANNOTATION = "#default";
  
  @Override
  public List<TimeSeries> parse(final String raw) {
    return parse(raw, null);
  }
  
  /**
   * Parses the series of a compiled query, naming them after the query's
   * metric and alias.
   * @param raw The raw CSV.
   * @param query An optional query, may be null in which case series are
   * named after their measurement.
   * @return The series in the order their tables appeared.
   * @throws OutputParseException if the CSV was malformed.
   * @throws RemoteQueryExecutionException if the server reported an error
   * in the body.
   */
  public List<TimeSeries> parse(final String raw, final FluxQuery query) {
    final Map<String, Table> tables = Maps.newLinkedHashMap();
    for (final Row row : rows(raw)) {
      final String time = row.get(TIME);
      if (time == null) {
        throw new OutputParseException("Missing " + TIME + " column", raw);
      }
      final String key = row.get(RESULT) + "\u0000" + row.get(TABLE);
      Table table = tables.get(key);
      if (table == null) {
        table = new Table(row);
        tables.put(key, table);
      }
      try {
        table.values.add(new TimeSeriesValue(DateTime.parseRfc3339(time), 
            value(row.get(VALUE))));
      } catch (IllegalArgumentException e) {
        throw new OutputParseException("Invalid point in row " + row.line 
            + ": " + e.getMessage(), raw, e);
      }
    }
    
    final List<TimeSeries> series = Lists.newArrayListWithCapacity(
        tables.size());
    for (final Table table : tables.values()) {
      final String metric;
      if (query != null) {
        metric = query.stream().getMetric().key();
      } else if (!Strings.isNullOrEmpty(table.measurement)) {
        metric = table.measurement;
      } else {
        metric = "value";
      }
      series.add(TimeSeries.newBuilder()
          .setMetric(metric)
          .setAlias(query != null ? query.alias() : null)
          .setLabels(table.labels)
          .setValues(table.values)
          .build());
    }
    return series;
  }
  
  /**
   * Collects the distinct {@code _value} cells, the shape of schema 
   * queries.
   * @param raw The raw CSV.
   * @return The distinct values in order of appearance.
   * @throws OutputParseException if the CSV was malformed.
   */
  public List<String> values(final String raw) {
    final Set<String> values = Sets.newLinkedHashSet();
    for (final Row row : rows(raw)) {
      final String value = row.get(VALUE);
      if (!Strings.isNullOrEmpty(value)) {
        values.add(value);
      }
    }
    return Lists.newArrayList(values);
  }
  
  /**
   * @param cell The cell, may be null or empty.
   * @return The numeric value, null when empty.
   * @throws NumberFormatException if the cell was not a number.
   */
  static Double value(final String cell) {
    if (Strings.isNullOrEmpty(cell)) {
      return null;
    }
    if (cell.equals("+Inf")) {
      return Double.POSITIVE_INFINITY;
    }
    if (cell.equals("-Inf")) {
      return Double.NEGATIVE_INFINITY;
    }
    return Double.parseDouble(cell);
  }
  
  /**
   * Splits RFC 4180 CSV into records. Quoted fields may contain commas, 
   * doubled quotes and line breaks. Blank lines yield empty records.
   * @param raw The raw text.
   * @return The records.
   * @throws OutputParseException if a quote is not terminated or a quoted
   * field is malformed.
   */
  static List<List<String>> records(final String raw) {
    final List<List<String>> records = Lists.newArrayList();
    if (raw == null || raw.isEmpty()) {
      return records;
    }
    if (CharMatcher.is('"').countIn(raw) % 2 != 0) {
      throw new OutputParseException("Unterminated quoted field", raw);
    }
    final List<String[]> rows;
    try {
      rows = newParser().parseAll(new StringReader(
          raw.replace("\r\n", "\n")));
    } catch (TextParsingException e) {
      throw new OutputParseException("Malformed CSV at line " 
          + (e.getLineIndex() + 1) + ": " + e.getMessage(), raw, e);
    }
    for (final String[] row : rows) {
      boolean blank = true;
      for (final String cell : row) {
        if (!Strings.isNullOrEmpty(cell)) {
          blank = false;
          break;
        }
      }
      if (blank) {
        records.add(Collections.<String>emptyList());
      } else {
        final List<String> record = Lists.newArrayListWithCapacity(
            row.length);
        for (final String cell : row) {
          record.add(Strings.nullToEmpty(cell));
        }
        records.add(record);
      }
    }
    return records;
  }
  
  /** @return A parser keeping annotation rows, blank lines and whitespace. */
  private static CsvParser newParser() {
    final CsvParserSettings settings = new CsvParserSettings();
    settings.getFormat().setDelimiter(',');
    settings.getFormat().setQuote('"');
    settings.getFormat().setQuoteEscape('"');
    settings.getFormat().setLineSeparator("\n");
    settings.getFormat().setComment('\0');
    settings.setNullValue("");
    settings.setEmptyValue("");
    settings.setSkipEmptyLines(false);
    settings.setIgnoreLeadingWhitespaces(false);
    settings.setIgnoreTrailingWhitespaces(false);
    settings.setMaxCharsPerColumn(-1);
    settings.setReadInputOnSeparateThread(false);
    settings.setUnescapedQuoteHandling(UnescapedQuoteHandling.RAISE_ERROR);
    return new CsvParser(settings);
  }
  
  /**
   * Resolves the data rows of every table against their headers and 
   * defaults.
   * @throws RemoteQueryExecutionException if a row carries an error.
   */
  private static List<Row> rows(final String raw) {
    final List<Row> rows = Lists.newArrayList();
    List<String> header = null;
    List<String> defaults = null;
    int line = 0;
    for (final List<String> record : records(raw)) {
      line++;
      if (record.isEmpty()) {
        header = null;
        defaults = null;
        continue;
      }
      if (record.get(0).startsWith("#")) {
        if (record.get(0).equals(DEFAULT_ANNOTATION)) {
          defaults = record;
        }
        continue;
      }
      if (header == null) {
        header = record;
        continue;
      }
      if (record.size() != header.size()) {
        throw new OutputParseException("Row " + line + " has " 
            + record.size() + " columns, expected " + header.size(), raw);
      }
      final Row row = new Row(line);
      for (int i = 0; i < header.size(); i++) {
        String cell = record.get(i);
        if (i > 0 && cell.isEmpty() && defaults != null && 
            i < defaults.size()) {
          cell = defaults.get(i);
        }
        row.cells.put(header.get(i), cell);
      }
      final String error = row.get(ERROR);
      if (!Strings.isNullOrEmpty(error)) {
        throw new RemoteQueryExecutionException(error, InfluxDriver.NAME, 
            500);
      }
      rows.add(row);
    }
    return rows;
  }
  
  /** A data row keyed by column name. */
  private static class Row {
    final int line;
    final Map<String, String> cells = Maps.newHashMap();
    
    Row(final int line) {
      this.line = line;
    }
    
    String get(final String column) {
      return cells.get(column);
    }
  }
  
  /** The series being assembled for a table. */
  private static class Table {
    final String measurement;
    final Map<String, String> labels = Maps.newTreeMap();
    final List<TimeSeriesValue> values = Lists.newArrayList();
    
    Table(final Row first) {
      measurement = first.get(MEASUREMENT);
      for (final Map.Entry<String, String> cell : first.cells.entrySet()) {
        final String column = cell.getKey();
        if (column.isEmpty() || column.startsWith("_") || 
            column.equals(RESULT) || column.equals(TABLE) ||
            Strings.isNullOrEmpty(cell.getValue())) {
          continue;
        }
        labels.put(column, cell.getValue());
      }
    }
  }
}
