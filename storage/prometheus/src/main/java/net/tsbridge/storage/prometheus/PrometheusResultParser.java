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
package net.tsbridge.storage.prometheus;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tsbridge.data.TimeSeries;
import net.tsbridge.data.TimeSeriesValue;
import net.tsbridge.exceptions.OutputParseException;
import net.tsbridge.exceptions.RemoteQueryExecutionException;
import net.tsbridge.query.ResultParser;
import net.tsbridge.utils.JSON;

/**
 * Parses Prometheus API responses. Query results of type {@code matrix}, 
 * {@code vector} and {@code scalar} become one series per result entry 
 * with the {@code __name__} label removed. Sample values arrive as 
 * strings; {@code NaN} becomes null.
 * 
 * @since 1.0
 */
public class PrometheusResultParser implements ResultParser<String> {
  
  public static final String NAME_LABEL = "__name__";

  @Override
  public List<TimeSeries> parse(final String raw) {
    return parse(raw, null);
  }
  
  /**
   * Parses a query response, naming the series after the compiled query.
   * @param raw The raw JSON body.
   * @param query The query the response belongs to, may be null in which 
   * case series are named from their {@code __name__} label.
   * @return The series in response order.
   * @throws OutputParseException if the body was not a query response.
   * @throws RemoteQueryExecutionException if the status was not success.
   */
  public List<TimeSeries> parse(final String raw, final PromQuery query) {
    final JsonNode data = data(raw);
    final String type = data.path("resultType").asText();
    final JsonNode result = data.get("result");
    if (result == null) {
      throw new OutputParseException("Missing result in response", raw);
    }
    
    final List<TimeSeries> series = Lists.newArrayList();
    if (type.equals("scalar")) {
      series.add(build(query, null, Lists.newArrayList(point(result, raw))));
      return series;
    }
    if (!result.isArray()) {
      throw new OutputParseException("Result was not an array", raw);
    }
    for (final JsonNode entry : result) {
      final List<TimeSeriesValue> values;
      if (type.equals("matrix")) {
        final JsonNode points = entry.get("values");
        if (points == null || !points.isArray()) {
          throw new OutputParseException("Matrix entry without values: " 
              + entry, raw);
        }
        values = Lists.newArrayListWithCapacity(points.size());
        for (final JsonNode point : points) {
          values.add(point(point, raw));
        }
      } else if (type.equals("vector")) {
        final JsonNode point = entry.get("value");
        if (point == null) {
          throw new OutputParseException("Vector entry without a value: " 
              + entry, raw);
        }
        values = Lists.newArrayList(point(point, raw));
      } else {
        throw new OutputParseException("Unsupported result type [" + type 
            + "]", raw);
      }
      series.add(build(query, entry.get("metric"), values));
    }
    return series;
  }
  
  /**
   * Parses the string list returned by the label name and value endpoints.
   * @param raw The raw JSON body.
   * @return The values in response order.
   * @throws OutputParseException if the body was not a string list.
   * @throws RemoteQueryExecutionException if the status was not success.
   */
  public List<String> parseLabels(final String raw) {
    final JsonNode data = data(raw);
    if (!data.isArray()) {
      throw new OutputParseException("Label data was not an array", raw);
    }
    final List<String> labels = Lists.newArrayListWithCapacity(data.size());
    for (final JsonNode label : data) {
      labels.add(label.asText());
    }
    return labels;
  }
  
  /**
   * Converts a sample value. Prometheus writes special values as 
   * {@code NaN}, {@code +Inf} and {@code -Inf}.
   * @param value The string value.
   * @return The value, null for NaN.
   */
  static Double value(final String value) {
    switch (value) {
    case "NaN":
      return null;
    case "+Inf":
      return Double.POSITIVE_INFINITY;
    case "-Inf":
      return Double.NEGATIVE_INFINITY;
    default:
      return Double.parseDouble(value);
    }
  }
  
  private static JsonNode data(final String raw) {
    if (Strings.isNullOrEmpty(raw)) {
      throw new OutputParseException("Empty Prometheus response", raw);
    }
    final JsonNode root;
    try {
      root = JSON.parseToTree(raw);
    } catch (IllegalArgumentException e) {
      throw new OutputParseException("Invalid Prometheus JSON", raw, e);
    }
    final String status = root.path("status").asText();
    if (!status.equals("success")) {
      final String error = root.path("error").asText("unknown error");
      final String type = root.path("errorType").asText();
      throw new RemoteQueryExecutionException("Prometheus returned status [" 
          + status + "]" + (type.isEmpty() ? "" : " " + type) + ": " + error, 
          PrometheusDriver.NAME, 500);
    }
    final JsonNode data = root.get("data");
    if (data == null || data.isNull()) {
      throw new OutputParseException("Missing data in response", raw);
    }
    return data;
  }
  
  private static TimeSeriesValue point(final JsonNode point, final String raw) {
    if (!point.isArray() || point.size() != 2) {
      throw new OutputParseException("Sample was not a [time, value] pair: " 
          + point, raw);
    }
    try {
      return new TimeSeriesValue((long) point.get(0).asDouble(), 
          value(point.get(1).asText()));
    } catch (NumberFormatException e) {
      throw new OutputParseException("Invalid sample value: " + point, raw, e);
    }
  }
  
  private static TimeSeries build(final PromQuery query, 
                                  final JsonNode metric, 
                                  final List<TimeSeriesValue> values) {
    final Map<String, String> labels = Maps.newHashMap();
    String name = null;
    if (metric != null) {
      final Iterator<Entry<String, JsonNode>> iterator = metric.fields();
      while (iterator.hasNext()) {
        final Entry<String, JsonNode> entry = iterator.next();
        if (entry.getKey().equals(NAME_LABEL)) {
          name = entry.getValue().asText();
        } else {
          labels.put(entry.getKey(), entry.getValue().asText());
        }
      }
    }
    final TimeSeries.Builder builder = TimeSeries.newBuilder()
        .setLabels(labels)
        .setValues(values);
    if (query != null) {
      builder.setMetric(query.stream().getMetric().key())
             .setAlias(query.alias());
    } else {
      builder.setMetric(Strings.isNullOrEmpty(name) ? "value" : name);
    }
    return builder.build();
  }
}
