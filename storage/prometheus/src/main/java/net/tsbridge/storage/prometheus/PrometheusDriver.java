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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.tsbridge.configuration.Configuration;
import net.tsbridge.core.BaseTSDBPlugin;
import net.tsbridge.core.TSDB;
import net.tsbridge.core.TimeSeriesDriver;
import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.data.Resolution;
import net.tsbridge.data.TimeRange;
import net.tsbridge.data.TimeSeries;
import net.tsbridge.data.TimeSeriesValue;
import net.tsbridge.exceptions.UnsupportedQueryOperationException;
import net.tsbridge.query.Capabilities;
import net.tsbridge.query.DataQuery;
import net.tsbridge.query.FillPolicy;
import net.tsbridge.query.Filter;
import net.tsbridge.query.LabelQuery;
import net.tsbridge.query.LabelQueryResult;
import net.tsbridge.query.MetricNode;
import net.tsbridge.query.QueryResult;
import net.tsbridge.query.SortOrder;
import net.tsbridge.storage.TimeSeriesWriter;
import net.tsbridge.utils.SharedHttpClient;

/**
 * A read only driver for Prometheus. Streams are compiled to PromQL range
 * queries, one per aggregation, and run over the shared HTTP client. The
 * series limit, fill policy and sort order are applied to the parsed 
 * results. Prometheus scrapes its targets so there is no writer.
 * 
 * @since 1.0
 */
public class PrometheusDriver extends BaseTSDBPlugin implements TimeSeriesDriver {
  private static final Logger LOG = LoggerFactory.getLogger(
      PrometheusDriver.class);
  
  public static final String NAME = "prometheus";
  public static final String TYPE = "PrometheusDriver";
  
  public static final String KEY_PREFIX = "prometheus.";
  public static final String URL_KEY = "url";
  public static final String RATE_INTERVAL_KEY = "rate.interval";
  
  private static final Capabilities CAPABILITIES = new PrometheusCapabilities();
  
  SharedHttpClient client;
  PrometheusExecutor executor;
  PromQlCompiler compiler;
  final PrometheusResultParser parser = new PrometheusResultParser();
  
  @Override
  public Deferred<Object> initialize(final TSDB tsdb, final String id) {
    super.initialize(tsdb, id);
    final Configuration config = tsdb.getConfig();
    registerConfigs(config);
    
    final String url = config.getString(getConfigKey(KEY_PREFIX, URL_KEY));
    try {
      compiler = new PromQlCompiler(config.getString(
          getConfigKey(KEY_PREFIX, RATE_INTERVAL_KEY)));
    } catch (IllegalArgumentException e) {
      return Deferred.fromError(e);
    }
    
    class InitCB implements Callback<Object, Object> {
      @Override
      public Object call(final Object ignored) throws Exception {
        executor = new PrometheusExecutor(client, url);
        LOG.info("Initialized Prometheus driver for " + url);
        return null;
      }
    }
    
    client = newHttpClient();
    return client.initialize(tsdb, null).addCallback(new InitCB());
  }
  
  @Override
  public Deferred<Object> shutdown() {
    if (client != null) {
      return client.shutdown();
    }
    return Deferred.fromResult(null);
  }
  
  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Capabilities capabilities() {
    return CAPABILITIES;
  }

  @Override
  public QueryResult query(final DataQuery query, final long timeout_ms) {
    final List<PromQuery> compiled = compiler.compile(query);
    final long deadline = System.currentTimeMillis() + timeout_ms;
    final List<TimeSeries> series = Lists.newArrayList();
    for (final PromQuery promql : compiled) {
      final String raw = executor.execute(promql, remaining(deadline, 
          timeout_ms));
      series.addAll(process(promql, parser.parse(raw, promql)));
    }
    final PromQuery first = compiled.get(0);
    return new QueryResult(series, 
        TimeRange.between(first.start(), first.end()), 
        Resolution.seconds(first.step()));
  }

  @Override
  public LabelQueryResult labels(final LabelQuery query, 
                                 final long timeout_ms) {
    query.validate();
    final List<String> keys = Lists.newArrayList();
    for (final Filter filter : query.getFilters()) {
      keys.add(filter.getKey());
    }
    if (!query.isNameQuery()) {
      keys.add(query.getLabel());
    }
    final List<String> selectors = Lists.newArrayListWithCapacity(
        query.getMetrics().size());
    for (final MetricIdentifier metric : query.getMetrics()) {
      metric.validateLabels(keys);
      selectors.add(PromQlCompiler.selector(metric.key(), 
          query.getFilters()));
    }
    
    if (query.isNameQuery()) {
      final List<String> names = parser.parseLabels(executor.labelNames(
          selectors, query.getTimeRange(), timeout_ms));
      names.remove(PrometheusResultParser.NAME_LABEL);
      return new LabelQueryResult(null, names);
    }
    return new LabelQueryResult(query.getLabel(), parser.parseLabels(
        executor.labelValues(query.getLabel(), selectors, 
            query.getTimeRange(), timeout_ms)));
  }

  /**
   * Prometheus scrapes its targets.
   * @throws UnsupportedQueryOperationException always.
   */
  @Override
  public TimeSeriesWriter writer() {
    throw new UnsupportedQueryOperationException(NAME, "write", 
        "Prometheus is pull based, expose the metrics for scraping instead");
  }
  
  /** @return A new, uninitialized shared client. Overridden in tests. */
  protected SharedHttpClient newHttpClient() {
    return new SharedHttpClient();
  }
  
  /**
   * Applies the stream's limit, fill and sort order to the series of one
   * compiled query.
   * @param query The non-null compiled query.
   * @param series The parsed series.
   * @return The processed series.
   */
  static List<TimeSeries> process(final PromQuery query, 
                                  final List<TimeSeries> series) {
    final MetricNode stream = query.stream();
    final List<TimeSeries> results = Lists.newArrayList();
    for (final TimeSeries ts : series) {
      if (stream.getLimit() != null && results.size() >= stream.getLimit()) {
        break;
      }
      List<TimeSeriesValue> values = fill(stream.getFill(), ts.values(), 
          query.start(), query.end(), query.step());
      if (stream.getSort() == SortOrder.DESC) {
        values = Lists.newArrayList(values);
        Collections.reverse(values);
      }
      results.add(TimeSeries.newBuilder(ts)
          .setValues(values)
          .build());
    }
    return results;
  }
  
  /**
   * Range queries only return samples that exist so missing steps are 
   * filled on the {@code start + n * step} grid the server evaluated.
   */
  static List<TimeSeriesValue> fill(final FillPolicy fill, 
                                    final List<TimeSeriesValue> values,
                                    final long start, 
                                    final long end, 
                                    final long step) {
    if (fill == null || fill == FillPolicy.NONE) {
      return values;
    }
    final Map<Long, Double> samples = Maps.newHashMap();
    for (final TimeSeriesValue value : values) {
      samples.put(value.timestamp(), value.value());
    }
    final List<TimeSeriesValue> filled = Lists.newArrayList();
    Double last = null;
    for (long timestamp = start; timestamp <= end; timestamp += step) {
      Double value = samples.get(timestamp);
      if (value == null) {
        switch (fill) {
        case ZERO:
          value = 0.0;
          break;
        case PREVIOUS:
          value = last;
          break;
        default:
          break;
        }
      } else {
        last = value;
      }
      filled.add(new TimeSeriesValue(timestamp, value));
    }
    return filled;
  }
  
  private static long remaining(final long deadline, final long timeout_ms) {
    if (timeout_ms <= 0) {
      return timeout_ms;
    }
    return Math.max(1, deadline - System.currentTimeMillis());
  }
  
  private void registerConfigs(final Configuration config) {
    if (!config.hasProperty(getConfigKey(KEY_PREFIX, URL_KEY))) {
      config.register(getConfigKey(KEY_PREFIX, URL_KEY), 
          "http://localhost:9090", false, "The Prometheus server URL.");
    }
    if (!config.hasProperty(getConfigKey(KEY_PREFIX, RATE_INTERVAL_KEY))) {
      config.register(getConfigKey(KEY_PREFIX, RATE_INTERVAL_KEY), "5m", 
          false, "The range of rate and delta steps without an interval "
              + "when the query has no resolution.");
    }
  }
}
