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

import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;
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
import net.tsbridge.query.Capabilities;
import net.tsbridge.query.DataQuery;
import net.tsbridge.query.Filter;
import net.tsbridge.query.LabelQuery;
import net.tsbridge.query.LabelQueryResult;
import net.tsbridge.query.QueryResult;
import net.tsbridge.storage.TimeSeriesWriter;
import net.tsbridge.utils.SharedHttpClient;

/**
 * A driver for InfluxDB 2. Streams are compiled to Flux, one script per 
 * aggregation, and the annotated CSV results parsed into series. Points 
 * are written as line protocol to the configured bucket.
 * 
 * @since 1.0
 */
public class InfluxDriver extends BaseTSDBPlugin implements TimeSeriesDriver {
  private static final Logger LOG = LoggerFactory.getLogger(
      InfluxDriver.class);
  
  public static final String NAME = "influxdb";
  public static final String TYPE = "InfluxDriver";
  
  public static final String KEY_PREFIX = "influxdb.";
  public static final String URL_KEY = "url";
  public static final String TOKEN_KEY = "token";
  public static final String ORG_KEY = "org";
  public static final String BUCKET_KEY = "bucket";
  public static final String FIELD_KEY = "field";
  
  private static final Capabilities CAPABILITIES = new InfluxCapabilities();
  
  SharedHttpClient client;
  InfluxExecutor executor;
  FluxCompiler compiler;
  InfluxWriter writer;
  final AnnotatedCsvParser parser = new AnnotatedCsvParser();
  
  @Override
  public Deferred<Object> initialize(final TSDB tsdb, final String id) {
    super.initialize(tsdb, id);
    final Configuration config = tsdb.getConfig();
    registerConfigs(config);
    
    final String url = config.getString(getConfigKey(KEY_PREFIX, URL_KEY));
    final String token = config.getString(
        getConfigKey(KEY_PREFIX, TOKEN_KEY));
    final String org = config.getString(getConfigKey(KEY_PREFIX, ORG_KEY));
    final String bucket = config.getString(
        getConfigKey(KEY_PREFIX, BUCKET_KEY));
    final String field = config.getString(
        getConfigKey(KEY_PREFIX, FIELD_KEY));
    if (Strings.isNullOrEmpty(org)) {
      return Deferred.fromError(new IllegalArgumentException("The " 
          + getConfigKey(KEY_PREFIX, ORG_KEY) + " setting is required."));
    }
    if (Strings.isNullOrEmpty(bucket)) {
      return Deferred.fromError(new IllegalArgumentException("The " 
          + getConfigKey(KEY_PREFIX, BUCKET_KEY) + " setting is required."));
    }
    try {
      compiler = new FluxCompiler(bucket, field);
    } catch (IllegalArgumentException e) {
      return Deferred.fromError(e);
    }
    
    class InitCB implements Callback<Object, Object> {
      @Override
      public Object call(final Object ignored) throws Exception {
        executor = new InfluxExecutor(client, url, token, org, bucket);
        writer = new InfluxWriter(executor, new LineProtocolWriter(field));
        LOG.info("Initialized InfluxDB driver for " + url + " bucket " 
            + bucket);
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
    final List<FluxQuery> compiled = compiler.compile(query);
    final long deadline = System.currentTimeMillis() + timeout_ms;
    final List<TimeSeries> series = Lists.newArrayList();
    for (final FluxQuery flux : compiled) {
      final String raw = executor.execute(flux, remaining(deadline, 
          timeout_ms));
      series.addAll(limit(flux, parser.parse(raw, flux)));
    }
    final FluxQuery first = compiled.get(0);
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
    for (final MetricIdentifier metric : query.getMetrics()) {
      metric.validateLabels(keys);
    }
    
    if (query.isNameQuery()) {
      final List<String> names = parser.values(executor.query(
          compiler.tagKeys(query.getMetrics(), query.getFilters(), 
              query.getTimeRange()), timeout_ms));
      final Iterator<String> iterator = names.iterator();
      while (iterator.hasNext()) {
        if (iterator.next().startsWith("_")) {
          iterator.remove();
        }
      }
      return new LabelQueryResult(null, names);
    }
    return new LabelQueryResult(query.getLabel(), parser.values(
        executor.query(compiler.tagValues(query.getLabel(), 
            query.getMetrics(), query.getFilters(), query.getTimeRange()), 
            timeout_ms)));
  }

  @Override
  public TimeSeriesWriter writer() {
    if (writer == null) {
      throw new IllegalStateException("The driver has not been initialized.");
    }
    return writer;
  }
  
  /** @return A new, uninitialized shared client. Overridden in tests. */
  protected SharedHttpClient newHttpClient() {
    return new SharedHttpClient();
  }
  
  /**
   * Flux limits rows per table so the stream's series limit is applied to
   * the parsed tables.
   */
  static List<TimeSeries> limit(final FluxQuery query, 
                                final List<TimeSeries> series) {
    final Integer limit = query.stream().getLimit();
    if (limit == null || series.size() <= limit) {
      return series;
    }
    return Lists.newArrayList(series.subList(0, limit));
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
          "http://localhost:8086", false, "The InfluxDB server URL.");
    }
    if (!config.hasProperty(getConfigKey(KEY_PREFIX, TOKEN_KEY))) {
      config.register(getConfigKey(KEY_PREFIX, TOKEN_KEY), null, false, 
          "The API token sent with every request.");
    }
    if (!config.hasProperty(getConfigKey(KEY_PREFIX, ORG_KEY))) {
      config.register(getConfigKey(KEY_PREFIX, ORG_KEY), null, false, 
          "The organization owning the bucket.");
    }
    if (!config.hasProperty(getConfigKey(KEY_PREFIX, BUCKET_KEY))) {
      config.register(getConfigKey(KEY_PREFIX, BUCKET_KEY), null, false, 
          "The bucket samples are read from and written to.");
    }
    if (!config.hasProperty(getConfigKey(KEY_PREFIX, FIELD_KEY))) {
      config.register(getConfigKey(KEY_PREFIX, FIELD_KEY), 
          FluxCompiler.DEFAULT_FIELD, false, 
          "The field holding the sample of each point.");
    }
  }
}
