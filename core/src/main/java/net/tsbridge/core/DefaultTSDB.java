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

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.stumbleupon.async.Deferred;

import net.tsbridge.configuration.Configuration;
import net.tsbridge.configuration.ConfigurationException;
import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.data.TimeSeriesDatum;
import net.tsbridge.exceptions.QueryValidationException;
import net.tsbridge.query.DataQuery;
import net.tsbridge.query.LabelQuery;
import net.tsbridge.query.LabelQueryResult;
import net.tsbridge.query.QueryResult;
import net.tsbridge.storage.WriteStatus;

/**
 * The entry point for applications. Holds the configuration, the metric
 * registry and the default driver and validates writes against the 
 * registry before handing them to the driver.
 * 
 * @since 1.0
 */
public class DefaultTSDB implements TSDB {
  private static final Logger LOG = LoggerFactory.getLogger(DefaultTSDB.class);
  
  public static final String DRIVER_KEY = "tsdb.driver";
  public static final String METRICS_FILE_KEY = "tsdb.metrics.file";
  public static final String TIMEOUT_KEY = "tsdb.query.timeout";
  
  /** The config. */
  private final Configuration config;
  
  /** The metrics. */
  private final MetricRegistry metrics;
  
  /** The drivers. */
  private final DriverRegistry drivers;
  
  /** The default driver once initialized. */
  private volatile TimeSeriesDriver driver;
  
  /**
   * Default ctor.
   * @param config A non-null config.
   * @param metrics A non-null metric registry.
   * @param drivers A non-null driver registry.
   */
  public DefaultTSDB(final Configuration config, 
                     final MetricRegistry metrics,
                     final DriverRegistry drivers) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (metrics == null) {
      throw new IllegalArgumentException("Metric registry cannot be null.");
    }
    if (drivers == null) {
      throw new IllegalArgumentException("Driver registry cannot be null.");
    }
    this.config = config;
    this.metrics = metrics;
    this.drivers = drivers;
  }
  
  /**
   * Registers the core config keys, loads the metric file if configured and
   * instantiates the default driver if configured.
   * @throws ConfigurationException if the metric file could not be read.
   * @throws IllegalArgumentException if the driver was not registered.
   */
  public void initialize() {
    if (!config.hasProperty(DRIVER_KEY)) {
      config.register(DRIVER_KEY, (String) null, false, 
          "The name of the default driver.");
    }
    if (!config.hasProperty(METRICS_FILE_KEY)) {
      config.register(METRICS_FILE_KEY, (String) null, false, 
          "An optional path to a YAML file with metric definitions.");
    }
    if (!config.hasProperty(TIMEOUT_KEY)) {
      config.register(TIMEOUT_KEY, 30000L, true, 
          "The default deadline in milliseconds for queries and writes.");
    }
    
    final String file = config.getString(METRICS_FILE_KEY);
    if (!Strings.isNullOrEmpty(file)) {
      if (!(metrics instanceof DefaultMetricRegistry)) {
        throw new ConfigurationException("The metric registry does not "
            + "support loading from " + file);
      }
      try (final InputStream stream = new FileInputStream(file)) {
        ((DefaultMetricRegistry) metrics).loadYaml(stream);
      } catch (IOException e) {
        throw new ConfigurationException("Failed to read the metrics file: " 
            + file, e);
      }
    }
    
    final String name = config.getString(DRIVER_KEY);
    if (Strings.isNullOrEmpty(name)) {
      LOG.warn("No default driver configured under " + DRIVER_KEY);
    } else {
      driver = drivers.newDriver(name, this, null);
    }
    LOG.info("Initialized TSDB with " + metrics.all().size() + " metrics.");
  }
  
  @Override
  public Configuration getConfig() {
    return config;
  }

  @Override
  public MetricRegistry getMetrics() {
    return metrics;
  }
  
  /** @return The driver registry. */
  public DriverRegistry getDrivers() {
    return drivers;
  }

  @Override
  public TimeSeriesDriver driver() {
    return driver;
  }
  
  /**
   * Runs the query against the default driver with the default deadline.
   * @param query The non-null query.
   * @return The non-null result.
   */
  public QueryResult query(final DataQuery query) {
    return query(query, defaultTimeout());
  }
  
  /**
   * Runs the query against the default driver.
   * @param query The non-null query.
   * @param timeout_ms The deadline in milliseconds.
   * @return The non-null result.
   */
  public QueryResult query(final DataQuery query, final long timeout_ms) {
    if (query == null) {
      throw new IllegalArgumentException("Query cannot be null.");
    }
    return checkDriver().query(query, timeout_ms);
  }
  
  /**
   * Runs the label query against the default driver.
   * @param query The non-null query.
   * @return The non-null result.
   */
  public LabelQueryResult labels(final LabelQuery query) {
    if (query == null) {
      throw new IllegalArgumentException("Query cannot be null.");
    }
    return checkDriver().labels(query, defaultTimeout());
  }
  
  /**
   * Validates and writes the point.
   * @param datum The non-null point.
   * @return The status.
   * @throws QueryValidationException if the metric was not registered or a
   * label was not declared.
   */
  public WriteStatus write(final TimeSeriesDatum datum) {
    validate(datum);
    return checkDriver().writer().write(datum, defaultTimeout());
  }
  
  /**
   * Validates and writes the points.
   * @param data The non-null points.
   * @return One status per point in input order.
   * @throws QueryValidationException if a metric was not registered or a
   * label was not declared.
   */
  public List<WriteStatus> write(final List<TimeSeriesDatum> data) {
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null.");
    }
    for (final TimeSeriesDatum datum : data) {
      validate(datum);
    }
    return checkDriver().writer().write(data, defaultTimeout());
  }
  
  /**
   * Shuts down the default driver.
   * @return A deferred resolving when the driver has shutdown.
   */
  public Deferred<Object> shutdown() {
    if (driver == null) {
      return Deferred.fromResult(null);
    }
    LOG.info("Shutting down driver: " + driver.name());
    return driver.shutdown();
  }
  
  /**
   * Checks the point against the registry.
   * @param datum The point.
   */
  void validate(final TimeSeriesDatum datum) {
    if (datum == null) {
      throw new IllegalArgumentException("Datum cannot be null.");
    }
    final MetricIdentifier registered = metrics.get(datum.metric().key());
    if (registered == null) {
      throw new QueryValidationException("Unknown metric: " 
          + datum.metric().key(), "metric");
    }
    registered.validateLabels(datum.labels().keySet());
  }
  
  private long defaultTimeout() {
    return config.hasProperty(TIMEOUT_KEY) ? 
        config.getLong(TIMEOUT_KEY) : 30000L;
  }
  
  private TimeSeriesDriver checkDriver() {
    final TimeSeriesDriver current = driver();
    if (current == null) {
      throw new IllegalStateException("No driver has been initialized. "
          + "Set " + DRIVER_KEY + " to one of " + drivers.names());
    }
    return current;
  }
}
