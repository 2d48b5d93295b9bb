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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.tsbridge.configuration.Configuration;
import net.tsbridge.configuration.ConfigurationException;
import net.tsbridge.exceptions.UnsupportedQueryOperationException;
import net.tsbridge.query.Capabilities;
import net.tsbridge.query.DataQuery;
import net.tsbridge.query.DefaultCapabilities;
import net.tsbridge.query.LabelQuery;
import net.tsbridge.query.LabelQueryResult;
import net.tsbridge.query.QueryResult;
import net.tsbridge.storage.TimeSeriesWriter;

/**
 * A write-only driver that fans points out to a list of other drivers.
 * The delegates are configured under {@code aggregate.connections} as a 
 * comma separated list of driver names, each optionally followed by a 
 * colon and the instance ID, e.g. {@code rrd, influxdb:east}. 
 * <p>
 * Queries are not supported.
 * 
 * @since 1.0
 */
public class AggregateDriver extends BaseTSDBPlugin 
    implements TimeSeriesDriver {
  private static final Logger LOG = LoggerFactory.getLogger(
      AggregateDriver.class);
  
  public static final String NAME = "aggregate";
  public static final String KEY_PREFIX = "aggregate.";
  public static final String CONNECTIONS_KEY = "connections";
  
  private static final Capabilities CAPABILITIES = 
      DefaultCapabilities.newBuilder().build();
  
  /** The registry delegates are resolved from. */
  private final DriverRegistry registry;
  
  /** The initialized delegates in config order. */
  private List<TimeSeriesDriver> delegates;
  
  /** The writer once initialized. */
  private AggregateWriter writer;
  
  /**
   * Default ctor.
   * @param registry The non-null registry.
   */
  public AggregateDriver(final DriverRegistry registry) {
    if (registry == null) {
      throw new IllegalArgumentException("Registry cannot be null.");
    }
    this.registry = registry;
  }
  
  @Override
  public Deferred<Object> initialize(final TSDB tsdb, final String id) {
    super.initialize(tsdb, id);
    final Configuration config = tsdb.getConfig();
    final String key = getConfigKey(KEY_PREFIX, CONNECTIONS_KEY);
    if (!config.hasProperty(key)) {
      config.register(key, (String) null, false, 
          "A comma separated list of driver names, optionally suffixed with "
          + ":<id>, that writes are sent to.");
    }
    
    final String connections = config.getString(key);
    if (connections == null || connections.trim().isEmpty()) {
      return Deferred.fromError(new ConfigurationException(
          "At least one connection must be configured under " + key));
    }
    
    final List<TimeSeriesDriver> drivers = Lists.newArrayList();
    final List<String> names = Lists.newArrayList();
    try {
      for (final String connection : Splitter.on(',').trimResults()
          .omitEmptyStrings().split(connections)) {
        final int idx = connection.indexOf(':');
        final String name = idx < 0 ? connection 
            : connection.substring(0, idx).trim();
        final String instance = idx < 0 ? null 
            : connection.substring(idx + 1).trim();
        if (name.equals(NAME)) {
          throw new ConfigurationException("An aggregate driver cannot "
              + "delegate to another aggregate: " + connection);
        }
        final TimeSeriesDriver driver = registry.newDriver(name, tsdb, 
            instance == null || instance.isEmpty() ? null : instance);
        drivers.add(driver);
        names.add(connection);
        // fails fast for read-only drivers
        driver.writer();
      }
    } catch (RuntimeException e) {
      LOG.error("Failed to initialize the aggregate driver", e);
      shutdown(drivers);
      return Deferred.fromError(e);
    }
    
    delegates = ImmutableList.copyOf(drivers);
    final List<TimeSeriesWriter> writers = 
        Lists.newArrayListWithCapacity(drivers.size());
    for (final TimeSeriesDriver driver : drivers) {
      writers.add(driver.writer());
    }
    writer = new AggregateWriter(names, writers);
    LOG.info("Initialized the aggregate driver with connections " + names);
    return Deferred.fromResult(null);
  }
  
  @Override
  public Deferred<Object> shutdown() {
    if (delegates == null) {
      return Deferred.fromResult(null);
    }
    return shutdown(delegates);
  }
  
  @Override
  public String type() {
    return AggregateDriver.class.getSimpleName();
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
    throw new UnsupportedQueryOperationException(NAME, "query");
  }

  @Override
  public LabelQueryResult labels(final LabelQuery query, 
                                 final long timeout_ms) {
    throw new UnsupportedQueryOperationException(NAME, "labels");
  }

  @Override
  public TimeSeriesWriter writer() {
    if (writer == null) {
      throw new IllegalStateException("The aggregate driver has not been "
          + "initialized.");
    }
    return writer;
  }
  
  /** @return The initialized delegates, null before initialization. */
  List<TimeSeriesDriver> delegates() {
    return delegates;
  }
  
  private static Deferred<Object> shutdown(
      final List<TimeSeriesDriver> drivers) {
    final List<Deferred<Object>> deferreds = 
        Lists.newArrayListWithCapacity(drivers.size());
    for (final TimeSeriesDriver driver : drivers) {
      deferreds.add(driver.shutdown());
    }
    
    class ShutdownCB implements Callback<Object, ArrayList<Object>> {
      @Override
      public Object call(final ArrayList<Object> ignored) throws Exception {
        return null;
      }
    }
    return Deferred.group(deferreds).addCallback(new ShutdownCB());
  }
}
