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

import java.io.File;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;

import net.tsbridge.configuration.Configuration;
import net.tsbridge.core.BaseTSDBPlugin;
import net.tsbridge.core.TSDB;
import net.tsbridge.core.TimeSeriesDriver;
import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.data.RetentionPolicy;
import net.tsbridge.query.Capabilities;
import net.tsbridge.query.DataQuery;
import net.tsbridge.query.Filter;
import net.tsbridge.query.LabelQuery;
import net.tsbridge.query.LabelQueryResult;
import net.tsbridge.query.QueryResult;
import net.tsbridge.storage.TimeSeriesWriter;

/**
 * A driver storing each labeled series in its own round robin archive 
 * managed by rrdtool, optionally through rrdcached.
 * <p>
 * Exports and info calls run through a persistent {@code rrdtool -} 
 * process or a process per call. When a daemon address is configured, 
 * updates, creates and listings go to rrdcached and the rrdtool 
 * processes are pointed at it so exports see unflushed values.
 * 
 * @since 1.0
 */
public class RrdDriver extends BaseTSDBPlugin implements TimeSeriesDriver {
  private static final Logger LOG = LoggerFactory.getLogger(RrdDriver.class);
  
  public static final String NAME = "rrd";
  public static final String TYPE = "RrdDriver";
  
  public static final String KEY_PREFIX = "rrd.";
  public static final String DIR_KEY = "dir";
  public static final String EXEC_KEY = "rrdtool.exec";
  public static final String RRDCACHED_KEY = "rrdcached.address";
  public static final String EXECUTOR_KEY = "executor";
  public static final String STRATEGY_KEY = "label.strategy";
  public static final String FOLDER_LABELS_KEY = "label.strategy.folder.labels";
  public static final String CACHE_KEY = "label.strategy.cache";
  public static final String RETENTION_KEY = "retention.default";
  public static final String PROCESS_TIMEOUT_KEY = "process.timeout";
  
  public static final String EXECUTOR_PROCESS = "process";
  public static final String EXECUTOR_CLI = "cli";
  
  private static final Capabilities CAPABILITIES = new RrdCapabilities();
  
  /** Runs exports and info calls. */
  RrdExecutor query_executor;
  
  /** Runs updates, creates and listings. May be the query executor. */
  RrdExecutor write_executor;
  
  LabelStrategy strategy;
  RrdCompiler compiler;
  RrdWriter writer;
  final RrdXportParser xport_parser = new RrdXportParser();
  final RrdInfoParser info_parser = new RrdInfoParser();
  final RrdPostProcessor post_processor = new RrdPostProcessor();
  
  @Override
  public Deferred<Object> initialize(final TSDB tsdb, final String id) {
    super.initialize(tsdb, id);
    final Configuration config = tsdb.getConfig();
    registerConfigs(config);
    
    final String dir = config.getString(getConfigKey(KEY_PREFIX, DIR_KEY));
    final String rrdtool = config.getString(getConfigKey(KEY_PREFIX, EXEC_KEY));
    final String rrdcached = config.getString(
        getConfigKey(KEY_PREFIX, RRDCACHED_KEY));
    final String executor = config.getString(
        getConfigKey(KEY_PREFIX, EXECUTOR_KEY));
    final List<RetentionPolicy> policies;
    try {
      policies = parsePolicies(config.getString(
          getConfigKey(KEY_PREFIX, RETENTION_KEY)));
    } catch (IllegalArgumentException e) {
      return Deferred.fromError(e);
    }
    
    final File working_dir = new File(dir);
    if (EXECUTOR_CLI.equals(executor)) {
      query_executor = new CliRrdExecutor(rrdtool, working_dir, rrdcached);
    } else if (EXECUTOR_PROCESS.equals(executor)) {
      query_executor = new ProcessRrdExecutor(rrdtool, working_dir, 
          rrdcached, config.getLong(
              getConfigKey(KEY_PREFIX, PROCESS_TIMEOUT_KEY)));
    } else {
      return Deferred.fromError(new IllegalArgumentException(
          "Unknown RRD executor [" + executor + "], must be one of " 
              + EXECUTOR_PROCESS + " or " + EXECUTOR_CLI));
    }
    write_executor = Strings.isNullOrEmpty(rrdcached) ? 
        query_executor : new RrdCachedExecutor(rrdcached);
    
    try {
      strategy = createStrategy(config, dir, 
          Strings.isNullOrEmpty(rrdcached) ? null : write_executor);
    } catch (IllegalArgumentException e) {
      return Deferred.fromError(e);
    }
    compiler = new RrdCompiler(strategy);
    writer = new RrdWriter(strategy, write_executor, 
        Strings.isNullOrEmpty(rrdcached) ? dir : null, policies);
    LOG.info("Initialized RRD driver with base directory " + dir 
        + ", executor " + query_executor.endpoint() 
        + (Strings.isNullOrEmpty(rrdcached) ? "" : " and " 
            + write_executor.endpoint()));
    return Deferred.fromResult(null);
  }
  
  @Override
  public Deferred<Object> shutdown() {
    if (write_executor != null && write_executor != query_executor) {
      write_executor.shutdown();
    }
    if (query_executor != null) {
      query_executor.shutdown();
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
    final RrdXportQuery compiled = compiler.compileQuery(query);
    final String raw = query_executor.execute(compiled.toCommand(), 
        timeout_ms);
    return post_processor.process(compiled, xport_parser.parseResult(raw));
  }

  @Override
  public LabelQueryResult labels(final LabelQuery query, 
                                 final long timeout_ms) {
    query.validate();
    if (query.isNameQuery()) {
      return new LabelQueryResult(null, 
          strategy.listLabelNames(query.getMetrics()));
    }
    final List<TagCondition> conditions = Lists.newArrayListWithCapacity(
        query.getFilters().size());
    for (final Filter filter : query.getFilters()) {
      conditions.add(TagCondition.fromFilter(filter));
    }
    return new LabelQueryResult(query.getLabel(), strategy.listLabelValues(
        query.getMetrics(), query.getLabel(), conditions));
  }

  @Override
  public TimeSeriesWriter writer() {
    return writer;
  }
  
  /**
   * Runs {@code info} on the archive for the metric and labels.
   * @param metric The non-null metric.
   * @param labels The labels, may be null.
   * @param timeout_ms The deadline in milliseconds.
   * @return The parsed info.
   * @throws RrdFileNotFoundException if the archive does not exist.
   */
  public RrdInfo info(final MetricIdentifier metric, 
                      final Map<String, String> labels,
                      final long timeout_ms) {
    final String path = strategy.generateFilename(metric, labels);
    return info_parser.parse(query_executor.execute(
        RrdCommandBuilder.info(path), timeout_ms));
  }
  
  /** @return The label strategy in use. */
  public LabelStrategy strategy() {
    return strategy;
  }
  
  /**
   * Parses comma separated {@code resolution:retention} pairs.
   * @param policies The non-null and non-empty policy list.
   * @return The parsed policies.
   * @throws IllegalArgumentException if the list was empty or malformed.
   */
  static List<RetentionPolicy> parsePolicies(final String policies) {
    if (Strings.isNullOrEmpty(policies)) {
      throw new IllegalArgumentException("Default retention policies "
          + "cannot be null or empty.");
    }
    final List<RetentionPolicy> parsed = Lists.newArrayList();
    for (final String policy : Splitter.on(',').trimResults()
        .omitEmptyStrings().split(policies)) {
      parsed.add(RetentionPolicy.parse(policy));
    }
    return parsed;
  }
  
  private LabelStrategy createStrategy(final Configuration config, 
                                       final String dir, 
                                       final RrdExecutor lister) {
    final String name = config.getString(getConfigKey(KEY_PREFIX, STRATEGY_KEY));
    final boolean cache = config.getBoolean(getConfigKey(KEY_PREFIX, CACHE_KEY));
    if (FilenameLabelStrategy.NAME.equals(name)) {
      return new FilenameLabelStrategy(dir, lister, cache);
    }
    if (FolderLabelStrategy.NAME.equals(name)) {
      return new FolderLabelStrategy(dir, lister, cache, 
          Splitter.on(',').trimResults().omitEmptyStrings().splitToList(
              Strings.nullToEmpty(config.getString(
                  getConfigKey(KEY_PREFIX, FOLDER_LABELS_KEY)))));
    }
    if (NoTagsLabelStrategy.NAME.equals(name)) {
      return new NoTagsLabelStrategy(dir, lister, cache);
    }
    throw new IllegalArgumentException("Unknown label strategy [" + name 
        + "], must be one of " + FilenameLabelStrategy.NAME + ", " 
        + FolderLabelStrategy.NAME + " or " + NoTagsLabelStrategy.NAME);
  }
  
  private void registerConfigs(final Configuration config) {
    if (!config.hasProperty(getConfigKey(KEY_PREFIX, DIR_KEY))) {
      config.register(getConfigKey(KEY_PREFIX, DIR_KEY), "/var/lib/rrd", 
          false, "The base directory holding the archives.");
    }
    if (!config.hasProperty(getConfigKey(KEY_PREFIX, EXEC_KEY))) {
      config.register(getConfigKey(KEY_PREFIX, EXEC_KEY), "rrdtool", 
          false, "The rrdtool binary.");
    }
    if (!config.hasProperty(getConfigKey(KEY_PREFIX, RRDCACHED_KEY))) {
      config.register(getConfigKey(KEY_PREFIX, RRDCACHED_KEY), (String) null, 
          false, "An optional rrdcached address, unix:/path or host:port.");
    }
    if (!config.hasProperty(getConfigKey(KEY_PREFIX, EXECUTOR_KEY))) {
      config.register(getConfigKey(KEY_PREFIX, EXECUTOR_KEY), 
          EXECUTOR_PROCESS, false, "How rrdtool is run, either " 
              + EXECUTOR_PROCESS + " for a persistent pipe or " + EXECUTOR_CLI 
              + " for a process per command.");
    }
    if (!config.hasProperty(getConfigKey(KEY_PREFIX, STRATEGY_KEY))) {
      config.register(getConfigKey(KEY_PREFIX, STRATEGY_KEY), 
          FilenameLabelStrategy.NAME, false, "How labels map onto archive "
              + "paths: filename, folder or notags.");
    }
    if (!config.hasProperty(getConfigKey(KEY_PREFIX, FOLDER_LABELS_KEY))) {
      config.register(getConfigKey(KEY_PREFIX, FOLDER_LABELS_KEY), "", 
          false, "Comma separated labels stored as directories by the "
              + "folder strategy.");
    }
    if (!config.hasProperty(getConfigKey(KEY_PREFIX, CACHE_KEY))) {
      config.register(getConfigKey(KEY_PREFIX, CACHE_KEY), false, false, 
          "Whether or not to memoize archive directory scans until an "
              + "archive is created.");
    }
    if (!config.hasProperty(getConfigKey(KEY_PREFIX, RETENTION_KEY))) {
      config.register(getConfigKey(KEY_PREFIX, RETENTION_KEY), 
          "60:172800,300:1209600,3600:31536000", false, 
          "Comma separated resolution:retention pairs for new archives of "
              + "metrics without their own policies.");
    }
    if (!config.hasProperty(getConfigKey(KEY_PREFIX, PROCESS_TIMEOUT_KEY))) {
      config.register(getConfigKey(KEY_PREFIX, PROCESS_TIMEOUT_KEY), 300000L, 
          false, "Milliseconds of idleness after which the persistent "
              + "rrdtool process is recycled.");
    }
  }
}
