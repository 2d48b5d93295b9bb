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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.locks.Lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.Striped;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.data.RetentionPolicy;
import net.tsbridge.data.TimeSeriesDatum;
import net.tsbridge.exceptions.ExecutionTimeoutException;
import net.tsbridge.exceptions.QueryExecutionException;
import net.tsbridge.exceptions.UnsupportedQueryOperationException;
import net.tsbridge.storage.TimeSeriesWriter;
import net.tsbridge.storage.WriteStatus;

/**
 * Writes points as rrdtool updates. Writers to the same archive are 
 * serialized with a striped lock on the path. A missing archive is 
 * created from the metric's retention policies, or the defaults, and the 
 * update retried once.
 * 
 * @since 1.0
 */
public class RrdWriter implements TimeSeriesWriter {
  private static final Logger LOG = LoggerFactory.getLogger(RrdWriter.class);
  
  /** Number of lock stripes. */
  public static final int STRIPES = 256;
  
  private final LabelStrategy strategy;
  private final RrdExecutor executor;
  private final String base_dir;
  private final List<RetentionPolicy> default_policies;
  private final Striped<Lock> locks;
  
  /**
   * Default ctor.
   * @param strategy The non-null label strategy.
   * @param executor The non-null executor for updates and creates.
   * @param base_dir The local base directory used to create parent 
   * directories. Null when archives are only reachable through rrdcached.
   * @param default_policies The non-empty policies for metrics without 
   * their own.
   */
  public RrdWriter(final LabelStrategy strategy, 
                   final RrdExecutor executor, 
                   final String base_dir,
                   final List<RetentionPolicy> default_policies) {
    if (strategy == null) {
      throw new IllegalArgumentException("Strategy cannot be null.");
    }
    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null.");
    }
    if (default_policies == null || default_policies.isEmpty()) {
      throw new IllegalArgumentException("Default retention policies cannot "
          + "be null or empty.");
    }
    this.strategy = strategy;
    this.executor = executor;
    this.base_dir = base_dir;
    this.default_policies = ImmutableList.copyOf(default_policies);
    locks = Striped.lock(STRIPES);
  }
  
  @Override
  public WriteStatus write(final TimeSeriesDatum datum, 
                           final long timeout_ms) {
    return write(new Update(datum), 
        System.currentTimeMillis() + timeout_ms, timeout_ms);
  }

  /**
   * Writes the points in order within one deadline. Every point is 
   * resolved to its archive before the first update is sent so invalid
   * points fail the call without writing anything. Points not attempted 
   * before the deadline are reported as {@link WriteStatus#retry(String)}.
   * @throws net.tsbridge.exceptions.UndefinedLabelException if a point 
   * used an undeclared label.
   */
  @Override
  public List<WriteStatus> write(final List<TimeSeriesDatum> data, 
                                 final long timeout_ms) {
    final List<Update> updates = Lists.newArrayListWithCapacity(data.size());
    for (final TimeSeriesDatum datum : data) {
      updates.add(new Update(datum));
    }
    
    final long deadline = System.currentTimeMillis() + timeout_ms;
    final List<WriteStatus> statuses = Lists.newArrayListWithCapacity(
        data.size());
    for (final Update update : updates) {
      if (System.currentTimeMillis() >= deadline) {
        statuses.add(WriteStatus.retry("Deadline expired before writing " 
            + update.path));
      } else {
        statuses.add(write(update, deadline, timeout_ms));
      }
    }
    return statuses;
  }
  
  private WriteStatus write(final Update update, 
                            final long deadline,
                            final long timeout_ms) {
    final Lock lock = locks.get(update.path);
    lock.lock();
    try {
      try {
        executor.execute(update.command, remaining(deadline, timeout_ms));
      } catch (RrdFileNotFoundException e) {
        create(update.metric, update.path, remaining(deadline, timeout_ms));
        executor.execute(update.command, remaining(deadline, timeout_ms));
      }
      return WriteStatus.OK;
    } catch (ExecutionTimeoutException e) {
      return WriteStatus.unknown("Timed out writing " + update.path, e);
    } catch (UnsupportedQueryOperationException e) {
      return WriteStatus.rejected(e.getMessage());
    } catch (QueryExecutionException e) {
      LOG.error("Failed to write to " + update.path, e);
      return WriteStatus.error(e.getMessage(), e);
    } finally {
      lock.unlock();
    }
  }
  
  /**
   * @return The milliseconds left before the deadline.
   * @throws ExecutionTimeoutException if the deadline has passed.
   */
  static long remaining(final long deadline, final long timeout_ms) {
    final long remaining = deadline - System.currentTimeMillis();
    if (remaining <= 0) {
      throw new ExecutionTimeoutException("Deadline of " + timeout_ms 
          + "ms expired", timeout_ms);
    }
    return remaining;
  }
  
  /**
   * Creates the archive for the metric.
   * @throws UnsupportedQueryOperationException if the metric type cannot
   * be stored.
   */
  private void create(final MetricIdentifier metric, 
                      final String path, 
                      final long timeout_ms) {
    final List<RetentionPolicy> policies = 
        metric.getRetentionPolicies() == null || 
        metric.getRetentionPolicies().isEmpty() ? 
            default_policies : metric.getRetentionPolicies();
    final RrdCommand create = RrdCommandBuilder.create(path, 
        ImmutableMap.of(RrdCompiler.DATA_SOURCE, metric.getType()), policies);
    LOG.warn("Creating missing archive " + path + " for " + metric.key());
    if (base_dir != null) {
      final Path parent = Paths.get(base_dir).resolve(path).getParent();
      try {
        Files.createDirectories(parent);
      } catch (IOException e) {
        LOG.warn("Failed to create directory " + parent 
            + ", the create command will report the failure", e);
      }
    }
    executor.execute(create, timeout_ms);
    strategy.invalidate();
  }
  
  /** A point resolved to its archive and update command. */
  private class Update {
    final MetricIdentifier metric;
    final String path;
    final RrdCommand command;
    
    Update(final TimeSeriesDatum datum) {
      metric = datum.metric();
      path = strategy.generateFilename(metric, datum.labels());
      command = RrdCommandBuilder.update(path, datum.timestamp(), 
          ImmutableList.of(datum.value()));
    }
  }
}
