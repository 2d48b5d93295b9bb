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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tsbridge.data.TimeSeriesDatum;
import net.tsbridge.exceptions.QueryValidationException;
import net.tsbridge.storage.TimeSeriesWriter;
import net.tsbridge.storage.WriteStatus;
import net.tsbridge.storage.WriteStatus.WriteState;

/**
 * Sends every point to each delegate writer in turn and merges the 
 * statuses per point. A point is OK only if every delegate stored it.
 * Otherwise the most severe state wins, in the order REJECTED, ERROR, 
 * UNKNOWN, RETRY, and the message names each failing delegate.
 * <p>
 * All delegates share the caller's deadline. Delegates that are not 
 * reached before it expires report RETRY. Validation exceptions from a 
 * delegate are thrown to the caller.
 * 
 * @since 1.0
 */
public class AggregateWriter implements TimeSeriesWriter {
  private static final Logger LOG = LoggerFactory.getLogger(
      AggregateWriter.class);
  
  /** Delegate names used in messages, parallel to writers. */
  private final List<String> names;
  
  /** The delegates. */
  private final List<TimeSeriesWriter> writers;
  
  /**
   * Default ctor.
   * @param names The non-null names of the delegates.
   * @param writers The non-null and non-empty delegates, same size as 
   * names.
   */
  public AggregateWriter(final List<String> names, 
                         final List<TimeSeriesWriter> writers) {
    if (names == null || writers == null || writers.isEmpty()) {
      throw new IllegalArgumentException("At least one writer is required.");
    }
    if (names.size() != writers.size()) {
      throw new IllegalArgumentException("Names and writers differ in "
          + "size: " + names.size() + " vs " + writers.size());
    }
    this.names = ImmutableList.copyOf(names);
    this.writers = ImmutableList.copyOf(writers);
  }
  
  @Override
  public WriteStatus write(final TimeSeriesDatum datum, 
                           final long timeout_ms) {
    return write(Lists.newArrayList(datum), timeout_ms).get(0);
  }

  @Override
  public List<WriteStatus> write(final List<TimeSeriesDatum> data, 
                                 final long timeout_ms) {
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null.");
    }
    final long deadline = System.currentTimeMillis() + timeout_ms;
    final List<List<WriteStatus>> results = 
        Lists.newArrayListWithCapacity(writers.size());
    for (int i = 0; i < writers.size(); i++) {
      final long remaining = deadline - System.currentTimeMillis();
      if (remaining <= 0) {
        final List<WriteStatus> expired = 
            Lists.newArrayListWithCapacity(data.size());
        for (int x = 0; x < data.size(); x++) {
          expired.add(WriteStatus.retry("Deadline expired before writing "
              + "to " + names.get(i)));
        }
        results.add(expired);
        continue;
      }
      
      List<WriteStatus> statuses;
      try {
        statuses = writers.get(i).write(data, remaining);
      } catch (QueryValidationException e) {
        throw e;
      } catch (RuntimeException e) {
        LOG.error("Unexpected exception writing to " + names.get(i), e);
        statuses = Lists.newArrayListWithCapacity(data.size());
        for (int x = 0; x < data.size(); x++) {
          statuses.add(WriteStatus.error(e.getMessage(), e));
        }
      }
      if (statuses.size() != data.size()) {
        throw new IllegalStateException("Writer " + names.get(i) 
            + " returned " + statuses.size() + " statuses for " 
            + data.size() + " points.");
      }
      results.add(statuses);
    }
    
    final List<WriteStatus> merged = 
        Lists.newArrayListWithCapacity(data.size());
    for (int x = 0; x < data.size(); x++) {
      merged.add(merge(results, x));
    }
    return merged;
  }
  
  /**
   * Merges the statuses of every delegate for one point.
   * @param results The per delegate results.
   * @param index The index of the point.
   * @return The merged status.
   */
  private WriteStatus merge(final List<List<WriteStatus>> results, 
                            final int index) {
    WriteStatus worst = null;
    StringBuilder buf = null;
    for (int i = 0; i < results.size(); i++) {
      final WriteStatus status = results.get(i).get(index);
      if (status.state() == WriteState.OK) {
        continue;
      }
      if (buf == null) {
        buf = new StringBuilder();
      } else {
        buf.append("; ");
      }
      buf.append(names.get(i))
         .append(": ")
         .append(status.state())
         .append(status.message() == null ? "" : " " + status.message());
      if (worst == null || severity(status.state()) > 
          severity(worst.state())) {
        worst = status;
      }
    }
    
    if (worst == null) {
      return WriteStatus.OK;
    }
    switch (worst.state()) {
    case RETRY:
      return WriteStatus.retry(buf.toString());
    case REJECTED:
      return WriteStatus.rejected(buf.toString());
    case ERROR:
      return WriteStatus.error(buf.toString(), worst.exception());
    default:
      return WriteStatus.unknown(buf.toString(), worst.exception());
    }
  }
  
  static int severity(final WriteState state) {
    switch (state) {
    case OK:
      return 0;
    case RETRY:
      return 1;
    case UNKNOWN:
      return 2;
    case ERROR:
      return 3;
    case REJECTED:
      return 4;
    default:
      throw new IllegalArgumentException("Unhandled state: " + state);
    }
  }
}
