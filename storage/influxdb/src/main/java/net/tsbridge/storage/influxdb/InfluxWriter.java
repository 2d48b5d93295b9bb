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

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import net.tsbridge.data.TimeSeriesDatum;
import net.tsbridge.exceptions.ExecutionTimeoutException;
import net.tsbridge.exceptions.QueryExecutionException;
import net.tsbridge.exceptions.QueryValidationException;
import net.tsbridge.storage.TimeSeriesWriter;
import net.tsbridge.storage.WriteStatus;

/**
 * Writes batches of points as line protocol in a single request. Points
 * that cannot be formatted are rejected individually and the rest are 
 * sent. The status of the request applies to every point that was sent.
 * 
 * @since 1.0
 */
public class InfluxWriter implements TimeSeriesWriter {
  private static final Logger LOG = LoggerFactory.getLogger(
      InfluxWriter.class);
  
  private final InfluxExecutor executor;
  private final LineProtocolWriter formatter;
  
  /**
   * Default ctor.
   * @param executor The non-null executor.
   * @param formatter The non-null line protocol formatter.
   */
  public InfluxWriter(final InfluxExecutor executor, 
                      final LineProtocolWriter formatter) {
    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null.");
    }
    if (formatter == null) {
      throw new IllegalArgumentException("Formatter cannot be null.");
    }
    this.executor = executor;
    this.formatter = formatter;
  }
  
  @Override
  public WriteStatus write(final TimeSeriesDatum datum, 
                           final long timeout_ms) {
    return write(Collections.singletonList(datum), timeout_ms).get(0);
  }

  @Override
  public List<WriteStatus> write(final List<TimeSeriesDatum> data, 
                                 final long timeout_ms) {
    final WriteStatus[] statuses = new WriteStatus[data.size()];
    final List<String> lines = Lists.newArrayListWithCapacity(data.size());
    final List<Integer> sent = Lists.newArrayListWithCapacity(data.size());
    for (int i = 0; i < data.size(); i++) {
      try {
        lines.add(formatter.format(data.get(i)));
        sent.add(i);
      } catch (QueryValidationException e) {
        throw e;
      } catch (IllegalArgumentException e) {
        statuses[i] = WriteStatus.rejected(e.getMessage());
      }
    }
    
    if (!lines.isEmpty()) {
      final WriteStatus status = send(Joiner.on('\n').join(lines), 
          lines.size(), timeout_ms);
      for (final int index : sent) {
        statuses[index] = status;
      }
    }
    return Lists.newArrayList(statuses);
  }
  
  private WriteStatus send(final String body, 
                           final int points,
                           final long timeout_ms) {
    try {
      executor.write(body, timeout_ms);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Wrote " + points + " points to " + executor.endpoint());
      }
      return WriteStatus.OK;
    } catch (ExecutionTimeoutException e) {
      return WriteStatus.unknown("Timed out writing " + points 
          + " points to " + executor.endpoint(), e);
    } catch (QueryExecutionException e) {
      switch (e.getStatusCode()) {
      case 400:
      case 422:
        return WriteStatus.rejected(e.getMessage());
      case 429:
      case 503:
        LOG.warn("InfluxDB at " + executor.endpoint() + " asked to retry: " 
            + e.getMessage());
        return WriteStatus.retry(e.getMessage());
      default:
        LOG.error("Failed to write " + points + " points to " 
            + executor.endpoint(), e);
        return WriteStatus.error(e.getMessage(), e);
      }
    }
  }
}
