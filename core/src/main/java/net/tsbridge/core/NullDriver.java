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

import java.util.Collections;
import java.util.List;

import com.google.common.collect.Lists;

import net.tsbridge.data.TimeSeriesDatum;
import net.tsbridge.query.Capabilities;
import net.tsbridge.query.DataQuery;
import net.tsbridge.query.DefaultCapabilities;
import net.tsbridge.query.LabelQuery;
import net.tsbridge.query.LabelQueryResult;
import net.tsbridge.query.QueryResult;
import net.tsbridge.storage.TimeSeriesWriter;
import net.tsbridge.storage.WriteStatus;

/**
 * A driver that discards writes and returns empty results. Useful for 
 * tests and for disabling storage.
 * 
 * @since 1.0
 */
public class NullDriver extends BaseTSDBPlugin 
    implements TimeSeriesDriver, TimeSeriesWriter {
  public static final String NAME = "null";
  
  private static final Capabilities CAPABILITIES = 
      DefaultCapabilities.newBuilder()
        .setRate(true)
        .setHistogram(true)
        .setLabelJoin(true)
        .build();
  
  @Override
  public String type() {
    return NullDriver.class.getSimpleName();
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
    return new QueryResult(Collections.emptyList(), query.getTimeRange(), 
        query.getResolution());
  }

  @Override
  public LabelQueryResult labels(final LabelQuery query, 
                                 final long timeout_ms) {
    return new LabelQueryResult(query.getLabel(), 
        Collections.<String>emptyList());
  }

  @Override
  public TimeSeriesWriter writer() {
    return this;
  }

  @Override
  public WriteStatus write(final TimeSeriesDatum datum, 
                           final long timeout_ms) {
    return WriteStatus.ok();
  }

  @Override
  public List<WriteStatus> write(final List<TimeSeriesDatum> data, 
                                 final long timeout_ms) {
    final List<WriteStatus> statuses = Lists.newArrayListWithCapacity(
        data.size());
    for (int i = 0; i < data.size(); i++) {
      statuses.add(WriteStatus.ok());
    }
    return statuses;
  }
}
