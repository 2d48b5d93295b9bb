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

import net.tsbridge.query.Capabilities;
import net.tsbridge.query.DataQuery;
import net.tsbridge.query.LabelQuery;
import net.tsbridge.query.LabelQueryResult;
import net.tsbridge.query.QueryResult;
import net.tsbridge.storage.TimeSeriesWriter;

/**
 * A backend binding: compiles the universal AST to native commands, runs
 * them and parses the output back into universal results. Drivers are 
 * built by a {@link DriverFactory} and initialized with the TSDB.
 * 
 * @since 1.0
 */
public interface TimeSeriesDriver extends TSDBPlugin {
  
  /** @return The registry name of the driver. */
  public String name();
  
  /** @return The non-null capability descriptor. */
  public Capabilities capabilities();
  
  /**
   * Runs a data query.
   * @param query The non-null query.
   * @param timeout_ms The deadline in milliseconds.
   * @return The non-null result.
   */
  public QueryResult query(final DataQuery query, final long timeout_ms);
  
  /**
   * Lists label names or label values.
   * @param query The non-null query.
   * @param timeout_ms The deadline in milliseconds.
   * @return The non-null result.
   */
  public LabelQueryResult labels(final LabelQuery query, 
                                 final long timeout_ms);
  
  /**
   * @return The writer for this backend.
   * @throws net.tsbridge.exceptions.UnsupportedQueryOperationException if
   * the backend does not accept writes.
   */
  public TimeSeriesWriter writer();
}
