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
package net.tsbridge.storage;

import java.util.List;

import net.tsbridge.data.TimeSeriesDatum;

/**
 * Writes universal points to a backend. Per-point backend failures are
 * reported through {@link WriteStatus} rather than thrown.
 * 
 * @since 1.0
 */
public interface TimeSeriesWriter {

  /**
   * Writes a single point.
   * @param datum The non-null point.
   * @param timeout_ms The deadline in milliseconds.
   * @return The non-null status.
   * @throws net.tsbridge.exceptions.QueryValidationException if the point
   * used an undeclared label.
   */
  public WriteStatus write(final TimeSeriesDatum datum, final long timeout_ms);
  
  /**
   * Writes a batch of points.
   * @param data The non-null points.
   * @param timeout_ms The deadline in milliseconds.
   * @return One status per point in input order.
   * @throws net.tsbridge.exceptions.QueryValidationException if a point
   * used an undeclared label.
   */
  public List<WriteStatus> write(final List<TimeSeriesDatum> data, 
                                 final long timeout_ms);
}
