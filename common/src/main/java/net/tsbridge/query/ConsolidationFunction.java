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
package net.tsbridge.query;

import java.util.Locale;

/**
 * The reduction an archive applies when compacting raw samples into a 
 * coarser resolution. Only meaningful for archival backends.
 * 
 * @since 1.0
 */
public enum ConsolidationFunction {
  AVERAGE,
  MIN,
  MAX,
  LAST;
  
  /**
   * Maps an aggregator name such as "avg" or "max" to a consolidation 
   * function.
   * @param aggregator The aggregator, may be null.
   * @return The function, {@link #AVERAGE} for null or unknown names.
   */
  public static ConsolidationFunction fromAggregator(final String aggregator) {
    if (aggregator == null) {
      return AVERAGE;
    }
    switch (aggregator.toLowerCase(Locale.ROOT)) {
    case "min":
      return MIN;
    case "max":
      return MAX;
    case "last":
      return LAST;
    default:
      return AVERAGE;
    }
  }
}
