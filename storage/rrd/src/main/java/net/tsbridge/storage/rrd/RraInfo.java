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

import java.util.Map;
import java.util.SortedMap;

import com.google.common.base.Objects;

/**
 * The fields of one round robin archive reported by {@code rrdtool info},
 * with the consolidation preparation cells grouped by index.
 * 
 * @since 1.0
 */
public class RraInfo {
  private final Map<String, Object> fields;
  private final SortedMap<Integer, Map<String, Object>> cdp_prep;
  
  /**
   * Default ctor.
   * @param fields The non-null fields, e.g. {@code cf} or {@code rows}.
   * @param cdp_prep The non-null preparation cells by index.
   */
  public RraInfo(final Map<String, Object> fields, 
                 final SortedMap<Integer, Map<String, Object>> cdp_prep) {
    this.fields = fields;
    this.cdp_prep = cdp_prep;
  }
  
  public Map<String, Object> fields() {
    return fields;
  }
  
  public SortedMap<Integer, Map<String, Object>> cdpPrep() {
    return cdp_prep;
  }
  
  /** @return The consolidation function or null if not reported. */
  public String cf() {
    final Object cf = fields.get("cf");
    return cf == null ? null : cf.toString();
  }
  
  /** @return The row count or -1 if not reported. */
  public long rows() {
    final Object rows = fields.get("rows");
    return rows instanceof Number ? ((Number) rows).longValue() : -1;
  }
  
  /** @return The primary data points per row or -1 if not reported. */
  public long pdpPerRow() {
    final Object pdp = fields.get("pdp_per_row");
    return pdp instanceof Number ? ((Number) pdp).longValue() : -1;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final RraInfo that = (RraInfo) o;
    return Objects.equal(fields, that.fields)
        && Objects.equal(cdp_prep, that.cdp_prep);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(fields, cdp_prep);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("fields=")
        .append(fields)
        .append(", cdpPrep=")
        .append(cdp_prep)
        .toString();
  }
}
