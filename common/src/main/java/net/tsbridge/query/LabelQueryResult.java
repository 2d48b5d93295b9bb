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

import java.util.Collection;
import java.util.SortedSet;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSortedSet;

/**
 * The result of a {@link LabelQuery}: the label queried (null for name 
 * listings) and the sorted, distinct values.
 * 
 * @since 1.0
 */
public class LabelQueryResult {
  private final String label;
  private final SortedSet<String> values;
  
  /**
   * Default ctor.
   * @param label The label, may be null for name listings.
   * @param values The values, may be null or contain duplicates.
   */
  public LabelQueryResult(final String label, 
                          final Collection<String> values) {
    this.label = label;
    this.values = values == null ? ImmutableSortedSet.<String>of() : 
      ImmutableSortedSet.copyOf(values);
  }
  
  /** @return The label or null for name listings. */
  public String label() {
    return label;
  }
  
  /** @return The non-null sorted set of values. */
  public SortedSet<String> values() {
    return values;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final LabelQueryResult that = (LabelQueryResult) o;
    return Objects.equal(label, that.label)
        && Objects.equal(values, that.values);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(label, values);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("label=")
        .append(label)
        .append(", values=")
        .append(values)
        .toString();
  }
}
