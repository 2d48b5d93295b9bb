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

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSortedMap;

/**
 * One decoded mapping between a metric, a label set and the relative path
 * of the archive holding it. Entries are derived from file names on 
 * demand and never stored.
 * 
 * @since 1.0
 */
public class LabelIndexEntry {
  private final String namespace;
  private final String name;
  private final Map<String, String> labels;
  private final String path;
  
  /**
   * Default ctor.
   * @param namespace The non-null metric namespace.
   * @param name The non-null metric name.
   * @param labels The non-null labels.
   * @param path The non-null relative path.
   */
  public LabelIndexEntry(final String namespace, 
                         final String name, 
                         final Map<String, String> labels, 
                         final String path) {
    this.namespace = namespace;
    this.name = name;
    this.labels = ImmutableSortedMap.copyOf(labels);
    this.path = path;
  }
  
  public String namespace() {
    return namespace;
  }
  
  public String name() {
    return name;
  }
  
  /** @return The metric key, {@code namespace.name}. */
  public String key() {
    return namespace + "." + name;
  }
  
  /** @return The labels sorted by key. */
  public Map<String, String> labels() {
    return labels;
  }
  
  /** @return The path relative to the base directory. */
  public String path() {
    return path;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final LabelIndexEntry that = (LabelIndexEntry) o;
    return Objects.equal(namespace, that.namespace)
        && Objects.equal(name, that.name)
        && Objects.equal(labels, that.labels)
        && Objects.equal(path, that.path);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(namespace, name, labels, path);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("metric=")
        .append(key())
        .append(", labels=")
        .append(labels)
        .append(", path=")
        .append(path)
        .toString();
  }
}
