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

import java.util.List;
import java.util.Map;
import java.util.Set;

import net.tsbridge.data.MetricIdentifier;

/**
 * Maps a metric and label set onto a single RRD archive path and back.
 * Label discovery works by scanning the archives that exist for a metric
 * and decoding their paths.
 * 
 * @since 1.0
 */
public interface LabelStrategy {

  /**
   * Encodes the metric and labels into a path relative to the base 
   * directory. The same inputs always yield the same path.
   * @param metric The non-null metric.
   * @param labels The non-null labels, may be empty.
   * @return The relative path ending with {@code .rrd}.
   * @throws net.tsbridge.exceptions.UndefinedLabelException if a label was
   * not declared by the metric.
   */
  public String generateFilename(final MetricIdentifier metric, 
                                 final Map<String, String> labels);
  
  /**
   * Reverses {@link #generateFilename(MetricIdentifier, Map)}.
   * @param path A non-null relative path.
   * @return The decoded entry.
   * @throws IllegalArgumentException if the path was not produced by this
   * strategy.
   */
  public LabelIndexEntry decode(final String path);
  
  /**
   * @param metric The non-null metric.
   * @return The sorted relative paths of every archive for the metric.
   */
  public List<String> listFilenames(final MetricIdentifier metric);
  
  /**
   * @param metric The non-null metric.
   * @param conditions Conditions that must all match, may be null.
   * @return The decoded entries sorted by path.
   */
  public List<LabelIndexEntry> findFilenames(final MetricIdentifier metric, 
                                             final List<TagCondition> conditions);
  
  /**
   * @param metrics The non-null metrics to scan.
   * @return The distinct label names found across the archives.
   */
  public Set<String> listLabelNames(final List<MetricIdentifier> metrics);
  
  /**
   * @param metrics The non-null metrics to scan.
   * @param label The non-null label name.
   * @param conditions Conditions that must all match, may be null.
   * @return The distinct values of the label across matching archives.
   */
  public Set<String> listLabelValues(final List<MetricIdentifier> metrics, 
                                     final String label,
                                     final List<TagCondition> conditions);
  
  /** Drops any memoized directory scans. */
  public void invalidate();
}
