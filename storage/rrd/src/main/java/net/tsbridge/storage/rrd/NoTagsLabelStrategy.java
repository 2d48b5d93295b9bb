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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Splitter;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.exceptions.QueryValidationException;

/**
 * One archive per metric, {@code <ns>/<name>.rrd}, without labels.
 * 
 * @since 1.0
 */
public class NoTagsLabelStrategy extends BaseLabelStrategy {
  public static final String NAME = "notags";
  
  /**
   * Default ctor.
   * @param base_dir The non-null base directory.
   * @param lister An optional remote lister.
   * @param cache_scans Whether or not to memoize scans.
   */
  public NoTagsLabelStrategy(final String base_dir, 
                             final RrdExecutor lister,
                             final boolean cache_scans) {
    super(base_dir, lister, cache_scans);
  }
  
  @Override
  public String generateFilename(final MetricIdentifier metric, 
                                 final Map<String, String> labels) {
    if (metric == null) {
      throw new IllegalArgumentException("Metric cannot be null.");
    }
    if (labels != null && !labels.isEmpty()) {
      throw new QueryValidationException("The " + NAME 
          + " label strategy does not store labels but received: " 
          + labels.keySet(), "labels");
    }
    final String file = LabelCodec.encode(metric.getName()) + EXTENSION;
    if (file.length() > FilenameTooLongException.MAX_LENGTH) {
      throw new FilenameTooLongException(file);
    }
    return LabelCodec.encode(metric.getNamespace()) + "/" + file;
  }

  @Override
  public LabelIndexEntry decode(final String path) {
    if (path == null) {
      throw new IllegalArgumentException("Path cannot be null.");
    }
    final List<String> parts = Splitter.on('/').splitToList(path);
    if (parts.size() != 2 || !parts.get(1).endsWith(EXTENSION)) {
      throw new IllegalArgumentException("Expected <namespace>/<name>.rrd: " 
          + path);
    }
    final String name = parts.get(1).substring(0, 
        parts.get(1).length() - EXTENSION.length());
    return new LabelIndexEntry(
        LabelCodec.decode(parts.get(0)), 
        LabelCodec.decode(name), 
        Collections.<String, String>emptyMap(), 
        path);
  }
  
  @Override
  protected String scanDirectory(final MetricIdentifier metric) {
    return LabelCodec.encode(metric.getNamespace());
  }
}
