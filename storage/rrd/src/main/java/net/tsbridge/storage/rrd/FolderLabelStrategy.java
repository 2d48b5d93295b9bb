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
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import net.tsbridge.data.MetricIdentifier;

/**
 * Stores the configured folder labels as directories and the remaining 
 * labels in the file name: 
 * {@code <ns>/<name>/<fk1>=<fv1>/.../<k>=<v>,....rrd}. A folder label 
 * missing from a label set is written as the {@code _} directory.
 * 
 * @since 1.0
 */
public class FolderLabelStrategy extends BaseLabelStrategy {
  public static final String NAME = "folder";
  
  /** The directory used for an absent folder label. */
  public static final String ABSENT = "_";
  
  private final List<String> folder_labels;
  
  /**
   * Default ctor.
   * @param base_dir The non-null base directory.
   * @param lister An optional remote lister.
   * @param cache_scans Whether or not to memoize scans.
   * @param folder_labels The non-null labels stored as directories, in 
   * order.
   */
  public FolderLabelStrategy(final String base_dir, 
                             final RrdExecutor lister,
                             final boolean cache_scans,
                             final List<String> folder_labels) {
    super(base_dir, lister, cache_scans);
    if (folder_labels == null) {
      throw new IllegalArgumentException("Folder labels cannot be null.");
    }
    this.folder_labels = ImmutableList.copyOf(folder_labels);
  }
  
  @Override
  public String generateFilename(final MetricIdentifier metric, 
                                 final Map<String, String> labels) {
    final SortedMap<String, String> remaining = 
        new TreeMap<>(validate(metric, labels));
    final StringBuilder buf = new StringBuilder(metricDirectory(metric));
    for (final String folder : folder_labels) {
      final String value = remaining.remove(folder);
      final String directory = value == null ? ABSENT : 
        LabelCodec.encode(folder) + "=" + LabelCodec.encode(value);
      if (directory.length() > FilenameTooLongException.MAX_LENGTH) {
        throw new FilenameTooLongException(directory);
      }
      buf.append('/')
         .append(directory);
    }
    return buf.append('/')
              .append(FilenameLabelStrategy.labelFile(remaining))
              .toString();
  }

  @Override
  public LabelIndexEntry decode(final String path) {
    if (path == null) {
      throw new IllegalArgumentException("Path cannot be null.");
    }
    final List<String> parts = Splitter.on('/').splitToList(path);
    if (parts.size() != 3 + folder_labels.size()) {
      throw new IllegalArgumentException("Expected " + folder_labels.size() 
          + " label folders in: " + path);
    }
    final Map<String, String> labels = Maps.newTreeMap();
    for (int i = 0; i < folder_labels.size(); i++) {
      final String directory = parts.get(2 + i);
      if (directory.equals(ABSENT)) {
        continue;
      }
      final String key = FilenameLabelStrategy.decodePair(directory, labels);
      if (!key.equals(folder_labels.get(i))) {
        throw new IllegalArgumentException("Expected folder label " 
            + folder_labels.get(i) + " but found " + key + " in: " + path);
      }
    }
    FilenameLabelStrategy.decodeLabelFile(parts.get(parts.size() - 1), labels);
    return new LabelIndexEntry(
        LabelCodec.decode(parts.get(0)), 
        LabelCodec.decode(parts.get(1)), 
        labels, 
        path);
  }
  
  @Override
  protected String scanDirectory(final MetricIdentifier metric) {
    return metricDirectory(metric);
  }
  
  /** @return The labels stored as directories. */
  public List<String> folderLabels() {
    return folder_labels;
  }
}
