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
import java.util.Map.Entry;
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.base.Splitter;
import com.google.common.collect.Maps;

import net.tsbridge.data.MetricIdentifier;

/**
 * The default strategy that encodes every label into the file name:
 * {@code <ns>/<name>/<k1>=<v1>,<k2>=<v2>.rrd} with the labels sorted by
 * key. A metric written without labels lands in {@code _default.rrd}.
 * 
 * @since 1.0
 */
public class FilenameLabelStrategy extends BaseLabelStrategy {
  public static final String NAME = "filename";
  
  /** The file name used for an empty label set. */
  public static final String DEFAULT_NAME = "_default";
  
  /**
   * Default ctor.
   * @param base_dir The non-null base directory.
   * @param lister An optional remote lister.
   * @param cache_scans Whether or not to memoize scans.
   */
  public FilenameLabelStrategy(final String base_dir, 
                               final RrdExecutor lister,
                               final boolean cache_scans) {
    super(base_dir, lister, cache_scans);
  }
  
  @Override
  public String generateFilename(final MetricIdentifier metric, 
                                 final Map<String, String> labels) {
    final Map<String, String> validated = validate(metric, labels);
    return metricDirectory(metric) + "/" 
        + labelFile(new TreeMap<>(validated));
  }

  @Override
  public LabelIndexEntry decode(final String path) {
    if (path == null) {
      throw new IllegalArgumentException("Path cannot be null.");
    }
    final List<String> parts = Splitter.on('/').splitToList(path);
    if (parts.size() != 3) {
      throw new IllegalArgumentException("Expected <namespace>/<name>/"
          + "<labels>.rrd: " + path);
    }
    return new LabelIndexEntry(
        LabelCodec.decode(parts.get(0)), 
        LabelCodec.decode(parts.get(1)), 
        decodeLabelFile(parts.get(2), Maps.<String, String>newTreeMap()), 
        path);
  }
  
  @Override
  protected String scanDirectory(final MetricIdentifier metric) {
    return metricDirectory(metric);
  }
  
  /**
   * Renders the sorted labels as the archive file name.
   * @param labels The non-null sorted labels.
   * @return The file name with extension.
   * @throws FilenameTooLongException if the name was too long.
   */
  static String labelFile(final SortedMap<String, String> labels) {
    final String file;
    if (labels.isEmpty()) {
      file = DEFAULT_NAME + EXTENSION;
    } else {
      final StringBuilder buf = new StringBuilder();
      for (final Entry<String, String> entry : labels.entrySet()) {
        if (buf.length() > 0) {
          buf.append(',');
        }
        buf.append(LabelCodec.encode(entry.getKey()))
           .append('=')
           .append(LabelCodec.encode(entry.getValue()));
      }
      file = buf.append(EXTENSION).toString();
    }
    if (file.length() > FilenameTooLongException.MAX_LENGTH) {
      throw new FilenameTooLongException(file);
    }
    return file;
  }
  
  /**
   * Parses a file name produced by {@link #labelFile(SortedMap)}.
   * @param file The non-null file name with extension.
   * @param labels The map to populate.
   * @return The populated map.
   * @throws IllegalArgumentException if the name was malformed.
   */
  static Map<String, String> decodeLabelFile(final String file, 
                                             final Map<String, String> labels) {
    if (!file.endsWith(EXTENSION)) {
      throw new IllegalArgumentException("Not an archive: " + file);
    }
    final String base = file.substring(0, file.length() - EXTENSION.length());
    if (base.equals(DEFAULT_NAME)) {
      return labels;
    }
    for (final String pair : Splitter.on(',').split(base)) {
      decodePair(pair, labels);
    }
    return labels;
  }
  
  /**
   * Parses one {@code k=v} component into the map.
   * @param pair The non-null pair.
   * @param labels The map to populate.
   * @return The decoded key.
   * @throws IllegalArgumentException if the pair was malformed or the key
   * repeated.
   */
  static String decodePair(final String pair, 
                           final Map<String, String> labels) {
    final int idx = pair.indexOf('=');
    if (idx < 1) {
      throw new IllegalArgumentException("Expected <key>=<value>: " + pair);
    }
    final String key = LabelCodec.decode(pair.substring(0, idx));
    final String value = LabelCodec.decode(pair.substring(idx + 1));
    if (labels.put(key, value) != null) {
      throw new IllegalArgumentException("Duplicate label " + key 
          + " in: " + pair);
    }
    return key;
  }
}
