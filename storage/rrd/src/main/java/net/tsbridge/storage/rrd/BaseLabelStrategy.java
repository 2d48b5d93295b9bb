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

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.exceptions.QueryExecutionException;

/**
 * Shared code for the label strategies: directory scans, the optional scan
 * memo, label validation and condition matching. Scans walk the local 
 * file system under the base directory or, when a lister is given, run 
 * {@code list --recursive} through it so archives behind rrdcached can be 
 * discovered.
 * 
 * @since 1.0
 */
public abstract class BaseLabelStrategy implements LabelStrategy {
  private static final Logger LOG = LoggerFactory.getLogger(
      BaseLabelStrategy.class);
  
  /** The archive extension. */
  public static final String EXTENSION = ".rrd";
  
  /** How long a remote listing may take. */
  public static final long LIST_TIMEOUT_MS = 30000;
  
  protected final String base_dir;
  
  /** Used for listing when not null. */
  protected final RrdExecutor lister;
  
  /** Scan results keyed on the relative directory when enabled. */
  protected final Map<String, List<String>> cache;
  
  /**
   * Default ctor.
   * @param base_dir The non-null and non-empty base directory.
   * @param lister An optional executor used for listings. If null the 
   * local file system is walked.
   * @param cache_scans Whether or not to memoize scans until 
   * {@link #invalidate()} is called.
   */
  protected BaseLabelStrategy(final String base_dir, 
                              final RrdExecutor lister, 
                              final boolean cache_scans) {
    if (Strings.isNullOrEmpty(base_dir)) {
      throw new IllegalArgumentException("Base directory cannot be null "
          + "or empty.");
    }
    this.base_dir = base_dir.endsWith("/") && base_dir.length() > 1 ? 
        base_dir.substring(0, base_dir.length() - 1) : base_dir;
    this.lister = lister;
    cache = cache_scans ? new ConcurrentHashMap<String, List<String>>() : null;
  }
  
  /**
   * @param metric The non-null metric.
   * @return The relative directory that holds every archive of the metric.
   */
  protected abstract String scanDirectory(final MetricIdentifier metric);
  
  @Override
  public List<String> listFilenames(final MetricIdentifier metric) {
    final List<String> files = Lists.newArrayList();
    for (final String path : scan(scanDirectory(metric))) {
      final LabelIndexEntry entry = tryDecode(path);
      if (entry != null && 
          entry.namespace().equals(metric.getNamespace()) &&
          entry.name().equals(metric.getName())) {
        files.add(path);
      }
    }
    Collections.sort(files);
    return files;
  }
  
  @Override
  public List<LabelIndexEntry> findFilenames(
      final MetricIdentifier metric, 
      final List<TagCondition> conditions) {
    final List<LabelIndexEntry> entries = Lists.newArrayList();
    for (final String path : listFilenames(metric)) {
      final LabelIndexEntry entry = decode(path);
      if (TagCondition.matchesAll(conditions, entry.labels())) {
        entries.add(entry);
      }
    }
    return entries;
  }
  
  @Override
  public Set<String> listLabelNames(final List<MetricIdentifier> metrics) {
    final Set<String> names = Sets.newTreeSet();
    for (final MetricIdentifier metric : metrics) {
      for (final String path : listFilenames(metric)) {
        names.addAll(decode(path).labels().keySet());
      }
    }
    return names;
  }
  
  @Override
  public Set<String> listLabelValues(final List<MetricIdentifier> metrics, 
                                     final String label,
                                     final List<TagCondition> conditions) {
    if (Strings.isNullOrEmpty(label)) {
      throw new IllegalArgumentException("Label cannot be null or empty.");
    }
    final Set<String> values = Sets.newTreeSet();
    for (final MetricIdentifier metric : metrics) {
      for (final LabelIndexEntry entry : findFilenames(metric, conditions)) {
        final String value = entry.labels().get(label);
        if (value != null) {
          values.add(value);
        }
      }
    }
    return values;
  }
  
  @Override
  public void invalidate() {
    if (cache != null) {
      cache.clear();
    }
  }
  
  /**
   * Validates labels against the metric and rejects null values.
   * @param metric The non-null metric.
   * @param labels The labels, may be null.
   * @return A non-null map.
   * @throws net.tsbridge.exceptions.UndefinedLabelException if a label
   * was not declared.
   */
  protected Map<String, String> validate(final MetricIdentifier metric, 
                                         final Map<String, String> labels) {
    if (metric == null) {
      throw new IllegalArgumentException("Metric cannot be null.");
    }
    if (labels == null) {
      return Collections.emptyMap();
    }
    metric.validateLabels(labels.keySet());
    for (final Map.Entry<String, String> entry : labels.entrySet()) {
      if (entry.getValue() == null) {
        throw new IllegalArgumentException("Value for label " 
            + entry.getKey() + " cannot be null.");
      }
    }
    return labels;
  }
  
  /** @return The encoded metric directory {@code <ns>/<name>}. */
  protected static String metricDirectory(final MetricIdentifier metric) {
    return LabelCodec.encode(metric.getNamespace()) + "/" 
        + LabelCodec.encode(metric.getName());
  }
  
  /**
   * Lists the archive paths under the relative directory.
   * @param directory The non-null relative directory.
   * @return Relative paths of every {@code .rrd} file below it.
   */
  protected List<String> scan(final String directory) {
    if (cache != null) {
      final List<String> cached = cache.get(directory);
      if (cached != null) {
        return cached;
      }
    }
    final List<String> files = lister == null ? 
        walk(directory) : listRemote(directory);
    if (cache != null) {
      cache.put(directory, files);
    }
    return files;
  }
  
  private LabelIndexEntry tryDecode(final String path) {
    try {
      return decode(path);
    } catch (IllegalArgumentException e) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Skipping archive not written by this strategy: " + path 
            + " (" + e.getMessage() + ")");
      }
      return null;
    }
  }
  
  private List<String> walk(final String directory) {
    final Path base = Paths.get(base_dir);
    final Path root = base.resolve(directory);
    if (!Files.isDirectory(root)) {
      return Collections.emptyList();
    }
    try (final Stream<Path> stream = Files.walk(root)) {
      return ImmutableList.copyOf(stream
          .filter(Files::isRegularFile)
          .map(path -> base.relativize(path).toString()
              .replace(File.separatorChar, '/'))
          .filter(path -> path.endsWith(EXTENSION))
          .sorted()
          .collect(Collectors.toList()));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to scan " + root, e);
    }
  }
  
  private List<String> listRemote(final String directory) {
    final String output;
    try {
      output = lister.execute(RrdCommandBuilder.list(directory), 
          LIST_TIMEOUT_MS);
    } catch (RrdFileNotFoundException e) {
      return Collections.emptyList();
    } catch (QueryExecutionException e) {
      LOG.error("Failed to list archives under " + directory 
          + " via " + lister.endpoint(), e);
      throw e;
    }
    final List<String> files = Lists.newArrayList();
    for (String line : Splitter.on('\n').trimResults().omitEmptyStrings()
        .split(output)) {
      if (line.startsWith(base_dir + "/")) {
        line = line.substring(base_dir.length() + 1);
      } else if (line.startsWith("/")) {
        line = line.substring(1);
      }
      if (!line.startsWith(directory + "/")) {
        line = directory + "/" + line;
      }
      if (line.endsWith(EXTENSION)) {
        files.add(line);
      }
    }
    Collections.sort(files);
    return ImmutableList.copyOf(files);
  }
}
