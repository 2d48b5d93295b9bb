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
package net.tsbridge.core;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.tsbridge.data.MetricIdentifier;
import net.tsbridge.utils.SerdesException;
import net.tsbridge.utils.YAML;

/**
 * A thread safe metric registry. Metrics can be registered at runtime or
 * loaded from a YAML file in the form:
 * <pre>
 * metrics:
 *   - namespace: net
 *     name: bytes.in
 *     unit: bytes
 *     type: COUNTER
 *     labels: [host, ifName]
 *     aggregations: [avg, max]
 *     retention_policies:
 *       - resolution: 60
 *         retention: 172800
 * </pre>
 * 
 * @since 1.0
 */
public class DefaultMetricRegistry implements MetricRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(
      DefaultMetricRegistry.class);
  
  /** The metrics keyed on namespace.name. */
  private final ConcurrentNavigableMap<String, MetricIdentifier> metrics;
  
  public DefaultMetricRegistry() {
    metrics = new ConcurrentSkipListMap<String, MetricIdentifier>();
  }
  
  @Override
  public void register(final MetricIdentifier metric) {
    if (metric == null) {
      throw new IllegalArgumentException("Metric cannot be null.");
    }
    final MetricIdentifier extant = metrics.putIfAbsent(metric.key(), metric);
    if (extant != null) {
      throw new IllegalArgumentException("A metric is already registered "
          + "for " + metric.key());
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Registered metric: " + metric);
    }
  }

  @Override
  public MetricIdentifier get(final String namespace, final String name) {
    return get(namespace + "." + name);
  }

  @Override
  public MetricIdentifier get(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return metrics.get(key);
  }

  @Override
  public Collection<MetricIdentifier> all() {
    return ImmutableList.copyOf(metrics.values());
  }
  
  /**
   * Loads and registers the metrics in the YAML document.
   * @param stream The non-null stream to read.
   * @return The number of metrics registered.
   * @throws IllegalArgumentException if the document was malformed or 
   * contained a duplicate.
   */
  public int loadYaml(final InputStream stream) {
    if (stream == null) {
      throw new IllegalArgumentException("Stream cannot be null.");
    }
    final MetricsFile file;
    try {
      file = YAML.getMapper().readValue(stream, MetricsFile.class);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException("Invalid metric definitions", e);
    } catch (IOException e) {
      throw new SerdesException(e);
    }
    if (file == null || file.metrics == null) {
      LOG.warn("No metrics found in the YAML document.");
      return 0;
    }
    for (final MetricIdentifier metric : file.metrics) {
      register(metric);
    }
    LOG.info("Loaded " + file.metrics.size() + " metrics from YAML.");
    return file.metrics.size();
  }
  
  /** The root of a metrics document. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  static class MetricsFile {
    @JsonProperty
    List<MetricIdentifier> metrics;
  }
}
