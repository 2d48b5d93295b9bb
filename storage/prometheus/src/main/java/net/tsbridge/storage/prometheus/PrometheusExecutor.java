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
package net.tsbridge.storage.prometheus;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

import org.apache.http.HttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.utils.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

import net.tsbridge.data.TimeRange;
import net.tsbridge.query.QueryExecutor;
import net.tsbridge.utils.SharedHttpClient;

/**
 * Issues GET requests against the Prometheus HTTP API through the shared
 * client and returns the raw JSON bodies. Non-2xx responses raise 
 * {@link net.tsbridge.exceptions.RemoteQueryExecutionException} with the
 * error from the body.
 * 
 * @since 1.0
 */
public class PrometheusExecutor implements QueryExecutor<PromQuery, String> {
  private static final Logger LOG = LoggerFactory.getLogger(
      PrometheusExecutor.class);
  
  public static final String QUERY_RANGE_PATH = "/api/v1/query_range";
  public static final String LABELS_PATH = "/api/v1/labels";
  public static final String LABEL_VALUES_PATH = "/api/v1/label/%s/values";
  
  private final SharedHttpClient client;
  private final String url;
  
  /**
   * Default ctor.
   * @param client The non-null shared client.
   * @param url The non-null and non-empty server URL, e.g. 
   * {@code http://localhost:9090}.
   */
  public PrometheusExecutor(final SharedHttpClient client, final String url) {
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    if (Strings.isNullOrEmpty(url)) {
      throw new IllegalArgumentException("URL cannot be null or empty.");
    }
    this.client = client;
    this.url = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
  
  @Override
  public String execute(final PromQuery compiled, final long timeout_ms) {
    final URIBuilder builder = builder(QUERY_RANGE_PATH)
        .addParameter("query", compiled.query())
        .addParameter("start", Long.toString(compiled.start()))
        .addParameter("end", Long.toString(compiled.end()))
        .addParameter("step", compiled.step() + "s");
    return get(builder, timeout_ms);
  }
  
  /**
   * Lists label names of the series matching any of the selectors.
   * @param selectors The selectors, may be empty to list all names.
   * @param range An optional range, may be null.
   * @param timeout_ms The deadline in milliseconds.
   * @return The raw JSON body.
   */
  public String labelNames(final List<String> selectors, 
                           final TimeRange range, 
                           final long timeout_ms) {
    return get(withMatchers(builder(LABELS_PATH), selectors, range), 
        timeout_ms);
  }
  
  /**
   * Lists the values of a label across the series matching any of the 
   * selectors.
   * @param label The non-null label name.
   * @param selectors The selectors, may be empty.
   * @param range An optional range, may be null.
   * @param timeout_ms The deadline in milliseconds.
   * @return The raw JSON body.
   */
  public String labelValues(final String label, 
                            final List<String> selectors,
                            final TimeRange range,
                            final long timeout_ms) {
    return get(withMatchers(builder(String.format(LABEL_VALUES_PATH, label)), 
        selectors, range), timeout_ms);
  }
  
  /** @return The server URL. */
  public String endpoint() {
    return url;
  }
  
  private URIBuilder builder(final String path) {
    try {
      return new URIBuilder(url + path);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid Prometheus URL: " + url, e);
    }
  }
  
  private static URIBuilder withMatchers(final URIBuilder builder, 
                                         final List<String> selectors,
                                         final TimeRange range) {
    if (selectors != null) {
      for (final String selector : selectors) {
        builder.addParameter("match[]", selector);
      }
    }
    if (range != null) {
      builder.addParameter("start", Long.toString(range.getStart()))
             .addParameter("end", Long.toString(range.getEnd()));
    }
    return builder;
  }
  
  private String get(final URIBuilder builder, final long timeout_ms) {
    final URI uri;
    try {
      uri = builder.build();
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Failed to build a request for " 
          + url, e);
    }
    final HttpGet get = new HttpGet(uri);
    get.addHeader("Accept", "application/json");
    if (LOG.isTraceEnabled()) {
      LOG.trace("Querying Prometheus: " + uri);
    }
    final HttpResponse response = client.execute(get, timeout_ms, url);
    return SharedHttpClient.parseResponse(response, url);
  }
}
