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
package net.tsbridge.storage.influxdb;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;

import org.apache.http.HttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

import net.tsbridge.query.QueryExecutor;
import net.tsbridge.utils.SharedHttpClient;

/**
 * Talks to the InfluxDB 2 HTTP API through the shared client. Flux 
 * scripts are posted to the query endpoint and return annotated CSV, line
 * protocol batches are posted to the write endpoint. Every request 
 * carries the API token.
 * 
 * @since 1.0
 */
public class InfluxExecutor implements QueryExecutor<FluxQuery, String> {
  private static final Logger LOG = LoggerFactory.getLogger(
      InfluxExecutor.class);
  
  public static final String QUERY_PATH = "/api/v2/query";
  public static final String WRITE_PATH = "/api/v2/write";
  
  static final ContentType FLUX = ContentType.create("application/vnd.flux", 
      StandardCharsets.UTF_8);
  static final ContentType LINE_PROTOCOL = ContentType.create("text/plain", 
      StandardCharsets.UTF_8);
  
  private final SharedHttpClient client;
  private final String url;
  private final String token;
  private final String org;
  private final String bucket;
  
  /**
   * Default ctor.
   * @param client The non-null shared client.
   * @param url The non-null and non-empty server URL.
   * @param token An optional API token, may be null for unauthenticated
   * servers.
   * @param org The non-null and non-empty organization.
   * @param bucket The non-null and non-empty bucket written to.
   */
  public InfluxExecutor(final SharedHttpClient client, 
                        final String url,
                        final String token,
                        final String org,
                        final String bucket) {
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    if (Strings.isNullOrEmpty(url)) {
      throw new IllegalArgumentException("URL cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(org)) {
      throw new IllegalArgumentException("Org cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(bucket)) {
      throw new IllegalArgumentException("Bucket cannot be null or empty.");
    }
    this.client = client;
    this.url = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    this.token = token;
    this.org = org;
    this.bucket = bucket;
  }
  
  @Override
  public String execute(final FluxQuery compiled, final long timeout_ms) {
    return query(compiled.flux(), timeout_ms);
  }
  
  /**
   * Runs a Flux script.
   * @param flux The non-null script.
   * @param timeout_ms The deadline in milliseconds.
   * @return The annotated CSV body.
   */
  public String query(final String flux, final long timeout_ms) {
    final HttpPost post = new HttpPost(uri(builder(QUERY_PATH)
        .addParameter("org", org)));
    post.addHeader("Accept", "application/csv");
    post.setEntity(new StringEntity(flux, FLUX));
    if (LOG.isTraceEnabled()) {
      LOG.trace("Querying InfluxDB: " + flux);
    }
    return send(post, timeout_ms);
  }
  
  /**
   * Writes a batch of line protocol with second precision.
   * @param body The non-null lines separated by newlines.
   * @param timeout_ms The deadline in milliseconds.
   * @return The response body, usually empty.
   */
  public String write(final String body, final long timeout_ms) {
    final HttpPost post = new HttpPost(uri(builder(WRITE_PATH)
        .addParameter("org", org)
        .addParameter("bucket", bucket)
        .addParameter("precision", "s")));
    post.setEntity(new StringEntity(body, LINE_PROTOCOL));
    return send(post, timeout_ms);
  }
  
  /** @return The server URL. */
  public String endpoint() {
    return url;
  }
  
  private String send(final HttpPost post, final long timeout_ms) {
    if (!Strings.isNullOrEmpty(token)) {
      post.addHeader("Authorization", "Token " + token);
    }
    final HttpResponse response = client.execute(post, timeout_ms, url);
    return SharedHttpClient.parseResponse(response, url);
  }
  
  private URIBuilder builder(final String path) {
    try {
      return new URIBuilder(url + path);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid InfluxDB URL: " + url, e);
    }
  }
  
  private URI uri(final URIBuilder builder) {
    try {
      return builder.build();
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Failed to build a request for " 
          + url, e);
    }
  }
}
