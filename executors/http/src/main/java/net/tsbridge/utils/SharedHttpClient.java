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
package net.tsbridge.utils;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.Future;

import org.apache.http.HttpResponse;
import org.apache.http.ParseException;
import org.apache.http.client.entity.DeflateDecompressingEntity;
import org.apache.http.client.entity.GzipDecompressingEntity;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.concurrent.FutureCallback;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.apache.http.impl.nio.client.HttpAsyncClients;
import org.apache.http.impl.nio.reactor.IOReactorConfig;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.TimeoutException;

import net.tsbridge.core.BaseTSDBPlugin;
import net.tsbridge.core.TSDB;
import net.tsbridge.exceptions.ExecutionTimeoutException;
import net.tsbridge.exceptions.QueryExecutionException;
import net.tsbridge.exceptions.RemoteQueryExecutionException;

/**
 * A shared asynchronous HTTP client for making remote calls to the network
 * backends. Calls are issued asynchronously and the caller blocks on a 
 * {@link Deferred} up to its deadline.
 * 
 * @since 1.0
 */
public class SharedHttpClient extends BaseTSDBPlugin {
  private static final Logger LOG = LoggerFactory.getLogger(
      SharedHttpClient.class);
  
  public static final String TYPE = "SharedHttpClient";
  
  public static final String KEY_PREFIX = "httpclient.";
  public static final String IO_THREADS_KEY = "io.threads";
  public static final String MAX_CONNECTIONS_KEY = "max.connections";
  public static final String MAX_ROUTE_CONNECTIONS_KEY = 
      "max.connections.route";
  
  /** The client. */
  protected volatile CloseableHttpAsyncClient client;
  
  @Override
  public Deferred<Object> initialize(final TSDB tsdb, final String id) {
    this.tsdb = tsdb;
    this.id = id;
    registerConfigs(tsdb);
    
    client = buildClient(
        tsdb.getConfig().getInt(getConfigKey(IO_THREADS_KEY)),
        tsdb.getConfig().getInt(getConfigKey(MAX_CONNECTIONS_KEY)),
        tsdb.getConfig().getInt(getConfigKey(MAX_ROUTE_CONNECTIONS_KEY)));
    client.start();
    LOG.info("Initialized shared HTTP client.");
    return Deferred.fromResult(null);
  }
  
  @Override
  public Deferred<Object> shutdown() {
    if (client != null) {
      try {
        client.close();
      } catch (IOException e) {
        LOG.error("Failed to close HTTPClient", e);
      }
    }
    return Deferred.fromResult(null);
  }
  
  @Override
  public String type() {
    return TYPE;
  }

  /**
   * NOTE: Do not close it.
   * @return The non-null client.
   */
  public CloseableHttpAsyncClient getClient() {
    return client;
  }
  
  /**
   * Sends the request and waits for the response up to the deadline.
   * @param request The non-null request.
   * @param timeout_ms The deadline in milliseconds. Zero or less waits
   * forever.
   * @param remote_host The remote endpoint for error messages.
   * @return The non-null response.
   * @throws ExecutionTimeoutException if the deadline expired. The request
   * is cancelled.
   * @throws RemoteQueryExecutionException if the transport failed.
   */
  public HttpResponse execute(final HttpUriRequest request, 
                              final long timeout_ms,
                              final String remote_host) {
    if (client == null) {
      throw new IllegalStateException("Client has not been initialized.");
    }
    final Deferred<HttpResponse> deferred = new Deferred<HttpResponse>();
    
    class ResponseCallback implements FutureCallback<HttpResponse> {

      @Override
      public void completed(final HttpResponse response) {
        deferred.callback(response);
      }

      @Override
      public void failed(final Exception ex) {
        deferred.callback(new RemoteQueryExecutionException(
            "Request to [" + remote_host + "] failed: " + ex.getMessage(), 
            remote_host, 0, ex));
      }

      @Override
      public void cancelled() {
        deferred.callback(new RemoteQueryExecutionException(
            "Request to [" + remote_host + "] was cancelled.", 
            remote_host, 0));
      }
    }
    
    if (LOG.isDebugEnabled()) {
      LOG.debug("Sending " + request.getMethod() + " " + request.getURI());
    }
    final Future<HttpResponse> future = 
        client.execute(request, new ResponseCallback());
    try {
      return timeout_ms > 0 ? deferred.join(timeout_ms) : deferred.join();
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new ExecutionTimeoutException("Request to [" + remote_host 
          + "] timed out after " + timeout_ms + "ms", timeout_ms, e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new QueryExecutionException("Interrupted waiting on [" 
          + remote_host + "]", 0, e);
    } catch (QueryExecutionException e) {
      throw e;
    } catch (Exception e) {
      throw new RemoteQueryExecutionException("Unexpected exception calling [" 
          + remote_host + "]", remote_host, 0, e);
    }
  }
  
  /**
   * Helper that handles decompressing the result and parses the entity
   * to a string. If the status is not 2xx then we throw a 
   * {@link RemoteQueryExecutionException} with the message extracted from
   * a JSON error body if present.
   * @param response The non-null response to parse.
   * @param remote_host The remote host name.
   * @return A string if successful, empty for 204 responses.
   */
  public static String parseResponse(final HttpResponse response,  
                                     final String remote_host) {
    final int status = response.getStatusLine().getStatusCode();
    if (status == 204) {
      return "";
    }
    
    final String content;
    if (response.getEntity() == null) {
      throw new RemoteQueryExecutionException("Content for http response "
          + "was null: " + response, remote_host, 500);
    }
    
    try {
      final String encoding = (response.getEntity().getContentEncoding() != null &&
          response.getEntity().getContentEncoding().getValue() != null ?
              response.getEntity().getContentEncoding().getValue().toLowerCase(Locale.ROOT) :
                "");
      if (encoding.equals("gzip") || encoding.equals("x-gzip")) {
        content = EntityUtils.toString(
            new GzipDecompressingEntity(response.getEntity()));
      } else if (encoding.equals("deflate")) {
        content = EntityUtils.toString(
            new DeflateDecompressingEntity(response.getEntity()));
      } else if (encoding.equals("")) {
        content = EntityUtils.toString(response.getEntity());
      } else {
        throw new RemoteQueryExecutionException("Unhandled content encoding [" 
            + encoding + "] : " + response, remote_host, 500);
      }
    } catch (ParseException e) {
      LOG.error("Failed to parse content from HTTP response: " + response, e);
      throw new RemoteQueryExecutionException("Content parsing failure for: " 
          + response, remote_host, 500, e);
    } catch (IOException e) {
      LOG.error("Failed to parse content from HTTP response: " + response, e);
      throw new RemoteQueryExecutionException("Content parsing failure for: " 
          + response, remote_host, 500, e);
    }
  
    if (status >= 200 && status < 300) {
      return content;
    }
    
    final String message = extractError(content);
    throw new RemoteQueryExecutionException(
        message == null ? content : message, remote_host, status);
  }
  
  /**
   * Attempts to pull an error message out of a JSON body in one of the 
   * forms {@code {"error":{"message":"m"}}}, {@code {"error":"m"}} or
   * {@code {"message":"m"}}.
   * @param content The body, may be null.
   * @return The message or null if not found.
   */
  static String extractError(final String content) {
    if (content == null || !content.trim().startsWith("{")) {
      return null;
    }
    try {
      final JsonNode root = JSON.getMapper().readTree(content);
      JsonNode node = root.get("error");
      if (node != null && !node.isNull()) {
        if (node.isTextual()) {
          return node.asText();
        }
        final JsonNode message = node.get("message");
        if (message != null && !message.isNull()) {
          return message.asText();
        }
      }
      node = root.get("message");
      if (node != null && !node.isNull()) {
        return node.asText();
      }
    } catch (IOException e) {
      LOG.warn("Failed to parse the JSON exception: " + content, e);
    }
    return null;
  }
  
  /**
   * Builds the client. Split out for unit tests.
   * @param io_threads The number of IO reactor threads.
   * @param max_connections The total connection limit.
   * @param max_route_connections The per route connection limit.
   * @return The non-null, unstarted client.
   */
  protected CloseableHttpAsyncClient buildClient(
      final int io_threads, 
      final int max_connections, 
      final int max_route_connections) {
    return HttpAsyncClients.custom()
        .setDefaultIOReactorConfig(IOReactorConfig.custom()
            .setIoThreadCount(io_threads).build())
        .setMaxConnTotal(max_connections)
        .setMaxConnPerRoute(max_route_connections)
        .build();
  }

  String getConfigKey(final String key) {
    return getConfigKey(KEY_PREFIX, key);
  }
  
  void registerConfigs(final TSDB tsdb) {
    if (!tsdb.getConfig().hasProperty(getConfigKey(IO_THREADS_KEY))) {
      tsdb.getConfig().register(getConfigKey(IO_THREADS_KEY), 8, false, 
          "The number of IO reactor threads for the HTTP client.");
    }
    if (!tsdb.getConfig().hasProperty(getConfigKey(MAX_CONNECTIONS_KEY))) {
      tsdb.getConfig().register(getConfigKey(MAX_CONNECTIONS_KEY), 200, false, 
          "The maximum number of open connections across all hosts.");
    }
    if (!tsdb.getConfig().hasProperty(getConfigKey(MAX_ROUTE_CONNECTIONS_KEY))) {
      tsdb.getConfig().register(getConfigKey(MAX_ROUTE_CONNECTIONS_KEY), 25, 
          false, "The maximum number of open connections per host.");
    }
  }
}
