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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.concurrent.Future;

import org.apache.http.HttpResponse;
import org.apache.http.StatusLine;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.concurrent.FutureCallback;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.junit.Before;
import org.junit.Test;

import net.tsbridge.core.MockTSDB;
import net.tsbridge.exceptions.ExecutionTimeoutException;
import net.tsbridge.exceptions.RemoteQueryExecutionException;

public class TestSharedHttpClient {

  private CloseableHttpAsyncClient client;
  private Future<HttpResponse> future;
  private MockTSDB tsdb;
  private int[] built;
  
  @SuppressWarnings("unchecked")
  @Before
  public void before() throws Exception {
    client = mock(CloseableHttpAsyncClient.class);
    future = mock(Future.class);
    tsdb = new MockTSDB();
    built = new int[3];
  }
  
  @Test
  public void initializeAndShutdown() throws Exception {
    final SharedHttpClient shared = new UTClient();
    assertNull(shared.initialize(tsdb, null).join(250));
    assertSame(client, shared.getClient());
    assertEquals(8, built[0]);
    assertEquals(200, built[1]);
    assertEquals(25, built[2]);
    verify(client, times(1)).start();
    assertNull(shared.shutdown().join(250));
    verify(client, times(1)).close();
  }
  
  @Test
  public void initializeWithId() throws Exception {
    final SharedHttpClient shared = new UTClient();
    shared.initialize(tsdb, "prom").join(250);
    assertEquals("httpclient.prom.io.threads", 
        shared.getConfigKey(SharedHttpClient.IO_THREADS_KEY));
  }
  
  @SuppressWarnings("unchecked")
  @Test
  public void executeCompleted() throws Exception {
    final HttpResponse response = mock(HttpResponse.class);
    when(client.execute(any(HttpUriRequest.class), any(FutureCallback.class)))
      .thenAnswer(invocation -> {
        ((FutureCallback<HttpResponse>) invocation.getArgument(1))
          .completed(response);
        return future;
      });
    final SharedHttpClient shared = new UTClient();
    shared.initialize(tsdb, null).join(250);
    assertSame(response, shared.execute(new HttpGet("http://localhost:9090"), 
        1000, "localhost:9090"));
  }
  
  @SuppressWarnings("unchecked")
  @Test
  public void executeFailed() throws Exception {
    when(client.execute(any(HttpUriRequest.class), any(FutureCallback.class)))
      .thenAnswer(invocation -> {
        ((FutureCallback<HttpResponse>) invocation.getArgument(1))
          .failed(new IOException("Connection refused"));
        return future;
      });
    final SharedHttpClient shared = new UTClient();
    shared.initialize(tsdb, null).join(250);
    try {
      shared.execute(new HttpGet("http://localhost:9090"), 1000, 
          "localhost:9090");
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals("localhost:9090", e.remoteEndpoint());
    }
  }
  
  @SuppressWarnings("unchecked")
  @Test
  public void executeTimeout() throws Exception {
    when(client.execute(any(HttpUriRequest.class), any(FutureCallback.class)))
      .thenReturn(future);
    final SharedHttpClient shared = new UTClient();
    shared.initialize(tsdb, null).join(250);
    try {
      shared.execute(new HttpGet("http://localhost:9090"), 50, 
          "localhost:9090");
      fail("Expected ExecutionTimeoutException");
    } catch (ExecutionTimeoutException e) {
      assertEquals(50, e.timeoutMs());
    }
    verify(future, times(1)).cancel(true);
  }
  
  @Test
  public void executeNotInitialized() throws Exception {
    try {
      new UTClient().execute(new HttpGet("http://localhost:9090"), 50, 
          "localhost:9090");
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
  }
  
  @Test
  public void parseResponse() throws Exception {
    HttpResponse response = mock(HttpResponse.class);
    StatusLine status = mock(StatusLine.class);
    when(response.getStatusLine()).thenReturn(status);
    
    StringEntity entity = new StringEntity("Hello!");
    when(response.getEntity()).thenReturn(entity);
    
    // raw
    when(status.getStatusCode()).thenReturn(200);
    assertEquals("Hello!", SharedHttpClient.parseResponse(response, "unknown"));
    
    // no content
    when(status.getStatusCode()).thenReturn(204);
    assertEquals("", SharedHttpClient.parseResponse(response, "unknown"));
    
    // non-200 non-json
    when(status.getStatusCode()).thenReturn(400);
    entity = new StringEntity("Hello!");
    when(response.getEntity()).thenReturn(entity);
    try {
      SharedHttpClient.parseResponse(response, "unknown");
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) { 
      assertEquals("Hello!", e.getMessage());
      assertEquals(400, e.getStatusCode());
    }
    
    // non-200 JSON
    entity = new StringEntity("{\"error\":{\"message\":\"Boo!\"}}");
    when(response.getEntity()).thenReturn(entity);
    try {
      SharedHttpClient.parseResponse(response, "unknown");
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) { 
      assertEquals("Boo!", e.getMessage());
    }
    
    // null entity
    when(status.getStatusCode()).thenReturn(200);
    when(response.getEntity()).thenReturn(null);
    try {
      SharedHttpClient.parseResponse(response, "unknown");
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) { }
  }
  
  @Test
  public void extractError() throws Exception {
    assertEquals("Boo!", SharedHttpClient.extractError(
        "{\"error\":{\"message\":\"Boo!\"}}"));
    assertEquals("bad_data", SharedHttpClient.extractError(
        "{\"status\":\"error\",\"errorType\":\"bad_data\",\"error\":\"bad_data\"}"));
    assertEquals("unauthorized access", SharedHttpClient.extractError(
        "{\"code\":\"unauthorized\",\"message\":\"unauthorized access\"}"));
    assertNull(SharedHttpClient.extractError("<html>"));
    assertNull(SharedHttpClient.extractError("{\"other\":1}"));
    assertNull(SharedHttpClient.extractError(null));
  }
  
  /** Hands back the mock client. */
  class UTClient extends SharedHttpClient {
    @Override
    protected CloseableHttpAsyncClient buildClient(
        final int io_threads, 
        final int max_connections, 
        final int max_route_connections) {
      built[0] = io_threads;
      built[1] = max_connections;
      built[2] = max_route_connections;
      return TestSharedHttpClient.this.client;
    }
  }
}
