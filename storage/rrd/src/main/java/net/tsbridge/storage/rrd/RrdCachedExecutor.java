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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import net.tsbridge.exceptions.ExecutionTimeoutException;
import net.tsbridge.exceptions.QueryExecutionException;
import net.tsbridge.exceptions.RemoteQueryExecutionException;
import net.tsbridge.exceptions.UnsupportedQueryOperationException;

/**
 * Speaks the rrdcached text protocol over a Unix domain socket 
 * ({@code unix:/path}) or TCP ({@code host[:port]}). Every response 
 * starts with {@code <n> <message>}; a negative count is an error and 
 * otherwise {@code n} lines of output follow. Calls are serialized over a
 * single lazily opened connection which is closed when a call times out
 * or fails.
 * 
 * @since 1.0
 */
public class RrdCachedExecutor implements RrdExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(
      RrdCachedExecutor.class);
  
  /** The port rrdcached listens on by default. */
  public static final int DEFAULT_PORT = 42217;
  
  public static final String UNIX_PREFIX = "unix:";
  
  private final String address;
  
  /** Runs the socket exchanges so callers can wait with a deadline. */
  private final ExecutorService io;
  
  private volatile SocketChannel channel;
  private volatile BufferedReader reader;
  private volatile Writer writer;
  
  /**
   * Default ctor.
   * @param address The non-null and non-empty daemon address.
   */
  public RrdCachedExecutor(final String address) {
    if (Strings.isNullOrEmpty(address)) {
      throw new IllegalArgumentException("Address cannot be null or empty.");
    }
    this.address = address;
    io = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("rrdcached-io-%d")
        .build());
  }
  
  @Override
  public synchronized String execute(final RrdCommand command, 
                                     final long timeout_ms) {
    final String line = toProtocol(command);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Sending to rrdcached at " + address + ": " + line);
    }
    final String response = exchange(line, command.type().command(), 
        timeout_ms);
    return command.type() == RrdCommandType.INFO ? 
        toInfoText(response) : response;
  }
  
  /**
   * Checks that the daemon answers.
   * @param timeout_ms The deadline in milliseconds.
   * @return True if the daemon replied {@code PONG}.
   */
  public synchronized boolean ping(final long timeout_ms) {
    return "PONG".equals(exchange("PING", "ping", timeout_ms));
  }

  @Override
  public String endpoint() {
    return "rrdcached " + address;
  }

  @Override
  public synchronized void shutdown() {
    if (channel != null) {
      try {
        writer.write("QUIT\n");
        writer.flush();
      } catch (IOException e) {
        LOG.debug("Failed to send QUIT to rrdcached", e);
      }
    }
    close();
    io.shutdownNow();
  }
  
  /**
   * Translates a command into the daemon's syntax.
   * @param command The non-null command.
   * @return The protocol line without the newline.
   * @throws UnsupportedQueryOperationException if the daemon has no 
   * equivalent.
   */
  static String toProtocol(final RrdCommand command) {
    final List<String> parts = Lists.newArrayList();
    switch (command.type()) {
    case CREATE:
      parts.add("CREATE");
      parts.add(command.path());
      for (final String option : command.options()) {
        if (option.equals("--step")) {
          parts.add("-s");
        } else if (option.equals("--no-overwrite")) {
          parts.add("-O");
        } else {
          parts.add(option);
        }
      }
      parts.addAll(command.arguments());
      break;
    case UPDATE:
    case INFO:
    case FIRST:
    case LAST:
      parts.add(command.type().name());
      parts.add(command.path());
      parts.addAll(command.arguments());
      break;
    case FLUSHCACHED:
      parts.add("FLUSH");
      parts.add(command.path());
      break;
    case LIST:
      parts.add("LIST");
      if (command.options().contains("--recursive")) {
        parts.add("RECURSIVE");
      }
      parts.addAll(command.arguments());
      break;
    default:
      throw new UnsupportedQueryOperationException(RrdDriver.NAME, 
          command.type().command(), "not available through rrdcached");
    }
    return Joiner.on(' ').join(parts);
  }
  
  /**
   * Converts the daemon's {@code <key> <type> <value>} info lines to the
   * {@code key = value} form written by rrdtool so one parser handles 
   * both. Type 2 values are strings and get quoted.
   * @param response The non-null response lines.
   * @return The rrdtool style text.
   */
  static String toInfoText(final String response) {
    final StringBuilder buf = new StringBuilder();
    for (final String line : Splitter.on('\n').omitEmptyStrings()
        .split(response)) {
      final List<String> fields = Splitter.on(' ').limit(3).splitToList(line);
      if (fields.size() != 3) {
        buf.append(line).append('\n');
        continue;
      }
      buf.append(fields.get(0))
         .append(" = ");
      if (fields.get(1).equals("2")) {
        buf.append('"').append(fields.get(2)).append('"');
      } else {
        buf.append(fields.get(2));
      }
      buf.append('\n');
    }
    return buf.toString();
  }
  
  /**
   * @param address The configured address.
   * @return The socket address, a Unix domain socket for {@code unix:} 
   * and absolute paths, TCP otherwise.
   */
  static SocketAddress parseAddress(final String address) {
    if (address.startsWith(UNIX_PREFIX)) {
      return UnixDomainSocketAddress.of(address.substring(
          UNIX_PREFIX.length()));
    }
    if (address.startsWith("/")) {
      return UnixDomainSocketAddress.of(address);
    }
    final int idx = address.lastIndexOf(':');
    if (idx > 0 && address.indexOf(']') < idx) {
      return new InetSocketAddress(address.substring(0, idx)
          .replace("[", "").replace("]", ""), 
          Integer.parseInt(address.substring(idx + 1)));
    }
    return new InetSocketAddress(address.replace("[", "").replace("]", ""), 
        DEFAULT_PORT);
  }
  
  /** Opens the connection. Protected so tests can substitute a socket. */
  protected SocketChannel connect() throws IOException {
    return SocketChannel.open(parseAddress(address));
  }
  
  private String exchange(final String line, 
                          final String operation, 
                          final long timeout_ms) {
    final Future<String> future = io.submit(() -> {
      if (channel == null) {
        channel = connect();
        reader = new BufferedReader(new InputStreamReader(
            Channels.newInputStream(channel), StandardCharsets.UTF_8));
        writer = new OutputStreamWriter(Channels.newOutputStream(channel), 
            StandardCharsets.UTF_8);
      }
      writer.write(line);
      writer.write('\n');
      writer.flush();
      return readResponse();
    });
    try {
      return future.get(timeout_ms, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      close();
      throw new ExecutionTimeoutException("Timed out after " + timeout_ms 
          + "ms waiting on rrdcached for " + operation, timeout_ms, e);
    } catch (InterruptedException e) {
      future.cancel(true);
      close();
      Thread.currentThread().interrupt();
      throw new QueryExecutionException("Interrupted waiting on rrdcached", 
          500, e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof QueryExecutionException) {
        throw (QueryExecutionException) e.getCause();
      }
      close();
      throw new RemoteQueryExecutionException("Failed to communicate with "
          + "rrdcached: " + e.getCause().getMessage(), endpoint(), 500, 
          e.getCause());
    }
  }
  
  private String readResponse() throws IOException {
    final String status = reader.readLine();
    if (status == null) {
      throw new IOException("Connection closed by rrdcached");
    }
    final int idx = status.indexOf(' ');
    final int count;
    try {
      count = Integer.parseInt(idx < 0 ? status : status.substring(0, idx));
    } catch (NumberFormatException e) {
      throw new IOException("Malformed rrdcached status line: " + status, e);
    }
    final String message = idx < 0 ? "" : status.substring(idx + 1);
    if (count < 0) {
      if (RrdFileNotFoundException.isNotFound(message)) {
        throw new RrdFileNotFoundException(message, endpoint());
      }
      throw new RemoteQueryExecutionException(message, endpoint(), 500);
    }
    if (count == 0) {
      return message;
    }
    final List<String> lines = Lists.newArrayListWithCapacity(count);
    for (int i = 0; i < count; i++) {
      final String line = reader.readLine();
      if (line == null) {
        throw new IOException("Connection closed after " + i + " of " 
            + count + " lines");
      }
      lines.add(line);
    }
    return Joiner.on('\n').join(lines);
  }
  
  private void close() {
    if (channel == null) {
      return;
    }
    try {
      channel.close();
    } catch (IOException e) {
      LOG.warn("Failed to close the connection to rrdcached", e);
    }
    channel = null;
    reader = null;
    writer = null;
  }
}
