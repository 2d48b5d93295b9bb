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
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.io.CharStreams;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import net.tsbridge.exceptions.ExecutionTimeoutException;
import net.tsbridge.exceptions.QueryExecutionException;
import net.tsbridge.exceptions.RemoteQueryExecutionException;

/**
 * Spawns one rrdtool process per command. Simple and isolated but pays 
 * the process start-up cost on every call.
 * 
 * @since 1.0
 */
public class CliRrdExecutor implements RrdExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(
      CliRrdExecutor.class);
  
  /** The environment variable rrdtool reads the daemon address from. */
  public static final String RRDCACHED_ENV = "RRDCACHED_ADDRESS";
  
  private final String rrdtool;
  private final File working_dir;
  private final String rrdcached_address;
  
  /** Drains stdout and stderr so the child never blocks on a full pipe. */
  private final ExecutorService readers;
  
  /**
   * Default ctor.
   * @param rrdtool The non-null path to the binary.
   * @param working_dir The non-null base directory archive paths are 
   * relative to.
   * @param rrdcached_address An optional daemon address, may be null.
   */
  public CliRrdExecutor(final String rrdtool, 
                        final File working_dir, 
                        final String rrdcached_address) {
    if (Strings.isNullOrEmpty(rrdtool)) {
      throw new IllegalArgumentException("Binary cannot be null or empty.");
    }
    if (working_dir == null) {
      throw new IllegalArgumentException("Working directory cannot be null.");
    }
    this.rrdtool = rrdtool;
    this.working_dir = working_dir;
    this.rrdcached_address = rrdcached_address;
    readers = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("rrdtool-cli-%d")
        .build());
  }
  
  @Override
  public String execute(final RrdCommand command, final long timeout_ms) {
    final List<String> args = Lists.newArrayList(rrdtool);
    args.addAll(command.toArgs());
    final ProcessBuilder builder = new ProcessBuilder(args)
        .directory(working_dir);
    if (!Strings.isNullOrEmpty(rrdcached_address)) {
      builder.environment().put(RRDCACHED_ENV, rrdcached_address);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Executing: " + args);
    }
    
    final Process process;
    try {
      process = builder.start();
    } catch (IOException e) {
      throw new RemoteQueryExecutionException("Failed to start " + rrdtool, 
          endpoint(), 500, e);
    }
    final Future<String> stdout = readers.submit(() -> 
        read(process.getInputStream()));
    final Future<String> stderr = readers.submit(() -> 
        read(process.getErrorStream()));
    
    final int exit;
    try {
      if (!process.waitFor(timeout_ms, TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        stdout.cancel(true);
        stderr.cancel(true);
        throw new ExecutionTimeoutException("Timed out after " + timeout_ms 
            + "ms executing " + command.type().command() + " " 
            + Strings.nullToEmpty(command.path()), timeout_ms);
      }
      exit = process.exitValue();
      final String output = stdout.get();
      final String error = stderr.get().trim();
      if (exit != 0) {
        final String message = error.startsWith("ERROR: ") ? 
            error.substring(7) : error;
        if (RrdFileNotFoundException.isNotFound(message)) {
          throw new RrdFileNotFoundException(message, endpoint());
        }
        throw new RemoteQueryExecutionException("rrdtool exited with " + exit 
            + ": " + message, endpoint(), 500);
      }
      return output;
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new QueryExecutionException("Interrupted executing " 
          + command.type().command(), 500, e);
    } catch (ExecutionException e) {
      throw new RemoteQueryExecutionException("Failed to read rrdtool "
          + "output", endpoint(), 500, e.getCause());
    }
  }

  @Override
  public String endpoint() {
    return rrdtool;
  }

  @Override
  public void shutdown() {
    readers.shutdownNow();
  }
  
  private static String read(final InputStream stream) throws IOException {
    try (final InputStreamReader reader = new InputStreamReader(stream, 
        StandardCharsets.UTF_8)) {
      return CharStreams.toString(reader);
    }
  }
}
