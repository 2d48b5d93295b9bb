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
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import net.tsbridge.exceptions.ExecutionTimeoutException;
import net.tsbridge.exceptions.QueryExecutionException;
import net.tsbridge.exceptions.RemoteQueryExecutionException;

/**
 * Keeps one {@code rrdtool -} process alive and pipes commands to it, one
 * at a time. Each response ends with an {@code OK u:...} line or an 
 * {@code ERROR: ...} line. A command that runs past its deadline kills 
 * the process; the next call starts a fresh one. The process is also
 * recycled once it has been idle for longer than the idle timeout.
 * 
 * @since 1.0
 */
public class ProcessRrdExecutor implements RrdExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(
      ProcessRrdExecutor.class);
  
  /** The prefix of the line terminating a successful response. */
  public static final String COMMAND_COMPLETE = "OK u:";
  
  /** The prefix of an error response. */
  public static final String ERROR_PREFIX = "ERROR: ";
  
  /** Queued when the process closes stdout. */
  private static final String EOF = new String("EOF");
  
  private final String rrdtool;
  private final File working_dir;
  private final String rrdcached_address;
  private final long idle_timeout_ms;
  private final ThreadFactory thread_factory;
  
  /** The live process, null until the first call or after a kill. */
  private RrdProcess process;
  
  /** When the last command finished. */
  private long last_used;
  
  /**
   * Default ctor.
   * @param rrdtool The non-null path to the binary.
   * @param working_dir The non-null base directory archive paths are 
   * relative to.
   * @param rrdcached_address An optional daemon address, may be null.
   * @param idle_timeout_ms Recycle the process after this much idle time.
   * Zero or less disables recycling.
   */
  public ProcessRrdExecutor(final String rrdtool, 
                            final File working_dir, 
                            final String rrdcached_address,
                            final long idle_timeout_ms) {
    if (Strings.isNullOrEmpty(rrdtool)) {
      throw new IllegalArgumentException("Binary cannot be null or empty.");
    }
    if (working_dir == null) {
      throw new IllegalArgumentException("Working directory cannot be null.");
    }
    this.rrdtool = rrdtool;
    this.working_dir = working_dir;
    this.rrdcached_address = rrdcached_address;
    this.idle_timeout_ms = idle_timeout_ms;
    thread_factory = new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("rrdtool-pipe-%d")
        .build();
  }
  
  @Override
  public synchronized String execute(final RrdCommand command, 
                                     final long timeout_ms) {
    final long deadline = System.nanoTime() + 
        TimeUnit.MILLISECONDS.toNanos(timeout_ms);
    if (process != null && idle_timeout_ms > 0 && 
        System.currentTimeMillis() - last_used > idle_timeout_ms) {
      LOG.info("Recycling rrdtool process idle for more than " 
          + idle_timeout_ms + "ms");
      stop();
    }
    if (process != null && !process.process.isAlive()) {
      LOG.warn("rrdtool process died, restarting it");
      process = null;
    }
    if (process == null) {
      process = start();
    }
    final String line = command.toString();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Piping: " + line);
    }
    
    try {
      process.lines.clear();
      process.stdin.write(line);
      process.stdin.write('\n');
      process.stdin.flush();
    } catch (IOException e) {
      kill();
      throw new RemoteQueryExecutionException("Failed to write to rrdtool", 
          endpoint(), 500, e);
    }
    
    final List<String> output = Lists.newArrayList();
    try {
      while (true) {
        final long remaining = deadline - System.nanoTime();
        final String response = remaining <= 0 ? null : 
          process.lines.poll(remaining, TimeUnit.NANOSECONDS);
        if (response == null) {
          LOG.warn("Killing rrdtool process after " + timeout_ms 
              + "ms waiting on: " + command.type().command());
          kill();
          throw new ExecutionTimeoutException("Timed out after " + timeout_ms 
              + "ms executing " + command.type().command() + " " 
              + Strings.nullToEmpty(command.path()), timeout_ms);
        }
        if (response == EOF) {
          kill();
          throw new RemoteQueryExecutionException("rrdtool process exited "
              + "while executing " + command.type().command(), endpoint(), 500);
        }
        if (response.startsWith(COMMAND_COMPLETE)) {
          last_used = System.currentTimeMillis();
          return Joiner.on('\n').join(output);
        }
        if (response.startsWith(ERROR_PREFIX)) {
          last_used = System.currentTimeMillis();
          final String error = response.substring(ERROR_PREFIX.length());
          if (RrdFileNotFoundException.isNotFound(error)) {
            throw new RrdFileNotFoundException(error, endpoint());
          }
          throw new RemoteQueryExecutionException(error, endpoint(), 500);
        }
        output.add(response);
      }
    } catch (InterruptedException e) {
      kill();
      Thread.currentThread().interrupt();
      throw new QueryExecutionException("Interrupted executing " 
          + command.type().command(), 500, e);
    }
  }

  @Override
  public String endpoint() {
    return rrdtool + " -";
  }

  @Override
  public synchronized void shutdown() {
    stop();
  }
  
  /** @return True if a process is currently running. */
  public synchronized boolean isRunning() {
    return process != null && process.process.isAlive();
  }
  
  /** Starts the process. Package private so tests can substitute it. */
  RrdProcess start() {
    final ProcessBuilder builder = new ProcessBuilder(rrdtool, "-")
        .directory(working_dir);
    if (!Strings.isNullOrEmpty(rrdcached_address)) {
      builder.environment().put(CliRrdExecutor.RRDCACHED_ENV, 
          rrdcached_address);
    }
    try {
      final RrdProcess started = new RrdProcess(builder.start());
      LOG.info("Started rrdtool process in " + working_dir);
      last_used = System.currentTimeMillis();
      return started;
    } catch (IOException e) {
      throw new RemoteQueryExecutionException("Failed to start " + rrdtool, 
          endpoint(), 500, e);
    }
  }
  
  /** Asks the process to quit, then kills it if it lingers. */
  private void stop() {
    if (process == null) {
      return;
    }
    try {
      process.stdin.write("quit\n");
      process.stdin.flush();
      if (!process.process.waitFor(1, TimeUnit.SECONDS)) {
        process.process.destroyForcibly();
      }
    } catch (IOException e) {
      LOG.warn("Failed to send quit to rrdtool, destroying it", e);
      process.process.destroyForcibly();
    } catch (InterruptedException e) {
      process.process.destroyForcibly();
      Thread.currentThread().interrupt();
    }
    process = null;
  }
  
  private void kill() {
    if (process != null) {
      process.process.destroyForcibly();
      process = null;
    }
  }
  
  /** A running process with its stdin and the pumped stdout lines. */
  class RrdProcess {
    final Process process;
    final Writer stdin;
    final BlockingQueue<String> lines = new LinkedBlockingQueue<String>();
    
    RrdProcess(final Process process) {
      this.process = process;
      stdin = new OutputStreamWriter(process.getOutputStream(), 
          StandardCharsets.UTF_8);
      thread_factory.newThread(() -> pump(process.getInputStream(), true))
        .start();
      thread_factory.newThread(() -> pump(process.getErrorStream(), false))
        .start();
    }
    
    private void pump(final InputStream stream, final boolean stdout) {
      try (final BufferedReader reader = new BufferedReader(
          new InputStreamReader(stream, StandardCharsets.UTF_8))) {
        String line;
        while ((line = reader.readLine()) != null) {
          if (stdout) {
            lines.add(line);
          } else {
            LOG.warn("rrdtool: " + line);
          }
        }
      } catch (IOException e) {
        if (process.isAlive()) {
          LOG.warn("Failed reading from rrdtool", e);
        }
      } finally {
        if (stdout) {
          lines.add(EOF);
        }
      }
    }
  }
}
