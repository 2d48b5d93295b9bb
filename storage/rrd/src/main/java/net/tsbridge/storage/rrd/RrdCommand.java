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

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * A single rrdtool invocation: the sub-command, an optional archive path,
 * the options and the positional arguments such as {@code DS:} or 
 * {@code DEF:} definitions.
 * 
 * @since 1.0
 */
public class RrdCommand {
  private final RrdCommandType type;
  private final String path;
  private final List<String> options;
  private final List<String> arguments;
  
  /**
   * Default ctor.
   * @param type The non-null command type.
   * @param path The archive or directory path, may be null.
   * @param options The options, e.g. {@code --step 60}. May be null.
   * @param arguments The positional arguments. May be null.
   */
  public RrdCommand(final RrdCommandType type, 
                    final String path, 
                    final List<String> options, 
                    final List<String> arguments) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    this.type = type;
    this.path = path;
    this.options = options == null ? ImmutableList.<String>of() : 
      ImmutableList.copyOf(options);
    this.arguments = arguments == null ? ImmutableList.<String>of() : 
      ImmutableList.copyOf(arguments);
  }
  
  public RrdCommandType type() {
    return type;
  }
  
  /** @return The path or null if the command does not take one. */
  public String path() {
    return path;
  }
  
  public List<String> options() {
    return options;
  }
  
  public List<String> arguments() {
    return arguments;
  }
  
  /** @return The argument vector for a one-shot rrdtool process, without
   * the binary itself. */
  public List<String> toArgs() {
    final List<String> args = Lists.newArrayListWithCapacity(
        2 + options.size() + arguments.size());
    args.add(type.command());
    if (path != null) {
      args.add(path);
    }
    args.addAll(options);
    args.addAll(arguments);
    return args;
  }
  
  /** @return The line to send to {@code rrdtool -}. Arguments containing
   * white space are double quoted. */
  @Override
  public String toString() {
    final List<String> args = toArgs();
    for (int i = 0; i < args.size(); i++) {
      final String arg = args.get(i);
      if (arg.isEmpty() || arg.matches(".*[\\s\"].*")) {
        args.set(i, "\"" + arg.replace("\"", "\\\"") + "\"");
      }
    }
    return Joiner.on(' ').join(args);
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final RrdCommand that = (RrdCommand) o;
    return type == that.type
        && Objects.equal(path, that.path)
        && Objects.equal(options, that.options)
        && Objects.equal(arguments, that.arguments);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(type, path, options, arguments);
  }
}
