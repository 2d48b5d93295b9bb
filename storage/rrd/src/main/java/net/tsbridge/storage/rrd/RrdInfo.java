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

import java.util.Map;
import java.util.SortedMap;

/**
 * The typed output of {@code rrdtool info} for one archive file. Values
 * are Strings, Longs or Doubles as coerced by {@link RrdInfoParser}.
 * 
 * @since 1.0
 */
public class RrdInfo {
  private final String filename;
  private final String version;
  private final long step;
  private final long last_update;
  private final long header_size;
  private final Map<String, Map<String, Object>> data_sources;
  private final SortedMap<Integer, RraInfo> archives;
  
  RrdInfo(final String filename, 
          final String version, 
          final long step, 
          final long last_update, 
          final long header_size,
          final Map<String, Map<String, Object>> data_sources,
          final SortedMap<Integer, RraInfo> archives) {
    this.filename = filename;
    this.version = version;
    this.step = step;
    this.last_update = last_update;
    this.header_size = header_size;
    this.data_sources = data_sources;
    this.archives = archives;
  }
  
  public String filename() {
    return filename;
  }
  
  public String version() {
    return version;
  }
  
  public long step() {
    return step;
  }
  
  public long lastUpdate() {
    return last_update;
  }
  
  public long headerSize() {
    return header_size;
  }
  
  /** @return Data source fields keyed on the data source name. */
  public Map<String, Map<String, Object>> dataSources() {
    return data_sources;
  }
  
  /** @return Archives keyed on their index. */
  public SortedMap<Integer, RraInfo> archives() {
    return archives;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("filename=")
        .append(filename)
        .append(", version=")
        .append(version)
        .append(", step=")
        .append(step)
        .append(", lastUpdate=")
        .append(last_update)
        .append(", headerSize=")
        .append(header_size)
        .append(", dataSources=")
        .append(data_sources)
        .append(", archives=")
        .append(archives)
        .toString();
  }
}
