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

import java.util.Locale;

/**
 * The rrdtool sub-commands issued by this driver.
 * 
 * @since 1.0
 */
public enum RrdCommandType {
  CREATE,
  UPDATE,
  INFO,
  XPORT,
  LIST,
  FETCH,
  FIRST,
  LAST,
  FLUSHCACHED;
  
  /** @return The lower case sub-command as given to rrdtool. */
  public String command() {
    return name().toLowerCase(Locale.ROOT);
  }
}
