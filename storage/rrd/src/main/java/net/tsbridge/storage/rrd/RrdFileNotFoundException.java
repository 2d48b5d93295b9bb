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

import net.tsbridge.exceptions.RemoteQueryExecutionException;

/**
 * Thrown when rrdtool or rrdcached reports that an archive does not exist.
 * 
 * @since 1.0
 */
public class RrdFileNotFoundException extends RemoteQueryExecutionException {
  private static final long serialVersionUID = -6839283626473016284L;

  /**
   * Default ctor.
   * @param msg The error reported by the backend.
   * @param remote_endpoint The executor that reported it.
   */
  public RrdFileNotFoundException(final String msg, 
                                  final String remote_endpoint) {
    super(msg, remote_endpoint, 404);
  }
  
  /**
   * Checks the error text for the not-found marker.
   * @param error The error text, may be null.
   * @return True if the text reports a missing file.
   */
  public static boolean isNotFound(final String error) {
    return error != null && error.contains("No such file");
  }
}
