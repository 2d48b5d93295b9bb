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
package net.tsbridge.core;

import com.stumbleupon.async.Deferred;

/**
 * The base interface for all plugins.
 * 
 * @since 1.0
 */
public interface TSDBPlugin {
  
  /** @return The type of plugin for the registry. */
  public String type();
  
  /** @return The ID of the plugin instance, may be null for the default. */
  public String id();
  
  /**
   * Called by the TSDB to initialize the plugin. Implementations should
   * register their configuration keys here.
   * @param tsdb The non-null TSDB this plugin belongs to.
   * @param id An optional ID for the instance. Used to derive config keys.
   * @return A non-null deferred resolving to a null on success or an 
   * exception on failure.
   */
  public Deferred<Object> initialize(final TSDB tsdb, final String id);
  
  /**
   * Called to gracefully shutdown the plugin and release resources.
   * @return A non-null deferred resolving to a null on success or an 
   * exception on failure.
   */
  public Deferred<Object> shutdown();
  
  /** @return A version string. */
  public String version();
}
