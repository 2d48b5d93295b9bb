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

import java.util.Collection;

import net.tsbridge.data.MetricIdentifier;

/**
 * Holds the metrics known to the application. Definitions are immutable
 * once registered.
 * 
 * @since 1.0
 */
public interface MetricRegistry {

  /**
   * Registers a metric.
   * @param metric The non-null metric.
   * @throws IllegalArgumentException if a metric with the same namespace 
   * and name was already registered.
   */
  public void register(final MetricIdentifier metric);
  
  /**
   * @param namespace The namespace.
   * @param name The name.
   * @return The metric or null if not registered.
   */
  public MetricIdentifier get(final String namespace, final String name);
  
  /**
   * @param key The metric key in the form {@code namespace.name}.
   * @return The metric or null if not registered.
   */
  public MetricIdentifier get(final String key);
  
  /** @return All registered metrics sorted by key. */
  public Collection<MetricIdentifier> all();
}
