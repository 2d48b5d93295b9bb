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

/**
 * Factory for the {@link AggregateDriver}. Holds the registry used to 
 * resolve the delegates.
 * 
 * @since 1.0
 */
public class AggregateDriverFactory implements DriverFactory {
  
  /** The registry delegates are instantiated from. */
  private final DriverRegistry registry;
  
  /**
   * Default ctor.
   * @param registry The non-null registry.
   */
  public AggregateDriverFactory(final DriverRegistry registry) {
    if (registry == null) {
      throw new IllegalArgumentException("Registry cannot be null.");
    }
    this.registry = registry;
  }
  
  @Override
  public String name() {
    return AggregateDriver.NAME;
  }

  @Override
  public TimeSeriesDriver newInstance() {
    return new AggregateDriver(registry);
  }
}
