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

import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;

/**
 * An explicit map of driver names to factories. Applications register the
 * factories they ship with at start up. The {@link NullDriverFactory} and
 * the {@link AggregateDriverFactory} are always present.
 * 
 * @since 1.0
 */
public class DriverRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(
      DriverRegistry.class);
  
  /** The factories keyed on name. */
  private final Map<String, DriverFactory> factories;
  
  /**
   * Default ctor, registers the null and aggregate drivers.
   */
  public DriverRegistry() {
    factories = Maps.newConcurrentMap();
    register(new NullDriverFactory());
    register(new AggregateDriverFactory(this));
  }
  
  /**
   * Registers the factory.
   * @param factory The non-null factory.
   * @return The registry for chaining.
   * @throws IllegalArgumentException if the factory was null, it's name 
   * was null or empty or a factory with the same name was registered.
   */
  public DriverRegistry register(final DriverFactory factory) {
    if (factory == null) {
      throw new IllegalArgumentException("Factory cannot be null.");
    }
    if (Strings.isNullOrEmpty(factory.name())) {
      throw new IllegalArgumentException("Factory name was null or empty.");
    }
    final DriverFactory extant = factories.putIfAbsent(factory.name(), 
        factory);
    if (extant != null) {
      throw new IllegalArgumentException("Factory already registered: " 
          + factory.name());
    }
    LOG.info("Registered driver factory: " + factory.name());
    return this;
  }
  
  /**
   * @param name The non-null name.
   * @return The factory or null if not registered.
   */
  public DriverFactory getFactory(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Name was null or empty.");
    }
    return factories.get(name);
  }
  
  /** @return The sorted registered names. */
  public Set<String> names() {
    return ImmutableSortedSet.copyOf(factories.keySet());
  }
  
  /**
   * Instantiates and initializes a driver.
   * @param name The non-null name of a registered factory.
   * @param tsdb The non-null TSDB.
   * @param id An optional instance ID used for config keys.
   * @return An initialized driver.
   * @throws IllegalArgumentException if the name was not registered.
   * @throws IllegalStateException if initialization failed.
   */
  public TimeSeriesDriver newDriver(final String name, 
                                    final TSDB tsdb, 
                                    final String id) {
    final DriverFactory factory = getFactory(name);
    if (factory == null) {
      throw new IllegalArgumentException("No driver registered under the "
          + "name [" + name + "]. Registered drivers: " 
          + Joiner.on(", ").join(names()));
    }
    final TimeSeriesDriver driver = factory.newInstance();
    try {
      driver.initialize(tsdb, id).join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted initializing driver: " 
          + name, e);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new IllegalStateException("Failed to initialize driver: " 
          + name, e);
    }
    LOG.info("Initialized driver [" + name + "] version " + driver.version());
    return driver;
  }
}
