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
package net.tsbridge.configuration;

import java.util.Collections;
import java.util.Map;

/**
 * A helper for use with Unit Testing Configuration consumers. System 
 * properties are ignored so tests are isolated from the environment.
 * <p>
 * To instantiate with default settings, use the {@link #getConfiguration(Map)}
 * by providing the reference to a map.
 * 
 * @since 1.0
 */
public class UnitTestConfiguration extends Configuration {

  /**
   * Protected ctor.
   * @param settings The non-null settings map.
   */
  protected UnitTestConfiguration(final Map<String, ?> settings) {
    super(settings, false);
  }
  
  /** @return A config without any settings. */
  public static UnitTestConfiguration getConfiguration() {
    return new UnitTestConfiguration(Collections.<String, Object>emptyMap());
  }
  
  /**
   * Returns a config with the given settings applied.
   * @param settings A map of key values to load.
   * @return A non-null config.
   */
  public static UnitTestConfiguration getConfiguration(
      final Map<String, ?> settings) {
    return new UnitTestConfiguration(settings);
  }

  /**
   * Allows a UnitTest to inject a value into the config even if the key is
   * not dynamic. It still requires that a config key be registered.
   * 
   * @param key A non-null and non-empty key.
   * @param value A value to inject.
   * @throws ConfigurationException if the key was not registered.
   */
  public void override(final String key, final Object value) {
    final Schema schema = getSchema(key);
    schema.convert(value);
    schema.default_value = value;
    settings.remove(key);
    overrides.remove(key);
  }
}
