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

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.base.Strings;
import com.google.common.collect.Maps;

import net.tsbridge.utils.YAML;

/**
 * The configuration handle passed to drivers and plugins. Components 
 * register the keys they consume along with a default, a type and a 
 * description via one of the {@code register()} methods, then read the 
 * current value with the typed getters.
 * <p>
 * Values are resolved in the following order, the first one found wins:
 * <ol>
 * <li>Runtime overrides set via {@link #addOverride(String, Object)} (only
 * for keys registered as dynamic).</li>
 * <li>Java system properties.</li>
 * <li>The settings map given at construction, e.g. parsed from a YAML 
 * file via {@link #fromYaml(InputStream)}.</li>
 * <li>The registered default.</li>
 * </ol>
 * <p>
 * Reading a key that was never registered throws a 
 * {@link ConfigurationException}.
 * 
 * @since 1.0
 */
public class Configuration {
  private static final Logger LOG = LoggerFactory.getLogger(Configuration.class);
  
  /** The registered schemas keyed on the config key. */
  protected final Map<String, Schema> schemas;
  
  /** The static settings given at construction. */
  protected final Map<String, Object> settings;
  
  /** Runtime overrides for dynamic keys. */
  protected final Map<String, Object> overrides;
  
  /** Whether or not system properties are consulted. */
  protected final boolean use_system_properties;
  
  /**
   * Default ctor with no settings that consults system properties.
   */
  public Configuration() {
    this(Collections.<String, Object>emptyMap(), true);
  }
  
  /**
   * Ctor with a map of settings.
   * @param settings A non-null map of settings, may be empty.
   * @param use_system_properties Whether or not to consult the system 
   * properties before the settings.
   */
  public Configuration(final Map<String, ?> settings, 
                       final boolean use_system_properties) {
    if (settings == null) {
      throw new IllegalArgumentException("Settings cannot be null.");
    }
    schemas = new ConcurrentHashMap<String, Schema>();
    this.settings = Maps.newHashMap(settings);
    overrides = new ConcurrentHashMap<String, Object>();
    this.use_system_properties = use_system_properties;
  }
  
  /**
   * Parses a YAML document of key/value pairs into a configuration. Nested
   * maps are flattened with a dot separator so that 
   * <pre>
   * rrd:
   *   dir: /tmp/rrd
   * </pre>
   * becomes {@code rrd.dir}.
   * @param stream A non-null stream to read from.
   * @return A non-null configuration.
   * @throws ConfigurationException if the YAML could not be read.
   */
  public static Configuration fromYaml(final InputStream stream) {
    if (stream == null) {
      throw new IllegalArgumentException("Stream cannot be null.");
    }
    final Map<String, Object> parsed;
    try {
      parsed = YAML.getMapper().readValue(stream, 
          new TypeReference<Map<String, Object>>() { });
    } catch (IOException e) {
      throw new ConfigurationException("Failed to parse the YAML config", e);
    }
    final Map<String, Object> flat = Maps.newHashMap();
    if (parsed != null) {
      flatten("", parsed, flat);
    }
    LOG.info("Loaded " + flat.size() + " settings from YAML.");
    return new Configuration(flat, true);
  }
  
  /**
   * Registers a config key with a String type.
   * @param key A non-null and non-empty key.
   * @param default_value A default value, may be null.
   * @param is_dynamic Whether or not the value can be overridden at runtime.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was 
   * null or empty.
   * @throws ConfigurationException if the key was already registered. 
   */
  public void register(final String key, 
                       final String default_value, 
                       final boolean is_dynamic,
                       final String description) {
    register(new Schema(key, String.class, default_value, is_dynamic, 
        description));
  }
  
  /**
   * Registers a config key with an int type.
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param is_dynamic Whether or not the value can be overridden at runtime.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was 
   * null or empty.
   * @throws ConfigurationException if the key was already registered. 
   */
  public void register(final String key, 
                       final int default_value, 
                       final boolean is_dynamic,
                       final String description) {
    register(new Schema(key, int.class, default_value, is_dynamic, 
        description));
  }
  
  /**
   * Registers a config key with a long type.
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param is_dynamic Whether or not the value can be overridden at runtime.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was 
   * null or empty.
   * @throws ConfigurationException if the key was already registered. 
   */
  public void register(final String key, 
                       final long default_value, 
                       final boolean is_dynamic,
                       final String description) {
    register(new Schema(key, long.class, default_value, is_dynamic, 
        description));
  }
  
  /**
   * Registers a config key with a double type.
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param is_dynamic Whether or not the value can be overridden at runtime.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was 
   * null or empty.
   * @throws ConfigurationException if the key was already registered. 
   */
  public void register(final String key, 
                       final double default_value, 
                       final boolean is_dynamic,
                       final String description) {
    register(new Schema(key, double.class, default_value, is_dynamic, 
        description));
  }
  
  /**
   * Registers a config key with a boolean type.
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param is_dynamic Whether or not the value can be overridden at runtime.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was 
   * null or empty.
   * @throws ConfigurationException if the key was already registered. 
   */
  public void register(final String key, 
                       final boolean default_value, 
                       final boolean is_dynamic,
                       final String description) {
    register(new Schema(key, boolean.class, default_value, is_dynamic, 
        description));
  }
  
  /**
   * Adds or replaces a runtime override for a dynamic key.
   * @param key A non-null and non-empty key that was registered.
   * @param value The value to set, may be null for nullable types.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key was not registered, was not
   * dynamic or the value could not be converted.
   */
  public void addOverride(final String key, final Object value) {
    final Schema schema = getSchema(key);
    if (!schema.dynamic) {
      throw new ConfigurationException("Key [" + key 
          + "] is not dynamic and cannot be overridden.");
    }
    // validates the type
    schema.convert(value);
    if (value == null) {
      overrides.remove(key);
    } else {
      overrides.put(key, value);
    }
  }
  
  /**
   * Returns the value as a string. Numbers are cast to strings.
   * @param key The non-null and non-empty config key entry.
   * @return A String if the entry had a value, null if it was set to null.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config.
   */
  public String getString(final String key) {
    final Object value = resolve(key);
    return value == null ? null : value.toString();
  }
  
  /**
   * Returns the value as an integer when possible.
   * @param key A non-null and non-empty key.
   * @return An integer value.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config or the value was not an integer.
   */
  public int getInt(final String key) {
    return (int) getLong(key);
  }
  
  /**
   * Returns the value as a long integer when possible.
   * @param key A non-null and non-empty key.
   * @return A long integer value.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config or the value was not an integer.
   */
  public long getLong(final String key) {
    final Object value = getSchema(key).convert(resolve(key));
    if (!(value instanceof Number)) {
      throw new ConfigurationException("Value for key [" + key 
          + "] was not a number: " + value);
    }
    return ((Number) value).longValue();
  }
  
  /**
   * Returns the value as a double when possible.
   * @param key A non-null and non-empty key.
   * @return A double value.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config or the value was not a number.
   */
  public double getDouble(final String key) {
    final Object value = getSchema(key).convert(resolve(key));
    if (!(value instanceof Number)) {
      throw new ConfigurationException("Value for key [" + key 
          + "] was not a number: " + value);
    }
    return ((Number) value).doubleValue();
  }
  
  /**
   * Checks to see if the value of the key is true or false. Nulls count
   * as false and only the values in the set [true, 1, yes] count as 
   * true (cast to lower case in string form).
   * @param key A non-null and non-empty key.
   * @return A boolean value.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config.
   */
  public boolean getBoolean(final String key) {
    String bool = getString(key);
    if (Strings.isNullOrEmpty(bool)) {
      return false;
    }
    bool = bool.toLowerCase(Locale.ROOT).trim();
    return bool.equals("true") || bool.equals("1") || bool.equals("yes");
  }
  
  /**
   * Determines if the given key has been registered.
   * @param key A non-null and no-empty key.
   * @return True if the key was registered, false if not and calls
   * to read methods would throw an exception.
   * @throws IllegalArgumentException if the key was null or empty.
   */
  public boolean hasProperty(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return schemas.containsKey(key);
  }
  
  /**
   * Registers the schema.
   * @param schema A non-null schema.
   * @throws ConfigurationException if the key was already registered.
   */
  protected void register(final Schema schema) {
    final Schema extant = schemas.putIfAbsent(schema.key, schema);
    if (extant != null) {
      throw new ConfigurationException("Schema already exists for "
          + "key: " + schema.key);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Registered config key [" + schema.key + "]");
    }
  }
  
  /**
   * Finds the current raw value for the key.
   * @param key The non-null and non-empty key.
   * @return The value, may be null.
   */
  protected Object resolve(final String key) {
    final Schema schema = getSchema(key);
    Object value = overrides.get(key);
    if (value != null) {
      return value;
    }
    if (use_system_properties) {
      value = System.getProperty(key);
      if (value != null) {
        return value;
      }
    }
    if (settings.containsKey(key)) {
      return settings.get(key);
    }
    return schema.default_value;
  }
  
  /**
   * Returns the schema for a key.
   * @param key A non-null and non-empty key.
   * @return The non-null schema.
   * @throws ConfigurationException if the key was not registered.
   */
  protected Schema getSchema(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    final Schema schema = schemas.get(key);
    if (schema == null) {
      throw new ConfigurationException("No schema registered for key: " 
          + key);
    }
    return schema;
  }
  
  @SuppressWarnings("unchecked")
  private static void flatten(final String prefix, 
                              final Map<String, Object> source,
                              final Map<String, Object> destination) {
    for (final Entry<String, Object> entry : source.entrySet()) {
      final String key = prefix.isEmpty() ? entry.getKey() : 
        prefix + "." + entry.getKey();
      if (entry.getValue() instanceof Map) {
        flatten(key, (Map<String, Object>) entry.getValue(), destination);
      } else {
        destination.put(key, entry.getValue());
      }
    }
  }
  
  /**
   * The schema for a config key.
   */
  protected static class Schema {
    protected final String key;
    protected final Class<?> type;
    protected Object default_value;
    protected final boolean dynamic;
    protected final String description;
    
    protected Schema(final String key, 
                     final Class<?> type, 
                     final Object default_value,
                     final boolean dynamic, 
                     final String description) {
      if (Strings.isNullOrEmpty(key)) {
        throw new IllegalArgumentException("Key cannot be null or empty.");
      }
      if (Strings.isNullOrEmpty(description)) {
        throw new IllegalArgumentException("Description cannot be null or "
            + "empty. Help the users!");
      }
      this.key = key;
      this.type = type;
      this.default_value = default_value;
      this.dynamic = dynamic;
      this.description = description;
    }
    
    /**
     * Converts the value to the registered type.
     * @param value The value to convert, may be null.
     * @return The converted value, may be null.
     * @throws ConfigurationException if conversion failed.
     */
    protected Object convert(final Object value) {
      if (value == null || type == String.class) {
        return value;
      }
      try {
        if (type == boolean.class) {
          return value instanceof Boolean ? value : 
            Boolean.parseBoolean(value.toString().trim());
        }
        if (value instanceof Number) {
          return value;
        }
        final String string = value.toString().trim();
        if (type == double.class) {
          return Double.parseDouble(string);
        }
        return Long.parseLong(string);
      } catch (NumberFormatException e) {
        throw new ConfigurationException("Unable to convert value [" + value 
            + "] for key [" + key + "] to type " + type, e);
      }
    }
    
    @Override
    public String toString() {
      return new StringBuilder()
          .append("key=")
          .append(key)
          .append(", type=")
          .append(type)
          .append(", dynamic=")
          .append(dynamic)
          .append(", description=")
          .append(description)
          .toString();
    }
  }
}
