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
package net.tsbridge.utils;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Static initialization and configuration of the Jackson ObjectMapper used
 * to parse backend responses. The mapper is lenient: it accepts NaN and 
 * infinity literals, unquoted field names and single quotes as emitted by
 * older rrdtool releases.
 * 
 * @since 1.0
 */
public final class JSON {
  /** Jackson de/serializer initialized, configured and shared. */
  private static final ObjectMapper MAPPER = new ObjectMapper();
  static {
    MAPPER.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    MAPPER.configure(JsonParser.Feature.ALLOW_UNQUOTED_FIELD_NAMES, true);
    MAPPER.configure(JsonParser.Feature.ALLOW_SINGLE_QUOTES, true);
  }
  
  private JSON() { }
  
  /**
   * Parses the string into a JSON tree.
   * @param json The non-null and non-empty string to parse.
   * @return The root node.
   * @throws IllegalArgumentException if the data was null, empty or not 
   * valid JSON.
   * @throws SerdesException if the data could not be read.
   */
  public static final JsonNode parseToTree(final String json) {
    if (json == null || json.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    try {
      return MAPPER.readTree(json);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new SerdesException(e);
    }
  }
  
  /**
   * Serializes the given object to a JSON string.
   * @param object The object to serialize.
   * @return A JSON formatted string.
   * @throws IllegalArgumentException if the object was null.
   * @throws SerdesException if the object could not be serialized.
   */
  public static final String serializeToString(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return MAPPER.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new SerdesException(e);
    }
  }
  
  /** @return The shared mapper. Do not reconfigure it. */
  public static final ObjectMapper getMapper() {
    return MAPPER;
  }
}
