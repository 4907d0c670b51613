// This file is part of TinyTSDB.
// Copyright (C) 2026  The TinyTSDB Authors.
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
package net.tinytsdb.utils;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A static, shared and pre-configured Jackson ObjectMapper with a couple of
 * wrappers for the common serialization calls. The mapper is thread safe
 * and expensive to build so it's created once per JVM.
 * <p>
 * Jackson's checked exceptions are wrapped: parse and mapping errors become
 * {@link IllegalArgumentException}s as the input was bad, anything else
 * becomes a {@link JSONException}.
 * <p>
 * Useful Class Annotations:
 * {@code @JsonDeserialize(builder = Foo.Builder.class)} - lets immutable
 *   objects deserialize through their builders.
 * 
 * @since 1.0
 */
public final class JSON {
  /** Jackson de/serializer initialized, configured and shared. */
  private static final ObjectMapper MAPPER = new ObjectMapper();
  static {
    // sample values may be NaN or infinite.
    MAPPER.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
  }

  /** No instantiation for you! */
  private JSON() { }
  
  /**
   * Deserializes a JSON formatted string to a specific class type.
   * @param json The string to deserialize.
   * @param pojo The class type of the object used for deserialization.
   * @return An object of the {@code pojo} type.
   * @throws IllegalArgumentException if the data or class was null or 
   * parsing failed.
   * @throws JSONException if the data could not be read.
   * @param <T> The type of object to parse to.
   */
  public static <T> T parseToObject(final String json,
                                    final Class<T> pojo) {
    if (json == null || json.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    
    try {
      return MAPPER.readValue(json, pojo);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }
  
  /**
   * Serializes the given object to a JSON string.
   * @param object The object to serialize.
   * @return A JSON formatted string.
   * @throws IllegalArgumentException if the object was null.
   * @throws JSONException if the object could not be serialized.
   */
  public static String serializeToString(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return MAPPER.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new JSONException(e);
    }
  }
  
  /** @return The shared mapper for streaming or tree access. */
  public static ObjectMapper getMapper() {
    return MAPPER;
  }
}
