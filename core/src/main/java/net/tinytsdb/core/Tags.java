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
package net.tinytsdb.core;

import com.google.common.base.Strings;

import net.tinytsdb.data.TagSet;
import net.tinytsdb.exceptions.TagParseException;
import net.tinytsdb.query.filter.TagReader;

/** Helper functions to deal with tags. */
public final class Tags {

  private Tags() {
    // Can't create instances of this utility class.
  }
  
  /**
   * Parses a tag set literal of the form {@code "k1" = "v1", "k2" = "v2"}.
   * Whitespace between tokens is ignored and the quotes are stripped. If a
   * key appears more than once the last value wins.
   * @param literal The non-null and non-empty literal.
   * @return The tag set.
   * @throws TagParseException if the literal was null, empty or malformed.
   */
  public static TagSet parseTagSet(final String literal) {
    if (Strings.isNullOrEmpty(literal) || literal.trim().isEmpty()) {
      throw new TagParseException("Tag set cannot be null or empty", 
          literal, 0);
    }
    final TagReader reader = new TagReader(literal);
    final TagSet.Builder builder = TagSet.newBuilder();
    while (true) {
      final String key = reader.readQuotedString();
      reader.expect('=', "'=' after tag key \"" + key + "\"");
      if (reader.isNextChar('=')) {
        throw reader.error("Found '==' in a tag set, use '=' to assign");
      }
      final String value = reader.readQuotedString();
      builder.addTag(key, value);
      
      reader.skipWhitespaces();
      if (reader.isEOF()) {
        break;
      }
      reader.expect(',', "',' between tags");
    }
    return builder.build();
  }
  
  /**
   * Parses a tag set literal and returns its canonical ID.
   * @param literal The non-null and non-empty literal.
   * @return The ID of the tag set.
   * @throws TagParseException if the literal was null, empty or malformed.
   */
  public static String idOf(final String literal) {
    return parseTagSet(literal).id();
  }
}
