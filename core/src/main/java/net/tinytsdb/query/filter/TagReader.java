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
package net.tinytsdb.query.filter;

import java.util.NoSuchElementException;

import net.tinytsdb.exceptions.TagParseException;

/**
 * A cursor over the characters of a tag set literal or a tag expression.
 * Please use {@link #isEOF()} before calling {@link #peek()} or 
 * {@link #next()}, otherwise they will throw a NoSuchElementException.
 * 
 * @since 1.0
 */
public class TagReader {
  /** The quote delimiting operands. */
  public static final char QUOTE = '"';
  
  /** The original input for error messages. */
  protected final String input;
  
  /** The character array to parse */
  protected final char[] chars;

  /** The current index in the character array */
  private int mark = 0;

  /**
   * Default ctor 
   * @param input The non-null text to parse.
   */
  public TagReader(final String input) {
    if (input == null) {
      throw new IllegalArgumentException("Input cannot be null");
    }
    this.input = input;
    chars = input.toCharArray();
  }

  /** @return the current index */
  public int getMark() {
    return mark;
  }

  /** @return the current character without advancing the index */
  public char peek() {
    if (isEOF()) {
      throw new NoSuchElementException("Index " + mark + " is out of bounds " 
          + chars.length);
    }
    return chars[mark];
  }

  /** @return the current character and advances the index */
  public char next() {
    if (isEOF()) {
      throw new NoSuchElementException("Index " + mark + " is out of bounds " 
          + chars.length);
    }
    return chars[mark++];
  }

  /** @param num the number of characters to skip */
  public void skip(final int num) {
    if (num < 0) {
      throw new UnsupportedOperationException("Skipping backwards is not allowed");
    }
    mark = Math.min(chars.length, mark + num);
  }

  /**
   * Checks to see if the next character matches the parameter
   * @param c The character to check for
   * @return True if they match, false if not or at the end of the input.
   */
  public boolean isNextChar(final char c) {
    return !isEOF() && peek() == c;
  }

  /** @return true if the given sequence appears next in the array. */
  public boolean isNextSeq(final CharSequence seq) {
    if (seq == null) {
      throw new IllegalArgumentException("Comparative sequence cannot be null");
    }
    for (int i = 0; i < seq.length(); i++) {
      if (mark + i >= chars.length) {
        return false;
      }
      if (chars[mark + i] != seq.charAt(i)) {
        return false;
      }
    }
    return true;
  }
  
  /**
   * Like {@link #isNextSeq(CharSequence)} but the word must end at a 
   * boundary, i.e. whitespace, a quote or the end of the input. So 
   * {@code and} matches in {@code and "a"} but not in {@code android}.
   * @param word The non-null word to look for.
   * @return True if the word is next.
   */
  public boolean isNextWord(final String word) {
    if (!isNextSeq(word)) {
      return false;
    }
    final int end = mark + word.length();
    return end >= chars.length 
        || Character.isWhitespace(chars[end]) 
        || chars[end] == QUOTE;
  }

  /** @return Whether or not the index is at the end of the character array */
  public boolean isEOF() {
    return mark >= chars.length;
  }

  /** Increments the mark over white spaces */
  public void skipWhitespaces() {
    while (mark < chars.length && Character.isWhitespace(chars[mark])) {
      mark++;
    }
  }
  
  /**
   * Consumes the expected character, skipping any leading whitespace.
   * @param c The character to consume.
   * @param what A description of the token for the error message.
   * @throws TagParseException if something else was found.
   */
  public void expect(final char c, final String what) {
    skipWhitespaces();
    if (!isNextChar(c)) {
      throw error("Expected " + what);
    }
    mark++;
  }

  /**
   * Reads a string enclosed in double quotes, skipping any leading 
   * whitespace. There isn't any escaping, the string ends at the next quote.
   * @return The string without the quotes, possibly empty.
   * @throws TagParseException if the next token isn't a quoted string or 
   * the closing quote is missing.
   */
  public String readQuotedString() {
    skipWhitespaces();
    if (isEOF()) {
      throw error("Expected a quoted string but reached the end of input");
    }
    if (peek() != QUOTE) {
      throw error("Expected a quoted string but found '" + peek() + "'");
    }
    final int start = mark;
    mark++;
    final StringBuilder builder = new StringBuilder();
    while (!isEOF() && peek() != QUOTE) {
      builder.append(next());
    }
    if (isEOF()) {
      throw new TagParseException("Unterminated quoted string", input, start);
    }
    mark++; // closing quote
    return builder.toString();
  }
  
  /**
   * @param message A description of the problem.
   * @return An exception flagging the current position.
   */
  public TagParseException error(final String message) {
    return new TagParseException(message, input, mark);
  }

  @Override
  public String toString() {
    return input;
  }

}
