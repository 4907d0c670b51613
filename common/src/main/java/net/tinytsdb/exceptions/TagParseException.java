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
package net.tinytsdb.exceptions;

/**
 * Thrown when a tag set literal or a tag expression does not match the 
 * grammar. The position is the zero based character offset in the input 
 * where parsing failed.
 * 
 * @since 1.0
 */
public class TagParseException extends IllegalArgumentException {
  private static final long serialVersionUID = -3017496127720486735L;
  
  /** The input that failed to parse. */
  private final String input;
  
  /** Where in the input the failure was detected. */
  private final int position;
  
  /**
   * Default ctor.
   * @param message A non-null description of the problem.
   * @param input The input being parsed, may be null.
   * @param position The offset at which the problem was found.
   */
  public TagParseException(final String message, 
                           final String input, 
                           final int position) {
    super(message + " at pos=" + position + ", input=" + input);
    this.input = input;
    this.position = position;
  }
  
  /** @return The input being parsed, may be null. */
  public String getInput() {
    return input;
  }
  
  /** @return The zero based offset where parsing failed. */
  public int getPosition() {
    return position;
  }
}
