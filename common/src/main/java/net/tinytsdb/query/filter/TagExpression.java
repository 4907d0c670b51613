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

import com.fasterxml.jackson.annotation.JsonProperty;

import net.tinytsdb.data.TagSet;

/**
 * A boolean condition over a {@link TagSet}. Expressions are immutable 
 * trees built by the parser or by hand through the builders.
 * 
 * @since 1.0
 */
public interface TagExpression {
  
  /** @return A name for the expression node type. */
  @JsonProperty("type")
  public String getType();
  
  /**
   * Evaluates the expression against the tags.
   * @param tags A non-null tag set.
   * @return True if the set satisfies the expression.
   */
  public boolean matches(final TagSet tags);
}
