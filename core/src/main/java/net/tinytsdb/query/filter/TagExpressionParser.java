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

import java.util.List;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import net.tinytsdb.data.TagSet;
import net.tinytsdb.exceptions.TagParseException;
import net.tinytsdb.query.filter.EqualityExpression.EqualityOp;
import net.tinytsdb.query.filter.LogicalExpression.LogicalOp;

/**
 * Parses tag expressions of the form:
 * <pre>
 * Equality ::= QuotedString ('==' | '!=') QuotedString
 * Logical  ::= Equality (('and' | 'or') Logical)?
 * </pre>
 * e.g. {@code "host" == "web01" and "dc" != "lga" or "app" == "db"}.
 * Operands are any text between double quotes, without escaping. The 
 * connectives are lower case. Chains nest to the right and there isn't any
 * grouping, parentheses are rejected.
 * 
 * @since 1.0
 */
public class TagExpressionParser {
  
  /** No instantiation for you! */
  private TagExpressionParser() { }
  
  /**
   * Parses the expression.
   * @param expression The non-null and non-empty expression.
   * @return A {@link EqualityExpression} if the input was a single 
   * comparison, a {@link LogicalExpression} chain otherwise.
   * @throws TagParseException if the expression was null, empty or didn't 
   * match the grammar.
   */
  public static TagExpression parse(final String expression) {
    if (Strings.isNullOrEmpty(expression) || expression.trim().isEmpty()) {
      throw new TagParseException("Expression cannot be null or empty", 
          expression, 0);
    }
    
    final TagReader reader = new TagReader(expression);
    final List<EqualityExpression> equalities = Lists.newArrayList();
    final List<LogicalOp> ops = Lists.newArrayList();
    while (true) {
      equalities.add(parseEquality(reader));
      reader.skipWhitespaces();
      if (reader.isEOF()) {
        break;
      }
      final LogicalOp op = parseConnective(reader);
      if (op == null) {
        throw reader.error("Expected 'and', 'or' or the end of the "
            + "expression");
      }
      ops.add(op);
    }
    
    // fold from the right to build the right-recursive chain
    TagExpression expression_tree = equalities.get(equalities.size() - 1);
    for (int i = ops.size() - 1; i >= 0; i--) {
      expression_tree = LogicalExpression.newBuilder()
          .setHead(equalities.get(i))
          .setOp(ops.get(i))
          .setRemainder(expression_tree)
          .build();
    }
    return expression_tree;
  }
  
  /**
   * Parses the expression and evaluates it against the tags.
   * @param expression The non-null and non-empty expression.
   * @param tags The non-null tags to evaluate against.
   * @return True if the tags satisfy the expression.
   * @throws TagParseException if the expression didn't parse.
   */
  public static boolean matches(final String expression, final TagSet tags) {
    if (tags == null) {
      throw new IllegalArgumentException("Tags cannot be null.");
    }
    return parse(expression).matches(tags);
  }
  
  /**
   * Parses one {@code "left" op "right"} comparison.
   * @param reader The non-null reader.
   * @return The equality.
   */
  static EqualityExpression parseEquality(final TagReader reader) {
    reader.skipWhitespaces();
    if (reader.isNextChar('(')) {
      throw reader.error("Parenthetical grouping is not supported");
    }
    final String left = reader.readQuotedString();
    reader.skipWhitespaces();
    final EqualityOp op;
    if (reader.isNextSeq(EqualityOp.EQUALS.symbol())) {
      op = EqualityOp.EQUALS;
    } else if (reader.isNextSeq(EqualityOp.NOT_EQUALS.symbol())) {
      op = EqualityOp.NOT_EQUALS;
    } else {
      throw reader.error("Expected '==' or '!='");
    }
    reader.skip(op.symbol().length());
    final String right = reader.readQuotedString();
    return EqualityExpression.newBuilder()
        .setOp(op)
        .setLeft(left)
        .setRight(right)
        .build();
  }
  
  /**
   * Consumes an {@code and} or {@code or} if one is next.
   * @param reader The non-null reader positioned on a non-whitespace char.
   * @return The operator or null if neither word was next.
   */
  static LogicalOp parseConnective(final TagReader reader) {
    if (reader.isNextWord("and")) {
      reader.skip(3);
      return LogicalOp.AND;
    }
    if (reader.isNextWord("or")) {
      reader.skip(2);
      return LogicalOp.OR;
    }
    return null;
  }
}
