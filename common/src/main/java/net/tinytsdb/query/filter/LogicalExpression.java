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
import com.google.common.base.Objects;

import net.tinytsdb.data.TagSet;

/**
 * An equality joined to the rest of an expression with {@code and} or
 * {@code or}. Chains nest to the right: {@code a and b or c} is 
 * {@code a and (b or c)}. There isn't any other precedence.
 * <p>
 * Evaluation short-circuits on the head: an AND with a false head is false
 * and an OR with a true head is true, otherwise the remainder decides.
 * Evaluation, equality, hashing and {@link #toString()} iterate over the 
 * chain so their stack use doesn't depend on its length.
 * 
 * @since 1.0
 */
public class LogicalExpression implements TagExpression {
  public static final String TYPE = "Logical";
  
  /** The logical connective. */
  public static enum LogicalOp {
    AND,
    OR
  }
  
  /** The equality evaluated first. */
  protected final EqualityExpression head;
  
  /** The connective. */
  protected final LogicalOp op;
  
  /** The rest of the chain. */
  protected final TagExpression remainder;
  
  /**
   * Protected ctor.
   * @param builder The non-null builder.
   * @throws IllegalArgumentException if any component was null.
   */
  protected LogicalExpression(final Builder builder) {
    if (builder.head == null) {
      throw new IllegalArgumentException("Head expression cannot be null.");
    }
    if (builder.op == null) {
      throw new IllegalArgumentException("Operator cannot be null.");
    }
    if (builder.remainder == null) {
      throw new IllegalArgumentException("Remainder cannot be null.");
    }
    head = builder.head;
    op = builder.op;
    remainder = builder.remainder;
  }
  
  @Override
  public String getType() {
    return TYPE;
  }
  
  @Override
  public boolean matches(final TagSet tags) {
    // iterative, chains may be arbitrarily long
    TagExpression current = this;
    while (current instanceof LogicalExpression) {
      final LogicalExpression link = (LogicalExpression) current;
      final boolean matched = link.head.matches(tags);
      switch (link.op) {
      case AND:
        if (!matched) {
          return false;
        }
        break;
      case OR:
        if (matched) {
          return true;
        }
        break;
      default:
        throw new IllegalStateException("Unhandled operator: " + link.op);
      }
      current = link.remainder;
    }
    return current.matches(tags);
  }
  
  /** @return The head equality. */
  @JsonProperty("head")
  public EqualityExpression getHead() {
    return head;
  }
  
  /** @return The connective. */
  @JsonProperty("op")
  public LogicalOp getOp() {
    return op;
  }
  
  /** @return The rest of the chain. */
  @JsonProperty("remainder")
  public TagExpression getRemainder() {
    return remainder;
  }
  
  @Override
  public boolean equals(final Object o) {
    LogicalExpression link = this;
    Object other_link = o;
    while (true) {
      if (link == other_link) {
        return true;
      }
      if (other_link == null || link.getClass() != other_link.getClass()) {
        return false;
      }
      final LogicalExpression other = (LogicalExpression) other_link;
      if (link.op != other.op || !Objects.equal(link.head, other.head)) {
        return false;
      }
      if (!(link.remainder instanceof LogicalExpression)) {
        return Objects.equal(link.remainder, other.remainder);
      }
      link = (LogicalExpression) link.remainder;
      other_link = other.remainder;
    }
  }
  
  @Override
  public int hashCode() {
    int hash = 1;
    TagExpression current = this;
    while (current instanceof LogicalExpression) {
      final LogicalExpression link = (LogicalExpression) current;
      hash = 31 * hash + Objects.hashCode(link.head, link.op);
      current = link.remainder;
    }
    return 31 * hash + current.hashCode();
  }
  
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    int depth = 0;
    TagExpression current = this;
    while (current instanceof LogicalExpression) {
      final LogicalExpression link = (LogicalExpression) current;
      buf.append("{type=")
         .append(link.getClass().getSimpleName())
         .append(", head=")
         .append(link.head)
         .append(", op=")
         .append(link.op)
         .append(", remainder=");
      depth++;
      current = link.remainder;
    }
    buf.append(current);
    for (int i = 0; i < depth; i++) {
      buf.append("}");
    }
    return buf.toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private EqualityExpression head;
    private LogicalOp op;
    private TagExpression remainder;
    
    public Builder setHead(final EqualityExpression head) {
      this.head = head;
      return this;
    }
    
    public Builder setOp(final LogicalOp op) {
      this.op = op;
      return this;
    }
    
    public Builder setRemainder(final TagExpression remainder) {
      this.remainder = remainder;
      return this;
    }
    
    public LogicalExpression build() {
      return new LogicalExpression(this);
    }
  }
}
