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
 * Compares two operands of a tag set with {@code ==} or {@code !=}.
 * <p>
 * <b>NOTE:</b> Both operands are looked up as tag <i>keys</i> and the two
 * resulting values are compared. The right hand operand is not treated as a
 * literal value so {@code "host" == "123"} is only true if the set has a
 * key {@code 123} whose value equals that of {@code host}. A missing key
 * yields "no value", which is only equal to another missing key.
 * 
 * @since 1.0
 */
public class EqualityExpression implements TagExpression {
  public static final String TYPE = "Equality";
  
  /** The comparison operator. */
  public static enum EqualityOp {
    EQUALS("=="),
    NOT_EQUALS("!=");
    
    private final String symbol;
    
    private EqualityOp(final String symbol) {
      this.symbol = symbol;
    }
    
    /** @return The textual form of the operator. */
    public String symbol() {
      return symbol;
    }
  }
  
  /** The operator. */
  protected final EqualityOp op;
  
  /** The left hand operand with the quotes stripped. */
  protected final String left;
  
  /** The right hand operand with the quotes stripped. */
  protected final String right;
  
  /**
   * Protected ctor.
   * @param builder The non-null builder.
   * @throws IllegalArgumentException if the operator or an operand was null.
   */
  protected EqualityExpression(final Builder builder) {
    if (builder.op == null) {
      throw new IllegalArgumentException("Operator cannot be null.");
    }
    if (builder.left == null) {
      throw new IllegalArgumentException("Left operand cannot be null.");
    }
    if (builder.right == null) {
      throw new IllegalArgumentException("Right operand cannot be null.");
    }
    op = builder.op;
    left = builder.left;
    right = builder.right;
  }
  
  @Override
  public String getType() {
    return TYPE;
  }
  
  @Override
  public boolean matches(final TagSet tags) {
    final boolean equal = Objects.equal(tags.get(left), tags.get(right));
    return op == EqualityOp.EQUALS ? equal : !equal;
  }
  
  /** @return The operator. */
  @JsonProperty("op")
  public EqualityOp getOp() {
    return op;
  }
  
  /** @return The left operand. */
  @JsonProperty("left")
  public String getLeft() {
    return left;
  }
  
  /** @return The right operand. */
  @JsonProperty("right")
  public String getRight() {
    return right;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final EqualityExpression other = (EqualityExpression) o;
    return op == other.op
        && Objects.equal(left, other.left)
        && Objects.equal(right, other.right);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(op, left, right);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{type=")
        .append(getClass().getSimpleName())
        .append(", left=")
        .append(left)
        .append(", op=")
        .append(op)
        .append(", right=")
        .append(right)
        .append("}")
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private EqualityOp op;
    private String left;
    private String right;
    
    public Builder setOp(final EqualityOp op) {
      this.op = op;
      return this;
    }
    
    public Builder setLeft(final String left) {
      this.left = left;
      return this;
    }
    
    public Builder setRight(final String right) {
      this.right = right;
      return this;
    }
    
    public EqualityExpression build() {
      return new EqualityExpression(this);
    }
  }
}
