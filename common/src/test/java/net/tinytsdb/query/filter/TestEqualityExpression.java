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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.tinytsdb.data.TagSet;
import net.tinytsdb.query.filter.EqualityExpression.EqualityOp;
import net.tinytsdb.utils.JSON;

public class TestEqualityExpression {
  private static final TagSet TAGS = TagSet.newBuilder()
      .addTag("host", "web01")
      .addTag("origin", "web01")
      .addTag("dc", "phx")
      .addTag("123", "phx")
      .build();

  @Test
  public void builder() throws Exception {
    final EqualityExpression expression = EqualityExpression.newBuilder()
        .setOp(EqualityOp.EQUALS)
        .setLeft("host")
        .setRight("123")
        .build();
    assertEquals(EqualityOp.EQUALS, expression.getOp());
    assertEquals("host", expression.getLeft());
    assertEquals("123", expression.getRight());
    assertEquals(EqualityExpression.TYPE, expression.getType());
    assertEquals("==", EqualityOp.EQUALS.symbol());
    assertEquals("!=", EqualityOp.NOT_EQUALS.symbol());
    
    try {
      EqualityExpression.newBuilder()
        .setLeft("host")
        .setRight("123")
        .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      EqualityExpression.newBuilder()
        .setOp(EqualityOp.EQUALS)
        .setRight("123")
        .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      EqualityExpression.newBuilder()
        .setOp(EqualityOp.EQUALS)
        .setLeft("host")
        .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void matchesComparesTwoKeys() throws Exception {
    // both operands are keys, the values match.
    assertTrue(eq("host", "origin").matches(TAGS));
    assertTrue(eq("dc", "123").matches(TAGS));
    assertFalse(eq("host", "dc").matches(TAGS));
    
    // the right operand is not a literal.
    assertFalse(eq("host", "web01").matches(TAGS));
    assertTrue(neq("host", "web01").matches(TAGS));
    
    assertFalse(neq("host", "origin").matches(TAGS));
    assertTrue(neq("host", "dc").matches(TAGS));
  }
  
  @Test
  public void matchesMissingKeys() throws Exception {
    // missing vs present
    assertFalse(eq("host", "nope").matches(TAGS));
    assertFalse(eq("nope", "host").matches(TAGS));
    assertTrue(neq("nope", "host").matches(TAGS));
    
    // both missing
    assertTrue(eq("nope", "nada").matches(TAGS));
    assertFalse(neq("nope", "nada").matches(TAGS));
    assertTrue(eq("nope", "nada").matches(TagSet.EMPTY));
    
    // same key
    assertTrue(eq("host", "host").matches(TAGS));
  }
  
  @Test
  public void equalsAndHashCode() throws Exception {
    final EqualityExpression a = eq("host", "123");
    final EqualityExpression b = eq("host", "123");
    final EqualityExpression c = neq("host", "123");
    final EqualityExpression d = eq("123", "host");
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
    assertNotEquals(a, d);
    assertEquals("{type=EqualityExpression, left=host, op=EQUALS, right=123}", 
        a.toString());
  }
  
  @Test
  public void serialize() throws Exception {
    final String json = JSON.serializeToString(neq("host", "123"));
    assertTrue(json.contains("\"type\":\"Equality\""));
    assertTrue(json.contains("\"op\":\"NOT_EQUALS\""));
    assertTrue(json.contains("\"left\":\"host\""));
    assertTrue(json.contains("\"right\":\"123\""));
  }
  
  static EqualityExpression eq(final String left, final String right) {
    return EqualityExpression.newBuilder()
        .setOp(EqualityOp.EQUALS)
        .setLeft(left)
        .setRight(right)
        .build();
  }
  
  static EqualityExpression neq(final String left, final String right) {
    return EqualityExpression.newBuilder()
        .setOp(EqualityOp.NOT_EQUALS)
        .setLeft(left)
        .setRight(right)
        .build();
  }
}
