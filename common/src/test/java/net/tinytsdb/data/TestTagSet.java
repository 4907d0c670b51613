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
package net.tinytsdb.data;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Map;

import org.junit.Test;

import com.google.common.collect.Maps;

import net.tinytsdb.utils.JSON;

public class TestTagSet {

  @Test
  public void builder() throws Exception {
    TagSet tags = TagSet.newBuilder()
        .addTag("host", "web01")
        .addTag("dc", "phx")
        .build();
    assertEquals(2, tags.size());
    assertEquals("web01", tags.get("host"));
    assertEquals("phx", tags.get("dc"));
    assertTrue(tags.containsKey("host"));
    assertFalse(tags.containsKey("owner"));
    assertNull(tags.get("owner"));
    assertFalse(tags.isEmpty());
    
    // replace
    tags = TagSet.newBuilder()
        .addTag("host", "web01")
        .addTag("host", "web02")
        .build();
    assertEquals(1, tags.size());
    assertEquals("web02", tags.get("host"));
    
    try {
      TagSet.newBuilder()
        .addTag(null, "web01")
        .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      TagSet.newBuilder()
        .addTag("host", null)
        .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void immutable() throws Exception {
    final Map<String, String> map = Maps.newHashMap();
    map.put("host", "web01");
    final TagSet tags = TagSet.newBuilder()
        .setTags(map)
        .build();
    map.put("dc", "phx");
    assertEquals(1, tags.size());
    
    try {
      tags.tags().put("dc", "phx");
      fail("Expected UnsupportedOperationException");
    } catch (UnsupportedOperationException e) { }
  }
  
  @Test
  public void id() throws Exception {
    TagSet tags = TagSet.newBuilder()
        .addTag("b", "B")
        .addTag("a", "A")
        .build();
    assertEquals("a=A,b=B", tags.id());
    
    tags = TagSet.newBuilder()
        .addTag("a", "A")
        .addTag("b", "B")
        .build();
    assertEquals("a=A,b=B", tags.id());
    
    tags = TagSet.newBuilder()
        .addTag("host", "web01")
        .build();
    assertEquals("host=web01", tags.id());
    
    // sorted on the full pair, not just the key.
    tags = TagSet.newBuilder()
        .addTag("a", "Z")
        .addTag("a.b", "A")
        .addTag("B", "x")
        .build();
    assertEquals("B=x,a.b=A,a=Z", tags.id());
    
    assertEquals("", TagSet.newBuilder().build().id());
    assertEquals("", TagSet.EMPTY.id());
    assertTrue(TagSet.EMPTY.isEmpty());
  }
  
  @Test
  public void idIsStableAcrossManyInsertOrders() throws Exception {
    final String[] keys = new String[] { "region", "host", "dc", "app", "z" };
    String expected = null;
    for (int offset = 0; offset < keys.length; offset++) {
      final TagSet.Builder builder = TagSet.newBuilder();
      for (int i = 0; i < keys.length; i++) {
        final String key = keys[(i + offset) % keys.length];
        builder.addTag(key, key.toUpperCase());
      }
      final String id = builder.build().id();
      if (expected == null) {
        expected = id;
      }
      assertEquals(expected, id);
    }
    assertEquals("app=APP,dc=DC,host=HOST,region=REGION,z=Z", expected);
  }
  
  @Test
  public void equalsAndHashCode() throws Exception {
    final TagSet a = TagSet.newBuilder()
        .addTag("a", "A")
        .addTag("b", "B")
        .build();
    final TagSet b = TagSet.newBuilder()
        .addTag("b", "B")
        .addTag("a", "A")
        .build();
    final TagSet c = TagSet.newBuilder()
        .addTag("b", "B")
        .addTag("c", "C")
        .build();
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
    assertEquals("{tags=a=A,b=B}", a.toString());
  }
  
  @Test
  public void serdes() throws Exception {
    final TagSet tags = TagSet.newBuilder()
        .addTag("host", "web01")
        .addTag("dc", "phx")
        .build();
    final String json = JSON.serializeToString(tags);
    assertTrue(json.contains("\"tags\":{"));
    assertTrue(json.contains("\"host\":\"web01\""));
    assertTrue(json.contains("\"dc\":\"phx\""));
    assertFalse(json.contains("empty"));
    
    final TagSet parsed = JSON.parseToObject(json, TagSet.class);
    assertEquals(tags, parsed);
    assertEquals("dc=phx,host=web01", parsed.id());
  }
}
