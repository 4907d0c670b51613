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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.tinytsdb.utils.JSON;

public class TestSeries {

  @Test
  public void ctor() throws Exception {
    final long[] timestamps = new long[] { 7, 8, 20 };
    final double[] values = new double[] { 8.1, 2.4, 3.0 };
    final Series series = new Series(timestamps, values);
    assertEquals(3, series.size());
    assertFalse(series.isEmpty());
    assertEquals(7, series.timestamp(0));
    assertEquals(3.0, series.value(2), 0.0);
    assertArrayEquals(new long[] { 7, 8, 20 }, series.timestamps());
    assertArrayEquals(new double[] { 8.1, 2.4, 3.0 }, series.values(), 0.0);
    
    // copies in and out
    timestamps[0] = 42;
    series.values()[0] = -1;
    assertEquals(7, series.timestamp(0));
    assertEquals(8.1, series.value(0), 0.0);
    
    try {
      new Series(null, new double[0]);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new Series(new long[0], null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new Series(new long[] { 1, 2 }, new double[] { 1.0 });
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void empty() throws Exception {
    assertTrue(Series.EMPTY.isEmpty());
    assertEquals(0, Series.EMPTY.size());
    assertEquals(0, Series.EMPTY.timestamps().length);
    assertEquals(0, Series.EMPTY.values().length);
    assertEquals(Series.EMPTY, new Series(new long[0], new double[0]));
  }
  
  @Test
  public void equalsAndHashCode() throws Exception {
    final Series a = new Series(new long[] { 1, 2 }, new double[] { 1.5, 2.5 });
    final Series b = new Series(new long[] { 1, 2 }, new double[] { 1.5, 2.5 });
    final Series c = new Series(new long[] { 1, 2 }, new double[] { 1.5, 3.5 });
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
    assertEquals("{timestamps=[1, 2], values=[1.5, 2.5]}", a.toString());
  }
  
  @Test
  public void serdes() throws Exception {
    final Series series = new Series(new long[] { 5, 7 }, 
        new double[] { 1.0, -1.1 });
    final String json = JSON.serializeToString(series);
    assertTrue(json.contains("\"timestamps\":[5,7]"));
    assertTrue(json.contains("\"values\":[1.0,-1.1]"));
    assertFalse(json.contains("empty"));
    
    final Series parsed = JSON.parseToObject(json, Series.class);
    assertEquals(series, parsed);
    
    try {
      JSON.parseToObject("{\"timestamps\":[1],\"values\":[]}", Series.class);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
