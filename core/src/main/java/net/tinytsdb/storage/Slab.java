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
package net.tinytsdb.storage;

import java.util.Arrays;

import com.google.common.math.LongMath;

/**
 * A fixed width, append only window of samples for a single tag set ID.
 * The window covers {@code [startTime, startTime + duration)}. Timestamps 
 * and values are kept in two arrays at the same index, in the order they
 * were written, <i>not</i> in time order. Readers sort.
 * <p>
 * Slabs are created and written by the {@link SlabStore} only. 
 * Not thread safe.
 * 
 * @since 1.0
 */
public class Slab {
  /** Initial capacity of the arrays. */
  static final int INITIAL_CAPACITY = 16;
  
  /** The inclusive start of the window. */
  private final long start_time;
  
  /** The width of the window. */
  private final long duration;
  
  /** Sample timestamps in write order. */
  private long[] timestamps;
  
  /** Sample values aligned with {@link #timestamps}. */
  private double[] values;
  
  /** How many samples have been written. */
  private int size;
  
  /** Epoch nanos of the last write, or of creation. */
  private long last_modified;
  
  /**
   * Package private ctor.
   * @param start_time The inclusive start of the window.
   * @param duration The width of the window, greater than zero.
   * @param created Epoch nanos of the creation.
   */
  Slab(final long start_time, final long duration, final long created) {
    if (duration <= 0) {
      throw new IllegalArgumentException("Duration must be greater than 0: " 
          + duration);
    }
    this.start_time = start_time;
    this.duration = duration;
    timestamps = new long[INITIAL_CAPACITY];
    values = new double[INITIAL_CAPACITY];
    last_modified = created;
  }
  
  /**
   * Appends the sample, growing the arrays if needed.
   * @param timestamp The timestamp of the sample.
   * @param value The value of the sample.
   * @param modified Epoch nanos of the write.
   */
  void append(final long timestamp, final double value, final long modified) {
    if (size == timestamps.length) {
      final int capacity = size * 2;
      timestamps = Arrays.copyOf(timestamps, capacity);
      values = Arrays.copyOf(values, capacity);
    }
    timestamps[size] = timestamp;
    values[size] = value;
    size++;
    last_modified = modified;
  }
  
  /** @return The inclusive start of the window. */
  public long startTime() {
    return start_time;
  }
  
  /** @return The width of the window. */
  public long duration() {
    return duration;
  }
  
  /** @return The exclusive end of the window, saturated at Long.MAX_VALUE. */
  public long endTime() {
    return LongMath.saturatedAdd(start_time, duration);
  }
  
  /**
   * Whether or not the window intersects {@code [start, stop)}. An empty
   * or inverted range, {@code start >= stop}, intersects nothing.
   * @param start The inclusive start of the range.
   * @param stop The exclusive end of the range.
   * @return True if they overlap.
   */
  public boolean overlaps(final long start, final long stop) {
    if (start >= stop) {
      return false;
    }
    return start_time < stop && endTime() > start;
  }
  
  /** @return The number of samples in the slab. */
  public int size() {
    return size;
  }
  
  /**
   * @param index An index from 0 to {@link #size()} exclusive.
   * @return The timestamp written at the index.
   */
  public long timestamp(final int index) {
    checkIndex(index);
    return timestamps[index];
  }
  
  /**
   * @param index An index from 0 to {@link #size()} exclusive.
   * @return The value written at the index.
   */
  public double value(final int index) {
    checkIndex(index);
    return values[index];
  }
  
  /** @return Epoch nanos of the last write or of the creation. */
  public long lastModified() {
    return last_modified;
  }
  
  private void checkIndex(final int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("Index " + index 
          + " is out of bounds " + size);
    }
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{startTime=")
        .append(start_time)
        .append(", duration=")
        .append(duration)
        .append(", size=")
        .append(size)
        .append(", lastModified=")
        .append(last_modified)
        .append("}")
        .toString();
  }
}
