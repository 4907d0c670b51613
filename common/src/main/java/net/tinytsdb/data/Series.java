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

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The result of a range read: timestamps in ascending order with the 
 * values at the same index. Both arrays always have the same length.
 * Instances are immutable, the accessors return copies.
 * 
 * @since 1.0
 */
public class Series {
  
  /** A series without any points. */
  public static final Series EMPTY = new Series(new long[0], new double[0]);
  
  /** The timestamps, ascending. */
  private final long[] timestamps;
  
  /** The values aligned with {@link #timestamps}. */
  private final double[] values;
  
  /**
   * Default ctor. The arrays are copied.
   * @param timestamps A non-null array of timestamps.
   * @param values A non-null array of values of the same length.
   * @throws IllegalArgumentException if either array was null or the 
   * lengths differ.
   */
  @JsonCreator
  public Series(@JsonProperty("timestamps") final long[] timestamps,
                @JsonProperty("values") final double[] values) {
    if (timestamps == null) {
      throw new IllegalArgumentException("Timestamps cannot be null.");
    }
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    if (timestamps.length != values.length) {
      throw new IllegalArgumentException("Timestamp count " 
          + timestamps.length + " does not match the value count " 
          + values.length);
    }
    this.timestamps = Arrays.copyOf(timestamps, timestamps.length);
    this.values = Arrays.copyOf(values, values.length);
  }
  
  /** @return A copy of the timestamps. */
  @JsonProperty("timestamps")
  public long[] timestamps() {
    return Arrays.copyOf(timestamps, timestamps.length);
  }
  
  /** @return A copy of the values. */
  @JsonProperty("values")
  public double[] values() {
    return Arrays.copyOf(values, values.length);
  }
  
  /**
   * @param index An index from 0 to {@link #size()} exclusive.
   * @return The timestamp at the index.
   */
  public long timestamp(final int index) {
    return timestamps[index];
  }
  
  /**
   * @param index An index from 0 to {@link #size()} exclusive.
   * @return The value at the index.
   */
  public double value(final int index) {
    return values[index];
  }
  
  /** @return The number of points. */
  public int size() {
    return timestamps.length;
  }
  
  /** @return True if there aren't any points. */
  @JsonIgnore
  public boolean isEmpty() {
    return timestamps.length == 0;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Series other = (Series) o;
    return Arrays.equals(timestamps, other.timestamps) 
        && Arrays.equals(values, other.values);
  }
  
  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(timestamps) + Arrays.hashCode(values);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{timestamps=")
        .append(Arrays.toString(timestamps))
        .append(", values=")
        .append(Arrays.toString(values))
        .append("}")
        .toString();
  }
}
