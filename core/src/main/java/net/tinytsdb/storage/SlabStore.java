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

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.math.LongMath;

import net.tinytsdb.core.Tags;
import net.tinytsdb.data.Series;
import net.tinytsdb.data.TagSet;

/**
 * An in-memory time series store. Samples are grouped by the ID of their
 * {@link TagSet} and, per ID, into fixed width {@link Slab}s kept in 
 * creation order. Writes append to the first slab accepted by the 
 * configured {@link SlabSelectionPolicy} or open a new slab starting at the
 * sample time. Reads merge the points of every slab overlapping the range
 * and sort them by time.
 * <p>
 * Nothing is ever evicted so memory grows with every write. 
 * <p>
 * <b>NOTE:</b> This class is not thread safe. Callers sharing a store must
 * serialize access, e.g. with a read/write lock around the store.
 * 
 * @since 1.0
 */
public class SlabStore {
  private static final Logger LOG = LoggerFactory.getLogger(SlabStore.class);
  
  /** The settings. */
  private final SlabStoreConfig config;
  
  /** Source of the last modified stamps. */
  private final Clock clock;
  
  /** Called on flush. */
  private final SlabFlusher flusher;
  
  /** Tag set ID to slabs in creation order. */
  private final Map<String, List<Slab>> hot_slabs;
  
  /**
   * Ctor using the system clock and a flusher that doesn't persist.
   * @param config The non-null config.
   */
  public SlabStore(final SlabStoreConfig config) {
    this(config, Clock.systemUTC(), SlabFlusher.NOOP);
  }
  
  /**
   * Full ctor.
   * @param config The non-null config.
   * @param clock The non-null clock for last modified stamps.
   * @param flusher The non-null flusher.
   * @throws IllegalArgumentException if any argument was null.
   */
  public SlabStore(final SlabStoreConfig config, 
                   final Clock clock, 
                   final SlabFlusher flusher) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null.");
    }
    if (flusher == null) {
      throw new IllegalArgumentException("Flusher cannot be null.");
    }
    this.config = config;
    this.clock = clock;
    this.flusher = flusher;
    hot_slabs = Maps.newHashMap();
    LOG.info("Instantiated slab store with config {} and flusher {}", 
        config, flusher);
  }
  
  /**
   * Writes a sample for the tag set. Any timestamp and value is accepted,
   * including out of order and negative timestamps.
   * @param tags The non-null tag set addressing the series.
   * @param time The sample timestamp.
   * @param value The sample value.
   * @throws IllegalArgumentException if the tag set was null.
   */
  public void write(final TagSet tags, final long time, final double value) {
    if (tags == null) {
      throw new IllegalArgumentException("Tags cannot be null.");
    }
    final String id = tags.id();
    List<Slab> slabs = hot_slabs.get(id);
    if (slabs == null) {
      slabs = Lists.newArrayList();
      hot_slabs.put(id, slabs);
    }
    
    Slab slab = null;
    for (final Slab candidate : slabs) {
      if (config.selectionPolicy().accepts(candidate, time)) {
        slab = candidate;
        break;
      }
    }
    
    final long now = nowNanos();
    if (slab == null) {
      slab = new Slab(time, config.slabDuration(), now);
      slabs.add(slab);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Created slab #" + slabs.size() + " " + slab 
            + " for series [" + id + "]");
      }
    }
    slab.append(time, value, now);
  }
  
  /**
   * Parses the tag set literal, e.g. {@code "host" = "web01"}, and writes 
   * the sample. Nothing is written if the literal is malformed.
   * @param tags A tag set literal.
   * @param time The sample timestamp.
   * @param value The sample value.
   * @throws net.tinytsdb.exceptions.TagParseException if the literal 
   * couldn't be parsed.
   */
  public void write(final String tags, final long time, final double value) {
    write(Tags.parseTagSet(tags), time, value);
  }
  
  /**
   * Reads the points of the tag set falling in {@code [start, stop)}, 
   * sorted by timestamp. The order of points with the same timestamp is 
   * unspecified.
   * @param tags The non-null tag set to read.
   * @param start The inclusive start of the range.
   * @param stop The exclusive end of the range.
   * @return A non-null and possibly empty series.
   * @throws IllegalArgumentException if the tag set was null.
   */
  public Series read(final TagSet tags, final long start, final long stop) {
    if (tags == null) {
      throw new IllegalArgumentException("Tags cannot be null.");
    }
    final List<Slab> slabs = hot_slabs.get(tags.id());
    if (slabs == null || start >= stop) {
      return Series.EMPTY;
    }
    
    int count = 0;
    for (final Slab slab : slabs) {
      if (slab.overlaps(start, stop)) {
        count += slab.size();
      }
    }
    if (count == 0) {
      return Series.EMPTY;
    }
    
    final long[] timestamps = new long[count];
    final double[] values = new double[count];
    int idx = 0;
    for (final Slab slab : slabs) {
      if (!slab.overlaps(start, stop)) {
        continue;
      }
      for (int i = 0; i < slab.size(); i++) {
        final long timestamp = slab.timestamp(i);
        if (timestamp >= start && timestamp < stop) {
          timestamps[idx] = timestamp;
          values[idx] = slab.value(i);
          idx++;
        }
      }
    }
    if (idx == 0) {
      return Series.EMPTY;
    }
    
    // stable sort of the indices so ties keep their collection order
    final Integer[] order = new Integer[idx];
    for (int i = 0; i < idx; i++) {
      order[i] = i;
    }
    Arrays.sort(order, new Comparator<Integer>() {
      @Override
      public int compare(final Integer a, final Integer b) {
        return Long.compare(timestamps[a], timestamps[b]);
      }
    });
    
    final long[] sorted_timestamps = new long[idx];
    final double[] sorted_values = new double[idx];
    for (int i = 0; i < idx; i++) {
      sorted_timestamps[i] = timestamps[order[i]];
      sorted_values[i] = values[order[i]];
    }
    return new Series(sorted_timestamps, sorted_values);
  }
  
  /**
   * Hands the store to the configured {@link SlabFlusher}. Exceptions 
   * thrown by the flusher are passed to the caller.
   */
  public void flush() {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Flushing " + hot_slabs.size() + " series to " + flusher);
    }
    flusher.flush(this);
  }
  
  /** @return An unmodifiable view of the tag set IDs written so far. */
  public Set<String> identities() {
    return Collections.unmodifiableSet(hot_slabs.keySet());
  }
  
  /**
   * @param id A tag set ID.
   * @return An unmodifiable view of the slabs for the ID in creation order,
   * empty if the ID was never written.
   */
  public List<Slab> slabs(final String id) {
    final List<Slab> slabs = hot_slabs.get(id);
    if (slabs == null) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(slabs);
  }
  
  /**
   * @param tags A non-null tag set.
   * @return An unmodifiable view of the slabs for the tag set in creation
   * order, empty if the tag set was never written.
   */
  public List<Slab> slabs(final TagSet tags) {
    if (tags == null) {
      throw new IllegalArgumentException("Tags cannot be null.");
    }
    return slabs(tags.id());
  }
  
  /** @return The config of the store. */
  public SlabStoreConfig config() {
    return config;
  }
  
  /** @return The current time in epoch nanoseconds. */
  private long nowNanos() {
    final Instant now = clock.instant();
    return LongMath.saturatedAdd(
        TimeUnit.SECONDS.toNanos(now.getEpochSecond()), now.getNano());
  }
}
