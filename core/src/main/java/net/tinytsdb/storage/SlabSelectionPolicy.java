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

/**
 * Decides whether an existing slab takes a new sample. The store offers
 * each slab for the tag set ID in creation order and writes into the first
 * accepted one, or creates a new slab starting at the sample time.
 * 
 * @since 1.0
 */
public enum SlabSelectionPolicy {
  
  /**
   * Accepts a slab that starts at or before the sample and whose window 
   * ended strictly before it: {@code start <= time && end < time}. A sample
   * that falls inside the window of its only slab therefore opens a new 
   * slab. This is the historical behavior and the default. Reads are 
   * correct either way as they filter every overlapping slab.
   */
  ENDED_BEFORE {
    @Override
    public boolean accepts(final Slab slab, final long time) {
      return slab.startTime() <= time && slab.endTime() < time;
    }
  },
  
  /** Accepts the slab whose window contains the sample time. */
  CONTAINS {
    @Override
    public boolean accepts(final Slab slab, final long time) {
      return slab.startTime() <= time && time < slab.endTime();
    }
  };
  
  /**
   * @param slab A non-null slab.
   * @param time The sample timestamp.
   * @return True if the sample should be appended to the slab.
   */
  public abstract boolean accepts(final Slab slab, final long time);
}
