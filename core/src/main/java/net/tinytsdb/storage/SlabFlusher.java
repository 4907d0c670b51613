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
 * Persists the contents of a {@link SlabStore} when 
 * {@link SlabStore#flush()} is called. Implementations walk 
 * {@link SlabStore#identities()} and {@link SlabStore#slabs(String)} and 
 * write them wherever they like. Called on the writer's thread.
 * 
 * @since 1.0
 */
public interface SlabFlusher {
  
  /** A flusher that doesn't do anything. */
  public static final SlabFlusher NOOP = new SlabFlusher() {
    @Override
    public void flush(final SlabStore store) {
      // nothing to persist to
    }
    
    @Override
    public String toString() {
      return "NOOP";
    }
  };
  
  /**
   * Persists the store.
   * @param store The non-null store to read from.
   */
  public void flush(final SlabStore store);
}
