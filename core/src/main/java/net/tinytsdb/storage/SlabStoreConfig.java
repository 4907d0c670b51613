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

import java.io.File;
import java.util.Map;

import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;

/**
 * Settings for a {@link SlabStore}. Build one by hand with 
 * {@link #newBuilder()} or load it from a config through the config 
 * library's usual sources, with the {@code reference.conf} shipped in this
 * jar as the fallback for missing keys:
 * <pre>
 * tinytsdb.slab.duration = 3600000000000
 * tinytsdb.slab.selection = ENDED_BEFORE
 * </pre>
 * 
 * @since 1.0
 */
public class SlabStoreConfig {
  private static final Logger LOG = LoggerFactory.getLogger(SlabStoreConfig.class);
  private static final ConfigParseOptions DEFAULT_PARSE_OPTIONS = 
      ConfigParseOptions.defaults().setAllowMissing(false);
  
  /** The width of new slabs, in the unit of the sample timestamps. */
  public static final String DURATION_KEY = "tinytsdb.slab.duration";
  
  /** The name of a {@link SlabSelectionPolicy}. */
  public static final String SELECTION_KEY = "tinytsdb.slab.selection";
  
  /** One hour of nanoseconds. */
  public static final long DEFAULT_DURATION = 3600L * 1000 * 1000 * 1000;
  
  /** The width of every new slab. */
  private final long slab_duration;
  
  /** Which slab takes a sample. */
  private final SlabSelectionPolicy selection_policy;
  
  /**
   * Protected ctor.
   * @param builder The non-null builder.
   * @throws IllegalArgumentException if the duration was zero or negative.
   */
  protected SlabStoreConfig(final Builder builder) {
    if (builder.slab_duration <= 0) {
      throw new IllegalArgumentException("Slab duration must be greater "
          + "than 0: " + builder.slab_duration);
    }
    slab_duration = builder.slab_duration;
    selection_policy = builder.selection_policy == null ? 
        SlabSelectionPolicy.ENDED_BEFORE : builder.selection_policy;
  }
  
  /** @return The width of every new slab. */
  public long slabDuration() {
    return slab_duration;
  }
  
  /** @return The policy picking the slab for a sample. */
  public SlabSelectionPolicy selectionPolicy() {
    return selection_policy;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{slabDuration=")
        .append(slab_duration)
        .append(", selectionPolicy=")
        .append(selection_policy)
        .append("}")
        .toString();
  }
  
  /**
   * Loads the config from the default (application) sources as dictated by
   * the config library. A missing application file is fine, the reference
   * values apply.
   * @return A non-null config.
   */
  @Nonnull
  public static SlabStoreConfig load() {
    return fromConfig(ConfigFactory.load());
  }
  
  /**
   * Loads the config from the default sources with the given values 
   * overridden.
   * @param overrides Keys and values that take precedence.
   * @return A non-null config.
   */
  @Nonnull
  public static SlabStoreConfig defaultWithOverrides(final Map<String, ?> overrides) {
    final Config config_overrides = ConfigFactory.parseMap(overrides, "overrides");
    return fromConfig(config_overrides.withFallback(ConfigFactory.load()));
  }
  
  /**
   * Loads the config from the given file.
   * @param config_file A file in any syntax the config library supports.
   * @return A non-null config.
   * @throws ConfigException.IO if the file is missing.
   */
  @Nonnull
  public static SlabStoreConfig fromFile(final File config_file) {
    return fromConfig(ConfigFactory.parseFileAnySyntax(config_file, 
        DEFAULT_PARSE_OPTIONS));
  }
  
  /**
   * Reads the settings from the given config, falling back to the values 
   * in {@code reference.conf}.
   * @param config A non-null config.
   * @return A non-null config.
   * @throws ConfigException.BadValue if the duration isn't positive or the
   * policy name is unknown.
   */
  @Nonnull
  public static SlabStoreConfig fromConfig(final Config config) {
    final Config merged = config.withFallback(
        ConfigFactory.parseResourcesAnySyntax("reference", DEFAULT_PARSE_OPTIONS));
    LOG.info("Loaded config from {}", config.origin());
    
    final long duration = merged.getLong(DURATION_KEY);
    if (duration <= 0) {
      throw new ConfigException.BadValue(merged.origin(), DURATION_KEY, 
          "must be greater than 0 but was " + duration);
    }
    return newBuilder()
        .setSlabDuration(duration)
        .setSelectionPolicy(merged.getEnum(SlabSelectionPolicy.class, SELECTION_KEY))
        .build();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private long slab_duration = DEFAULT_DURATION;
    private SlabSelectionPolicy selection_policy;
    
    public Builder setSlabDuration(final long slab_duration) {
      this.slab_duration = slab_duration;
      return this;
    }
    
    public Builder setSelectionPolicy(final SlabSelectionPolicy selection_policy) {
      this.selection_policy = selection_policy;
      return this;
    }
    
    public SlabStoreConfig build() {
      return new SlabStoreConfig(this);
    }
  }
}
