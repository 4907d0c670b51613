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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * An unordered set of tag key/value pairs addressing a series. Keys are 
 * unique. After building the set is immutable.
 * <p>
 * The {@link #id()} of a set is its canonical form: each pair rendered as
 * {@code key=value}, the strings sorted lexicographically and joined with
 * commas, e.g. {@code a=A,b=B}. Two sets holding the same pairs have the 
 * same ID regardless of the order in which the pairs were added. The empty
 * set has the empty string as its ID.
 * 
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = TagSet.Builder.class)
public class TagSet implements Identifiable {
  
  /** The empty tag set. */
  public static final TagSet EMPTY = newBuilder().build();
  
  /** Joins the sorted pairs. */
  private static final Joiner PAIR_JOINER = Joiner.on(',');
  
  /** The non-null and unmodifiable map of tags. */
  protected final Map<String, String> tags;
  
  /** Lazily computed ID. */
  protected volatile String cached_id;
  
  /**
   * Private ctor used by the builder. Copies the builder's map.
   * @param builder A non-null builder.
   * @throws IllegalArgumentException if a key or value was null.
   */
  private TagSet(final Builder builder) {
    if (builder.tags == null || builder.tags.isEmpty()) {
      tags = Collections.emptyMap();
      return;
    }
    for (final Entry<String, String> pair : builder.tags.entrySet()) {
      if (pair.getKey() == null) {
        throw new IllegalArgumentException("Tag key cannot be null.");
      }
      if (pair.getValue() == null) {
        throw new IllegalArgumentException("Tag value cannot be null for "
            + "key: " + pair.getKey());
      }
    }
    tags = Collections.unmodifiableMap(Maps.newHashMap(builder.tags));
  }
  
  @Override
  public String id() {
    if (cached_id == null) {
      final List<String> pairs = Lists.newArrayListWithCapacity(tags.size());
      for (final Entry<String, String> pair : tags.entrySet()) {
        pairs.add(pair.getKey() + "=" + pair.getValue());
      }
      Collections.sort(pairs);
      cached_id = PAIR_JOINER.join(pairs);
    }
    return cached_id;
  }
  
  /** @return The non-null, unmodifiable map of tags. */
  @JsonProperty("tags")
  public Map<String, String> tags() {
    return tags;
  }
  
  /**
   * @param key The tag key to look up.
   * @return The value of the tag or null if the key isn't present.
   */
  public String get(final String key) {
    return tags.get(key);
  }
  
  /**
   * @param key The tag key to look for.
   * @return True if the key is present in the set.
   */
  public boolean containsKey(final String key) {
    return tags.containsKey(key);
  }
  
  /** @return The number of pairs in the set. */
  public int size() {
    return tags.size();
  }
  
  /** @return True if the set doesn't have any tags. */
  @JsonIgnore
  public boolean isEmpty() {
    return tags.isEmpty();
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || !(o instanceof TagSet)) {
      return false;
    }
    return Objects.equal(tags, ((TagSet) o).tags);
  }
  
  @Override
  public int hashCode() {
    return tags.hashCode();
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{tags=")
        .append(id())
        .append("}")
        .toString();
  }
  
  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private Map<String, String> tags;
    
    /**
     * Replaces the tags with a copy of the given map.
     * @param tags A map of tags, may be null.
     * @return The builder.
     */
    public Builder setTags(final Map<String, String> tags) {
      this.tags = tags == null ? null : Maps.newHashMap(tags);
      return this;
    }
    
    /**
     * Adds or replaces a tag.
     * @param key A non-null key.
     * @param value A non-null value.
     * @return The builder.
     */
    public Builder addTag(final String key, final String value) {
      if (tags == null) {
        tags = Maps.newHashMap();
      }
      tags.put(key, value);
      return this;
    }
    
    public TagSet build() {
      return new TagSet(this);
    }
  }
}
