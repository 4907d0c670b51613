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

/**
 * Something with a canonical, deterministic string identity that can be
 * used as a storage key.
 * 
 * @since 1.0
 */
public interface Identifiable {

  /** @return The non-null identity string. May be empty. */
  public String id();
}
