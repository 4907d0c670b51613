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
package net.tinytsdb.utils;

/**
 * Wraps the typed exceptions thrown by Jackson that aren't caused by bad
 * input.
 * @since 1.0
 */
public final class JSONException extends RuntimeException {
  private static final long serialVersionUID = 2791635087436110432L;

  /**
   * Wraps a Jackson failure.
   * @param cause The non-null Jackson exception.
   */
  public JSONException(final Throwable cause) {
    super(cause);
  }
}
