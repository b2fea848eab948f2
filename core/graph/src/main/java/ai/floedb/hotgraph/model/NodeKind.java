/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.hotgraph.model;

import java.util.Locale;

/** Component classification for graph nodes. */
public enum NodeKind {
  HARDWARE,
  SOFTWARE;

  /** The other kind; related-component lookups cross this boundary. */
  public NodeKind counterpart() {
    return this == HARDWARE ? SOFTWARE : HARDWARE;
  }

  /** Case-insensitive parse used by the shell and the JSON codecs. */
  public static NodeKind parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("node kind is required");
    }
    try {
      return NodeKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("unknown node kind: " + value, e);
    }
  }
}
