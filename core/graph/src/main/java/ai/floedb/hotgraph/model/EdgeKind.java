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

/** Relationship classification for graph edges. */
public enum EdgeKind {
  ELECTRICAL,
  LOGICAL,
  DATA;

  public static EdgeKind parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("edge kind is required");
    }
    try {
      return EdgeKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("unknown edge kind: " + value, e);
    }
  }
}
