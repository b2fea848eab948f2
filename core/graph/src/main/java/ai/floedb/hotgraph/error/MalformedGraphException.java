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

package ai.floedb.hotgraph.error;

import java.util.Map;

/** Structural violation found while building an index (dangling edge, duplicate id, bad weight). */
public final class MalformedGraphException extends HotGraphException {

  public MalformedGraphException(String message) {
    super(ErrorCode.MALFORMED_GRAPH, message, null, Map.of());
  }

  public MalformedGraphException(String message, Map<String, String> details) {
    super(ErrorCode.MALFORMED_GRAPH, message, null, details);
  }
}
