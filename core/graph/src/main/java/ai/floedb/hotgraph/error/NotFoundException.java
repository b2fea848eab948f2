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

/** A node id or zone name is absent from the current snapshot. */
public final class NotFoundException extends HotGraphException {

  public NotFoundException(String what, String name) {
    super(ErrorCode.NOT_FOUND, what + " not found: " + name, null, Map.of(what, name));
  }

  public static NotFoundException node(String id) {
    return new NotFoundException("node", id);
  }

  public static NotFoundException zone(String name) {
    return new NotFoundException("zone", name);
  }
}
