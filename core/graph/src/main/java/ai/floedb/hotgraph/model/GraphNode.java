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

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable hardware or software component.
 *
 * <p>Nodes are never mutated in place. A sync replaces the whole node set with the store's new
 * snapshot, so holders of an older node keep a consistent view.
 */
public record GraphNode(String id, NodeKind kind, Map<String, String> attributes) {

  public GraphNode {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(kind, "kind");
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public static GraphNode hardware(String id) {
    return new GraphNode(id, NodeKind.HARDWARE, Map.of());
  }

  public static GraphNode software(String id) {
    return new GraphNode(id, NodeKind.SOFTWARE, Map.of());
  }

  public Optional<String> attribute(String key) {
    return Optional.ofNullable(attributes.get(key));
  }

  public GraphNode withAttributes(Map<String, String> next) {
    return new GraphNode(id, kind, next);
  }
}
