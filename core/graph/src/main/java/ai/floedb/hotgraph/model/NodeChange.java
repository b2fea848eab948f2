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

import java.util.Objects;
import java.util.Optional;

/**
 * A pending modification handed to the store on sync.
 *
 * <ul>
 *   <li>{@link Type#TOUCH}: the node was marked dirty without new content; the store re-reads it
 *   <li>{@link Type#UPSERT}: the node is replaced by {@link #node()}
 *   <li>{@link Type#REMOVE}: the node and its incident edges are dropped
 * </ul>
 */
public record NodeChange(String id, Type type, GraphNode node) {

  public enum Type {
    TOUCH,
    UPSERT,
    REMOVE
  }

  public NodeChange {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    if (type == Type.UPSERT) {
      Objects.requireNonNull(node, "node");
      if (!node.id().equals(id)) {
        throw new IllegalArgumentException("upsert id mismatch: " + id + " vs " + node.id());
      }
    } else if (node != null) {
      throw new IllegalArgumentException(type + " change must not carry a node");
    }
  }

  public static NodeChange touch(String id) {
    return new NodeChange(id, Type.TOUCH, null);
  }

  public static NodeChange upsert(GraphNode node) {
    return new NodeChange(node.id(), Type.UPSERT, node);
  }

  public static NodeChange remove(String id) {
    return new NodeChange(id, Type.REMOVE, null);
  }

  public Optional<GraphNode> replacement() {
    return Optional.ofNullable(node);
  }
}
