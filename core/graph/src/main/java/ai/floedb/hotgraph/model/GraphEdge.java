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

/**
 * Typed relationship between two nodes.
 *
 * <p>Edges are undirected unless {@code directed} is set: an undirected edge appears in the
 * adjacency of both endpoints. Weight defaults to {@link #DEFAULT_WEIGHT}; any other value switches
 * path search to the weighted algorithm.
 */
public record GraphEdge(
    String source, String target, EdgeKind kind, double weight, boolean directed) {

  public static final double DEFAULT_WEIGHT = 1.0d;

  public GraphEdge {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(kind, "kind");
  }

  public static GraphEdge of(String source, String target, EdgeKind kind) {
    return new GraphEdge(source, target, kind, DEFAULT_WEIGHT, false);
  }

  public static GraphEdge weighted(String source, String target, EdgeKind kind, double weight) {
    return new GraphEdge(source, target, kind, weight, false);
  }

  public boolean hasDefaultWeight() {
    return Double.compare(weight, DEFAULT_WEIGHT) == 0;
  }

  public boolean touches(String nodeId) {
    return source.equals(nodeId) || target.equals(nodeId);
  }
}
