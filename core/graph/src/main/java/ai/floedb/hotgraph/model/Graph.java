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

import java.util.List;

/**
 * Full node and edge set at a store revision.
 *
 * <p>List order is significant: adjacency lists follow edge order, and zone members follow node
 * order.
 */
public record Graph(List<GraphNode> nodes, List<GraphEdge> edges, long revision) {

  public Graph {
    nodes = List.copyOf(nodes);
    edges = List.copyOf(edges);
    if (revision < 0) {
      throw new IllegalArgumentException("revision must be >= 0: " + revision);
    }
  }

  public static Graph empty() {
    return new Graph(List.of(), List.of(), 0L);
  }
}
