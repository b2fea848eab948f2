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

package ai.floedb.hotgraph.store;

import ai.floedb.hotgraph.model.Graph;
import ai.floedb.hotgraph.model.GraphEdge;
import ai.floedb.hotgraph.model.GraphNode;
import ai.floedb.hotgraph.model.NodeChange;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies node changes to a graph the same way for every store implementation.
 *
 * <p>Upserts keep the node's position when it already exists and append otherwise. Removals drop
 * the node together with every edge touching it. Touches leave content untouched; they only cause
 * a new revision.
 */
public final class ChangeApplier {

  private ChangeApplier() {}

  public static Graph apply(Graph base, Collection<NodeChange> changes, long newRevision) {
    Map<String, GraphNode> nodes = new LinkedHashMap<>();
    for (GraphNode node : base.nodes()) {
      nodes.put(node.id(), node);
    }
    Set<String> removed = new HashSet<>();
    for (NodeChange change : changes) {
      switch (change.type()) {
        case TOUCH -> {}
        case UPSERT -> {
          nodes.put(change.id(), change.node());
          removed.remove(change.id());
        }
        case REMOVE -> {
          if (nodes.remove(change.id()) != null) {
            removed.add(change.id());
          }
        }
      }
    }
    List<GraphEdge> edges = new ArrayList<>(base.edges().size());
    for (GraphEdge edge : base.edges()) {
      if (!removed.contains(edge.source()) && !removed.contains(edge.target())) {
        edges.add(edge);
      }
    }
    return new Graph(List.copyOf(nodes.values()), edges, newRevision);
  }
}
