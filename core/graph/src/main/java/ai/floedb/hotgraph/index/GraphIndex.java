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

package ai.floedb.hotgraph.index;

import ai.floedb.hotgraph.error.MalformedGraphException;
import ai.floedb.hotgraph.error.NotFoundException;
import ai.floedb.hotgraph.model.EdgeKind;
import ai.floedb.hotgraph.model.Graph;
import ai.floedb.hotgraph.model.GraphEdge;
import ai.floedb.hotgraph.model.GraphNode;
import ai.floedb.hotgraph.model.NodeKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Immutable adjacency view of one graph revision.
 *
 * <p>Built once per revision and then shared by every reader. Neighbor lists follow edge insertion
 * order so query results are deterministic; when several edges join the same pair the first one
 * fixes the position. Lookups are hash based.
 */
public final class GraphIndex {

  private static final Logger LOG = Logger.getLogger(GraphIndex.class);

  /** One traversable direction of an edge. */
  public record Adjacency(String target, EdgeKind kind, double weight) {}

  private final long revision;
  private final Map<String, GraphNode> nodesById;
  private final Map<String, List<Adjacency>> adjacency;
  private final Map<String, List<String>> neighborIds;
  private final Map<NodeKind, List<String>> idsByKind;
  private final boolean weighted;
  private final int edgeCount;

  private GraphIndex(
      long revision,
      Map<String, GraphNode> nodesById,
      Map<String, List<Adjacency>> adjacency,
      Map<String, List<String>> neighborIds,
      Map<NodeKind, List<String>> idsByKind,
      boolean weighted,
      int edgeCount) {
    this.revision = revision;
    this.nodesById = nodesById;
    this.adjacency = adjacency;
    this.neighborIds = neighborIds;
    this.idsByKind = idsByKind;
    this.weighted = weighted;
    this.edgeCount = edgeCount;
  }

  /**
   * Validates the graph and builds its adjacency lists.
   *
   * @throws MalformedGraphException on a blank or duplicate node id, an edge endpoint that is not
   *     a node, or a negative / non-finite weight
   */
  public static GraphIndex build(Graph graph) {
    Map<String, GraphNode> nodes = new LinkedHashMap<>();
    Map<NodeKind, List<String>> byKind = new EnumMap<>(NodeKind.class);
    for (NodeKind kind : NodeKind.values()) {
      byKind.put(kind, new ArrayList<>());
    }
    for (GraphNode node : graph.nodes()) {
      if (node.id().isBlank()) {
        throw new MalformedGraphException("node id must not be blank");
      }
      if (nodes.putIfAbsent(node.id(), node) != null) {
        throw new MalformedGraphException(
            "duplicate node id: " + node.id(), Map.of("node", node.id()));
      }
      byKind.get(node.kind()).add(node.id());
    }

    Map<String, List<Adjacency>> adj = new LinkedHashMap<>();
    Map<String, Set<String>> neighbors = new LinkedHashMap<>();
    for (String id : nodes.keySet()) {
      adj.put(id, new ArrayList<>());
      neighbors.put(id, new LinkedHashSet<>());
    }

    boolean weighted = false;
    for (GraphEdge edge : graph.edges()) {
      requireEndpoint(nodes, edge, edge.source());
      requireEndpoint(nodes, edge, edge.target());
      double w = edge.weight();
      if (Double.isNaN(w) || Double.isInfinite(w) || w < 0) {
        throw new MalformedGraphException(
            "edge " + edge.source() + "->" + edge.target() + " has invalid weight " + w,
            Map.of("source", edge.source(), "target", edge.target()));
      }
      weighted |= !edge.hasDefaultWeight();

      adj.get(edge.source()).add(new Adjacency(edge.target(), edge.kind(), w));
      neighbors.get(edge.source()).add(edge.target());
      if (!edge.directed() && !edge.source().equals(edge.target())) {
        adj.get(edge.target()).add(new Adjacency(edge.source(), edge.kind(), w));
        neighbors.get(edge.target()).add(edge.source());
      }
    }

    Map<String, List<Adjacency>> frozenAdj = new LinkedHashMap<>();
    adj.forEach((id, list) -> frozenAdj.put(id, List.copyOf(list)));
    Map<String, List<String>> frozenNeighbors = new LinkedHashMap<>();
    neighbors.forEach((id, set) -> frozenNeighbors.put(id, List.copyOf(set)));
    Map<NodeKind, List<String>> frozenKinds = new EnumMap<>(NodeKind.class);
    byKind.forEach((kind, ids) -> frozenKinds.put(kind, List.copyOf(ids)));

    LOG.debugf(
        "Indexed revision %d: %d nodes, %d edges (weighted=%s)",
        graph.revision(), nodes.size(), graph.edges().size(), weighted);

    return new GraphIndex(
        graph.revision(),
        Collections.unmodifiableMap(nodes),
        Collections.unmodifiableMap(frozenAdj),
        Collections.unmodifiableMap(frozenNeighbors),
        Collections.unmodifiableMap(frozenKinds),
        weighted,
        graph.edges().size());
  }

  /** Index over the empty graph at revision 0. */
  public static GraphIndex empty() {
    return build(Graph.empty());
  }

  private static void requireEndpoint(Map<String, GraphNode> nodes, GraphEdge edge, String id) {
    if (!nodes.containsKey(id)) {
      throw new MalformedGraphException(
          "edge " + edge.source() + "->" + edge.target() + " references unknown node " + id,
          Map.of("source", edge.source(), "target", edge.target(), "missing", id));
    }
  }

  public long revision() {
    return revision;
  }

  public boolean contains(String id) {
    return id != null && nodesById.containsKey(id);
  }

  public Optional<GraphNode> find(String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(nodesById.get(id));
  }

  public GraphNode node(String id) {
    return find(id).orElseThrow(() -> NotFoundException.node(id));
  }

  /** Neighbor ids in edge insertion order. */
  public List<String> neighbors(String id) {
    List<String> ids = neighborIds.get(id);
    if (ids == null) {
      throw NotFoundException.node(id);
    }
    return ids;
  }

  /** Every traversable edge leaving {@code id}, in edge insertion order. */
  public List<Adjacency> adjacency(String id) {
    List<Adjacency> list = adjacency.get(id);
    if (list == null) {
      throw NotFoundException.node(id);
    }
    return list;
  }

  public List<String> nodesOfKind(NodeKind kind) {
    return idsByKind.getOrDefault(kind, List.of());
  }

  /** Nodes in graph order. */
  public Collection<GraphNode> nodes() {
    return nodesById.values();
  }

  public Set<String> nodeIds() {
    return nodesById.keySet();
  }

  /** True when any edge carries a non-default weight. */
  public boolean weighted() {
    return weighted;
  }

  public int nodeCount() {
    return nodesById.size();
  }

  public int edgeCount() {
    return edgeCount;
  }

  /**
   * Shortest path from {@code start} to {@code end} using at most {@code maxHops} edges.
   *
   * @see PathSearch
   */
  public List<String> path(String start, String end, int maxHops) {
    return PathSearch.find(this, start, end, maxHops);
  }

  /**
   * Every node within {@code radius} hops of one of the centers, in discovery order. Unknown
   * centers are ignored.
   */
  public Set<String> within(Collection<String> centers, int radius) {
    if (radius < 0) {
      throw new IllegalArgumentException("radius must be >= 0: " + radius);
    }
    Set<String> seen = new LinkedHashSet<>();
    ArrayDeque<String> frontier = new ArrayDeque<>();
    for (String center : centers) {
      if (contains(center) && seen.add(center)) {
        frontier.add(center);
      }
    }
    for (int depth = 0; depth < radius && !frontier.isEmpty(); depth++) {
      ArrayDeque<String> next = new ArrayDeque<>();
      for (String id : frontier) {
        for (String neighbor : neighborIds.get(id)) {
          if (seen.add(neighbor)) {
            next.add(neighbor);
          }
        }
      }
      frontier = next;
    }
    return seen;
  }
}
