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

package ai.floedb.hotgraph.storage.file;

import ai.floedb.hotgraph.model.EdgeKind;
import ai.floedb.hotgraph.model.Graph;
import ai.floedb.hotgraph.model.GraphEdge;
import ai.floedb.hotgraph.model.GraphNode;
import ai.floedb.hotgraph.model.NodeKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * On-disk JSON shape of a graph.
 *
 * <pre>{@code
 * {
 *   "revision": 3,
 *   "nodes": [{"id": "dac1", "kind": "hardware", "attributes": {"part": "AD5593R"}}],
 *   "edges": [{"source": "teensy", "target": "dac1", "kind": "data", "weight": 1.0}]
 * }
 * }</pre>
 *
 * <p>{@code weight} defaults to 1.0 and {@code directed} to false when absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphDocument(long revision, List<NodeEntry> nodes, List<EdgeEntry> edges) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public record NodeEntry(String id, String kind, Map<String, String> attributes) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record EdgeEntry(
      String source, String target, String kind, Double weight, Boolean directed) {}

  public GraphDocument {
    nodes = nodes == null ? List.of() : List.copyOf(nodes);
    edges = edges == null ? List.of() : List.copyOf(edges);
  }

  public Graph toGraph() {
    List<GraphNode> graphNodes =
        nodes.stream()
            .map(
                n ->
                    new GraphNode(
                        required(n.id(), "node id"), NodeKind.parse(n.kind()), n.attributes()))
            .toList();
    List<GraphEdge> graphEdges =
        edges.stream()
            .map(
                e ->
                    new GraphEdge(
                        required(e.source(), "edge source"),
                        required(e.target(), "edge target"),
                        EdgeKind.parse(e.kind()),
                        e.weight() == null ? GraphEdge.DEFAULT_WEIGHT : e.weight(),
                        Boolean.TRUE.equals(e.directed())))
            .toList();
    return new Graph(graphNodes, graphEdges, revision);
  }

  public static GraphDocument of(Graph graph) {
    List<NodeEntry> nodeEntries =
        graph.nodes().stream()
            .map(n -> new NodeEntry(n.id(), lower(n.kind().name()), n.attributes()))
            .toList();
    List<EdgeEntry> edgeEntries =
        graph.edges().stream()
            .map(
                e ->
                    new EdgeEntry(
                        e.source(),
                        e.target(),
                        lower(e.kind().name()),
                        e.hasDefaultWeight() ? null : e.weight(),
                        e.directed() ? Boolean.TRUE : null))
            .toList();
    return new GraphDocument(graph.revision(), nodeEntries, edgeEntries);
  }

  private static String required(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing " + field);
    }
    return value;
  }

  private static String lower(String value) {
    return value.toLowerCase(Locale.ROOT);
  }
}
