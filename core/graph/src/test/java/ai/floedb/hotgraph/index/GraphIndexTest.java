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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.hotgraph.error.ErrorCode;
import ai.floedb.hotgraph.error.MalformedGraphException;
import ai.floedb.hotgraph.error.NotFoundException;
import ai.floedb.hotgraph.model.EdgeKind;
import ai.floedb.hotgraph.model.Graph;
import ai.floedb.hotgraph.model.GraphEdge;
import ai.floedb.hotgraph.model.GraphNode;
import ai.floedb.hotgraph.model.NodeKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class GraphIndexTest {

  private static Graph bench() {
    return new Graph(
        List.of(
            GraphNode.hardware("dac1"),
            GraphNode.hardware("amp1"),
            GraphNode.hardware("teensy"),
            GraphNode.hardware("usb"),
            GraphNode.software("dr_teeth")),
        List.of(
            GraphEdge.of("dac1", "amp1", EdgeKind.ELECTRICAL),
            GraphEdge.of("teensy", "dac1", EdgeKind.DATA),
            GraphEdge.of("usb", "teensy", EdgeKind.DATA),
            GraphEdge.of("teensy", "dr_teeth", EdgeKind.LOGICAL)),
        7L);
  }

  @Test
  void neighborsFollowEdgeInsertionOrderInBothDirections() {
    GraphIndex index = GraphIndex.build(bench());

    assertThat(index.revision()).isEqualTo(7L);
    assertThat(index.neighbors("dac1")).containsExactly("amp1", "teensy");
    assertThat(index.neighbors("teensy")).containsExactly("dac1", "usb", "dr_teeth");
    assertThat(index.neighbors("amp1")).containsExactly("dac1");
  }

  @Test
  void everyNeighborHasABackingEdge() {
    Graph graph = bench();
    GraphIndex index = GraphIndex.build(graph);

    for (GraphNode node : graph.nodes()) {
      for (String neighbor : index.neighbors(node.id())) {
        assertThat(graph.edges())
            .anyMatch(e -> e.touches(node.id()) && e.touches(neighbor));
      }
    }
  }

  @Test
  void directedEdgeOnlyAppearsAtItsSource() {
    Graph graph =
        new Graph(
            List.of(GraphNode.software("a"), GraphNode.software("b")),
            List.of(new GraphEdge("a", "b", EdgeKind.DATA, 1.0, true)),
            1L);
    GraphIndex index = GraphIndex.build(graph);

    assertThat(index.neighbors("a")).containsExactly("b");
    assertThat(index.neighbors("b")).isEmpty();
  }

  @Test
  void parallelEdgesYieldOneNeighborEntry() {
    Graph graph =
        new Graph(
            List.of(GraphNode.hardware("teensy"), GraphNode.hardware("dac1")),
            List.of(
                GraphEdge.of("teensy", "dac1", EdgeKind.ELECTRICAL),
                GraphEdge.of("teensy", "dac1", EdgeKind.DATA)),
            1L);
    GraphIndex index = GraphIndex.build(graph);

    assertThat(index.neighbors("teensy")).containsExactly("dac1");
    assertThat(index.adjacency("teensy")).hasSize(2);
  }

  @Test
  void unknownNodeIsNotFound() {
    GraphIndex index = GraphIndex.build(bench());

    assertThatThrownBy(() -> index.neighbors("nonexistent"))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining("nonexistent")
        .extracting(e -> ((NotFoundException) e).code())
        .isEqualTo(ErrorCode.NOT_FOUND);
  }

  @Test
  void danglingEdgeIsALoadError() {
    Graph graph =
        new Graph(
            List.of(GraphNode.hardware("dac1")),
            List.of(GraphEdge.of("dac1", "ghost", EdgeKind.ELECTRICAL)),
            1L);

    assertThatThrownBy(() -> GraphIndex.build(graph))
        .isInstanceOf(MalformedGraphException.class)
        .hasMessageContaining("ghost");
  }

  @Test
  void duplicateIdsAndNegativeWeightsAreRejected() {
    Graph duplicate =
        new Graph(List.of(GraphNode.hardware("x"), GraphNode.software("x")), List.of(), 1L);
    Graph negative =
        new Graph(
            List.of(GraphNode.hardware("x"), GraphNode.hardware("y")),
            List.of(GraphEdge.weighted("x", "y", EdgeKind.ELECTRICAL, -2.0)),
            1L);

    assertThatThrownBy(() -> GraphIndex.build(duplicate))
        .isInstanceOf(MalformedGraphException.class)
        .hasMessageContaining("duplicate");
    assertThatThrownBy(() -> GraphIndex.build(negative))
        .isInstanceOf(MalformedGraphException.class)
        .hasMessageContaining("weight");
  }

  @Test
  void kindIndexAndRadiusExpansion() {
    GraphIndex index = GraphIndex.build(bench());

    assertThat(index.nodesOfKind(NodeKind.SOFTWARE)).containsExactly("dr_teeth");
    assertThat(index.nodesOfKind(NodeKind.HARDWARE))
        .containsExactly("dac1", "amp1", "teensy", "usb");
    assertThat(index.within(List.of("usb"), 0)).containsExactly("usb");
    assertThat(index.within(List.of("usb"), 2))
        .containsExactly("usb", "teensy", "dac1", "dr_teeth");
    assertThat(index.within(List.of("ghost"), 3)).isEmpty();
    assertThat(index.weighted()).isFalse();
  }
}
