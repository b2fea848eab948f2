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

import ai.floedb.hotgraph.error.NotFoundException;
import ai.floedb.hotgraph.error.NotReachableException;
import ai.floedb.hotgraph.model.EdgeKind;
import ai.floedb.hotgraph.model.Graph;
import ai.floedb.hotgraph.model.GraphEdge;
import ai.floedb.hotgraph.model.GraphNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class PathSearchTest {

  private static GraphIndex scenario() {
    return GraphIndex.build(
        new Graph(
            List.of(
                GraphNode.hardware("dac1"),
                GraphNode.hardware("amp1"),
                GraphNode.hardware("teensy"),
                GraphNode.hardware("usb")),
            List.of(
                GraphEdge.of("dac1", "amp1", EdgeKind.ELECTRICAL),
                GraphEdge.of("teensy", "dac1", EdgeKind.DATA),
                GraphEdge.of("usb", "teensy", EdgeKind.DATA)),
            1L));
  }

  @Test
  void findsThreeHopPathFromUsbToAmp() {
    assertThat(scenario().path("usb", "amp1", 5)).containsExactly("usb", "teensy", "dac1", "amp1");
  }

  @Test
  void hopBoundTooSmallIsNotReachable() {
    assertThatThrownBy(() -> scenario().path("usb", "amp1", 1))
        .isInstanceOf(NotReachableException.class)
        .satisfies(
            e -> {
              NotReachableException nre = (NotReachableException) e;
              assertThat(nre.start()).isEqualTo("usb");
              assertThat(nre.end()).isEqualTo("amp1");
              assertThat(nre.maxHops()).isEqualTo(1);
            });
  }

  @Test
  void exactHopBoundIsEnough() {
    assertThat(scenario().path("usb", "amp1", 3)).hasSize(4);
    assertThatThrownBy(() -> scenario().path("usb", "amp1", 2))
        .isInstanceOf(NotReachableException.class);
  }

  @Test
  void pathToSelfIsSingleNode() {
    assertThat(scenario().path("dac1", "dac1", 0)).containsExactly("dac1");
  }

  @Test
  void unknownEndpointsAndNegativeBound() {
    assertThatThrownBy(() -> scenario().path("usb", "ghost", 3))
        .isInstanceOf(NotFoundException.class);
    assertThatThrownBy(() -> scenario().path("usb", "amp1", -1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void tiesPreferAdjacencyOrder() {
    // a -> {b, c} -> d: both two hops, b comes first in a's adjacency
    GraphIndex index =
        GraphIndex.build(
            new Graph(
                List.of(
                    GraphNode.software("a"),
                    GraphNode.software("b"),
                    GraphNode.software("c"),
                    GraphNode.software("d")),
                List.of(
                    GraphEdge.of("a", "b", EdgeKind.LOGICAL),
                    GraphEdge.of("a", "c", EdgeKind.LOGICAL),
                    GraphEdge.of("c", "d", EdgeKind.LOGICAL),
                    GraphEdge.of("b", "d", EdgeKind.LOGICAL)),
                1L));

    assertThat(index.path("a", "d", 4)).containsExactly("a", "b", "d");
  }

  @Test
  void weightedSearchPrefersCheaperLongerRoute() {
    GraphIndex index =
        GraphIndex.build(
            new Graph(
                List.of(
                    GraphNode.hardware("psu"),
                    GraphNode.hardware("reg"),
                    GraphNode.hardware("filter"),
                    GraphNode.hardware("dac1")),
                List.of(
                    GraphEdge.weighted("psu", "dac1", EdgeKind.ELECTRICAL, 10.0),
                    GraphEdge.weighted("psu", "reg", EdgeKind.ELECTRICAL, 1.0),
                    GraphEdge.weighted("reg", "filter", EdgeKind.ELECTRICAL, 1.0),
                    GraphEdge.weighted("filter", "dac1", EdgeKind.ELECTRICAL, 1.0)),
                1L));

    assertThat(index.weighted()).isTrue();
    assertThat(index.path("psu", "dac1", 5)).containsExactly("psu", "reg", "filter", "dac1");
    // with two hops only the expensive direct edge fits
    assertThat(index.path("psu", "dac1", 2)).containsExactly("psu", "dac1");
  }

  @Test
  void weightedSearchHonorsHopBoundOverCost() {
    GraphIndex index =
        GraphIndex.build(
            new Graph(
                List.of(
                    GraphNode.hardware("a"),
                    GraphNode.hardware("b"),
                    GraphNode.hardware("c"),
                    GraphNode.hardware("d")),
                List.of(
                    GraphEdge.weighted("a", "b", EdgeKind.ELECTRICAL, 0.5),
                    GraphEdge.weighted("b", "c", EdgeKind.ELECTRICAL, 0.5),
                    GraphEdge.weighted("c", "d", EdgeKind.ELECTRICAL, 0.5)),
                1L));

    assertThat(index.path("a", "d", 3)).containsExactly("a", "b", "c", "d");
    assertThatThrownBy(() -> index.path("a", "d", 2)).isInstanceOf(NotReachableException.class);
  }

  @Test
  void everyReturnedPathIsAdjacentStepByStep() {
    GraphIndex index = scenario();
    for (String start : index.nodeIds()) {
      for (String end : index.nodeIds()) {
        List<String> path = index.path(start, end, 5);
        assertThat(path.get(0)).isEqualTo(start);
        assertThat(path.get(path.size() - 1)).isEqualTo(end);
        assertThat(path.size()).isLessThanOrEqualTo(6);
        for (int i = 0; i + 1 < path.size(); i++) {
          assertThat(index.neighbors(path.get(i))).contains(path.get(i + 1));
        }
      }
    }
  }
}
