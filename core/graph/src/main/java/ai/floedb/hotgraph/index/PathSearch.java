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

import ai.floedb.hotgraph.error.NotFoundException;
import ai.floedb.hotgraph.error.NotReachableException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Hop-bounded shortest path search over a {@link GraphIndex}.
 *
 * <p>Unweighted graphs use breadth-first search. As soon as one edge carries a non-default weight
 * the search switches to Dijkstra over (node, hops) states so that the hop bound still applies.
 * Both explore neighbors in adjacency order, which makes ties deterministic: BFS keeps the first
 * discovered parent, Dijkstra breaks equal cost by hop count and then by enqueue order.
 */
final class PathSearch {

  private PathSearch() {}

  static List<String> find(GraphIndex index, String start, String end, int maxHops) {
    if (maxHops < 0) {
      throw new IllegalArgumentException("maxHops must be >= 0: " + maxHops);
    }
    if (!index.contains(start)) {
      throw NotFoundException.node(start);
    }
    if (!index.contains(end)) {
      throw NotFoundException.node(end);
    }
    if (start.equals(end)) {
      return List.of(start);
    }
    return index.weighted()
        ? dijkstra(index, start, end, maxHops)
        : breadthFirst(index, start, end, maxHops);
  }

  private static List<String> breadthFirst(
      GraphIndex index, String start, String end, int maxHops) {
    Map<String, String> parent = new HashMap<>();
    Map<String, Integer> depth = new HashMap<>();
    ArrayDeque<String> queue = new ArrayDeque<>();
    parent.put(start, null);
    depth.put(start, 0);
    queue.add(start);

    while (!queue.isEmpty()) {
      String current = queue.poll();
      int d = depth.get(current);
      if (d >= maxHops) {
        continue;
      }
      for (String next : index.neighbors(current)) {
        if (parent.containsKey(next)) {
          continue;
        }
        parent.put(next, current);
        depth.put(next, d + 1);
        if (next.equals(end)) {
          return unwind(parent, end);
        }
        queue.add(next);
      }
    }
    throw new NotReachableException(start, end, maxHops);
  }

  private static List<String> unwind(Map<String, String> parent, String end) {
    List<String> path = new ArrayList<>();
    for (String at = end; at != null; at = parent.get(at)) {
      path.add(at);
    }
    Collections.reverse(path);
    return List.copyOf(path);
  }

  private record State(String node, int hops, double cost, long seq, State previous) {}

  private static final Comparator<State> ORDER =
      Comparator.comparingDouble(State::cost)
          .thenComparingInt(State::hops)
          .thenComparingLong(State::seq);

  private static List<String> dijkstra(GraphIndex index, String start, String end, int maxHops) {
    PriorityQueue<State> queue = new PriorityQueue<>(ORDER);
    // fewest hops among settled states per node; a later state with more hops and no lower cost
    // can never lead to a better path
    Map<String, Integer> settledHops = new HashMap<>();
    long seq = 0;
    queue.add(new State(start, 0, 0.0d, seq++, null));

    while (!queue.isEmpty()) {
      State state = queue.poll();
      Integer settled = settledHops.get(state.node());
      if (settled != null && settled <= state.hops()) {
        continue;
      }
      settledHops.put(state.node(), state.hops());
      if (state.node().equals(end)) {
        return unwind(state);
      }
      if (state.hops() >= maxHops) {
        continue;
      }
      for (GraphIndex.Adjacency edge : index.adjacency(state.node())) {
        Integer targetSettled = settledHops.get(edge.target());
        if (targetSettled != null && targetSettled <= state.hops() + 1) {
          continue;
        }
        queue.add(
            new State(
                edge.target(), state.hops() + 1, state.cost() + edge.weight(), seq++, state));
      }
    }
    throw new NotReachableException(start, end, maxHops);
  }

  private static List<String> unwind(State last) {
    List<String> path = new ArrayList<>(last.hops() + 1);
    for (State at = last; at != null; at = at.previous()) {
      path.add(at.node());
    }
    Collections.reverse(path);
    return List.copyOf(path);
  }
}
