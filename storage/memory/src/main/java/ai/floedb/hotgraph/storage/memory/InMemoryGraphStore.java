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

package ai.floedb.hotgraph.storage.memory;

import ai.floedb.hotgraph.error.ConflictException;
import ai.floedb.hotgraph.error.NotFoundException;
import ai.floedb.hotgraph.model.Graph;
import ai.floedb.hotgraph.model.GraphEdge;
import ai.floedb.hotgraph.model.GraphNode;
import ai.floedb.hotgraph.model.NodeChange;
import ai.floedb.hotgraph.store.ChangeApplier;
import ai.floedb.hotgraph.store.GraphStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Process-local {@link GraphStore}.
 *
 * <p>Every write, whether a {@link #persist} from the cache or one of the edit helpers used by
 * design tooling and tests, produces a new revision. Writes are serialized on the store monitor
 * and {@link #persist} honours the expected revision like a compare-and-set.
 */
public class InMemoryGraphStore implements GraphStore {

  private static final Logger LOG = Logger.getLogger(InMemoryGraphStore.class);

  private Graph current;

  public InMemoryGraphStore() {
    this(Graph.empty());
  }

  public InMemoryGraphStore(Graph seed) {
    this.current = Objects.requireNonNull(seed, "seed");
  }

  @Override
  public synchronized Graph load() {
    return current;
  }

  @Override
  public synchronized long revision() {
    return current.revision();
  }

  @Override
  public synchronized long persist(Collection<NodeChange> changes, long expectedRevision) {
    if (expectedRevision != ANY_REVISION && expectedRevision != current.revision()) {
      throw new ConflictException(expectedRevision, current.revision());
    }
    current = ChangeApplier.apply(current, changes, current.revision() + 1L);
    LOG.debugf("Persisted %d change(s) at revision %d", changes.size(), current.revision());
    return current.revision();
  }

  /** Adds or replaces a node. */
  public synchronized long putNode(GraphNode node) {
    return write(ChangeApplier.apply(current, List.of(NodeChange.upsert(node)), next()));
  }

  /** Removes a node and its incident edges. */
  public synchronized long removeNode(String id) {
    requireNode(id);
    return write(ChangeApplier.apply(current, List.of(NodeChange.remove(id)), next()));
  }

  /** Appends an edge between two existing nodes. */
  public synchronized long connect(GraphEdge edge) {
    requireNode(edge.source());
    requireNode(edge.target());
    List<GraphEdge> edges = new ArrayList<>(current.edges());
    edges.add(edge);
    return write(new Graph(current.nodes(), edges, next()));
  }

  /** Removes every edge joining {@code source} and {@code target}, in either direction. */
  public synchronized long disconnect(String source, String target) {
    List<GraphEdge> edges = new ArrayList<>(current.edges());
    edges.removeIf(e -> e.touches(source) && e.touches(target));
    return write(new Graph(current.nodes(), edges, next()));
  }

  /**
   * Replaces the whole graph without validation. Used to stage content that the cache must reject
   * at index build time.
   */
  public synchronized long replace(List<GraphNode> nodes, List<GraphEdge> edges) {
    return write(new Graph(nodes, edges, next()));
  }

  private long next() {
    return current.revision() + 1L;
  }

  private long write(Graph graph) {
    current = graph;
    return current.revision();
  }

  private void requireNode(String id) {
    boolean present = current.nodes().stream().anyMatch(n -> n.id().equals(id));
    if (!present) {
      throw NotFoundException.node(id);
    }
  }
}
