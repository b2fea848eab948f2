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

package ai.floedb.hotgraph.service;

import ai.floedb.hotgraph.index.GraphIndex;
import ai.floedb.hotgraph.model.GraphNode;
import ai.floedb.hotgraph.model.NodeChange;
import ai.floedb.hotgraph.model.NodeKind;
import ai.floedb.hotgraph.service.cache.PathCache;
import ai.floedb.hotgraph.service.metrics.HotGraphMetrics;
import ai.floedb.hotgraph.service.state.AccessStats;
import ai.floedb.hotgraph.service.state.DirtyTracker;
import ai.floedb.hotgraph.service.state.FocusSet;
import ai.floedb.hotgraph.service.sync.GraphSnapshot;
import ai.floedb.hotgraph.service.sync.SyncManager;
import ai.floedb.hotgraph.service.zone.ZoneRule;
import ai.floedb.hotgraph.store.GraphStore;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Hot working set over a component graph.
 *
 * <p>Queries read the currently published snapshot without locking. Mutations only record pending
 * changes; nothing reaches the store until {@link #sync()}. Instances are independent, so tests
 * and tools can run several side by side against different stores.
 */
public final class HotGraph {

  private static final Logger LOG = Logger.getLogger(HotGraph.class);

  public static final int DEFAULT_MAX_HOPS = 5;
  public static final int DEFAULT_TOP_N = 10;

  private final SyncManager syncManager;
  private final PathCache pathCache;
  private final FocusSet focus = new FocusSet();
  private final DirtyTracker dirty;
  private final AccessStats stats = new AccessStats();
  private final HotGraphMetrics metrics;
  private final int defaultMaxHops;
  private final int topN;

  private HotGraph(Builder builder) {
    this.metrics = builder.metrics != null ? builder.metrics : HotGraphMetrics.detached();
    this.pathCache = new PathCache(builder.pathCacheEnabled, metrics);
    this.dirty = new DirtyTracker();
    this.syncManager =
        new SyncManager(builder.store, dirty, pathCache, builder.zoneRules, metrics);
    this.defaultMaxHops = builder.defaultMaxHops;
    this.topN = builder.topN;

    GraphSnapshot initial = syncManager.refresh();
    metrics.trackGauge("hotgraph.dirty.size", "Pending dirty nodes", dirty::size);
    metrics.trackGauge("hotgraph.revision", "Published revision", () -> revision());
    metrics.trackGauge("hotgraph.path.cache.size", "Cached paths", pathCache::size);
    LOG.infof(
        "Hot graph ready at revision %d: %d nodes, %d edges, %d zone(s)",
        initial.revision(),
        initial.index().nodeCount(),
        initial.index().edgeCount(),
        initial.zones().names().size());
  }

  public static Builder builder(GraphStore store) {
    return new Builder(store);
  }

  // ---- focus ----

  /** Replaces the focus set; no ids clears it. Ids are not validated. */
  public int focus(String... ids) {
    return focus(Arrays.asList(ids));
  }

  public int focus(Collection<String> ids) {
    int size = focus.replace(ids);
    LOG.debugf("Focus set to %d id(s)", size);
    return size;
  }

  /** Focuses on every node within {@code radius} hops of the centers. */
  public int focusAround(int radius, Collection<String> centers) {
    Set<String> around = snapshot().index().within(centers, radius);
    return focus(around);
  }

  public Set<String> focusSet() {
    return focus.members();
  }

  // ---- queries ----

  /** Neighbors of {@code id} in edge order, restricted to the focus set when one is active. */
  public List<String> neighbors(String id) {
    List<String> ids = snapshot().index().neighbors(id);
    stats.record(id);
    return focus.filter(ids);
  }

  /** Neighbors of the opposite kind: software for a hardware node and the other way round. */
  public List<String> related(String id) {
    GraphIndex index = snapshot().index();
    NodeKind counterpart = index.node(id).kind().counterpart();
    List<String> ids = new ArrayList<>();
    for (String neighbor : index.neighbors(id)) {
      if (index.node(neighbor).kind() == counterpart) {
        ids.add(neighbor);
      }
    }
    stats.record(id);
    return focus.filter(ids);
  }

  public List<String> path(String start, String end) {
    return path(start, end, defaultMaxHops);
  }

  /**
   * Shortest path with at most {@code maxHops} edges, served from the cache while the snapshot
   * revision is unchanged. Paths through a dirty node are not cached until the next sync.
   */
  public List<String> path(String start, String end, int maxHops) {
    if (maxHops < 0) {
      throw new IllegalArgumentException("maxHops must be >= 0: " + maxHops);
    }
    GraphSnapshot snapshot = snapshot();
    GraphIndex index = snapshot.index();
    index.node(start);
    index.node(end);

    PathCache.Key key = new PathCache.Key(start, end, maxHops);
    List<String> path =
        pathCache
            .get(key, snapshot.revision())
            .orElseGet(
                () -> {
                  List<String> found = index.path(start, end, maxHops);
                  cacheUnlessDirty(key, found, snapshot.revision());
                  return found;
                });
    stats.record(start);
    stats.record(end);
    return path;
  }

  private void cacheUnlessDirty(PathCache.Key key, List<String> path, long revision) {
    syncManager.withPublishLock(
        current -> {
          boolean cacheable =
              current.revision() == revision && path.stream().noneMatch(dirty::isDirty);
          if (cacheable) {
            pathCache.put(key, path, revision);
          }
          return cacheable;
        });
  }

  public List<String> zoneMembers(String name) {
    List<String> members = snapshot().zones().members(name);
    members.forEach(stats::record);
    return members;
  }

  public Set<String> zoneNames() {
    return snapshot().zones().names();
  }

  public List<String> nodesOfKind(NodeKind kind) {
    return snapshot().index().nodesOfKind(kind);
  }

  public GraphNode node(String id) {
    return snapshot().index().node(id);
  }

  // ---- pending changes ----

  /**
   * Marks ids dirty and evicts cached paths through them. Every id is checked before anything is
   * marked.
   */
  public int markDirty(String... ids) {
    return markDirty(Arrays.asList(ids));
  }

  public int markDirty(Collection<String> ids) {
    List<String> marked = List.copyOf(ids);
    int count =
        syncManager.withPublishLock(
            current -> {
              marked.forEach(current.index()::node);
              int size = dirty.mark(marked);
              marked.forEach(pathCache::invalidateContaining);
              return size;
            });
    metrics.recordMarked(marked.size());
    return count;
  }

  /** Stages a replacement for an existing node. */
  public int stageUpdate(GraphNode node) {
    return stage(NodeChange.upsert(node));
  }

  /** Stages removal of an existing node and its edges. */
  public int stageRemoval(String id) {
    return stage(NodeChange.remove(id));
  }

  private int stage(NodeChange change) {
    int count =
        syncManager.withPublishLock(
            current -> {
              current.index().node(change.id());
              int size = dirty.stage(change);
              pathCache.invalidateContaining(change.id());
              return size;
            });
    metrics.recordMarked(1);
    LOG.debugf("Staged %s for %s", change.type(), change.id());
    return count;
  }

  public boolean isDirty(String id) {
    return dirty.isDirty(id);
  }

  public int dirtyCount() {
    return dirty.size();
  }

  public List<NodeChange> pendingChanges() {
    return dirty.snapshot();
  }

  // ---- sync ----

  public long sync() {
    return syncManager.sync();
  }

  /** Syncs, requiring the store to still be at {@code expectedRevision}. */
  public long sync(long expectedRevision) {
    return syncManager.sync(expectedRevision);
  }

  public SyncManager.State syncState() {
    return syncManager.state();
  }

  public RuntimeException lastSyncError() {
    return syncManager.lastError();
  }

  // ---- diagnostics ----

  public long revision() {
    return snapshot().revision();
  }

  public int defaultMaxHops() {
    return defaultMaxHops;
  }

  public HotGraphStats stats() {
    GraphSnapshot snapshot = snapshot();
    return new HotGraphStats(
        snapshot.revision(),
        snapshot.index().nodeCount(),
        snapshot.index().edgeCount(),
        focus.size(),
        pathCache.size(),
        pathCache.hits(),
        pathCache.misses(),
        stats.total(),
        dirty.size(),
        stats.topN(topN),
        syncManager.state());
  }

  public long accessCount(String id) {
    return stats.count(id);
  }

  /** Zeroes the access counters. */
  public void resetStats() {
    stats.reset();
    LOG.debug("Access counters reset");
  }

  private GraphSnapshot snapshot() {
    return syncManager.current();
  }

  public static final class Builder {
    private final GraphStore store;
    private List<ZoneRule> zoneRules = List.of();
    private HotGraphMetrics metrics;
    private int defaultMaxHops = DEFAULT_MAX_HOPS;
    private int topN = DEFAULT_TOP_N;
    private boolean pathCacheEnabled = true;

    private Builder(GraphStore store) {
      this.store = Objects.requireNonNull(store, "store");
    }

    public Builder zones(List<ZoneRule> rules) {
      this.zoneRules = List.copyOf(rules);
      return this;
    }

    public Builder zones(ZoneRule... rules) {
      return zones(List.of(rules));
    }

    public Builder metrics(HotGraphMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder defaultMaxHops(int hops) {
      if (hops < 0) {
        throw new IllegalArgumentException("defaultMaxHops must be >= 0: " + hops);
      }
      this.defaultMaxHops = hops;
      return this;
    }

    public Builder statsTopN(int n) {
      this.topN = n;
      return this;
    }

    public Builder pathCacheEnabled(boolean enabled) {
      this.pathCacheEnabled = enabled;
      return this;
    }

    /** Loads the store and publishes the first snapshot. */
    public HotGraph build() {
      return new HotGraph(this);
    }
  }
}
