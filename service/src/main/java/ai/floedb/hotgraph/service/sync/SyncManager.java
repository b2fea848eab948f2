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

package ai.floedb.hotgraph.service.sync;

import ai.floedb.hotgraph.model.NodeChange;
import ai.floedb.hotgraph.service.cache.PathCache;
import ai.floedb.hotgraph.service.metrics.HotGraphMetrics;
import ai.floedb.hotgraph.service.state.DirtyTracker;
import ai.floedb.hotgraph.service.zone.ZoneRule;
import ai.floedb.hotgraph.store.GraphStore;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.jboss.logging.Logger;

/**
 * Flushes pending changes to the store and republishes the rebuilt snapshot.
 *
 * <p>One sync runs at a time. Readers call {@link #current()} and never wait on the lock: the new
 * snapshot replaces the old one with a single reference swap, and only after the store accepted
 * the changes and the reloaded graph indexed cleanly. On failure the previous snapshot and the
 * whole dirty set stay as they were and the error propagates to the caller.
 *
 * <p>A second, short-held publish lock covers only the swap, the cache clear and the dirty-set
 * cleanup. Mutations that validate ids against the snapshot run under it through {@link
 * #withPublishLock}, so the snapshot cannot change between their check and their write. Marks are
 * therefore not held up by a slow flush.
 */
public class SyncManager {

  private static final Logger LOG = Logger.getLogger(SyncManager.class);

  public enum State {
    IDLE,
    FLUSHING,
    REBUILDING,
    FAILED
  }

  private final GraphStore store;
  private final DirtyTracker dirty;
  private final PathCache pathCache;
  private final List<ZoneRule> zoneRules;
  private final HotGraphMetrics metrics;
  private final ReentrantLock lock = new ReentrantLock();
  private final ReentrantLock publishLock = new ReentrantLock();
  private final AtomicReference<GraphSnapshot> current = new AtomicReference<>();
  private volatile State state = State.IDLE;
  private volatile RuntimeException lastError;

  public SyncManager(
      GraphStore store,
      DirtyTracker dirty,
      PathCache pathCache,
      List<ZoneRule> zoneRules,
      HotGraphMetrics metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.dirty = Objects.requireNonNull(dirty, "dirty");
    this.pathCache = Objects.requireNonNull(pathCache, "pathCache");
    this.zoneRules = List.copyOf(zoneRules);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /** Loads the store's current graph and publishes it without flushing anything. */
  public GraphSnapshot refresh() {
    lock.lock();
    try {
      GraphSnapshot next = GraphSnapshot.build(store.load(), zoneRules);
      publishLock.lock();
      try {
        publish(next);
      } finally {
        publishLock.unlock();
      }
      return next;
    } finally {
      lock.unlock();
    }
  }

  public GraphSnapshot current() {
    GraphSnapshot snapshot = current.get();
    if (snapshot == null) {
      throw new IllegalStateException("no snapshot published yet; call refresh() first");
    }
    return snapshot;
  }

  /**
   * Runs {@code action} against the current snapshot while no new snapshot can be published and
   * no flushed change can be cleared.
   */
  public <T> T withPublishLock(Function<GraphSnapshot, T> action) {
    publishLock.lock();
    try {
      return action.apply(current());
    } finally {
      publishLock.unlock();
    }
  }

  boolean publishContended() {
    return publishLock.hasQueuedThreads();
  }

  public long sync() {
    return sync(GraphStore.ANY_REVISION);
  }

  /**
   * Persists pending changes, rebuilds, and publishes.
   *
   * @param expectedRevision revision the pending changes were made against, or {@link
   *     GraphStore#ANY_REVISION}; the store rejects a mismatch with a conflict
   * @return the revision now published
   */
  public long sync(long expectedRevision) {
    lock.lock();
    try {
      List<NodeChange> changes = dirty.snapshot();
      if (changes.isEmpty()) {
        LOG.debugf("Nothing to sync at revision %d", current().revision());
        return current().revision();
      }
      long startNanos = System.nanoTime();
      long previous = current().revision();
      try {
        state = State.FLUSHING;
        long persisted = store.persist(changes, expectedRevision);
        LOG.debugf("Store accepted %d change(s) as revision %d", changes.size(), persisted);

        state = State.REBUILDING;
        GraphSnapshot next = GraphSnapshot.build(store.load(), zoneRules);

        int remaining;
        publishLock.lock();
        try {
          publish(next);
          remaining = dirty.removeFlushed(changes);
        } finally {
          publishLock.unlock();
        }
        state = State.IDLE;
        lastError = null;
        metrics.recordSync(Duration.ofNanos(System.nanoTime() - startNanos));
        LOG.infof(
            "Synced %d change(s): revision %d -> %d (%d still pending)",
            changes.size(), previous, next.revision(), remaining);
        return next.revision();
      } catch (RuntimeException e) {
        LOG.warnf(e, "Sync failed while %s; keeping revision %d", state, previous);
        state = State.FAILED;
        lastError = e;
        metrics.recordSyncFailure(Duration.ofNanos(System.nanoTime() - startNanos), e);
        throw e;
      }
    } finally {
      lock.unlock();
    }
  }

  public State state() {
    return state;
  }

  public RuntimeException lastError() {
    return lastError;
  }

  private void publish(GraphSnapshot next) {
    pathCache.invalidateAll();
    current.set(next);
    LOG.debugf(
        "Published revision %d (%d nodes, %d zones)",
        next.revision(), next.index().nodeCount(), next.zones().names().size());
  }
}
