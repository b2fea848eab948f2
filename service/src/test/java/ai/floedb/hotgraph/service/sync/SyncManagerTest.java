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

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ai.floedb.hotgraph.error.ConflictException;
import ai.floedb.hotgraph.error.MalformedGraphException;
import ai.floedb.hotgraph.error.NotFoundException;
import ai.floedb.hotgraph.error.PersistenceException;
import ai.floedb.hotgraph.model.EdgeKind;
import ai.floedb.hotgraph.model.GraphEdge;
import ai.floedb.hotgraph.model.GraphNode;
import ai.floedb.hotgraph.model.NodeChange;
import ai.floedb.hotgraph.model.NodeKind;
import ai.floedb.hotgraph.service.BenchGraphs;
import ai.floedb.hotgraph.service.HotGraph;
import ai.floedb.hotgraph.service.cache.PathCache;
import ai.floedb.hotgraph.service.metrics.HotGraphMetrics;
import ai.floedb.hotgraph.service.state.DirtyTracker;
import ai.floedb.hotgraph.storage.memory.InMemoryGraphStore;
import ai.floedb.hotgraph.store.GraphStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SyncManagerTest {

  @Mock GraphStore store;

  private SyncManager manager(GraphStore graphStore, DirtyTracker dirty, PathCache cache) {
    return new SyncManager(graphStore, dirty, cache, List.of(), HotGraphMetrics.detached());
  }

  @Test
  void persistFailureKeepsDirtySetAndSnapshot() {
    when(store.load()).thenReturn(BenchGraphs.bench(3L));
    when(store.persist(anyCollection(), anyLong()))
        .thenThrow(new PersistenceException("disk full"));
    DirtyTracker dirty = new DirtyTracker();
    PathCache cache = new PathCache(true, HotGraphMetrics.detached());
    SyncManager sync = manager(store, dirty, cache);
    sync.refresh();
    cache.put(new PathCache.Key("usb", "teensy", 5), List.of("usb", "teensy"), 3L);
    dirty.mark(List.of("dac1", "amp1"));

    assertThatThrownBy(sync::sync)
        .isInstanceOf(PersistenceException.class)
        .hasMessage("disk full");

    assertThat(sync.state()).isEqualTo(SyncManager.State.FAILED);
    assertThat(sync.lastError()).isInstanceOf(PersistenceException.class);
    assertThat(sync.current().revision()).isEqualTo(3L);
    assertThat(dirty.snapshot()).extracting(NodeChange::id).containsExactly("dac1", "amp1");
    assertThat(cache.size()).isEqualTo(1);
    verify(store, times(1)).load();
  }

  @Test
  void emptyDirtySetNeverTouchesTheStore() {
    when(store.load()).thenReturn(BenchGraphs.bench(9L));
    SyncManager sync =
        manager(store, new DirtyTracker(), new PathCache(true, HotGraphMetrics.detached()));
    sync.refresh();

    assertThat(sync.sync(4L)).isEqualTo(9L);
    verify(store, never()).persist(anyCollection(), anyLong());
    assertThat(sync.state()).isEqualTo(SyncManager.State.IDLE);
  }

  @Test
  void malformedReloadKeepsPreviousSnapshot() {
    InMemoryGraphStore memory = new InMemoryGraphStore(BenchGraphs.bench(1L));
    DirtyTracker dirty = new DirtyTracker();
    SyncManager sync = manager(memory, dirty, new PathCache(true, HotGraphMetrics.detached()));
    sync.refresh();

    List<GraphEdge> edges = new ArrayList<>(memory.load().edges());
    edges.add(GraphEdge.of("usb", "animal", EdgeKind.DATA));
    memory.replace(memory.load().nodes(), edges);
    dirty.mark(List.of("usb"));

    assertThatThrownBy(sync::sync)
        .isInstanceOf(MalformedGraphException.class)
        .hasMessageContaining("animal");
    assertThat(sync.current().revision()).isEqualTo(1L);
    assertThat(sync.current().index().neighbors("usb")).containsExactly("teensy");
    assertThat(dirty.isDirty("usb")).isTrue();
    assertThat(sync.state()).isEqualTo(SyncManager.State.FAILED);
  }

  @Test
  void conflictLeavesChangesPending() {
    InMemoryGraphStore memory = new InMemoryGraphStore(BenchGraphs.bench(1L));
    HotGraph graph = HotGraph.builder(memory).build();
    memory.putNode(GraphNode.hardware("dac2"));
    graph.markDirty("dac1");

    assertThatThrownBy(() -> graph.sync(1L))
        .isInstanceOf(ConflictException.class)
        .satisfies(
            e -> {
              ConflictException conflict = (ConflictException) e;
              assertThat(conflict.expectedRevision()).isEqualTo(1L);
              assertThat(conflict.actualRevision()).isEqualTo(2L);
            });
    assertThat(graph.isDirty("dac1")).isTrue();
    assertThat(graph.revision()).isEqualTo(1L);

    assertThat(graph.sync(2L)).isEqualTo(3L);
    assertThat(graph.nodesOfKind(NodeKind.HARDWARE)).contains("dac2");
  }

  @Test
  void marksDuringFlushWaitForTheNextSync() {
    InMemoryGraphStore memory = spy(new InMemoryGraphStore(BenchGraphs.bench(1L)));
    AtomicReference<HotGraph> holder = new AtomicReference<>();
    AtomicReference<SyncManager.State> seen = new AtomicReference<>();
    doAnswer(
            invocation -> {
              seen.set(holder.get().syncState());
              holder.get().markDirty("dac1", "amp1");
              return invocation.callRealMethod();
            })
        .when(memory)
        .persist(anyCollection(), anyLong());
    HotGraph graph = HotGraph.builder(memory).build();
    holder.set(graph);
    graph.markDirty("dac1", "usb");

    graph.sync();

    assertThat(seen.get()).isEqualTo(SyncManager.State.FLUSHING);
    assertThat(graph.pendingChanges())
        .extracting(NodeChange::id)
        .containsExactlyInAnyOrder("dac1", "amp1");
    assertThat(graph.syncState()).isEqualTo(SyncManager.State.IDLE);
  }

  @Test
  void markOnStagedNodeDuringFlushWaitsForTheNextSync() {
    InMemoryGraphStore memory = spy(new InMemoryGraphStore(BenchGraphs.bench(1L)));
    AtomicReference<HotGraph> holder = new AtomicReference<>();
    doAnswer(
            invocation -> {
              holder.get().markDirty("amp1");
              return invocation.callRealMethod();
            })
        .when(memory)
        .persist(anyCollection(), anyLong());
    HotGraph graph = HotGraph.builder(memory).build();
    holder.set(graph);
    GraphNode amp = new GraphNode("amp1", NodeKind.HARDWARE, Map.of("part", "TPA3116"));
    graph.stageUpdate(amp);

    graph.sync();

    assertThat(graph.isDirty("amp1")).isTrue();
    assertThat(graph.pendingChanges()).containsExactly(NodeChange.upsert(amp));
    assertThat(graph.node("amp1").attribute("part")).contains("TPA3116");
  }

  @Test
  void markWaitsForPublishAndChecksTheNewSnapshot() throws Exception {
    InMemoryGraphStore memory = new InMemoryGraphStore(BenchGraphs.bench(1L));
    DirtyTracker dirty = new DirtyTracker();
    PathCache cache = spy(new PathCache(true, HotGraphMetrics.detached()));
    SyncManager sync = manager(memory, dirty, cache);
    sync.refresh();
    CountDownLatch publishing = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    doAnswer(
            invocation -> {
              publishing.countDown();
              assertThat(release.await(5, SECONDS)).isTrue();
              return invocation.callRealMethod();
            })
        .when(cache)
        .invalidateAll();
    dirty.stage(NodeChange.remove("usb"));

    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<Long> syncing = pool.submit(() -> sync.sync());
      assertThat(publishing.await(5, SECONDS)).isTrue();
      Future<Integer> marking =
          pool.submit(
              () ->
                  sync.withPublishLock(
                      current -> {
                        current.index().node("usb");
                        return dirty.mark(List.of("usb"));
                      }));
      long deadline = System.nanoTime() + SECONDS.toNanos(5);
      while (!sync.publishContended() && System.nanoTime() < deadline) {
        Thread.onSpinWait();
      }
      assertThat(sync.publishContended()).isTrue();
      assertThat(marking.isDone()).isFalse();

      release.countDown();

      assertThat(syncing.get(5, SECONDS)).isEqualTo(2L);
      assertThatThrownBy(() -> marking.get(5, SECONDS))
          .isInstanceOf(ExecutionException.class)
          .hasCauseInstanceOf(NotFoundException.class);
      assertThat(dirty.isDirty("usb")).isFalse();
      assertThat(sync.current().index().contains("usb")).isFalse();
    } finally {
      pool.shutdownNow();
    }
  }
}
