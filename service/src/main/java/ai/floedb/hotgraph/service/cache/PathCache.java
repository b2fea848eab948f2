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

package ai.floedb.hotgraph.service.cache;

import ai.floedb.hotgraph.service.metrics.HotGraphMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Memoized shortest paths keyed by (start, end, hop bound).
 *
 * <p>Entries carry the snapshot revision they were computed against. A lookup against a different
 * revision evicts the entry and reports a miss, so a stale path is never returned even if a
 * concurrent reader stored it after an invalidation. There is no size or time bound: the working
 * set is cleared on every sync.
 */
public class PathCache {

  public record Key(String start, String end, int maxHops) {
    public Key {
      Objects.requireNonNull(start, "start");
      Objects.requireNonNull(end, "end");
    }
  }

  public record CachedPath(List<String> path, long revision) {
    public CachedPath {
      path = List.copyOf(path);
    }

    public boolean contains(String id) {
      return path.contains(id);
    }
  }

  private final boolean enabled;
  private final HotGraphMetrics metrics;
  private final Cache<Key, CachedPath> cache = Caffeine.newBuilder().build();
  private final LongAdder hits = new LongAdder();
  private final LongAdder misses = new LongAdder();

  public PathCache(boolean enabled, HotGraphMetrics metrics) {
    this.enabled = enabled;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /** Returns the cached path when one exists for {@code revision}. */
  public Optional<List<String>> get(Key key, long revision) {
    if (!enabled) {
      return Optional.empty();
    }
    CachedPath entry = cache.getIfPresent(key);
    if (entry != null && entry.revision() != revision) {
      cache.asMap().remove(key, entry);
      entry = null;
    }
    boolean hit = entry != null;
    (hit ? hits : misses).increment();
    metrics.recordPathLookup(hit);
    return hit ? Optional.of(entry.path()) : Optional.empty();
  }

  public void put(Key key, List<String> path, long revision) {
    if (!enabled) {
      return;
    }
    cache.put(key, new CachedPath(path, revision));
  }

  /** Evicts every cached path that passes through {@code id}; returns how many went. */
  public int invalidateContaining(String id) {
    int before = size();
    cache.asMap().values().removeIf(entry -> entry.contains(id));
    return Math.max(0, before - size());
  }

  public void invalidateAll() {
    cache.invalidateAll();
  }

  public int size() {
    return cache.asMap().size();
  }

  public boolean enabled() {
    return enabled;
  }

  public long hits() {
    return hits.sum();
  }

  public long misses() {
    return misses.sum();
  }
}
