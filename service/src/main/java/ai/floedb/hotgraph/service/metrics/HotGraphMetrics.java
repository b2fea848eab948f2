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

package ai.floedb.hotgraph.service.metrics;

import ai.floedb.hotgraph.error.HotGraphException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Micrometer meters for the hot graph.
 *
 * <p>Meter names:
 *
 * <ul>
 *   <li>{@code hotgraph.path.cache} counter, tag {@code result=hit|miss}
 *   <li>{@code hotgraph.dirty.marked} counter
 *   <li>{@code hotgraph.sync} timer, tags {@code result=success|failure} and {@code error}
 *   <li>{@code hotgraph.dirty.size}, {@code hotgraph.revision}, {@code hotgraph.path.cache.size}
 *       gauges
 * </ul>
 */
public final class HotGraphMetrics {

  private final MeterRegistry registry;
  private final Counter pathHits;
  private final Counter pathMisses;
  private final Counter marked;

  public HotGraphMetrics(MeterRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.pathHits =
        Counter.builder("hotgraph.path.cache")
            .tag("result", "hit")
            .description("Path cache hits")
            .register(registry);
    this.pathMisses =
        Counter.builder("hotgraph.path.cache")
            .tag("result", "miss")
            .description("Path cache misses")
            .register(registry);
    this.marked =
        Counter.builder("hotgraph.dirty.marked")
            .description("Ids marked dirty or staged")
            .register(registry);
  }

  /** Meters kept in a private registry nobody scrapes. */
  public static HotGraphMetrics detached() {
    return new HotGraphMetrics(new SimpleMeterRegistry());
  }

  public MeterRegistry registry() {
    return registry;
  }

  public void recordPathLookup(boolean hit) {
    if (hit) {
      pathHits.increment();
    } else {
      pathMisses.increment();
    }
  }

  public void recordMarked(int count) {
    marked.increment(count);
  }

  public void recordSync(Duration duration) {
    Timer.builder("hotgraph.sync")
        .tag("result", "success")
        .tag("error", "none")
        .description("Sync duration")
        .register(registry)
        .record(duration);
  }

  public void recordSyncFailure(Duration duration, Throwable error) {
    String code =
        error instanceof HotGraphException hge
            ? hge.code().key()
            : error.getClass().getSimpleName();
    Timer.builder("hotgraph.sync")
        .tag("result", "failure")
        .tag("error", code)
        .description("Sync duration")
        .register(registry)
        .record(duration);
  }

  public void trackGauge(String name, String description, Supplier<Number> value) {
    Gauge.builder(name, value).description(description).register(registry);
  }
}
