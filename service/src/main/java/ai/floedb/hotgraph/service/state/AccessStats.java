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

package ai.floedb.hotgraph.service.state;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-node access counters for diagnostics. Counts are approximate under concurrency and never
 * influence caching.
 */
public final class AccessStats {

  public record AccessCount(String id, long count) {}

  private static final Comparator<AccessCount> BY_COUNT_THEN_ID =
      Comparator.comparingLong(AccessCount::count).reversed().thenComparing(AccessCount::id);

  private final ConcurrentMap<String, LongAdder> counters = new ConcurrentHashMap<>();

  public void record(String id) {
    counters.computeIfAbsent(id, k -> new LongAdder()).increment();
  }

  public long count(String id) {
    LongAdder adder = counters.get(id);
    return adder == null ? 0L : adder.sum();
  }

  /** The {@code n} most accessed ids, highest first, ties by ascending id. */
  public List<AccessCount> topN(int n) {
    if (n <= 0) {
      return List.of();
    }
    return counters.entrySet().stream()
        .map(AccessStats::toCount)
        .sorted(BY_COUNT_THEN_ID)
        .limit(n)
        .toList();
  }

  public long total() {
    return counters.values().stream().mapToLong(LongAdder::sum).sum();
  }

  public void reset() {
    counters.clear();
  }

  private static AccessCount toCount(Map.Entry<String, LongAdder> entry) {
    return new AccessCount(entry.getKey(), entry.getValue().sum());
  }
}
