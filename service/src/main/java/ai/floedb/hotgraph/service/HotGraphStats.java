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

import ai.floedb.hotgraph.service.state.AccessStats.AccessCount;
import ai.floedb.hotgraph.service.sync.SyncManager;
import java.util.List;

/** Point-in-time diagnostics of a {@link HotGraph}. */
public record HotGraphStats(
    long revision,
    int nodeCount,
    int edgeCount,
    int focusSize,
    int cachedPaths,
    long cacheHits,
    long cacheMisses,
    long totalAccesses,
    int dirtyCount,
    List<AccessCount> topAccessed,
    SyncManager.State syncState) {

  public HotGraphStats {
    topAccessed = List.copyOf(topAccessed);
  }
}
