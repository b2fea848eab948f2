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

import ai.floedb.hotgraph.index.GraphIndex;
import ai.floedb.hotgraph.model.Graph;
import ai.floedb.hotgraph.service.zone.ZoneIndex;
import ai.floedb.hotgraph.service.zone.ZoneRule;
import java.util.List;
import java.util.Objects;

/** Index and zones of one revision, published together. */
public record GraphSnapshot(GraphIndex index, ZoneIndex zones) {

  public GraphSnapshot {
    Objects.requireNonNull(index, "index");
    Objects.requireNonNull(zones, "zones");
  }

  public static GraphSnapshot build(Graph graph, List<ZoneRule> rules) {
    GraphIndex index = GraphIndex.build(graph);
    return new GraphSnapshot(index, ZoneIndex.build(rules, index));
  }

  public long revision() {
    return index.revision();
  }
}
