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

import ai.floedb.hotgraph.error.PersistenceException;
import ai.floedb.hotgraph.service.config.HotGraphConfig;
import ai.floedb.hotgraph.service.metrics.HotGraphMetrics;
import ai.floedb.hotgraph.service.zone.ZoneRule;
import ai.floedb.hotgraph.service.zone.ZoneRuleLoader;
import ai.floedb.hotgraph.storage.file.GraphDocumentCodec;
import ai.floedb.hotgraph.storage.file.JsonFileGraphStore;
import ai.floedb.hotgraph.storage.memory.InMemoryGraphStore;
import ai.floedb.hotgraph.store.GraphStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.jboss.logging.Logger;

/** Wires a {@link HotGraph} from {@link HotGraphConfig}. */
public final class HotGraphFactory {

  private static final Logger LOG = Logger.getLogger(HotGraphFactory.class);

  private HotGraphFactory() {}

  public static HotGraph create(HotGraphConfig config, MeterRegistry registry) {
    List<ZoneRule> zones =
        config.zoneFile().map(f -> new ZoneRuleLoader().load(Path.of(f))).orElse(List.of());
    return HotGraph.builder(createStore(config.store()))
        .zones(zones)
        .metrics(new HotGraphMetrics(registry))
        .defaultMaxHops(config.path().defaultMaxHops())
        .pathCacheEnabled(config.path().cacheEnabled())
        .statsTopN(config.stats().topN())
        .build();
  }

  public static GraphStore createStore(HotGraphConfig.Store store) {
    String kind = store.kind().trim().toLowerCase(Locale.ROOT);
    switch (kind) {
      case "file" -> {
        Path file =
            store
                .path()
                .map(Path::of)
                .orElseThrow(
                    () ->
                        new IllegalArgumentException(
                            "hotgraph.store.path is required for the file store"));
        LOG.infof("Using JSON graph file %s", file);
        return new JsonFileGraphStore(file);
      }
      case "memory" -> {
        if (store.path().isEmpty()) {
          return new InMemoryGraphStore();
        }
        Path seed = Path.of(store.path().get());
        try {
          LOG.infof("Seeding in-memory store from %s", seed);
          return new InMemoryGraphStore(new GraphDocumentCodec().read(seed));
        } catch (IOException e) {
          throw new PersistenceException("Failed to read seed graph " + seed, e);
        }
      }
      default -> throw new IllegalArgumentException("unknown store kind: " + store.kind());
    }
  }
}
