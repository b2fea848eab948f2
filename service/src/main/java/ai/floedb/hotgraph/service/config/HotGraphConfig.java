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

package ai.floedb.hotgraph.service.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.util.Optional;

@ConfigMapping(prefix = "hotgraph")
public interface HotGraphConfig {

  Store store();

  /** JSON zone definitions; no zones when unset. */
  Optional<String> zoneFile();

  PathQueries path();

  Stats stats();

  interface Store {
    /** {@code memory} or {@code file}. */
    @WithDefault("memory")
    String kind();

    /**
     * Graph document. Required for {@code file}; for {@code memory} it seeds the store when set.
     */
    Optional<String> path();
  }

  interface PathQueries {
    @WithDefault("5")
    int defaultMaxHops();

    @WithDefault("true")
    boolean cacheEnabled();
  }

  interface Stats {
    @WithDefault("10")
    int topN();
  }
}
