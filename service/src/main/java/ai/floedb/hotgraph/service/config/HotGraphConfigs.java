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

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.util.Map;

/**
 * Builds {@link HotGraphConfig} outside a container. Sources, highest first: the overrides
 * passed in, system properties, environment, {@code META-INF/microprofile-config.properties}.
 */
public final class HotGraphConfigs {

  private static final int OVERRIDE_ORDINAL = 500;

  private HotGraphConfigs() {}

  public static HotGraphConfig load() {
    return load(Map.of());
  }

  public static HotGraphConfig load(Map<String, String> overrides) {
    SmallRyeConfig config =
        new SmallRyeConfigBuilder()
            .addDefaultSources()
            .addDiscoveredConverters()
            .withSources(new PropertiesConfigSource(overrides, "overrides", OVERRIDE_ORDINAL))
            .withMapping(HotGraphConfig.class)
            .build();
    return config.getConfigMapping(HotGraphConfig.class);
  }
}
