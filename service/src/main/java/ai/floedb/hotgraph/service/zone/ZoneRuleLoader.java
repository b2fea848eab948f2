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

package ai.floedb.hotgraph.service.zone;

import ai.floedb.hotgraph.error.PersistenceException;
import ai.floedb.hotgraph.model.NodeKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads zone rules from JSON.
 *
 * <pre>{@code
 * {"zones": [
 *   {"name": "power_analog", "members": ["dac1", "amp1"]},
 *   {"name": "audio", "attribute": "domain", "equals": "audio"},
 *   {"name": "firmware", "kind": "software"}
 * ]}
 * }</pre>
 *
 * Each entry must use exactly one of {@code members}, {@code attribute} or {@code kind}.
 */
public final class ZoneRuleLoader {

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ZoneFile(List<ZoneEntry> zones) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ZoneEntry(
      String name,
      List<String> members,
      String attribute,
      @JsonProperty("equals") String value,
      String kind) {}

  private final ObjectMapper mapper;

  public ZoneRuleLoader() {
    this(new ObjectMapper());
  }

  public ZoneRuleLoader(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public List<ZoneRule> load(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      return load(in);
    } catch (IOException e) {
      throw new PersistenceException("Failed to read zone file " + file, e);
    }
  }

  public List<ZoneRule> load(InputStream in) throws IOException {
    ZoneFile file = mapper.readValue(in, ZoneFile.class);
    if (file.zones() == null) {
      return List.of();
    }
    List<ZoneRule> rules = new ArrayList<>(file.zones().size());
    Set<String> names = new HashSet<>();
    for (ZoneEntry entry : file.zones()) {
      ZoneRule rule = toRule(entry);
      if (!names.add(rule.name())) {
        throw new IllegalArgumentException("duplicate zone: " + rule.name());
      }
      rules.add(rule);
    }
    return List.copyOf(rules);
  }

  private static ZoneRule toRule(ZoneEntry entry) {
    int forms =
        (entry.members() != null ? 1 : 0)
            + (entry.attribute() != null ? 1 : 0)
            + (entry.kind() != null ? 1 : 0);
    if (forms != 1) {
      throw new IllegalArgumentException(
          "zone " + entry.name() + " must define exactly one of members, attribute, kind");
    }
    if (entry.members() != null) {
      return ZoneRule.explicit(entry.name(), entry.members());
    }
    if (entry.attribute() != null) {
      return ZoneRule.attribute(entry.name(), entry.attribute(), entry.value());
    }
    return ZoneRule.kind(entry.name(), NodeKind.parse(entry.kind()));
  }
}
