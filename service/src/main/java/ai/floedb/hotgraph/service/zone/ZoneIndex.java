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

import ai.floedb.hotgraph.error.NotFoundException;
import ai.floedb.hotgraph.index.GraphIndex;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Zone name to member ids, computed once per snapshot. */
public final class ZoneIndex {

  private final Map<String, List<String>> members;

  private ZoneIndex(Map<String, List<String>> members) {
    this.members = members;
  }

  public static ZoneIndex build(List<ZoneRule> rules, GraphIndex index) {
    Map<String, List<String>> members = new LinkedHashMap<>();
    for (ZoneRule rule : rules) {
      if (members.put(rule.name(), List.copyOf(rule.select(index))) != null) {
        throw new IllegalArgumentException("duplicate zone: " + rule.name());
      }
    }
    return new ZoneIndex(Collections.unmodifiableMap(members));
  }

  public static ZoneIndex empty() {
    return new ZoneIndex(Map.of());
  }

  public List<String> members(String name) {
    List<String> ids = members.get(name);
    if (ids == null) {
      throw NotFoundException.zone(name);
    }
    return ids;
  }

  public Set<String> names() {
    return members.keySet();
  }
}
