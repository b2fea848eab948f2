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

import ai.floedb.hotgraph.index.GraphIndex;
import ai.floedb.hotgraph.model.GraphNode;
import ai.floedb.hotgraph.model.NodeKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declarative definition of a zone. Membership is recomputed from the rule against every new
 * snapshot; ids the snapshot does not know are dropped.
 */
public interface ZoneRule {

  String name();

  /** Members of this zone in {@code index}, in declaration order for explicit zones. */
  List<String> select(GraphIndex index);

  static ZoneRule explicit(String name, List<String> members) {
    return new Explicit(name, members);
  }

  static ZoneRule attribute(String name, String key, String value) {
    return new AttributeMatch(name, key, value);
  }

  static ZoneRule kind(String name, NodeKind kind) {
    return new OfKind(name, kind);
  }

  record Explicit(String name, List<String> members) implements ZoneRule {
    public Explicit {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("zone name must not be blank");
      }
      members = List.copyOf(members);
    }

    @Override
    public List<String> select(GraphIndex index) {
      return members.stream().filter(index::contains).distinct().toList();
    }
  }

  /** Nodes whose attribute {@code key} equals {@code value}; a null value matches any value. */
  record AttributeMatch(String name, String key, String value) implements ZoneRule {
    public AttributeMatch {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("zone name must not be blank");
      }
      Objects.requireNonNull(key, "key");
    }

    @Override
    public List<String> select(GraphIndex index) {
      List<String> ids = new ArrayList<>();
      for (GraphNode node : index.nodes()) {
        String actual = node.attributes().get(key);
        if (actual != null && (value == null || value.equals(actual))) {
          ids.add(node.id());
        }
      }
      return ids;
    }
  }

  record OfKind(String name, NodeKind kind) implements ZoneRule {
    public OfKind {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("zone name must not be blank");
      }
      Objects.requireNonNull(kind, "kind");
    }

    @Override
    public List<String> select(GraphIndex index) {
      return index.nodesOfKind(kind);
    }
  }
}
