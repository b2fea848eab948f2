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

import ai.floedb.hotgraph.model.NodeChange;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pending node changes awaiting sync, keyed by node id in first-marked order.
 *
 * <p>All methods synchronize on the tracker, so a flush snapshot never interleaves with a mark.
 * Ids are validated by the caller; the tracker stores whatever it is given.
 */
public final class DirtyTracker {

  private final Map<String, NodeChange> pending = new LinkedHashMap<>();

  /**
   * Marks ids dirty. A staged upsert or removal already pending for an id keeps its content, but
   * every mark stores a new change instance so a mark made during a flush survives it.
   */
  public synchronized int mark(Collection<String> ids) {
    for (String id : ids) {
      NodeChange existing = pending.get(id);
      pending.put(
          id,
          existing == null
              ? NodeChange.touch(id)
              : new NodeChange(id, existing.type(), existing.node()));
    }
    return pending.size();
  }

  /** Records a staged change, replacing whatever was pending for the same id. */
  public synchronized int stage(NodeChange change) {
    pending.put(change.id(), change);
    return pending.size();
  }

  public synchronized boolean isDirty(String id) {
    return pending.containsKey(id);
  }

  public synchronized int size() {
    return pending.size();
  }

  public synchronized boolean isEmpty() {
    return pending.isEmpty();
  }

  /** Copy of the pending changes in mark order. */
  public synchronized List<NodeChange> snapshot() {
    return List.copyOf(pending.values());
  }

  /**
   * Drops exactly the flushed change objects. Changes recorded after the snapshot was taken are
   * different instances and stay pending.
   */
  public synchronized int removeFlushed(Collection<NodeChange> flushed) {
    List<String> done = new ArrayList<>();
    for (NodeChange change : flushed) {
      if (pending.get(change.id()) == change) {
        done.add(change.id());
      }
    }
    done.forEach(pending::remove);
    return pending.size();
  }
}
