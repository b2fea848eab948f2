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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Active subset of node ids that restricts neighbor results. Empty means unrestricted. Each call
 * to {@link #replace} swaps the whole set; sets are never merged.
 */
public final class FocusSet {

  private final AtomicReference<Set<String>> members = new AtomicReference<>(Set.of());

  /** Replaces the focus with {@code ids} and returns the size of the new set. */
  public int replace(Collection<String> ids) {
    Set<String> next = Collections.unmodifiableSet(new LinkedHashSet<>(ids));
    members.set(next);
    return next.size();
  }

  public void clear() {
    members.set(Set.of());
  }

  public Set<String> members() {
    return members.get();
  }

  public int size() {
    return members.get().size();
  }

  public boolean isEmpty() {
    return members.get().isEmpty();
  }

  /** Keeps the ids that are in focus, preserving order; everything passes when unfocused. */
  public List<String> filter(List<String> ids) {
    Set<String> focus = members.get();
    if (focus.isEmpty()) {
      return ids;
    }
    return ids.stream().filter(focus::contains).toList();
  }
}
