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

package ai.floedb.hotgraph.store;

import ai.floedb.hotgraph.model.Graph;
import ai.floedb.hotgraph.model.NodeChange;
import java.util.Collection;

/**
 * Authoritative, versioned graph storage.
 *
 * <p>Implementations assign a strictly increasing revision on every successful {@link #persist}.
 * Both operations surface I/O problems as {@link ai.floedb.hotgraph.error.PersistenceException}.
 */
public interface GraphStore {

  /** Disables the compare-and-set check in {@link #persist}. */
  long ANY_REVISION = -1L;

  /** Loads the full graph at the current revision. */
  Graph load();

  /**
   * Applies the changes atomically and returns the new revision.
   *
   * @param expectedRevision revision the changes were based on, or {@link #ANY_REVISION}
   * @throws ai.floedb.hotgraph.error.ConflictException when the store moved past {@code
   *     expectedRevision}
   */
  long persist(Collection<NodeChange> changes, long expectedRevision);

  /** Current revision without loading the graph. */
  long revision();
}
