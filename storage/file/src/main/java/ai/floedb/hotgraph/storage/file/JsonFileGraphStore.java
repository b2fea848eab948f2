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

package ai.floedb.hotgraph.storage.file;

import ai.floedb.hotgraph.error.ConflictException;
import ai.floedb.hotgraph.error.PersistenceException;
import ai.floedb.hotgraph.model.Graph;
import ai.floedb.hotgraph.model.NodeChange;
import ai.floedb.hotgraph.store.ChangeApplier;
import ai.floedb.hotgraph.store.GraphStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * {@link GraphStore} backed by one JSON document.
 *
 * <p>The file is the authority: every call re-reads it, so edits made by other tools between
 * calls are picked up. A missing file reads as the empty graph at revision 0 and is created by the
 * first persist. Writes are atomic file replacements.
 */
public final class JsonFileGraphStore implements GraphStore {

  private static final Logger LOG = Logger.getLogger(JsonFileGraphStore.class);

  private final Path file;
  private final GraphDocumentCodec codec;

  public JsonFileGraphStore(Path file) {
    this(file, new GraphDocumentCodec());
  }

  public JsonFileGraphStore(Path file, GraphDocumentCodec codec) {
    this.file = Objects.requireNonNull(file, "file");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public Path file() {
    return file;
  }

  @Override
  public synchronized Graph load() {
    if (!Files.exists(file)) {
      LOG.debugf("Graph file %s does not exist yet; starting empty", file);
      return Graph.empty();
    }
    try {
      return codec.read(file);
    } catch (IOException | IllegalArgumentException e) {
      throw new PersistenceException("Failed to read graph file " + file, e);
    }
  }

  @Override
  public synchronized long revision() {
    return load().revision();
  }

  @Override
  public synchronized long persist(Collection<NodeChange> changes, long expectedRevision) {
    Graph base = load();
    if (expectedRevision != ANY_REVISION && expectedRevision != base.revision()) {
      throw new ConflictException(expectedRevision, base.revision());
    }
    Graph next = ChangeApplier.apply(base, changes, base.revision() + 1L);
    try {
      codec.write(next, file);
    } catch (IOException e) {
      throw new PersistenceException("Failed to write graph file " + file, e);
    }
    LOG.infof("Wrote revision %d to %s (%d change(s))", next.revision(), file, changes.size());
    return next.revision();
  }
}
