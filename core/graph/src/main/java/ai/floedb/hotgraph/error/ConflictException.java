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

package ai.floedb.hotgraph.error;

import java.util.Map;

/** The revision a sync was based on is no longer the store's current revision. */
public final class ConflictException extends HotGraphException {

  private final long expectedRevision;
  private final long actualRevision;

  public ConflictException(long expectedRevision, long actualRevision) {
    super(
        ErrorCode.CONFLICT,
        "stale revision "
            + expectedRevision
            + " (store is at "
            + actualRevision
            + "); reload and retry",
        null,
        Map.of(
            "expected", Long.toString(expectedRevision),
            "actual", Long.toString(actualRevision)));
    this.expectedRevision = expectedRevision;
    this.actualRevision = actualRevision;
  }

  public long expectedRevision() {
    return expectedRevision;
  }

  public long actualRevision() {
    return actualRevision;
  }
}
