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

/** Stable codes surfaced to callers alongside the exception message. */
public enum ErrorCode {
  NOT_FOUND("graph.not_found"),
  NOT_REACHABLE("graph.not_reachable"),
  MALFORMED_GRAPH("graph.malformed"),
  PERSISTENCE("store.persistence"),
  CONFLICT("store.conflict");

  private final String key;

  ErrorCode(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }
}
