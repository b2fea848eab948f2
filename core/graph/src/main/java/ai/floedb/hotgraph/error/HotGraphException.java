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
import java.util.Objects;

/**
 * Base type for every failure the graph cache reports.
 *
 * <p>All subtypes are unchecked. Operations validate before they mutate, so catching one of these
 * means shared state is exactly as it was before the call.
 */
public abstract class HotGraphException extends RuntimeException {

  private final ErrorCode code;
  private final Map<String, String> details;

  protected HotGraphException(
      ErrorCode code, String message, Throwable cause, Map<String, String> details) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.details = details == null ? Map.of() : Map.copyOf(details);
  }

  public ErrorCode code() {
    return code;
  }

  public Map<String, String> details() {
    return details;
  }
}
