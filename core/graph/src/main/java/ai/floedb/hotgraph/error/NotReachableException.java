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

/** Path search exhausted the hop bound without reaching the target. */
public final class NotReachableException extends HotGraphException {

  private final String start;
  private final String end;
  private final int maxHops;

  public NotReachableException(String start, String end, int maxHops) {
    super(
        ErrorCode.NOT_REACHABLE,
        "no path from " + start + " to " + end + " within " + maxHops + " hops",
        null,
        Map.of("start", start, "end", end, "maxHops", Integer.toString(maxHops)));
    this.start = start;
    this.end = end;
    this.maxHops = maxHops;
  }

  public String start() {
    return start;
  }

  public String end() {
    return end;
  }

  public int maxHops() {
    return maxHops;
  }
}
