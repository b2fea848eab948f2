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

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.hotgraph.model.GraphNode;
import ai.floedb.hotgraph.model.NodeChange;
import java.util.List;
import org.junit.jupiter.api.Test;

class DirtyTrackerTest {

  private final DirtyTracker tracker = new DirtyTracker();

  @Test
  void markIsIdempotent() {
    assertThat(tracker.mark(List.of("dac1", "amp1"))).isEqualTo(2);
    assertThat(tracker.mark(List.of("dac1"))).isEqualTo(2);
    assertThat(tracker.isDirty("dac1")).isTrue();
    assertThat(tracker.isDirty("usb")).isFalse();
  }

  @Test
  void markKeepsStagedChange() {
    NodeChange upsert = NodeChange.upsert(GraphNode.hardware("dac1"));
    tracker.stage(upsert);
    tracker.mark(List.of("dac1"));

    assertThat(tracker.snapshot()).containsExactly(upsert);
  }

  @Test
  void removeFlushedKeepsChangesRecordedAfterTheSnapshot() {
    tracker.mark(List.of("dac1", "amp1"));
    List<NodeChange> flushed = tracker.snapshot();

    tracker.mark(List.of("amp1"));
    tracker.mark(List.of("usb"));

    assertThat(tracker.removeFlushed(flushed)).isEqualTo(2);
    assertThat(tracker.snapshot())
        .extracting(NodeChange::id)
        .containsExactly("amp1", "usb");
  }

  @Test
  void markOnStagedChangeDuringFlushStaysPending() {
    NodeChange upsert = NodeChange.upsert(GraphNode.hardware("dac1"));
    tracker.stage(upsert);
    tracker.mark(List.of("amp1"));
    List<NodeChange> flushed = tracker.snapshot();

    tracker.mark(List.of("dac1"));

    assertThat(tracker.removeFlushed(flushed)).isEqualTo(1);
    assertThat(tracker.snapshot()).containsExactly(upsert);
    assertThat(tracker.isDirty("amp1")).isFalse();
  }

  @Test
  void stageReplacesPendingChange() {
    tracker.stage(NodeChange.upsert(GraphNode.hardware("dac1")));
    tracker.stage(NodeChange.remove("dac1"));

    assertThat(tracker.size()).isEqualTo(1);
    assertThat(tracker.snapshot()).containsExactly(NodeChange.remove("dac1"));
  }
}
