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

import java.util.List;
import org.junit.jupiter.api.Test;

class FocusSetTest {

  @Test
  void replaceSwapsRatherThanMerges() {
    FocusSet focus = new FocusSet();
    focus.replace(List.of("dac1", "amp1"));
    assertThat(focus.replace(List.of("usb"))).isEqualTo(1);

    assertThat(focus.members()).containsExactly("usb");
  }

  @Test
  void emptyFocusPassesEverything() {
    FocusSet focus = new FocusSet();
    List<String> ids = List.of("dac1", "usb", "amp1");

    assertThat(focus.filter(ids)).isSameAs(ids);

    focus.replace(List.of("amp1", "dac1"));
    assertThat(focus.filter(ids)).containsExactly("dac1", "amp1");

    focus.replace(List.of());
    assertThat(focus.isEmpty()).isTrue();
  }
}
