/*
 * Copyright 2026 The phpcheck Authors.
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


package dev.phpcheck.check;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import dev.phpcheck.syntax.IR;
import dev.phpcheck.syntax.Node;
import dev.phpcheck.syntax.Parser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ConditionCorrelationTrackerTest {

  @Test
  public void testKeyIgnoresWhitespace() {
    String code = "<?php if ($a > 1) {} if ($a>1) {} if (\n  $a\t>  1\n) {} if (1 < $a) {}";
    SourceFile source = SourceFile.fromCode("t.php", code);
    Node script = Parser.parse(code);
    ConditionCorrelationTracker tracker = new ConditionCorrelationTracker(source);

    ImmutableList.Builder<String> keys = ImmutableList.builder();
    for (Node ifNode : script.children()) {
      keys.add(tracker.key(ifNode.getFirstChild()));
    }
    assertThat(keys.build()).containsExactly("$a>1", "$a>1", "$a>1", "1<$a").inOrder();
  }

  @Test
  public void testKeyOfTreeWithoutPositions() {
    ConditionCorrelationTracker tracker =
        new ConditionCorrelationTracker(SourceFile.fromCode("t.php", ""));
    assertThat(tracker.key(IR.not(IR.var("$x")))).isEqualTo(tracker.key(IR.not(IR.var("$x"))));
    assertThat(tracker.key(IR.not(IR.var("$x")))).isNotEqualTo(tracker.key(IR.var("$x")));
  }

  @Test
  public void testCorrelationFollowsConditionStack() {
    ConditionCorrelationTracker tracker =
        new ConditionCorrelationTracker(SourceFile.fromCode("t.php", ""));
    tracker.recordAssignedUnder("$debug", ImmutableList.of("$start"));
    assertThat(tracker.isCorrelated("$start")).isFalse();

    tracker.pushCondition("$verbose");
    tracker.pushCondition("$debug");
    assertThat(tracker.isCorrelated("$start")).isTrue();
    assertThat(tracker.isCorrelated("$other")).isFalse();
    tracker.popCondition();
    assertThat(tracker.isCorrelated("$start")).isFalse();
    tracker.popCondition();
  }

  @Test
  public void testRecordedNamesAccumulate() {
    ConditionCorrelationTracker tracker =
        new ConditionCorrelationTracker(SourceFile.fromCode("t.php", ""));
    tracker.recordAssignedUnder("$c", ImmutableList.of("$a"));
    tracker.recordAssignedUnder("$c", ImmutableList.of("$b"));
    assertThat(tracker.assignedUnder("$c")).containsExactly("$a", "$b");
    assertThat(tracker.assignedUnder("$d")).isEmpty();

    tracker.recordNoElseIf("$x", ImmutableList.of("$v"));
    assertThat(tracker.noElseAssigned("$x")).containsExactly("$v");
    assertThat(tracker.noElseAssigned("$c")).isEmpty();
  }
}
