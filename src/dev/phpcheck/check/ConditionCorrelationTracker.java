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

import com.google.common.base.CharMatcher;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.SetMultimap;
import dev.phpcheck.syntax.Node;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Remembers which names were assigned under which condition within one file, so that a later read
 * guarded by the same condition text is not reported.
 *
 * <p>Conditions are compared by their source text with whitespace removed; {@code $a>0} and
 * {@code $a > 0} are the same condition, {@code 0 < $a} is not.
 */
final class ConditionCorrelationTracker {

  private final SourceFile source;

  // Condition key to names assigned in the then-branch of an if with that condition.
  private final SetMultimap<String, String> assignedUnder = HashMultimap.create();
  // Condition key to names assigned in the body of an if with that condition and no else.
  private final SetMultimap<String, String> assignedInNoElseIf = HashMultimap.create();
  private final Deque<String> activeConditions = new ArrayDeque<>();

  ConditionCorrelationTracker(SourceFile source) {
    this.source = source;
  }

  /** Returns the normalized text of {@code cond}. */
  String key(Node cond) {
    String text = cond.getSourceOffset() >= 0 ? source.getCode(cond) : cond.toStringTree();
    return CharMatcher.whitespace().removeFrom(text);
  }

  void pushCondition(String key) {
    activeConditions.push(key);
  }

  void popCondition() {
    activeConditions.pop();
  }

  void recordAssignedUnder(String key, Iterable<String> names) {
    assignedUnder.putAll(key, names);
  }

  /** Whether {@code name} was assigned under a condition that is active now. */
  boolean isCorrelated(String name) {
    for (String key : activeConditions) {
      if (assignedUnder.containsEntry(key, name)) {
        return true;
      }
    }
    return false;
  }

  ImmutableSet<String> assignedUnder(String key) {
    return ImmutableSet.copyOf(assignedUnder.get(key));
  }

  void recordNoElseIf(String key, Iterable<String> names) {
    assignedInNoElseIf.putAll(key, names);
  }

  ImmutableSet<String> noElseAssigned(String key) {
    return ImmutableSet.copyOf(assignedInNoElseIf.get(key));
  }
}
