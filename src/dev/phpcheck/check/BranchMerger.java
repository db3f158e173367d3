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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Joins the states of the exclusive branches of an {@code if} chain or a {@code switch}.
 *
 * <p>A name first assigned in every branch is definite after the construct; a name first assigned
 * in some of them is possibly defined. When the branches do not cover every case, the state from
 * before the construct counts as one more branch, so nothing becomes definite through a construct
 * that might not run. Branches that always exit are left out by the caller.
 */
final class BranchMerger {

  /** The names to promote after a construct. */
  record Deltas(ImmutableSet<String> definite, ImmutableSet<String> possible) {
    static final Deltas NONE = new Deltas(ImmutableSet.of(), ImmutableSet.of());
  }

  private BranchMerger() {}

  static Deltas computeDeltas(
      Set<String> before, List<? extends Set<String>> branches, boolean exhaustive) {
    List<Set<String>> all = new ArrayList<>(branches.size() + 1);
    if (!exhaustive) {
      all.add(before);
    }
    all.addAll(branches);
    if (all.isEmpty()) {
      return Deltas.NONE;
    }

    Set<String> definite = null;
    Set<String> union = new LinkedHashSet<>();
    for (Set<String> branch : all) {
      Set<String> newInBranch = Sets.difference(branch, before);
      union.addAll(newInBranch);
      if (definite == null) {
        definite = new LinkedHashSet<>(newInBranch);
      } else {
        definite.retainAll(newInBranch);
      }
    }
    return new Deltas(
        ImmutableSet.copyOf(definite), ImmutableSet.copyOf(Sets.difference(union, definite)));
  }

  /** Computes the deltas of the branches and applies them to the top of {@code scopes}. */
  static void merge(
      ScopeStack scopes,
      Set<String> before,
      List<? extends Set<String>> branches,
      boolean exhaustive) {
    Deltas deltas = computeDeltas(before, branches, exhaustive);
    for (String name : deltas.definite()) {
      scopes.define(name);
    }
    for (String name : deltas.possible()) {
      if (!scopes.isDefined(name)) {
        scopes.definePossibly(name);
      }
    }
  }
}
