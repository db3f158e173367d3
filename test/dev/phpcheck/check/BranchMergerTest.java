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
import com.google.common.collect.ImmutableSet;
import dev.phpcheck.check.BranchMerger.Deltas;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BranchMergerTest {

  private static final ImmutableSet<String> BEFORE = ImmutableSet.of("$x");

  @Test
  public void testExhaustiveBranchesAssigningTheSameName() {
    Deltas deltas =
        BranchMerger.computeDeltas(
            BEFORE, ImmutableList.of(ImmutableSet.of("$x", "$a"), ImmutableSet.of("$x", "$a")),
            true);
    assertThat(deltas.definite()).containsExactly("$a");
    assertThat(deltas.possible()).isEmpty();
  }

  @Test
  public void testNonExhaustiveBranchesOnlyPossiblyDefine() {
    Deltas deltas =
        BranchMerger.computeDeltas(
            BEFORE, ImmutableList.of(ImmutableSet.of("$x", "$a"), ImmutableSet.of("$x", "$a")),
            false);
    assertThat(deltas.definite()).isEmpty();
    assertThat(deltas.possible()).containsExactly("$a");
  }

  @Test
  public void testNameInSomeBranches() {
    Deltas deltas =
        BranchMerger.computeDeltas(
            BEFORE,
            ImmutableList.of(
                ImmutableSet.of("$x", "$a", "$b"), ImmutableSet.of("$x", "$a"),
                ImmutableSet.of("$x", "$a", "$c")),
            true);
    assertThat(deltas.definite()).containsExactly("$a");
    assertThat(deltas.possible()).containsExactly("$b", "$c");
  }

  @Test
  public void testNoBranches() {
    assertThat(BranchMerger.computeDeltas(BEFORE, ImmutableList.of(), true))
        .isEqualTo(Deltas.NONE);
    assertThat(BranchMerger.computeDeltas(BEFORE, ImmutableList.of(), false))
        .isEqualTo(Deltas.NONE);
  }

  @Test
  public void testSingleExhaustiveBranch() {
    Deltas deltas =
        BranchMerger.computeDeltas(BEFORE, ImmutableList.of(ImmutableSet.of("$x", "$a")), true);
    assertThat(deltas.definite()).containsExactly("$a");
  }

  @Test
  public void testMergeIntoScopes() {
    ScopeStack scopes = new ScopeStack(ImmutableList.of());
    scopes.define("$x");
    scopes.define("$b");
    BranchMerger.merge(
        scopes,
        BEFORE,
        ImmutableList.of(ImmutableSet.of("$x", "$a", "$b"), ImmutableSet.of("$x", "$a")),
        true);

    assertThat(scopes.isDefined("$a")).isTrue();
    // $b was defined outside the branches and stays definite.
    assertThat(scopes.isDefined("$b")).isTrue();
    assertThat(scopes.isPossiblyDefined("$b")).isFalse();
  }

  @Test
  public void testMergePossible() {
    ScopeStack scopes = new ScopeStack(ImmutableList.of());
    BranchMerger.merge(
        scopes, ImmutableSet.of(), ImmutableList.of(ImmutableSet.of("$a")), false);
    assertThat(scopes.isDefined("$a")).isFalse();
    assertThat(scopes.isPossiblyDefined("$a")).isTrue();
  }
}
