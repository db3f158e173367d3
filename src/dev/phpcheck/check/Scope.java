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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import java.util.HashSet;
import java.util.Set;

/**
 * The assignment facts of one function-level unit: the top level of a file, a function, a method
 * or a closure. Blocks, conditionals and loops do not get a scope of their own.
 *
 * <p>{@code defined} and {@code possiblyDefined} are always disjoint. Names in {@code inherited}
 * were captured by a closure's {@code use} clause. Assumed names are temporary facts installed
 * while one branch or operand is analyzed; they count as defined but are never part of a
 * snapshot.
 */
final class Scope {

  /** The state of a scope at one point, for restoring it before the next branch. */
  record Checkpoint(ImmutableSet<String> defined, ImmutableSet<String> possiblyDefined) {}

  private final Set<String> defined = new HashSet<>();
  private final Set<String> possiblyDefined = new HashSet<>();
  private final Set<String> inherited = new HashSet<>();
  // A multiset, since nested operands may assume the same name more than once.
  private final Multiset<String> assumed = HashMultiset.create();
  private final boolean isClosure;
  private boolean hasThis;

  private Scope(boolean isClosure) {
    this.isClosure = isClosure;
  }

  static Scope create() {
    return new Scope(false);
  }

  static Scope createClosure() {
    return new Scope(true);
  }

  boolean isClosure() {
    return isClosure;
  }

  boolean hasThis() {
    return hasThis;
  }

  void setHasThis() {
    hasThis = true;
    define("$this");
  }

  void define(String name) {
    possiblyDefined.remove(name);
    defined.add(name);
  }

  /** Records that {@code name} is assigned on some paths. Never downgrades a definite name. */
  void definePossibly(String name) {
    if (!defined.contains(name)) {
      possiblyDefined.add(name);
    }
  }

  /** Turns a definite name into a possible one, for names first assigned in a loop body. */
  void demote(String name) {
    if (defined.remove(name)) {
      possiblyDefined.add(name);
    }
  }

  void inherit(String name) {
    inherited.add(name);
  }

  boolean isDefined(String name) {
    return defined.contains(name) || inherited.contains(name) || assumed.contains(name);
  }

  boolean isPossiblyDefined(String name) {
    return possiblyDefined.contains(name);
  }

  void assume(Set<String> names) {
    assumed.addAll(names);
  }

  void retract(Set<String> names) {
    for (String name : names) {
      assumed.remove(name);
    }
  }

  /** Returns a copy of the definitely assigned names. */
  ImmutableSet<String> snapshot() {
    return ImmutableSet.copyOf(defined);
  }

  Checkpoint checkpoint() {
    return new Checkpoint(ImmutableSet.copyOf(defined), ImmutableSet.copyOf(possiblyDefined));
  }

  void restore(Checkpoint checkpoint) {
    defined.clear();
    defined.addAll(checkpoint.defined());
    possiblyDefined.clear();
    possiblyDefined.addAll(checkpoint.possiblyDefined());
  }

  @Override
  public String toString() {
    return (isClosure ? "closure" : "scope")
        + "{defined="
        + defined
        + ", possiblyDefined="
        + possiblyDefined
        + ", inherited="
        + inherited
        + "}";
  }
}
