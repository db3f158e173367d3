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
import java.io.Serializable;
import java.util.Arrays;

/**
 * Group a set of related diagnostic types together, so that they can be toggled on and off as one
 * unit. The group name is the rule name reported with every diagnostic of the group.
 */
public final class DiagnosticGroup implements Serializable {
  private static final long serialVersionUID = 1;

  private final ImmutableSet<DiagnosticType> types;

  private final String name;

  DiagnosticGroup(String name, DiagnosticType... types) {
    this.name = name;
    this.types = ImmutableSet.copyOf(Arrays.asList(types));
  }

  public String getName() {
    return name;
  }

  /** Returns whether the given error's type matches a type in this group. */
  public boolean matches(PhpError error) {
    return matches(error.type());
  }

  /** Returns whether the given type matches a type in this group. */
  public boolean matches(DiagnosticType type) {
    return types.contains(type);
  }

  public ImmutableSet<DiagnosticType> getTypes() {
    return types;
  }

  @Override
  public String toString() {
    return "DiagnosticGroup<" + name + ">";
  }
}
