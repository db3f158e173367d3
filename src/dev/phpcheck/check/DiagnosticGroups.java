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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Named groups of DiagnosticTypes exposed by the analyzer. */
public final class DiagnosticGroups {

  private DiagnosticGroups() {}

  // Must be initialized before the groups below register themselves.
  private static final Map<String, DiagnosticGroup> groupsByName = new LinkedHashMap<>();

  static DiagnosticGroup registerGroup(String name, DiagnosticType... types) {
    checkArgument(!groupsByName.containsKey(name), "duplicate group %s", name);
    DiagnosticGroup group = new DiagnosticGroup(name, types);
    groupsByName.put(name, group);
    return group;
  }

  /** Get the registered diagnostic groups, indexed by name. */
  public static ImmutableMap<String, DiagnosticGroup> getRegisteredGroups() {
    return ImmutableMap.copyOf(groupsByName);
  }

  public static ImmutableSet<String> getRegisteredGroupNames() {
    return ImmutableSet.copyOf(groupsByName.keySet());
  }

  /** Find the diagnostic group registered under the given name. */
  public static @Nullable DiagnosticGroup forName(String name) {
    return groupsByName.get(name);
  }

  public static final DiagnosticGroup UNDEFINED_VARIABLE =
      registerGroup(
          "undefined.variable",
          UndefinedVariableCheck.UNDEFINED_VARIABLE,
          UndefinedVariableCheck.POSSIBLY_UNDEFINED_VARIABLE);

  public static final DiagnosticGroup PARSE_ERROR =
      registerGroup("parse.error", Analyzer.PARSE_ERROR, Analyzer.READ_ERROR);

  /**
   * Returns the name of the first registered group containing {@code type}, or the type's own key
   * for a type outside every group.
   */
  static String ruleFor(DiagnosticType type) {
    for (DiagnosticGroup group : groupsByName.values()) {
      if (group.matches(type)) {
        return group.getName();
      }
    }
    return type.key;
  }
}
