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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Options for the analyzer. */
public class AnalyzerOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Variables PHP defines in every file before any user code runs. */
  public static final ImmutableSet<String> DEFAULT_SUPERGLOBALS =
      ImmutableSet.of(
          "$_GET",
          "$_POST",
          "$_REQUEST",
          "$_SERVER",
          "$_SESSION",
          "$_COOKIE",
          "$_FILES",
          "$_ENV",
          "$GLOBALS",
          "$argc",
          "$argv");

  /**
   * Built-in functions that assign to some of their arguments, keyed by lower-case function name.
   * The values are 0-based argument positions.
   */
  public static final ImmutableSetMultimap<String, Integer> DEFAULT_BY_REFERENCE_PARAMETERS =
      ImmutableSetMultimap.<String, Integer>builder()
          .put("preg_match", 2)
          .put("preg_match_all", 2)
          .put("parse_str", 1)
          .put("mb_parse_str", 1)
          .putAll("exec", 1, 2)
          .put("str_replace", 3)
          .put("str_ireplace", 3)
          .put("preg_replace", 4)
          .put("preg_replace_callback", 4)
          .put("similar_text", 2)
          .putAll("getmxrr", 1, 2)
          .put("is_callable", 2)
          .putAll("headers_sent", 0, 1)
          .build();

  public static final String DEFAULT_EXIT_METHOD_SUFFIX = "Exit";

  private ImmutableSet<String> superglobals = DEFAULT_SUPERGLOBALS;

  private String exitMethodSuffix = DEFAULT_EXIT_METHOD_SUFFIX;

  private ImmutableSetMultimap<String, Integer> byReferenceParameters =
      DEFAULT_BY_REFERENCE_PARAMETERS;

  private final Map<String, CheckLevel> levelOverrides = new LinkedHashMap<>();

  private int numThreads = 1;

  public ImmutableSet<String> getSuperglobals() {
    return superglobals;
  }

  /** Sets the names every file starts with as defined, replacing the PHP superglobals. */
  public void setSuperglobals(Iterable<String> names) {
    for (String name : names) {
      checkArgument(name.startsWith("$"), "variable name without sigil: %s", name);
    }
    this.superglobals = ImmutableSet.copyOf(names);
  }

  public String getExitMethodSuffix() {
    return exitMethodSuffix;
  }

  /**
   * Calls to methods whose names end with this suffix, e.g. {@code $this->redirectAndExit()}, are
   * treated like {@code exit}.
   */
  public void setExitMethodSuffix(String suffix) {
    checkArgument(!suffix.isEmpty(), "empty exit method suffix");
    this.exitMethodSuffix = suffix;
  }

  public ImmutableSetMultimap<String, Integer> getByReferenceParameters() {
    return byReferenceParameters;
  }

  public void setByReferenceParameters(ImmutableSetMultimap<String, Integer> parameters) {
    ImmutableSetMultimap.Builder<String, Integer> normalized = ImmutableSetMultimap.builder();
    parameters.forEach((fn, index) -> normalized.put(fn.toLowerCase(Locale.ROOT), index));
    this.byReferenceParameters = normalized.build();
  }

  /** Configure the given group of diagnostics to the given level. */
  public void setWarningLevel(DiagnosticGroup group, CheckLevel level) {
    levelOverrides.put(group.getName(), level);
  }

  /** Returns the level {@code error} is reported at under these options. */
  public CheckLevel getLevel(PhpError error) {
    for (Map.Entry<String, CheckLevel> override : levelOverrides.entrySet()) {
      DiagnosticGroup group = DiagnosticGroups.forName(override.getKey());
      if (group != null && group.matches(error)) {
        return override.getValue();
      }
    }
    return error.defaultLevel();
  }

  public int getNumThreads() {
    return numThreads;
  }

  public void setNumThreads(int numThreads) {
    checkArgument(numThreads > 0, "numThreads must be positive: %s", numThreads);
    this.numThreads = numThreads;
  }
}
