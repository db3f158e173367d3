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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSetMultimap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AnalyzerOptionsTest {

  @Test
  public void testDefaults() {
    AnalyzerOptions options = new AnalyzerOptions();
    assertThat(options.getSuperglobals()).contains("$_GET");
    assertThat(options.getSuperglobals()).contains("$GLOBALS");
    assertThat(options.getExitMethodSuffix()).isEqualTo("Exit");
    assertThat(options.getByReferenceParameters().get("preg_match")).containsExactly(2);
    assertThat(options.getNumThreads()).isEqualTo(1);
  }

  @Test
  public void testSuperglobalsNeedSigils() {
    AnalyzerOptions options = new AnalyzerOptions();
    options.setSuperglobals(ImmutableList.of("$config"));
    assertThat(options.getSuperglobals()).containsExactly("$config");
    assertThrows(
        IllegalArgumentException.class, () -> options.setSuperglobals(ImmutableList.of("config")));
  }

  @Test
  public void testByReferenceParametersAreCaseInsensitive() {
    AnalyzerOptions options = new AnalyzerOptions();
    options.setByReferenceParameters(ImmutableSetMultimap.of("My_Fill", 0));
    assertThat(options.getByReferenceParameters().get("my_fill")).containsExactly(0);
    assertThat(options.getByReferenceParameters().containsKey("preg_match")).isFalse();
  }

  @Test
  public void testInvalidValues() {
    AnalyzerOptions options = new AnalyzerOptions();
    assertThrows(IllegalArgumentException.class, () -> options.setExitMethodSuffix(""));
    assertThrows(IllegalArgumentException.class, () -> options.setNumThreads(0));
  }

  @Test
  public void testLevelOverrides() {
    AnalyzerOptions options = new AnalyzerOptions();
    PhpError undefined = PhpError.make(UndefinedVariableCheck.UNDEFINED_VARIABLE, "$x");
    PhpError parse = PhpError.make(Analyzer.PARSE_ERROR, "oops");
    assertThat(options.getLevel(undefined)).isEqualTo(CheckLevel.ERROR);

    options.setWarningLevel(DiagnosticGroups.UNDEFINED_VARIABLE, CheckLevel.WARNING);
    assertThat(options.getLevel(undefined)).isEqualTo(CheckLevel.WARNING);
    assertThat(options.getLevel(parse)).isEqualTo(CheckLevel.ERROR);

    options.setWarningLevel(DiagnosticGroups.UNDEFINED_VARIABLE, CheckLevel.OFF);
    assertThat(options.getLevel(undefined)).isEqualTo(CheckLevel.OFF);
  }
}
