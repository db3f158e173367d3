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
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableList;
import dev.phpcheck.syntax.Node;
import dev.phpcheck.syntax.Parser;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;

/**
 * Base class for testing a {@link CheckPass}. Inputs are PHP code without the open tag; {@code
 * <?php } is prepended on the same line, so line numbers match the input.
 */
public abstract class CheckTestCase {

  protected static final String FILE_NAME = "testcode.php";

  /** The open tag every input is prefixed with. */
  protected static final String OPEN_TAG = "<?php ";

  private AnalyzerOptions options;

  /** Errors found by the last run. */
  protected ImmutableList<PhpError> lastErrors = ImmutableList.of();

  @Before
  public void setUp() throws Exception {
    options = new AnalyzerOptions();
  }

  protected AnalyzerOptions getOptions() {
    return options;
  }

  /** Gets the check to run on the test inputs. */
  protected abstract CheckPass getProcessor(AnalyzerOptions options);

  /** Parses and checks {@code php}, returning what the check reported. */
  protected ImmutableList<PhpError> check(String php) {
    String code = OPEN_TAG + php;
    SourceFile source = SourceFile.fromCode(FILE_NAME, code);
    Node root = Parser.parse(code);
    lastErrors = getProcessor(options).check(source, root);
    return lastErrors;
  }

  /** Verifies that the check reports nothing for the given input. */
  protected void testSame(String php) {
    ImmutableList<PhpError> errors = check(php);
    assertWithMessage("Unexpected diagnostics for:\n%s", php).that(errors).isEmpty();
  }

  /**
   * Verifies that the check reports exactly one diagnostic, of the given type, for the given
   * input.
   */
  protected PhpError testWarning(String php, DiagnosticType type) {
    ImmutableList<PhpError> errors = check(php);
    assertWithMessage("Expected one %s for:\n%s", type.key, php).that(errors).hasSize(1);
    PhpError error = errors.get(0);
    assertThat(error.type()).isEqualTo(type);
    return error;
  }

  /** Verifies the type and message of the single diagnostic reported for the given input. */
  protected PhpError testWarning(String php, DiagnosticType type, String description) {
    PhpError error = testWarning(php, type);
    assertThat(error.description()).isEqualTo(description);
    return error;
  }

  /** Verifies that the check reports diagnostics of the given types, in order. */
  protected void testWarnings(String php, DiagnosticType... types) {
    ImmutableList<PhpError> errors = check(php);
    List<DiagnosticType> actual = new ArrayList<>();
    for (PhpError error : errors) {
      actual.add(error.type());
    }
    assertWithMessage("Diagnostics for:\n%s", php)
        .that(actual)
        .containsExactlyElementsIn(types)
        .inOrder();
  }
}
