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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SortingErrorManagerTest {
  private static final DiagnosticType FOO = DiagnosticType.error("test.foo", "Foo {0}");
  private static final DiagnosticType BAR = DiagnosticType.warning("test.bar", "Bar {0}");

  private static PhpError error(DiagnosticType type, String file, int line, int column) {
    return PhpError.builder(type, file + line + column)
        .setSourceLocation(file, line, column)
        .build();
  }

  @Test
  public void testOrderingWithinLevel() {
    SortingErrorManager manager = new SortingErrorManager();
    PhpError b2 = error(FOO, "b.php", 2, 1);
    PhpError a9 = error(FOO, "a.php", 9, 1);
    PhpError b1c5 = error(FOO, "b.php", 1, 5);
    PhpError b1c2 = error(FOO, "b.php", 1, 2);
    manager.report(CheckLevel.ERROR, b2);
    manager.report(CheckLevel.ERROR, a9);
    manager.report(CheckLevel.ERROR, b1c5);
    manager.report(CheckLevel.ERROR, b1c2);

    assertThat(manager.getErrors()).containsExactly(a9, b1c2, b1c5, b2).inOrder();
  }

  @Test
  public void testCounts() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(CheckLevel.ERROR, error(FOO, "a.php", 1, 1));
    manager.report(CheckLevel.WARNING, error(FOO, "a.php", 2, 1));
    manager.report(CheckLevel.ERROR, error(BAR, "a.php", 3, 1));
    manager.report(CheckLevel.WARNING, error(BAR, "a.php", 4, 1));

    assertThat(manager.getErrorCount()).isEqualTo(2);
    assertThat(manager.getWarningCount()).isEqualTo(2);
    assertThat(manager.hasHaltingErrors()).isTrue();
    assertThat(manager.getErrors()).hasSize(2);
    assertThat(manager.getWarnings()).hasSize(2);
  }

  @Test
  public void testPromotedWarningDoesNotHalt() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(CheckLevel.ERROR, error(BAR, "a.php", 1, 1));
    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.hasHaltingErrors()).isFalse();
  }

  @Test
  public void testDuplicatesAreReportedOnce() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(CheckLevel.ERROR, error(FOO, "a.php", 1, 1));
    manager.report(CheckLevel.ERROR, error(FOO, "a.php", 1, 1));
    assertThat(manager.getErrorCount()).isEqualTo(1);
  }

  @Test
  public void testReportGenerators() {
    List<Integer> seen = new ArrayList<>();
    SortingErrorManager manager =
        new SortingErrorManager(
            ImmutableSet.of(m -> seen.add(m.getSortedDiagnostics().size())));
    manager.report(CheckLevel.WARNING, error(BAR, "a.php", 1, 1));
    manager.generateReport();
    assertThat(seen).containsExactly(1);
  }
}
