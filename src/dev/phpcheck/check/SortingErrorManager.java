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

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Ordering;
import java.util.Comparator;
import java.util.Set;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;

/**
 * Collects diagnostics in a stable order, whatever order the files were analyzed in, and hands
 * them to {@link ErrorReportGenerator}s at the end of the run.
 */
public class SortingErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledPhpErrorComparator());
  private int originalErrorCount = 0;
  private int promotedErrorCount = 0;
  private int warningCount = 0;

  // Run by generateReport, in order.
  private final ImmutableSet<ErrorReportGenerator> errorReportGenerators;

  public SortingErrorManager(Set<ErrorReportGenerator> errorReportGenerators) {
    this.errorReportGenerators = ImmutableSet.copyOf(errorReportGenerators);
  }

  public SortingErrorManager() {
    this(ImmutableSet.of());
  }

  @Override
  public synchronized void report(CheckLevel level, PhpError error) {
    ErrorWithLevel e = new ErrorWithLevel(error, level);
    if (messages.add(e)) {
      if (level == CheckLevel.ERROR) {
        if (error.type().level == CheckLevel.ERROR) {
          originalErrorCount++;
        } else {
          promotedErrorCount++;
        }
      } else if (level == CheckLevel.WARNING) {
        warningCount++;
      }
    }
  }

  @Override
  public synchronized boolean hasHaltingErrors() {
    return originalErrorCount != 0;
  }

  @Override
  public synchronized int getErrorCount() {
    return originalErrorCount + promotedErrorCount;
  }

  @Override
  public synchronized int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<PhpError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<PhpError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  synchronized ImmutableList<ErrorWithLevel> getSortedDiagnostics() {
    return ImmutableList.copyOf(messages);
  }

  private synchronized ImmutableList<PhpError> toList(CheckLevel level) {
    ImmutableList.Builder<PhpError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorReportGenerator generator : this.errorReportGenerators) {
      generator.generateReport(this);
    }
  }

  /** Strategy for customizing the output format of the error report */
  public interface ErrorReportGenerator {
    void generateReport(SortingErrorManager manager);
  }

  /**
   * Orders diagnostics by level, then file (errors without a file first), line, column and
   * description. Two diagnostics that compare equal are the same report.
   */
  static final class LeveledPhpErrorComparator implements Comparator<ErrorWithLevel> {
    private static final Ordering<@Nullable String> SOURCE_ORDER =
        Ordering.<String>natural().nullsFirst();

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      return ComparisonChain.start()
          .compare(p1.level, p2.level)
          .compare(p1.error.sourceName(), p2.error.sourceName(), SOURCE_ORDER)
          .compare(p1.error.lineno(), p2.error.lineno())
          .compare(p1.error.column(), p2.error.column())
          .compare(p1.error.description(), p2.error.description())
          .result();
    }
  }

  /** A diagnostic together with the level it was reported at. */
  static final class ErrorWithLevel {
    final PhpError error;
    final CheckLevel level;

    ErrorWithLevel(PhpError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }
  }
}
