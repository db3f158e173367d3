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

import com.google.common.collect.ImmutableList;

/** The error manager is in charge of storing, organizing and displaying errors and warnings. */
public interface ErrorManager {

  /**
   * Reports an error. The errors will be displayed by {@link #generateReport()} at the
   * discretion of the implementation.
   *
   * @param level the reporting level
   * @param error the error to report
   */
  void report(CheckLevel level, PhpError error);

  /** Writes a report to an implementation-specific medium. */
  void generateReport();

  /** Gets the number of reported errors. */
  int getErrorCount();

  /** Gets the number of reported warnings. */
  int getWarningCount();

  /** Gets all the errors, in the order the implementation keeps them. */
  ImmutableList<PhpError> getErrors();

  /** Gets all the warnings, in the order the implementation keeps them. */
  ImmutableList<PhpError> getWarnings();

  /** Whether an error that was an error by default has been reported. */
  boolean hasHaltingErrors();
}
