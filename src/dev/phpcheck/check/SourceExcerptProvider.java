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

import org.jspecify.annotations.Nullable;

/** A source excerpt provider is responsible for building source code excerpts of errors. */
public interface SourceExcerptProvider {

  /**
   * Get the line indicated by the line number. This call will return only the specific line.
   *
   * @param sourceName the source name
   * @param lineNumber the line number, 1 being the first line of the file
   * @return the line indicated, or {@code null} if it does not exist
   */
  @Nullable String getSourceLine(String sourceName, int lineNumber);
}
