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
import dev.phpcheck.syntax.Node;

/** A check that runs over the parsed tree of one file and returns what it found. */
public interface CheckPass {

  /**
   * Analyzes {@code root}, the SCRIPT node parsed from {@code source}. Implementations keep no
   * state between calls.
   */
  ImmutableList<PhpError> check(SourceFile source, Node root);
}
