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

package dev.phpcheck.syntax;

/** Thrown by {@link TokenStream} and {@link Parser} on input they cannot handle. */
public class ParseException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int offset;

  public ParseException(String message, int offset) {
    super(message);
    this.offset = offset;
  }

  public ParseException(String message, int offset, Throwable cause) {
    super(message, cause);
    this.offset = offset;
  }

  /** The offset in the source text at which the problem was found. */
  public int getOffset() {
    return offset;
  }
}
