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

import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.Math.max;
import static java.lang.Math.min;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/**
 * Lightweight message formatter. The format of messages this formatter produces is very compact
 * and to the point:
 *
 * <pre>
 * index.php:3:6: ERROR - [undefined.variable] Undefined variable $name
 * echo $name;
 *      ^^^^^
 * </pre>
 */
public final class LightweightMessageFormatter implements MessageFormatter {
  private final @Nullable SourceExcerptProvider source;
  private boolean includeLocation = true;
  private boolean includeLevel = true;

  /** A constructor for when the client doesn't care about source information. */
  private LightweightMessageFormatter() {
    this.source = null;
  }

  public LightweightMessageFormatter(SourceExcerptProvider source) {
    this.source = checkNotNull(source);
  }

  public static LightweightMessageFormatter withoutSource() {
    return new LightweightMessageFormatter();
  }

  @CanIgnoreReturnValue
  public LightweightMessageFormatter setIncludeLocation(boolean includeLocation) {
    this.includeLocation = includeLocation;
    return this;
  }

  @CanIgnoreReturnValue
  public LightweightMessageFormatter setIncludeLevel(boolean includeLevel) {
    this.includeLevel = includeLevel;
    return this;
  }

  @Override
  public String formatError(PhpError error) {
    return format(error, CheckLevel.ERROR);
  }

  @Override
  public String formatWarning(PhpError warning) {
    return format(warning, CheckLevel.WARNING);
  }

  private String format(PhpError error, CheckLevel level) {
    StringBuilder b = new StringBuilder();
    if (includeLocation) {
      appendPosition(b, error.sourceName(), error.lineno(), error.column());
    }
    if (includeLevel) {
      b.append(level);
      b.append(" - [");
      b.append(error.rule());
      b.append("] ");
    }
    b.append(error.description());
    b.append('\n');

    String line =
        source == null || error.sourceName() == null || error.lineno() < 1
            ? null
            : source.getSourceLine(error.sourceName(), error.lineno());
    if (line != null) {
      b.append(line);
      b.append('\n');
      int charno = error.column() - 1;
      // charno == line.length() means something is missing at the end of the line
      if (0 <= charno && charno <= line.length()) {
        padLine(charno, line, b, error.length());
      }
    }
    return b.toString();
  }

  private static void appendPosition(
      StringBuilder b, @Nullable String sourceName, int lineNumber, int column) {
    if (sourceName != null) {
      b.append(sourceName);
      if (lineNumber > 0) {
        b.append(':').append(lineNumber);
        if (column > 0) {
          b.append(':').append(column);
        }
      }
      b.append(": ");
    }
  }

  private static void padLine(int charno, String sourceExcerpt, StringBuilder b, int errLength) {
    // Append leading whitespace
    for (int i = 0; i < charno; i++) {
      char c = sourceExcerpt.charAt(i);
      b.append(Character.isWhitespace(c) ? c : ' ');
    }
    int length = max(1, min(errLength, sourceExcerpt.length() - charno));
    for (int i = 0; i < length; i++) {
      b.append('^');
    }
    b.append('\n');
  }
}
