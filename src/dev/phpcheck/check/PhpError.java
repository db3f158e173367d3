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

import static com.google.common.base.Strings.emptyToNull;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.phpcheck.syntax.Node;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Compile error description.
 *
 * @param type the diagnostic type; its key is the identifier reported with the error
 * @param description the formatted message
 * @param sourceName the file the error was found in
 * @param lineno 1-based line number, or -1 if unknown
 * @param column 1-based column, or -1 if unknown; it restarts at 1 after each newline
 * @param offset offset of the reported node in the file, or -1 if unknown
 * @param length length of the reported node
 * @param defaultLevel the level the error is reported at unless overridden
 */
public record PhpError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int column,
    int offset,
    int length,
    CheckLevel defaultLevel)
    implements Serializable {
  public PhpError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  private static final int DEFAULT_LINENO = -1;
  private static final int DEFAULT_COLUMN = -1;

  /** The rule this error belongs to: the name of its diagnostic group. */
  public String rule() {
    return DiagnosticGroups.ruleFor(type);
  }

  /** The identifier of this error, e.g. {@code variable.undefined}. */
  public String identifier() {
    return type.key;
  }

  public static PhpError make(DiagnosticType type, String... arguments) {
    return builder(type, arguments).build();
  }

  public static PhpError make(SourceFile source, Node n, DiagnosticType type, String... arguments) {
    return builder(type, arguments).setNode(source, n).build();
  }

  /** Creates a new builder for a {@link PhpError} of the given type. */
  public static Builder builder(DiagnosticType type, String... arguments) {
    return new Builder(type, arguments);
  }

  /** Builder for {@link PhpError}. */
  public static final class Builder {
    private final DiagnosticType type;
    private final String[] args;

    private CheckLevel level;
    private @Nullable String sourceName = null;
    private int lineno = DEFAULT_LINENO;
    private int column = DEFAULT_COLUMN;
    private int offset = -1;
    private int length = 0;

    private Builder(DiagnosticType type, String... args) {
      this.type = type;
      this.args = args;
      this.level = type.level; // may be overwritten later
    }

    /** Locates the error at {@code n}, which must come from a parse of {@code source}. */
    @CanIgnoreReturnValue
    public Builder setNode(SourceFile source, Node n) {
      this.sourceName = source.getName();
      this.offset = n.getSourceOffset();
      this.length = n.getLength();
      if (offset >= 0) {
        this.lineno = source.getLineOfOffset(offset);
        this.column = source.getColumnOfOffset(offset) + 1;
      }
      return this;
    }

    /** Locates the error at an offset of {@code source}, with no node. */
    @CanIgnoreReturnValue
    public Builder setOffset(SourceFile source, int offset) {
      this.sourceName = source.getName();
      this.offset = offset;
      this.length = 0;
      this.lineno = source.getLineOfOffset(offset);
      this.column = source.getColumnOfOffset(offset) + 1;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSourceLocation(String sourceName, int lineno, int column) {
      this.sourceName = sourceName;
      this.lineno = lineno;
      this.column = column;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLevel(CheckLevel level) {
      this.level = Preconditions.checkNotNull(level);
      return this;
    }

    public PhpError build() {
      return new PhpError(
          type, type.format(args), sourceName, lineno, column, offset, length, level);
    }
  }

  @Override
  public final String toString() {
    String sourceName =
        emptyToNull(this.sourceName()) != null ? this.sourceName() : "(unknown source)";
    String lineno =
        this.lineno() != DEFAULT_LINENO ? String.valueOf(this.lineno()) : "(unknown line)";
    String column =
        this.column() != DEFAULT_COLUMN ? String.valueOf(this.column()) : "(unknown column)";

    return this.type().key
        + ". "
        + this.description()
        + " at "
        + sourceName
        + " line "
        + lineno
        + " : "
        + column;
  }
}
