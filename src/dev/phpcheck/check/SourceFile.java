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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.lang.Math.min;

import dev.phpcheck.syntax.Node;
import java.io.IOException;
import java.io.Serializable;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * An abstract representation of a PHP source file. The code is read lazily when the file comes
 * from disk and kept once read.
 */
public final class SourceFile implements Serializable {
  private static final long serialVersionUID = 1L;

  private final String fileName;
  private final @Nullable Path path;
  private final Charset charset;

  private @Nullable String code;

  // Offsets of the first character of each line; lines are 1-based, so line n starts at
  // lineOffsets[n - 1].
  private int @Nullable [] lineOffsets = null;

  private SourceFile(String fileName, @Nullable Path path, Charset charset, @Nullable String code) {
    checkArgument(!fileName.isEmpty(), "a source must have a name");
    this.fileName = fileName;
    this.path = path;
    this.charset = charset;
    this.code = code;
  }

  public static SourceFile fromCode(String fileName, String code) {
    return new SourceFile(fileName, null, StandardCharsets.UTF_8, code);
  }

  public static SourceFile fromPath(Path path, Charset charset) {
    return new SourceFile(path.toString(), path, charset, null);
  }

  public static SourceFile fromPath(Path path) {
    return fromPath(path, StandardCharsets.UTF_8);
  }

  public String getName() {
    return fileName;
  }

  /** Gets all the code in this source file, reading it from disk on first use. */
  public synchronized String getCode() throws IOException {
    if (code == null) {
      checkState(path != null, "no code and no path for %s", fileName);
      code = Files.readString(path, charset);
    }
    return code;
  }

  /** Returns the code a node was parsed from. */
  public String getCode(Node n) {
    checkArgument(n.getSourceOffset() >= 0, "node without source position: %s", n);
    return loadedCode().substring(n.getSourceOffset(), n.getSourceEnd());
  }

  private String loadedCode() {
    checkState(code != null, "%s has not been read", fileName);
    return code;
  }

  private synchronized void findLineOffsets() {
    if (lineOffsets != null) {
      return;
    }
    String localCode = loadedCode();
    int numLines = 1;
    for (int i = 0; i < localCode.length(); i++) {
      if (localCode.charAt(i) == '\n') {
        numLines++;
      }
    }
    int[] offsets = new int[numLines];
    int index = 1; // start at 1 since the offset for line 0 is always at byte 0
    int offset = 0;
    while ((offset = localCode.indexOf('\n', offset)) != -1) {
      // +1 because this is the offset of the next line which is one past the newline
      offset++;
      offsets[index++] = offset;
    }
    checkState(index == offsets.length);
    this.lineOffsets = offsets;
  }

  /** Returns the 1-based line containing {@code offset}. */
  public int getLineOfOffset(int offset) {
    findLineOffsets();
    int search = Arrays.binarySearch(lineOffsets, offset);
    if (search >= 0) {
      return search + 1; // lines are 1-based.
    } else {
      int insertionPoint = -1 * (search + 1);
      return min(insertionPoint - 1, lineOffsets.length - 1) + 1;
    }
  }

  /** Returns the 0-based column of {@code offset} within its line. */
  public int getColumnOfOffset(int offset) {
    int line = getLineOfOffset(offset);
    return offset - lineOffsets[line - 1];
  }

  /**
   * Gets the source line for the indicated line number.
   *
   * @param lineNumber the line number, 1 being the first line of the file.
   * @return The line indicated. Does not include the newline at the end of the file. Returns
   *     {@code null} if it does not exist.
   */
  public @Nullable String getLine(int lineNumber) {
    if (code == null) {
      return null;
    }
    findLineOffsets();
    if (lineNumber < 1 || lineNumber > lineOffsets.length) {
      return null;
    }
    int pos = lineOffsets[lineNumber - 1];
    int end = code.indexOf('\n', pos);
    if (end == -1) {
      return pos >= code.length() ? null : code.substring(pos);
    }
    return code.substring(pos, end);
  }

  @Override
  public String toString() {
    return fileName;
  }
}
