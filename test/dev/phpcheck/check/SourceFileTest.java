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
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import dev.phpcheck.syntax.Node;
import dev.phpcheck.syntax.Parser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceFileTest {

  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testLinesAndColumns() {
    SourceFile source = SourceFile.fromCode("a.php", "ab\ncde\n\nf");
    assertThat(source.getLineOfOffset(0)).isEqualTo(1);
    assertThat(source.getLineOfOffset(2)).isEqualTo(1);
    assertThat(source.getLineOfOffset(3)).isEqualTo(2);
    assertThat(source.getColumnOfOffset(5)).isEqualTo(2);
    assertThat(source.getLineOfOffset(7)).isEqualTo(3);
    assertThat(source.getLineOfOffset(8)).isEqualTo(4);
    assertThat(source.getColumnOfOffset(8)).isEqualTo(0);
  }

  @Test
  public void testGetLine() {
    SourceFile source = SourceFile.fromCode("a.php", "ab\ncde\n\nf");
    assertThat(source.getLine(1)).isEqualTo("ab");
    assertThat(source.getLine(2)).isEqualTo("cde");
    assertThat(source.getLine(3)).isEmpty();
    assertThat(source.getLine(4)).isEqualTo("f");
    assertThat(source.getLine(0)).isNull();
    assertThat(source.getLine(5)).isNull();
  }

  @Test
  public void testGetCodeOfNode() {
    String code = "<?php echo $value;";
    SourceFile source = SourceFile.fromCode("a.php", code);
    Node echo = Parser.parse(code).getFirstChild();
    assertThat(source.getCode(echo.getFirstChild())).isEqualTo("$value");
  }

  @Test
  public void testFromPathReadsLazily() throws IOException {
    Path path = folder.newFile("lazy.php").toPath();
    Files.writeString(path, "<?php\necho 1;\n", UTF_8);
    SourceFile source = SourceFile.fromPath(path);

    assertThat(source.getName()).isEqualTo(path.toString());
    assertThat(source.getLine(1)).isNull();
    assertThat(source.getCode()).isEqualTo("<?php\necho 1;\n");
    assertThat(source.getLine(2)).isEqualTo("echo 1;");
  }

  @Test
  public void testMissingFile() {
    SourceFile source = SourceFile.fromPath(folder.getRoot().toPath().resolve("missing.php"));
    assertThrows(IOException.class, source::getCode);
  }
}
