/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.javascript.jstrip;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.Files;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CommandLineRunner}. */
@RunWith(JUnit4.class)
public final class CommandLineRunnerTest {

  @Rule public final TemporaryFolder tempFolder = new TemporaryFolder();

  private ByteArrayOutputStream outBytes;
  private ByteArrayOutputStream errBytes;

  @Before
  public void setUp() {
    outBytes = new ByteArrayOutputStream();
    errBytes = new ByteArrayOutputStream();
  }

  private int run(String... args) throws IOException {
    return new CommandLineRunner()
        .run(
            args,
            new PrintStream(outBytes, true, "UTF-8"),
            new PrintStream(errBytes, true, "UTF-8"));
  }

  private String out() {
    return new String(outBytes.toByteArray(), UTF_8);
  }

  private String err() {
    return new String(errBytes.toByteArray(), UTF_8);
  }

  private File writeInput(String name, String contents) throws IOException {
    File file = tempFolder.newFile(name);
    Files.asCharSink(file, UTF_8).write(contents);
    return file;
  }

  @Test
  public void testTransformsByExtension() throws IOException {
    File input = writeInput("a.ts", "let x: number = 1;\n");
    assertThat(run("--js", input.getPath())).isEqualTo(0);
    assertThat(out()).startsWith("\"use strict\";");
    assertThat(out()).contains("let x = 1;");
    assertThat(out()).doesNotContain("number");
    assertThat(err()).isEmpty();
  }

  @Test
  public void testExplicitTransforms() throws IOException {
    File input = writeInput("a.js", "const a = 1_000;\n");
    assertThat(run("--js", input.getPath(), "--transforms", "jsx")).isEqualTo(0);
    assertThat(out()).contains("const a = 1000;");
    assertThat(out()).doesNotContain("use strict");
  }

  @Test
  public void testJsxDebugFlag() throws IOException {
    File input = writeInput("a.jsx", "<div/>;\n");
    assertThat(run("--js", input.getPath(), "--transforms", "jsx", "--jsx_debug", "false"))
        .isEqualTo(0);
    assertThat(out()).doesNotContain("__source");

    outBytes.reset();
    assertThat(run("--js", input.getPath(), "--transforms", "jsx")).isEqualTo(0);
    assertThat(out()).contains("__source");
    assertThat(out()).contains("_jsxFileName");
  }

  @Test
  public void testOutputFile() throws IOException {
    File input = writeInput("a.js", "export const a = 1;\n");
    File output = new File(tempFolder.getRoot(), "out.js");
    assertThat(run("--js", input.getPath(), "--js_output_file", output.getPath())).isEqualTo(0);
    assertThat(out()).isEmpty();
    String written = Files.asCharSource(output, UTF_8).read();
    assertThat(written).contains("exports.a");
  }

  @Test
  public void testSyntaxError() throws IOException {
    File input = writeInput("bad.js", "a;\n  'open");
    assertThat(run("--js", input.getPath())).isEqualTo(1);
    assertThat(err()).contains(input.getPath() + ": Unterminated string constant (2:2)");
  }

  @Test
  public void testUnknownTransform() throws IOException {
    File input = writeInput("a.js", "a;\n");
    assertThat(run("--js", input.getPath(), "--transforms", "imports,coffee")).isEqualTo(1);
    assertThat(err()).contains("Unknown transform: coffee");
  }

  @Test
  public void testInvalidTransformCombination() throws IOException {
    File input = writeInput("a.ts", "a;\n");
    assertThat(run("--js", input.getPath(), "--transforms", "typescript")).isEqualTo(1);
    assertThat(err()).contains("without the import transform");
  }

  @Test
  public void testMissingInput() throws IOException {
    assertThat(run()).isEqualTo(1);
    assertThat(err()).contains("--js");
  }

  @Test
  public void testHelp() throws IOException {
    assertThat(run("--help")).isEqualTo(0);
    assertThat(out()).contains("--transforms");
  }
}
