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
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link TranspileOptions} and {@link Transform}. */
@RunWith(JUnit4.class)
public final class TranspileOptionsTest {

  @Test
  public void testDefaults() {
    TranspileOptions options = TranspileOptions.builder().build();
    assertThat(options.transforms()).isEmpty();
    assertThat(options.filePath()).isNull();
    assertThat(options.jsxDebugMetadata()).isTrue();
  }

  @Test
  public void testHas() {
    TranspileOptions options =
        TranspileOptions.builder().setTransforms(Transform.JSX, Transform.IMPORTS).build();
    assertThat(options.has(Transform.JSX)).isTrue();
    assertThat(options.has(Transform.IMPORTS)).isTrue();
    assertThat(options.has(Transform.FLOW)).isFalse();
  }

  @Test
  public void testTypeScriptRequiresImports() {
    InvalidOptionsException e =
        assertThrows(
            InvalidOptionsException.class,
            () -> TranspileOptions.builder().setTransforms(Transform.TYPESCRIPT).build());
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("The TypeScript transform without the import transform is not supported.");
  }

  @Test
  public void testFlowAndTypeScriptAreExclusive() {
    assertThrows(
        InvalidOptionsException.class,
        () ->
            TranspileOptions.builder()
                .setTransforms(Transform.IMPORTS, Transform.TYPESCRIPT, Transform.FLOW)
                .build());
  }

  @Test
  public void testFromFlagName() {
    assertThat(Transform.fromFlagName("add-module-exports"))
        .isEqualTo(Transform.ADD_MODULE_EXPORTS);
    assertThat(Transform.fromFlagName("jsx")).isEqualTo(Transform.JSX);
    assertThat(Transform.IMPORTS.getFlagName()).isEqualTo("imports");
  }

  @Test
  public void testFromFlagNameRejectsUnknownNames() {
    InvalidOptionsException e =
        assertThrows(InvalidOptionsException.class, () -> Transform.fromFlagName("coffee"));
    assertThat(e).hasMessageThat().isEqualTo("Unknown transform: coffee");
  }

  @Test
  public void testForFileExtension() {
    assertThat(Transform.forFileExtension("src/app.js"))
        .containsExactly(Transform.IMPORTS, Transform.FLOW, Transform.JSX);
    assertThat(Transform.forFileExtension("App.jsx"))
        .containsExactly(Transform.IMPORTS, Transform.FLOW, Transform.JSX);
    assertThat(Transform.forFileExtension("lib/util.ts"))
        .containsExactly(Transform.IMPORTS, Transform.TYPESCRIPT);
    assertThat(Transform.forFileExtension("App.TSX"))
        .containsExactly(Transform.IMPORTS, Transform.TYPESCRIPT, Transform.JSX);
  }
}
