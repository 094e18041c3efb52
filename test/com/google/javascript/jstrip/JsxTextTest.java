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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link JsxText}. */
@RunWith(JUnit4.class)
public final class JsxTextTest {

  @Test
  public void testSingleLineTextIsKept() {
    assertThat(JsxText.formatTextLiteral("hello")).isEqualTo("\"hello\"");
    assertThat(JsxText.formatTextLiteral(" hello world ")).isEqualTo("\" hello world \"");
  }

  @Test
  public void testWhitespaceOnlyTextIsEmpty() {
    assertThat(JsxText.formatTextLiteral("\n  ")).isEqualTo("\"\"");
    assertThat(JsxText.formatTextLiteral("\n\n\t\n")).isEqualTo("\"\"");
  }

  @Test
  public void testLinesAreTrimmedAndJoined() {
    assertThat(JsxText.formatTextLiteral("\n  first\n\n  second  \n"))
        .isEqualTo("\"first second\"");
  }

  @Test
  public void testWhitespaceNextToTagsIsKeptOnTheSameLine() {
    assertThat(JsxText.formatTextLiteral("a  \n  b")).isEqualTo("\"a b\"");
    assertThat(JsxText.formatTextLiteral("  a")).isEqualTo("\"  a\"");
  }

  @Test
  public void testNamedEntities() {
    assertThat(JsxText.formatTextLiteral("&amp;")).isEqualTo("\"&\"");
    assertThat(JsxText.formatTextLiteral("a &lt; b")).isEqualTo("\"a < b\"");
    assertThat(JsxText.formatTextLiteral("&nbsp;")).isEqualTo("\"\u00a0\"");
  }

  @Test
  public void testNumericEntities() {
    assertThat(JsxText.formatTextLiteral("&#65;")).isEqualTo("\"A\"");
    assertThat(JsxText.formatTextLiteral("&#x41;")).isEqualTo("\"A\"");
    assertThat(JsxText.formatTextLiteral("&#x1F600;")).isEqualTo("\"\uD83D\uDE00\"");
  }

  @Test
  public void testUnknownEntityIsLeftAsText() {
    assertThat(JsxText.formatTextLiteral("&zzz;")).isEqualTo("\"&zzz;\"");
    assertThat(JsxText.formatTextLiteral("&#xZZ;")).isEqualTo("\"&#xZZ;\"");
    assertThat(JsxText.formatTextLiteral("a & b")).isEqualTo("\"a & b\"");
  }

  @Test
  public void testEntityTerminatorMustBeWithinTenCharacters() {
    assertThat(JsxText.formatTextLiteral("&abcdefghijk;")).isEqualTo("\"&abcdefghijk;\"");
  }

  @Test
  public void testQuotesAndBackslashesAreEscaped() {
    assertThat(JsxText.formatTextLiteral("say \"hi\" \\o/")).isEqualTo("\"say \\\"hi\\\" \\\\o/\"");
  }

  @Test
  public void testHtmlCharactersAreNotEscaped() {
    assertThat(JsxText.toStringLiteral("<a href='x'>")).isEqualTo("\"<a href='x'>\"");
  }

  @Test
  public void testTextReplacementKeepsLineBreaksAndTrailingSpaces() {
    assertThat(JsxText.formatTextReplacement("hello")).isEmpty();
    assertThat(JsxText.formatTextReplacement("\n  a  b\n    ")).isEqualTo("\n\n    ");
    assertThat(JsxText.formatTextReplacement("a b")).isEqualTo(" ");
  }

  @Test
  public void testStringValueCollapsesLineBreakAndIndentation() {
    assertThat(JsxText.formatStringValueLiteral("a\n    b")).isEqualTo("\"a b\"");
    assertThat(JsxText.formatStringValueLiteral("a\nb")).isEqualTo("\"a\\nb\"");
    assertThat(JsxText.formatStringValueLiteral("x &amp; y")).isEqualTo("\"x & y\"");
  }
}
