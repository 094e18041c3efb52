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

package com.google.javascript.jstrip.parsing;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for JSX scanning and parsing. */
@RunWith(JUnit4.class)
public final class JsxParserTest {

  private static ImmutableList<Token> parse(String code) {
    return Parser.parse(code, true, false, false);
  }

  private static ImmutableList<TokenType> types(ImmutableList<Token> tokens) {
    ImmutableList.Builder<TokenType> types = ImmutableList.builder();
    for (Token token : tokens) {
      types.add(token.getType());
    }
    return types.build();
  }

  private static JsSyntaxException parseError(String code) {
    return assertThrows(JsSyntaxException.class, () -> parse(code));
  }

  @Test
  public void testElementTokens() {
    ImmutableList<Token> tokens = parse("<a b=\"c\">t{d}</a>;");
    assertThat(types(tokens))
        .containsExactly(
            TokenType.JSX_TAG_START,
            TokenType.JSX_NAME,
            TokenType.JSX_NAME,
            TokenType.EQ,
            TokenType.STRING,
            TokenType.JSX_TAG_END,
            TokenType.JSX_TEXT,
            TokenType.BRACE_L,
            TokenType.NAME,
            TokenType.BRACE_R,
            TokenType.JSX_TAG_START,
            TokenType.SLASH,
            TokenType.JSX_NAME,
            TokenType.JSX_TAG_END,
            TokenType.SEMI)
        .inOrder();
    assertThat(tokens.get(1).getIdentifierRole()).isEqualTo(IdentifierRole.ACCESS);
    assertThat(tokens.get(2).getIdentifierRole()).isNull();
    assertThat(tokens.get(4).getValue()).isEqualTo("c");
    assertThat(tokens.get(6).getValue()).isEqualTo("t");
    assertThat(tokens.get(8).getIdentifierRole()).isEqualTo(IdentifierRole.ACCESS);
  }

  @Test
  public void testTextKeepsWhitespaceAndCharacters() {
    ImmutableList<Token> tokens = parse("<p> a > b's &amp; </p>;");
    assertThat(tokens.get(3).getType()).isEqualTo(TokenType.JSX_TEXT);
    assertThat(tokens.get(3).getValue()).isEqualTo(" a > b's &amp; ");
  }

  @Test
  public void testDashedAttributeName() {
    ImmutableList<Token> tokens = parse("<div aria-label='x'/>;");
    assertThat(tokens.get(2).getType()).isEqualTo(TokenType.JSX_NAME);
    assertThat(tokens.get(2).getValue()).isEqualTo("aria-label");
  }

  @Test
  public void testMemberAndNamespacedNames() {
    ImmutableList<Token> member = parse("<A.B/>;");
    assertThat(types(member).subList(0, 4))
        .containsExactly(
            TokenType.JSX_TAG_START, TokenType.JSX_NAME, TokenType.DOT, TokenType.JSX_NAME)
        .inOrder();
    assertThat(member.get(1).getIdentifierRole()).isEqualTo(IdentifierRole.ACCESS);

    ImmutableList<Token> namespaced = parse("<svg:g/>;");
    assertThat(namespaced.get(2).getType()).isEqualTo(TokenType.COLON);
    assertThat(namespaced.get(1).getIdentifierRole()).isNull();
  }

  @Test
  public void testFragment() {
    assertThat(types(parse("<></>;")))
        .containsExactly(
            TokenType.JSX_TAG_START,
            TokenType.JSX_TAG_END,
            TokenType.JSX_TAG_START,
            TokenType.SLASH,
            TokenType.JSX_TAG_END,
            TokenType.SEMI)
        .inOrder();
  }

  @Test
  public void testNestedElementsAndSpreads() {
    ImmutableList<Token> tokens = parse("<a {...p}><b/>{...kids}</a>;");
    assertThat(types(tokens).subList(0, 7))
        .containsExactly(
            TokenType.JSX_TAG_START,
            TokenType.JSX_NAME,
            TokenType.BRACE_L,
            TokenType.ELLIPSIS,
            TokenType.NAME,
            TokenType.BRACE_R,
            TokenType.JSX_TAG_END)
        .inOrder();
    assertThat(tokens.get(4).getIdentifierRole()).isEqualTo(IdentifierRole.ACCESS);
  }

  @Test
  public void testElementAsAttributeValue() {
    ImmutableList<Token> tokens = parse("<A icon=<I/> />;");
    assertThat(types(tokens))
        .containsExactly(
            TokenType.JSX_TAG_START,
            TokenType.JSX_NAME,
            TokenType.JSX_NAME,
            TokenType.EQ,
            TokenType.JSX_TAG_START,
            TokenType.JSX_NAME,
            TokenType.SLASH,
            TokenType.JSX_TAG_END,
            TokenType.SLASH,
            TokenType.JSX_TAG_END,
            TokenType.SEMI)
        .inOrder();
  }

  @Test
  public void testJsxInsideExpressions() {
    ImmutableList<Token> tokens = parse("const f = (x) => x ? <a/> : null;");
    assertThat(types(tokens)).contains(TokenType.JSX_TAG_START);
    assertThat(tokens.get(tokens.size() - 1).getType()).isEqualTo(TokenType.SEMI);
  }

  @Test
  public void testLessThanIsStillAnOperator() {
    ImmutableList<Token> tokens = parse("a < b;");
    assertThat(tokens.get(1).getType()).isEqualTo(TokenType.LESS_THAN);
  }

  @Test
  public void testMismatchedClosingTag() {
    assertThat(parseError("<a></b>;"))
        .hasMessageThat()
        .contains("Expected corresponding JSX closing tag for <a>");
    assertThat(parseError("<></b>;"))
        .hasMessageThat()
        .contains("Expected corresponding JSX closing tag for <>");
  }

  @Test
  public void testEmptyAttributeExpression() {
    assertThat(parseError("<a b={} />;"))
        .hasMessageThat()
        .contains("JSX attributes must only be assigned a non-empty expression");
  }

  @Test
  public void testUnterminatedContents() {
    assertThat(parseError("<a>text")).hasMessageThat().contains("Unterminated JSX contents");
  }

  @Test
  public void testJsxWithTypeScript() {
    ImmutableList<Token> tokens = Parser.parse("const e = <A/>;", true, true, false);
    assertThat(tokens.get(3).getType()).isEqualTo(TokenType.JSX_TAG_START);
  }
}
