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
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for the token annotations produced by {@link Parser}. */
@RunWith(JUnit4.class)
public final class ParserTest {

  private String code;
  private ImmutableList<Token> tokens;

  private void parse(String code) {
    this.code = code;
    this.tokens = Parser.parse(code, false, false, false);
  }

  private void parseTypeScript(String code) {
    this.code = code;
    this.tokens = Parser.parse(code, false, true, false);
  }

  private void parseFlow(String code) {
    this.code = code;
    this.tokens = Parser.parse(code, false, false, true);
  }

  /** Returns the {@code occurrence}-th (zero-based) token whose source text is {@code text}. */
  private Token token(String text, int occurrence) {
    int seen = 0;
    for (Token token : tokens) {
      if (code.substring(token.getStart(), token.getEnd()).equals(text)) {
        if (seen == occurrence) {
          return token;
        }
        seen++;
      }
    }
    throw new AssertionError("No occurrence " + occurrence + " of " + text);
  }

  private Token token(String text) {
    return token(text, 0);
  }

  private static ImmutableList<TokenType> types(List<Token> tokens) {
    ImmutableList.Builder<TokenType> types = ImmutableList.builder();
    for (Token token : tokens) {
      types.add(token.getType());
    }
    return types.build();
  }

  @Test
  public void testTokenKindsAndOffsets() {
    parse("let a = b + 1; // done");
    assertThat(types(tokens))
        .containsExactly(
            TokenType.NAME,
            TokenType.NAME,
            TokenType.EQ,
            TokenType.NAME,
            TokenType.PLUS_MIN,
            TokenType.NUM,
            TokenType.SEMI)
        .inOrder();
    assertThat(tokens.get(1).getStart()).isEqualTo(4);
    assertThat(tokens.get(1).getEnd()).isEqualTo(5);
    assertThat(tokens.get(1).getValue()).isEqualTo("a");
  }

  @Test
  public void testEmptyInputHasNoTokens() {
    parse("  /* nothing */ ");
    assertThat(tokens).isEmpty();
  }

  @Test
  public void testStringValueIsDecoded() {
    parse("f('a\\'b', \"\\u0041\");");
    assertThat(tokens.get(2).getValue()).isEqualTo("a'b");
    assertThat(tokens.get(4).getValue()).isEqualTo("A");
  }

  @Test
  public void testDeclarationRoles() {
    parse("const {a, b: c} = d; function f(x) { var y; }");
    assertThat(token("a").getIdentifierRole()).isEqualTo(IdentifierRole.BLOCK_SCOPED_DECLARATION);
    assertThat(token("b").getIdentifierRole()).isEqualTo(IdentifierRole.OBJECT_KEY);
    assertThat(token("c").getIdentifierRole()).isEqualTo(IdentifierRole.BLOCK_SCOPED_DECLARATION);
    assertThat(token("d").getIdentifierRole()).isEqualTo(IdentifierRole.ACCESS);
    assertThat(token("f").getIdentifierRole())
        .isEqualTo(IdentifierRole.FUNCTION_SCOPED_DECLARATION);
    assertThat(token("x").getIdentifierRole())
        .isEqualTo(IdentifierRole.FUNCTION_SCOPED_DECLARATION);
    assertThat(token("y").getIdentifierRole())
        .isEqualTo(IdentifierRole.FUNCTION_SCOPED_DECLARATION);
  }

  @Test
  public void testObjectLiteralRoles() {
    parse("g({a, b: 1, c() {}});");
    assertThat(token("g").getIdentifierRole()).isEqualTo(IdentifierRole.ACCESS);
    assertThat(token("a").getIdentifierRole()).isEqualTo(IdentifierRole.OBJECT_SHORTHAND);
    assertThat(token("b").getIdentifierRole()).isEqualTo(IdentifierRole.OBJECT_KEY);
    assertThat(token("c").getIdentifierRole()).isEqualTo(IdentifierRole.OBJECT_KEY);
  }

  @Test
  public void testArrowParametersAreDeclarations() {
    parse("const h = (p, q) => p;");
    assertThat(token("p", 0).getIdentifierRole())
        .isEqualTo(IdentifierRole.FUNCTION_SCOPED_DECLARATION);
    assertThat(token("q").getIdentifierRole())
        .isEqualTo(IdentifierRole.FUNCTION_SCOPED_DECLARATION);
    assertThat(token("p", 1).getIdentifierRole()).isEqualTo(IdentifierRole.ACCESS);
  }

  @Test
  public void testParenthesizedExpressionIsNotAnArrow() {
    parse("(p, q);");
    assertThat(token("p").getIdentifierRole()).isEqualTo(IdentifierRole.ACCESS);
    assertThat(token("q").getIdentifierRole()).isEqualTo(IdentifierRole.ACCESS);
  }

  @Test
  public void testImportAndExportRoles() {
    parse("import a, {b as c} from 'm'; export {c as d};");
    assertThat(token("a").getIdentifierRole()).isEqualTo(IdentifierRole.IMPORT_DECLARATION);
    assertThat(token("c", 0).getIdentifierRole()).isEqualTo(IdentifierRole.IMPORT_DECLARATION);
    assertThat(token("c", 1).getIdentifierRole()).isEqualTo(IdentifierRole.EXPORT_ACCESS);
  }

  @Test
  public void testReExportNamesAreNotLocalReferences() {
    parse("export {x} from 'm';");
    assertThat(token("x").getIdentifierRole()).isNull();
  }

  @Test
  public void testFunctionContextIds() {
    parse("function f(a) { return a; }");
    Integer contextId = token("(").getContextId();
    assertThat(contextId).isNotNull();
    assertThat(token(")").getContextId()).isEqualTo(contextId);
    assertThat(token("{").getContextId()).isEqualTo(contextId);
    assertThat(token("}").getContextId()).isEqualTo(contextId);
    assertThat(token("return").getContextId()).isNull();
  }

  @Test
  public void testNestedConstructsGetDistinctContextIds() {
    parse("f(g(1));");
    Integer outer = token("(", 0).getContextId();
    Integer inner = token("(", 1).getContextId();
    assertThat(outer).isNotNull();
    assertThat(inner).isNotNull();
    assertThat(inner).isNotEqualTo(outer);
    assertThat(token(")", 0).getContextId()).isEqualTo(inner);
    assertThat(token(")", 1).getContextId()).isEqualTo(outer);
  }

  @Test
  public void testClassAnnotations() {
    parse("class A { x = 1; m() {} }");
    Token classToken = token("class");
    Integer contextId = classToken.getContextId();
    assertThat(contextId).isNotNull();
    assertThat(classToken.isExpression()).isFalse();
    assertThat(token("{", 0).getContextId()).isEqualTo(contextId);
    assertThat(token("x").getContextId()).isEqualTo(contextId);
    assertThat(token("m").getContextId()).isEqualTo(contextId);
    assertThat(token("}", 1).getContextId()).isEqualTo(contextId);
    assertThat(token("A").getIdentifierRole())
        .isEqualTo(IdentifierRole.BLOCK_SCOPED_DECLARATION);
    // The field initializer ends before the semicolon.
    assertThat(token("=").getEndIndex()).isEqualTo(tokens.indexOf(token(";")));
  }

  @Test
  public void testClassExpression() {
    parse("const B = class extends A {};");
    assertThat(token("class").isExpression()).isTrue();
  }

  @Test
  public void testScopeDepth() {
    parse("a; function f() { b; }");
    assertThat(token("a").getScopeDepth()).isEqualTo(0);
    assertThat(token("b").getScopeDepth()).isEqualTo(1);
  }

  @Test
  public void testExportedDeclarationEnd() {
    parse("export const a = 1;\nfoo();");
    assertThat(token("export").getEndIndex()).isEqualTo(tokens.indexOf(token("foo")));
  }

  @Test
  public void testTypeScriptAnnotationsAreTypes() {
    parseTypeScript("let x: Map<string, number> = f<T>(y as any);");
    assertThat(token("x").isType()).isFalse();
    assertThat(token(":").isType()).isTrue();
    assertThat(token("Map").isType()).isTrue();
    assertThat(token("number").isType()).isTrue();
    assertThat(token("=").isType()).isFalse();
    assertThat(token("f").isType()).isFalse();
    assertThat(token("T").isType()).isTrue();
    assertThat(token("y").isType()).isFalse();
    assertThat(token("as").isType()).isTrue();
    assertThat(token("any").isType()).isTrue();
  }

  @Test
  public void testTypeScriptDeclarationsAreTypes() {
    parseTypeScript("interface I { a: string }\ntype T = I | null;\nconst z = 1;");
    for (Token token : tokens.subList(0, tokens.indexOf(token("const")))) {
      assertThat(token.isType()).isTrue();
    }
    assertThat(token("z").isType()).isFalse();
  }

  @Test
  public void testTypeScriptParameterModifiersAreTypes() {
    parseTypeScript("class A { constructor(private readonly x: number) {} }");
    assertThat(token("private").isType()).isTrue();
    assertThat(token("readonly").isType()).isTrue();
    assertThat(token("x").isType()).isFalse();
  }

  @Test
  public void testFlowAnnotationsAreTypes() {
    parseFlow("function f(a: ?string): void {}");
    assertThat(token("a").isType()).isFalse();
    assertThat(token("?").isType()).isTrue();
    assertThat(token("string").isType()).isTrue();
    assertThat(token("void").isType()).isTrue();
  }

  @Test
  public void testTypeScriptEnumIsRejected() {
    JsSyntaxException e =
        assertThrows(
            JsSyntaxException.class, () -> Parser.parse("enum E { A }", false, true, false));
    assertThat(e).hasMessageThat().contains("TypeScript enums are not supported");
  }

  @Test
  public void testPrivateNamesAreRejected() {
    JsSyntaxException e =
        assertThrows(
            JsSyntaxException.class,
            () -> Parser.parse("class A { #x = 1; }", false, false, false));
    assertThat(e).hasMessageThat().contains("Private class members are not supported");
  }

  @Test
  public void testSyntaxErrorPosition() {
    JsSyntaxException e =
        assertThrows(
            JsSyntaxException.class, () -> Parser.parse("a;\n  'open", false, false, false));
    assertThat(e.getOffset()).isEqualTo(5);
    assertThat(e.getLineNumber()).isEqualTo(2);
    assertThat(e.getColumnNumber()).isEqualTo(2);
    assertThat(e).hasMessageThat().contains("Unterminated string constant");
  }

  @Test
  public void testCodePointEscape() {
    parse("x = '\\u{1F600}';");
    assertThat(tokens.get(2).getValue()).isEqualTo(new String(Character.toChars(0x1F600)));
  }

  @Test
  public void testBadCharacterEscapes() {
    JsSyntaxException e =
        assertThrows(
            JsSyntaxException.class, () -> Parser.parse("x = '\\u{110000}';", false, false, false));
    assertThat(e).hasMessageThat().contains("Bad character escape sequence");
    assertThat(e.getOffset()).isEqualTo(5);

    for (String code :
        ImmutableList.of(
            "x = '\\u{-1}';",
            "x = '\\u+041';",
            "x = '\\u{}';",
            "x = '\\u12';",
            "x = '\\x4';",
            "x = '\\u{FFFFFFFFF}';",
            "\\u{110000}x;")) {
      assertThrows(code, JsSyntaxException.class, () -> Parser.parse(code, false, false, false));
    }
  }
}
