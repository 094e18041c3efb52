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

import com.google.javascript.jstrip.parsing.Parser;
import com.google.javascript.jstrip.parsing.TokenType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link TokenProcessor}. */
@RunWith(JUnit4.class)
public final class TokenProcessorTest {

  private static TokenProcessor forCode(String code) {
    return new TokenProcessor(code, Parser.parse(code, false, false, false));
  }

  @Test
  public void testCopyReplaceAndRemove() {
    TokenProcessor tokens = forCode("a  + /* c */ b;\n// end");
    tokens.copyToken();
    tokens.replaceToken("-");
    tokens.removeToken();
    tokens.copyExpectedToken(TokenType.SEMI);
    assertThat(tokens.finish()).isEqualTo("a  -;\n// end");
  }

  @Test
  public void testRemoveTokenKeepsLineBreaks() {
    TokenProcessor tokens = forCode("a\n\n  b;");
    tokens.copyToken();
    tokens.removeToken();
    tokens.copyToken();
    assertThat(tokens.finish()).isEqualTo("a\n\n;");
  }

  @Test
  public void testRemoveInitialTokenKeepsWhitespace() {
    TokenProcessor tokens = forCode("a  +b;");
    tokens.copyToken();
    tokens.removeInitialToken();
    tokens.copyToken();
    tokens.copyToken();
    assertThat(tokens.finish()).isEqualTo("a  b;");
  }

  @Test
  public void testMatches() {
    TokenProcessor tokens = forCode("async (x);");
    assertThat(tokens.matches(TokenType.NAME, TokenType.PAREN_L)).isTrue();
    assertThat(tokens.matches(TokenType.PAREN_L)).isFalse();
    assertThat(tokens.matchesContextual("async")).isTrue();
    assertThat(tokens.matchesAtIndex(3, TokenType.PAREN_R, TokenType.SEMI)).isTrue();
    assertThat(tokens.matchesAtIndex(4, TokenType.SEMI, TokenType.SEMI)).isFalse();
    assertThat(tokens.matchesAtIndex(-1, TokenType.NAME)).isFalse();
  }

  @Test
  public void testSnapshotRestore() {
    TokenProcessor tokens = forCode("a + b;");
    tokens.copyToken();
    TokenProcessor.Snapshot snapshot = tokens.snapshot();
    tokens.copyToken();
    tokens.appendCode("junk");
    tokens.restoreToSnapshot(snapshot);
    assertThat(tokens.currentIndex()).isEqualTo(1);
    tokens.replaceToken("*");
    tokens.copyToken();
    tokens.copyToken();
    assertThat(tokens.finish()).isEqualTo("a * b;");
  }

  @Test
  public void testCodeInsertedSinceIndex() {
    TokenProcessor tokens = forCode("a;");
    int start = tokens.getResultCodeIndex();
    tokens.copyToken();
    tokens.appendCode(" = 1");
    assertThat(tokens.getCodeInsertedSinceIndex(start)).isEqualTo("a = 1");
  }

  @Test
  public void testFinishRequiresAllTokens() {
    TokenProcessor tokens = forCode("a;");
    tokens.copyToken();
    assertThrows(IllegalStateException.class, tokens::finish);
  }

  @Test
  public void testCopyExpectedTokenChecksKind() {
    TokenProcessor tokens = forCode("a;");
    assertThrows(IllegalStateException.class, () -> tokens.copyExpectedToken(TokenType.SEMI));
  }
}
