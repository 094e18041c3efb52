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

import static com.google.javascript.jstrip.parsing.TokenType.COLON;
import static com.google.javascript.jstrip.parsing.TokenType.COMMA;
import static com.google.javascript.jstrip.parsing.TokenType.ELLIPSIS;
import static com.google.javascript.jstrip.parsing.TokenType.EQ;
import static com.google.javascript.jstrip.parsing.TokenType.QUESTION;

import com.google.common.collect.ImmutableSet;

/**
 * Parses binding patterns: declared names, array and object destructuring, rest elements and
 * defaults. Every bound name is tagged with a block-scoped or function-scoped declaration role.
 */
final class LvalParser {
  private static final ImmutableSet<String> PARAMETER_MODIFIERS =
      ImmutableSet.of("public", "private", "protected", "readonly", "override");

  private final ScanState state;
  private final Parser parser;

  LvalParser(ScanState state, Parser parser) {
    this.state = state;
    this.parser = parser;
  }

  void parseSpread() {
    parser.tokenizer.next();
    parser.expressions.parseMaybeAssign();
  }

  void parseRest(boolean isBlockScope) {
    parser.tokenizer.next();
    parseBindingAtom(isBlockScope);
  }

  void parseBindingAtom(boolean isBlockScope) {
    Tokenizer tokenizer = parser.tokenizer;
    switch (state.type) {
      case THIS:
        if (!state.hasTypes()) {
          throw tokenizer.unexpected();
        }
        // A declared type for "this" is written as the first parameter and erased with it.
        tokenizer.runInTypeContext(tokenizer::next);
        return;
      case NAME:
        tokenizer.next();
        state
            .lastToken()
            .setIdentifierRole(
                isBlockScope
                    ? IdentifierRole.BLOCK_SCOPED_DECLARATION
                    : IdentifierRole.FUNCTION_SCOPED_DECLARATION);
        return;
      case BRACKET_L:
        tokenizer.next();
        parseBindingList(TokenType.BRACKET_R, isBlockScope, true, false);
        return;
      case BRACE_L:
        parser.expressions.parseObj(true, isBlockScope);
        return;
      default:
        throw tokenizer.unexpected();
    }
  }

  /**
   * Parses a comma-separated list of bindings up to and including {@code close}.
   *
   * @param allowEmpty whether elided items such as {@code [, b]} are allowed
   * @param allowModifiers whether TypeScript parameter properties are allowed
   */
  void parseBindingList(
      TokenType close, boolean isBlockScope, boolean allowEmpty, boolean allowModifiers) {
    Tokenizer tokenizer = parser.tokenizer;
    boolean first = true;
    boolean hasRemovedComma = false;
    boolean firstItemIsThis = false;

    while (!tokenizer.eat(close)) {
      if (first) {
        first = false;
        firstItemIsThis = state.hasTypes() && state.type == TokenType.THIS;
      } else {
        tokenizer.expect(COMMA);
        // The comma after an erased "this" parameter has to go too.
        if (!hasRemovedComma && firstItemIsThis) {
          state.lastToken().setType(true);
          hasRemovedComma = true;
        }
      }
      if (allowEmpty && tokenizer.match(COMMA)) {
        continue;
      }
      if (tokenizer.eat(close)) {
        break;
      }
      if (tokenizer.match(ELLIPSIS)) {
        parseRest(isBlockScope);
        parseAssignableListItemTypes();
        tokenizer.expect(close);
        break;
      }
      parseAssignableListItem(allowModifiers, isBlockScope);
    }
  }

  private void parseAssignableListItem(boolean allowModifiers, boolean isBlockScope) {
    if (allowModifiers) {
      parseParameterModifiers();
    }
    parseMaybeDefault(isBlockScope, false);
    parseAssignableListItemTypes();
    parseMaybeDefault(isBlockScope, true);
  }

  private void parseParameterModifiers() {
    Tokenizer tokenizer = parser.tokenizer;
    while (state.isTypeScript
        && state.type == TokenType.NAME
        && PARAMETER_MODIFIERS.contains(state.value)) {
      TokenType following = tokenizer.lookahead().getType();
      if (following != TokenType.NAME
          && following != TokenType.BRACE_L
          && following != TokenType.BRACKET_L) {
        return;
      }
      tokenizer.runInTypeContext(tokenizer::next);
    }
  }

  /** Parses the optional marker and type annotation of a parameter. */
  void parseAssignableListItemTypes() {
    if (!state.hasTypes()) {
      return;
    }
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.runInTypeContext(
        () -> {
          tokenizer.eat(QUESTION);
          if (tokenizer.match(COLON)) {
            parser.types.parseTypeAnnotation();
          }
        });
  }

  void parseMaybeDefault(boolean isBlockScope, boolean leftAlreadyParsed) {
    if (!leftAlreadyParsed) {
      parseBindingAtom(isBlockScope);
    }
    if (parser.tokenizer.eat(EQ)) {
      parser.expressions.parseMaybeAssign();
    }
  }
}
