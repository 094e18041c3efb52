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

import static com.google.javascript.jstrip.parsing.TokenType.BITWISE_AND;
import static com.google.javascript.jstrip.parsing.TokenType.BITWISE_OR;
import static com.google.javascript.jstrip.parsing.TokenType.BRACE_BAR_L;
import static com.google.javascript.jstrip.parsing.TokenType.BRACE_BAR_R;
import static com.google.javascript.jstrip.parsing.TokenType.BRACE_L;
import static com.google.javascript.jstrip.parsing.TokenType.BRACE_R;
import static com.google.javascript.jstrip.parsing.TokenType.BRACKET_L;
import static com.google.javascript.jstrip.parsing.TokenType.BRACKET_R;
import static com.google.javascript.jstrip.parsing.TokenType.COLON;
import static com.google.javascript.jstrip.parsing.TokenType.COMMA;
import static com.google.javascript.jstrip.parsing.TokenType.DOT;
import static com.google.javascript.jstrip.parsing.TokenType.EQ;
import static com.google.javascript.jstrip.parsing.TokenType.EXTENDS;
import static com.google.javascript.jstrip.parsing.TokenType.GREATER_THAN;
import static com.google.javascript.jstrip.parsing.TokenType.LESS_THAN;
import static com.google.javascript.jstrip.parsing.TokenType.NAME;
import static com.google.javascript.jstrip.parsing.TokenType.PAREN_L;
import static com.google.javascript.jstrip.parsing.TokenType.PAREN_R;
import static com.google.javascript.jstrip.parsing.TokenType.QUESTION;
import static com.google.javascript.jstrip.parsing.TokenType.SEMI;

import com.google.common.collect.ImmutableSet;

/**
 * Parses TypeScript and Flow type syntax. Everything consumed here ends up as type tokens, so the
 * parser only has to find where each type ends, not what it means.
 *
 * <p>The {@code parse*} methods expect the caller to be in a type context already. The
 * short-named entry points ({@link #typeAnnotation()}, {@link #typeArguments()}, ...) enter one.
 */
final class TypeParser {
  private static final ImmutableSet<String> TYPE_OPERATORS =
      ImmutableSet.of("keyof", "unique", "readonly", "infer");

  private static final ImmutableSet<TokenType> TYPE_STARTS =
      ImmutableSet.of(
          NAME,
          TokenType.STRING,
          TokenType.NUM,
          BRACE_L,
          BRACE_BAR_L,
          BRACKET_L,
          PAREN_L,
          LESS_THAN,
          TokenType.THIS,
          TokenType.VOID,
          TokenType.NULL,
          TokenType.TRUE,
          TokenType.FALSE,
          TokenType.TYPEOF,
          TokenType.NEW,
          TokenType.IMPORT,
          TokenType.BACK_QUOTE,
          TokenType.PLUS_MIN,
          TokenType.STAR,
          QUESTION,
          BITWISE_OR,
          BITWISE_AND);

  private final ScanState state;
  private final Parser parser;

  TypeParser(ScanState state, Parser parser) {
    this.state = state;
    this.parser = parser;
  }

  void typeAnnotation() {
    parser.tokenizer.runInTypeContext(this::parseTypeAnnotation);
  }

  void returnType() {
    parser.tokenizer.runInTypeContext(this::parseReturnType);
  }

  void type() {
    parser.tokenizer.runInTypeContext(this::parseType);
  }

  void typeArguments() {
    parser.tokenizer.runInTypeContext(this::parseTypeArguments);
  }

  void typeParameters() {
    parser.tokenizer.runInTypeContext(this::parseTypeParameters);
  }

  void parseTypeAnnotation() {
    parser.tokenizer.expect(COLON);
    parseType();
  }

  void parseReturnType() {
    parser.tokenizer.expect(COLON);
    parseTypeOrTypePredicate();
  }

  private void parseTypeOrTypePredicate() {
    Tokenizer tokenizer = parser.tokenizer;
    if (tokenizer.isContextual("asserts")) {
      Token next = tokenizer.lookahead();
      if ((next.getType() == NAME || next.getType() == TokenType.THIS)
          && !tokenizer.hasLineBreakBefore(next)) {
        tokenizer.next();
        tokenizer.next();
        if (tokenizer.eatContextual("is")) {
          parseType();
        }
        return;
      }
    }
    if (tokenizer.match(NAME) || tokenizer.match(TokenType.THIS)) {
      Token next = tokenizer.lookahead();
      if (next.getType() == NAME
          && "is".equals(next.getValue())
          && !tokenizer.hasLineBreakBefore(next)) {
        tokenizer.next();
        tokenizer.next();
        parseType();
        return;
      }
    }
    parseType();
    if (state.isFlow && tokenizer.match(TokenType.MODULO)) {
      tokenizer.next();
      tokenizer.expectContextual("checks");
    }
  }

  void parseType() {
    Tokenizer tokenizer = parser.tokenizer;
    parseNonConditionalType();
    if (state.isTypeScript && tokenizer.match(EXTENDS) && !tokenizer.hasPrecedingLineBreak()) {
      tokenizer.next();
      parseNonConditionalType();
      tokenizer.expect(QUESTION);
      parseType();
      tokenizer.expect(COLON);
      parseType();
    }
  }

  private void parseNonConditionalType() {
    Tokenizer tokenizer = parser.tokenizer;
    if (tokenizer.match(LESS_THAN)) {
      parseTypeParameters();
      parseFunctionTypeRest();
      return;
    }
    if (tokenizer.isContextual("abstract") && tokenizer.lookahead().getType() == TokenType.NEW) {
      tokenizer.next();
    }
    if (tokenizer.eat(TokenType.NEW)) {
      if (tokenizer.match(LESS_THAN)) {
        parseTypeParameters();
      }
      parseFunctionTypeRest();
      return;
    }
    tokenizer.eat(BITWISE_OR);
    tokenizer.eat(BITWISE_AND);
    do {
      parseTypeOperator();
    } while (tokenizer.eat(BITWISE_OR) || tokenizer.eat(BITWISE_AND));
  }

  private void parseFunctionTypeRest() {
    if (!parser.tokenizer.match(PAREN_L)) {
      throw parser.tokenizer.unexpected();
    }
    skipBalanced();
    parser.tokenizer.expect(TokenType.ARROW);
    parseTypeOrTypePredicate();
  }

  private void parseTypeOperator() {
    Tokenizer tokenizer = parser.tokenizer;
    if (state.isTypeScript && state.type == NAME && TYPE_OPERATORS.contains(state.value)) {
      Token next = tokenizer.lookahead();
      if (TYPE_STARTS.contains(next.getType()) && next.getType() != QUESTION) {
        boolean isInfer = "infer".equals(state.value);
        tokenizer.next();
        if (isInfer) {
          tokenizer.expect(NAME);
        } else {
          parseTypeOperator();
        }
        return;
      }
    }
    if (state.isFlow && tokenizer.eat(QUESTION)) {
      parseTypeOperator();
      return;
    }
    parsePrimaryType();
    while (tokenizer.match(BRACKET_L) && !tokenizer.hasPrecedingLineBreak()) {
      tokenizer.next();
      if (!tokenizer.match(BRACKET_R)) {
        parseType();
      }
      tokenizer.expect(BRACKET_R);
    }
  }

  private void parsePrimaryType() {
    Tokenizer tokenizer = parser.tokenizer;
    switch (state.type) {
      case NAME:
        tokenizer.next();
        parseQualifiedNameRest();
        parseOptionalTypeArguments();
        return;
      case THIS:
      case VOID:
      case NULL:
      case TRUE:
      case FALSE:
      case STRING:
      case NUM:
      case STAR:
        tokenizer.next();
        return;
      case PLUS_MIN:
        tokenizer.next();
        tokenizer.expect(TokenType.NUM);
        return;
      case TYPEOF:
        tokenizer.next();
        if (tokenizer.match(TokenType.IMPORT)) {
          parseImportType();
        } else {
          tokenizer.nextAsName();
          parseQualifiedNameRest();
          parseOptionalTypeArguments();
        }
        return;
      case IMPORT:
        parseImportType();
        return;
      case BACK_QUOTE:
        parser.expressions.parseTemplate(true);
        return;
      case PAREN_L:
        skipBalanced();
        if (tokenizer.eat(TokenType.ARROW)) {
          parseTypeOrTypePredicate();
        }
        return;
      case BRACE_L:
      case BRACE_BAR_L:
      case BRACKET_L:
        skipBalanced();
        return;
      default:
        throw tokenizer.unexpected();
    }
  }

  private void parseImportType() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expect(TokenType.IMPORT);
    if (!tokenizer.match(PAREN_L)) {
      throw tokenizer.unexpected();
    }
    skipBalanced();
    parseQualifiedNameRest();
    parseOptionalTypeArguments();
  }

  private void parseQualifiedNameRest() {
    while (parser.tokenizer.eat(DOT)) {
      parser.tokenizer.nextAsName();
    }
  }

  private void parseOptionalTypeArguments() {
    if (parser.tokenizer.match(LESS_THAN) && !parser.tokenizer.hasPrecedingLineBreak()) {
      parseTypeArguments();
    }
  }

  void parseTypeArguments() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expect(LESS_THAN);
    while (!tokenizer.eat(GREATER_THAN)) {
      parseType();
      if (!tokenizer.match(GREATER_THAN)) {
        tokenizer.expect(COMMA);
      }
    }
  }

  void parseTypeParameters() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expect(LESS_THAN);
    while (!tokenizer.eat(GREATER_THAN)) {
      if (state.isFlow && tokenizer.match(TokenType.PLUS_MIN)) {
        tokenizer.next();
      }
      while (tokenizer.isContextual("in")
          || tokenizer.isContextual("out")
          || tokenizer.match(TokenType.CONST)
          || tokenizer.match(TokenType.IN)) {
        if (tokenizer.lookahead().getType() != NAME) {
          break;
        }
        tokenizer.next();
      }
      tokenizer.nextAsName();
      if (tokenizer.eat(EXTENDS) || (state.isFlow && tokenizer.eat(COLON))) {
        parseType();
      }
      if (tokenizer.eat(EQ)) {
        parseType();
      }
      if (!tokenizer.match(GREATER_THAN)) {
        tokenizer.expect(COMMA);
      }
    }
  }

  /**
   * Consumes a bracketed group (parentheses, brackets or braces) together with everything nested
   * in it. The current token must be the opener.
   */
  void skipBalanced() {
    Tokenizer tokenizer = parser.tokenizer;
    int depth = 0;
    do {
      switch (state.type) {
        case EOF:
          throw tokenizer.unexpected();
        case BACK_QUOTE:
          parser.expressions.parseTemplate(true);
          continue;
        case BRACE_L:
        case BRACE_BAR_L:
        case BRACKET_L:
        case PAREN_L:
          depth++;
          break;
        case BRACE_R:
        case BRACE_BAR_R:
        case BRACKET_R:
        case PAREN_R:
          depth--;
          break;
        default:
          break;
      }
      tokenizer.next();
    } while (depth > 0);
  }

  /**
   * Parses a type-only statement (a type alias, an interface, a {@code declare} form, an abstract
   * class header) if one starts at the current name.
   *
   * @return whether a statement was consumed
   */
  boolean tryParseTypeDeclaration() {
    if (!state.hasTypes() || state.type != NAME) {
      return false;
    }
    Tokenizer tokenizer = parser.tokenizer;
    String word = state.value;
    Token next = tokenizer.lookahead();
    if (tokenizer.hasLineBreakBefore(next)) {
      return false;
    }
    TokenType nextType = next.getType();
    switch (word) {
      case "type":
        if (nextType == NAME) {
          tokenizer.runInTypeContext(this::parseTypeAlias);
          return true;
        }
        return false;
      case "opaque":
        if (state.isFlow && nextType == NAME && "type".equals(next.getValue())) {
          tokenizer.runInTypeContext(
              () -> {
                tokenizer.next();
                parseTypeAlias();
              });
          return true;
        }
        return false;
      case "interface":
        if (nextType == NAME) {
          tokenizer.runInTypeContext(this::parseInterface);
          return true;
        }
        return false;
      case "declare":
        if (nextType == NAME || nextType.isKeyword()) {
          tokenizer.runInTypeContext(
              () -> {
                tokenizer.next();
                parser.statements.parseStatement();
              });
          return true;
        }
        return false;
      case "abstract":
        if (state.isTypeScript && nextType == TokenType.CLASS) {
          tokenizer.runInTypeContext(tokenizer::next);
          parser.statements.parseClass(true);
          return true;
        }
        return false;
      case "enum":
        if (state.isTypeScript && nextType == NAME) {
          if (!state.isType) {
            throw tokenizer.raise(state.start, "TypeScript enums are not supported");
          }
          tokenizer.next();
          tokenizer.next();
          skipBalanced();
          return true;
        }
        return false;
      case "namespace":
      case "module":
        if (state.isTypeScript && (nextType == NAME || nextType == TokenType.STRING)) {
          if (!state.isType) {
            throw tokenizer.raise(state.start, "TypeScript namespaces are not supported");
          }
          tokenizer.next();
          tokenizer.next();
          parseQualifiedNameRest();
          if (tokenizer.match(BRACE_L)) {
            skipBalanced();
          } else {
            tokenizer.semicolon();
          }
          return true;
        }
        return false;
      case "global":
        if (state.isType && nextType == BRACE_L) {
          tokenizer.next();
          skipBalanced();
          return true;
        }
        return false;
      default:
        return false;
    }
  }

  private void parseTypeAlias() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expectContextual("type");
    tokenizer.expect(NAME);
    if (tokenizer.match(LESS_THAN)) {
      parseTypeParameters();
    }
    if (state.isFlow && tokenizer.eat(COLON)) {
      parseType();
    }
    if (tokenizer.eat(EQ)) {
      parseType();
    }
    tokenizer.semicolon();
  }

  private void parseInterface() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expectContextual("interface");
    tokenizer.expect(NAME);
    if (tokenizer.match(LESS_THAN)) {
      parseTypeParameters();
    }
    if (tokenizer.eat(EXTENDS)) {
      do {
        parseType();
      } while (tokenizer.eat(COMMA));
    }
    if (!tokenizer.match(BRACE_L) && !tokenizer.match(BRACE_BAR_L)) {
      throw tokenizer.unexpected();
    }
    skipBalanced();
  }

  /**
   * Parses a TypeScript index signature class member such as {@code [key: string]: number;} if
   * one starts at the current bracket.
   */
  boolean tryParseIndexSignature() {
    Tokenizer tokenizer = parser.tokenizer;
    ScanState.Snapshot snapshot = state.snapshot();
    tokenizer.next();
    boolean isIndexSignature = false;
    if (tokenizer.match(NAME)) {
      tokenizer.next();
      isIndexSignature = tokenizer.match(COLON);
    }
    state.restore(snapshot);
    if (!isIndexSignature) {
      return false;
    }
    tokenizer.runInTypeContext(
        () -> {
          skipBalanced();
          if (tokenizer.match(COLON)) {
            parseTypeAnnotation();
          }
          tokenizer.eat(SEMI);
        });
    return true;
  }
}
