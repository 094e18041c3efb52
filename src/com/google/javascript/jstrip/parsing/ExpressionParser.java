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

import static com.google.javascript.jstrip.parsing.TokenType.ARROW;
import static com.google.javascript.jstrip.parsing.TokenType.BACK_QUOTE;
import static com.google.javascript.jstrip.parsing.TokenType.BRACE_L;
import static com.google.javascript.jstrip.parsing.TokenType.BRACE_R;
import static com.google.javascript.jstrip.parsing.TokenType.BRACKET_L;
import static com.google.javascript.jstrip.parsing.TokenType.BRACKET_R;
import static com.google.javascript.jstrip.parsing.TokenType.COLON;
import static com.google.javascript.jstrip.parsing.TokenType.COMMA;
import static com.google.javascript.jstrip.parsing.TokenType.DOT;
import static com.google.javascript.jstrip.parsing.TokenType.ELLIPSIS;
import static com.google.javascript.jstrip.parsing.TokenType.EQ;
import static com.google.javascript.jstrip.parsing.TokenType.LESS_THAN;
import static com.google.javascript.jstrip.parsing.TokenType.NAME;
import static com.google.javascript.jstrip.parsing.TokenType.PAREN_L;
import static com.google.javascript.jstrip.parsing.TokenType.PAREN_R;
import static com.google.javascript.jstrip.parsing.TokenType.QUESTION;
import static com.google.javascript.jstrip.parsing.TokenType.STAR;

import com.google.common.collect.ImmutableSet;

/**
 * Parses expressions. Nothing is built; the parse only decides where each construct ends and
 * tags tokens (identifier roles, context ids, type regions) on the way.
 *
 * <p>Methods that may consume an arrow function return whether they did, so callers know the
 * expression is complete.
 */
final class ExpressionParser {
  private static final ImmutableSet<TokenType> PREFIX_OPERATORS =
      ImmutableSet.of(
          TokenType.BANG,
          TokenType.TILDE,
          TokenType.INC_DEC,
          TokenType.PLUS_MIN,
          TokenType.TYPEOF,
          TokenType.VOID,
          TokenType.DELETE);

  /** Tokens that make a top-level {@code await} an operator rather than an identifier. */
  private static final ImmutableSet<TokenType> AWAIT_OPERANDS =
      ImmutableSet.of(
          NAME,
          TokenType.NUM,
          TokenType.STRING,
          TokenType.THIS,
          TokenType.SUPER,
          TokenType.NEW,
          TokenType.FUNCTION,
          TokenType.CLASS,
          TokenType.IMPORT,
          TokenType.NULL,
          TokenType.TRUE,
          TokenType.FALSE,
          BRACKET_L,
          BACK_QUOTE);

  private final ScanState state;
  private final Parser parser;

  ExpressionParser(ScanState state, Parser parser) {
    this.state = state;
    this.parser = parser;
  }

  void parseExpression() {
    parseExpression(false);
  }

  /** Parses a comma-separated expression. {@code noIn} is set inside a for-loop head. */
  void parseExpression(boolean noIn) {
    parseMaybeAssign(noIn);
    while (parser.tokenizer.eat(COMMA)) {
      parseMaybeAssign(noIn);
    }
  }

  void parseMaybeAssign() {
    parseMaybeAssign(false);
  }

  void parseMaybeAssign(boolean noIn) {
    if (state.inGenerator && parser.tokenizer.isContextual("yield")) {
      parseYield(noIn);
      return;
    }
    if (parser.tokenizer.match(LESS_THAN) && (state.isJsx || state.hasTypes())) {
      parseMaybeAngleBracketStart(noIn);
      return;
    }
    parseMaybeAssignTail(noIn);
  }

  private void parseMaybeAssignTail(boolean noIn) {
    if (parseMaybeConditional(noIn)) {
      return;
    }
    if (state.type == EQ || state.type == TokenType.ASSIGN) {
      parser.tokenizer.next();
      parseMaybeAssign(noIn);
    }
  }

  /**
   * A leading {@code <} is either a JSX element, a generic arrow function or (in TypeScript
   * without JSX) a type assertion. JSX wins when it parses.
   */
  private void parseMaybeAngleBracketStart(boolean noIn) {
    Tokenizer tokenizer = parser.tokenizer;
    if (!state.isJsx) {
      if (!tokenizer.tryParse(this::parseGenericArrow)) {
        parseMaybeAssignTail(noIn);
      }
      return;
    }
    if (!state.hasTypes()) {
      parseMaybeAssignTail(noIn);
      return;
    }
    ScanState.Snapshot snapshot = state.snapshot();
    try {
      parseMaybeAssignTail(noIn);
    } catch (JsSyntaxException jsxError) {
      state.restore(snapshot);
      try {
        parseGenericArrow();
      } catch (JsSyntaxException arrowError) {
        jsxError.addSuppressed(arrowError);
        throw jsxError;
      }
    }
  }

  private void parseGenericArrow() {
    parser.types.typeParameters();
    if (!parser.tokenizer.match(PAREN_L)) {
      throw parser.tokenizer.unexpected();
    }
    if (!parseParenAndDistinguish()) {
      throw parser.tokenizer.raise(state.start, "Expected an arrow function after type parameters");
    }
  }

  private void parseYield(boolean noIn) {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.next();
    if (tokenizer.hasPrecedingLineBreak()) {
      return;
    }
    boolean isDelegating = tokenizer.eat(STAR);
    if (isDelegating || state.type.startsExpression() || isRegexpStart()) {
      parseMaybeAssign(noIn);
    }
  }

  private boolean parseMaybeConditional(boolean noIn) {
    if (parseExprOps(noIn)) {
      return true;
    }
    Tokenizer tokenizer = parser.tokenizer;
    if (!tokenizer.match(QUESTION)) {
      return false;
    }
    if (state.hasTypes()) {
      // "x?" as an optional parameter or property marker.
      TokenType next = tokenizer.lookahead().getType();
      if (next == COLON || next == COMMA || next == PAREN_R || next == EQ) {
        tokenizer.runInTypeContext(tokenizer::next);
        return false;
      }
    }
    tokenizer.next();
    parseMaybeAssign(false);
    tokenizer.expect(COLON);
    parseMaybeAssign(noIn);
    return false;
  }

  private boolean parseExprOps(boolean noIn) {
    if (parseMaybeUnary()) {
      return true;
    }
    Tokenizer tokenizer = parser.tokenizer;
    while (true) {
      if (state.isTypeScript
          && (tokenizer.isContextual("as") || tokenizer.isContextual("satisfies"))
          && !tokenizer.hasPrecedingLineBreak()) {
        tokenizer.runInTypeContext(
            () -> {
              tokenizer.next();
              if (!tokenizer.eat(TokenType.CONST)) {
                parser.types.parseType();
              }
            });
        continue;
      }
      if (state.type.isBinaryOperator() && !(noIn && state.type == TokenType.IN)) {
        tokenizer.next();
        parseMaybeUnary();
        continue;
      }
      return false;
    }
  }

  private boolean parseMaybeUnary() {
    Tokenizer tokenizer = parser.tokenizer;
    if (state.isTypeScript && !state.isJsx && tokenizer.match(LESS_THAN)) {
      // Old-style type assertion: <T>x
      parser.types.typeArguments();
      parseMaybeUnary();
      return false;
    }
    if (tokenizer.isContextual("await") && isAwaitExpression()) {
      tokenizer.next();
      parseMaybeUnary();
      return false;
    }
    if (PREFIX_OPERATORS.contains(state.type)) {
      tokenizer.next();
      parseMaybeUnary();
      return false;
    }
    if (parseExprSubscripts()) {
      return true;
    }
    while (tokenizer.match(TokenType.INC_DEC) && !tokenizer.hasPrecedingLineBreak()) {
      tokenizer.next();
    }
    return false;
  }

  private boolean isAwaitExpression() {
    if (state.inAsync) {
      return true;
    }
    if (state.scopeDepth > 0) {
      return false;
    }
    Token next = parser.tokenizer.lookahead();
    return !parser.tokenizer.hasLineBreakBefore(next) && AWAIT_OPERANDS.contains(next.getType());
  }

  boolean parseExprSubscripts() {
    int startIndex = state.tokens.size();
    if (parseExprAtom()) {
      return true;
    }
    return parseSubscripts(startIndex, false);
  }

  /**
   * Parses member accesses, calls and tagged templates following an atom that starts at token
   * {@code startIndex}.
   *
   * @param noCalls whether to stop at a call, as in the callee of {@code new}
   * @return whether an async arrow function was parsed instead
   */
  private boolean parseSubscripts(int startIndex, boolean noCalls) {
    Tokenizer tokenizer = parser.tokenizer;
    while (true) {
      if (state.isTypeScript
          && tokenizer.match(TokenType.BANG)
          && !tokenizer.hasPrecedingLineBreak()) {
        tokenizer.runInTypeContext(tokenizer::next);
      } else if (tokenizer.match(TokenType.QUESTION_DOT)) {
        tokenizer.next();
        if (tokenizer.match(PAREN_L)) {
          parseCallArguments();
        } else if (tokenizer.match(BRACKET_L)) {
          parseIndex();
        } else if (tokenizer.match(LESS_THAN) && state.hasTypes()) {
          parser.types.typeArguments();
          parseCallArguments();
        } else {
          parseMemberName();
        }
      } else if (tokenizer.eat(DOT)) {
        parseMemberName();
      } else if (tokenizer.match(BRACKET_L)) {
        parseIndex();
      } else if (!noCalls && tokenizer.match(PAREN_L)) {
        boolean maybeAsyncArrow =
            state.tokens.size() == startIndex + 1
                && state.tokens.get(startIndex).getType() == NAME
                && "async".equals(state.tokens.get(startIndex).getValue())
                && !tokenizer.hasPrecedingLineBreak();
        parseCallArguments();
        if (maybeAsyncArrow && parseArrowHead()) {
          state.tokens.get(startIndex).setIdentifierRole(null);
          markPriorBindingIdentifiers(startIndex + 1);
          parseArrowExpression(true);
          return true;
        }
      } else if (tokenizer.match(BACK_QUOTE)) {
        parseTemplate(false);
      } else if (state.hasTypes() && tokenizer.match(LESS_THAN)) {
        if (!tryParseGenericCall(noCalls)) {
          return false;
        }
        if (noCalls && tokenizer.match(PAREN_L)) {
          return false;
        }
      } else {
        return false;
      }
    }
  }

  /** Parses {@code f<T>(...)} or {@code f<T>`...`} if the angle brackets hold type arguments. */
  private boolean tryParseGenericCall(boolean noCalls) {
    Tokenizer tokenizer = parser.tokenizer;
    ScanState.Snapshot snapshot = state.snapshot();
    if (!tokenizer.tryParse(parser.types::typeArguments)) {
      return false;
    }
    if (tokenizer.match(PAREN_L)) {
      if (!noCalls) {
        parseCallArguments();
      }
      return true;
    }
    if (tokenizer.match(BACK_QUOTE)) {
      parseTemplate(false);
      return true;
    }
    state.restore(snapshot);
    return false;
  }

  private void parseIndex() {
    parser.tokenizer.expect(BRACKET_L);
    parseExpression();
    parser.tokenizer.expect(BRACKET_R);
  }

  private void parseMemberName() {
    if (parser.tokenizer.match(TokenType.HASH)) {
      throw parser.tokenizer.raise(state.start, "Private class members are not supported");
    }
    parser.tokenizer.nextAsName();
  }

  void parseCallArguments() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expect(PAREN_L);
    state.openContext();
    boolean first = true;
    while (!tokenizer.eat(PAREN_R)) {
      if (first) {
        first = false;
      } else {
        tokenizer.expect(COMMA);
        if (tokenizer.eat(PAREN_R)) {
          break;
        }
      }
      if (tokenizer.match(ELLIPSIS)) {
        parser.lvals.parseSpread();
      } else {
        parseMaybeAssign();
      }
    }
    state.closeContext();
  }

  private boolean parseExprAtom() {
    Tokenizer tokenizer = parser.tokenizer;
    if (isRegexpStart()) {
      tokenizer.readRegexp();
      tokenizer.next();
      return false;
    }
    switch (state.type) {
      case NUM:
      case STRING:
      case NULL:
      case TRUE:
      case FALSE:
      case THIS:
      case SUPER:
        tokenizer.next();
        return false;
      case LESS_THAN:
        if (!state.isJsx) {
          throw tokenizer.unexpected();
        }
        state.type = TokenType.JSX_TAG_START;
        parser.jsx.parseElement();
        tokenizer.next();
        return false;
      case PAREN_L:
        return parseParenAndDistinguish();
      case BRACKET_L:
        parseArrayLiteral();
        return false;
      case BRACE_L:
        parseObj(false, false);
        return false;
      case FUNCTION:
        parser.statements.parseFunction(state.tokens.size(), false, false);
        return false;
      case CLASS:
        parser.statements.parseClass(false);
        return false;
      case NEW:
        parseNew();
        return false;
      case BACK_QUOTE:
        parseTemplate(false);
        return false;
      case IMPORT:
        tokenizer.next();
        if (tokenizer.eat(DOT)) {
          tokenizer.nextAsName();
        }
        return false;
      case HASH:
        throw tokenizer.raise(state.start, "Private class members are not supported");
      case AT:
        throw tokenizer.raise(state.start, "Decorators are not supported");
      case NAME:
        return parseIdentifierAtom();
      default:
        throw tokenizer.unexpected();
    }
  }

  private boolean isRegexpStart() {
    return state.type == TokenType.SLASH
        || (state.type == TokenType.ASSIGN && state.input.charAt(state.start) == '/');
  }

  private boolean parseIdentifierAtom() {
    Tokenizer tokenizer = parser.tokenizer;
    if (tokenizer.isContextual("async")) {
      Token next = tokenizer.lookahead();
      if (!tokenizer.hasLineBreakBefore(next)) {
        if (next.getType() == TokenType.FUNCTION) {
          int functionStart = state.tokens.size();
          tokenizer.next();
          parser.statements.parseFunction(functionStart, false, true);
          return false;
        }
        if (next.getType() == NAME) {
          tokenizer.next();
          tokenizer.next();
          Token param = state.lastToken();
          param.setIdentifierRole(IdentifierRole.FUNCTION_SCOPED_DECLARATION);
          param.setScopeDepth(state.scopeDepth + 1);
          parseArrowExpression(true);
          return true;
        }
      }
    }
    tokenizer.next();
    state.lastToken().setIdentifierRole(IdentifierRole.ACCESS);
    if (tokenizer.match(ARROW) && !tokenizer.hasPrecedingLineBreak()) {
      markPriorBindingIdentifiers(state.tokens.size() - 1);
      parseArrowExpression(false);
      return true;
    }
    return false;
  }

  /**
   * Parses a parenthesized expression, or an arrow function's parameter list together with the
   * arrow function.
   *
   * @return whether it was an arrow function
   */
  private boolean parseParenAndDistinguish() {
    Tokenizer tokenizer = parser.tokenizer;
    int startIndex = state.tokens.size();
    tokenizer.expect(PAREN_L);
    boolean first = true;
    while (!tokenizer.eat(PAREN_R)) {
      if (first) {
        first = false;
      } else {
        tokenizer.expect(COMMA);
        if (tokenizer.eat(PAREN_R)) {
          break;
        }
      }
      if (tokenizer.match(ELLIPSIS)) {
        parser.lvals.parseRest(false);
        parser.lvals.parseAssignableListItemTypes();
      } else {
        parseMaybeAssign();
        parseParenItemTypes();
      }
    }
    if (parseArrowHead()) {
      markPriorBindingIdentifiers(startIndex);
      parseArrowExpression(false);
      return true;
    }
    return false;
  }

  /** Parses the annotation of a typed parameter or a Flow type cast such as {@code (x: T)}. */
  private void parseParenItemTypes() {
    if (state.hasTypes() && parser.tokenizer.match(COLON)) {
      parser.types.typeAnnotation();
      if (parser.tokenizer.eat(EQ)) {
        parseMaybeAssign();
      }
    }
  }

  /**
   * Returns whether the current token is {@code =>}, consuming an arrow function return type first
   * if there is one.
   */
  private boolean parseArrowHead() {
    Tokenizer tokenizer = parser.tokenizer;
    if (tokenizer.match(ARROW)) {
      return true;
    }
    if (!state.hasTypes() || !tokenizer.match(COLON)) {
      return false;
    }
    ScanState.Snapshot snapshot = state.snapshot();
    if (tokenizer.tryParse(parser.types::returnType) && tokenizer.match(ARROW)) {
      return true;
    }
    state.restore(snapshot);
    return false;
  }

  /** Turns the names parsed as accesses since {@code startIndex} into arrow parameters. */
  private void markPriorBindingIdentifiers(int startIndex) {
    for (int i = startIndex; i < state.tokens.size(); i++) {
      Token token = state.tokens.get(i);
      if (token.getType() != NAME || token.isType()) {
        continue;
      }
      IdentifierRole role = token.getIdentifierRole();
      if (role == IdentifierRole.ACCESS
          || role == IdentifierRole.OBJECT_SHORTHAND
          || role == IdentifierRole.FUNCTION_SCOPED_DECLARATION) {
        token.setIdentifierRole(IdentifierRole.FUNCTION_SCOPED_DECLARATION);
        token.setScopeDepth(state.scopeDepth + 1);
      }
    }
  }

  private void parseArrowExpression(boolean isAsync) {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expect(ARROW);
    boolean oldInAsync = state.inAsync;
    boolean oldInGenerator = state.inGenerator;
    state.inAsync = isAsync;
    state.inGenerator = false;
    state.scopeDepth++;
    if (tokenizer.match(BRACE_L)) {
      parser.statements.parseBlock();
    } else {
      parseMaybeAssign();
    }
    state.scopeDepth--;
    state.inAsync = oldInAsync;
    state.inGenerator = oldInGenerator;
  }

  private void parseArrayLiteral() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expect(BRACKET_L);
    boolean first = true;
    while (!tokenizer.eat(BRACKET_R)) {
      if (first) {
        first = false;
      } else {
        tokenizer.expect(COMMA);
        if (tokenizer.eat(BRACKET_R)) {
          break;
        }
      }
      if (tokenizer.match(COMMA)) {
        continue;
      }
      if (tokenizer.match(ELLIPSIS)) {
        parser.lvals.parseSpread();
      } else {
        parseMaybeAssign();
      }
    }
  }

  private void parseNew() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expect(TokenType.NEW);
    if (tokenizer.eat(DOT)) {
      tokenizer.nextAsName();
      return;
    }
    int startIndex = state.tokens.size();
    parseExprAtom();
    parseSubscripts(startIndex, true);
    if (tokenizer.match(PAREN_L)) {
      parseCallArguments();
    }
  }

  /**
   * Parses a template literal starting at the current back quote. Inside a type the
   * substitutions are types.
   */
  void parseTemplate(boolean inType) {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.nextTemplateChunk();
    while (true) {
      tokenizer.nextTemplateDelimiter();
      if (tokenizer.match(BACK_QUOTE)) {
        tokenizer.next();
        return;
      }
      tokenizer.next();
      if (inType) {
        parser.types.parseType();
      } else {
        parseExpression();
      }
      if (!tokenizer.match(BRACE_R)) {
        throw tokenizer.unexpected();
      }
      tokenizer.nextTemplateChunk();
    }
  }

  /**
   * Parses an object literal, or an object pattern when {@code isPattern} is set. The braces and
   * every key share a context id.
   */
  void parseObj(boolean isPattern, boolean isBlockScope) {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expect(BRACE_L);
    state.openContext();
    boolean first = true;
    while (!tokenizer.eat(BRACE_R)) {
      if (first) {
        first = false;
      } else {
        tokenizer.expect(COMMA);
        if (tokenizer.eat(BRACE_R)) {
          break;
        }
      }
      if (tokenizer.match(ELLIPSIS)) {
        if (isPattern) {
          parser.lvals.parseRest(isBlockScope);
        } else {
          parser.lvals.parseSpread();
        }
        continue;
      }
      parseObjectMember(isPattern, isBlockScope);
    }
    state.closeContext();
  }

  private void parseObjectMember(boolean isPattern, boolean isBlockScope) {
    Tokenizer tokenizer = parser.tokenizer;
    int memberStart = state.tokens.size();
    boolean isAsync = false;
    boolean isGenerator = false;
    if (!isPattern) {
      if (tokenizer.isContextual("async") && isPropertyKeyNext(true)) {
        tokenizer.next();
        isAsync = true;
      }
      isGenerator = tokenizer.eat(STAR);
      if ((tokenizer.isContextual("get") || tokenizer.isContextual("set"))
          && isPropertyKeyNext(false)) {
        tokenizer.next();
      }
    }
    int keyIndex = state.tokens.size();
    parsePropertyKey();
    Token key = state.tokens.get(keyIndex);

    if (!isPattern && (tokenizer.match(PAREN_L) || tokenizer.match(LESS_THAN))) {
      if (key.getType() == NAME) {
        key.setIdentifierRole(IdentifierRole.OBJECT_KEY);
      }
      parser.statements.parseFunctionParamsAndBody(memberStart, isAsync, isGenerator, false);
      return;
    }
    if (tokenizer.eat(COLON)) {
      if (key.getType() == NAME) {
        key.setIdentifierRole(IdentifierRole.OBJECT_KEY);
      }
      if (isPattern) {
        parser.lvals.parseMaybeDefault(isBlockScope, false);
      } else {
        parseMaybeAssign();
      }
      return;
    }
    if (key.getType() != NAME || keyIndex != state.tokens.size() - 1) {
      throw tokenizer.unexpected();
    }
    if (isPattern) {
      key.setIdentifierRole(
          isBlockScope
              ? IdentifierRole.BLOCK_SCOPED_DECLARATION
              : IdentifierRole.FUNCTION_SCOPED_DECLARATION);
    } else {
      key.setIdentifierRole(IdentifierRole.OBJECT_SHORTHAND);
    }
    if (tokenizer.eat(EQ)) {
      parseMaybeAssign();
    }
  }

  /**
   * Parses an object or class member key and tags it with the innermost context id. Keywords are
   * read as plain names.
   */
  void parsePropertyKey() {
    Tokenizer tokenizer = parser.tokenizer;
    if (tokenizer.match(BRACKET_L)) {
      tokenizer.next();
      state.stampContext();
      parseMaybeAssign();
      tokenizer.expect(BRACKET_R);
      state.stampContext();
      return;
    }
    if (tokenizer.match(TokenType.HASH)) {
      throw tokenizer.raise(state.start, "Private class members are not supported");
    }
    if (tokenizer.match(TokenType.NUM) || tokenizer.match(TokenType.STRING)) {
      tokenizer.next();
    } else {
      tokenizer.nextAsName();
    }
    state.stampContext();
  }

  /**
   * Whether the token after the current one starts a member key, which makes the current word a
   * modifier such as {@code get} or {@code async} rather than the key itself.
   */
  boolean isPropertyKeyNext(boolean forbidLineBreak) {
    Token next = parser.tokenizer.lookahead();
    if (forbidLineBreak && parser.tokenizer.hasLineBreakBefore(next)) {
      return false;
    }
    TokenType type = next.getType();
    return type == NAME
        || type == TokenType.STRING
        || type == TokenType.NUM
        || type == BRACKET_L
        || type == STAR
        || type == TokenType.HASH
        || type.isKeyword();
  }
}
