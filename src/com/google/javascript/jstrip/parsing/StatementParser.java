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

import static com.google.javascript.jstrip.parsing.TokenType.BRACE_L;
import static com.google.javascript.jstrip.parsing.TokenType.BRACE_R;
import static com.google.javascript.jstrip.parsing.TokenType.COLON;
import static com.google.javascript.jstrip.parsing.TokenType.COMMA;
import static com.google.javascript.jstrip.parsing.TokenType.EQ;
import static com.google.javascript.jstrip.parsing.TokenType.LESS_THAN;
import static com.google.javascript.jstrip.parsing.TokenType.NAME;
import static com.google.javascript.jstrip.parsing.TokenType.PAREN_L;
import static com.google.javascript.jstrip.parsing.TokenType.PAREN_R;
import static com.google.javascript.jstrip.parsing.TokenType.SEMI;
import static com.google.javascript.jstrip.parsing.TokenType.STAR;
import static com.google.javascript.jstrip.parsing.TokenType.STRING;

import com.google.common.collect.ImmutableSet;

/** Parses statements, declarations, classes and module syntax. */
final class StatementParser {
  private static final ImmutableSet<String> CLASS_MEMBER_MODIFIERS =
      ImmutableSet.of(
          "public", "private", "protected", "readonly", "abstract", "override", "declare");

  private final ScanState state;
  private final Parser parser;

  StatementParser(ScanState state, Parser parser) {
    this.state = state;
    this.parser = parser;
  }

  void parseTopLevel() {
    while (!parser.tokenizer.match(TokenType.EOF)) {
      parseStatement();
    }
  }

  void parseStatement() {
    Tokenizer tokenizer = parser.tokenizer;
    if (tokenizer.match(TokenType.AT)) {
      throw tokenizer.raise(state.start, "Decorators are not supported");
    }
    if (parser.types.tryParseTypeDeclaration()) {
      return;
    }
    switch (state.type) {
      case BREAK:
      case CONTINUE:
        tokenizer.next();
        if (tokenizer.match(NAME) && !tokenizer.hasPrecedingLineBreak()) {
          tokenizer.next();
        }
        tokenizer.semicolon();
        return;
      case DEBUGGER:
        tokenizer.next();
        tokenizer.semicolon();
        return;
      case DO:
        tokenizer.next();
        parseStatement();
        tokenizer.expect(TokenType.WHILE);
        parseParenExpression();
        tokenizer.eat(SEMI);
        return;
      case FOR:
        parseFor();
        return;
      case FUNCTION:
        parseFunctionStatement(state.tokens.size(), false);
        return;
      case CLASS:
        parseClass(true);
        return;
      case IF:
        tokenizer.next();
        parseParenExpression();
        parseStatement();
        if (tokenizer.eat(TokenType.ELSE)) {
          parseStatement();
        }
        return;
      case RETURN:
        tokenizer.next();
        if (!tokenizer.eat(SEMI) && !tokenizer.canInsertSemicolon()) {
          parser.expressions.parseExpression();
          tokenizer.semicolon();
        }
        return;
      case SWITCH:
        parseSwitch();
        return;
      case THROW:
        tokenizer.next();
        parser.expressions.parseExpression();
        tokenizer.semicolon();
        return;
      case TRY:
        parseTry();
        return;
      case CONST:
        if (state.isTypeScript && isNextWord("enum")) {
          if (!state.isType) {
            throw tokenizer.raise(state.start, "TypeScript enums are not supported");
          }
          tokenizer.next();
          parser.types.tryParseTypeDeclaration();
          return;
        }
        parseVarStatement(true);
        return;
      case VAR:
        parseVarStatement(false);
        return;
      case WHILE:
      case WITH:
        tokenizer.next();
        parseParenExpression();
        parseStatement();
        return;
      case BRACE_L:
        parseBlock();
        return;
      case SEMI:
        tokenizer.next();
        return;
      case EXPORT:
        parseExport();
        return;
      case IMPORT:
        {
          TokenType next = tokenizer.lookahead().getType();
          if (next != PAREN_L && next != TokenType.DOT) {
            parseImport();
            return;
          }
          break;
        }
      case NAME:
        if (tokenizer.isContextual("let") && isLetDeclaration()) {
          parseVarStatement(true);
          return;
        }
        if (tokenizer.isContextual("async")) {
          Token next = tokenizer.lookahead();
          if (next.getType() == TokenType.FUNCTION && !tokenizer.hasLineBreakBefore(next)) {
            int functionStart = state.tokens.size();
            tokenizer.next();
            parseFunctionStatement(functionStart, true);
            return;
          }
        }
        if (tokenizer.lookahead().getType() == COLON) {
          // Label.
          tokenizer.next();
          tokenizer.next();
          parseStatement();
          return;
        }
        break;
      default:
        break;
    }
    parser.expressions.parseExpression();
    tokenizer.semicolon();
  }

  private boolean isNextWord(String word) {
    Token next = parser.tokenizer.lookahead();
    return next.getType() == NAME && word.equals(next.getValue());
  }

  private boolean isLetDeclaration() {
    TokenType next = parser.tokenizer.lookahead().getType();
    return next == NAME || next == TokenType.BRACKET_L || next == BRACE_L;
  }

  void parseBlock() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expect(BRACE_L);
    while (!tokenizer.eat(BRACE_R)) {
      parseStatement();
    }
  }

  private void parseParenExpression() {
    parser.tokenizer.expect(PAREN_L);
    parser.expressions.parseExpression();
    parser.tokenizer.expect(PAREN_R);
  }

  private void parseSwitch() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.next();
    parseParenExpression();
    tokenizer.expect(BRACE_L);
    while (!tokenizer.eat(BRACE_R)) {
      if (tokenizer.eat(TokenType.CASE)) {
        parser.expressions.parseExpression();
        tokenizer.expect(COLON);
      } else if (tokenizer.eat(TokenType.DEFAULT)) {
        tokenizer.expect(COLON);
      } else {
        parseStatement();
      }
    }
  }

  private void parseTry() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.next();
    parseBlock();
    if (tokenizer.eat(TokenType.CATCH)) {
      if (tokenizer.eat(PAREN_L)) {
        parser.lvals.parseBindingAtom(true);
        if (state.hasTypes() && tokenizer.match(COLON)) {
          parser.types.typeAnnotation();
        }
        tokenizer.expect(PAREN_R);
      }
      parseBlock();
    }
    if (tokenizer.eat(TokenType.FINALLY)) {
      parseBlock();
    }
  }

  private void parseFor() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.next();
    if (tokenizer.isContextual("await")) {
      tokenizer.next();
    }
    tokenizer.expect(PAREN_L);
    if (tokenizer.match(SEMI)) {
      parseForRest();
      return;
    }
    if (tokenizer.match(TokenType.VAR)
        || tokenizer.match(TokenType.CONST)
        || (tokenizer.isContextual("let") && isLetDeclaration())) {
      boolean isBlockScope = !tokenizer.match(TokenType.VAR);
      tokenizer.next();
      parseVar(true, isBlockScope);
    } else {
      parser.expressions.parseExpression(true);
    }
    if (tokenizer.match(TokenType.IN) || tokenizer.isContextual("of")) {
      tokenizer.next();
      parser.expressions.parseExpression();
      tokenizer.expect(PAREN_R);
      parseStatement();
      return;
    }
    parseForRest();
  }

  private void parseForRest() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expect(SEMI);
    if (!tokenizer.match(SEMI)) {
      parser.expressions.parseExpression();
    }
    tokenizer.expect(SEMI);
    if (!tokenizer.match(PAREN_R)) {
      parser.expressions.parseExpression();
    }
    tokenizer.expect(PAREN_R);
    parseStatement();
  }

  private void parseVarStatement(boolean isBlockScope) {
    parser.tokenizer.next();
    parseVar(false, isBlockScope);
    parser.tokenizer.semicolon();
  }

  /** Parses the declarator list after {@code var}, {@code let} or {@code const}. */
  private void parseVar(boolean isFor, boolean isBlockScope) {
    Tokenizer tokenizer = parser.tokenizer;
    do {
      parser.lvals.parseBindingAtom(isBlockScope);
      if (state.isTypeScript && tokenizer.match(TokenType.BANG)) {
        tokenizer.runInTypeContext(tokenizer::next);
      }
      if (state.hasTypes() && tokenizer.match(COLON)) {
        parser.types.typeAnnotation();
      }
      if (tokenizer.eat(EQ)) {
        parser.expressions.parseMaybeAssign(isFor);
      }
    } while (tokenizer.eat(COMMA));
  }

  private void parseFunctionStatement(int functionStart, boolean isAsync) {
    if (!parseFunction(functionStart, true, isAsync)) {
      parser.tokenizer.runInTypeContext(parser.tokenizer::semicolon);
    }
  }

  /**
   * Parses a function starting at the current {@code function} keyword. Any {@code async} has
   * already been consumed and belongs to the function from {@code functionStart} on.
   *
   * @return whether the function had a body; one without is an overload or a declaration and has
   *     been turned into type tokens
   */
  boolean parseFunction(int functionStart, boolean isStatement, boolean isAsync) {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expect(TokenType.FUNCTION);
    boolean isGenerator = tokenizer.eat(STAR);
    if (tokenizer.match(NAME)) {
      tokenizer.next();
      if (isStatement) {
        state.lastToken().setIdentifierRole(IdentifierRole.FUNCTION_SCOPED_DECLARATION);
      }
    }
    return parseFunctionParamsAndBody(functionStart, isAsync, isGenerator, false);
  }

  /**
   * Parses the type parameters, parameters, return type and body of a function or method. The
   * parameter parentheses and body braces share a context id.
   *
   * @param allowModifiers whether TypeScript parameter properties are allowed, as in constructors
   * @return whether there was a body
   */
  boolean parseFunctionParamsAndBody(
      int functionStart, boolean isAsync, boolean isGenerator, boolean allowModifiers) {
    Tokenizer tokenizer = parser.tokenizer;
    boolean oldInAsync = state.inAsync;
    boolean oldInGenerator = state.inGenerator;
    state.inAsync = isAsync;
    state.inGenerator = isGenerator;
    state.scopeDepth++;

    if (state.hasTypes() && tokenizer.match(LESS_THAN)) {
      parser.types.typeParameters();
    }
    tokenizer.expect(PAREN_L);
    state.openContext();
    parser.lvals.parseBindingList(PAREN_R, false, false, allowModifiers);
    state.stampContext();
    if (state.hasTypes() && tokenizer.match(COLON)) {
      parser.types.returnType();
    }

    boolean hasBody = tokenizer.match(BRACE_L);
    if (hasBody) {
      tokenizer.next();
      state.stampContext();
      while (!tokenizer.eat(BRACE_R)) {
        parseStatement();
      }
      state.closeContext();
    } else {
      state.popContext();
      for (int i = functionStart; i < state.tokens.size(); i++) {
        state.tokens.get(i).setType(true);
      }
    }

    state.scopeDepth--;
    state.inAsync = oldInAsync;
    state.inGenerator = oldInGenerator;
    return hasBody;
  }

  /**
   * Parses a class starting at the {@code class} keyword. The keyword, the body braces and every
   * member key share a context id.
   */
  void parseClass(boolean isStatement) {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expect(TokenType.CLASS);
    state.openContext();
    state.lastToken().setExpression(!isStatement);

    if (tokenizer.match(NAME) && !tokenizer.isContextual("implements")) {
      tokenizer.next();
      if (isStatement) {
        state.lastToken().setIdentifierRole(IdentifierRole.BLOCK_SCOPED_DECLARATION);
      }
    }
    if (state.hasTypes() && tokenizer.match(LESS_THAN)) {
      parser.types.typeParameters();
    }
    if (tokenizer.eat(TokenType.EXTENDS)) {
      parser.expressions.parseExprSubscripts();
      if (state.hasTypes() && tokenizer.match(LESS_THAN)) {
        parser.types.typeArguments();
      }
    }
    if (state.hasTypes() && tokenizer.isContextual("implements")) {
      tokenizer.runInTypeContext(
          () -> {
            tokenizer.next();
            do {
              parser.types.parseType();
            } while (tokenizer.eat(COMMA));
          });
    }

    if (state.isType) {
      // Declared class: nothing inside survives, so only its extent matters.
      parser.types.skipBalanced();
      state.popContext();
      return;
    }

    tokenizer.expect(BRACE_L);
    state.stampContext();
    state.scopeDepth++;
    while (!tokenizer.eat(BRACE_R)) {
      parseClassMember();
    }
    state.scopeDepth--;
    state.closeContext();
  }

  private void parseClassMember() {
    Tokenizer tokenizer = parser.tokenizer;
    if (tokenizer.eat(SEMI)) {
      return;
    }
    if (tokenizer.match(TokenType.AT)) {
      throw tokenizer.raise(state.start, "Decorators are not supported");
    }
    int memberStart = state.tokens.size();
    if (state.isTypeScript
        && tokenizer.isContextual("declare")
        && parser.expressions.isPropertyKeyNext(true)) {
      tokenizer.runInTypeContext(
          () -> {
            tokenizer.next();
            parseClassMemberModifiers();
            parseClassMemberRest(memberStart);
          });
      return;
    }
    parseClassMemberModifiers();
    if (state.isTypeScript
        && tokenizer.match(TokenType.BRACKET_L)
        && parser.types.tryParseIndexSignature()) {
      for (int i = memberStart; i < state.tokens.size(); i++) {
        state.tokens.get(i).setType(true);
      }
      return;
    }
    parseClassMemberRest(memberStart);
  }

  /** Consumes {@code static} and the TypeScript modifiers, which become type tokens. */
  private void parseClassMemberModifiers() {
    Tokenizer tokenizer = parser.tokenizer;
    while (state.type == NAME) {
      if (tokenizer.isContextual("static")) {
        Token next = tokenizer.lookahead();
        if (next.getType() == BRACE_L) {
          throw tokenizer.raise(state.start, "Class static blocks are not supported");
        }
        if (!parser.expressions.isPropertyKeyNext(false)) {
          return;
        }
        tokenizer.next();
      } else if (state.isTypeScript
          && CLASS_MEMBER_MODIFIERS.contains(state.value)
          && parser.expressions.isPropertyKeyNext(true)) {
        tokenizer.runInTypeContext(tokenizer::next);
      } else {
        return;
      }
    }
  }

  private void parseClassMemberRest(int memberStart) {
    Tokenizer tokenizer = parser.tokenizer;
    if (state.isFlow && tokenizer.match(TokenType.PLUS_MIN)) {
      tokenizer.runInTypeContext(tokenizer::next);
    }
    boolean isAsync = false;
    if (tokenizer.isContextual("async") && parser.expressions.isPropertyKeyNext(true)) {
      tokenizer.next();
      isAsync = true;
    }
    boolean isGenerator = tokenizer.eat(STAR);
    if ((tokenizer.isContextual("get") || tokenizer.isContextual("set"))
        && parser.expressions.isPropertyKeyNext(false)) {
      tokenizer.next();
    }

    int keyIndex = state.tokens.size();
    parser.expressions.parsePropertyKey();
    Token key = state.tokens.get(keyIndex);
    boolean isConstructor =
        (key.getType() == NAME || key.getType() == STRING)
            && "constructor".equals(key.getValue());

    if (state.hasTypes()
        && (tokenizer.match(TokenType.QUESTION) || tokenizer.match(TokenType.BANG))) {
      tokenizer.runInTypeContext(tokenizer::next);
    }

    if (tokenizer.match(PAREN_L) || tokenizer.match(LESS_THAN)) {
      boolean hasBody =
          parseFunctionParamsAndBody(memberStart, isAsync, isGenerator, isConstructor);
      if (!hasBody) {
        tokenizer.runInTypeContext(() -> tokenizer.eat(SEMI));
      }
      return;
    }

    if (state.hasTypes() && tokenizer.match(COLON)) {
      parser.types.typeAnnotation();
    }
    if (tokenizer.eat(EQ)) {
      Token eqToken = state.lastToken();
      parser.expressions.parseMaybeAssign();
      eqToken.setEndIndex(state.tokens.size());
    }
    tokenizer.semicolon();
  }

  private void parseExport() {
    Tokenizer tokenizer = parser.tokenizer;
    int exportIndex = state.tokens.size();
    if (state.hasTypes() && isTypeOnlyExport()) {
      tokenizer.runInTypeContext(this::parseTypeOnlyExport);
      return;
    }
    tokenizer.next();

    if (state.isTypeScript && tokenizer.match(EQ)) {
      tokenizer.next();
      parser.expressions.parseExpression();
      tokenizer.semicolon();
      return;
    }
    if (tokenizer.eat(STAR)) {
      if (tokenizer.eatContextual("as")) {
        tokenizer.nextAsName();
      }
      tokenizer.expectContextual("from");
      tokenizer.expect(STRING);
      tokenizer.semicolon();
      return;
    }
    if (tokenizer.match(BRACE_L)) {
      parseExportSpecifiers();
      return;
    }
    int declarationStart;
    if (tokenizer.eat(TokenType.DEFAULT)) {
      declarationStart = state.tokens.size();
      parseExportDefault();
    } else {
      declarationStart = state.tokens.size();
      boolean isVariable =
          tokenizer.match(TokenType.VAR)
              || tokenizer.match(TokenType.CONST)
              || tokenizer.isContextual("let");
      parseStatement();
      if (isVariable) {
        state.tokens.get(exportIndex).setEndIndex(state.tokens.size());
      }
    }
    markTypeOnlyDeclaration(exportIndex, declarationStart);
  }

  /** Erases {@code export} (and {@code default}) when everything they introduce was a type. */
  private void markTypeOnlyDeclaration(int exportIndex, int declarationStart) {
    if (declarationStart == state.tokens.size()) {
      return;
    }
    for (int i = declarationStart; i < state.tokens.size(); i++) {
      if (!state.tokens.get(i).isType()) {
        return;
      }
    }
    for (int i = exportIndex; i < declarationStart; i++) {
      state.tokens.get(i).setType(true);
    }
  }

  private boolean isTypeOnlyExport() {
    Tokenizer tokenizer = parser.tokenizer;
    Token next = tokenizer.lookahead();
    if (next.getType() == TokenType.DEFAULT) {
      Token afterDefault = tokenizer.lookahead(2);
      return afterDefault.getType() == NAME
          && "interface".equals(afterDefault.getValue())
          && tokenizer.lookahead(3).getType() == NAME;
    }
    if (next.getType() != NAME || next.getValue() == null) {
      return false;
    }
    switch (next.getValue()) {
      case "type":
        {
          TokenType afterType = tokenizer.lookahead(2).getType();
          return afterType == NAME || afterType == BRACE_L || afterType == STAR;
        }
      case "interface":
      case "declare":
      case "opaque":
        return true;
      case "as":
        return state.isTypeScript;
      default:
        return false;
    }
  }

  /** Parses an export whose tokens are all erased. Runs in a type context. */
  private void parseTypeOnlyExport() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.next();
    if (tokenizer.eatContextual("as")) {
      tokenizer.expectContextual("namespace");
      tokenizer.nextAsName();
      tokenizer.semicolon();
      return;
    }
    if (tokenizer.isContextual("type")) {
      TokenType afterType = tokenizer.lookahead().getType();
      if (afterType == BRACE_L || afterType == STAR) {
        tokenizer.next();
        if (tokenizer.eat(STAR)) {
          if (tokenizer.eatContextual("as")) {
            tokenizer.nextAsName();
          }
        } else {
          parser.types.skipBalanced();
        }
        if (tokenizer.eatContextual("from")) {
          tokenizer.expect(STRING);
        }
        tokenizer.semicolon();
        return;
      }
    }
    tokenizer.eat(TokenType.DEFAULT);
    parseStatement();
  }

  private void parseExportDefault() {
    Tokenizer tokenizer = parser.tokenizer;
    if (tokenizer.match(TokenType.FUNCTION)) {
      parseFunctionStatement(state.tokens.size(), false);
      return;
    }
    if (tokenizer.isContextual("async")) {
      Token next = tokenizer.lookahead();
      if (next.getType() == TokenType.FUNCTION && !tokenizer.hasLineBreakBefore(next)) {
        int functionStart = state.tokens.size();
        tokenizer.next();
        parseFunctionStatement(functionStart, true);
        return;
      }
    }
    if (tokenizer.match(TokenType.CLASS)) {
      parseClass(true);
      return;
    }
    if (state.isTypeScript
        && tokenizer.isContextual("abstract")
        && tokenizer.lookahead().getType() == TokenType.CLASS) {
      tokenizer.runInTypeContext(tokenizer::next);
      parseClass(true);
      return;
    }
    parser.expressions.parseMaybeAssign();
    tokenizer.semicolon();
  }

  private void parseExportSpecifiers() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expect(BRACE_L);
    int specifiersStart = state.tokens.size();
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
      if (state.isTypeScript && tokenizer.isContextual("type") && isNamedSpecifierNext()) {
        tokenizer.runInTypeContext(
            () -> {
              tokenizer.next();
              parseExportSpecifier();
            });
      } else {
        parseExportSpecifier();
      }
    }
    if (tokenizer.eatContextual("from")) {
      tokenizer.expect(STRING);
      // Re-exported names refer to the other module, not to local bindings.
      for (int i = specifiersStart; i < state.tokens.size(); i++) {
        state.tokens.get(i).setIdentifierRole(null);
      }
    }
    tokenizer.semicolon();
  }

  private void parseExportSpecifier() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.nextAsName();
    state.lastToken().setIdentifierRole(IdentifierRole.EXPORT_ACCESS);
    if (tokenizer.eatContextual("as")) {
      tokenizer.nextAsName();
    }
  }

  /** Whether the current {@code type} word is a modifier of the specifier that follows it. */
  private boolean isNamedSpecifierNext() {
    Token next = parser.tokenizer.lookahead();
    return (next.getType() == NAME || next.getType().isKeyword())
        && !"as".equals(next.getValue());
  }

  private void parseImport() {
    Tokenizer tokenizer = parser.tokenizer;
    if (state.hasTypes() && isTypeOnlyImport()) {
      tokenizer.runInTypeContext(
          () -> {
            tokenizer.next();
            tokenizer.next();
            parseImportClause();
          });
      return;
    }
    tokenizer.next();
    parseImportClause();
  }

  private boolean isTypeOnlyImport() {
    Tokenizer tokenizer = parser.tokenizer;
    Token next = tokenizer.lookahead();
    boolean isTypeWord =
        (next.getType() == NAME && "type".equals(next.getValue()))
            || next.getType() == TokenType.TYPEOF;
    if (!isTypeWord) {
      return false;
    }
    Token afterType = tokenizer.lookahead(2);
    if (afterType.getType() == BRACE_L || afterType.getType() == STAR) {
      return true;
    }
    return afterType.getType() == NAME && !"from".equals(afterType.getValue());
  }

  private void parseImportClause() {
    Tokenizer tokenizer = parser.tokenizer;
    if (tokenizer.eat(STRING)) {
      tokenizer.semicolon();
      return;
    }
    if (state.isTypeScript && tokenizer.match(NAME) && tokenizer.lookahead().getType() == EQ) {
      parseImportEquals();
      return;
    }
    boolean hasNamedBindings = true;
    if (tokenizer.match(NAME)) {
      tokenizer.next();
      state.lastToken().setIdentifierRole(IdentifierRole.IMPORT_DECLARATION);
      hasNamedBindings = tokenizer.eat(COMMA);
    }
    if (hasNamedBindings) {
      if (tokenizer.eat(STAR)) {
        tokenizer.expectContextual("as");
        tokenizer.expect(NAME);
        state.lastToken().setIdentifierRole(IdentifierRole.IMPORT_DECLARATION);
      } else {
        parseImportSpecifiers();
      }
    }
    tokenizer.expectContextual("from");
    tokenizer.expect(STRING);
    tokenizer.semicolon();
  }

  /** Parses TypeScript's {@code import a = require('a')} and {@code import a = b.c}. */
  private void parseImportEquals() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.next();
    state.lastToken().setIdentifierRole(IdentifierRole.BLOCK_SCOPED_DECLARATION);
    tokenizer.expect(EQ);
    if (tokenizer.isContextual("require") && tokenizer.lookahead().getType() == PAREN_L) {
      tokenizer.next();
      tokenizer.expect(PAREN_L);
      tokenizer.expect(STRING);
      tokenizer.expect(PAREN_R);
    } else {
      tokenizer.expect(NAME);
      state.lastToken().setIdentifierRole(IdentifierRole.ACCESS);
      while (tokenizer.eat(TokenType.DOT)) {
        tokenizer.nextAsName();
      }
    }
    tokenizer.semicolon();
  }

  private void parseImportSpecifiers() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.expect(BRACE_L);
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
      if (state.hasTypes()
          && (tokenizer.isContextual("type") || tokenizer.match(TokenType.TYPEOF))
          && isNamedSpecifierNext()) {
        tokenizer.runInTypeContext(
            () -> {
              tokenizer.next();
              parseImportSpecifier();
            });
      } else {
        parseImportSpecifier();
      }
    }
  }

  private void parseImportSpecifier() {
    Tokenizer tokenizer = parser.tokenizer;
    tokenizer.nextAsName();
    if (tokenizer.eatContextual("as")) {
      tokenizer.nextAsName();
    }
    state.lastToken().setIdentifierRole(IdentifierRole.IMPORT_DECLARATION);
  }
}
