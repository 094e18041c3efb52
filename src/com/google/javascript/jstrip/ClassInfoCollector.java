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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Range;
import com.google.javascript.jstrip.parsing.JsSyntaxException;
import com.google.javascript.jstrip.parsing.Token;
import com.google.javascript.jstrip.parsing.TokenType;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Looks ahead over a class, from its {@code class} keyword to its closing brace, and collects the
 * {@link ClassInfo} needed to rewrite its fields. Field initializers are rewritten on the way
 * through the root transformer, so they can be moved as finished code; the cursor and the output
 * are then rewound to the class keyword.
 */
final class ClassInfoCollector {
  private static final ImmutableSet<String> PARAMETER_PROPERTY_MODIFIERS =
      ImmutableSet.of("public", "private", "protected", "readonly", "override");

  private final RootTransformer rootTransformer;
  private final TokenProcessor tokens;
  private final ClassInfo.Builder info = ClassInfo.builder();
  private final List<String> constructorInitializers = new ArrayList<>();
  private final List<String> fieldInitializers = new ArrayList<>();
  private boolean hasSuperclass;
  // Offset of a constructor's super() call that is not a statement of its body, or -1.
  private int nestedSuperCallOffset = -1;

  private ClassInfoCollector(RootTransformer rootTransformer, TokenProcessor tokens) {
    this.rootTransformer = rootTransformer;
    this.tokens = tokens;
  }

  /** Collects the class whose {@code class} keyword is at the cursor, leaving the cursor there. */
  static ClassInfo collect(RootTransformer rootTransformer, TokenProcessor tokens) {
    TokenProcessor.Snapshot snapshot = tokens.snapshot();
    ClassInfo classInfo = new ClassInfoCollector(rootTransformer, tokens).collectClass();
    tokens.restoreToSnapshot(snapshot);
    return classInfo;
  }

  private ClassInfo collectClass() {
    int classContextId = processClassHeader();
    tokens.nextToken();
    while (!tokens.matchesContextIdAndLabel(TokenType.BRACE_R, classContextId)) {
      if (tokens.matches(TokenType.SEMI) || tokens.currentToken().isType()) {
        tokens.nextToken();
      } else {
        processMember(classContextId);
      }
    }
    ImmutableList<String> initializerStatements =
        ImmutableList.<String>builder()
            .addAll(constructorInitializers)
            .addAll(fieldInitializers)
            .build();
    if (!initializerStatements.isEmpty() && nestedSuperCallOffset != -1) {
      throw JsSyntaxException.at(
          tokens.getCode(),
          nestedSuperCallOffset,
          "A super() call that is not a statement of the constructor body is not supported in a"
              + " class with initialized fields or parameter properties");
    }
    info.setInitializerStatements(initializerStatements);
    return info.build();
  }

  /** Reads the header and stops at the body's opening brace. Returns the class context id. */
  private int processClassHeader() {
    Token classToken = tokens.currentToken();
    Integer contextId = classToken.getContextId();
    checkState(
        contextId != null,
        "Expected class to have a context id at offset %s",
        classToken.getStart());
    info.setIsExpression(classToken.isExpression());
    tokens.nextToken();
    @Nullable String className = null;
    if (tokens.matches(TokenType.NAME) && !tokens.currentToken().isType()) {
      className = tokens.identifierName();
    }
    info.setClassName(className);
    while (!tokens.matchesContextIdAndLabel(TokenType.BRACE_L, contextId)) {
      if (tokens.matches(TokenType.EXTENDS) && !tokens.currentToken().isType()) {
        hasSuperclass = true;
      }
      tokens.nextToken();
    }
    info.setHasSuperclass(hasSuperclass);
    return contextId;
  }

  private void processMember(int classContextId) {
    int memberStart = tokens.currentIndex();
    boolean isStatic = false;
    // Modifiers carry no context id; the key does.
    while (!isMemberKey(tokens.currentToken(), classContextId)) {
      if (tokens.matchesContextual("static") && !tokens.currentToken().isType()) {
        isStatic = true;
      }
      tokens.nextToken();
    }
    int keyIndex = tokens.currentIndex();
    String nameCode = getNameCode(classContextId);
    skipTypeTokens();

    if (tokens.matches(TokenType.PAREN_L)) {
      int parenIndex = tokens.currentIndex();
      int bodyEndIndex = tokens.findMatchingContextIndex(parenIndex, TokenType.BRACE_R);
      if (!isStatic && tokens.matchesContextualAtIndex(keyIndex, "constructor")) {
        processConstructor(parenIndex, bodyEndIndex);
      }
      while (tokens.currentIndex() <= bodyEndIndex) {
        tokens.nextToken();
      }
      return;
    }

    if (tokens.matches(TokenType.EQ)) {
      Token eqToken = tokens.currentToken();
      int valueEnd = eqToken.getEndIndex();
      checkState(
          valueEnd >= 0, "Expected the end of the initializer at offset %s", eqToken.getStart());
      tokens.nextToken();
      int resultCodeStart = tokens.getResultCodeIndex();
      while (tokens.currentIndex() < valueEnd) {
        rootTransformer.processToken();
      }
      String expressionCode = tokens.getCodeInsertedSinceIndex(resultCodeStart);
      if (isStatic) {
        info.staticInitializerSuffixesBuilder().add(nameCode + " =" + expressionCode);
      } else {
        fieldInitializers.add("this" + nameCode + " =" + expressionCode);
      }
    }
    if (tokens.matches(TokenType.SEMI)) {
      tokens.nextToken();
    }
    info.fieldRangesBuilder().add(Range.closedOpen(memberStart, tokens.currentIndex()));
  }

  private static boolean isMemberKey(Token token, int classContextId) {
    Integer contextId = token.getContextId();
    return contextId != null && contextId == classContextId;
  }

  /**
   * Reads the member key at the cursor and returns the code that accesses the member on an
   * object: {@code .name} or {@code [expression]}.
   */
  private String getNameCode(int classContextId) {
    String code = tokens.getCode();
    if (tokens.matches(TokenType.BRACKET_L)) {
      Token start = tokens.currentToken();
      int endIndex = tokens.findMatchingContextIndex(tokens.currentIndex(), TokenType.BRACKET_R);
      Token end = tokens.getTokens().get(endIndex);
      while (tokens.currentIndex() <= endIndex) {
        tokens.nextToken();
      }
      return "[" + code.substring(start.getEnd(), end.getStart()) + "]";
    }
    Token key = tokens.currentToken();
    tokens.nextToken();
    String keyCode = code.substring(key.getStart(), key.getEnd());
    if (key.getType() == TokenType.STRING || key.getType() == TokenType.NUM) {
      return "[" + keyCode + "]";
    }
    return "." + keyCode;
  }

  private void skipTypeTokens() {
    while (tokens.currentToken().isType()) {
      tokens.nextToken();
    }
  }

  /**
   * Records the parameter properties of the constructor and where its initializers go: at the
   * start of the body, or in a derived class right after the {@code super(...)} call.
   */
  private void processConstructor(int parenIndex, int bodyEndIndex) {
    List<Token> allTokens = tokens.getTokens();
    int parenEndIndex = tokens.findMatchingContextIndex(parenIndex, TokenType.PAREN_R);
    for (int i = parenIndex + 1; i + 1 < parenEndIndex; i++) {
      Token token = allTokens.get(i);
      Token next = allTokens.get(i + 1);
      if (token.isType()
          && token.getType() == TokenType.NAME
          && PARAMETER_PROPERTY_MODIFIERS.contains(tokens.identifierNameAtIndex(i))
          && next.getType() == TokenType.NAME
          && !next.isType()) {
        String name = tokens.identifierNameAtIndex(i + 1);
        constructorInitializers.add("this." + name + " = " + name);
      }
    }

    int bodyStartIndex = tokens.findMatchingContextIndex(parenIndex, TokenType.BRACE_L);
    int insertPos = bodyStartIndex;
    if (hasSuperclass) {
      int superIndex = findSuperCall(bodyStartIndex, bodyEndIndex);
      if (superIndex != -1) {
        insertPos = tokens.findMatchingContextIndex(superIndex + 1, TokenType.PAREN_R);
        if (tokens.matchesAtIndex(insertPos + 1, TokenType.SEMI)) {
          insertPos++;
        }
      }
    }
    info.setConstructorInsertPos(insertPos);
  }

  /**
   * Returns the index of the first {@code super(...)} call of the constructor body, or -1. The
   * call must be a statement of the body itself; a first call nested in a block or a branch is
   * recorded in {@link #nestedSuperCallOffset} instead.
   */
  private int findSuperCall(int bodyStartIndex, int bodyEndIndex) {
    List<Token> allTokens = tokens.getTokens();
    int bodyDepth = allTokens.get(bodyStartIndex).getScopeDepth();
    int braceDepth = 0;
    for (int i = bodyStartIndex + 1; i < bodyEndIndex; i++) {
      Token token = allTokens.get(i);
      switch (token.getType()) {
        case BRACE_L:
        case BRACE_BAR_L:
        case DOLLAR_BRACE_L:
          braceDepth++;
          continue;
        case BRACE_R:
        case BRACE_BAR_R:
          braceDepth--;
          continue;
        default:
          break;
      }
      if (!tokens.matchesAtIndex(i, TokenType.SUPER, TokenType.PAREN_L)
          || token.getScopeDepth() != bodyDepth) {
        continue;
      }
      if (braceDepth == 0 && startsStatement(i, bodyStartIndex)) {
        return i;
      }
      nestedSuperCallOffset = token.getStart();
      return -1;
    }
    return -1;
  }

  private boolean startsStatement(int index, int bodyStartIndex) {
    int previous = index - 1;
    return previous == bodyStartIndex
        || tokens.matchesAtIndex(previous, TokenType.SEMI)
        || tokens.matchesAtIndex(previous, TokenType.BRACE_R);
  }
}
