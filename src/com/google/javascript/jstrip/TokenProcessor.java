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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.javascript.jstrip.parsing.Token;
import com.google.javascript.jstrip.parsing.TokenType;
import java.util.List;

/**
 * A cursor over the annotated tokens of one source file that builds the rewritten code as it
 * moves. Every consuming operation emits the whitespace and comments preceding the token (except
 * where noted) and then advances by exactly one token, so source text that no transformer touches
 * comes out unchanged.
 */
final class TokenProcessor {
  private final String code;
  private final ImmutableList<Token> tokens;
  private final ListMultimap<Integer, Integer> indicesByContextId = ArrayListMultimap.create();
  private final StringBuilder resultCode = new StringBuilder();
  private int tokenIndex = 0;

  TokenProcessor(String code, ImmutableList<Token> tokens) {
    this.code = code;
    this.tokens = tokens;
    for (int i = 0; i < tokens.size(); i++) {
      Integer contextId = tokens.get(i).getContextId();
      if (contextId != null) {
        indicesByContextId.put(contextId, i);
      }
    }
  }

  /** A position of the cursor and of the output, for look-ahead that must be undone. */
  @AutoValue
  abstract static class Snapshot {
    abstract int resultLength();

    abstract int tokenIndex();

    static Snapshot create(int resultLength, int tokenIndex) {
      return new AutoValue_TokenProcessor_Snapshot(resultLength, tokenIndex);
    }
  }

  Snapshot snapshot() {
    return Snapshot.create(resultCode.length(), tokenIndex);
  }

  void restoreToSnapshot(Snapshot snapshot) {
    resultCode.setLength(snapshot.resultLength());
    tokenIndex = snapshot.tokenIndex();
  }

  int getResultCodeIndex() {
    return resultCode.length();
  }

  String getCodeInsertedSinceIndex(int initialResultCodeIndex) {
    return resultCode.substring(initialResultCodeIndex);
  }

  String getCode() {
    return code;
  }

  List<Token> getTokens() {
    return tokens;
  }

  int currentIndex() {
    return tokenIndex;
  }

  Token currentToken() {
    return tokens.get(tokenIndex);
  }

  Token tokenAtRelativeIndex(int relativeIndex) {
    return tokens.get(tokenIndex + relativeIndex);
  }

  boolean isAtEnd() {
    return tokenIndex >= tokens.size();
  }

  /** Whether the tokens starting at the cursor have exactly the given kinds. */
  boolean matches(TokenType... types) {
    return matchesAtIndex(tokenIndex, types);
  }

  boolean matchesAtIndex(int index, TokenType... types) {
    if (index < 0) {
      return false;
    }
    for (int i = 0; i < types.length; i++) {
      if (index + i >= tokens.size() || tokens.get(index + i).getType() != types[i]) {
        return false;
      }
    }
    return true;
  }

  /** Whether the current token is the plain identifier {@code name}. */
  boolean matchesContextual(String name) {
    return matchesContextualAtIndex(tokenIndex, name);
  }

  boolean matchesContextualAtIndex(int index, String name) {
    return matchesAtIndex(index, TokenType.NAME) && name.equals(identifierNameAtIndex(index));
  }

  boolean matchesContextIdAndLabel(TokenType type, int contextId) {
    if (isAtEnd()) {
      return false;
    }
    Token token = currentToken();
    Integer tokenContextId = token.getContextId();
    return token.getType() == type && tokenContextId != null && tokenContextId == contextId;
  }

  /**
   * Returns the index of the token after {@code index} that has the same context id and the
   * given kind, such as the closing brace of a function whose parameter list starts at
   * {@code index}.
   */
  int findMatchingContextIndex(int index, TokenType type) {
    Integer contextId = tokens.get(index).getContextId();
    checkState(
        contextId != null, "Expected a context id at offset %s", tokens.get(index).getStart());
    for (int candidate : indicesByContextId.get(contextId)) {
      if (candidate > index && tokens.get(candidate).getType() == type) {
        return candidate;
      }
    }
    throw new IllegalStateException(
        "No matching " + type + " for the construct at offset " + tokens.get(index).getStart());
  }

  String identifierName() {
    return identifierNameAtIndex(tokenIndex);
  }

  /** The source text of the token, which for identifiers is the name as written. */
  String identifierNameAtIndex(int index) {
    Token token = tokens.get(index);
    return code.substring(token.getStart(), token.getEnd());
  }

  /** The text between the quotes of a string token. */
  String stringValueAtIndex(int index) {
    Token token = tokens.get(index);
    return code.substring(token.getStart() + 1, token.getEnd() - 1);
  }

  String rawCode() {
    Token token = currentToken();
    return code.substring(token.getStart(), token.getEnd());
  }

  private String previousWhitespaceAndComments() {
    int previousEnd = tokenIndex > 0 ? tokens.get(tokenIndex - 1).getEnd() : 0;
    return code.substring(previousEnd, currentToken().getStart());
  }

  void copyToken() {
    resultCode.append(previousWhitespaceAndComments()).append(rawCode());
    tokenIndex++;
  }

  void copyExpectedToken(TokenType type) {
    checkState(
        currentToken().getType() == type,
        "Expected %s but found %s at offset %s",
        type,
        currentToken().getType(),
        currentToken().getStart());
    copyToken();
  }

  void replaceToken(String newCode) {
    resultCode.append(previousWhitespaceAndComments()).append(newCode);
    tokenIndex++;
  }

  /** Replaces the token, keeping only the line breaks of the whitespace before it. */
  void replaceTokenTrimmingLeftWhitespace(String newCode) {
    resultCode.append(lineBreaksOf(previousWhitespaceAndComments())).append(newCode);
    tokenIndex++;
  }

  /** Removes the first token of a region, keeping the whitespace that precedes the region. */
  void removeInitialToken() {
    replaceToken("");
  }

  /** Removes a token inside a region being deleted. */
  void removeToken() {
    replaceTokenTrimmingLeftWhitespace("");
  }

  @CanIgnoreReturnValue
  TokenProcessor appendCode(String newCode) {
    resultCode.append(newCode);
    return this;
  }

  /** Moves to the next token without emitting anything. */
  void nextToken() {
    checkState(!isAtEnd(), "Unexpectedly reached the end of input");
    tokenIndex++;
  }

  void previousToken() {
    tokenIndex--;
  }

  /** Returns the rewritten code. Every token must have been consumed. */
  String finish() {
    checkState(
        tokenIndex == tokens.size(),
        "Did not reach the end of the tokens; stopped at offset %s",
        isAtEnd() ? code.length() : currentToken().getStart());
    int lastEnd = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).getEnd();
    resultCode.append(code, lastEnd, code.length());
    return resultCode.toString();
  }

  private static String lineBreaksOf(String whitespace) {
    StringBuilder lineBreaks = new StringBuilder();
    for (int i = 0; i < whitespace.length(); i++) {
      char c = whitespace.charAt(i);
      if (c == '\n' || c == '\r') {
        lineBreaks.append(c);
      }
    }
    return lineBreaks.toString();
  }
}
