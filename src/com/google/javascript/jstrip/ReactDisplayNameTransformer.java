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

import com.google.common.base.Splitter;
import com.google.javascript.jstrip.parsing.IdentifierRole;
import com.google.javascript.jstrip.parsing.Token;
import com.google.javascript.jstrip.parsing.TokenType;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Adds a {@code displayName} to classes made with {@code React.createClass} or
 * {@code createReactClass}, named after the variable or property they are assigned to, or after
 * the file for a default export.
 */
final class ReactDisplayNameTransformer extends Transformer {
  private final RootTransformer rootTransformer;
  private final TokenProcessor tokens;
  private final ImportBindingResolver importBindings;
  private final @Nullable String filePath;

  ReactDisplayNameTransformer(
      RootTransformer rootTransformer,
      TokenProcessor tokens,
      ImportBindingResolver importBindings,
      @Nullable String filePath) {
    this.rootTransformer = rootTransformer;
    this.tokens = tokens;
    this.importBindings = importBindings;
    this.filePath = filePath;
  }

  @Override
  boolean process() {
    if (!tokens.matches(TokenType.NAME) || tokens.currentToken().isType()) {
      return false;
    }
    int startIndex = tokens.currentIndex();
    if (tokens.identifierName().equals("createReactClass")) {
      String newName = importBindings.getIdentifierReplacement("createReactClass");
      if (newName == null) {
        tokens.copyToken();
      } else {
        tokens.replaceToken("(0, " + newName + ")");
      }
      tryProcessCreateClassCall(startIndex);
      return true;
    }
    if (tokens.matches(TokenType.NAME, TokenType.DOT, TokenType.NAME)
        && tokens.identifierName().equals("React")
        && tokens.identifierNameAtIndex(startIndex + 2).equals("createClass")) {
      String newName = importBindings.getIdentifierReplacement("React");
      tokens.replaceToken(newName == null ? "React" : newName);
      tokens.copyToken();
      tokens.copyToken();
      tryProcessCreateClassCall(startIndex);
      return true;
    }
    return false;
  }

  /** Inserts the display name if the call is given a single object literal without one. */
  private void tryProcessCreateClassCall(int startIndex) {
    String displayName = findDisplayName(startIndex);
    if (displayName == null || !classNeedsDisplayName()) {
      return;
    }
    tokens.copyExpectedToken(TokenType.PAREN_L);
    tokens.copyExpectedToken(TokenType.BRACE_L);
    tokens.appendCode("displayName: '" + displayName + "',");
    rootTransformer.processBalancedCode();
    tokens.copyExpectedToken(TokenType.BRACE_R);
    tokens.copyExpectedToken(TokenType.PAREN_R);
  }

  private @Nullable String findDisplayName(int startIndex) {
    if (startIndex < 2) {
      return null;
    }
    if (tokens.matchesAtIndex(startIndex - 2, TokenType.NAME, TokenType.EQ)) {
      // foo = React.createClass({...})
      return tokens.identifierNameAtIndex(startIndex - 2);
    }
    if (tokens.getTokens().get(startIndex - 2).getIdentifierRole() == IdentifierRole.OBJECT_KEY) {
      // {foo: React.createClass({...})}
      return tokens.identifierNameAtIndex(startIndex - 2);
    }
    if (tokens.matchesAtIndex(startIndex - 2, TokenType.EXPORT, TokenType.DEFAULT)) {
      return getDisplayNameFromFilename();
    }
    return null;
  }

  private String getDisplayNameFromFilename() {
    List<String> segments = Splitter.on('/').splitToList(filePath == null ? "unknown" : filePath);
    String filename = segments.get(segments.size() - 1);
    int dotIndex = filename.lastIndexOf('.');
    String baseFilename = dotIndex == -1 ? filename : filename.substring(0, dotIndex);
    if (baseFilename.equals("index") && segments.size() >= 2) {
      return segments.get(segments.size() - 2);
    }
    return baseFilename;
  }

  /** Whether the call at the cursor has one object literal argument with no displayName key. */
  private boolean classNeedsDisplayName() {
    if (!tokens.matches(TokenType.PAREN_L, TokenType.BRACE_L)) {
      return false;
    }
    List<Token> allTokens = tokens.getTokens();
    int objectStartIndex = tokens.currentIndex() + 1;
    Integer objectContextId = allTokens.get(objectStartIndex).getContextId();
    if (objectContextId == null) {
      throw new IllegalStateException(
          "Expected a context id on the object literal at offset "
              + allTokens.get(objectStartIndex).getStart());
    }
    int objectEndIndex = tokens.findMatchingContextIndex(objectStartIndex, TokenType.BRACE_R);
    for (int index = objectStartIndex + 1; index < objectEndIndex; index++) {
      Token token = allTokens.get(index);
      if (token.getIdentifierRole() == IdentifierRole.OBJECT_KEY
          && objectContextId.equals(token.getContextId())
          && tokens.identifierNameAtIndex(index).equals("displayName")) {
        return false;
      }
    }
    int afterObject = objectEndIndex + 1;
    return tokens.matchesAtIndex(afterObject, TokenType.PAREN_R)
        || tokens.matchesAtIndex(afterObject, TokenType.COMMA, TokenType.PAREN_R);
  }
}
