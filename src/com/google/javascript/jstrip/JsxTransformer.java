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

import com.google.javascript.jstrip.parsing.Token;
import com.google.javascript.jstrip.parsing.TokenType;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites JSX elements into {@code React.createElement} calls. Host elements (a single
 * lowercase name) are passed as strings, components as references; attributes become a props
 * object and children become the remaining arguments.
 */
final class JsxTransformer extends Transformer {
  private final RootTransformer rootTransformer;
  private final TokenProcessor tokens;
  private final ImportBindingResolver importBindings;
  private final NameManager nameManager;
  private final @Nullable String filePath;
  private final boolean debugMetadata;

  private @Nullable String filenameVarName;
  // Line counting cursor, so that each newline is counted once in the common forward case.
  private int lastLineNumber = 1;
  private int lastIndex = 0;

  JsxTransformer(
      RootTransformer rootTransformer,
      TokenProcessor tokens,
      ImportBindingResolver importBindings,
      NameManager nameManager,
      @Nullable String filePath,
      boolean debugMetadata) {
    this.rootTransformer = rootTransformer;
    this.tokens = tokens;
    this.importBindings = importBindings;
    this.nameManager = nameManager;
    this.filePath = filePath;
    this.debugMetadata = debugMetadata;
  }

  @Override
  boolean process() {
    if (tokens.matches(TokenType.JSX_TAG_START)) {
      processJsxTag();
      return true;
    }
    return false;
  }

  @Override
  String getPrefixCode() {
    if (filenameVarName == null) {
      return "";
    }
    return "const "
        + filenameVarName
        + " = "
        + JsxText.toStringLiteral(filePath == null ? "" : filePath)
        + ";";
  }

  private int getLineNumberForIndex(int index) {
    String code = tokens.getCode();
    while (lastIndex < index && lastIndex < code.length()) {
      if (code.charAt(lastIndex) == '\n') {
        lastLineNumber++;
      }
      lastIndex++;
    }
    // Class field initializers are rewritten ahead of the code before them.
    while (lastIndex > index) {
      lastIndex--;
      if (code.charAt(lastIndex) == '\n') {
        lastLineNumber--;
      }
    }
    return lastLineNumber;
  }

  private String getFilenameVarName() {
    if (filenameVarName == null) {
      filenameVarName = nameManager.claimFreeName("_jsxFileName");
    }
    return filenameVarName;
  }

  private String getFactoryName() {
    String reactName = importBindings.getIdentifierReplacement("React");
    return reactName == null ? "React" : reactName;
  }

  private void processJsxTag() {
    String factoryName = getFactoryName();
    int firstTokenStart = tokens.currentToken().getStart();
    tokens.replaceToken(factoryName + ".createElement(");
    if (tokens.matches(TokenType.JSX_TAG_END)) {
      tokens.appendCode(factoryName + ".Fragment, null");
    } else {
      processTagIntro();
      processProps(firstTokenStart);
    }

    if (tokens.matches(TokenType.SLASH, TokenType.JSX_TAG_END)) {
      tokens.replaceToken("");
      tokens.replaceToken(")");
    } else if (tokens.matches(TokenType.JSX_TAG_END)) {
      tokens.replaceToken("");
      processChildren();
      // The closing tag.
      while (!tokens.matches(TokenType.JSX_TAG_END)) {
        tokens.replaceToken("");
      }
      tokens.replaceToken(")");
    } else {
      throw new IllegalStateException(
          "Expected either /> or > at the end of the tag at offset "
              + tokens.currentToken().getStart());
    }
  }

  /** Emits the element name as the first argument. */
  private void processTagIntro() {
    if (tokens.matches(TokenType.JSX_NAME, TokenType.COLON, TokenType.JSX_NAME)) {
      replaceNamespacedName();
      return;
    }
    if (!tokens.matches(TokenType.JSX_NAME, TokenType.DOT)) {
      String tagName = tokens.identifierName();
      if (startsWithLowerCase(tagName)) {
        tokens.replaceToken("'" + tagName + "'");
        return;
      }
    }
    rootTransformer.processToken();
    while (tokens.matches(TokenType.DOT, TokenType.JSX_NAME)) {
      tokens.copyToken();
      rootTransformer.processToken();
    }
  }

  /** Replaces {@code ns:name} with a single quoted string. */
  private void replaceNamespacedName() {
    Token first = tokens.currentToken();
    Token last = tokens.tokenAtRelativeIndex(2);
    String name = tokens.getCode().substring(first.getStart(), last.getEnd());
    tokens.replaceToken("'" + name + "'");
    tokens.replaceToken("");
    tokens.replaceToken("");
  }

  private void processProps(int firstTokenStart) {
    @Nullable String devProps = null;
    if (debugMetadata) {
      int lineNumber = getLineNumberForIndex(firstTokenStart);
      devProps =
          "__self: this, __source: {fileName: "
              + getFilenameVarName()
              + ", lineNumber: "
              + lineNumber
              + "}";
    }
    if (!tokens.matches(TokenType.JSX_NAME) && !tokens.matches(TokenType.BRACE_L)) {
      tokens.appendCode(devProps == null ? ", null" : ", {" + devProps + "}");
      return;
    }
    tokens.appendCode(", {");
    while (true) {
      if (tokens.matches(TokenType.JSX_NAME)) {
        processAttributeName();
        if (tokens.matches(TokenType.EQ)) {
          tokens.replaceToken(": ");
          processAttributeValue();
        } else {
          tokens.appendCode(": true");
        }
      } else if (tokens.matches(TokenType.BRACE_L)) {
        // A spread attribute stays a spread inside the props object.
        tokens.replaceToken("");
        rootTransformer.processBalancedCode();
        tokens.replaceToken("");
      } else {
        break;
      }
      tokens.appendCode(",");
    }
    tokens.appendCode(devProps == null ? "}" : " " + devProps + "}");
  }

  private void processAttributeName() {
    if (tokens.matches(TokenType.JSX_NAME, TokenType.COLON, TokenType.JSX_NAME)) {
      replaceNamespacedName();
      return;
    }
    String keyName = tokens.identifierName();
    if (keyName.contains("-")) {
      tokens.replaceToken("'" + keyName + "'");
    } else {
      tokens.copyToken();
    }
  }

  private void processAttributeValue() {
    if (tokens.matches(TokenType.BRACE_L)) {
      tokens.replaceToken("");
      rootTransformer.processBalancedCode();
      tokens.replaceToken("");
    } else if (tokens.matches(TokenType.JSX_TAG_START)) {
      processJsxTag();
    } else {
      Token token = tokens.currentToken();
      String valueCode = tokens.getCode().substring(token.getStart() + 1, token.getEnd() - 1);
      tokens.replaceToken(
          JsxText.formatStringValueLiteral(valueCode) + JsxText.formatTextReplacement(valueCode));
    }
  }

  private void processChildren() {
    while (true) {
      if (tokens.matches(TokenType.JSX_TAG_START, TokenType.SLASH)) {
        return;
      }
      if (tokens.matches(TokenType.BRACE_L, TokenType.BRACE_R)) {
        // Empty and comment-only containers add no argument.
        tokens.replaceToken("");
        tokens.replaceToken("");
      } else if (tokens.matches(TokenType.BRACE_L)) {
        tokens.replaceToken(", ");
        rootTransformer.processBalancedCode();
        tokens.replaceToken("");
      } else if (tokens.matches(TokenType.JSX_TAG_START)) {
        tokens.appendCode(", ");
        processJsxTag();
      } else if (tokens.matches(TokenType.JSX_TEXT)) {
        processChildTextElement();
      } else {
        throw new IllegalStateException(
            "Unexpected token when processing JSX children at offset "
                + tokens.currentToken().getStart());
      }
    }
  }

  private void processChildTextElement() {
    String valueCode = tokens.rawCode();
    String replacementCode = JsxText.formatTextReplacement(valueCode);
    String literalCode = JsxText.formatTextLiteral(valueCode);
    if (literalCode.equals("\"\"")) {
      tokens.replaceToken(replacementCode);
    } else {
      tokens.replaceToken(", " + literalCode + replacementCode);
    }
  }

  private static boolean startsWithLowerCase(String name) {
    char first = name.charAt(0);
    return Character.toLowerCase(first) == first;
  }
}
