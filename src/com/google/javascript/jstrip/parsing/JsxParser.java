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
import static com.google.javascript.jstrip.parsing.TokenType.JSX_NAME;
import static com.google.javascript.jstrip.parsing.TokenType.JSX_TAG_END;
import static com.google.javascript.jstrip.parsing.TokenType.JSX_TAG_START;

import org.jspecify.annotations.Nullable;

/**
 * Parses JSX elements. Tags are scanned with {@link JsxScanner}; embedded expressions switch back
 * to the regular tokenizer and return to JSX scanning at their closing brace.
 */
final class JsxParser {
  private final ScanState state;
  private final Parser parser;

  JsxParser(ScanState state, Parser parser) {
    this.state = state;
    this.parser = parser;
  }

  /**
   * Parses an element whose {@code <} is the current token. The closing {@code >} is left as the
   * current token so the caller can resume regular scanning after it.
   */
  void parseElement() {
    parser.jsxScanner.nextTagToken();
    parseElementAt();
  }

  private void parseElementAt() {
    JsxScanner scanner = parser.jsxScanner;
    @Nullable String name = null;
    if (!match(JSX_TAG_END)) {
      name = parseElementName();
      while (!match(TokenType.SLASH) && !match(JSX_TAG_END)) {
        parseAttribute();
      }
      if (match(TokenType.SLASH)) {
        scanner.nextTagToken();
        require(JSX_TAG_END);
        return;
      }
    }
    scanner.nextContentToken();
    while (true) {
      switch (state.type) {
        case JSX_TAG_START:
          scanner.nextTagToken();
          if (match(TokenType.SLASH)) {
            scanner.nextTagToken();
            parseClosingElement(name);
            return;
          }
          parseElementAt();
          scanner.nextContentToken();
          break;
        case JSX_TEXT:
          scanner.nextContentToken();
          break;
        case BRACE_L:
          parser.tokenizer.next();
          if (parser.tokenizer.eat(TokenType.ELLIPSIS)) {
            parser.expressions.parseExpression();
          } else if (!match(BRACE_R)) {
            parser.expressions.parseExpression();
          }
          require(BRACE_R);
          scanner.nextContentToken();
          break;
        default:
          throw parser.tokenizer.unexpected();
      }
    }
  }

  private void parseClosingElement(@Nullable String openingName) {
    int closingStart = state.start;
    @Nullable String closingName = match(JSX_TAG_END) ? null : parseElementName();
    if (openingName == null ? closingName != null : !openingName.equals(closingName)) {
      throw parser.tokenizer.raise(
          closingStart,
          "Expected corresponding JSX closing tag for <" + (openingName == null ? "" : openingName)
              + ">");
    }
    require(JSX_TAG_END);
  }

  /**
   * Parses a plain, namespaced ({@code a:b}) or member ({@code a.b.c}) element name and returns
   * its text. Only a plain or member name refers to a binding.
   */
  private String parseElementName() {
    JsxScanner scanner = parser.jsxScanner;
    int nameStart = state.start;
    require(JSX_NAME);
    scanner.nextTagToken();
    if (match(TokenType.COLON)) {
      scanner.nextTagToken();
      require(JSX_NAME);
      scanner.nextTagToken();
    } else {
      state.lastToken().setIdentifierRole(IdentifierRole.ACCESS);
      while (match(TokenType.DOT)) {
        scanner.nextTagToken();
        require(JSX_NAME);
        scanner.nextTagToken();
      }
    }
    return state.input.substring(nameStart, state.lastToken().getEnd());
  }

  private void parseAttribute() {
    JsxScanner scanner = parser.jsxScanner;
    if (match(BRACE_L)) {
      parser.tokenizer.next();
      parser.tokenizer.expect(TokenType.ELLIPSIS);
      parser.expressions.parseMaybeAssign();
      require(BRACE_R);
      scanner.nextTagToken();
      return;
    }
    require(JSX_NAME);
    scanner.nextTagToken();
    if (match(TokenType.COLON)) {
      scanner.nextTagToken();
      require(JSX_NAME);
      scanner.nextTagToken();
    }
    if (!match(TokenType.EQ)) {
      return;
    }
    scanner.nextTagToken();
    switch (state.type) {
      case BRACE_L:
        parser.tokenizer.next();
        if (match(BRACE_R)) {
          throw parser.tokenizer.raise(
              state.start, "JSX attributes must only be assigned a non-empty expression");
        }
        parser.expressions.parseMaybeAssign();
        require(BRACE_R);
        scanner.nextTagToken();
        return;
      case JSX_TAG_START:
        parseElement();
        scanner.nextTagToken();
        return;
      case STRING:
        scanner.nextTagToken();
        return;
      default:
        throw parser.tokenizer.raise(
            state.start, "JSX value should be either an expression or a quoted JSX text");
    }
  }

  private boolean match(TokenType type) {
    return state.type == type;
  }

  /** Checks the current token without consuming it. */
  private void require(TokenType type) {
    if (state.type != type) {
      throw parser.tokenizer.unexpected();
    }
  }
}
