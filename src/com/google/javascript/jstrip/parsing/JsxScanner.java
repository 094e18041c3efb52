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

/**
 * Scans the tokens that only exist inside JSX: tag names and attribute names that may contain
 * dashes, attribute strings without escapes, and raw text between tags.
 */
final class JsxScanner {
  private final ScanState state;
  private final Tokenizer tokenizer;

  JsxScanner(ScanState state, Tokenizer tokenizer) {
    this.state = state;
    this.tokenizer = tokenizer;
  }

  /** Pushes the current token and scans the next token inside a tag. */
  void nextTagToken() {
    state.tokens.add(new Token(state));
    tokenizer.skipSpace();
    state.start = state.pos;
    if (state.pos >= state.input.length()) {
      throw tokenizer.raise(state.start, "Unterminated JSX tag");
    }
    int code = state.input.codePointAt(state.pos);
    if (Tokenizer.isIdentifierStart(code)) {
      readWord();
    } else if (code == '"' || code == '\'') {
      readString((char) code);
    } else {
      TokenType type;
      switch (code) {
        case '<':
          type = TokenType.JSX_TAG_START;
          break;
        case '>':
          type = TokenType.JSX_TAG_END;
          break;
        case '/':
          type = TokenType.SLASH;
          break;
        case '=':
          type = TokenType.EQ;
          break;
        case '{':
          type = TokenType.BRACE_L;
          break;
        case '.':
          type = TokenType.DOT;
          break;
        case ':':
          type = TokenType.COLON;
          break;
        default:
          throw tokenizer.raise(
              state.start, "Unexpected character '" + (char) code + "' in JSX tag");
      }
      state.pos++;
      tokenizer.finishToken(type);
    }
  }

  /** Pushes the current token and scans the next piece of element content. */
  void nextContentToken() {
    state.tokens.add(new Token(state));
    state.start = state.pos;
    readContentToken();
  }

  /** Reads text up to the next {@code <} or {@code {}, or that delimiter itself. */
  private void readContentToken() {
    String input = state.input;
    while (true) {
      if (state.pos >= input.length()) {
        throw tokenizer.raise(state.start, "Unterminated JSX contents");
      }
      char ch = input.charAt(state.pos);
      if (ch == '<' || ch == '{') {
        if (state.pos == state.start) {
          state.pos++;
          tokenizer.finishToken(ch == '<' ? TokenType.JSX_TAG_START : TokenType.BRACE_L);
        } else {
          tokenizer.finishToken(TokenType.JSX_TEXT, input.substring(state.start, state.pos));
        }
        return;
      }
      state.pos++;
    }
  }

  /** Reads an attribute value verbatim, up to the matching quote. */
  private void readString(char quote) {
    String input = state.input;
    state.pos++;
    while (true) {
      if (state.pos >= input.length()) {
        throw tokenizer.raise(state.start, "Unterminated string constant");
      }
      if (input.charAt(state.pos) == quote) {
        state.pos++;
        break;
      }
      state.pos++;
    }
    tokenizer.finishToken(TokenType.STRING, input.substring(state.start + 1, state.pos - 1));
  }

  /** Reads a tag or attribute name. The caller has checked the first character. */
  private void readWord() {
    String input = state.input;
    int code;
    do {
      state.pos += Character.charCount(input.codePointAt(state.pos));
      code = state.pos < input.length() ? input.codePointAt(state.pos) : -1;
    } while (code != -1 && (Tokenizer.isIdentifierChar(code) || code == '-'));
    tokenizer.finishToken(TokenType.JSX_NAME, input.substring(state.start, state.pos));
  }
}
