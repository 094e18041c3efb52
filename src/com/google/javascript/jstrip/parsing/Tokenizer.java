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

import static com.google.javascript.jstrip.parsing.TokenType.NAME;

import com.google.common.base.CharMatcher;
import org.jspecify.annotations.Nullable;

/**
 * Reads plain JavaScript tokens from the input, one at a time, as the parser consumes them.
 *
 * <p>Regular expressions and template strings depend on parser context, so the parser asks for
 * them explicitly with {@link #readRegexp()} and the {@code nextTemplate*} methods.
 */
final class Tokenizer {
  private static final CharMatcher HEX_DIGITS =
      CharMatcher.inRange('0', '9')
          .or(CharMatcher.inRange('a', 'f'))
          .or(CharMatcher.inRange('A', 'F'));

  private final ScanState state;

  Tokenizer(ScanState state) {
    this.state = state;
  }

  /** Pushes the current token and scans the following one. */
  void next() {
    state.tokens.add(new Token(state));
    nextToken();
  }

  void nextToken() {
    skipSpace();
    state.start = state.pos;
    if (state.pos >= state.input.length()) {
      finishToken(TokenType.EOF);
      return;
    }
    readToken(state.input.codePointAt(state.pos));
  }

  boolean match(TokenType type) {
    return state.type == type;
  }

  boolean eat(TokenType type) {
    if (state.type == type) {
      next();
      return true;
    }
    return false;
  }

  void expect(TokenType type) {
    if (!eat(type)) {
      throw raise(state.start, "Expected \"" + type.getLabel() + "\" but found " + describe());
    }
  }

  /** Whether the current token is the unescaped identifier {@code name}. */
  boolean isContextual(String name) {
    return state.type == NAME && name.equals(state.value);
  }

  boolean eatContextual(String name) {
    if (isContextual(name)) {
      next();
      return true;
    }
    return false;
  }

  void expectContextual(String name) {
    if (!eatContextual(name)) {
      throw raise(state.start, "Expected \"" + name + "\" but found " + describe());
    }
  }

  /** Consumes the current token as a name even when it is spelled like a keyword. */
  void nextAsName() {
    if (state.type.isKeyword()) {
      state.type = NAME;
      state.value = state.input.substring(state.start, state.end);
    }
    expect(NAME);
  }

  boolean hasPrecedingLineBreak() {
    int previousEnd = state.tokens.isEmpty() ? 0 : state.lastToken().getEnd();
    return containsLineBreak(previousEnd, state.start);
  }

  boolean hasLineBreakBefore(Token token) {
    return containsLineBreak(state.end, token.getStart());
  }

  private boolean containsLineBreak(int from, int to) {
    for (int i = from; i < to; i++) {
      if (isNewLine(state.input.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  boolean canInsertSemicolon() {
    return match(TokenType.EOF) || match(TokenType.BRACE_R) || hasPrecedingLineBreak();
  }

  /** Consumes a statement terminator, allowing it to be inserted automatically. */
  void semicolon() {
    if (!eat(TokenType.SEMI) && !canInsertSemicolon()) {
      throw unexpected();
    }
  }

  /** Returns the token after the current one without consuming anything. */
  Token lookahead() {
    return lookahead(1);
  }

  /** Returns the token {@code distance} positions after the current one. */
  Token lookahead(int distance) {
    ScanState.Snapshot snapshot = state.snapshot();
    try {
      for (int i = 0; i < distance; i++) {
        next();
      }
      return new Token(state);
    } finally {
      state.restore(snapshot);
    }
  }

  /**
   * Runs {@code parse} speculatively. If it raises a syntax error the state is rewound to where it
   * was and {@code false} is returned.
   */
  boolean tryParse(Runnable parse) {
    ScanState.Snapshot snapshot = state.snapshot();
    try {
      parse.run();
      return true;
    } catch (JsSyntaxException e) {
      state.restore(snapshot);
      return false;
    }
  }

  void runInTypeContext(Runnable parse) {
    boolean wasType = state.isType;
    state.isType = true;
    try {
      parse.run();
    } finally {
      state.isType = wasType;
    }
  }

  JsSyntaxException unexpected() {
    return raise(state.start, "Unexpected token " + describe());
  }

  JsSyntaxException raise(int offset, String message) {
    return JsSyntaxException.at(state.input, offset, message);
  }

  private String describe() {
    if (state.type == TokenType.EOF) {
      return "end of input";
    }
    return "\"" + state.input.substring(state.start, state.end) + "\"";
  }

  void finishToken(TokenType type) {
    finishToken(type, null);
  }

  void finishToken(TokenType type, @Nullable String value) {
    state.end = state.pos;
    state.type = type;
    state.value = value;
  }

  private void finishOp(TokenType type, int size) {
    state.pos += size;
    finishToken(type);
  }

  void skipSpace() {
    String input = state.input;
    if (state.pos == 0 && input.startsWith("#!")) {
      skipLineComment();
    }
    while (state.pos < input.length()) {
      char ch = input.charAt(state.pos);
      if (ch == '/') {
        char nextCh = charAt(state.pos + 1);
        if (nextCh == '/') {
          skipLineComment();
        } else if (nextCh == '*') {
          skipBlockComment();
        } else {
          return;
        }
      } else if (ch == ' ' || ch == '\t' || isNewLine(ch) || Character.isSpaceChar(ch)
          || ch == '\u000b' || ch == '\f' || ch == '\ufeff') {
        state.pos++;
      } else {
        return;
      }
    }
  }

  private void skipLineComment() {
    while (state.pos < state.input.length() && !isNewLine(state.input.charAt(state.pos))) {
      state.pos++;
    }
  }

  private void skipBlockComment() {
    int commentStart = state.pos;
    int commentEnd = state.input.indexOf("*/", state.pos + 2);
    if (commentEnd == -1) {
      throw raise(commentStart, "Unterminated comment");
    }
    state.pos = commentEnd + 2;
  }

  private void readToken(int code) {
    if (isIdentifierStart(code) || code == '\\') {
      readWord();
      return;
    }
    switch (code) {
      case '.':
        if (isDigit(charAt(state.pos + 1))) {
          readNumber();
        } else if (charAt(state.pos + 1) == '.' && charAt(state.pos + 2) == '.') {
          finishOp(TokenType.ELLIPSIS, 3);
        } else {
          finishOp(TokenType.DOT, 1);
        }
        return;
      case '(':
        finishOp(TokenType.PAREN_L, 1);
        return;
      case ')':
        finishOp(TokenType.PAREN_R, 1);
        return;
      case ';':
        finishOp(TokenType.SEMI, 1);
        return;
      case ',':
        finishOp(TokenType.COMMA, 1);
        return;
      case '[':
        finishOp(TokenType.BRACKET_L, 1);
        return;
      case ']':
        finishOp(TokenType.BRACKET_R, 1);
        return;
      case '{':
        if (state.isFlow && state.isType && charAt(state.pos + 1) == '|') {
          finishOp(TokenType.BRACE_BAR_L, 2);
        } else {
          finishOp(TokenType.BRACE_L, 1);
        }
        return;
      case '}':
        finishOp(TokenType.BRACE_R, 1);
        return;
      case ':':
        finishOp(TokenType.COLON, 1);
        return;
      case '~':
        finishOp(TokenType.TILDE, 1);
        return;
      case '@':
        finishOp(TokenType.AT, 1);
        return;
      case '#':
        finishOp(TokenType.HASH, 1);
        return;
      case '`':
        finishOp(TokenType.BACK_QUOTE, 1);
        return;
      case '?':
        readQuestionMark();
        return;
      case '"':
      case '\'':
        readString((char) code);
        return;
      case '/':
        readSlashOrModulo(TokenType.SLASH);
        return;
      case '%':
        readSlashOrModulo(TokenType.MODULO);
        return;
      case '*':
        readStar();
        return;
      case '|':
      case '&':
        readPipeOrAmpersand((char) code);
        return;
      case '^':
        readAssignable(TokenType.BITWISE_XOR, 1);
        return;
      case '+':
      case '-':
        readPlusMinus((char) code);
        return;
      case '<':
      case '>':
        readAngle((char) code);
        return;
      case '=':
      case '!':
        readEqualsOrBang((char) code);
        return;
      default:
        if (isDigit(code)) {
          readNumber();
          return;
        }
        throw raise(
            state.pos, "Unexpected character '" + new String(Character.toChars(code)) + "'");
    }
  }

  private void readQuestionMark() {
    char nextCh = charAt(state.pos + 1);
    if (nextCh == '.' && !isDigit(charAt(state.pos + 2))) {
      finishOp(TokenType.QUESTION_DOT, 2);
    } else if (nextCh == '?') {
      readAssignable(TokenType.NULLISH, 2);
    } else {
      finishOp(TokenType.QUESTION, 1);
    }
  }

  private void readSlashOrModulo(TokenType type) {
    readAssignable(type, 1);
  }

  private void readStar() {
    if (charAt(state.pos + 1) == '*') {
      readAssignable(TokenType.EXPONENT, 2);
    } else {
      readAssignable(TokenType.STAR, 1);
    }
  }

  private void readPipeOrAmpersand(char ch) {
    char nextCh = charAt(state.pos + 1);
    if (nextCh == ch) {
      readAssignable(ch == '|' ? TokenType.LOGICAL_OR : TokenType.LOGICAL_AND, 2);
    } else if (ch == '|' && nextCh == '}' && state.isFlow && state.isType) {
      finishOp(TokenType.BRACE_BAR_R, 2);
    } else {
      readAssignable(ch == '|' ? TokenType.BITWISE_OR : TokenType.BITWISE_AND, 1);
    }
  }

  private void readPlusMinus(char ch) {
    char nextCh = charAt(state.pos + 1);
    if (nextCh == ch) {
      finishOp(TokenType.INC_DEC, 2);
    } else {
      readAssignable(TokenType.PLUS_MIN, 1);
    }
  }

  private void readAngle(char ch) {
    TokenType single = ch == '<' ? TokenType.LESS_THAN : TokenType.GREATER_THAN;
    if (state.isType) {
      // Keeps "A<B<C>>" from closing both type argument lists with one token.
      finishOp(single, 1);
      return;
    }
    int size = 1;
    if (charAt(state.pos + 1) == ch) {
      size = ch == '>' && charAt(state.pos + 2) == '>' ? 3 : 2;
      readAssignable(TokenType.BIT_SHIFT, size);
      return;
    }
    if (charAt(state.pos + 1) == '=') {
      finishOp(TokenType.RELATIONAL, 2);
      return;
    }
    finishOp(single, size);
  }

  private void readEqualsOrBang(char ch) {
    if (ch == '=' && charAt(state.pos + 1) == '>') {
      finishOp(TokenType.ARROW, 2);
      return;
    }
    if (charAt(state.pos + 1) == '=') {
      finishOp(TokenType.EQUALITY, charAt(state.pos + 2) == '=' ? 3 : 2);
      return;
    }
    finishOp(ch == '=' ? TokenType.EQ : TokenType.BANG, 1);
  }

  /** Reads an operator of {@code size} characters, or its compound assignment form. */
  private void readAssignable(TokenType type, int size) {
    if (charAt(state.pos + size) == '=') {
      finishOp(TokenType.ASSIGN, size + 1);
    } else {
      finishOp(type, size);
    }
  }

  private void readWord() {
    StringBuilder word = new StringBuilder();
    String input = state.input;
    while (state.pos < input.length()) {
      int code = input.codePointAt(state.pos);
      if (code == '\\') {
        word.appendCodePoint(readIdentifierEscape());
      } else if (isIdentifierChar(code)) {
        word.appendCodePoint(code);
        state.pos += Character.charCount(code);
      } else {
        break;
      }
    }
    String name = word.toString();
    TokenType keyword = TokenType.keywordFor(name);
    finishToken(keyword != null ? keyword : NAME, name);
  }

  private int readIdentifierEscape() {
    int escapeStart = state.pos;
    if (charAt(state.pos + 1) != 'u') {
      throw raise(escapeStart, "Expected Unicode escape sequence \\uXXXX");
    }
    state.pos += 2;
    return readUnicodeEscapeDigits(escapeStart);
  }

  private int readUnicodeEscapeDigits(int escapeStart) {
    String digits;
    if (charAt(state.pos) == '{') {
      int close = state.input.indexOf('}', state.pos);
      if (close == -1) {
        throw raise(escapeStart, "Bad character escape sequence");
      }
      digits = state.input.substring(state.pos + 1, close);
      state.pos = close + 1;
    } else {
      digits = state.input.substring(state.pos, Math.min(state.pos + 4, state.input.length()));
      if (digits.length() != 4) {
        throw raise(escapeStart, "Bad character escape sequence");
      }
      state.pos += 4;
    }
    return parseHex(digits, escapeStart);
  }

  /** Parses hex digits naming a code point, raising a syntax error for anything else. */
  private int parseHex(String digits, int escapeStart) {
    if (digits.isEmpty() || !HEX_DIGITS.matchesAllOf(digits)) {
      throw raise(escapeStart, "Bad character escape sequence");
    }
    int value = 0;
    for (int i = 0; i < digits.length(); i++) {
      value = value * 16 + Character.digit(digits.charAt(i), 16);
      if (value > Character.MAX_CODE_POINT) {
        throw raise(escapeStart, "Bad character escape sequence");
      }
    }
    return value;
  }

  private void readNumber() {
    String input = state.input;
    char first = charAt(state.pos);
    char second = charAt(state.pos + 1);
    if (first == '0' && "xXoObB".indexOf(second) >= 0) {
      state.pos += 2;
      while (state.pos < input.length()
          && (Character.digit(input.charAt(state.pos), 16) >= 0
              || input.charAt(state.pos) == '_')) {
        state.pos++;
      }
    } else {
      readDigits();
      if (charAt(state.pos) == '.') {
        state.pos++;
        readDigits();
      }
      char exponent = charAt(state.pos);
      if (exponent == 'e' || exponent == 'E') {
        state.pos++;
        if (charAt(state.pos) == '+' || charAt(state.pos) == '-') {
          state.pos++;
        }
        readDigits();
      }
    }
    if (charAt(state.pos) == 'n') {
      state.pos++;
    }
    finishToken(TokenType.NUM, input.substring(state.start, state.pos));
  }

  private void readDigits() {
    while (isDigit(charAt(state.pos)) || charAt(state.pos) == '_') {
      state.pos++;
    }
  }

  private void readString(char quote) {
    StringBuilder out = new StringBuilder();
    String input = state.input;
    state.pos++;
    while (true) {
      if (state.pos >= input.length()) {
        throw raise(state.start, "Unterminated string constant");
      }
      char ch = input.charAt(state.pos);
      if (ch == quote) {
        state.pos++;
        break;
      }
      if (ch == '\\') {
        readStringEscape(out);
      } else if (ch == '\n' || ch == '\r') {
        throw raise(state.start, "Unterminated string constant");
      } else {
        out.append(ch);
        state.pos++;
      }
    }
    finishToken(TokenType.STRING, out.toString());
  }

  private void readStringEscape(StringBuilder out) {
    int escapeStart = state.pos;
    state.pos++;
    if (state.pos >= state.input.length()) {
      throw raise(state.start, "Unterminated string constant");
    }
    char ch = state.input.charAt(state.pos++);
    switch (ch) {
      case 'n':
        out.append('\n');
        break;
      case 'r':
        out.append('\r');
        break;
      case 't':
        out.append('\t');
        break;
      case 'b':
        out.append('\b');
        break;
      case 'f':
        out.append('\f');
        break;
      case 'v':
        out.append('\u000b');
        break;
      case '0':
        out.append('\0');
        break;
      case 'x':
        String hexDigits = substring(state.pos, state.pos + 2);
        if (hexDigits.length() != 2) {
          throw raise(escapeStart, "Bad character escape sequence");
        }
        out.append((char) parseHex(hexDigits, escapeStart));
        state.pos += 2;
        break;
      case 'u':
        out.appendCodePoint(readUnicodeEscapeDigits(escapeStart));
        break;
      case '\r':
        if (charAt(state.pos) == '\n') {
          state.pos++;
        }
        break;
      case '\n':
      case '\u2028':
      case '\u2029':
        break;
      default:
        out.append(ch);
    }
  }

  /** Re-reads the current {@code /} or {@code /=} token as a regular expression literal. */
  void readRegexp() {
    String input = state.input;
    state.pos = state.start + 1;
    boolean escaped = false;
    boolean inClass = false;
    while (true) {
      if (state.pos >= input.length() || isNewLine(input.charAt(state.pos))) {
        throw raise(state.start, "Unterminated regular expression");
      }
      char ch = input.charAt(state.pos);
      if (escaped) {
        escaped = false;
      } else if (ch == '[') {
        inClass = true;
      } else if (ch == ']' && inClass) {
        inClass = false;
      } else if (ch == '/' && !inClass) {
        break;
      } else {
        escaped = ch == '\\';
      }
      state.pos++;
    }
    state.pos++;
    while (state.pos < input.length() && isIdentifierChar(input.codePointAt(state.pos))) {
      state.pos += Character.charCount(input.codePointAt(state.pos));
    }
    finishToken(TokenType.REGEXP, input.substring(state.start, state.pos));
  }

  /** Pushes the current token and reads raw template text up to the next delimiter. */
  void nextTemplateChunk() {
    state.tokens.add(new Token(state));
    state.start = state.pos;
    String input = state.input;
    while (true) {
      if (state.pos >= input.length()) {
        throw raise(state.start, "Unterminated template");
      }
      char ch = input.charAt(state.pos);
      if (ch == '`' || (ch == '$' && charAt(state.pos + 1) == '{')) {
        break;
      }
      state.pos += ch == '\\' ? 2 : 1;
    }
    finishToken(TokenType.TEMPLATE, input.substring(state.start, state.pos));
  }

  /** Pushes a template chunk and reads the closing backquote or a {@code ${}. */
  void nextTemplateDelimiter() {
    state.tokens.add(new Token(state));
    state.start = state.pos;
    if (charAt(state.pos) == '`') {
      finishOp(TokenType.BACK_QUOTE, 1);
    } else {
      finishOp(TokenType.DOLLAR_BRACE_L, 2);
    }
  }

  private char charAt(int index) {
    return index < state.input.length() ? state.input.charAt(index) : 0;
  }

  private String substring(int from, int to) {
    return state.input.substring(from, Math.min(to, state.input.length()));
  }

  static boolean isIdentifierStart(int code) {
    return code == '$' || code == '_' || Character.isUnicodeIdentifierStart(code);
  }

  static boolean isIdentifierChar(int code) {
    if (code == '$' || code == '\u200c' || code == '\u200d') {
      return true;
    }
    return Character.isUnicodeIdentifierPart(code) && !Character.isIdentifierIgnorable(code);
  }

  static boolean isNewLine(int code) {
    return code == '\n' || code == '\r' || code == '\u2028' || code == '\u2029';
  }

  private static boolean isDigit(int code) {
    return code >= '0' && code <= '9';
  }
}
