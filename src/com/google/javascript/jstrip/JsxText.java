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

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.jspecify.annotations.Nullable;

/** Turns raw JSX text and attribute strings into JavaScript string literals. */
final class JsxText {
  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  private static final CharMatcher HEX_DIGITS =
      CharMatcher.inRange('0', '9')
          .or(CharMatcher.inRange('a', 'f'))
          .or(CharMatcher.inRange('A', 'F'));
  private static final CharMatcher DECIMAL_DIGITS = CharMatcher.inRange('0', '9');

  /** How many characters after {@code &} are searched for the {@code ;} ending a reference. */
  private static final int ENTITY_LENGTH_LIMIT = 10;

  /**
   * Returns the string literal for a run of text between tags. Whitespace at the start and end of
   * each line is dropped, except next to the tags themselves; blank lines disappear; the
   * remaining lines are joined with single spaces. Returns {@code ""} (with the quotes) if
   * nothing is left.
   */
  static String formatTextLiteral(String text) {
    StringBuilder result = new StringBuilder();
    StringBuilder whitespace = new StringBuilder();
    boolean isInInitialLineWhitespace = false;
    boolean seenNonWhitespace = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == ' ' || c == '\t' || c == '\r') {
        if (!isInInitialLineWhitespace) {
          whitespace.append(c);
        }
      } else if (c == '\n') {
        whitespace.setLength(0);
        isInInitialLineWhitespace = true;
      } else {
        if (seenNonWhitespace && isInInitialLineWhitespace) {
          result.append(' ');
        }
        result.append(whitespace);
        whitespace.setLength(0);
        if (c == '&') {
          i = appendEntity(text, i + 1, result) - 1;
        } else {
          result.append(c);
        }
        seenNonWhitespace = true;
        isInInitialLineWhitespace = false;
      }
    }
    if (!isInInitialLineWhitespace) {
      result.append(whitespace);
    }
    return GSON.toJson(result.toString());
  }

  /**
   * Returns the code emitted after a text's string literal: the text's line breaks, then as many
   * spaces as follow its last line break. Keeps the rewritten code on the same lines.
   */
  static String formatTextReplacement(String text) {
    int newlines = 0;
    int spaces = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\n') {
        newlines++;
        spaces = 0;
      } else if (c == ' ') {
        spaces++;
      }
    }
    return Strings.repeat("\n", newlines) + Strings.repeat(" ", spaces);
  }

  /**
   * Returns the string literal for a quoted attribute value. A line break followed by whitespace
   * becomes one space; character references are decoded.
   */
  static String formatStringValueLiteral(String text) {
    StringBuilder result = new StringBuilder();
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\n') {
        if (isWhitespaceAt(text, i + 1)) {
          result.append(' ');
          while (isWhitespaceAt(text, i + 1)) {
            i++;
          }
        } else {
          result.append('\n');
        }
      } else if (c == '&') {
        i = appendEntity(text, i + 1, result) - 1;
      } else {
        result.append(c);
      }
    }
    return GSON.toJson(result.toString());
  }

  /** Returns {@code value} as a double-quoted JavaScript string literal. */
  static String toStringLiteral(String value) {
    return GSON.toJson(value);
  }

  private static boolean isWhitespaceAt(String text, int index) {
    return index < text.length() && CharMatcher.whitespace().matches(text.charAt(index));
  }

  /**
   * Decodes the character reference starting after an {@code &} and appends it. An unknown or
   * unterminated reference appends just the {@code &}, and the text after it is read as usual.
   *
   * @return the index after the consumed reference
   */
  private static int appendEntity(String text, int indexAfterAmpersand, StringBuilder out) {
    @Nullable String entity = null;
    int i = indexAfterAmpersand;
    int count = 0;
    while (i < text.length() && count++ < ENTITY_LENGTH_LIMIT) {
      char c = text.charAt(i);
      i++;
      if (c == ';') {
        entity = decodeReference(text.substring(indexAfterAmpersand, i - 1));
        break;
      }
    }
    if (entity == null) {
      out.append('&');
      return indexAfterAmpersand;
    }
    out.append(entity);
    return i;
  }

  private static @Nullable String decodeReference(String reference) {
    if (reference.startsWith("#x")) {
      return decodeCodePoint(reference.substring(2), HEX_DIGITS, 16);
    }
    if (reference.startsWith("#")) {
      return decodeCodePoint(reference.substring(1), DECIMAL_DIGITS, 10);
    }
    return XhtmlEntities.decode(reference);
  }

  private static @Nullable String decodeCodePoint(
      String digits, CharMatcher digitMatcher, int radix) {
    if (digits.isEmpty() || !digitMatcher.matchesAllOf(digits)) {
      return null;
    }
    long codePoint = Long.parseLong(digits, radix);
    if (codePoint > Character.MAX_CODE_POINT) {
      return null;
    }
    return new String(Character.toChars((int) codePoint));
  }

  private JsxText() {}
}
