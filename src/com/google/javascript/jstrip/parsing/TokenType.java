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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The closed set of token kinds produced by the {@link Tokenizer} and the {@link JsxScanner}.
 *
 * <p>Keywords get their own kinds. Contextual keywords ({@code let}, {@code async}, {@code of},
 * {@code type}, ...) are {@link #NAME} tokens and are recognized by their text.
 */
public enum TokenType {
  NUM("num", Flags.STARTS_EXPR),
  REGEXP("regexp", Flags.STARTS_EXPR),
  STRING("string", Flags.STARTS_EXPR),
  NAME("name", Flags.STARTS_EXPR),
  EOF("eof", 0),

  // Punctuation.
  BRACKET_L("[", Flags.STARTS_EXPR),
  BRACKET_R("]", 0),
  BRACE_L("{", Flags.STARTS_EXPR),
  BRACE_BAR_L("{|", Flags.STARTS_EXPR),
  BRACE_R("}", 0),
  BRACE_BAR_R("|}", 0),
  PAREN_L("(", Flags.STARTS_EXPR),
  PAREN_R(")", 0),
  COMMA(",", 0),
  SEMI(";", 0),
  COLON(":", 0),
  DOT(".", 0),
  QUESTION("?", 0),
  QUESTION_DOT("?.", 0),
  ARROW("=>", 0),
  TEMPLATE("template", 0),
  ELLIPSIS("...", 0),
  BACK_QUOTE("`", Flags.STARTS_EXPR),
  DOLLAR_BRACE_L("${", Flags.STARTS_EXPR),
  AT("@", 0),
  HASH("#", 0),

  // Operators.
  EQ("=", 0),
  ASSIGN("_=", 0),
  INC_DEC("++/--", Flags.STARTS_EXPR),
  BANG("!", Flags.STARTS_EXPR),
  TILDE("~", Flags.STARTS_EXPR),
  NULLISH("??", Flags.BINARY),
  LOGICAL_OR("||", Flags.BINARY),
  LOGICAL_AND("&&", Flags.BINARY),
  BITWISE_OR("|", Flags.BINARY),
  BITWISE_XOR("^", Flags.BINARY),
  BITWISE_AND("&", Flags.BINARY),
  EQUALITY("==/!=/===/!==", Flags.BINARY),
  LESS_THAN("<", Flags.BINARY | Flags.STARTS_EXPR),
  GREATER_THAN(">", Flags.BINARY),
  RELATIONAL("<=/>=", Flags.BINARY),
  BIT_SHIFT("<</>>/>>>", Flags.BINARY),
  PLUS_MIN("+/-", Flags.BINARY | Flags.STARTS_EXPR),
  MODULO("%", Flags.BINARY),
  STAR("*", Flags.BINARY),
  SLASH("/", Flags.BINARY | Flags.STARTS_EXPR),
  EXPONENT("**", Flags.BINARY),

  // JSX.
  JSX_NAME("jsxName", 0),
  JSX_TEXT("jsxText", 0),
  JSX_TAG_START("jsxTagStart", Flags.STARTS_EXPR),
  JSX_TAG_END("jsxTagEnd", 0),

  // Keywords.
  BREAK("break", Flags.KEYWORD),
  CASE("case", Flags.KEYWORD),
  CATCH("catch", Flags.KEYWORD),
  CONTINUE("continue", Flags.KEYWORD),
  DEBUGGER("debugger", Flags.KEYWORD),
  DEFAULT("default", Flags.KEYWORD),
  DO("do", Flags.KEYWORD),
  ELSE("else", Flags.KEYWORD),
  FINALLY("finally", Flags.KEYWORD),
  FOR("for", Flags.KEYWORD),
  FUNCTION("function", Flags.KEYWORD | Flags.STARTS_EXPR),
  IF("if", Flags.KEYWORD),
  RETURN("return", Flags.KEYWORD),
  SWITCH("switch", Flags.KEYWORD),
  THROW("throw", Flags.KEYWORD),
  TRY("try", Flags.KEYWORD),
  VAR("var", Flags.KEYWORD),
  CONST("const", Flags.KEYWORD),
  WHILE("while", Flags.KEYWORD),
  WITH("with", Flags.KEYWORD),
  NEW("new", Flags.KEYWORD | Flags.STARTS_EXPR),
  THIS("this", Flags.KEYWORD | Flags.STARTS_EXPR),
  SUPER("super", Flags.KEYWORD | Flags.STARTS_EXPR),
  CLASS("class", Flags.KEYWORD | Flags.STARTS_EXPR),
  EXTENDS("extends", Flags.KEYWORD),
  EXPORT("export", Flags.KEYWORD),
  IMPORT("import", Flags.KEYWORD | Flags.STARTS_EXPR),
  NULL("null", Flags.KEYWORD | Flags.STARTS_EXPR),
  TRUE("true", Flags.KEYWORD | Flags.STARTS_EXPR),
  FALSE("false", Flags.KEYWORD | Flags.STARTS_EXPR),
  IN("in", Flags.KEYWORD | Flags.BINARY),
  INSTANCEOF("instanceof", Flags.KEYWORD | Flags.BINARY),
  TYPEOF("typeof", Flags.KEYWORD | Flags.STARTS_EXPR),
  VOID("void", Flags.KEYWORD | Flags.STARTS_EXPR),
  DELETE("delete", Flags.KEYWORD | Flags.STARTS_EXPR);

  private static final ImmutableMap<String, TokenType> KEYWORDS;

  static {
    ImmutableMap.Builder<String, TokenType> builder = ImmutableMap.builder();
    for (TokenType type : values()) {
      if (type.isKeyword()) {
        builder.put(type.label, type);
      }
    }
    KEYWORDS = builder.buildOrThrow();
  }

  private final String label;
  private final int flags;

  TokenType(String label, int flags) {
    this.label = label;
    this.flags = flags;
  }

  /** The keyword text, or a short description for the other kinds. */
  public String getLabel() {
    return label;
  }

  public boolean isKeyword() {
    return (flags & Flags.KEYWORD) != 0;
  }

  /** Whether the kind can appear between two operands of a binary expression. */
  public boolean isBinaryOperator() {
    return (flags & Flags.BINARY) != 0;
  }

  /** Whether a token of this kind can begin an expression. */
  public boolean startsExpression() {
    return (flags & Flags.STARTS_EXPR) != 0;
  }

  /** Returns the keyword kind spelled by {@code word}, or {@code null} for other words. */
  static @Nullable TokenType keywordFor(String word) {
    return KEYWORDS.get(word);
  }

  @Override
  public String toString() {
    return label;
  }

  private static final class Flags {
    static final int KEYWORD = 1;
    static final int BINARY = 1 << 1;
    static final int STARTS_EXPR = 1 << 2;

    private Flags() {}
  }
}
