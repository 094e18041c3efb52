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

import com.google.common.collect.ImmutableList;

/**
 * Turns source text into an annotated token list. No syntax tree is built: parsing exists to
 * decide, for every token, whether it is part of a type, what role an identifier plays, and which
 * tokens open and close the same construct.
 *
 * <p>Instances are single use; call {@link #parse} instead of constructing one.
 */
public final class Parser {
  final ScanState state;
  final Tokenizer tokenizer;
  final JsxScanner jsxScanner;
  final TypeParser types;
  final LvalParser lvals;
  final ExpressionParser expressions;
  final StatementParser statements;
  final JsxParser jsx;

  private Parser(String input, boolean isJsx, boolean isTypeScript, boolean isFlow) {
    this.state = new ScanState(input, isJsx, isTypeScript, isFlow);
    this.tokenizer = new Tokenizer(state);
    this.jsxScanner = new JsxScanner(state, tokenizer);
    this.types = new TypeParser(state, this);
    this.lvals = new LvalParser(state, this);
    this.expressions = new ExpressionParser(state, this);
    this.statements = new StatementParser(state, this);
    this.jsx = new JsxParser(state, this);
  }

  /**
   * Parses a whole program.
   *
   * @throws JsSyntaxException if the input is not valid in the selected syntax, or uses a
   *     construct that cannot be removed token by token
   */
  public static ImmutableList<Token> parse(
      String input, boolean isJsx, boolean isTypeScript, boolean isFlow) {
    Parser parser = new Parser(input, isJsx, isTypeScript, isFlow);
    parser.tokenizer.nextToken();
    parser.statements.parseTopLevel();
    return ImmutableList.copyOf(parser.state.tokens);
  }
}
