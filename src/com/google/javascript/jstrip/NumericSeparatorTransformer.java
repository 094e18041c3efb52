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
import com.google.javascript.jstrip.parsing.TokenType;

/** Removes the {@code _} separators from numeric literals such as {@code 1_000_000}. */
final class NumericSeparatorTransformer extends Transformer {
  private final TokenProcessor tokens;

  NumericSeparatorTransformer(TokenProcessor tokens) {
    this.tokens = tokens;
  }

  @Override
  boolean process() {
    if (!tokens.matches(TokenType.NUM) || tokens.currentToken().isType()) {
      return false;
    }
    String code = tokens.rawCode();
    if (code.indexOf('_') == -1) {
      return false;
    }
    tokens.replaceToken(CharMatcher.is('_').removeFrom(code));
    return true;
  }
}
