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

import com.google.javascript.jstrip.parsing.TokenType;

/** Gives a {@code catch} clause without a binding, {@code catch {}}, an unused one. */
final class OptionalCatchBindingTransformer extends Transformer {
  private final TokenProcessor tokens;
  private final NameManager nameManager;

  OptionalCatchBindingTransformer(TokenProcessor tokens, NameManager nameManager) {
    this.tokens = tokens;
    this.nameManager = nameManager;
  }

  @Override
  boolean process() {
    if (tokens.matches(TokenType.CATCH, TokenType.BRACE_L)) {
      tokens.copyToken();
      tokens.appendCode(" (" + nameManager.claimFreeName("e") + ")");
      return true;
    }
    return false;
  }
}
