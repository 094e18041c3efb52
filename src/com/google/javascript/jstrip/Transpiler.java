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

import com.google.common.collect.ImmutableList;
import com.google.javascript.jstrip.parsing.JsSyntaxException;
import com.google.javascript.jstrip.parsing.Parser;
import com.google.javascript.jstrip.parsing.Token;
import java.util.logging.Logger;

/**
 * Rewrites JavaScript that uses JSX, type annotations or module syntax into plain JavaScript
 * without building a syntax tree. Runs are independent and share no state.
 */
public final class Transpiler {
  private static final Logger logger = Logger.getLogger(Transpiler.class.getName());

  /**
   * Returns {@code code} with the transforms of {@code options} applied.
   *
   * @throws JsSyntaxException if {@code code} cannot be parsed with the selected syntax
   */
  public static String transform(String code, TranspileOptions options) {
    boolean isTypeScript = options.has(Transform.TYPESCRIPT);
    ImmutableList<Token> tokenList =
        Parser.parse(code, options.has(Transform.JSX), isTypeScript, options.has(Transform.FLOW));
    logger.fine("Parsed " + tokenList.size() + " tokens from " + options.filePath());

    TokenProcessor tokens = new TokenProcessor(code, tokenList);
    NameManager nameManager = new NameManager(tokenList);
    ImportProcessor importProcessor = new ImportProcessor(nameManager, tokens, isTypeScript);
    if (options.has(Transform.IMPORTS)) {
      importProcessor.preprocessTokens();
      if (isTypeScript) {
        importProcessor.pruneTypeOnlyImports();
      }
    }
    return new RootTransformer(tokens, nameManager, importProcessor, options).transform();
  }

  // Don't instantiate.
  private Transpiler() {}
}
