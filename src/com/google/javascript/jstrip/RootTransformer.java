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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import com.google.javascript.jstrip.parsing.Token;
import com.google.javascript.jstrip.parsing.TokenType;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Drives the rewrite of one file: walks the tokens once, hands each one to the feature
 * transformers in a fixed order, rewrites classes itself, and assembles the output with the
 * transformers' prefix and suffix code.
 */
final class RootTransformer {
  private static final Logger logger = Logger.getLogger(RootTransformer.class.getName());

  private final TokenProcessor tokens;
  private final NameManager nameManager;
  private final ImmutableList<Transformer> transformers;
  private final boolean shouldAddUseStrict;
  private final List<String> generatedVariables = new ArrayList<>();

  RootTransformer(
      TokenProcessor tokens,
      NameManager nameManager,
      ImportProcessor importProcessor,
      TranspileOptions options) {
    this.tokens = tokens;
    this.nameManager = nameManager;

    ImmutableList.Builder<Transformer> transformers = ImmutableList.builder();
    transformers.add(new NumericSeparatorTransformer(tokens));
    transformers.add(new OptionalCatchBindingTransformer(tokens, nameManager));
    if (options.has(Transform.JSX)) {
      transformers.add(
          new JsxTransformer(
              this,
              tokens,
              importProcessor,
              nameManager,
              options.filePath(),
              options.jsxDebugMetadata()));
      transformers.add(
          new ReactDisplayNameTransformer(this, tokens, importProcessor, options.filePath()));
    }
    if (options.has(Transform.IMPORTS)) {
      transformers.add(
          new ImportTransformer(
              this, tokens, importProcessor, options.has(Transform.ADD_MODULE_EXPORTS)));
    }
    if (options.has(Transform.FLOW)) {
      transformers.add(new FlowTransformer(this));
    }
    if (options.has(Transform.TYPESCRIPT)) {
      transformers.add(new TypeScriptTransformer(this));
    }
    this.transformers = transformers.build();
    this.shouldAddUseStrict = options.has(Transform.IMPORTS);
  }

  String transform() {
    processBalancedCode();
    StringBuilder prefix = new StringBuilder();
    // The directive has to come before any injected code.
    if (shouldAddUseStrict) {
      prefix.append("\"use strict\";");
    }
    for (Transformer transformer : transformers) {
      prefix.append(transformer.getPrefixCode());
    }
    for (String variable : generatedVariables) {
      prefix.append(" var ").append(variable).append(";");
    }
    StringBuilder suffix = new StringBuilder();
    for (Transformer transformer : transformers) {
      suffix.append(transformer.getSuffixCode());
    }
    logger.fine("Rewrote " + tokens.getTokens().size() + " tokens");

    String code = tokens.finish();
    if (code.startsWith("#!")) {
      int newlineIndex = code.indexOf('\n');
      if (newlineIndex == -1) {
        newlineIndex = code.length();
        code += "\n";
      }
      return code.substring(0, newlineIndex + 1)
          + prefix
          + code.substring(newlineIndex + 1)
          + suffix;
    }
    return prefix + code + suffix;
  }

  /**
   * Processes tokens until a closing brace or parenthesis that was not opened in this call, or
   * the end of input. The closer is left at the cursor.
   */
  void processBalancedCode() {
    int braceDepth = 0;
    int parenDepth = 0;
    while (!tokens.isAtEnd()) {
      if (tokens.matches(TokenType.BRACE_L) || tokens.matches(TokenType.DOLLAR_BRACE_L)) {
        braceDepth++;
      } else if (tokens.matches(TokenType.BRACE_R)) {
        if (braceDepth == 0) {
          return;
        }
        braceDepth--;
      }
      if (tokens.matches(TokenType.PAREN_L)) {
        parenDepth++;
      } else if (tokens.matches(TokenType.PAREN_R)) {
        if (parenDepth == 0) {
          return;
        }
        parenDepth--;
      }
      processToken();
    }
  }

  void processToken() {
    if (tokens.matches(TokenType.CLASS) && !tokens.currentToken().isType()) {
      processClass();
      return;
    }
    for (Transformer transformer : transformers) {
      if (transformer.process()) {
        return;
      }
    }
    tokens.copyToken();
  }

  /** Rewrites a class that must have a name and returns the name. */
  String processNamedClass() {
    checkState(
        tokens.matches(TokenType.CLASS, TokenType.NAME),
        "Expected identifier for exported class name at offset %s",
        tokens.currentToken().getStart());
    String name = tokens.identifierNameAtIndex(tokens.currentIndex() + 1);
    processClass();
    return name;
  }

  private void processClass() {
    ClassInfo classInfo = ClassInfoCollector.collect(this, tokens);

    boolean needsCommaExpression =
        !classInfo.staticInitializerSuffixes().isEmpty()
            && (classInfo.isExpression() || classInfo.className() == null);
    String className = classInfo.className();
    if (needsCommaExpression) {
      className = nameManager.claimFreeName("_class");
      generatedVariables.add(className);
      tokens.appendCode(" (" + className + " =");
    }

    Token classToken = tokens.currentToken();
    Integer contextId = classToken.getContextId();
    checkState(
        contextId != null,
        "Expected class to have a context id at offset %s",
        classToken.getStart());
    tokens.copyExpectedToken(TokenType.CLASS);
    while (!tokens.matchesContextIdAndLabel(TokenType.BRACE_L, contextId)) {
      processToken();
    }

    processClassBody(classInfo, contextId);

    List<String> staticInitializerStatements = new ArrayList<>();
    for (String suffix : classInfo.staticInitializerSuffixes()) {
      staticInitializerStatements.add(className + suffix);
    }
    if (needsCommaExpression) {
      tokens.appendCode(
          ", " + Joiner.on(", ").join(staticInitializerStatements) + ", " + className + ")");
    } else if (!staticInitializerStatements.isEmpty()) {
      tokens.appendCode(" " + Joiner.on("; ").join(staticInitializerStatements) + ";");
    }
  }

  /**
   * Copies the class body, removing field declarations and putting their initializers into the
   * existing or a synthesized constructor.
   */
  private void processClassBody(ClassInfo classInfo, int classContextId) {
    ImmutableList<Range<Integer>> fieldRanges = classInfo.fieldRanges();
    ImmutableList<String> initializerStatements = classInfo.initializerStatements();
    int fieldIndex = 0;
    tokens.copyExpectedToken(TokenType.BRACE_L);

    if (classInfo.constructorInsertPos() == -1 && !initializerStatements.isEmpty()) {
      String initializersCode = Joiner.on(";").join(initializerStatements);
      if (classInfo.hasSuperclass()) {
        String argsName = nameManager.claimFreeName("args");
        tokens.appendCode(
            "constructor(..."
                + argsName
                + ") { super(..."
                + argsName
                + "); "
                + initializersCode
                + "; }");
      } else {
        tokens.appendCode("constructor() { " + initializersCode + "; }");
      }
    }

    while (!tokens.matchesContextIdAndLabel(TokenType.BRACE_R, classContextId)) {
      if (fieldIndex < fieldRanges.size()
          && tokens.currentIndex() == fieldRanges.get(fieldIndex).lowerEndpoint()) {
        int fieldEnd = fieldRanges.get(fieldIndex).upperEndpoint();
        tokens.removeInitialToken();
        while (tokens.currentIndex() < fieldEnd) {
          tokens.removeToken();
        }
        fieldIndex++;
      } else if (tokens.currentIndex() == classInfo.constructorInsertPos()) {
        tokens.copyToken();
        if (!initializerStatements.isEmpty()) {
          tokens.appendCode(";" + Joiner.on(";").join(initializerStatements) + ";");
        }
        // The token after the insertion point goes back through the loop, so a field range or
        // a class starting there is still handled.
      } else {
        processToken();
      }
    }
    tokens.copyExpectedToken(TokenType.BRACE_R);
  }

  /** Removes the run of type tokens at the cursor, if there is one. */
  boolean processPossibleTypeRange() {
    if (tokens.isAtEnd() || !tokens.currentToken().isType()) {
      return false;
    }
    tokens.removeInitialToken();
    while (!tokens.isAtEnd() && tokens.currentToken().isType()) {
      tokens.removeToken();
    }
    return true;
  }
}
