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
import com.google.javascript.jstrip.parsing.IdentifierRole;
import com.google.javascript.jstrip.parsing.Token;
import com.google.javascript.jstrip.parsing.TokenType;
import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites ES module syntax into CommonJS: imports become {@code require} calls, references to
 * imported bindings read from the required module, and exports assign to {@code exports}.
 */
final class ImportTransformer extends Transformer {
  private final RootTransformer rootTransformer;
  private final TokenProcessor tokens;
  private final ImportProcessor importProcessor;
  private final boolean shouldAddModuleExports;

  private boolean hadExport = false;
  private boolean hadNamedExport = false;
  private boolean hadDefaultExport = false;

  ImportTransformer(
      RootTransformer rootTransformer,
      TokenProcessor tokens,
      ImportProcessor importProcessor,
      boolean shouldAddModuleExports) {
    this.rootTransformer = rootTransformer;
    this.tokens = tokens;
    this.importProcessor = importProcessor;
    this.shouldAddModuleExports = shouldAddModuleExports;
  }

  @Override
  String getPrefixCode() {
    String prefix = importProcessor.getPrefixCode();
    if (hadExport) {
      prefix += "Object.defineProperty(exports, \"__esModule\", {value: true});";
    }
    return prefix;
  }

  @Override
  String getSuffixCode() {
    if (shouldAddModuleExports && hadDefaultExport && !hadNamedExport) {
      return "\nmodule.exports = exports.default;\n";
    }
    return "";
  }

  @Override
  boolean process() {
    if (tokens.currentToken().isType()) {
      return false;
    }
    if (tokens.matches(TokenType.IMPORT, TokenType.NAME, TokenType.EQ)) {
      // TypeScript's import a = require('a').
      tokens.replaceToken("const");
      return true;
    }
    if (tokens.matches(TokenType.IMPORT, TokenType.PAREN_L)) {
      processDynamicImport();
      return true;
    }
    if (tokens.matches(TokenType.IMPORT, TokenType.DOT)) {
      return false;
    }
    if (tokens.matches(TokenType.IMPORT)) {
      processImport();
      return true;
    }
    if (tokens.matches(TokenType.EXPORT, TokenType.EQ)) {
      tokens.replaceToken("module.exports");
      return true;
    }
    if (tokens.matches(TokenType.EXPORT)) {
      hadExport = true;
      processExport();
      return true;
    }
    if (tokens.matches(TokenType.NAME) || tokens.matches(TokenType.JSX_NAME)) {
      return processIdentifier();
    }
    return false;
  }

  private void processDynamicImport() {
    tokens.replaceToken("Promise.resolve().then(() => require");
    Token openParen = tokens.currentToken();
    Integer contextId = openParen.getContextId();
    checkState(
        contextId != null,
        "Expected a context id on the import call at offset %s",
        openParen.getStart());
    tokens.copyToken();
    while (!tokens.matchesContextIdAndLabel(TokenType.PAREN_R, contextId)) {
      rootTransformer.processToken();
    }
    tokens.replaceToken("))");
  }

  /** Replaces a whole import declaration with the require code for its module. */
  private void processImport() {
    tokens.removeInitialToken();
    while (!tokens.matches(TokenType.STRING)) {
      tokens.removeToken();
    }
    String path = tokens.stringValueAtIndex(tokens.currentIndex());
    tokens.replaceTokenTrimmingLeftWhitespace(importProcessor.claimImportCode(path));
    if (tokens.matches(TokenType.SEMI)) {
      tokens.removeToken();
    }
  }

  private boolean processIdentifier() {
    Token token = tokens.currentToken();
    IdentifierRole role = token.getIdentifierRole();
    if (role != IdentifierRole.ACCESS && role != IdentifierRole.OBJECT_SHORTHAND) {
      return false;
    }
    String name = tokens.identifierName();
    String replacement = importProcessor.getIdentifierReplacement(name);
    if (replacement == null) {
      return false;
    }
    if (role == IdentifierRole.OBJECT_SHORTHAND) {
      tokens.replaceToken(name + ": " + replacement);
      return true;
    }
    // Calling a member expression would bind this to the module object.
    int possibleOpenParenIndex = nextNonTypeIndex(tokens.currentIndex() + 1);
    if (tokens.matchesAtIndex(possibleOpenParenIndex, TokenType.PAREN_L)
        && !tokens.matchesAtIndex(tokens.currentIndex() - 1, TokenType.NEW)) {
      tokens.replaceToken("(0, " + replacement + ")");
    } else {
      tokens.replaceToken(replacement);
    }
    return true;
  }

  private int nextNonTypeIndex(int index) {
    List<Token> allTokens = tokens.getTokens();
    while (index < allTokens.size() && allTokens.get(index).isType()) {
      index++;
    }
    return index;
  }

  private void processExport() {
    if (tokens.matches(TokenType.EXPORT, TokenType.DEFAULT)) {
      hadDefaultExport = true;
      processExportDefault();
      return;
    }
    hadNamedExport = true;
    if (tokens.matches(TokenType.EXPORT, TokenType.BRACE_L)) {
      processExportBindings();
      return;
    }
    if (tokens.matches(TokenType.EXPORT, TokenType.STAR)) {
      processExportStar();
      return;
    }
    int declarationIndex = nextNonTypeIndex(tokens.currentIndex() + 1);
    if (tokens.matchesAtIndex(declarationIndex, TokenType.VAR)
        || tokens.matchesAtIndex(declarationIndex, TokenType.CONST)
        || tokens.matchesContextualAtIndex(declarationIndex, "let")) {
      processExportVar();
    } else if (isNamedFunctionAt(declarationIndex)) {
      tokens.removeInitialToken();
      removeTypeTokens();
      String name = processNamedFunction();
      tokens.appendCode(" exports." + name + " = " + name + ";");
    } else if (tokens.matchesAtIndex(declarationIndex, TokenType.CLASS)) {
      tokens.removeInitialToken();
      removeTypeTokens();
      String name = rootTransformer.processNamedClass();
      tokens.appendCode(" exports." + name + " = " + name + ";");
    } else {
      throw new IllegalStateException(
          "Unrecognized export syntax at offset " + tokens.currentToken().getStart());
    }
  }

  private boolean isNamedFunctionAt(int index) {
    if (tokens.matchesContextualAtIndex(index, "async")) {
      index++;
    }
    return tokens.matchesAtIndex(index, TokenType.FUNCTION, TokenType.NAME)
        || tokens.matchesAtIndex(index, TokenType.FUNCTION, TokenType.STAR, TokenType.NAME);
  }

  private void removeTypeTokens() {
    while (tokens.currentToken().isType()) {
      tokens.removeToken();
    }
  }

  private void processExportDefault() {
    int declarationIndex = nextNonTypeIndex(tokens.currentIndex() + 2);
    if (isNamedFunctionAt(declarationIndex)) {
      tokens.removeInitialToken();
      tokens.removeToken();
      removeTypeTokens();
      String name = processNamedFunction();
      tokens.appendCode(" exports.default = " + name + ";");
    } else if (tokens.matchesAtIndex(declarationIndex, TokenType.CLASS, TokenType.NAME)) {
      tokens.removeInitialToken();
      tokens.removeToken();
      removeTypeTokens();
      String name = rootTransformer.processNamedClass();
      tokens.appendCode(" exports.default = " + name + ";");
    } else {
      tokens.replaceToken("exports.default =");
      tokens.removeToken();
    }
  }

  /**
   * Copies a named function declaration and returns its name. Its body is rewritten as usual.
   */
  private String processNamedFunction() {
    if (tokens.matches(TokenType.NAME, TokenType.FUNCTION)) {
      checkState(
          tokens.matchesContextual("async"),
          "Expected async before function at offset %s",
          tokens.currentToken().getStart());
      tokens.copyToken();
    }
    tokens.copyExpectedToken(TokenType.FUNCTION);
    if (tokens.matches(TokenType.STAR)) {
      tokens.copyToken();
    }
    checkState(
        tokens.matches(TokenType.NAME),
        "Expected identifier for exported function name at offset %s",
        tokens.currentToken().getStart());
    String name = tokens.identifierName();
    tokens.copyToken();
    rootTransformer.processPossibleTypeRange();
    tokens.copyExpectedToken(TokenType.PAREN_L);
    rootTransformer.processBalancedCode();
    tokens.copyExpectedToken(TokenType.PAREN_R);
    rootTransformer.processPossibleTypeRange();
    tokens.copyExpectedToken(TokenType.BRACE_L);
    rootTransformer.processBalancedCode();
    tokens.copyExpectedToken(TokenType.BRACE_R);
    return name;
  }

  /**
   * Removes {@code export} from a variable declaration and assigns each declared name to
   * {@code exports} after it.
   */
  private void processExportVar() {
    Token exportToken = tokens.currentToken();
    int exportIndex = tokens.currentIndex();
    int endIndex = exportToken.getEndIndex();
    checkState(
        endIndex >= 0,
        "Expected the end of the exported declaration at offset %s",
        exportToken.getStart());

    List<String> declaredNames = new ArrayList<>();
    List<Token> allTokens = tokens.getTokens();
    for (int i = exportIndex + 1; i < endIndex; i++) {
      Token token = allTokens.get(i);
      IdentifierRole role = token.getIdentifierRole();
      if (token.getType() == TokenType.NAME
          && !token.isType()
          && role != null
          && role.isDeclaration()
          && token.getScopeDepth() == exportToken.getScopeDepth()) {
        declaredNames.add(tokens.identifierNameAtIndex(i));
      }
    }

    tokens.removeInitialToken();
    while (tokens.currentIndex() < endIndex) {
      rootTransformer.processToken();
    }
    for (String name : declaredNames) {
      tokens.appendCode(" exports." + name + " = " + name + ";");
    }
  }

  /** Rewrites {@code export {a, b as c}}, with or without a {@code from} clause. */
  private void processExportBindings() {
    tokens.removeInitialToken();
    tokens.removeToken();
    List<String> exportStatements = new ArrayList<>();
    while (true) {
      if (tokens.matches(TokenType.BRACE_R)) {
        tokens.removeToken();
        break;
      }
      if (tokens.currentToken().isType() || tokens.matches(TokenType.COMMA)) {
        tokens.removeToken();
        continue;
      }
      String localName = tokens.identifierName();
      String exportedName = localName;
      tokens.removeToken();
      if (tokens.matchesContextual("as")) {
        tokens.removeToken();
        exportedName = tokens.identifierName();
        tokens.removeToken();
      }
      String replacement = importProcessor.getIdentifierReplacement(localName);
      exportStatements.add(
          "exports."
              + exportedName
              + " = "
              + (replacement == null ? localName : replacement)
              + ";");
    }

    if (tokens.matchesContextual("from")) {
      tokens.removeToken();
      String path = tokens.stringValueAtIndex(tokens.currentIndex());
      tokens.replaceTokenTrimmingLeftWhitespace(importProcessor.claimImportCode(path));
    } else {
      tokens.appendCode(Joiner.on(" ").join(exportStatements));
    }
    if (tokens.matches(TokenType.SEMI)) {
      tokens.removeToken();
    }
  }

  private void processExportStar() {
    tokens.removeInitialToken();
    while (!tokens.matches(TokenType.STRING)) {
      tokens.removeToken();
    }
    String path = tokens.stringValueAtIndex(tokens.currentIndex());
    tokens.replaceTokenTrimmingLeftWhitespace(importProcessor.claimImportCode(path));
    if (tokens.matches(TokenType.SEMI)) {
      tokens.removeToken();
    }
  }
}
