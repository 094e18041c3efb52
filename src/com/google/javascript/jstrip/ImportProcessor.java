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

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.Iterables;
import com.google.javascript.jstrip.parsing.IdentifierRole;
import com.google.javascript.jstrip.parsing.Token;
import com.google.javascript.jstrip.parsing.TokenType;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Collects every module a file imports or re-exports from, decides the CommonJS code that replaces
 * each import, and records what each imported binding turns into.
 *
 * <p>The tokens are scanned once, before rewriting starts, so that references which precede
 * their import declaration are rewritten too.
 */
final class ImportProcessor implements ImportBindingResolver {
  private static final Logger logger = Logger.getLogger(ImportProcessor.class.getName());

  private static final CharMatcher WORD_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'));

  /** Runtime support functions emitted at the top of the file when some import needs them. */
  private enum Helper {
    INTEROP_REQUIRE_WILDCARD(
        "_interopRequireWildcard",
        "function %s(obj) { if (obj && obj.__esModule) { return obj; } else { var newObj = {};"
            + " if (obj != null) { for (var key in obj) {"
            + " if (Object.prototype.hasOwnProperty.call(obj, key)) newObj[key] = obj[key]; } }"
            + " newObj.default = obj; return newObj; } }"),
    INTEROP_REQUIRE_DEFAULT(
        "_interopRequireDefault",
        "function %s(obj) { return obj && obj.__esModule ? obj : { default: obj }; }"),
    CREATE_NAMED_EXPORT_FROM(
        "_createNamedExportFrom",
        "function %s(obj, localName, importedName) {"
            + " Object.defineProperty(exports, localName, {enumerable: true,"
            + " get: () => obj[importedName]}); }"),
    CREATE_STAR_EXPORT(
        "_createStarExport",
        "function %s(obj) { Object.keys(obj)"
            + " .filter((key) => key !== \"default\" && key !== \"__esModule\")"
            + " .forEach((key) => { if (exports.hasOwnProperty(key)) { return; }"
            + " Object.defineProperty(exports, key, {enumerable: true,"
            + " get: () => obj[key]}); }); }");

    private final String baseName;
    private final String codeTemplate;

    Helper(String baseName, String codeTemplate) {
      this.baseName = baseName;
      this.codeTemplate = codeTemplate;
    }
  }

  /** One {@code a as b} entry of an import or export clause. */
  @AutoValue
  abstract static class NamedBinding {
    /** The name on the side of the other module. */
    abstract String importedName();

    /** The name on the side of this module. */
    abstract String localName();

    static NamedBinding create(String importedName, String localName) {
      return new AutoValue_ImportProcessor_NamedBinding(importedName, localName);
    }
  }

  /** Everything this file does with one module path. */
  private static final class ImportInfo {
    final List<String> defaultNames = new ArrayList<>();
    final List<String> wildcardNames = new ArrayList<>();
    final List<NamedBinding> namedImports = new ArrayList<>();
    final List<NamedBinding> namedExports = new ArrayList<>();
    final List<String> exportStarNames = new ArrayList<>();
    boolean hasBareImport;
    boolean hasStarExport;

    String requireCode = "";
    final Set<Helper> helpers = EnumSet.noneOf(Helper.class);
    boolean claimed;

    boolean hasNoBindings() {
      return defaultNames.isEmpty()
          && wildcardNames.isEmpty()
          && namedImports.isEmpty()
          && namedExports.isEmpty()
          && exportStarNames.isEmpty()
          && !hasStarExport;
    }
  }

  private final NameManager nameManager;
  private final TokenProcessor tokens;
  private final boolean isTypeScript;
  private final Map<String, ImportInfo> importInfoByPath = new LinkedHashMap<>();
  private final Map<String, String> identifierReplacements = new HashMap<>();
  private final Map<Helper, String> helperNames = new EnumMap<>(Helper.class);
  private final Set<Helper> usedHelpers = EnumSet.noneOf(Helper.class);

  ImportProcessor(NameManager nameManager, TokenProcessor tokens, boolean isTypeScript) {
    this.nameManager = nameManager;
    this.tokens = tokens;
    this.isTypeScript = isTypeScript;
  }

  /** Scans all import and re-export declarations and computes their replacement code. */
  void preprocessTokens() {
    List<Token> allTokens = tokens.getTokens();
    for (int i = 0; i < allTokens.size(); i++) {
      Token token = allTokens.get(i);
      if (token.isType()) {
        continue;
      }
      if (token.getType() == TokenType.IMPORT
          && !tokens.matchesAtIndex(i, TokenType.IMPORT, TokenType.NAME, TokenType.EQ)
          && !tokens.matchesAtIndex(i, TokenType.IMPORT, TokenType.PAREN_L)
          && !tokens.matchesAtIndex(i, TokenType.IMPORT, TokenType.DOT)) {
        preprocessImportAtIndex(i);
      } else if (token.getType() == TokenType.EXPORT
          && !tokens.matchesAtIndex(i, TokenType.EXPORT, TokenType.EQ)) {
        preprocessExportAtIndex(i);
      }
    }
    generateImportReplacements();
    logger.fine(
        "Found "
            + importInfoByPath.size()
            + " imported module(s) and "
            + identifierReplacements.size()
            + " imported binding(s)");
  }

  private void preprocessImportAtIndex(int importIndex) {
    int index = importIndex + 1;
    List<String> defaultNames = new ArrayList<>();
    List<String> wildcardNames = new ArrayList<>();
    List<NamedBinding> namedImports = new ArrayList<>();

    if (tokens.matchesAtIndex(index, TokenType.NAME)) {
      defaultNames.add(tokens.identifierNameAtIndex(index));
      index++;
      if (tokens.matchesAtIndex(index, TokenType.COMMA)) {
        index++;
      }
    }
    if (tokens.matchesAtIndex(index, TokenType.STAR)) {
      // Skip "* as".
      index += 2;
      wildcardNames.add(tokens.identifierNameAtIndex(index));
      index++;
    }
    if (tokens.matchesAtIndex(index, TokenType.BRACE_L)) {
      index = collectNamedBindings(index + 1, namedImports);
    }
    if (tokens.matchesContextualAtIndex(index, "from")) {
      index++;
    }
    checkState(
        tokens.matchesAtIndex(index, TokenType.STRING),
        "Expected a module path in the import at offset %s",
        tokens.getTokens().get(importIndex).getStart());

    ImportInfo info = getImportInfo(tokens.stringValueAtIndex(index));
    info.defaultNames.addAll(defaultNames);
    info.wildcardNames.addAll(wildcardNames);
    info.namedImports.addAll(namedImports);
    if (defaultNames.isEmpty() && wildcardNames.isEmpty() && namedImports.isEmpty()) {
      info.hasBareImport = true;
    }
  }

  private void preprocessExportAtIndex(int exportIndex) {
    if (tokens.matchesAtIndex(exportIndex, TokenType.EXPORT, TokenType.BRACE_L)) {
      List<NamedBinding> namedExports = new ArrayList<>();
      int index = collectNamedBindings(exportIndex + 2, namedExports);
      if (!tokens.matchesContextualAtIndex(index, "from")) {
        return;
      }
      getImportInfo(tokens.stringValueAtIndex(index + 1)).namedExports.addAll(namedExports);
    } else if (tokens.matchesAtIndex(exportIndex, TokenType.EXPORT, TokenType.STAR)) {
      int index = exportIndex + 2;
      @Nullable String exportStarName = null;
      if (tokens.matchesContextualAtIndex(index, "as")) {
        exportStarName = tokens.identifierNameAtIndex(index + 1);
        index += 2;
      }
      ImportInfo info = getImportInfo(tokens.stringValueAtIndex(index + 1));
      if (exportStarName == null) {
        info.hasStarExport = true;
      } else {
        info.exportStarNames.add(exportStarName);
      }
    }
  }

  /**
   * Reads the specifiers of a braced import or export clause starting after the {@code {} and
   * returns the index after the {@code }}. Type-only specifiers are skipped.
   */
  private int collectNamedBindings(int startIndex, List<NamedBinding> bindings) {
    List<Token> allTokens = tokens.getTokens();
    int index = startIndex;
    while (!tokens.matchesAtIndex(index, TokenType.BRACE_R)) {
      checkState(index < allTokens.size(), "Unterminated import or export clause");
      if (allTokens.get(index).isType() || tokens.matchesAtIndex(index, TokenType.COMMA)) {
        index++;
        continue;
      }
      String importedName = tokens.identifierNameAtIndex(index);
      String localName = importedName;
      index++;
      if (tokens.matchesContextualAtIndex(index, "as")) {
        localName = tokens.identifierNameAtIndex(index + 1);
        index += 2;
      }
      bindings.add(NamedBinding.create(importedName, localName));
    }
    return index + 1;
  }

  private ImportInfo getImportInfo(String path) {
    return importInfoByPath.computeIfAbsent(path, unused -> new ImportInfo());
  }

  private void generateImportReplacements() {
    for (Map.Entry<String, ImportInfo> entry : importInfoByPath.entrySet()) {
      String path = entry.getKey();
      ImportInfo info = entry.getValue();
      if (info.hasNoBindings()) {
        info.requireCode = "require('" + path + "');";
        continue;
      }

      String primaryImportName = getFreeIdentifierForPath(path);
      String secondaryImportName =
          info.wildcardNames.isEmpty()
              ? getFreeIdentifierForPath(path)
              : info.wildcardNames.get(0);

      StringBuilder requireCode =
          new StringBuilder("var " + primaryImportName + " = require('" + path + "');");
      if (!info.wildcardNames.isEmpty()) {
        for (String wildcardName : info.wildcardNames) {
          String moduleExpression =
              isTypeScript
                  ? primaryImportName
                  : callHelper(info, Helper.INTEROP_REQUIRE_WILDCARD, primaryImportName);
          requireCode.append(" var ").append(wildcardName).append(" = ");
          requireCode.append(moduleExpression).append(";");
        }
      } else if (!info.exportStarNames.isEmpty()) {
        requireCode.append(" var ").append(secondaryImportName).append(" = ");
        requireCode.append(callHelper(info, Helper.INTEROP_REQUIRE_WILDCARD, primaryImportName));
        requireCode.append(";");
      } else if (!info.defaultNames.isEmpty()) {
        requireCode.append(" var ").append(secondaryImportName).append(" = ");
        requireCode.append(callHelper(info, Helper.INTEROP_REQUIRE_DEFAULT, primaryImportName));
        requireCode.append(";");
      }
      for (NamedBinding namedExport : info.namedExports) {
        requireCode
            .append(" ")
            .append(helperName(info, Helper.CREATE_NAMED_EXPORT_FROM))
            .append("(")
            .append(primaryImportName)
            .append(", '")
            .append(namedExport.localName())
            .append("', '")
            .append(namedExport.importedName())
            .append("');");
      }
      for (String exportStarName : info.exportStarNames) {
        requireCode.append(" exports.").append(exportStarName);
        requireCode.append(" = ").append(secondaryImportName).append(";");
      }
      if (info.hasStarExport) {
        requireCode.append(" ");
        requireCode.append(callHelper(info, Helper.CREATE_STAR_EXPORT, primaryImportName));
        requireCode.append(";");
      }
      info.requireCode = requireCode.toString();

      for (String defaultName : info.defaultNames) {
        identifierReplacements.put(defaultName, secondaryImportName + ".default");
      }
      for (NamedBinding namedImport : info.namedImports) {
        identifierReplacements.put(
            namedImport.localName(), primaryImportName + "." + namedImport.importedName());
      }
    }
  }

  private String callHelper(ImportInfo info, Helper helper, String argument) {
    return helperName(info, helper) + "(" + argument + ")";
  }

  private String helperName(ImportInfo info, Helper helper) {
    info.helpers.add(helper);
    return helperNames.computeIfAbsent(helper, h -> nameManager.claimFreeName(h.baseName));
  }

  private String getFreeIdentifierForPath(String path) {
    String lastComponent = Iterables.getLast(Splitter.on('/').split(path));
    return nameManager.claimFreeName("_" + WORD_CHARS.retainFrom(lastComponent));
  }

  /**
   * Drops the require of every module whose bindings are only ever used as types. TypeScript
   * does not mark type-only imports, so they are recognized by never being read as values.
   */
  void pruneTypeOnlyImports() {
    Set<String> nonTypeIdentifiers = getNonTypeIdentifiers();
    for (Map.Entry<String, ImportInfo> entry : importInfoByPath.entrySet()) {
      ImportInfo info = entry.getValue();
      if (info.hasBareImport
          || info.hasStarExport
          || !info.exportStarNames.isEmpty()
          || !info.namedExports.isEmpty()) {
        continue;
      }
      List<String> names = new ArrayList<>(info.defaultNames);
      names.addAll(info.wildcardNames);
      for (NamedBinding namedImport : info.namedImports) {
        names.add(namedImport.localName());
      }
      if (names.stream().noneMatch(nonTypeIdentifiers::contains)) {
        logger.fine("Removing type-only import of " + entry.getKey());
        info.requireCode = "";
        info.helpers.clear();
      }
    }
  }

  private Set<String> getNonTypeIdentifiers() {
    Set<String> names = new HashSet<>();
    List<Token> allTokens = tokens.getTokens();
    for (int i = 0; i < allTokens.size(); i++) {
      Token token = allTokens.get(i);
      if (token.getType() == TokenType.JSX_TAG_START) {
        names.add("React");
      }
      if (token.isType()
          || (token.getType() != TokenType.NAME && token.getType() != TokenType.JSX_NAME)) {
        continue;
      }
      IdentifierRole role = token.getIdentifierRole();
      if (role == IdentifierRole.ACCESS
          || role == IdentifierRole.OBJECT_SHORTHAND
          || role == IdentifierRole.EXPORT_ACCESS) {
        names.add(tokens.identifierNameAtIndex(i));
      }
    }
    return names;
  }

  /**
   * Returns the code replacing the first import of {@code path}, and the empty string for later
   * imports of the same path so that each module is required once.
   */
  String claimImportCode(String path) {
    ImportInfo info = importInfoByPath.get(path);
    if (info == null || info.claimed) {
      return "";
    }
    info.claimed = true;
    if (!info.requireCode.isEmpty()) {
      usedHelpers.addAll(info.helpers);
    }
    return info.requireCode;
  }

  @Override
  public @Nullable String getIdentifierReplacement(String localName) {
    return identifierReplacements.get(localName);
  }

  /** The helper functions needed by the import code handed out so far. */
  String getPrefixCode() {
    StringBuilder prefix = new StringBuilder();
    for (Helper helper : usedHelpers) {
      prefix.append(" ").append(String.format(helper.codeTemplate, helperNames.get(helper)));
    }
    return prefix.toString();
  }
}
