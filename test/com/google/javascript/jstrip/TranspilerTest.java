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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import com.google.javascript.jstrip.parsing.JsSyntaxException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Transpiler}. */
@RunWith(JUnit4.class)
public final class TranspilerTest {
  private static final String USE_STRICT = "\"use strict\";";
  private static final String ES_MODULE =
      "Object.defineProperty(exports, \"__esModule\", {value: true});";
  private static final String INTEROP_REQUIRE_DEFAULT =
      " function _interopRequireDefault(obj) {"
          + " return obj && obj.__esModule ? obj : { default: obj }; }";

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines);
  }

  private static String transform(String code, Transform... transforms) {
    return Transpiler.transform(
        code,
        TranspileOptions.builder().setTransforms(transforms).setJsxDebugMetadata(false).build());
  }

  private static void test(String code, String expected, Transform... transforms) {
    assertThat(transform(code, transforms)).isEqualTo(expected);
  }

  private static void testSame(String code, Transform... transforms) {
    test(code, code, transforms);
  }

  @Test
  public void testPlainCodeIsUnchanged() {
    String code =
        lines(
            "// Adds things.",
            "function add(a, b) {",
            "  return a + b * 2; /* inline */",
            "}",
            "const obj = {a: 1, b: [2, 3], c() { return this.a; }};",
            "for (let i = 0; i < 10; i++) {",
            "  if (i % 2) { continue; } else { add(i, obj.a); }",
            "}",
            "const re = /ab+c/g, arrow = (x) => x ? `t${x}` : 'none';",
            "");
    testSame(code);
    testSame(code, Transform.JSX, Transform.FLOW);
  }

  @Test
  public void testEmptyInput() {
    testSame("");
    testSame("  // only a comment\n");
  }

  @Test
  public void testSelfClosingComponent() {
    test("<Foo a=\"1\" b/>;", "React.createElement(Foo, { a: \"1\", b: true,});", Transform.JSX);
  }

  @Test
  public void testHostElementWithText() {
    test("<div>hello</div>;", "React.createElement('div', null, \"hello\");", Transform.JSX);
  }

  @Test
  public void testWhitespaceOnlyChildrenAddNoArguments() {
    test("<a>\n  </a>;", "React.createElement('a', null\n  );", Transform.JSX);
  }

  @Test
  public void testEntitiesInText() {
    test(
        "<p>&amp;&#65;&#x41;&zzz;</p>;",
        "React.createElement('p', null, \"&AA&zzz;\");",
        Transform.JSX);
  }

  @Test
  public void testExpressionAndElementChildren() {
    test(
        "<ul>{items}<li/></ul>;",
        "React.createElement('ul', null, items, React.createElement('li', null));",
        Transform.JSX);
  }

  @Test
  public void testEmptyExpressionContainerAddsNoArgument() {
    test("<a>{/* note */}</a>;", "React.createElement('a', null/* note */);", Transform.JSX);
  }

  @Test
  public void testFragment() {
    test(
        "<><a/></>;",
        "React.createElement(React.Fragment, null, React.createElement('a', null));",
        Transform.JSX);
  }

  @Test
  public void testSpreadAndDashedAttributes() {
    test(
        "<Foo {...props} data-id={id} />;",
        "React.createElement(Foo, { ...props, 'data-id': id,} );",
        Transform.JSX);
  }

  @Test
  public void testMemberExpressionTag() {
    test("<Foo.Bar/>;", "React.createElement(Foo.Bar, null);", Transform.JSX);
  }

  @Test
  public void testNamespacedNames() {
    test(
        "<svg:rect xlink:href=\"a\"/>;",
        "React.createElement('svg:rect', { 'xlink:href': \"a\",});",
        Transform.JSX);
  }

  @Test
  public void testDebugMetadata() {
    String code = lines("const el = (", "  <div/>", ");");
    String result =
        Transpiler.transform(
            code,
            TranspileOptions.builder().setTransforms(Transform.JSX).setFilePath("App.js").build());
    assertThat(result)
        .isEqualTo(
            lines(
                "const _jsxFileName = \"App.js\";const el = (",
                "  React.createElement('div', {__self: this, __source:"
                    + " {fileName: _jsxFileName, lineNumber: 2}})",
                ");"));
  }

  @Test
  public void testDebugMetadataAfterAttributes() {
    String result =
        Transpiler.transform(
            "<a b/>;",
            TranspileOptions.builder().setTransforms(Transform.JSX).setFilePath("x.js").build());
    assertThat(result)
        .isEqualTo(
            "const _jsxFileName = \"x.js\";React.createElement('a', { b: true,"
                + " __self: this, __source: {fileName: _jsxFileName, lineNumber: 1}});");
  }

  @Test
  public void testImportedReactIsTheFactory() {
    test(
        lines("import React from 'react';", "const a = <div/>;"),
        USE_STRICT
            + INTEROP_REQUIRE_DEFAULT
            + lines(
                "var _react = require('react'); var _react2 = _interopRequireDefault(_react);",
                "const a = _react2.default.createElement('div', null);"),
        Transform.IMPORTS,
        Transform.JSX);
  }

  @Test
  public void testMismatchedClosingTagIsASyntaxError() {
    JsSyntaxException e =
        assertThrows(JsSyntaxException.class, () -> transform("<a></b>;", Transform.JSX));
    assertThat(e).hasMessageThat().contains("Expected corresponding JSX closing tag for <a>");
  }

  @Test
  public void testSynthesizedConstructorForwardsToSuper() {
    test(
        lines("class A extends B {", "  x = 1;", "}"),
        lines(
            "class A extends B {constructor(...args) { super(...args); this.x = 1; }",
            "  ",
            "}"));
  }

  @Test
  public void testSynthesizedConstructorWithoutSuperclass() {
    test(
        "class A { x = 1; y = [2]; }",
        "class A {constructor() { this.x = 1;this.y = [2]; }   }");
  }

  @Test
  public void testFieldInitializersGoAfterSuperCall() {
    test(
        lines(
            "class B extends A {",
            "  x = 1;",
            "  constructor() {",
            "    super();",
            "  }",
            "}"),
        lines(
            "class B extends A {",
            "  ",
            "  constructor() {",
            "    super();;this.x = 1;",
            "  }",
            "}"));
  }

  @Test
  public void testFieldInitializersFollowSuperCallAfterBlock() {
    test(
        "class A extends B { constructor() { if (x) { f(); } super(); } y = 1; }",
        "class A extends B { constructor() { if (x) { f(); } super();;this.y = 1; }  }");
  }

  @Test
  public void testSuperCallInsideBranchWithFieldsIsRejected() {
    JsSyntaxException e =
        assertThrows(
            JsSyntaxException.class,
            () ->
                transform(
                    "class A extends B { constructor() { if (x) { super(); } else { super(1); } }"
                        + " y = 1; }"));
    assertThat(e).hasMessageThat().contains("super() call that is not a statement");
    assertThat(e.getOffset()).isEqualTo(45);
  }

  @Test
  public void testSuperCallInsideBranchWithoutFieldsIsUnchanged() {
    testSame("class A extends B { constructor() { if (x) { super(); } else { super(1); } } }");
  }

  @Test
  public void testFieldInitializersGoAtStartOfConstructor() {
    test(
        "class A { x = 1; constructor() { f(); } }",
        "class A {  constructor() {;this.x = 1; f(); } }");
  }

  @Test
  public void testStaticFieldOfClassDeclaration() {
    test("class C { static y = 2; }", "class C {  } C.y = 2;");
  }

  @Test
  public void testAnonymousClassExpressionWithStaticField() {
    test(
        "const C = class { static x = 1; };",
        " var _class;const C = (_class = class {  }, _class.x = 1, _class);");
  }

  @Test
  public void testClassWithoutFieldsIsUnchanged() {
    testSame("class A extends B { constructor() { super(); } m() { return 1; } }");
  }

  @Test
  public void testTypeScriptFields() {
    test(
        lines("class A {", "  x: number = 1;", "  y: string;", "}"),
        USE_STRICT + lines("class A {constructor() { this.x = 1; }", "  ", "  ", "}"),
        Transform.IMPORTS,
        Transform.TYPESCRIPT);
  }

  @Test
  public void testTypeScriptParameterProperties() {
    test(
        "class A { constructor(private x: number) {} }",
        USE_STRICT + "class A { constructor( x) {;this.x = x;} }",
        Transform.IMPORTS,
        Transform.TYPESCRIPT);
  }

  @Test
  public void testTypeScriptParameterPropertiesKeepParameterCommas() {
    test(
        "class A { constructor(readonly a, b) {} }",
        USE_STRICT + "class A { constructor( a, b) {;this.a = a;} }",
        Transform.IMPORTS,
        Transform.TYPESCRIPT);
    test(
        "class A { constructor(private x: number, public y) {} }",
        USE_STRICT + "class A { constructor( x,  y) {;this.x = x;this.y = y;} }",
        Transform.IMPORTS,
        Transform.TYPESCRIPT);
  }

  @Test
  public void testTypeScriptThisParameterIsErasedWithItsComma() {
    test(
        "function f(this: Window, a) {}",
        USE_STRICT + "function f( a) {}",
        Transform.IMPORTS,
        Transform.TYPESCRIPT);
  }

  @Test
  public void testTypeScriptTypesAreErased() {
    test(
        lines("interface Foo { a: string }", "const x: number = 1;"),
        USE_STRICT + lines("", "const x = 1;"),
        Transform.IMPORTS,
        Transform.TYPESCRIPT);
  }

  @Test
  public void testTypeScriptTypeOnlyImportsAreRemoved() {
    test(
        lines(
            "import {Foo} from './types';",
            "import {bar} from './bar';",
            "const x: Foo = bar();"),
        USE_STRICT + lines("", "var _bar = require('./bar');", "const x = (0, _bar.bar)();"),
        Transform.IMPORTS,
        Transform.TYPESCRIPT);
  }

  @Test
  public void testFlowTypesAreErased() {
    test(
        "function f(x: number): string { return x; }",
        "function f(x) { return x; }",
        Transform.FLOW);
  }

  @Test
  public void testNamedImports() {
    test(
        lines("import {a, b as c} from './util';", "a(c);"),
        USE_STRICT + lines("var _util = require('./util');", "(0, _util.a)(_util.b);"),
        Transform.IMPORTS);
  }

  @Test
  public void testDefaultImport() {
    test(
        lines("import foo from 'foo';", "foo();", "new foo();"),
        USE_STRICT
            + INTEROP_REQUIRE_DEFAULT
            + lines(
                "var _foo = require('foo'); var _foo2 = _interopRequireDefault(_foo);",
                "(0, _foo2.default)();",
                "new _foo2.default();"),
        Transform.IMPORTS);
  }

  @Test
  public void testWildcardImport() {
    String result = transform(lines("import * as ns from 'ns';", "ns.x;"), Transform.IMPORTS);
    assertThat(result).startsWith(USE_STRICT + " function _interopRequireWildcard(obj) {");
    assertThat(result)
        .endsWith(
            lines("var _ns = require('ns'); var ns = _interopRequireWildcard(_ns);", "ns.x;"));
  }

  @Test
  public void testBareImport() {
    test("import './styles.css';", USE_STRICT + "require('./styles.css');", Transform.IMPORTS);
  }

  @Test
  public void testRepeatedImportRequiresOnce() {
    test(
        lines("import {a} from 'm';", "import {b} from 'm';", "a(b);"),
        USE_STRICT + lines("var _m = require('m');", "", "(0, _m.a)(_m.b);"),
        Transform.IMPORTS);
  }

  @Test
  public void testImportedShorthandProperty() {
    test(
        lines("import {a} from 'm';", "const o = {a};"),
        USE_STRICT + lines("var _m = require('m');", "const o = {a: _m.a};"),
        Transform.IMPORTS);
  }

  @Test
  public void testDynamicImport() {
    test(
        "import('./a').then(m => m);",
        USE_STRICT + "Promise.resolve().then(() => require('./a')).then(m => m);",
        Transform.IMPORTS);
  }

  @Test
  public void testExportVariables() {
    test(
        "export const a = 1, b = 2;",
        USE_STRICT + ES_MODULE + " const a = 1, b = 2; exports.a = a; exports.b = b;",
        Transform.IMPORTS);
  }

  @Test
  public void testExportFunction() {
    test(
        "export function f() {}",
        USE_STRICT + ES_MODULE + " function f() {} exports.f = f;",
        Transform.IMPORTS);
  }

  @Test
  public void testExportClass() {
    test(
        "export class A {}",
        USE_STRICT + ES_MODULE + " class A {} exports.A = A;",
        Transform.IMPORTS);
  }

  @Test
  public void testExportDefaultExpression() {
    test(
        "export default 42;",
        USE_STRICT + ES_MODULE + "exports.default = 42;",
        Transform.IMPORTS);
  }

  @Test
  public void testExportDefaultFunction() {
    test(
        "export default function main() {}",
        USE_STRICT + ES_MODULE + " function main() {} exports.default = main;",
        Transform.IMPORTS);
  }

  @Test
  public void testAddModuleExports() {
    test(
        "export default 42;",
        USE_STRICT
            + ES_MODULE
            + "exports.default = 42;\nmodule.exports = exports.default;\n",
        Transform.IMPORTS,
        Transform.ADD_MODULE_EXPORTS);
  }

  @Test
  public void testAddModuleExportsSkippedWithNamedExports() {
    String result =
        transform(
            lines("export default 42;", "export const a = 1;"),
            Transform.IMPORTS,
            Transform.ADD_MODULE_EXPORTS);
    assertThat(result).doesNotContain("module.exports");
  }

  @Test
  public void testExportBindings() {
    test(
        lines("const a = 1, b = 2;", "export {a, b as c};"),
        USE_STRICT + ES_MODULE + lines("const a = 1, b = 2;", "exports.a = a; exports.c = b;"),
        Transform.IMPORTS);
  }

  @Test
  public void testExportFrom() {
    String result = transform("export {y} from './y';", Transform.IMPORTS);
    assertThat(result).contains(" function _createNamedExportFrom(obj, localName, importedName)");
    assertThat(result)
        .endsWith(ES_MODULE + "var _y = require('./y'); _createNamedExportFrom(_y, 'y', 'y');");
  }

  @Test
  public void testExportStar() {
    String result = transform("export * from './x';", Transform.IMPORTS);
    assertThat(result).contains(" function _createStarExport(obj)");
    assertThat(result).endsWith(ES_MODULE + "var _x = require('./x'); _createStarExport(_x);");
  }

  @Test
  public void testShebangStaysFirst() {
    test(
        lines("#!/usr/bin/env node", "import {a} from 'a';", "a;"),
        lines("#!/usr/bin/env node", USE_STRICT + "var _a = require('a');", "_a.a;"),
        Transform.IMPORTS);
  }

  @Test
  public void testDisplayNameFromAssignment() {
    test(
        "var Foo = React.createClass({render() {}});",
        "var Foo = React.createClass({displayName: 'Foo',render() {}});",
        Transform.JSX);
  }

  @Test
  public void testDisplayNameFromObjectKey() {
    test(
        "const o = {Foo: createReactClass({})};",
        "const o = {Foo: createReactClass({displayName: 'Foo',})};",
        Transform.JSX);
  }

  @Test
  public void testExistingDisplayNameIsKept() {
    testSame("const A = createReactClass({displayName: 'X'});", Transform.JSX);
  }

  @Test
  public void testDisplayNameFromIndexFileDirectory() {
    String result =
        Transpiler.transform(
            "export default React.createClass({});",
            TranspileOptions.builder()
                .setTransforms(Transform.IMPORTS, Transform.JSX)
                .setFilePath("components/Button/index.js")
                .build());
    assertThat(result)
        .isEqualTo(
            USE_STRICT
                + ES_MODULE
                + "exports.default = React.createClass({displayName: 'Button',});");
  }

  @Test
  public void testNumericSeparators() {
    test("const n = 1_000_000 + 0x_ff;", "const n = 1000000 + 0xff;");
  }

  @Test
  public void testOptionalCatchBinding() {
    test("try { f(); } catch { g(); }", "try { f(); } catch (e) { g(); }");
    test("let e; try {} catch {}", "let e; try {} catch (e2) {}");
  }

  @Test
  public void testSyntaxErrorHasPosition() {
    JsSyntaxException e =
        assertThrows(JsSyntaxException.class, () -> transform("let a = 1;\nconst = 2;"));
    assertThat(e.getLineNumber()).isEqualTo(2);
  }
}
