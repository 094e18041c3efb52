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

/** The grammatical function of an identifier token, as far as the rewriters need to know it. */
public enum IdentifierRole {
  /** A plain read or write of a binding. */
  ACCESS,
  /** The local name in an {@code export {a as b}} clause. */
  EXPORT_ACCESS,
  /** A {@code let}, {@code const}, class or catch binding. */
  BLOCK_SCOPED_DECLARATION,
  /** A {@code var}, function or parameter binding. */
  FUNCTION_SCOPED_DECLARATION,
  /** A local binding introduced by an import declaration. */
  IMPORT_DECLARATION,
  /** A shorthand property such as the {@code a} in {@code {a}}. */
  OBJECT_SHORTHAND,
  /** The key of a non-shorthand object property. */
  OBJECT_KEY;

  public boolean isDeclaration() {
    return this == BLOCK_SCOPED_DECLARATION || this == FUNCTION_SCOPED_DECLARATION;
  }
}
