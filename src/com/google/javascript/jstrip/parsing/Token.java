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

import com.google.common.base.MoreObjects;
import org.jspecify.annotations.Nullable;

/**
 * One lexical unit of the source plus the annotations the parser attaches to it.
 *
 * <p>The kind, offsets and value are fixed when the token is pushed. The annotations are filled in
 * while the rest of the construct is parsed and are read-only for the rewriters.
 */
public final class Token {
  private final TokenType type;
  private final int start;
  private final int end;
  private final @Nullable String value;

  private @Nullable IdentifierRole identifierRole;
  private boolean isType;
  private @Nullable Integer contextId;
  private boolean isExpression;
  private int endIndex = -1;
  private int scopeDepth;

  Token(ScanState state) {
    this.type = state.type;
    this.start = state.start;
    this.end = state.end;
    this.value = state.value;
    this.isType = state.isType;
    this.scopeDepth = state.scopeDepth;
  }

  public TokenType getType() {
    return type;
  }

  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  /**
   * The decoded contents of a string literal, the text of a name or template part, or {@code
   * null} for punctuation.
   */
  public @Nullable String getValue() {
    return value;
  }

  public @Nullable IdentifierRole getIdentifierRole() {
    return identifierRole;
  }

  void setIdentifierRole(@Nullable IdentifierRole identifierRole) {
    this.identifierRole = identifierRole;
  }

  /** Whether the token is part of a type annotation or declaration and must be erased. */
  public boolean isType() {
    return isType;
  }

  void setType(boolean isType) {
    this.isType = isType;
  }

  /**
   * The id shared by the tokens that make up one tracked construct (a class, a function, an
   * object literal or a call's argument list), or {@code null}.
   */
  public @Nullable Integer getContextId() {
    return contextId;
  }

  void setContextId(int contextId) {
    this.contextId = contextId;
  }

  /** On a {@code class} token, whether the class is used as a value rather than declared. */
  public boolean isExpression() {
    return isExpression;
  }

  void setExpression(boolean isExpression) {
    this.isExpression = isExpression;
  }

  /**
   * On the {@code =} of a class field, the index just past the initializer. On an {@code export}
   * of a variable declaration, the index just past the declaration. {@code -1} elsewhere.
   */
  public int getEndIndex() {
    return endIndex;
  }

  void setEndIndex(int endIndex) {
    this.endIndex = endIndex;
  }

  /** The number of enclosing function and class bodies. */
  public int getScopeDepth() {
    return scopeDepth;
  }

  void setScopeDepth(int scopeDepth) {
    this.scopeDepth = scopeDepth;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("type", type)
        .add("start", start)
        .add("end", end)
        .add("value", value)
        .add("role", identifierRole)
        .add("contextId", contextId)
        .toString();
  }
}
