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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.Iterables;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The single mutable record shared by the scanning and parsing capabilities of one {@link Parser}.
 *
 * <p>{@code type}, {@code start}, {@code end} and {@code value} describe the current token, which
 * has been scanned but not yet pushed onto {@link #tokens}.
 */
final class ScanState {
  final String input;
  final boolean isJsx;
  final boolean isTypeScript;
  final boolean isFlow;

  int pos;
  TokenType type = TokenType.EOF;
  int start;
  int end;
  @Nullable String value;

  final List<Token> tokens = new ArrayList<>();

  /** Whether tokens pushed now belong to a type region. */
  boolean isType;

  int scopeDepth;
  boolean inGenerator;
  boolean inAsync;

  private int nextContextId = 1;
  private ArrayDeque<Integer> contextStack = new ArrayDeque<>();

  ScanState(String input, boolean isJsx, boolean isTypeScript, boolean isFlow) {
    this.input = input;
    this.isJsx = isJsx;
    this.isTypeScript = isTypeScript;
    this.isFlow = isFlow;
  }

  boolean hasTypes() {
    return isTypeScript || isFlow;
  }

  Token lastToken() {
    return Iterables.getLast(tokens);
  }

  /** Starts a tracked construct whose opener is the most recently pushed token. */
  int openContext() {
    int id = nextContextId++;
    contextStack.push(id);
    lastToken().setContextId(id);
    return id;
  }

  /** Tags the most recently pushed token with the innermost tracked construct. */
  void stampContext() {
    checkState(!contextStack.isEmpty(), "No open construct at offset %s", start);
    lastToken().setContextId(contextStack.peek());
  }

  /** Tags the most recently pushed token as the closer of the innermost construct. */
  void closeContext() {
    stampContext();
    contextStack.pop();
  }

  /** Ends the innermost construct without tagging a closer. */
  void popContext() {
    contextStack.pop();
  }

  Snapshot snapshot() {
    return new Snapshot(this);
  }

  void restore(Snapshot snapshot) {
    pos = snapshot.pos;
    type = snapshot.type;
    start = snapshot.start;
    end = snapshot.end;
    value = snapshot.value;
    isType = snapshot.isType;
    scopeDepth = snapshot.scopeDepth;
    inGenerator = snapshot.inGenerator;
    inAsync = snapshot.inAsync;
    contextStack = new ArrayDeque<>(snapshot.contextStack);
    tokens.subList(snapshot.tokenCount, tokens.size()).clear();
  }

  /** Everything needed to rewind a speculative parse. */
  static final class Snapshot {
    private final int pos;
    private final TokenType type;
    private final int start;
    private final int end;
    private final @Nullable String value;
    private final int tokenCount;
    private final boolean isType;
    private final int scopeDepth;
    private final boolean inGenerator;
    private final boolean inAsync;
    private final ArrayDeque<Integer> contextStack;

    private Snapshot(ScanState state) {
      this.pos = state.pos;
      this.type = state.type;
      this.start = state.start;
      this.end = state.end;
      this.value = state.value;
      this.tokenCount = state.tokens.size();
      this.isType = state.isType;
      this.scopeDepth = state.scopeDepth;
      this.inGenerator = state.inGenerator;
      this.inAsync = state.inAsync;
      this.contextStack = new ArrayDeque<>(state.contextStack);
    }
  }
}
