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

/**
 * Thrown when the input cannot be scanned or parsed. The run that raised it produces no output.
 */
public class JsSyntaxException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int offset;
  private final int lineNumber;
  private final int columnNumber;

  public JsSyntaxException(String message, int offset, int lineNumber, int columnNumber) {
    super(message + " (" + lineNumber + ":" + columnNumber + ")");
    this.offset = offset;
    this.lineNumber = lineNumber;
    this.columnNumber = columnNumber;
  }

  /** The zero-based character offset into the source. */
  public int getOffset() {
    return offset;
  }

  /** The one-based line number of {@link #getOffset()}. */
  public int getLineNumber() {
    return lineNumber;
  }

  /** The zero-based column of {@link #getOffset()}. */
  public int getColumnNumber() {
    return columnNumber;
  }

  /** Creates an exception for {@code offset}, computing its line and column in {@code input}. */
  public static JsSyntaxException at(String input, int offset, String message) {
    int line = 1;
    int lineStart = 0;
    for (int i = 0; i < offset && i < input.length(); i++) {
      if (input.charAt(i) == '\n') {
        line++;
        lineStart = i + 1;
      }
    }
    return new JsSyntaxException(message, offset, line, offset - lineStart);
  }
}
