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

import com.google.javascript.jstrip.parsing.Token;
import com.google.javascript.jstrip.parsing.TokenType;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Hands out identifiers that collide with no name in the file or handed out before. */
final class NameManager {
  private final Set<String> usedNames = new HashSet<>();

  NameManager(List<Token> tokens) {
    for (Token token : tokens) {
      if (token.getType() == TokenType.NAME && token.getValue() != null) {
        usedNames.add(token.getValue());
      }
    }
  }

  /** Returns {@code name}, or {@code name} followed by the smallest free number from 2 up. */
  String claimFreeName(String name) {
    String freeName = name;
    for (int suffix = 2; usedNames.contains(freeName); suffix++) {
      freeName = name + suffix;
    }
    usedNames.add(freeName);
    return freeName;
  }
}
