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

/**
 * Rewrites one language feature. The root transformer offers each token to its transformers in
 * order; the first one that handles it consumes it, along with any tokens that follow it in the
 * same construct.
 */
abstract class Transformer {
  /**
   * Rewrites the construct at the cursor.
   *
   * @return whether anything was consumed; if not, the next transformer is asked
   */
  abstract boolean process();

  /** Code to emit before the rewritten file. */
  String getPrefixCode() {
    return "";
  }

  /** Code to emit after the rewritten file. */
  String getSuffixCode() {
    return "";
  }
}
