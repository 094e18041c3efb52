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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import org.jspecify.annotations.Nullable;

/** What rewriting one class needs to know about it, collected ahead of the rewrite. */
@AutoValue
abstract class ClassInfo {
  /** The declared name; {@code null} for an anonymous class. */
  abstract @Nullable String className();

  /** Whether the class is used as a value rather than declared by a statement. */
  abstract boolean isExpression();

  abstract boolean hasSuperclass();

  /** Token index ranges of the field declarations, in source order. */
  abstract ImmutableList<Range<Integer>> fieldRanges();

  /**
   * The index of the token after which constructor initializers are inserted, or {@code -1} if
   * the class has no constructor and one must be synthesized.
   */
  abstract int constructorInsertPos();

  /** Statements run by the constructor: parameter properties, then instance fields. */
  abstract ImmutableList<String> initializerStatements();

  /** Static field assignments, each to be prefixed with the class name, such as {@code .x = 1}. */
  abstract ImmutableList<String> staticInitializerSuffixes();

  static Builder builder() {
    return new AutoValue_ClassInfo.Builder().setConstructorInsertPos(-1);
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setClassName(@Nullable String className);

    abstract Builder setIsExpression(boolean isExpression);

    abstract Builder setHasSuperclass(boolean hasSuperclass);

    abstract ImmutableList.Builder<Range<Integer>> fieldRangesBuilder();

    abstract Builder setConstructorInsertPos(int constructorInsertPos);

    abstract Builder setInitializerStatements(ImmutableList<String> initializerStatements);

    abstract ImmutableList.Builder<String> staticInitializerSuffixesBuilder();

    abstract ClassInfo build();
  }
}
