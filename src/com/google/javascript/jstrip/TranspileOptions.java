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
import com.google.common.collect.ImmutableSet;
import org.jspecify.annotations.Nullable;

/** The configuration of one {@link Transpiler} run. */
@AutoValue
public abstract class TranspileOptions {
  public abstract ImmutableSet<Transform> transforms();

  /** The path of the file being rewritten, used in JSX debug metadata and display names. */
  public abstract @Nullable String filePath();

  /** Whether JSX elements get {@code __self} and {@code __source} properties. */
  public abstract boolean jsxDebugMetadata();

  public boolean has(Transform transform) {
    return transforms().contains(transform);
  }

  public static Builder builder() {
    return new AutoValue_TranspileOptions.Builder()
        .setTransforms(ImmutableSet.of())
        .setJsxDebugMetadata(true);
  }

  /** Builder for {@link TranspileOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setTransforms(Iterable<Transform> transforms);

    public Builder setTransforms(Transform... transforms) {
      return setTransforms(ImmutableSet.copyOf(transforms));
    }

    public abstract Builder setFilePath(@Nullable String filePath);

    public abstract Builder setJsxDebugMetadata(boolean jsxDebugMetadata);

    abstract TranspileOptions autoBuild();

    /**
     * @throws InvalidOptionsException if the transforms cannot be combined
     */
    public TranspileOptions build() {
      TranspileOptions options = autoBuild();
      if (options.has(Transform.TYPESCRIPT) && !options.has(Transform.IMPORTS)) {
        throw new InvalidOptionsException(
            "The TypeScript transform without the import transform is not supported.");
      }
      if (options.has(Transform.TYPESCRIPT) && options.has(Transform.FLOW)) {
        throw new InvalidOptionsException(
            "The Flow and TypeScript transforms cannot be used together.");
      }
      return options;
    }
  }
}
