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

import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;
import java.util.Locale;

/** A source transform that can be switched on for a run. */
public enum Transform {
  /** ES module syntax to CommonJS {@code require} and {@code exports}. */
  IMPORTS("imports"),
  /** Removes Flow type annotations. */
  FLOW("flow"),
  /** Removes TypeScript type syntax. */
  TYPESCRIPT("typescript"),
  /** JSX elements to {@code React.createElement} calls. */
  JSX("jsx"),
  /** Makes a module with only a default export assign it to {@code module.exports}. */
  ADD_MODULE_EXPORTS("add-module-exports");

  private final String flagName;

  Transform(String flagName) {
    this.flagName = flagName;
  }

  /** The name used for this transform on the command line. */
  public String getFlagName() {
    return flagName;
  }

  public static Transform fromFlagName(String flagName) {
    for (Transform transform : values()) {
      if (transform.flagName.equals(flagName)) {
        return transform;
      }
    }
    throw new InvalidOptionsException("Unknown transform: %s", flagName);
  }

  /**
   * The transforms applied to a file with the given name when none are requested explicitly.
   * Files with an unrecognized extension are treated as JavaScript.
   */
  public static ImmutableSet<Transform> forFileExtension(String fileName) {
    switch (Files.getFileExtension(fileName).toLowerCase(Locale.ROOT)) {
      case "ts":
        return ImmutableSet.of(IMPORTS, TYPESCRIPT);
      case "tsx":
        return ImmutableSet.of(IMPORTS, TYPESCRIPT, JSX);
      default:
        return ImmutableSet.of(IMPORTS, FLOW, JSX);
    }
  }
}
