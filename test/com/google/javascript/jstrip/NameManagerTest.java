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

import com.google.javascript.jstrip.parsing.Parser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link NameManager}. */
@RunWith(JUnit4.class)
public final class NameManagerTest {

  private static NameManager forCode(String code) {
    return new NameManager(Parser.parse(code, false, false, false));
  }

  @Test
  public void testUnusedNameIsReturnedAsIs() {
    assertThat(forCode("let a = 1;").claimFreeName("_interopRequireDefault"))
        .isEqualTo("_interopRequireDefault");
  }

  @Test
  public void testTakenNamesGetSuffixes() {
    NameManager names = forCode("const _a = 1; let _a2 = _a;");
    assertThat(names.claimFreeName("_a")).isEqualTo("_a3");
    assertThat(names.claimFreeName("_a")).isEqualTo("_a4");
  }

  @Test
  public void testClaimedNamesAreRemembered() {
    NameManager names = forCode("x;");
    assertThat(names.claimFreeName("_class")).isEqualTo("_class");
    assertThat(names.claimFreeName("_class")).isEqualTo("_class2");
  }

  @Test
  public void testStringsAreNotNames() {
    assertThat(forCode("f('e');").claimFreeName("e")).isEqualTo("e");
  }
}
