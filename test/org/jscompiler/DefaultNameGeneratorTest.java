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

package org.jscompiler;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DefaultNameGeneratorTest {

  private static final ImmutableSet<String> RESERVED_NAMES = ImmutableSet.of("ba", "xba");

  private static String[] generate(NameGenerator ng, int num) {
    String[] result = new String[num];
    for (int i = 0; i < num; i++) {
      result[i] = ng.generateNextName();
    }
    return result;
  }

  @Test
  public void testGenerate() {
    DefaultNameGenerator ng = new DefaultNameGenerator(RESERVED_NAMES);
    String[] result = generate(ng, 106);
    assertThat(result[0]).isEqualTo("a");
    assertThat(result[25]).isEqualTo("z");
    assertThat(result[26]).isEqualTo("A");
    assertThat(result[51]).isEqualTo("Z");
    assertThat(result[52]).isEqualTo("$");
    assertThat(result[53]).isEqualTo("aa");
    // ba is reserved
    assertThat(result[54]).isEqualTo("ca");
    assertThat(result[104]).isEqualTo("$a");
    assertThat(result[105]).isEqualTo("ab");
  }

  @Test
  public void testKeywordsNotGenerated() {
    Set<String> names = ImmutableSet.copyOf(generate(new DefaultNameGenerator(), 3000));
    assertThat(names).containsNoneOf("do", "if", "in");
    assertThat(names).contains("da");
  }

  @Test
  public void testNoDuplicates() {
    String[] result = generate(new DefaultNameGenerator(), 5000);
    Set<String> seen = new HashSet<>();
    for (String name : result) {
      assertWithMessage("Duplicate name %s", name).that(seen.add(name)).isTrue();
    }
  }

  @Test
  public void testReservedNamesAreReferenced() {
    Set<String> reserved = new HashSet<>();
    DefaultNameGenerator ng = new DefaultNameGenerator(reserved);
    assertThat(ng.generateNextName()).isEqualTo("a");
    reserved.add("b");
    assertThat(ng.generateNextName()).isEqualTo("c");
  }

  @Test
  public void testReset() {
    DefaultNameGenerator ng = new DefaultNameGenerator();
    generate(ng, 10);
    ng.reset(ImmutableSet.of("a"));
    assertThat(ng.generateNextName()).isEqualTo("b");
  }
}
