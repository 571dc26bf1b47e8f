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

package org.jscompiler.ir;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DToATest {

  @Test
  public void testIntegers() {
    assertThat(DToA.numberToString(0)).isEqualTo("0");
    assertThat(DToA.numberToString(-0.0)).isEqualTo("0");
    assertThat(DToA.numberToString(1)).isEqualTo("1");
    assertThat(DToA.numberToString(100)).isEqualTo("100");
    assertThat(DToA.numberToString(-42)).isEqualTo("-42");
  }

  @Test
  public void testFractions() {
    assertThat(DToA.numberToString(1.5)).isEqualTo("1.5");
    assertThat(DToA.numberToString(123.456)).isEqualTo("123.456");
    assertThat(DToA.numberToString(0.1 + 0.2)).isEqualTo("0.30000000000000004");
    assertThat(DToA.numberToString(0.000001)).isEqualTo("0.000001");
  }

  @Test
  public void testExponents() {
    assertThat(DToA.numberToString(1e21)).isEqualTo("1e+21");
    assertThat(DToA.numberToString(1.5e300)).isEqualTo("1.5e+300");
    assertThat(DToA.numberToString(1e-7)).isEqualTo("1e-7");
    assertThat(DToA.numberToString(1e20)).isEqualTo("100000000000000000000");
  }

  @Test
  public void testSpecialValues() {
    assertThat(DToA.numberToString(Double.NaN)).isEqualTo("NaN");
    assertThat(DToA.numberToString(Double.POSITIVE_INFINITY)).isEqualTo("Infinity");
    assertThat(DToA.numberToString(Double.NEGATIVE_INFINITY)).isEqualTo("-Infinity");
  }
}
