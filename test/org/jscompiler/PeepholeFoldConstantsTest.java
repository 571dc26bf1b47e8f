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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PeepholeFoldConstantsTest extends CompilerTestCase {

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return new PeepholeOptimizationsPass(compiler, new PeepholeFoldConstants());
  }

  private void fold(String js, String expected) {
    test(js, expected);
  }

  private void foldSame(String js) {
    testSame(js);
  }

  @Test
  public void testFoldArithmetic() {
    fold("x = 1 + 2", "x = 3");
    fold("x = 10 - 4", "x = 6");
    fold("x = 1 - 2", "x = -1");
    fold("x = 2 * 3", "x = 6");
    fold("x = 10 / 4", "x = 2.5");
    fold("x = 7 % 3", "x = 1");
    fold("x = 2 ** 10", "x = 1024");
    fold("x = 1 + 2 + 3", "x = 6");
    fold("x = -(-4)", "x = 4");
    fold("x = +5", "x = 5");
  }

  @Test
  public void testFoldArithmeticNotWorthIt() {
    foldSame("x = 1 / 3");
    foldSame("x = 0.1 + 0.2");
    foldSame("x = 10 ** 20");
    foldSame("x = 9007199254740992 * 2");
  }

  @Test
  public void testNoFoldToSpecialValues() {
    foldSame("x = 1 / 0");
    foldSame("x = 1 % 0");
    foldSame("x = 0 * -1");
  }

  @Test
  public void testNoFoldNonLiterals() {
    foldSame("x = y + 1 + 2");
    foldSame("x = y * 2");
    foldSame("x = f() - 1");
  }

  @Test
  public void testFoldStringConcatenation() {
    fold("x = 'a' + 'b'", "x = 'ab'");
    fold("x = 'a' + 1", "x = 'a1'");
    fold("x = 'a' + 1 + 2", "x = 'a12'");
    fold("x = 1 + 2 + 'a'", "x = '3a'");
    fold("x = 'a' + true", "x = 'atrue'");
    fold("x = 'a' + null", "x = 'anull'");
    foldSame("x = 'a' + 1.5");
    foldSame("x = 'a' + y");
  }

  @Test
  public void testFoldBitwise() {
    fold("x = 5 & 3", "x = 1");
    fold("x = 5 | 3", "x = 7");
    fold("x = 5 ^ 3", "x = 6");
    fold("x = ~5", "x = -6");
    fold("x = 1 << 3", "x = 8");
    fold("x = 1 << 31", "x = -2147483648");
    fold("x = -8 >> 1", "x = -4");
    fold("x = -1 >>> 0", "x = 4294967295");
    foldSame("x = 1 << 32");
    foldSame("x = 1 << y");
  }

  @Test
  public void testFractionalBitwiseOperand() {
    testWarning("x = 1.5 | 0", PeepholeFoldConstants.FRACTIONAL_BITWISE_OPERAND);
    testWarning("x = 1 << 0.5", PeepholeFoldConstants.FRACTIONAL_BITWISE_OPERAND);
    testWarning("x = ~1.5", PeepholeFoldConstants.FRACTIONAL_BITWISE_OPERAND);
  }

  @Test
  public void testFoldNot() {
    fold("x = !true", "x = false");
    fold("x = !0", "x = true");
    fold("x = !'a'", "x = false");
    foldSame("x = !y");
  }

  @Test
  public void testFoldAndOr() {
    fold("x = true && y", "x = y");
    fold("x = false && y", "x = false");
    fold("x = 0 || y", "x = y");
    fold("x = 'a' || y", "x = 'a'");
    foldSame("x = y && true");
    foldSame("x = y || 0");
  }

  @Test
  public void testFoldComparison() {
    fold("x = 1 < 2", "x = true");
    fold("x = 2 <= 1", "x = false");
    fold("x = 'a' < 'b'", "x = true");
    fold("x = 'a' === 'a'", "x = true");
    fold("x = 1 === '1'", "x = false");
    fold("x = 1 !== '1'", "x = true");
    fold("x = null == void 0", "x = true");
    fold("x = null === void 0", "x = false");
    fold("x = true > false", "x = true");
    foldSame("x = 1 == '1'");
    foldSame("x = y < 1");
  }

  @Test
  public void testFoldTypeof() {
    fold("x = typeof 1", "x = 'number'");
    fold("x = typeof 'a'", "x = 'string'");
    fold("x = typeof true", "x = 'boolean'");
    fold("x = typeof null", "x = 'object'");
    fold("x = typeof [1, 2]", "x = 'object'");
    fold("x = typeof function() {}", "x = 'function'");
    fold("x = typeof void 0", "x = 'undefined'");
    foldSame("x = typeof y");
    foldSame("x = typeof [y]");
  }

  @Test
  public void testReduceVoid() {
    fold("x = void 1", "x = void 0");
    fold("x = void 'a'", "x = void 0");
    foldSame("x = void 0");
    foldSame("x = void f()");
  }
}
