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

package org.jscompiler.sourcemap;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class Base64VLQTest {

  @Test
  public void testEncodeKnownValues() throws IOException {
    assertThat(encode(0)).isEqualTo("A");
    assertThat(encode(1)).isEqualTo("C");
    assertThat(encode(-1)).isEqualTo("D");
    assertThat(encode(15)).isEqualTo("e");
    assertThat(encode(16)).isEqualTo("gB");
    assertThat(encode(123)).isEqualTo("2H");
    assertThat(encode(-123)).isEqualTo("3H");
  }

  @Test
  public void testDecodeSequence() {
    CharIteratorImpl it = new CharIteratorImpl("AAgBSA3HD");
    List<Integer> values = new ArrayList<>();
    while (it.hasNext()) {
      values.add(Base64VLQ.decode(it));
    }
    assertThat(values).containsExactly(0, 0, 16, 9, 0, -123, -1).inOrder();
  }

  @Test
  public void testDigitBoundaries() throws IOException {
    for (int value : ImmutableList.of(15, 16, 511, 512, -512, Integer.MAX_VALUE >> 1)) {
      String encoded = encode(value);
      CharIteratorImpl it = new CharIteratorImpl(encoded);
      assertThat(Base64VLQ.decode(it)).isEqualTo(value);
      assertThat(it.hasNext()).isFalse();
    }
  }

  @Test
  public void testBase64Digits() {
    assertThat(Base64.toBase64(0)).isEqualTo('A');
    assertThat(Base64.toBase64(26)).isEqualTo('a');
    assertThat(Base64.toBase64(52)).isEqualTo('0');
    assertThat(Base64.toBase64(63)).isEqualTo('/');
    assertThat(Base64.fromBase64('+')).isEqualTo(62);
    assertThrows(IllegalArgumentException.class, () -> Base64.toBase64(64));
    assertThrows(IllegalArgumentException.class, () -> Base64.fromBase64('*'));
  }

  private static String encode(int value) throws IOException {
    StringBuilder sb = new StringBuilder();
    Base64VLQ.encode(sb, value);
    return sb.toString();
  }

  private static final class CharIteratorImpl implements Base64VLQ.CharIterator {
    private final CharSequence cs;
    private int current;

    CharIteratorImpl(CharSequence cs) {
      this.cs = cs;
    }

    @Override
    public boolean hasNext() {
      return current < cs.length();
    }

    @Override
    public char next() {
      return cs.charAt(current++);
    }
  }
}
