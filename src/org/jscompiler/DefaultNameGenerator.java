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

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import org.jscompiler.ir.TokenStream;

/**
 * A simple class for generating unique JavaScript variable names: {@code a} to {@code z}, {@code
 * A} to {@code Z} and {@code $}, then two characters, then three.
 *
 * <p>This class is not thread safe.
 */
final class DefaultNameGenerator implements NameGenerator {

  /** Generate short name with this first character */
  static final char[] FIRST_CHAR =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ$".toCharArray();

  /** These appear after after the first character */
  static final char[] NONFIRST_CHAR =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ_0123456789$".toCharArray();

  /** Names that are not keywords but still cannot be bound by a renamed variable. */
  private static final ImmutableSet<String> SPECIAL_NAMES = ImmutableSet.of("arguments", "eval");

  private Set<String> reservedNames;
  private int nameCount;

  public DefaultNameGenerator() {
    this(ImmutableSet.of());
  }

  /**
   * Creates a DefaultNameGenerator.
   *
   * @param reservedNames set of names that are reserved; generated names will not include these
   *     names. This set is referenced rather than copied.
   */
  public DefaultNameGenerator(Set<String> reservedNames) {
    reset(reservedNames);
  }

  @Override
  public void reset(Set<String> reservedNames) {
    this.reservedNames = reservedNames;
    this.nameCount = 0;
  }

  /** Generates the next short name. */
  @Override
  public String generateNextName() {
    while (true) {
      StringBuilder name = new StringBuilder();
      int i = nameCount;

      name.append(FIRST_CHAR[i % FIRST_CHAR.length]);
      i /= FIRST_CHAR.length;

      while (i > 0) {
        i--;
        name.append(NONFIRST_CHAR[i % NONFIRST_CHAR.length]);
        i /= NONFIRST_CHAR.length;
      }

      nameCount++;

      // Make sure it's not a JS keyword or reserved name.
      String result = name.toString();
      if (TokenStream.isReservedWord(result)
          || SPECIAL_NAMES.contains(result)
          || reservedNames.contains(result)) {
        continue;
      }
      return result;
    }
  }
}
