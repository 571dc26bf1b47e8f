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

/** An extension of {@code boolean} with a third, unknown, value. */
public enum Tri {
  TRUE,
  FALSE,
  UNKNOWN;

  public static Tri forBoolean(boolean value) {
    return value ? TRUE : FALSE;
  }

  public Tri not() {
    return switch (this) {
      case TRUE -> FALSE;
      case FALSE -> TRUE;
      case UNKNOWN -> UNKNOWN;
    };
  }

  public Tri and(Tri other) {
    if (this == FALSE || other == FALSE) {
      return FALSE;
    }
    return (this == TRUE && other == TRUE) ? TRUE : UNKNOWN;
  }

  public Tri or(Tri other) {
    if (this == TRUE || other == TRUE) {
      return TRUE;
    }
    return (this == FALSE && other == FALSE) ? FALSE : UNKNOWN;
  }

  /** Converts to a boolean, using {@code valueForUnknown} when the value is unknown. */
  public boolean toBoolean(boolean valueForUnknown) {
    return switch (this) {
      case TRUE -> true;
      case FALSE -> false;
      case UNKNOWN -> valueForUnknown;
    };
  }
}
