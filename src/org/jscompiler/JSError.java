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

import static com.google.common.base.Strings.emptyToNull;
import static java.util.Objects.requireNonNull;

import java.io.Serializable;
import org.jscompiler.ir.Node;
import org.jspecify.annotations.Nullable;

/**
 * Compile error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source
 * @param lineno One-indexed line number of the error location.
 * @param charno Zero-indexed character number of the error location.
 * @param defaultLevel The default level, before any per-diagnostic override is applied.
 */
public record JSError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    CheckLevel defaultLevel)
    implements Serializable {
  public JSError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  public DiagnosticType getType() {
    return type();
  }

  public String getDescription() {
    return description();
  }

  public @Nullable String getSourceName() {
    return sourceName();
  }

  public int getLineno() {
    return lineno();
  }

  public int getCharno() {
    return charno();
  }

  public CheckLevel getDefaultLevel() {
    return defaultLevel();
  }

  private static final int DEFAULT_LINENO = -1;
  private static final int DEFAULT_CHARNO = -1;

  /**
   * Creates a JSError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static JSError make(DiagnosticType type, Object... arguments) {
    return new JSError(
        type, type.format(arguments), null, DEFAULT_LINENO, DEFAULT_CHARNO, type.level);
  }

  /**
   * Creates a JSError at a given source location
   *
   * @param sourceName The source file name
   * @param lineno Line number with source file, or -1 if unknown
   * @param charno Column number within line, or -1 for whole line.
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static JSError make(
      @Nullable String sourceName, int lineno, int charno, DiagnosticType type,
      Object... arguments) {
    return new JSError(type, type.format(arguments), sourceName, lineno, charno, type.level);
  }

  /**
   * Creates a JSError from a Node position.
   *
   * @param sourceName The source file name
   * @param n Determines the line and char position
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static JSError make(
      @Nullable String sourceName, Node n, DiagnosticType type, Object... arguments) {
    return make(sourceName, n.getLineno(), n.getCharno(), type, arguments);
  }

  /** @return the default rendering of an error as text. */
  @Override
  public final String toString() {
    String sourceName =
        emptyToNull(this.sourceName()) != null ? this.sourceName() : "(unknown source)";
    String lineno =
        this.lineno() != DEFAULT_LINENO ? String.valueOf(this.lineno()) : "(unknown line)";
    String charno =
        this.charno() != DEFAULT_CHARNO ? String.valueOf(this.charno()) : "(unknown column)";

    return this.type().key
        + ". "
        + this.description()
        + " at "
        + sourceName
        + " line "
        + lineno
        + " : "
        + charno;
  }

  /**
   * Format a message at the given level.
   *
   * @return the formatted message or {@code null}
   */
  public final @Nullable String format(CheckLevel level, MessageFormatter formatter) {
    return switch (level) {
      case ERROR -> formatter.formatError(this);
      case WARNING -> formatter.formatWarning(this);
      default -> null;
    };
  }

  /** Alias for {@link #getLineno()}. */
  public final int getLineNumber() {
    return this.lineno();
  }
}
