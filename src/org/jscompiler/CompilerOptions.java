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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Compiler options */
public class CompilerOptions implements Serializable {
  private static final long serialVersionUID = 7L;

  /** The name diagnostics and source maps use for the input when none is set. */
  public static final String DEFAULT_SOURCE_NAME = "input.js";

  /** The length of a compact line after which the printer breaks it at the next safe point. */
  public static final int DEFAULT_LINE_LENGTH_THRESHOLD = 500;

  /** How the printer lays out the output. */
  public enum OutputMode {
    /** No whitespace beyond what keeps tokens apart. */
    COMPACT,
    /** Indented, one statement per line, every body braced. */
    PRETTY
  }

  //--------------------------------
  // Optimizations
  //--------------------------------

  /** Renames local variables to short names. */
  private boolean mangleNames = true;

  /** Folds constant expressions. */
  private boolean foldConstants = true;

  /** Removes unreachable code and unused local declarations. */
  private boolean removeDeadCode = true;

  /** Flattens blocks, merges declarations and shortens loops and booleans. */
  private boolean simplifyStructure = true;

  //--------------------------------
  // Output options
  //--------------------------------

  private OutputMode outputMode = OutputMode.COMPACT;

  private int lineLengthThreshold = DEFAULT_LINE_LENGTH_THRESHOLD;

  /** Whether a source map is produced along with the code. */
  private boolean sourceMapOutput = false;

  private String sourceName = DEFAULT_SOURCE_NAME;

  //--------------------------------
  // Diagnostics
  //--------------------------------

  /** Levels that override the default level of a diagnostic type, keyed by the type's key. */
  private final Map<String, CheckLevel> warningLevels = new HashMap<>();

  private boolean colorizeErrorOutput = false;

  /** Initializes compiler options. All optimizations are turned on by default. */
  public CompilerOptions() {}

  public void setMangleNames(boolean mangleNames) {
    this.mangleNames = mangleNames;
  }

  public boolean shouldMangleNames() {
    return mangleNames;
  }

  public void setFoldConstants(boolean foldConstants) {
    this.foldConstants = foldConstants;
  }

  public boolean shouldFoldConstants() {
    return foldConstants;
  }

  public void setRemoveDeadCode(boolean removeDeadCode) {
    this.removeDeadCode = removeDeadCode;
  }

  public boolean shouldRemoveDeadCode() {
    return removeDeadCode;
  }

  public void setSimplifyStructure(boolean simplifyStructure) {
    this.simplifyStructure = simplifyStructure;
  }

  public boolean shouldSimplifyStructure() {
    return simplifyStructure;
  }

  public void setOutputMode(OutputMode outputMode) {
    this.outputMode = checkNotNull(outputMode);
  }

  public OutputMode getOutputMode() {
    return outputMode;
  }

  /**
   * Sets the length of a compact line after which the printer starts a new line. Zero or less
   * disables line breaking.
   */
  public void setLineLengthThreshold(int lineLengthThreshold) {
    this.lineLengthThreshold = lineLengthThreshold;
  }

  public int getLineLengthThreshold() {
    return lineLengthThreshold;
  }

  public void setSourceMapOutput(boolean sourceMapOutput) {
    this.sourceMapOutput = sourceMapOutput;
  }

  public boolean shouldOutputSourceMap() {
    return sourceMapOutput;
  }

  /** Sets the name diagnostics and the source map use for the input. */
  public void setSourceName(String sourceName) {
    this.sourceName = checkNotNull(sourceName);
  }

  public String getSourceName() {
    return sourceName;
  }

  /**
   * Configure the given type of warning to the given level. {@link CheckLevel#OFF} drops the
   * diagnostic.
   */
  public void setWarningLevel(DiagnosticType type, CheckLevel level) {
    warningLevels.put(type.key, checkNotNull(level));
  }

  /** Returns the level configured for the type, or null if its default level applies. */
  @Nullable CheckLevel getWarningLevel(DiagnosticType type) {
    return warningLevels.get(type.key);
  }

  public void setColorizeErrorOutput(boolean colorizeErrorOutput) {
    this.colorizeErrorOutput = colorizeErrorOutput;
  }

  public boolean shouldColorizeErrorOutput() {
    return colorizeErrorOutput;
  }

  /** Turns every transformation on or off at once. */
  @CanIgnoreReturnValue
  CompilerOptions setAllOptimizations(boolean enabled) {
    mangleNames = enabled;
    foldConstants = enabled;
    removeDeadCode = enabled;
    simplifyStructure = enabled;
    return this;
  }
}
