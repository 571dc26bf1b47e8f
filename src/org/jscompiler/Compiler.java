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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jscompiler.ir.Node;
import org.jscompiler.parsing.ParseException;
import org.jscompiler.parsing.Parser;
import org.jscompiler.sourcemap.SourceMapGeneratorV3;
import org.jspecify.annotations.Nullable;

/**
 * Compiler (and the other classes in this package) does the following:
 *
 * <ul>
 *   <li>parses JS code
 *   <li>checks for undeclared and early-referenced variables
 *   <li>performs optimizations such as constant folding, dead code removal and renaming
 *   <li>outputs the AST back as compact or pretty JS code, with an optional source map
 * </ul>
 *
 * <p>A Compiler compiles a single input once. Use a new instance for each compilation. The
 * compilation runs on a thread with a large stack, see {@link CompilerExecutor}.
 */
public class Compiler extends AbstractCompiler {
  static final DiagnosticType PARSE_ERROR =
      DiagnosticType.error("JSC_PARSE_ERROR", "Parse error. {0}");

  static final DiagnosticType PROGRAM_TOO_DEEP =
      DiagnosticType.error(
          "JSC_PROGRAM_TOO_DEEP",
          "The program is nested too deeply to compile ({0} ran out of stack)");

  /**
   * Logger for the whole org.jscompiler domain - setting configuration for this logger affects all
   * loggers in other classes within the compiler.
   */
  public static final Logger logger = Logger.getLogger("org.jscompiler");

  private static final Splitter LINE_SPLITTER =
      Splitter.onPattern("\\r\\n|[\\n\\r\\u2028\\u2029]");

  private final CompilerExecutor compilerExecutor = new CompilerExecutor();

  private @Nullable ErrorManager errorManager;
  private @Nullable CompilerOptions options;
  private @Nullable List<String> sourceLines;
  private boolean compiled = false;
  private int changeStamp = 0;

  /** The phase reported when an internal error escapes. */
  private String currentPhase = "initialization";

  /** Creates a Compiler that reports errors and warnings to its logger. */
  public Compiler() {}

  /** Creates a Compiler that uses a custom error manager. */
  public Compiler(ErrorManager errorManager) {
    this.errorManager = checkNotNull(errorManager);
  }

  /**
   * Compiles the source with the given options.
   *
   * @throws InternalCompilerError if the compiler breaks one of its own invariants
   * @throws IllegalStateException if this compiler has already compiled something
   */
  public Result compile(String source, CompilerOptions options) {
    checkState(!compiled, "A Compiler compiles only once; create a new instance.");
    compiled = true;
    initOptions(options);
    this.sourceLines = LINE_SPLITTER.splitToList(checkNotNull(source));

    try {
      return compilerExecutor.runInCompilerThread(() -> compileInternal(source));
    } catch (RuntimeException e) {
      throw new InternalCompilerError(currentPhase, e);
    }
  }

  /** Sets the options and the error manager, so that passes can run without {@link #compile}. */
  void initOptions(CompilerOptions options) {
    this.options = checkNotNull(options);
    if (errorManager == null) {
      LightweightMessageFormatter formatter = new LightweightMessageFormatter(this);
      formatter.setColorize(options.shouldColorizeErrorOutput());
      errorManager = new LoggerErrorManager(formatter, logger);
    }
  }

  private Result compileInternal(String source) {
    try {
      return compilePhases(source);
    } catch (StackOverflowError e) {
      logger.fine("Stack overflow while running " + currentPhase);
      report(JSError.make(options.getSourceName(), 1, 0, PROGRAM_TOO_DEEP, currentPhase));
      return toResult(null, null);
    }
  }

  private Result compilePhases(String source) {
    Node root = parse(source);
    if (root == null || hasHaltingErrors()) {
      return toResult(null, null);
    }

    runPass("varCheck", new VarCheck(this), root);
    if (options.shouldFoldConstants()) {
      runPass(
          "foldConstants",
          new PeepholeOptimizationsPass(this, new PeepholeFoldConstants()),
          root);
    }
    if (options.shouldRemoveDeadCode()) {
      runPass("removeDeadCode", new RemoveDeadCode(this), root);
    }
    if (options.shouldMangleNames()) {
      runPass("renameVars", new RenameVars(this), root);
    }
    if (options.shouldSimplifyStructure()) {
      runPass("simplifyStructure", new SimplifyStructure(this), root);
    }

    currentPhase = "printing";
    SourceMapGeneratorV3 sourceMap =
        options.shouldOutputSourceMap() ? new SourceMapGeneratorV3() : null;
    String code =
        new CodePrinter.Builder(root).setCompilerOptions(options).setSourceMap(sourceMap).build();
    return toResult(code, sourceMap == null ? null : toJson(sourceMap));
  }

  private @Nullable Node parse(String source) {
    currentPhase = "parsing";
    logger.fine("Parsing: " + options.getSourceName());
    try {
      return new Parser(source).parse();
    } catch (ParseException e) {
      report(
          JSError.make(
              options.getSourceName(),
              e.getLineNumber(),
              e.getColumnNumber(),
              PARSE_ERROR,
              e.details()));
      return null;
    }
  }

  private void runPass(String name, CompilerPass pass, Node root) {
    currentPhase = name;
    logger.fine("Running pass " + name);
    Stopwatch stopwatch = Stopwatch.createStarted();
    pass.process(root);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          "Finished pass " + name + " in " + stopwatch.elapsed(TimeUnit.MILLISECONDS) + " ms");
    }
  }

  private String toJson(SourceMapGeneratorV3 sourceMap) {
    StringBuilder sb = new StringBuilder();
    try {
      sourceMap.appendTo(sb, options.getSourceName());
    } catch (IOException e) {
      throw new IllegalStateException("A StringBuilder does not throw", e);
    }
    return sb.toString();
  }

  private Result toResult(@Nullable String code, @Nullable String sourceMap) {
    errorManager.generateReport();
    return new Result(errorManager.getErrors(), errorManager.getWarnings(), code, sourceMap);
  }

  @Override
  CompilerOptions getOptions() {
    return checkNotNull(options, "options are set by compile");
  }

  @Override
  public void report(JSError error) {
    CheckLevel level = options.getWarningLevel(error.getType());
    if (level == null) {
      level = error.getDefaultLevel();
    }
    if (level.isOn()) {
      errorManager.report(level, error);
    }
  }

  @Override
  public ErrorManager getErrorManager() {
    return checkNotNull(errorManager, "the error manager is set by compile");
  }

  @Override
  boolean hasHaltingErrors() {
    return errorManager.getErrorCount() > 0;
  }

  @Override
  public void reportChangeToEnclosingScope(Node n) {
    changeStamp++;
  }

  @Override
  int getChangeStamp() {
    return changeStamp;
  }

  @Override
  String getSourceName() {
    return getOptions().getSourceName();
  }

  @Override
  public @Nullable String getSourceLine(String sourceName, int lineNumber) {
    if (lineNumber < 1
        || sourceLines == null
        || lineNumber > sourceLines.size()
        || !sourceName.equals(getSourceName())) {
      return null;
    }
    return sourceLines.get(lineNumber - 1);
  }

  /** The errors reported so far. */
  public ImmutableList<JSError> getErrors() {
    return getErrorManager().getErrors();
  }

  /** The warnings reported so far. */
  public ImmutableList<JSError> getWarnings() {
    return getErrorManager().getWarnings();
  }
}
