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

import com.google.common.base.CharMatcher;
import java.util.ArrayList;
import java.util.List;
import org.jscompiler.ir.Node;
import org.jscompiler.sourcemap.FilePosition;
import org.jscompiler.sourcemap.SourceMapGeneratorV3;
import org.jspecify.annotations.Nullable;

/**
 * CodePrinter prints out JS code in either pretty format or compact format.
 *
 * @see CodeGenerator
 */
public final class CodePrinter {
  // There are two separate CodeConsumers, one for pretty-printing and
  // another for compact printing.

  private abstract static class MappedCodePrinter extends CodeConsumer {
    private final @Nullable List<Mapping> mappings;
    protected final StringBuilder code = new StringBuilder(1024);
    protected final int lineLengthThreshold;
    protected int lineLength = 0;
    protected int lineIndex = 0;

    MappedCodePrinter(int lineLengthThreshold, boolean createSrcMap) {
      this.lineLengthThreshold =
          lineLengthThreshold <= 0 ? Integer.MAX_VALUE : lineLengthThreshold;
      this.mappings = createSrcMap ? new ArrayList<>() : null;
    }

    /**
     * Maintains a mapping from a given node to the position in the generated code at which its
     * generated form starts.
     */
    private static final class Mapping {
      final Node node;
      final FilePosition start;

      Mapping(Node node, FilePosition start) {
        this.node = node;
        this.start = start;
      }

      @Override
      public String toString() {
        // This toString() representation is used for debugging purposes only.
        return "Mapping: start " + start + ", node " + node;
      }
    }

    /** Starts the source mapping for the given node at the current position. */
    @Override
    void startSourceMapping(Node node) {
      checkNotNull(node);
      if (mappings != null && node.getLineno() > 0) {
        // A pending ';' belongs before the node.
        if (statementNeedsEnded) {
          maybeEndStatement();
        }
        if (lineLength == 0) {
          // Write the pending indentation first.
          append("");
        }
        mappings.add(new Mapping(node, new FilePosition(lineIndex, lineLength)));
      }
    }

    /**
     * Generates the source map from the given code consumer, appending the information it saved
     * to the SourceMapGeneratorV3 object given.
     */
    void generateSourceMap(String sourceName, SourceMapGeneratorV3 map) {
      checkState(mappings != null, "source map not requested");
      for (Mapping mapping : mappings) {
        Node node = mapping.node;
        map.addMapping(
            sourceName,
            originalNameOf(node),
            new FilePosition(node.getLineno() - 1, node.getCharno()),
            mapping.start);
      }
      map.setLineCount(lineIndex + 1);
    }

    private static @Nullable String originalNameOf(Node node) {
      if (!node.isName()) {
        return null;
      }
      String originalName = node.getOriginalName();
      return originalName != null && !originalName.equals(node.getString()) ? originalName : null;
    }

    public String getCode() {
      return code.toString();
    }

    @Override
    char getLastChar() {
      return (code.length() > 0) ? code.charAt(code.length() - 1) : '\0';
    }

    /** Appends the string, keeping track of the current line. */
    protected final void appendTracked(String str) {
      code.append(str);
      lineLength += str.length();
      // Correct lineIndex and lineLength if there were newlines in the string.
      int newlines = CharMatcher.is('\n').countIn(str);
      if (newlines > 0) {
        lineIndex += newlines;
        lineLength = str.length() - str.lastIndexOf('\n') - 1;
      }
    }
  }

  static class PrettyCodePrinter extends MappedCodePrinter {
    static final String INDENT = "  ";

    private int indent = 0;

    /**
     * @param lineLengthThreshold The length of a line after which we force a newline when
     *     possible.
     * @param createSourceMap Whether to generate source map data.
     */
    private PrettyCodePrinter(int lineLengthThreshold, boolean createSourceMap) {
      super(lineLengthThreshold, createSourceMap);
    }

    /** Appends a string to the code, keeping track of the current line length. */
    @Override
    void append(String str) {
      // For pretty printing: indent at the beginning of the line
      if (lineLength == 0) {
        for (int i = 0; i < indent; i++) {
          appendTracked(INDENT);
        }
      }
      appendTracked(str);
    }

    /**
     * Adds a newline to the code, resetting the line length and handling indenting for pretty
     * printing.
     */
    @Override
    void startNewLine() {
      if (lineLength > 0) {
        code.append('\n');
        lineIndex++;
        lineLength = 0;
      }
    }

    @Override
    void maybeLineBreak() {
      maybeCutLine();
    }

    /** This may start a new line if the current line is longer than the line length threshold. */
    @Override
    void maybeCutLine() {
      if (lineLength > lineLengthThreshold) {
        startNewLine();
      }
    }

    @Override
    void endLine() {
      startNewLine();
    }

    @Override
    void appendBlockStart() {
      maybeInsertSpace();
      append("{");
      indent++;
    }

    @Override
    void appendBlockEnd() {
      maybeEndStatement();
      endLine();
      indent--;
      append("}");
    }

    @Override
    void listSeparator() {
      add(", ");
      maybeLineBreak();
    }

    @Override
    void endFunction(boolean statementContext) {
      super.endFunction(statementContext);
      if (statementContext) {
        startNewLine();
      }
    }

    @Override
    void beginCaseBody() {
      super.beginCaseBody();
      indent++;
      endLine();
    }

    @Override
    void endCaseBody() {
      super.endCaseBody();
      indent--;
    }

    @Override
    void appendOp(String op, boolean binOp) {
      if (getLastChar() != ' ' && binOp && op.charAt(0) != ',') {
        append(" ");
      }
      append(op);
      if (binOp) {
        append(" ");
      }
    }

    /** When pretty-printing, always place the statement in its own block. */
    @Override
    boolean shouldPreserveExtraBlocks() {
      return true;
    }

    @Override
    boolean shouldPreserveParentheses() {
      return true;
    }

    @Override
    void maybeInsertSpace() {
      if (getLastChar() != ' ' && getLastChar() != '\n') {
        add(" ");
      }
    }

    /** Whether the a line break should be added after the specified BLOCK. */
    @Override
    boolean breakAfterBlockFor(Node n, boolean isStatementContext) {
      checkState(n.isBlock(), n);
      Node parent = n.getParent();
      switch (parent.getToken()) {
        case DO:
          // Don't break before 'while' in DO-WHILE statements.
          return false;
        case FUNCTION:
          // FUNCTIONs are handled separately, don't break here.
          return false;
        case TRY:
          // Don't break before catch
          return n != parent.getFirstChild();
        case CATCH:
          // Don't break before finally. The CATCH sits in a block under the TRY.
          return parent.getGrandparent().getChildCount() != 3;
        case IF:
          // Don't break before else
          return n == parent.getLastChild();
        default:
          return true;
      }
    }

    @Override
    void endStatement(boolean needsSemicolon) {
      append(";");
      endLine();
      statementNeedsEnded = false;
    }

    @Override
    void endFile() {
      maybeEndStatement();
    }
  }

  static class CompactCodePrinter extends MappedCodePrinter {
    /**
     * @param lineLengthThreshold The length of a line after which we force a newline when
     *     possible.
     * @param createSrcMap Whether to gather source position mapping information when printing.
     */
    private CompactCodePrinter(int lineLengthThreshold, boolean createSrcMap) {
      super(lineLengthThreshold, createSrcMap);
    }

    /** Appends a string to the code, keeping track of the current line length. */
    @Override
    void append(String str) {
      appendTracked(str);
    }

    /** Adds a newline to the code, resetting the line length. */
    @Override
    void startNewLine() {
      if (lineLength > 0) {
        code.append('\n');
        lineLength = 0;
        lineIndex++;
      }
    }

    /**
     * This may start a new line if the current line is longer than the line length threshold.
     * Callers only ask at points where a newline cannot change the meaning of the code.
     */
    @Override
    void maybeCutLine() {
      if (lineLength > lineLengthThreshold) {
        startNewLine();
      }
    }
  }

  /** Builder for a CodePrinter. */
  public static final class Builder {
    private final Node root;
    private CompilerOptions.OutputMode outputMode = CompilerOptions.OutputMode.COMPACT;
    private int lineLengthThreshold = CompilerOptions.DEFAULT_LINE_LENGTH_THRESHOLD;
    private String sourceName = CompilerOptions.DEFAULT_SOURCE_NAME;
    private @Nullable SourceMapGeneratorV3 sourceMap = null;

    /**
     * Sets the root node from which to generate the source code.
     *
     * @param node The root node.
     */
    public Builder(Node node) {
      root = checkNotNull(node);
    }

    /** Sets the output options from compiler options. */
    public Builder setCompilerOptions(CompilerOptions options) {
      this.outputMode = options.getOutputMode();
      this.lineLengthThreshold = options.getLineLengthThreshold();
      this.sourceName = options.getSourceName();
      return this;
    }

    /** Sets whether pretty printing should be used. */
    public Builder setPrettyPrint(boolean prettyPrint) {
      this.outputMode =
          prettyPrint ? CompilerOptions.OutputMode.PRETTY : CompilerOptions.OutputMode.COMPACT;
      return this;
    }

    /**
     * Sets the source map generator that receives the mappings of the printed code.
     *
     * @param sourceMap The source map generator, or null for none.
     */
    public Builder setSourceMap(@Nullable SourceMapGeneratorV3 sourceMap) {
      this.sourceMap = sourceMap;
      return this;
    }

    /** Generates the source code and returns it. */
    public String build() {
      return toSource(root, outputMode, lineLengthThreshold, sourceName, sourceMap);
    }
  }

  private CodePrinter() {}

  /** Converts a tree to JS code */
  private static String toSource(
      Node root,
      CompilerOptions.OutputMode outputMode,
      int lineLengthThreshold,
      String sourceName,
      @Nullable SourceMapGeneratorV3 sourceMap) {
    boolean createSourceMap = sourceMap != null;
    MappedCodePrinter mcp =
        outputMode == CompilerOptions.OutputMode.COMPACT
            ? new CompactCodePrinter(lineLengthThreshold, createSourceMap)
            : new PrettyCodePrinter(lineLengthThreshold, createSourceMap);
    CodeGenerator cg = new CodeGenerator(mcp);
    cg.add(root);
    mcp.endFile();

    String code = mcp.getCode();

    if (sourceMap != null) {
      mcp.generateSourceMap(sourceName, sourceMap);
    }

    return code;
  }
}
