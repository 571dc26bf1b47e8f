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

import static com.google.common.base.Preconditions.checkState;

import com.google.gson.Gson;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Collects source mappings and generates a source map in the "Revision 3" format.
 *
 * <p>Each mapping ties a position of the generated code to a position, and optionally a symbol
 * name, of an original source file. Mappings must be added in the order of their generated
 * positions. A mapping extends to the start of the next one.
 */
public final class SourceMapGeneratorV3 {

  /** Escapes JSON strings. */
  private static final Gson GSON = new Gson();

  /** A list of all the mappings in the current source map. */
  private final List<Mapping> mappings = new ArrayList<>();

  /** A map of source names to source name index. */
  private final Map<String, Integer> sourceFileMap = new LinkedHashMap<>();

  /** A map of symbol names to symbol name index. */
  private final Map<String, Integer> originalNameMap = new LinkedHashMap<>();

  /** The last mapping added, to validate the order and collapse mappings of the same position. */
  private @Nullable Mapping lastMapping;

  /** Number of lines of the generated code, at least one more than the last mapped line. */
  private int lineCount = 1;

  /** Clears the mappings added so far. */
  public void reset() {
    mappings.clear();
    sourceFileMap.clear();
    originalNameMap.clear();
    lastMapping = null;
    lineCount = 1;
  }

  /**
   * Adds a mapping for the given node. Mappings must be added in order.
   *
   * @param sourceName The file name to use in the generate source map to represent this source.
   * @param symbolName The symbol name associated with this position in the source map.
   * @param sourceStartPosition The starting position in the original source, first line 0.
   * @param startPosition The position of the generated code, first line 0.
   */
  public void addMapping(
      String sourceName,
      @Nullable String symbolName,
      FilePosition sourceStartPosition,
      FilePosition startPosition) {
    // Don't bother if there is not sufficient information to be useful.
    if (sourceStartPosition.getLine() < 0) {
      return;
    }

    Mapping mapping = new Mapping(sourceName, sourceStartPosition, symbolName, startPosition);

    // Validate the mappings are in a proper order.
    if (lastMapping != null) {
      int lastLine = lastMapping.startPosition.getLine();
      int lastColumn = lastMapping.startPosition.getColumn();
      int nextLine = startPosition.getLine();
      int nextColumn = startPosition.getColumn();
      checkState(
          nextLine > lastLine || (nextLine == lastLine && nextColumn >= lastColumn),
          "Incorrect source mappings order, previous : (%s,%s)\nnew : (%s,%s)",
          lastLine,
          lastColumn,
          nextLine,
          nextColumn);
      if (lastMapping.startPosition.equals(startPosition)) {
        // The innermost node starting at a position describes it best.
        mappings.remove(mappings.size() - 1);
      }
    }

    lastMapping = mapping;
    mappings.add(mapping);
    lineCount = Math.max(lineCount, startPosition.getLine() + 1);
  }

  /** Sets the number of lines of the generated code. */
  public void setLineCount(int lineCount) {
    this.lineCount = Math.max(this.lineCount, lineCount);
  }

  /**
   * Writes out the source map in the following format (line numbers are for reference only and
   * are not part of the format):
   *
   * <pre>
   * 1.  {
   * 2.    version: 3,
   * 3.    file: "out.js",
   * 4.    lineCount: 2,
   * 5.    mappings: "AAAAA,QAASA,UAAU;",
   * 6.    sources: ["foo.js", "bar.js"],
   * 7.    names: ["src", "maps", "are", "fun"]
   * 8.  }
   * </pre>
   *
   * @param out The stream to which the map will be appended.
   * @param name The name of the generated source file that this source map represents.
   */
  public void appendTo(Appendable out, String name) throws IOException {
    // Indexes are assigned in the order the mappings use them.
    for (Mapping m : mappings) {
      getSourceId(m.sourceFile);
      if (m.originalName != null) {
        getNameId(m.originalName);
      }
    }

    out.append("{\n");
    appendFirstField(out, "version", "3");
    appendField(out, "file", escapeString(name));
    appendField(out, "lineCount", String.valueOf(lineCount));

    StringBuilder lineMappings = new StringBuilder();
    new LineMapper(lineMappings).appendLineMappings();
    appendField(out, "mappings", escapeString(lineMappings.toString()));

    appendField(out, "sources", nameList(sourceFileMap));
    appendField(out, "names", nameList(originalNameMap));
    out.append("\n}\n");
  }

  private static String nameList(Map<String, Integer> map) {
    StringBuilder sb = new StringBuilder("[");
    for (String key : map.keySet()) {
      if (sb.length() > 1) {
        sb.append(",");
      }
      sb.append(escapeString(key));
    }
    return sb.append("]").toString();
  }

  /** Escapes the given string for JSON. */
  private static String escapeString(String value) {
    return GSON.toJson(value);
  }

  // Source map field helpers.

  private static void appendFirstField(Appendable out, String name, CharSequence value)
      throws IOException {
    out.append("\"").append(name).append("\":").append(value);
  }

  private static void appendField(Appendable out, String name, CharSequence value)
      throws IOException {
    out.append(",\n");
    appendFirstField(out, name, value);
  }

  private int getSourceId(String sourceName) {
    return sourceFileMap.computeIfAbsent(sourceName, k -> sourceFileMap.size());
  }

  private int getNameId(String symbolName) {
    return originalNameMap.computeIfAbsent(symbolName, k -> originalNameMap.size());
  }

  /** Maps a position in an input source file to a position in the generated code. */
  private static final class Mapping {
    final String sourceFile;

    /** The position of the code in the input source file. */
    final FilePosition originalPosition;

    /** The original name of the token found at the position represented by this mapping. */
    final @Nullable String originalName;

    /** The starting position of the code in the generated source file. */
    final FilePosition startPosition;

    Mapping(
        String sourceFile,
        FilePosition originalPosition,
        @Nullable String originalName,
        FilePosition startPosition) {
      this.sourceFile = sourceFile;
      this.originalPosition = originalPosition;
      this.originalName = originalName;
      this.startPosition = startPosition;
    }
  }

  /** Writes the "mappings" field: one group per generated line, separated by semicolons. */
  private class LineMapper {
    private final StringBuilder out;

    private int previousColumn;

    // Previous values used for storing relative ids.
    private int previousSourceFileId;
    private int previousSourceLine;
    private int previousSourceColumn;
    private int previousNameId;

    LineMapper(StringBuilder out) {
      this.out = out;
    }

    void appendLineMappings() throws IOException {
      int line = 0;
      boolean firstOnLine = true;
      for (Mapping m : mappings) {
        while (line < m.startPosition.getLine()) {
          out.append(';');
          line++;
          previousColumn = 0;
          firstOnLine = true;
        }
        if (!firstOnLine) {
          out.append(',');
        }
        writeEntry(m);
        firstOnLine = false;
      }
      while (line < lineCount - 1) {
        out.append(';');
        line++;
      }
    }

    /**
     * Writes an entry for the given mapping. The values are stored as relative to the last seen
     * values for each field and encoded as Base64VLQs.
     */
    private void writeEntry(Mapping m) throws IOException {
      // The relative generated column number
      int column = m.startPosition.getColumn();
      Base64VLQ.encode(out, column - previousColumn);
      previousColumn = column;

      // The relative source file id
      int sourceId = getSourceId(m.sourceFile);
      Base64VLQ.encode(out, sourceId - previousSourceFileId);
      previousSourceFileId = sourceId;

      // The relative source file line and column
      int srcline = m.originalPosition.getLine();
      int srcColumn = m.originalPosition.getColumn();
      Base64VLQ.encode(out, srcline - previousSourceLine);
      previousSourceLine = srcline;
      Base64VLQ.encode(out, srcColumn - previousSourceColumn);
      previousSourceColumn = srcColumn;

      if (m.originalName != null) {
        // The relative id for the associated symbol name
        int nameId = getNameId(m.originalName);
        Base64VLQ.encode(out, nameId - previousNameId);
        previousNameId = nameId;
      }
    }
  }
}
