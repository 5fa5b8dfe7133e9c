/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.infix.util;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

/** Utilities. */
public class Static {
  private Static() {}

  /** Maximum number of unmatched trailing lines printed by
   * {@link #diffyPrint}. */
  private static final int MAX_EXTRA_LINES = 4;

  /** Splits a string into lines. A trailing newline does not create an
   * empty last line. */
  public static List<String> splitLines(String s) {
    if (s.isEmpty()) {
      return ImmutableList.of();
    }
    final String t = s.endsWith("\n") ? s.substring(0, s.length() - 1) : s;
    return Splitter.on('\n').splitToList(t);
  }

  /**
   * Compares two multi-line strings line by line, and writes the actual
   * lines to a consumer with a prefix that says how each compares to the
   * expected line in the same position.
   *
   * <p>A line that matches is prefixed with two spaces, a line that differs
   * with "! ". Actual lines beyond the end of the expected text are prefixed
   * with "+ "; after a few such lines, "..." ends the output.
   */
  public static void diffyPrint(String expected, String actual,
      Consumer<String> out) {
    final List<String> expectedLines = splitLines(expected);
    final List<String> actualLines = splitLines(actual);
    for (int i = 0; i < actualLines.size(); i++) {
      final String line = actualLines.get(i);
      if (i < expectedLines.size()) {
        out.accept((line.equals(expectedLines.get(i)) ? "  " : "! ") + line);
      } else if (i - expectedLines.size() >= MAX_EXTRA_LINES) {
        out.accept("...");
        break;
      } else {
        out.accept("+ " + line);
      }
    }
  }
}

// End Static.java
