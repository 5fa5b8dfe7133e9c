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
package net.hydromatic.infix;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.infix.progspace.Explorer;

/**
 * Command-line entry point; explores the space of programs.
 *
 * <p>Arguments are properties in hyphenated form, for example
 * {@code --depth=1 --op-count=2 --enable-tuples=false}; see {@link Prop}.
 */
public class Main {
  private final List<String> argList;
  private final PrintWriter out;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main = new Main(ImmutableList.copyOf(args), System.out);
    final int status;
    try {
      status = main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
      return;
    }
    if (status != 0) {
      System.exit(status);
    }
  }

  /** Creates a Main. */
  public Main(List<String> argList, PrintStream out) {
    this(argList,
        new OutputStreamWriter(out, StandardCharsets.UTF_8));
  }

  /** Creates a Main. */
  public Main(List<String> argList, Writer out) {
    this.argList = ImmutableList.copyOf(argList);
    this.out = out instanceof PrintWriter
        ? (PrintWriter) out
        : new PrintWriter(out);
  }

  /** Runs the exploration. Returns 0 if every program round-trips, 1 if
   * there is a failure, 2 if the arguments are invalid. */
  public int run() {
    try {
      final Explorer explorer;
      try {
        final Map<Prop, Object> propMap = new LinkedHashMap<>();
        for (String arg : argList) {
          if (arg.equals("--help")) {
            usage();
            return 0;
          }
          setProp(propMap, arg);
        }
        explorer = Explorer.create(propMap, out::println);
      } catch (IllegalArgumentException e) {
        out.println("Error: " + e.getMessage());
        return 2;
      }
      return explorer.explore().ok() ? 0 : 1;
    } finally {
      out.flush();
    }
  }

  /** Parses an argument such as "--op-count=2" and sets the property. */
  private static void setProp(Map<Prop, Object> propMap, String arg) {
    final int eq = arg.indexOf('=');
    if (!arg.startsWith("--") || eq < 0) {
      throw new IllegalArgumentException("invalid argument '" + arg
          + "'; expected --name=value");
    }
    final String name =
        CaseFormat.LOWER_HYPHEN.to(CaseFormat.LOWER_CAMEL,
            arg.substring(2, eq));
    Prop.lookup(name).setLenient(propMap, arg.substring(eq + 1));
  }

  private void usage() {
    out.println("Usage: infix [--help] [--name=value]...");
    out.println();
    out.println("Properties:");
    for (Prop prop : Prop.BY_CAMEL_NAME) {
      out.println("  --"
          + CaseFormat.LOWER_CAMEL.to(CaseFormat.LOWER_HYPHEN, prop.camelName)
          + " (default " + prop.get(ImmutableMap.of()) + ")");
    }
  }
}

// End Main.java
