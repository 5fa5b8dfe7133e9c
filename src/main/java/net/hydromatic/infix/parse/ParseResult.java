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
package net.hydromatic.infix.parse;

import static java.util.Objects.requireNonNull;

import net.hydromatic.infix.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of parsing a program: either a tree or an error. */
public class ParseResult {
  private final Ast.@Nullable Calculation calculation;
  private final @Nullable InfixParseException error;

  private ParseResult(Ast.@Nullable Calculation calculation,
      @Nullable InfixParseException error) {
    this.calculation = calculation;
    this.error = error;
  }

  /** Creates a successful result. */
  public static ParseResult success(Ast.Calculation calculation) {
    return new ParseResult(requireNonNull(calculation), null);
  }

  /** Creates a failed result. */
  public static ParseResult failure(InfixParseException error) {
    return new ParseResult(null, requireNonNull(error));
  }

  /** Returns whether the text parsed successfully. */
  public boolean ok() {
    return calculation != null;
  }

  /** Returns the tree; throws if parsing failed. */
  public Ast.Calculation calculation() {
    if (calculation == null) {
      throw new IllegalStateException("parse failed: " + error);
    }
    return calculation;
  }

  /** Returns the error, or null if parsing succeeded. */
  public @Nullable InfixParseException error() {
    return error;
  }

  @Override public String toString() {
    return calculation != null
        ? "ok: " + calculation
        : "error: " + requireNonNull(error).describeTo(new StringBuilder());
  }
}

// End ParseResult.java
