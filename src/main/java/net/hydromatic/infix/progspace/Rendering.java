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
package net.hydromatic.infix.progspace;

import static java.util.Objects.requireNonNull;

import net.hydromatic.infix.util.Rope;

/**
 * One way of writing a tree as text.
 *
 * <p>Also records whether any tuple in the text was written without
 * parentheses; a parser that requires parentheses around tuples must reject
 * such text.
 */
public class Rendering {
  /** Rendering of the empty string. */
  public static final Rendering EMPTY = new Rendering(Rope.EMPTY, false);

  public final Rope rope;
  public final boolean tupleParensOmitted;

  private Rendering(Rope rope, boolean tupleParensOmitted) {
    this.rope = requireNonNull(rope);
    this.tupleParensOmitted = tupleParensOmitted;
  }

  public static Rendering of(String s) {
    return new Rendering(Rope.of(s), false);
  }

  /** Appends a string. */
  public Rendering concat(String s) {
    return new Rendering(rope.concat(s), tupleParensOmitted);
  }

  /** Appends another rendering. The result has omitted parentheses if
   * either input did. */
  public Rendering concat(Rendering r) {
    return new Rendering(rope.concat(r.rope),
        tupleParensOmitted || r.tupleParensOmitted);
  }

  /** Returns this rendering between a prefix and a suffix. */
  public Rendering wrap(String prefix, String suffix) {
    return new Rendering(Rope.of(prefix).concat(rope).concat(suffix),
        tupleParensOmitted);
  }

  /** Returns this rendering in parentheses. */
  public Rendering parenthesize() {
    return wrap("(", ")");
  }

  /** Returns a copy of this rendering that records that a tuple was written
   * without parentheses. */
  public Rendering withParensOmitted() {
    return tupleParensOmitted ? this : new Rendering(rope, true);
  }

  /** Returns the text. */
  public String text() {
    return rope.toString();
  }

  @Override public String toString() {
    return text() + (tupleParensOmitted ? " [parens omitted]" : "");
  }
}

// End Rendering.java
