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
package net.hydromatic.infix.ast;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  INT_LITERAL(true),
  FLOAT_LITERAL(true),
  STRING_LITERAL(true),

  // tuple constructors; always bracketed by the canonical writer
  TUPLE(true),
  APPEND(true),

  // binary operators
  TUPLE_INDEX(" . ", 0),
  TIMES(" * ", -1),
  DIVIDE(" / ", -1),
  PLUS(" + ", -2),
  MINUS(" - ", -2),

  // statements
  ASSIGN,
  OUTPUT,
  CALCULATION;

  /** Group level of tuple and append, looser than any binary operator. */
  public static final int TUPLE_LEVEL = -3;

  /** Group level of the root of a statement, looser than anything. */
  public static final int ROOT_LEVEL = -4;

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Group level; higher binds tighter. Only meaningful for operators. */
  public final int level;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op() {
    this(null, ROOT_LEVEL, 0, 0);
  }

  Op(boolean atom) {
    this("", TUPLE_LEVEL, 99, 99);
    assert atom;
  }

  /** Creates a left-associative binary operator. Its binding powers are
   * derived from its level, so that "a + b + c" needs no parentheses but
   * "a + (b + c)" does. */
  Op(String padded, int level) {
    this(padded, level, (level - ROOT_LEVEL) * 2, (level - ROOT_LEVEL) * 2 + 1);
  }

  Op(String padded, int level, int left, int right) {
    this.padded = padded;
    this.level = level;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is a binary operator. */
  public boolean isBinary() {
    switch (this) {
    case TUPLE_INDEX:
    case TIMES:
    case DIVIDE:
    case PLUS:
    case MINUS:
      return true;
    default:
      return false;
    }
  }

  /** Returns whether an expression with this operator can only be parsed
   * if tuples are enabled. */
  public boolean isTupleOp() {
    switch (this) {
    case TUPLE:
    case APPEND:
    case TUPLE_INDEX:
      return true;
    default:
      return false;
    }
  }
}

// End Op.java
