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

import java.util.Objects;
import net.hydromatic.infix.ast.Op;

/**
 * Binding context in which an expression is rendered.
 *
 * <p>An expression whose operator has a higher level than the context can
 * be written without parentheses. So can an expression whose level equals
 * the context's if the context allows associative chaining; that is the case
 * for the left operand of a left-associative operator.
 */
public class GroupPrecedence {
  /** Context at the root of a statement. */
  public static final GroupPrecedence DEFAULT =
      new GroupPrecedence(Op.ROOT_LEVEL, false);

  public final int level;
  public final boolean allowAssoc;

  private GroupPrecedence(int level, boolean allowAssoc) {
    this.level = level;
    this.allowAssoc = allowAssoc;
  }

  public static GroupPrecedence of(int level, boolean allowAssoc) {
    return new GroupPrecedence(level, allowAssoc);
  }

  /** Returns a context with the same level and the given associativity. */
  public GroupPrecedence withAssoc(boolean allowAssoc) {
    return allowAssoc == this.allowAssoc ? this
        : new GroupPrecedence(level, allowAssoc);
  }

  /** Returns whether an expression of a given level may appear in this
   * context without parentheses. */
  public boolean permits(int level) {
    return level > this.level
        || level == this.level && allowAssoc;
  }

  @Override public int hashCode() {
    return Objects.hash(level, allowAssoc);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof GroupPrecedence
        && level == ((GroupPrecedence) o).level
        && allowAssoc == ((GroupPrecedence) o).allowAssoc;
  }

  @Override public String toString() {
    return "{level: " + level + ", allowAssoc: " + allowAssoc + "}";
  }
}

// End GroupPrecedence.java
