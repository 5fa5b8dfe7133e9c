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

import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * String built by concatenation, without copying.
 *
 * <p>{@link #concat} is O(1): it creates a node that refers to both
 * operands. The characters are copied only when the rope is converted to a
 * string. Ropes may be very deep, so conversion walks the tree with an
 * explicit stack rather than by recursion.
 *
 * <p>As with {@link String}, the length is at most
 * {@link Integer#MAX_VALUE}.
 */
public abstract class Rope {
  /** The empty rope. */
  public static final Rope EMPTY = new Leaf("");

  private Rope() {}

  /** Creates a rope that contains a string. */
  public static Rope of(String s) {
    return s.isEmpty() ? EMPTY : new Leaf(s);
  }

  /** Returns the number of characters. */
  public abstract int length();

  /** Returns a rope that consists of this rope followed by another.
   *
   * @throws ArithmeticException if the result would be longer than
   *   {@link Integer#MAX_VALUE}
   */
  public Rope concat(Rope rope) {
    return new Node(this, rope);
  }

  /** Returns a rope that consists of this rope followed by a string. */
  public Rope concat(String s) {
    return concat(of(s));
  }

  /** Appends the contents of this rope to a buffer. */
  public StringBuilder appendTo(StringBuilder buf) {
    final Deque<Rope> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      final Rope rope = stack.pop();
      if (rope instanceof Leaf) {
        buf.append(((Leaf) rope).s);
      } else {
        final Node node = (Node) rope;
        stack.push(node.right);
        stack.push(node.left);
      }
    }
    return buf;
  }

  @Override public String toString() {
    return appendTo(new StringBuilder(length())).toString();
  }

  /** Rope that holds a string. */
  private static class Leaf extends Rope {
    private final String s;

    Leaf(String s) {
      this.s = requireNonNull(s);
    }

    @Override public int length() {
      return s.length();
    }
  }

  /** Rope that is the concatenation of two ropes. */
  private static class Node extends Rope {
    private final Rope left;
    private final Rope right;
    private final int length;

    Node(Rope left, Rope right) {
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
      this.length = Math.addExact(left.length(), right.length());
    }

    @Override public int length() {
      return length;
    }
  }
}

// End Rope.java
