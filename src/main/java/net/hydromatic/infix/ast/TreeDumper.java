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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import java.util.Locale;

/**
 * Writes a syntax tree as an indented list of nodes, one node per line.
 *
 * <p>For example, "foo = 1 + bar;" becomes
 *
 * <pre>{@code
 * calculation
 *   assign foo
 *     plus
 *       int_literal 1
 *       id bar
 * }</pre>
 *
 * <p>Unlike the text from {@link AstWriter}, the dump shows the structure
 * of the tree, so two dumps can be compared line by line.
 */
public class TreeDumper extends Visitor {
  private final StringBuilder b;
  private int indent = 0;

  private TreeDumper(StringBuilder b) {
    this.b = requireNonNull(b);
  }

  /** Returns the dump of a tree. */
  public static String dump(AstNode node) {
    final StringBuilder b = new StringBuilder();
    node.accept(new TreeDumper(b));
    return b.toString();
  }

  private void line(AstNode node, String suffix) {
    if (b.length() > 0) {
      b.append('\n');
    }
    b.append(Strings.repeat("  ", indent))
        .append(node.op.name().toLowerCase(Locale.ROOT))
        .append(suffix);
  }

  private void nested(AstNode node, String suffix, Runnable children) {
    line(node, suffix);
    ++indent;
    children.run();
    --indent;
  }

  @Override protected void visit(Ast.Literal literal) {
    line(literal, " " + literal.text);
  }

  @Override protected void visit(Ast.Id id) {
    line(id, " " + id.name);
  }

  @Override protected void visit(Ast.Tuple tuple) {
    nested(tuple, "", () -> super.visit(tuple));
  }

  @Override protected void visit(Ast.Append append) {
    nested(append, "", () -> super.visit(append));
  }

  @Override protected void visit(Ast.InfixCall infixCall) {
    nested(infixCall, "", () -> super.visit(infixCall));
  }

  @Override protected void visit(Ast.Assign assign) {
    nested(assign, " " + assign.id.name, () -> assign.exp.accept(this));
  }

  @Override protected void visit(Ast.Output output) {
    nested(output, " " + output.label.text, () -> output.exp.accept(this));
  }

  @Override protected void visit(Ast.Calculation calculation) {
    nested(calculation, "", () -> super.visit(calculation));
  }
}

// End TreeDumper.java
