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

import java.util.List;
import java.util.function.Function;
import net.hydromatic.infix.ast.Ast;
import net.hydromatic.infix.ast.Op;
import net.hydromatic.infix.util.ResultStream;

/**
 * Writes a tree in every way that a parser should read back as the same
 * tree.
 *
 * <p>Where parentheses are optional, there are two renderings, one without
 * and one with. Where a trailing comma is optional, there are two
 * renderings, one without and one with. A tree with several such choices
 * has a rendering for each combination of choices; they are generated
 * lazily, one at a time.
 *
 * <p>The first rendering of each tree uses no optional parentheses and no
 * optional commas, except that a tuple at the root of a statement is
 * written without parentheses.
 */
public class Renderer {
  /** Context of the elements of a tuple or append. */
  private static final GroupPrecedence ELEMENT =
      GroupPrecedence.of(Op.TUPLE_LEVEL, false);

  /** Returns every rendering of a program. Statements are separated by
   * newlines. */
  public ResultStream<Rendering> render(Ast.Calculation calculation) {
    ResultStream<Rendering> s = ResultStream.of(Rendering.EMPTY);
    final List<Ast.Stmt> stmts = calculation.stmts;
    for (int i = 0; i < stmts.size(); i++) {
      final Ast.Stmt stmt = stmts.get(i);
      final String separator = i == 0 ? "" : "\n";
      s = s.flatMap(r ->
          render(stmt).map(r2 -> r.concat(separator).concat(r2)));
    }
    return s;
  }

  /** Returns every rendering of a statement. */
  public ResultStream<Rendering> render(Ast.Stmt stmt) {
    final String prefix;
    switch (stmt.op) {
    case ASSIGN:
      prefix = ((Ast.Assign) stmt).id.name + " = ";
      break;
    case OUTPUT:
      prefix = "print " + ((Ast.Output) stmt).label.text + " ";
      break;
    default:
      throw new AssertionError("unknown statement " + stmt.op);
    }
    return render(GroupPrecedence.DEFAULT, stmt.exp)
        .map(r -> Rendering.of(prefix).concat(r).concat(";"));
  }

  /** Returns every rendering of an expression in a given context. */
  public ResultStream<Rendering> render(GroupPrecedence context,
      Ast.Exp exp) {
    switch (exp.op) {
    case INT_LITERAL:
    case FLOAT_LITERAL:
    case STRING_LITERAL:
      return ResultStream.of(Rendering.of(((Ast.Literal) exp).text));

    case ID:
      return ResultStream.of(Rendering.of(((Ast.Id) exp).name));

    case TUPLE:
      return sequence(context, "(", ((Ast.Tuple) exp).args, true);

    case APPEND:
      return sequence(context, "append(", ((Ast.Append) exp).args, false);

    case TUPLE_INDEX:
    case TIMES:
    case DIVIDE:
    case PLUS:
    case MINUS:
      return infix(context, (Ast.InfixCall) exp);

    default:
      throw new AssertionError("unknown op " + exp.op);
    }
  }

  private ResultStream<Rendering> infix(GroupPrecedence context,
      Ast.InfixCall call) {
    final Op op = call.op;
    return wrapGroup(context, op.level, inner ->
        render(inner.withAssoc(true), call.a0).flatMap(r0 ->
            render(inner.withAssoc(false), call.a1).map(r1 ->
                r0.concat(op.padded).concat(r1))));
  }

  /**
   * Renders an expression whose operator has a given level.
   *
   * <p>Calls {@code fn} to render the contents in a context of that level.
   * If {@code context} permits the level, yields each rendering without
   * parentheses, then each with parentheses; otherwise only the latter.
   */
  static ResultStream<Rendering> wrapGroup(GroupPrecedence context,
      int level, Function<GroupPrecedence, ResultStream<Rendering>> fn) {
    final ResultStream<Rendering> contents =
        fn.apply(GroupPrecedence.of(level, false));
    if (context.permits(level)) {
      return contents.concat(() -> contents.map(Rendering::parenthesize));
    }
    return contents.map(Rendering::parenthesize);
  }

  /**
   * Renders a tuple or append.
   *
   * <p>A trailing comma is mandatory if there are fewer than two elements,
   * and optional otherwise. If {@code omittable}, there are at least two
   * elements, and the context is loose enough, the parentheses are optional
   * too; renderings without them are flagged.
   */
  private ResultStream<Rendering> sequence(GroupPrecedence context,
      String prefix, List<Ast.Exp> args, boolean omittable) {
    ResultStream<Rendering> elements = ResultStream.of(Rendering.EMPTY);
    for (int i = 0; i < args.size(); i++) {
      final Ast.Exp arg = args.get(i);
      final String separator = i == 0 ? "" : ", ";
      elements = elements.flatMap(r ->
          render(ELEMENT, arg).map(r2 -> r.concat(separator).concat(r2)));
    }
    final ResultStream<Rendering> list;
    if (args.size() < 2) {
      list = elements.map(r -> r.concat(","));
    } else {
      final ResultStream<Rendering> elements2 = elements;
      list = elements2.concat(() -> elements2.map(r -> r.concat(",")));
    }
    if (omittable
        && args.size() >= 2
        && context.permits(Op.TUPLE_LEVEL)) {
      return list.map(Rendering::withParensOmitted)
          .concat(() -> list.map(r -> r.wrap(prefix, ")")));
    }
    return list.map(r -> r.wrap(prefix, ")"));
  }
}

// End Renderer.java
