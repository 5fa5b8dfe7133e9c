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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.infix.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.regex.Pattern;
import net.hydromatic.infix.Prop;
import net.hydromatic.infix.ast.Ast;
import net.hydromatic.infix.ast.Pos;
import net.hydromatic.infix.util.ResultStream;

/**
 * Space of all programs up to a given size.
 *
 * <p>A program is a list of assignments, each to a different variable, and
 * each expression may refer to variables assigned by earlier statements.
 * The space is enumerated lazily, in a fixed order. Some numbers:
 *
 * <pre>
 * |E{depth 0, no variables}| = 4
 * |E{depth 0, 1 variable}|   = 5
 * |E{depth 1, no variables}| = 120
 * |E{depth 1, 1 variable}|   = 185
 * |E{depth 2, no variables}| = 101_040
 *
 * |P{1 statement, depth 0}|  = 4
 * |P{2 statements, depth 0}| = 20
 * |P{1 statement, depth 1}|  = 120
 * </pre>
 */
public class ProgramSpace {
  /** Same as the IDENTIFIER token of the parser. */
  private static final Pattern IDENTIFIER =
      Pattern.compile("[_A-Za-z][_A-Za-z0-9]*");

  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of("append", "print");

  private final ImmutableList<String> variableNames;

  /** Creates a ProgramSpace that assigns the given variables, in order.
   *
   * @throws IllegalArgumentException if a name is not an identifier, is a
   *   keyword, or occurs more than once
   */
  public ProgramSpace(List<String> variableNames) {
    this.variableNames = ImmutableList.copyOf(variableNames);
    for (String name : this.variableNames) {
      checkArgument(IDENTIFIER.matcher(name).matches(),
          "variable name '%s' is not an identifier", name);
      checkArgument(!KEYWORDS.contains(name),
          "variable name '%s' is a keyword", name);
    }
    checkArgument(new HashSet<>(this.variableNames).size()
        == this.variableNames.size(),
        "variable names must be distinct: %s", this.variableNames);
  }

  /** Creates a ProgramSpace whose variable names are given by the
   * {@link Prop#VARIABLE_NAMES} property. */
  public static ProgramSpace of(Map<Prop, Object> props) {
    return new ProgramSpace(Prop.VARIABLE_NAMES.listValue(props));
  }

  /** Returns the names of the variables, in the order they are assigned. */
  public List<String> variableNames() {
    return variableNames;
  }

  /**
   * Returns every expression of a given depth whose references are to
   * variables in {@code env}.
   *
   * <p>At depth 0, the expressions are "0", "1", a reference to each
   * variable in {@code env} (in sorted order), the empty tuple and the empty
   * append. At greater depths, every expression is a tuple, append or binary
   * operator whose operands are of the depth below.
   */
  public ResultStream<Ast.Exp> expressions(SortedSet<String> env,
      int depth) {
    checkArgument(depth >= 0, "negative depth %s", depth);
    if (depth == 0) {
      final ImmutableList.Builder<Ast.Exp> list = ImmutableList.builder();
      list.add(ast.intLiteral(Pos.ZERO, "0"));
      list.add(ast.intLiteral(Pos.ZERO, "1"));
      for (String name : env) {
        list.add(ast.id(Pos.ZERO, name));
      }
      list.add(ast.tuple(Pos.ZERO));
      list.add(ast.append(Pos.ZERO));
      return ResultStream.from(list.build());
    }
    final ImmutableSortedSet<String> env2 = ImmutableSortedSet.copyOf(env);
    return expressions(env2, depth - 1).flatMap(lhs ->
        ResultStream.<Ast.Exp>of(ast.tuple(Pos.ZERO, lhs), () ->
            ResultStream.<Ast.Exp>of(ast.append(Pos.ZERO, lhs), () ->
                expressions(env2, depth - 1).flatMap(rhs ->
                    binaries(lhs, rhs)))));
  }

  /** Returns each binary expression with two given operands. */
  private static ResultStream<Ast.Exp> binaries(Ast.Exp lhs, Ast.Exp rhs) {
    return ResultStream.of(
        ast.plus(lhs, rhs),
        ast.minus(lhs, rhs),
        ast.times(lhs, rhs),
        ast.divide(lhs, rhs),
        ast.tuple(Pos.ZERO, lhs, rhs),
        ast.append(Pos.ZERO, lhs, rhs),
        ast.tupleIndex(lhs, rhs));
  }

  /** Returns every assignment to {@code name} of an expression of a given
   * depth. */
  public ResultStream<Ast.Assign> assignments(SortedSet<String> env,
      String name, int depth) {
    requireNonNull(name);
    return expressions(env, depth).map(exp ->
        ast.assign(Pos.ZERO, ast.id(Pos.ZERO, name), exp));
  }

  /** Throws if this space cannot generate programs of {@code opCount}
   * statements. */
  public void checkOpCount(int opCount) {
    checkArgument(opCount >= 0, "negative op count %s", opCount);
    checkArgument(opCount <= variableNames.size(),
        "op count %s exceeds the number of variable names %s", opCount,
        variableNames.size());
  }

  /**
   * Returns every program of {@code opCount} assignments whose expressions
   * have a given depth.
   *
   * <p>The first statement assigns the first variable name, and so forth.
   * Each statement may refer to the variables assigned before it.
   *
   * @throws IllegalArgumentException if there are fewer variable names
   *   than {@code opCount}
   */
  public ResultStream<Ast.Calculation> calculations(int opCount, int depth) {
    checkOpCount(opCount);
    ResultStream<Partial> partials =
        ResultStream.of(
            new Partial(ast.calculation(), ImmutableSortedSet.of()));
    for (String name : variableNames.subList(0, opCount)) {
      partials = partials.flatMap(partial ->
          assignments(partial.env, name, depth).map(partial::plus));
    }
    return partials.map(partial -> partial.calculation);
  }

  /** Program that has some of its statements, and the variables those
   * statements assign. */
  private static class Partial {
    final Ast.Calculation calculation;
    final ImmutableSortedSet<String> env;

    Partial(Ast.Calculation calculation, ImmutableSortedSet<String> env) {
      this.calculation = calculation;
      this.env = env;
    }

    Partial plus(Ast.Assign assign) {
      return new Partial(calculation.plus(assign),
          ImmutableSortedSet.<String>naturalOrder()
              .addAll(env)
              .add(assign.id.name)
              .build());
    }
  }
}

// End ProgramSpace.java
