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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a reference to a variable. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  /** Creates an integer literal, for example "12". */
  public Ast.Literal intLiteral(Pos pos, String text) {
    return new Ast.Literal(pos, Op.INT_LITERAL, text);
  }

  /** Creates a float literal, for example "1.5e3". */
  public Ast.Literal floatLiteral(Pos pos, String text) {
    return new Ast.Literal(pos, Op.FLOAT_LITERAL, text);
  }

  /** Creates a string literal; the text includes the quotes. */
  public Ast.Literal stringLiteral(Pos pos, String text) {
    checkArgument(text.length() >= 2
        && text.startsWith("\"")
        && text.endsWith("\""), "not quoted: %s", text);
    return new Ast.Literal(pos, Op.STRING_LITERAL, text);
  }

  public Ast.Tuple tuple(Pos pos, Iterable<? extends Ast.Exp> args) {
    return new Ast.Tuple(pos, args);
  }

  public Ast.Tuple tuple(Pos pos, Ast.Exp... args) {
    return new Ast.Tuple(pos, ImmutableList.copyOf(args));
  }

  public Ast.Append append(Pos pos, Iterable<? extends Ast.Exp> args) {
    return new Ast.Append(pos, args);
  }

  public Ast.Append append(Pos pos, Ast.Exp... args) {
    return new Ast.Append(pos, ImmutableList.copyOf(args));
  }

  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(pos, op, a0, a1);
  }

  public Ast.InfixCall plus(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(a0.pos.plus(a1.pos), Op.PLUS, a0, a1);
  }

  public Ast.InfixCall minus(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(a0.pos.plus(a1.pos), Op.MINUS, a0, a1);
  }

  public Ast.InfixCall times(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(a0.pos.plus(a1.pos), Op.TIMES, a0, a1);
  }

  public Ast.InfixCall divide(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(a0.pos.plus(a1.pos), Op.DIVIDE, a0, a1);
  }

  public Ast.InfixCall tupleIndex(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(a0.pos.plus(a1.pos), Op.TUPLE_INDEX, a0, a1);
  }

  public Ast.Assign assign(Pos pos, Ast.Id id, Ast.Exp exp) {
    return new Ast.Assign(pos, id, exp);
  }

  public Ast.Output output(Pos pos, Ast.Literal label, Ast.Exp exp) {
    return new Ast.Output(pos, label, exp);
  }

  public Ast.Calculation calculation(Pos pos,
      Iterable<? extends Ast.Stmt> stmts) {
    return new Ast.Calculation(pos, stmts);
  }

  public Ast.Calculation calculation(Ast.Stmt... stmts) {
    final List<Ast.Stmt> list = ImmutableList.copyOf(stmts);
    return new Ast.Calculation(Pos.sum(list), list);
  }
}

// End AstBuilder.java
