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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.ObjIntConsumer;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Base class of expression parse tree nodes. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    public void forEachArg(ObjIntConsumer<Exp> action) {
      // no args
    }

    /** Returns a list of all arguments. */
    public final List<Exp> args() {
      final ImmutableList.Builder<Exp> args = ImmutableList.builder();
      forEachArg((exp, i) -> args.add(exp));
      return args.build();
    }

    /** Returns whether this expression, or any expression within it, is a
     * tuple, an append, or a tuple index. */
    public boolean containsTupleOps() {
      if (op.isTupleOp()) {
        return true;
      }
      for (Exp arg : args()) {
        if (arg.containsTupleOps()) {
          return true;
        }
      }
      return false;
    }
  }

  /** Parse tree node of an identifier. */
  public static class Id extends Exp {
    public final String name;

    /** Creates an Id. */
    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Id
          && this.name.equals(((Id) o).name);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Parse tree node of a literal (constant).
   *
   * <p>The value is held as source text, for example {@code 1}, {@code 2.5}
   * or {@code "abc"} (including the quotes). */
  public static class Literal extends Exp {
    public final String text;

    /** Creates a Literal. */
    Literal(Pos pos, Op op, String text) {
      super(pos, op);
      this.text = requireNonNull(text);
      checkArgument(op == Op.INT_LITERAL
          || op == Op.FLOAT_LITERAL
          || op == Op.STRING_LITERAL, "not a literal: %s", op);
    }

    @Override public int hashCode() {
      return Objects.hash(op, text);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && this.op == ((Literal) o).op
          && this.text.equals(((Literal) o).text);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(text);
    }
  }

  /** Tuple, for example "(a, b)". */
  public static class Tuple extends Exp {
    public final List<Exp> args;

    Tuple(Pos pos, Iterable<? extends Exp> args) {
      super(pos, Op.TUPLE);
      this.args = ImmutableList.copyOf(args);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      for (int i = 0; i < args.size(); i++) {
        action.accept(args.get(i), i);
      }
    }

    @Override public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Tuple
          && this.args.equals(((Tuple) o).args);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.sequence("(", args, ")");
    }
  }

  /** Call to the built-in "append" function, for example
   * "append(a, b)". */
  public static class Append extends Exp {
    public final List<Exp> args;

    Append(Pos pos, Iterable<? extends Exp> args) {
      super(pos, Op.APPEND);
      this.args = ImmutableList.copyOf(args);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      for (int i = 0; i < args.size(); i++) {
        action.accept(args.get(i), i);
      }
    }

    @Override public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Append
          && this.args.equals(((Append) o).args);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.sequence("append(", args, ")");
    }
  }

  /** Call to an infix operator. */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isBinary(), "not a binary operator: %s", op);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(a0, 0);
      action.accept(a1, 1);
    }

    @Override public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof InfixCall
          && this.op == ((InfixCall) o).op
          && this.a0.equals(((InfixCall) o).a0)
          && this.a1.equals(((InfixCall) o).a1);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /** Base class for statements. */
  public abstract static class Stmt extends AstNode {
    public final Exp exp;

    Stmt(Pos pos, Op op, Exp exp) {
      super(pos, op);
      this.exp = requireNonNull(exp);
    }
  }

  /** Assignment statement, for example "foo = 1 + 2;". */
  public static class Assign extends Stmt {
    public final Id id;

    Assign(Pos pos, Id id, Exp exp) {
      super(pos, Op.ASSIGN, exp);
      this.id = requireNonNull(id);
    }

    @Override public int hashCode() {
      return Objects.hash(id, exp);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Assign
          && this.id.equals(((Assign) o).id)
          && this.exp.equals(((Assign) o).exp);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(id.name).append(" = ").append(exp, 0, 0).append(";");
    }
  }

  /** Output statement, for example {@code print "total" a + b;}. */
  public static class Output extends Stmt {
    public final Literal label;

    Output(Pos pos, Literal label, Exp exp) {
      super(pos, Op.OUTPUT, exp);
      this.label = requireNonNull(label);
      checkArgument(label.op == Op.STRING_LITERAL);
    }

    @Override public int hashCode() {
      return Objects.hash(label, exp);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Output
          && this.label.equals(((Output) o).label)
          && this.exp.equals(((Output) o).exp);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("print ").append(label.text).append(" ")
          .append(exp, 0, 0).append(";");
    }
  }

  /** A whole program: a list of statements. */
  public static class Calculation extends AstNode {
    public final List<Stmt> stmts;

    Calculation(Pos pos, Iterable<? extends Stmt> stmts) {
      super(pos, Op.CALCULATION);
      this.stmts = ImmutableList.copyOf(stmts);
    }

    @Override public int hashCode() {
      return stmts.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Calculation
          && this.stmts.equals(((Calculation) o).stmts);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      for (int i = 0; i < stmts.size(); i++) {
        w.append(i == 0 ? "" : "\n").append(stmts.get(i), 0, 0);
      }
      return w;
    }

    /** Returns whether any statement uses tuples. */
    public boolean containsTupleOps() {
      for (Stmt stmt : stmts) {
        if (stmt.exp.containsTupleOps()) {
          return true;
        }
      }
      return false;
    }

    /** Returns a copy of this calculation with one more statement. */
    public Calculation plus(Stmt stmt) {
      return new Calculation(pos,
          ImmutableList.<Stmt>builder().addAll(stmts).add(stmt).build());
    }
  }
}

// End Ast.java
