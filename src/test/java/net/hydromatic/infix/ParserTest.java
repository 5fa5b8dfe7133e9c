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
package net.hydromatic.infix;

import static net.hydromatic.infix.Prog.prog;
import static net.hydromatic.infix.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.infix.ast.Ast;
import net.hydromatic.infix.ast.Pos;
import net.hydromatic.infix.ast.TreeDumper;
import net.hydromatic.infix.parse.InfixParseException;
import net.hydromatic.infix.parse.ParseResult;
import net.hydromatic.infix.parse.Parsers;
import org.junit.jupiter.api.Test;

/** Tests the parser and the canonical writer. */
public class ParserTest {
  private static Ast.Literal lit(int i) {
    return ast.intLiteral(Pos.ZERO, Integer.toString(i));
  }

  private static Ast.Id id(String name) {
    return ast.id(Pos.ZERO, name);
  }

  private static Ast.Calculation assign(String name, Ast.Exp exp) {
    return ast.calculation(ast.assign(Pos.ZERO, id(name), exp));
  }

  @Test
  void testParse() {
    prog("foo = 1;").assertParseSame();
    prog("foo = 1 + 2;").assertParseSame();
    prog("foo = bar;").assertParseSame();
    prog("foo = 1.5 + 2.0e10 - 3.25e-2;").assertParseSame();
    prog("foo = 1;\nbar = foo * 2;").assertParseSame();
    prog("print \"total\" foo + 1;").assertParseSame();
    prog("").assertParseSame();
    prog("  foo=1+2 ;  ").assertParse("foo = 1 + 2;");
    prog("// a comment\nfoo = 1; // another\n").assertParse("foo = 1;");
    prog("appendix = append_1;").assertParseSame();
  }

  /** Tests that the canonical writer removes redundant parentheses, and
   * keeps necessary ones. */
  @Test
  void testParentheses() {
    prog("foo = (1 + 2) + 3;").assertParse("foo = 1 + 2 + 3;");
    prog("foo = 1 + (2 + 3);").assertParseSame();
    prog("foo = 1 - (2 - 3);").assertParseSame();
    prog("foo = (1 * 2) + 3;").assertParse("foo = 1 * 2 + 3;");
    prog("foo = 1 * (2 + 3);").assertParseSame();
    prog("foo = (1 + 2) / 3;").assertParseSame();
    prog("foo = ((1));").assertParse("foo = 1;");
    prog("foo = (((1 + 2)));").assertParse("foo = 1 + 2;");
    prog("foo = 1 . 2 . 3;").assertParseSame();
    prog("foo = 1 . (2 . 3);").assertParseSame();
    prog("foo = (1 . 2) * 3;").assertParse("foo = 1 . 2 * 3;");
    prog("foo = (1 + 2) . 3;").assertParseSame();
  }

  /** Tests that operators bind and associate correctly. */
  @Test
  void testTree() {
    prog("foo = 1 + 2 * 3;")
        .assertTree(
            assign("foo", ast.plus(lit(1), ast.times(lit(2), lit(3)))));
    prog("foo = 1 - 2 - 3;")
        .assertTree(
            assign("foo", ast.minus(ast.minus(lit(1), lit(2)), lit(3))));
    prog("foo = 1 / 2 . 3;")
        .assertTree(
            assign("foo", ast.divide(lit(1), ast.tupleIndex(lit(2), lit(3)))));
    prog("foo = 1, 2 + 3;")
        .assertTree(
            assign("foo",
                ast.tuple(Pos.ZERO, lit(1), ast.plus(lit(2), lit(3)))));
    prog("foo = append(bar, (1,));")
        .assertTree(
            assign("foo",
                ast.append(Pos.ZERO, id("bar"), ast.tuple(Pos.ZERO, lit(1)))));
  }

  /** Tests tuples and appends, and where a trailing comma is written. */
  @Test
  void testTuple() {
    prog("foo = (,);").assertParseSame();
    prog("foo = (1,);").assertParseSame();
    prog("foo = (1, 2);").assertParseSame();
    prog("foo = (1, 2,);").assertParse("foo = (1, 2);");
    prog("foo = 1, 2;").assertParse("foo = (1, 2);");
    prog("foo = 1, 2, 3,;").assertParse("foo = (1, 2, 3);");
    prog("foo = 1,;").assertParse("foo = (1,);");
    prog("foo = ((1, 2), (3,));").assertParseSame();
    prog("foo = (1, 2) + 3;").assertParseSame();
    prog("foo = 1 + (2, 3);").assertParseSame();
    prog("foo = ((,),);").assertParseSame();

    prog("foo = append(,);").assertParseSame();
    prog("foo = append();").assertParse("foo = append(,);");
    prog("foo = append(1);").assertParse("foo = append(1,);");
    prog("foo = append(1,);").assertParseSame();
    prog("foo = append(1, 2,);").assertParse("foo = append(1, 2);");
    prog("foo = append(1, append(,)) . 0;").assertParseSame();
  }

  /** Tests that the parser rejects tuple syntax when tuples are
   * disabled. */
  @Test
  void testTuplesDisabled() {
    prog("foo = 1 + 2 * (3 - 4);")
        .withProp(Prop.ENABLE_TUPLES, false)
        .assertParseSame();
    prog("foo = (1, 2);")
        .withProp(Prop.ENABLE_TUPLES, false)
        .assertParseError(is("',' is not allowed when tuples are disabled"));
    prog("foo = 1, 2;")
        .withProp(Prop.ENABLE_TUPLES, false)
        .assertParseError(is("',' is not allowed when tuples are disabled"));
    prog("foo = (,);")
        .withProp(Prop.ENABLE_TUPLES, false)
        .assertParseError(is("',' is not allowed when tuples are disabled"));
    prog("foo = append(,);")
        .withProp(Prop.ENABLE_TUPLES, false)
        .assertParseError(
            is("'append' is not allowed when tuples are disabled"));
    prog("foo = 1 . 2;")
        .withProp(Prop.ENABLE_TUPLES, false)
        .assertParseError(is("'.' is not allowed when tuples are disabled"));
  }

  /** Tests that the parser requires parentheses around a tuple at the root
   * of a statement if {@link Prop#TUPLES_REQUIRE_PARENS} is set. */
  @Test
  void testTuplesRequireParens() {
    prog("foo = 1, 2;")
        .withProp(Prop.TUPLES_REQUIRE_PARENS, true)
        .assertParseError(is("tuple must be enclosed in parentheses"));
    prog("foo = 1,;")
        .withProp(Prop.TUPLES_REQUIRE_PARENS, true)
        .assertParseError(is("tuple must be enclosed in parentheses"));
    prog("foo = (1, 2);")
        .withProp(Prop.TUPLES_REQUIRE_PARENS, true)
        .assertParseSame();
    prog("foo = append(1, 2);")
        .withProp(Prop.TUPLES_REQUIRE_PARENS, true)
        .assertParseSame();
  }

  @Test
  void testParseError() {
    prog("foo = 1 +;").assertParseError(startsWith("Encountered"));
    prog("foo = 1").assertParseError(startsWith("Encountered"));
    prog("foo = \"abc;").assertParseError(startsWith("Encountered"));
    prog("1 = foo;").assertParseError(startsWith("Encountered"));
    prog("foo = 1 2;").assertParseError(startsWith("Encountered"));
    prog("foo = ();").assertParseError(startsWith("Encountered"));
    prog("print foo;").assertParseError(startsWith("Encountered"));
    prog("foo = 1 $ 2;").assertParseError(containsString("$"));

    final ParseResult result =
        Parsers.parse("foo = 1;\nbar = 1 $ 2;", ImmutableMap.of());
    assertThat(result.ok(), is(false));
    final InfixParseException e = result.error();
    assertThat(e.pos().startLine, is(2));
    assertThat(e.pos().startColumn, is(9));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        startsWith("stdIn:2.9: Encountered"));
  }

  /** Tests that the canonical writer uses the fewest parentheses, for trees
   * built directly rather than by the parser. */
  @Test
  void testWriter() {
    final Ast.Exp a = id("a");
    final Ast.Exp b = id("b");
    final Ast.Exp c = id("c");
    assertThat(ast.minus(a, ast.minus(b, c)), hasToString("a - (b - c)"));
    assertThat(ast.minus(ast.minus(a, b), c), hasToString("a - b - c"));
    assertThat(ast.times(ast.plus(a, b), c), hasToString("(a + b) * c"));
    assertThat(ast.plus(a, ast.times(b, c)), hasToString("a + b * c"));
    assertThat(ast.divide(a, ast.times(b, c)), hasToString("a / (b * c)"));
    assertThat(ast.tupleIndex(ast.tuple(Pos.ZERO, a, b), lit(0)),
        hasToString("(a, b) . 0"));
    assertThat(ast.tuple(Pos.ZERO), hasToString("(,)"));
    assertThat(ast.tuple(Pos.ZERO, a), hasToString("(a,)"));
    assertThat(ast.append(Pos.ZERO, ImmutableList.of(a, b, c)),
        hasToString("append(a, b, c)"));
    assertThat(
        ast.calculation(
            ast.assign(Pos.ZERO, id("x"), ast.tuple(Pos.ZERO, a, b)),
            ast.output(Pos.ZERO, ast.stringLiteral(Pos.ZERO, "\"x\""),
                id("x"))),
        hasToString("x = (a, b);\nprint \"x\" x;"));
  }

  /** Tests {@link TreeDumper}. */
  @Test
  void testTreeDumper() {
    final ParseResult result =
        Parsers.parse("foo = 1 + bar, (,);", ImmutableMap.of());
    final String expected = "calculation\n"
        + "  assign foo\n"
        + "    tuple\n"
        + "      plus\n"
        + "        int_literal 1\n"
        + "        id bar\n"
        + "      tuple";
    assertThat(TreeDumper.dump(result.calculation()), is(expected));
  }

  /** Tests that trees are equal regardless of position. */
  @Test
  void testEquals() {
    final Ast.Calculation c1 =
        Parsers.parse("foo = 1 + 2;", ImmutableMap.of()).calculation();
    final Ast.Calculation c2 =
        Parsers.parse("\n\n  foo =\n1+2;", ImmutableMap.of()).calculation();
    assertThat(c1.stmts.get(0).pos.equals(c2.stmts.get(0).pos), is(false));
    assertThat(c1, is(c2));
    assertThat(c1.hashCode(), is(c2.hashCode()));
    assertThat(c1.equals(assign("foo", ast.plus(lit(1), lit(2)))), is(true));
    assertThat(c1.equals(assign("foo", ast.minus(lit(1), lit(2)))),
        is(false));
    assertThat(c1.equals(assign("bar", ast.plus(lit(1), lit(2)))),
        is(false));
    assertThat(
        ast.tuple(Pos.ZERO, lit(1)).equals(ast.append(Pos.ZERO, lit(1))),
        is(false));
    assertThat(ast.intLiteral(Pos.ZERO, "1")
            .equals(ast.floatLiteral(Pos.ZERO, "1")),
        is(false));
  }
}

// End ParserTest.java
