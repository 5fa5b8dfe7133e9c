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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Iterables;
import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.infix.Prop;
import net.hydromatic.infix.ast.Ast;
import net.hydromatic.infix.compile.Scopes;
import org.junit.jupiter.api.Test;

/** Tests {@link ProgramSpace}. */
public class ProgramSpaceTest {
  private static final ProgramSpace SPACE =
      ProgramSpace.of(ImmutableMap.of());

  private static List<String> strings(Iterable<? extends Ast.Exp> exps) {
    return ImmutableList.copyOf(exps).stream()
        .map(Object::toString)
        .collect(Collectors.toList());
  }

  @Test
  void testDepth0() {
    assertThat(strings(SPACE.expressions(ImmutableSortedSet.of(), 0)),
        is(ImmutableList.of("0", "1", "(,)", "append(,)")));
    assertThat(
        strings(
            SPACE.expressions(ImmutableSortedSet.of("ping", "bar", "foo"),
                0)),
        is(ImmutableList.of("0", "1", "bar", "foo", "ping", "(,)",
            "append(,)")));
  }

  @Test
  void testDepth1() {
    final List<Ast.Exp> list =
        SPACE.expressions(ImmutableSortedSet.of(), 1).toList();
    assertThat(list, hasSize(120));
    assertThat(strings(list.subList(0, 10)),
        is(
            ImmutableList.of("(0,)", "append(0,)",
                "0 + 0", "0 - 0", "0 * 0", "0 / 0", "(0, 0)", "append(0, 0)",
                "0 . 0",
                "0 + 1")));
    assertThat(list.get(119), hasToString("append(,) . append(,)"));
    assertThat(SPACE.expressions(ImmutableSortedSet.of("foo"), 1).toList(),
        hasSize(185));
  }

  @Test
  void testDepth2Prefix() {
    // Depth 2 has 101,040 expressions; look only at the first few.
    final List<String> list =
        strings(Iterables.limit(SPACE.expressions(ImmutableSortedSet.of(), 2),
            4));
    assertThat(list,
        is(
            ImmutableList.of("((0,),)", "append((0,),)", "(0,) + (0,)",
                "(0,) - (0,)")));
  }

  @Test
  void testAssignments() {
    final List<Ast.Assign> list =
        SPACE.assignments(ImmutableSortedSet.of("foo"), "bar", 0).toList();
    assertThat(list, hasSize(5));
    assertThat(list.get(2), hasToString("bar = foo;"));
  }

  @Test
  void testCalculations() {
    final List<Ast.Calculation> list = SPACE.calculations(1, 0).toList();
    assertThat(list, hasSize(4));
    assertThat(list.get(0), hasToString("foo = 0;"));
    assertThat(list.get(3), hasToString("foo = append(,);"));

    final List<Ast.Calculation> list2 = SPACE.calculations(2, 0).toList();
    assertThat(list2, hasSize(20));
    assertThat(list2.get(0), hasToString("foo = 0;\nbar = 0;"));
    assertThat(list2.get(2), hasToString("foo = 0;\nbar = foo;"));
    assertThat(list2.get(19),
        hasToString("foo = append(,);\nbar = append(,);"));

    // Every generated program has a valid symbol table.
    for (Ast.Calculation calculation : SPACE.calculations(3, 0)) {
      assertThat(calculation.toString(),
          Scopes.build(calculation).isValid(), is(true));
    }
    assertThat(SPACE.calculations(3, 0).toList(), hasSize(4 * 5 * 6));
    assertThat(SPACE.calculations(0, 1).toList(), hasSize(1));
  }

  @Test
  void testVariableNames() {
    final ProgramSpace space =
        ProgramSpace.of(
            ImmutableMap.of(Prop.VARIABLE_NAMES, "x, y"));
    assertThat(space.variableNames(), is(ImmutableList.of("x", "y")));
    final List<Ast.Calculation> list = space.calculations(2, 0).toList();
    assertThat(list.get(2), hasToString("x = 0;\ny = x;"));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> space.calculations(3, 0));
    assertThat(e.getMessage(),
        is("op count 3 exceeds the number of variable names 2"));
    assertThrows(IllegalArgumentException.class,
        () -> new ProgramSpace(ImmutableList.of("x", "x")));
  }

  /** Tests that a variable name must be one that the parser reads as an
   * identifier. */
  @Test
  void testBadVariableNames() {
    final ProgramSpace space =
        new ProgramSpace(ImmutableList.of("_x", "Y2", "appended"));
    assertThat(space.variableNames(), hasSize(3));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> new ProgramSpace(ImmutableList.of("x", "1a")));
    assertThat(e.getMessage(), is("variable name '1a' is not an identifier"));
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class,
            () -> new ProgramSpace(ImmutableList.of("append")));
    assertThat(e2.getMessage(), is("variable name 'append' is a keyword"));
    assertThrows(IllegalArgumentException.class,
        () -> new ProgramSpace(ImmutableList.of("print")));
    assertThrows(IllegalArgumentException.class,
        () -> new ProgramSpace(ImmutableList.of("a-b")));
    assertThrows(IllegalArgumentException.class,
        () -> new ProgramSpace(ImmutableList.of("")));
  }

  /** Tests that the space is generated lazily; the first program at depth 3
   * is available without enumerating the whole space. */
  @Test
  void testLazy() {
    final Ast.Calculation first = SPACE.calculations(4, 3).head();
    assertThat(first.stmts, hasSize(4));
    assertThat(first.stmts.get(0), hasToString("foo = (((0,),),);"));
  }
}

// End ProgramSpaceTest.java
