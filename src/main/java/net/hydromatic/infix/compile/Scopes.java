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
package net.hydromatic.infix.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.infix.ast.Ast;
import net.hydromatic.infix.ast.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Symbol table of a program.
 *
 * <p>Maps each reference to the assignment that defines it. A name is in
 * scope from the statement after its assignment; a later assignment to the
 * same name hides the earlier one. A reference that has no earlier
 * assignment is unresolved, and the table is invalid.
 */
public class Scopes {
  private final Map<Ast.Id, Ast.Assign> resolved;
  private final List<Ast.Id> unresolved;

  private Scopes(Map<Ast.Id, Ast.Assign> resolved,
      List<Ast.Id> unresolved) {
    this.resolved = resolved;
    this.unresolved = ImmutableList.copyOf(unresolved);
  }

  /** Builds the symbol table of a program. */
  public static Scopes build(Ast.Calculation calculation) {
    final Resolver resolver = new Resolver();
    calculation.accept(resolver);
    return new Scopes(resolver.resolved, resolver.unresolved);
  }

  /** Returns whether every reference is resolved. */
  public boolean isValid() {
    return unresolved.isEmpty();
  }

  /** Returns the references that have no definition, in the order they
   * occur. */
  public List<Ast.Id> unresolved() {
    return unresolved;
  }

  /** Returns the assignment that defines a reference, or null.
   *
   * <p>The reference must be a node of the tree from which this table was
   * built; references are matched by identity, not by name. */
  public Ast.@Nullable Assign lookup(Ast.Id id) {
    return resolved.get(requireNonNull(id));
  }

  /** Visitor that resolves references, statement by statement. */
  private static class Resolver extends Visitor {
    final Map<Ast.Id, Ast.Assign> resolved = new IdentityHashMap<>();
    final List<Ast.Id> unresolved = new ArrayList<>();
    final Map<String, Ast.Assign> env = new HashMap<>();

    @Override protected void visit(Ast.Id id) {
      final Ast.Assign assign = env.get(id.name);
      if (assign == null) {
        unresolved.add(id);
      } else {
        resolved.put(id, assign);
      }
    }

    @Override protected void visit(Ast.Assign assign) {
      // The name is not in scope in its own definition.
      assign.exp.accept(this);
      env.put(assign.id.name, assign);
    }
  }
}

// End Scopes.java
