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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.infix.Prop;
import net.hydromatic.infix.ast.Ast;
import net.hydromatic.infix.ast.AstNode;
import net.hydromatic.infix.ast.TreeDumper;
import net.hydromatic.infix.compile.Scopes;
import net.hydromatic.infix.parse.InfixParseException;
import net.hydromatic.infix.parse.ParseResult;
import net.hydromatic.infix.parse.Parsers;
import net.hydromatic.infix.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Checks that every program in a {@link ProgramSpace} survives a round trip
 * through the {@link Renderer} and the parser.
 *
 * <p>For each program, and each rendering of it, parses the text and checks
 * that the result is the original tree, or that the parser rejects the text
 * if the configuration says it should. Also checks that the canonical
 * writer's text for the program is one of its renderings.
 *
 * <p>Stops at the first failure, because the enumeration is exhaustive and
 * one failure calls the whole generator, renderer and parser into question.
 */
public class Explorer {
  private final ImmutableMap<Prop, Object> props;
  private final Consumer<String> outLines;
  private final Parser parser;
  private final Writer writer;
  private final ScopeBuilder scopeBuilder;
  private final ProgramSpace space;

  private Explorer(Map<Prop, Object> props, Consumer<String> outLines,
      Parser parser, Writer writer, ScopeBuilder scopeBuilder) {
    this.props = ImmutableMap.copyOf(props);
    this.outLines = requireNonNull(outLines);
    this.parser = requireNonNull(parser);
    this.writer = requireNonNull(writer);
    this.scopeBuilder = requireNonNull(scopeBuilder);
    this.space = ProgramSpace.of(this.props);
    space.checkOpCount(Prop.OP_COUNT.intValue(this.props));
    final int depth = Prop.DEPTH.intValue(this.props);
    checkArgument(depth >= 0, "negative depth %s", depth);
  }

  /** Creates an Explorer that uses the production parser, writer and
   * symbol table.
   *
   * @throws IllegalArgumentException if the properties do not describe a
   *   valid space of programs
   */
  public static Explorer create(Map<Prop, Object> props,
      Consumer<String> outLines) {
    return new Explorer(props, outLines, Parsers::parse, AstNode::toString,
        Scopes::build);
  }

  /** Returns a copy of this Explorer with a given parser. */
  public Explorer withParser(Parser parser) {
    return parser == this.parser ? this
        : new Explorer(props, outLines, parser, writer, scopeBuilder);
  }

  /** Returns a copy of this Explorer with a given canonical writer. */
  public Explorer withWriter(Writer writer) {
    return writer == this.writer ? this
        : new Explorer(props, outLines, parser, writer, scopeBuilder);
  }

  /** Returns a copy of this Explorer with a given symbol table builder. */
  public Explorer withScopeBuilder(ScopeBuilder scopeBuilder) {
    return scopeBuilder == this.scopeBuilder ? this
        : new Explorer(props, outLines, parser, writer, scopeBuilder);
  }

  /** Explores every program up to the depth and op count given by the
   * properties. */
  public Outcome explore() {
    final int maxDepth = Prop.DEPTH.intValue(props);
    final int opCount = Prop.OP_COUNT.intValue(props);
    final boolean enableTuples = Prop.ENABLE_TUPLES.booleanValue(props);
    final boolean tuplesRequireParens =
        Prop.TUPLES_REQUIRE_PARENS.booleanValue(props);
    final Renderer renderer = new Renderer();
    int count = 0;
    for (int depth = 0; depth <= maxDepth; depth++) {
      outLines.accept("Exploring depth " + depth + "...");
      for (Ast.Calculation calculation
          : space.calculations(opCount, depth)) {
        final Scopes scopes = scopeBuilder.build(calculation);
        if (!scopes.isValid()) {
          return fail(count, internal(calculation, scopes));
        }
        final String canonical = writer.write(calculation);
        final boolean containsTupleOps = calculation.containsTupleOps();
        boolean canonicalFound = false;
        for (Rendering rendering : renderer.render(calculation)) {
          final String text = rendering.text();
          if (text.equals(canonical)) {
            canonicalFound = true;
          }
          final boolean expectFailure =
              !enableTuples && containsTupleOps
                  || tuplesRequireParens && rendering.tupleParensOmitted;
          final Failure failure =
              check(calculation, text, expectFailure,
                  parser.parse(text, props));
          if (failure != null) {
            return fail(count, failure);
          }
          ++count;
          if (count % (count < 1000 ? 100 : 1000) == 0) {
            outLines.accept(count + " programs ok...");
          }
        }
        if (!canonicalFound) {
          return fail(count, desync(calculation, canonical, renderer));
        }
      }
    }
    outLines.accept("Tested " + count + " programs, all ok.");
    return new Outcome(count, null);
  }

  private Outcome fail(int count, Failure failure) {
    failure.lines.forEach(outLines);
    return new Outcome(count, failure);
  }

  /** Compares the result of parsing a rendering with the original tree.
   * Returns a failure, or null if the result is as expected. */
  private static @Nullable Failure check(Ast.Calculation calculation,
      String text, boolean expectFailure, ParseResult result) {
    if (!result.ok()) {
      if (expectFailure) {
        return null;
      }
      final InfixParseException e = requireNonNull(result.error());
      final List<String> lines = new ArrayList<>();
      lines.add("Unexpected parse error:");
      lines.add(text);
      lines.add(e.describeTo(new StringBuilder()).toString());
      lines.add("Original tree:");
      lines.addAll(Static.splitLines(TreeDumper.dump(calculation)));
      return new Failure(Kind.ROUND_TRIP, lines);
    }
    final Ast.Calculation parsed = result.calculation();
    if (parsed.equals(calculation)) {
      if (!expectFailure) {
        return null;
      }
      return new Failure(Kind.ROUND_TRIP,
          ImmutableList.of("Should have had error:", text));
    }
    if (expectFailure) {
      // A different tree is an acceptable way to reject the text.
      return null;
    }
    final List<String> lines = new ArrayList<>();
    lines.add("Parsed tree differs from original:");
    lines.add(text);
    Static.diffyPrint(TreeDumper.dump(calculation), TreeDumper.dump(parsed),
        lines::add);
    return new Failure(Kind.ROUND_TRIP, lines);
  }

  private static Failure internal(Ast.Calculation calculation,
      Scopes scopes) {
    final List<String> lines = new ArrayList<>();
    lines.add("Symbol table is invalid for generated program:");
    lines.add(calculation.toString());
    scopes.unresolved().forEach(id ->
        lines.add("unresolved: " + id.name));
    return new Failure(Kind.INTERNAL, lines);
  }

  private static Failure desync(Ast.Calculation calculation,
      String canonical, Renderer renderer) {
    final List<String> lines = new ArrayList<>();
    lines.add("Canonical text is not among the renderings:");
    lines.addAll(Static.splitLines(TreeDumper.dump(calculation)));
    lines.add("Canonical:");
    lines.add(canonical);
    lines.add("Renderings:");
    for (Rendering rendering : renderer.render(calculation)) {
      lines.add(rendering.toString());
    }
    return new Failure(Kind.DESYNC, lines);
  }

  /** Parses program text. */
  @FunctionalInterface
  public interface Parser {
    ParseResult parse(String text, Map<Prop, Object> props);
  }

  /** Converts a program to canonical text. */
  @FunctionalInterface
  public interface Writer {
    String write(Ast.Calculation calculation);
  }

  /** Builds the symbol table of a program. */
  @FunctionalInterface
  public interface ScopeBuilder {
    Scopes build(Ast.Calculation calculation);
  }

  /** Category of failure. */
  public enum Kind {
    /** The symbol table of a generated program is invalid. */
    INTERNAL,
    /** The canonical writer produced text that the renderer did not. */
    DESYNC,
    /** A rendering did not parse back to the original tree, or parsed when
     * it should have been rejected. */
    ROUND_TRIP
  }

  /** Description of the first thing that went wrong. */
  public static class Failure {
    public final Kind kind;
    public final List<String> lines;

    Failure(Kind kind, List<String> lines) {
      this.kind = requireNonNull(kind);
      this.lines = ImmutableList.copyOf(lines);
    }

    @Override public String toString() {
      return kind + ": " + String.join("\n", lines);
    }
  }

  /** Result of an exploration. */
  public static class Outcome {
    /** Number of renderings that were checked successfully. */
    public final int programCount;
    public final @Nullable Failure failure;

    Outcome(int programCount, @Nullable Failure failure) {
      this.programCount = programCount;
      this.failure = failure;
    }

    public boolean ok() {
      return failure == null;
    }

    @Override public String toString() {
      return failure == null
          ? "ok, " + programCount + " programs"
          : failure.toString();
    }
  }
}

// End Explorer.java
