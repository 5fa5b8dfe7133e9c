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
package net.hydromatic.infix.parse;

import java.io.StringReader;
import java.util.Map;
import net.hydromatic.infix.Prop;
import net.hydromatic.infix.ast.Pos;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /** Name used in positions of text that was not read from a file. */
  public static final String STDIN = "stdIn";

  /**
   * Parses a program.
   *
   * <p>Properties {@link Prop#ENABLE_TUPLES} and
   * {@link Prop#TUPLES_REQUIRE_PARENS} determine which tuple syntax is
   * allowed. Never throws a parse exception; an error is returned in the
   * result.
   */
  public static ParseResult parse(String text, Map<Prop, Object> props) {
    final InfixParserImpl parser =
        new InfixParserImpl(new StringReader(text));
    parser.zero(STDIN);
    parser.configure(Prop.ENABLE_TUPLES.booleanValue(props),
        Prop.TUPLES_REQUIRE_PARENS.booleanValue(props));
    try {
      return ParseResult.success(parser.calculation());
    } catch (ParseException e) {
      return ParseResult.failure(
          new InfixParseException(e, errorPos(parser, e)));
    } catch (TokenMgrError e) {
      return ParseResult.failure(
          new InfixParseException(e, parser.pos(parser.token)));
    }
  }

  /** Returns the position of the token that caused a parse error. */
  private static Pos errorPos(InfixParserImpl parser, ParseException e) {
    if (e.currentToken != null && e.currentToken.next != null) {
      return parser.pos(e.currentToken.next);
    }
    return parser.pos(parser.token);
  }
}

// End Parsers.java
