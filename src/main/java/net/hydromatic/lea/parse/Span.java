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
package net.hydromatic.lea.parse;

import net.hydromatic.lea.ast.AstNode;
import net.hydromatic.lea.ast.Pos;

import java.util.ArrayList;
import java.util.List;

/**
 * Builder for {@link Pos}.
 *
 * <p>Because it is mutable, it is convenient for keeping track of the positions
 * of the tokens that go into a non-terminal. It can be passed into methods,
 * which can add the positions of tokens consumed to it.
 *
 * <p>Some patterns:
 *
 * <ul>
 *   <li>{@code final Span s = Span.of(next().pos);} consumes a token and
 *       initializes s to a Span that includes it
 *   <li>{@code s.end(this)} adds the most recent token to s and evaluates to a
 *       position that spans from beginning to end; commonly used when making
 *       a node
 *   <li>{@code s.add(node)} adds a node's position to a span
 * </ul>
 */
public final class Span {
  private final List<Pos> posList = new ArrayList<>();

  /** Use one of the {@link #of} methods. */
  private Span() {}

  /** Creates a Span with one position. */
  public static Span of(Pos p) {
    return new Span().add(p);
  }

  /** Creates a Span of one node. */
  public static Span of(AstNode n) {
    return new Span().add(n);
  }

  /** Adds a node's position to the list, and returns this Span. */
  public Span add(AstNode n) {
    return add(n.pos);
  }

  /** Adds a position to the list, and returns this Span. */
  public Span add(Pos pos) {
    posList.add(pos);
    return this;
  }

  /**
   * Adds the position of the last token consumed by a parser to the list, and
   * returns this Span.
   */
  public Span add(Parser parser) {
    return add(parser.pos());
  }

  /**
   * Returns a position spanning the earliest position to the latest. Does not
   * assume that the positions are sorted. Throws if the list is empty.
   */
  public Pos pos() {
    switch (posList.size()) {
    case 0:
      throw new AssertionError();
    case 1:
      return posList.get(0);
    default:
      return Pos.sum(posList);
    }
  }

  /**
   * Adds the position of the last token consumed by a parser to the list, and
   * returns a position that covers the whole range.
   */
  public Pos end(Parser parser) {
    return add(parser).pos();
  }

  /**
   * Adds a node's position to the list, and returns a position that covers the
   * whole range.
   */
  public Pos end(AstNode n) {
    return add(n).pos();
  }
}

// End Span.java
