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
package net.hydromatic.lea.ast;

/** Sub-types of {@link AstNode}.
 *
 * <p>Each operator has a left and a right binding power. A larger value binds
 * more tightly. The parser climbs the binary levels using these values, and
 * the formatter uses the same values to decide where parentheses are needed:
 * a child that sits between binding powers {@code left} and {@code right} is
 * parenthesized if {@code left > child.left || child.right < right}. */
public enum Op {
  // literals
  NUMBER_LITERAL(true),
  STRING_LITERAL(true),
  BOOL_LITERAL(true),
  TEMPLATE(true),

  // identifiers
  ID(true),
  PLACEHOLDER(true),

  // value constructors
  LIST(true),
  TUPLE(true),
  RECORD(true),
  USE(true),

  // binary operators, loosest first
  EQ(" == ", 1),
  NE(" != ", 1),
  LT(" < ", 2),
  LE(" <= ", 2),
  GT(" > ", 2),
  GE(" >= ", 2),
  PLUS(" + ", 3),
  MINUS(" - ", 3),
  CONCAT(" ++ ", 3),
  TIMES(" * ", 4),
  DIVIDE(" / ", 4),
  MOD(" % ", 4),

  // prefix operators
  NEGATE("-", 99, 14),
  NOT("!", 99, 14),
  AWAIT("await ", 99, 14),

  // postfix operators
  APPLY("", 16, 99),
  INDEX("", 16, 99),
  MEMBER(".", 16, 99),

  TERNARY(" ? ", 5, 4),

  // pipes
  PIPE(" /> ", 2, 3),
  SPREAD_PIPE(" />>> ", 2, 3),
  REVERSE_PIPE(" </ ", 2, 3),
  PARALLEL_PIPE("\\> ", 2, 3),
  REACTIVE_PIPE(" @> ", 2, 0),

  // open-ended expressions; nothing may follow them on the right
  FN(" -> ", 99, 0),
  MATCH("match ", 99, 0),
  RETURN("return ", 99, 0),
  PIPELINE("/> ", 99, 0),
  BIDIRECTIONAL("</> ", 99, 0),

  // miscellaneous
  PARAM,
  SPREAD("..."),
  FIELD(": "),
  CASE("| "),
  STAGE,
  PARALLEL_STAGE,
  DECORATOR("#"),
  SIGNATURE(" :: "),
  PIPE_SIGNATURE(" :: "),
  NAMED_TYPE,
  TUPLE_TYPE,
  LIST_TYPE,

  // statements
  LET("let "),
  MAYBE("maybe "),
  AND("and "),
  ASSIGN(" = "),
  EXP_STMT,
  CONTEXT_DEF("context "),
  PROVIDE("provide "),
  DECORATOR_DEF("decorator "),
  CODEBLOCK,
  PROGRAM;

  /** Padded name, e.g. " /> ". */
  public final String padded;
  /** Left binding power. */
  public final int left;
  /** Right binding power. */
  public final int right;

  Op() {
    this("", 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  /** Creates a left-associative binary operator. Precedence 1 is the
   * loosest binary level and 4 the tightest; every binary level binds more
   * tightly than a ternary, which binds more tightly than a pipe. */
  Op(String padded, int precedence) {
    this(padded, precedence * 2 + 4, precedence * 2 + 5);
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is a binary arithmetic, comparison or concatenation
   * operator. */
  public boolean isBinary() {
    return ordinal() >= EQ.ordinal() && ordinal() <= MOD.ordinal();
  }

  /** Returns whether this operator chains stages left to right:
   * {@code />}, {@code />>>} or {@code </}. */
  public boolean isPipe() {
    return this == PIPE || this == SPREAD_PIPE || this == REVERSE_PIPE;
  }

  /** Returns whether this is a prefix operator. */
  public boolean isPrefix() {
    return this == NEGATE || this == NOT || this == AWAIT || this == RETURN;
  }

  /** Returns the operator text without padding, e.g. "/>". */
  public String symbol() {
    return padded.trim();
  }
}

// End Op.java
