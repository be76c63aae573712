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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Comparator;
import java.util.Locale;
import java.util.stream.Stream;

/** Kind of lexical token. */
public enum TokenType {
  // literals and names
  NUMBER,
  STRING,
  TEMPLATE_STRING,
  IDENT,
  UNDERSCORE,

  // keywords
  LET("let", true),
  AND("and", true),
  MAYBE("maybe", true),
  TRUE("true", true),
  FALSE("false", true),
  AWAIT("await", true),
  CONTEXT("context", true),
  PROVIDE("provide", true),
  DECORATOR("decorator", true),
  MATCH("match", true),
  IF("if", true),
  RETURN("return", true),
  INPUT("input", true),
  USE("use", true),

  // operators
  PLUS("+"),
  CONCAT("++"),
  MINUS("-"),
  STAR("*"),
  SLASH("/"),
  PERCENT("%"),
  EQ_EQ("=="),
  NOT_EQ("!="),
  EQ("="),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">="),
  BANG("!"),
  PIPE("/>"),
  SPREAD_PIPE("/>>>"),
  PARALLEL_PIPE("\\>"),
  REVERSE_PIPE("</"),
  BIDIRECTIONAL("</>"),
  REACTIVE_PIPE("@>"),
  ARROW("->"),
  REVERSE_ARROW("<-"),
  DOUBLE_COLON("::"),
  RETURN_TYPE(":>"),
  COLON(":"),
  QUESTION("?"),
  DOT("."),
  ELLIPSIS("..."),
  COMMA(","),
  LPAREN("("),
  RPAREN(")"),
  LBRACKET("["),
  RBRACKET("]"),
  LBRACE("{"),
  RBRACE("}"),
  BAR("|"),
  HASH("#"),
  AT("@"),

  // code block markers, "{-- label --}" and "{/--}"
  CODEBLOCK_OPEN,
  CODEBLOCK_CLOSE("{/--}"),

  NEWLINE,
  EOF;

  /** Fixed text of this token, or null if the text varies (names,
   * literals). */
  public final @Nullable String text;
  final boolean keyword;

  /** Keywords, keyed by their text. */
  static final ImmutableMap<String, TokenType> KEYWORDS;

  /** Operators, longest first, so that the lexer can match greedily. */
  static final ImmutableList<TokenType> OPERATORS;

  static {
    final ImmutableMap.Builder<String, TokenType> b = ImmutableMap.builder();
    for (TokenType t : values()) {
      if (t.keyword) {
        b.put(t.text, t);
      }
    }
    KEYWORDS = b.build();
    OPERATORS =
        Stream.of(values())
            .filter(t -> t.text != null && !t.keyword && t != CODEBLOCK_CLOSE)
            .sorted(
                Comparator.comparingInt((TokenType t) -> t.text.length())
                    .reversed())
            .collect(ImmutableList.toImmutableList());
  }

  TokenType() {
    this(null, false);
  }

  TokenType(String text) {
    this(text, false);
  }

  TokenType(@Nullable String text, boolean keyword) {
    this.text = text;
    this.keyword = keyword;
  }

  /** Returns a description for use in error messages, e.g. "')'". */
  public String describe() {
    if (text != null) {
      return "'" + text + "'";
    }
    switch (this) {
    case IDENT:
      return "identifier";
    case NUMBER:
      return "number";
    case STRING:
      return "string";
    case TEMPLATE_STRING:
      return "template string";
    case NEWLINE:
      return "newline";
    case EOF:
      return "end of input";
    default:
      return name().toLowerCase(Locale.ROOT);
    }
  }
}

// End TokenType.java
