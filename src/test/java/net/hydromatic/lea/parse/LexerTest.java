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

import net.hydromatic.lea.ast.Pos;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static net.hydromatic.lea.Matchers.throwsA;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests {@link Lexer}. */
public class LexerTest {
  private static List<Token> tokens(String s) {
    return new Lexer("stdIn", s).tokenize();
  }

  private static List<TokenType> types(String s) {
    final ImmutableList.Builder<TokenType> b = ImmutableList.builder();
    for (Token token : tokens(s)) {
      b.add(token.type);
    }
    return b.build();
  }

  private static void assertLexError(String s, String message, Pos pos) {
    final LexerException e =
        assertThrows(LexerException.class, () -> tokens(s));
    assertThat(e, throwsA(LexerException.class, message, pos));
  }

  @Test void testPipeOperators() {
    assertThat(types("/> />>> \\> </ </> @>"),
        is(ImmutableList.of(TokenType.PIPE, TokenType.SPREAD_PIPE,
            TokenType.PARALLEL_PIPE, TokenType.REVERSE_PIPE,
            TokenType.BIDIRECTIONAL, TokenType.REACTIVE_PIPE,
            TokenType.EOF)));
    assertThat(types("-> <- :: :> : ..."),
        is(ImmutableList.of(TokenType.ARROW, TokenType.REVERSE_ARROW,
            TokenType.DOUBLE_COLON, TokenType.RETURN_TYPE, TokenType.COLON,
            TokenType.ELLIPSIS, TokenType.EOF)));
  }

  /** The longest operator wins, so {@code a</b} is a reverse pipe, not a
   * less-than. */
  @Test void testLongestMatch() {
    assertThat(types("a</b"),
        is(ImmutableList.of(TokenType.IDENT, TokenType.REVERSE_PIPE,
            TokenType.IDENT, TokenType.EOF)));
    assertThat(types("a<=b"),
        is(ImmutableList.of(TokenType.IDENT, TokenType.LE, TokenType.IDENT,
            TokenType.EOF)));
    assertThat(types("== != = ++ + !"),
        is(ImmutableList.of(TokenType.EQ_EQ, TokenType.NOT_EQ, TokenType.EQ,
            TokenType.CONCAT, TokenType.PLUS, TokenType.BANG,
            TokenType.EOF)));
  }

  @Test void testKeywords() {
    assertThat(types("let maybe and context provide decorator"),
        is(ImmutableList.of(TokenType.LET, TokenType.MAYBE, TokenType.AND,
            TokenType.CONTEXT, TokenType.PROVIDE, TokenType.DECORATOR,
            TokenType.EOF)));
    assertThat(types("match if return await use input true false"),
        is(ImmutableList.of(TokenType.MATCH, TokenType.IF, TokenType.RETURN,
            TokenType.AWAIT, TokenType.USE, TokenType.INPUT, TokenType.TRUE,
            TokenType.FALSE, TokenType.EOF)));
    assertThat(types("lettuce _ _x x_1"),
        is(ImmutableList.of(TokenType.IDENT, TokenType.UNDERSCORE,
            TokenType.IDENT, TokenType.IDENT, TokenType.EOF)));
  }

  @Test void testCommentsAndNewlines() {
    assertThat(types("x -- a comment /> y\ny"),
        is(ImmutableList.of(TokenType.IDENT, TokenType.NEWLINE,
            TokenType.IDENT, TokenType.EOF)));
    assertThat(types("a - b"),
        is(ImmutableList.of(TokenType.IDENT, TokenType.MINUS,
            TokenType.IDENT, TokenType.EOF)));
    assertThat(types(""), is(ImmutableList.of(TokenType.EOF)));
  }

  @Test void testNumbers() {
    final List<Token> tokens = tokens("1.50 7 1.");
    assertThat(tokens.get(0).value, is(new BigDecimal("1.50")));
    assertThat(tokens.get(1).value, is(new BigDecimal("7")));
    assertThat(tokens.get(2).type, is(TokenType.NUMBER));
    assertThat(tokens.get(3).type, is(TokenType.DOT));
  }

  @Test void testStrings() {
    final List<Token> tokens = tokens("\"a\\nb\" \"q\\\"\" \"\"");
    assertThat(tokens.get(0).value, is("a\nb"));
    assertThat(tokens.get(1).value, is("q\""));
    assertThat(tokens.get(2).value, is(""));
    assertThat(tokens.get(0).text, is("\"a\\nb\""));
  }

  @Test void testTemplateString() {
    final List<Token> tokens = tokens("`Hello {name}!`");
    assertThat(tokens.size(), is(2));
    final Token.TemplateParts parts =
        (Token.TemplateParts) tokens.get(0).value;
    assertThat(parts.texts, is(ImmutableList.of("Hello ", "!")));
    assertThat(parts.interpolations.size(), is(1));
    final List<Token> interpolation = parts.interpolations.get(0);
    assertThat(interpolation.get(0).type, is(TokenType.IDENT));
    assertThat(interpolation.get(1).type, is(TokenType.EOF));
    // Tokens inside an interpolation know where they are in the file
    assertThat(interpolation.get(0).line(), is(1));
    assertThat(interpolation.get(0).column(), is(9));
  }

  @Test void testCodeblockMarkers() {
    final List<Token> tokens = tokens("{-- Setup --}\n{-- --}\n{/--}");
    assertThat(tokens.get(0).type, is(TokenType.CODEBLOCK_OPEN));
    assertThat(tokens.get(0).value, is("Setup"));
    assertThat(tokens.get(2).type, is(TokenType.CODEBLOCK_OPEN));
    assertThat(tokens.get(2).value, nullValue());
    assertThat(tokens.get(4).type, is(TokenType.CODEBLOCK_CLOSE));
  }

  @Test void testPositions() {
    final List<Token> tokens = tokens("let x\n  = 10");
    final Token eq = tokens.get(3);
    assertThat(eq.type, is(TokenType.EQ));
    assertThat(eq.line(), is(2));
    assertThat(eq.column(), is(3));
    assertThat(tokens.get(4).pos, is(new Pos("stdIn", 2, 5, 2, 7)));
  }

  @Test void testErrors() {
    assertLexError("\"abc", "Unterminated string",
        new Pos("stdIn", 1, 1, 1, 2));
    assertLexError("let x = ~", "Unexpected character '~'",
        new Pos("stdIn", 1, 9, 1, 10));
    assertLexError("`a{}b`", "Empty interpolation in template string",
        new Pos("stdIn", 1, 3, 1, 5));
    assertLexError("`abc", "Unterminated template string",
        new Pos("stdIn", 1, 1, 1, 2));
    assertLexError("`a{b`", "Unterminated interpolation in template string",
        new Pos("stdIn", 1, 3, 1, 4));
    assertLexError("{-- label", "Unterminated code block marker",
        new Pos("stdIn", 1, 1, 1, 4));
  }

  /** An error inside an interpolation is reported at its position in the
   * file. */
  @Test void testErrorInInterpolation() {
    assertLexError("x\n`a{b ~ c}`", "Unexpected character '~'",
        new Pos("stdIn", 2, 6, 2, 7));
  }
}

// End LexerTest.java
