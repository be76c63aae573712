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
import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** Splits Lea source text into tokens.
 *
 * <p>Line breaks are significant in Lea, so the lexer emits a
 * {@link TokenType#NEWLINE} token for each one. Comments start with
 * {@code --} and run to the end of the line; they produce no token.
 *
 * <p>A lexer is used once: create it, call {@link #tokenize()}. */
public class Lexer {
  private final String file;
  private final String source;
  private final List<Token> tokens = new ArrayList<>();

  /** Offset of the next character to read. */
  private int i = 0;
  private int line;
  private int column;

  // Position of the token being scanned
  private int start;
  private int startLine;
  private int startColumn;

  /** Creates a lexer for a whole file. */
  public Lexer(String file, String source) {
    this(file, source, 1, 1);
  }

  /** Creates a lexer for a fragment of a file, such as an interpolation
   * inside a template string, whose first character is at a given line and
   * column. */
  public Lexer(String file, String source, int line, int column) {
    this.file = requireNonNull(file);
    this.source = requireNonNull(source);
    this.line = line;
    this.column = column;
  }

  /** Returns the tokens of the source text. The last token is always
   * {@link TokenType#EOF}.
   *
   * @throws LexerException if the text contains a malformed token */
  public List<Token> tokenize() {
    while (i < source.length()) {
      start = i;
      startLine = line;
      startColumn = column;
      scanToken();
    }
    start = i;
    startLine = line;
    startColumn = column;
    add(TokenType.EOF, null);
    return ImmutableList.copyOf(tokens);
  }

  private void scanToken() {
    final char c = source.charAt(i);
    switch (c) {
    case ' ':
    case '\t':
    case '\r':
      advance();
      return;
    case '\n':
      advance();
      add(TokenType.NEWLINE, null);
      return;
    case '"':
      string();
      return;
    case '`':
      templateString();
      return;
    case '{':
      if (lookingAt("{/--}")) {
        advance(5);
        add(TokenType.CODEBLOCK_CLOSE, null);
        return;
      }
      if (lookingAt("{--")) {
        codeblockOpen();
        return;
      }
      break;
    case '-':
      if (lookingAt("--")) {
        comment();
        return;
      }
      break;
    default:
      break;
    }
    if (isDigit(c)) {
      number();
      return;
    }
    if (isIdentifierStart(c)) {
      identifier();
      return;
    }
    for (TokenType type : TokenType.OPERATORS) {
      if (lookingAt(requireNonNull(type.text))) {
        advance(type.text.length());
        add(type, null);
        return;
      }
    }
    throw new LexerException("Unexpected character '" + c + "'",
        pos(line, column, line, column + 1));
  }

  private void comment() {
    while (i < source.length() && source.charAt(i) != '\n') {
      advance();
    }
  }

  /** Scans a code block opening marker, {@code {-- label --}}. An empty
   * label is treated as no label. */
  private void codeblockOpen() {
    advance(3);
    final int labelStart = i;
    while (!lookingAt("--}")) {
      if (i >= source.length() || source.charAt(i) == '\n') {
        throw new LexerException("Unterminated code block marker",
            pos(startLine, startColumn, startLine, startColumn + 3));
      }
      advance();
    }
    final String label = source.substring(labelStart, i).trim();
    advance(3);
    add(TokenType.CODEBLOCK_OPEN, label.isEmpty() ? null : label);
  }

  private void string() {
    advance(); // opening quote
    while (i < source.length() && source.charAt(i) != '"') {
      if (source.charAt(i) == '\\' && i + 1 < source.length()) {
        advance();
      }
      advance();
    }
    if (i >= source.length()) {
      throw new LexerException("Unterminated string",
          pos(startLine, startColumn, startLine, startColumn + 1));
    }
    advance(); // closing quote
    final String text = source.substring(start, i);
    add(TokenType.STRING, Parsers.unquoteString(text));
  }

  /** Scans a template string such as {@code `Hello {name}!`}. The source of
   * each interpolation is tokenized by a nested lexer that starts at the
   * interpolation's line and column, so that errors inside it have the right
   * position. */
  private void templateString() {
    advance(); // opening back-tick
    final ImmutableList.Builder<String> texts = ImmutableList.builder();
    final ImmutableList.Builder<List<Token>> interpolations =
        ImmutableList.builder();
    final StringBuilder text = new StringBuilder();
    for (;;) {
      if (i >= source.length()) {
        throw new LexerException("Unterminated template string",
            pos(startLine, startColumn, startLine, startColumn + 1));
      }
      final char c = source.charAt(i);
      if (c == '`') {
        advance();
        break;
      }
      if (c != '{') {
        text.append(c);
        advance();
        continue;
      }
      texts.add(text.toString());
      text.setLength(0);
      final int braceLine = line;
      final int braceColumn = column;
      advance(); // '{'
      final int exprStart = i;
      final int exprLine = line;
      final int exprColumn = column;
      int depth = 1;
      while (depth > 0) {
        if (i >= source.length()) {
          throw new LexerException(
              "Unterminated interpolation in template string",
              pos(braceLine, braceColumn, braceLine, braceColumn + 1));
        }
        final char c2 = source.charAt(i);
        if (c2 == '{') {
          ++depth;
        } else if (c2 == '}') {
          --depth;
        } else if (c2 == '"') {
          skipNestedString(braceLine, braceColumn);
          continue;
        }
        advance();
      }
      final String exprSource = source.substring(exprStart, i - 1);
      if (exprSource.trim().isEmpty()) {
        throw new LexerException("Empty interpolation in template string",
            pos(braceLine, braceColumn, line, column));
      }
      interpolations.add(
          new Lexer(file, exprSource, exprLine, exprColumn).tokenize());
    }
    texts.add(text.toString());
    add(TokenType.TEMPLATE_STRING,
        new Token.TemplateParts(texts.build(), interpolations.build()));
  }

  /** Skips a string literal inside an interpolation, so that braces inside
   * it are not counted. */
  private void skipNestedString(int braceLine, int braceColumn) {
    advance(); // opening quote
    while (i < source.length() && source.charAt(i) != '"') {
      if (source.charAt(i) == '\\' && i + 1 < source.length()) {
        advance();
      }
      advance();
    }
    if (i >= source.length()) {
      throw new LexerException("Unterminated interpolation in template string",
          pos(braceLine, braceColumn, braceLine, braceColumn + 1));
    }
    advance(); // closing quote
  }

  private void number() {
    while (i < source.length() && isDigit(source.charAt(i))) {
      advance();
    }
    if (i + 1 < source.length()
        && source.charAt(i) == '.'
        && isDigit(source.charAt(i + 1))) {
      advance();
      while (i < source.length() && isDigit(source.charAt(i))) {
        advance();
      }
    }
    add(TokenType.NUMBER, new BigDecimal(source.substring(start, i)));
  }

  private void identifier() {
    while (i < source.length() && isIdentifierPart(source.charAt(i))) {
      advance();
    }
    final String text = source.substring(start, i);
    if (text.equals("_")) {
      add(TokenType.UNDERSCORE, null);
      return;
    }
    final TokenType keyword = TokenType.KEYWORDS.get(text);
    add(keyword != null ? keyword : TokenType.IDENT, null);
  }

  private boolean lookingAt(String s) {
    return source.startsWith(s, i);
  }

  private void advance() {
    if (source.charAt(i++) == '\n') {
      ++line;
      column = 1;
    } else {
      ++column;
    }
  }

  private void advance(int n) {
    for (int k = 0; k < n; k++) {
      advance();
    }
  }

  private void add(TokenType type, @Nullable Object value) {
    tokens.add(
        new Token(type, source.substring(start, i), value,
            pos(startLine, startColumn, line, column)));
  }

  private Pos pos(int startLine, int startColumn, int endLine,
      int endColumn) {
    return new Pos(file, startLine, startColumn, endLine, endColumn);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(char c) {
    return c >= 'a' && c <= 'z'
        || c >= 'A' && c <= 'Z'
        || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isDigit(c);
  }
}

// End Lexer.java
