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

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Lexical token.
 *
 * <p>The value of a {@link TokenType#NUMBER} token is a
 * {@link java.math.BigDecimal}; of a {@link TokenType#STRING} token, the
 * unescaped {@link String}; of a {@link TokenType#TEMPLATE_STRING} token, a
 * {@link TemplateParts}; of a {@link TokenType#CODEBLOCK_OPEN} token, the label
 * or null. */
public class Token {
  public final TokenType type;
  /** Source text of the token. */
  public final String text;
  public final @Nullable Object value;
  public final Pos pos;

  public Token(TokenType type, String text, @Nullable Object value, Pos pos) {
    this.type = requireNonNull(type);
    this.text = requireNonNull(text);
    this.value = value;
    this.pos = requireNonNull(pos);
  }

  /** Returns the 1-based line on which this token starts. */
  public int line() {
    return pos.startLine;
  }

  /** Returns the 1-based column at which this token starts. */
  public int column() {
    return pos.startColumn;
  }

  @Override public String toString() {
    return type + "(" + text + ")@" + pos;
  }

  /** Contents of a template string: literal text segments alternating with
   * the tokens of interpolated expressions. There is one more text than
   * there are interpolations. */
  public static class TemplateParts {
    public final List<String> texts;
    public final List<List<Token>> interpolations;

    TemplateParts(ImmutableList<String> texts,
        ImmutableList<List<Token>> interpolations) {
      this.texts = requireNonNull(texts);
      this.interpolations = requireNonNull(interpolations);
      checkArgument(texts.size() == interpolations.size() + 1);
    }
  }
}

// End Token.java
