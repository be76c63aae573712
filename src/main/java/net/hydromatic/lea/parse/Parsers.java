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

import static com.google.common.base.Preconditions.checkArgument;

/** Utilities for parsing and printing literals. */
public final class Parsers {
  private Parsers() {}

  /**
   * Given quoted string {@code "abc"} returns {@code abc}; {@code "\t"} returns
   * the tab character; {@code "\0"} returns character 0.
   */
  public static String unquoteString(String s) {
    checkArgument(s.length() >= 2);
    checkArgument(s.charAt(0) == '"');
    checkArgument(s.charAt(s.length() - 1) == '"');
    s = s.substring(1, s.length() - 1);
    if (!s.contains("\\")) {
      // There are no escaped characters. Take the quick route.
      return s;
    }
    final StringParser p = new StringParser(s);
    final StringBuilder b = new StringBuilder();
    while (p.i < p.s.length()) {
      b.append(p.parseChar());
    }
    return b.toString();
  }

  /**
   * Converts a character to how it appears in a string literal.
   *
   * <p>For example, '{@code a}' becomes "a", the newline character becomes
   * {@code "\n"} and the double-quote character becomes {@code "\""}.
   */
  public static String charToString(char c) {
    switch (c) {
    case 0:
      return "\\0";
    case 9:
      return "\\t";
    case 10:
      return "\\n";
    case 13:
      return "\\r";
    case 34:
      // Double-quote requires escape
      return "\\\"";
    case 92:
      // Backslash requires escape
      return "\\\\";
    default:
      return String.valueOf(c);
    }
  }

  /** Converts an internal string to the contents of a string literal,
   * escaping characters as necessary. Inverse of {@link #unquoteString},
   * except for the enclosing quotes. */
  public static String stringToString(String s) {
    if (!requiresEscape(s)) {
      return s;
    }
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      b.append(charToString(s.charAt(i)));
    }
    return b.toString();
  }

  /** Appends a string as a double-quoted string literal. */
  public static StringBuilder appendQuoted(StringBuilder buf, String s) {
    return buf.append('"').append(stringToString(s)).append('"');
  }

  private static boolean requiresEscape(String s) {
    for (int i = 0; i < s.length(); i++) {
      switch (s.charAt(i)) {
      case 0:
      case '\t':
      case '\n':
      case '\r':
      case '"':
      case '\\':
        return true;
      default:
        break;
      }
    }
    return false;
  }

  /** Returns the character denoted by an escape sequence {@code \c}.
   * An unknown escape denotes the character itself. */
  static char unescape(char c) {
    switch (c) {
    case 'n':
      return '\n';
    case 't':
      return '\t';
    case 'r':
      return '\r';
    case '0':
      return '\0';
    default:
      // Includes '"' and '\\'
      return c;
    }
  }

  /** Reads the characters of the body of a string literal. */
  static class StringParser {
    final String s;
    int i = 0;

    StringParser(String s) {
      this.s = s;
    }

    /**
     * Parses a single character in a string literal.
     * Advances {@code i} to the next character in the string.
     */
    char parseChar() {
      final char c = s.charAt(i++);
      if (c != '\\') {
        return c;
      }
      if (i >= s.length()) {
        throw new IllegalArgumentException(
            "illegal escape; no character after \\");
      }
      return unescape(s.charAt(i++));
    }
  }
}

// End Parsers.java
