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
package net.hydromatic.lea;

import net.hydromatic.lea.ast.Ast;
import net.hydromatic.lea.format.Formatter;
import net.hydromatic.lea.format.FormatterConfig;
import net.hydromatic.lea.parse.Parser;

/** Entry points for parsing and formatting Lea source text. */
public class Lea {
  private Lea() {}

  /** Parses a Lea program.
   *
   * @throws net.hydromatic.lea.parse.LexerException if the text contains a
   *   malformed token
   * @throws net.hydromatic.lea.parse.LeaParseException if the tokens do not
   *   form a program */
  public static Ast.Program parse(String source) {
    return parse("", source);
  }

  /** Parses a Lea program from a named file, whose name appears in error
   * positions. */
  public static Ast.Program parse(String file, String source) {
    return Parser.create(file, source).parseProgram();
  }

  /** Formats a Lea program using the default configuration. */
  public static String format(String source) {
    return format(source, FormatterConfig.DEFAULT);
  }

  /** Formats a Lea program. */
  public static String format(String source, FormatterConfig config) {
    return new Formatter(config).format(parse(source));
  }
}

// End Lea.java
