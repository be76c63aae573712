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
import net.hydromatic.lea.format.FormatterConfig;
import net.hydromatic.lea.format.Prop;
import net.hydromatic.lea.parse.LeaParseException;
import net.hydromatic.lea.parse.LexerException;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests the {@link Lea} entry points. */
public class LeaTest {
  @Test void testParse() {
    final Ast.Program program = Lea.parse("let x = 1\nprint(x)");
    assertThat(program.statements.size(), is(2));
    assertThat(program.toString(), is("(program (let x 1) (call print x))"));
    assertThat(program.statements.get(1).pos.startLine, is(2));
  }

  @Test void testFormat() {
    assertThat(Lea.format("let   x =1"), is("let x = 1\n"));
    assertThat(
        Lea.format("let f = (x) -> x",
            FormatterConfig.DEFAULT.with(Prop.INDENT_SIZE, 4)),
        is("let f = (x) -> x\n"));
  }

  /** Errors describe themselves with the file name and position. */
  @Test void testErrorDescription() {
    final LexerException e =
        assertThrows(LexerException.class,
            () -> Lea.parse("f.lea", "let x = ~"));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        is("f.lea:1.9 Error: Unexpected character '~'"));

    final LeaParseException e2 =
        assertThrows(LeaParseException.class,
            () -> Lea.parse("f.lea", "let x = (1,\n2"));
    assertThat(e2.getMessage(), is("Expected ')' after tuple"));
    assertThat(e2.describeTo(new StringBuilder()).toString(),
        is("f.lea:2.2-2.2 Error: Expected ')' after tuple"));
  }
}

// End LeaTest.java
