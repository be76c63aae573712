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
package net.hydromatic.lea.format;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests {@link Prop} and {@link FormatterConfig}. */
public class FormatterConfigTest {
  @Test void testDefaults() {
    final FormatterConfig config = FormatterConfig.DEFAULT;
    assertThat(config.indentSize, is(2));
    assertThat(config.printWidth, is(80));
    assertThat(config.trailingCommas, is(true));
    assertThat(config.breakPipeChains, is(true));
    assertThat(config.pipeChainBreakThreshold, is(3));
    assertThat(FormatterConfig.of(ImmutableMap.of()), sameInstance(config));
    assertThat(Formatter.create().config(), sameInstance(config));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("printWidth"), is(Prop.PRINT_WIDTH));
    assertThat(Prop.lookup("PRINT_WIDTH"), is(Prop.PRINT_WIDTH));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("tabWidth"));
    assertThat(e.getMessage(), is("property tabWidth not found"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.BREAK_PIPE_CHAINS));
  }

  @Test void testSetLenient() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.INDENT_SIZE.setLenient(map, " 4 ");
    Prop.TRAILING_COMMAS.setLenient(map, "FALSE");
    assertThat(map.get(Prop.INDENT_SIZE), is(4));
    assertThat(map.get(Prop.TRAILING_COMMAS), is(false));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.BREAK_PIPE_CHAINS.setLenient(map, "yes"));
    assertThat(e.getMessage(),
        is("value for property breakPipeChains must be true or false: yes"));

    // A null value restores the default
    Prop.INDENT_SIZE.setLenient(map, null);
    assertThat(Prop.INDENT_SIZE.intValue(map), is(2));
  }

  @Test void testSetChecksType() {
    final Map<Prop, Object> map = new HashMap<>();
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.PRINT_WIDTH.set(map, "wide"));
    assertThat(e.getMessage(),
        is("value for property printWidth must have type "
            + Integer.class));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.PRINT_WIDTH.booleanValue(map));
  }

  @Test void testWith() {
    final FormatterConfig config =
        FormatterConfig.DEFAULT.with(Prop.PRINT_WIDTH, 100);
    assertThat(config.printWidth, is(100));
    assertThat(config.indentSize, is(2));
    assertThat(config.map(), is(ImmutableMap.of(Prop.PRINT_WIDTH, 100)));
    assertThat(config, is(FormatterConfig.of(config.map())));
    assertThat(config, not(FormatterConfig.DEFAULT));
    assertThat(config.with(Prop.PRINT_WIDTH, null).printWidth, is(80));
    assertThat(config.with(Prop.PRINT_WIDTH, null),
        is(FormatterConfig.DEFAULT));
  }

  /** A property set explicitly to its default value makes no difference to
   * equality. */
  @Test void testEqualsUsesResolvedValues() {
    final FormatterConfig config =
        FormatterConfig.DEFAULT.with(Prop.INDENT_SIZE, 2);
    assertThat(config.map(), is(ImmutableMap.of(Prop.INDENT_SIZE, 2)));
    assertThat(config, is(FormatterConfig.DEFAULT));
    assertThat(config.hashCode(), is(FormatterConfig.DEFAULT.hashCode()));
    assertThat(config.with(Prop.TRAILING_COMMAS, false),
        not(FormatterConfig.DEFAULT));
  }

  @Test void testValidation() {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> FormatterConfig.DEFAULT.with(Prop.INDENT_SIZE, 0));
    assertThat(e.getMessage(), is("indentSize must be positive"));
    assertThrows(IllegalArgumentException.class,
        () -> FormatterConfig.DEFAULT.with(Prop.PRINT_WIDTH, -1));
    assertThrows(IllegalArgumentException.class,
        () -> FormatterConfig.DEFAULT.with(Prop.PIPE_CHAIN_BREAK_THRESHOLD,
            0));
  }
}

// End FormatterConfigTest.java
