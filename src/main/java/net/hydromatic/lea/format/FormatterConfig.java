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
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/** Immutable set of formatter options.
 *
 * <p>The values are held in a map keyed by {@link Prop}; a property that is
 * not in the map has its default value. */
public class FormatterConfig {
  /** Configuration with every property at its default value. */
  public static final FormatterConfig DEFAULT =
      new FormatterConfig(ImmutableMap.of());

  public final int indentSize;
  public final int printWidth;
  public final boolean trailingCommas;
  public final boolean breakPipeChains;
  public final int pipeChainBreakThreshold;

  private final ImmutableMap<Prop, Object> map;

  private FormatterConfig(ImmutableMap<Prop, Object> map) {
    this.map = map;
    this.indentSize = Prop.INDENT_SIZE.intValue(map);
    this.printWidth = Prop.PRINT_WIDTH.intValue(map);
    this.trailingCommas = Prop.TRAILING_COMMAS.booleanValue(map);
    this.breakPipeChains = Prop.BREAK_PIPE_CHAINS.booleanValue(map);
    this.pipeChainBreakThreshold =
        Prop.PIPE_CHAIN_BREAK_THRESHOLD.intValue(map);
    checkArgument(indentSize > 0, "indentSize must be positive");
    checkArgument(printWidth > 0, "printWidth must be positive");
    checkArgument(pipeChainBreakThreshold > 0,
        "pipeChainBreakThreshold must be positive");
  }

  /** Creates a configuration from a map of property values. */
  public static FormatterConfig of(Map<Prop, Object> map) {
    return map.isEmpty() ? DEFAULT
        : new FormatterConfig(ImmutableMap.copyOf(map));
  }

  /** Returns a configuration that is the same as this but with one property
   * changed. A null value restores the property's default. */
  public FormatterConfig with(Prop prop, @Nullable Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(this.map);
    prop.set(map, value);
    return new FormatterConfig(ImmutableMap.copyOf(map));
  }

  /** Returns the property values that were set explicitly. */
  public Map<Prop, Object> map() {
    return map;
  }

  @Override public int hashCode() {
    return Objects.hash(indentSize, printWidth, trailingCommas,
        breakPipeChains, pipeChainBreakThreshold);
  }

  /** Two configurations are equal if their properties have the same values,
   * whether set explicitly or by default. */
  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof FormatterConfig
        && indentSize == ((FormatterConfig) o).indentSize
        && printWidth == ((FormatterConfig) o).printWidth
        && trailingCommas == ((FormatterConfig) o).trailingCommas
        && breakPipeChains == ((FormatterConfig) o).breakPipeChains
        && pipeChainBreakThreshold
            == ((FormatterConfig) o).pipeChainBreakThreshold;
  }

  @Override public String toString() {
    return "FormatterConfig" + map;
  }
}

// End FormatterConfig.java
