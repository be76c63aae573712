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

import static java.util.Objects.requireNonNull;

/** Abstract syntax tree node. */
public abstract class AstNode {
  public final Pos pos;
  public final Op op;

  public AstNode(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a structural string.
   *
   * <p>The string is an S-expression such as {@code (/> xs (call f 1))}. It
   * contains every semantic field of the node and none of its positions, so
   * two trees are structurally equal if and only if their strings are equal.
   * If you want source code, use
   * {@link net.hydromatic.lea.format.Formatter}.
   */
  @Override public final String toString() {
    // Marked final because you should override describeTo, not toString
    return describeTo(new StringBuilder()).toString();
  }

  /** Writes the structural form of this node to a builder. */
  public abstract StringBuilder describeTo(StringBuilder buf);
}

// End AstNode.java
