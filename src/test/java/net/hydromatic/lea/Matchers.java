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

import net.hydromatic.lea.ast.AstNode;
import net.hydromatic.lea.ast.Pos;
import net.hydromatic.lea.util.LeaException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Matchers for use in Lea tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches an AST node by its structural string. */
  public static <T extends AstNode> Matcher<T> isAst(Class<? extends T> clazz,
      String expected) {
    return new CustomTypeSafeMatcher<T>("ast with value " + expected) {
      @Override protected boolean matchesSafely(T t) {
        return clazz.isInstance(t) && t.toString().equals(expected);
      }
    };
  }

  /** Matches a throwable of a given class with a given message and, if
   * {@code pos} is not null, a given position. */
  public static <T extends Throwable> Matcher<Throwable> throwsA(Class<T> clazz,
      String message, @Nullable Pos pos) {
    return new CustomTypeSafeMatcher<Throwable>(clazz + " with message '"
        + message + "'" + (pos == null ? "" : " at " + pos)) {
      @Override protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && message.equals(item.getMessage())
            && (pos == null
                || item instanceof LeaException
                && pos.equals(((LeaException) item).pos()));
      }
    };
  }
}

// End Matchers.java
