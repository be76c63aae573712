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

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.List;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a number literal. */
  public Ast.Literal numberLiteral(Pos pos, BigDecimal value) {
    return new Ast.Literal(pos, Op.NUMBER_LITERAL, value);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  /** Creates a boolean literal. */
  public Ast.Literal boolLiteral(Pos pos, boolean value) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, value);
  }

  public Ast.Template template(Pos pos, List<String> texts,
      List<? extends Ast.Exp> exps) {
    return new Ast.Template(pos, ImmutableList.copyOf(texts),
        ImmutableList.copyOf(exps));
  }

  /** Creates an identifier. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  public Ast.Placeholder placeholder(Pos pos) {
    return new Ast.Placeholder(pos);
  }

  /** Creates a call to an infix operator or pipe. */
  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(pos, op, a0, a1);
  }

  /** Creates a call to a prefix operator. */
  public Ast.PrefixCall prefixCall(Pos pos, Op op, Ast.Exp a) {
    return new Ast.PrefixCall(pos, op, a);
  }

  public Ast.Parallel parallel(Pos pos, Ast.Exp input,
      List<? extends Ast.Exp> branches) {
    return new Ast.Parallel(pos, input, ImmutableList.copyOf(branches));
  }

  public Ast.Reactive reactive(Pos pos, Ast.Id source,
      List<? extends Ast.Exp> stages) {
    return new Ast.Reactive(pos, source, ImmutableList.copyOf(stages));
  }

  public Ast.Apply apply(Pos pos, Ast.Exp fn, List<? extends Ast.Exp> args) {
    return new Ast.Apply(pos, fn, ImmutableList.copyOf(args));
  }

  public Ast.Param param(Pos pos, String name, Ast.@Nullable Type type,
      Ast.@Nullable Exp defaultValue) {
    return new Ast.Param(pos, name, type, defaultValue);
  }

  /** Creates a function. If {@code statements} is empty, the function has an
   * expression body. */
  public Ast.Fn fn(Pos pos, List<Ast.Param> params, boolean reverse,
      Ast.@Nullable Signature signature, List<String> attachments,
      List<? extends Ast.Stmt> statements, Ast.Exp result,
      List<Ast.Decorator> decorators) {
    return new Ast.Fn(pos, ImmutableList.copyOf(params), reverse, signature,
        ImmutableList.copyOf(attachments), ImmutableList.copyOf(statements),
        result, ImmutableList.copyOf(decorators));
  }

  /** Creates a function with an expression body and no annotations. */
  public Ast.Fn fn(Pos pos, List<Ast.Param> params, Ast.Exp body) {
    return fn(pos, params, false, null, ImmutableList.of(), ImmutableList.of(),
        body, ImmutableList.of());
  }

  public Ast.ListExp list(Pos pos, List<? extends Ast.Exp> elements) {
    return new Ast.ListExp(pos, ImmutableList.copyOf(elements));
  }

  public Ast.Spread spread(Pos pos, Ast.Exp exp) {
    return new Ast.Spread(pos, exp);
  }

  public Ast.Tuple tuple(Pos pos, List<? extends Ast.Exp> elements) {
    return new Ast.Tuple(pos, ImmutableList.copyOf(elements));
  }

  /** Creates a record field; a null label means a spread field. */
  public Ast.Field field(Pos pos, @Nullable String label, Ast.Exp exp) {
    return new Ast.Field(pos, label, exp);
  }

  public Ast.Record record(Pos pos, List<Ast.Field> fields) {
    return new Ast.Record(pos, ImmutableList.copyOf(fields));
  }

  public Ast.Index index(Pos pos, Ast.Exp exp, Ast.Exp index) {
    return new Ast.Index(pos, exp, index);
  }

  public Ast.Member member(Pos pos, Ast.Exp exp, String name) {
    return new Ast.Member(pos, exp, name);
  }

  public Ast.Ternary ternary(Pos pos, Ast.Exp condition, Ast.Exp ifTrue,
      Ast.Exp ifFalse) {
    return new Ast.Ternary(pos, condition, ifTrue, ifFalse);
  }

  public Ast.MatchCase patternCase(Pos pos, Ast.Exp pattern, Ast.Exp body) {
    return new Ast.MatchCase(pos, pattern, null, body);
  }

  public Ast.MatchCase guardCase(Pos pos, Ast.Exp guard, Ast.Exp body) {
    return new Ast.MatchCase(pos, null, guard, body);
  }

  public Ast.MatchCase defaultCase(Pos pos, Ast.Exp body) {
    return new Ast.MatchCase(pos, null, null, body);
  }

  public Ast.Match match(Pos pos, Ast.Exp exp, List<Ast.MatchCase> cases) {
    return new Ast.Match(pos, exp, ImmutableList.copyOf(cases));
  }

  /** Creates a pipeline stage with a single expression. */
  public Ast.Stage stage(Pos pos, Ast.Exp exp) {
    return new Ast.Stage(pos, Op.STAGE, ImmutableList.of(exp));
  }

  /** Creates a pipeline stage that feeds its input to several branches. */
  public Ast.Stage parallelStage(Pos pos, List<? extends Ast.Exp> branches) {
    return new Ast.Stage(pos, Op.PARALLEL_STAGE,
        ImmutableList.copyOf(branches));
  }

  public Ast.Pipeline pipeline(Pos pos, List<Ast.Stage> stages,
      Ast.@Nullable PipeSignature signature, List<Ast.Decorator> decorators) {
    return new Ast.Pipeline(pos, ImmutableList.copyOf(stages), signature,
        ImmutableList.copyOf(decorators));
  }

  public Ast.Bidirectional bidirectional(Pos pos,
      List<? extends Ast.Exp> stages, List<Ast.Decorator> decorators) {
    return new Ast.Bidirectional(pos, ImmutableList.copyOf(stages),
        ImmutableList.copyOf(decorators));
  }

  public Ast.Use use(Pos pos, String path) {
    return new Ast.Use(pos, path);
  }

  public Ast.Decorator decorator(Pos pos, String name,
      List<Ast.Literal> args) {
    return new Ast.Decorator(pos, name, ImmutableList.copyOf(args));
  }

  public Ast.Type namedType(Pos pos, String name, boolean optional) {
    return new Ast.Type(pos, Op.NAMED_TYPE, name, ImmutableList.of(),
        optional);
  }

  public Ast.Type tupleType(Pos pos, List<Ast.Type> components,
      boolean optional) {
    return new Ast.Type(pos, Op.TUPLE_TYPE, null,
        ImmutableList.copyOf(components), optional);
  }

  public Ast.Type listType(Pos pos, Ast.Type element, boolean optional) {
    return new Ast.Type(pos, Op.LIST_TYPE, null, ImmutableList.of(element),
        optional);
  }

  public Ast.Signature signature(Pos pos, List<Ast.Type> paramTypes,
      Ast.@Nullable Type returnType) {
    return new Ast.Signature(pos, ImmutableList.copyOf(paramTypes),
        returnType);
  }

  public Ast.PipeSignature pipeSignature(Pos pos, Ast.Type input,
      Ast.@Nullable Type output) {
    return new Ast.PipeSignature(pos, input, output);
  }

  /** Creates a {@code let} binding, or a {@code maybe} binding if
   * {@code mutable}. */
  public Ast.Binding let(Pos pos, boolean mutable, String name, Ast.Exp exp) {
    return new Ast.Binding(pos, mutable ? Op.MAYBE : Op.LET, name, exp);
  }

  /** Creates an {@code and} binding, which continues a preceding
   * {@code let}. */
  public Ast.Binding and(Pos pos, String name, Ast.Exp exp) {
    return new Ast.Binding(pos, Op.AND, name, exp);
  }

  public Ast.Binding assign(Pos pos, String name, Ast.Exp exp) {
    return new Ast.Binding(pos, Op.ASSIGN, name, exp);
  }

  public Ast.Binding contextDef(Pos pos, String name, Ast.Exp defaultValue) {
    return new Ast.Binding(pos, Op.CONTEXT_DEF, name, defaultValue);
  }

  public Ast.Binding provide(Pos pos, String name, Ast.Exp value) {
    return new Ast.Binding(pos, Op.PROVIDE, name, value);
  }

  public Ast.Binding decoratorDef(Pos pos, String name, Ast.Exp transformer) {
    return new Ast.Binding(pos, Op.DECORATOR_DEF, name, transformer);
  }

  public Ast.ExpStmt expStmt(Pos pos, Ast.Exp exp) {
    return new Ast.ExpStmt(pos, exp);
  }

  public Ast.Codeblock codeblock(Pos pos, @Nullable String label,
      List<? extends Ast.Stmt> statements) {
    return new Ast.Codeblock(pos, label, ImmutableList.copyOf(statements));
  }

  public Ast.Program program(Pos pos, boolean strict,
      List<? extends Ast.Stmt> statements) {
    return new Ast.Program(pos, strict, ImmutableList.copyOf(statements));
  }
}

// End AstBuilder.java
