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

import static net.hydromatic.lea.parse.Parsers.appendQuoted;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Appends a list of nodes, each preceded by a space. */
  static StringBuilder describeAll(StringBuilder buf,
      List<? extends AstNode> nodes) {
    for (AstNode node : nodes) {
      node.describeTo(buf.append(' '));
    }
    return buf;
  }

  /** Base class for an expression. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Parse tree node of a literal (constant).
   *
   * <p>The value is a {@link BigDecimal} for a number, a {@link String} for a
   * string, and a {@link Boolean} for {@code true} and {@code false}. */
  public static class Literal extends Exp {
    public final Object value;

    /** Creates a Literal. */
    Literal(Pos pos, Op op, Object value) {
      super(pos, op);
      this.value = requireNonNull(value);
      switch (op) {
      case NUMBER_LITERAL:
        checkArgument(value instanceof BigDecimal);
        break;
      case STRING_LITERAL:
        checkArgument(value instanceof String);
        break;
      case BOOL_LITERAL:
        checkArgument(value instanceof Boolean);
        break;
      default:
        throw new IllegalArgumentException("not a literal: " + op);
      }
    }

    /** Returns the canonical source text of this literal's value, excluding
     * the quotes of a string. Numbers are printed in plain notation without
     * trailing fractional zeros. */
    public String valueText() {
      if (value instanceof BigDecimal) {
        return plain((BigDecimal) value);
      }
      return value.toString();
    }

    /** Prints a number in plain notation without trailing zeros. */
    public static String plain(BigDecimal value) {
      return value.signum() == 0
          ? "0"
          : value.stripTrailingZeros().toPlainString();
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      if (op == Op.STRING_LITERAL) {
        return appendQuoted(buf, (String) value);
      }
      return buf.append(valueText());
    }
  }

  /** Template string, such as {@code `Hello {name}!`}.
   *
   * <p>There is always one more text segment than there are interpolated
   * expressions; the first and last segments may be empty. */
  public static class Template extends Exp {
    public final List<String> texts;
    public final List<Exp> exps;

    Template(Pos pos, ImmutableList<String> texts, ImmutableList<Exp> exps) {
      super(pos, Op.TEMPLATE);
      this.texts = requireNonNull(texts);
      this.exps = requireNonNull(exps);
      checkArgument(texts.size() == exps.size() + 1,
          "template must begin and end with a text segment");
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      buf.append("(template ");
      appendQuoted(buf, texts.get(0));
      for (int i = 0; i < exps.size(); i++) {
        exps.get(i).describeTo(buf.append(' '));
        appendQuoted(buf.append(' '), texts.get(i + 1));
      }
      return buf.append(')');
    }
  }

  /** Identifier. */
  public static class Id extends Exp {
    public final String name;

    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      return buf.append(name);
    }
  }

  /** Anonymous pipe input, written {@code _} or {@code input}. */
  public static class Placeholder extends Exp {
    Placeholder(Pos pos) {
      super(pos, Op.PLACEHOLDER);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      return buf.append("input");
    }
  }

  /** Call to an infix operator: a binary operator, or one of the pipes
   * {@code />}, {@code />>>} and {@code </}. */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isBinary() || op.isPipe(), "not infix: %s", op);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      buf.append('(').append(op.symbol()).append(' ');
      a0.describeTo(buf).append(' ');
      return a1.describeTo(buf).append(')');
    }
  }

  /** Call to a prefix operator: {@code -}, {@code !}, {@code await} or
   * {@code return}. */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Pos pos, Op op, Exp a) {
      super(pos, op);
      this.a = requireNonNull(a);
      checkArgument(op.isPrefix(), "not prefix: %s", op);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      buf.append('(').append(op.symbol()).append(' ');
      return a.describeTo(buf).append(')');
    }
  }

  /** Parallel pipe. Feeds one input to each of two or more branches.
   *
   * <p>For example,
   *
   * <pre>{@code
   * xs
   *   \> double
   *   \> square
   * }</pre> */
  public static class Parallel extends Exp {
    public final Exp input;
    public final List<Exp> branches;

    Parallel(Pos pos, Exp input, ImmutableList<Exp> branches) {
      super(pos, Op.PARALLEL_PIPE);
      this.input = requireNonNull(input);
      this.branches = requireNonNull(branches);
      checkArgument(branches.size() >= 2,
          "parallel pipe requires at least two branches");
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      input.describeTo(buf.append("(\\> "));
      return describeAll(buf, branches).append(')');
    }
  }

  /** Reactive pipe, {@code source @> stage /> stage}. */
  public static class Reactive extends Exp {
    public final Id source;
    public final List<Exp> stages;

    Reactive(Pos pos, Id source, ImmutableList<Exp> stages) {
      super(pos, Op.REACTIVE_PIPE);
      this.source = requireNonNull(source);
      this.stages = requireNonNull(stages);
      checkArgument(!stages.isEmpty());
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      source.describeTo(buf.append("(@> "));
      return describeAll(buf, stages).append(')');
    }
  }

  /** Function application, {@code f(a, b)}. */
  public static class Apply extends Exp {
    public final Exp fn;
    public final List<Exp> args;

    Apply(Pos pos, Exp fn, ImmutableList<Exp> args) {
      super(pos, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      fn.describeTo(buf.append("(call "));
      return describeAll(buf, args).append(')');
    }
  }

  /** Parameter of a function. The name is {@code _} for an ignored
   * parameter. */
  public static class Param extends AstNode {
    public final String name;
    /** Inline type annotation, {@code (x: Int)}; deprecated in favor of a
     * trailing {@link Signature}. */
    public final @Nullable Type type;
    public final @Nullable Exp defaultValue;

    Param(Pos pos, String name, @Nullable Type type,
        @Nullable Exp defaultValue) {
      super(pos, Op.PARAM);
      this.name = requireNonNull(name);
      this.type = type;
      this.defaultValue = defaultValue;
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      buf.append(name);
      if (type != null) {
        type.describeTo(buf.append(':'));
      }
      if (defaultValue != null) {
        defaultValue.describeTo(buf.append('='));
      }
      return buf;
    }
  }

  /** Function literal.
   *
   * <p>The body is a list of statements followed by a result expression. If
   * there are no statements, the function has an expression body,
   * {@code (x) -> x + 1}. */
  public static class Fn extends Exp {
    public final List<Param> params;
    /** Whether the function was defined with {@code <-} rather than
     * {@code ->}. */
    public final boolean reverse;
    public final @Nullable Signature signature;
    /** Names of contexts that the function depends on, {@code @Logger}. */
    public final List<String> attachments;
    public final List<Stmt> statements;
    public final Exp result;
    public final List<Decorator> decorators;

    Fn(Pos pos, ImmutableList<Param> params, boolean reverse,
        @Nullable Signature signature, ImmutableList<String> attachments,
        ImmutableList<Stmt> statements, Exp result,
        ImmutableList<Decorator> decorators) {
      super(pos, Op.FN);
      this.params = requireNonNull(params);
      this.reverse = reverse;
      this.signature = signature;
      this.attachments = requireNonNull(attachments);
      this.statements = requireNonNull(statements);
      this.result = requireNonNull(result);
      this.decorators = requireNonNull(decorators);
    }

    /** Returns whether the body is a block of statements. */
    public boolean isBlock() {
      return !statements.isEmpty();
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      buf.append(reverse ? "(fn<- (" : "(fn (");
      for (int i = 0; i < params.size(); i++) {
        if (i > 0) {
          buf.append(' ');
        }
        params.get(i).describeTo(buf);
      }
      buf.append(')');
      if (signature != null) {
        signature.describeTo(buf.append(' '));
      }
      attachments.forEach(a -> buf.append(" @").append(a));
      describeAll(buf, statements);
      result.describeTo(buf.append(' '));
      return describeAll(buf, decorators).append(')');
    }
  }

  /** List expression, {@code [1, ...xs]}. */
  public static class ListExp extends Exp {
    public final List<Exp> elements;

    ListExp(Pos pos, ImmutableList<Exp> elements) {
      super(pos, Op.LIST);
      this.elements = requireNonNull(elements);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      return describeAll(buf.append("(list"), elements).append(')');
    }
  }

  /** Spread of a list inside a list, {@code ...xs}. */
  public static class Spread extends Exp {
    public final Exp exp;

    Spread(Pos pos, Exp exp) {
      super(pos, Op.SPREAD);
      this.exp = requireNonNull(exp);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      return exp.describeTo(buf.append("(... ")).append(')');
    }
  }

  /** Tuple expression, {@code (a, b)}, or the empty tuple {@code ()}. */
  public static class Tuple extends Exp {
    public final List<Exp> elements;

    Tuple(Pos pos, ImmutableList<Exp> elements) {
      super(pos, Op.TUPLE);
      this.elements = requireNonNull(elements);
      checkArgument(elements.size() != 1, "tuple must not have one element");
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      return describeAll(buf.append("(tuple"), elements).append(')');
    }
  }

  /** Field of a record. If the label is null, the field spreads another
   * record, {@code ...r}. */
  public static class Field extends AstNode {
    public final @Nullable String label;
    public final Exp exp;

    Field(Pos pos, @Nullable String label, Exp exp) {
      super(pos, Op.FIELD);
      this.label = label;
      this.exp = requireNonNull(exp);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      buf.append('(').append(label == null ? "..." : label).append(' ');
      return exp.describeTo(buf).append(')');
    }
  }

  /** Record expression, {@code { name: "x", ...r }}. */
  public static class Record extends Exp {
    public final List<Field> fields;

    Record(Pos pos, ImmutableList<Field> fields) {
      super(pos, Op.RECORD);
      this.fields = requireNonNull(fields);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      return describeAll(buf.append("(record"), fields).append(')');
    }
  }

  /** Index access, {@code xs[i]}. */
  public static class Index extends Exp {
    public final Exp exp;
    public final Exp index;

    Index(Pos pos, Exp exp, Exp index) {
      super(pos, Op.INDEX);
      this.exp = requireNonNull(exp);
      this.index = requireNonNull(index);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      exp.describeTo(buf.append("(index ")).append(' ');
      return index.describeTo(buf).append(')');
    }
  }

  /** Member access, {@code r.name}. */
  public static class Member extends Exp {
    public final Exp exp;
    public final String name;

    Member(Pos pos, Exp exp, String name) {
      super(pos, Op.MEMBER);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      return exp.describeTo(buf.append("(. ")).append(' ').append(name)
          .append(')');
    }
  }

  /** Ternary conditional, {@code c ? a : b}. */
  public static class Ternary extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    Ternary(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.TERNARY);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      condition.describeTo(buf.append("(? ")).append(' ');
      ifTrue.describeTo(buf).append(' ');
      return ifFalse.describeTo(buf).append(')');
    }
  }

  /** Case of a {@link Match}.
   *
   * <p>A pattern case has a pattern, a guard case has a guard, and a default
   * case has neither. */
  public static class MatchCase extends AstNode {
    public final @Nullable Exp pattern;
    public final @Nullable Exp guard;
    public final Exp body;

    MatchCase(Pos pos, @Nullable Exp pattern, @Nullable Exp guard, Exp body) {
      super(pos, Op.CASE);
      this.pattern = pattern;
      this.guard = guard;
      this.body = requireNonNull(body);
      checkArgument(pattern == null || guard == null,
          "case must not have both pattern and guard");
    }

    public boolean isDefault() {
      return pattern == null && guard == null;
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      if (pattern != null) {
        pattern.describeTo(buf.append("(case ")).append(' ');
      } else if (guard != null) {
        guard.describeTo(buf.append("(if ")).append(' ');
      } else {
        buf.append("(default ");
      }
      return body.describeTo(buf).append(')');
    }
  }

  /** Match expression. */
  public static class Match extends Exp {
    public final Exp exp;
    public final List<MatchCase> cases;

    Match(Pos pos, Exp exp, ImmutableList<MatchCase> cases) {
      super(pos, Op.MATCH);
      this.exp = requireNonNull(exp);
      this.cases = requireNonNull(cases);
      checkArgument(!cases.isEmpty(), "match requires at least one case");
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      exp.describeTo(buf.append("(match "));
      return describeAll(buf, cases).append(')');
    }
  }

  /** Stage of a {@link Pipeline}. A stage with op {@link Op#STAGE} has one
   * expression; a stage with op {@link Op#PARALLEL_STAGE} has one expression
   * per branch. */
  public static class Stage extends AstNode {
    public final List<Exp> exps;

    Stage(Pos pos, Op op, ImmutableList<Exp> exps) {
      super(pos, op);
      this.exps = requireNonNull(exps);
      checkArgument(op == Op.STAGE ? exps.size() == 1 : !exps.isEmpty());
    }

    public boolean isParallel() {
      return op == Op.PARALLEL_STAGE;
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      if (!isParallel()) {
        return exps.get(0).describeTo(buf);
      }
      return describeAll(buf.append("(\\>"), exps).append(')');
    }
  }

  /** Pipeline literal, a reusable sequence of stages,
   * {@code /> filter(pred) /> map(f)}. */
  public static class Pipeline extends Exp {
    public final List<Stage> stages;
    public final @Nullable PipeSignature signature;
    public final List<Decorator> decorators;

    Pipeline(Pos pos, ImmutableList<Stage> stages,
        @Nullable PipeSignature signature,
        ImmutableList<Decorator> decorators) {
      super(pos, Op.PIPELINE);
      this.stages = requireNonNull(stages);
      this.signature = signature;
      this.decorators = requireNonNull(decorators);
      checkArgument(!stages.isEmpty());
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      describeAll(buf.append("(pipeline"), stages);
      if (signature != null) {
        signature.describeTo(buf.append(' '));
      }
      return describeAll(buf, decorators).append(')');
    }
  }

  /** Bidirectional pipeline literal, {@code </> encode </> compress}. */
  public static class Bidirectional extends Exp {
    public final List<Exp> stages;
    public final List<Decorator> decorators;

    Bidirectional(Pos pos, ImmutableList<Exp> stages,
        ImmutableList<Decorator> decorators) {
      super(pos, Op.BIDIRECTIONAL);
      this.stages = requireNonNull(stages);
      this.decorators = requireNonNull(decorators);
      checkArgument(!stages.isEmpty());
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      describeAll(buf.append("(</>"), stages);
      return describeAll(buf, decorators).append(')');
    }
  }

  /** Module import, {@code use "./lib"}. */
  public static class Use extends Exp {
    public final String path;

    Use(Pos pos, String path) {
      super(pos, Op.USE);
      this.path = requireNonNull(path);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      return appendQuoted(buf.append("(use "), path).append(')');
    }
  }

  /** Decorator, such as {@code #memo} or {@code #retry(3)}. Arguments are
   * literals. */
  public static class Decorator extends AstNode {
    public final String name;
    public final List<Literal> args;

    Decorator(Pos pos, String name, ImmutableList<Literal> args) {
      super(pos, Op.DECORATOR);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      buf.append('#').append(name);
      if (!args.isEmpty()) {
        buf.append('(');
        for (int i = 0; i < args.size(); i++) {
          args.get(i).describeTo(buf.append(i == 0 ? "" : ", "));
        }
        buf.append(')');
      }
      return buf;
    }
  }

  /** Type in a signature: a name such as {@code Int}, a tuple such as
   * {@code (Int, String)}, or a list such as {@code [Int]}. Any of them may be
   * marked optional with a leading {@code ?}. */
  public static class Type extends AstNode {
    public final @Nullable String name;
    public final List<Type> components;
    public final boolean optional;

    Type(Pos pos, Op op, @Nullable String name, ImmutableList<Type> components,
        boolean optional) {
      super(pos, op);
      this.name = name;
      this.components = requireNonNull(components);
      this.optional = optional;
      switch (op) {
      case NAMED_TYPE:
        checkArgument(name != null && components.isEmpty());
        break;
      case LIST_TYPE:
        checkArgument(name == null && components.size() == 1);
        break;
      case TUPLE_TYPE:
        checkArgument(name == null);
        break;
      default:
        throw new IllegalArgumentException("not a type: " + op);
      }
    }

    /** Writes this type as source text. */
    public StringBuilder unparse(StringBuilder buf) {
      if (optional) {
        buf.append('?');
      }
      switch (op) {
      case NAMED_TYPE:
        return buf.append(name);
      case LIST_TYPE:
        return components.get(0).unparse(buf.append('[')).append(']');
      default:
        buf.append('(');
        for (int i = 0; i < components.size(); i++) {
          components.get(i).unparse(buf.append(i == 0 ? "" : ", "));
        }
        return buf.append(')');
      }
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      return unparse(buf);
    }
  }

  /** Trailing type signature of a function, {@code :: Int, Int :> Int}.
   *
   * <p>A single parameter type is written alone; zero or several parameter
   * types are written in parentheses. A single parameter whose type is a
   * tuple is therefore written {@code ((Int, Int))}. */
  public static class Signature extends AstNode {
    public final List<Type> paramTypes;
    public final @Nullable Type returnType;

    Signature(Pos pos, ImmutableList<Type> paramTypes,
        @Nullable Type returnType) {
      super(pos, Op.SIGNATURE);
      this.paramTypes = requireNonNull(paramTypes);
      this.returnType = returnType;
    }

    /** Writes this signature as source text, without the leading
     * {@code ::}. */
    public StringBuilder unparse(StringBuilder buf) {
      if (paramTypes.size() == 1
          && (paramTypes.get(0).op != Op.TUPLE_TYPE
              || paramTypes.get(0).optional)) {
        paramTypes.get(0).unparse(buf);
      } else {
        buf.append('(');
        for (int i = 0; i < paramTypes.size(); i++) {
          paramTypes.get(i).unparse(buf.append(i == 0 ? "" : ", "));
        }
        buf.append(')');
      }
      if (returnType != null) {
        returnType.unparse(buf.append(" :> "));
      }
      return buf;
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      return unparse(buf.append(":: "));
    }
  }

  /** Type signature of a pipeline literal, {@code :: [Int] /> Int}. */
  public static class PipeSignature extends AstNode {
    public final Type input;
    public final @Nullable Type output;

    PipeSignature(Pos pos, Type input, @Nullable Type output) {
      super(pos, Op.PIPE_SIGNATURE);
      this.input = requireNonNull(input);
      this.output = output;
    }

    /** Writes this signature as source text, without the leading
     * {@code ::}. */
    public StringBuilder unparse(StringBuilder buf) {
      input.unparse(buf);
      if (output != null) {
        output.unparse(buf.append(" /> "));
      }
      return buf;
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      return unparse(buf.append(":: "));
    }
  }

  /** Base class for a statement. */
  public abstract static class Stmt extends AstNode {
    Stmt(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Statement that binds a name to an expression. The op distinguishes
   * {@code let} (immutable), {@code maybe} (mutable), {@code and}
   * (continuation of a preceding {@code let}), assignment to an existing
   * mutable binding, context definition, context provision, and decorator
   * definition. */
  public static class Binding extends Stmt {
    public final String name;
    public final Exp exp;

    Binding(Pos pos, Op op, String name, Exp exp) {
      super(pos, op);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
      switch (op) {
      case LET:
      case MAYBE:
      case AND:
      case ASSIGN:
      case CONTEXT_DEF:
      case PROVIDE:
      case DECORATOR_DEF:
        break;
      default:
        throw new IllegalArgumentException("not a binding: " + op);
      }
    }

    /** Returns whether this is a {@code maybe} binding, whose name may later
     * be re-assigned. */
    public boolean isMutable() {
      return op == Op.MAYBE;
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      final String keyword;
      switch (op) {
      case ASSIGN:
        keyword = "=";
        break;
      case CONTEXT_DEF:
        keyword = "context";
        break;
      case DECORATOR_DEF:
        keyword = "decorator";
        break;
      default:
        keyword = op.symbol();
      }
      buf.append('(').append(keyword).append(' ').append(name).append(' ');
      return exp.describeTo(buf).append(')');
    }
  }

  /** Statement that consists of an expression. */
  public static class ExpStmt extends Stmt {
    public final Exp exp;

    ExpStmt(Pos pos, Exp exp) {
      super(pos, Op.EXP_STMT);
      this.exp = requireNonNull(exp);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      return exp.describeTo(buf);
    }
  }

  /** Labeled code block,
   *
   * <pre>{@code
   * {-- Setup --}
   * let x = 1
   * {/--}
   * }</pre> */
  public static class Codeblock extends Stmt {
    public final @Nullable String label;
    public final List<Stmt> statements;

    Codeblock(Pos pos, @Nullable String label,
        ImmutableList<Stmt> statements) {
      super(pos, Op.CODEBLOCK);
      this.label = label;
      this.statements = requireNonNull(statements);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      buf.append("(codeblock");
      if (label != null) {
        appendQuoted(buf.append(' '), label);
      }
      return describeAll(buf, statements).append(')');
    }
  }

  /** Program, the root of a parsed file. */
  public static class Program extends AstNode {
    /** Whether the file starts with the {@code #strict} pragma. */
    public final boolean strict;
    public final List<Stmt> statements;

    Program(Pos pos, boolean strict, ImmutableList<Stmt> statements) {
      super(pos, Op.PROGRAM);
      this.strict = strict;
      this.statements = requireNonNull(statements);
    }

    @Override public StringBuilder describeTo(StringBuilder buf) {
      buf.append(strict ? "(program #strict" : "(program");
      return describeAll(buf, statements).append(')');
    }
  }
}

// End Ast.java
