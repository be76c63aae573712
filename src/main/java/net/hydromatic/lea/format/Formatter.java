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

import net.hydromatic.lea.ast.Ast;
import net.hydromatic.lea.ast.Op;
import net.hydromatic.lea.ast.Pos;
import net.hydromatic.lea.parse.Parsers;

import com.google.common.base.Strings;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

import static net.hydromatic.lea.ast.AstBuilder.ast;

import static java.util.Objects.requireNonNull;

/** Converts a syntax tree into canonical Lea source text.
 *
 * <p>The formatter has no memory of how the source was laid out. It decides
 * where parentheses are needed from the binding powers in {@link Op}, which
 * are the same ones that the parser uses, and it decides where lines break
 * from the print width in its {@link FormatterConfig}.
 *
 * <p>Each expression is first rendered on a single line. If that fits in the
 * remaining width it is used; otherwise the expression is rendered in its
 * broken form, whose children in turn try to fit on a single line. A match,
 * a parallel pipe and a function with a block body are always broken.
 *
 * <p>Parsing the output yields the tree that was formatted, and formatting
 * the output again yields the same text.
 *
 * <p>A formatter is immutable and may be used from several threads. */
public class Formatter {
  private final FormatterConfig config;

  /** Creates a formatter. */
  public Formatter(FormatterConfig config) {
    this.config = requireNonNull(config);
  }

  /** Creates a formatter with the default configuration. */
  public static Formatter create() {
    return new Formatter(FormatterConfig.DEFAULT);
  }

  /** Returns this formatter's configuration. */
  public FormatterConfig config() {
    return config;
  }

  /** Formats a program. Each statement ends with a line break, so the
   * result of a non-empty program ends with a line break. */
  public String format(Ast.Program program) {
    final StringBuilder b = new StringBuilder();
    if (program.strict) {
      b.append("#strict\n");
    }
    Ast.@Nullable Stmt previous = null;
    for (Ast.Stmt stmt : program.statements) {
      if (previous != null && needsBlankLine(previous, stmt)) {
        b.append('\n');
      }
      b.append(stmt(stmt, 0)).append('\n');
      previous = stmt;
    }
    return b.toString();
  }

  /** Formats a statement, without a trailing line break. */
  public String format(Ast.Stmt stmt) {
    return stmt(stmt, 0);
  }

  /** Formats an expression that starts in the first column. */
  public String format(Ast.Exp exp) {
    return exp(exp, new Ctx(0, 0, 0, false), 0, 0);
  }

  /** Returns whether a blank line separates two consecutive top-level
   * statements. */
  static boolean needsBlankLine(Ast.Stmt previous, Ast.Stmt stmt) {
    switch (stmt.op) {
    case LET:
    case MAYBE:
      return previous.op == Op.EXP_STMT;
    case CONTEXT_DEF:
    case CODEBLOCK:
      return true;
    case PROVIDE:
      return previous.op != Op.PROVIDE;
    default:
      return false;
    }
  }

  // -- statements ------------------------------------------------------------

  private String stmt(Ast.Stmt stmt, int level) {
    final String indent = indent(level);
    final Ctx c = new Ctx(level, 0, 0, false);
    switch (stmt.op) {
    case LET:
    case MAYBE:
    case AND:
    case CONTEXT_DEF:
    case DECORATOR_DEF:
      final Ast.Binding binding = (Ast.Binding) stmt;
      return binding(indent + stmt.op.padded + binding.name + " = ",
          binding.exp, c);
    case ASSIGN:
      final Ast.Binding assign = (Ast.Binding) stmt;
      return binding(indent + assign.name + " = ", assign.exp, c);
    case PROVIDE:
      final Ast.Binding provide = (Ast.Binding) stmt;
      return binding(indent + "provide " + provide.name + " ", provide.exp, c);
    case EXP_STMT:
      return binding(indent, ((Ast.ExpStmt) stmt).exp, c);
    case CODEBLOCK:
      final Ast.Codeblock codeblock = (Ast.Codeblock) stmt;
      final StringBuilder b = new StringBuilder(indent).append("{-- ");
      if (codeblock.label != null) {
        b.append(codeblock.label).append(' ');
      }
      b.append("--}");
      for (Ast.Stmt s : codeblock.statements) {
        b.append('\n').append(stmt(s, level + 1));
      }
      return b.append('\n').append(indent).append("{/--}").toString();
    default:
      throw new AssertionError("unknown statement " + stmt.op);
    }
  }

  private String binding(String prefix, Ast.Exp exp, Ctx c) {
    return prefix + exp(exp, c.after(prefix), 0, 0);
  }

  // -- expressions -----------------------------------------------------------

  /** Renders an expression whose neighbors bind with powers {@code left}
   * and {@code right}, adding parentheses if the expression binds less
   * tightly than its neighbors. */
  private String exp(Ast.Exp e, Ctx c, int left, int right) {
    if (left > e.op.left || e.op.right < right) {
      return parenthesize(e, c);
    }
    if (!c.flat) {
      final String flat = node(e, c.flat(), left, right);
      if (c.fits(flat)) {
        return flat;
      }
    }
    return node(e, c, left, right);
  }

  /** Renders an expression, adding parentheses if {@code force} even if
   * binding powers do not require them. */
  private String exp(Ast.Exp e, Ctx c, int left, int right, boolean force) {
    return force ? parenthesize(e, c) : exp(e, c, left, right);
  }

  private String parenthesize(Ast.Exp e, Ctx c) {
    return "(" + exp(e, c.after("(").tail(c.tail + 1), 0, 0) + ")";
  }

  private String node(Ast.Exp e, Ctx c, int left, int right) {
    switch (e.op) {
    case NUMBER_LITERAL:
    case STRING_LITERAL:
    case BOOL_LITERAL:
      return literal(new StringBuilder(), (Ast.Literal) e).toString();
    case TEMPLATE:
      return template((Ast.Template) e, c);
    case ID:
      return ((Ast.Id) e).name;
    case PLACEHOLDER:
      return "input";
    case USE:
      return Parsers.appendQuoted(new StringBuilder("use "),
          ((Ast.Use) e).path).toString();
    case LIST:
      return group("[", "]", false, ((Ast.ListExp) e).elements,
          this::element, c);
    case TUPLE:
      return group("(", ")", false, ((Ast.Tuple) e).elements,
          this::element, c);
    case RECORD:
      return group("{", "}", true, ((Ast.Record) e).fields, this::field, c);
    case SPREAD:
      return "..." + exp(((Ast.Spread) e).exp, c.after("..."), 0, 0);
    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
    case PLUS:
    case MINUS:
    case CONCAT:
    case TIMES:
    case DIVIDE:
    case MOD:
      final Ast.InfixCall call = (Ast.InfixCall) e;
      final String a0 = exp(call.a0, c.tail(0), left, call.op.left);
      final String prefix = a0 + call.op.padded;
      return prefix + exp(call.a1, c.after(prefix), call.op.right, right);
    case NEGATE:
    case NOT:
    case AWAIT:
    case RETURN:
      final Ast.PrefixCall prefixCall = (Ast.PrefixCall) e;
      final String padded = e.op.padded;
      // "--" would start a comment
      final boolean force =
          e.op == Op.NEGATE && prefixCall.a.op == Op.NEGATE;
      return padded + exp(prefixCall.a, c.after(padded), e.op.right, right,
          force);
    case APPLY:
      final Ast.Apply apply = (Ast.Apply) e;
      final String callee = exp(apply.fn, c.tail(0), left, Op.APPLY.left);
      return callee + group("(", ")", false, apply.args, this::element,
          c.after(callee));
    case INDEX:
      final Ast.Index index = (Ast.Index) e;
      final String indexed = exp(index.exp, c.tail(0), left, Op.INDEX.left);
      return indexed + "["
          + exp(index.index, c.after(indexed + "[").tail(c.tail + 1), 0, 0)
          + "]";
    case MEMBER:
      final Ast.Member member = (Ast.Member) e;
      return exp(member.exp, c.tail(0), left, Op.MEMBER.left) + "."
          + member.name;
    case TERNARY:
      return ternary((Ast.Ternary) e, c, left, right);
    case PIPE:
    case SPREAD_PIPE:
    case REVERSE_PIPE:
    case REACTIVE_PIPE:
    case PIPELINE:
    case BIDIRECTIONAL:
      return sequence(e, c, left, right);
    case PARALLEL_PIPE:
      return parallel((Ast.Parallel) e, c, left);
    case FN:
      return fn((Ast.Fn) e, c, right);
    case MATCH:
      return match((Ast.Match) e, c);
    default:
      throw new AssertionError("unknown expression " + e.op);
    }
  }

  private static StringBuilder literal(StringBuilder b, Ast.Literal literal) {
    if (literal.op == Op.STRING_LITERAL) {
      return Parsers.appendQuoted(b, (String) literal.value);
    }
    return b.append(literal.valueText());
  }

  /** Renders a template string. Interpolations are always on one line. */
  private String template(Ast.Template template, Ctx c) {
    final StringBuilder b =
        new StringBuilder("`").append(template.texts.get(0));
    for (int i = 0; i < template.exps.size(); i++) {
      b.append('{')
          .append(exp(template.exps.get(i), c.flat(), 0, 0))
          .append('}')
          .append(template.texts.get(i + 1));
    }
    return b.append('`').toString();
  }

  private String element(Ast.Exp e, Ctx c) {
    return exp(e, c, 0, 0);
  }

  private String field(Ast.Field field, Ctx c) {
    final String prefix = field.label == null ? "..." : field.label + ": ";
    return prefix + exp(field.exp, c.after(prefix), 0, 0);
  }

  /** Renders a bracketed, comma-separated group: a list, tuple, record or
   * argument list. If the group does not fit on one line, each item goes on
   * its own line. */
  private <E> String group(String open, String close, boolean pad,
      List<E> items, BiFunction<E, Ctx, String> renderer, Ctx c) {
    if (items.isEmpty()) {
      return open + close;
    }
    final Ctx flat = c.flat();
    final StringBuilder b = new StringBuilder(open);
    if (pad) {
      b.append(' ');
    }
    for (int i = 0; i < items.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(renderer.apply(items.get(i), flat));
    }
    if (pad) {
      b.append(' ');
    }
    b.append(close);
    if (c.flat || c.fits(b.toString())) {
      return b.toString();
    }

    final Ctx n = c.nest().tail(1);
    final String indent = indent(n.level);
    b.setLength(0);
    b.append(open);
    for (int i = 0; i < items.size(); i++) {
      b.append('\n').append(indent).append(renderer.apply(items.get(i), n));
      if (i < items.size() - 1 || config.trailingCommas) {
        b.append(',');
      }
    }
    return b.append('\n').append(indent(c.level)).append(close).toString();
  }

  private String ternary(Ast.Ternary t, Ctx c, int left, int right) {
    final String condition =
        exp(t.condition, c.tail(0), left, Op.TERNARY.left);
    if (c.flat) {
      return condition
          + " ? " + exp(t.ifTrue, c, 0, 0)
          + " : " + exp(t.ifFalse, c, Op.TERNARY.right, right);
    }
    final Ctx n = c.nest();
    final String indent = indent(n.level);
    return condition
        + "\n" + indent + "? " + exp(t.ifTrue, n.after("? "), 0, 0)
        + "\n" + indent + ": "
        + exp(t.ifFalse, n.after(": ").tail(c.tail), Op.TERNARY.right, right);
  }

  // -- pipes -----------------------------------------------------------------

  /** Renders a pipe chain, reactive pipe, pipeline literal or bidirectional
   * pipeline literal.
   *
   * <p>A sequence with fewer stages than the break threshold stays on one
   * line even if it is too wide, unless one of its stages is itself broken
   * over several lines. */
  private String sequence(Ast.Exp e, Ctx c, int left, int right) {
    if (c.flat) {
      return sequence(e, c, left, right, false);
    }
    if (!config.breakPipeChains
        || stepCount(e) < config.pipeChainBreakThreshold) {
      final String flat = sequence(e, c.flat(), left, right, false);
      if (flat.indexOf('\n') < 0) {
        return flat;
      }
    }
    return sequence(e, c, left, right, true);
  }

  /** Renders a sequence of stages; if {@code broken}, each stage after the
   * first goes on its own line, indented one level. */
  private String sequence(Ast.Exp e, Ctx c, int left, int right,
      boolean broken) {
    final StringBuilder b = new StringBuilder();
    final List<Step> steps = new ArrayList<>();
    final StringBuilder trailer = new StringBuilder();
    Ast.@Nullable Exp first = null;
    switch (e.op) {
    case REACTIVE_PIPE:
      final Ast.Reactive reactive = (Ast.Reactive) e;
      b.append(reactive.source.name).append(" @> ");
      first = reactive.stages.get(0);
      for (Ast.Exp stage
          : reactive.stages.subList(1, reactive.stages.size())) {
        steps.add(new Step("/> ", stage));
      }
      break;

    case PIPELINE:
      final Ast.Pipeline pipeline = (Ast.Pipeline) e;
      for (Ast.Stage stage : pipeline.stages) {
        final String prefix = stage.isParallel() ? "\\> " : "/> ";
        for (Ast.Exp exp : stage.exps) {
          steps.add(new Step(prefix, exp));
        }
      }
      final Step firstStep = steps.remove(0);
      b.append(firstStep.prefix);
      first = firstStep.exp;
      if (pipeline.signature != null) {
        pipeline.signature.unparse(trailer.append(" :: "));
      }
      decorators(trailer, pipeline.decorators);
      break;

    case BIDIRECTIONAL:
      final Ast.Bidirectional bidirectional = (Ast.Bidirectional) e;
      b.append("</> ");
      first = bidirectional.stages.get(0);
      for (Ast.Exp stage : bidirectional.stages.subList(1,
          bidirectional.stages.size())) {
        steps.add(new Step("</> ", stage));
      }
      decorators(trailer, bidirectional.decorators);
      break;

    default:
      Ast.Exp head = e;
      while (head.op.isPipe()) {
        final Ast.InfixCall call = (Ast.InfixCall) head;
        steps.add(0, new Step(call.op.symbol() + " ", call.a1));
        head = call.a0;
      }
      b.append(exp(head, c.tail(0), left, Op.PIPE.left, isLoose(head)));
    }

    final int lastRight = trailer.length() > 0 ? 1 : right;
    if (first != null) {
      b.append(
          exp(first, c.after(b.toString()), Op.PIPE.right,
              steps.isEmpty() ? lastRight : Op.PIPE.left));
    }
    final Ctx n = c.nest();
    for (int i = 0; i < steps.size(); i++) {
      final Step step = steps.get(i);
      final int r = i == steps.size() - 1 ? lastRight : Op.PIPE.left;
      if (broken) {
        b.append('\n').append(indent(n.level)).append(step.prefix)
            .append(exp(step.exp, n.after(step.prefix), Op.PIPE.right, r));
      } else {
        b.append(' ').append(step.prefix)
            .append(exp(step.exp, c, Op.PIPE.right, r));
      }
    }
    return b.append(trailer).toString();
  }

  /** Returns the number of lines a sequence occupies if broken. */
  private static int stepCount(Ast.Exp e) {
    switch (e.op) {
    case REACTIVE_PIPE:
      return ((Ast.Reactive) e).stages.size() + 1;
    case PIPELINE:
      int n = 0;
      for (Ast.Stage stage : ((Ast.Pipeline) e).stages) {
        n += stage.exps.size();
      }
      return n;
    case BIDIRECTIONAL:
      return ((Ast.Bidirectional) e).stages.size();
    default:
      int count = 1;
      for (Ast.Exp x = e; x.op.isPipe(); x = ((Ast.InfixCall) x).a0) {
        ++count;
      }
      return count;
    }
  }

  /** Returns whether an expression must be parenthesized at the head of a
   * pipe chain or as the input of a parallel pipe. Binding powers alone
   * would allow {@code a + b /> f}, but it reads as if {@code b} were
   * piped. */
  private static boolean isLoose(Ast.Exp e) {
    return e.op.isBinary() || e.op == Op.TERNARY;
  }

  /** Renders a parallel pipe. The input is on the first line, and each
   * branch is on its own line, indented one level. A branch that is a pipe
   * chain is always broken, because a pipe on the same line as a branch
   * would be read as following the whole parallel pipe. */
  private String parallel(Ast.Parallel p, Ctx c, int left) {
    final StringBuilder b = new StringBuilder();
    b.append(
        exp(p.input, c.tail(0), left, Op.PARALLEL_PIPE.left,
            isLoose(p.input) || p.input.op == Op.PARALLEL_PIPE));
    final Ctx n = c.nest();
    final String indent = indent(n.level);
    for (Ast.Exp branch : p.branches) {
      b.append('\n').append(indent).append("\\> ");
      final Ctx bc = n.after("\\> ");
      b.append(branch.op.isPipe()
          ? sequence(branch, bc, 0, 0, true)
          : exp(branch, bc, 0, 0));
    }
    return b.toString();
  }

  // -- functions and match ---------------------------------------------------

  private String fn(Ast.Fn fn, Ctx c, int right) {
    final Ast.Signature signature = signature(fn);
    final boolean inlineTypes = signature == fn.signature;
    final StringBuilder b = new StringBuilder("(");
    for (int i = 0; i < fn.params.size(); i++) {
      final Ast.Param param = fn.params.get(i);
      if (i > 0) {
        b.append(", ");
      }
      b.append(param.name);
      if (inlineTypes && param.type != null) {
        param.type.unparse(b.append(": "));
      }
      if (param.defaultValue != null) {
        b.append(" = ");
        b.append(exp(param.defaultValue, c.after(b.toString()), 0, 0));
      }
    }
    b.append(fn.reverse ? ") <-" : ") ->");
    final String decorators =
        decorators(new StringBuilder(), fn.decorators).toString();

    if (fn.statements.isEmpty() && fn.attachments.isEmpty()) {
      final StringBuilder trailer = new StringBuilder();
      if (signature != null) {
        signature.unparse(trailer.append(" :: "));
      }
      trailer.append(decorators);
      final String head = b.append(' ').toString();
      final Ctx bodyCtx = c.after(head).tail(c.tail + trailer.length());
      return head
          + exp(fn.result, bodyCtx, 0, trailer.length() > 0 ? 1 : right)
          + trailer;
    }

    if (signature != null) {
      signature.unparse(b.append(" :: "));
    }
    final Ctx n = c.nest();
    final String indent = indent(n.level);
    for (String attachment : fn.attachments) {
      b.append('\n').append(indent).append('@').append(attachment);
    }
    for (Ast.Stmt stmt : fn.statements) {
      b.append('\n').append(stmt(stmt, n.level));
    }
    b.append('\n').append(indent)
        .append(
            exp(fn.result, n.tail(decorators.length()), 0,
                decorators.isEmpty() ? 0 : 1));
    return b.append(decorators).toString();
  }

  /** Returns the signature of a function. Parameter types written inline,
   * {@code (x: Int) -> ...}, are converted to a trailing signature if every
   * parameter has one and the function has no signature of its own;
   * otherwise they stay inline. */
  private static Ast.@Nullable Signature signature(Ast.Fn fn) {
    if (fn.signature != null || fn.params.isEmpty()) {
      return fn.signature;
    }
    final List<Ast.Type> types = new ArrayList<>();
    for (Ast.Param param : fn.params) {
      if (param.type == null) {
        return null;
      }
      types.add(param.type);
    }
    return ast.signature(Pos.ZERO, types, null);
  }

  private static StringBuilder decorators(StringBuilder b,
      List<Ast.Decorator> decorators) {
    for (Ast.Decorator decorator : decorators) {
      b.append(" #").append(decorator.name);
      if (!decorator.args.isEmpty()) {
        b.append('(');
        for (int i = 0; i < decorator.args.size(); i++) {
          literal(b.append(i == 0 ? "" : ", "), decorator.args.get(i));
        }
        b.append(')');
      }
    }
    return b;
  }

  private String match(Ast.Match match, Ctx c) {
    final StringBuilder b = new StringBuilder("match ");
    // an open-ended scrutinee, such as a match, would absorb the cases
    b.append(exp(match.exp, c.after("match "), 0, 1));
    final Ctx n = c.nest();
    for (Ast.MatchCase matchCase : match.cases) {
      b.append('\n').append(indent(n.level));
      final StringBuilder line = new StringBuilder("| ");
      if (matchCase.guard != null) {
        line.append("if ");
        line.append(pattern(matchCase.guard, n.after(line.toString())));
      } else if (matchCase.pattern != null) {
        line.append(pattern(matchCase.pattern, n.after(line.toString())));
      }
      if (!matchCase.isDefault()) {
        line.append(" -> ");
      }
      line.append(exp(matchCase.body, n.after(line.toString()), 0, 0));
      b.append(line);
    }
    return b.toString();
  }

  /** Renders the pattern or guard of a match case, which is followed by
   * {@code ->}. */
  private String pattern(Ast.Exp e, Ctx c) {
    // "(a, b) ->" would be read as a function
    return endsWithNames(e) ? parenthesize(e, c) : exp(e, c, 0, 1);
  }

  /** Returns whether an expression ends with a parenthesized list of
   * names. */
  private static boolean endsWithNames(Ast.Exp e) {
    if (e instanceof Ast.Tuple) {
      for (Ast.Exp element : ((Ast.Tuple) e).elements) {
        if (element.op != Op.ID) {
          return false;
        }
      }
      return true;
    } else if (e instanceof Ast.InfixCall) {
      return endsWithNames(((Ast.InfixCall) e).a1);
    } else if (e instanceof Ast.PrefixCall) {
      return endsWithNames(((Ast.PrefixCall) e).a);
    } else if (e instanceof Ast.Ternary) {
      return endsWithNames(((Ast.Ternary) e).ifFalse);
    } else if (e instanceof Ast.Parallel) {
      final List<Ast.Exp> branches = ((Ast.Parallel) e).branches;
      return endsWithNames(branches.get(branches.size() - 1));
    } else if (e instanceof Ast.Reactive) {
      final List<Ast.Exp> stages = ((Ast.Reactive) e).stages;
      return endsWithNames(stages.get(stages.size() - 1));
    } else {
      return false;
    }
  }

  private String indent(int level) {
    return Strings.repeat(" ", level * config.indentSize);
  }

  /** Stage of a sequence, with the operator that introduces it. */
  private static class Step {
    final String prefix;
    final Ast.Exp exp;

    Step(String prefix, Ast.Exp exp) {
      this.prefix = prefix;
      this.exp = exp;
    }
  }

  /** Rendering context.
   *
   * <p>{@code level} is the indentation level of the line on which the
   * text starts, {@code col} is the column (0-based) where it starts, and
   * {@code tail} is the width of the text that will follow it on its last
   * line. If {@code flat}, each expression is rendered in its single-line
   * form, though constructs that are always broken still contain line
   * breaks. */
  private class Ctx {
    final int level;
    final int col;
    final int tail;
    final boolean flat;

    Ctx(int level, int col, int tail, boolean flat) {
      this.level = level;
      this.col = col;
      this.tail = tail;
      this.flat = flat;
    }

    Ctx flat() {
      return flat ? this : new Ctx(level, col, tail, true);
    }

    Ctx tail(int tail) {
      return tail == this.tail ? this : new Ctx(level, col, tail, flat);
    }

    /** Returns a context for a line indented one level deeper. */
    Ctx nest() {
      return new Ctx(level + 1, (level + 1) * config.indentSize, 0, flat);
    }

    /** Returns a context that starts after some text. */
    Ctx after(String text) {
      final int newline = text.lastIndexOf('\n');
      final int col2 = newline < 0
          ? col + text.length()
          : text.length() - newline - 1;
      return new Ctx(level, col2, tail, flat);
    }

    /** Returns whether a piece of text fits on the current line. */
    boolean fits(String s) {
      return s.indexOf('\n') < 0
          && col + s.length() + tail <= config.printWidth;
    }
  }
}

// End Formatter.java
