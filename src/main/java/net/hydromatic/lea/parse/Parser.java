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

import net.hydromatic.lea.ast.Ast;
import net.hydromatic.lea.ast.Op;
import net.hydromatic.lea.ast.Pos;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static net.hydromatic.lea.ast.AstBuilder.ast;

import static com.google.common.collect.Iterables.getLast;

import static java.util.Objects.requireNonNull;

/** Recursive-descent parser for Lea.
 *
 * <p>Binary operators are parsed by precedence climbing over the binding
 * powers in {@link Op}, the same values that the formatter uses to decide
 * where to put parentheses.
 *
 * <p>Line breaks are significant. An operator that begins a new line
 * continues the current expression only if it is indented further than the
 * statement that contains it (or, inside a parallel branch or a match case,
 * further than the {@code \>} or {@code |} that introduced it). Inside
 * parentheses, brackets and braces, line breaks are not significant.
 *
 * <p>A parser is used once. It throws {@link LeaParseException} on the first
 * error and does not attempt to recover. Recursion depth is proportional to
 * the nesting depth of the source, so extremely deep nesting may exhaust the
 * stack. */
public class Parser {
  private final List<Token> tokens;
  private int i = 0;

  /** A token at the start of a line continues the current expression only
   * if its column is greater than this. Zero inside brackets. */
  private int contColumn = 0;

  /** Creates a parser over a list of tokens. Newline tokens are ignored; the
   * parser uses the line numbers of the tokens instead. */
  public Parser(List<Token> tokens) {
    final ImmutableList.Builder<Token> b = ImmutableList.builder();
    for (Token token : tokens) {
      if (token.type != TokenType.NEWLINE) {
        b.add(token);
      }
    }
    this.tokens = b.build();
    if (this.tokens.isEmpty() || getLast(this.tokens).type != TokenType.EOF) {
      throw new IllegalArgumentException("token list must end with EOF");
    }
  }

  /** Creates a parser for a source file.
   *
   * @throws LexerException if the source cannot be tokenized */
  public static Parser create(String file, String source) {
    return new Parser(new Lexer(file, source).tokenize());
  }

  /** Parses a whole file. */
  public Ast.Program parseProgram() {
    final Pos start = peek().pos;
    boolean strict = false;
    if (at(TokenType.HASH)
        && peek(1).type == TokenType.IDENT
        && peek(1).text.equals("strict")
        && peek(1).line() == peek().line()) {
      next();
      next();
      strict = true;
    }
    final List<Ast.Stmt> statements = new ArrayList<>();
    while (!at(TokenType.EOF)) {
      if (strict || !statements.isEmpty()) {
        requireLineBreak();
      }
      statements.add(statement());
    }
    final Pos pos = i == 0 ? start : start.plus(pos());
    return ast.program(pos, strict, statements);
  }

  /** Parses a single expression that is followed by end of input. */
  public Ast.Exp parseExpression() {
    final Ast.Exp e = expression();
    if (!at(TokenType.EOF)) {
      throw unexpected();
    }
    return e;
  }

  /** Returns the position of the most recently consumed token. */
  Pos pos() {
    return tokens.get(Math.max(i - 1, 0)).pos;
  }

  // -- statements ------------------------------------------------------------

  private Ast.Stmt statement() {
    final Token t = peek();
    return withContColumn(t.column(), () -> {
      switch (t.type) {
      case LET:
      case MAYBE:
        return let();
      case AND:
        return binding(TokenType.AND, "'and'");
      case CONTEXT:
        return binding(TokenType.CONTEXT, "'context'");
      case PROVIDE:
        return provide();
      case DECORATOR:
        return binding(TokenType.DECORATOR, "'decorator'");
      case CODEBLOCK_OPEN:
        return codeblock();
      case IDENT:
        if (peek(1).type == TokenType.EQ) {
          final Span s = Span.of(next().pos);
          next(); // '='
          final Ast.Exp e = expression();
          return ast.assign(s.end(e), t.text, e);
        }
        // fall through
      default:
        final Ast.Exp e = expression();
        return ast.expStmt(e.pos, e);
      }
    });
  }

  private Ast.Stmt let() {
    final Token keyword = next();
    final Span s = Span.of(keyword.pos);
    if (at(TokenType.LPAREN)
        || at(TokenType.LBRACKET)
        || at(TokenType.LBRACE)) {
      throw error("Destructuring patterns are not supported in '"
          + keyword.text + "'");
    }
    final String name =
        expect(TokenType.IDENT,
            "Expected variable name after '" + keyword.text + "'").text;
    expect(TokenType.EQ, "Expected '=' after variable name");
    final Ast.Exp e = expression();
    return ast.let(s.end(e), keyword.type == TokenType.MAYBE, name, e);
  }

  /** Parses a statement of the form {@code keyword name = exp}. */
  private Ast.Stmt binding(TokenType keyword, String description) {
    final Span s = Span.of(next().pos);
    final String name =
        expect(TokenType.IDENT, "Expected name after " + description).text;
    expect(TokenType.EQ, "Expected '=' after name");
    final Ast.Exp e = expression();
    final Pos pos = s.end(e);
    switch (keyword) {
    case AND:
      return ast.and(pos, name, e);
    case CONTEXT:
      return ast.contextDef(pos, name, e);
    case DECORATOR:
      return ast.decoratorDef(pos, name, e);
    default:
      throw new AssertionError(keyword);
    }
  }

  /** Parses {@code provide Name value}. */
  private Ast.Stmt provide() {
    final Span s = Span.of(next().pos);
    final String name =
        expect(TokenType.IDENT, "Expected context name after 'provide'").text;
    final Ast.Exp e = expression();
    return ast.provide(s.end(e), name, e);
  }

  private Ast.Stmt codeblock() {
    final Token open = next();
    final Span s = Span.of(open.pos);
    final List<Ast.Stmt> statements = new ArrayList<>();
    while (!at(TokenType.CODEBLOCK_CLOSE)) {
      if (at(TokenType.EOF)) {
        throw error("Expected '{/--}' to close code block");
      }
      requireLineBreak();
      statements.add(statement());
    }
    requireLineBreak();
    next();
    return ast.codeblock(s.end(this), (String) open.value, statements);
  }

  /** Parses the statements of an indented block whose first token is at a
   * given column. The block ends at the first line that is indented less
   * than the block, or at a token on the same line as the end of a
   * statement (such as {@code )} or {@code ,}). */
  private List<Ast.Stmt> indentedStatements(int column) {
    final List<Ast.Stmt> statements = new ArrayList<>();
    for (;;) {
      statements.add(statement());
      if (at(TokenType.EOF) || !startsLine()) {
        return statements;
      }
      final Token t = peek();
      if (t.column() < column) {
        return statements;
      }
      if (t.column() > column) {
        throw error("Unexpected indentation");
      }
      switch (t.type) {
      case RPAREN:
      case RBRACKET:
      case RBRACE:
      case CODEBLOCK_CLOSE:
        return statements;
      default:
        break;
      }
    }
  }

  // -- expressions -----------------------------------------------------------

  private Ast.Exp expression() {
    return expression(false);
  }

  /** Parses an expression, including pipes.
   *
   * @param branch Whether the expression is a branch of a parallel pipe;
   *   a branch continues with a pipe only on a later line indented further
   *   than its {@code \>}, because a pipe on the same line starts a sibling
   *   branch or follows the whole parallel pipe */
  private Ast.Exp expression(boolean branch) {
    if (at(TokenType.IDENT)
        && peek(1).type == TokenType.REACTIVE_PIPE
        && (peek(1).line() == peek().line()
            || peek(1).column() > contColumn)) {
      return reactive();
    }
    Ast.Exp e = ternary();
    for (;;) {
      final Op op;
      switch (peek().type) {
      case PIPE:
        op = Op.PIPE;
        break;
      case SPREAD_PIPE:
        op = Op.SPREAD_PIPE;
        break;
      case REVERSE_PIPE:
        op = Op.REVERSE_PIPE;
        break;
      case PARALLEL_PIPE:
        op = Op.PARALLEL_PIPE;
        break;
      default:
        return e;
      }
      if (branch
          ? !startsLine() || peek().column() <= contColumn
          : !continues()) {
        return e;
      }
      if (op == Op.PARALLEL_PIPE) {
        e = parallel(e);
        continue;
      }
      next();
      final Ast.Exp right = ternary();
      e = ast.infixCall(Span.of(e).end(right), op, e, right);
    }
  }

  /** Parses the branches of a parallel pipe. The current token is the first
   * {@code \>}. Further branches are on the same line or at the same
   * column. */
  private Ast.Exp parallel(Ast.Exp input) {
    final Token first = peek();
    final int column = first.column();
    final List<Ast.Exp> branches = new ArrayList<>();
    for (;;) {
      next(); // '\>'
      branches.add(withContColumn(column, () -> expression(true)));
      if (!at(TokenType.PARALLEL_PIPE)
          || startsLine() && peek().column() != column) {
        break;
      }
    }
    if (branches.size() < 2) {
      throw new LeaParseException(
          "Parallel pipe requires at least two branches", first.pos);
    }
    return ast.parallel(Span.of(input).end(this), input, branches);
  }

  /** Parses {@code source @> stage /> stage}. */
  private Ast.Exp reactive() {
    final Token source = next();
    next(); // '@>'
    final List<Ast.Exp> stages = new ArrayList<>();
    stages.add(ternary());
    while (at(TokenType.PIPE) && continues()) {
      next();
      stages.add(ternary());
    }
    return ast.reactive(Span.of(source.pos).end(this),
        ast.id(source.pos, source.text), stages);
  }

  /** Parses a ternary conditional, or a binary expression. The branch
   * between {@code ?} and {@code :} is a full expression; the branch after
   * {@code :} is another ternary, so that ternaries associate to the
   * right. */
  private Ast.Exp ternary() {
    final Ast.Exp condition = binary(Op.EQ.left);
    if (!at(TokenType.QUESTION) || !continues()) {
      return condition;
    }
    next();
    final Ast.Exp ifTrue = expression();
    expect(TokenType.COLON, "Expected ':' in ternary expression");
    final Ast.Exp ifFalse = ternary();
    return ast.ternary(Span.of(condition).end(ifFalse), condition, ifTrue,
        ifFalse);
  }

  /** Parses binary operators whose left binding power is at least
   * {@code minLeft}. The right operand is parsed with the operator's right
   * binding power, which is one more than its left, so operators of equal
   * precedence group to the left. */
  private Ast.Exp binary(int minLeft) {
    Ast.Exp e = unary();
    for (;;) {
      final Op op = binaryOp(peek().type);
      if (op == null || op.left < minLeft || !continues()) {
        return e;
      }
      next();
      final Ast.Exp right = binary(op.right);
      e = ast.infixCall(Span.of(e).end(right), op, e, right);
    }
  }

  private static @Nullable Op binaryOp(TokenType type) {
    switch (type) {
    case EQ_EQ:
      return Op.EQ;
    case NOT_EQ:
      return Op.NE;
    case LT:
      return Op.LT;
    case LE:
      return Op.LE;
    case GT:
      return Op.GT;
    case GE:
      return Op.GE;
    case PLUS:
      return Op.PLUS;
    case MINUS:
      return Op.MINUS;
    case CONCAT:
      return Op.CONCAT;
    case STAR:
      return Op.TIMES;
    case SLASH:
      return Op.DIVIDE;
    case PERCENT:
      return Op.MOD;
    default:
      return null;
    }
  }

  private Ast.Exp unary() {
    final Op op;
    switch (peek().type) {
    case MINUS:
      op = Op.NEGATE;
      break;
    case BANG:
      op = Op.NOT;
      break;
    case AWAIT:
      op = Op.AWAIT;
      break;
    case RETURN:
      final Span s = Span.of(next().pos);
      final Ast.Exp value = expression();
      return ast.prefixCall(s.end(value), Op.RETURN, value);
    default:
      return postfix(primary());
    }
    final Span s = Span.of(next().pos);
    final Ast.Exp a = unary();
    return ast.prefixCall(s.end(a), op, a);
  }

  /** Parses calls, index accesses and member accesses that follow an
   * expression on the same line. */
  private Ast.Exp postfix(Ast.Exp e) {
    for (;;) {
      if (startsLine()) {
        return e;
      }
      switch (peek().type) {
      case LPAREN:
        next();
        final List<Ast.Exp> args =
            commaList(TokenType.RPAREN, this::expression,
                "Expected ')' after arguments");
        e = ast.apply(Span.of(e).end(this), e, args);
        break;
      case LBRACKET:
        next();
        final Ast.Exp index = withContColumn(0, this::expression);
        expect(TokenType.RBRACKET, "Expected ']' after index");
        e = ast.index(Span.of(e).end(this), e, index);
        break;
      case DOT:
        next();
        final Token name =
            expect(TokenType.IDENT, "Expected property name after '.'");
        e = ast.member(Span.of(e).end(this), e, name.text);
        break;
      default:
        return e;
      }
    }
  }

  private Ast.Exp primary() {
    final Token t = peek();
    switch (t.type) {
    case NUMBER:
      next();
      return ast.numberLiteral(t.pos, (BigDecimal) requireNonNull(t.value));
    case STRING:
      next();
      return ast.stringLiteral(t.pos, (String) requireNonNull(t.value));
    case TEMPLATE_STRING:
      next();
      return template(t);
    case TRUE:
    case FALSE:
      next();
      return ast.boolLiteral(t.pos, t.type == TokenType.TRUE);
    case UNDERSCORE:
    case INPUT:
      next();
      return ast.placeholder(t.pos);
    case IDENT:
      next();
      return ast.id(t.pos, t.text);
    case LPAREN:
      return looksLikeFunction() ? fn() : parenthesized();
    case LBRACKET:
      return list();
    case LBRACE:
      return record();
    case PIPE:
      return pipeline();
    case BIDIRECTIONAL:
      return bidirectional();
    case MATCH:
      return match();
    case USE:
      next();
      final Token path =
          expect(TokenType.STRING, "Expected module path string after 'use'");
      return ast.use(t.pos.plus(path.pos), (String) requireNonNull(path.value));
    default:
      throw unexpected();
    }
  }

  /** Converts a template string token into a template, parsing each
   * interpolation with a nested parser. */
  private Ast.Exp template(Token t) {
    final Token.TemplateParts parts =
        (Token.TemplateParts) requireNonNull(t.value);
    final List<Ast.Exp> exps = new ArrayList<>();
    for (List<Token> interpolation : parts.interpolations) {
      exps.add(new Parser(interpolation).parseExpression());
    }
    return ast.template(t.pos, parts.texts, exps);
  }

  /** Parses an expression in parentheses, or a tuple. */
  private Ast.Exp parenthesized() {
    final Span s = Span.of(next().pos);
    if (at(TokenType.RPAREN)) {
      next();
      return ast.tuple(s.end(this), ImmutableList.of());
    }
    return withContColumn(0, () -> {
      final Ast.Exp e = expression();
      if (!at(TokenType.COMMA)) {
        expect(TokenType.RPAREN, "Expected ')'");
        return e;
      }
      final List<Ast.Exp> elements = new ArrayList<>();
      elements.add(e);
      while (at(TokenType.COMMA)) {
        next();
        if (at(TokenType.RPAREN)) {
          break;
        }
        elements.add(expression());
      }
      expect(TokenType.RPAREN, "Expected ')' after tuple");
      return elements.size() == 1
          ? e
          : ast.tuple(s.end(this), elements);
    });
  }

  private Ast.Exp list() {
    final Span s = Span.of(next().pos);
    final List<Ast.Exp> elements =
        commaList(TokenType.RBRACKET, () -> {
          if (at(TokenType.ELLIPSIS)) {
            final Span s2 = Span.of(next().pos);
            final Ast.Exp e = expression();
            return ast.spread(s2.end(e), e);
          }
          return expression();
        }, "Expected ']' after list");
    return ast.list(s.end(this), elements);
  }

  private Ast.Exp record() {
    final Span s = Span.of(next().pos);
    final List<Ast.Field> fields =
        commaList(TokenType.RBRACE, this::field, "Expected '}' after record");
    return ast.record(s.end(this), fields);
  }

  private Ast.Field field() {
    final Span s = Span.of(peek().pos);
    if (at(TokenType.ELLIPSIS)) {
      next();
      final Ast.Exp e = expression();
      return ast.field(s.end(e), null, e);
    }
    final String label = expect(TokenType.IDENT, "Expected field name").text;
    expect(TokenType.COLON, "Expected ':' after field name");
    final Ast.Exp e = expression();
    return ast.field(s.end(e), label, e);
  }

  /** Parses a match expression. The first {@code |} fixes the column of the
   * cases; each further case is at that column or on the same line. */
  private Ast.Exp match() {
    final Span s = Span.of(next().pos);
    final Ast.Exp e = expression();
    if (!at(TokenType.BAR)) {
      throw error("Expected '|' to start a match case");
    }
    if (startsLine() && peek().column() <= contColumn) {
      throw error("Match case must be indented");
    }
    final int column = peek().column();
    final List<Ast.MatchCase> cases = new ArrayList<>();
    do {
      cases.add(matchCase());
    } while (at(TokenType.BAR)
        && (!startsLine() || peek().column() == column));
    return ast.match(s.end(this), e, cases);
  }

  private Ast.MatchCase matchCase() {
    final Token bar = next();
    final Span s = Span.of(bar.pos);
    return withContColumn(bar.column(), () -> {
      if (at(TokenType.IF)) {
        next();
        final Ast.Exp guard = expression();
        expect(TokenType.ARROW, "Expected '->' after guard");
        final Ast.Exp body = expression();
        return ast.guardCase(s.end(body), guard, body);
      }
      final Ast.Exp e = expression();
      if (!at(TokenType.ARROW)) {
        return ast.defaultCase(s.end(e), e);
      }
      next();
      final Ast.Exp body = expression();
      return ast.patternCase(s.end(body), e, body);
    });
  }

  /** Parses a pipeline literal, {@code /> f /> g}. Consecutive {@code \>}
   * branches form one parallel stage. */
  private Ast.Exp pipeline() {
    final Span s = Span.of(next().pos);
    final List<Ast.Stage> stages = new ArrayList<>();
    final Ast.Exp first = ternary();
    stages.add(ast.stage(first.pos, first));
    for (;;) {
      if (at(TokenType.PIPE) && continues()) {
        next();
        final Ast.Exp e = ternary();
        stages.add(ast.stage(e.pos, e));
      } else if (at(TokenType.PARALLEL_PIPE) && continues()) {
        final Span s2 = Span.of(peek().pos);
        final List<Ast.Exp> branches = new ArrayList<>();
        while (at(TokenType.PARALLEL_PIPE) && continues()) {
          next();
          branches.add(ternary());
        }
        stages.add(ast.parallelStage(s2.end(this), branches));
      } else {
        break;
      }
    }
    Ast.PipeSignature signature = null;
    if (at(TokenType.DOUBLE_COLON) && continues()) {
      final Span s2 = Span.of(next().pos);
      final Ast.Type input = type();
      Ast.Type output = null;
      if (at(TokenType.PIPE)) {
        next();
        output = type();
      }
      signature = ast.pipeSignature(s2.end(this), input, output);
    }
    final List<Ast.Decorator> decorators = decorators();
    return ast.pipeline(s.end(this), stages, signature, decorators);
  }

  /** Parses a bidirectional pipeline literal, {@code </> f </> g}. */
  private Ast.Exp bidirectional() {
    final Span s = Span.of(next().pos);
    final List<Ast.Exp> stages = new ArrayList<>();
    stages.add(ternary());
    while (at(TokenType.BIDIRECTIONAL) && continues()) {
      next();
      stages.add(ternary());
    }
    final List<Ast.Decorator> decorators = decorators();
    return ast.bidirectional(s.end(this), stages, decorators);
  }

  // -- functions -------------------------------------------------------------

  /** Returns whether the parenthesis at the current position starts the
   * parameter list of a function: a list of names, each with an optional
   * type annotation and default value, followed by {@code ->} or
   * {@code <-}. Does not consume any tokens. */
  private boolean looksLikeFunction() {
    int k = i + 1;
    if (type(k) == TokenType.RPAREN) {
      return isArrow(type(k + 1));
    }
    for (;;) {
      if (type(k) != TokenType.IDENT && type(k) != TokenType.UNDERSCORE) {
        return false;
      }
      ++k;
      if (type(k) == TokenType.COLON) {
        k = skipType(k + 1);
        if (k < 0) {
          return false;
        }
      }
      if (type(k) == TokenType.EQ) {
        k = skipDefault(k + 1);
        if (k < 0) {
          return false;
        }
      }
      if (type(k) == TokenType.COMMA) {
        ++k;
        if (type(k) == TokenType.RPAREN) {
          return isArrow(type(k + 1));
        }
        continue;
      }
      return type(k) == TokenType.RPAREN && isArrow(type(k + 1));
    }
  }

  private static boolean isArrow(TokenType type) {
    return type == TokenType.ARROW || type == TokenType.REVERSE_ARROW;
  }

  /** Skips a type annotation starting at token {@code k}; returns the index
   * of the token after it, or -1. */
  private int skipType(int k) {
    if (type(k) == TokenType.QUESTION) {
      ++k;
    }
    switch (type(k)) {
    case IDENT:
      return k + 1;
    case LPAREN:
    case LBRACKET:
      int depth = 0;
      do {
        switch (type(k)) {
        case LPAREN:
        case LBRACKET:
          ++depth;
          break;
        case RPAREN:
        case RBRACKET:
          --depth;
          break;
        case EOF:
          return -1;
        default:
          break;
        }
        ++k;
      } while (depth > 0);
      return k;
    default:
      return -1;
    }
  }

  /** Skips a default value starting at token {@code k}, up to the next comma
   * or closing parenthesis outside brackets; returns the index of that
   * token, or -1. */
  private int skipDefault(int k) {
    int depth = 0;
    for (;; ++k) {
      switch (type(k)) {
      case LPAREN:
      case LBRACKET:
      case LBRACE:
        ++depth;
        break;
      case RPAREN:
      case RBRACKET:
      case RBRACE:
        if (depth == 0) {
          return type(k) == TokenType.RPAREN ? k : -1;
        }
        --depth;
        break;
      case COMMA:
        if (depth == 0) {
          return k;
        }
        break;
      case EOF:
        return -1;
      default:
        break;
      }
    }
  }

  /** Parses a function literal. The body is an expression on the same line
   * as the arrow, a block in braces, or an indented block on the following
   * lines. */
  private Ast.Exp fn() {
    final Span s = Span.of(next().pos);
    final List<Ast.Param> params =
        commaList(TokenType.RPAREN, this::param,
            "Expected ')' after parameters");
    final boolean reverse = next().type == TokenType.REVERSE_ARROW;
    Ast.Signature signature = null;
    if (at(TokenType.DOUBLE_COLON) && !startsLine()) {
      signature = signature();
    }
    final List<String> attachments = new ArrayList<>();
    final List<Ast.Stmt> statements = new ArrayList<>();
    final Ast.Exp result;
    if (at(TokenType.LBRACE) && !startsLine() && isBlock()) {
      next();
      while (!at(TokenType.RBRACE)) {
        if (at(TokenType.EOF)) {
          throw error("Expected '}' after block");
        }
        if (!statements.isEmpty()) {
          requireLineBreak();
        }
        statements.add(statement());
      }
      next();
      result = blockResult(statements);
    } else if (startsLine()) {
      if (at(TokenType.EOF) || peek().column() <= contColumn) {
        throw error("Expected function body");
      }
      final int column = peek().column();
      while (at(TokenType.AT)) {
        next();
        attachments.add(
            expect(TokenType.IDENT, "Expected context name after '@'").text);
        if (!startsLine()) {
          throw unexpected();
        }
      }
      if (at(TokenType.EOF)) {
        throw error("Expected function body");
      }
      statements.addAll(indentedStatements(column));
      result = blockResult(statements);
    } else {
      result = expression();
      if (signature == null
          && at(TokenType.DOUBLE_COLON)
          && continues()) {
        signature = signature();
      }
    }
    final List<Ast.Decorator> decorators = decorators();
    return ast.fn(s.end(this), params, reverse, signature, attachments,
        statements, result, decorators);
  }

  /** Returns whether the brace at the current position, which follows a
   * function arrow, starts a block rather than a record. */
  private boolean isBlock() {
    switch (peek(1).type) {
    case RBRACE:
    case ELLIPSIS:
      return false;
    case IDENT:
      return peek(2).type != TokenType.COLON;
    default:
      return true;
    }
  }

  /** Removes the last statement of a block, which must be an expression,
   * and returns it. */
  private Ast.Exp blockResult(List<Ast.Stmt> statements) {
    final Ast.Stmt last = statements.remove(statements.size() - 1);
    if (!(last instanceof Ast.ExpStmt)) {
      throw new LeaParseException(
          "Function body must end with an expression", last.pos);
    }
    return ((Ast.ExpStmt) last).exp;
  }

  private Ast.Param param() {
    final Token name = peek();
    if (name.type != TokenType.IDENT && name.type != TokenType.UNDERSCORE) {
      throw error("Expected parameter name");
    }
    next();
    final Span s = Span.of(name.pos);
    Ast.Type type = null;
    if (at(TokenType.COLON)) {
      next();
      type = type();
    }
    Ast.Exp defaultValue = null;
    if (at(TokenType.EQ)) {
      next();
      defaultValue = expression();
    }
    return ast.param(s.end(this), name.text, type, defaultValue);
  }

  /** Parses a signature, {@code :: Int :> Int}. Several parameter types are
   * enclosed in parentheses. */
  private Ast.Signature signature() {
    final Span s = Span.of(next().pos);
    final List<Ast.Type> paramTypes;
    if (at(TokenType.LPAREN)) {
      next();
      paramTypes =
          commaList(TokenType.RPAREN, this::type,
              "Expected ')' after parameter types");
    } else {
      paramTypes = ImmutableList.of(type());
    }
    Ast.Type returnType = null;
    if (at(TokenType.RETURN_TYPE)) {
      next();
      returnType = type();
    }
    return ast.signature(s.end(this), paramTypes, returnType);
  }

  private Ast.Type type() {
    final Span s = Span.of(peek().pos);
    boolean optional = false;
    if (at(TokenType.QUESTION)) {
      next();
      optional = true;
    }
    switch (peek().type) {
    case IDENT:
      final Token name = next();
      return ast.namedType(s.end(this), name.text, optional);
    case LPAREN:
      next();
      final List<Ast.Type> components =
          commaList(TokenType.RPAREN, this::type,
              "Expected ')' after tuple type");
      return ast.tupleType(s.end(this), components, optional);
    case LBRACKET:
      next();
      final Ast.Type element = type();
      expect(TokenType.RBRACKET, "Expected ']' after list type");
      return ast.listType(s.end(this), element, optional);
    default:
      throw error("Expected type");
    }
  }

  /** Parses zero or more decorators, {@code #memo #retry(3)}. */
  private List<Ast.Decorator> decorators() {
    final List<Ast.Decorator> decorators = new ArrayList<>();
    while (at(TokenType.HASH) && continues()) {
      final Span s = Span.of(next().pos);
      final String name =
          expect(TokenType.IDENT, "Expected decorator name after '#'").text;
      List<Ast.Literal> args = ImmutableList.of();
      if (at(TokenType.LPAREN) && !startsLine()) {
        next();
        args =
            commaList(TokenType.RPAREN, this::decoratorArg,
                "Expected ')' after decorator arguments");
      }
      decorators.add(ast.decorator(s.end(this), name, args));
    }
    return decorators;
  }

  private Ast.Literal decoratorArg() {
    final Token t = peek();
    switch (t.type) {
    case NUMBER:
      next();
      return ast.numberLiteral(t.pos, (BigDecimal) requireNonNull(t.value));
    case MINUS:
      if (peek(1).type == TokenType.NUMBER) {
        next();
        final Token number = next();
        return ast.numberLiteral(t.pos.plus(number.pos),
            ((BigDecimal) requireNonNull(number.value)).negate());
      }
      break;
    case STRING:
      next();
      return ast.stringLiteral(t.pos, (String) requireNonNull(t.value));
    case TRUE:
    case FALSE:
      next();
      return ast.boolLiteral(t.pos, t.type == TokenType.TRUE);
    default:
      break;
    }
    throw error("Decorator arguments must be literals");
  }

  // -- helpers ---------------------------------------------------------------

  /** Parses a comma-separated list of elements followed by a closing token,
   * allowing a trailing comma. The opening token has been consumed. Line
   * breaks are not significant inside the list. */
  private <T> List<T> commaList(TokenType close, Supplier<T> element,
      String message) {
    return withContColumn(0, () -> {
      final List<T> list = new ArrayList<>();
      while (!at(close)) {
        list.add(element.get());
        if (!at(TokenType.COMMA)) {
          break;
        }
        next();
      }
      expect(close, message);
      return list;
    });
  }

  /** Calls a parser method with a given continuation column, restoring the
   * previous column afterwards. */
  private <T> T withContColumn(int column, Supplier<T> supplier) {
    final int save = contColumn;
    contColumn = column;
    try {
      return supplier.get();
    } finally {
      contColumn = save;
    }
  }

  private Token peek() {
    return tokens.get(i);
  }

  private Token peek(int k) {
    return tokens.get(Math.min(i + k, tokens.size() - 1));
  }

  private TokenType type(int k) {
    return tokens.get(Math.min(k, tokens.size() - 1)).type;
  }

  /** Consumes the current token and returns it. Never moves beyond EOF. */
  private Token next() {
    final Token t = tokens.get(i);
    if (t.type != TokenType.EOF) {
      ++i;
    }
    return t;
  }

  private boolean at(TokenType type) {
    return peek().type == type;
  }

  private Token expect(TokenType type, String message) {
    if (!at(type)) {
      throw error(message);
    }
    return next();
  }

  /** Returns whether the current token is the first on its line. */
  private boolean startsLine() {
    return i == 0 || peek().line() > tokens.get(i - 1).pos.endLine;
  }

  /** Returns whether the current token continues the current expression:
   * it is on the same line as the previous token, or it is on a later line
   * and indented further than the continuation column. */
  private boolean continues() {
    return !startsLine() || peek().column() > contColumn;
  }

  private void requireLineBreak() {
    if (!startsLine()) {
      throw unexpected();
    }
  }

  private LeaParseException error(String message) {
    return new LeaParseException(message, peek().pos);
  }

  private LeaParseException unexpected() {
    final Token t = peek();
    return t.type == TokenType.EOF
        ? error("Unexpected end of input")
        : error("Unexpected token '" + t.text + "'");
  }
}

// End Parser.java
