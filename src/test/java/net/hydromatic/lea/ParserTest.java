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

import org.junit.jupiter.api.Test;

import static net.hydromatic.lea.Ml.ml;
import static net.hydromatic.lea.Ml.mlE;

/** Tests the parser. Each tree is checked via its structural string. */
public class ParserTest {

  @Test void testPrecedence() {
    ml("1 + 2 * 3").assertParse("(+ 1 (* 2 3))");
    ml("(1 + 2) * 3").assertParse("(* (+ 1 2) 3)");
    ml("a - b - c").assertParse("(- (- a b) c)");
    ml("a == b < c").assertParse("(== a (< b c))");
    ml("a ++ b + c").assertParse("(+ (++ a b) c)");
    ml("x % 2 == 0").assertParse("(== (% x 2) 0)");
    ml("a != b").assertParse("(!= a b)");
    ml("a <= b").assertParse("(<= a b)");
    ml("a / b >= c").assertParse("(>= (/ a b) c)");
  }

  @Test void testUnary() {
    ml("-x * y").assertParse("(* (- x) y)");
    ml("!a == b").assertParse("(== (! a) b)");
    ml("a - -b").assertParse("(- a (- b))");
    ml("await f(x)").assertParse("(await (call f x))");
    ml("return x + 1").assertParse("(return (+ x 1))");
  }

  @Test void testPostfix() {
    ml("f(1)(2)").assertParse("(call (call f 1) 2)");
    ml("f()").assertParse("(call f)");
    ml("xs[0].name").assertParse("(. (index xs 0) name)");
    ml("a.b.c(1, 2,)").assertParse("(call (. (. a b) c) 1 2)");
  }

  /** A call's arguments must start on the same line as the callee; otherwise
   * the parenthesis starts a new statement. */
  @Test void testPostfixOnNextLine() {
    ml("f\n(1)").assertParseProgram("(program f 1)");
  }

  @Test void testLiterals() {
    ml("1.50").assertParse("1.5");
    ml("2.0").assertParse("2");
    ml("0.000").assertParse("0");
    ml("true").assertParse("true");
    ml("false").assertParse("false");
    ml("\"a\\tb\"").assertParse("\"a\\tb\"");
    ml("_").assertParse("input");
    ml("input").assertParse("input");
  }

  @Test void testTemplate() {
    ml("`Hello {name}!`").assertParse("(template \"Hello \" name \"!\")");
    ml("`{a + 1}`").assertParse("(template \"\" (+ a 1) \"\")");
    ml("`plain`").assertParse("(template \"plain\")");
    ml("`{f(\"}\")}`").assertParse("(template \"\" (call f \"}\") \"\")");
  }

  @Test void testCollections() {
    ml("[1, 2, ...rest]").assertParse("(list 1 2 (... rest))");
    ml("[]").assertParse("(list)");
    ml("(1, \"a\")").assertParse("(tuple 1 \"a\")");
    ml("()").assertParse("(tuple)");
    ml("(a,)").assertParse("a");
    ml("{ name: \"x\", ...base }")
        .assertParse("(record (name \"x\") (... base))");
    ml("{}").assertParse("(record)");
  }

  @Test void testTernary() {
    ml("a ? b : c").assertParse("(? a b c)");
    ml("a ? b : c ? d : e").assertParse("(? a b (? c d e))");
    ml("x > 0 ? x : -x").assertParse("(? (> x 0) x (- x))");
  }

  @Test void testPipes() {
    ml("a /> f /> g").assertParse("(/> (/> a f) g)");
    ml("a + 1 /> f").assertParse("(/> (+ a 1) f)");
    ml("xs />>> f").assertParse("(/>>> xs f)");
    ml("x </ f").assertParse("(</ x f)");
    ml("xs /> map((x) -> x * 2)")
        .assertParse("(/> xs (call map (fn (x) (* x 2))))");
  }

  /** Pipes bind more loosely than the ternary operator. */
  @Test void testPipeAndTernary() {
    ml("c ? a : b /> f").assertParse("(/> (? c a b) f)");
    ml("c ? a /> f : b").assertParse("(? c (/> a f) b)");
  }

  @Test void testParallel() {
    ml("xs\n"
        + "  \\> f\n"
        + "  \\> g")
        .assertParse("(\\> xs f g)");
    ml("xs \\> f \\> g").assertParse("(\\> xs f g)");
    ml("xs\n"
        + "  \\> f\n"
        + "  \\> g\n"
        + "  /> combine")
        .assertParse("(/> (\\> xs f g) combine)");
    ml("xs\n"
        + "  \\> f\n"
        + "    /> h\n"
        + "  \\> g")
        .assertParse("(\\> xs (/> f h) g)");
  }

  @Test void testParallelInLet() {
    final String ml = "let result = data\n"
        + "  \\> processA\n"
        + "  \\> processB\n"
        + "  /> combine";
    ml(ml).assertParseProgram(
        "(program (let result (/> (\\> data processA processB) combine)))");
  }

  @Test void testReactive() {
    ml("src @> double /> print").assertParse("(@> src double print)");
    ml("src @> double").assertParse("(@> src double)");
  }

  @Test void testPipelineLiteral() {
    ml("/> double /> inc").assertParse("(pipeline double inc)");
    ml("/> split \\> left \\> right /> join")
        .assertParse("(pipeline split (\\> left right) join)");
    ml("/> double :: Int /> Int")
        .assertParse("(pipeline double :: Int /> Int)");
    ml("/> double :: [Int] #logged")
        .assertParse("(pipeline double :: [Int] #logged)");
    ml("</> encode </> compress").assertParse("(</> encode compress)");
    ml("</> encode #trace").assertParse("(</> encode #trace)");
  }

  @Test void testUse() {
    ml("use \"math\"").assertParse("(use \"math\")");
    ml("let m = use \"./lib\"")
        .assertParseProgram("(program (let m (use \"./lib\")))");
  }

  @Test void testFunction() {
    ml("(x) -> x + 1").assertParse("(fn (x) (+ x 1))");
    ml("(x, y = 10) -> x + y").assertParse("(fn (x y=10) (+ x y))");
    ml("() -> 42").assertParse("(fn () 42)");
    ml("(x) <- x").assertParse("(fn<- (x) x)");
    ml("(_) -> 0").assertParse("(fn (_) 0)");
    ml("(a: Int, b: ?[Int]) -> a").assertParse("(fn (a:Int b:?[Int]) a)");
    ml("(x: Int, y) -> x").assertParse("(fn (x:Int y) x)");
    ml("(x) -> (y) -> x + y").assertParse("(fn (x) (fn (y) (+ x y)))");
  }

  @Test void testFunctionSignatureAndDecorators() {
    ml("(a, b) -> a + b :: (Int, Int) :> Int")
        .assertParse("(fn (a b) :: (Int, Int) :> Int (+ a b))");
    ml("(x) -> x :: Int").assertParse("(fn (x) :: Int x)");
    ml("(x) -> x #memo #retry(3, \"a\")")
        .assertParse("(fn (x) x #memo #retry(3, \"a\"))");
    ml("(x) -> x #retry(-1, true)")
        .assertParse("(fn (x) x #retry(-1, true))");
  }

  @Test void testFunctionBlock() {
    final String ml = "let f = (x) ->\n"
        + "  let y = x * 2\n"
        + "  y + 1";
    ml(ml).assertParseProgram(
        "(program (let f (fn (x) (let y (* x 2)) (+ y 1))))");

    final String ml2 = "let f = (x) -> {\n"
        + "  let y = x\n"
        + "  y\n"
        + "}";
    ml(ml2).assertParseProgram("(program (let f (fn (x) (let y x) y)))");

    final String ml3 = "let f = (x) ->\n"
        + "  @Logger\n"
        + "  @Theme\n"
        + "  x";
    ml(ml3).assertParseProgram(
        "(program (let f (fn (x) @Logger @Theme x)))");

    final String ml4 = "let f = (x) -> :: Int :> Int\n"
        + "  let y = x\n"
        + "  y #memo";
    ml(ml4).assertParseProgram(
        "(program (let f (fn (x) :: Int :> Int (let y x) y #memo)))");
  }

  /** A brace after the arrow starts a record if it is empty or its first
   * item is a field or a spread. */
  @Test void testFunctionReturningRecord() {
    ml("(x) -> { a: x }").assertParse("(fn (x) (record (a x)))");
    ml("(x) -> {}").assertParse("(fn (x) (record))");
    ml("(x) -> { ...x }").assertParse("(fn (x) (record (... x)))");
  }

  @Test void testMatch() {
    final String ml = "match x\n"
        + "  | 0 -> \"zero\"\n"
        + "  | if x > 100 -> \"big\"\n"
        + "  | \"other\"";
    ml(ml).assertParse("(match x (case 0 \"zero\") (if (> x 100) \"big\") "
        + "(default \"other\"))");

    final String ml2 = "let describe = (x) -> match x\n"
        + "  | 0 -> \"zero\"\n"
        + "  | if x > 100 -> \"big\"\n"
        + "  | \"other\"";
    ml(ml2).assertParseProgram("(program (let describe (fn (x) (match x "
        + "(case 0 \"zero\") (if (> x 100) \"big\") (default \"other\")))))");

    ml("match x | 1 -> 2 | 3").assertParse("(match x (case 1 2) (default 3))");
  }

  /** A case's body ends at the next case, even if the body is a nested
   * match whose cases are indented further. */
  @Test void testNestedMatch() {
    final String ml = "match x\n"
        + "  | 0 -> match y\n"
        + "    | 1 -> a\n"
        + "    | b\n"
        + "  | c";
    ml(ml).assertParse(
        "(match x (case 0 (match y (case 1 a) (default b))) (default c))");
  }

  /** A parenthesized match or block function may be the scrutinee of a
   * match; the outer cases follow the closing parenthesis. */
  @Test void testMatchScrutinee() {
    ml("match (match a | 1 -> 2) | 3 -> 4")
        .assertParse("(match (match a (case 1 2)) (case 3 4))");
    final String ml = "match (match a\n"
        + "  | 1 -> 2)\n"
        + "  | 3 -> 4";
    ml(ml).assertParse("(match (match a (case 1 2)) (case 3 4))");
    final String ml2 = "let x = match ((p) ->\n"
        + "  let q = 1\n"
        + "  q)\n"
        + "  | 1 -> 2";
    ml(ml2).assertParseProgram(
        "(program (let x (match (fn (p) (let q 1) q) (case 1 2))))");
  }

  @Test void testStatements() {
    ml("let x = 1\nmaybe y = 2\ny = 3\nand z = 4")
        .assertParseProgram("(program (let x 1) (maybe y 2) (= y 3) "
            + "(and z 4))");
    ml("context Theme = \"dark\"\nprovide Theme \"light\"")
        .assertParseProgram("(program (context Theme \"dark\") "
            + "(provide Theme \"light\"))");
    ml("decorator logged = (f) -> f")
        .assertParseProgram("(program (decorator logged (fn (f) f)))");
    ml("print(1)\nprint(2)")
        .assertParseProgram("(program (call print 1) (call print 2))");
    ml("").assertParseProgram("(program)");
    ml("-- just a comment\n").assertParseProgram("(program)");
  }

  @Test void testStrict() {
    ml("#strict\nlet x = 1").assertParseProgram("(program #strict (let x 1))");
    ml("#strict").assertParseProgram("(program #strict)");
  }

  @Test void testCodeblock() {
    ml("{-- Setup --}\nlet x = 1\n{/--}")
        .assertParseProgram("(program (codeblock \"Setup\" (let x 1)))");
    ml("{-- --}\nx\n{/--}").assertParseProgram("(program (codeblock x))");
    ml("{-- a --}\n{-- b --}\nx\n{/--}\n{/--}")
        .assertParseProgram("(program (codeblock \"a\" (codeblock \"b\" x)))");
  }

  /** A line that is indented more than the statement continues it; a line
   * at the same column starts a new statement. */
  @Test void testContinuation() {
    ml("let x = a\n  /> f").assertParseProgram("(program (let x (/> a f)))");
    ml("x\n/> f").assertParseProgram("(program x (pipeline f))");
    ml("let x = 1 +\n  2").assertParseProgram("(program (let x (+ 1 2)))");
    ml("let xs = [\n1,\n2\n]")
        .assertParseProgram("(program (let xs (list 1 2)))");
  }

  @Test void testErrors() {
    mlE("let $($a, b) = pair")
        .assertParseThrows("Destructuring patterns are not supported in "
            + "'let'");
    mlE("maybe $[$a] = xs")
        .assertParseThrows("Destructuring patterns are not supported in "
            + "'maybe'");
    mlE("f(1, 2$$").assertParseThrows("Expected ')' after arguments");
    ml("x ? 1").assertParseThrows("Expected ':' in ternary expression");
    ml("match x").assertParseThrows("Expected '|' to start a match case");
    ml("match x\n| 1 -> 2").assertParseThrows("Match case must be indented");
    mlE("xs $\\>$ f")
        .assertParseThrows("Parallel pipe requires at least two branches");
    ml("1 +").assertParseThrows("Unexpected end of input");
    mlE("let x = $)$").assertParseThrows("Unexpected token ')'");
    mlE("let x = 1 $let$ y = 2").assertParseThrows("Unexpected token 'let'");
    ml("let x 1").assertParseThrows("Expected '=' after variable name");
    ml("xs[0").assertParseThrows("Expected ']' after index");
    ml("a.1").assertParseThrows("Expected property name after '.'");
    ml("use x").assertParseThrows("Expected module path string after 'use'");
    ml("{ 1 }").assertParseThrows("Expected field name");
  }

  @Test void testFunctionErrors() {
    ml("let f = (x) ->\n").assertParseThrows("Expected function body");
    ml("let f = (x) ->\nx").assertParseThrows("Expected function body");
    mlE("let f = (x) ->\n  $let y = x$")
        .assertParseThrows("Function body must end with an expression");
    mlE("let f = (x) ->\n  let y = x\n    $y$")
        .assertParseThrows("Unexpected indentation");
    mlE("(x) -> x #retry($n$)")
        .assertParseThrows("Decorator arguments must be literals");
    ml("let f = (x) -> x :: ").assertParseThrows("Expected type");
    ml("(x) -> {\n  let y = x\n  y")
        .assertParseThrows("Expected '}' after block");
    ml("{-- a --}\nx")
        .assertParseThrows("Expected '{/--}' to close code block");
  }
}

// End ParserTest.java
