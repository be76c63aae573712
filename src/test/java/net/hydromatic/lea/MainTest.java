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

import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;

import static java.nio.charset.StandardCharsets.UTF_8;

/** Tests the command-line formatter, {@link Main}. */
public class MainTest {
  @TempDir Path dir;

  private final StringWriter out = new StringWriter();
  private final StringWriter err = new StringWriter();

  private int run(Object... args) {
    out.getBuffer().setLength(0);
    err.getBuffer().setLength(0);
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    for (Object arg : args) {
      b.add(arg.toString());
    }
    return new Main(b.build(), out, err).run();
  }

  private Path file(String name, String content) throws IOException {
    final Path path = dir.resolve(name);
    Files.createDirectories(path.getParent());
    MoreFiles.asCharSink(path, UTF_8).write(content);
    return path;
  }

  private static String read(Path path) throws IOException {
    return MoreFiles.asCharSource(path, UTF_8).read();
  }

  @Test void testFormatToStdout() throws IOException {
    final Path a = file("a.lea", "let x=1+2");
    assertThat(run(a), is(0));
    assertThat(out.toString(), is("let x = 1 + 2\n"));
    assertThat(err.toString(), is(""));
    // The file is not changed
    assertThat(read(a), is("let x=1+2"));
  }

  @Test void testDirectory() throws IOException {
    final Path b = file("b.lea", "b");
    final Path a = file("a.lea", "a");
    final Path c = file("sub/c.lea", "c");
    file("sub/notes.txt", "not lea");
    assertThat(run(dir), is(0));
    final String s = out.toString();
    assertThat(s, containsString("=== " + a + " ===\na\n"));
    assertThat(s, containsString("=== " + b + " ===\nb\n"));
    assertThat(s, containsString("=== " + c + " ===\nc\n"));
    assertThat(s.indexOf(a.toString()) < s.indexOf(b.toString()), is(true));
    assertThat(s.indexOf(b.toString()) < s.indexOf(c.toString()), is(true));
    assertThat(s, not(containsString("notes.txt")));
  }

  @Test void testCheck() throws IOException {
    final Path messy = file("messy.lea", "let x=1");
    final Path tidy = file("tidy.lea", "let x = 1\n");
    assertThat(run("--check", messy, tidy), is(1));
    assertThat(err.toString(), containsString("Not formatted: " + messy));
    assertThat(err.toString(), not(containsString("Not formatted: " + tidy)));
    assertThat(err.toString(), containsString("1 file(s) need formatting"));
    assertThat(out.toString(), is(""));
    assertThat(read(messy), is("let x=1"));

    assertThat(run("--check", tidy), is(0));
    assertThat(err.toString(), is(""));
  }

  @Test void testWrite() throws IOException {
    final Path a = file("a.lea", "let   x = [1,2]");
    assertThat(run("--write", a), is(0));
    assertThat(read(a), is("let x = [1, 2]\n"));
    assertThat(out.toString(), containsString("Formatted: " + a));

    assertThat(run("-w", a), is(0));
    assertThat(out.toString(), containsString("Unchanged: " + a));
  }

  @Test void testParseError() throws IOException {
    final Path bad = file("bad.lea", "let x = (1");
    final Path good = file("good.lea", "let y=2");
    assertThat(run(bad, good), is(1));
    assertThat(err.toString(),
        containsString("Parse error in " + bad
            + ": Expected ')' at line 1, column 11"));
    // The other file is still formatted
    assertThat(out.toString(), containsString("let y = 2\n"));
  }

  @Test void testLexerError() throws IOException {
    final Path bad = file("bad.lea", "let x = 1\nlet y = ~");
    assertThat(run("--check", bad), is(1));
    assertThat(err.toString(),
        containsString("Lexer error in " + bad
            + ": Unexpected character '~' at line 2, column 9"));
  }

  @Test void testFileNotFound() {
    final Path missing = dir.resolve("missing.lea");
    assertThat(run(missing), is(1));
    assertThat(err.toString(),
        containsString("Error: File not found: " + missing));
    assertThat(err.toString(), containsString("Error: No .lea files found"));
  }

  @Test void testSkipNonLeaFile() throws IOException {
    final Path txt = file("notes.txt", "hello");
    final Path a = file("a.lea", "a\n");
    assertThat(run(txt, a), is(0));
    assertThat(err.toString(),
        containsString("Warning: Skipping non-.lea file: " + txt));
    assertThat(out.toString(), is("a\n"));
  }

  @Test void testHelp() {
    assertThat(run("--help"), is(0));
    assertThat(out.toString(), startsWith("Usage: lea-format"));
    assertThat(run("-h"), is(0));
    assertThat(out.toString(), containsString("--print-width"));
    assertThat(out.toString(),
        containsString("Properties in a configuration file:\n"
            + "  breakPipeChains\n"
            + "  indentSize\n"));
  }

  @Test void testUsageErrors() {
    assertThat(run(), is(2));
    assertThat(err.toString(), containsString("Error: no input files"));
    assertThat(err.toString(), containsString("Usage:"));

    assertThat(run("--bogus", "a.lea"), is(2));
    assertThat(err.toString(), containsString("Unknown option: --bogus"));

    assertThat(run("--write", "--check", "a.lea"), is(2));
    assertThat(err.toString(),
        containsString("--write and --check cannot be used together"));

    assertThat(run("a.lea", "--indent"), is(2));
    assertThat(err.toString(), containsString("--indent requires a value"));

    assertThat(run("--indent", "abc", "a.lea"), is(2));
    assertThat(err.toString(),
        containsString("value for property indentSize must be an integer: "
            + "abc"));

    assertThat(run("--indent", "0", "a.lea"), is(2));
    assertThat(err.toString(), containsString("indentSize must be positive"));
  }

  @Test void testOptions() throws IOException {
    final Path a = file("a.lea", "let x = a /> b /> c /> d");
    assertThat(run("--indent", 4, "--print-width", 20, a), is(0));
    assertThat(out.toString(),
        is("let x = a\n    /> b\n    /> c\n    /> d\n"));

    assertThat(run("--print-width", 20, "--no-break-pipes", a), is(0));
    assertThat(out.toString(), is("let x = a /> b /> c /> d\n"));

    assertThat(run("--print-width", 20, "--pipe-threshold", 5, a), is(0));
    assertThat(out.toString(), is("let x = a /> b /> c /> d\n"));

    final Path b = file("b.lea", "let xs = [aaaaaaaa, bbbbbbbb]");
    assertThat(run("--print-width", 20, "--no-trailing-commas", b), is(0));
    assertThat(out.toString(),
        is("let xs = [\n  aaaaaaaa,\n  bbbbbbbb\n]\n"));
  }

  /** Properties from a configuration file apply unless a command-line
   * option overrides them. */
  @Test void testConfigFile() throws IOException {
    final Path a = file("a.lea", "let x = a /> b /> c /> d");
    final Path config =
        file("lea.properties", "indentSize = 4\nprintWidth=20\n");
    assertThat(run("--config", config, a), is(0));
    assertThat(out.toString(),
        is("let x = a\n    /> b\n    /> c\n    /> d\n"));

    assertThat(run("--config", config, "--indent", 2, a), is(0));
    assertThat(out.toString(), is("let x = a\n  /> b\n  /> c\n  /> d\n"));

    final Path bad = file("bad.properties", "tabs=true\n");
    assertThat(run("--config", bad, a), is(2));
    assertThat(err.toString(), containsString("property tabs not found"));

    assertThat(run("--config", dir.resolve("none.properties"), a), is(2));
    assertThat(err.toString(),
        containsString("Error: cannot read configuration"));
  }
}

// End MainTest.java
