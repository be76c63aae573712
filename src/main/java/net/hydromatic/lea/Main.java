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

import net.hydromatic.lea.ast.Pos;
import net.hydromatic.lea.format.Formatter;
import net.hydromatic.lea.format.FormatterConfig;
import net.hydromatic.lea.format.Prop;
import net.hydromatic.lea.parse.LeaParseException;
import net.hydromatic.lea.parse.LexerException;

import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;

/** Command-line formatter for Lea source files.
 *
 * <p>Each argument is a {@code .lea} file or a directory, which is searched
 * recursively for {@code .lea} files. By default the formatted text is
 * printed; {@code --write} rewrites files that change, and {@code --check}
 * reports files that are not formatted without changing them.
 *
 * <p>The exit status is 0 on success, 1 if a file could not be read or
 * parsed or (with {@code --check}) is not formatted, and 2 if the arguments
 * are invalid. */
public class Main {
  private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

  static final String USAGE =
      "Usage: lea-format [options] <file-or-directory>...\n"
      + "\n"
      + "Options:\n"
      + "  -w, --write           Format files in place\n"
      + "  --check               Check whether files are formatted; exit with"
      + " status 1 if not\n"
      + "  --indent <n>          Number of spaces per indentation level"
      + " (default 2)\n"
      + "  --print-width <n>     Maximum line width (default 80)\n"
      + "  --no-trailing-commas  No trailing comma after the last element of a"
      + " broken list\n"
      + "  --no-break-pipes      Never break a pipe chain because it is too"
      + " wide\n"
      + "  --pipe-threshold <n>  Minimum number of pipe chain elements that"
      + " may be broken (default 3)\n"
      + "  --config <file>       Read formatter properties from a properties"
      + " file\n"
      + "  -h, --help            Print this message\n"
      + "\n"
      + "Properties in a configuration file:\n"
      + Prop.BY_CAMEL_NAME.stream()
          .map(prop -> "  " + prop.camelName + "\n")
          .collect(Collectors.joining());

  private final List<String> args;
  private final PrintWriter out;
  private final PrintWriter err;

  /** Creates a Main. */
  public Main(List<String> args, Writer out, Writer err) {
    this.args = ImmutableList.copyOf(args);
    this.out = buffer(out);
    this.err = buffer(err);
  }

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(ImmutableList.copyOf(args),
            new OutputStreamWriter(System.out, UTF_8),
            new OutputStreamWriter(System.err, UTF_8));
    System.exit(main.run());
  }

  private static PrintWriter buffer(Writer out) {
    return out instanceof PrintWriter
        ? (PrintWriter) out
        : new PrintWriter(out);
  }

  /** Formats the files named by the arguments and returns the exit
   * status. */
  public int run() {
    try {
      return run2();
    } finally {
      out.flush();
      err.flush();
    }
  }

  private int run2() {
    final Options options;
    final FormatterConfig config;
    try {
      options = Options.parse(args);
      if (options.help) {
        out.print(USAGE);
        return 0;
      }
      if (options.paths.isEmpty()) {
        throw new IllegalArgumentException("no input files");
      }
      config = options.config();
    } catch (IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      err.print(USAGE);
      return 2;
    } catch (IOException e) {
      err.println("Error: cannot read configuration: " + e.getMessage());
      return 2;
    }

    boolean failed = false;
    final List<Path> files = new ArrayList<>();
    for (String name : options.paths) {
      final Path path = Paths.get(name);
      if (!Files.exists(path)) {
        err.println("Error: File not found: " + path);
        failed = true;
        continue;
      }
      try {
        collect(path, files);
      } catch (IOException e) {
        LOGGER.log(Level.WARNING, "Cannot list " + path, e);
        err.println("Error in " + path + ": " + e.getMessage());
        failed = true;
      }
    }
    if (files.isEmpty()) {
      err.println("Error: No .lea files found");
      return 1;
    }
    LOGGER.fine(() -> "Formatting " + files.size() + " file(s) with "
        + config);

    final Formatter formatter = new Formatter(config);
    int unformattedCount = 0;
    for (Path file : files) {
      try {
        final String original = MoreFiles.asCharSource(file, UTF_8).read();
        final String formatted =
            formatter.format(Lea.parse(file.toString(), original));
        if (options.check) {
          if (!formatted.equals(original)) {
            err.println("Not formatted: " + file);
            ++unformattedCount;
          }
        } else if (options.write) {
          if (!formatted.equals(original)) {
            MoreFiles.asCharSink(file, UTF_8).write(formatted);
            out.println("Formatted: " + file);
          } else {
            out.println("Unchanged: " + file);
          }
        } else {
          if (files.size() > 1) {
            out.println("=== " + file + " ===");
          }
          out.print(formatted);
        }
        LOGGER.fine(() -> "Formatted " + file);
      } catch (LexerException e) {
        failed = true;
        LOGGER.log(Level.WARNING, "Lexer error in " + file, e);
        err.println("Lexer error in " + file + ": " + message(e, e.pos()));
      } catch (LeaParseException e) {
        failed = true;
        LOGGER.log(Level.WARNING, "Parse error in " + file, e);
        err.println("Parse error in " + file + ": " + message(e, e.pos()));
      } catch (IOException e) {
        failed = true;
        LOGGER.log(Level.WARNING, "Cannot read or write " + file, e);
        err.println("Error in " + file + ": " + e.getMessage());
      }
    }

    if (unformattedCount > 0) {
      err.println(unformattedCount + " file(s) need formatting");
    }
    return failed || unformattedCount > 0 ? 1 : 0;
  }

  private static String message(Exception e, Pos pos) {
    return e.getMessage() + " at line " + pos.startLine
        + ", column " + pos.startColumn;
  }

  /** Adds a file to a list, or if it is a directory, the {@code .lea} files
   * under it in name order. */
  private void collect(Path path, List<Path> files) throws IOException {
    if (Files.isDirectory(path)) {
      try (Stream<Path> stream = Files.walk(path)) {
        final List<Path> found =
            stream.filter(p -> Files.isRegularFile(p) && isLea(p))
                .sorted()
                .collect(Collectors.toList());
        LOGGER.fine(() -> "Found " + found.size() + " file(s) in " + path);
        files.addAll(found);
      }
    } else if (isLea(path)) {
      files.add(path);
    } else {
      err.println("Warning: Skipping non-.lea file: " + path);
    }
  }

  private static boolean isLea(Path path) {
    return path.getFileName().toString().endsWith(".lea");
  }

  /** Parsed command-line arguments. */
  static class Options {
    final List<String> paths = new ArrayList<>();
    final Map<Prop, Object> props = new LinkedHashMap<>();
    @Nullable Path configFile;
    boolean write;
    boolean check;
    boolean help;

    static Options parse(List<String> args) {
      final Options options = new Options();
      for (int i = 0; i < args.size(); i++) {
        final String arg = args.get(i);
        switch (arg) {
        case "-w":
        case "--write":
          options.write = true;
          break;
        case "--check":
          options.check = true;
          break;
        case "--indent":
          Prop.INDENT_SIZE.setLenient(options.props, value(args, ++i, arg));
          break;
        case "--print-width":
          Prop.PRINT_WIDTH.setLenient(options.props, value(args, ++i, arg));
          break;
        case "--no-trailing-commas":
          Prop.TRAILING_COMMAS.set(options.props, false);
          break;
        case "--no-break-pipes":
          Prop.BREAK_PIPE_CHAINS.set(options.props, false);
          break;
        case "--pipe-threshold":
          Prop.PIPE_CHAIN_BREAK_THRESHOLD.setLenient(options.props,
              value(args, ++i, arg));
          break;
        case "--config":
          options.configFile = Paths.get(value(args, ++i, arg));
          break;
        case "-h":
        case "--help":
          options.help = true;
          break;
        default:
          if (arg.startsWith("-")) {
            throw new IllegalArgumentException("Unknown option: " + arg);
          }
          options.paths.add(arg);
        }
      }
      if (options.write && options.check) {
        throw new IllegalArgumentException(
            "--write and --check cannot be used together");
      }
      return options;
    }

    private static String value(List<String> args, int i, String option) {
      if (i >= args.size()) {
        throw new IllegalArgumentException(option + " requires a value");
      }
      return args.get(i);
    }

    /** Builds the formatter configuration: properties from the
     * configuration file, if any, overridden by command-line options. */
    FormatterConfig config() throws IOException {
      final Map<Prop, Object> map = new LinkedHashMap<>();
      if (configFile != null) {
        final Properties properties = new Properties();
        try (Reader reader =
                 MoreFiles.asCharSource(configFile, UTF_8).openStream()) {
          properties.load(reader);
        }
        for (String name : properties.stringPropertyNames()) {
          Prop.lookup(name).setLenient(map, properties.getProperty(name));
        }
        LOGGER.fine(() -> "Read configuration " + map + " from "
            + configFile);
      }
      map.putAll(props);
      return FormatterConfig.of(map);
    }
  }
}

// End Main.java
