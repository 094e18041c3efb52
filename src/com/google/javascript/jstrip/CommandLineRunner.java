/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.javascript.jstrip;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;
import com.google.javascript.jstrip.parsing.JsSyntaxException;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.OptionDef;
import org.kohsuke.args4j.spi.OptionHandler;
import org.kohsuke.args4j.spi.Parameters;
import org.kohsuke.args4j.spi.Setter;

/**
 * Rewrites one file from the command line.
 *
 * <pre>
 * java -jar jstrip.jar --js app.tsx --js_output_file app.js
 * </pre>
 */
public final class CommandLineRunner {
  private static final Logger rootLogger = Logger.getLogger("com.google.javascript.jstrip");

  @Option(name = "--js", required = true, usage = "The file to rewrite")
  private String js = "";

  @Option(
      name = "--js_output_file",
      usage = "Primary output filename. If not specified, output is written to stdout")
  private String jsOutputFile = "";

  @Option(
      name = "--transforms",
      usage =
          "Comma-separated transforms to apply: imports, flow, typescript, jsx,"
              + " add-module-exports. Defaults to the transforms for the input's extension")
  private String transforms = "";

  @Option(
      name = "--jsx_debug",
      handler = BooleanOptionHandler.class,
      usage = "Add __self and __source properties to JSX elements")
  private boolean jsxDebug = true;

  @Option(
      name = "--logging_level",
      usage = "The logging level (standard java.util.logging.Level values) for progress messages")
  private String loggingLevel = Level.WARNING.getName();

  @Option(name = "--help", help = true, usage = "Displays this message")
  private boolean displayHelp = false;

  public static void main(String[] args) throws IOException {
    System.exit(new CommandLineRunner().run(args, System.out, System.err));
  }

  /** Runs with the given flags and returns the process exit code. */
  int run(String[] args, PrintStream out, PrintStream err) throws IOException {
    CmdLineParser parser = new CmdLineParser(this);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      return 1;
    }
    if (displayHelp) {
      parser.printUsage(out);
      return 0;
    }
    rootLogger.setLevel(Level.parse(loggingLevel));

    try {
      TranspileOptions options =
          TranspileOptions.builder()
              .setTransforms(getTransforms())
              .setFilePath(js)
              .setJsxDebugMetadata(jsxDebug)
              .build();
      String code = Files.asCharSource(new File(js), UTF_8).read();
      String result = Transpiler.transform(code, options);
      if (jsOutputFile.isEmpty()) {
        out.print(result);
      } else {
        Files.asCharSink(new File(jsOutputFile), UTF_8).write(result);
      }
      return 0;
    } catch (JsSyntaxException e) {
      err.println(js + ": " + e.getMessage());
      return 1;
    } catch (InvalidOptionsException e) {
      err.println(e.getMessage());
      return 1;
    }
  }

  private ImmutableSet<Transform> getTransforms() {
    if (transforms.isEmpty()) {
      return Transform.forFileExtension(js);
    }
    ImmutableSet.Builder<Transform> result = ImmutableSet.builder();
    for (String name : Splitter.on(',').trimResults().omitEmptyStrings().split(transforms)) {
      result.add(Transform.fromFlagName(name));
    }
    return result.build();
  }

  /** Accepts {@code --flag}, {@code --flag=false} and the other usual spellings of a boolean. */
  // Public for args4j reflection.
  public static class BooleanOptionHandler extends OptionHandler<Boolean> {
    private static final Set<String> TRUES = ImmutableSet.of("true", "on", "yes", "1");
    private static final Set<String> FALSES = ImmutableSet.of("false", "off", "no", "0");

    public BooleanOptionHandler(
        CmdLineParser parser, OptionDef option, Setter<? super Boolean> setter) {
      super(parser, option, setter);
    }

    @Override
    public int parseArguments(Parameters params) throws CmdLineException {
      @Nullable String param = params.size() > 0 ? params.getParameter(0) : null;
      if (param == null) {
        setter.addValue(true);
        return 0;
      }
      String lowerParam = param.toLowerCase(Locale.ROOT);
      if (TRUES.contains(lowerParam)) {
        setter.addValue(true);
      } else if (FALSES.contains(lowerParam)) {
        setter.addValue(false);
      } else {
        // Not a boolean, so it is the next flag.
        setter.addValue(true);
        return 0;
      }
      return 1;
    }

    @Override
    public @Nullable String getDefaultMetaVariable() {
      return null;
    }
  }
}
