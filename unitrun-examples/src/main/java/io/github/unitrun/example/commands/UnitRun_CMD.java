/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.unitrun.example.commands;

import io.github.unitrun.example.ExampleSuites;
import io.github.unitrun.example.util.LoggerConfig;
import io.github.unitrun.example.yaml.RunSettings;
import io.github.unitrun.exceptions.FixtureException;
import io.github.unitrun.runner.SuiteCatalog;
import io.github.unitrun.runner.TestDriver;
import io.github.unitrun.runner.TestRunner;
import io.github.unitrun.status.sinks.ConsoleReporter;
import io.github.unitrun.status.sinks.OutputMode;
import picocli.CommandLine;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "unitrun",
    header = "Unit Testing Options:",
    mixinStandardHelpOptions = true,
    description = "Runs the registered test suites. The exit status is the number of failed assertions.")
public class UnitRun_CMD implements Callable<Integer> {

  /** Exit statuses above this wrap around on POSIX systems. */
  static final int MAX_EXIT_CODE = 255;

  @CommandLine.Spec
  CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(names = {"-v", "--verbose"},
      description = "Show individual tests.")
  boolean verbose;

  @CommandLine.Option(names = {"-q", "--quiet"},
      description = "Don't output anything (overrides --verbose).")
  boolean quiet;

  @CommandLine.Option(names = {"--color"}, negatable = true,
      description = "Highlight suite, PASS and FAIL tags. Detected from the terminal when not given.")
  Boolean color;

  @CommandLine.Option(names = {"--status-capacity"},
      description = "Number of progress glyphs per console line before it wraps.")
  Integer statusCapacity;

  @CommandLine.Option(names = {"-c", "--config"},
      description = "A yaml file with run settings")
  Path config;

  @CommandLine.Option(names = {"-s", "--suite"},
      description = "Suite to run; repeat for several. All suites run when not given.")
  List<String> suites;

  @CommandLine.Option(names = {"--list"},
      description = "List the registered suites and exit.")
  boolean list;

  private final SuiteCatalog catalog;
  private final PrintStream output;

  public UnitRun_CMD() {
    this(ExampleSuites.catalog(), System.out);
  }

  public UnitRun_CMD(SuiteCatalog catalog, PrintStream output) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.output = Objects.requireNonNull(output, "output");
  }

  public static void main(String[] args) {
    int exitCode = newCommandLine(new UnitRun_CMD()).execute(args);
    System.exit(exitCode);
  }

  /**
   * Runs {@code catalog} with command line {@code args}, printing progress to {@code output}.
   *
   * @return the process exit status
   */
  public static int execute(SuiteCatalog catalog, PrintStream output, String... args) {
    return newCommandLine(new UnitRun_CMD(catalog, output)).execute(args);
  }

  static CommandLine newCommandLine(UnitRun_CMD command) {
    return new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true)
        .setOptionsCaseInsensitive(true);
  }

  @Override
  public Integer call() throws Exception {
    RunSettings settings = config != null ? RunSettings.load(config) : new RunSettings();

    if (list) {
      catalog.titles().forEach(output::println);
      return 0;
    }

    OutputMode fileMode = settings.outputMode();
    OutputMode mode = OutputMode.resolve(verbose || fileMode == OutputMode.VERBOSE,
        quiet || fileMode == OutputMode.QUIET);
    LoggerConfig.configure(mode);

    ConsoleReporter.Builder builder = ConsoleReporter.builder().withOutput(output);
    Boolean useColors = color != null ? color : settings.color;
    if (useColors != null) {
      builder.withColorOutput(useColors);
    }
    Integer capacity = statusCapacity != null ? statusCapacity : settings.statusCapacity;
    if (capacity != null) {
      if (capacity < 1) {
        throw new CommandLine.ParameterException(spec.commandLine(),
            "Invalid value for status capacity: " + capacity + " (must be positive)");
      }
      builder.withStatusCapacity(capacity);
    }

    List<String> selection = suites != null && !suites.isEmpty() ? suites : settings.suites;
    SuiteCatalog selected;
    try {
      selected = selection == null || selection.isEmpty() ? catalog : catalog.select(selection);
    } catch (IllegalArgumentException e) {
      throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
    }

    TestRunner runner = TestRunner.create(mode, builder);
    try {
      int failed = new TestDriver(runner).run(selected);
      return Math.min(failed, MAX_EXIT_CODE);
    } catch (FixtureException e) {
      // fatal, shown even with --quiet
      spec.commandLine().getErr().println("Aborting run: " + e.getMessage()
          + (e.getCause() != null ? " (" + e.getCause() + ")" : ""));
      spec.commandLine().getErr().flush();
      return 1;
    }
  }
}
