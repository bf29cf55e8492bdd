/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.sct.ui;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import exm.sct.common.Logging;
import exm.sct.common.Settings;
import exm.sct.common.exceptions.InvalidOptionException;
import exm.sct.common.exceptions.SCTFatal;
import exm.sct.ir.trans.TransformationRegistry;

/**
 * Command line interface to SCT.  Settings can also be given as Java
 * system properties; see Settings.java for the keys.
 */
public class Main {
  private static final String TRANSFORM_FLAG = "t";
  private static final String BACKEND_FLAG = "b";
  private static final String DIST_MEM_FLAG = "m";
  private static final String SETTING_FLAG = "D";
  private static final String LOG_FILE_FLAG = "l";
  private static final String TRACE_FLAG = "v";
  private static final String HELP_FLAG = "h";

  public static void main(String[] args) {
    Args sctArgs = processArgs(args);

    Settings settings = null;
    try {
      settings = Settings.fromSystemProperties(sctArgs.overrides);
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    Logger logger = null;
    try {
      logger = setupLogging(settings);
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    try {
      SCTDriver driver = new SCTDriver(logger, settings);
      driver.run(sctArgs.inputFilename, sctArgs.outputFilename,
                 sctArgs.steps);
    } catch (SCTFatal ex) {
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  static Options initOptions() {
    Options opts = new Options();

    Option transform = new Option(TRANSFORM_FLAG, "transform", true,
        "Apply transformation name[:key=value,...]; may be repeated");
    opts.addOption(transform);

    opts.addOption(BACKEND_FLAG, "backend", true,
                   "Output language: " + Settings.BACKENDS);
    opts.addOption(DIST_MEM_FLAG, "distributed-memory", false,
                   "Enable distributed memory constructs");

    Option setting = new Option(SETTING_FLAG, true, "Set an option");
    setting.setArgs(2);
    setting.setValueSeparator('=');
    opts.addOption(setting);

    opts.addOption(LOG_FILE_FLAG, "log-file", true, "Write full log to file");
    opts.addOption(TRACE_FLAG, "verbose", false, "Trace logging");
    opts.addOption(HELP_FLAG, "help", false, "Print this message");
    return opts;
  }

  /**
   * Parse the command line, exiting on error
   */
  static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    if (cmd.hasOption(HELP_FLAG)) {
      usage(opts);
      System.exit(ExitCode.SUCCESS.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1 || remainingArgs.length > 2) {
      System.err.println("Expected input file and optional output file, " +
              "but got " + remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    return buildArgs(cmd, remainingArgs);
  }

  static Args buildArgs(CommandLine cmd, String[] remainingArgs) {
    Properties overrides = cmd.getOptionProperties(SETTING_FLAG);
    if (cmd.hasOption(BACKEND_FLAG)) {
      overrides.setProperty(Settings.BACKEND,
                            cmd.getOptionValue(BACKEND_FLAG));
    }
    if (cmd.hasOption(DIST_MEM_FLAG)) {
      overrides.setProperty(Settings.DISTRIBUTED_MEMORY, "true");
    }
    if (cmd.hasOption(LOG_FILE_FLAG)) {
      overrides.setProperty(Settings.LOG_FILE,
                            cmd.getOptionValue(LOG_FILE_FLAG));
    }
    if (cmd.hasOption(TRACE_FLAG)) {
      overrides.setProperty(Settings.LOG_TRACE, "true");
    }

    List<String> steps = new ArrayList<String>();
    if (cmd.hasOption(TRANSFORM_FLAG)) {
      steps.addAll(Arrays.asList(cmd.getOptionValues(TRANSFORM_FLAG)));
    }

    String input = remainingArgs[0];
    String output = null;
    if (remainingArgs.length == 2) {
      output = remainingArgs[1];
    }
    return new Args(input, output, steps, overrides);
  }

  private static Logger setupLogging(Settings settings)
                                        throws InvalidOptionException {
    String logfile = settings.get(Settings.LOG_FILE);
    boolean trace = settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("sct [options] <input> [<output>]", opts, false);
    System.out.println("transformations: " + TransformationRegistry.NAMES);
  }

  static class Args {
    public final String inputFilename;
    public final String outputFilename;
    public final List<String> steps;
    public final Properties overrides;

    public Args(String inputFilename, String outputFilename,
                List<String> steps, Properties overrides) {
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.steps = steps;
      this.overrides = overrides;
    }
  }
}
