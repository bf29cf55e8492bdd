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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.sct.backend.CWriter;
import exm.sct.backend.FortranWriter;
import exm.sct.backend.LanguageWriter;
import exm.sct.common.Settings;
import exm.sct.common.exceptions.BackendException;
import exm.sct.common.exceptions.SCTFatal;
import exm.sct.common.exceptions.UserException;
import exm.sct.common.util.Misc;
import exm.sct.frontend.FortranReader;
import exm.sct.ir.trans.TransformationRegistry;
import exm.sct.ir.trans.TransformationScript;
import exm.sct.ir.tree.Container;
import exm.sct.ir.tree.IRValidator;
import exm.sct.ir.tree.Node;
import exm.sct.ir.tree.NodeKind;

/**
 * This is the main entry point to the transformation engine: read a
 * Fortran file, apply a list of transformations and write the result
 */
public class SCTDriver {

  private final Logger logger;
  private final Settings settings;

  public SCTDriver(Logger logger, Settings settings) {
    this.logger = logger;
    this.settings = settings;
  }

  /**
   * Transform a file.  Errors are reported on stderr and end in an
   * SCTFatal carrying the exit code.
   * @param inputFile Fortran source
   * @param outputFile file to write, or null for stdout
   * @param steps transformation steps as name[:key=value,...]
   */
  public void run(String inputFile, String outputFile, List<String> steps) {
    try {
      logger.info("SCT starting: " + Misc.timestamp());
      String source = readInput(inputFile);
      String output = process(source, inputFile, steps);
      writeOutput(outputFile, output);
      logger.debug("SCT done: " + Misc.timestamp());
    }
    catch (SCTFatal e) {
      // Rethrow
      throw e;
    }
    catch (UserException e) {
      System.err.println("sct error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug(Misc.stackTrace(e));
      throw new SCTFatal(ExitCode.forUserError(e).code());
    }
    catch (AssertionError e) {
      reportInternalError(e);
      throw new SCTFatal(ExitCode.ERROR_INTERNAL.code());
    }
    catch (RuntimeException e) {
      reportInternalError(e);
      throw new SCTFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  /**
   * Read, transform and write source text
   * @return the transformed program in the configured backend language
   */
  public String process(String source, String fileName, List<String> steps)
                                                    throws UserException {
    FortranReader reader = new FortranReader(logger);
    Container root = reader.psyirFromSource(source, fileName);
    if (settings.getBoolean(Settings.VALIDATE_IR)) {
      IRValidator.validate(logger, root);
    }

    TransformationRegistry registry = new TransformationRegistry(settings);
    TransformationScript script = new TransformationScript(settings);
    for (String step: steps) {
      script.addStep(registry.parseStep(step));
    }
    int applied = script.run(logger, root);
    logger.debug("Applied " + script.getSteps().size() + " steps: " +
                 applied + " transformations");

    return generate(root);
  }

  /**
   * Render the tree with the configured backend.  The C backend has no
   * notion of modules, so each routine is written separately.
   */
  String generate(Container root) throws BackendException {
    LanguageWriter writer = writerFor(settings.getBackend());
    if (writer instanceof FortranWriter) {
      return writer.render(root);
    }
    List<String> routines = new ArrayList<String>();
    for (Node routine: root.walk(NodeKind.ROUTINE)) {
      routines.add(writer.render(routine));
    }
    return StringUtils.join(routines, "\n");
  }

  static LanguageWriter writerFor(String backend) {
    if (backend.equals("c")) {
      return new CWriter();
    }
    return new FortranWriter();
  }

  private static String readInput(String inputFile) {
    try {
      return FileUtils.readFileToString(new File(inputFile), "UTF-8");
    } catch (IOException e) {
      System.err.println("Error reading input file " + inputFile + ": " +
                         e.getMessage());
      throw new SCTFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static void writeOutput(String outputFile, String output) {
    if (outputFile == null) {
      System.out.print(output);
      System.out.flush();
      return;
    }
    try {
      FileUtils.writeStringToFile(new File(outputFile), output, "UTF-8");
    } catch (IOException e) {
      System.err.println("I/O error while writing to output");
      System.err.println(e.getMessage());
      throw new SCTFatal(ExitCode.ERROR_IO.code());
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("SCT INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
