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
package exm.sct.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.sct.common.exceptions.InvalidOptionException;
import exm.sct.common.util.Pair;

public class Logging {
  private static final String SCT_LOGGER_NAME = "exm.sct";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  private static final Set<Pair<Level, String>> emitted =
          new HashSet<Pair<Level, String>>();

  public static Logger getSCTLogger() {
    return Logger.getLogger(SCT_LOGGER_NAME);
  }

  /**
   * Configure the SCT logger.  With no log file, only warnings and errors
   * go to stderr.
   * @param logfile file to write the full log to, or empty/null for none
   * @param trace if true, log at TRACE level instead of DEBUG
   * @return the configured logger
   * @throws InvalidOptionException if the log file cannot be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException {
    Logger sctLogger = getSCTLogger();
    sctLogger.removeAllAppenders();
    sctLogger.setAdditivity(false);
    Layout layout = new PatternLayout(LOG_PATTERN);

    if (StringUtils.isBlank(logfile)) {
      ConsoleAppender console = new ConsoleAppender(layout,
                                          ConsoleAppender.SYSTEM_ERR);
      sctLogger.addAppender(console);
      sctLogger.setLevel(trace ? Level.TRACE : Level.WARN);
    } else {
      try {
        FileAppender appender = new FileAppender(layout, logfile, false);
        sctLogger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file " +
                                         logfile + ": " + e.getMessage());
      }
      sctLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    }
    // Even if logging is disabled, this must be valid:
    return sctLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg) {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (addEmitted(Level.WARN, msg)) {
      getSCTLogger().warn(msg);
    } else {
      getSCTLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
