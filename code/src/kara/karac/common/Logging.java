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

package kara.karac.common;

import java.io.IOException;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import kara.karac.common.exceptions.KaracRuntimeError;

public class Logging
{
  private static final String KARAC_LOGGER_NAME = "kara.karac";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  public static Logger getKaracLogger()
  {
    return Logger.getLogger(KARAC_LOGGER_NAME);
  }

  /**
   * Route compiler logging to a file, or leave the classpath
   * configuration in place if no file was given.
   * @param logfile path of log file, may be null or empty
   * @param trace if true, log everything down to TRACE
   * @return the compiler logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger karacLogger = getKaracLogger();
    if (logfile != null && logfile.length() > 0) {
      Layout layout = new PatternLayout(LOG_PATTERN);
      try {
        FileAppender appender = new FileAppender(layout, logfile, false);
        karacLogger.removeAllAppenders();
        karacLogger.addAppender(appender);
        karacLogger.setAdditivity(false);
      } catch (IOException e) {
        throw new KaracRuntimeError("Could not open log file: " + logfile, e);
      }
      karacLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else if (trace) {
      karacLogger.setLevel(Level.TRACE);
    }
    // Even if logging is disabled, this must be valid:
    return karacLogger;
  }

  /**
   * Send compiler logging to stderr at the given level.  Used by
   * the command line driver's verbose flag.
   */
  public static Logger setupConsoleLogging(Level level)
  {
    Logger karacLogger = getKaracLogger();
    karacLogger.removeAllAppenders();
    ConsoleAppender appender = new ConsoleAppender(
                  new PatternLayout(LOG_PATTERN), ConsoleAppender.SYSTEM_ERR);
    karacLogger.addAppender(appender);
    karacLogger.setAdditivity(false);
    karacLogger.setLevel(level);
    return karacLogger;
  }
}
