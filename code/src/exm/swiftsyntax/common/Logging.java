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

package exm.swiftsyntax.common;

import java.io.IOException;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;

import exm.swiftsyntax.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String LOGGER_NAME = "exm.swiftsyntax";
  private static final String FILE_APPENDER_NAME = "swiftsyntax-file";
  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted, by level.
   */
  private static final SetMultimap<Level, String> emitted =
                                              HashMultimap.create();

  public static Logger getLogger()
  {
    return Logger.getLogger(LOGGER_NAME);
  }

  /**
   * Set up logging from the log file and trace settings.
   */
  public static Logger setupLogging() throws InvalidOptionException
  {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return setupLogging(logfile, trace);
  }

  /**
   * @param logfile file to log to, or null/empty for no file logging
   * @param trace log at TRACE level rather than DEBUG when logging to file
   * @return the library logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger logger = getLogger();
    logger.removeAppender(FILE_APPENDER_NAME);
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(
                          new PatternLayout(LOG_PATTERN), logfile, false);
        appender.setName(FILE_APPENDER_NAME);
        logger.addAppender(appender);
        logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
      } catch (IOException e) {
        logger.warn("Could not open log file " + logfile + ": " +
                    e.getMessage());
      }
    } else {
      // Even if logging is disabled, warnings must get through
      logger.setLevel(Level.WARN);
    }
    return logger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg)
  {
    return emitted.put(level, msg);
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getLogger().warn(msg);
    else
      getLogger().debug("Duplicate Warning: " + msg);
  }
}
