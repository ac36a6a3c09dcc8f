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
package exm.rdl.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.rdl.common.exceptions.RDLRuntimeError;
import exm.rdl.common.util.Pair;

public class Logging
{
  private static final String RDL_LOGGER_NAME = "exm.rdl";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  static final Set<Pair<Level, String>> emitted =
       new HashSet<Pair<Level, String>>();

  public static Logger getRDLLogger()
  {
    return Logger.getLogger(RDL_LOGGER_NAME);
  }

  /**
   * Send elaborator log output to a file.
   * @param logfile file to write, or null/empty to leave appenders alone
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @return the elaborator logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger rdlLogger = getRDLLogger();
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(
                          new PatternLayout(LOG_PATTERN), logfile, false);
        rdlLogger.addAppender(appender);
      } catch (IOException e) {
        throw new RDLRuntimeError("Could not open log file: " + logfile, e);
      }
      rdlLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    }
    // Even if logging is disabled, this must be valid:
    return rdlLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    synchronized (emitted) {
      return emitted.add(Pair.create(level, msg));
    }
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getRDLLogger().warn(msg);
    else
      getRDLLogger().debug("Duplicate Warning: " + msg);
  }
}
