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

package exm.mct.common;

import java.io.IOException;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

public class Logging
{
  private static final String MCT_LOGGER_NAME = "exm.mct";

  private static final String FILE_LAYOUT = "%-5p %c{1} - %m%n";

  public static Logger getMCTLogger()
  {
    return Logger.getLogger(MCT_LOGGER_NAME);
  }

  /**
   * Set up logging to a file in addition to the console appender configured
   * in log4j.properties.
   * @param logfile file to log to, or empty/null for console only
   * @param trace if true log at TRACE level, otherwise DEBUG
   * @return the compiler logger
   * @throws IOException if the log file cannot be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws IOException
  {
    Logger mctLogger = getMCTLogger();
    if (logfile != null && logfile.length() > 0) {
      Level level = trace ? Level.TRACE : Level.DEBUG;
      Layout layout = new PatternLayout(FILE_LAYOUT);
      FileAppender appender = new FileAppender(layout, logfile, false);
      appender.setThreshold(level);
      mctLogger.addAppender(appender);
      mctLogger.setLevel(level);
    }
    // Even if logging is disabled, this must be valid:
    return mctLogger;
  }
}
