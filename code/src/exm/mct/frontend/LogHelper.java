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

package exm.mct.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.mct.ast.antlr.MiniCParser;
import exm.mct.common.Logging;

/**
 * Logging helpers for the front end: messages are prefixed with the
 * current source location and indented by scope depth
 */
public class LogHelper {

  private static final Logger logger = Logging.getMCTLogger();

  /**
   * @param tokenNum token number from AST
   * @return descriptive string containing token name, or token number if
   *        unknown token type
   */
  public static String tokName(int tokenNum) {
    if (tokenNum < 0 || tokenNum > MiniCParser.tokenNames.length - 1) {
      return "Invalid token number (" + tokenNum + ")";
    } else {
      return MiniCParser.tokenNames[tokenNum];
    }
  }

  public static void debug(Context context, String msg) {
    log(context.getLevel(), Level.DEBUG, context.getLocation(), msg);
  }

  public static void trace(Context context, String msg) {
    if (logger.isTraceEnabled()) {
      log(context.getLevel(), Level.TRACE, context.getLocation(), msg);
    }
  }

  /**
   * WARN once per program checked; repeats go to DEBUG
   */
  public static void uniqueWarn(Context context, String msg) {
    String full = context.getLocation() + msg;
    if (context.getGlobals().addEmittedWarning(full)) {
      logger.warn(full);
    } else {
      logger.debug("Duplicate Warning: " + full);
    }
  }

  /**
     TRACE-level with indentation for nice output
   */
  public static void trace(int indent, String msg) {
    log(indent, Level.TRACE, msg);
  }

  public static void log(int indent, Level level, String location, String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    sb.append(location);
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  public static void log(int indent, Level level, String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }
}
