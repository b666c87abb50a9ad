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
package kara.karac.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import kara.karac.ast.FilePosition;
import kara.karac.common.Logging;

/**
 * Log messages prefixed with a source position and indented by
 * scope depth.
 */
public class LogHelper {
  private static final Logger logger = Logging.getKaracLogger();

  public static void debug(Context context, FilePosition pos, String msg) {
    log(context.getLevel(), Level.DEBUG, pos, msg);
  }

  public static void trace(Context context, FilePosition pos, String msg) {
    log(context.getLevel(), Level.TRACE, pos, msg);
  }

  private static void log(int indent, Level level, FilePosition pos,
                          String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    if (pos != null) {
      sb.append(pos).append(": ");
    }
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  public static boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }
}
