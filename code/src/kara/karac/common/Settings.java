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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import kara.karac.common.exceptions.InvalidOptionException;

/**
 * General karac settings.
 *
 * Every setting has a default here and can be overridden with a Java
 * system property of the same name, e.g. -Dkarac.threads=4.
 * */
public class Settings
{
  /** Worker threads used to check definitions after registration */
  public static final String THREADS = "karac.threads";

  /** Alternative built-in function table; classpath table if empty */
  public static final String BUILTINS_FILE = "karac.builtins.file";

  /** Report let bindings in flows that nothing reads */
  public static final String WARN_UNUSED = "karac.warn.unused";

  /** Print dependency graphs after a successful compile */
  public static final String DUMP_GRAPHS = "karac.dump.graphs";

  public static final String INPUT_FILENAME = "karac.input_filename";

  public static final String LOG_FILE = "karac.log.file";
  public static final String LOG_TRACE = "karac.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(THREADS, "1");
    defaults.setProperty(BUILTINS_FILE, "");
    defaults.setProperty(WARN_UNUSED, "true");
    defaults.setProperty(DUMP_GRAPHS, "false");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initKaracProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set since startup, restoring the default
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(WARN_UNUSED);
    getBoolean(DUMP_GRAPHS);
    getBoolean(LOG_TRACE);
    if (getInt(THREADS) < 1) {
      throw new InvalidOptionException("Expected property " + THREADS +
                        " to be at least 1 but was " + get(THREADS));
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
