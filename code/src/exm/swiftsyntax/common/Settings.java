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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.swiftsyntax.common.exceptions.InvalidOptionException;

/**
 * General settings for the syntax tree library.
 *
 * Every key has a default here; a system property of the same name
 * overrides it once {@link #initProperties()} has run.
 * */
public class Settings
{
  public static final String PRINTER_INDENT_WIDTH =
                                    "swiftsyntax.printer.indent-width";
  /** Indent factor for JSON output, 0 for compact output */
  public static final String JSON_INDENT = "swiftsyntax.json.indent";
  /** Reject trees with shared subtrees before serializing them */
  public static final String WALK_CHECK_OWNERSHIP =
                                    "swiftsyntax.walk.check-ownership";

  /**
   * Deepest tree the printer and the JSON codec accept.  Both recurse
   * once per level, so this bounds their stack use.
   */
  public static final String MAX_DEPTH = "swiftsyntax.max-depth";

  public static final String LOG_FILE = "swiftsyntax.log.file";
  public static final String LOG_TRACE = "swiftsyntax.log.trace";

  private static final Properties defaults;
  private static final Properties properties;

  static {
    defaults = new Properties();
    defaults.setProperty(PRINTER_INDENT_WIDTH, "4");
    defaults.setProperty(JSON_INDENT, "2");
    defaults.setProperty(WALK_CHECK_OWNERSHIP, "true");
    defaults.setProperty(MAX_DEPTH, "1000");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
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
   * Drop any value set on top of the defaults.
   */
  public static void reset() {
    properties.clear();
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
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
    if (getInt(PRINTER_INDENT_WIDTH) < 0) {
      throw new InvalidOptionException(PRINTER_INDENT_WIDTH +
                    " must not be negative, but was " + get(PRINTER_INDENT_WIDTH));
    }
    if (getInt(JSON_INDENT) < 0) {
      throw new InvalidOptionException(JSON_INDENT +
                    " must not be negative, but was " + get(JSON_INDENT));
    }
    if (getInt(MAX_DEPTH) < 1) {
      throw new InvalidOptionException(MAX_DEPTH +
                    " must be positive, but was " + get(MAX_DEPTH));
    }
    getBoolean(WALK_CHECK_OWNERSHIP);
    getBoolean(LOG_TRACE);
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
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
