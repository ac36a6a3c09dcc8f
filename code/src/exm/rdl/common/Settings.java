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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.rdl.common.exceptions.InvalidOptionException;

/**
 * General elaborator settings.
 *
 * Every setting has a default here and can be overridden by a Java system
 * property of the same name (see {@link #initRDLProperties()}), or
 * programmatically with {@link #set(String, String)}.
 * */
public class Settings
{
  public static final String INPUT_FILENAME = "rdl.input_filename";

  public static final String LOG_FILE = "rdl.log.file";
  public static final String LOG_TRACE = "rdl.log.trace";

  /** Keep going after a top-level instantiation fails */
  public static final String COLLECT_ERRORS = "rdl.elab.collect-errors";

  /** Share specialized components between equal instantiations */
  public static final String SPECIALIZATION_CACHE = "rdl.elab.cache";

  /** Largest instance array extent we are willing to expand */
  public static final String MAX_EXTENT = "rdl.elab.max-extent";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(INPUT_FILENAME, "<input>");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(COLLECT_ERRORS, "false");
    defaults.setProperty(SPECIALIZATION_CACHE, "true");
    defaults.setProperty(MAX_EXTENT, "1048576");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initRDLProperties() throws InvalidOptionException {
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
   * Drop any value set for key, reverting to the default
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
    getBoolean(LOG_TRACE);
    getBoolean(COLLECT_ERRORS);
    getBoolean(SPECIALIZATION_CACHE);
    long maxExtent = getLong(MAX_EXTENT);
    if (maxExtent < 0) {
      throw new InvalidOptionException("Option " + MAX_EXTENT +
                          " must not be negative, but was " + maxExtent);
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
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
