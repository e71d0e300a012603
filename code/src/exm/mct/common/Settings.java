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
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.io.IOUtils;

import exm.mct.common.exceptions.InvalidOptionException;

/**
 * General MCT settings.  Built from the defaults below, then the optional
 * mct.properties resource on the classpath, then Java system properties.
 * A Settings object is not modified after it is built, so it can be
 * shared between compilations.
 * */
public class Settings
{
  public static final String CODEGEN_INDENT_WIDTH = "mct.codegen.indent-width";
  public static final String CODEGEN_MAIN_GUARD = "mct.codegen.main-guard";
  public static final String CODEGEN_HEADER = "mct.codegen.header";

  public static final String LOG_FILE = "mct.log.file";
  public static final String LOG_TRACE = "mct.log.trace";

  /** What to emit: python source, or nothing (analysis only) */
  public static final String OUTPUT_MODE = "mct.output";
  public static final String OUTPUT_PYTHON = "python";
  public static final String OUTPUT_NONE = "none";

  static final String PROPERTIES_RESOURCE = "/mct.properties";

  private static final Properties defaults;

  static {
    defaults = new Properties();
    defaults.setProperty(CODEGEN_INDENT_WIDTH, "4");
    defaults.setProperty(CODEGEN_MAIN_GUARD, "true");
    defaults.setProperty(CODEGEN_HEADER, "true");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(OUTPUT_MODE, OUTPUT_PYTHON);
  }

  private final Properties properties;

  private Settings(Properties properties) {
    this.properties = properties;
  }

  /**
   * @return settings with built-in defaults only
   */
  public static Settings defaults() {
    return new Settings(new Properties(defaults));
  }

  /**
   * Load settings: defaults, overwritten by the mct.properties resource if
   * present, overwritten by any matching Java system property.
   * @throws InvalidOptionException if a value is malformed or the
   *          resource cannot be read
   */
  public static Settings load() throws InvalidOptionException {
    Properties props = new Properties(defaults);
    InputStream in = Settings.class.getResourceAsStream(PROPERTIES_RESOURCE);
    if (in != null) {
      try {
        props.load(in);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not read " +
                      PROPERTIES_RESOURCE + ": " + e.getMessage());
      } finally {
        IOUtils.closeQuietly(in);
      }
    }

    // Pull in properties from command line or wrapper script
    for (String key: props.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        props.setProperty(key, sysVal);
      }
    }
    Settings result = new Settings(props);
    result.validateProperties();
    return result;
  }

  /**
   * @return a copy of these settings with one key changed
   */
  public Settings with(String key, String value) throws InvalidOptionException {
    Properties props = new Properties(defaults);
    for (String k: properties.stringPropertyNames()) {
      props.setProperty(k, properties.getProperty(k));
    }
    props.setProperty(key, value);
    Settings result = new Settings(props);
    result.validateProperties();
    return result;
  }

  public List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private void validateProperties() throws InvalidOptionException {
    int indent = getInt(CODEGEN_INDENT_WIDTH);
    if (indent < 1 || indent > 16) {
      throw new InvalidOptionException("Expected property " +
          CODEGEN_INDENT_WIDTH + " to be between 1 and 16 but was " + indent);
    }
    getBoolean(CODEGEN_MAIN_GUARD);
    getBoolean(CODEGEN_HEADER);
    getBoolean(LOG_TRACE);
    checkOneOf(OUTPUT_MODE, Arrays.asList(OUTPUT_PYTHON, OUTPUT_NONE));
  }

  public String get(String key)
  {
    return properties.getProperty(key);
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  private void checkOneOf(String key, List<String> validVals)
                                                  throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    for (String vv: validVals) {
      if (val.equalsIgnoreCase(vv)) {
        return;
      }
    }

    StringBuilder sb = new StringBuilder();
    for (String vv: validVals) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append("'");
      sb.append(vv);
      sb.append("'");
    }
    throw new InvalidOptionException("Expected property " + key + " to be one of: "
        + sb.toString() + " but was '" + val + "'");
  }

  public int getInt(String key) throws InvalidOptionException {
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

  public boolean getBoolean(String key)
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
