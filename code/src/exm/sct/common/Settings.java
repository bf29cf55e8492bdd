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
package exm.sct.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.sct.common.exceptions.InvalidOptionException;
import exm.sct.common.lang.Dialect;

/**
 * General SCT settings.
 *
 * Settings are an immutable value: build one with {@link #create(Properties)}
 * or {@link #fromSystemProperties(Properties)} and pass it explicitly to the
 * reader, transformations and driver.  Two trees of different dialects
 * can thus be processed side by side.
 * */
public class Settings
{
  public static final String DIALECT = "sct.dialect";
  public static final String DISTRIBUTED_MEMORY = "sct.distributed-memory";
  public static final String BACKEND = "sct.backend";
  public static final String VALIDATE_IR = "sct.validate-ir";

  public static final String TRANS_BLOCKSIZE = "sct.trans.blocksize";
  public static final String TRANS_TILESIZE = "sct.trans.tilesize";
  public static final String EXTRACT_PREFIX = "sct.extract.prefix";
  public static final String PROFILE_PREFIX = "sct.profile.prefix";

  public static final String LOG_FILE = "sct.log.file";
  public static final String LOG_TRACE = "sct.log.trace";

  public static final List<String> BACKENDS =
      Collections.unmodifiableList(Arrays.asList("fortran", "c"));

  private static final Properties defaults;

  static {
    defaults = new Properties();
    defaults.setProperty(DIALECT, "generic");
    defaults.setProperty(DISTRIBUTED_MEMORY, "false");
    defaults.setProperty(BACKEND, "fortran");
    defaults.setProperty(VALIDATE_IR, "true");
    defaults.setProperty(TRANS_BLOCKSIZE, "32");
    defaults.setProperty(TRANS_TILESIZE, "32");
    defaults.setProperty(EXTRACT_PREFIX, "extract");
    defaults.setProperty(PROFILE_PREFIX, "profile");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
  }

  private final Properties properties;

  private Settings(Properties properties) {
    this.properties = properties;
  }

  /**
   * @return settings with all default values
   */
  public static Settings defaultSettings() {
    try {
      return create(new Properties());
    } catch (InvalidOptionException e) {
      throw new IllegalStateException("Invalid default settings", e);
    }
  }

  /**
   * Create settings with defaults overridden by the given properties
   * @param overrides
   * @throws InvalidOptionException if a value is malformed
   */
  public static Settings create(Properties overrides)
        throws InvalidOptionException {
    Properties props = new Properties();
    props.putAll(defaults);
    for (String key: overrides.stringPropertyNames()) {
      props.setProperty(key, overrides.getProperty(key));
    }
    Settings settings = new Settings(props);
    settings.validateProperties();
    return settings;
  }

  /**
     Overwrite each default property with value from System, then
     with the explicit overrides (e.g. from the command line)
   */
  public static Settings fromSystemProperties(Properties overrides)
        throws InvalidOptionException {
    Properties props = new Properties();
    for (String key: defaults.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        props.setProperty(key, sysVal);
      }
    }
    for (String key: overrides.stringPropertyNames()) {
      props.setProperty(key, overrides.getProperty(key));
    }
    return create(props);
  }

  /**
   * @return copy of these settings with one value changed
   */
  public Settings with(String key, String value)
        throws InvalidOptionException {
    Properties props = new Properties();
    props.putAll(properties);
    props.setProperty(key, value);
    return create(props);
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private void validateProperties() throws InvalidOptionException {
    getBoolean(DISTRIBUTED_MEMORY);
    getBoolean(VALIDATE_IR);
    getBoolean(LOG_TRACE);
    checkPositive(TRANS_BLOCKSIZE);
    checkPositive(TRANS_TILESIZE);
    checkOneOf(BACKEND, BACKENDS);
    List<String> dialects = new ArrayList<String>();
    for (Dialect d: Dialect.values()) {
      dialects.add(d.name().toLowerCase());
    }
    checkOneOf(DIALECT, dialects);
  }

  public String get(String key)
  {
    return properties.getProperty(key);
  }

  public List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  public Dialect getDialect() {
    return Dialect.fromString(get(DIALECT));
  }

  /**
   * @return true if distributed memory was requested and the dialect
   *          has distributed-memory constructs
   */
  public boolean isDistributedMemoryActive() {
    try {
      return getBoolean(DISTRIBUTED_MEMORY) &&
             getDialect().supportsDistributedMemory();
    } catch (InvalidOptionException e) {
      // Validated at construction
      throw new IllegalStateException(e);
    }
  }

  public String getBackend() {
    return get(BACKEND).toLowerCase();
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
    throw new InvalidOptionException("Expected property " + key +
        " to be one of: " + sb.toString() + " but was '" + val + "'");
  }

  private void checkPositive(String key) throws InvalidOptionException {
    if (getInt(key) <= 0) {
      throw new InvalidOptionException("Option " + key +
          " must be a positive integer, but was " + get(key));
    }
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
