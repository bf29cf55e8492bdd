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
package exm.sct.ir.trans;

import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableMap;

import exm.sct.common.exceptions.InvalidOptionException;
import exm.sct.common.exceptions.TransformationException;

/**
 * Immutable key/value options for one application of a transformation.
 * Each transformation checks the keys it knows about and ignores the rest.
 */
public class TransformationOptions {
  public static final TransformationOptions EMPTY =
      new TransformationOptions(ImmutableMap.<String, String>of());

  private final ImmutableMap<String, String> values;

  private TransformationOptions(ImmutableMap<String, String> values) {
    this.values = values;
  }

  public static TransformationOptions of(String key, String value) {
    return EMPTY.with(key, value);
  }

  public static TransformationOptions of(Map<String, String> values) {
    return new TransformationOptions(ImmutableMap.copyOf(values));
  }

  /**
   * Parse options written as key=value,key=value
   * @throws InvalidOptionException if an entry is not key=value
   */
  public static TransformationOptions parse(String text)
                                        throws InvalidOptionException {
    TransformationOptions result = EMPTY;
    if (StringUtils.isBlank(text)) {
      return result;
    }
    for (String entry: StringUtils.split(text, ',')) {
      int eq = entry.indexOf('=');
      if (eq <= 0) {
        throw new InvalidOptionException("Expected key=value in " +
                                "transformation options but got: " + entry);
      }
      result = result.with(entry.substring(0, eq).trim(),
                           entry.substring(eq + 1).trim());
    }
    return result;
  }

  /**
   * @return copy with one value set, replacing any previous value
   */
  public TransformationOptions with(String key, String value) {
    ImmutableMap.Builder<String, String> b = ImmutableMap.builder();
    for (Map.Entry<String, String> e: values.entrySet()) {
      if (!e.getKey().equals(key)) {
        b.put(e);
      }
    }
    b.put(key, value);
    return new TransformationOptions(b.build());
  }

  /**
   * @return copy without the key
   */
  public TransformationOptions without(String key) {
    ImmutableMap.Builder<String, String> b = ImmutableMap.builder();
    for (Map.Entry<String, String> e: values.entrySet()) {
      if (!e.getKey().equals(key)) {
        b.put(e);
      }
    }
    return new TransformationOptions(b.build());
  }

  public boolean has(String key) {
    return values.containsKey(key);
  }

  public String getString(String key, String defaultVal) {
    String val = values.get(key);
    return val == null ? defaultVal : val;
  }

  public int getInt(String key, int defaultVal) throws TransformationException {
    String val = values.get(key);
    if (val == null) {
      return defaultVal;
    }
    try {
      return Integer.parseInt(val.trim());
    } catch (NumberFormatException e) {
      throw new TransformationException("The '" + key +
          "' option must be an integer but was '" + val + "'");
    }
  }

  /**
   * Get an integer option that must be positive
   */
  public int getPositiveInt(String key, int defaultVal)
                                        throws TransformationException {
    int val = getInt(key, defaultVal);
    if (val <= 0) {
      throw new TransformationException("The '" + key +
          "' option must be a positive integer but was " + val);
    }
    return val;
  }

  public boolean getBoolean(String key, boolean defaultVal)
                                        throws TransformationException {
    String val = values.get(key);
    if (val == null) {
      return defaultVal;
    }
    if (val.equalsIgnoreCase("true")) {
      return true;
    } else if (val.equalsIgnoreCase("false")) {
      return false;
    }
    throw new TransformationException("The '" + key +
        "' option must be true or false but was '" + val + "'");
  }

  public Map<String, String> asMap() {
    return values;
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
