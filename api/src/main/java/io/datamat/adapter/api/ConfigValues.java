/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.datamat.adapter.api;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed accessors for configuration maps parsed from YAML or JSON.
 *
 * <p>String values may reference variables with the shell-style
 * {@code ${VAR_NAME}} or {@code ${VAR_NAME:-default}} syntax.
 * {@link #resolveAll} replaces them, through a {@link SecretResolver}, before
 * the typed accessors read the map; the accessors take values as given.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * Map<String, Object> raw = ...; // {maxRetries: "${API_MAX_RETRIES:-3}"}
 * Map<String, Object> retry = ConfigValues.resolveAll(raw, SecretResolver.system());
 * int maxRetries = ConfigValues.getInt(retry, "maxRetries", 3);
 * }</pre>
 */
public final class ConfigValues {

  /**
   * Matches only innermost {@code ${...}} references, allowing iterative
   * resolution from inside out.
   */
  private static final Pattern DOLLAR_VAR_PATTERN = Pattern.compile("\\$\\{([^{}]+)\\}");
  private static final int MAX_ITERATIONS = 10;

  private ConfigValues() {
    // Utility class
  }

  /**
   * Resolves {@code ${VAR}} references in a template.
   *
   * <p>Unresolvable references without a default are kept verbatim for
   * debugging.
   *
   * @param template Template string, may be null
   * @param resolver Source of variable values
   * @return Resolved string
   */
  public static @Nullable String resolveEnvVars(@Nullable String template,
      SecretResolver resolver) {
    if (template == null || template.isEmpty()) {
      return template;
    }
    String current = template;
    for (int i = 0; i < MAX_ITERATIONS; i++) {
      String resolved = resolveOnce(current, resolver);
      if (resolved.equals(current)) {
        break;
      }
      current = resolved;
    }
    return current;
  }

  private static String resolveOnce(String template, SecretResolver resolver) {
    StringBuffer result = new StringBuffer();
    Matcher matcher = DOLLAR_VAR_PATTERN.matcher(template);

    while (matcher.find()) {
      String varExpr = matcher.group(1);
      String envName;
      String defaultValue = "";

      int colonIdx = varExpr.indexOf(":-");
      if (colonIdx > 0) {
        envName = varExpr.substring(0, colonIdx);
        defaultValue = varExpr.substring(colonIdx + 2);
      } else {
        envName = varExpr;
      }

      String resolved = resolver.resolve(envName);
      if (resolved == null) {
        resolved = defaultValue;
      }
      if (resolved.isEmpty()) {
        resolved = "${" + varExpr + "}";
      }
      matcher.appendReplacement(result, Matcher.quoteReplacement(resolved));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  /**
   * Returns a copy of a configuration tree with the variable references of
   * every string value resolved. Nested maps and lists are copied; other
   * values are kept.
   *
   * @param map Configuration tree, as parsed from YAML or JSON
   * @param resolver Source of variable values
   * @return Resolved copy, in the same key order
   */
  public static Map<String, Object> resolveAll(Map<String, Object> map,
      SecretResolver resolver) {
    Map<String, Object> result = new LinkedHashMap<String, Object>();
    for (Map.Entry<String, Object> e : map.entrySet()) {
      result.put(e.getKey(), resolveValue(e.getValue(), resolver));
    }
    return result;
  }

  @SuppressWarnings("unchecked")
  private static @Nullable Object resolveValue(@Nullable Object value, SecretResolver resolver) {
    if (value instanceof String) {
      return resolveEnvVars((String) value, resolver);
    }
    if (value instanceof Map) {
      return resolveAll((Map<String, Object>) value, resolver);
    }
    if (value instanceof List) {
      List<Object> items = new ArrayList<Object>();
      for (Object item : (List<?>) value) {
        items.add(resolveValue(item, resolver));
      }
      return items;
    }
    return value;
  }

  /**
   * Returns a string value.
   */
  public static @Nullable String getString(Map<String, Object> map, String key,
      @Nullable String defaultValue) {
    Object value = map.get(key);
    if (value == null) {
      return defaultValue;
    }
    return String.valueOf(value);
  }

  /**
   * Returns an integer value. Accepts numbers and numeric strings.
   */
  public static int getInt(Map<String, Object> map, String key, int defaultValue) {
    Integer value = getInteger(map, key);
    return value != null ? value : defaultValue;
  }

  /**
   * Returns an integer value, or null if absent or neither a number nor a
   * string.
   *
   * @throws IllegalArgumentException if a string value does not parse as an
   *     integer
   */
  public static @Nullable Integer getInteger(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    if (value instanceof String) {
      try {
        return Integer.parseInt(((String) value).trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "Configuration value '" + key + "' is not an integer: " + value, e);
      }
    }
    return null;
  }

  /**
   * Returns a long value.
   */
  public static long getLong(Map<String, Object> map, String key, long defaultValue) {
    Object value = map.get(key);
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    if (value instanceof String) {
      try {
        return Long.parseLong(((String) value).trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "Configuration value '" + key + "' is not a number: " + value, e);
      }
    }
    return defaultValue;
  }

  /**
   * Returns a boolean value. Accepts booleans and "true"/"false" strings.
   */
  public static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
    Object value = map.get(key);
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof String) {
      return Boolean.parseBoolean(((String) value).trim());
    }
    return defaultValue;
  }

  /**
   * Returns a nested map, or null if absent.
   */
  @SuppressWarnings("unchecked")
  public static @Nullable Map<String, Object> getMap(Map<String, Object> map, String key) {
    Object value = map.get(key);
    return value instanceof Map ? (Map<String, Object>) value : null;
  }

  /**
   * Returns a map of string values, preserving declaration order.
   */
  public static Map<String, String> getStringMap(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (!(value instanceof Map)) {
      return Collections.emptyMap();
    }
    Map<String, String> result = new LinkedHashMap<String, String>();
    for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
      result.put(String.valueOf(e.getKey()), String.valueOf(e.getValue()));
    }
    return result;
  }

  /**
   * Returns a list of integers.
   */
  public static @Nullable List<Integer> getIntList(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (!(value instanceof List)) {
      return null;
    }
    List<Integer> result = new ArrayList<Integer>();
    for (Object item : (List<?>) value) {
      result.add(item instanceof Number
          ? ((Number) item).intValue()
          : Integer.parseInt(String.valueOf(item).trim()));
    }
    return result;
  }
}
