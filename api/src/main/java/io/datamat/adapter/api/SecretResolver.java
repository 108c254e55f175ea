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

import java.util.Map;

/**
 * Looks up secrets and environment-provided settings by name.
 *
 * <p>Credentials are never embedded in job configuration. The configuration
 * names the variables, and a SecretResolver supplies their values.
 */
public interface SecretResolver {

  /**
   * Resolves a named value.
   *
   * @param name Variable name, e.g. {@code OAUTH_CLIENT_ID}
   * @return The value, or null if it is not set or is empty
   */
  @Nullable String resolve(String name);

  /**
   * Returns a resolver that reads environment variables, then system properties.
   */
  static SecretResolver system() {
    return name -> {
      String value = System.getenv(name);
      if (value == null || value.isEmpty()) {
        value = System.getProperty(name);
      }
      return value == null || value.isEmpty() ? null : value;
    };
  }

  /**
   * Returns a resolver backed by a fixed map.
   */
  static SecretResolver of(Map<String, String> values) {
    return name -> {
      String value = values.get(name);
      return value == null || value.isEmpty() ? null : value;
    };
  }
}
