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
package io.datamat.adapter.api.http;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Status, headers and body of a completed HTTP exchange.
 *
 * <p>Header names are matched case-insensitively.
 */
public class ApiResponse {

  private final int statusCode;
  private final Map<String, List<String>> headers;
  private final String body;

  public ApiResponse(int statusCode, Map<String, List<String>> headers, @Nullable String body) {
    this.statusCode = statusCode;
    TreeMap<String, List<String>> sorted =
        new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
    sorted.putAll(headers);
    this.headers = Collections.unmodifiableMap(sorted);
    this.body = body != null ? body : "";
  }

  /**
   * Creates a response without headers.
   */
  public static ApiResponse of(int statusCode, String body) {
    return new ApiResponse(statusCode, Collections.<String, List<String>>emptyMap(), body);
  }

  public int getStatusCode() {
    return statusCode;
  }

  public Map<String, List<String>> getHeaders() {
    return headers;
  }

  /**
   * Returns the first value of the named header, or null.
   */
  public @Nullable String getHeader(String name) {
    List<String> values = headers.get(name);
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  public String getBody() {
    return body;
  }

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
