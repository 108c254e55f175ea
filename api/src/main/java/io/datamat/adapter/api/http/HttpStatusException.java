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

import java.io.IOException;

/**
 * Signals that an HTTP exchange completed with a non-2xx status.
 */
public class HttpStatusException extends IOException {

  private static final int MAX_BODY_IN_MESSAGE = 500;

  private final int statusCode;
  private final String body;
  private final @Nullable String retryAfter;

  public HttpStatusException(int statusCode, String body, @Nullable String retryAfter) {
    super("HTTP " + statusCode + ": " + truncate(body));
    this.statusCode = statusCode;
    this.body = body;
    this.retryAfter = retryAfter;
  }

  public static HttpStatusException of(ApiResponse response) {
    return new HttpStatusException(response.getStatusCode(), response.getBody(),
        response.getHeader("Retry-After"));
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getBody() {
    return body;
  }

  /**
   * Returns the raw {@code Retry-After} header value, or null.
   */
  public @Nullable String getRetryAfter() {
    return retryAfter;
  }

  private static String truncate(String body) {
    return body.length() <= MAX_BODY_IN_MESSAGE
        ? body
        : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
  }
}
