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

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single HTTP request issued through an {@link HttpTransport}.
 *
 * <p>Requests are immutable. The URI already contains any query string.
 */
public class ApiRequest {

  /**
   * HTTP methods used by the adapter. Data endpoints are read with GET; POST
   * is used only for OAuth2 token endpoints.
   */
  public enum Method {
    GET, POST
  }

  private final Method method;
  private final URI uri;
  private final Map<String, String> headers;
  private final @Nullable String body;
  private final Duration timeout;

  private ApiRequest(Builder builder) {
    this.method = builder.method;
    this.uri = builder.uri;
    this.headers = Collections.unmodifiableMap(
        new LinkedHashMap<String, String>(builder.headers));
    this.body = builder.body;
    this.timeout = builder.timeout;
  }

  public Method getMethod() {
    return method;
  }

  public URI getUri() {
    return uri;
  }

  public Map<String, String> getHeaders() {
    return headers;
  }

  public @Nullable String getBody() {
    return body;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public static Builder get(URI uri) {
    return new Builder(Method.GET, uri);
  }

  public static Builder post(URI uri, String body) {
    return new Builder(Method.POST, uri).body(body);
  }

  @Override public String toString() {
    // Headers are omitted: they carry credentials.
    return method + " " + uri;
  }

  /**
   * Builder for ApiRequest.
   */
  public static class Builder {
    private final Method method;
    private final URI uri;
    private final Map<String, String> headers = new LinkedHashMap<String, String>();
    private @Nullable String body;
    private Duration timeout = Duration.ofSeconds(30);

    private Builder(Method method, URI uri) {
      this.method = method;
      this.uri = uri;
    }

    public Builder header(String name, String value) {
      this.headers.put(name, value);
      return this;
    }

    public Builder headers(Map<String, String> headers) {
      this.headers.putAll(headers);
      return this;
    }

    public Builder body(@Nullable String body) {
      this.body = body;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public ApiRequest build() {
      return new ApiRequest(this);
    }
  }
}
