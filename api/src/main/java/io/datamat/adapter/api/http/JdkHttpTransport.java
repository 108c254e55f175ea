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

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * {@link HttpTransport} backed by {@link java.net.http.HttpClient}.
 */
public class JdkHttpTransport implements HttpTransport {

  private final HttpClient httpClient;

  public JdkHttpTransport() {
    this(HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(30))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build());
  }

  public JdkHttpTransport(HttpClient httpClient) {
    this.httpClient = httpClient;
  }

  @Override public ApiResponse send(ApiRequest request) throws IOException {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(request.getUri())
        .timeout(request.getTimeout());

    for (Map.Entry<String, String> e : request.getHeaders().entrySet()) {
      builder.header(e.getKey(), e.getValue());
    }

    if (request.getMethod() == ApiRequest.Method.POST) {
      String body = request.getBody();
      builder.POST(body != null
          ? HttpRequest.BodyPublishers.ofString(body)
          : HttpRequest.BodyPublishers.noBody());
    } else {
      builder.GET();
    }

    try {
      HttpResponse<String> response =
          httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
      return new ApiResponse(response.statusCode(), response.headers().map(), response.body());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      InterruptedIOException ioe = new InterruptedIOException("Interrupted during " + request);
      ioe.initCause(e);
      throw ioe;
    }
  }
}
