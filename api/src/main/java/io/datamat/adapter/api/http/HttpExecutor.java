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

import io.datamat.adapter.api.ApiSourceConfig;
import io.datamat.adapter.api.AuthenticationException;
import io.datamat.adapter.api.DataExtractionException;
import io.datamat.adapter.api.auth.RequestAuthenticator;

import org.checkerframework.checker.nullness.qual.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Issues GET requests with rate pacing, authentication, retries and
 * exponential backoff.
 *
 * <p>For each attempt the executor waits on the supplied {@link RateGovernor},
 * attaches credentials and sends the request. Failures are handled as follows:
 * <ul>
 *   <li>401 with OAuth2 auth: the token is refreshed once and the same request
 *       is re-sent once, before the generic retry loop applies</li>
 *   <li>Retryable statuses (by default 429, 500, 502, 503, 504) and network
 *       errors: retried after {@code backoffBase * 2^attempt}; a 429 carrying
 *       {@code Retry-After} waits for the server-declared delay instead</li>
 *   <li>Any other non-2xx status: fails immediately without using the retry
 *       budget</li>
 * </ul>
 *
 * <p>Exhausting the attempts raises {@link DataExtractionException} carrying
 * the last failure. Instances are safe for concurrent use.
 */
public class HttpExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpExecutor.class);
  private static final int TOO_MANY_REQUESTS = 429;
  private static final int UNAUTHORIZED = 401;
  /** Upper bound on a server-declared {@code Retry-After} delay. */
  static final long MAX_RETRY_AFTER_MS = TimeUnit.MINUTES.toMillis(10);

  private final HttpTransport transport;
  private final RequestAuthenticator authenticator;
  private final ApiSourceConfig.RetryConfig retry;

  public HttpExecutor(HttpTransport transport, RequestAuthenticator authenticator,
      ApiSourceConfig.RetryConfig retry) {
    this.transport = transport;
    this.authenticator = authenticator;
    this.retry = retry;
  }

  /**
   * Performs a GET request, retrying transient failures.
   *
   * @param url Base URL without query string
   * @param params Query parameters
   * @param governor Rate channel to pace the request on
   * @return The successful (2xx) response
   * @throws DataExtractionException if retries are exhausted or the status is
   *     not retryable
   * @throws AuthenticationException if credentials are missing or rejected
   */
  public ApiResponse requestWithRetries(String url, Map<String, String> params,
      RateGovernor governor) {
    int maxAttempts = Math.max(1, retry.getMaxRetries());
    boolean refreshedOnUnauthorized = false;
    IOException lastFailure = null;

    for (int attempt = 0; attempt < maxAttempts; attempt++) {
      try {
        Exchange exchange = send(url, params, governor);
        ApiResponse response = exchange.response;

        if (response.getStatusCode() == UNAUTHORIZED && authenticator.isOAuth2()
            && !refreshedOnUnauthorized) {
          LOGGER.warn("Received 401 from {}; forcing token refresh and retrying once", url);
          refreshedOnUnauthorized = true;
          authenticator.refreshRejectedToken(exchange.accessToken);
          response = send(url, params, governor).response;
        }

        if (response.isSuccessful()) {
          return response;
        }

        HttpStatusException failure = HttpStatusException.of(response);
        if (response.getStatusCode() == UNAUTHORIZED && authenticator.isOAuth2()) {
          throw new AuthenticationException(
              "Access token rejected by " + url + " even after refresh", failure);
        }
        if (!retry.isRetryable(response.getStatusCode())) {
          LOGGER.error("Non-retryable status {} from {}", response.getStatusCode(), url);
          throw new DataExtractionException(
              "Request to " + url + " failed with non-retryable status "
                  + response.getStatusCode(), failure);
        }
        lastFailure = failure;
      } catch (SocketTimeoutException e) {
        lastFailure = e;
      } catch (InterruptedIOException e) {
        throw new DataExtractionException("Interrupted while requesting " + url, e);
      } catch (IOException e) {
        lastFailure = e;
      }

      if (attempt + 1 < maxAttempts) {
        long delayMs = computeDelayMs(attempt, lastFailure);
        LOGGER.warn("Request to {} failed, retrying in {}ms (attempt {}/{}): {}",
            url, delayMs, attempt + 1, maxAttempts, lastFailure.getMessage());
        sleep(delayMs, url);
      }
    }

    LOGGER.error("Maximum retries ({}) reached for {}", maxAttempts, url);
    throw new DataExtractionException(
        "Maximum retries (" + maxAttempts + ") reached for " + url, lastFailure);
  }

  private Exchange send(String url, Map<String, String> params, RateGovernor governor)
      throws IOException {
    try {
      governor.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      InterruptedIOException ioe = new InterruptedIOException("Interrupted during rate pacing");
      ioe.initCause(e);
      throw ioe;
    }

    Map<String, String> headers = new LinkedHashMap<String, String>();
    headers.put("Accept", "application/json");
    Map<String, String> query = new LinkedHashMap<String, String>(params);
    String accessToken = authenticator.apply(headers, query);

    ApiRequest request = ApiRequest.get(URI.create(buildUrlWithParams(url, query)))
        .headers(headers)
        .timeout(Duration.ofSeconds(retry.getTimeoutSeconds()))
        .build();
    ApiResponse response = transport.send(request);
    LOGGER.debug("GET {} -> {}", url, response.getStatusCode());
    return new Exchange(response, accessToken);
  }

  /**
   * Returns the delay before the next attempt. A 429 honours the server's
   * {@code Retry-After} header when present.
   */
  long computeDelayMs(int attempt, IOException failure) {
    if (failure instanceof HttpStatusException) {
      HttpStatusException status = (HttpStatusException) failure;
      if (status.getStatusCode() == TOO_MANY_REQUESTS) {
        Long retryAfter = parseRetryAfterMs(status.getRetryAfter());
        if (retryAfter != null) {
          if (retryAfter > MAX_RETRY_AFTER_MS) {
            LOGGER.warn("Retry-After of {}ms exceeds the {}ms cap", retryAfter,
                MAX_RETRY_AFTER_MS);
            return MAX_RETRY_AFTER_MS;
          }
          return retryAfter;
        }
      }
    }
    return retry.getBackoffBaseMs() * (1L << Math.min(attempt, 30));
  }

  /**
   * Parses a {@code Retry-After} value given either as delta-seconds or as an
   * HTTP date.
   */
  static @Nullable Long parseRetryAfterMs(@Nullable String value) {
    if (value == null || value.trim().isEmpty()) {
      return null;
    }
    String trimmed = value.trim();
    try {
      return Math.max(0L, TimeUnit.SECONDS.toMillis(Long.parseLong(trimmed)));
    } catch (NumberFormatException e) {
      try {
        ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
        return Math.max(0L, Duration.between(Instant.now(), at.toInstant()).toMillis());
      } catch (DateTimeParseException dte) {
        LOGGER.debug("Ignoring unparseable Retry-After header '{}'", value);
        return null;
      }
    }
  }

  private static void sleep(long delayMs, String url) {
    if (delayMs <= 0) {
      return;
    }
    try {
      Thread.sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DataExtractionException("Interrupted during retry backoff for " + url, e);
    }
  }

  /**
   * Builds a URL with query parameters appended.
   */
  public static String buildUrlWithParams(String baseUrl, Map<String, String> params) {
    if (params == null || params.isEmpty()) {
      return baseUrl;
    }

    StringBuilder url = new StringBuilder(baseUrl);
    char separator = baseUrl.contains("?") ? '&' : '?';

    for (Map.Entry<String, String> e : params.entrySet()) {
      url.append(separator)
          .append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
          .append('=')
          .append(URLEncoder.encode(String.valueOf(e.getValue()), StandardCharsets.UTF_8));
      separator = '&';
    }

    return url.toString();
  }

  /** A response together with the OAuth2 access token that was sent, if any. */
  private static class Exchange {
    final ApiResponse response;
    final @Nullable String accessToken;

    Exchange(ApiResponse response, @Nullable String accessToken) {
      this.response = response;
      this.accessToken = accessToken;
    }
  }
}
