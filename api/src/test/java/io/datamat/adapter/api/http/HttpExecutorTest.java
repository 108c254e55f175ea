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
import io.datamat.adapter.api.SecretResolver;
import io.datamat.adapter.api.auth.AuthConfig;
import io.datamat.adapter.api.auth.InMemoryTokenCache;
import io.datamat.adapter.api.auth.RequestAuthenticator;
import io.datamat.adapter.api.auth.TokenRecord;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for HttpExecutor.
 */
@Tag("unit")
public class HttpExecutorTest {

  private static final String URL = "https://api.example.com/v3/pedidos";
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  private static final ApiSourceConfig.RetryConfig FAST_RETRY =
      ApiSourceConfig.RetryConfig.of(3, 1, 5);

  private static Map<String, String> oauthEnv() {
    Map<String, String> env = new HashMap<String, String>();
    env.put("OAUTH_TOKEN_URL", "https://auth.example.com/token");
    env.put("OAUTH_CLIENT_ID", "client-1");
    env.put("OAUTH_CLIENT_SECRET", "s3cret");
    return env;
  }

  private static RequestAuthenticator oauthAuthenticator(ScriptedHttpTransport transport,
      InMemoryTokenCache cache) {
    return RequestAuthenticator.create(AuthConfig.oauth2(), SecretResolver.of(oauthEnv()),
        transport, CLOCK, cache);
  }

  private static boolean isTokenRequest(ApiRequest request) {
    return request.getMethod() == ApiRequest.Method.POST;
  }

  @Test void testSuccessfulRequest() {
    ScriptedHttpTransport transport = new ScriptedHttpTransport().respond(200, "[]");
    HttpExecutor executor =
        new HttpExecutor(transport, RequestAuthenticator.none(), FAST_RETRY);

    Map<String, String> params = new LinkedHashMap<String, String>();
    params.put("pagina", "1");
    params.put("dataInicial", "2026-01-01");
    ApiResponse response =
        executor.requestWithRetries(URL, params, RateGovernor.unlimited("main"));

    assertEquals(200, response.getStatusCode());
    ApiRequest request = transport.lastRequest();
    assertEquals(ApiRequest.Method.GET, request.getMethod());
    assertEquals("application/json", request.getHeaders().get("Accept"));
    assertEquals(params, ScriptedHttpTransport.queryOf(request));
  }

  @Test void testRetriesServerErrorsThenSucceeds() {
    ScriptedHttpTransport transport = new ScriptedHttpTransport()
        .respond(500, "boom")
        .respond(502, "bad gateway")
        .respond(200, "{\"data\": []}");
    HttpExecutor executor =
        new HttpExecutor(transport, RequestAuthenticator.none(), FAST_RETRY);

    ApiResponse response = executor.requestWithRetries(URL,
        Collections.<String, String>emptyMap(), RateGovernor.unlimited("main"));

    assertEquals(200, response.getStatusCode());
    assertEquals(3, transport.getRequestCount());
  }

  @Test void testRetriesNetworkFailures() {
    ScriptedHttpTransport transport = new ScriptedHttpTransport()
        .fail(new SocketTimeoutException("read timed out"))
        .respond(200, "[]");
    HttpExecutor executor =
        new HttpExecutor(transport, RequestAuthenticator.none(), FAST_RETRY);

    executor.requestWithRetries(URL, Collections.<String, String>emptyMap(),
        RateGovernor.unlimited("main"));

    assertEquals(2, transport.getRequestCount());
  }

  @Test void testReadTimeoutsAreRetriedUntilExhausted() {
    ScriptedHttpTransport transport = new ScriptedHttpTransport()
        .fail(new SocketTimeoutException("Read timed out"))
        .fail(new SocketTimeoutException("Read timed out"))
        .fail(new SocketTimeoutException("Read timed out"));
    HttpExecutor executor =
        new HttpExecutor(transport, RequestAuthenticator.none(), FAST_RETRY);

    DataExtractionException e = assertThrows(DataExtractionException.class, () ->
        executor.requestWithRetries(URL, Collections.<String, String>emptyMap(),
            RateGovernor.unlimited("main")));

    assertEquals(3, transport.getRequestCount());
    assertTrue(e.getMessage().contains("Maximum retries (3)"));
    assertInstanceOf(SocketTimeoutException.class, e.getCause());
  }

  @Test void testInterruptedTransportAbortsWithoutRetry() {
    ScriptedHttpTransport transport = new ScriptedHttpTransport()
        .fail(new InterruptedIOException("interrupted"))
        .respond(200, "[]");
    HttpExecutor executor =
        new HttpExecutor(transport, RequestAuthenticator.none(), FAST_RETRY);

    DataExtractionException e = assertThrows(DataExtractionException.class, () ->
        executor.requestWithRetries(URL, Collections.<String, String>emptyMap(),
            RateGovernor.unlimited("main")));

    assertEquals(1, transport.getRequestCount());
    assertTrue(e.getMessage().startsWith("Interrupted while requesting"));
  }

  @Test void testNonRetryableStatusAbortsImmediately() {
    ScriptedHttpTransport transport = new ScriptedHttpTransport().respond(404, "not found");
    HttpExecutor executor =
        new HttpExecutor(transport, RequestAuthenticator.none(), FAST_RETRY);

    DataExtractionException e = assertThrows(DataExtractionException.class, () ->
        executor.requestWithRetries(URL, Collections.<String, String>emptyMap(),
            RateGovernor.unlimited("main")));

    assertEquals(1, transport.getRequestCount());
    HttpStatusException cause = assertInstanceOf(HttpStatusException.class, e.getCause());
    assertEquals(404, cause.getStatusCode());
  }

  @Test void testExhaustedRetriesCarryLastFailure() {
    ScriptedHttpTransport transport = new ScriptedHttpTransport()
        .otherwise(request -> ApiResponse.of(503, "unavailable"));
    HttpExecutor executor =
        new HttpExecutor(transport, RequestAuthenticator.none(), FAST_RETRY);

    DataExtractionException e = assertThrows(DataExtractionException.class, () ->
        executor.requestWithRetries(URL, Collections.<String, String>emptyMap(),
            RateGovernor.unlimited("main")));

    assertEquals(3, transport.getRequestCount());
    assertTrue(e.getMessage().contains("Maximum retries (3)"), e.getMessage());
    assertEquals(503, ((HttpStatusException) e.getCause()).getStatusCode());
  }

  @Test void testZeroRetriesStillMakesOneAttempt() {
    ScriptedHttpTransport transport = new ScriptedHttpTransport()
        .otherwise(request -> ApiResponse.of(500, "boom"));
    HttpExecutor executor = new HttpExecutor(transport, RequestAuthenticator.none(),
        ApiSourceConfig.RetryConfig.of(0, 1, 5));

    assertThrows(DataExtractionException.class, () ->
        executor.requestWithRetries(URL, Collections.<String, String>emptyMap(),
            RateGovernor.unlimited("main")));
    assertEquals(1, transport.getRequestCount());
  }

  @Test void testBackoffDoublesPerAttempt() {
    HttpExecutor executor = new HttpExecutor(new ScriptedHttpTransport(),
        RequestAuthenticator.none(), ApiSourceConfig.RetryConfig.of(5, 500, 30));
    IOException failure = new IOException("reset");

    assertEquals(500, executor.computeDelayMs(0, failure));
    assertEquals(1000, executor.computeDelayMs(1, failure));
    assertEquals(4000, executor.computeDelayMs(3, failure));
  }

  @Test void testTooManyRequestsHonoursRetryAfter() {
    HttpExecutor executor = new HttpExecutor(new ScriptedHttpTransport(),
        RequestAuthenticator.none(), ApiSourceConfig.RetryConfig.of(5, 500, 30));

    assertEquals(7000, executor.computeDelayMs(2, new HttpStatusException(429, "", "7")));
    // no header: regular backoff
    assertEquals(2000, executor.computeDelayMs(2, new HttpStatusException(429, "", null)));
    // header on another status is ignored
    assertEquals(2000, executor.computeDelayMs(2, new HttpStatusException(503, "", "7")));
  }

  @Test void testParseRetryAfter() {
    assertEquals(Long.valueOf(3000), HttpExecutor.parseRetryAfterMs("3"));
    assertEquals(Long.valueOf(0), HttpExecutor.parseRetryAfterMs("Wed, 21 Oct 2015 07:28:00 GMT"));
    assertNull(HttpExecutor.parseRetryAfterMs("soon"));
    assertNull(HttpExecutor.parseRetryAfterMs(null));
  }

  @Test void testHugeRetryAfterDoesNotOverflow() {
    assertEquals(Long.valueOf(Long.MAX_VALUE),
        HttpExecutor.parseRetryAfterMs("9223372036854775807"));
    assertEquals(Long.valueOf(Long.MAX_VALUE),
        HttpExecutor.parseRetryAfterMs("9300000000000000"));
    assertEquals(Long.valueOf(0), HttpExecutor.parseRetryAfterMs("-5"));

    HttpExecutor executor = new HttpExecutor(new ScriptedHttpTransport(),
        RequestAuthenticator.none(), FAST_RETRY);
    assertEquals(HttpExecutor.MAX_RETRY_AFTER_MS, executor.computeDelayMs(0,
        new HttpStatusException(429, "", "9300000000000000")));
  }

  @Test void testTooManyRequestsIsRetried() {
    ApiResponse throttled = new ApiResponse(429,
        Collections.singletonMap("Retry-After", Collections.singletonList("0")), "slow down");
    ScriptedHttpTransport transport = new ScriptedHttpTransport()
        .respond(throttled)
        .respond(200, "[]");
    HttpExecutor executor =
        new HttpExecutor(transport, RequestAuthenticator.none(), FAST_RETRY);

    executor.requestWithRetries(URL, Collections.<String, String>emptyMap(),
        RateGovernor.unlimited("main"));

    assertEquals(2, transport.getRequestCount());
  }

  @Test void testUnauthorizedTriggersSingleRefreshThenSucceeds() {
    InMemoryTokenCache cache = new InMemoryTokenCache(
        new TokenRecord("stale", "refresh-1", NOW.plusSeconds(1800), "Bearer", null));
    ScriptedHttpTransport transport = new ScriptedHttpTransport()
        .respond(401, "{\"error\": \"invalid_token\"}")
        .respond(200, "{\"access_token\": \"fresh\", \"expires_in\": 3600}")
        .respond(200, "{\"data\": [{\"id\": 1}]}");
    RequestAuthenticator authenticator = oauthAuthenticator(transport, cache);
    HttpExecutor executor = new HttpExecutor(transport, authenticator, FAST_RETRY);

    ApiResponse response = executor.requestWithRetries(URL,
        Collections.<String, String>emptyMap(), RateGovernor.unlimited("main"));

    assertEquals(200, response.getStatusCode());
    assertEquals(1, authenticator.getTokenStore().getRefreshCount());
    List<ApiRequest> requests = transport.getRequests();
    assertEquals(3, requests.size());
    assertEquals("Bearer stale", requests.get(0).getHeaders().get("Authorization"));
    assertTrue(isTokenRequest(requests.get(1)));
    assertEquals("refresh_token",
        ScriptedHttpTransport.formOf(requests.get(1)).get("grant_type"));
    assertEquals("Bearer fresh", requests.get(2).getHeaders().get("Authorization"));
    // the refresh token survives a response that omits it
    assertEquals("refresh-1", cache.load().getRefreshToken());
  }

  @Test void testUnauthorizedAfterRefreshFailsAuthentication() {
    InMemoryTokenCache cache = new InMemoryTokenCache(
        new TokenRecord("stale", "refresh-1", NOW.plusSeconds(1800), "Bearer", null));
    ScriptedHttpTransport transport = new ScriptedHttpTransport()
        .respond(401, "")
        .respond(200, "{\"access_token\": \"fresh\", \"expires_in\": 3600}")
        .respond(401, "");
    RequestAuthenticator authenticator = oauthAuthenticator(transport, cache);
    HttpExecutor executor = new HttpExecutor(transport, authenticator, FAST_RETRY);

    assertThrows(AuthenticationException.class, () ->
        executor.requestWithRetries(URL, Collections.<String, String>emptyMap(),
            RateGovernor.unlimited("main")));
    assertEquals(1, authenticator.getTokenStore().getRefreshCount());
    assertEquals(3, transport.getRequestCount());
  }

  @Test void testUnauthorizedWithoutOAuthIsNotRetried() {
    ScriptedHttpTransport transport = new ScriptedHttpTransport().respond(401, "");
    Map<String, String> env = Collections.singletonMap("API_TOKEN", "abc");
    RequestAuthenticator authenticator = RequestAuthenticator.create(
        AuthConfig.bearerEnv("API_TOKEN"), SecretResolver.of(env), transport, CLOCK, null);
    HttpExecutor executor = new HttpExecutor(transport, authenticator, FAST_RETRY);

    assertThrows(DataExtractionException.class, () ->
        executor.requestWithRetries(URL, Collections.<String, String>emptyMap(),
            RateGovernor.unlimited("main")));
    assertEquals(1, transport.getRequestCount());
    assertEquals("Bearer abc", transport.lastRequest().getHeaders().get("Authorization"));
  }

  @Test void testBuildUrlWithParams() {
    Map<String, String> params = new LinkedHashMap<String, String>();
    params.put("q", "a b&c");
    params.put("pagina", "2");

    assertEquals(URL, HttpExecutor.buildUrlWithParams(URL, Collections.<String, String>emptyMap()));
    assertEquals(URL + "?q=a+b%26c&pagina=2", HttpExecutor.buildUrlWithParams(URL, params));
    assertEquals(URL + "?x=1&pagina=2",
        HttpExecutor.buildUrlWithParams(URL + "?x=1",
            Collections.singletonMap("pagina", "2")));
  }
}
