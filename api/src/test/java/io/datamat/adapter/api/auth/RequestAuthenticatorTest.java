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
package io.datamat.adapter.api.auth;

import io.datamat.adapter.api.AuthenticationException;
import io.datamat.adapter.api.SecretResolver;
import io.datamat.adapter.api.http.ScriptedHttpTransport;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for RequestAuthenticator.
 */
@Tag("unit")
public class RequestAuthenticatorTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  private static RequestAuthenticator create(AuthConfig config, Map<String, String> env) {
    return RequestAuthenticator.create(config, SecretResolver.of(env),
        new ScriptedHttpTransport(), CLOCK, new InMemoryTokenCache());
  }

  @Test void testNoneAttachesNothing() {
    Map<String, String> headers = new LinkedHashMap<String, String>();
    Map<String, String> params = new LinkedHashMap<String, String>();

    assertNull(RequestAuthenticator.none().apply(headers, params));
    assertTrue(headers.isEmpty());
    assertTrue(params.isEmpty());
    assertFalse(RequestAuthenticator.none().isOAuth2());
  }

  @Test void testHeaderToken() {
    RequestAuthenticator auth = create(AuthConfig.headerToken("X-Api-Key", "API_KEY"),
        Collections.singletonMap("API_KEY", "k-1"));
    Map<String, String> headers = new LinkedHashMap<String, String>();

    auth.apply(headers, new LinkedHashMap<String, String>());

    assertEquals("k-1", headers.get("X-Api-Key"));
  }

  @Test void testQueryToken() {
    RequestAuthenticator auth = create(AuthConfig.queryToken("apikey", "API_KEY"),
        Collections.singletonMap("API_KEY", "k-2"));
    Map<String, String> params = new LinkedHashMap<String, String>();

    auth.apply(new LinkedHashMap<String, String>(), params);

    assertEquals("k-2", params.get("apikey"));
  }

  @Test void testMissingSecretFails() {
    RequestAuthenticator auth = create(AuthConfig.bearerEnv("API_TOKEN"),
        Collections.<String, String>emptyMap());

    assertThrows(AuthenticationException.class, () ->
        auth.apply(new LinkedHashMap<String, String>(), new LinkedHashMap<String, String>()));
  }

  @Test void testOAuth2RequiresClientSettings() {
    assertThrows(AuthenticationException.class, () ->
        create(AuthConfig.oauth2(), Collections.singletonMap("OAUTH_CLIENT_ID", "c")));
  }

  @Test void testOAuth2AttachesAccessToken() {
    Map<String, String> env = new HashMap<String, String>();
    env.put("OAUTH_TOKEN_URL", "https://auth.example.com/token");
    env.put("OAUTH_CLIENT_ID", "client-1");
    InMemoryTokenCache cache = new InMemoryTokenCache(
        new TokenRecord("a1", "r1", NOW.plusSeconds(600), "Bearer", null));
    RequestAuthenticator auth = RequestAuthenticator.create(AuthConfig.oauth2(),
        SecretResolver.of(env), new ScriptedHttpTransport(), CLOCK, cache);
    Map<String, String> headers = new LinkedHashMap<String, String>();

    String token = auth.apply(headers, new LinkedHashMap<String, String>());

    assertTrue(auth.isOAuth2());
    assertEquals("a1", token);
    assertEquals("Bearer a1", headers.get("Authorization"));
    assertNotNull(auth.getTokenStore());
  }

  @Test void testOAuth2DefaultsToFileCachePerClient(@TempDir Path dir) {
    Map<String, String> env = new HashMap<String, String>();
    env.put("OAUTH_TOKEN_URL", "https://auth.example.com/token");
    env.put("OAUTH_CLIENT_ID", "client-9");
    AuthConfig config = AuthConfig.builder(AuthConfig.AuthType.OAUTH2)
        .cacheDir(dir.toString())
        .build();

    RequestAuthenticator auth = RequestAuthenticator.create(config, SecretResolver.of(env),
        new ScriptedHttpTransport(), CLOCK, null);

    assertEquals("client-9", auth.getTokenStore().getClientId());
    assertEquals(TokenState.UNINITIALIZED, auth.getTokenStore().status().getState());
  }
}
