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
import io.datamat.adapter.api.http.ApiRequest;
import io.datamat.adapter.api.http.ApiResponse;
import io.datamat.adapter.api.http.HttpStatusException;
import io.datamat.adapter.api.http.HttpTransport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the OAuth2 token lifecycle for one credential identity.
 *
 * <p>The store loads its record from a {@link TokenCache} on construction and
 * writes it back after every mutation. Reads of a valid access token are
 * lock-free; refreshes are serialized, so concurrent callers that all observe
 * an expired token trigger a single network refresh.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * TokenStore store = new TokenStore(credentials,
 *     FileTokenCache.forClient(".secrets", credentials.getClientId()),
 *     new JdkHttpTransport());
 * store.exchangeCode(code);             // once, after the user authorizes
 * String token = store.ensureAccessToken();
 * }</pre>
 *
 * @see TokenState
 */
public class TokenStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(TokenStore.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final Duration DEFAULT_EXPIRY_BUFFER = Duration.ofSeconds(60);
  public static final long DEFAULT_LIFETIME_SECONDS = 3600;
  private static final Duration TOKEN_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  private final OAuth2Credentials credentials;
  private final TokenCache cache;
  private final HttpTransport transport;
  private final Clock clock;
  private final Duration expiryBuffer;
  private final ReentrantLock refreshLock = new ReentrantLock();
  private final AtomicInteger refreshCount = new AtomicInteger();

  private volatile @Nullable TokenRecord current;
  private volatile boolean invalid;

  public TokenStore(OAuth2Credentials credentials, TokenCache cache, HttpTransport transport) {
    this(credentials, cache, transport, Clock.systemUTC(), DEFAULT_EXPIRY_BUFFER);
  }

  public TokenStore(OAuth2Credentials credentials, TokenCache cache, HttpTransport transport,
      Clock clock, Duration expiryBuffer) {
    this.credentials = credentials;
    this.cache = cache;
    this.transport = transport;
    this.clock = clock;
    this.expiryBuffer = expiryBuffer;
    this.current = loadCache();
  }

  private @Nullable TokenRecord loadCache() {
    try {
      TokenRecord record = cache.load();
      if (record != null) {
        LOGGER.debug("Loaded cached tokens for client {}", credentials.getClientId());
      }
      return record;
    } catch (IOException e) {
      LOGGER.warn("Ignoring unreadable token cache {}: {}", cache, e.getMessage());
      return null;
    }
  }

  /**
   * Returns a valid access token, refreshing it first if it has expired.
   *
   * @throws AuthenticationException if a refresh is needed and fails, or no
   *     refresh token is available
   */
  public String ensureAccessToken() {
    TokenRecord token = current;
    if (token != null && !token.isExpired(clock.instant())) {
      return token.getAccessToken();
    }

    refreshLock.lock();
    try {
      token = current;
      if (token != null && !token.isExpired(clock.instant())) {
        // Refreshed by another caller while we waited for the lock.
        return token.getAccessToken();
      }
      return requireAccessToken(doRefresh(token));
    } finally {
      refreshLock.unlock();
    }
  }

  /**
   * Unconditionally refreshes the access token using the stored refresh token.
   *
   * @return The new token record
   * @throws AuthenticationException if no refresh token is stored or the token
   *     endpoint rejects it
   */
  public TokenRecord refresh() {
    refreshLock.lock();
    try {
      return doRefresh(current);
    } finally {
      refreshLock.unlock();
    }
  }

  /**
   * Refreshes the access token after the API rejected {@code rejectedToken},
   * unless another caller already replaced that token.
   *
   * @param rejectedToken Access token that received a 401, may be null
   */
  public void refreshRejected(@Nullable String rejectedToken) {
    refreshLock.lock();
    try {
      TokenRecord token = current;
      if (rejectedToken != null && token != null && token.getAccessToken() != null
          && !rejectedToken.equals(token.getAccessToken())) {
        LOGGER.debug("Rejected token already replaced; skipping refresh");
        return;
      }
      doRefresh(token);
    } finally {
      refreshLock.unlock();
    }
  }

  /**
   * Exchanges a one-time authorization code for an initial token pair.
   *
   * <p>If the response omits a refresh token, a previously stored one is kept.
   *
   * @param code Authorization code returned to the redirect URI
   * @return The new token record
   * @throws AuthenticationException if the exchange fails
   */
  public TokenRecord exchangeCode(String code) {
    if (code == null || code.trim().isEmpty()) {
      throw new AuthenticationException("An authorization code is required for the first "
          + "token exchange");
    }
    Map<String, String> form = new LinkedHashMap<String, String>();
    form.put("grant_type", "authorization_code");
    form.put("code", code.trim());
    if (credentials.getRedirectUri() != null) {
      form.put("redirect_uri", credentials.getRedirectUri());
    }
    if (credentials.getScope() != null) {
      form.put("scope", credentials.getScope());
    }

    refreshLock.lock();
    try {
      TokenRecord previous = current;
      TokenRecord record = postToken(form, previous, "authorization code exchange");
      invalid = false;
      store(record);
      LOGGER.info("Authorization code exchanged for client {}", credentials.getClientId());
      return record;
    } finally {
      refreshLock.unlock();
    }
  }

  /**
   * Builds the URL a user opens to authorize this client and obtain a code.
   *
   * @param authorizationUrl Provider's authorization endpoint; when null, the
   *     URL from the environment is used
   * @param state Opaque value echoed back to the redirect URI
   */
  public String buildAuthorizationUrl(@Nullable String authorizationUrl, String state) {
    String base = authorizationUrl != null ? authorizationUrl : credentials.getAuthorizationUrl();
    if (base == null) {
      throw new AuthenticationException("No OAuth2 authorization URL configured");
    }
    StringBuilder url = new StringBuilder(base);
    url.append(base.contains("?") ? '&' : '?')
        .append("response_type=code")
        .append("&client_id=").append(encode(credentials.getClientId()))
        .append("&state=").append(encode(state));
    if (credentials.getRedirectUri() != null) {
      url.append("&redirect_uri=").append(encode(credentials.getRedirectUri()));
    }
    return url.toString();
  }

  /**
   * Returns the current lifecycle state and expiry information.
   */
  public TokenStatus status() {
    TokenRecord token = current;
    if (token == null) {
      return new TokenStatus(TokenState.UNINITIALIZED, false, false, null, 0);
    }
    Instant now = clock.instant();
    TokenState state;
    if (invalid) {
      state = TokenState.INVALID;
    } else if (token.isExpired(now)) {
      state = TokenState.EXPIRED;
    } else {
      state = TokenState.AUTHORIZED;
    }
    return new TokenStatus(state, token.getAccessToken() != null,
        token.getRefreshToken() != null, token.getExpiresAt(),
        Duration.between(now, token.getExpiresAt()).getSeconds());
  }

  /**
   * Returns how many refreshes this store has performed.
   */
  public int getRefreshCount() {
    return refreshCount.get();
  }

  public String getClientId() {
    return credentials.getClientId();
  }

  /** Must be called with {@link #refreshLock} held. */
  private TokenRecord doRefresh(@Nullable TokenRecord token) {
    if (invalid) {
      throw new AuthenticationException("Refresh token for client " + credentials.getClientId()
          + " was rejected earlier; repeat the authorization code exchange");
    }
    String refreshToken = token != null ? token.getRefreshToken() : null;
    if (refreshToken == null) {
      throw new AuthenticationException("No refresh token available for client "
          + credentials.getClientId() + "; repeat the authorization code exchange");
    }

    Map<String, String> form = new LinkedHashMap<String, String>();
    form.put("grant_type", "refresh_token");
    form.put("refresh_token", refreshToken);

    refreshCount.incrementAndGet();
    TokenRecord record = postToken(form, token, "token refresh");
    store(record);
    LOGGER.info("Access token refreshed for client {}, valid until {}",
        credentials.getClientId(), record.getExpiresAt());
    return record;
  }

  private TokenRecord postToken(Map<String, String> form, @Nullable TokenRecord previous,
      String operation) {
    Map<String, String> body = new LinkedHashMap<String, String>(form);
    if (!credentials.isUseBasicAuth()) {
      body.put("client_id", credentials.getClientId());
      if (credentials.getClientSecret() != null) {
        body.put("client_secret", credentials.getClientSecret());
      }
    }

    ApiRequest.Builder request = ApiRequest.post(URI.create(credentials.getTokenUrl()),
            encodeForm(body))
        .header("Content-Type", "application/x-www-form-urlencoded")
        .header("Accept", "application/json")
        .timeout(TOKEN_REQUEST_TIMEOUT);
    if (credentials.isUseBasicAuth()) {
      String raw = credentials.getClientId() + ":"
          + (credentials.getClientSecret() != null ? credentials.getClientSecret() : "");
      request.header("Authorization", "Basic "
          + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8)));
    }
    request.headers(credentials.getTokenHeaders());

    ApiResponse response;
    try {
      response = transport.send(request.build());
    } catch (IOException e) {
      throw new AuthenticationException("OAuth2 " + operation + " failed: " + e.getMessage(), e);
    }

    int status = response.getStatusCode();
    if (status == 400 || status == 401) {
      if ("refresh_token".equals(form.get("grant_type"))) {
        invalid = true;
      }
      LOGGER.error("OAuth2 {} rejected with HTTP {} for client {}", operation, status,
          credentials.getClientId());
      throw new AuthenticationException("OAuth2 " + operation + " rejected (HTTP " + status
          + "); the grant is revoked or expired", HttpStatusException.of(response));
    }
    if (!response.isSuccessful()) {
      throw new AuthenticationException("OAuth2 " + operation + " failed with HTTP " + status,
          HttpStatusException.of(response));
    }

    JsonNode json;
    try {
      json = OBJECT_MAPPER.readTree(response.getBody());
    } catch (IOException e) {
      throw new AuthenticationException("OAuth2 " + operation + " returned invalid JSON", e);
    }
    if (json == null || !json.hasNonNull(TokenRecord.ACCESS_TOKEN)) {
      throw new AuthenticationException("OAuth2 " + operation + " response has no access_token");
    }
    return TokenRecord.fromTokenResponse(json, previous, clock.instant(),
        expiryBuffer.getSeconds(), DEFAULT_LIFETIME_SECONDS);
  }

  private void store(TokenRecord record) {
    current = record;
    try {
      cache.save(record);
    } catch (IOException e) {
      LOGGER.error("Failed to persist tokens to {}: {}", cache, e.getMessage());
      throw new AuthenticationException("Failed to persist OAuth2 tokens to " + cache, e);
    }
  }

  private static String requireAccessToken(TokenRecord record) {
    String accessToken = record.getAccessToken();
    if (accessToken == null) {
      throw new AuthenticationException("Token endpoint did not provide an access token");
    }
    return accessToken;
  }

  private static String encodeForm(Map<String, String> form) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> e : form.entrySet()) {
      if (sb.length() > 0) {
        sb.append('&');
      }
      sb.append(encode(e.getKey())).append('=').append(encode(e.getValue()));
    }
    return sb.toString();
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
