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

import com.fasterxml.jackson.databind.JsonNode;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An OAuth2 token pair with its absolute expiry.
 *
 * <p>The expiry already has the safety buffer subtracted, so a token is
 * usable while {@code now < expiresAt}. Records are immutable; every refresh
 * produces a new record that supersedes the previous one.
 */
public class TokenRecord {

  static final String ACCESS_TOKEN = "access_token";
  static final String REFRESH_TOKEN = "refresh_token";
  static final String EXPIRES_AT = "expires_at";
  static final String EXPIRES_IN = "expires_in";
  static final String TOKEN_TYPE = "token_type";
  static final String SCOPE = "scope";

  private final @Nullable String accessToken;
  private final @Nullable String refreshToken;
  private final Instant expiresAt;
  private final @Nullable String tokenType;
  private final @Nullable String scope;

  public TokenRecord(@Nullable String accessToken, @Nullable String refreshToken,
      Instant expiresAt, @Nullable String tokenType, @Nullable String scope) {
    this.accessToken = accessToken;
    this.refreshToken = refreshToken;
    this.expiresAt = expiresAt;
    this.tokenType = tokenType;
    this.scope = scope;
  }

  /**
   * Builds a record from a token endpoint response.
   *
   * <p>A response that omits {@code refresh_token} keeps the previous refresh
   * token: some providers issue it only on the first exchange.
   *
   * @param json Token endpoint response body
   * @param previous Record being superseded, may be null
   * @param issuedAt Issuance instant
   * @param expiryBufferSeconds Seconds subtracted from the declared lifetime
   * @param defaultLifetimeSeconds Lifetime assumed when {@code expires_in} is absent
   */
  static TokenRecord fromTokenResponse(JsonNode json, @Nullable TokenRecord previous,
      Instant issuedAt, long expiryBufferSeconds, long defaultLifetimeSeconds) {
    long expiresIn = json.hasNonNull(EXPIRES_IN)
        ? json.get(EXPIRES_IN).asLong(defaultLifetimeSeconds)
        : defaultLifetimeSeconds;
    Instant expiresAt = issuedAt.plusSeconds(Math.max(0, expiresIn - expiryBufferSeconds));

    String refreshToken = text(json, REFRESH_TOKEN);
    if (refreshToken == null && previous != null) {
      refreshToken = previous.getRefreshToken();
    }
    String scope = text(json, SCOPE);
    if (scope == null && previous != null) {
      scope = previous.getScope();
    }
    return new TokenRecord(text(json, ACCESS_TOKEN), refreshToken, expiresAt,
        text(json, TOKEN_TYPE), scope);
  }

  /**
   * Reads a record from its persisted key-value form.
   */
  static TokenRecord fromJson(JsonNode json) {
    Instant expiresAt = json.hasNonNull(EXPIRES_AT)
        ? Instant.ofEpochSecond(json.get(EXPIRES_AT).asLong(0))
        : Instant.EPOCH;
    return new TokenRecord(text(json, ACCESS_TOKEN), text(json, REFRESH_TOKEN), expiresAt,
        text(json, TOKEN_TYPE), text(json, SCOPE));
  }

  /**
   * Returns the persisted key-value form.
   */
  Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    map.put(ACCESS_TOKEN, accessToken);
    map.put(REFRESH_TOKEN, refreshToken);
    map.put(EXPIRES_AT, expiresAt.getEpochSecond());
    map.put(TOKEN_TYPE, tokenType);
    map.put(SCOPE, scope);
    return map;
  }

  private static @Nullable String text(JsonNode json, String field) {
    JsonNode node = json.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    String value = node.asText();
    return value.isEmpty() ? null : value;
  }

  public @Nullable String getAccessToken() {
    return accessToken;
  }

  public @Nullable String getRefreshToken() {
    return refreshToken;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public @Nullable String getTokenType() {
    return tokenType;
  }

  public @Nullable String getScope() {
    return scope;
  }

  /**
   * Whether the access token is missing or past its (buffered) expiry.
   */
  public boolean isExpired(Instant now) {
    return accessToken == null || !now.isBefore(expiresAt);
  }

  @Override public String toString() {
    return "TokenRecord{accessToken=" + (accessToken != null ? "***" : "null")
        + ", refreshToken=" + (refreshToken != null ? "***" : "null")
        + ", expiresAt=" + expiresAt + ", tokenType=" + tokenType + ", scope=" + scope + "}";
  }
}
