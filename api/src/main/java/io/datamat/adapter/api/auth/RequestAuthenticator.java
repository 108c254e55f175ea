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
import io.datamat.adapter.api.http.HttpTransport;

import org.checkerframework.checker.nullness.qual.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * Attaches credentials to outgoing requests according to an {@link AuthConfig}.
 *
 * <p>Static tokens are read from the {@link SecretResolver} on every request;
 * OAuth2 tokens come from a {@link TokenStore}.
 */
public class RequestAuthenticator {

  private static final Logger LOGGER = LoggerFactory.getLogger(RequestAuthenticator.class);

  private final AuthConfig config;
  private final SecretResolver secrets;
  private final @Nullable TokenStore tokenStore;

  RequestAuthenticator(AuthConfig config, SecretResolver secrets,
      @Nullable TokenStore tokenStore) {
    this.config = config;
    this.secrets = secrets;
    this.tokenStore = tokenStore;
  }

  /**
   * Returns an authenticator that attaches nothing.
   */
  public static RequestAuthenticator none() {
    return new RequestAuthenticator(AuthConfig.none(), SecretResolver.system(), null);
  }

  /**
   * Creates an authenticator for a configuration.
   *
   * @param config Auth configuration
   * @param secrets Source of secret values
   * @param transport Transport used for OAuth2 token requests
   * @param clock Clock for token expiry
   * @param tokenCache Token cache override; when null, OAuth2 tokens are kept
   *     in the per-client file under {@link AuthConfig#getCacheDir()}
   * @throws AuthenticationException if OAuth2 client settings are missing
   */
  public static RequestAuthenticator create(AuthConfig config, SecretResolver secrets,
      HttpTransport transport, Clock clock, @Nullable TokenCache tokenCache) {
    if (config.getType() != AuthConfig.AuthType.OAUTH2) {
      return new RequestAuthenticator(config, secrets, null);
    }
    LOGGER.info("Configuring OAuth2 client for API source");
    OAuth2Credentials credentials = OAuth2Credentials.resolve(config, secrets);
    TokenCache cache = tokenCache != null
        ? tokenCache
        : FileTokenCache.forClient(config.getCacheDir(), credentials.getClientId());
    TokenStore store = new TokenStore(credentials, cache, transport, clock,
        TokenStore.DEFAULT_EXPIRY_BUFFER);
    return new RequestAuthenticator(config, secrets, store);
  }

  /**
   * Adds credentials to a request's headers or query parameters.
   *
   * @param headers Mutable request headers
   * @param params Mutable query parameters
   * @return The OAuth2 access token that was attached, or null for other
   *     variants
   * @throws AuthenticationException if a required secret is missing or a token
   *     cannot be obtained
   */
  public @Nullable String apply(Map<String, String> headers, Map<String, String> params) {
    switch (config.getType()) {
      case BEARER_ENV:
        headers.put("Authorization", "Bearer " + requireSecret(config.getTokenEnv()));
        return null;
      case HEADER_TOKEN:
        headers.put(config.getName(), requireSecret(config.getTokenEnv()));
        return null;
      case QUERY_TOKEN:
        params.put(config.getName(), requireSecret(config.getTokenEnv()));
        return null;
      case OAUTH2:
        String accessToken = requireTokenStore().ensureAccessToken();
        headers.put("Authorization", "Bearer " + accessToken);
        return accessToken;
      case NONE:
      default:
        return null;
    }
  }

  /**
   * Whether requests are authenticated with OAuth2 tokens.
   */
  public boolean isOAuth2() {
    return config.getType() == AuthConfig.AuthType.OAUTH2;
  }

  /**
   * Forces a refresh after the API rejected an access token with 401.
   *
   * @param rejectedToken The token that was rejected
   */
  public void refreshRejectedToken(@Nullable String rejectedToken) {
    requireTokenStore().refreshRejected(rejectedToken);
  }

  /**
   * Returns the OAuth2 token store, or null for other variants.
   */
  public @Nullable TokenStore getTokenStore() {
    return tokenStore;
  }

  private TokenStore requireTokenStore() {
    if (tokenStore == null) {
      throw new IllegalStateException("Auth type " + config.getType() + " has no token store");
    }
    return tokenStore;
  }

  private String requireSecret(@Nullable String envName) {
    String value = envName != null ? secrets.resolve(envName) : null;
    if (value == null) {
      throw new AuthenticationException("Credential environment variable '" + envName
          + "' is not set for auth type " + config.getType());
    }
    return value;
  }
}
