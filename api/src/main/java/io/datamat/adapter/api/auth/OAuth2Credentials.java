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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OAuth2 client settings, materialized from the environment variables named
 * by an {@link AuthConfig}.
 */
public class OAuth2Credentials {

  private final String tokenUrl;
  private final String clientId;
  private final @Nullable String clientSecret;
  private final @Nullable String redirectUri;
  private final @Nullable String scope;
  private final @Nullable String authorizationUrl;
  private final boolean useBasicAuth;
  private final Map<String, String> tokenHeaders;

  public OAuth2Credentials(String tokenUrl, String clientId, @Nullable String clientSecret,
      @Nullable String redirectUri, @Nullable String scope, @Nullable String authorizationUrl,
      boolean useBasicAuth, Map<String, String> tokenHeaders) {
    this.tokenUrl = tokenUrl;
    this.clientId = clientId;
    this.clientSecret = clientSecret;
    this.redirectUri = redirectUri;
    this.scope = scope;
    this.authorizationUrl = authorizationUrl;
    this.useBasicAuth = useBasicAuth;
    this.tokenHeaders = Collections.unmodifiableMap(
        new LinkedHashMap<String, String>(tokenHeaders));
  }

  /**
   * Resolves the credentials named by an OAuth2 auth configuration.
   *
   * @throws AuthenticationException if the token URL or client id is not set
   */
  public static OAuth2Credentials resolve(AuthConfig config, SecretResolver secrets) {
    String tokenUrl = secrets.resolve(config.getTokenUrlEnv());
    String clientId = secrets.resolve(config.getClientIdEnv());
    if (tokenUrl == null || clientId == null) {
      throw new AuthenticationException("OAuth2 requires environment variables '"
          + config.getTokenUrlEnv() + "' and '" + config.getClientIdEnv() + "'");
    }
    return new OAuth2Credentials(tokenUrl, clientId,
        secrets.resolve(config.getClientSecretEnv()),
        secrets.resolve(config.getRedirectUriEnv()),
        secrets.resolve(config.getScopeEnv()),
        secrets.resolve(config.getAuthUrlEnv()),
        config.isUseBasicAuth(),
        config.getTokenHeaders());
  }

  public String getTokenUrl() {
    return tokenUrl;
  }

  public String getClientId() {
    return clientId;
  }

  public @Nullable String getClientSecret() {
    return clientSecret;
  }

  public @Nullable String getRedirectUri() {
    return redirectUri;
  }

  public @Nullable String getScope() {
    return scope;
  }

  public @Nullable String getAuthorizationUrl() {
    return authorizationUrl;
  }

  public boolean isUseBasicAuth() {
    return useBasicAuth;
  }

  public Map<String, String> getTokenHeaders() {
    return tokenHeaders;
  }
}
