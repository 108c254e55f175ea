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

import io.datamat.adapter.api.ConfigValues;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Authentication configuration for an API source.
 *
 * <p>Each variant names the environment variables that hold its secrets; no
 * secret is embedded in the configuration itself.
 *
 * <h3>YAML Configuration Examples</h3>
 * <pre>{@code
 * auth:
 *   type: bearer-env
 *   tokenEnv: API_TOKEN
 *
 * auth:
 *   type: query-token
 *   name: apikey
 *   tokenEnv: API_KEY
 *
 * auth:
 *   type: oauth2
 *   tokenUrlEnv: OAUTH_TOKEN_URL
 *   clientIdEnv: BLING_CLIENT_ID
 *   clientSecretEnv: BLING_CLIENT_SECRET
 *   cacheDir: .secrets
 *   useBasicAuth: true
 * }</pre>
 */
public class AuthConfig {

  /**
   * Authentication variants.
   */
  public enum AuthType {
    /** No credentials. */
    NONE,
    /** {@code Authorization: Bearer <token>} with the token read from the environment. */
    BEARER_ENV,
    /** A raw token in a named header. */
    HEADER_TOKEN,
    /** A raw token in a named query parameter. */
    QUERY_TOKEN,
    /** OAuth2 authorization code grant with refresh and a persisted token cache. */
    OAUTH2
  }

  public static final String DEFAULT_CACHE_DIR = ".secrets";

  private final AuthType type;
  private final @Nullable String name;
  private final @Nullable String tokenEnv;
  private final String tokenUrlEnv;
  private final String authUrlEnv;
  private final String clientIdEnv;
  private final String clientSecretEnv;
  private final String redirectUriEnv;
  private final String scopeEnv;
  private final String cacheDir;
  private final boolean useBasicAuth;
  private final Map<String, String> tokenHeaders;

  private AuthConfig(Builder builder) {
    this.type = builder.type;
    this.name = builder.name;
    this.tokenEnv = builder.tokenEnv;
    this.tokenUrlEnv = builder.tokenUrlEnv;
    this.authUrlEnv = builder.authUrlEnv;
    this.clientIdEnv = builder.clientIdEnv;
    this.clientSecretEnv = builder.clientSecretEnv;
    this.redirectUriEnv = builder.redirectUriEnv;
    this.scopeEnv = builder.scopeEnv;
    this.cacheDir = builder.cacheDir;
    this.useBasicAuth = builder.useBasicAuth;
    this.tokenHeaders = Collections.unmodifiableMap(
        new LinkedHashMap<String, String>(builder.tokenHeaders));
  }

  public static AuthConfig none() {
    return builder(AuthType.NONE).build();
  }

  public static AuthConfig bearerEnv(String tokenEnv) {
    return builder(AuthType.BEARER_ENV).tokenEnv(tokenEnv).build();
  }

  public static AuthConfig headerToken(String headerName, String tokenEnv) {
    return builder(AuthType.HEADER_TOKEN).name(headerName).tokenEnv(tokenEnv).build();
  }

  public static AuthConfig queryToken(String paramName, String tokenEnv) {
    return builder(AuthType.QUERY_TOKEN).name(paramName).tokenEnv(tokenEnv).build();
  }

  public static AuthConfig oauth2() {
    return builder(AuthType.OAUTH2).build();
  }

  public static Builder builder(AuthType type) {
    return new Builder(type);
  }

  public AuthType getType() {
    return type;
  }

  /**
   * Returns the header or query parameter name for token variants.
   */
  public @Nullable String getName() {
    return name;
  }

  /**
   * Returns the environment variable holding the static token.
   */
  public @Nullable String getTokenEnv() {
    return tokenEnv;
  }

  public String getTokenUrlEnv() {
    return tokenUrlEnv;
  }

  public String getAuthUrlEnv() {
    return authUrlEnv;
  }

  public String getClientIdEnv() {
    return clientIdEnv;
  }

  public String getClientSecretEnv() {
    return clientSecretEnv;
  }

  public String getRedirectUriEnv() {
    return redirectUriEnv;
  }

  public String getScopeEnv() {
    return scopeEnv;
  }

  /**
   * Returns the directory holding one token cache file per client id.
   */
  public String getCacheDir() {
    return cacheDir;
  }

  /**
   * Whether client credentials are sent to the token endpoint as HTTP Basic
   * auth (true) or as form fields (false).
   */
  public boolean isUseBasicAuth() {
    return useBasicAuth;
  }

  /**
   * Returns extra headers sent to the token endpoint.
   */
  public Map<String, String> getTokenHeaders() {
    return tokenHeaders;
  }

  /**
   * Parses an auth block. Type names may be kebab-case ({@code bearer-env}),
   * camelCase ({@code bearerEnv}) or snake_case.
   */
  public static AuthConfig fromMap(@Nullable Map<String, Object> map) {
    if (map == null) {
      return none();
    }
    Object typeObj = map.containsKey("type") ? map.get("type") : map.get("kind");
    if (typeObj == null) {
      return none();
    }

    AuthType type = parseType(String.valueOf(typeObj));
    Builder builder = builder(type)
        .name(ConfigValues.getString(map, "name", null))
        .tokenEnv(ConfigValues.getString(map, "tokenEnv", null))
        .useBasicAuth(ConfigValues.getBoolean(map, "useBasicAuth", true))
        .tokenHeaders(ConfigValues.getStringMap(map, "tokenHeaders"));

    String value = ConfigValues.getString(map, "tokenUrlEnv", null);
    if (value != null) {
      builder.tokenUrlEnv(value);
    }
    value = ConfigValues.getString(map, "authUrlEnv", null);
    if (value != null) {
      builder.authUrlEnv(value);
    }
    value = ConfigValues.getString(map, "clientIdEnv", null);
    if (value != null) {
      builder.clientIdEnv(value);
    }
    value = ConfigValues.getString(map, "clientSecretEnv", null);
    if (value != null) {
      builder.clientSecretEnv(value);
    }
    value = ConfigValues.getString(map, "redirectUriEnv", null);
    if (value != null) {
      builder.redirectUriEnv(value);
    }
    value = ConfigValues.getString(map, "scopeEnv", null);
    if (value != null) {
      builder.scopeEnv(value);
    }
    value = ConfigValues.getString(map, "cacheDir", null);
    if (value != null) {
      builder.cacheDir(value);
    }
    return builder.build();
  }

  static AuthType parseType(String typeStr) {
    String normalized = typeStr
        .replaceAll("([a-z])([A-Z])", "$1_$2")
        .replace("-", "_")
        .toUpperCase(Locale.ROOT);
    if ("OAUTH2_GENERIC".equals(normalized)) {
      return AuthType.OAUTH2;
    }
    try {
      return AuthType.valueOf(normalized);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown auth type: " + typeStr, e);
    }
  }

  @Override public String toString() {
    return "AuthConfig{type=" + type + "}";
  }

  /**
   * Builder for AuthConfig.
   */
  public static class Builder {
    private final AuthType type;
    private @Nullable String name;
    private @Nullable String tokenEnv;
    private String tokenUrlEnv = "OAUTH_TOKEN_URL";
    private String authUrlEnv = "OAUTH_AUTH_URL";
    private String clientIdEnv = "OAUTH_CLIENT_ID";
    private String clientSecretEnv = "OAUTH_CLIENT_SECRET";
    private String redirectUriEnv = "OAUTH_REDIRECT_URI";
    private String scopeEnv = "OAUTH_SCOPE";
    private String cacheDir = DEFAULT_CACHE_DIR;
    private boolean useBasicAuth = true;
    private Map<String, String> tokenHeaders = Collections.emptyMap();

    private Builder(AuthType type) {
      this.type = type;
    }

    public Builder name(@Nullable String name) {
      this.name = name;
      return this;
    }

    public Builder tokenEnv(@Nullable String tokenEnv) {
      this.tokenEnv = tokenEnv;
      return this;
    }

    public Builder tokenUrlEnv(String tokenUrlEnv) {
      this.tokenUrlEnv = tokenUrlEnv;
      return this;
    }

    public Builder authUrlEnv(String authUrlEnv) {
      this.authUrlEnv = authUrlEnv;
      return this;
    }

    public Builder clientIdEnv(String clientIdEnv) {
      this.clientIdEnv = clientIdEnv;
      return this;
    }

    public Builder clientSecretEnv(String clientSecretEnv) {
      this.clientSecretEnv = clientSecretEnv;
      return this;
    }

    public Builder redirectUriEnv(String redirectUriEnv) {
      this.redirectUriEnv = redirectUriEnv;
      return this;
    }

    public Builder scopeEnv(String scopeEnv) {
      this.scopeEnv = scopeEnv;
      return this;
    }

    public Builder cacheDir(String cacheDir) {
      this.cacheDir = cacheDir;
      return this;
    }

    public Builder useBasicAuth(boolean useBasicAuth) {
      this.useBasicAuth = useBasicAuth;
      return this;
    }

    public Builder tokenHeaders(Map<String, String> tokenHeaders) {
      this.tokenHeaders = tokenHeaders;
      return this;
    }

    public AuthConfig build() {
      switch (type) {
        case BEARER_ENV:
          requireSet(tokenEnv, "tokenEnv");
          break;
        case HEADER_TOKEN:
        case QUERY_TOKEN:
          requireSet(tokenEnv, "tokenEnv");
          requireSet(name, "name");
          break;
        default:
          break;
      }
      return new AuthConfig(this);
    }

    private void requireSet(@Nullable String value, String field) {
      if (value == null || value.isEmpty()) {
        throw new IllegalArgumentException(
            "Auth type " + type + " requires '" + field + "'");
      }
    }
  }
}
