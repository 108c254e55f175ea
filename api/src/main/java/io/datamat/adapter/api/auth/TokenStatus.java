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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;

/**
 * Snapshot of a {@link TokenStore}'s state, safe to print: it never carries
 * token values.
 */
public class TokenStatus {

  private final TokenState state;
  private final boolean accessTokenPresent;
  private final boolean refreshTokenPresent;
  private final @Nullable Instant expiresAt;
  private final long secondsRemaining;

  TokenStatus(TokenState state, boolean accessTokenPresent, boolean refreshTokenPresent,
      @Nullable Instant expiresAt, long secondsRemaining) {
    this.state = state;
    this.accessTokenPresent = accessTokenPresent;
    this.refreshTokenPresent = refreshTokenPresent;
    this.expiresAt = expiresAt;
    this.secondsRemaining = secondsRemaining;
  }

  public TokenState getState() {
    return state;
  }

  public boolean isAccessTokenPresent() {
    return accessTokenPresent;
  }

  public boolean isRefreshTokenPresent() {
    return refreshTokenPresent;
  }

  public @Nullable Instant getExpiresAt() {
    return expiresAt;
  }

  /**
   * Returns seconds until the access token expires; zero or negative once it
   * has expired.
   */
  public long getSecondsRemaining() {
    return secondsRemaining;
  }

  @Override public String toString() {
    return "TokenStatus{state=" + state
        + ", accessToken=" + (accessTokenPresent ? "present" : "absent")
        + ", refreshToken=" + (refreshTokenPresent ? "present" : "absent")
        + ", expiresAt=" + expiresAt
        + ", secondsRemaining=" + secondsRemaining + "}";
  }
}
