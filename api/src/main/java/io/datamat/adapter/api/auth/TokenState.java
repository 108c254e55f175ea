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

/**
 * Lifecycle states of a {@link TokenStore}.
 *
 * <pre>
 * UNINITIALIZED -&gt; AUTHORIZED -&gt; (EXPIRED &lt;-&gt; AUTHORIZED via refresh) -&gt; INVALID
 * </pre>
 */
public enum TokenState {
  /** No token has ever been obtained for this credential identity. */
  UNINITIALIZED,
  /** A usable access token is cached. */
  AUTHORIZED,
  /** The access token is past its expiry; the next use refreshes it. */
  EXPIRED,
  /** The refresh token was rejected; a new authorization code is required. */
  INVALID
}
