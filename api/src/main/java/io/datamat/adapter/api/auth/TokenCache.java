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

import java.io.IOException;

/**
 * Durable storage for one credential identity's OAuth2 tokens.
 *
 * <p>Concurrent processes sharing one store are not coordinated; the last
 * writer wins.
 *
 * @see FileTokenCache
 * @see InMemoryTokenCache
 */
public interface TokenCache {

  /**
   * Loads the stored record.
   *
   * @return The record, or null if nothing has been stored yet
   * @throws IOException if the store exists but cannot be read
   */
  @Nullable TokenRecord load() throws IOException;

  /**
   * Replaces the stored record.
   *
   * @param record Record to persist
   * @throws IOException if the record cannot be written
   */
  void save(TokenRecord record) throws IOException;
}
