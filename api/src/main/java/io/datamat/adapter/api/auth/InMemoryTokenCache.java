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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TokenCache} held in memory, for tests and short-lived processes.
 */
public class InMemoryTokenCache implements TokenCache {

  private volatile @Nullable TokenRecord record;
  private final AtomicInteger saveCount = new AtomicInteger();

  public InMemoryTokenCache() {
  }

  public InMemoryTokenCache(@Nullable TokenRecord initial) {
    this.record = initial;
  }

  @Override public @Nullable TokenRecord load() {
    return record;
  }

  @Override public void save(TokenRecord record) {
    this.record = record;
    saveCount.incrementAndGet();
  }

  /**
   * Returns how many times a record has been saved.
   */
  public int getSaveCount() {
    return saveCount.get();
  }
}
