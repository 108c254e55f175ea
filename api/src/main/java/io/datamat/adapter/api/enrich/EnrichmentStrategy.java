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
package io.datamat.adapter.api.enrich;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

/**
 * How detail records are fetched during enrichment.
 */
public enum EnrichmentStrategy {
  /** One detail request at a time, paced by the enrichment rate channel. */
  SEQUENTIAL,
  /** A worker pool, with a separate cap on requests in flight. */
  CONCURRENT;

  /**
   * Parses a strategy name, case-insensitively. Null means sequential.
   *
   * @throws IllegalArgumentException for unknown names
   */
  public static EnrichmentStrategy fromString(@Nullable String value) {
    if (value == null || value.trim().isEmpty()) {
      return SEQUENTIAL;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown enrichment strategy '" + value
          + "', expected 'sequential' or 'concurrent'", e);
    }
  }
}
