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

import io.datamat.adapter.api.ApiSourceConfig;
import io.datamat.adapter.api.AuthenticationException;
import io.datamat.adapter.api.DataExtractionException;
import io.datamat.adapter.api.RecordPaths;
import io.datamat.adapter.api.http.ApiResponse;
import io.datamat.adapter.api.http.HttpExecutor;
import io.datamat.adapter.api.http.RateGovernor;
import io.datamat.adapter.api.paging.PayloadExtractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches one detail record per distinct identity from
 * {@code <endpoint>/<identity>}.
 *
 * <p>In concurrent mode a fixed pool of {@code detailWorkers} threads runs
 * the fetches while a semaphore of {@code concurrentRequests} permits caps
 * how many are on the wire at once. The two bounds are independent.
 *
 * <p>A failed identity is logged and left out of the result; the batch goes
 * on. Authentication failures abort the whole enrichment. When no identity
 * enriches successfully the input rows are returned unchanged.
 */
public class EnrichmentEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(EnrichmentEngine.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  static final int PROGRESS_INTERVAL = 50;

  private final HttpExecutor executor;
  private final RateGovernor governor;
  private final String endpointUrl;
  private final String identityField;
  private final @Nullable String detailDataPath;
  private final ApiSourceConfig.EnrichmentConfig config;
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicInteger peakInFlight = new AtomicInteger();

  public EnrichmentEngine(HttpExecutor executor, RateGovernor governor, String endpointUrl,
      String identityField, @Nullable String detailDataPath,
      ApiSourceConfig.EnrichmentConfig config) {
    this.executor = executor;
    this.governor = governor;
    this.endpointUrl = endpointUrl;
    this.identityField = identityField;
    this.detailDataPath = detailDataPath;
    this.config = config;
  }

  /**
   * Replaces rows with their detail records.
   *
   * @param rows Consolidated rows
   * @return Detail records in identity order, or {@code rows} if none could
   *     be fetched
   * @throws DataExtractionException if no row carries the identity field
   * @throws AuthenticationException if credentials are rejected
   */
  public List<Map<String, Object>> enrich(List<Map<String, Object>> rows) {
    if (rows.isEmpty()) {
      return rows;
    }
    List<String> ids = distinctIdentities(rows);
    if (ids.isEmpty()) {
      throw new DataExtractionException(
          "Identity field '" + identityField + "' not found for enrichment");
    }

    LOGGER.info("Enriching {} records with strategy '{}'", ids.size(),
        config.getStrategy().name().toLowerCase(Locale.ROOT));
    List<Map<String, Object>> enriched = config.getStrategy() == EnrichmentStrategy.CONCURRENT
        ? enrichConcurrently(ids)
        : enrichSequentially(ids);

    if (enriched.isEmpty()) {
      LOGGER.warn("No record was enriched successfully, keeping the {} original rows",
          rows.size());
      return rows;
    }
    if (enriched.size() < ids.size()) {
      LOGGER.warn("Enriched {} of {} records; {} failed", enriched.size(), ids.size(),
          ids.size() - enriched.size());
    } else {
      LOGGER.info("Enriched {} records", enriched.size());
    }
    return enriched;
  }

  /**
   * Returns the highest number of detail requests observed in flight at
   * once.
   */
  public int getPeakInFlight() {
    return peakInFlight.get();
  }

  private List<String> distinctIdentities(List<Map<String, Object>> rows) {
    Set<String> ids = new LinkedHashSet<String>();
    for (Map<String, Object> row : rows) {
      String id = RecordPaths.identityOf(row, identityField);
      if (id != null) {
        ids.add(id);
      }
    }
    return new ArrayList<String>(ids);
  }

  private List<Map<String, Object>> enrichSequentially(List<String> ids) {
    List<Map<String, Object>> enriched = new ArrayList<Map<String, Object>>();
    for (int i = 0; i < ids.size(); i++) {
      if ((i + 1) % PROGRESS_INTERVAL == 0) {
        LOGGER.info("  ... {}/{} details fetched", i + 1, ids.size());
      }
      Map<String, Object> detail = fetchDetailOrNull(ids.get(i));
      if (detail != null) {
        enriched.add(detail);
      }
    }
    return enriched;
  }

  private List<Map<String, Object>> enrichConcurrently(List<String> ids) {
    final Semaphore permits = new Semaphore(config.getConcurrentRequests());
    ExecutorService pool = Executors.newFixedThreadPool(config.getDetailWorkers());
    List<CompletableFuture<Map<String, Object>>> futures =
        new ArrayList<CompletableFuture<Map<String, Object>>>();
    boolean aborted = true;
    try {
      for (final String id : ids) {
        futures.add(CompletableFuture.supplyAsync(() -> fetchWithPermit(permits, id), pool));
      }

      List<Map<String, Object>> enriched = new ArrayList<Map<String, Object>>();
      for (CompletableFuture<Map<String, Object>> future : futures) {
        Map<String, Object> detail = join(future);
        if (detail != null) {
          enriched.add(detail);
        }
      }
      aborted = false;
      return enriched;
    } finally {
      if (aborted) {
        for (CompletableFuture<Map<String, Object>> future : futures) {
          future.cancel(true);
        }
        pool.shutdownNow();
      } else {
        pool.shutdown();
      }
      try {
        pool.awaitTermination(1, TimeUnit.MINUTES);
      } catch (InterruptedException e) {
        LOGGER.warn("Enrichment pool interrupted: {}", e.getMessage());
        Thread.currentThread().interrupt();
      }
    }
  }

  private @Nullable Map<String, Object> fetchWithPermit(Semaphore permits, String id) {
    try {
      permits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CompletionException(e);
    }
    int current = inFlight.incrementAndGet();
    peakInFlight.accumulateAndGet(current, Math::max);
    try {
      return fetchDetailOrNull(id);
    } finally {
      inFlight.decrementAndGet();
      permits.release();
    }
  }

  private static @Nullable Map<String, Object> join(
      CompletableFuture<Map<String, Object>> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof AuthenticationException) {
        throw (AuthenticationException) cause;
      }
      if (cause instanceof InterruptedException) {
        throw new DataExtractionException("Interrupted during enrichment", cause);
      }
      throw new DataExtractionException("Enrichment worker failed", cause);
    }
  }

  private @Nullable Map<String, Object> fetchDetailOrNull(String id) {
    try {
      return fetchDetail(id);
    } catch (DataExtractionException e) {
      LOGGER.error("Failed to enrich id {}: {}", id, e.getMessage());
      return null;
    }
  }

  /**
   * Fetches the detail record of one identity.
   *
   * @throws DataExtractionException if the request fails or the payload holds
   *     no record
   */
  Map<String, Object> fetchDetail(String id) {
    String detailUrl = detailUrl(id);
    ApiResponse response =
        executor.requestWithRetries(detailUrl, Collections.<String, String>emptyMap(), governor);
    JsonNode payload;
    try {
      payload = OBJECT_MAPPER.readTree(response.getBody());
    } catch (JsonProcessingException e) {
      throw new DataExtractionException("Detail response for id " + id + " is not valid JSON", e);
    }
    Map<String, Object> detail = PayloadExtractor.extractDetail(payload, detailDataPath);
    if (detail == null) {
      throw new DataExtractionException("Detail response for id " + id + " holds no record");
    }
    return detail;
  }

  String detailUrl(String id) {
    String encoded = URLEncoder.encode(id, StandardCharsets.UTF_8).replace("+", "%20");
    return endpointUrl + "/" + encoded;
  }
}
