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
import io.datamat.adapter.api.auth.RequestAuthenticator;
import io.datamat.adapter.api.http.ApiRequest;
import io.datamat.adapter.api.http.ApiResponse;
import io.datamat.adapter.api.http.HttpExecutor;
import io.datamat.adapter.api.http.HttpTransport;
import io.datamat.adapter.api.http.RateGovernor;
import io.datamat.adapter.api.http.ScriptedHttpTransport;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for EnrichmentEngine.
 */
@Tag("unit")
public class EnrichmentEngineTest {

  private static final String URL = "https://api.example.com/v3/pedidos/vendas";

  private static List<Map<String, Object>> rows(Object... ids) {
    List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();
    for (Object id : ids) {
      Map<String, Object> row = new LinkedHashMap<String, Object>();
      row.put("id", id);
      row.put("resumo", true);
      rows.add(row);
    }
    return rows;
  }

  private static String idOf(ApiRequest request) {
    String path = request.getUri().getPath();
    return path.substring(path.lastIndexOf('/') + 1);
  }

  /** Answers every detail request with {@code {"data": {"id": <id>, "itens": 2}}}. */
  private static ApiResponse detail(ApiRequest request) {
    return ApiResponse.of(200, "{\"data\": {\"id\": \"" + idOf(request) + "\", \"itens\": 2}}");
  }

  private static EnrichmentEngine engine(HttpTransport transport,
      ApiSourceConfig.EnrichmentConfig config) {
    HttpExecutor executor = new HttpExecutor(transport, RequestAuthenticator.none(),
        ApiSourceConfig.RetryConfig.of(1, 1, 5));
    return new EnrichmentEngine(executor, RateGovernor.unlimited("enrichment"), URL, "id",
        "data", config);
  }

  private static Set<Object> ids(List<Map<String, Object>> rows) {
    Set<Object> ids = new HashSet<Object>();
    for (Map<String, Object> row : rows) {
      ids.add(row.get("id"));
    }
    return ids;
  }

  @Test void testSequentialEnrichment() {
    ScriptedHttpTransport transport =
        new ScriptedHttpTransport().otherwise(EnrichmentEngineTest::detail);

    List<Map<String, Object>> enriched =
        engine(transport, ApiSourceConfig.EnrichmentConfig.sequential()).enrich(rows(1, 2, 3));

    assertEquals(3, enriched.size());
    assertEquals("1", enriched.get(0).get("id"));
    assertEquals(2, enriched.get(0).get("itens"));
    assertEquals(URL + "/1", transport.getRequests().get(0).getUri().toString());
    assertEquals(URL + "/3", transport.getRequests().get(2).getUri().toString());
  }

  @Test void testDuplicateIdentitiesFetchedOnce() {
    ScriptedHttpTransport transport =
        new ScriptedHttpTransport().otherwise(EnrichmentEngineTest::detail);

    List<Map<String, Object>> enriched = engine(transport,
        ApiSourceConfig.EnrichmentConfig.sequential()).enrich(rows(7, 7, "7", 8));

    assertEquals(2, enriched.size());
    assertEquals(2, transport.getRequestCount());
  }

  @Test void testFailedIdentitiesAreDropped() {
    ScriptedHttpTransport transport = new ScriptedHttpTransport().otherwise(request ->
        "2".equals(idOf(request)) ? ApiResponse.of(404, "not found") : detail(request));

    List<Map<String, Object>> enriched =
        engine(transport, ApiSourceConfig.EnrichmentConfig.sequential()).enrich(rows(1, 2, 3));

    assertEquals(2, enriched.size());
    assertEquals(new HashSet<Object>(Arrays.asList("1", "3")), ids(enriched));
  }

  @Test void testDetailWithoutRecordIsDropped() {
    ScriptedHttpTransport transport = new ScriptedHttpTransport().otherwise(request ->
        "1".equals(idOf(request)) ? ApiResponse.of(200, "{\"data\": null}") : detail(request));

    List<Map<String, Object>> enriched =
        engine(transport, ApiSourceConfig.EnrichmentConfig.sequential()).enrich(rows(1, 2));

    assertEquals(1, enriched.size());
    assertEquals("2", enriched.get(0).get("id"));
  }

  @Test void testAllFailuresKeepOriginalRows() {
    ScriptedHttpTransport transport = new ScriptedHttpTransport()
        .otherwise(request -> ApiResponse.of(500, "down"));
    List<Map<String, Object>> rows = rows(1, 2);

    List<Map<String, Object>> result =
        engine(transport, ApiSourceConfig.EnrichmentConfig.concurrent(2, 2)).enrich(rows);

    assertSame(rows, result);
  }

  @Test void testMissingIdentityFieldFails() {
    List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();
    rows.add(Collections.<String, Object>singletonMap("numero", "A1"));

    assertThrows(DataExtractionException.class, () -> engine(new ScriptedHttpTransport(),
        ApiSourceConfig.EnrichmentConfig.sequential()).enrich(rows));
  }

  @Test void testEmptyInputNeedsNoRequests() {
    ScriptedHttpTransport transport = new ScriptedHttpTransport();
    List<Map<String, Object>> empty = new ArrayList<Map<String, Object>>();

    assertTrue(engine(transport, ApiSourceConfig.EnrichmentConfig.sequential())
        .enrich(empty).isEmpty());
    assertEquals(0, transport.getRequestCount());
  }

  @Test void testConcurrentEnrichmentKeepsIdentityOrder() {
    ScriptedHttpTransport transport =
        new ScriptedHttpTransport().otherwise(EnrichmentEngineTest::detail);
    Object[] ids = new Object[40];
    for (int i = 0; i < ids.length; i++) {
      ids[i] = i + 1;
    }

    List<Map<String, Object>> enriched = engine(transport,
        ApiSourceConfig.EnrichmentConfig.concurrent(5, 3)).enrich(rows(ids));

    assertEquals(40, enriched.size());
    for (int i = 0; i < 40; i++) {
      assertEquals(String.valueOf(i + 1), enriched.get(i).get("id"));
    }
    assertEquals(40, transport.getRequestCount());
  }

  @Test void testConcurrentRequestsBoundedBySemaphore() {
    final AtomicInteger inFlight = new AtomicInteger();
    final AtomicInteger peak = new AtomicInteger();
    HttpTransport slow = request -> {
      int now = inFlight.incrementAndGet();
      peak.accumulateAndGet(now, Math::max);
      try {
        Thread.sleep(30);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException("interrupted", e);
      } finally {
        inFlight.decrementAndGet();
      }
      return detail(request);
    };
    Object[] ids = new Object[20];
    for (int i = 0; i < ids.length; i++) {
      ids[i] = "p-" + i;
    }

    EnrichmentEngine engine = engine(slow, ApiSourceConfig.EnrichmentConfig.concurrent(8, 2));
    List<Map<String, Object>> enriched = engine.enrich(rows(ids));

    assertEquals(20, enriched.size());
    assertTrue(peak.get() <= 2, "peak in flight was " + peak.get());
    assertTrue(engine.getPeakInFlight() <= 2);
    assertTrue(engine.getPeakInFlight() >= 1);
  }

  @Test void testAuthenticationFailureAborts() {
    HttpTransport transport = request -> {
      throw new AuthenticationException("token revoked");
    };

    assertThrows(AuthenticationException.class, () -> engine(transport,
        ApiSourceConfig.EnrichmentConfig.concurrent(3, 2)).enrich(rows(1, 2, 3)));
    assertThrows(AuthenticationException.class, () -> engine(transport,
        ApiSourceConfig.EnrichmentConfig.sequential()).enrich(rows(1, 2, 3)));
  }

  @Test void testIdentityIsEncodedInDetailUrl() {
    EnrichmentEngine engine = engine(new ScriptedHttpTransport(),
        ApiSourceConfig.EnrichmentConfig.sequential());

    assertEquals(URL + "/A%2F1%20B", engine.detailUrl("A/1 B"));
  }

  @Test void testStrategyNames() {
    assertEquals(EnrichmentStrategy.SEQUENTIAL, EnrichmentStrategy.fromString(null));
    assertEquals(EnrichmentStrategy.CONCURRENT, EnrichmentStrategy.fromString("Concurrent"));
    assertThrows(IllegalArgumentException.class,
        () -> EnrichmentStrategy.fromString("parallel"));
  }
}
