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
package io.datamat.adapter.api.consolidate;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for ConsolidationEngine.
 */
@Tag("unit")
public class ConsolidationEngineTest {

  private static final List<Map<String, String>> ONE_COMBINATION =
      Collections.singletonList(Collections.<String, String>emptyMap());

  private static Map<String, Object> record(Object id, String status) {
    Map<String, Object> record = new LinkedHashMap<String, Object>();
    if (id != null) {
      record.put("id", id);
    }
    record.put("situacao", status);
    return record;
  }

  private static List<Map<String, Object>> records(Object... ids) {
    List<Map<String, Object>> result = new ArrayList<Map<String, Object>>();
    for (Object id : ids) {
      result.add(record(id, "aberto"));
    }
    return result;
  }

  private static Set<Object> ids(List<Map<String, Object>> rows) {
    Set<Object> ids = new HashSet<Object>();
    for (Map<String, Object> row : rows) {
      ids.add(row.get("id"));
    }
    return ids;
  }

  /** Replays one scripted result per call, repeating the last one. */
  private static final class ScriptedFetcher implements CombinationFetcher {
    private final List<List<Map<String, Object>>> script;
    private int calls;

    @SafeVarargs
    ScriptedFetcher(List<Map<String, Object>>... script) {
      this.script = Arrays.asList(script);
    }

    @Override public List<Map<String, Object>> fetch(Map<String, String> params) {
      List<Map<String, Object>> result = script.get(Math.min(calls, script.size() - 1));
      calls++;
      return result;
    }
  }

  @Test void testSinglePassDeduplicatesLastSeenWins() {
    List<Map<String, Object>> rows = records(1, 2);
    rows.add(record(1, "faturado"));
    ScriptedFetcher fetcher = new ScriptedFetcher(rows);

    ConsolidationResult result =
        new ConsolidationEngine(fetcher, "id", 1, 0).consolidate(ONE_COMBINATION);

    assertEquals(2, result.getRecords().size());
    assertEquals("faturado", result.getRecords().get(0).get("situacao"));
    assertEquals(1, result.getPassesExecuted());
    assertFalse(result.isStabilized());
    assertEquals(1, fetcher.calls);
  }

  @Test void testSinglePassWithoutIdentitiesReturnsRawRows() {
    List<Map<String, Object>> rows = records(null, null, null);
    ScriptedFetcher fetcher = new ScriptedFetcher(rows);

    ConsolidationResult result =
        new ConsolidationEngine(fetcher, "id", 1, 0).consolidate(ONE_COMBINATION);

    assertEquals(3, result.getRecords().size());
  }

  @Test void testUnidentifiedRecordsFollowIdentifiedOnes() {
    List<Map<String, Object>> rows = records(null, 1, 2);
    ScriptedFetcher fetcher = new ScriptedFetcher(rows);

    ConsolidationResult result =
        new ConsolidationEngine(fetcher, "id", 1, 0).consolidate(ONE_COMBINATION);

    assertEquals(3, result.getRecords().size());
    assertEquals(1, result.getRecords().get(0).get("id"));
    assertFalse(result.getRecords().get(2).containsKey("id"));
  }

  @Test void testNumericAndTextualIdentitiesMatch() {
    ScriptedFetcher fetcher = new ScriptedFetcher(Arrays.asList(
        record(15, "aberto"), record("15", "faturado")));

    ConsolidationResult result =
        new ConsolidationEngine(fetcher, "id", 1, 0).consolidate(ONE_COMBINATION);

    assertEquals(1, result.getRecords().size());
    assertEquals("faturado", result.getRecords().get(0).get("situacao"));
  }

  @Test void testNestedIdentityPath() {
    Map<String, Object> a = new LinkedHashMap<String, Object>();
    a.put("pedido", Collections.singletonMap("numero", 10));
    Map<String, Object> b = new LinkedHashMap<String, Object>();
    b.put("pedido", Collections.singletonMap("numero", 10));
    ScriptedFetcher fetcher = new ScriptedFetcher(Arrays.asList(a, b));

    ConsolidationResult result =
        new ConsolidationEngine(fetcher, "pedido.numero", 1, 0).consolidate(ONE_COMBINATION);

    assertEquals(1, result.getRecords().size());
    assertSame(b, result.getRecords().get(0));
  }

  @Test void testConsistentUpstreamIsIdempotent() {
    List<Map<String, Object>> dataset = records(1, 2, 3, 4, 5);
    Set<Object> expected = ids(dataset);

    for (int maxPasses = 1; maxPasses <= 4; maxPasses++) {
      ScriptedFetcher fetcher = new ScriptedFetcher(dataset);
      ConsolidationResult result =
          new ConsolidationEngine(fetcher, "id", maxPasses, 0).consolidate(ONE_COMBINATION);

      assertEquals(5, result.getRecords().size());
      assertEquals(expected, ids(result.getRecords()));
      assertEquals(Math.min(maxPasses, 2), result.getPassesExecuted());
    }
  }

  @Test void testFlippedOrderStopsAfterSecondPass() {
    ScriptedFetcher fetcher = new ScriptedFetcher(records(1, 2), records(2, 1));

    ConsolidationResult result =
        new ConsolidationEngine(fetcher, "id", 3, 0).consolidate(ONE_COMBINATION);

    assertEquals(2, fetcher.calls);
    assertEquals(2, result.getPassesExecuted());
    assertTrue(result.isStabilized());
    assertEquals(2, result.getRecords().size());
    assertEquals(new HashSet<Object>(Arrays.asList(1, 2)), ids(result.getRecords()));
  }

  @Test void testMissedRecordsAreRecoveredUntilStable() {
    ScriptedFetcher fetcher = new ScriptedFetcher(
        records(1, 2, 3), records(1, 3, 4), records(2, 4, 5), records(1, 2, 3));

    ConsolidationResult result =
        new ConsolidationEngine(fetcher, "id", 5, 0).consolidate(ONE_COMBINATION);

    assertEquals(4, result.getPassesExecuted());
    assertTrue(result.isStabilized());
    assertEquals(new HashSet<Object>(Arrays.asList(1, 2, 3, 4, 5)), ids(result.getRecords()));
  }

  @Test void testStopsAtMaxPassesWithoutStabilizing() {
    ScriptedFetcher fetcher = new ScriptedFetcher(records(1), records(2), records(3),
        records(4));

    ConsolidationResult result =
        new ConsolidationEngine(fetcher, "id", 3, 0).consolidate(ONE_COMBINATION);

    assertEquals(3, fetcher.calls);
    assertFalse(result.isStabilized());
    assertEquals(3, result.getRecords().size());
  }

  @Test void testLaterPassOverwritesByIdentity() {
    List<Map<String, Object>> second = new ArrayList<Map<String, Object>>();
    second.add(record(1, "faturado"));
    ScriptedFetcher fetcher = new ScriptedFetcher(records(1, 2), second);

    ConsolidationResult result =
        new ConsolidationEngine(fetcher, "id", 2, 0).consolidate(ONE_COMBINATION);

    assertEquals(2, result.getRecords().size());
    assertEquals("faturado", result.getRecords().get(0).get("situacao"));
  }

  @Test void testEmptyFirstPassYieldsEmptyResult() {
    ScriptedFetcher fetcher = new ScriptedFetcher(records(), records(1, 2));

    ConsolidationResult result =
        new ConsolidationEngine(fetcher, "id", 3, 0).consolidate(ONE_COMBINATION);

    assertTrue(result.getRecords().isEmpty());
    assertEquals(1, fetcher.calls);
  }

  @Test void testTransientEmptyPassIsSkipped() {
    Map<String, String> lojaA = Collections.singletonMap("loja", "A");
    Map<String, String> lojaB = Collections.singletonMap("loja", "B");
    // pass 1: A, B; pass 2: A, B(empty); pass 3: A, B
    ScriptedFetcher fetcher = new ScriptedFetcher(
        records(1, 2), records(10),
        records(1, 2, 3), records(),
        records(1, 2), records(10, 11),
        records(1, 2), records(10, 11));

    ConsolidationResult result = new ConsolidationEngine(fetcher, "id", 4, 0)
        .consolidate(Arrays.asList(lojaA, lojaB));

    assertEquals(1, result.getPassesSkipped());
    assertEquals(4, result.getPassesExecuted());
    assertTrue(result.isStabilized());
    // id 3 only appeared in the skipped pass
    assertEquals(new HashSet<Object>(Arrays.asList(1, 2, 10, 11)), ids(result.getRecords()));
  }

  @Test void testCombinationEmptyFromTheStartIsNotTransient() {
    ScriptedFetcher fetcher = new ScriptedFetcher(
        records(1, 2), records(),
        records(1, 2), records());

    ConsolidationResult result = new ConsolidationEngine(fetcher, "id", 3, 0)
        .consolidate(Arrays.asList(Collections.singletonMap("loja", "A"),
            Collections.singletonMap("loja", "B")));

    assertEquals(0, result.getPassesSkipped());
    assertEquals(2, result.getPassesExecuted());
    assertTrue(result.isStabilized());
  }

  @Test void testCooldownBetweenPasses() {
    ScriptedFetcher fetcher = new ScriptedFetcher(records(1), records(1));

    long start = System.nanoTime();
    new ConsolidationEngine(fetcher, "id", 2, 80).consolidate(ONE_COMBINATION);
    long elapsedMs = (System.nanoTime() - start) / 1_000_000;

    assertTrue(elapsedMs >= 75, "took " + elapsedMs + "ms");
  }

  @Test void testMaxPassesMustBePositive() {
    assertThrows(IllegalArgumentException.class,
        () -> new ConsolidationEngine(new ScriptedFetcher(records()), "id", 0, 0));
  }

  @Test void testResultIsImmutable() {
    ConsolidationResult result = new ConsolidationEngine(new ScriptedFetcher(records(1)),
        "id", 1, 0).consolidate(ONE_COMBINATION);

    assertThrows(UnsupportedOperationException.class,
        () -> result.getRecords().add(record(2, "x")));
  }
}
