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

import io.datamat.adapter.api.DataExtractionException;
import io.datamat.adapter.api.RecordPaths;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs full passes over every parameter combination and merges the results
 * by record identity until the record set stops growing.
 *
 * <p>Some upstream APIs return inconsistent pages across repeated scans
 * (concurrent writes, unstable ordering), so a single pass may miss records.
 * Each pass after the first is merged into the running set, last-seen-wins.
 * Consolidation stops as soon as a pass adds no new identity, or after
 * {@code maxPasses} passes.
 *
 * <p>A later pass in which a combination that returned data before now
 * returns nothing is treated as a transient upstream failure: it is skipped
 * and does not count towards stabilization. An empty first pass ends the run
 * with no records.
 *
 * <p>With a single pass the records are only de-duplicated when at least one
 * of them carries an identity; otherwise they are returned as fetched.
 * Records without an identity are taken from the first pass only and follow
 * the identified records.
 */
public class ConsolidationEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConsolidationEngine.class);

  private final CombinationFetcher fetcher;
  private final String identityField;
  private final int maxPasses;
  private final long passCooldownMs;

  /**
   * Creates a consolidation engine.
   *
   * @param fetcher Runs one pagination per combination
   * @param identityField Dot-path of the record identity
   * @param maxPasses Upper bound on passes, at least 1
   * @param passCooldownMs Pause between passes
   */
  public ConsolidationEngine(CombinationFetcher fetcher, String identityField, int maxPasses,
      long passCooldownMs) {
    if (maxPasses < 1) {
      throw new IllegalArgumentException("maxPasses must be at least 1");
    }
    this.fetcher = fetcher;
    this.identityField = identityField;
    this.maxPasses = maxPasses;
    this.passCooldownMs = passCooldownMs;
  }

  /**
   * Consolidates the records of all combinations.
   *
   * @param combinations Parameter combinations, in run order
   * @return Consolidated records and pass statistics
   */
  public ConsolidationResult consolidate(List<Map<String, String>> combinations) {
    long startNanos = System.nanoTime();

    LOGGER.info("Pass 1/{} over {} combinations", maxPasses, combinations.size());
    Pass first = runPass(combinations);
    if (first.rows.isEmpty()) {
      LOGGER.warn("First pass returned no records, extraction result is empty");
      return finish(new ArrayList<Map<String, Object>>(), 1, 0, false, startNanos);
    }

    Map<String, Map<String, Object>> consolidated =
        new LinkedHashMap<String, Map<String, Object>>();
    List<Map<String, Object>> unidentified = new ArrayList<Map<String, Object>>();
    merge(first.rows, consolidated, unidentified);
    if (!consolidated.isEmpty() && !unidentified.isEmpty()) {
      LOGGER.warn("{} records carry no '{}' and are kept without de-duplication",
          unidentified.size(), identityField);
    }

    if (maxPasses == 1) {
      if (consolidated.isEmpty()) {
        LOGGER.warn("No record carries '{}', returning {} records without de-duplication",
            identityField, first.rows.size());
        return finish(first.rows, 1, 0, false, startNanos);
      }
      if (consolidated.size() + unidentified.size() < first.rows.size()) {
        LOGGER.info("Removed {} duplicate records from {} fetched",
            first.rows.size() - consolidated.size() - unidentified.size(), first.rows.size());
      }
      return finish(combine(consolidated, unidentified), 1, 0, false, startNanos);
    }

    boolean[] everReturnedData = new boolean[combinations.size()];
    markReturnedData(first, everReturnedData);
    LOGGER.info("Pass 1 gathered {} distinct identities", consolidated.size());

    int executed = 1;
    int skipped = 0;
    boolean stabilized = false;
    for (int pass = 2; pass <= maxPasses; pass++) {
      coolDown(pass);
      LOGGER.info("Pass {}/{} over {} combinations", pass, maxPasses, combinations.size());
      Pass current = runPass(combinations);
      executed++;

      int failed = transientlyEmpty(current, everReturnedData);
      if (failed >= 0) {
        LOGGER.warn("Pass {} returned no records for combination {} which returned data"
            + " before; treating the pass as a transient failure", pass,
            combinations.get(failed));
        skipped++;
        continue;
      }
      markReturnedData(current, everReturnedData);

      int before = consolidated.size();
      merge(current.rows, consolidated, null);
      int added = consolidated.size() - before;
      LOGGER.info("Pass {} fetched {} records, {} new identities, {} total",
          pass, current.rows.size(), added, consolidated.size());
      if (added == 0) {
        LOGGER.info("Record set stabilized after {} passes", pass);
        stabilized = true;
        break;
      }
    }
    if (!stabilized) {
      LOGGER.warn("Record set did not stabilize within {} passes", maxPasses);
    }

    return finish(combine(consolidated, unidentified), executed, skipped, stabilized,
        startNanos);
  }

  private Pass runPass(List<Map<String, String>> combinations) {
    Pass pass = new Pass(combinations.size());
    for (int i = 0; i < combinations.size(); i++) {
      List<Map<String, Object>> rows = fetcher.fetch(combinations.get(i));
      pass.counts[i] = rows.size();
      pass.rows.addAll(rows);
    }
    return pass;
  }

  private void merge(List<Map<String, Object>> rows,
      Map<String, Map<String, Object>> consolidated,
      @Nullable List<Map<String, Object>> unidentified) {
    for (Map<String, Object> row : rows) {
      String id = RecordPaths.identityOf(row, identityField);
      if (id != null) {
        consolidated.put(id, row);
      } else if (unidentified != null) {
        unidentified.add(row);
      }
    }
  }

  private static int transientlyEmpty(Pass pass, boolean[] everReturnedData) {
    for (int i = 0; i < pass.counts.length; i++) {
      if (pass.counts[i] == 0 && everReturnedData[i]) {
        return i;
      }
    }
    return -1;
  }

  private static void markReturnedData(Pass pass, boolean[] everReturnedData) {
    for (int i = 0; i < pass.counts.length; i++) {
      if (pass.counts[i] > 0) {
        everReturnedData[i] = true;
      }
    }
  }

  private static List<Map<String, Object>> combine(
      Map<String, Map<String, Object>> consolidated, List<Map<String, Object>> unidentified) {
    List<Map<String, Object>> result =
        new ArrayList<Map<String, Object>>(consolidated.size() + unidentified.size());
    result.addAll(consolidated.values());
    result.addAll(unidentified);
    return result;
  }

  private void coolDown(int pass) {
    if (passCooldownMs <= 0) {
      return;
    }
    LOGGER.info("Waiting {}ms before pass {}", passCooldownMs, pass);
    try {
      Thread.sleep(passCooldownMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DataExtractionException("Interrupted while waiting for pass " + pass, e);
    }
  }

  private static ConsolidationResult finish(List<Map<String, Object>> records, int executed,
      int skipped, boolean stabilized, long startNanos) {
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    ConsolidationResult result =
        new ConsolidationResult(records, executed, skipped, stabilized, elapsedMillis);
    LOGGER.info("Consolidation finished: {}", result);
    return result;
  }

  /** Records and per-combination counts of one pass. */
  private static final class Pass {
    final List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();
    final int[] counts;

    Pass(int combinations) {
      this.counts = new int[combinations];
    }
  }
}
