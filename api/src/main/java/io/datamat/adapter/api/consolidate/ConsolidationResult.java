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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a consolidation run: the de-duplicated records plus statistics
 * about the passes that produced them.
 */
public class ConsolidationResult {
  private final ImmutableList<Map<String, Object>> records;
  private final int passesExecuted;
  private final int passesSkipped;
  private final boolean stabilized;
  private final long elapsedMillis;

  ConsolidationResult(List<Map<String, Object>> records, int passesExecuted,
      int passesSkipped, boolean stabilized, long elapsedMillis) {
    this.records = ImmutableList.copyOf(records);
    this.passesExecuted = passesExecuted;
    this.passesSkipped = passesSkipped;
    this.stabilized = stabilized;
    this.elapsedMillis = elapsedMillis;
  }

  public List<Map<String, Object>> getRecords() {
    return records;
  }

  /**
   * Returns the number of passes run, skipped ones included.
   */
  public int getPassesExecuted() {
    return passesExecuted;
  }

  /**
   * Returns the number of passes discarded as transient failures.
   */
  public int getPassesSkipped() {
    return passesSkipped;
  }

  /**
   * Returns whether a pass after the first contributed no new identities.
   * Always false for a single-pass run.
   */
  public boolean isStabilized() {
    return stabilized;
  }

  public long getElapsedMillis() {
    return elapsedMillis;
  }

  @Override public String toString() {
    return "ConsolidationResult{records=" + records.size()
        + ", passesExecuted=" + passesExecuted
        + ", passesSkipped=" + passesSkipped
        + ", stabilized=" + stabilized
        + ", elapsedMillis=" + elapsedMillis + "}";
  }
}
