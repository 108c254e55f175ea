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
package io.datamat.adapter.api.paging;

import io.datamat.adapter.api.ApiSourceConfig;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands a job's parameters into the ordered list of parameter
 * combinations to run.
 *
 * <p>Each combination is the base parameters, overlaid with one entry of the
 * parameter sequence (if any), overlaid with one element of the matrix's
 * Cartesian product. Matrix keys are enumerated in declaration order and
 * values in list order, so the first key varies slowest:
 *
 * <pre>
 * parameterMatrix:
 *   loja: [1, 2]
 *   situacao: [6, 9]
 *
 * Produces: {loja=1, situacao=6}, {loja=1, situacao=9},
 *           {loja=2, situacao=6}, {loja=2, situacao=9}
 * </pre>
 */
public class ParameterExpander {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParameterExpander.class);

  private final Clock clock;

  public ParameterExpander() {
    this(Clock.systemDefaultZone());
  }

  public ParameterExpander(Clock clock) {
    this.clock = clock;
  }

  /**
   * Expands the configured parameters of a job.
   *
   * @param config Job configuration
   * @return Non-empty list of parameter combinations
   */
  public List<Map<String, String>> expand(ApiSourceConfig config) {
    Map<String, String> base = applyIncremental(config.getParameters(), config.getIncremental());
    return expand(base, config.getParameterSequence(), config.getParameterMatrix());
  }

  /**
   * Expands base parameters with an optional sequence and matrix.
   *
   * @param base Parameters sent with every combination
   * @param sequence Explicit parameter sets, or empty
   * @param matrix Keys mapped to candidate values, or empty
   * @return Non-empty list of parameter combinations
   */
  public List<Map<String, String>> expand(Map<String, String> base,
      List<Map<String, String>> sequence, Map<String, List<String>> matrix) {
    List<String> names = new ArrayList<String>();
    List<List<String>> values = new ArrayList<List<String>>();
    for (Map.Entry<String, List<String>> e : matrix.entrySet()) {
      if (e.getValue() == null || e.getValue().isEmpty()) {
        LOGGER.warn("Parameter matrix key '{}' has no values, ignoring it", e.getKey());
        continue;
      }
      names.add(e.getKey());
      values.add(e.getValue());
    }

    List<Map<String, String>> seeds = sequence.isEmpty()
        ? Collections.singletonList(Collections.<String, String>emptyMap())
        : sequence;
    List<Map<String, String>> product = cartesianProduct(names, values);

    ImmutableList.Builder<Map<String, String>> result = ImmutableList.builder();
    for (Map<String, String> seed : seeds) {
      for (Map<String, String> cell : product) {
        Map<String, String> combination = new LinkedHashMap<String, String>(base);
        combination.putAll(seed);
        combination.putAll(cell);
        result.add(ImmutableMap.copyOf(combination));
      }
    }
    List<Map<String, String>> combinations = result.build();

    if (combinations.size() > 1) {
      LOGGER.info("Expanded {} matrix keys and {} sequence entries into {} combinations",
          names.size(), sequence.size(), combinations.size());
    }
    return combinations;
  }

  /**
   * Injects the rolling date window and filter into the base parameters when
   * incremental loading is enabled. The window ends today and starts
   * {@code daysToLoad} days earlier.
   */
  public Map<String, String> applyIncremental(Map<String, String> base,
      ApiSourceConfig.IncrementalConfig incremental) {
    if (!incremental.isEnabled()) {
      return base;
    }
    DateTimeFormatter formatter = DateTimeFormatter.ofPattern(incremental.getDatePattern());
    LocalDate end = LocalDate.now(clock);
    LocalDate start = end.minusDays(incremental.getDaysToLoad());

    Map<String, String> params = new LinkedHashMap<String, String>(base);
    if (incremental.getDateParamStart() != null) {
      params.put(incremental.getDateParamStart(), start.format(formatter));
    }
    if (incremental.getDateParamEnd() != null) {
      params.put(incremental.getDateParamEnd(), end.format(formatter));
    }
    if (incremental.getFilterParam() != null && incremental.getFilterValue() != null) {
      params.put(incremental.getFilterParam(), incremental.getFilterValue());
    }
    LOGGER.info("Incremental window: {} to {} ({} days)",
        start.format(formatter), end.format(formatter), incremental.getDaysToLoad());
    return params;
  }

  private static List<Map<String, String>> cartesianProduct(
      List<String> names, List<List<String>> values) {

    List<Map<String, String>> result = new ArrayList<Map<String, String>>();

    // Start with a single empty combination
    result.add(new LinkedHashMap<String, String>());

    for (int i = 0; i < names.size(); i++) {
      String name = names.get(i);
      List<String> dimValues = values.get(i);

      List<Map<String, String>> newResult = new ArrayList<Map<String, String>>();
      for (Map<String, String> existing : result) {
        for (String value : dimValues) {
          Map<String, String> newCombination = new LinkedHashMap<String, String>(existing);
          newCombination.put(name, value);
          newResult.add(newCombination);
        }
      }
      result = newResult;
    }

    return result;
  }
}
