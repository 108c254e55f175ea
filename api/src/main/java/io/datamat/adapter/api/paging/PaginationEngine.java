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
import io.datamat.adapter.api.DataExtractionException;
import io.datamat.adapter.api.RecordPaths;
import io.datamat.adapter.api.http.ApiResponse;
import io.datamat.adapter.api.http.HttpExecutor;
import io.datamat.adapter.api.http.RateGovernor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drives successive page or cursor requests for one parameter combination.
 *
 * <p>Pages are requested strictly in order; each page's parameters derive
 * from the previous one (or, for cursors, from the previous response).
 * Pagination stops, checking in this order, when:
 * <ol>
 *   <li>the located payload is not a list (an object counts as one final
 *       record, anything else is logged as an error)</li>
 *   <li>three consecutive pages came back empty</li>
 *   <li>a page returned fewer records than the declared page size</li>
 *   <li>no next-page parameters can be derived (cursor absent, single-shot
 *       endpoint, or the page limit reached)</li>
 * </ol>
 * It also stops once the row limit, if any, is reached.
 */
public class PaginationEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(PaginationEngine.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  static final int MAX_CONSECUTIVE_EMPTY_PAGES = 3;

  private final HttpExecutor executor;
  private final RateGovernor governor;
  private final String url;
  private final ApiSourceConfig.PagingConfig paging;
  private final @Nullable String dataPath;
  private final String identityField;
  private final @Nullable Integer rowLimit;
  private final long delayBetweenPagesMs;

  public PaginationEngine(HttpExecutor executor, RateGovernor governor, String url,
      ApiSourceConfig config) {
    this.executor = executor;
    this.governor = governor;
    this.url = url;
    this.paging = config.getPaging();
    this.dataPath = config.getDataPath();
    this.identityField = config.getEndpoint().getIdentityField();
    this.rowLimit = config.getRowLimit();
    this.delayBetweenPagesMs = config.getDelayBetweenPagesMs();
  }

  /**
   * Fetches every page for one parameter combination.
   *
   * @param params Query parameters of the combination
   * @return Records in page order, truncated to the row limit
   * @throws DataExtractionException if a page cannot be fetched or parsed
   */
  public List<Map<String, Object>> fetchAllPages(Map<String, String> params) {
    List<Map<String, Object>> allRows = new ArrayList<Map<String, Object>>();
    Set<String> seenIds = new HashSet<String>();
    Map<String, String> pageParams = firstPageParams(params);
    int emptyStreak = 0;
    int pageNum = 0;

    while (pageParams != null && pageNum < paging.getMaxPages()) {
      if (rowLimit != null && allRows.size() >= rowLimit) {
        LOGGER.info("Row limit {} reached, stopping pagination", rowLimit);
        break;
      }
      pageNum++;
      LOGGER.info("Page {}: GET {} | params={}", pageNum, url, pageParams);

      JsonNode payload = fetchPage(pageParams, pageNum);
      JsonNode located = PayloadExtractor.locate(payload, dataPath);

      if (!located.isArray()) {
        if (located.isObject()) {
          LOGGER.info("Page {} returned a single object, treating it as one record", pageNum);
          addRows(allRows, PayloadExtractor.toRecords(located));
        } else {
          LOGGER.error("Unexpected payload on page {} (not a list), stopping: {}",
              pageNum, abbreviate(payload.toString()));
        }
        break;
      }

      List<Map<String, Object>> pageRows = PayloadExtractor.toRecords(located);
      int numRecords = pageRows.size();
      int newIds = trackIdentities(pageRows, seenIds, pageNum);
      addRows(allRows, pageRows);
      LOGGER.info("  -> Received {} records ({} new ids) | Total so far: {}",
          numRecords, newIds, allRows.size());

      if (numRecords == 0) {
        emptyStreak++;
        if (emptyStreak >= MAX_CONSECUTIVE_EMPTY_PAGES) {
          LOGGER.info("{} consecutive empty pages, stopping pagination", emptyStreak);
          break;
        }
      } else {
        emptyStreak = 0;
      }

      if (paging.getPageSize() > 0 && numRecords < paging.getPageSize()) {
        LOGGER.info("Last page detected ({} of {} records), stopping pagination",
            numRecords, paging.getPageSize());
        break;
      }

      pageParams = nextPageParams(pageParams, payload, pageNum);
      if (pageParams != null && delayBetweenPagesMs > 0) {
        LOGGER.debug("Waiting {}ms before next page", delayBetweenPagesMs);
        pause(delayBetweenPagesMs);
      }
    }

    return allRows;
  }

  /**
   * Computes the parameters of the first request.
   */
  Map<String, String> firstPageParams(Map<String, String> params) {
    Map<String, String> first = new LinkedHashMap<String, String>(params);
    switch (paging.getMode()) {
      case PAGE:
        first.put(paging.getPageParam(), String.valueOf(paging.getStartPage()));
        putPageSize(first);
        break;
      case CURSOR:
        putPageSize(first);
        break;
      case NONE:
      default:
        break;
    }
    return first;
  }

  /**
   * Computes the parameters of the next request, or null if there is none.
   */
  @Nullable Map<String, String> nextPageParams(Map<String, String> current, JsonNode payload,
      int pagesFetched) {
    if (paging.getMode() == ApiSourceConfig.PagingMode.NONE) {
      return null;
    }
    if (pagesFetched >= paging.getMaxPages()) {
      LOGGER.warn("Page limit {} reached for {}", paging.getMaxPages(), url);
      return null;
    }
    switch (paging.getMode()) {
      case PAGE: {
        Map<String, String> next = new LinkedHashMap<String, String>(current);
        int page = Integer.parseInt(current.get(paging.getPageParam()));
        next.put(paging.getPageParam(), String.valueOf(page + 1));
        return next;
      }
      case CURSOR: {
        JsonNode cursor = PayloadExtractor.navigate(payload, paging.getCursorPath());
        if (cursor.isMissingNode() || cursor.isNull() || cursor.asText().isEmpty()) {
          LOGGER.info("No next cursor at '{}', stopping pagination", paging.getCursorPath());
          return null;
        }
        Map<String, String> next = new LinkedHashMap<String, String>(current);
        next.put(paging.getCursorParam(), cursor.asText());
        return next;
      }
      case NONE:
      default:
        return null;
    }
  }

  private void putPageSize(Map<String, String> params) {
    if (paging.getSizeParam() != null && paging.getPageSize() > 0) {
      params.put(paging.getSizeParam(), String.valueOf(paging.getPageSize()));
    }
  }

  private JsonNode fetchPage(Map<String, String> params, int pageNum) {
    ApiResponse response;
    try {
      response = executor.requestWithRetries(url, params, governor);
    } catch (DataExtractionException e) {
      LOGGER.error("Critical failure fetching page {}: {}", pageNum, e.getMessage());
      throw new DataExtractionException("Request for page " + pageNum + " of " + url
          + " failed", e);
    }

    String body = response.getBody();
    if (body == null || body.trim().isEmpty()) {
      return OBJECT_MAPPER.nullNode();
    }
    try {
      return OBJECT_MAPPER.readTree(body);
    } catch (JsonProcessingException e) {
      throw new DataExtractionException("Page " + pageNum + " of " + url
          + " is not valid JSON: " + abbreviate(body), e);
    }
  }

  private void addRows(List<Map<String, Object>> allRows, List<Map<String, Object>> pageRows) {
    if (rowLimit != null && allRows.size() + pageRows.size() > rowLimit) {
      allRows.addAll(pageRows.subList(0, rowLimit - allRows.size()));
    } else {
      allRows.addAll(pageRows);
    }
  }

  private int trackIdentities(List<Map<String, Object>> pageRows, Set<String> seenIds,
      int pageNum) {
    int newIds = 0;
    for (Map<String, Object> record : pageRows) {
      String id = RecordPaths.identityOf(record, identityField);
      if (id == null) {
        continue;
      }
      if (seenIds.add(id)) {
        newIds++;
      } else {
        LOGGER.warn("  -> Duplicate id '{}' on page {} was already seen in this run", id, pageNum);
      }
    }
    return newIds;
  }

  private void pause(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DataExtractionException("Interrupted between pages of " + url, e);
    }
  }

  private static String abbreviate(String text) {
    return text.length() > 500 ? text.substring(0, 500) + "..." : text;
  }
}
