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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Locates records inside a JSON payload.
 *
 * <p>With an explicit data path the payload is navigated with dot and
 * bracket notation ({@code $.results.data}, {@code data[0].itens}). Without
 * one, a top-level array is used as-is, otherwise the first of
 * {@code data}, {@code items}, {@code results} and {@code content} holding an
 * array wins, and the payload itself is returned when none does.
 */
public final class PayloadExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(PayloadExtractor.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  static final List<String> WRAPPER_KEYS =
      Collections.unmodifiableList(Arrays.asList("data", "items", "results", "content"));

  private PayloadExtractor() {
  }

  /**
   * Returns the node holding the records. A configured path that is not
   * present yields an empty array; without a path, a payload with no array to
   * offer is returned unchanged.
   */
  public static JsonNode locate(JsonNode payload, @Nullable String path) {
    if (path == null || path.isEmpty()) {
      if (payload.isArray()) {
        return payload;
      }
      if (payload.isObject()) {
        for (String key : WRAPPER_KEYS) {
          JsonNode candidate = payload.get(key);
          if (candidate != null && candidate.isArray()) {
            return candidate;
          }
        }
      }
      return payload;
    }

    JsonNode found = navigate(payload, path);
    if (found.isMissingNode() || found.isNull()) {
      LOGGER.warn("Data path '{}' not found in payload", path);
      LOGGER.debug("Payload received: {}", payload);
      return OBJECT_MAPPER.createArrayNode();
    }
    return found;
  }

  /**
   * Extracts records from a payload. An object is coerced to a single record;
   * scalars yield nothing. Non-object array elements are skipped.
   */
  public static List<Map<String, Object>> extractRows(JsonNode payload, @Nullable String path) {
    return toRecords(locate(payload, path));
  }

  /**
   * Extracts a single detail record, or null if the payload holds none.
   */
  public static @Nullable Map<String, Object> extractDetail(JsonNode payload,
      @Nullable String path) {
    JsonNode node = locate(payload, path);
    if (node.isArray()) {
      node = node.size() > 0 ? node.get(0) : MissingNode.getInstance();
    }
    return node.isObject() ? toRecord(node) : null;
  }

  /**
   * Converts an array or object node to records.
   */
  static List<Map<String, Object>> toRecords(JsonNode node) {
    List<Map<String, Object>> result = new ArrayList<Map<String, Object>>();
    if (node.isArray()) {
      for (JsonNode item : node) {
        if (item.isObject()) {
          result.add(toRecord(item));
        } else {
          LOGGER.debug("Skipping non-object array element: {}", item);
        }
      }
    } else if (node.isObject()) {
      result.add(toRecord(node));
    }
    return result;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> toRecord(JsonNode node) {
    return OBJECT_MAPPER.convertValue(node, Map.class);
  }

  /**
   * Navigates to a dot path. Returns a missing node when a segment is absent.
   * An array met before a field segment contributes its first element.
   */
  public static JsonNode navigate(JsonNode root, String path) {
    String cleanPath = path;
    if (cleanPath.startsWith("$.")) {
      cleanPath = cleanPath.substring(2);
    } else if (cleanPath.startsWith("$")) {
      cleanPath = cleanPath.substring(1);
    }
    if (cleanPath.isEmpty()) {
      return root;
    }

    JsonNode current = root;
    for (String part : cleanPath.split("\\.")) {
      if (current == null || current.isMissingNode()) {
        return MissingNode.getInstance();
      }

      String fieldName = part;
      int index = -1;
      int bracketIdx = part.indexOf('[');
      if (bracketIdx >= 0) {
        fieldName = part.substring(0, bracketIdx);
        int endBracket = part.indexOf(']', bracketIdx);
        if (endBracket < 0) {
          throw new IllegalArgumentException("Malformed path segment '" + part + "'");
        }
        index = Integer.parseInt(part.substring(bracketIdx + 1, endBracket));
      }

      if (!fieldName.isEmpty()) {
        if (current.isArray()) {
          current = current.size() > 0 ? current.get(0) : MissingNode.getInstance();
        }
        current = current.path(fieldName);
      }
      if (index >= 0) {
        current = current.path(index);
      }
    }
    return current == null ? MissingNode.getInstance() : current;
  }
}
