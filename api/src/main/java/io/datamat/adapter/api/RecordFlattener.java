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
package io.datamat.adapter.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens nested records into dotted column names, so
 * {@code {"contato": {"id": 7}}} becomes {@code {"contato.id": 7}}.
 * Lists are kept as values.
 */
public final class RecordFlattener {

  private RecordFlattener() {
  }

  public static List<Map<String, Object>> flatten(List<Map<String, Object>> records) {
    List<Map<String, Object>> result = new ArrayList<Map<String, Object>>(records.size());
    for (Map<String, Object> record : records) {
      result.add(flatten(record));
    }
    return result;
  }

  public static Map<String, Object> flatten(Map<String, Object> record) {
    Map<String, Object> flat = new LinkedHashMap<String, Object>();
    flattenInto(flat, "", record);
    return flat;
  }

  private static void flattenInto(Map<String, Object> flat, String prefix, Map<?, ?> node) {
    for (Map.Entry<?, ?> e : node.entrySet()) {
      String key = prefix + e.getKey();
      Object value = e.getValue();
      if (value instanceof Map && !((Map<?, ?>) value).isEmpty()) {
        flattenInto(flat, key + ".", (Map<?, ?>) value);
      } else {
        flat.put(key, value);
      }
    }
  }
}
