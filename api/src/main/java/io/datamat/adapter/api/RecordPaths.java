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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Dot-path lookups into converted JSON records.
 *
 * <p>A path such as {@code contato.id} walks nested maps; a list met along
 * the way contributes its first element.
 */
public final class RecordPaths {

  private RecordPaths() {
  }

  /**
   * Returns the value at the given dot-path, or null if any segment is
   * missing.
   */
  public static @Nullable Object get(Map<String, Object> record, String path) {
    if (record.containsKey(path)) {
      return record.get(path);
    }
    Object current = record;
    for (String part : path.split("\\.")) {
      if (current instanceof List) {
        List<?> list = (List<?>) current;
        current = list.isEmpty() ? null : list.get(0);
      }
      if (!(current instanceof Map)) {
        return null;
      }
      current = ((Map<?, ?>) current).get(part);
      if (current == null) {
        return null;
      }
    }
    return current;
  }

  /**
   * Returns the record's identity in string form, or null when the record has
   * none. Numeric and textual identities with the same digits compare equal.
   */
  public static @Nullable String identityOf(Map<String, Object> record, String identityField) {
    Object value = get(record, identityField);
    if (value == null || value instanceof Map || value instanceof List) {
      return null;
    }
    return String.valueOf(value);
  }
}
