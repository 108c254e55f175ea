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

import java.util.List;
import java.util.Map;

/**
 * A source of rows for a warehouse staging load.
 *
 * <p>Each row is a Map of column name to value. Loaders consume the rows
 * without knowing which kind of source produced them.
 */
public interface SourceAdapter {

  /**
   * Extracts all rows from the source.
   *
   * @return Rows, each as a Map of column name to value
   * @throws DataExtractionException if the rows cannot be fetched
   * @throws AuthenticationException if credentials are missing or rejected
   */
  List<Map<String, Object>> extract();

  /**
   * Returns the source type identifier.
   *
   * @return Source type (e.g., "api")
   */
  String getType();
}
