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
package io.datamat.adapter.api.http;

import java.io.IOException;

/**
 * Sends one HTTP request and returns the response, whatever its status.
 *
 * <p>Implementations must be safe for concurrent use: detail enrichment
 * issues requests from several worker threads.
 *
 * @see JdkHttpTransport
 */
public interface HttpTransport {

  /**
   * Sends a request.
   *
   * @param request Request to send
   * @return The response; non-2xx statuses are returned, not thrown
   * @throws IOException on network failure or timeout
   */
  ApiResponse send(ApiRequest request) throws IOException;
}
