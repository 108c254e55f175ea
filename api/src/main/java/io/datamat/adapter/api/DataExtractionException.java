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

/**
 * Thrown when an extraction cannot complete: retries were exhausted, a request
 * failed with a non-retryable status, or the payload shape was not usable.
 *
 * <p>The last underlying failure is always attached as the cause.
 */
public class DataExtractionException extends DataMatException {
  public DataExtractionException(String message) {
    super(message);
  }

  public DataExtractionException(String message, Throwable cause) {
    super(message, cause);
  }

  public DataExtractionException(Throwable cause) {
    super(cause);
  }
}
