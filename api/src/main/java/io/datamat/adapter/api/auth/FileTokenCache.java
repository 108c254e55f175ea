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
package io.datamat.adapter.api.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.checkerframework.checker.nullness.qual.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * {@link TokenCache} persisted as a JSON file.
 *
 * <p>The file holds {@code access_token}, {@code refresh_token},
 * {@code expires_at} (epoch seconds), {@code token_type} and {@code scope}.
 * It is rewritten in full after every token mutation, through a temporary
 * file moved into place.
 */
public class FileTokenCache implements TokenCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileTokenCache.class);
  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final Path path;

  public FileTokenCache(Path path) {
    this.path = path;
  }

  /**
   * Returns the cache for a client id: {@code <cacheDir>/oauth_tokens_<clientId>.json}.
   */
  public static FileTokenCache forClient(String cacheDir, String clientId) {
    String safeId = clientId.replaceAll("[^A-Za-z0-9._-]", "_");
    return new FileTokenCache(Paths.get(cacheDir, "oauth_tokens_" + safeId + ".json"));
  }

  public Path getPath() {
    return path;
  }

  @Override public @Nullable TokenRecord load() throws IOException {
    if (!Files.exists(path)) {
      LOGGER.debug("No token cache at {}", path);
      return null;
    }
    JsonNode json = OBJECT_MAPPER.readTree(path.toFile());
    if (json == null || !json.isObject()) {
      throw new IOException("Token cache " + path + " does not contain a JSON object");
    }
    return TokenRecord.fromJson(json);
  }

  @Override public void save(TokenRecord record) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path temp = path.resolveSibling(path.getFileName() + ".tmp");
    OBJECT_MAPPER.writeValue(temp.toFile(), record.toMap());
    try {
      Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
    }
    LOGGER.debug("Token cache written to {}", path);
  }

  @Override public String toString() {
    return "FileTokenCache{" + path + "}";
  }
}
