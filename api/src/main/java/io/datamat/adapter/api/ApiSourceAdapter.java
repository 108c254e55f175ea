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

import io.datamat.adapter.api.auth.RequestAuthenticator;
import io.datamat.adapter.api.auth.TokenCache;
import io.datamat.adapter.api.auth.TokenStore;
import io.datamat.adapter.api.consolidate.ConsolidationEngine;
import io.datamat.adapter.api.consolidate.ConsolidationResult;
import io.datamat.adapter.api.enrich.EnrichmentEngine;
import io.datamat.adapter.api.http.HttpExecutor;
import io.datamat.adapter.api.http.HttpTransport;
import io.datamat.adapter.api.http.JdkHttpTransport;
import io.datamat.adapter.api.http.RateGovernor;
import io.datamat.adapter.api.paging.PaginationEngine;
import io.datamat.adapter.api.paging.ParameterExpander;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Extracts records from a paginated, rate-limited REST API.
 *
 * <p>An extraction expands the configured parameters into combinations,
 * paginates each combination over one or more consolidation passes, and
 * optionally replaces every consolidated record with its detail record.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * ApiSourceConfig config = ApiSourceConfig.fromYaml(in);
 * ApiSourceAdapter adapter = ApiSourceAdapter.builder(config).build();
 * List<Map<String, Object>> rows = adapter.extract();
 * }</pre>
 *
 * <p>Instances are not safe for concurrent {@link #extract()} calls; the
 * rate channels and the token store are shared across calls.
 *
 * @see ApiSourceConfig
 */
public class ApiSourceAdapter implements SourceAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiSourceAdapter.class);

  private final ApiSourceConfig config;
  private final String endpointUrl;
  private final RequestAuthenticator authenticator;
  private final HttpExecutor executor;
  private final RateGovernor mainGovernor;
  private final RateGovernor enrichmentGovernor;
  private final ParameterExpander expander;
  private @Nullable ConsolidationResult lastResult;

  private ApiSourceAdapter(Builder builder) {
    this.config = builder.config;
    this.endpointUrl = config.getEndpoint().resolveUrl(builder.secrets);
    this.authenticator = RequestAuthenticator.create(config.getAuth(), builder.secrets,
        builder.transport, builder.clock, builder.tokenCache);
    this.executor = new HttpExecutor(builder.transport, authenticator, config.getRetry());
    this.mainGovernor = RateGovernor.perMinute("main", config.getRequestsPerMinute());
    this.enrichmentGovernor = RateGovernor.perMinute("enrichment",
        config.getEffectiveEnrichmentRequestsPerMinute());
    this.expander = new ParameterExpander(builder.clock);
  }

  public static Builder builder(ApiSourceConfig config) {
    return new Builder(config);
  }

  @Override public List<Map<String, Object>> extract() {
    long start = System.nanoTime();
    LOGGER.info("Starting extraction from {}", endpointUrl);

    List<Map<String, String>> combinations = expander.expand(config);
    PaginationEngine pager = new PaginationEngine(executor, mainGovernor, endpointUrl, config);
    ConsolidationEngine consolidator = new ConsolidationEngine(pager::fetchAllPages,
        config.getEndpoint().getIdentityField(), config.getMaxPasses(),
        config.getPassCooldownMs());
    ConsolidationResult result = consolidator.consolidate(combinations);
    this.lastResult = result;

    List<Map<String, Object>> rows = result.getRecords();
    if (!rows.isEmpty() && config.getEnrichment().isEnabled()) {
      EnrichmentEngine enricher = new EnrichmentEngine(executor, enrichmentGovernor,
          endpointUrl, config.getEndpoint().getIdentityField(), config.getDetailDataPath(),
          config.getEnrichment());
      rows = enricher.enrich(rows);
    }
    if (config.isFlattenRecords()) {
      rows = RecordFlattener.flatten(rows);
    }

    LOGGER.info("Extraction from {} finished: {} records in {}ms", endpointUrl, rows.size(),
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    return rows;
  }

  @Override public String getType() {
    return "api";
  }

  public ApiSourceConfig getConfig() {
    return config;
  }

  /**
   * Returns the resolved endpoint URL.
   */
  public String getEndpointUrl() {
    return endpointUrl;
  }

  /**
   * Returns the OAuth2 token store, or null when the source does not use
   * OAuth2.
   */
  public @Nullable TokenStore getTokenStore() {
    return authenticator.getTokenStore();
  }

  /**
   * Returns the consolidation statistics of the last extraction, or null
   * before the first one.
   */
  public @Nullable ConsolidationResult getLastResult() {
    return lastResult;
  }

  /**
   * Builder for ApiSourceAdapter.
   */
  public static class Builder {
    private final ApiSourceConfig config;
    private SecretResolver secrets = SecretResolver.system();
    private HttpTransport transport;
    private Clock clock = Clock.systemDefaultZone();
    private @Nullable TokenCache tokenCache;

    private Builder(ApiSourceConfig config) {
      this.config = config;
    }

    public Builder secrets(SecretResolver secrets) {
      this.secrets = secrets;
      return this;
    }

    public Builder transport(HttpTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Overrides the clock. Its zone decides the local date of the incremental
     * window; the default is the system zone.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Overrides where OAuth2 tokens are kept.
     */
    public Builder tokenCache(@Nullable TokenCache tokenCache) {
      this.tokenCache = tokenCache;
      return this;
    }

    /**
     * Builds the adapter.
     *
     * @throws IllegalArgumentException if the endpoint URL cannot be resolved
     * @throws AuthenticationException if OAuth2 client settings are missing
     */
    public ApiSourceAdapter build() {
      if (transport == null) {
        transport = new JdkHttpTransport();
      }
      return new ApiSourceAdapter(this);
    }
  }
}
