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

import io.datamat.adapter.api.auth.AuthConfig;
import io.datamat.adapter.api.enrich.EnrichmentStrategy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for an API extraction job.
 *
 * <p>ApiSourceConfig defines how to fetch records from a paginated REST API:
 * endpoint and identity field, pagination, authentication, query parameters
 * and their expansion, consolidation passes, rate limits, retries and detail
 * enrichment.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * endpoint:
 *   baseUrlEnv: API_BASE_URL
 *   path: pedidos/vendas
 *   identityField: id
 * paging:
 *   mode: page
 *   pageParam: pagina
 *   sizeParam: limite
 *   pageSize: 100
 * auth:
 *   type: oauth2
 * parameters:
 *   situacao: "6"
 * parameterMatrix:
 *   loja: ["1", "2"]
 * dataPath: data
 * maxPasses: 3
 * requestsPerMinute: 120
 * retry:
 *   maxRetries: "${API_MAX_RETRIES:-3}"
 *   backoffBaseMs: 500
 * enrichment:
 *   enabled: true
 *   strategy: concurrent
 *   detailWorkers: 5
 *   concurrentRequests: 3
 * }</pre>
 *
 * @see ApiSourceAdapter
 */
public class ApiSourceConfig {

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  public static final int DEFAULT_REQUESTS_PER_MINUTE = 60;
  public static final long DEFAULT_PASS_COOLDOWN_MS = 5000;

  private final EndpointConfig endpoint;
  private final PagingConfig paging;
  private final AuthConfig auth;
  private final Map<String, String> parameters;
  private final Map<String, List<String>> parameterMatrix;
  private final List<Map<String, String>> parameterSequence;
  private final IncrementalConfig incremental;
  private final @Nullable String dataPath;
  private final @Nullable String detailDataPath;
  private final @Nullable Integer requestsPerMinute;
  private final @Nullable Integer enrichmentRequestsPerMinute;
  private final @Nullable Integer rowLimit;
  private final int maxPasses;
  private final long passCooldownMs;
  private final long delayBetweenPagesMs;
  private final RetryConfig retry;
  private final EnrichmentConfig enrichment;
  private final boolean flattenRecords;

  private ApiSourceConfig(Builder builder) {
    this.endpoint = builder.endpoint;
    this.paging = builder.paging != null ? builder.paging : PagingConfig.none();
    this.auth = builder.auth != null ? builder.auth : AuthConfig.none();
    this.parameters = builder.parameters != null
        ? Collections.unmodifiableMap(new LinkedHashMap<String, String>(builder.parameters))
        : Collections.<String, String>emptyMap();
    Map<String, List<String>> matrix = new LinkedHashMap<String, List<String>>();
    if (builder.parameterMatrix != null) {
      for (Map.Entry<String, List<String>> e : builder.parameterMatrix.entrySet()) {
        matrix.put(e.getKey(),
            Collections.unmodifiableList(new ArrayList<String>(e.getValue())));
      }
    }
    this.parameterMatrix = Collections.unmodifiableMap(matrix);
    List<Map<String, String>> sequence = new ArrayList<Map<String, String>>();
    if (builder.parameterSequence != null) {
      for (Map<String, String> entry : builder.parameterSequence) {
        sequence.add(Collections.unmodifiableMap(new LinkedHashMap<String, String>(entry)));
      }
    }
    this.parameterSequence = Collections.unmodifiableList(sequence);
    this.incremental = builder.incremental != null
        ? builder.incremental : IncrementalConfig.disabled();
    this.dataPath = builder.dataPath;
    this.detailDataPath = builder.detailDataPath;
    this.requestsPerMinute = builder.requestsPerMinute;
    this.enrichmentRequestsPerMinute = builder.enrichmentRequestsPerMinute;
    this.rowLimit = builder.rowLimit;
    this.maxPasses = builder.maxPasses;
    this.passCooldownMs = builder.passCooldownMs;
    this.delayBetweenPagesMs = builder.delayBetweenPagesMs;
    this.retry = builder.retry != null ? builder.retry : RetryConfig.defaults();
    this.enrichment = builder.enrichment != null
        ? builder.enrichment : EnrichmentConfig.disabled();
    this.flattenRecords = builder.flattenRecords;
  }

  public EndpointConfig getEndpoint() {
    return endpoint;
  }

  public PagingConfig getPaging() {
    return paging;
  }

  public AuthConfig getAuth() {
    return auth;
  }

  /**
   * Returns the base query parameters sent with every list request.
   */
  public Map<String, String> getParameters() {
    return parameters;
  }

  /**
   * Returns the parameter matrix; its Cartesian product is run in declaration
   * order.
   */
  public Map<String, List<String>> getParameterMatrix() {
    return parameterMatrix;
  }

  /**
   * Returns explicit parameter sets, each crossed with the matrix product.
   */
  public List<Map<String, String>> getParameterSequence() {
    return parameterSequence;
  }

  public IncrementalConfig getIncremental() {
    return incremental;
  }

  /**
   * Returns the dot-path locating records in a list response, or null to
   * probe common wrapper keys.
   */
  public @Nullable String getDataPath() {
    return dataPath;
  }

  /**
   * Returns the dot-path locating the record in a detail response.
   */
  public @Nullable String getDetailDataPath() {
    return detailDataPath;
  }

  public @Nullable Integer getRequestsPerMinute() {
    return requestsPerMinute;
  }

  /**
   * Returns the enrichment channel's limit, falling back to the primary
   * channel's limit when not set.
   */
  public @Nullable Integer getEffectiveEnrichmentRequestsPerMinute() {
    return enrichmentRequestsPerMinute != null ? enrichmentRequestsPerMinute : requestsPerMinute;
  }

  public @Nullable Integer getEnrichmentRequestsPerMinute() {
    return enrichmentRequestsPerMinute;
  }

  /**
   * Returns the maximum rows per pagination run, or null for no limit.
   */
  public @Nullable Integer getRowLimit() {
    return rowLimit;
  }

  public int getMaxPasses() {
    return maxPasses;
  }

  public long getPassCooldownMs() {
    return passCooldownMs;
  }

  public long getDelayBetweenPagesMs() {
    return delayBetweenPagesMs;
  }

  public RetryConfig getRetry() {
    return retry;
  }

  public EnrichmentConfig getEnrichment() {
    return enrichment;
  }

  public boolean isFlattenRecords() {
    return flattenRecords;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads a configuration from a YAML document, resolving {@code ${VAR}}
   * references against the environment.
   *
   * @param input YAML stream
   * @return Parsed configuration
   * @throws IOException if the document cannot be read
   */
  public static ApiSourceConfig fromYaml(InputStream input) throws IOException {
    return fromYaml(input, SecretResolver.system());
  }

  /**
   * Loads a configuration from a YAML document.
   *
   * @param input YAML stream
   * @param resolver Source of the values of {@code ${VAR}} references
   * @return Parsed configuration
   * @throws IOException if the document cannot be read
   */
  @SuppressWarnings("unchecked")
  public static ApiSourceConfig fromYaml(InputStream input, SecretResolver resolver)
      throws IOException {
    Map<String, Object> map = YAML_MAPPER.readValue(input, Map.class);
    if (map == null) {
      throw new IOException("Empty API source configuration");
    }
    return fromMap(map, resolver);
  }

  public static ApiSourceConfig fromMap(Map<String, Object> map) {
    return fromMap(map, SecretResolver.system());
  }

  /**
   * Builds a configuration from a parsed map. String values may reference
   * variables as {@code ${VAR}} or {@code ${VAR:-default}}; they are resolved
   * through {@code resolver} before any value is read.
   */
  public static ApiSourceConfig fromMap(Map<String, Object> raw, SecretResolver resolver) {
    Map<String, Object> map = ConfigValues.resolveAll(raw, resolver);
    Builder builder = builder();

    Map<String, Object> endpointMap = ConfigValues.getMap(map, "endpoint");
    if (endpointMap != null) {
      builder.endpoint(EndpointConfig.fromMap(endpointMap));
    } else if (map.get("endpoint") instanceof String) {
      builder.endpoint(EndpointConfig.builder()
          .path(ConfigValues.getString(map, "endpoint", null))
          .build());
    }

    Map<String, Object> pagingMap = ConfigValues.getMap(map, "paging");
    if (pagingMap != null) {
      builder.paging(PagingConfig.fromMap(pagingMap));
    }
    builder.auth(AuthConfig.fromMap(ConfigValues.getMap(map, "auth")));
    builder.parameters(ConfigValues.getStringMap(map, "parameters"));

    Object matrixObj = map.get("parameterMatrix");
    if (matrixObj instanceof Map) {
      Map<String, List<String>> matrix = new LinkedHashMap<String, List<String>>();
      for (Map.Entry<?, ?> e : ((Map<?, ?>) matrixObj).entrySet()) {
        matrix.put(String.valueOf(e.getKey()), toStringList(e.getValue()));
      }
      builder.parameterMatrix(matrix);
    }

    Object sequenceObj = map.get("parameterSequence");
    if (sequenceObj instanceof List) {
      List<Map<String, String>> sequence = new ArrayList<Map<String, String>>();
      for (Object item : (List<?>) sequenceObj) {
        if (item instanceof Map) {
          Map<String, String> entry = new LinkedHashMap<String, String>();
          for (Map.Entry<?, ?> e : ((Map<?, ?>) item).entrySet()) {
            entry.put(String.valueOf(e.getKey()), String.valueOf(e.getValue()));
          }
          sequence.add(entry);
        }
      }
      builder.parameterSequence(sequence);
    }

    Map<String, Object> incrementalMap = ConfigValues.getMap(map, "incremental");
    if (incrementalMap != null) {
      builder.incremental(IncrementalConfig.fromMap(incrementalMap));
    }

    builder.dataPath(ConfigValues.getString(map, "dataPath", null));
    builder.detailDataPath(ConfigValues.getString(map, "detailDataPath", null));
    if (map.containsKey("requestsPerMinute")) {
      builder.requestsPerMinute(ConfigValues.getInteger(map, "requestsPerMinute"));
    }
    builder.enrichmentRequestsPerMinute(
        ConfigValues.getInteger(map, "enrichmentRequestsPerMinute"));
    builder.rowLimit(ConfigValues.getInteger(map, "rowLimit"));
    builder.maxPasses(ConfigValues.getInt(map, "maxPasses", 1));
    builder.passCooldownMs(
        ConfigValues.getLong(map, "passCooldownMs", DEFAULT_PASS_COOLDOWN_MS));
    builder.delayBetweenPagesMs(ConfigValues.getLong(map, "delayBetweenPagesMs", 0));

    Map<String, Object> retryMap = ConfigValues.getMap(map, "retry");
    if (retryMap != null) {
      builder.retry(RetryConfig.fromMap(retryMap));
    }
    Map<String, Object> enrichmentMap = ConfigValues.getMap(map, "enrichment");
    if (enrichmentMap != null) {
      builder.enrichment(EnrichmentConfig.fromMap(enrichmentMap));
    }
    builder.flattenRecords(ConfigValues.getBoolean(map, "flattenRecords", false));

    return builder.build();
  }

  private static List<String> toStringList(Object value) {
    List<String> result = new ArrayList<String>();
    if (value instanceof List) {
      for (Object item : (List<?>) value) {
        result.add(String.valueOf(item));
      }
    } else if (value != null) {
      result.add(String.valueOf(value));
    }
    return result;
  }

  /**
   * Endpoint configuration: where records live and how they are identified.
   */
  public static class EndpointConfig {
    public static final String DEFAULT_BASE_URL_ENV = "API_BASE_URL";
    public static final String DEFAULT_IDENTITY_FIELD = "id";

    private final @Nullable String baseUrl;
    private final String baseUrlEnv;
    private final String path;
    private final String identityField;

    private EndpointConfig(Builder builder) {
      this.baseUrl = builder.baseUrl;
      this.baseUrlEnv = builder.baseUrlEnv;
      this.path = builder.path != null ? builder.path : "";
      this.identityField = builder.identityField;
    }

    public static Builder builder() {
      return new Builder();
    }

    /**
     * Creates an endpoint from a complete URL.
     */
    public static EndpointConfig of(String url) {
      return builder().baseUrl(url).build();
    }

    public @Nullable String getBaseUrl() {
      return baseUrl;
    }

    public String getBaseUrlEnv() {
      return baseUrlEnv;
    }

    public String getPath() {
      return path;
    }

    /**
     * Returns the dot-path of the field identifying a record.
     */
    public String getIdentityField() {
      return identityField;
    }

    /**
     * Resolves the full endpoint URL: the base URL (given directly or read
     * from {@link #getBaseUrlEnv()}) joined with the path.
     *
     * @throws IllegalArgumentException if no base URL is available
     */
    public String resolveUrl(SecretResolver secrets) {
      if (path.startsWith("http://") || path.startsWith("https://")) {
        return path;
      }
      String base = baseUrl != null ? baseUrl : secrets.resolve(baseUrlEnv);
      if (base == null || base.isEmpty()) {
        throw new IllegalArgumentException(
            "Environment variable '" + baseUrlEnv + "' is not defined");
      }
      if (path.isEmpty()) {
        return stripTrailingSlash(base);
      }
      return stripTrailingSlash(base) + "/" + stripLeadingSlash(path);
    }

    private static String stripTrailingSlash(String s) {
      String result = s;
      while (result.endsWith("/")) {
        result = result.substring(0, result.length() - 1);
      }
      return result;
    }

    private static String stripLeadingSlash(String s) {
      String result = s;
      while (result.startsWith("/")) {
        result = result.substring(1);
      }
      return result;
    }

    public static EndpointConfig fromMap(Map<String, Object> map) {
      Builder builder = builder()
          .baseUrl(ConfigValues.getString(map, "baseUrl", null))
          .path(ConfigValues.getString(map, "path", null));
      String env = ConfigValues.getString(map, "baseUrlEnv", null);
      if (env != null) {
        builder.baseUrlEnv(env);
      }
      String identity = ConfigValues.getString(map, "identityField", null);
      if (identity != null) {
        builder.identityField(identity);
      }
      return builder.build();
    }

    /**
     * Builder for EndpointConfig.
     */
    public static class Builder {
      private @Nullable String baseUrl;
      private String baseUrlEnv = DEFAULT_BASE_URL_ENV;
      private @Nullable String path;
      private String identityField = DEFAULT_IDENTITY_FIELD;

      public Builder baseUrl(@Nullable String baseUrl) {
        this.baseUrl = baseUrl;
        return this;
      }

      public Builder baseUrlEnv(String baseUrlEnv) {
        this.baseUrlEnv = baseUrlEnv;
        return this;
      }

      public Builder path(@Nullable String path) {
        this.path = path;
        return this;
      }

      public Builder identityField(String identityField) {
        this.identityField = identityField;
        return this;
      }

      public EndpointConfig build() {
        if (identityField == null || identityField.isEmpty()) {
          throw new IllegalArgumentException("identityField must not be empty");
        }
        return new EndpointConfig(this);
      }
    }
  }

  /**
   * Pagination modes.
   */
  public enum PagingMode {
    /** A single request; the endpoint is not paginated. */
    NONE,
    /** Page-number pagination: page and size query parameters. */
    PAGE,
    /** Cursor pagination: the next cursor is read from each response. */
    CURSOR
  }

  /**
   * Pagination configuration. Exactly one mode is active per extraction.
   */
  public static class PagingConfig {
    public static final int DEFAULT_MAX_PAGES = 1000;

    private final PagingMode mode;
    private final String pageParam;
    private final @Nullable String sizeParam;
    private final int pageSize;
    private final int startPage;
    private final @Nullable String cursorPath;
    private final String cursorParam;
    private final int maxPages;

    private PagingConfig(PagingMode mode, String pageParam, @Nullable String sizeParam,
        int pageSize, int startPage, @Nullable String cursorPath, String cursorParam,
        int maxPages) {
      this.mode = mode;
      this.pageParam = pageParam;
      this.sizeParam = sizeParam;
      this.pageSize = pageSize;
      this.startPage = startPage;
      this.cursorPath = cursorPath;
      this.cursorParam = cursorParam;
      this.maxPages = maxPages;
    }

    public static PagingConfig none() {
      return new PagingConfig(PagingMode.NONE, "page", null, 0, 1, null, "cursor", 1);
    }

    public static PagingConfig page(String pageParam, String sizeParam, int pageSize) {
      return page(pageParam, sizeParam, pageSize, 1, DEFAULT_MAX_PAGES);
    }

    public static PagingConfig page(String pageParam, String sizeParam, int pageSize,
        int startPage, int maxPages) {
      if (pageSize <= 0) {
        throw new IllegalArgumentException("Page mode requires a positive pageSize");
      }
      return new PagingConfig(PagingMode.PAGE, pageParam, sizeParam, pageSize, startPage,
          null, "cursor", maxPages);
    }

    /**
     * Creates a cursor pagination config.
     *
     * @param cursorPath Dot-path of the next cursor in each response
     * @param cursorParam Query parameter carrying the cursor
     * @param sizeParam Size parameter name, or null to not send one
     * @param pageSize Declared page size, or 0 if the API does not take one
     */
    public static PagingConfig cursor(String cursorPath, String cursorParam,
        @Nullable String sizeParam, int pageSize) {
      return cursor(cursorPath, cursorParam, sizeParam, pageSize, DEFAULT_MAX_PAGES);
    }

    public static PagingConfig cursor(String cursorPath, String cursorParam,
        @Nullable String sizeParam, int pageSize, int maxPages) {
      if (cursorPath == null || cursorPath.isEmpty()) {
        throw new IllegalArgumentException("Cursor mode requires a cursorPath");
      }
      return new PagingConfig(PagingMode.CURSOR, "page", sizeParam, pageSize, 1, cursorPath,
          cursorParam, maxPages);
    }

    public PagingMode getMode() {
      return mode;
    }

    public String getPageParam() {
      return pageParam;
    }

    public @Nullable String getSizeParam() {
      return sizeParam;
    }

    /**
     * Returns the declared page size; 0 when undeclared.
     */
    public int getPageSize() {
      return pageSize;
    }

    public int getStartPage() {
      return startPage;
    }

    public @Nullable String getCursorPath() {
      return cursorPath;
    }

    public String getCursorParam() {
      return cursorParam;
    }

    public int getMaxPages() {
      return maxPages;
    }

    public static PagingConfig fromMap(Map<String, Object> map) {
      String modeStr = ConfigValues.getString(map, "mode", null);
      PagingMode mode = modeStr != null
          ? PagingMode.valueOf(modeStr.toUpperCase(Locale.ROOT))
          : PagingMode.NONE;
      int maxPages = ConfigValues.getInt(map, "maxPages", DEFAULT_MAX_PAGES);

      switch (mode) {
        case PAGE:
          return page(
              ConfigValues.getString(map, "pageParam", "page"),
              ConfigValues.getString(map, "sizeParam", "limit"),
              ConfigValues.getInt(map, "pageSize", 100),
              ConfigValues.getInt(map, "startPage", 1),
              maxPages);
        case CURSOR:
          return cursor(
              ConfigValues.getString(map, "cursorPath", null),
              ConfigValues.getString(map, "cursorParam", "cursor"),
              ConfigValues.getString(map, "sizeParam", null),
              ConfigValues.getInt(map, "pageSize", 0),
              maxPages);
        case NONE:
        default:
          return none();
      }
    }
  }

  /**
   * Retry configuration for HTTP requests.
   */
  public static class RetryConfig {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_BACKOFF_BASE_MS = 500;
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    public static final List<Integer> DEFAULT_RETRY_ON =
        Collections.unmodifiableList(Arrays.asList(429, 500, 502, 503, 504));

    private final int maxRetries;
    private final long backoffBaseMs;
    private final int timeoutSeconds;
    private final Set<Integer> retryOn;

    private RetryConfig(int maxRetries, long backoffBaseMs, int timeoutSeconds,
        List<Integer> retryOn) {
      this.maxRetries = maxRetries;
      this.backoffBaseMs = backoffBaseMs;
      this.timeoutSeconds = timeoutSeconds;
      this.retryOn = Collections.unmodifiableSet(new LinkedHashSet<Integer>(retryOn));
    }

    public static RetryConfig defaults() {
      return new RetryConfig(DEFAULT_MAX_RETRIES, DEFAULT_BACKOFF_BASE_MS,
          DEFAULT_TIMEOUT_SECONDS, DEFAULT_RETRY_ON);
    }

    public static RetryConfig of(int maxRetries, long backoffBaseMs, int timeoutSeconds) {
      return new RetryConfig(maxRetries, backoffBaseMs, timeoutSeconds, DEFAULT_RETRY_ON);
    }

    /**
     * Returns the maximum number of attempts per request.
     */
    public int getMaxRetries() {
      return maxRetries;
    }

    public long getBackoffBaseMs() {
      return backoffBaseMs;
    }

    public int getTimeoutSeconds() {
      return timeoutSeconds;
    }

    public Set<Integer> getRetryOn() {
      return retryOn;
    }

    public boolean isRetryable(int statusCode) {
      return retryOn.contains(statusCode);
    }

    public static RetryConfig fromMap(Map<String, Object> map) {
      List<Integer> retryOn = ConfigValues.getIntList(map, "retryOn");
      return new RetryConfig(
          ConfigValues.getInt(map, "maxRetries", DEFAULT_MAX_RETRIES),
          ConfigValues.getLong(map, "backoffBaseMs", DEFAULT_BACKOFF_BASE_MS),
          ConfigValues.getInt(map, "timeoutSeconds", DEFAULT_TIMEOUT_SECONDS),
          retryOn != null ? retryOn : DEFAULT_RETRY_ON);
    }
  }

  /**
   * Detail enrichment configuration.
   */
  public static class EnrichmentConfig {
    public static final int DEFAULT_DETAIL_WORKERS = 5;
    public static final int DEFAULT_CONCURRENT_REQUESTS = 3;

    private final boolean enabled;
    private final EnrichmentStrategy strategy;
    private final int detailWorkers;
    private final int concurrentRequests;

    private EnrichmentConfig(boolean enabled, EnrichmentStrategy strategy, int detailWorkers,
        int concurrentRequests) {
      if (detailWorkers <= 0 || concurrentRequests <= 0) {
        throw new IllegalArgumentException(
            "detailWorkers and concurrentRequests must be positive");
      }
      this.enabled = enabled;
      this.strategy = strategy;
      this.detailWorkers = detailWorkers;
      this.concurrentRequests = concurrentRequests;
    }

    public static EnrichmentConfig disabled() {
      return new EnrichmentConfig(false, EnrichmentStrategy.SEQUENTIAL,
          DEFAULT_DETAIL_WORKERS, DEFAULT_CONCURRENT_REQUESTS);
    }

    public static EnrichmentConfig sequential() {
      return new EnrichmentConfig(true, EnrichmentStrategy.SEQUENTIAL,
          DEFAULT_DETAIL_WORKERS, DEFAULT_CONCURRENT_REQUESTS);
    }

    /**
     * Creates a concurrent enrichment config.
     *
     * @param detailWorkers Worker pool size
     * @param concurrentRequests Maximum detail requests in flight at once
     */
    public static EnrichmentConfig concurrent(int detailWorkers, int concurrentRequests) {
      return new EnrichmentConfig(true, EnrichmentStrategy.CONCURRENT, detailWorkers,
          concurrentRequests);
    }

    public boolean isEnabled() {
      return enabled;
    }

    public EnrichmentStrategy getStrategy() {
      return strategy;
    }

    public int getDetailWorkers() {
      return detailWorkers;
    }

    public int getConcurrentRequests() {
      return concurrentRequests;
    }

    public static EnrichmentConfig fromMap(Map<String, Object> map) {
      return new EnrichmentConfig(
          ConfigValues.getBoolean(map, "enabled", true),
          EnrichmentStrategy.fromString(ConfigValues.getString(map, "strategy", null)),
          ConfigValues.getInt(map, "detailWorkers", DEFAULT_DETAIL_WORKERS),
          ConfigValues.getInt(map, "concurrentRequests", DEFAULT_CONCURRENT_REQUESTS));
    }
  }

  /**
   * Rolling date window injected into the base parameters.
   *
   * <pre>{@code
   * incremental:
   *   enabled: true
   *   daysToLoad: 7
   *   dateParamStart: dataInicial
   *   dateParamEnd: dataFinal
   *   filterParam: tipoFiltro
   *   filterValue: V
   * }</pre>
   */
  public static class IncrementalConfig {
    public static final String DEFAULT_DATE_PATTERN = "yyyy-MM-dd";

    private final boolean enabled;
    private final int daysToLoad;
    private final @Nullable String dateParamStart;
    private final @Nullable String dateParamEnd;
    private final String datePattern;
    private final @Nullable String filterParam;
    private final @Nullable String filterValue;

    private IncrementalConfig(boolean enabled, int daysToLoad, @Nullable String dateParamStart,
        @Nullable String dateParamEnd, String datePattern, @Nullable String filterParam,
        @Nullable String filterValue) {
      this.enabled = enabled;
      this.daysToLoad = daysToLoad;
      this.dateParamStart = dateParamStart;
      this.dateParamEnd = dateParamEnd;
      this.datePattern = datePattern;
      this.filterParam = filterParam;
      this.filterValue = filterValue;
    }

    public static IncrementalConfig disabled() {
      return new IncrementalConfig(false, 0, null, null, DEFAULT_DATE_PATTERN, null, null);
    }

    public static IncrementalConfig lastDays(int daysToLoad, String dateParamStart,
        String dateParamEnd) {
      return new IncrementalConfig(true, daysToLoad, dateParamStart, dateParamEnd,
          DEFAULT_DATE_PATTERN, null, null);
    }

    public IncrementalConfig withFilter(String param, String value) {
      return new IncrementalConfig(enabled, daysToLoad, dateParamStart, dateParamEnd,
          datePattern, param, value);
    }

    public IncrementalConfig withDatePattern(String pattern) {
      return new IncrementalConfig(enabled, daysToLoad, dateParamStart, dateParamEnd,
          pattern, filterParam, filterValue);
    }

    public boolean isEnabled() {
      return enabled;
    }

    public int getDaysToLoad() {
      return daysToLoad;
    }

    public @Nullable String getDateParamStart() {
      return dateParamStart;
    }

    public @Nullable String getDateParamEnd() {
      return dateParamEnd;
    }

    public String getDatePattern() {
      return datePattern;
    }

    public @Nullable String getFilterParam() {
      return filterParam;
    }

    public @Nullable String getFilterValue() {
      return filterValue;
    }

    public static IncrementalConfig fromMap(Map<String, Object> map) {
      return new IncrementalConfig(
          ConfigValues.getBoolean(map, "enabled", true),
          ConfigValues.getInt(map, "daysToLoad", 7),
          ConfigValues.getString(map, "dateParamStart", null),
          ConfigValues.getString(map, "dateParamEnd", null),
          ConfigValues.getString(map, "datePattern", DEFAULT_DATE_PATTERN),
          ConfigValues.getString(map, "filterParam", null),
          ConfigValues.getString(map, "filterValue", null));
    }
  }

  /**
   * Builder for ApiSourceConfig.
   */
  public static class Builder {
    private EndpointConfig endpoint;
    private PagingConfig paging;
    private AuthConfig auth;
    private Map<String, String> parameters;
    private Map<String, List<String>> parameterMatrix;
    private List<Map<String, String>> parameterSequence;
    private IncrementalConfig incremental;
    private @Nullable String dataPath;
    private @Nullable String detailDataPath;
    private @Nullable Integer requestsPerMinute = DEFAULT_REQUESTS_PER_MINUTE;
    private @Nullable Integer enrichmentRequestsPerMinute;
    private @Nullable Integer rowLimit;
    private int maxPasses = 1;
    private long passCooldownMs = DEFAULT_PASS_COOLDOWN_MS;
    private long delayBetweenPagesMs;
    private RetryConfig retry;
    private EnrichmentConfig enrichment;
    private boolean flattenRecords;

    public Builder endpoint(EndpointConfig endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    public Builder paging(PagingConfig paging) {
      this.paging = paging;
      return this;
    }

    public Builder auth(AuthConfig auth) {
      this.auth = auth;
      return this;
    }

    public Builder parameters(Map<String, String> parameters) {
      this.parameters = parameters;
      return this;
    }

    public Builder parameterMatrix(Map<String, List<String>> parameterMatrix) {
      this.parameterMatrix = parameterMatrix;
      return this;
    }

    public Builder parameterSequence(List<Map<String, String>> parameterSequence) {
      this.parameterSequence = parameterSequence;
      return this;
    }

    public Builder incremental(IncrementalConfig incremental) {
      this.incremental = incremental;
      return this;
    }

    public Builder dataPath(@Nullable String dataPath) {
      this.dataPath = dataPath;
      return this;
    }

    public Builder detailDataPath(@Nullable String detailDataPath) {
      this.detailDataPath = detailDataPath;
      return this;
    }

    public Builder requestsPerMinute(@Nullable Integer requestsPerMinute) {
      this.requestsPerMinute = requestsPerMinute;
      return this;
    }

    public Builder enrichmentRequestsPerMinute(@Nullable Integer enrichmentRequestsPerMinute) {
      this.enrichmentRequestsPerMinute = enrichmentRequestsPerMinute;
      return this;
    }

    public Builder rowLimit(@Nullable Integer rowLimit) {
      this.rowLimit = rowLimit;
      return this;
    }

    public Builder maxPasses(int maxPasses) {
      this.maxPasses = maxPasses;
      return this;
    }

    public Builder passCooldownMs(long passCooldownMs) {
      this.passCooldownMs = passCooldownMs;
      return this;
    }

    public Builder delayBetweenPagesMs(long delayBetweenPagesMs) {
      this.delayBetweenPagesMs = delayBetweenPagesMs;
      return this;
    }

    public Builder retry(RetryConfig retry) {
      this.retry = retry;
      return this;
    }

    public Builder enrichment(EnrichmentConfig enrichment) {
      this.enrichment = enrichment;
      return this;
    }

    public Builder flattenRecords(boolean flattenRecords) {
      this.flattenRecords = flattenRecords;
      return this;
    }

    public ApiSourceConfig build() {
      if (endpoint == null) {
        throw new IllegalArgumentException("Endpoint is required");
      }
      if (maxPasses < 1) {
        throw new IllegalArgumentException("maxPasses must be at least 1");
      }
      if (rowLimit != null && rowLimit <= 0) {
        throw new IllegalArgumentException("rowLimit must be positive when set");
      }
      return new ApiSourceConfig(this);
    }
  }
}
