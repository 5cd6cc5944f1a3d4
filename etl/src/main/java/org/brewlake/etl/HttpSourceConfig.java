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
package org.brewlake.etl;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for HTTP data source.
 *
 * <p>HttpSourceConfig defines how to fetch data from a read-only REST API:
 * URL, static query parameters, headers, response parsing, pagination,
 * client-side rate limiting and timeouts.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * source:
 *   url: "https://api.openbrewerydb.org/v1/breweries"
 *   headers:
 *     Accept: "application/json"
 *   response:
 *     dataPath: ""
 *     pagination:
 *       type: page
 *       pageParam: "page"
 *       limitParam: "per_page"
 *       pageSize: 200
 *       maxPages: 0
 *   rateLimit:
 *     requestsPerSecond: 5
 *   timeouts:
 *     connectSeconds: 30
 *     requestSeconds: 30
 * }</pre>
 *
 * <p>Failed requests are not retried; a non-2xx response surfaces as
 * {@link HttpStatusException} so that the caller decides on retries.
 *
 * @see HttpSource
 */
public class HttpSourceConfig {

  /**
   * Pagination types.
   */
  public enum PaginationType {
    NONE, OFFSET, PAGE
  }

  private final String url;
  private final Map<String, String> parameters;
  private final Map<String, String> headers;
  private final ResponseConfig response;
  private final RateLimitConfig rateLimit;
  private final TimeoutConfig timeouts;

  private HttpSourceConfig(Builder builder) {
    this.url = builder.url;
    this.parameters = builder.parameters != null
        ? Collections.unmodifiableMap(new LinkedHashMap<String, String>(builder.parameters))
        : Collections.<String, String>emptyMap();
    this.headers = builder.headers != null
        ? Collections.unmodifiableMap(new LinkedHashMap<String, String>(builder.headers))
        : Collections.<String, String>emptyMap();
    this.response = builder.response != null ? builder.response : ResponseConfig.defaults();
    this.rateLimit = builder.rateLimit != null ? builder.rateLimit : RateLimitConfig.defaults();
    this.timeouts = builder.timeouts != null ? builder.timeouts : TimeoutConfig.defaults();
  }

  public String getUrl() {
    return url;
  }

  public Map<String, String> getParameters() {
    return parameters;
  }

  public Map<String, String> getHeaders() {
    return headers;
  }

  public ResponseConfig getResponse() {
    return response;
  }

  public RateLimitConfig getRateLimit() {
    return rateLimit;
  }

  public TimeoutConfig getTimeouts() {
    return timeouts;
  }

  /**
   * Returns a builder pre-populated with this configuration.
   */
  public Builder toBuilder() {
    return builder()
        .url(url)
        .parameters(parameters)
        .headers(headers)
        .response(response)
        .rateLimit(rateLimit)
        .timeouts(timeouts);
  }

  public static Builder builder() {
    return new Builder();
  }

  @SuppressWarnings("unchecked")
  public static HttpSourceConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      return null;
    }

    Builder builder = builder();
    builder.url((String) map.get("url"));

    Object paramsObj = map.get("parameters");
    if (paramsObj instanceof Map) {
      builder.parameters(toStringMap((Map<?, ?>) paramsObj));
    }

    Object headersObj = map.get("headers");
    if (headersObj instanceof Map) {
      builder.headers(toStringMap((Map<?, ?>) headersObj));
    }

    Object responseObj = map.get("response");
    if (responseObj instanceof Map) {
      builder.response(ResponseConfig.fromMap((Map<String, Object>) responseObj));
    }

    Object rateLimitObj = map.get("rateLimit");
    if (rateLimitObj instanceof Map) {
      builder.rateLimit(RateLimitConfig.fromMap((Map<String, Object>) rateLimitObj));
    }

    Object timeoutsObj = map.get("timeouts");
    if (timeoutsObj instanceof Map) {
      builder.timeouts(TimeoutConfig.fromMap((Map<String, Object>) timeoutsObj));
    }

    return builder.build();
  }

  private static Map<String, String> toStringMap(Map<?, ?> source) {
    Map<String, String> result = new LinkedHashMap<String, String>();
    for (Map.Entry<?, ?> e : source.entrySet()) {
      result.put(String.valueOf(e.getKey()), String.valueOf(e.getValue()));
    }
    return result;
  }

  private static int intValue(Map<String, Object> map, String key, int defaultValue) {
    Object value = map.get(key);
    return value instanceof Number ? ((Number) value).intValue() : defaultValue;
  }

  /**
   * Response parsing configuration.
   */
  public static class ResponseConfig {
    private final String dataPath;
    private final PaginationConfig pagination;

    private ResponseConfig(String dataPath, PaginationConfig pagination) {
      this.dataPath = dataPath;
      this.pagination = pagination;
    }

    public static ResponseConfig defaults() {
      return new ResponseConfig(null, PaginationConfig.none());
    }

    public static ResponseConfig of(String dataPath, PaginationConfig pagination) {
      return new ResponseConfig(dataPath,
          pagination != null ? pagination : PaginationConfig.none());
    }

    /**
     * Returns the dotted path to the record array inside the response,
     * or null when the response body is the array itself.
     */
    public @Nullable String getDataPath() {
      return dataPath;
    }

    public PaginationConfig getPagination() {
      return pagination;
    }

    @SuppressWarnings("unchecked")
    public static ResponseConfig fromMap(Map<String, Object> map) {
      if (map == null) {
        return defaults();
      }

      String format = (String) map.get("format");
      if (format != null && !"json".equalsIgnoreCase(format)) {
        throw new IllegalArgumentException("Unsupported response format: " + format);
      }

      Object paginationObj = map.get("pagination");
      PaginationConfig pagination = paginationObj instanceof Map
          ? PaginationConfig.fromMap((Map<String, Object>) paginationObj)
          : PaginationConfig.none();

      return new ResponseConfig((String) map.get("dataPath"), pagination);
    }
  }

  /**
   * Pagination configuration.
   *
   * <p>Paging stops at the first empty page. With {@code stopOnShortPage} it also
   * stops after a page holding fewer than {@code pageSize} records, and
   * {@code maxPages > 0} caps the number of requests.
   */
  public static class PaginationConfig {
    private final PaginationType type;
    private final String limitParam;
    private final String offsetParam;
    private final String pageParam;
    private final int pageSize;
    private final int maxPages;
    private final boolean stopOnShortPage;

    private PaginationConfig(PaginationType type, String limitParam, String offsetParam,
        String pageParam, int pageSize, int maxPages, boolean stopOnShortPage) {
      this.type = type;
      this.limitParam = limitParam;
      this.offsetParam = offsetParam;
      this.pageParam = pageParam;
      this.pageSize = pageSize;
      this.maxPages = maxPages;
      this.stopOnShortPage = stopOnShortPage;
    }

    public static PaginationConfig none() {
      return new PaginationConfig(PaginationType.NONE, null, null, null, 0, 0, false);
    }

    public static PaginationConfig offset(String limitParam, String offsetParam, int pageSize) {
      return new PaginationConfig(PaginationType.OFFSET, limitParam, offsetParam,
          null, pageSize, 0, false);
    }

    public static PaginationConfig page(String pageParam, String limitParam, int pageSize) {
      return new PaginationConfig(PaginationType.PAGE, limitParam, null,
          pageParam, pageSize, 0, false);
    }

    /** Returns a copy capped at {@code maxPages} requests (0 = unlimited). */
    public PaginationConfig withMaxPages(int maxPages) {
      return new PaginationConfig(type, limitParam, offsetParam, pageParam, pageSize,
          maxPages, stopOnShortPage);
    }

    /** Returns a copy that also stops after a short page. */
    public PaginationConfig withStopOnShortPage(boolean stopOnShortPage) {
      return new PaginationConfig(type, limitParam, offsetParam, pageParam, pageSize,
          maxPages, stopOnShortPage);
    }

    /** Returns a copy with a different page size. */
    public PaginationConfig withPageSize(int pageSize) {
      if (pageSize <= 0) {
        throw new IllegalArgumentException("Page size must be positive: " + pageSize);
      }
      return new PaginationConfig(type, limitParam, offsetParam, pageParam, pageSize,
          maxPages, stopOnShortPage);
    }

    public PaginationType getType() {
      return type;
    }

    public String getLimitParam() {
      return limitParam;
    }

    public String getOffsetParam() {
      return offsetParam;
    }

    public String getPageParam() {
      return pageParam;
    }

    public int getPageSize() {
      return pageSize;
    }

    public int getMaxPages() {
      return maxPages;
    }

    public boolean isStopOnShortPage() {
      return stopOnShortPage;
    }

    public static PaginationConfig fromMap(Map<String, Object> map) {
      if (map == null) {
        return none();
      }

      String typeStr = (String) map.get("type");
      PaginationType type = typeStr != null
          ? PaginationType.valueOf(typeStr.toUpperCase())
          : PaginationType.NONE;

      String pageParam = (String) map.get("pageParam");
      if (type == PaginationType.PAGE && pageParam == null) {
        pageParam = "page";
      }

      Object shortPageObj = map.get("stopOnShortPage");

      return new PaginationConfig(
          type,
          (String) map.get("limitParam"),
          (String) map.get("offsetParam"),
          pageParam,
          intValue(map, "pageSize", 1000),
          intValue(map, "maxPages", 0),
          shortPageObj instanceof Boolean && (Boolean) shortPageObj
      );
    }
  }

  /**
   * Client-side rate limit configuration.
   */
  public static class RateLimitConfig {
    private final int requestsPerSecond;

    private RateLimitConfig(int requestsPerSecond) {
      this.requestsPerSecond = requestsPerSecond;
    }

    public static RateLimitConfig defaults() {
      return new RateLimitConfig(10);
    }

    /** Requests per second; 0 or less disables throttling. */
    public static RateLimitConfig of(int requestsPerSecond) {
      return new RateLimitConfig(requestsPerSecond);
    }

    public int getRequestsPerSecond() {
      return requestsPerSecond;
    }

    public static RateLimitConfig fromMap(Map<String, Object> map) {
      if (map == null) {
        return defaults();
      }
      return new RateLimitConfig(intValue(map, "requestsPerSecond", 10));
    }
  }

  /**
   * Connect and per-request timeouts.
   */
  public static class TimeoutConfig {
    private final int connectSeconds;
    private final int requestSeconds;

    private TimeoutConfig(int connectSeconds, int requestSeconds) {
      this.connectSeconds = connectSeconds;
      this.requestSeconds = requestSeconds;
    }

    public static TimeoutConfig defaults() {
      return new TimeoutConfig(30, 30);
    }

    public static TimeoutConfig of(int connectSeconds, int requestSeconds) {
      return new TimeoutConfig(connectSeconds, requestSeconds);
    }

    public int getConnectSeconds() {
      return connectSeconds;
    }

    public int getRequestSeconds() {
      return requestSeconds;
    }

    public static TimeoutConfig fromMap(Map<String, Object> map) {
      if (map == null) {
        return defaults();
      }
      return new TimeoutConfig(intValue(map, "connectSeconds", 30),
          intValue(map, "requestSeconds", 30));
    }
  }

  /**
   * Builder for HttpSourceConfig.
   */
  public static class Builder {
    private String url;
    private Map<String, String> parameters;
    private Map<String, String> headers;
    private ResponseConfig response;
    private RateLimitConfig rateLimit;
    private TimeoutConfig timeouts;

    public Builder url(String url) {
      this.url = url;
      return this;
    }

    public Builder parameters(Map<String, String> parameters) {
      this.parameters = parameters;
      return this;
    }

    public Builder headers(Map<String, String> headers) {
      this.headers = headers;
      return this;
    }

    public Builder response(ResponseConfig response) {
      this.response = response;
      return this;
    }

    public Builder rateLimit(RateLimitConfig rateLimit) {
      this.rateLimit = rateLimit;
      return this;
    }

    public Builder timeouts(TimeoutConfig timeouts) {
      this.timeouts = timeouts;
      return this;
    }

    public HttpSourceConfig build() {
      if (url == null || url.isEmpty()) {
        throw new IllegalArgumentException("URL is required");
      }
      return new HttpSourceConfig(this);
    }
  }
}
