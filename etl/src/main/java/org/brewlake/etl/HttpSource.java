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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTTP data source that fetches records from a paginated REST API.
 *
 * <p>HttpSource implements the {@link DataSource} interface with support for:
 * <ul>
 *   <li>Variable substitution in URL, parameters, and headers</li>
 *   <li>Environment variable references ({@code {env:VAR_NAME}})</li>
 *   <li>Pagination (offset or page-based), stopping at the first empty page</li>
 *   <li>Client-side rate limiting</li>
 *   <li>Dotted data paths into the JSON response</li>
 * </ul>
 *
 * <p>Requests are not retried. Any I/O failure or non-2xx status is thrown to
 * the caller unchanged; the latter as {@link HttpStatusException}.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * HttpSourceConfig config = HttpSourceConfig.builder()
 *     .url("https://api.openbrewerydb.org/v1/breweries")
 *     .response(HttpSourceConfig.ResponseConfig.of(null,
 *         HttpSourceConfig.PaginationConfig.page("page", "per_page", 200)))
 *     .build();
 *
 * try (HttpSource source = new HttpSource(config)) {
 *   Iterator<Map<String, Object>> data = source.fetch(Collections.emptyMap());
 * }
 * }</pre>
 *
 * @see HttpSourceConfig
 * @see DataSource
 */
public class HttpSource implements DataSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSource.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> ROW_TYPE =
      new TypeReference<Map<String, Object>>() { };
  private static final Pattern VAR_PATTERN = Pattern.compile("\\{([^}]+)\\}");
  private static final Pattern ENV_PATTERN = Pattern.compile("env:(.+)");

  private final HttpSourceConfig config;
  private final HttpClient httpClient;
  private long lastRequestTime;
  private int requestCount;

  /**
   * Creates a new HttpSource with the given configuration.
   *
   * @param config HTTP source configuration
   */
  public HttpSource(HttpSourceConfig config) {
    this(config, HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(config.getTimeouts().getConnectSeconds()))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build());
  }

  /**
   * Creates a new HttpSource that sends requests through the given client.
   */
  public HttpSource(HttpSourceConfig config, HttpClient httpClient) {
    this.config = config;
    this.httpClient = httpClient;
    this.lastRequestTime = 0;
  }

  @Override public Iterator<Map<String, Object>> fetch(Map<String, String> variables)
      throws IOException {
    String url = substituteVariables(config.getUrl(), variables);

    Map<String, String> params = new LinkedHashMap<String, String>();
    for (Map.Entry<String, String> e : config.getParameters().entrySet()) {
      params.put(e.getKey(), substituteVariables(e.getValue(), variables));
    }

    List<Map<String, Object>> allData = new ArrayList<Map<String, Object>>();
    HttpSourceConfig.PaginationConfig pagination = config.getResponse().getPagination();

    if (pagination.getType() == HttpSourceConfig.PaginationType.NONE) {
      String response = executeRequest(url, params, variables);
      allData.addAll(parseResponse(response));
    } else {
      int pageSize = pagination.getPageSize();
      int pageNumber = 0;
      boolean hasMore = true;

      while (hasMore) {
        pageNumber++;
        Map<String, String> pageParams = new LinkedHashMap<String, String>(params);

        switch (pagination.getType()) {
          case OFFSET:
            pageParams.put(pagination.getLimitParam(), String.valueOf(pageSize));
            pageParams.put(pagination.getOffsetParam(),
                String.valueOf((long) (pageNumber - 1) * pageSize));
            break;
          case PAGE:
            pageParams.put(pagination.getPageParam(), String.valueOf(pageNumber));
            if (pagination.getLimitParam() != null) {
              pageParams.put(pagination.getLimitParam(), String.valueOf(pageSize));
            }
            break;
          default:
            throw new IllegalStateException("Unsupported pagination: " + pagination.getType());
        }

        String response = executeRequest(url, pageParams, variables);
        List<Map<String, Object>> pageData = parseResponse(response);

        if (pageData.isEmpty()) {
          LOGGER.info("No more data at page {}. Total fetched: {}", pageNumber, allData.size());
          hasMore = false;
        } else {
          allData.addAll(pageData);
          LOGGER.debug("Fetched {} records from page {}; accumulated {}",
              pageData.size(), pageNumber, allData.size());

          if (pagination.isStopOnShortPage() && pageData.size() < pageSize) {
            hasMore = false;
          } else if (pagination.getMaxPages() > 0 && pageNumber >= pagination.getMaxPages()) {
            LOGGER.warn("Pagination limit of {} pages reached, stopping", pagination.getMaxPages());
            hasMore = false;
          }
        }
      }
    }

    LOGGER.info("Fetched {} records from {} in {} request(s)", allData.size(), url,
        requestCount);
    return allData.iterator();
  }

  @Override public String getType() {
    return "http";
  }

  /**
   * Returns the number of HTTP requests issued so far.
   */
  public int getRequestCount() {
    return requestCount;
  }

  /**
   * Executes a single HTTP GET after applying the rate limit.
   */
  private String executeRequest(String baseUrl, Map<String, String> params,
      Map<String, String> variables) throws IOException {
    enforceRateLimit();

    String fullUrl = buildUrlWithParams(baseUrl, params);
    HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
        .uri(URI.create(fullUrl))
        .timeout(Duration.ofSeconds(config.getTimeouts().getRequestSeconds()))
        .GET();
    for (Map.Entry<String, String> e : config.getHeaders().entrySet()) {
      requestBuilder.header(e.getKey(), substituteVariables(e.getValue(), variables));
    }

    HttpResponse<String> response;
    try {
      requestCount++;
      response = httpClient.send(requestBuilder.build(),
          HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while requesting " + fullUrl, e);
    }

    LOGGER.debug("HTTP GET {} -> {}", fullUrl, response.statusCode());
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new HttpStatusException(response.statusCode(), fullUrl, response.body());
    }
    return response.body();
  }

  /**
   * Parses the response body and navigates to the configured data path.
   */
  private List<Map<String, Object>> parseResponse(String response) throws IOException {
    if (response == null || response.trim().isEmpty()) {
      return new ArrayList<Map<String, Object>>();
    }

    JsonNode root = OBJECT_MAPPER.readTree(response);
    String dataPath = config.getResponse().getDataPath();
    if (dataPath != null && !dataPath.isEmpty()) {
      root = navigateToPath(root, dataPath);
    }

    List<Map<String, Object>> result = new ArrayList<Map<String, Object>>();
    if (root.isArray()) {
      for (JsonNode item : root) {
        if (item.isObject()) {
          result.add(OBJECT_MAPPER.convertValue(item, ROW_TYPE));
        } else {
          LOGGER.warn("Skipping non-object array element: {}", item.getNodeType());
        }
      }
    } else if (root.isObject()) {
      result.add(OBJECT_MAPPER.convertValue(root, ROW_TYPE));
    }
    return result;
  }

  /**
   * Navigates to a JSON path (simple dot notation, optional leading {@code $.}).
   */
  private JsonNode navigateToPath(JsonNode root, String path) {
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
      current = current.path(part);
      if (current.isMissingNode()) {
        LOGGER.warn("Data path segment '{}' not found in response", part);
        return OBJECT_MAPPER.createArrayNode();
      }
    }
    return current;
  }

  /**
   * Substitutes variables in a string.
   * Supports {varName} for variables and {env:VAR_NAME} for environment variables.
   */
  static String substituteVariables(String template, Map<String, String> variables) {
    if (template == null || template.isEmpty()) {
      return template;
    }

    StringBuffer result = new StringBuffer();
    Matcher matcher = VAR_PATTERN.matcher(template);

    while (matcher.find()) {
      String varExpr = matcher.group(1);
      String replacement;

      Matcher envMatcher = ENV_PATTERN.matcher(varExpr);
      if (envMatcher.matches()) {
        String envName = envMatcher.group(1);
        replacement = System.getenv(envName);
        if (replacement == null) {
          replacement = System.getProperty(envName, "");
        }
      } else {
        replacement = variables != null ? variables.get(varExpr) : null;
        if (replacement == null) {
          replacement = matcher.group(0); // Keep original if not found
        }
      }

      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);

    return result.toString();
  }

  /**
   * Builds URL with encoded query parameters.
   */
  static String buildUrlWithParams(String baseUrl, Map<String, String> params) {
    if (params == null || params.isEmpty()) {
      return baseUrl;
    }

    StringBuilder url = new StringBuilder(baseUrl);
    char separator = baseUrl.contains("?") ? '&' : '?';
    for (Map.Entry<String, String> e : params.entrySet()) {
      url.append(separator)
          .append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
          .append('=')
          .append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
      separator = '&';
    }
    return url.toString();
  }

  /**
   * Enforces rate limiting.
   */
  private void enforceRateLimit() throws IOException {
    int rps = config.getRateLimit().getRequestsPerSecond();
    if (rps <= 0) {
      return;
    }

    long minInterval = 1000 / rps;
    long elapsed = System.currentTimeMillis() - lastRequestTime;
    if (lastRequestTime > 0 && elapsed < minInterval) {
      try {
        Thread.sleep(minInterval - elapsed);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException("Interrupted while rate limiting", e);
      }
    }
    lastRequestTime = System.currentTimeMillis();
  }
}
