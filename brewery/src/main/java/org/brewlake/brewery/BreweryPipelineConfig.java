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
package org.brewlake.brewery;

import org.brewlake.etl.HttpSourceConfig;
import org.brewlake.etl.TableExpectations;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Configuration of the brewery pipeline.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * dataDirectory: /opt/airflow/data
 * bronze: bronze
 * silver: silver
 * gold: gold
 * goldFileName: breweries_aggregated.parquet
 * compression: snappy
 * unknownValue: unknown
 * reconcileWithSilver: true
 * source:
 *   url: "https://api.openbrewerydb.org/v1/breweries"
 *   response:
 *     pagination:
 *       type: page
 *       pageParam: page
 *       limitParam: per_page
 *       pageSize: 200
 * quality:
 *   minRows: 10
 *   notNull: [brewery_type, country, state]
 * }</pre>
 *
 * <p>Every key is optional; missing keys take the values of
 * {@link #defaults()}. Layer directories are resolved against
 * {@code dataDirectory} unless they are absolute; the resolved paths returned
 * by {@link #getBronzePath()} and its siblings are always absolute.
 *
 * <p>The {@code quality} block adds expectations to the gold quality gate; it
 * can tighten the built-in checks but never loosen them.
 */
public class BreweryPipelineConfig {

  /** Classpath resource read by {@link #loadDefault()}. */
  public static final String DEFAULT_RESOURCE = "brewery-pipeline.yaml";

  public static final String DEFAULT_URL = "https://api.openbrewerydb.org/v1/breweries";
  public static final int DEFAULT_PAGE_SIZE = 200;

  private final String dataDirectory;
  private final String bronzeDirectory;
  private final String silverDirectory;
  private final String goldDirectory;
  private final String goldFileName;
  private final String compression;
  private final String unknownValue;
  private final boolean reconcileWithSilver;
  private final HttpSourceConfig source;
  private final TableExpectations qualityExpectations;

  private BreweryPipelineConfig(Builder builder) {
    this.dataDirectory = builder.dataDirectory != null ? builder.dataDirectory : "data";
    this.bronzeDirectory = builder.bronzeDirectory != null ? builder.bronzeDirectory : "bronze";
    this.silverDirectory = builder.silverDirectory != null ? builder.silverDirectory : "silver";
    this.goldDirectory = builder.goldDirectory != null ? builder.goldDirectory : "gold";
    this.goldFileName = builder.goldFileName != null
        ? builder.goldFileName : "breweries_aggregated.parquet";
    this.compression = builder.compression != null ? builder.compression : "snappy";
    this.unknownValue = builder.unknownValue != null ? builder.unknownValue : "unknown";
    this.reconcileWithSilver = builder.reconcileWithSilver != null
        ? builder.reconcileWithSilver : true;
    this.source = builder.source != null ? builder.source : defaultSource();
    this.qualityExpectations = builder.qualityExpectations != null
        ? builder.qualityExpectations : TableExpectations.builder().build();
  }

  /**
   * Returns the base directory holding the three layers.
   */
  public String getDataDirectory() {
    return dataDirectory;
  }

  public String getBronzeDirectory() {
    return bronzeDirectory;
  }

  public String getSilverDirectory() {
    return silverDirectory;
  }

  public String getGoldDirectory() {
    return goldDirectory;
  }

  public String getGoldFileName() {
    return goldFileName;
  }

  /**
   * Returns the Parquet compression codec for silver and gold output.
   */
  public String getCompression() {
    return compression;
  }

  /**
   * Returns the placeholder written for missing optional text fields and
   * missing countries.
   */
  public String getUnknownValue() {
    return unknownValue;
  }

  /**
   * Returns whether the quality check compares the gold total against the
   * silver row count.
   */
  public boolean isReconcileWithSilver() {
    return reconcileWithSilver;
  }

  public HttpSourceConfig getSource() {
    return source;
  }

  /**
   * Returns the configured gold expectations, applied on top of the built-in ones.
   */
  public TableExpectations getQualityExpectations() {
    return qualityExpectations;
  }

  /** Resolved bronze directory. */
  public String getBronzePath() {
    return resolve(bronzeDirectory);
  }

  /** Resolved silver directory. */
  public String getSilverPath() {
    return resolve(silverDirectory);
  }

  /** Resolved gold directory. */
  public String getGoldPath() {
    return resolve(goldDirectory);
  }

  /** Resolved gold file. */
  public String getGoldFilePath() {
    return Paths.get(getGoldPath()).resolve(goldFileName).toString();
  }

  private String resolve(String directory) {
    Path path = Paths.get(directory);
    Path resolved = path.isAbsolute() ? path : Paths.get(dataDirectory).resolve(path);
    return resolved.toAbsolutePath().normalize().toString();
  }

  /**
   * Returns a copy that fetches pages of {@code pageSize} records.
   */
  public BreweryPipelineConfig withPageSize(int pageSize) {
    HttpSourceConfig.ResponseConfig response = source.getResponse();
    HttpSourceConfig.ResponseConfig resized = HttpSourceConfig.ResponseConfig.of(
        response.getDataPath(), response.getPagination().withPageSize(pageSize));
    return toBuilder().source(source.toBuilder().response(resized).build()).build();
  }

  public Builder toBuilder() {
    return builder()
        .dataDirectory(dataDirectory)
        .bronzeDirectory(bronzeDirectory)
        .silverDirectory(silverDirectory)
        .goldDirectory(goldDirectory)
        .goldFileName(goldFileName)
        .compression(compression)
        .unknownValue(unknownValue)
        .reconcileWithSilver(reconcileWithSilver)
        .source(source)
        .qualityExpectations(qualityExpectations);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the built-in configuration: the public Open Brewery DB endpoint,
   * pages of {@value #DEFAULT_PAGE_SIZE}, layers below {@code ./data}.
   */
  public static BreweryPipelineConfig defaults() {
    return builder().build();
  }

  static HttpSourceConfig defaultSource() {
    return HttpSourceConfig.builder()
        .url(DEFAULT_URL)
        .response(HttpSourceConfig.ResponseConfig.of(null,
            HttpSourceConfig.PaginationConfig.page("page", "per_page", DEFAULT_PAGE_SIZE)))
        .build();
  }

  /**
   * Creates a configuration from a YAML/JSON map.
   *
   * @param map Configuration map; may be null
   * @return Configuration with defaults for missing keys
   */
  @SuppressWarnings("unchecked")
  public static BreweryPipelineConfig fromMap(@Nullable Map<String, Object> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }

    builder.dataDirectory(stringValue(map, "dataDirectory"));
    builder.bronzeDirectory(stringValue(map, "bronze"));
    builder.silverDirectory(stringValue(map, "silver"));
    builder.goldDirectory(stringValue(map, "gold"));
    builder.goldFileName(stringValue(map, "goldFileName"));
    builder.compression(stringValue(map, "compression"));
    builder.unknownValue(stringValue(map, "unknownValue"));

    Object reconcileObj = map.get("reconcileWithSilver");
    if (reconcileObj instanceof Boolean) {
      builder.reconcileWithSilver((Boolean) reconcileObj);
    }

    Object sourceObj = map.get("source");
    if (sourceObj instanceof Map) {
      builder.source(HttpSourceConfig.fromMap((Map<String, Object>) sourceObj));
    }

    Object qualityObj = map.get("quality");
    if (qualityObj instanceof Map) {
      builder.qualityExpectations(TableExpectations.fromMap((Map<String, Object>) qualityObj));
    }

    return builder.build();
  }

  private static @Nullable String stringValue(Map<String, Object> map, String key) {
    Object value = map.get(key);
    return value != null ? value.toString() : null;
  }

  /**
   * Loads a configuration from a YAML file.
   *
   * @throws IOException If the file cannot be read
   * @throws BreweryException If the file is not a YAML mapping
   */
  public static BreweryPipelineConfig load(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return parse(in, file.toString());
    }
  }

  /**
   * Loads {@value #DEFAULT_RESOURCE} from the classpath, or returns
   * {@link #defaults()} when the resource is absent.
   */
  public static BreweryPipelineConfig loadDefault() throws IOException {
    try (InputStream in = BreweryPipelineConfig.class.getClassLoader()
        .getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        return defaults();
      }
      return parse(in, DEFAULT_RESOURCE);
    }
  }

  @SuppressWarnings("unchecked")
  static BreweryPipelineConfig parse(InputStream in, String resourceName) {
    Yaml yaml = new Yaml(new LoaderOptions());
    Object parsed;
    try {
      parsed = yaml.load(in);
    } catch (RuntimeException e) {
      throw new BreweryException("Invalid YAML in " + resourceName + ": " + e.getMessage(), e);
    }
    if (parsed == null) {
      return defaults();
    }
    if (!(parsed instanceof Map)) {
      throw new BreweryException("Expected a YAML mapping in " + resourceName);
    }
    try {
      return fromMap((Map<String, Object>) parsed);
    } catch (IllegalArgumentException | ClassCastException e) {
      throw new BreweryException("Invalid configuration in " + resourceName + ": "
          + e.getMessage(), e);
    }
  }

  @Override public String toString() {
    return "BreweryPipelineConfig{data='" + dataDirectory + "', source='" + source.getUrl()
        + "', pageSize=" + source.getResponse().getPagination().getPageSize()
        + ", compression=" + compression + "}";
  }

  /**
   * Builder for BreweryPipelineConfig.
   */
  public static class Builder {
    private String dataDirectory;
    private String bronzeDirectory;
    private String silverDirectory;
    private String goldDirectory;
    private String goldFileName;
    private String compression;
    private String unknownValue;
    private Boolean reconcileWithSilver;
    private HttpSourceConfig source;
    private TableExpectations qualityExpectations;

    public Builder dataDirectory(String dataDirectory) {
      this.dataDirectory = dataDirectory;
      return this;
    }

    public Builder bronzeDirectory(String bronzeDirectory) {
      this.bronzeDirectory = bronzeDirectory;
      return this;
    }

    public Builder silverDirectory(String silverDirectory) {
      this.silverDirectory = silverDirectory;
      return this;
    }

    public Builder goldDirectory(String goldDirectory) {
      this.goldDirectory = goldDirectory;
      return this;
    }

    public Builder goldFileName(String goldFileName) {
      this.goldFileName = goldFileName;
      return this;
    }

    public Builder compression(String compression) {
      this.compression = compression;
      return this;
    }

    public Builder unknownValue(String unknownValue) {
      this.unknownValue = unknownValue;
      return this;
    }

    public Builder reconcileWithSilver(boolean reconcileWithSilver) {
      this.reconcileWithSilver = reconcileWithSilver;
      return this;
    }

    public Builder source(HttpSourceConfig source) {
      this.source = source;
      return this;
    }

    public Builder qualityExpectations(TableExpectations qualityExpectations) {
      this.qualityExpectations = qualityExpectations;
      return this;
    }

    public BreweryPipelineConfig build() {
      return new BreweryPipelineConfig(this);
    }
  }
}
