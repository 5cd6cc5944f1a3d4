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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for BreweryPipelineConfig.
 */
@Tag("unit")
public class BreweryPipelineConfigTest {

  @TempDir
  Path tempDir;

  @Test void testDefaults() {
    BreweryPipelineConfig config = BreweryPipelineConfig.defaults();
    Path data = Paths.get("data").toAbsolutePath().normalize();

    assertEquals(data.resolve("bronze").toString(), config.getBronzePath());
    assertEquals(data.resolve("silver").toString(), config.getSilverPath());
    assertEquals(data.resolve("gold/breweries_aggregated.parquet").toString(),
        config.getGoldFilePath());
    assertEquals("snappy", config.getCompression());
    assertEquals("unknown", config.getUnknownValue());
    assertTrue(config.isReconcileWithSilver());

    HttpSourceConfig source = config.getSource();
    assertEquals(BreweryPipelineConfig.DEFAULT_URL, source.getUrl());
    HttpSourceConfig.PaginationConfig pagination = source.getResponse().getPagination();
    assertEquals(HttpSourceConfig.PaginationType.PAGE, pagination.getType());
    assertEquals("page", pagination.getPageParam());
    assertEquals("per_page", pagination.getLimitParam());
    assertEquals(200, pagination.getPageSize());
  }

  @Test void testFromMap() {
    Map<String, Object> pagination = new HashMap<String, Object>();
    pagination.put("type", "page");
    pagination.put("pageParam", "page");
    pagination.put("limitParam", "per_page");
    pagination.put("pageSize", 50);
    Map<String, Object> response = new HashMap<String, Object>();
    response.put("pagination", pagination);
    Map<String, Object> source = new HashMap<String, Object>();
    source.put("url", "http://localhost:9999/breweries");
    source.put("response", response);

    Map<String, Object> map = new HashMap<String, Object>();
    map.put("dataDirectory", tempDir.toString());
    map.put("gold", "/srv/gold");
    map.put("compression", "zstd");
    map.put("reconcileWithSilver", false);
    map.put("source", source);

    BreweryPipelineConfig config = BreweryPipelineConfig.fromMap(map);

    assertEquals(tempDir.resolve("bronze").toString(), config.getBronzePath());
    assertEquals("/srv/gold", config.getGoldPath());
    assertEquals("zstd", config.getCompression());
    assertFalse(config.isReconcileWithSilver());
    assertEquals("http://localhost:9999/breweries", config.getSource().getUrl());
    assertEquals(50, config.getSource().getResponse().getPagination().getPageSize());
  }

  @Test void testNullMapGivesDefaults() {
    assertEquals(BreweryPipelineConfig.defaults().getSilverPath(),
        BreweryPipelineConfig.fromMap(null).getSilverPath());
  }

  @Test void testWithPageSizeKeepsEverythingElse() {
    BreweryPipelineConfig config = BreweryPipelineConfig.builder()
        .dataDirectory(tempDir.toString())
        .unknownValue("n/a")
        .build()
        .withPageSize(25);

    HttpSourceConfig.PaginationConfig pagination =
        config.getSource().getResponse().getPagination();
    assertEquals(25, pagination.getPageSize());
    assertEquals("per_page", pagination.getLimitParam());
    assertEquals("n/a", config.getUnknownValue());
    assertEquals(tempDir.toString(), config.getDataDirectory());
    assertThrows(IllegalArgumentException.class, () -> config.withPageSize(0));
  }

  @Test void testLoadYaml() throws IOException {
    Path file = tempDir.resolve("pipeline.yaml");
    Files.write(file, ("dataDirectory: " + tempDir + "/lake\n"
        + "unknownValue: missing\n"
        + "source:\n"
        + "  url: http://127.0.0.1:8080/v1/breweries\n"
        + "  rateLimit:\n"
        + "    requestsPerSecond: 0\n").getBytes(StandardCharsets.UTF_8));

    BreweryPipelineConfig config = BreweryPipelineConfig.load(file);

    assertEquals(tempDir.resolve("lake/silver").toString(), config.getSilverPath());
    assertEquals("missing", config.getUnknownValue());
    assertEquals(0, config.getSource().getRateLimit().getRequestsPerSecond());
  }

  @Test void testLoadDefaultReadsClasspathResource() throws IOException {
    BreweryPipelineConfig config = BreweryPipelineConfig.loadDefault();

    assertEquals(BreweryPipelineConfig.DEFAULT_URL, config.getSource().getUrl());
    assertEquals(5, config.getSource().getRateLimit().getRequestsPerSecond());
    assertEquals("application/json", config.getSource().getHeaders().get("Accept"));
  }

  @Test void testInvalidYaml() {
    BreweryException malformed = assertThrows(BreweryException.class,
        () -> parse("source: [unclosed"));
    assertThat(malformed.getMessage(), containsString("Invalid YAML in test.yaml"));

    BreweryException notMapping = assertThrows(BreweryException.class,
        () -> parse("- just\n- a list\n"));
    assertThat(notMapping.getMessage(), containsString("Expected a YAML mapping"));

    BreweryException badSource = assertThrows(BreweryException.class,
        () -> parse("source:\n  response:\n    pagination:\n      type: cursor\n"));
    assertThat(badSource.getMessage(), containsString("Invalid configuration in test.yaml"));
  }

  @Test void testQualityExpectationsFromYaml() {
    TableExpectations expectations = parse("quality:\n"
        + "  minRows: 10\n"
        + "  notNull: [city]\n").getQualityExpectations();
    assertEquals(10, expectations.getMinRows());
    assertEquals(Collections.singletonList("city"), expectations.getNotNullColumns());

    TableExpectations none = BreweryPipelineConfig.defaults().getQualityExpectations();
    assertEquals(0, none.getMinRows());
    assertTrue(none.getNotNullColumns().isEmpty());

    BreweryException negative = assertThrows(BreweryException.class,
        () -> parse("quality:\n  minRows: -1\n"));
    assertThat(negative.getMessage(), containsString("Invalid configuration in test.yaml"));
  }

  @Test void testEmptyYamlGivesDefaults() {
    assertEquals(BreweryPipelineConfig.DEFAULT_URL, parse("").getSource().getUrl());
  }

  private static BreweryPipelineConfig parse(String yaml) {
    return BreweryPipelineConfig.parse(
        new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test.yaml");
  }
}
