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

import org.brewlake.brewery.gold.BreweryAggregate;
import org.brewlake.brewery.gold.GoldAggregator;
import org.brewlake.etl.HttpSourceConfig;
import org.brewlake.etl.HttpStatusException;
import org.brewlake.storage.LocalFileStorageProvider;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end tests for BreweryPipeline against a stub of the brewery API.
 */
@Tag("integration")
public class BreweryPipelineTest {

  @TempDir
  Path tempDir;

  private BreweryFixtures.ApiStub api;
  private BreweryPipelineConfig config;

  @BeforeEach
  void setUp() throws IOException {
    api = new BreweryFixtures.ApiStub(BreweryFixtures.records());
    BreweryPipelineConfig base = BreweryFixtures.config(tempDir.resolve("data"));
    config = base.toBuilder()
        .source(base.getSource().toBuilder()
            .url(api.url())
            .rateLimit(HttpSourceConfig.RateLimitConfig.of(0))
            .build())
        .build()
        .withPageSize(3);
  }

  @AfterEach
  void tearDown() {
    api.close();
  }

  private BreweryPipeline pipeline(String instant) {
    return new BreweryPipeline(config, new LocalFileStorageProvider(),
        Clock.fixed(Instant.parse(instant), ZoneOffset.UTC));
  }

  @Test void testRunAll() throws IOException {
    List<StageResult> results = pipeline("2024-05-01T12:00:00Z").runAll();

    assertEquals(4, results.size());
    assertEquals(PipelineStage.INGEST, results.get(0).getStage());
    assertEquals(7, results.get(0).getOutputRows());
    assertEquals(5, results.get(1).getOutputRows());
    assertEquals(2, results.get(1).getDroppedRows());
    assertEquals(4, results.get(2).getOutputRows());
    assertEquals(5, results.get(3).getOutputRows());

    // 3 + 3 + 1 records, then an empty page
    assertEquals(4, api.getRequestCount());
    assertTrue(Files.exists(Paths.get(config.getBronzePath(),
        "breweries_raw_20240501_120000.json")));
    assertTrue(Files.isRegularFile(Paths.get(config.getGoldFilePath())));
  }

  @Test void testStagesRunIndependently() throws IOException {
    BreweryPipeline pipeline = pipeline("2024-05-01T12:00:00Z");
    pipeline.run(PipelineStage.INGEST);
    pipeline.run(PipelineStage.TRANSFORM);
    pipeline.run(PipelineStage.AGGREGATE);
    StageResult quality = pipeline.run(PipelineStage.QUALITY);

    assertEquals(5, quality.getOutputRows());
    assertEquals(new BreweryAggregate("micro", "United States", "Oregon", 2),
        new GoldAggregator(config, new LocalFileStorageProvider()).readAggregates().get(2));
  }

  @Test void testLaterSnapshotDrivesSilverAndGold() throws IOException {
    pipeline("2024-05-01T12:00:00Z").runAll();

    List<Map<String, Object>> more = new ArrayList<Map<String, Object>>(
        BreweryFixtures.records());
    more.add(BreweryFixtures.brewery("8", "micro", "Ireland", "Dublin"));
    api.setRecords(more);
    List<StageResult> second = pipeline("2024-05-02T12:00:00Z").runAll();

    assertEquals(6, second.get(1).getOutputRows());
    assertEquals(6, second.get(3).getOutputRows());
    try (Stream<Path> snapshots = Files.list(Paths.get(config.getBronzePath()))) {
      assertEquals(2, snapshots.count());
    }
  }

  @Test void testSameTimestampIngestFails() throws IOException {
    pipeline("2024-05-01T12:00:00Z").ingest();

    BreweryException e = assertThrows(BreweryException.class,
        () -> pipeline("2024-05-01T12:00:00Z").ingest());
    assertThat(e.getMessage(), containsString("already exists"));
  }

  @Test void testApiErrorStopsPipeline() {
    api.failWith(503);

    HttpStatusException e = assertThrows(HttpStatusException.class,
        () -> pipeline("2024-05-01T12:00:00Z").runAll());

    assertEquals(503, e.getStatusCode());
    assertEquals(1, api.getRequestCount());
    assertFalse(Files.exists(Paths.get(config.getSilverPath())));
  }

  @Test void testStageCommands() {
    assertEquals(Arrays.asList(PipelineStage.INGEST, PipelineStage.TRANSFORM,
        PipelineStage.AGGREGATE, PipelineStage.QUALITY), Arrays.asList(PipelineStage.values()));
    assertEquals(PipelineStage.QUALITY, PipelineStage.fromCommand(" Quality "));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> PipelineStage.fromCommand("publish"));
    assertEquals("Unknown stage: publish", e.getMessage());
  }
}
