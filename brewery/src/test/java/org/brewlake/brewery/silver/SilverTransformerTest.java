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
package org.brewlake.brewery.silver;

import org.brewlake.brewery.BreweryException;
import org.brewlake.brewery.BreweryFixtures;
import org.brewlake.brewery.BreweryPipelineConfig;
import org.brewlake.brewery.StageResult;
import org.brewlake.brewery.gold.GoldAggregator;
import org.brewlake.etl.MaterializeConfig;
import org.brewlake.etl.ParquetTableReader;
import org.brewlake.storage.LocalFileStorageProvider;
import org.brewlake.storage.StorageProvider;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for SilverTransformer.
 */
@Tag("integration")
public class SilverTransformerTest {

  private static final String SNAPSHOT = "breweries_raw_20240501_120000.json";

  @TempDir
  Path tempDir;

  private BreweryPipelineConfig config;
  private StorageProvider storage;
  private SilverTransformer transformer;
  private ParquetTableReader reader;

  @BeforeEach
  void setUp() {
    config = BreweryFixtures.config(tempDir.resolve("data"));
    storage = new LocalFileStorageProvider();
    transformer = new SilverTransformer(config, storage);
    reader = new ParquetTableReader(storage, config.getDataDirectory());
  }

  private Map<String, Object> silverRow(String id) throws IOException {
    List<Map<String, Object>> rows = reader.readRows(GoldAggregator.silverPattern(config),
        ImmutableMap.<String, Object>of(BrewerySchema.ID, id));
    assertEquals(1, rows.size(), "rows with id " + id);
    return rows.get(0);
  }

  @Test void testCountsAndPartitions() throws IOException {
    BreweryFixtures.writeBronze(config, SNAPSHOT, BreweryFixtures.records());

    StageResult result = transformer.transform();

    assertEquals(7, result.getInputRows());
    assertEquals(5, result.getOutputRows());
    assertEquals(2, result.getDroppedRows());
    assertEquals(result.getInputRows() - result.getDroppedRows(), result.getOutputRows());
    assertEquals(config.getSilverPath(), result.getOutputPath());
    assertEquals(5, reader.countRows(GoldAggregator.silverPattern(config)));

    Path silver = Paths.get(config.getSilverPath());
    assertTrue(Files.isDirectory(silver.resolve("country=Ireland/state=Dublin")));
    assertTrue(Files.isDirectory(silver.resolve("country=unknown/state=Bavaria")));
  }

  @Test void testRowsKeepTheirValues() throws IOException {
    BreweryFixtures.writeBronze(config, SNAPSHOT, BreweryFixtures.records());
    transformer.transform();

    Map<String, Object> portland = silverRow("1");
    assertEquals("micro", portland.get("brewery_type"));
    assertEquals("United States", portland.get("country"));
    assertEquals("Oregon", portland.get("state"));
    assertEquals(45.5, portland.get("latitude"));
    assertEquals(-122.6, portland.get("longitude"));
    assertEquals("unknown", portland.get("phone"));
    assertEquals(LocalDateTime.of(2024, 5, 1, 12, 0), portland.get("ingested_at"));

    assertNull(silverRow("3").get("latitude"));
    assertEquals(95.0, silverRow("2").get("latitude"));
    assertEquals("unknown", silverRow("5").get("country"));
  }

  @Test void testEveryRowIsFoundUnderItsPartition() throws IOException {
    BreweryFixtures.writeBronze(config, SNAPSHOT, BreweryFixtures.records());
    transformer.transform();

    List<Map<String, Object>> all = reader.readRows(GoldAggregator.silverPattern(config));
    assertEquals(5, all.size());
    for (Map<String, Object> row : all) {
      List<Map<String, Object>> partition = reader.readRows(GoldAggregator.silverPattern(config),
          ImmutableMap.<String, Object>of(
              BrewerySchema.COUNTRY, row.get(BrewerySchema.COUNTRY),
              BrewerySchema.STATE, row.get(BrewerySchema.STATE)));
      List<Object> ids = new ArrayList<Object>();
      for (Map<String, Object> r : partition) {
        ids.add(r.get(BrewerySchema.ID));
      }
      assertTrue(ids.contains(row.get(BrewerySchema.ID)), "id " + row.get(BrewerySchema.ID));
    }
  }

  @Test void testNewestSnapshotIsUsed() throws IOException {
    BreweryFixtures.writeBronze(config, "breweries_raw_20240101_000000.json",
        Collections.singletonList(BreweryFixtures.brewery("old", "micro", "Chile", "Maule")));
    BreweryFixtures.writeBronze(config, SNAPSHOT, BreweryFixtures.records());

    StageResult result = transformer.transform();

    assertEquals(5, result.getOutputRows());
    assertEquals(0, reader.readRows(GoldAggregator.silverPattern(config),
        ImmutableMap.<String, Object>of(BrewerySchema.ID, "old")).size());
  }

  @Test void testRerunReplacesSilver() throws IOException {
    BreweryFixtures.writeBronze(config, SNAPSHOT, BreweryFixtures.records());
    transformer.transform();

    List<Map<String, Object>> smaller = new ArrayList<Map<String, Object>>();
    smaller.add(BreweryFixtures.brewery("10", "nano", "Chile", "Maule"));
    Path newer = BreweryFixtures.writeBronze(config, "breweries_raw_20240601_000000.json",
        smaller);
    transformer.transform(newer.toString());

    assertEquals(1, reader.countRows(GoldAggregator.silverPattern(config)));
    Path silver = Paths.get(config.getSilverPath());
    assertTrue(Files.isDirectory(silver.resolve("country=Chile/state=Maule")));
    assertFalse(Files.exists(silver.resolve("country=Ireland")));
  }

  @Test void testAllRowsDroppedLeavesSilverUnchanged() throws IOException {
    BreweryFixtures.writeBronze(config, SNAPSHOT, BreweryFixtures.records());
    transformer.transform();

    List<Map<String, Object>> invalid = new ArrayList<Map<String, Object>>();
    invalid.add(BreweryFixtures.brewery("20", "micro", "Chile", null));
    invalid.add(BreweryFixtures.brewery("21", null, "Chile", "Maule"));
    Path bad = BreweryFixtures.writeBronze(config, "breweries_raw_20240601_000000.json",
        invalid);

    BreweryException e = assertThrows(BreweryException.class,
        () -> transformer.transform(bad.toString()));
    assertThat(e.getMessage(), containsString("All 2 records"));
    assertEquals(5, reader.countRows(GoldAggregator.silverPattern(config)));
  }

  @Test void testEmptyBronze() throws IOException {
    Path empty = BreweryFixtures.writeBronze(config, SNAPSHOT,
        new ArrayList<Map<String, Object>>());

    BreweryException e = assertThrows(BreweryException.class,
        () -> transformer.transform(empty.toString()));
    assertThat(e.getMessage(), containsString("Bronze layer returned empty data"));
    assertFalse(Files.exists(Paths.get(config.getSilverPath())));
  }

  @Test void testMissingBronze() {
    assertThrows(BreweryException.class, () -> transformer.transform());
  }

  @Test void testMaterializeConfig() {
    MaterializeConfig materialize = SilverTransformer.materializeConfig(
        config.toBuilder().compression("zstd").build());

    assertEquals(config.getSilverPath(), materialize.getOutput().getLocation());
    assertEquals("zstd", materialize.getOutput().getCompression());
    assertEquals(BrewerySchema.PARTITION_COLUMNS, materialize.getPartition().getColumns());
  }
}
