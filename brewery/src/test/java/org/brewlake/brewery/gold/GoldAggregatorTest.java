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
package org.brewlake.brewery.gold;

import org.brewlake.brewery.BreweryException;
import org.brewlake.brewery.BreweryFixtures;
import org.brewlake.brewery.BreweryPipelineConfig;
import org.brewlake.brewery.PipelineStage;
import org.brewlake.brewery.StageResult;
import org.brewlake.brewery.silver.SilverTransformer;
import org.brewlake.etl.ColumnConfig;
import org.brewlake.etl.HiveParquetWriter;
import org.brewlake.etl.MaterializeConfig;
import org.brewlake.etl.MaterializeOutputConfig;
import org.brewlake.etl.ParquetTableReader;
import org.brewlake.storage.LocalFileStorageProvider;
import org.brewlake.storage.StorageProvider;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for GoldAggregator.
 */
@Tag("integration")
public class GoldAggregatorTest {

  @TempDir
  Path tempDir;

  private BreweryPipelineConfig config;
  private StorageProvider storage;
  private GoldAggregator aggregator;

  @BeforeEach
  void setUp() {
    config = BreweryFixtures.config(tempDir.resolve("data"));
    storage = new LocalFileStorageProvider();
    aggregator = new GoldAggregator(config, storage);
  }

  private void buildSilver() throws IOException {
    BreweryFixtures.writeBronze(config, "breweries_raw_20240501_120000.json",
        BreweryFixtures.records());
    new SilverTransformer(config, storage).transform();
  }

  @Test void testAggregatesSilver() throws IOException {
    buildSilver();

    StageResult result = aggregator.aggregate();

    assertEquals(PipelineStage.AGGREGATE, result.getStage());
    assertEquals(5, result.getInputRows());
    assertEquals(4, result.getOutputRows());
    assertEquals(config.getGoldFilePath(), result.getOutputPath());
    assertTrue(Files.isRegularFile(Paths.get(config.getGoldFilePath())));

    assertEquals(Arrays.asList(
        new BreweryAggregate("micro", "Ireland", "Dublin", 1),
        new BreweryAggregate("brewpub", "United States", "California", 1),
        new BreweryAggregate("micro", "United States", "Oregon", 2),
        new BreweryAggregate("large", "unknown", "Bavaria", 1)),
        aggregator.readAggregates());
  }

  @Test void testTotalMatchesSilverRowCount() throws IOException {
    buildSilver();
    aggregator.aggregate();

    long total = 0;
    for (BreweryAggregate aggregate : aggregator.readAggregates()) {
      assertTrue(aggregate.getBreweryCount() > 0);
      total += aggregate.getBreweryCount();
    }
    ParquetTableReader reader = new ParquetTableReader(storage, config.getDataDirectory());
    assertEquals(reader.countRows(GoldAggregator.silverPattern(config)), total);
  }

  @Test void testGoldColumnOrder() throws IOException {
    buildSilver();
    aggregator.aggregate();

    ParquetTableReader reader = new ParquetTableReader(storage, config.getDataDirectory());
    List<Map<String, Object>> rows = reader.readRows(config.getGoldFilePath());
    assertEquals(Arrays.asList("brewery_type", "country", "state", "brewery_count"),
        new ArrayList<String>(rows.get(0).keySet()));
  }

  @Test void testRerunOverwritesGold() throws IOException {
    buildSilver();
    aggregator.aggregate();
    StageResult second = aggregator.aggregate();

    assertEquals(4, second.getOutputRows());
    assertEquals(4, aggregator.readAggregates().size());
  }

  @Test void testMissingSilver() {
    BreweryException e = assertThrows(BreweryException.class, aggregator::aggregate);
    assertThat(e.getMessage(), containsString("Silver layer has no Parquet files"));
  }

  @Test void testEmptySilver() throws IOException {
    MaterializeConfig empty = MaterializeConfig.builder()
        .name("empty silver")
        .output(MaterializeOutputConfig.builder()
            .location(config.getSilverPath() + "/country=Nowhere/state=Empty")
            .fileName("data_0.parquet")
            .build())
        .columns(Collections.singletonList(
            ColumnConfig.of("id", ColumnConfig.ColumnType.VARCHAR)))
        .build();
    new HiveParquetWriter(storage, config.getDataDirectory())
        .write(empty, Collections.<Map<String, Object>>emptyIterator());

    BreweryException e = assertThrows(BreweryException.class, aggregator::aggregate);
    assertThat(e.getMessage(), containsString("Silver layer is empty"));
    assertFalse(Files.exists(Paths.get(config.getGoldFilePath())));
  }

  @Test void testMissingGold() {
    BreweryException e = assertThrows(BreweryException.class, aggregator::readAggregates);
    assertThat(e.getMessage(), containsString("Gold file not found"));
  }
}
