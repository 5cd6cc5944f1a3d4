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
package org.brewlake.brewery.quality;

import org.brewlake.brewery.BreweryFixtures;
import org.brewlake.brewery.BreweryPipelineConfig;
import org.brewlake.brewery.DataQualityException;
import org.brewlake.brewery.StageResult;
import org.brewlake.brewery.gold.GoldAggregator;
import org.brewlake.brewery.silver.SilverTransformer;
import org.brewlake.etl.ColumnConfig;
import org.brewlake.etl.HiveParquetWriter;
import org.brewlake.etl.MaterializeConfig;
import org.brewlake.etl.MaterializeOutputConfig;
import org.brewlake.etl.TableExpectations;
import org.brewlake.storage.LocalFileStorageProvider;
import org.brewlake.storage.StorageProvider;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for GoldQualityCheck.
 */
@Tag("integration")
public class GoldQualityCheckTest {

  @TempDir
  Path tempDir;

  private BreweryPipelineConfig config;
  private StorageProvider storage;

  @BeforeEach
  void setUp() {
    config = BreweryFixtures.config(tempDir.resolve("data"));
    storage = new LocalFileStorageProvider();
  }

  private void buildSilverAndGold() throws IOException {
    BreweryFixtures.writeBronze(config, "breweries_raw_20240501_120000.json",
        BreweryFixtures.records());
    new SilverTransformer(config, storage).transform();
    new GoldAggregator(config, storage).aggregate();
  }

  /** Writes a gold file by hand, bypassing the aggregator. */
  private void writeGold(Object[][] groups) throws IOException {
    List<ColumnConfig> columns = new ArrayList<ColumnConfig>();
    for (String name : GoldAggregator.GROUP_BY) {
      columns.add(ColumnConfig.of(name, ColumnConfig.ColumnType.VARCHAR));
    }
    columns.add(ColumnConfig.of(GoldAggregator.BREWERY_COUNT, ColumnConfig.ColumnType.BIGINT));
    MaterializeConfig materialize = MaterializeConfig.builder()
        .name("handmade gold")
        .output(MaterializeOutputConfig.builder()
            .location(config.getGoldPath())
            .fileName(config.getGoldFileName())
            .build())
        .columns(columns)
        .build();

    List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();
    for (Object[] group : groups) {
      Map<String, Object> row = new LinkedHashMap<String, Object>();
      row.put("brewery_type", group[0]);
      row.put("country", group[1]);
      row.put("state", group[2]);
      row.put("brewery_count", group[3]);
      rows.add(row);
    }
    new HiveParquetWriter(storage, config.getDataDirectory()).write(materialize, rows.iterator());
  }

  @Test void testPassesAfterAggregation() throws IOException {
    buildSilverAndGold();

    StageResult result = new GoldQualityCheck(config, storage).check();

    assertEquals(4, result.getInputRows());
    assertEquals(5, result.getOutputRows());
    assertEquals(config.getGoldFilePath(), result.getOutputPath());
  }

  @Test void testMissingGold() {
    DataQualityException e = assertThrows(DataQualityException.class,
        () -> new GoldQualityCheck(config, storage).check());

    assertThat(e.getFailures().get(0), containsString("Table not found"));
    assertThat(e.getFailures(), hasItem(containsString("Silver layer not found")));
  }

  @Test void testNullGroupingValue() throws IOException {
    writeGold(new Object[][] {{"micro", "Ireland", null, 3}, {"large", "unknown", "Bavaria", 1}});
    BreweryPipelineConfig noReconcile = config.toBuilder().reconcileWithSilver(false).build();

    DataQualityException e = assertThrows(DataQualityException.class,
        () -> new GoldQualityCheck(noReconcile, storage).check());

    assertEquals(Arrays.asList("Column state has 1 null value(s)"), e.getFailures());
    assertEquals(1, e.getReport().getMetric("nulls.state"));
  }

  @Test void testEveryFailureIsReported() throws IOException {
    writeGold(new Object[0][]);
    BreweryPipelineConfig noReconcile = config.toBuilder().reconcileWithSilver(false).build();

    DataQualityException e = assertThrows(DataQualityException.class,
        () -> new GoldQualityCheck(noReconcile, storage).check());

    assertThat(e.getFailures(), hasItem("Table is empty"));
    assertThat(e.getFailures(), hasItem("Sum of brewery_count is 0, expected > 0"));
    assertThat(e.getMessage(), containsString("Table is empty; Sum of brewery_count"));
  }

  @Test void testReconciliationWithSilver() throws IOException {
    buildSilverAndGold();
    List<Map<String, Object>> fewer = new ArrayList<Map<String, Object>>(
        BreweryFixtures.records().subList(0, 4));
    new SilverTransformer(config, storage).transform(BreweryFixtures.writeBronze(config,
        "breweries_raw_20240601_000000.json", fewer).toString());

    DataQualityException e = assertThrows(DataQualityException.class,
        () -> new GoldQualityCheck(config, storage).check());
    assertEquals(Arrays.asList("Sum of brewery_count is 5, expected 4"), e.getFailures());

    BreweryPipelineConfig noReconcile = config.toBuilder().reconcileWithSilver(false).build();
    assertEquals(5, new GoldQualityCheck(noReconcile, storage).check().getOutputRows());
  }

  @Test void testConfiguredExpectationsAreChecked() throws IOException {
    buildSilverAndGold();
    BreweryPipelineConfig strict = config.toBuilder()
        .qualityExpectations(TableExpectations.builder().minRows(10).build())
        .build();

    DataQualityException e = assertThrows(DataQualityException.class,
        () -> new GoldQualityCheck(strict, storage).check());
    assertEquals(Arrays.asList("Expected at least 10 rows but found 4"), e.getFailures());
  }

  @Tag("unit")
  @Test void testConfiguredExpectationsCannotLoosenBuiltInChecks() {
    TableExpectations configured = TableExpectations.builder()
        .notNull(Arrays.asList("state", "city"))
        .build();

    TableExpectations merged = GoldQualityCheck.expectations(configured).build();

    assertEquals(1, merged.getMinRows());
    assertEquals(Arrays.asList("brewery_type", "country", "state", "city"),
        merged.getNotNullColumns());
    assertEquals(Arrays.asList("brewery_count"), merged.getPositiveSumColumns());
  }
}
