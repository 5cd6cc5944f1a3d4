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
import org.brewlake.brewery.BreweryPipelineConfig;
import org.brewlake.brewery.PipelineStage;
import org.brewlake.brewery.StageResult;
import org.brewlake.brewery.silver.BrewerySchema;
import org.brewlake.etl.AggregateConfig;
import org.brewlake.etl.HiveParquetWriter;
import org.brewlake.etl.MaterializeConfig;
import org.brewlake.etl.MaterializeOutputConfig;
import org.brewlake.etl.MaterializeResult;
import org.brewlake.etl.ParquetTableReader;
import org.brewlake.storage.StorageProvider;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Gold stage: counts silver breweries per type, country and state.
 *
 * <p>The aggregate is recomputed from the whole silver layer on every run and
 * written as a single Parquet file sorted by country, state and brewery type.
 */
public class GoldAggregator {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoldAggregator.class);

  public static final String BREWERY_COUNT = "brewery_count";

  /** Grouping columns, in output column order. */
  public static final ImmutableList<String> GROUP_BY = ImmutableList.of(
      BrewerySchema.BREWERY_TYPE, BrewerySchema.COUNTRY, BrewerySchema.STATE);

  private static final ImmutableList<String> ORDER_BY = ImmutableList.of(
      BrewerySchema.COUNTRY, BrewerySchema.STATE, BrewerySchema.BREWERY_TYPE);

  private final BreweryPipelineConfig config;
  private final StorageProvider storageProvider;
  private final ParquetTableReader reader;

  public GoldAggregator(BreweryPipelineConfig config, StorageProvider storageProvider) {
    this.config = config;
    this.storageProvider = storageProvider;
    this.reader = new ParquetTableReader(storageProvider, config.getDataDirectory());
  }

  /**
   * Aggregates the silver layer into the gold file.
   *
   * @return Result with the silver row count as input and the group count as output
   * @throws IOException If reading or writing Parquet fails
   * @throws BreweryException If the silver layer is missing or empty
   */
  public StageResult aggregate() throws IOException {
    long startTime = System.currentTimeMillis();
    if (!reader.hasParquetFiles(config.getSilverPath())) {
      throw new BreweryException("Silver layer has no Parquet files: " + config.getSilverPath());
    }
    String silverPattern = silverPattern(config);
    long silverRows = reader.countRows(silverPattern);
    if (silverRows == 0) {
      throw new BreweryException("Silver layer is empty: " + config.getSilverPath());
    }

    HiveParquetWriter writer = new HiveParquetWriter(storageProvider, config.getDataDirectory());
    MaterializeResult written = writer.aggregateFromParquet(outputConfig(config), silverPattern,
        AggregateConfig.of(GROUP_BY, BREWERY_COUNT, ORDER_BY));

    long elapsed = System.currentTimeMillis() - startTime;
    LOGGER.info("Gold layer written to {}: {} groups from {} breweries",
        written.getOutputPath(), written.getRowCount(), silverRows);
    return StageResult.builder(PipelineStage.AGGREGATE)
        .outputPath(written.getOutputPath())
        .inputRows(silverRows)
        .outputRows(written.getRowCount())
        .elapsedMillis(elapsed)
        .build();
  }

  /**
   * Reads the gold file back, in file order.
   *
   * @throws BreweryException If the gold file does not exist
   */
  public List<BreweryAggregate> readAggregates() throws IOException {
    String goldFile = config.getGoldFilePath();
    if (!storageProvider.exists(goldFile)) {
      throw new BreweryException("Gold file not found: " + goldFile);
    }

    List<BreweryAggregate> aggregates = new ArrayList<BreweryAggregate>();
    for (Map<String, Object> row : reader.readRows(goldFile)) {
      Object count = row.get(BREWERY_COUNT);
      aggregates.add(new BreweryAggregate(
          (String) row.get(BrewerySchema.BREWERY_TYPE),
          (String) row.get(BrewerySchema.COUNTRY),
          (String) row.get(BrewerySchema.STATE),
          count instanceof Number ? ((Number) count).longValue() : 0L));
    }
    return aggregates;
  }

  /**
   * Returns the glob matching every silver Parquet file.
   */
  public static String silverPattern(BreweryPipelineConfig config) {
    return config.getSilverPath() + "/**/*.parquet";
  }

  static MaterializeConfig outputConfig(BreweryPipelineConfig config) {
    return MaterializeConfig.builder()
        .name("gold brewery counts")
        .output(MaterializeOutputConfig.builder()
            .location(config.getGoldPath())
            .fileName(config.getGoldFileName())
            .compression(config.getCompression())
            .build())
        .build();
  }
}
