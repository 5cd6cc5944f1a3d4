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
import org.brewlake.brewery.BreweryPipelineConfig;
import org.brewlake.brewery.PipelineStage;
import org.brewlake.brewery.StageResult;
import org.brewlake.brewery.bronze.BronzeSnapshots;
import org.brewlake.etl.HiveParquetWriter;
import org.brewlake.etl.JsonFileSource;
import org.brewlake.etl.MaterializeConfig;
import org.brewlake.etl.MaterializeOutputConfig;
import org.brewlake.etl.MaterializePartitionConfig;
import org.brewlake.etl.MaterializeResult;
import org.brewlake.etl.RowContext;
import org.brewlake.etl.RowProcessor;
import org.brewlake.storage.StorageProvider;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Silver stage: turns a bronze snapshot into partitioned Parquet.
 *
 * <p>Records missing {@code state} or {@code brewery_type} are dropped; a
 * missing {@code country} is kept under {@code country=unknown}. The silver
 * directory is replaced as a whole, so it always reflects exactly one snapshot.
 */
public class SilverTransformer {

  private static final Logger LOGGER = LoggerFactory.getLogger(SilverTransformer.class);

  private final BreweryPipelineConfig config;
  private final StorageProvider storageProvider;

  public SilverTransformer(BreweryPipelineConfig config, StorageProvider storageProvider) {
    this.config = config;
    this.storageProvider = storageProvider;
  }

  /**
   * Transforms the newest bronze snapshot.
   */
  public StageResult transform() throws IOException {
    return transform(BronzeSnapshots.latest(storageProvider, config.getBronzePath()));
  }

  /**
   * Transforms the given bronze file.
   *
   * @param bronzeFile Path of a raw JSON file
   * @return Result with input, output and dropped counts
   * @throws IOException If the file cannot be read or the Parquet write fails
   * @throws BreweryException If the file is empty or no record survives validation
   */
  public StageResult transform(String bronzeFile) throws IOException {
    long startTime = System.currentTimeMillis();
    LOGGER.info("Transforming bronze file {}", bronzeFile);

    List<Map<String, Object>> raw = new JsonFileSource(storageProvider, bronzeFile).readAll();
    if (raw.isEmpty()) {
      throw new BreweryException("Bronze layer returned empty data: " + bronzeFile);
    }

    RowContext.Builder context = RowContext.builder().sourceName(bronzeFile);
    LocalDateTime ingestedAt = BronzeSnapshots.parseTimestamp(bronzeFile);
    if (ingestedAt != null) {
      context.attributes(ImmutableMap.<String, Object>of(BrewerySchema.INGESTED_AT, ingestedAt));
    } else {
      LOGGER.warn("Cannot derive ingestion time from {}; ingested_at will be null", bronzeFile);
    }

    RowProcessor processor = new RowProcessor(
        ImmutableList.of(new BreweryNormalizer(config.getUnknownValue())),
        ImmutableList.of(new RequiredFieldsValidator(BrewerySchema.REQUIRED_COLUMNS),
            new CoordinateRangeValidator()));
    List<Map<String, Object>> normalized = processor.process(raw.iterator(), context.build());

    if (normalized.isEmpty()) {
      throw new BreweryException("All " + raw.size() + " records of " + bronzeFile
          + " were dropped; silver layer left unchanged");
    }

    HiveParquetWriter writer = new HiveParquetWriter(storageProvider, config.getDataDirectory());
    MaterializeResult written = writer.write(materializeConfig(config), normalized.iterator());

    long elapsed = System.currentTimeMillis() - startTime;
    LOGGER.info("Silver layer written to {}: {} of {} records in {} partitions ({} dropped)",
        written.getOutputPath(), written.getRowCount(), raw.size(),
        written.getPartitionCount(), processor.getDroppedCount());
    return StageResult.builder(PipelineStage.TRANSFORM)
        .outputPath(written.getOutputPath())
        .inputRows(raw.size())
        .outputRows(written.getRowCount())
        .droppedRows(processor.getDroppedCount())
        .elapsedMillis(elapsed)
        .build();
  }

  static MaterializeConfig materializeConfig(BreweryPipelineConfig config) {
    return MaterializeConfig.builder()
        .name("silver breweries")
        .output(MaterializeOutputConfig.builder()
            .location(config.getSilverPath())
            .compression(config.getCompression())
            .build())
        .partition(MaterializePartitionConfig.of(BrewerySchema.PARTITION_COLUMNS))
        .columns(BrewerySchema.COLUMNS)
        .build();
  }
}
