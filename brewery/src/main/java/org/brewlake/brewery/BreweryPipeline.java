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

import org.brewlake.brewery.bronze.BronzeIngestor;
import org.brewlake.brewery.gold.GoldAggregator;
import org.brewlake.brewery.quality.GoldQualityCheck;
import org.brewlake.brewery.silver.SilverTransformer;
import org.brewlake.etl.HttpSource;
import org.brewlake.storage.LocalFileStorageProvider;
import org.brewlake.storage.StorageProvider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the brewery medallion stages: ingest, transform, aggregate and the
 * quality check.
 *
 * <p>Each stage reads only what the previous stage published, so stages can
 * be invoked one at a time by an external scheduler, or all together with
 * {@link #runAll()}.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * BreweryPipeline pipeline = new BreweryPipeline(BreweryPipelineConfig.loadDefault());
 * List<StageResult> results = pipeline.runAll();
 * }</pre>
 */
public class BreweryPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(BreweryPipeline.class);

  private final BreweryPipelineConfig config;
  private final StorageProvider storageProvider;
  private final Clock clock;

  /**
   * Creates a pipeline on the local filesystem using the system clock.
   */
  public BreweryPipeline(BreweryPipelineConfig config) {
    this(config, new LocalFileStorageProvider(), Clock.systemDefaultZone());
  }

  public BreweryPipeline(BreweryPipelineConfig config, StorageProvider storageProvider,
      Clock clock) {
    this.config = config;
    this.storageProvider = storageProvider;
    this.clock = clock;
  }

  public BreweryPipelineConfig getConfig() {
    return config;
  }

  /**
   * Fetches all breweries into a new bronze snapshot.
   */
  public StageResult ingest() throws IOException {
    try (HttpSource source = new HttpSource(config.getSource())) {
      return new BronzeIngestor(config, storageProvider, source, clock).ingest();
    }
  }

  /**
   * Rebuilds the silver layer from the newest bronze snapshot.
   */
  public StageResult transform() throws IOException {
    return new SilverTransformer(config, storageProvider).transform();
  }

  /**
   * Rebuilds the silver layer from a specific bronze file.
   */
  public StageResult transform(String bronzeFile) throws IOException {
    return new SilverTransformer(config, storageProvider).transform(bronzeFile);
  }

  /**
   * Recomputes the gold aggregate from the silver layer.
   */
  public StageResult aggregate() throws IOException {
    return new GoldAggregator(config, storageProvider).aggregate();
  }

  /**
   * Checks the gold layer.
   *
   * @throws DataQualityException If any assertion fails
   */
  public StageResult checkQuality() throws IOException {
    return new GoldQualityCheck(config, storageProvider).check();
  }

  /**
   * Runs a single stage.
   */
  public StageResult run(PipelineStage stage) throws IOException {
    LOGGER.info("Running stage {}", stage.getCommand());
    StageResult result;
    switch (stage) {
      case INGEST:
        result = ingest();
        break;
      case TRANSFORM:
        result = transform();
        break;
      case AGGREGATE:
        result = aggregate();
        break;
      case QUALITY:
        result = checkQuality();
        break;
      default:
        throw new IllegalStateException("Unsupported stage: " + stage);
    }
    LOGGER.info("Stage {} finished: {}", stage.getCommand(), result);
    return result;
  }

  /**
   * Runs every stage in order, stopping at the first failure.
   *
   * @return One result per stage, in execution order
   */
  public List<StageResult> runAll() throws IOException {
    long startTime = System.currentTimeMillis();
    List<StageResult> results = new ArrayList<StageResult>();
    for (PipelineStage stage : PipelineStage.values()) {
      results.add(run(stage));
    }
    LOGGER.info("Pipeline completed in {}ms", System.currentTimeMillis() - startTime);
    return results;
  }
}
