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
package org.brewlake.brewery.bronze;

import org.brewlake.brewery.BreweryException;
import org.brewlake.brewery.BreweryPipelineConfig;
import org.brewlake.brewery.PipelineStage;
import org.brewlake.brewery.StageResult;
import org.brewlake.etl.DataSource;
import org.brewlake.storage.StorageProvider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Bronze stage: fetches every record from the API and stores them verbatim.
 *
 * <p>One run produces one immutable snapshot file. The file is written under a
 * temporary name and then moved into place, and an existing snapshot with the
 * same name is never replaced. Fetch failures propagate without a retry; the
 * scheduler that runs the stage owns the retry policy.
 */
public class BronzeIngestor {

  private static final Logger LOGGER = LoggerFactory.getLogger(BronzeIngestor.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT);

  private final BreweryPipelineConfig config;
  private final StorageProvider storageProvider;
  private final DataSource source;
  private final Clock clock;

  public BronzeIngestor(BreweryPipelineConfig config, StorageProvider storageProvider,
      DataSource source, Clock clock) {
    this.config = config;
    this.storageProvider = storageProvider;
    this.source = source;
    this.clock = clock;
  }

  /**
   * Fetches all records and writes them as a new bronze snapshot.
   *
   * @return Result whose output path is the snapshot file
   * @throws IOException If the fetch or the write fails
   * @throws BreweryException If the API returned no records or the snapshot exists
   */
  public StageResult ingest() throws IOException {
    long startTime = System.currentTimeMillis();
    LocalDateTime ingestedAt = LocalDateTime.now(clock);
    String bronzeDir = config.getBronzePath();
    String target = storageProvider.resolvePath(bronzeDir,
        BronzeSnapshots.fileNameFor(ingestedAt));

    LOGGER.info("Fetching breweries from {}", config.getSource().getUrl());
    List<Map<String, Object>> records = new ArrayList<Map<String, Object>>();
    Iterator<Map<String, Object>> rows = source.fetch(Collections.<String, String>emptyMap());
    while (rows.hasNext()) {
      records.add(rows.next());
    }

    if (records.isEmpty()) {
      throw new BreweryException("API returned no records from " + config.getSource().getUrl());
    }
    if (storageProvider.exists(target)) {
      throw new BreweryException("Bronze snapshot already exists: " + target);
    }

    byte[] content = OBJECT_MAPPER.writeValueAsBytes(records);
    String temp = storageProvider.resolvePath(bronzeDir,
        "." + BronzeSnapshots.fileNameFor(ingestedAt) + ".tmp");
    storageProvider.writeFile(temp, content);
    try {
      storageProvider.move(temp, target);
    } catch (IOException e) {
      storageProvider.delete(temp);
      throw e;
    }

    long elapsed = System.currentTimeMillis() - startTime;
    LOGGER.info("Saved {} breweries to {} ({} bytes)", records.size(), target, content.length);
    return StageResult.builder(PipelineStage.INGEST)
        .outputPath(target)
        .inputRows(records.size())
        .outputRows(records.size())
        .elapsedMillis(elapsed)
        .build();
  }
}
