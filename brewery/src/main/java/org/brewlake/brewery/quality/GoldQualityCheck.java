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

import org.brewlake.brewery.BreweryPipelineConfig;
import org.brewlake.brewery.DataQualityException;
import org.brewlake.brewery.PipelineStage;
import org.brewlake.brewery.StageResult;
import org.brewlake.brewery.gold.GoldAggregator;
import org.brewlake.etl.ParquetTableReader;
import org.brewlake.etl.ParquetTableValidator;
import org.brewlake.etl.QualityReport;
import org.brewlake.etl.TableExpectations;
import org.brewlake.storage.StorageProvider;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Quality gate over the gold file.
 *
 * <p>Asserts that the file exists, has rows, that {@code brewery_count} sums to
 * a positive total and that the grouping columns hold no nulls. When
 * reconciliation is enabled the total must also equal the silver row count.
 * Expectations from {@link BreweryPipelineConfig#getQualityExpectations()}
 * are checked as well. Every failed assertion is reported together in one
 * {@link DataQualityException}.
 */
public class GoldQualityCheck {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoldQualityCheck.class);

  private final BreweryPipelineConfig config;
  private final StorageProvider storageProvider;

  public GoldQualityCheck(BreweryPipelineConfig config, StorageProvider storageProvider) {
    this.config = config;
    this.storageProvider = storageProvider;
  }

  /**
   * Runs every assertion against the gold file.
   *
   * @return Result whose output row count is the total number of breweries
   * @throws DataQualityException If any assertion fails
   * @throws IOException If an existing file cannot be read
   */
  public StageResult check() throws IOException {
    long startTime = System.currentTimeMillis();
    String goldFile = config.getGoldFilePath();
    ParquetTableReader reader = new ParquetTableReader(storageProvider,
        config.getDataDirectory());

    List<String> reconciliationFailures = new ArrayList<String>();
    TableExpectations.Builder expectations = expectations(config.getQualityExpectations());
    if (config.isReconcileWithSilver()) {
      if (reader.hasParquetFiles(config.getSilverPath())) {
        long silverRows = reader.countRows(GoldAggregator.silverPattern(config));
        expectations.expectSum(GoldAggregator.BREWERY_COUNT, silverRows);
      } else {
        reconciliationFailures.add("Silver layer not found for reconciliation: "
            + config.getSilverPath());
      }
    }

    QualityReport report = new ParquetTableValidator(storageProvider, config.getDataDirectory())
        .validate(goldFile, expectations.build());
    if (!reconciliationFailures.isEmpty()) {
      List<String> failures = new ArrayList<String>(report.getFailures());
      failures.addAll(reconciliationFailures);
      report = QualityReport.of(report.getTable(), failures, report.getMetrics());
    }

    if (!report.isPassed()) {
      LOGGER.error("Quality check FAILED for {}: {}", goldFile, report.getFailures());
      throw new DataQualityException(report);
    }

    long groups = report.getMetric("row_count");
    long total = report.getMetric("sum." + GoldAggregator.BREWERY_COUNT);
    long countries = reader.queryLong(goldFile, "COUNT(DISTINCT country)");
    long states = reader.queryLong(goldFile, "COUNT(DISTINCT state)");
    LOGGER.info("Quality check PASSED: {} groups, {} breweries, {} countries, {} states",
        groups, total, countries, states);

    return StageResult.builder(PipelineStage.QUALITY)
        .outputPath(goldFile)
        .inputRows(groups)
        .outputRows(total)
        .elapsedMillis(System.currentTimeMillis() - startTime)
        .build();
  }

  /**
   * Merges the configured expectations with the built-in ones: at least one
   * row, no nulls in the grouping columns and a positive total.
   */
  static TableExpectations.Builder expectations(TableExpectations configured) {
    TableExpectations.Builder builder = TableExpectations.builder()
        .minRows(Math.max(1, configured.getMinRows()))
        .notNull(union(GoldAggregator.GROUP_BY, configured.getNotNullColumns()))
        .positiveSum(union(ImmutableList.of(GoldAggregator.BREWERY_COUNT),
            configured.getPositiveSumColumns()));
    for (TableExpectations.ExpectedSum sum : configured.getExpectedSums()) {
      builder.expectSum(sum.getColumn(), sum.getExpected());
    }
    return builder;
  }

  private static List<String> union(List<String> first, List<String> second) {
    return ImmutableSet.<String>builder().addAll(first).addAll(second).build().asList();
  }
}
