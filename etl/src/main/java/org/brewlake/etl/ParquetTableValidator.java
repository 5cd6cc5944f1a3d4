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
package org.brewlake.etl;

import org.brewlake.storage.StorageProvider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks {@link TableExpectations} against a Parquet file or tree.
 *
 * <p>All assertions are evaluated and collected into a {@link QualityReport};
 * deciding whether a failed report aborts the run is left to the caller.
 * A missing table is reported as a failure rather than thrown.
 */
public class ParquetTableValidator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParquetTableValidator.class);

  private final StorageProvider storageProvider;
  private final String baseDirectory;
  private final ParquetTableReader reader;

  public ParquetTableValidator(StorageProvider storageProvider, String baseDirectory) {
    this.storageProvider = storageProvider;
    this.baseDirectory = baseDirectory;
    this.reader = new ParquetTableReader(storageProvider, baseDirectory);
  }

  /**
   * Validates the Parquet data at {@code path} (a file or a glob).
   *
   * @param path Parquet file or glob, resolved against the base directory
   * @param expectations Assertions to check
   * @return Report listing failed assertions and measured metrics
   * @throws IOException If the data exists but cannot be read
   */
  public QualityReport validate(String path, TableExpectations expectations)
      throws IOException {
    List<String> failures = new ArrayList<String>();
    Map<String, Long> metrics = new LinkedHashMap<String, Long>();

    boolean isGlob = path.contains("*");
    if (!isGlob && !storageProvider.exists(storageProvider.resolvePath(baseDirectory, path))) {
      failures.add("Table not found: " + path);
      return report(path, failures, metrics);
    }

    long rowCount = reader.countRows(path);
    metrics.put("row_count", rowCount);
    if (expectations.getMinRows() > 0 && rowCount < expectations.getMinRows()) {
      failures.add(rowCount == 0
          ? "Table is empty"
          : "Expected at least " + expectations.getMinRows() + " rows but found " + rowCount);
    }

    for (String column : expectations.getNotNullColumns()) {
      long nulls = reader.queryLong(path,
          "COUNT(*) FILTER (WHERE " + ColumnConfig.quoteIdentifier(column) + " IS NULL)");
      metrics.put("nulls." + column, nulls);
      if (nulls > 0) {
        failures.add("Column " + column + " has " + nulls + " null value(s)");
      }
    }

    for (String column : expectations.getPositiveSumColumns()) {
      long sum = sum(path, column, metrics);
      if (sum <= 0) {
        failures.add("Sum of " + column + " is " + sum + ", expected > 0");
      }
    }

    for (TableExpectations.ExpectedSum expected : expectations.getExpectedSums()) {
      long sum = sum(path, expected.getColumn(), metrics);
      if (sum != expected.getExpected()) {
        failures.add("Sum of " + expected.getColumn() + " is " + sum + ", expected "
            + expected.getExpected());
      }
    }

    return report(path, failures, metrics);
  }

  private long sum(String path, String column, Map<String, Long> metrics) throws IOException {
    String key = "sum." + column;
    Long cached = metrics.get(key);
    if (cached != null) {
      return cached;
    }
    long sum = reader.queryLong(path,
        "COALESCE(SUM(" + ColumnConfig.quoteIdentifier(column) + "), 0)");
    metrics.put(key, sum);
    return sum;
  }

  private static QualityReport report(String path, List<String> failures,
      Map<String, Long> metrics) {
    QualityReport report = QualityReport.of(path, failures, metrics);
    if (report.isPassed()) {
      LOGGER.debug("Quality checks passed for {}: {}", path, metrics);
    } else {
      LOGGER.warn("Quality checks failed for {}: {}", path, failures);
    }
    return report;
  }
}
