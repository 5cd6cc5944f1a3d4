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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link ParquetTableValidator#validate}.
 *
 * <p>Holds every failed assertion, not just the first, plus the metrics that
 * were measured along the way (row count, null counts, sums).
 */
public class QualityReport {

  private final String table;
  private final List<String> failures;
  private final Map<String, Long> metrics;

  private QualityReport(String table, List<String> failures, Map<String, Long> metrics) {
    this.table = table;
    this.failures = Collections.unmodifiableList(new ArrayList<String>(failures));
    this.metrics = Collections.unmodifiableMap(new LinkedHashMap<String, Long>(metrics));
  }

  public static QualityReport of(String table, List<String> failures,
      Map<String, Long> metrics) {
    return new QualityReport(table, failures, metrics);
  }

  public String getTable() {
    return table;
  }

  public boolean isPassed() {
    return failures.isEmpty();
  }

  public List<String> getFailures() {
    return failures;
  }

  /**
   * Returns measured values keyed as {@code row_count}, {@code nulls.<column>}
   * and {@code sum.<column>}.
   */
  public Map<String, Long> getMetrics() {
    return metrics;
  }

  /**
   * Returns a metric, or -1 if it was not measured.
   */
  public long getMetric(String name) {
    Long value = metrics.get(name);
    return value != null ? value : -1;
  }

  @Override public String toString() {
    if (isPassed()) {
      return "QualityReport{" + table + ": PASSED, metrics=" + metrics + "}";
    }
    return "QualityReport{" + table + ": FAILED " + failures + ", metrics=" + metrics + "}";
  }
}
