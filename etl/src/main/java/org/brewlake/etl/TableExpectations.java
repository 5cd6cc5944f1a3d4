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
import java.util.List;
import java.util.Map;

/**
 * Table-level assertions checked by {@link ParquetTableValidator}.
 *
 * <h3>YAML Configuration</h3>
 * <pre>{@code
 * expectations:
 *   minRows: 1
 *   notNull: [brewery_type, country, state]
 *   positiveSum: [brewery_count]
 * }</pre>
 *
 * <p>Expected sums are usually only known at run time and are added with
 * {@link Builder#expectSum(String, long)}.
 */
public class TableExpectations {

  private final long minRows;
  private final List<String> notNullColumns;
  private final List<String> positiveSumColumns;
  private final List<ExpectedSum> expectedSums;

  private TableExpectations(Builder builder) {
    this.minRows = builder.minRows;
    this.notNullColumns = Collections.unmodifiableList(
        new ArrayList<String>(builder.notNullColumns));
    this.positiveSumColumns = Collections.unmodifiableList(
        new ArrayList<String>(builder.positiveSumColumns));
    this.expectedSums = Collections.unmodifiableList(
        new ArrayList<ExpectedSum>(builder.expectedSums));
  }

  /**
   * Returns the minimum number of rows; 0 disables the check.
   */
  public long getMinRows() {
    return minRows;
  }

  public List<String> getNotNullColumns() {
    return notNullColumns;
  }

  public List<String> getPositiveSumColumns() {
    return positiveSumColumns;
  }

  public List<ExpectedSum> getExpectedSums() {
    return expectedSums;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder pre-populated with these expectations.
   */
  public Builder toBuilder() {
    Builder builder = builder()
        .minRows(minRows)
        .notNull(notNullColumns)
        .positiveSum(positiveSumColumns);
    for (ExpectedSum sum : expectedSums) {
      builder.expectSum(sum.getColumn(), sum.getExpected());
    }
    return builder;
  }

  /**
   * Creates TableExpectations from a YAML/JSON map.
   *
   * @param map Configuration map with keys: minRows, notNull, positiveSum
   * @return TableExpectations instance
   */
  public static TableExpectations fromMap(Map<String, Object> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }

    Object minRowsObj = map.get("minRows");
    if (minRowsObj instanceof Number) {
      builder.minRows(((Number) minRowsObj).longValue());
    }
    builder.notNull(toStringList(map.get("notNull")));
    builder.positiveSum(toStringList(map.get("positiveSum")));
    return builder.build();
  }

  private static List<String> toStringList(Object value) {
    List<String> result = new ArrayList<String>();
    if (value instanceof List) {
      for (Object item : (List<?>) value) {
        if (item != null) {
          result.add(item.toString());
        }
      }
    }
    return result;
  }

  /**
   * A column whose sum must equal a known total.
   */
  public static class ExpectedSum {
    private final String column;
    private final long expected;

    ExpectedSum(String column, long expected) {
      this.column = column;
      this.expected = expected;
    }

    public String getColumn() {
      return column;
    }

    public long getExpected() {
      return expected;
    }
  }

  /**
   * Builder for TableExpectations.
   */
  public static class Builder {
    private long minRows;
    private final List<String> notNullColumns = new ArrayList<String>();
    private final List<String> positiveSumColumns = new ArrayList<String>();
    private final List<ExpectedSum> expectedSums = new ArrayList<ExpectedSum>();

    public Builder minRows(long minRows) {
      this.minRows = minRows;
      return this;
    }

    public Builder notNull(List<String> columns) {
      this.notNullColumns.addAll(columns);
      return this;
    }

    public Builder positiveSum(List<String> columns) {
      this.positiveSumColumns.addAll(columns);
      return this;
    }

    public Builder expectSum(String column, long expected) {
      this.expectedSums.add(new ExpectedSum(column, expected));
      return this;
    }

    public TableExpectations build() {
      if (minRows < 0) {
        throw new IllegalArgumentException("minRows must not be negative: " + minRows);
      }
      return new TableExpectations(this);
    }
  }
}
