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

/**
 * Group-by count applied by {@link HiveParquetWriter#aggregateFromParquet}.
 *
 * <p>The count is {@code COUNT(*)}; rows with nulls in other columns still count.
 * When {@code orderBy} is empty the output is ordered by {@code groupBy}.
 */
public class AggregateConfig {

  private static final String DEFAULT_COUNT_COLUMN = "row_count";

  private final List<String> groupBy;
  private final String countColumn;
  private final List<String> orderBy;

  private AggregateConfig(List<String> groupBy, String countColumn, List<String> orderBy) {
    if (groupBy == null || groupBy.isEmpty()) {
      throw new IllegalArgumentException("At least one group-by column is required");
    }
    this.groupBy = Collections.unmodifiableList(new ArrayList<String>(groupBy));
    this.countColumn = countColumn != null && !countColumn.isEmpty()
        ? countColumn : DEFAULT_COUNT_COLUMN;
    this.orderBy = orderBy != null && !orderBy.isEmpty()
        ? Collections.unmodifiableList(new ArrayList<String>(orderBy))
        : this.groupBy;
  }

  public static AggregateConfig of(List<String> groupBy, String countColumn,
      List<String> orderBy) {
    return new AggregateConfig(groupBy, countColumn, orderBy);
  }

  public List<String> getGroupBy() {
    return groupBy;
  }

  public String getCountColumn() {
    return countColumn;
  }

  public List<String> getOrderBy() {
    return orderBy;
  }

  /**
   * Builds the SELECT that produces the aggregate from {@code fromClause}.
   */
  String buildSelect(String fromClause) {
    StringBuilder sql = new StringBuilder();
    sql.append("SELECT ");
    for (String column : groupBy) {
      sql.append(ColumnConfig.quoteIdentifier(column)).append(", ");
    }
    sql.append("COUNT(*) AS ").append(ColumnConfig.quoteIdentifier(countColumn));
    sql.append("\n  FROM ").append(fromClause);
    sql.append("\n  GROUP BY ").append(joinQuoted(groupBy));
    sql.append("\n  ORDER BY ").append(joinQuoted(orderBy));
    return sql.toString();
  }

  private static String joinQuoted(List<String> columns) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(ColumnConfig.quoteIdentifier(columns.get(i)));
    }
    return sb.toString();
  }

  @Override public String toString() {
    return "AggregateConfig{groupBy=" + groupBy + ", count=" + countColumn
        + ", orderBy=" + orderBy + "}";
  }
}
