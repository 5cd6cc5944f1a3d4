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

import org.brewlake.etl.duckdb.DuckDBConnections;
import org.brewlake.storage.StorageProvider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads rows back from Parquet files written by {@link HiveParquetWriter}.
 *
 * <p>Patterns are globs resolved against the base directory, for example
 * {@code silver/**&#47;*.parquet} or {@code gold/breweries_aggregated.parquet}.
 * Hive partition directories are exposed as VARCHAR columns.
 * TIMESTAMP values are returned as {@link java.time.LocalDateTime}.
 */
public class ParquetTableReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParquetTableReader.class);

  private final StorageProvider storageProvider;
  private final String baseDirectory;

  public ParquetTableReader(StorageProvider storageProvider, String baseDirectory) {
    this.storageProvider = storageProvider;
    this.baseDirectory = baseDirectory;
  }

  /**
   * Reads every row matching the pattern.
   */
  public List<Map<String, Object>> readRows(String pattern) throws IOException {
    return readRows(pattern, Collections.<String, Object>emptyMap());
  }

  /**
   * Reads rows whose columns equal the given values; a null value matches SQL NULL.
   *
   * @param pattern Parquet glob
   * @param equalTo Column name to required value
   * @return Matching rows, keyed by column name in file order
   * @throws IOException If the files cannot be read
   */
  public List<Map<String, Object>> readRows(String pattern, Map<String, Object> equalTo)
      throws IOException {
    StringBuilder sql = new StringBuilder();
    sql.append("SELECT * FROM ").append(source(pattern));
    List<Object> parameters = appendWhere(sql, equalTo);

    List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();
    try (Connection conn = DuckDBConnections.open();
         PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
      for (int i = 0; i < parameters.size(); i++) {
        stmt.setObject(i + 1, parameters.get(i));
      }
      try (ResultSet rs = stmt.executeQuery()) {
        ResultSetMetaData meta = rs.getMetaData();
        while (rs.next()) {
          Map<String, Object> row = new LinkedHashMap<String, Object>();
          for (int i = 1; i <= meta.getColumnCount(); i++) {
            row.put(meta.getColumnName(i), toJavaValue(rs.getObject(i)));
          }
          rows.add(row);
        }
      }
    } catch (SQLException e) {
      throw new IOException("Failed to read " + pattern + ": " + e.getMessage(), e);
    }

    LOGGER.debug("Read {} rows from {}", rows.size(), pattern);
    return rows;
  }

  /**
   * Counts rows matching the pattern.
   */
  public long countRows(String pattern) throws IOException {
    return queryLong(pattern, "COUNT(*)");
  }

  /**
   * Evaluates a single scalar aggregate expression, such as {@code SUM(n)},
   * over the pattern. SQL NULL is returned as 0.
   */
  public long queryLong(String pattern, String aggregateExpression) throws IOException {
    String sql = "SELECT " + aggregateExpression + " FROM " + source(pattern);
    try (Connection conn = DuckDBConnections.open();
         PreparedStatement stmt = conn.prepareStatement(sql);
         ResultSet rs = stmt.executeQuery()) {
      rs.next();
      return rs.getLong(1);
    } catch (SQLException e) {
      throw new IOException("Failed to evaluate " + aggregateExpression + " over " + pattern
          + ": " + e.getMessage(), e);
    }
  }

  /**
   * Returns true if at least one Parquet file exists below {@code directory}.
   */
  public boolean hasParquetFiles(String directory) throws IOException {
    String fullPath = storageProvider.resolvePath(baseDirectory, directory);
    for (StorageProvider.FileEntry entry : storageProvider.listFiles(fullPath, true)) {
      if (!entry.isDirectory() && entry.getName().endsWith(".parquet")) {
        return true;
      }
    }
    return false;
  }

  String source(String pattern) {
    return DuckDBConnections.readParquet(storageProvider.resolvePath(baseDirectory, pattern));
  }

  private static List<Object> appendWhere(StringBuilder sql, Map<String, Object> equalTo) {
    List<Object> parameters = new ArrayList<Object>();
    if (equalTo == null || equalTo.isEmpty()) {
      return parameters;
    }
    String separator = " WHERE ";
    for (Map.Entry<String, Object> e : equalTo.entrySet()) {
      sql.append(separator).append(ColumnConfig.quoteIdentifier(e.getKey()));
      if (e.getValue() == null) {
        sql.append(" IS NULL");
      } else {
        sql.append(" = ?");
        parameters.add(e.getValue());
      }
      separator = " AND ";
    }
    return parameters;
  }

  private static Object toJavaValue(Object value) {
    if (value instanceof Timestamp) {
      return ((Timestamp) value).toLocalDateTime();
    }
    return value;
  }
}
