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
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.text.SimpleDateFormat;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes rows to hive-partitioned Parquet files using DuckDB.
 *
 * <p>HiveParquetWriter handles:
 * <ul>
 *   <li>Loading rows into a typed temporary table (explicit schema, batched inserts)</li>
 *   <li>DuckDB {@code COPY ... PARTITION_BY} into {@code column=value/} directories</li>
 *   <li>Group-by count aggregation of an existing Parquet tree into a single file</li>
 *   <li>Staged publication: output is written next to its target and moved into
 *       place only after DuckDB has finished, so readers never see partial output</li>
 * </ul>
 *
 * <h3>Output Structure</h3>
 * <pre>
 * silver/
 *   country=United States/
 *     state=Oregon/
 *       data_0.parquet
 *     state=California/
 *       data_0.parquet
 * </pre>
 *
 * <p>A partitioned output directory is replaced as a whole on every write.
 *
 * @see MaterializeConfig
 * @see AggregateConfig
 */
public class HiveParquetWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(HiveParquetWriter.class);

  private static final int BATCH_SIZE = 1000;
  private static final String STAGING_TABLE = "staging_rows";

  private final StorageProvider storageProvider;
  private final String baseDirectory;

  /**
   * Creates a new HiveParquetWriter.
   *
   * @param storageProvider Storage provider for file operations
   * @param baseDirectory Base directory that output locations are resolved against
   */
  public HiveParquetWriter(StorageProvider storageProvider, String baseDirectory) {
    this.storageProvider = storageProvider;
    this.baseDirectory = baseDirectory;
  }

  /**
   * Writes rows to Parquet as described by {@code config}.
   *
   * <p>Only the declared columns are written; other keys in the row maps are
   * ignored and missing keys are written as null.
   *
   * @param config Materialization configuration, with at least one column
   * @param rows Rows to write
   * @return Materialization result with statistics
   * @throws IOException If DuckDB or the storage provider fails
   */
  public MaterializeResult write(MaterializeConfig config, Iterator<Map<String, Object>> rows)
      throws IOException {
    List<ColumnConfig> columns = config.getColumns();
    if (columns.isEmpty()) {
      throw new IllegalArgumentException("No columns configured for " + displayName(config));
    }

    String displayName = displayName(config);
    long startTime = System.currentTimeMillis();
    MaterializeOutputConfig output = config.getOutput();
    String outputDir = trimTrailingSlash(
        storageProvider.resolvePath(baseDirectory, output.getLocation()));
    String target = output.isSingleFile()
        ? storageProvider.resolvePath(outputDir, output.getFileName())
        : outputDir;
    String staging = stagingPath(target);

    LOGGER.info("Materializing {} to {}", displayName, target);

    long rowCount;
    try (Connection conn = DuckDBConnections.open()) {
      createStagingTable(conn, columns);
      rowCount = insertRows(conn, columns, rows);

      if (output.isSingleFile()) {
        storageProvider.createDirectories(outputDir);
      } else {
        storageProvider.createDirectories(staging);
      }
      String copyTarget = output.isSingleFile() || config.getPartition().isPartitioned()
          ? staging
          : staging + "/data_0.parquet";
      String select = "SELECT " + buildSelectList(columns) + " FROM " + STAGING_TABLE;
      String sql = buildCopySql(select, copyTarget, config.getPartition(),
          output.getCompression());
      LOGGER.debug("Materialization SQL:\n{}", sql);

      try (Statement stmt = conn.createStatement()) {
        stmt.execute(sql);
      }
    } catch (SQLException e) {
      discardStaging(staging);
      String errorMsg = String.format("DuckDB materialization failed for '%s': %s",
          displayName, e.getMessage());
      LOGGER.error(errorMsg, e);
      throw new IOException(errorMsg, e);
    } catch (RuntimeException | IOException e) {
      discardStaging(staging);
      throw e;
    }

    int fileCount;
    int partitionCount;
    if (output.isSingleFile()) {
      fileCount = 1;
      partitionCount = 0;
    } else {
      Set<String> partitionDirs = new HashSet<String>();
      fileCount = 0;
      for (StorageProvider.FileEntry entry : storageProvider.listFiles(staging, true)) {
        if (!entry.isDirectory() && entry.getName().endsWith(".parquet")) {
          fileCount++;
          String path = entry.getPath();
          partitionDirs.add(path.substring(0, path.length() - entry.getName().length()));
        }
      }
      partitionCount = config.getPartition().isPartitioned() ? partitionDirs.size() : 0;
    }

    publish(staging, target);

    long elapsed = System.currentTimeMillis() - startTime;
    LOGGER.info("Materialization of {} complete: {} rows, {} files, {} partitions in {}ms",
        displayName, rowCount, fileCount, partitionCount, elapsed);
    return MaterializeResult.of(target, rowCount, fileCount, partitionCount, elapsed);
  }

  /**
   * Aggregates an existing Parquet tree with a group-by count and writes the
   * result as a single Parquet file.
   *
   * @param config Output configuration; {@code output.fileName} is required
   * @param sourcePattern Source Parquet glob, resolved against the base directory
   * @param aggregate Group-by columns, count column name and ordering
   * @return Result whose row count is the number of groups written
   * @throws IOException If DuckDB or the storage provider fails
   */
  public MaterializeResult aggregateFromParquet(MaterializeConfig config, String sourcePattern,
      AggregateConfig aggregate) throws IOException {
    MaterializeOutputConfig output = config.getOutput();
    if (!output.isSingleFile()) {
      throw new IllegalArgumentException("Aggregation output requires a file name");
    }

    String displayName = displayName(config);
    long startTime = System.currentTimeMillis();
    String fullSourcePattern = storageProvider.resolvePath(baseDirectory, sourcePattern);
    String outputDir = trimTrailingSlash(
        storageProvider.resolvePath(baseDirectory, output.getLocation()));
    String target = storageProvider.resolvePath(outputDir, output.getFileName());
    String staging = stagingPath(target);

    LOGGER.info("Aggregating {} into {} ({})", fullSourcePattern, target, aggregate);

    long groupCount;
    try (Connection conn = DuckDBConnections.open()) {
      storageProvider.createDirectories(outputDir);
      String select = aggregate.buildSelect(DuckDBConnections.readParquet(fullSourcePattern));
      String sql = buildCopySql(select, staging, MaterializePartitionConfig.none(),
          output.getCompression());
      LOGGER.debug("Aggregation SQL:\n{}", sql);

      try (Statement stmt = conn.createStatement()) {
        stmt.execute(sql);
        try (ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM read_parquet("
            + DuckDBConnections.quoteLiteral(staging) + ")")) {
          rs.next();
          groupCount = rs.getLong(1);
        }
      }
    } catch (SQLException e) {
      discardStaging(staging);
      String errorMsg = String.format("DuckDB aggregation failed for '%s': %s",
          displayName, e.getMessage());
      LOGGER.error(errorMsg, e);
      throw new IOException(errorMsg, e);
    } catch (RuntimeException | IOException e) {
      discardStaging(staging);
      throw e;
    }

    publish(staging, target);

    long elapsed = System.currentTimeMillis() - startTime;
    LOGGER.info("Aggregation of {} complete: {} groups in {}ms", displayName, groupCount,
        elapsed);
    return MaterializeResult.of(target, groupCount, 1, 0, elapsed);
  }

  /**
   * Creates the typed temporary table that rows are loaded into.
   */
  private void createStagingTable(Connection conn, List<ColumnConfig> columns)
      throws SQLException {
    StringBuilder ddl = new StringBuilder();
    ddl.append("CREATE TEMPORARY TABLE ").append(STAGING_TABLE).append(" (");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        ddl.append(", ");
      }
      ddl.append(columns.get(i).buildColumnDefinition());
    }
    ddl.append(")");
    LOGGER.debug("Staging table DDL: {}", ddl);

    try (Statement stmt = conn.createStatement()) {
      stmt.execute(ddl.toString());
    }
  }

  /**
   * Inserts rows in batches of {@value #BATCH_SIZE}.
   */
  private long insertRows(Connection conn, List<ColumnConfig> columns,
      Iterator<Map<String, Object>> rows) throws SQLException {
    StringBuilder sql = new StringBuilder();
    sql.append("INSERT INTO ").append(STAGING_TABLE).append(" VALUES (");
    for (int i = 0; i < columns.size(); i++) {
      sql.append(i > 0 ? ", ?" : "?");
    }
    sql.append(")");

    long rowCount = 0;
    try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
      int batchCount = 0;
      while (rows.hasNext()) {
        Map<String, Object> row = rows.next();
        for (int i = 0; i < columns.size(); i++) {
          ColumnConfig column = columns.get(i);
          bindValue(stmt, i + 1, column, row.get(column.getName()));
        }
        stmt.addBatch();
        rowCount++;
        batchCount++;

        if (batchCount >= BATCH_SIZE) {
          stmt.executeBatch();
          batchCount = 0;
        }
      }
      if (batchCount > 0) {
        stmt.executeBatch();
      }
    }

    LOGGER.debug("Loaded {} rows into staging table", rowCount);
    return rowCount;
  }

  /**
   * Binds one value using the column's declared type.
   */
  static void bindValue(PreparedStatement stmt, int index, ColumnConfig column, Object value)
      throws SQLException {
    if (value == null) {
      stmt.setNull(index, sqlType(column.getType()));
      return;
    }

    try {
      switch (column.getType()) {
        case BIGINT:
          stmt.setLong(index, value instanceof Number
              ? ((Number) value).longValue() : Long.parseLong(value.toString().trim()));
          break;
        case INTEGER:
          stmt.setInt(index, value instanceof Number
              ? ((Number) value).intValue() : Integer.parseInt(value.toString().trim()));
          break;
        case DOUBLE:
          stmt.setDouble(index, value instanceof Number
              ? ((Number) value).doubleValue() : Double.parseDouble(value.toString().trim()));
          break;
        case BOOLEAN:
          stmt.setBoolean(index, value instanceof Boolean
              ? (Boolean) value : Boolean.parseBoolean(value.toString().trim()));
          break;
        case TIMESTAMP:
          stmt.setTimestamp(index, toTimestamp(value));
          break;
        default:
          stmt.setString(index, value.toString());
          break;
      }
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Value '" + value + "' of column "
          + column.getName() + " is not a valid " + column.getType(), e);
    }
  }

  private static Timestamp toTimestamp(Object value) {
    if (value instanceof Timestamp) {
      return (Timestamp) value;
    }
    if (value instanceof LocalDateTime) {
      return Timestamp.valueOf((LocalDateTime) value);
    }
    if (value instanceof Instant) {
      return Timestamp.from((Instant) value);
    }
    if (value instanceof OffsetDateTime) {
      return Timestamp.from(((OffsetDateTime) value).toInstant());
    }
    if (value instanceof Date) {
      return new Timestamp(((Date) value).getTime());
    }
    return Timestamp.valueOf(LocalDateTime.parse(value.toString().trim()));
  }

  private static int sqlType(ColumnConfig.ColumnType type) {
    switch (type) {
      case BIGINT:
        return Types.BIGINT;
      case INTEGER:
        return Types.INTEGER;
      case DOUBLE:
        return Types.DOUBLE;
      case BOOLEAN:
        return Types.BOOLEAN;
      case TIMESTAMP:
        return Types.TIMESTAMP;
      default:
        return Types.VARCHAR;
    }
  }

  private static String buildSelectList(List<ColumnConfig> columns) {
    StringBuilder clause = new StringBuilder();
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        clause.append(", ");
      }
      clause.append(ColumnConfig.quoteIdentifier(columns.get(i).getName()));
    }
    return clause.toString();
  }

  /**
   * Builds DuckDB COPY SQL with FORMAT, PARTITION_BY, and COMPRESSION options.
   */
  static String buildCopySql(String select, String outputPath,
      MaterializePartitionConfig partition, String compression) {
    StringBuilder sql = new StringBuilder();
    sql.append("COPY (\n  ").append(select).append("\n) TO ");
    sql.append(DuckDBConnections.quoteLiteral(outputPath));
    sql.append(" (FORMAT PARQUET");

    if (partition != null && partition.isPartitioned()) {
      sql.append(", PARTITION_BY (");
      List<String> partitionCols = partition.getColumns();
      for (int i = 0; i < partitionCols.size(); i++) {
        if (i > 0) {
          sql.append(", ");
        }
        sql.append(ColumnConfig.quoteIdentifier(partitionCols.get(i)));
      }
      sql.append("), OVERWRITE_OR_IGNORE");
    }

    if (compression != null && !compression.isEmpty() && !"none".equalsIgnoreCase(compression)) {
      sql.append(", COMPRESSION ").append(compression.toUpperCase());
    }
    sql.append(")");
    return sql.toString();
  }

  private void publish(String staging, String target) throws IOException {
    storageProvider.move(staging, target);
    LOGGER.debug("Published {} -> {}", staging, target);
  }

  private void discardStaging(String staging) {
    try {
      storageProvider.delete(staging);
    } catch (IOException e) {
      LOGGER.warn("Could not remove staging output {}: {}", staging, e.getMessage());
    }
  }

  /**
   * Returns a sibling of {@code target} that is unique to this run.
   */
  private static String stagingPath(String target) {
    String timestamp = new SimpleDateFormat("yyyyMMdd_HHmmss_SSS").format(new Date());
    int slash = target.lastIndexOf('/');
    String parent = slash >= 0 ? target.substring(0, slash + 1) : "";
    String name = slash >= 0 ? target.substring(slash + 1) : target;
    return parent + "._staging_" + timestamp + "_" + name;
  }

  private static String trimTrailingSlash(String path) {
    String result = path;
    while (result.length() > 1 && result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  private static String displayName(MaterializeConfig config) {
    return config.getName() != null ? config.getName() : config.getOutput().getLocation();
  }
}
