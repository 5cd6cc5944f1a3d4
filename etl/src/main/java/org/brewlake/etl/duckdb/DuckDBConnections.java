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
package org.brewlake.etl.duckdb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Opens in-process DuckDB connections for Parquet work.
 *
 * <p>Each call returns a fresh in-memory database; callers close it when done.
 * Nothing is shared between connections, so temporary tables never leak across
 * operations.
 */
public final class DuckDBConnections {

  private static final Logger LOGGER = LoggerFactory.getLogger(DuckDBConnections.class);
  private static final String URL = "jdbc:duckdb:";

  private DuckDBConnections() {
  }

  /**
   * Opens an in-memory connection with the parquet extension loaded.
   */
  public static Connection open() throws SQLException {
    Connection conn = DriverManager.getConnection(URL);
    loadExtensions(conn);
    return conn;
  }

  /**
   * Loads the parquet extension. The JDBC driver ships it statically linked,
   * so a failure here is logged and ignored.
   */
  static void loadExtensions(Connection conn) {
    try (Statement stmt = conn.createStatement()) {
      stmt.execute("LOAD parquet");
    } catch (SQLException e) {
      LOGGER.debug("Extensions already loaded or built-in: {}", e.getMessage());
    }
  }

  /**
   * Quotes a string literal for SQL.
   */
  public static String quoteLiteral(String literal) {
    return "'" + literal.replace("'", "''") + "'";
  }

  /**
   * Builds a {@code read_parquet} table function over a glob with hive partitioning.
   */
  public static String readParquet(String pattern) {
    return "read_parquet(" + quoteLiteral(pattern)
        + ", hive_partitioning=true, union_by_name=true)";
  }
}
