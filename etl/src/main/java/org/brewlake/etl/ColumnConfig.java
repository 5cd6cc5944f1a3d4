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

/**
 * Typed column of a materialized table.
 *
 * <p>Columns drive the DDL of the staging table that rows are inserted into
 * before they are copied out to Parquet, so every written file carries an
 * explicit schema instead of one inferred from the first rows.
 *
 * <p>Supported types are those the writer knows how to bind:
 * VARCHAR, BIGINT, INTEGER, DOUBLE, BOOLEAN and TIMESTAMP.
 */
public class ColumnConfig {

  /**
   * SQL types understood by {@link HiveParquetWriter}.
   */
  public enum ColumnType {
    VARCHAR, BIGINT, INTEGER, DOUBLE, BOOLEAN, TIMESTAMP
  }

  private final String name;
  private final ColumnType type;
  private final boolean nullable;

  private ColumnConfig(Builder builder) {
    this.name = builder.name;
    this.type = builder.type != null ? builder.type : ColumnType.VARCHAR;
    this.nullable = builder.nullable != null ? builder.nullable : true;
  }

  /**
   * Returns the output column name; also the key looked up in each row map.
   */
  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  /**
   * Returns whether the column accepts nulls. Non-nullable columns are declared
   * {@code NOT NULL}, so a null value fails the insert.
   */
  public boolean isNullable() {
    return nullable;
  }

  /**
   * Builds the column definition used in CREATE TABLE.
   */
  public String buildColumnDefinition() {
    return quoteIdentifier(name) + " " + type.name() + (nullable ? "" : " NOT NULL");
  }

  static String quoteIdentifier(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  public static ColumnConfig of(String name, ColumnType type) {
    return builder().name(name).type(type).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return name + " " + type + (nullable ? "" : " NOT NULL");
  }

  /**
   * Builder for ColumnConfig.
   */
  public static class Builder {
    private String name;
    private ColumnType type;
    private Boolean nullable;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder type(ColumnType type) {
      this.type = type;
      return this;
    }

    public Builder nullable(boolean nullable) {
      this.nullable = nullable;
      return this;
    }

    public ColumnConfig build() {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Column name is required");
      }
      return new ColumnConfig(this);
    }
  }
}
