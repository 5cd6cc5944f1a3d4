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
 * Configuration for writing rows to Parquet with {@link HiveParquetWriter}.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * MaterializeConfig config = MaterializeConfig.builder()
 *     .name("breweries")
 *     .output(MaterializeOutputConfig.builder().location("silver").build())
 *     .partition(MaterializePartitionConfig.of(Arrays.asList("country", "state")))
 *     .columns(columns)
 *     .build();
 * }</pre>
 *
 * <p>Every partition column must also be declared in {@code columns}.
 *
 * @see MaterializeOutputConfig
 * @see MaterializePartitionConfig
 * @see ColumnConfig
 */
public class MaterializeConfig {

  private final String name;
  private final MaterializeOutputConfig output;
  private final MaterializePartitionConfig partition;
  private final List<ColumnConfig> columns;

  private MaterializeConfig(Builder builder) {
    this.name = builder.name;
    this.output = builder.output;
    this.partition = builder.partition != null
        ? builder.partition : MaterializePartitionConfig.none();
    this.columns = builder.columns != null
        ? Collections.unmodifiableList(new ArrayList<ColumnConfig>(builder.columns))
        : Collections.<ColumnConfig>emptyList();
  }

  /**
   * Returns the display name used in logs.
   */
  public String getName() {
    return name;
  }

  public MaterializeOutputConfig getOutput() {
    return output;
  }

  public MaterializePartitionConfig getPartition() {
    return partition;
  }

  public List<ColumnConfig> getColumns() {
    return columns;
  }

  /**
   * Returns the column with the given name, or null.
   */
  public ColumnConfig getColumn(String columnName) {
    for (ColumnConfig column : columns) {
      if (column.getName().equals(columnName)) {
        return column;
      }
    }
    return null;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return "MaterializeConfig{name='" + name + "', location='" + output.getLocation()
        + "', partition=" + partition.getColumns() + ", columns=" + columns.size() + "}";
  }

  /**
   * Builder for MaterializeConfig.
   */
  public static class Builder {
    private String name;
    private MaterializeOutputConfig output;
    private MaterializePartitionConfig partition;
    private List<ColumnConfig> columns;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder output(MaterializeOutputConfig output) {
      this.output = output;
      return this;
    }

    public Builder partition(MaterializePartitionConfig partition) {
      this.partition = partition;
      return this;
    }

    public Builder columns(List<ColumnConfig> columns) {
      this.columns = columns;
      return this;
    }

    public MaterializeConfig build() {
      if (output == null) {
        throw new IllegalArgumentException("Output configuration is required");
      }
      if (partition != null && !partition.getColumns().isEmpty() && columns != null
          && !columns.isEmpty()) {
        for (String partitionColumn : partition.getColumns()) {
          boolean declared = false;
          for (ColumnConfig column : columns) {
            if (column.getName().equals(partitionColumn)) {
              declared = true;
              break;
            }
          }
          if (!declared) {
            throw new IllegalArgumentException("Partition column '" + partitionColumn
                + "' is not declared in columns");
          }
        }
      }
      return new MaterializeConfig(this);
    }
  }
}
