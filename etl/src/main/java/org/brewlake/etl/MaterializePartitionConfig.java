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
 * Partition columns for DuckDB {@code PARTITION_BY}.
 *
 * <p>Each column becomes one level of {@code column=value} directories, in the
 * order given. Partition columns are not stored inside the data files; readers
 * recover them from the path with {@code hive_partitioning=true}.
 */
public class MaterializePartitionConfig {

  private final List<String> columns;

  private MaterializePartitionConfig(List<String> columns) {
    this.columns = columns != null
        ? Collections.unmodifiableList(new ArrayList<String>(columns))
        : Collections.<String>emptyList();
  }

  public static MaterializePartitionConfig of(List<String> columns) {
    return new MaterializePartitionConfig(columns);
  }

  public static MaterializePartitionConfig none() {
    return new MaterializePartitionConfig(null);
  }

  public List<String> getColumns() {
    return columns;
  }

  public boolean isPartitioned() {
    return !columns.isEmpty();
  }

  @Override public String toString() {
    return "MaterializePartitionConfig{columns=" + columns + "}";
  }
}
