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
 * Result of a materialization operation.
 *
 * <p>Contains statistics about the materialization:
 * <ul>
 *   <li>outputPath - Directory or file that was published</li>
 *   <li>rowCount - Number of rows written</li>
 *   <li>fileCount - Number of Parquet files published</li>
 *   <li>partitionCount - Number of leaf partitions (0 when unpartitioned)</li>
 *   <li>elapsedMillis - Time taken for materialization</li>
 * </ul>
 *
 * <p>Failures are not represented here; the writer throws instead, leaving
 * any previously published output untouched.
 */
public class MaterializeResult {

  private final String outputPath;
  private final long rowCount;
  private final int fileCount;
  private final int partitionCount;
  private final long elapsedMillis;

  private MaterializeResult(String outputPath, long rowCount, int fileCount,
      int partitionCount, long elapsedMillis) {
    this.outputPath = outputPath;
    this.rowCount = rowCount;
    this.fileCount = fileCount;
    this.partitionCount = partitionCount;
    this.elapsedMillis = elapsedMillis;
  }

  public static MaterializeResult of(String outputPath, long rowCount, int fileCount,
      int partitionCount, long elapsedMillis) {
    return new MaterializeResult(outputPath, rowCount, fileCount, partitionCount,
        elapsedMillis);
  }

  public String getOutputPath() {
    return outputPath;
  }

  public long getRowCount() {
    return rowCount;
  }

  public int getFileCount() {
    return fileCount;
  }

  public int getPartitionCount() {
    return partitionCount;
  }

  public long getElapsedMillis() {
    return elapsedMillis;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("MaterializeResult{path='").append(outputPath).append("'");
    sb.append(", rows=").append(rowCount);
    sb.append(", files=").append(fileCount);
    if (partitionCount > 0) {
      sb.append(", partitions=").append(partitionCount);
    }
    if (elapsedMillis > 0) {
      sb.append(", elapsed=").append(elapsedMillis).append("ms");
    }
    sb.append("}");
    return sb.toString();
  }
}
