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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Where and how {@link HiveParquetWriter} writes its output.
 *
 * <ul>
 *   <li>location - Output directory, resolved against the writer's base directory</li>
 *   <li>fileName - Single output file inside {@code location}; when absent the
 *       output is a hive-partitioned directory tree</li>
 *   <li>compression - Parquet codec (snappy, zstd, gzip, uncompressed)</li>
 * </ul>
 */
public class MaterializeOutputConfig {
  private static final String DEFAULT_COMPRESSION = "snappy";

  private final String location;
  private final String fileName;
  private final String compression;

  private MaterializeOutputConfig(Builder builder) {
    this.location = builder.location;
    this.fileName = builder.fileName;
    this.compression = builder.compression != null ? builder.compression : DEFAULT_COMPRESSION;
  }

  public String getLocation() {
    return location;
  }

  /**
   * Returns the single-file name, or null for a partitioned directory.
   */
  public @Nullable String getFileName() {
    return fileName;
  }

  public boolean isSingleFile() {
    return fileName != null && !fileName.isEmpty();
  }

  /**
   * Returns the compression codec (default: "snappy").
   */
  public String getCompression() {
    return compression;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for MaterializeOutputConfig.
   */
  public static class Builder {
    private String location;
    private String fileName;
    private String compression;

    public Builder location(String location) {
      this.location = location;
      return this;
    }

    public Builder fileName(String fileName) {
      this.fileName = fileName;
      return this;
    }

    public Builder compression(String compression) {
      this.compression = compression;
      return this;
    }

    public MaterializeOutputConfig build() {
      if (location == null || location.isEmpty()) {
        throw new IllegalArgumentException("Output location is required");
      }
      return new MaterializeOutputConfig(this);
    }
  }
}
