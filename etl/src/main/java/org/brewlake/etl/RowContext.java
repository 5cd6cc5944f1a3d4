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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Context passed to {@link RowTransformer} and {@link Validator} hooks.
 */
public class RowContext {

  private final String sourceName;
  private final Map<String, Object> attributes;
  private final long rowNumber;

  private RowContext(Builder builder) {
    this.sourceName = builder.sourceName;
    this.attributes = builder.attributes != null
        ? Collections.unmodifiableMap(new LinkedHashMap<String, Object>(builder.attributes))
        : Collections.<String, Object>emptyMap();
    this.rowNumber = builder.rowNumber;
  }

  /**
   * Returns the name of the input the row came from (a file name, for instance).
   */
  public @Nullable String getSourceName() {
    return sourceName;
  }

  /**
   * Returns run-level values shared by every row, such as the ingestion time.
   */
  public Map<String, Object> getAttributes() {
    return attributes;
  }

  /**
   * Returns the 1-based position of the row within its source.
   */
  public long getRowNumber() {
    return rowNumber;
  }

  /**
   * Returns a copy of this context positioned at another row.
   */
  public RowContext atRow(long rowNumber) {
    return builder()
        .sourceName(sourceName)
        .attributes(attributes)
        .rowNumber(rowNumber)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("RowContext{rowNumber=").append(rowNumber);
    if (sourceName != null) {
      sb.append(", source='").append(sourceName).append("'");
    }
    if (!attributes.isEmpty()) {
      sb.append(", attributes=").append(attributes);
    }
    sb.append("}");
    return sb.toString();
  }

  /**
   * Builder for RowContext.
   */
  public static class Builder {
    private String sourceName;
    private Map<String, Object> attributes;
    private long rowNumber;

    public Builder sourceName(String sourceName) {
      this.sourceName = sourceName;
      return this;
    }

    public Builder attributes(Map<String, Object> attributes) {
      this.attributes = attributes;
      return this;
    }

    public Builder rowNumber(long rowNumber) {
      this.rowNumber = rowNumber;
      return this;
    }

    public RowContext build() {
      return new RowContext(this);
    }
  }
}
