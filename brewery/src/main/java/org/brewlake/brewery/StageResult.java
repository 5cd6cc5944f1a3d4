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
package org.brewlake.brewery;

/**
 * Outcome of one successful pipeline stage.
 *
 * <p>For the transform stage {@code outputRows == inputRows - droppedRows}.
 * For aggregation, {@code inputRows} is the silver row count and
 * {@code outputRows} the number of groups.
 */
public class StageResult {

  private final PipelineStage stage;
  private final String outputPath;
  private final long inputRows;
  private final long outputRows;
  private final long droppedRows;
  private final long elapsedMillis;

  private StageResult(Builder builder) {
    this.stage = builder.stage;
    this.outputPath = builder.outputPath;
    this.inputRows = builder.inputRows;
    this.outputRows = builder.outputRows;
    this.droppedRows = builder.droppedRows;
    this.elapsedMillis = builder.elapsedMillis;
  }

  public PipelineStage getStage() {
    return stage;
  }

  /**
   * Returns the file or directory the stage produced or inspected.
   */
  public String getOutputPath() {
    return outputPath;
  }

  public long getInputRows() {
    return inputRows;
  }

  public long getOutputRows() {
    return outputRows;
  }

  public long getDroppedRows() {
    return droppedRows;
  }

  public long getElapsedMillis() {
    return elapsedMillis;
  }

  public static Builder builder(PipelineStage stage) {
    return new Builder(stage);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("StageResult{").append(stage.getCommand());
    sb.append(", output='").append(outputPath).append("'");
    sb.append(", in=").append(inputRows);
    sb.append(", out=").append(outputRows);
    if (droppedRows > 0) {
      sb.append(", dropped=").append(droppedRows);
    }
    sb.append(", elapsed=").append(elapsedMillis).append("ms}");
    return sb.toString();
  }

  /**
   * Builder for StageResult.
   */
  public static class Builder {
    private final PipelineStage stage;
    private String outputPath;
    private long inputRows;
    private long outputRows;
    private long droppedRows;
    private long elapsedMillis;

    private Builder(PipelineStage stage) {
      this.stage = stage;
    }

    public Builder outputPath(String outputPath) {
      this.outputPath = outputPath;
      return this;
    }

    public Builder inputRows(long inputRows) {
      this.inputRows = inputRows;
      return this;
    }

    public Builder outputRows(long outputRows) {
      this.outputRows = outputRows;
      return this;
    }

    public Builder droppedRows(long droppedRows) {
      this.droppedRows = droppedRows;
      return this;
    }

    public Builder elapsedMillis(long elapsedMillis) {
      this.elapsedMillis = elapsedMillis;
      return this;
    }

    public StageResult build() {
      if (stage == null) {
        throw new IllegalArgumentException("Stage is required");
      }
      return new StageResult(this);
    }
  }
}
