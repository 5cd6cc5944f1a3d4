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

import java.util.Locale;

/**
 * Stages of the brewery pipeline in execution order.
 */
public enum PipelineStage {
  INGEST("ingest"),
  TRANSFORM("transform"),
  AGGREGATE("aggregate"),
  QUALITY("quality");

  private final String command;

  PipelineStage(String command) {
    this.command = command;
  }

  /**
   * Returns the command-line name of the stage.
   */
  public String getCommand() {
    return command;
  }

  /**
   * Looks up a stage by its command-line name.
   *
   * @throws IllegalArgumentException If no stage has that name
   */
  public static PipelineStage fromCommand(String command) {
    String normalized = command == null ? "" : command.trim().toLowerCase(Locale.ROOT);
    for (PipelineStage stage : values()) {
      if (stage.command.equals(normalized)) {
        return stage;
      }
    }
    throw new IllegalArgumentException("Unknown stage: " + command);
  }
}
