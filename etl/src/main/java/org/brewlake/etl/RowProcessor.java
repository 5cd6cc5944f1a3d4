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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Applies {@link RowTransformer}s and then {@link Validator}s to a stream of rows.
 *
 * <p>Transformers run in order; a transformer returning null drops the row.
 * Every validator then sees the transformed row and the most severe result
 * decides its fate. A {@code FAIL} result aborts with
 * {@link RowValidationException}.
 *
 * <p>Counters are cumulative over the lifetime of the processor, so that
 * {@code getInputCount() == getOutputCount() + getDroppedCount()} after every
 * call to {@link #process}.
 */
public class RowProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(RowProcessor.class);
  private static final int MAX_LOGGED_DROPS = 20;

  private final List<RowTransformer> transformers;
  private final List<Validator> validators;

  private long inputCount;
  private long outputCount;
  private long droppedCount;
  private long warnedCount;

  public RowProcessor(List<RowTransformer> transformers, List<Validator> validators) {
    this.transformers = transformers != null
        ? Collections.unmodifiableList(new ArrayList<RowTransformer>(transformers))
        : Collections.<RowTransformer>emptyList();
    this.validators = validators != null
        ? Collections.unmodifiableList(new ArrayList<Validator>(validators))
        : Collections.<Validator>emptyList();
  }

  /**
   * Processes every row of {@code rows}.
   *
   * @param rows Input rows
   * @param context Context shared by all rows; its row number is replaced per row
   * @return Rows that survived transformation and validation, in input order
   * @throws RowValidationException If a validator returns {@code FAIL}
   */
  public List<Map<String, Object>> process(Iterator<Map<String, Object>> rows,
      RowContext context) {
    RowContext baseContext = context != null ? context : RowContext.builder().build();
    List<Map<String, Object>> result = new ArrayList<Map<String, Object>>();
    long rowNumber = 0;

    while (rows.hasNext()) {
      Map<String, Object> row = rows.next();
      rowNumber++;
      inputCount++;
      RowContext rowContext = baseContext.atRow(rowNumber);

      for (RowTransformer transformer : transformers) {
        if (row == null) {
          break;
        }
        row = transformer.transform(row, rowContext);
      }
      if (row == null) {
        recordDrop(rowContext, "removed by transformer");
        continue;
      }

      ValidationResult outcome = ValidationResult.valid();
      for (Validator validator : validators) {
        outcome = outcome.mostSevere(validator.validate(row));
      }

      switch (outcome.getAction()) {
        case FAIL:
          throw new RowValidationException(outcome.getMessage(), rowContext);
        case DROP:
          recordDrop(rowContext, outcome.getMessage());
          break;
        case WARN:
          warnedCount++;
          LOGGER.warn("Row {} of {}: {}", rowNumber, baseContext.getSourceName(),
              outcome.getMessage());
          result.add(row);
          outputCount++;
          break;
        default:
          result.add(row);
          outputCount++;
          break;
      }
    }

    LOGGER.debug("Processed {} rows from {}: {} kept, {} dropped, {} warned", rowNumber,
        baseContext.getSourceName(), result.size(), droppedCount, warnedCount);
    return result;
  }

  private void recordDrop(RowContext context, String reason) {
    droppedCount++;
    if (droppedCount <= MAX_LOGGED_DROPS) {
      LOGGER.info("Dropping row {} of {}: {}", context.getRowNumber(),
          context.getSourceName(), reason);
    } else if (droppedCount == MAX_LOGGED_DROPS + 1) {
      LOGGER.info("Further dropped rows are only counted");
    }
  }

  public long getInputCount() {
    return inputCount;
  }

  public long getOutputCount() {
    return outputCount;
  }

  public long getDroppedCount() {
    return droppedCount;
  }

  public long getWarnedCount() {
    return warnedCount;
  }
}
