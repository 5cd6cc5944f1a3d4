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
package org.brewlake.brewery.silver;

import org.brewlake.etl.RowContext;
import org.brewlake.etl.RowTransformer;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Normalizes a raw brewery record for the silver layer.
 *
 * <ul>
 *   <li>keys are trimmed and lower-cased</li>
 *   <li>text values are trimmed; blank text becomes null</li>
 *   <li>{@code latitude} and {@code longitude} become doubles, or null when unparseable</li>
 *   <li>missing optional text fields, {@code country} included, become the unknown
 *       placeholder</li>
 *   <li>{@code ingested_at} is copied from the context attribute of the same name</li>
 * </ul>
 *
 * <p>{@code state} and {@code brewery_type} are left null when missing so that
 * {@link RequiredFieldsValidator} can drop the record.
 */
public class BreweryNormalizer implements RowTransformer {

  private static final Logger LOGGER = LoggerFactory.getLogger(BreweryNormalizer.class);

  private final String unknownValue;

  public BreweryNormalizer(String unknownValue) {
    this.unknownValue = unknownValue;
  }

  @Override public Map<String, Object> transform(Map<String, Object> row, RowContext context) {
    Map<String, Object> normalized = new LinkedHashMap<String, Object>();
    for (Map.Entry<String, Object> e : row.entrySet()) {
      String key = e.getKey().trim().toLowerCase(Locale.ROOT);
      normalized.put(key, cleanText(e.getValue()));
    }

    normalized.put(BrewerySchema.LATITUDE,
        toDouble(normalized.get(BrewerySchema.LATITUDE), BrewerySchema.LATITUDE, context));
    normalized.put(BrewerySchema.LONGITUDE,
        toDouble(normalized.get(BrewerySchema.LONGITUDE), BrewerySchema.LONGITUDE, context));

    for (String column : BrewerySchema.OPTIONAL_TEXT_COLUMNS) {
      if (normalized.get(column) == null) {
        normalized.put(column, unknownValue);
      }
    }

    Object ingestedAt = context.getAttributes().get(BrewerySchema.INGESTED_AT);
    if (ingestedAt instanceof LocalDateTime) {
      normalized.put(BrewerySchema.INGESTED_AT, ingestedAt);
    }
    return normalized;
  }

  private static @Nullable Object cleanText(@Nullable Object value) {
    if (value instanceof String) {
      String trimmed = ((String) value).trim();
      return trimmed.isEmpty() ? null : trimmed;
    }
    return value;
  }

  private static @Nullable Double toDouble(@Nullable Object value, String column,
      RowContext context) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    try {
      double parsed = Double.parseDouble(value.toString());
      return Double.isFinite(parsed) ? parsed : null;
    } catch (NumberFormatException e) {
      LOGGER.debug("Row {}: {} '{}' is not a number", context.getRowNumber(), column, value);
      return null;
    }
  }
}
