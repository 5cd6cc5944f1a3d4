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

import java.util.Map;

/**
 * Transforms individual rows before they are materialized.
 *
 * <p>Use this interface for normalizations that are easier to express in Java
 * than as SQL column types: renaming keys, trimming strings, coercing numbers
 * that arrive as text, filling defaults.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * public class LowerCaseKeys implements RowTransformer {
 *     public Map<String, Object> transform(Map<String, Object> row, RowContext context) {
 *         Map<String, Object> out = new LinkedHashMap<>();
 *         row.forEach((k, v) -> out.put(k.toLowerCase(Locale.ROOT), v));
 *         return out;
 *     }
 * }
 * }</pre>
 *
 * @see RowContext
 * @see Validator
 */
public interface RowTransformer {

  /**
   * Transforms a single row.
   *
   * <p>The implementation may modify the input map in place or create a new map.
   * Returning null will cause the row to be dropped from the output.
   *
   * @param row Map of column name to value (mutable)
   * @param context Row context including source name and row number
   * @return Transformed row, or null to drop the row
   */
  Map<String, Object> transform(Map<String, Object> row, RowContext context);
}
