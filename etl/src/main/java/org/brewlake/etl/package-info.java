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
/**
 * Extract, transform and load building blocks for the pipeline layers.
 *
 * <p>Key components:</p>
 * <ul>
 *   <li>{@link org.brewlake.etl.DataSource} - Row sources ({@link org.brewlake.etl.HttpSource},
 *       {@link org.brewlake.etl.JsonFileSource})</li>
 *   <li>{@link org.brewlake.etl.RowProcessor} - Applies row transformers and validators</li>
 *   <li>{@link org.brewlake.etl.HiveParquetWriter} - Typed, hive-partitioned Parquet output
 *       through DuckDB</li>
 *   <li>{@link org.brewlake.etl.ParquetTableReader} and
 *       {@link org.brewlake.etl.ParquetTableValidator} - Reading back and table-level
 *       quality assertions</li>
 * </ul>
 */
package org.brewlake.etl;
