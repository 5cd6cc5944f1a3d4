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
 * Brewery medallion pipeline: configuration, stage orchestration and the
 * command-line entry point.
 *
 * <p>Stages live in sub-packages, one per layer:</p>
 * <ul>
 *   <li>{@link org.brewlake.brewery.bronze} - raw API snapshots</li>
 *   <li>{@link org.brewlake.brewery.silver} - normalized, partitioned Parquet</li>
 *   <li>{@link org.brewlake.brewery.gold} - aggregated counts</li>
 *   <li>{@link org.brewlake.brewery.quality} - quality gate over the gold layer</li>
 * </ul>
 */
package org.brewlake.brewery;
