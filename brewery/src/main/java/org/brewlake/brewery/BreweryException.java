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
 * Exception thrown when a pipeline stage cannot produce its output.
 *
 * <p>Infrastructure failures (network, file system, DuckDB) surface as
 * {@link java.io.IOException} instead; this type covers conditions found in
 * the data or in the layout of the layers, such as an empty API response or
 * a missing input layer.
 */
public class BreweryException extends RuntimeException {

  /**
   * Creates a new BreweryException with the specified message.
   */
  public BreweryException(String message) {
    super(message);
  }

  /**
   * Creates a new BreweryException with the specified message and cause.
   */
  public BreweryException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Creates a new BreweryException with the specified cause.
   */
  public BreweryException(Throwable cause) {
    super(cause);
  }
}
