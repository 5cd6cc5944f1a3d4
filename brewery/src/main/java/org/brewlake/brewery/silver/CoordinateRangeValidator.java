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

import org.brewlake.etl.ValidationResult;
import org.brewlake.etl.Validator;

import java.util.Map;

/**
 * Warns about coordinates outside the valid latitude/longitude ranges.
 * Such rows are still written.
 */
public class CoordinateRangeValidator implements Validator {

  @Override public ValidationResult validate(Map<String, Object> row) {
    Object latitude = row.get(BrewerySchema.LATITUDE);
    if (latitude instanceof Number && Math.abs(((Number) latitude).doubleValue()) > 90) {
      return ValidationResult.warn("latitude " + latitude + " out of range for id "
          + row.get(BrewerySchema.ID));
    }
    Object longitude = row.get(BrewerySchema.LONGITUDE);
    if (longitude instanceof Number && Math.abs(((Number) longitude).doubleValue()) > 180) {
      return ValidationResult.warn("longitude " + longitude + " out of range for id "
          + row.get(BrewerySchema.ID));
    }
    return ValidationResult.valid();
  }
}
