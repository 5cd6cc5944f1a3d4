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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Map;

/**
 * Drops rows that lack any of the given fields.
 */
public class RequiredFieldsValidator implements Validator {

  private final ImmutableList<String> fields;

  public RequiredFieldsValidator(List<String> fields) {
    this.fields = ImmutableList.copyOf(fields);
  }

  @Override public ValidationResult validate(Map<String, Object> row) {
    for (String field : fields) {
      Object value = row.get(field);
      if (value == null || value.toString().trim().isEmpty()) {
        return ValidationResult.drop("missing " + field
            + (row.get(BrewerySchema.ID) != null ? " (id " + row.get(BrewerySchema.ID) + ")" : ""));
      }
    }
    return ValidationResult.valid();
  }
}
