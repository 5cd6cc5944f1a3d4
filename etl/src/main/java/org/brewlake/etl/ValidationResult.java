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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Outcome of checking one row with a {@link Validator}.
 *
 * <p>Actions are ordered by severity: {@code VALID < WARN < DROP < FAIL}.
 * When several validators inspect the same row, the most severe outcome wins
 * (see {@link #mostSevere(ValidationResult)}).
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * Object state = row.get("state");
 * if (state == null) {
 *   return ValidationResult.drop("state is missing");
 * }
 * return ValidationResult.valid();
 * }</pre>
 *
 * @see Validator
 */
public final class ValidationResult {

  /**
   * What to do with the row, in ascending order of severity.
   */
  public enum Action {
    /** Keep the row. */
    VALID,
    /** Keep the row and log the message. */
    WARN,
    /** Exclude the row and count it as dropped. */
    DROP,
    /** Abort the whole run. */
    FAIL
  }

  private static final ValidationResult VALID_RESULT =
      new ValidationResult(Action.VALID, null);

  private final Action action;
  private final String message;

  private ValidationResult(Action action, String message) {
    this.action = action;
    this.message = message;
  }

  public static ValidationResult valid() {
    return VALID_RESULT;
  }

  public static ValidationResult warn(String message) {
    return new ValidationResult(Action.WARN, message);
  }

  public static ValidationResult drop(String message) {
    return new ValidationResult(Action.DROP, message);
  }

  public static ValidationResult fail(String message) {
    return new ValidationResult(Action.FAIL, message);
  }

  public Action getAction() {
    return action;
  }

  /**
   * Returns the reason given by the validator, or null for valid rows.
   */
  public @Nullable String getMessage() {
    return message;
  }

  public boolean isValid() {
    return action == Action.VALID;
  }

  /** Returns false only for {@link Action#FAIL}. */
  public boolean shouldContinue() {
    return action != Action.FAIL;
  }

  /** Returns true for {@link Action#VALID} and {@link Action#WARN}. */
  public boolean shouldInclude() {
    return action == Action.VALID || action == Action.WARN;
  }

  /**
   * Returns whichever of this result and {@code other} is more severe.
   * Ties keep this result.
   */
  public ValidationResult mostSevere(ValidationResult other) {
    if (other == null) {
      return this;
    }
    return other.action.compareTo(action) > 0 ? other : this;
  }

  @Override public String toString() {
    if (action == Action.VALID) {
      return "ValidationResult{VALID}";
    }
    return "ValidationResult{" + action + ", message='" + message + "'}";
  }
}
