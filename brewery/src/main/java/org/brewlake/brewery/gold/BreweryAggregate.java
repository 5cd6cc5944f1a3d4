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
package org.brewlake.brewery.gold;

import java.util.Objects;

/**
 * One row of the gold table: the number of breweries of a type in a state.
 */
public final class BreweryAggregate {

  private final String breweryType;
  private final String country;
  private final String state;
  private final long breweryCount;

  public BreweryAggregate(String breweryType, String country, String state,
      long breweryCount) {
    this.breweryType = breweryType;
    this.country = country;
    this.state = state;
    this.breweryCount = breweryCount;
  }

  public String getBreweryType() {
    return breweryType;
  }

  public String getCountry() {
    return country;
  }

  public String getState() {
    return state;
  }

  public long getBreweryCount() {
    return breweryCount;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BreweryAggregate)) {
      return false;
    }
    BreweryAggregate that = (BreweryAggregate) o;
    return breweryCount == that.breweryCount
        && Objects.equals(breweryType, that.breweryType)
        && Objects.equals(country, that.country)
        && Objects.equals(state, that.state);
  }

  @Override public int hashCode() {
    return Objects.hash(breweryType, country, state, breweryCount);
  }

  @Override public String toString() {
    return country + "/" + state + "/" + breweryType + "=" + breweryCount;
  }
}
