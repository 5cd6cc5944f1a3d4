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

import org.brewlake.etl.ColumnConfig;
import org.brewlake.etl.ColumnConfig.ColumnType;

import com.google.common.collect.ImmutableList;

/**
 * Column layout of the silver table.
 */
public final class BrewerySchema {

  public static final String ID = "id";
  public static final String NAME = "name";
  public static final String BREWERY_TYPE = "brewery_type";
  public static final String ADDRESS_1 = "address_1";
  public static final String ADDRESS_2 = "address_2";
  public static final String ADDRESS_3 = "address_3";
  public static final String STREET = "street";
  public static final String CITY = "city";
  public static final String STATE_PROVINCE = "state_province";
  public static final String POSTAL_CODE = "postal_code";
  public static final String COUNTRY = "country";
  public static final String LONGITUDE = "longitude";
  public static final String LATITUDE = "latitude";
  public static final String PHONE = "phone";
  public static final String WEBSITE_URL = "website_url";
  public static final String STATE = "state";
  public static final String INGESTED_AT = "ingested_at";

  /** Text fields replaced by the unknown placeholder when missing. */
  public static final ImmutableList<String> OPTIONAL_TEXT_COLUMNS = ImmutableList.of(
      CITY, COUNTRY, STATE_PROVINCE, POSTAL_CODE, PHONE, WEBSITE_URL,
      ADDRESS_1, ADDRESS_2, ADDRESS_3);

  /** Fields without which a record is dropped. */
  public static final ImmutableList<String> REQUIRED_COLUMNS = ImmutableList.of(
      STATE, BREWERY_TYPE);

  /** Hive partition levels, outermost first. */
  public static final ImmutableList<String> PARTITION_COLUMNS = ImmutableList.of(
      COUNTRY, STATE);

  public static final ImmutableList<ColumnConfig> COLUMNS = ImmutableList.of(
      ColumnConfig.of(ID, ColumnType.VARCHAR),
      ColumnConfig.of(NAME, ColumnType.VARCHAR),
      notNull(BREWERY_TYPE),
      ColumnConfig.of(ADDRESS_1, ColumnType.VARCHAR),
      ColumnConfig.of(ADDRESS_2, ColumnType.VARCHAR),
      ColumnConfig.of(ADDRESS_3, ColumnType.VARCHAR),
      ColumnConfig.of(STREET, ColumnType.VARCHAR),
      ColumnConfig.of(CITY, ColumnType.VARCHAR),
      ColumnConfig.of(STATE_PROVINCE, ColumnType.VARCHAR),
      ColumnConfig.of(POSTAL_CODE, ColumnType.VARCHAR),
      notNull(COUNTRY),
      ColumnConfig.of(LONGITUDE, ColumnType.DOUBLE),
      ColumnConfig.of(LATITUDE, ColumnType.DOUBLE),
      ColumnConfig.of(PHONE, ColumnType.VARCHAR),
      ColumnConfig.of(WEBSITE_URL, ColumnType.VARCHAR),
      notNull(STATE),
      ColumnConfig.of(INGESTED_AT, ColumnType.TIMESTAMP));

  private BrewerySchema() {
  }

  private static ColumnConfig notNull(String name) {
    return ColumnConfig.builder().name(name).type(ColumnType.VARCHAR).nullable(false).build();
  }
}
