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
package org.brewlake.brewery.bronze;

import org.brewlake.brewery.BreweryException;
import org.brewlake.storage.StorageProvider;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naming and lookup of bronze snapshot files.
 *
 * <p>A snapshot is named {@code breweries_raw_<yyyyMMdd_HHmmss>.json}. The
 * timestamp format sorts lexicographically, so the newest snapshot is the
 * greatest file name.
 */
public final class BronzeSnapshots {

  public static final String PREFIX = "breweries_raw_";
  public static final String SUFFIX = ".json";

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
  private static final Pattern NAME_PATTERN =
      Pattern.compile("^breweries_raw_(\\d{8}_\\d{6})\\.json$");

  private BronzeSnapshots() {
  }

  /**
   * Returns the snapshot file name for an ingestion time.
   */
  public static String fileNameFor(LocalDateTime ingestedAt) {
    return PREFIX + TIMESTAMP_FORMAT.format(ingestedAt) + SUFFIX;
  }

  /**
   * Returns true if {@code fileName} follows the snapshot naming scheme.
   */
  public static boolean isSnapshot(String fileName) {
    return parseTimestamp(fileName) != null;
  }

  /**
   * Extracts the ingestion time from a snapshot file name.
   *
   * @param fileName File name, with or without directories
   * @return Ingestion time, or null if the name does not match
   */
  public static @Nullable LocalDateTime parseTimestamp(String fileName) {
    String name = fileName;
    int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    if (slash >= 0) {
      name = name.substring(slash + 1);
    }
    Matcher matcher = NAME_PATTERN.matcher(name);
    if (!matcher.matches()) {
      return null;
    }
    try {
      return LocalDateTime.parse(matcher.group(1), TIMESTAMP_FORMAT);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  /**
   * Lists snapshot files in {@code bronzeDir}, oldest first.
   */
  public static List<StorageProvider.FileEntry> list(StorageProvider storageProvider,
      String bronzeDir) throws IOException {
    List<StorageProvider.FileEntry> snapshots = new ArrayList<StorageProvider.FileEntry>();
    for (StorageProvider.FileEntry entry : storageProvider.listFiles(bronzeDir, false)) {
      if (!entry.isDirectory() && isSnapshot(entry.getName())) {
        snapshots.add(entry);
      }
    }
    snapshots.sort((a, b) -> a.getName().compareTo(b.getName()));
    return snapshots;
  }

  /**
   * Returns the path of the newest snapshot in {@code bronzeDir}.
   *
   * @throws BreweryException If the directory holds no snapshot
   */
  public static String latest(StorageProvider storageProvider, String bronzeDir)
      throws IOException {
    List<StorageProvider.FileEntry> snapshots = list(storageProvider, bronzeDir);
    if (snapshots.isEmpty()) {
      throw new BreweryException("No bronze snapshot found in " + bronzeDir);
    }
    return snapshots.get(snapshots.size() - 1).getPath();
  }
}
