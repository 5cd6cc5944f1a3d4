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

import org.brewlake.storage.StorageProvider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Data source that reads rows from a JSON file on a {@link StorageProvider}.
 *
 * <p>The file must hold either an array of objects or a single object.
 * Variables are ignored; the file is read in full on every fetch.
 */
public class JsonFileSource implements DataSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileSource.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> ROW_TYPE =
      new TypeReference<Map<String, Object>>() { };

  private final StorageProvider storageProvider;
  private final String path;

  public JsonFileSource(StorageProvider storageProvider, String path) {
    this.storageProvider = storageProvider;
    this.path = path;
  }

  @Override public Iterator<Map<String, Object>> fetch(Map<String, String> variables)
      throws IOException {
    return readAll().iterator();
  }

  /**
   * Reads every row of the file.
   *
   * @return Rows in file order
   * @throws IOException If the file is missing or is not a JSON array/object
   */
  public List<Map<String, Object>> readAll() throws IOException {
    JsonNode root;
    try (InputStream in = storageProvider.openInputStream(path)) {
      root = OBJECT_MAPPER.readTree(in);
    }

    List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();
    if (root == null || root.isMissingNode() || root.isNull()) {
      LOGGER.warn("JSON file {} is empty", path);
      return rows;
    }
    if (root.isObject()) {
      rows.add(OBJECT_MAPPER.convertValue(root, ROW_TYPE));
    } else if (root.isArray()) {
      for (JsonNode item : root) {
        if (!item.isObject()) {
          throw new IOException("Expected JSON objects in " + path + " but found "
              + item.getNodeType());
        }
        rows.add(OBJECT_MAPPER.convertValue(item, ROW_TYPE));
      }
    } else {
      throw new IOException("Expected a JSON array or object in " + path
          + " but found " + root.getNodeType());
    }

    LOGGER.debug("Read {} rows from {}", rows.size(), path);
    return rows;
  }

  public String getPath() {
    return path;
  }

  @Override public String getType() {
    return "file";
  }
}
