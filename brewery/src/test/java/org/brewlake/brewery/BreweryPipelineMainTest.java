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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the command-line entry point.
 */
@Tag("integration")
public class BreweryPipelineMainTest {

  @TempDir
  Path tempDir;

  private BreweryFixtures.ApiStub api;

  @BeforeEach
  void setUp() throws IOException {
    api = new BreweryFixtures.ApiStub(BreweryFixtures.records());
  }

  @AfterEach
  void tearDown() {
    api.close();
  }

  private int run(String... command) {
    String[] args = new String[command.length + 6];
    args[0] = "--data-dir";
    args[1] = tempDir.resolve("data").toString();
    args[2] = "--base-url";
    args[3] = api.url();
    args[4] = "--page-size";
    args[5] = "4";
    System.arraycopy(command, 0, args, 6, command.length);
    return BreweryPipelineMain.run(args);
  }

  @Test void testRunAllSucceeds() {
    assertEquals(BreweryPipelineMain.EXIT_OK, run("run-all"));
    assertTrue(Files.isRegularFile(
        tempDir.resolve("data/gold/breweries_aggregated.parquet")));
    // 4 + 3 records, then an empty page
    assertEquals(3, api.getRequestCount());

    assertEquals(BreweryPipelineMain.EXIT_OK, run("quality"));
    assertEquals(BreweryPipelineMain.EXIT_OK, run("aggregate"));
  }

  @Test void testStageFailureExitsWithOne() {
    assertEquals(BreweryPipelineMain.EXIT_FAILURE, run("transform"));
    assertEquals(BreweryPipelineMain.EXIT_FAILURE, run("quality"));

    api.failWith(500);
    assertEquals(BreweryPipelineMain.EXIT_FAILURE, run("ingest"));
  }

  @Test void testUsageErrors() {
    assertEquals(BreweryPipelineMain.EXIT_USAGE, BreweryPipelineMain.run(new String[0]));
    assertEquals(BreweryPipelineMain.EXIT_USAGE, run("publish"));
    assertEquals(BreweryPipelineMain.EXIT_USAGE, run("ingest", "transform"));
    assertEquals(BreweryPipelineMain.EXIT_USAGE,
        BreweryPipelineMain.run(new String[] {"--page-size", "many", "ingest"}));
    assertEquals(BreweryPipelineMain.EXIT_USAGE,
        BreweryPipelineMain.run(new String[] {"--page-size", "0", "ingest"}));
    assertEquals(BreweryPipelineMain.EXIT_USAGE,
        BreweryPipelineMain.run(new String[] {"--no-such-flag", "ingest"}));
    assertEquals(0, api.getRequestCount());
  }

  @Test void testConfigFile() throws IOException {
    Path file = tempDir.resolve("pipeline.yaml");
    Files.write(file, ("dataDirectory: " + tempDir.resolve("lake") + "\n"
        + "source:\n"
        + "  url: " + api.url() + "\n"
        + "  response:\n"
        + "    pagination:\n"
        + "      type: page\n"
        + "      pageParam: page\n"
        + "      limitParam: per_page\n"
        + "      pageSize: 10\n"
        + "  rateLimit:\n"
        + "    requestsPerSecond: 0\n").getBytes(StandardCharsets.UTF_8));

    assertEquals(BreweryPipelineMain.EXIT_OK,
        BreweryPipelineMain.run(new String[] {"--config", file.toString(), "ingest"}));
    assertEquals(2, api.getRequestCount());
    assertTrue(Files.isDirectory(tempDir.resolve("lake/bronze")));

    assertEquals(BreweryPipelineMain.EXIT_FAILURE, BreweryPipelineMain.run(
        new String[] {"--config", tempDir.resolve("absent.yaml").toString(), "ingest"}));
  }

  @Test void testHelp() {
    assertEquals(BreweryPipelineMain.EXIT_OK, BreweryPipelineMain.run(new String[] {"--help"}));
    assertThat(BreweryPipelineMain.help(), containsString("--page-size"));
    assertThat(BreweryPipelineMain.help(), containsString("run-all"));
  }
}
