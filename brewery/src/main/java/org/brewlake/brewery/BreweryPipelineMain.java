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

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <pre>
 * brewery-pipeline [--config FILE] [--data-dir DIR] [--base-url URL] [--page-size N]
 *                  ingest|transform|aggregate|quality|run-all
 * </pre>
 *
 * <p>Exit status is {@value #EXIT_OK} on success, {@value #EXIT_FAILURE} when a
 * stage fails (quality violations included) and {@value #EXIT_USAGE} for
 * invalid arguments.
 */
public class BreweryPipelineMain {

  private static final Logger LOGGER = LoggerFactory.getLogger(BreweryPipelineMain.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;
  public static final int EXIT_USAGE = 2;

  static final String RUN_ALL = "run-all";
  private static final String USAGE =
      "brewery-pipeline [options] <ingest|transform|aggregate|quality|run-all>";

  private static final Option CONFIG_OPT =
      Option.builder("c").longOpt("config").desc("path to a pipeline YAML file").hasArg()
          .argName("file").build();
  private static final Option DATA_DIR_OPT =
      Option.builder("d").longOpt("data-dir").desc("base directory of the data layers")
          .hasArg().argName("dir").build();
  private static final Option BASE_URL_OPT =
      Option.builder().longOpt("base-url").desc("brewery API endpoint").hasArg()
          .argName("url").build();
  private static final Option PAGE_SIZE_OPT =
      Option.builder().longOpt("page-size").desc("records requested per page").hasArg()
          .argName("n").build();
  private static final Option HELP_OPT =
      Option.builder("h").longOpt("help").desc("print this help").build();

  private static final Options CLI_OPTIONS = new Options()
      .addOption(CONFIG_OPT)
      .addOption(DATA_DIR_OPT)
      .addOption(BASE_URL_OPT)
      .addOption(PAGE_SIZE_OPT)
      .addOption(HELP_OPT);

  private BreweryPipelineMain() {
  }

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /**
   * Parses the arguments, runs the requested stage and returns the exit status.
   */
  public static int run(String[] args) {
    CommandLine commandLine;
    try {
      commandLine = new DefaultParser().parse(CLI_OPTIONS, args);
    } catch (ParseException e) {
      return usageError(e.getMessage());
    }

    if (commandLine.hasOption(HELP_OPT.getOpt())) {
      System.out.println(help());
      return EXIT_OK;
    }

    List<String> commands = commandLine.getArgList();
    if (commands.size() != 1) {
      return usageError(commands.isEmpty() ? "Missing command" : "Too many commands: " + commands);
    }
    String command = commands.get(0);
    PipelineStage stage = null;
    if (!RUN_ALL.equals(command)) {
      try {
        stage = PipelineStage.fromCommand(command);
      } catch (IllegalArgumentException e) {
        return usageError(e.getMessage());
      }
    }

    BreweryPipelineConfig config;
    try {
      config = buildConfig(commandLine);
    } catch (IllegalArgumentException e) {
      return usageError(e.getMessage());
    } catch (IOException | BreweryException e) {
      LOGGER.error("Could not load configuration: {}", e.getMessage(), e);
      return EXIT_FAILURE;
    }

    LOGGER.info("Starting '{}' with {}", command, config);
    BreweryPipeline pipeline = new BreweryPipeline(config);
    try {
      if (stage == null) {
        pipeline.runAll();
      } else {
        pipeline.run(stage);
      }
      return EXIT_OK;
    } catch (Exception e) {
      LOGGER.error("Stage '{}' failed: {}", command, e.getMessage(), e);
      return EXIT_FAILURE;
    }
  }

  static BreweryPipelineConfig buildConfig(CommandLine commandLine) throws IOException {
    BreweryPipelineConfig config = commandLine.hasOption(CONFIG_OPT.getLongOpt())
        ? BreweryPipelineConfig.load(Paths.get(commandLine.getOptionValue(CONFIG_OPT.getLongOpt())))
        : BreweryPipelineConfig.loadDefault();

    if (commandLine.hasOption(DATA_DIR_OPT.getLongOpt())) {
      config = config.toBuilder()
          .dataDirectory(commandLine.getOptionValue(DATA_DIR_OPT.getLongOpt()))
          .build();
    }
    if (commandLine.hasOption(BASE_URL_OPT.getLongOpt())) {
      config = config.toBuilder()
          .source(config.getSource().toBuilder()
              .url(commandLine.getOptionValue(BASE_URL_OPT.getLongOpt()))
              .build())
          .build();
    }
    if (commandLine.hasOption(PAGE_SIZE_OPT.getLongOpt())) {
      String value = commandLine.getOptionValue(PAGE_SIZE_OPT.getLongOpt());
      int pageSize;
      try {
        pageSize = Integer.parseInt(value);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Page size is not a number: " + value, e);
      }
      config = config.withPageSize(pageSize);
    }
    return config;
  }

  private static int usageError(String message) {
    System.err.println(message);
    System.err.println(help());
    return EXIT_USAGE;
  }

  static String help() {
    StringWriter out = new StringWriter();
    new HelpFormatter().printHelp(new PrintWriter(out), HelpFormatter.DEFAULT_WIDTH, USAGE,
        null, CLI_OPTIONS, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
    return out.toString();
  }
}
