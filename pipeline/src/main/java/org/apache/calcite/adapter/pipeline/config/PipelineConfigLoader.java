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
package org.apache.calcite.adapter.pipeline.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads {@link PipelineConfig} from YAML or JSON files.
 *
 * <p>Relative paths in the file are resolved against the file's directory.
 */
public final class PipelineConfigLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineConfigLoader.class);

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  private PipelineConfigLoader() {
  }

  /**
   * Loads a configuration file. Files ending in {@code .json} are read as
   * JSON, everything else as YAML.
   *
   * @throws IOException if the file cannot be read or parsed
   * @throws IllegalArgumentException if the configuration is invalid
   */
  public static PipelineConfig load(Path file) throws IOException {
    ObjectMapper mapper = file.getFileName().toString().endsWith(".json")
        ? JSON_MAPPER : YAML_MAPPER;
    Map<String, Object> map;
    try (InputStream in = Files.newInputStream(file)) {
      map = mapper.readValue(in, new TypeReference<Map<String, Object>>() { });
    }
    if (map == null) {
      throw new IOException("Empty pipeline configuration: " + file);
    }
    Path parent = file.toAbsolutePath().getParent();
    PipelineConfig config = PipelineConfig.fromMap(map, parent);
    LOGGER.info("Loaded pipeline configuration from {}: {}", file, config);
    return config;
  }

  /** Parses YAML text; relative paths resolve against {@code baseDirectory}. */
  public static PipelineConfig parse(String yaml, Path baseDirectory) throws IOException {
    Map<String, Object> map =
        YAML_MAPPER.readValue(yaml, new TypeReference<Map<String, Object>>() { });
    if (map == null) {
      throw new IOException("Empty pipeline configuration");
    }
    return PipelineConfig.fromMap(map, baseDirectory);
  }
}
