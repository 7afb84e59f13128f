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
package org.apache.calcite.adapter.pipeline.run;

import org.apache.calcite.adapter.pipeline.analytics.AnalyticsRelation;
import org.apache.calcite.adapter.pipeline.checkpoint.CheckpointStore;
import org.apache.calcite.adapter.pipeline.checkpoint.DuckDBCheckpointStore;
import org.apache.calcite.adapter.pipeline.config.PipelineConfig;
import org.apache.calcite.adapter.pipeline.config.PipelineConfigLoader;
import org.apache.calcite.adapter.pipeline.materialize.ColumnPartitionKeyFunction;
import org.apache.calcite.adapter.pipeline.materialize.DuckDBParquetPartitionWriter;
import org.apache.calcite.adapter.pipeline.materialize.PartitionFileWriter;
import org.apache.calcite.adapter.pipeline.materialize.PartitionedMaterializer;
import org.apache.calcite.adapter.pipeline.schema.SchemaRegistry;
import org.apache.calcite.adapter.pipeline.schema.TransactionSchemas;
import org.apache.calcite.adapter.pipeline.staging.CsvRawSource;
import org.apache.calcite.adapter.pipeline.staging.DuckDBStagingStore;
import org.apache.calcite.adapter.pipeline.staging.RawSource;
import org.apache.calcite.adapter.pipeline.staging.StagingLoader;
import org.apache.calcite.adapter.pipeline.storage.LocalFileStorageProvider;
import org.apache.calcite.adapter.pipeline.storage.StorageProvider;
import org.apache.calcite.adapter.pipeline.transform.FeatureTransformer;
import org.apache.calcite.adapter.pipeline.transform.TransactionFeatures;
import org.apache.calcite.adapter.pipeline.validate.TransactionRules;
import org.apache.calcite.adapter.pipeline.validate.ValidationGate;
import org.apache.calcite.adapter.pipeline.validate.ValidationRule;
import org.apache.calcite.adapter.pipeline.validate.ValidationRules;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Wires a {@link PipelineConfig} into the five-node DAG and runs it.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * try (FeaturePipeline pipeline = FeaturePipeline.fromFile(Paths.get("pipeline.yaml"))) {
 *   RunResult result = pipeline.run();
 *   if (result.getStatus() == RunStatus.FAILED) {
 *     ...
 *   }
 * }
 * }</pre>
 *
 * <p>The DAG is {@code schema -> staging -> transform -> validate ->
 * materialize}, with {@code validate} also depending on {@code schema}.
 * Runs of the same pipeline are expected to be sequential.
 */
public class FeaturePipeline implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(FeaturePipeline.class);

  private final PipelineConfig config;
  private final SchemaRegistry registry;
  private final FeatureTransformer transformer;
  private final List<ValidationRule> rules;
  private final RawSource source;
  private final DuckDBStagingStore stagingStore;
  private final CheckpointStore checkpoints;
  private final PartitionedMaterializer materializer;
  private final RunListener listener;
  private volatile @Nullable RunCoordinator activeCoordinator;

  /** Creates a pipeline with local storage, DuckDB checkpoints and Parquet output. */
  public FeaturePipeline(PipelineConfig config) throws IOException {
    this(config, new CsvRawSource(config.getSource()),
        DuckDBCheckpointStore.open(config.getWorkDirectory()), new LocalFileStorageProvider(),
        new DuckDBParquetPartitionWriter(config.getCompression()), new LoggingRunListener());
  }

  /**
   * Creates a pipeline with explicit collaborators. The pipeline takes
   * ownership of the checkpoint store and closes it.
   */
  public FeaturePipeline(PipelineConfig config, RawSource source, CheckpointStore checkpoints,
      StorageProvider storage, PartitionFileWriter fileWriter, RunListener listener)
      throws IOException {
    this.config = config;
    this.source = source;
    this.checkpoints = checkpoints;
    this.listener = listener;
    this.registry = new SchemaRegistry(TransactionSchemas.raw(),
        TransactionSchemas.feature(config.getEntityKey()));
    this.transformer = new FeatureTransformer(
        TransactionFeatures.defaultSteps(config.getOriginDate(), config.getEntityKey()));
    List<Map<String, Object>> ruleMaps = config.getRules();
    this.rules = ruleMaps == null
        ? TransactionRules.defaults()
        : ValidationRules.fromList(ruleMaps);
    this.stagingStore = new DuckDBStagingStore(config.getWorkDirectory());
    this.materializer = new PartitionedMaterializer(config.getName(), storage, fileWriter,
        config.getConcurrency(), config.getWriteAttempts());
    LOGGER.info("Configured pipeline '{}' with {} derivation steps and {} rules",
        config.getName(), transformer.getSteps().size(), rules.size());
  }

  /** Creates a pipeline from a YAML or JSON configuration file. */
  public static FeaturePipeline fromFile(Path configFile) throws IOException {
    return new FeaturePipeline(PipelineConfigLoader.load(configFile));
  }

  public PipelineConfig getConfig() {
    return config;
  }

  public SchemaRegistry getSchemaRegistry() {
    return registry;
  }

  public FeatureTransformer getTransformer() {
    return transformer;
  }

  public List<ValidationRule> getRules() {
    return rules;
  }

  public CheckpointStore getCheckpointStore() {
    return checkpoints;
  }

  /** Returns the analytics view over the sink. */
  public AnalyticsRelation getAnalyticsRelation() {
    return materializer.analyticsRelation(config.getSink());
  }

  /** Creates the nodes of the DAG. */
  public List<PipelineNode> nodes() {
    StagingLoader loader = new StagingLoader(registry, stagingStore, config.getChunkSize(),
        config.getMalformedRowPolicy(), config.getQuarantineDirectory());
    return ImmutableList.of(
        new SchemaNode(registry, transformer),
        new StagingNode(loader, source, stagingStore, registry, config.getMalformedRowPolicy()),
        new TransformNode(transformer, stagingStore, registry),
        new ValidateNode(registry, new ValidationGate(), rules),
        new MaterializeNode(materializer,
            new ColumnPartitionKeyFunction(config.getPartitionColumns()), config.getSink(),
            config.getCompression()));
  }

  /** Runs the pipeline once. Errors are reported in the result. */
  public RunResult run() {
    String runId = new SimpleDateFormat("yyyyMMdd_HHmmss").format(new Date())
        + "_" + UUID.randomUUID().toString().substring(0, 8);
    RunContext context = new RunContext(config.getName(), runId);
    try (RunCoordinator coordinator = new RunCoordinator(nodes(), checkpoints,
        config.getRetryPolicy(), config.getStageTimeout(), listener)) {
      activeCoordinator = coordinator;
      return coordinator.run(context);
    } finally {
      activeCoordinator = null;
    }
  }

  /** Cancels the run in progress, if any. */
  public void cancel() {
    RunCoordinator coordinator = activeCoordinator;
    if (coordinator == null) {
      LOGGER.info("No run of pipeline '{}' in progress", config.getName());
      return;
    }
    coordinator.cancel();
  }

  @Override public void close() throws IOException {
    try {
      stagingStore.close();
    } catch (SQLException e) {
      throw new IOException(
          String.format("Failed to close staging store for pipeline '%s': %s",
              config.getName(), e.getMessage()), e);
    } finally {
      checkpoints.close();
    }
  }
}
