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

import org.apache.calcite.adapter.pipeline.PipelineException;
import org.apache.calcite.adapter.pipeline.batch.RecordBatch;
import org.apache.calcite.adapter.pipeline.checkpoint.Checkpoint;
import org.apache.calcite.adapter.pipeline.schema.Schema;
import org.apache.calcite.adapter.pipeline.schema.SchemaRegistry;
import org.apache.calcite.adapter.pipeline.staging.DuckDBStagingStore;
import org.apache.calcite.adapter.pipeline.staging.LoadException;
import org.apache.calcite.adapter.pipeline.transform.FeatureTransformer;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;

/**
 * Applies the derivation steps to the staged relation and persists the
 * result in the table {@code <pipeline>_features}.
 */
public class TransformNode implements PipelineNode {
  private static final Logger LOGGER = LoggerFactory.getLogger(TransformNode.class);

  public static final String NAME = "transform";

  /** Context key of the transformed {@link RecordBatch}. */
  public static final String BATCH = "transform.batch";

  private final FeatureTransformer transformer;
  private final DuckDBStagingStore store;
  private final SchemaRegistry registry;

  public TransformNode(FeatureTransformer transformer, DuckDBStagingStore store,
      SchemaRegistry registry) {
    this.transformer = transformer;
    this.store = store;
    this.registry = registry;
  }

  /** Name of the table holding the transformed relation of a pipeline. */
  public static String featureTable(String pipelineName) {
    return pipelineName + "_features";
  }

  @Override public String getName() {
    return NAME;
  }

  @Override public List<String> getPredecessors() {
    return ImmutableList.of(StagingNode.NAME);
  }

  @Override public String inputFingerprint(RunContext context) {
    return Fingerprints.of(context.outputFingerprint(StagingNode.NAME), transformer.signature());
  }

  @Override public String run(RunContext context) throws PipelineException {
    RecordBatch staged = context.get(StagingNode.BATCH, RecordBatch.class);
    RecordBatch features = transformer.transform(staged);
    String table = featureTable(context.getPipelineName());
    try {
      store.replace(table, features);
    } catch (SQLException e) {
      throw LoadException.staging(table, e);
    }
    context.put(BATCH, features);
    LOGGER.info("Derived {} columns for {} rows into {}", transformer.derivedColumns().size(),
        features.rowCount(), table);
    return features.fingerprint();
  }

  @Override public boolean supportsRestore() {
    return true;
  }

  @Override public boolean restore(RunContext context, Checkpoint checkpoint)
      throws PipelineException {
    String table = featureTable(context.getPipelineName());
    Schema schema = transformer.plan(registry.raw());
    RecordBatch features;
    try {
      if (!store.exists(table)) {
        return false;
      }
      features = store.read(table, schema);
    } catch (SQLException e) {
      throw LoadException.staging(table, e);
    }
    if (!features.fingerprint().equals(checkpoint.getOutputFingerprint())) {
      LOGGER.info("Feature table {} changed since its checkpoint", table);
      return false;
    }
    context.put(BATCH, features);
    LOGGER.info("Restored {} transformed rows from {}", features.rowCount(), table);
    return true;
  }
}
