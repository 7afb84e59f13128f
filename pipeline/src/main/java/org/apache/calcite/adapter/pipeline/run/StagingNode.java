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
import org.apache.calcite.adapter.pipeline.schema.SchemaRegistry;
import org.apache.calcite.adapter.pipeline.staging.DuckDBStagingStore;
import org.apache.calcite.adapter.pipeline.staging.LoadException;
import org.apache.calcite.adapter.pipeline.staging.MalformedRowPolicy;
import org.apache.calcite.adapter.pipeline.staging.RawSource;
import org.apache.calcite.adapter.pipeline.staging.StagingLoader;
import org.apache.calcite.adapter.pipeline.staging.StagingResult;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.SQLException;
import java.util.List;

/**
 * Loads the source into the staging relation. Restorable from the staging
 * table when the source, the raw schema and the malformed-row policy are
 * unchanged.
 */
public class StagingNode implements PipelineNode {
  private static final Logger LOGGER = LoggerFactory.getLogger(StagingNode.class);

  public static final String NAME = "staging";

  /** Context key of the staged {@link RecordBatch}. */
  public static final String BATCH = "staging.batch";

  /** Context key of the {@link StagingResult}; absent when restored. */
  public static final String RESULT = "staging.result";

  private final StagingLoader loader;
  private final RawSource source;
  private final DuckDBStagingStore store;
  private final SchemaRegistry registry;
  private final MalformedRowPolicy policy;

  public StagingNode(StagingLoader loader, RawSource source, DuckDBStagingStore store,
      SchemaRegistry registry, MalformedRowPolicy policy) {
    this.loader = loader;
    this.source = source;
    this.store = store;
    this.registry = registry;
    this.policy = policy;
  }

  @Override public String getName() {
    return NAME;
  }

  @Override public List<String> getPredecessors() {
    return ImmutableList.of(SchemaNode.NAME);
  }

  @Override public String inputFingerprint(RunContext context) throws PipelineException {
    String sourceFingerprint;
    try {
      sourceFingerprint = source.fingerprint();
    } catch (IOException e) {
      throw LoadException.unreachable(source.getLocation(), e);
    }
    return Fingerprints.of(context.outputFingerprint(SchemaNode.NAME), sourceFingerprint,
        policy);
  }

  @Override public String run(RunContext context)
      throws PipelineException, InterruptedException {
    StagingResult result = loader.load(source, context.getPipelineName());
    context.put(RESULT, result);
    context.put(BATCH, result.getBatch());
    return result.getBatch().fingerprint();
  }

  @Override public boolean supportsRestore() {
    return true;
  }

  @Override public boolean restore(RunContext context, Checkpoint checkpoint)
      throws PipelineException {
    String table = StagingLoader.stagingTable(context.getPipelineName());
    RecordBatch batch;
    try {
      if (!store.exists(table)) {
        return false;
      }
      batch = store.read(table, registry.raw());
    } catch (SQLException e) {
      throw LoadException.staging(table, e);
    }
    if (!batch.fingerprint().equals(checkpoint.getOutputFingerprint())) {
      LOGGER.info("Staging table {} changed since its checkpoint", table);
      return false;
    }
    context.put(BATCH, batch);
    LOGGER.info("Restored {} staged rows from {}", batch.rowCount(), table);
    return true;
  }
}
