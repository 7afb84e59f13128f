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
import org.apache.calcite.adapter.pipeline.schema.Schema;
import org.apache.calcite.adapter.pipeline.schema.SchemaRegistry;
import org.apache.calcite.adapter.pipeline.transform.FeatureTransformer;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Checks that the registered schemas and the derivation steps fit
 * together: the steps can be planned over the raw schema, and every derived
 * column of the feature schema is produced by a step with the same type.
 */
public class SchemaNode implements PipelineNode {
  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaNode.class);

  public static final String NAME = "schema";

  private final SchemaRegistry registry;
  private final FeatureTransformer transformer;

  public SchemaNode(SchemaRegistry registry, FeatureTransformer transformer) {
    this.registry = registry;
    this.transformer = transformer;
  }

  @Override public String getName() {
    return NAME;
  }

  @Override public List<String> getPredecessors() {
    return ImmutableList.of();
  }

  @Override public String inputFingerprint(RunContext context) {
    return Fingerprints.of(registry.raw().toJson(), registry.feature().toJson(),
        transformer.signature());
  }

  @Override public String run(RunContext context) throws PipelineException {
    Schema planned = transformer.plan(registry.raw());
    registry.checkDerivations(transformer.derivedColumns());
    LOGGER.debug("Planned {} columns over raw schema; feature schema has {}",
        planned.size(), registry.feature().size());
    return inputFingerprint(context);
  }
}
