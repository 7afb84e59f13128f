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
import org.apache.calcite.adapter.pipeline.schema.SchemaRegistry;
import org.apache.calcite.adapter.pipeline.validate.ValidationGate;
import org.apache.calcite.adapter.pipeline.validate.ValidationReport;
import org.apache.calcite.adapter.pipeline.validate.ValidationRule;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Conforms the transformed relation to the feature schema and runs the
 * validation rules over it. Always re-run; it is pure.
 */
public class ValidateNode implements PipelineNode {
  public static final String NAME = "validate";

  /** Context key of the validated {@link RecordBatch}. */
  public static final String BATCH = "validate.batch";

  private final SchemaRegistry registry;
  private final ValidationGate gate;
  private final List<ValidationRule> rules;

  public ValidateNode(SchemaRegistry registry, ValidationGate gate,
      List<? extends ValidationRule> rules) {
    this.registry = registry;
    this.gate = gate;
    this.rules = ImmutableList.copyOf(rules);
  }

  @Override public String getName() {
    return NAME;
  }

  @Override public List<String> getPredecessors() {
    return ImmutableList.of(TransformNode.NAME, SchemaNode.NAME);
  }

  @Override public String inputFingerprint(RunContext context) {
    StringBuilder ruleSignature = new StringBuilder();
    for (ValidationRule rule : rules) {
      ruleSignature.append(rule.getName()).append(':').append(rule.getSeverity())
          .append(rule.getColumns()).append(';');
    }
    return Fingerprints.of(context.outputFingerprint(TransformNode.NAME),
        context.outputFingerprint(SchemaNode.NAME), ruleSignature);
  }

  @Override public String run(RunContext context) throws PipelineException {
    RecordBatch features = context.get(TransformNode.BATCH, RecordBatch.class);
    RecordBatch conformed = registry.validate(features, registry.feature());
    ValidationReport report = gate.evaluate(conformed, rules);
    context.setReport(report);
    gate.enforce(report);
    context.put(BATCH, conformed);
    return conformed.fingerprint();
  }
}
