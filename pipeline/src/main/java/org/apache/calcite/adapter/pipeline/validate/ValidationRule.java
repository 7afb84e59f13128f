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
package org.apache.calcite.adapter.pipeline.validate;

import org.apache.calcite.adapter.pipeline.batch.RecordBatch;

import java.util.List;

/**
 * A data-quality check over a batch.
 *
 * <p>Evaluation is a pure function of the batch: it counts passing and
 * failing rows and never modifies the batch. New rule kinds implement this
 * interface; the {@link ValidationGate} needs no change.
 */
public interface ValidationRule {

  String getName();

  /** Columns the rule reads. */
  List<String> getColumns();

  Severity getSeverity();

  /** Evaluates the rule against every row of a batch. */
  RuleResult evaluate(RecordBatch batch);
}
