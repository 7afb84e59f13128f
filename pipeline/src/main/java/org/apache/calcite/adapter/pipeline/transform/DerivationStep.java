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
package org.apache.calcite.adapter.pipeline.transform;

import org.apache.calcite.adapter.pipeline.batch.RecordBatch;
import org.apache.calcite.adapter.pipeline.schema.ColumnSpec;

import java.util.List;

/**
 * One feature derivation: reads named input columns of a batch and produces
 * new columns, one value per input row.
 *
 * <p>Implementations must be deterministic. They must not reorder rows, and
 * must not modify the batch they are given.
 *
 * @see FeatureTransformer
 */
public interface DerivationStep {

  /** Unique name, used in logs and errors. */
  String getName();

  /** Columns this step reads. Each must exist before the step runs. */
  List<String> getInputColumns();

  /** Columns this step appends, in order. */
  List<ColumnSpec> getOutputColumns();

  /**
   * Computes the output columns.
   *
   * @param batch Input, containing at least {@link #getInputColumns()}
   * @return One array per output column, each with one value per input row
   * @throws TransformException if the values cannot be derived
   */
  List<Object[]> derive(RecordBatch batch) throws TransformException;

  /**
   * Returns a stable description of the step's configuration. Two steps with
   * equal descriptions derive equal values from equal input.
   */
  String describe();
}
