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
import org.apache.calcite.adapter.pipeline.schema.Schema;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies an ordered list of {@link DerivationStep}s to a batch.
 *
 * <p>Steps run in declared order and each sees the columns appended by the
 * steps before it. Rows are never reordered. Every call returns a new batch;
 * the input is not modified.
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * FeatureTransformer transformer = new FeatureTransformer(
 *     TransactionFeatures.defaultSteps(LocalDate.of(2017, 12, 1), "card1"));
 * transformer.plan(TransactionSchemas.raw());
 * RecordBatch features = transformer.transform(staged);
 * }</pre>
 */
public class FeatureTransformer {
  private static final Logger LOGGER = LoggerFactory.getLogger(FeatureTransformer.class);

  private final List<DerivationStep> steps;

  public FeatureTransformer(List<DerivationStep> steps) {
    this.steps = ImmutableList.copyOf(steps);
  }

  public List<DerivationStep> getSteps() {
    return steps;
  }

  /** Output columns of all steps, in derivation order. */
  public List<ColumnSpec> derivedColumns() {
    List<ColumnSpec> columns = new ArrayList<>();
    for (DerivationStep step : steps) {
      columns.addAll(step.getOutputColumns());
    }
    return columns;
  }

  /**
   * Checks that the steps can run against an input schema.
   *
   * @return The schema of the transformed batch
   * @throws TransformException with kind {@code MISSING_DEPENDENCY} if a step
   *     reads an absent column, or {@code DUPLICATE_COLUMN} if a step
   *     produces a column that already exists
   */
  public Schema plan(Schema input) throws TransformException {
    Schema current = input;
    for (DerivationStep step : steps) {
      for (String column : step.getInputColumns()) {
        if (!current.contains(column)) {
          throw new TransformException(TransformException.Kind.MISSING_DEPENDENCY,
              step.getName(), column, "Step '" + step.getName() + "' reads column '"
              + column + "', which is not produced before it");
        }
      }
      for (ColumnSpec output : step.getOutputColumns()) {
        if (current.contains(output.getName())) {
          throw new TransformException(TransformException.Kind.DUPLICATE_COLUMN,
              step.getName(), output.getName(), "Step '" + step.getName()
              + "' produces column '" + output.getName() + "', which already exists");
        }
      }
      try {
        current = current.extend(step.getOutputColumns());
      } catch (IllegalArgumentException e) {
        throw new TransformException(TransformException.Kind.DUPLICATE_COLUMN,
            step.getName(), null, e.getMessage(), e);
      }
    }
    return current;
  }

  /**
   * Derives all feature columns.
   *
   * @param batch Input batch; not modified
   * @return A new batch with the input columns followed by the derived ones
   */
  public RecordBatch transform(RecordBatch batch) throws TransformException {
    plan(batch.getSchema());
    RecordBatch current = batch;
    for (DerivationStep step : steps) {
      long start = System.currentTimeMillis();
      List<Object[]> values = step.derive(current);
      try {
        current = current.withColumns(step.getOutputColumns(), values);
      } catch (IllegalArgumentException e) {
        throw new TransformException(TransformException.Kind.DERIVATION_FAILED,
            step.getName(), null, "Step '" + step.getName() + "' produced invalid values: "
            + e.getMessage(), e);
      }
      LOGGER.debug("Step {} derived {} columns over {} rows in {}ms", step.getName(),
          step.getOutputColumns().size(), current.rowCount(),
          System.currentTimeMillis() - start);
    }
    LOGGER.info("Transformed {} rows with {} steps", current.rowCount(), steps.size());
    return current;
  }

  /** Returns a hash of the step list's configuration. */
  public String signature() {
    Hasher hasher = Hashing.sha256().newHasher();
    for (DerivationStep step : steps) {
      hasher.putString(step.describe(), StandardCharsets.UTF_8).putByte((byte) 0);
    }
    return hasher.hash().toString();
  }

  @Override public String toString() {
    return "FeatureTransformer" + steps;
  }
}
