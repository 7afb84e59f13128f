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
import org.apache.calcite.adapter.pipeline.schema.ColumnType;
import org.apache.calcite.adapter.pipeline.schema.TransactionSchemas;

import com.google.common.collect.ImmutableList;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-entity aggregates of a numeric column over the whole batch: the
 * number of rows for the entity, and the mean and sample standard deviation
 * of its non-null values.
 *
 * <p>Mean and variance are computed in two passes, each accumulating in
 * input row order in double precision, so equal input always gives
 * bit-identical output. The standard deviation is null for an entity with
 * fewer than two values; the mean is null for one with none. Rows whose key
 * is null get null aggregates.
 */
public class EntityAggregateStep implements DerivationStep {
  private final String keyColumn;
  private final String valueColumn;

  public EntityAggregateStep(String keyColumn, String valueColumn) {
    this.keyColumn = keyColumn;
    this.valueColumn = valueColumn;
  }

  @Override public String getName() {
    return "entity_aggregates(" + keyColumn + ")";
  }

  @Override public List<String> getInputColumns() {
    return ImmutableList.of(keyColumn, valueColumn);
  }

  @Override public List<ColumnSpec> getOutputColumns() {
    return ImmutableList.of(
        ColumnSpec.optional(TransactionSchemas.countColumn(keyColumn), ColumnType.BIGINT),
        ColumnSpec.optional(TransactionSchemas.meanColumn(keyColumn), ColumnType.DOUBLE),
        ColumnSpec.optional(TransactionSchemas.stdColumn(keyColumn), ColumnType.DOUBLE));
  }

  @Override public List<Object[]> derive(RecordBatch batch) {
    int n = batch.rowCount();
    int keyIndex = batch.columnIndex(keyColumn);
    int valueIndex = batch.columnIndex(valueColumn);

    Map<Object, Accumulator> groups = new HashMap<>();
    for (int r = 0; r < n; r++) {
      Object key = batch.value(r, keyIndex);
      if (key == null) {
        continue;
      }
      Accumulator acc = groups.computeIfAbsent(key, k -> new Accumulator());
      acc.rows++;
      Object value = batch.value(r, valueIndex);
      if (value != null) {
        acc.values++;
        acc.sum += ((Number) value).doubleValue();
      }
    }
    for (int r = 0; r < n; r++) {
      Object key = batch.value(r, keyIndex);
      Object value = batch.value(r, valueIndex);
      if (key == null || value == null) {
        continue;
      }
      Accumulator acc = groups.get(key);
      double deviation = ((Number) value).doubleValue() - acc.mean();
      acc.squares += deviation * deviation;
    }

    Object[] counts = new Object[n];
    Object[] means = new Object[n];
    Object[] stds = new Object[n];
    for (int r = 0; r < n; r++) {
      Object key = batch.value(r, keyIndex);
      if (key == null) {
        continue;
      }
      Accumulator acc = groups.get(key);
      counts[r] = acc.rows;
      if (acc.values > 0) {
        means[r] = acc.mean();
      }
      if (acc.values > 1) {
        stds[r] = Math.sqrt(acc.squares / (acc.values - 1));
      }
    }
    return ImmutableList.of(counts, means, stds);
  }

  @Override public String describe() {
    return "entity_aggregates{key=" + keyColumn + ", value=" + valueColumn + "}";
  }

  @Override public String toString() {
    return describe();
  }

  /** Running totals for one entity. */
  private static class Accumulator {
    long rows;
    long values;
    double sum;
    double squares;

    double mean() {
      return sum / values;
    }
  }
}
