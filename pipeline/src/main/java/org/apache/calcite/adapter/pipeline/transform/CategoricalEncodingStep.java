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
import java.util.TreeSet;

/**
 * Encodes a text column as a number.
 *
 * <ul>
 *   <li>{@link Encoding#ORDINAL}: position of the value among the sorted
 *       distinct non-null values of the batch (INTEGER)</li>
 *   <li>{@link Encoding#FREQUENCY}: number of rows holding the value
 *       (BIGINT)</li>
 * </ul>
 *
 * <p>Null stays null.
 */
public class CategoricalEncodingStep implements DerivationStep {

  /** Encoding scheme. */
  public enum Encoding {
    ORDINAL, FREQUENCY
  }

  private final String sourceColumn;
  private final Encoding encoding;
  private final String outputColumn;

  public CategoricalEncodingStep(String sourceColumn, Encoding encoding) {
    this(sourceColumn, encoding, TransactionSchemas.codeColumn(sourceColumn));
  }

  public CategoricalEncodingStep(String sourceColumn, Encoding encoding, String outputColumn) {
    this.sourceColumn = sourceColumn;
    this.encoding = encoding;
    this.outputColumn = outputColumn;
  }

  @Override public String getName() {
    return "encode(" + sourceColumn + ")";
  }

  @Override public List<String> getInputColumns() {
    return ImmutableList.of(sourceColumn);
  }

  @Override public List<ColumnSpec> getOutputColumns() {
    ColumnType type = encoding == Encoding.ORDINAL ? ColumnType.INTEGER : ColumnType.BIGINT;
    return ImmutableList.of(ColumnSpec.optional(outputColumn, type));
  }

  @Override public List<Object[]> derive(RecordBatch batch) {
    int n = batch.rowCount();
    int column = batch.columnIndex(sourceColumn);
    Object[] out = new Object[n];
    switch (encoding) {
    case ORDINAL:
      TreeSet<String> distinct = new TreeSet<>();
      for (int r = 0; r < n; r++) {
        Object value = batch.value(r, column);
        if (value != null) {
          distinct.add(value.toString());
        }
      }
      Map<String, Integer> codes = new HashMap<>();
      for (String value : distinct) {
        codes.put(value, codes.size());
      }
      for (int r = 0; r < n; r++) {
        Object value = batch.value(r, column);
        out[r] = value == null ? null : codes.get(value.toString());
      }
      break;
    case FREQUENCY:
      Map<String, Long> counts = new HashMap<>();
      for (int r = 0; r < n; r++) {
        Object value = batch.value(r, column);
        if (value != null) {
          counts.merge(value.toString(), 1L, Long::sum);
        }
      }
      for (int r = 0; r < n; r++) {
        Object value = batch.value(r, column);
        out[r] = value == null ? null : counts.get(value.toString());
      }
      break;
    default:
      throw new AssertionError(encoding);
    }
    return ImmutableList.of(out);
  }

  @Override public String describe() {
    return "encode{" + sourceColumn + ", " + encoding + "->" + outputColumn + "}";
  }

  @Override public String toString() {
    return describe();
  }
}
