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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Divides one numeric column by another. The result is null when either
 * side is null or the denominator is zero, so it is never infinite or NaN.
 */
public class RatioStep implements DerivationStep {
  private final String numerator;
  private final String denominator;
  private final String outputColumn;

  public RatioStep(String numerator, String denominator, String outputColumn) {
    this.numerator = numerator;
    this.denominator = denominator;
    this.outputColumn = outputColumn;
  }

  @Override public String getName() {
    return "ratio(" + outputColumn + ")";
  }

  @Override public List<String> getInputColumns() {
    return ImmutableList.of(numerator, denominator);
  }

  @Override public List<ColumnSpec> getOutputColumns() {
    return ImmutableList.of(ColumnSpec.optional(outputColumn, ColumnType.DOUBLE));
  }

  @Override public List<Object[]> derive(RecordBatch batch) {
    int n = batch.rowCount();
    int num = batch.columnIndex(numerator);
    int den = batch.columnIndex(denominator);
    Object[] out = new Object[n];
    for (int r = 0; r < n; r++) {
      Object a = batch.value(r, num);
      Object b = batch.value(r, den);
      if (a == null || b == null) {
        continue;
      }
      double divisor = ((Number) b).doubleValue();
      if (divisor == 0d) {
        continue;
      }
      double ratio = ((Number) a).doubleValue() / divisor;
      out[r] = Double.isNaN(ratio) || Double.isInfinite(ratio) ? null : ratio;
    }
    return ImmutableList.of(out);
  }

  @Override public String describe() {
    return "ratio{" + numerator + "/" + denominator + "->" + outputColumn + "}";
  }

  @Override public String toString() {
    return describe();
  }
}
