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

import java.time.LocalDate;
import java.util.List;

/**
 * Buckets an offset-in-seconds column into hour of day, day of week and
 * calendar date.
 *
 * <p>The offset counts seconds from midnight of {@code originDate}.
 * {@code day_of_week} is the number of whole days since the origin modulo 7,
 * so 0 is the origin's weekday. Negative offsets are bucketed with floor
 * division.
 */
public class TemporalBucketStep implements DerivationStep {
  private static final long SECONDS_PER_HOUR = 3600L;
  private static final long SECONDS_PER_DAY = 86400L;

  private final String sourceColumn;
  private final LocalDate originDate;

  public TemporalBucketStep(String sourceColumn, LocalDate originDate) {
    this.sourceColumn = sourceColumn;
    this.originDate = originDate;
  }

  @Override public String getName() {
    return "temporal_buckets(" + sourceColumn + ")";
  }

  @Override public List<String> getInputColumns() {
    return ImmutableList.of(sourceColumn);
  }

  @Override public List<ColumnSpec> getOutputColumns() {
    return ImmutableList.of(
        ColumnSpec.required(TransactionSchemas.HOUR_OF_DAY, ColumnType.INTEGER),
        ColumnSpec.required(TransactionSchemas.DAY_OF_WEEK, ColumnType.INTEGER),
        ColumnSpec.required(TransactionSchemas.TXN_DATE, ColumnType.DATE));
  }

  @Override public List<Object[]> derive(RecordBatch batch) throws TransformException {
    int n = batch.rowCount();
    int column = batch.columnIndex(sourceColumn);
    Object[] hours = new Object[n];
    Object[] days = new Object[n];
    Object[] dates = new Object[n];
    for (int r = 0; r < n; r++) {
      Object value = batch.value(r, column);
      if (value == null) {
        throw new TransformException(TransformException.Kind.DERIVATION_FAILED, getName(),
            sourceColumn, "Null " + sourceColumn + " at row " + r);
      }
      long seconds = ((Number) value).longValue();
      long day = Math.floorDiv(seconds, SECONDS_PER_DAY);
      long secondOfDay = Math.floorMod(seconds, SECONDS_PER_DAY);
      hours[r] = (int) (secondOfDay / SECONDS_PER_HOUR);
      days[r] = (int) Math.floorMod(day, 7L);
      dates[r] = originDate.plusDays(day);
    }
    return ImmutableList.of(hours, days, dates);
  }

  @Override public String describe() {
    return "temporal_buckets{source=" + sourceColumn + ", origin=" + originDate + "}";
  }

  @Override public String toString() {
    return describe();
  }
}
