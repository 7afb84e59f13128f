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
package org.apache.calcite.adapter.pipeline.batch;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Read-only view of one row of a {@link RecordBatch}.
 */
public final class Row {
  private final RecordBatch batch;
  private final int index;

  Row(RecordBatch batch, int index) {
    this.batch = batch;
    this.index = index;
  }

  /** Position of this row in its batch. */
  public int getIndex() {
    return index;
  }

  public @Nullable Object get(int column) {
    return batch.value(index, column);
  }

  public @Nullable Object get(String column) {
    return batch.value(index, column);
  }

  public boolean isNull(String column) {
    return get(column) == null;
  }

  /** Returns a numeric value as double, or null. */
  public @Nullable Double getDouble(String column) {
    Object value = get(column);
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    throw new IllegalArgumentException("Column '" + column + "' is not numeric");
  }

  public @Nullable Long getLong(String column) {
    Object value = get(column);
    if (value == null) {
      return null;
    }
    if (value instanceof Integer || value instanceof Long) {
      return ((Number) value).longValue();
    }
    throw new IllegalArgumentException("Column '" + column + "' is not integral");
  }

  public @Nullable String getString(String column) {
    Object value = get(column);
    return value == null ? null : value.toString();
  }

  @Override public String toString() {
    return "Row{" + index + ": " + java.util.Arrays.toString(batch.rowValues(index)) + "}";
  }
}
