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
package org.apache.calcite.adapter.pipeline.schema;

import org.apache.calcite.adapter.pipeline.PipelineException;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A batch does not conform to a schema: missing or unexpected column,
 * incompatible type, or a null in a non-nullable column.
 */
public class SchemaException extends PipelineException {
  private static final long serialVersionUID = 1L;

  private final String column;
  private final String expected;
  private final String actual;
  private final long rowIndex;

  public SchemaException(String column, String expected, String actual) {
    this(column, expected, actual, -1);
  }

  /**
   * Creates a schema error.
   *
   * @param column Offending column
   * @param expected What the schema declares
   * @param actual What was found
   * @param rowIndex Row of the offending value, or -1 if the error is not row-specific
   */
  public SchemaException(String column, String expected, String actual, long rowIndex) {
    super(format(column, expected, actual, rowIndex));
    this.column = column;
    this.expected = expected;
    this.actual = actual;
    this.rowIndex = rowIndex;
  }

  private static String format(String column, String expected, String actual, long rowIndex) {
    StringBuilder sb = new StringBuilder("Schema mismatch for column '")
        .append(column).append("': expected ").append(expected)
        .append(", actual ").append(actual);
    if (rowIndex >= 0) {
      sb.append(" (row ").append(rowIndex).append(")");
    }
    return sb.toString();
  }

  public String getColumn() {
    return column;
  }

  public String getExpected() {
    return expected;
  }

  public String getActual() {
    return actual;
  }

  /** Returns the row index, or -1 if the error concerns the column as a whole. */
  public long getRowIndex() {
    return rowIndex;
  }

  static String describe(@Nullable ColumnSpec column) {
    return column == null ? "<absent>" : column.getType() + (column.isNullable() ? "" : " NOT NULL");
  }
}
