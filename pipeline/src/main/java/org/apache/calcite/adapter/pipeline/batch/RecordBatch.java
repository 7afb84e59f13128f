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

import org.apache.calcite.adapter.pipeline.schema.ColumnSpec;
import org.apache.calcite.adapter.pipeline.schema.ColumnType;
import org.apache.calcite.adapter.pipeline.schema.Schema;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Immutable, ordered collection of rows that all conform to one {@link Schema}.
 *
 * <p>A batch is the unit handed from one pipeline stage to the next. Every
 * operation that changes the data ({@link #withColumns}, {@link #select})
 * returns a new batch and leaves this one untouched, so a
 * stage can never observe changes made downstream.
 *
 * <p>Each value must be null or an instance of the Java class that its
 * column's {@link ColumnType} maps to.
 */
public final class RecordBatch implements Iterable<Row> {
  private final Schema schema;
  private final List<Object[]> rows;

  private RecordBatch(Schema schema, List<Object[]> rows) {
    this.schema = schema;
    this.rows = rows;
  }

  /**
   * Creates a batch, copying and type-checking every row.
   *
   * @throws IllegalArgumentException if a row has the wrong arity or a value
   *     does not match its column type
   */
  public static RecordBatch of(Schema schema, List<Object[]> rows) {
    List<Object[]> copy = new ArrayList<>(rows.size());
    for (int r = 0; r < rows.size(); r++) {
      Object[] row = rows.get(r);
      checkRow(schema, row, r);
      copy.add(row.clone());
    }
    return new RecordBatch(schema, copy);
  }

  /** Creates an empty batch. */
  public static RecordBatch empty(Schema schema) {
    return new RecordBatch(schema, Collections.<Object[]>emptyList());
  }

  public static Builder builder(Schema schema) {
    return new Builder(schema);
  }

  private static void checkRow(Schema schema, Object[] row, int rowIndex) {
    if (row.length != schema.size()) {
      throw new IllegalArgumentException("Row " + rowIndex + " has " + row.length
          + " values, schema has " + schema.size() + " columns");
    }
    for (int c = 0; c < row.length; c++) {
      Object value = row[c];
      if (value != null && ColumnType.of(value) != schema.get(c).getType()) {
        throw new IllegalArgumentException("Row " + rowIndex + ", column '"
            + schema.get(c).getName() + "': value of class "
            + value.getClass().getSimpleName() + " does not match "
            + schema.get(c).getType());
      }
    }
  }

  public Schema getSchema() {
    return schema;
  }

  public int rowCount() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public @Nullable Object value(int row, int column) {
    return rows.get(row)[column];
  }

  public @Nullable Object value(int row, String column) {
    return rows.get(row)[columnIndex(column)];
  }

  /** Returns a view of one row. */
  public Row row(int index) {
    if (index < 0 || index >= rows.size()) {
      throw new IndexOutOfBoundsException("Row " + index + " of " + rows.size());
    }
    return new Row(this, index);
  }

  /** Returns a copy of the values of one row. */
  public Object[] rowValues(int index) {
    return rows.get(index).clone();
  }

  /** Returns a read-only list of the values in one column. */
  public List<Object> column(String name) {
    final int index = columnIndex(name);
    return new AbstractList<Object>() {
      @Override public Object get(int i) {
        return rows.get(i)[index];
      }

      @Override public int size() {
        return rows.size();
      }
    };
  }

  /**
   * Returns the position of a column.
   *
   * @throws IllegalArgumentException if the schema has no such column
   */
  public int columnIndex(String name) {
    int index = schema.indexOf(name);
    if (index < 0) {
      throw new IllegalArgumentException("No column '" + name + "' in " + schema.names());
    }
    return index;
  }

  @Override public Iterator<Row> iterator() {
    return new Iterator<Row>() {
      private int next = 0;

      @Override public boolean hasNext() {
        return next < rows.size();
      }

      @Override public Row next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return new Row(RecordBatch.this, next++);
      }
    };
  }

  /**
   * Returns a new batch with columns appended.
   *
   * @param columns Columns to append
   * @param values One array per appended column, each with {@link #rowCount()} values
   */
  public RecordBatch withColumns(List<ColumnSpec> columns, List<Object[]> values) {
    if (columns.size() != values.size()) {
      throw new IllegalArgumentException(columns.size() + " columns but "
          + values.size() + " value arrays");
    }
    for (int i = 0; i < values.size(); i++) {
      if (values.get(i).length != rows.size()) {
        throw new IllegalArgumentException("Column '" + columns.get(i).getName() + "' has "
            + values.get(i).length + " values, batch has " + rows.size() + " rows");
      }
    }
    Schema extended = schema.extend(columns);
    List<Object[]> out = new ArrayList<>(rows.size());
    int width = schema.size();
    for (int r = 0; r < rows.size(); r++) {
      Object[] row = Arrays.copyOf(rows.get(r), width + columns.size());
      for (int c = 0; c < columns.size(); c++) {
        row[width + c] = values.get(c)[r];
      }
      checkRow(extended, row, r);
      out.add(row);
    }
    return new RecordBatch(extended, out);
  }

  /** Returns a new batch holding the given rows, in the given order. */
  public RecordBatch select(List<Integer> rowIndexes) {
    List<Object[]> out = new ArrayList<>(rowIndexes.size());
    for (int index : rowIndexes) {
      out.add(rows.get(index).clone());
    }
    return new RecordBatch(schema, out);
  }

  /**
   * Returns a SHA-256 fingerprint of the schema and every value in row order.
   * Two batches have the same fingerprint only if they are value-identical,
   * including the bit pattern of doubles.
   */
  public String fingerprint() {
    Hasher hasher = Hashing.sha256().newHasher();
    hasher.putString(schema.toJson(), StandardCharsets.UTF_8);
    hasher.putInt(rows.size());
    for (Object[] row : rows) {
      for (Object value : row) {
        putValue(hasher, value);
      }
    }
    return hasher.hash().toString();
  }

  private static void putValue(Hasher hasher, @Nullable Object value) {
    if (value == null) {
      hasher.putByte((byte) 0);
    } else if (value instanceof Boolean) {
      hasher.putByte((byte) 1).putBoolean((Boolean) value);
    } else if (value instanceof Integer) {
      hasher.putByte((byte) 2).putInt((Integer) value);
    } else if (value instanceof Long) {
      hasher.putByte((byte) 3).putLong((Long) value);
    } else if (value instanceof Double) {
      hasher.putByte((byte) 4).putLong(Double.doubleToRawLongBits((Double) value));
    } else if (value instanceof String) {
      String s = (String) value;
      hasher.putByte((byte) 5).putInt(s.length()).putString(s, StandardCharsets.UTF_8);
    } else if (value instanceof LocalDate) {
      hasher.putByte((byte) 6).putLong(((LocalDate) value).toEpochDay());
    } else {
      throw new IllegalStateException("Unexpected value " + value.getClass());
    }
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RecordBatch)) {
      return false;
    }
    RecordBatch that = (RecordBatch) o;
    if (!schema.equals(that.schema) || rows.size() != that.rows.size()) {
      return false;
    }
    for (int i = 0; i < rows.size(); i++) {
      if (!Arrays.equals(rows.get(i), that.rows.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override public int hashCode() {
    int h = schema.hashCode();
    for (Object[] row : rows) {
      h = 31 * h + Arrays.hashCode(row);
    }
    return h;
  }

  @Override public String toString() {
    return "RecordBatch{columns=" + schema.names() + ", rows=" + rows.size() + "}";
  }

  /**
   * Accumulates rows for a new batch.
   */
  public static class Builder {
    private final Schema schema;
    private final List<Object[]> rows = new ArrayList<>();

    private Builder(Schema schema) {
      this.schema = schema;
    }

    public Builder add(Object... values) {
      checkRow(schema, values, rows.size());
      rows.add(values.clone());
      return this;
    }

    public int size() {
      return rows.size();
    }

    public RecordBatch build() {
      return new RecordBatch(schema, new ArrayList<>(rows));
    }
  }
}
