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
package org.apache.calcite.adapter.pipeline.staging;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.Closeable;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

/**
 * Open handle on a {@link RawSource}. Must be closed on every exit path.
 */
public interface RawRowReader extends Closeable {

  /** Column names from the source header, in source order. */
  List<String> getHeader();

  /**
   * Returns the next record, or null at end of input.
   *
   * @throws IOException If the underlying stream fails
   */
  @Nullable RawRecord next() throws IOException;

  /**
   * One raw record: its 1-based data row index and either its cell values or
   * the reason it could not be tokenized.
   */
  final class RawRecord {
    private final long rowIndex;
    private final String @Nullable [] values;
    private final @Nullable String error;

    private RawRecord(long rowIndex, String @Nullable [] values, @Nullable String error) {
      this.rowIndex = rowIndex;
      this.values = values;
      this.error = error;
    }

    public static RawRecord of(long rowIndex, String[] values) {
      return new RawRecord(rowIndex, values.clone(), null);
    }

    public static RawRecord unreadable(long rowIndex, String error) {
      return new RawRecord(rowIndex, null, error);
    }

    public long getRowIndex() {
      return rowIndex;
    }

    /** Cell values; null when the record could not be tokenized. */
    public String @Nullable [] getValues() {
      return values == null ? null : values.clone();
    }

    public @Nullable String getError() {
      return error;
    }

    public boolean isReadable() {
      return error == null;
    }

    @Override public String toString() {
      return "RawRecord{" + rowIndex + ": "
          + (values != null ? Arrays.toString(values) : "error=" + error) + "}";
    }
  }
}
