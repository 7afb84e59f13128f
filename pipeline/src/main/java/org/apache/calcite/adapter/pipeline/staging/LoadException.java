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

import org.apache.calcite.adapter.pipeline.PipelineException;
import org.apache.calcite.adapter.pipeline.schema.SchemaException;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Raw data could not be staged.
 *
 * <ul>
 *   <li>{@link Kind#MALFORMED} - a row (or the header, row 0) cannot be parsed
 *       into the raw schema; not retryable</li>
 *   <li>{@link Kind#UNREACHABLE} - the source cannot be opened or read;
 *       retryable</li>
 *   <li>{@link Kind#STAGING} - the staging relation cannot be written;
 *       retryable</li>
 * </ul>
 */
public class LoadException extends PipelineException {
  private static final long serialVersionUID = 1L;

  /** Failure classification. */
  public enum Kind {
    MALFORMED, UNREACHABLE, STAGING
  }

  private final Kind kind;
  private final long rowIndex;
  private final String reason;

  private LoadException(Kind kind, long rowIndex, String reason, String message,
      @Nullable Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.rowIndex = rowIndex;
    this.reason = reason;
  }

  public static LoadException malformed(long rowIndex, String reason,
      @Nullable Throwable cause) {
    return new LoadException(Kind.MALFORMED, rowIndex, reason,
        "Malformed row " + rowIndex + ": " + reason, cause);
  }

  public static LoadException unreachable(String location, Throwable cause) {
    return new LoadException(Kind.UNREACHABLE, -1, String.valueOf(cause.getMessage()),
        "Source " + location + " is unreachable: " + cause.getMessage(), cause);
  }

  public static LoadException staging(String table, Throwable cause) {
    return new LoadException(Kind.STAGING, -1, String.valueOf(cause.getMessage()),
        "Cannot write staging relation '" + table + "': " + cause.getMessage(), cause);
  }

  public Kind getKind() {
    return kind;
  }

  /** Data row index of a malformed row (0 for the header), or -1. */
  public long getRowIndex() {
    return rowIndex;
  }

  public String getReason() {
    return reason;
  }

  /** Returns the schema error behind a malformed row, if that is the cause. */
  public @Nullable SchemaException getSchemaError() {
    return getCause() instanceof SchemaException ? (SchemaException) getCause() : null;
  }

  @Override public boolean isRetryable() {
    return kind != Kind.MALFORMED;
  }
}
