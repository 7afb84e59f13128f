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

import org.apache.calcite.adapter.pipeline.PipelineException;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A feature transformation cannot be planned or applied.
 */
public class TransformException extends PipelineException {
  private static final long serialVersionUID = 1L;

  /** Failure classification. */
  public enum Kind {
    /** A step reads a column that neither the input nor an earlier step provides. */
    MISSING_DEPENDENCY,
    /** A step produces a column that already exists. */
    DUPLICATE_COLUMN,
    /** A step failed while deriving values. */
    DERIVATION_FAILED
  }

  private final Kind kind;
  private final String step;
  private final @Nullable String column;

  public TransformException(Kind kind, String step, @Nullable String column, String message) {
    super(message);
    this.kind = kind;
    this.step = step;
    this.column = column;
  }

  public TransformException(Kind kind, String step, @Nullable String column, String message,
      Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.step = step;
    this.column = column;
  }

  public Kind getKind() {
    return kind;
  }

  /** Name of the offending step. */
  public String getStep() {
    return step;
  }

  /** Offending column, if the error is about one. */
  public @Nullable String getColumn() {
    return column;
  }
}
