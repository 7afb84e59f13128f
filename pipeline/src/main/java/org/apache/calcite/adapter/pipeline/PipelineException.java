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
package org.apache.calcite.adapter.pipeline;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Base class of every error raised by a pipeline stage.
 *
 * <p>Subclasses classify the failure (schema, load, transform, validation,
 * write). {@link #isRetryable()} tells the run coordinator whether running
 * the stage again against the same input can succeed.
 */
public class PipelineException extends Exception {
  private static final long serialVersionUID = 1L;

  public PipelineException(String message) {
    super(message);
  }

  public PipelineException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns whether a retry of the failing stage may succeed.
   * Defaults to false; data and configuration defects are not retryable.
   */
  public boolean isRetryable() {
    return false;
  }
}
