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
package org.apache.calcite.adapter.pipeline.run;

import org.apache.calcite.adapter.pipeline.PipelineException;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Error of a DAG node, tagged with the node name and the fingerprint of the
 * input it ran against. The original error is the cause.
 */
public class StageException extends PipelineException {
  private static final long serialVersionUID = 1L;

  private final String stage;
  private final @Nullable String inputFingerprint;

  public StageException(String stage, @Nullable String inputFingerprint, Throwable cause) {
    super("Stage '" + stage + "' failed"
        + (inputFingerprint != null ? " for input " + abbreviate(inputFingerprint) : "")
        + ": " + cause.getMessage(), cause);
    this.stage = stage;
    this.inputFingerprint = inputFingerprint;
  }

  private static String abbreviate(String fingerprint) {
    return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
  }

  public String getStage() {
    return stage;
  }

  public @Nullable String getInputFingerprint() {
    return inputFingerprint;
  }

  @Override public boolean isRetryable() {
    Throwable cause = getCause();
    return cause instanceof PipelineException && ((PipelineException) cause).isRetryable();
  }
}
