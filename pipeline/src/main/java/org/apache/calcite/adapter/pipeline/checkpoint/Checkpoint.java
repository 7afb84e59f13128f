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
package org.apache.calcite.adapter.pipeline.checkpoint;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Persisted state of one stage for one input fingerprint.
 */
public final class Checkpoint {
  private final String pipeline;
  private final String stage;
  private final String inputFingerprint;
  private final @Nullable String outputFingerprint;
  private final CheckpointStatus status;
  private final long startedAt;
  private final @Nullable Long completedAt;
  private final @Nullable String detail;

  public Checkpoint(String pipeline, String stage, String inputFingerprint,
      @Nullable String outputFingerprint, CheckpointStatus status, long startedAt,
      @Nullable Long completedAt, @Nullable String detail) {
    this.pipeline = pipeline;
    this.stage = stage;
    this.inputFingerprint = inputFingerprint;
    this.outputFingerprint = outputFingerprint;
    this.status = status;
    this.startedAt = startedAt;
    this.completedAt = completedAt;
    this.detail = detail;
  }

  public String getPipeline() {
    return pipeline;
  }

  public String getStage() {
    return stage;
  }

  public String getInputFingerprint() {
    return inputFingerprint;
  }

  /** Fingerprint of the stage output; set when the stage succeeded. */
  public @Nullable String getOutputFingerprint() {
    return outputFingerprint;
  }

  public CheckpointStatus getStatus() {
    return status;
  }

  /** Epoch millis. */
  public long getStartedAt() {
    return startedAt;
  }

  public @Nullable Long getCompletedAt() {
    return completedAt;
  }

  /** Summary of the outcome, or the error of a failed stage. */
  public @Nullable String getDetail() {
    return detail;
  }

  public boolean isSucceeded() {
    return status == CheckpointStatus.SUCCEEDED;
  }

  @Override public String toString() {
    return "Checkpoint{" + pipeline + "/" + stage + " input=" + inputFingerprint
        + " status=" + status + "}";
  }
}
