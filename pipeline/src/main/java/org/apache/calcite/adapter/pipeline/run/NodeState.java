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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable snapshot of one node's state in a run.
 */
public final class NodeState {

  /** Why a node was skipped. */
  public enum SkipReason {
    /** Restored from a checkpoint for the same input fingerprint. */
    CHECKPOINT,
    /** A predecessor failed or was skipped for a reason other than a checkpoint. */
    UPSTREAM_FAILED,
    /** The run was cancelled before the node started. */
    CANCELLED
  }

  private final String name;
  private final NodeStatus status;
  private final @Nullable SkipReason skipReason;
  private final int attempts;
  private final @Nullable String inputFingerprint;
  private final @Nullable String outputFingerprint;
  private final @Nullable StageException error;
  private final long elapsedMs;

  private NodeState(String name, NodeStatus status, @Nullable SkipReason skipReason,
      int attempts, @Nullable String inputFingerprint, @Nullable String outputFingerprint,
      @Nullable StageException error, long elapsedMs) {
    this.name = name;
    this.status = status;
    this.skipReason = skipReason;
    this.attempts = attempts;
    this.inputFingerprint = inputFingerprint;
    this.outputFingerprint = outputFingerprint;
    this.error = error;
    this.elapsedMs = elapsedMs;
  }

  static NodeState pending(String name) {
    return new NodeState(name, NodeStatus.PENDING, null, 0, null, null, null, 0);
  }

  NodeState running(@Nullable String inputFingerprint, int attempt) {
    return new NodeState(name, NodeStatus.RUNNING, null, attempt, inputFingerprint, null, null,
        0);
  }

  NodeState succeeded(String outputFingerprint, long elapsedMs) {
    return new NodeState(name, NodeStatus.SUCCEEDED, null, attempts, inputFingerprint,
        outputFingerprint, null, elapsedMs);
  }

  NodeState failed(StageException error, long elapsedMs) {
    return new NodeState(name, NodeStatus.FAILED, null, attempts, inputFingerprint, null, error,
        elapsedMs);
  }

  NodeState restored(String inputFingerprint, String outputFingerprint) {
    return new NodeState(name, NodeStatus.SKIPPED, SkipReason.CHECKPOINT, 0, inputFingerprint,
        outputFingerprint, null, 0);
  }

  NodeState skipped(SkipReason reason) {
    return new NodeState(name, NodeStatus.SKIPPED, reason, 0, null, null, null, 0);
  }

  public String getName() {
    return name;
  }

  public NodeStatus getStatus() {
    return status;
  }

  public @Nullable SkipReason getSkipReason() {
    return skipReason;
  }

  /** Number of attempts made; 0 if the node never ran. */
  public int getAttempts() {
    return attempts;
  }

  public @Nullable String getInputFingerprint() {
    return inputFingerprint;
  }

  public @Nullable String getOutputFingerprint() {
    return outputFingerprint;
  }

  public @Nullable StageException getError() {
    return error;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  /**
   * Returns whether dependents may start: the node succeeded, or was
   * skipped because its checkpoint was restored.
   */
  public boolean isSatisfied() {
    return status == NodeStatus.SUCCEEDED
        || status == NodeStatus.SKIPPED && skipReason == SkipReason.CHECKPOINT;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder(name).append('=').append(status);
    if (skipReason != null) {
      sb.append('(').append(skipReason).append(')');
    }
    return sb.toString();
  }
}
