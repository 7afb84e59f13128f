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

import org.apache.calcite.adapter.pipeline.materialize.WriteSummary;
import org.apache.calcite.adapter.pipeline.validate.ValidationReport;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one pipeline run.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * RunResult result = pipeline.run();
 * if (result.getStatus() == RunStatus.FAILED) {
 *   System.err.println("Failed at " + result.getFailedNode() + ": "
 *       + result.getError().getMessage());
 * } else {
 *   System.out.println("Wrote " + result.getWriteSummary().getPartitionsWritten());
 * }
 * }</pre>
 */
public class RunResult {

  private final String pipelineName;
  private final String runId;
  private final RunStatus status;
  private final @Nullable String failedNode;
  private final @Nullable StageException error;
  private final Map<String, NodeState> nodeStates;
  private final @Nullable ValidationReport report;
  private final @Nullable WriteSummary writeSummary;
  private final long elapsedMs;

  private RunResult(Builder builder) {
    this.pipelineName = builder.pipelineName;
    this.runId = builder.runId;
    this.status = builder.status;
    this.failedNode = builder.failedNode;
    this.error = builder.error;
    this.nodeStates = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodeStates));
    this.report = builder.report;
    this.writeSummary = builder.writeSummary;
    this.elapsedMs = builder.elapsedMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getPipelineName() {
    return pipelineName;
  }

  public String getRunId() {
    return runId;
  }

  public RunStatus getStatus() {
    return status;
  }

  public boolean isSuccessful() {
    return status != RunStatus.FAILED;
  }

  /**
   * Returns the name of the node that failed, or null.
   */
  public @Nullable String getFailedNode() {
    return failedNode;
  }

  /**
   * Returns the error of the failed node, or null.
   */
  public @Nullable StageException getError() {
    return error;
  }

  /**
   * Returns the final state of every node, in execution order.
   */
  public Map<String, NodeState> getNodeStates() {
    return nodeStates;
  }

  /** Returns the state of one node. */
  public NodeState getNodeState(String node) {
    NodeState state = nodeStates.get(node);
    if (state == null) {
      throw new IllegalArgumentException("Unknown node: " + node);
    }
    return state;
  }

  /**
   * Returns the validation report, or null if validation did not run.
   */
  public @Nullable ValidationReport getReport() {
    return report;
  }

  /**
   * Returns the materializer's summary, or null if it did not complete.
   */
  public @Nullable WriteSummary getWriteSummary() {
    return writeSummary;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  @Override public String toString() {
    return "RunResult{pipeline=" + pipelineName + ", runId=" + runId + ", status=" + status
        + (failedNode != null ? ", failedNode=" + failedNode : "")
        + ", nodes=" + nodeStates.values() + ", elapsedMs=" + elapsedMs + "}";
  }

  /**
   * Builder for RunResult.
   */
  public static class Builder {
    private String pipelineName;
    private String runId;
    private RunStatus status = RunStatus.SUCCEEDED;
    private @Nullable String failedNode;
    private @Nullable StageException error;
    private Map<String, NodeState> nodeStates = new LinkedHashMap<>();
    private @Nullable ValidationReport report;
    private @Nullable WriteSummary writeSummary;
    private long elapsedMs;

    public Builder pipelineName(String pipelineName) {
      this.pipelineName = pipelineName;
      return this;
    }

    public Builder runId(String runId) {
      this.runId = runId;
      return this;
    }

    public Builder status(RunStatus status) {
      this.status = status;
      return this;
    }

    public Builder failedNode(@Nullable String failedNode) {
      this.failedNode = failedNode;
      return this;
    }

    public Builder error(@Nullable StageException error) {
      this.error = error;
      return this;
    }

    public Builder nodeStates(Map<String, NodeState> nodeStates) {
      this.nodeStates = nodeStates;
      return this;
    }

    public Builder report(@Nullable ValidationReport report) {
      this.report = report;
      return this;
    }

    public Builder writeSummary(@Nullable WriteSummary writeSummary) {
      this.writeSummary = writeSummary;
      return this;
    }

    public Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    public RunResult build() {
      if (pipelineName == null) {
        throw new IllegalArgumentException("Pipeline name is required");
      }
      if (runId == null) {
        throw new IllegalArgumentException("Run id is required");
      }
      return new RunResult(this);
    }
  }
}
