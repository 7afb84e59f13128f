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
package org.apache.calcite.adapter.pipeline.materialize;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Outcome of a successful materialization.
 */
public class WriteSummary {
  private final String runId;
  private final List<String> partitionsWritten;
  private final List<String> partitionsUnchanged;
  private final long rowsWritten;
  private final long totalRows;
  private final List<String> files;
  private final long elapsedMs;

  public WriteSummary(String runId, List<String> partitionsWritten,
      List<String> partitionsUnchanged, long rowsWritten, long totalRows, List<String> files,
      long elapsedMs) {
    this.runId = runId;
    this.partitionsWritten = ImmutableList.copyOf(partitionsWritten);
    this.partitionsUnchanged = ImmutableList.copyOf(partitionsUnchanged);
    this.rowsWritten = rowsWritten;
    this.totalRows = totalRows;
    this.files = ImmutableList.copyOf(files);
    this.elapsedMs = elapsedMs;
  }

  public String getRunId() {
    return runId;
  }

  /** Partitions written by this run. */
  public List<String> getPartitionsWritten() {
    return partitionsWritten;
  }

  /** Partitions skipped because their fingerprint was unchanged. */
  public List<String> getPartitionsUnchanged() {
    return partitionsUnchanged;
  }

  public long getRowsWritten() {
    return rowsWritten;
  }

  /** Rows across every partition of the sink after the write. */
  public long getTotalRows() {
    return totalRows;
  }

  /** Every data file in the sink after the write. */
  public List<String> getFiles() {
    return files;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  /** True if nothing was written because every partition was unchanged. */
  public boolean isNoOp() {
    return partitionsWritten.isEmpty();
  }

  @Override public String toString() {
    return "WriteSummary{run=" + runId + ", written=" + partitionsWritten.size()
        + ", unchanged=" + partitionsUnchanged.size() + ", rowsWritten=" + rowsWritten
        + ", totalRows=" + totalRows + ", elapsed=" + elapsedMs + "ms}";
  }
}
