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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * State shared by the nodes of one run.
 *
 * <p>Nodes publish their outputs under string keys and read their
 * predecessors' outputs the same way. Published values are immutable; a
 * value is never replaced by a later node. The coordinator records each
 * node's output fingerprint here, which is how a node derives its input
 * fingerprint.
 */
public class RunContext {
  private final String pipelineName;
  private final String runId;
  private final Map<String, Object> values = new ConcurrentHashMap<>();
  private final Map<String, String> outputFingerprints = new ConcurrentHashMap<>();
  private volatile @Nullable ValidationReport report;
  private volatile @Nullable WriteSummary writeSummary;

  public RunContext(String pipelineName, String runId) {
    this.pipelineName = pipelineName;
    this.runId = runId;
  }

  public String getPipelineName() {
    return pipelineName;
  }

  public String getRunId() {
    return runId;
  }

  /** Publishes a value. */
  public void put(String key, Object value) {
    values.put(key, value);
  }

  /**
   * Returns a published value.
   *
   * @throws IllegalStateException if nothing was published under the key
   */
  public <T> T get(String key, Class<T> type) {
    Object value = values.get(key);
    if (value == null) {
      throw new IllegalStateException("No value '" + key + "' in run " + runId);
    }
    return type.cast(value);
  }

  public boolean contains(String key) {
    return values.containsKey(key);
  }

  /** Output fingerprint of a completed or restored node. */
  public String outputFingerprint(String node) {
    String fingerprint = outputFingerprints.get(node);
    if (fingerprint == null) {
      throw new IllegalStateException("Node '" + node + "' has no output in run " + runId);
    }
    return fingerprint;
  }

  void setOutputFingerprint(String node, String fingerprint) {
    outputFingerprints.put(node, fingerprint);
  }

  public @Nullable ValidationReport getReport() {
    return report;
  }

  public void setReport(ValidationReport report) {
    this.report = report;
  }

  public @Nullable WriteSummary getWriteSummary() {
    return writeSummary;
  }

  public void setWriteSummary(WriteSummary writeSummary) {
    this.writeSummary = writeSummary;
  }
}
