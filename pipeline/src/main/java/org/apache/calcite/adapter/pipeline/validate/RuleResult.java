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
package org.apache.calcite.adapter.pipeline.validate;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Outcome of one rule over one batch.
 */
public final class RuleResult {
  /** Maximum number of failing row indexes kept as a sample. */
  public static final int MAX_SAMPLE = 10;

  private final String ruleName;
  private final List<String> columns;
  private final Severity severity;
  private final long passedCount;
  private final long failedCount;
  private final List<Integer> failedRowSample;

  public RuleResult(String ruleName, List<String> columns, Severity severity,
      long passedCount, long failedCount, List<Integer> failedRowSample) {
    this.ruleName = ruleName;
    this.columns = ImmutableList.copyOf(columns);
    this.severity = severity;
    this.passedCount = passedCount;
    this.failedCount = failedCount;
    this.failedRowSample = ImmutableList.copyOf(failedRowSample);
  }

  public String getRuleName() {
    return ruleName;
  }

  public List<String> getColumns() {
    return columns;
  }

  public Severity getSeverity() {
    return severity;
  }

  public long getPassedCount() {
    return passedCount;
  }

  public long getFailedCount() {
    return failedCount;
  }

  /** Indexes of the first failing rows, at most {@link #MAX_SAMPLE}. */
  public List<Integer> getFailedRowSample() {
    return failedRowSample;
  }

  public boolean isPassed() {
    return failedCount == 0;
  }

  @Override public String toString() {
    return ruleName + "[" + severity + "]: passed=" + passedCount + ", failed=" + failedCount;
  }
}
