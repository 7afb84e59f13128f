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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable outcome of a validation pass: one {@link RuleResult} per rule.
 *
 * <p>The report is blocking if any {@link Severity#CRITICAL} rule has at
 * least one failing row.
 */
public final class ValidationReport {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final long rowCount;
  private final List<RuleResult> results;

  public ValidationReport(long rowCount, List<RuleResult> results) {
    this.rowCount = rowCount;
    this.results = ImmutableList.copyOf(results);
  }

  /** Number of rows evaluated. */
  public long getRowCount() {
    return rowCount;
  }

  public List<RuleResult> getResults() {
    return results;
  }

  /** Number of critical rules with failures. */
  public int criticalFailed() {
    return countFailed(Severity.CRITICAL);
  }

  /** Number of warning rules with failures. */
  public int warningFailed() {
    return countFailed(Severity.WARNING);
  }

  private int countFailed(Severity severity) {
    int count = 0;
    for (RuleResult result : results) {
      if (result.getSeverity() == severity && !result.isPassed()) {
        count++;
      }
    }
    return count;
  }

  public boolean isBlocking() {
    return criticalFailed() > 0;
  }

  public boolean hasWarnings() {
    return warningFailed() > 0;
  }

  /** Results of the failing rules. */
  public List<RuleResult> failures() {
    List<RuleResult> failures = new ArrayList<>();
    for (RuleResult result : results) {
      if (!result.isPassed()) {
        failures.add(result);
      }
    }
    return failures;
  }

  /** Serializes the report for external alerting. */
  public String toJson() {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("rowCount", rowCount);
    root.put("criticalFailed", criticalFailed());
    root.put("warningFailed", warningFailed());
    root.put("blocking", isBlocking());
    List<Map<String, Object>> rules = new ArrayList<>();
    for (RuleResult result : results) {
      Map<String, Object> rule = new LinkedHashMap<>();
      rule.put("rule", result.getRuleName());
      rule.put("columns", result.getColumns());
      rule.put("severity", result.getSeverity().name());
      rule.put("passed", result.getPassedCount());
      rule.put("failed", result.getFailedCount());
      rule.put("failedRowSample", result.getFailedRowSample());
      rules.add(rule);
    }
    root.put("rules", rules);
    try {
      return MAPPER.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Cannot serialize validation report", e);
    }
  }

  @Override public String toString() {
    return "ValidationReport{rows=" + rowCount + ", criticalFailed=" + criticalFailed()
        + ", warningFailed=" + warningFailed() + ", results=" + results + "}";
  }
}
