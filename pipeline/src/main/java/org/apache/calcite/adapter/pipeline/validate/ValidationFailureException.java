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

import org.apache.calcite.adapter.pipeline.PipelineException;

/**
 * A critical validation rule failed. Carries the full report.
 */
public class ValidationFailureException extends PipelineException {
  private static final long serialVersionUID = 1L;

  private final transient ValidationReport report;

  public ValidationFailureException(ValidationReport report) {
    super(message(report));
    this.report = report;
  }

  private static String message(ValidationReport report) {
    StringBuilder sb = new StringBuilder()
        .append(report.criticalFailed()).append(" critical rule(s) failed:");
    for (RuleResult result : report.failures()) {
      if (result.getSeverity() == Severity.CRITICAL) {
        sb.append(' ').append(result.getRuleName())
            .append(" (").append(result.getFailedCount()).append(" rows)");
      }
    }
    return sb.toString();
  }

  public ValidationReport getReport() {
    return report;
  }
}
