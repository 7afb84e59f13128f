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

import org.apache.calcite.adapter.pipeline.batch.RecordBatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs validation rules over a batch and decides whether it may be
 * published.
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * ValidationGate gate = new ValidationGate();
 * ValidationReport report = gate.evaluate(features, TransactionRules.defaults());
 * gate.enforce(report);   // throws if a critical rule failed
 * }</pre>
 */
public class ValidationGate {
  private static final Logger LOGGER = LoggerFactory.getLogger(ValidationGate.class);

  /**
   * Evaluates every rule.
   *
   * @throws IllegalArgumentException if a rule reads a column the batch does
   *     not have
   */
  public ValidationReport evaluate(RecordBatch batch, List<? extends ValidationRule> rules) {
    List<RuleResult> results = new ArrayList<>(rules.size());
    for (ValidationRule rule : rules) {
      for (String column : rule.getColumns()) {
        if (!batch.getSchema().contains(column)) {
          throw new IllegalArgumentException("Rule '" + rule.getName()
              + "' reads unknown column '" + column + "'");
        }
      }
      RuleResult result = rule.evaluate(batch);
      if (!result.isPassed()) {
        LOGGER.debug("Rule {} failed on {} rows, first at {}", rule.getName(),
            result.getFailedCount(), result.getFailedRowSample());
      }
      results.add(result);
    }
    ValidationReport report = new ValidationReport(batch.rowCount(), results);
    LOGGER.info("Validated {} rows against {} rules: {} critical and {} warning rule(s) failed",
        batch.rowCount(), rules.size(), report.criticalFailed(), report.warningFailed());
    return report;
  }

  /**
   * Throws if the report is blocking; logs warning failures otherwise.
   */
  public void enforce(ValidationReport report) throws ValidationFailureException {
    for (RuleResult result : report.failures()) {
      if (result.getSeverity() == Severity.WARNING) {
        LOGGER.warn("Warning rule {} failed on {} of {} rows", result.getRuleName(),
            result.getFailedCount(), report.getRowCount());
      }
    }
    if (report.isBlocking()) {
      ValidationFailureException e = new ValidationFailureException(report);
      LOGGER.error("Validation blocked publication: {}", e.getMessage());
      throw e;
    }
  }
}
