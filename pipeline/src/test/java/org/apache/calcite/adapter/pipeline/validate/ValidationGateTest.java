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
import org.apache.calcite.adapter.pipeline.schema.ColumnType;
import org.apache.calcite.adapter.pipeline.schema.Schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ValidationGate} and the rule variants.
 */
@Tag("unit")
public class ValidationGateTest {

  private static final Schema SCHEMA = Schema.builder()
      .optional("id", ColumnType.BIGINT)
      .optional("amount", ColumnType.DOUBLE)
      .optional("product", ColumnType.VARCHAR)
      .build();

  private final ValidationGate gate = new ValidationGate();

  private static RecordBatch amounts(Double... values) {
    RecordBatch.Builder builder = RecordBatch.builder(SCHEMA);
    long id = 1;
    for (Double value : values) {
      builder.add(id++, value, "W");
    }
    return builder.build();
  }

  @Test void testNegativeAmountBlocks() {
    RecordBatch batch = amounts(10.0, -5.0, null);
    List<ValidationRule> rules = ImmutableList.<ValidationRule>of(
        new RangeRule("amount_non_negative", "amount", 0d, null, Severity.CRITICAL));

    ValidationReport report = gate.evaluate(batch, rules);

    assertEquals(3, report.getRowCount());
    assertEquals(1, report.criticalFailed());
    assertTrue(report.isBlocking());
    RuleResult result = report.getResults().get(0);
    assertEquals(2, result.getPassedCount());
    assertEquals(1, result.getFailedCount());
    assertEquals(ImmutableList.of(1), result.getFailedRowSample());

    ValidationFailureException e = assertThrows(ValidationFailureException.class,
        () -> gate.enforce(report));
    assertSame(report, e.getReport());
    assertFalse(e.isRetryable());
  }

  @Test void testNullFailsWhenConfigured() {
    RecordBatch batch = amounts(10.0, null);
    ValidationReport report = gate.evaluate(batch, ImmutableList.<ValidationRule>of(
        new RangeRule("strict", "amount", 0d, 100d, false, Severity.CRITICAL)));
    assertEquals(1, report.getResults().get(0).getFailedCount());
  }

  @Test void testWarningsDoNotBlock() {
    RecordBatch batch = amounts(10.0, null);
    ValidationReport report = gate.evaluate(batch, ImmutableList.<ValidationRule>of(
        new NotNullRule("amount_present", "amount", Severity.WARNING),
        new RangeRule("amount_non_negative", "amount", 0d, null, Severity.CRITICAL)));

    assertFalse(report.isBlocking());
    assertTrue(report.hasWarnings());
    assertEquals(1, report.warningFailed());
    assertEquals(0, report.criticalFailed());
    assertDoesNotThrow(() -> gate.enforce(report));
  }

  @Test void testEvaluationDoesNotChangeBatch() {
    RecordBatch batch = amounts(10.0, -5.0, null);
    String before = batch.fingerprint();
    gate.evaluate(batch, ImmutableList.<ValidationRule>of(
        new NotNullRule("id_present", "id", Severity.CRITICAL),
        new RangeRule("amount_non_negative", "amount", 0d, null, Severity.CRITICAL),
        new AllowedValuesRule("product_known", "product", ImmutableList.of("W", "C"),
            Severity.WARNING)));
    assertEquals(before, batch.fingerprint());
  }

  @Test void testAllowedValuesComparesText() {
    Schema schema = Schema.builder().optional("label", ColumnType.INTEGER).build();
    RecordBatch batch = RecordBatch.builder(schema).add(0).add(1).add(2).build();
    ValidationReport report = gate.evaluate(batch, ImmutableList.<ValidationRule>of(
        new AllowedValuesRule("label", "label", ImmutableList.of(0L, 1L), Severity.CRITICAL)));
    assertEquals(1, report.getResults().get(0).getFailedCount());
    assertEquals(ImmutableList.of(2), report.getResults().get(0).getFailedRowSample());
  }

  @Test void testUniqueRule() {
    Schema schema = Schema.builder().optional("id", ColumnType.BIGINT).build();
    RecordBatch batch = RecordBatch.builder(schema)
        .add(1L).add(2L).add(1L).add(new Object[] {null}).add(new Object[] {null})
        .build();
    ValidationReport report = gate.evaluate(batch, ImmutableList.<ValidationRule>of(
        new UniqueRule("id_unique", ImmutableList.of("id"), Severity.CRITICAL)));
    RuleResult result = report.getResults().get(0);
    assertEquals(4, result.getPassedCount());
    assertEquals(1, result.getFailedCount());
    assertEquals(ImmutableList.of(2), result.getFailedRowSample());
  }

  @Test void testPredicateRule() {
    RecordBatch batch = amounts(10.0, 250.0);
    ValidationReport report = gate.evaluate(batch, ImmutableList.<ValidationRule>of(
        new PredicateRule("small_w", ImmutableList.of("amount", "product"),
            row -> !"W".equals(row.getString("product")) || row.getDouble("amount") < 100,
            Severity.WARNING)));
    assertEquals(1, report.warningFailed());
  }

  @Test void testUnknownColumnIsRejected() {
    RecordBatch batch = amounts(1.0);
    assertThrows(IllegalArgumentException.class,
        () -> gate.evaluate(batch, ImmutableList.<ValidationRule>of(
            new NotNullRule("missing", "nope", Severity.CRITICAL))));
  }

  @Test void testReportJson() throws Exception {
    ValidationReport report = gate.evaluate(amounts(10.0, -5.0, null),
        ImmutableList.<ValidationRule>of(
            new RangeRule("amount_non_negative", "amount", 0d, null, Severity.CRITICAL),
            new NotNullRule("amount_present", "amount", Severity.WARNING)));
    JsonNode json = new ObjectMapper().readTree(report.toJson());
    assertEquals(3, json.get("rowCount").asInt());
    assertEquals(1, json.get("criticalFailed").asInt());
    assertEquals(1, json.get("warningFailed").asInt());
    assertTrue(json.get("blocking").asBoolean());
    assertEquals("amount_non_negative", json.get("rules").get(0).get("rule").asText());
    assertEquals(1, json.get("rules").get(0).get("failedRowSample").get(0).asInt());
  }
}
