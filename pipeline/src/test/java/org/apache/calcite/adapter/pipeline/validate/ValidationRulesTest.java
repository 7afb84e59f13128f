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
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link ValidationRules}.
 */
@Tag("unit")
public class ValidationRulesTest {

  @Test void testFromList() {
    List<Map<String, Object>> maps = ImmutableList.<Map<String, Object>>of(
        ImmutableMap.<String, Object>of("type", "not_null", "column", "TransactionID"),
        ImmutableMap.<String, Object>of("name", "amt", "type", "range",
            "column", "TransactionAmt", "min", 0, "severity", "warning"),
        ImmutableMap.<String, Object>of("type", "allowed_values", "column", "isFraud",
            "values", ImmutableList.of(0, 1)),
        ImmutableMap.<String, Object>of("type", "UNIQUE",
            "columns", ImmutableList.of("TransactionID")));

    List<ValidationRule> rules = ValidationRules.fromList(maps);

    assertEquals(4, rules.size());
    assertInstanceOf(NotNullRule.class, rules.get(0));
    assertEquals("not_null_TransactionID", rules.get(0).getName());
    assertEquals(Severity.CRITICAL, rules.get(0).getSeverity());
    assertInstanceOf(RangeRule.class, rules.get(1));
    assertEquals("amt", rules.get(1).getName());
    assertEquals(Severity.WARNING, rules.get(1).getSeverity());
    assertInstanceOf(AllowedValuesRule.class, rules.get(2));
    assertInstanceOf(UniqueRule.class, rules.get(3));
    assertEquals(ImmutableList.of("TransactionID"), rules.get(3).getColumns());
  }

  @Test void testInvalidDefinitions() {
    assertThrows(IllegalArgumentException.class,
        () -> ValidationRules.fromMap(ImmutableMap.<String, Object>of("column", "x")));
    assertThrows(IllegalArgumentException.class,
        () -> ValidationRules.fromMap(
            ImmutableMap.<String, Object>of("type", "regex", "column", "x")));
    assertThrows(IllegalArgumentException.class,
        () -> ValidationRules.fromMap(ImmutableMap.<String, Object>of("type", "not_null")));
    assertThrows(IllegalArgumentException.class,
        () -> ValidationRules.fromMap(
            ImmutableMap.<String, Object>of("type", "allowed_values", "column", "x")));
  }

  @Test void testDefaultTransactionRules() {
    List<ValidationRule> rules = TransactionRules.defaults();
    long critical = rules.stream().filter(r -> r.getSeverity() == Severity.CRITICAL).count();
    assertEquals(5, critical);
    assertEquals(7, rules.size());
  }
}
