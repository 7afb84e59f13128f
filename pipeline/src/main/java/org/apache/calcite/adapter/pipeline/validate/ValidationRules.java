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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds rules from maps, as read from YAML or JSON configuration.
 *
 * <pre>{@code
 * rules:
 *   - name: amount_non_negative
 *     type: range
 *     column: TransactionAmt
 *     min: 0
 *     severity: critical
 *   - type: allowed_values
 *     column: isFraud
 *     values: [0, 1]
 *   - type: unique
 *     columns: [TransactionID]
 *     severity: warning
 * }</pre>
 *
 * <p>Supported types are {@code not_null}, {@code range},
 * {@code allowed_values} and {@code unique}. Severity defaults to critical.
 * A range rule accepts {@code nullPasses: false} to fail null values.
 */
public final class ValidationRules {
  private ValidationRules() {
  }

  public static List<ValidationRule> fromList(List<Map<String, Object>> maps) {
    List<ValidationRule> rules = new ArrayList<>(maps.size());
    for (Map<String, Object> map : maps) {
      rules.add(fromMap(map));
    }
    return rules;
  }

  /**
   * Builds one rule.
   *
   * @throws IllegalArgumentException if the type is unknown or a required
   *     attribute is missing
   */
  public static ValidationRule fromMap(Map<String, Object> map) {
    Object typeValue = map.get("type");
    if (typeValue == null) {
      throw new IllegalArgumentException("Rule is missing 'type': " + map);
    }
    String type = typeValue.toString().trim().toLowerCase(Locale.ROOT);
    List<String> columns = columns(map);
    String name = map.get("name") != null
        ? map.get("name").toString()
        : type + "_" + String.join("_", columns);
    Severity severity = map.get("severity") != null
        ? Severity.fromName(map.get("severity").toString())
        : Severity.CRITICAL;

    switch (type) {
    case "not_null":
      return new NotNullRule(name, single(name, columns), severity);
    case "range":
      Object nullPasses = map.get("nullPasses");
      return new RangeRule(name, single(name, columns), number(map.get("min")),
          number(map.get("max")),
          nullPasses == null || Boolean.parseBoolean(nullPasses.toString()), severity);
    case "allowed_values":
      Object values = map.get("values");
      if (!(values instanceof Collection)) {
        throw new IllegalArgumentException("Rule " + name + " needs a 'values' list");
      }
      return new AllowedValuesRule(name, single(name, columns), (Collection<?>) values,
          severity);
    case "unique":
      return new UniqueRule(name, columns, severity);
    default:
      throw new IllegalArgumentException("Unknown rule type '" + type + "' in rule " + name);
    }
  }

  private static List<String> columns(Map<String, Object> map) {
    Object column = map.get("column");
    if (column != null) {
      return ImmutableList.of(column.toString());
    }
    Object columns = map.get("columns");
    if (columns instanceof Collection) {
      List<String> names = new ArrayList<>();
      for (Object o : (Collection<?>) columns) {
        names.add(o.toString());
      }
      if (!names.isEmpty()) {
        return names;
      }
    }
    throw new IllegalArgumentException("Rule needs 'column' or 'columns': " + map);
  }

  private static String single(String name, List<String> columns) {
    if (columns.size() != 1) {
      throw new IllegalArgumentException("Rule " + name + " takes exactly one column, got "
          + columns);
    }
    return columns.get(0);
  }

  private static @Nullable Double number(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    return Double.valueOf(value.toString());
  }
}
