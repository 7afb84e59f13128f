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
import org.apache.calcite.adapter.pipeline.batch.Row;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for rules that judge each row on its own.
 */
public abstract class AbstractRowRule implements ValidationRule {
  private final String name;
  private final List<String> columns;
  private final Severity severity;

  protected AbstractRowRule(String name, List<String> columns, Severity severity) {
    Preconditions.checkArgument(!columns.isEmpty(), "rule %s has no columns", name);
    this.name = name;
    this.columns = ImmutableList.copyOf(columns);
    this.severity = severity;
  }

  @Override public String getName() {
    return name;
  }

  @Override public List<String> getColumns() {
    return columns;
  }

  @Override public Severity getSeverity() {
    return severity;
  }

  /** Returns whether a row satisfies the rule. */
  protected abstract boolean test(Row row);

  @Override public RuleResult evaluate(RecordBatch batch) {
    long passed = 0;
    long failed = 0;
    List<Integer> sample = new ArrayList<>();
    for (Row row : batch) {
      if (test(row)) {
        passed++;
      } else {
        failed++;
        if (sample.size() < RuleResult.MAX_SAMPLE) {
          sample.add(row.getIndex());
        }
      }
    }
    return new RuleResult(name, columns, severity, passed, failed, sample);
  }

  @Override public String toString() {
    return getClass().getSimpleName() + "{" + name + ", " + columns + ", " + severity + "}";
  }
}
