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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks that the combination of the given columns is unique. The first
 * occurrence of a value passes, every later one fails. Rows with a null in
 * any of the columns pass.
 */
public class UniqueRule implements ValidationRule {
  private final String name;
  private final List<String> columns;
  private final Severity severity;

  public UniqueRule(String name, List<String> columns, Severity severity) {
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

  @Override public RuleResult evaluate(RecordBatch batch) {
    int[] indexes = new int[columns.size()];
    for (int i = 0; i < indexes.length; i++) {
      indexes[i] = batch.columnIndex(columns.get(i));
    }
    Set<List<Object>> seen = new HashSet<>();
    long passed = 0;
    long failed = 0;
    List<Integer> sample = new ArrayList<>();
    for (int r = 0; r < batch.rowCount(); r++) {
      Object[] key = new Object[indexes.length];
      boolean hasNull = false;
      for (int i = 0; i < indexes.length; i++) {
        key[i] = batch.value(r, indexes[i]);
        hasNull |= key[i] == null;
      }
      if (hasNull || seen.add(Arrays.asList(key))) {
        passed++;
      } else {
        failed++;
        if (sample.size() < RuleResult.MAX_SAMPLE) {
          sample.add(r);
        }
      }
    }
    return new RuleResult(name, columns, severity, passed, failed, sample);
  }

  @Override public String toString() {
    return "UniqueRule{" + name + ", " + columns + ", " + severity + "}";
  }
}
