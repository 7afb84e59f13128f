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

import org.apache.calcite.adapter.pipeline.batch.Row;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Checks that a numeric column lies within inclusive bounds. Either bound may
 * be absent. A null value passes unless {@code nullPasses} is false.
 */
public class RangeRule extends AbstractRowRule {
  private final String column;
  private final @Nullable Double min;
  private final @Nullable Double max;
  private final boolean nullPasses;

  public RangeRule(String name, String column, @Nullable Double min, @Nullable Double max,
      Severity severity) {
    this(name, column, min, max, true, severity);
  }

  public RangeRule(String name, String column, @Nullable Double min, @Nullable Double max,
      boolean nullPasses, Severity severity) {
    super(name, ImmutableList.of(column), severity);
    if (min != null && max != null && min > max) {
      throw new IllegalArgumentException("Rule " + name + ": min " + min + " > max " + max);
    }
    this.column = column;
    this.min = min;
    this.max = max;
    this.nullPasses = nullPasses;
  }

  @Override protected boolean test(Row row) {
    Double value = row.getDouble(column);
    if (value == null) {
      return nullPasses;
    }
    return (min == null || value >= min) && (max == null || value <= max);
  }
}
