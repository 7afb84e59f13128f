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
package org.apache.calcite.adapter.pipeline.materialize;

import org.apache.calcite.adapter.pipeline.batch.Row;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions by the text values of a list of columns, in list order.
 * A null value maps to {@link PartitionKey#DEFAULT_PARTITION_NAME}.
 */
public class ColumnPartitionKeyFunction implements PartitionKeyFunction {
  private final List<String> columns;

  public ColumnPartitionKeyFunction(List<String> columns) {
    Preconditions.checkArgument(!columns.isEmpty(), "at least one partition column required");
    this.columns = ImmutableList.copyOf(columns);
  }

  public static ColumnPartitionKeyFunction of(String... columns) {
    return new ColumnPartitionKeyFunction(ImmutableList.copyOf(columns));
  }

  @Override public List<String> getColumns() {
    return columns;
  }

  @Override public PartitionKey apply(Row row) {
    Map<String, String> values = new LinkedHashMap<>();
    for (String column : columns) {
      String value = row.getString(column);
      values.put(column, value == null ? PartitionKey.DEFAULT_PARTITION_NAME : value);
    }
    return PartitionKey.of(values);
  }

  @Override public String toString() {
    return "ColumnPartitionKeyFunction" + columns;
  }
}
