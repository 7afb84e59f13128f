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

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Ordered partition column values of one partition, rendered as a hive
 * style relative path such as {@code txn_date=2018-01-02/isFraud=0}.
 */
public final class PartitionKey {
  /** Path value used for null. */
  public static final String DEFAULT_PARTITION_NAME = "__HIVE_DEFAULT_PARTITION__";

  private final ImmutableMap<String, String> values;

  private PartitionKey(ImmutableMap<String, String> values) {
    this.values = values;
  }

  /**
   * Creates a key. Iteration order of the map is the path order.
   */
  public static PartitionKey of(Map<String, String> values) {
    if (values.isEmpty()) {
      throw new IllegalArgumentException("Partition key needs at least one column");
    }
    return new PartitionKey(ImmutableMap.copyOf(values));
  }

  public Map<String, String> getValues() {
    return values;
  }

  /** Relative directory of the partition. */
  public String toPath() {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (sb.length() > 0) {
        sb.append('/');
      }
      sb.append(escape(entry.getKey())).append('=').append(escape(entry.getValue()));
    }
    return sb.toString();
  }

  /** Percent-encodes characters that cannot appear in a path segment. */
  static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '/' || c == '\\' || c == '=' || c == '%' || c == ':' || c < ' ') {
        sb.append('%').append(String.format("%02X", (int) c));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof PartitionKey
        && values.equals(((PartitionKey) o).values)
        && values.keySet().asList().equals(((PartitionKey) o).values.keySet().asList());
  }

  @Override public int hashCode() {
    return values.hashCode();
  }

  @Override public String toString() {
    return toPath();
  }
}
