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
package org.apache.calcite.adapter.pipeline.schema;

import java.util.Map;
import java.util.Objects;

/**
 * Declaration of a single column: name, type and nullability.
 */
public final class ColumnSpec {
  private final String name;
  private final ColumnType type;
  private final boolean nullable;

  private ColumnSpec(String name, ColumnType type, boolean nullable) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Column name is required");
    }
    this.name = name;
    this.type = Objects.requireNonNull(type, "type");
    this.nullable = nullable;
  }

  public static ColumnSpec of(String name, ColumnType type, boolean nullable) {
    return new ColumnSpec(name, type, nullable);
  }

  /** Creates a non-nullable column. */
  public static ColumnSpec required(String name, ColumnType type) {
    return new ColumnSpec(name, type, false);
  }

  /** Creates a nullable column. */
  public static ColumnSpec optional(String name, ColumnType type) {
    return new ColumnSpec(name, type, true);
  }

  /**
   * Creates a column from a configuration map with keys {@code name},
   * {@code type} and optional {@code nullable} (default true).
   */
  public static ColumnSpec fromMap(Map<String, Object> map) {
    Object name = map.get("name");
    Object type = map.get("type");
    if (!(name instanceof String) || !(type instanceof String)) {
      throw new IllegalArgumentException("Column requires 'name' and 'type': " + map);
    }
    Object nullable = map.get("nullable");
    return new ColumnSpec((String) name, ColumnType.fromName((String) type),
        nullable == null || Boolean.parseBoolean(nullable.toString()));
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  public boolean isNullable() {
    return nullable;
  }

  /** Returns a copy of this column with a different type. */
  public ColumnSpec withType(ColumnType newType) {
    return new ColumnSpec(name, newType, nullable);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnSpec)) {
      return false;
    }
    ColumnSpec that = (ColumnSpec) o;
    return nullable == that.nullable && name.equals(that.name) && type == that.type;
  }

  @Override public int hashCode() {
    return Objects.hash(name, type, nullable);
  }

  @Override public String toString() {
    return name + " " + type + (nullable ? "" : " NOT NULL");
  }
}
