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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered mapping from column name to {@link ColumnSpec}.
 *
 * <p>Schemas are immutable. {@link #extend(List)} returns a new schema with
 * additional columns appended, which is how a feature schema is derived from
 * the raw schema.
 */
public final class Schema {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final ImmutableList<ColumnSpec> columns;
  private final ImmutableMap<String, Integer> indexByName;

  private Schema(List<ColumnSpec> columns) {
    ImmutableMap.Builder<String, Integer> index = ImmutableMap.builder();
    for (int i = 0; i < columns.size(); i++) {
      index.put(columns.get(i).getName(), i);
    }
    this.columns = ImmutableList.copyOf(columns);
    try {
      this.indexByName = index.buildOrThrow();
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Duplicate column name in schema: " + columns, e);
    }
  }

  public static Schema of(List<ColumnSpec> columns) {
    return new Schema(columns);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a schema from a configuration map holding a {@code columns} list.
   */
  @SuppressWarnings("unchecked")
  public static Schema fromMap(Map<String, Object> map) {
    Object columnsObj = map.get("columns");
    if (!(columnsObj instanceof List)) {
      throw new IllegalArgumentException("Schema requires a 'columns' list");
    }
    Builder builder = builder();
    for (Object item : (List<?>) columnsObj) {
      if (!(item instanceof Map)) {
        throw new IllegalArgumentException("Invalid column definition: " + item);
      }
      builder.add(ColumnSpec.fromMap((Map<String, Object>) item));
    }
    return builder.build();
  }

  public List<ColumnSpec> getColumns() {
    return columns;
  }

  public int size() {
    return columns.size();
  }

  public ColumnSpec get(int index) {
    return columns.get(index);
  }

  /** Returns the column with the given name, or null. */
  public @Nullable ColumnSpec column(String name) {
    Integer index = indexByName.get(name);
    return index == null ? null : columns.get(index);
  }

  /** Returns the position of a column, or -1 if absent. */
  public int indexOf(String name) {
    Integer index = indexByName.get(name);
    return index == null ? -1 : index;
  }

  public boolean contains(String name) {
    return indexByName.containsKey(name);
  }

  public List<String> names() {
    List<String> names = new ArrayList<>(columns.size());
    for (ColumnSpec column : columns) {
      names.add(column.getName());
    }
    return names;
  }

  /** Returns a new schema with the given columns appended. */
  public Schema extend(List<ColumnSpec> extra) {
    List<ColumnSpec> all = new ArrayList<>(columns);
    all.addAll(extra);
    return new Schema(all);
  }

  /**
   * Renders the schema as JSON, e.g.
   * {@code {"columns":[{"name":"id","type":"BIGINT","nullable":false}]}}.
   */
  public String toJson() {
    List<Map<String, Object>> list = new ArrayList<>();
    for (ColumnSpec column : columns) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("name", column.getName());
      entry.put("type", column.getType().sqlName());
      entry.put("nullable", column.isNullable());
      list.add(entry);
    }
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("columns", list);
    try {
      return MAPPER.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize schema", e);
    }
  }

  /** Parses the output of {@link #toJson()}. */
  @SuppressWarnings("unchecked")
  public static Schema fromJson(String json) {
    try {
      return fromMap(MAPPER.readValue(json, Map.class));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid schema JSON: " + e.getOriginalMessage(), e);
    }
  }

  @Override public boolean equals(Object o) {
    return this == o || (o instanceof Schema && columns.equals(((Schema) o).columns));
  }

  @Override public int hashCode() {
    return columns.hashCode();
  }

  @Override public String toString() {
    return "Schema" + columns;
  }

  /**
   * Builder for {@link Schema}.
   */
  public static class Builder {
    private final List<ColumnSpec> columns = new ArrayList<>();

    public Builder add(ColumnSpec column) {
      columns.add(column);
      return this;
    }

    public Builder required(String name, ColumnType type) {
      return add(ColumnSpec.required(name, type));
    }

    public Builder optional(String name, ColumnType type) {
      return add(ColumnSpec.optional(name, type));
    }

    public Schema build() {
      if (columns.isEmpty()) {
        throw new IllegalArgumentException("Schema must declare at least one column");
      }
      return new Schema(columns);
    }
  }
}
