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

import org.apache.calcite.adapter.pipeline.batch.RecordBatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the named schemas of a pipeline and checks batches against them.
 *
 * <p>Two schemas are always present: {@link #RAW}, the input contract, and
 * {@link #FEATURE}, the raw columns plus every derived column.
 *
 * <h3>Conformance rules</h3>
 * <ul>
 *   <li>Column set equality: a missing or an unexpected column is an error</li>
 *   <li>Types must match, except numeric widening (INTEGER to BIGINT or
 *       DOUBLE, BIGINT to DOUBLE), which converts the values</li>
 *   <li>A null in a non-nullable column is an error naming the row</li>
 * </ul>
 *
 * <p>Checks are pure; the input batch is never changed.
 */
public class SchemaRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaRegistry.class);

  public static final String RAW = "raw";
  public static final String FEATURE = "feature";

  private final Map<String, Schema> schemas = new LinkedHashMap<>();

  public SchemaRegistry(Schema raw, Schema feature) {
    schemas.put(RAW, raw);
    schemas.put(FEATURE, feature);
  }

  /** Registers or replaces a named schema. */
  public synchronized void register(String name, Schema schema) {
    schemas.put(name, schema);
  }

  /**
   * Returns a registered schema.
   *
   * @throws IllegalArgumentException if no schema has that name
   */
  public synchronized Schema get(String name) {
    Schema schema = schemas.get(name);
    if (schema == null) {
      throw new IllegalArgumentException("Unknown schema '" + name + "'");
    }
    return schema;
  }

  public Schema raw() {
    return get(RAW);
  }

  public Schema feature() {
    return get(FEATURE);
  }

  /**
   * Checks a batch against a schema.
   *
   * @param batch Batch to check
   * @param schema Expected schema
   * @return A batch with exactly {@code schema}: columns in schema order and
   *     widened values
   * @throws SchemaException on the first violation found
   */
  public RecordBatch validate(RecordBatch batch, Schema schema) throws SchemaException {
    Schema actual = batch.getSchema();
    for (ColumnSpec expected : schema.getColumns()) {
      ColumnSpec found = actual.column(expected.getName());
      if (found == null) {
        throw new SchemaException(expected.getName(), SchemaException.describe(expected),
            "<absent>");
      }
      if (!found.getType().canWidenTo(expected.getType())) {
        throw new SchemaException(expected.getName(), expected.getType().sqlName(),
            found.getType().sqlName());
      }
    }
    for (ColumnSpec found : actual.getColumns()) {
      if (!schema.contains(found.getName())) {
        throw new SchemaException(found.getName(), "<absent>", found.getType().sqlName());
      }
    }

    int[] sourceIndex = new int[schema.size()];
    for (int c = 0; c < schema.size(); c++) {
      sourceIndex[c] = actual.indexOf(schema.get(c).getName());
    }

    List<Object[]> rows = new ArrayList<>(batch.rowCount());
    for (int r = 0; r < batch.rowCount(); r++) {
      Object[] out = new Object[schema.size()];
      for (int c = 0; c < schema.size(); c++) {
        ColumnSpec expected = schema.get(c);
        Object value = batch.value(r, sourceIndex[c]);
        if (value == null && !expected.isNullable()) {
          throw new SchemaException(expected.getName(), "NOT NULL", "null", r);
        }
        out[c] = expected.getType().coerce(value);
      }
      rows.add(out);
    }
    LOGGER.debug("Batch of {} rows conforms to schema {}", batch.rowCount(), schema.names());
    return RecordBatch.of(schema, rows);
  }

  /**
   * Checks that every column of the feature schema that is not in the raw
   * schema is produced, with the same type, by one of the derived columns.
   *
   * @param derived Output columns of all registered derivation steps
   * @throws SchemaException naming the first column without a derivation
   */
  public void checkDerivations(Collection<ColumnSpec> derived) throws SchemaException {
    Schema raw = raw();
    Map<String, ColumnSpec> byName = new LinkedHashMap<>();
    for (ColumnSpec column : derived) {
      byName.put(column.getName(), column);
    }
    for (ColumnSpec column : feature().getColumns()) {
      ColumnSpec rawColumn = raw.column(column.getName());
      if (rawColumn != null) {
        if (rawColumn.getType() != column.getType()) {
          throw new SchemaException(column.getName(), rawColumn.getType().sqlName(),
              column.getType().sqlName());
        }
        continue;
      }
      ColumnSpec producer = byName.get(column.getName());
      if (producer == null) {
        throw new SchemaException(column.getName(), "a registered derivation step",
            "no step produces it");
      }
      if (producer.getType() != column.getType()) {
        throw new SchemaException(column.getName(), column.getType().sqlName(),
            producer.getType().sqlName() + " (derived)");
      }
    }
  }
}
