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
import org.apache.calcite.adapter.pipeline.transform.FeatureTransformer;
import org.apache.calcite.adapter.pipeline.transform.TransactionFeatures;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link SchemaRegistry}.
 */
@Tag("unit")
public class SchemaRegistryTest {

  private static final Schema TARGET = Schema.builder()
      .required("id", ColumnType.BIGINT)
      .optional("amount", ColumnType.DOUBLE)
      .optional("name", ColumnType.VARCHAR)
      .build();

  private final SchemaRegistry registry = new SchemaRegistry(TARGET, TARGET);

  @Test void testValidateReordersAndWidens() throws SchemaException {
    Schema actual = Schema.builder()
        .optional("name", ColumnType.VARCHAR)
        .required("id", ColumnType.INTEGER)
        .optional("amount", ColumnType.INTEGER)
        .build();
    RecordBatch batch = RecordBatch.builder(actual)
        .add("a", 1, 10)
        .add(null, 2, null)
        .build();

    RecordBatch result = registry.validate(batch, TARGET);

    assertEquals(TARGET, result.getSchema());
    assertEquals(1L, result.value(0, "id"));
    assertEquals(10.0, result.value(0, "amount"));
    assertEquals("a", result.value(0, "name"));
    assertNull(result.value(1, "amount"));
    // input untouched
    assertEquals(1, batch.value(0, "id"));
    assertSame(actual, batch.getSchema());
  }

  @Test void testMissingColumn() {
    Schema actual = Schema.builder()
        .required("id", ColumnType.BIGINT)
        .optional("amount", ColumnType.DOUBLE)
        .build();
    SchemaException e = assertThrows(SchemaException.class,
        () -> registry.validate(RecordBatch.empty(actual), TARGET));
    assertEquals("name", e.getColumn());
    assertEquals("<absent>", e.getActual());
  }

  @Test void testUnexpectedColumn() {
    Schema actual = TARGET.extend(
        ImmutableList.of(ColumnSpec.optional("extra", ColumnType.BOOLEAN)));
    SchemaException e = assertThrows(SchemaException.class,
        () -> registry.validate(RecordBatch.empty(actual), TARGET));
    assertEquals("extra", e.getColumn());
  }

  @Test void testNarrowingIsRejected() {
    Schema wide = Schema.builder()
        .required("id", ColumnType.DOUBLE)
        .optional("amount", ColumnType.DOUBLE)
        .optional("name", ColumnType.VARCHAR)
        .build();
    SchemaException e = assertThrows(SchemaException.class,
        () -> registry.validate(RecordBatch.empty(wide), TARGET));
    assertEquals("id", e.getColumn());
    assertEquals("BIGINT", e.getExpected());
    assertEquals("DOUBLE", e.getActual());
  }

  @Test void testTextToNumberIsRejected() {
    Schema text = Schema.builder()
        .required("id", ColumnType.BIGINT)
        .optional("amount", ColumnType.VARCHAR)
        .optional("name", ColumnType.VARCHAR)
        .build();
    SchemaException e = assertThrows(SchemaException.class,
        () -> registry.validate(RecordBatch.empty(text), TARGET));
    assertEquals("amount", e.getColumn());
  }

  @Test void testNullInRequiredColumnNamesRow() {
    Schema loose = Schema.builder()
        .optional("id", ColumnType.BIGINT)
        .optional("amount", ColumnType.DOUBLE)
        .optional("name", ColumnType.VARCHAR)
        .build();
    RecordBatch batch = RecordBatch.builder(loose)
        .add(1L, 1.0, "x")
        .add(2L, 2.0, "y")
        .add(null, 3.0, "z")
        .build();
    SchemaException e = assertThrows(SchemaException.class,
        () -> registry.validate(batch, TARGET));
    assertEquals("id", e.getColumn());
    assertEquals(2, e.getRowIndex());
  }

  @Test void testRegisterAndGet() {
    Schema other = Schema.builder().required("x", ColumnType.DATE).build();
    registry.register("other", other);
    assertSame(other, registry.get("other"));
    assertSame(TARGET, registry.get(SchemaRegistry.RAW));
    assertThrows(IllegalArgumentException.class, () -> registry.get("missing"));
  }

  @Test void testDefaultDerivationsCoverFeatureSchema() throws Exception {
    SchemaRegistry transactions =
        new SchemaRegistry(TransactionSchemas.raw(), TransactionSchemas.feature());
    FeatureTransformer transformer = new FeatureTransformer(TransactionFeatures.defaultSteps());
    transactions.checkDerivations(transformer.derivedColumns());
  }

  @Test void testUnproducedDerivedColumn() {
    SchemaRegistry transactions =
        new SchemaRegistry(TransactionSchemas.raw(), TransactionSchemas.feature());
    List<ColumnSpec> derived = TransactionSchemas.derivedColumns(TransactionSchemas.CARD1)
        .subList(0, 3);
    SchemaException e = assertThrows(SchemaException.class,
        () -> transactions.checkDerivations(derived));
    assertEquals(TransactionSchemas.countColumn(TransactionSchemas.CARD1), e.getColumn());
  }

  @Test void testSchemaFromMapAndJson() {
    Schema schema = Schema.fromMap(ImmutableMap.<String, Object>of("columns",
        ImmutableList.of(
            ImmutableMap.of("name", "id", "type", "bigint", "nullable", false),
            ImmutableMap.of("name", "day", "type", "DATE"))));
    assertEquals(ColumnType.BIGINT, schema.get(0).getType());
    assertEquals(false, schema.get(0).isNullable());
    assertEquals(true, schema.get(1).isNullable());
    assertEquals(schema, Schema.fromJson(schema.toJson()));
  }
}
