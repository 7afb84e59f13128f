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
package org.apache.calcite.adapter.pipeline.transform;

import org.apache.calcite.adapter.pipeline.batch.RecordBatch;
import org.apache.calcite.adapter.pipeline.schema.ColumnType;
import org.apache.calcite.adapter.pipeline.schema.Schema;
import org.apache.calcite.adapter.pipeline.schema.TransactionSchemas;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.apache.calcite.adapter.pipeline.TransactionFixtures.rawBatch;
import static org.apache.calcite.adapter.pipeline.TransactionFixtures.row;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link FeatureTransformer} and the derivation steps.
 */
@Tag("unit")
public class FeatureTransformerTest {

  private static final LocalDate ORIGIN = TransactionFeatures.DEFAULT_ORIGIN_DATE;

  @Test void testTemporalBuckets() throws TransformException {
    RecordBatch batch = rawBatch(
        row(1, 86410L, 1.0),
        row(2, 2 * 86400L + 36000L, 1.0),
        row(3, -1L, 1.0),
        row(4, 7 * 86400L + 23 * 3600L + 3599L, 1.0));
    FeatureTransformer transformer = new FeatureTransformer(
        ImmutableList.<DerivationStep>of(
            new TemporalBucketStep(TransactionSchemas.TRANSACTION_DT, ORIGIN)));

    RecordBatch out = transformer.transform(batch);

    assertEquals(0, out.value(0, TransactionSchemas.HOUR_OF_DAY));
    assertEquals(1, out.value(0, TransactionSchemas.DAY_OF_WEEK));
    assertEquals(LocalDate.of(2017, 12, 2), out.value(0, TransactionSchemas.TXN_DATE));
    assertEquals(10, out.value(1, TransactionSchemas.HOUR_OF_DAY));
    assertEquals(2, out.value(1, TransactionSchemas.DAY_OF_WEEK));
    assertEquals(LocalDate.of(2017, 12, 3), out.value(1, TransactionSchemas.TXN_DATE));
    assertEquals(23, out.value(2, TransactionSchemas.HOUR_OF_DAY));
    assertEquals(6, out.value(2, TransactionSchemas.DAY_OF_WEEK));
    assertEquals(LocalDate.of(2017, 11, 30), out.value(2, TransactionSchemas.TXN_DATE));
    assertEquals(23, out.value(3, TransactionSchemas.HOUR_OF_DAY));
    assertEquals(0, out.value(3, TransactionSchemas.DAY_OF_WEEK));
  }

  @Test void testTemporalBucketsRejectNullSource() {
    Schema schema = Schema.builder().optional("dt", ColumnType.BIGINT).build();
    RecordBatch batch = RecordBatch.builder(schema).add(10L).add(new Object[] {null}).build();
    FeatureTransformer transformer = new FeatureTransformer(
        ImmutableList.<DerivationStep>of(new TemporalBucketStep("dt", ORIGIN)));
    TransformException e = assertThrows(TransformException.class,
        () -> transformer.transform(batch));
    assertEquals(TransformException.Kind.DERIVATION_FAILED, e.getKind());
    assertEquals("dt", e.getColumn());
  }

  @Test void testEntityAggregates() throws TransformException {
    RecordBatch batch = RecordBatch.builder(TransactionSchemas.raw())
        .add(1L, 0, 0L, 10.0, "W", 100L, null, null)
        .add(2L, 0, 0L, 5.0, "W", 200L, null, null)
        .add(3L, 0, 0L, 20.0, "W", 100L, null, null)
        .add(4L, 0, 0L, null, "W", 100L, null, null)
        .build();
    FeatureTransformer transformer = new FeatureTransformer(
        ImmutableList.<DerivationStep>of(
            new EntityAggregateStep(TransactionSchemas.CARD1,
                TransactionSchemas.TRANSACTION_AMT)));

    RecordBatch out = transformer.transform(batch);

    String count = TransactionSchemas.countColumn(TransactionSchemas.CARD1);
    String mean = TransactionSchemas.meanColumn(TransactionSchemas.CARD1);
    String std = TransactionSchemas.stdColumn(TransactionSchemas.CARD1);
    assertEquals(3L, out.value(0, count));
    assertEquals(15.0, out.value(0, mean));
    assertEquals(Math.sqrt(50.0), (Double) out.value(0, std), 1e-12);
    assertEquals(3L, out.value(3, count));
    assertEquals(1L, out.value(1, count));
    assertEquals(5.0, out.value(1, mean));
    assertNull(out.value(1, std));
  }

  @Test void testEntityAggregatesNullKey() throws TransformException {
    Schema schema = Schema.builder()
        .optional("key", ColumnType.VARCHAR)
        .optional("value", ColumnType.DOUBLE)
        .build();
    RecordBatch batch = RecordBatch.builder(schema).add(null, 1.0).add("a", 2.0).build();
    RecordBatch out = new FeatureTransformer(
        ImmutableList.<DerivationStep>of(new EntityAggregateStep("key", "value")))
        .transform(batch);
    assertNull(out.value(0, "key_txn_count"));
    assertNull(out.value(0, "key_amt_mean"));
    assertEquals(1L, out.value(1, "key_txn_count"));
  }

  @Test void testRatioNeverProducesInfinityOrNaN() throws TransformException {
    Schema schema = Schema.builder()
        .optional("num", ColumnType.DOUBLE)
        .optional("den", ColumnType.DOUBLE)
        .build();
    RecordBatch batch = RecordBatch.builder(schema)
        .add(10.0, 4.0)
        .add(10.0, 0.0)
        .add(null, 4.0)
        .add(10.0, null)
        .add(0.0, 0.0)
        .build();
    RecordBatch out = new FeatureTransformer(
        ImmutableList.<DerivationStep>of(new RatioStep("num", "den", "ratio")))
        .transform(batch);
    assertEquals(2.5, out.value(0, "ratio"));
    for (int r = 1; r < 5; r++) {
      assertNull(out.value(r, "ratio"));
    }
  }

  @Test void testCategoricalEncodings() throws TransformException {
    Schema schema = Schema.builder().optional("cat", ColumnType.VARCHAR).build();
    RecordBatch batch = RecordBatch.builder(schema)
        .add("W").add("C").add("W").add(new Object[] {null}).add("H")
        .build();
    RecordBatch out = new FeatureTransformer(
        ImmutableList.<DerivationStep>of(
            new CategoricalEncodingStep("cat", CategoricalEncodingStep.Encoding.ORDINAL),
            new CategoricalEncodingStep("cat", CategoricalEncodingStep.Encoding.FREQUENCY,
                "cat_freq")))
        .transform(batch);

    assertEquals(ColumnType.INTEGER, out.getSchema().column("cat_code").getType());
    assertEquals(ColumnType.BIGINT, out.getSchema().column("cat_freq").getType());
    assertEquals(2, out.value(0, "cat_code"));
    assertEquals(0, out.value(1, "cat_code"));
    assertEquals(1, out.value(4, "cat_code"));
    assertNull(out.value(3, "cat_code"));
    assertEquals(2L, out.value(0, "cat_freq"));
    assertEquals(1L, out.value(1, "cat_freq"));
    assertNull(out.value(3, "cat_freq"));
  }

  @Test void testMissingDependency() {
    FeatureTransformer transformer = new FeatureTransformer(
        ImmutableList.<DerivationStep>of(
            new RatioStep(TransactionSchemas.TRANSACTION_AMT,
                TransactionSchemas.meanColumn(TransactionSchemas.CARD1), "ratio"),
            new EntityAggregateStep(TransactionSchemas.CARD1,
                TransactionSchemas.TRANSACTION_AMT)));
    TransformException e = assertThrows(TransformException.class,
        () -> transformer.plan(TransactionSchemas.raw()));
    assertEquals(TransformException.Kind.MISSING_DEPENDENCY, e.getKind());
    assertEquals(TransactionSchemas.meanColumn(TransactionSchemas.CARD1), e.getColumn());
  }

  @Test void testDuplicateColumn() {
    FeatureTransformer transformer = new FeatureTransformer(
        ImmutableList.<DerivationStep>of(
            new RatioStep(TransactionSchemas.TRANSACTION_AMT, TransactionSchemas.TRANSACTION_DT,
                TransactionSchemas.CARD4)));
    TransformException e = assertThrows(TransformException.class,
        () -> transformer.plan(TransactionSchemas.raw()));
    assertEquals(TransformException.Kind.DUPLICATE_COLUMN, e.getKind());
    assertEquals(TransactionSchemas.CARD4, e.getColumn());
  }

  @Test void testDefaultStepsAreDeterministicAndKeepOrder() throws TransformException {
    RecordBatch batch = rawBatch(
        row(5, 86410L, 30.0),
        row(3, 90000L, 10.0),
        row(9, 200000L, null));
    String before = batch.fingerprint();
    FeatureTransformer transformer = new FeatureTransformer(TransactionFeatures.defaultSteps());

    RecordBatch first = transformer.transform(batch);
    RecordBatch second = transformer.transform(batch);

    assertEquals(before, batch.fingerprint());
    assertEquals(first.fingerprint(), second.fingerprint());
    assertEquals(transformer.plan(TransactionSchemas.raw()), first.getSchema());
    assertEquals(5L, first.value(0, TransactionSchemas.TRANSACTION_ID));
    assertEquals(3L, first.value(1, TransactionSchemas.TRANSACTION_ID));
    assertEquals(9L, first.value(2, TransactionSchemas.TRANSACTION_ID));
    assertEquals(1.5, first.value(0, TransactionSchemas.ratioColumn(TransactionSchemas.CARD1)));
    assertNull(first.value(2, TransactionSchemas.ratioColumn(TransactionSchemas.CARD1)));
  }

  @Test void testSignatureReflectsConfiguration() {
    String a = new FeatureTransformer(TransactionFeatures.defaultSteps()).signature();
    String b = new FeatureTransformer(TransactionFeatures.defaultSteps()).signature();
    String c = new FeatureTransformer(
        TransactionFeatures.defaultSteps(LocalDate.of(2018, 1, 1), TransactionSchemas.CARD1))
        .signature();
    assertEquals(a, b);
    assertNotEquals(a, c);
  }
}
