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

import org.apache.calcite.adapter.pipeline.schema.TransactionSchemas;

import com.google.common.collect.ImmutableList;

import java.time.LocalDate;
import java.util.List;

/**
 * Default feature steps for the transaction dataset.
 */
public final class TransactionFeatures {
  /** Reference date that {@code TransactionDT} offsets count from. */
  public static final LocalDate DEFAULT_ORIGIN_DATE = LocalDate.of(2017, 12, 1);

  private TransactionFeatures() {
  }

  /**
   * Returns the default steps: temporal buckets of {@code TransactionDT},
   * per-entity amount aggregates, the amount to entity mean ratio, and
   * ordinal codes of {@code ProductCD} and {@code card4}.
   */
  public static List<DerivationStep> defaultSteps(LocalDate originDate, String entityKey) {
    return ImmutableList.of(
        new TemporalBucketStep(TransactionSchemas.TRANSACTION_DT, originDate),
        new EntityAggregateStep(entityKey, TransactionSchemas.TRANSACTION_AMT),
        new RatioStep(TransactionSchemas.TRANSACTION_AMT,
            TransactionSchemas.meanColumn(entityKey),
            TransactionSchemas.ratioColumn(entityKey)),
        new CategoricalEncodingStep(TransactionSchemas.PRODUCT_CD,
            CategoricalEncodingStep.Encoding.ORDINAL),
        new CategoricalEncodingStep(TransactionSchemas.CARD4,
            CategoricalEncodingStep.Encoding.ORDINAL));
  }

  public static List<DerivationStep> defaultSteps() {
    return defaultSteps(DEFAULT_ORIGIN_DATE, TransactionSchemas.CARD1);
  }
}
