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

import org.apache.calcite.adapter.pipeline.schema.TransactionSchemas;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Default data-quality rules for transaction features.
 */
public final class TransactionRules {
  private TransactionRules() {
  }

  public static List<ValidationRule> defaults() {
    return ImmutableList.of(
        new NotNullRule("transaction_id_present", TransactionSchemas.TRANSACTION_ID,
            Severity.CRITICAL),
        new UniqueRule("transaction_id_unique",
            ImmutableList.of(TransactionSchemas.TRANSACTION_ID), Severity.CRITICAL),
        new RangeRule("amount_non_negative", TransactionSchemas.TRANSACTION_AMT,
            0d, null, Severity.CRITICAL),
        new AllowedValuesRule("is_fraud_label", TransactionSchemas.IS_FRAUD,
            ImmutableList.of(0, 1), Severity.CRITICAL),
        new RangeRule("hour_of_day_range", TransactionSchemas.HOUR_OF_DAY,
            0d, 23d, Severity.CRITICAL),
        new NotNullRule("amount_present", TransactionSchemas.TRANSACTION_AMT,
            Severity.WARNING),
        new AllowedValuesRule("product_code_known", TransactionSchemas.PRODUCT_CD,
            ImmutableList.of("W", "C", "R", "H", "S"), Severity.WARNING));
  }
}
