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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Schemas of the card-transaction dataset.
 *
 * <p>The raw layout follows the {@code train_transaction} file of the
 * IEEE-CIS fraud detection data: {@code TransactionDT} is an offset in
 * seconds from a reference instant and {@code isFraud} is the label.
 */
public final class TransactionSchemas {
  public static final String TRANSACTION_ID = "TransactionID";
  public static final String IS_FRAUD = "isFraud";
  public static final String TRANSACTION_DT = "TransactionDT";
  public static final String TRANSACTION_AMT = "TransactionAmt";
  public static final String PRODUCT_CD = "ProductCD";
  public static final String CARD1 = "card1";
  public static final String CARD4 = "card4";
  public static final String P_EMAIL_DOMAIN = "P_emaildomain";

  public static final String HOUR_OF_DAY = "hour_of_day";
  public static final String DAY_OF_WEEK = "day_of_week";
  public static final String TXN_DATE = "txn_date";

  private TransactionSchemas() {
  }

  public static Schema raw() {
    return Schema.builder()
        .required(TRANSACTION_ID, ColumnType.BIGINT)
        .required(IS_FRAUD, ColumnType.INTEGER)
        .required(TRANSACTION_DT, ColumnType.BIGINT)
        .optional(TRANSACTION_AMT, ColumnType.DOUBLE)
        .required(PRODUCT_CD, ColumnType.VARCHAR)
        .required(CARD1, ColumnType.BIGINT)
        .optional(CARD4, ColumnType.VARCHAR)
        .optional(P_EMAIL_DOMAIN, ColumnType.VARCHAR)
        .build();
  }

  /** Name of the per-entity transaction count column. */
  public static String countColumn(String entityKey) {
    return entityKey + "_txn_count";
  }

  public static String meanColumn(String entityKey) {
    return entityKey + "_amt_mean";
  }

  public static String stdColumn(String entityKey) {
    return entityKey + "_amt_std";
  }

  public static String ratioColumn(String entityKey) {
    return "amt_to_" + entityKey + "_mean";
  }

  public static String codeColumn(String column) {
    return column + "_code";
  }

  /** Columns derived by the default feature steps, in derivation order. */
  public static List<ColumnSpec> derivedColumns(String entityKey) {
    return ImmutableList.of(
        ColumnSpec.required(HOUR_OF_DAY, ColumnType.INTEGER),
        ColumnSpec.required(DAY_OF_WEEK, ColumnType.INTEGER),
        ColumnSpec.required(TXN_DATE, ColumnType.DATE),
        ColumnSpec.optional(countColumn(entityKey), ColumnType.BIGINT),
        ColumnSpec.optional(meanColumn(entityKey), ColumnType.DOUBLE),
        ColumnSpec.optional(stdColumn(entityKey), ColumnType.DOUBLE),
        ColumnSpec.optional(ratioColumn(entityKey), ColumnType.DOUBLE),
        ColumnSpec.optional(codeColumn(PRODUCT_CD), ColumnType.INTEGER),
        ColumnSpec.optional(codeColumn(CARD4), ColumnType.INTEGER));
  }

  public static Schema feature(String entityKey) {
    return raw().extend(derivedColumns(entityKey));
  }

  public static Schema feature() {
    return feature(CARD1);
  }
}
