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
package org.apache.calcite.adapter.pipeline.analytics;

import org.apache.calcite.adapter.pipeline.batch.RecordBatch;
import org.apache.calcite.adapter.pipeline.materialize.DuckDBParquetPartitionWriter;
import org.apache.calcite.adapter.pipeline.schema.ColumnType;
import org.apache.calcite.adapter.pipeline.schema.Schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Collections;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link AnalyticsRelation} and {@link AnalyticsSchemaFactory}.
 */
@Tag("integration")
public class AnalyticsSchemaFactoryTest {

  private static final Schema SCHEMA = Schema.builder()
      .required("TransactionID", ColumnType.BIGINT)
      .optional("TransactionAmt", ColumnType.DOUBLE)
      .build();

  @TempDir
  Path tempDir;

  private AnalyticsRelation writeSink() throws Exception {
    Path sink = tempDir.resolve("sink");
    Path partition = sink.resolve("txn_date=2017-12-02");
    Files.createDirectories(partition);
    String file = partition.resolve("part-00000.parquet").toString();
    RecordBatch batch = RecordBatch.builder(SCHEMA)
        .add(2987000L, 68.5)
        .add(2987001L, 29.0)
        .add(2987002L, null)
        .build();
    new DuckDBParquetPartitionWriter("zstd").write(batch, file, ImmutableMap.of());

    AnalyticsRelation relation = AnalyticsRelation.forSink(sink.toString(), "txn");
    relation.refresh(ImmutableList.of(file));
    return relation;
  }

  @Test void testRefreshAndDrop() throws Exception {
    AnalyticsRelation relation = writeSink();
    assertTrue(relation.exists());
    assertEquals(3, relation.count());

    relation.refresh(Collections.<String>emptyList());
    assertFalse(relation.exists());
  }

  @Test void testQueryThroughCalcite() throws Exception {
    AnalyticsRelation relation = writeSink();
    String model = "inline:{\"version\":\"1.0\",\"defaultSchema\":\"analytics\","
        + "\"schemas\":[{\"name\":\"analytics\",\"type\":\"custom\","
        + "\"factory\":\"" + AnalyticsSchemaFactory.class.getName() + "\","
        + "\"operand\":{\"database\":\""
        + relation.getDatabaseFile().toAbsolutePath().toString().replace("\\", "\\\\")
        + "\"}}]}";
    Properties info = new Properties();
    info.setProperty("model", model);

    try (Connection connection = DriverManager.getConnection("jdbc:calcite:", info);
         Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery(
             "select count(*) from \"analytics\".\"txn\" where \"TransactionAmt\" > 30")) {
      assertTrue(rs.next());
      assertEquals(1, rs.getLong(1));
    }
  }

  @Test void testOperandIsRequired() {
    assertThrows(IllegalArgumentException.class,
        () -> AnalyticsSchemaFactory.INSTANCE.create(null, "analytics",
            ImmutableMap.<String, Object>of()));
  }
}
