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

import org.apache.calcite.adapter.pipeline.analytics.AnalyticsRelation;
import org.apache.calcite.adapter.pipeline.batch.RecordBatch;
import org.apache.calcite.adapter.pipeline.schema.ColumnType;
import org.apache.calcite.adapter.pipeline.schema.Schema;
import org.apache.calcite.adapter.pipeline.storage.LocalFileStorageProvider;
import org.apache.calcite.adapter.pipeline.storage.StorageProvider;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link PartitionedMaterializer} writing Parquet through DuckDB.
 */
@Tag("integration")
public class PartitionedMaterializerTest {

  private static final Schema SCHEMA = Schema.builder()
      .required("id", ColumnType.BIGINT)
      .required("txn_date", ColumnType.DATE)
      .required("isFraud", ColumnType.INTEGER)
      .optional("amount", ColumnType.DOUBLE)
      .build();

  private static final LocalDate JAN1 = LocalDate.of(2018, 1, 1);
  private static final LocalDate JAN2 = LocalDate.of(2018, 1, 2);

  @TempDir
  Path tempDir;

  private StorageProvider storage;
  private String sink;

  @BeforeEach
  void setUp() {
    storage = new LocalFileStorageProvider();
    sink = tempDir.resolve("sink").toString();
  }

  private PartitionedMaterializer materializer(PartitionFileWriter writer) {
    return new PartitionedMaterializer("txn", storage, writer, 2, 2);
  }

  private static RecordBatch batch(double lastAmount) {
    return RecordBatch.builder(SCHEMA)
        .add(1L, JAN1, 0, 10.0)
        .add(2L, JAN2, 1, 20.0)
        .add(3L, JAN1, 1, null)
        .add(4L, JAN2, 0, lastAmount)
        .build();
  }

  private Path partitionFile(String partition) {
    return tempDir.resolve("sink").resolve(partition).resolve("part-00000.parquet");
  }

  @Test void testWritesHivePartitions() throws Exception {
    PartitionedMaterializer materializer =
        materializer(new DuckDBParquetPartitionWriter("zstd"));

    WriteSummary summary = materializer.write(batch(40.0),
        ColumnPartitionKeyFunction.of("txn_date"), sink);

    assertEquals(ImmutableList.of("txn_date=2018-01-01", "txn_date=2018-01-02"),
        summary.getPartitionsWritten());
    assertTrue(summary.getPartitionsUnchanged().isEmpty());
    assertEquals(4, summary.getRowsWritten());
    assertEquals(4, summary.getTotalRows());
    assertTrue(Files.exists(partitionFile("txn_date=2018-01-01")));
    assertTrue(Files.exists(partitionFile("txn_date=2018-01-02")));
    assertFalse(Files.exists(tempDir.resolve("sink")
        .resolve(PartitionedMaterializer.TEMPORARY_DIRECTORY)));
    assertTrue(Files.exists(tempDir.resolve("sink").resolve(PartitionManifest.FILE_NAME)));

    Map<String, String> metadata = DuckDBParquetPartitionWriter.readMetadata(
        partitionFile("txn_date=2018-01-01").toString());
    assertEquals(SCHEMA, Schema.fromJson(
        metadata.get(PartitionedMaterializer.SCHEMA_METADATA_KEY)));
    assertEquals(batch(40.0).select(ImmutableList.of(0, 2)).fingerprint(),
        metadata.get(PartitionedMaterializer.FINGERPRINT_METADATA_KEY));

    AnalyticsRelation relation = materializer.analyticsRelation(sink);
    assertTrue(relation.exists());
    assertEquals(4, relation.count());
  }

  @Test void testRewriteOfSameBatchIsNoOp() throws Exception {
    PartitionedMaterializer materializer =
        materializer(new DuckDBParquetPartitionWriter("snappy"));
    PartitionKeyFunction key = ColumnPartitionKeyFunction.of("txn_date");
    materializer.write(batch(40.0), key, sink);
    Path file = partitionFile("txn_date=2018-01-02");
    FileTime firstWrite = Files.getLastModifiedTime(file);

    WriteSummary second = materializer.write(batch(40.0), key, sink);

    assertTrue(second.isNoOp());
    assertEquals(2, second.getPartitionsUnchanged().size());
    assertEquals(0, second.getRowsWritten());
    assertEquals(4, second.getTotalRows());
    assertEquals(firstWrite, Files.getLastModifiedTime(file));
  }

  @Test void testChangedPartitionIsOverwritten() throws Exception {
    PartitionedMaterializer materializer =
        materializer(new DuckDBParquetPartitionWriter("zstd"));
    PartitionKeyFunction key = ColumnPartitionKeyFunction.of("txn_date");
    materializer.write(batch(40.0), key, sink);

    WriteSummary summary = materializer.write(batch(45.0), key, sink);

    assertEquals(ImmutableList.of("txn_date=2018-01-02"), summary.getPartitionsWritten());
    assertEquals(ImmutableList.of("txn_date=2018-01-01"), summary.getPartitionsUnchanged());
    assertEquals(2, summary.getRowsWritten());
    assertEquals(4, materializer.analyticsRelation(sink).count());

    PartitionManifest manifest = PartitionManifest.load(storage, sink, "txn");
    assertEquals(batch(45.0).select(ImmutableList.of(1, 3)).fingerprint(),
        manifest.get("txn_date=2018-01-02").getFingerprint());
    assertEquals(summary.getRunId(), manifest.getRunId());
  }

  @Test void testCompositeAndNullPartitionKeys() throws Exception {
    Schema schema = Schema.builder()
        .required("id", ColumnType.BIGINT)
        .optional("txn_date", ColumnType.DATE)
        .required("isFraud", ColumnType.INTEGER)
        .build();
    RecordBatch batch = RecordBatch.builder(schema)
        .add(1L, JAN1, 0)
        .add(2L, JAN1, 1)
        .add(3L, null, 0)
        .build();

    WriteSummary summary = materializer(new DuckDBParquetPartitionWriter("zstd"))
        .write(batch, ColumnPartitionKeyFunction.of("txn_date", "isFraud"), sink);

    assertEquals(ImmutableList.of("txn_date=2018-01-01/isFraud=0",
        "txn_date=2018-01-01/isFraud=1",
        "txn_date=" + PartitionKey.DEFAULT_PARTITION_NAME + "/isFraud=0"),
        summary.getPartitionsWritten());
    assertTrue(Files.exists(partitionFile("txn_date=2018-01-01/isFraud=1")));
  }

  @Test void testFailedPartitionLeavesNoPartialFile() throws Exception {
    DuckDBParquetPartitionWriter real = new DuckDBParquetPartitionWriter("zstd");
    PartitionFileWriter flaky = (rows, file, metadata) -> {
      if (file.contains("txn_date=2018-01-02")) {
        Files.write(Paths.get(file),
            "partial".getBytes(StandardCharsets.UTF_8));
        throw new IOException("disk full");
      }
      real.write(rows, file, metadata);
    };
    PartitionedMaterializer materializer = materializer(flaky);

    WriteException e = assertThrows(WriteException.class,
        () -> materializer.write(batch(40.0), ColumnPartitionKeyFunction.of("txn_date"), sink));

    assertTrue(e.isRetryable());
    assertEquals(ImmutableList.of("txn_date=2018-01-01"), e.getPartitionsWritten());
    assertTrue(e.getPartitionsFailed().containsKey("txn_date=2018-01-02"));
    assertFalse(Files.exists(partitionFile("txn_date=2018-01-02")));
    assertTrue(Files.exists(partitionFile("txn_date=2018-01-01")));
    assertFalse(Files.exists(tempDir.resolve("sink")
        .resolve(PartitionedMaterializer.TEMPORARY_DIRECTORY)));

    PartitionManifest manifest = PartitionManifest.load(storage, sink, "txn");
    assertNotNull(manifest.get("txn_date=2018-01-01"));
    assertNull(manifest.get("txn_date=2018-01-02"));
    assertEquals(2, materializer.analyticsRelation(sink).count());
  }

  @Test void testInterruptedWriteRecordsPartitionPromotedByRunningWriter() throws Exception {
    DuckDBParquetPartitionWriter real = new DuckDBParquetPartitionWriter("zstd");
    CountDownLatch writing = new CountDownLatch(1);
    CountDownLatch callerInterrupted = new CountDownLatch(1);
    PartitionFileWriter stubborn = (rows, file, metadata) -> {
      writing.countDown();
      while (true) {
        try {
          if (callerInterrupted.await(10, TimeUnit.SECONDS)) {
            break;
          }
        } catch (InterruptedException e) {
          // ignored until the caller has been interrupted
        }
      }
      Thread.interrupted();
      real.write(rows, file, metadata);
    };
    PartitionedMaterializer materializer =
        new PartitionedMaterializer("txn", storage, stubborn, 1, 1);

    AtomicReference<WriteException> error = new AtomicReference<>();
    AtomicBoolean interruptRestored = new AtomicBoolean();
    Thread caller = new Thread(() -> {
      try {
        materializer.write(batch(40.0), ColumnPartitionKeyFunction.of("txn_date"), sink);
      } catch (WriteException e) {
        error.set(e);
      }
      interruptRestored.set(Thread.currentThread().isInterrupted());
    });
    caller.start();
    assertTrue(writing.await(10, TimeUnit.SECONDS));
    caller.interrupt();
    Thread.sleep(200);
    callerInterrupted.countDown();
    caller.join(30_000);

    assertFalse(caller.isAlive());
    assertTrue(interruptRestored.get());
    WriteException e = error.get();
    assertNotNull(e);
    assertEquals(ImmutableList.of("txn_date=2018-01-01"), e.getPartitionsWritten());
    assertEquals("interrupted", e.getPartitionsFailed().get("txn_date=2018-01-02"));
    assertTrue(Files.exists(partitionFile("txn_date=2018-01-01")));
    assertFalse(Files.exists(partitionFile("txn_date=2018-01-02")));
    assertFalse(Files.exists(tempDir.resolve("sink")
        .resolve(PartitionedMaterializer.TEMPORARY_DIRECTORY)));

    PartitionManifest manifest = PartitionManifest.load(storage, sink, "txn");
    assertNotNull(manifest.get("txn_date=2018-01-01"));
    assertNull(manifest.get("txn_date=2018-01-02"));
    assertEquals(2, materializer.analyticsRelation(sink).count());
  }

  @Test void testGroupKeepsFirstSeenAndRowOrder() {
    Map<PartitionKey, List<Integer>> groups = PartitionedMaterializer.group(batch(1.0),
        ColumnPartitionKeyFunction.of("txn_date"));
    List<PartitionKey> keys = ImmutableList.copyOf(groups.keySet());
    assertEquals("txn_date=2018-01-01", keys.get(0).toPath());
    assertEquals(ImmutableList.of(0, 2), groups.get(keys.get(0)));
    assertEquals(ImmutableList.of(1, 3), groups.get(keys.get(1)));
  }
}
