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
import org.apache.calcite.adapter.pipeline.batch.Row;
import org.apache.calcite.adapter.pipeline.storage.StorageProvider;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Writes a validated batch as one Parquet file per partition.
 *
 * <p>For every partition:
 * <ol>
 *   <li>The partition rows are fingerprinted. If the sink manifest records
 *       the same fingerprint and the file exists, the partition is left
 *       alone.</li>
 *   <li>Otherwise the file is written under
 *       {@code <sink>/_temporary/<runId>/<partition>/} and then moved
 *       atomically to {@code <sink>/<partition>/part-00000.parquet},
 *       replacing the previous file.</li>
 * </ol>
 *
 * <p>Partitions are written concurrently by a pool of {@code concurrency}
 * threads, and each one is attempted up to {@code writeAttempts} times. The
 * run's temporary directory is removed on every exit path. The manifest is
 * saved after the writes, recording every promoted partition, and the
 * analytics view is re-pointed at the manifest's files.
 *
 * <p>If the calling thread is interrupted, the pool is shut down and the
 * writers are given time to stop before the temporary directory is removed.
 * Partitions that a writer promoted before stopping are still recorded in
 * the manifest. The interrupt is restored once the manifest is saved.
 */
public class PartitionedMaterializer {
  private static final Logger LOGGER = LoggerFactory.getLogger(PartitionedMaterializer.class);

  /** Directory under the sink for in-progress files. */
  public static final String TEMPORARY_DIRECTORY = "_temporary";

  /** How long an interrupted write waits for its writers to stop. */
  private static final long WRITER_STOP_TIMEOUT_SECONDS = 60;

  /** Parquet key/value metadata key holding the schema JSON. */
  public static final String SCHEMA_METADATA_KEY = "pipeline_schema";

  /** Parquet key/value metadata key holding the partition fingerprint. */
  public static final String FINGERPRINT_METADATA_KEY = "pipeline_fingerprint";

  private final String pipelineName;
  private final StorageProvider storage;
  private final PartitionFileWriter fileWriter;
  private final int concurrency;
  private final int writeAttempts;

  public PartitionedMaterializer(String pipelineName, StorageProvider storage,
      PartitionFileWriter fileWriter, int concurrency, int writeAttempts) {
    Preconditions.checkArgument(concurrency > 0, "concurrency must be positive: %s", concurrency);
    Preconditions.checkArgument(writeAttempts > 0, "writeAttempts must be positive: %s",
        writeAttempts);
    this.pipelineName = pipelineName;
    this.storage = storage;
    this.fileWriter = fileWriter;
    this.concurrency = concurrency;
    this.writeAttempts = writeAttempts;
  }

  /** Returns the analytics relation of a sink for this pipeline. */
  public AnalyticsRelation analyticsRelation(String sink) {
    return AnalyticsRelation.forSink(sink, pipelineName);
  }

  /**
   * Writes a batch to a sink.
   *
   * @param batch Validated rows
   * @param keyFunction Maps rows to partitions
   * @param sink Sink root
   * @return Summary of written and unchanged partitions
   * @throws WriteException if any partition could not be written; partitions
   *     listed in the exception as written were promoted
   */
  public WriteSummary write(RecordBatch batch, PartitionKeyFunction keyFunction, String sink)
      throws WriteException {
    long start = System.currentTimeMillis();
    String runId = new SimpleDateFormat("yyyyMMdd_HHmmss").format(new Date())
        + "_" + UUID.randomUUID().toString().substring(0, 8);
    String tempBase = storage.resolvePath(storage.resolvePath(sink, TEMPORARY_DIRECTORY), runId);

    Map<PartitionKey, List<Integer>> groups = group(batch, keyFunction);
    LOGGER.info("Materializing {} rows into {} partitions under {} ({} storage, run {})",
        batch.rowCount(), groups.size(), sink, storage.getStorageType(), runId);

    PartitionManifest manifest;
    try {
      storage.createDirectories(sink);
      manifest = PartitionManifest.load(storage, sink, pipelineName);
    } catch (IOException e) {
      throw new WriteException("Cannot read manifest of sink " + sink + ": " + e.getMessage(),
          new ArrayList<>(), ImmutableMap.<String, String>of(), e);
    }

    String schemaJson = batch.getSchema().toJson();
    List<String> written = new ArrayList<>();
    List<String> unchanged = new ArrayList<>();
    Map<String, String> failed = new LinkedHashMap<>();
    Throwable firstError = null;
    long rowsWritten = 0;

    boolean interrupted = false;
    Map<String, Future<PartitionManifest.Entry>> futures = new LinkedHashMap<>();
    ExecutorService pool = Executors.newFixedThreadPool(concurrency,
        new ThreadFactoryBuilder().setNameFormat(pipelineName + "-writer-%d").setDaemon(true)
            .build());
    try {
      for (Map.Entry<PartitionKey, List<Integer>> group : groups.entrySet()) {
        String partitionPath = group.getKey().toPath();
        RecordBatch rows = batch.select(group.getValue());
        String fingerprint = rows.fingerprint();
        String finalFile = storage.resolvePath(storage.resolvePath(sink, partitionPath),
            fileWriter.fileName());
        PartitionManifest.Entry previous = manifest.get(partitionPath);
        if (previous != null && previous.getFingerprint().equals(fingerprint)
            && storage.exists(finalFile)) {
          LOGGER.debug("Partition {} unchanged (fingerprint {})", partitionPath, fingerprint);
          unchanged.add(partitionPath);
          continue;
        }
        String tempDir = storage.resolvePath(tempBase, partitionPath);
        Map<String, String> metadata = ImmutableMap.of(
            SCHEMA_METADATA_KEY, schemaJson,
            FINGERPRINT_METADATA_KEY, fingerprint);
        futures.put(partitionPath, pool.submit(() ->
            writePartition(partitionPath, rows, tempDir, finalFile, fingerprint, metadata)));
      }

      for (Map.Entry<String, Future<PartitionManifest.Entry>> f : futures.entrySet()) {
        try {
          PartitionManifest.Entry entry = f.getValue().get();
          manifest.put(f.getKey(), entry);
          written.add(f.getKey());
          rowsWritten += entry.getRowCount();
        } catch (ExecutionException e) {
          Throwable cause = e.getCause() != null ? e.getCause() : e;
          LOGGER.error("Partition {} failed after {} attempt(s): {}", f.getKey(),
              writeAttempts, cause.getMessage(), cause);
          failed.put(f.getKey(), String.valueOf(cause.getMessage()));
          if (firstError == null) {
            firstError = cause;
          }
        }
      }
    } catch (InterruptedException e) {
      interrupted = true;
      firstError = e;
      pool.shutdownNow();
      awaitWriters(pool);
      // writers that finished before stopping have promoted their file
      for (Map.Entry<String, Future<PartitionManifest.Entry>> f : futures.entrySet()) {
        Future<PartitionManifest.Entry> future = f.getValue();
        if (written.contains(f.getKey()) || failed.containsKey(f.getKey())
            || !future.isDone() || future.isCancelled()) {
          continue;
        }
        try {
          PartitionManifest.Entry entry = future.get();
          manifest.put(f.getKey(), entry);
          written.add(f.getKey());
          rowsWritten += entry.getRowCount();
        } catch (ExecutionException | InterruptedException failure) {
          failed.put(f.getKey(), String.valueOf(failure.getMessage()));
        }
      }
      for (Map.Entry<PartitionKey, List<Integer>> group : groups.entrySet()) {
        String path = group.getKey().toPath();
        if (!written.contains(path) && !unchanged.contains(path) && !failed.containsKey(path)) {
          failed.put(path, "interrupted");
        }
      }
    } catch (IOException e) {
      failed.put("<sink>", String.valueOf(e.getMessage()));
      firstError = e;
    } finally {
      pool.shutdownNow();
      cleanTemporary(sink, tempBase);
    }

    try {
      try {
        manifest.setRunId(runId);
        manifest.save(storage, sink);
        analyticsRelation(sink).refresh(manifest.files());
      } catch (IOException e) {
        throw new WriteException("Cannot publish partitions of run " + runId + ": "
            + e.getMessage(), written, failed, e);
      }

      if (!failed.isEmpty()) {
        throw new WriteException("Materialization of run " + runId + " wrote "
            + written.size() + " partition(s) and failed " + failed.size() + ": "
            + failed.keySet(), written, failed, firstError);
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    WriteSummary summary = new WriteSummary(runId, written, unchanged, rowsWritten,
        manifest.totalRows(), manifest.files(), System.currentTimeMillis() - start);
    LOGGER.info("Materialization complete: {}", summary);
    return summary;
  }

  /** Groups row indexes by partition, keeping first-seen and row order. */
  static Map<PartitionKey, List<Integer>> group(RecordBatch batch,
      PartitionKeyFunction keyFunction) {
    Map<PartitionKey, List<Integer>> groups = new LinkedHashMap<>();
    for (Row row : batch) {
      groups.computeIfAbsent(keyFunction.apply(row), k -> new ArrayList<>())
          .add(row.getIndex());
    }
    return groups;
  }

  private PartitionManifest.Entry writePartition(String partitionPath, RecordBatch rows,
      String tempDir, String finalFile, String fingerprint, Map<String, String> metadata)
      throws IOException {
    String tempFile = storage.resolvePath(tempDir, fileWriter.fileName());
    IOException last = null;
    for (int attempt = 1; attempt <= writeAttempts; attempt++) {
      try {
        storage.createDirectories(tempDir);
        fileWriter.write(rows, tempFile, metadata);
        storage.moveAtomic(tempFile, finalFile);
        LOGGER.debug("Promoted partition {} ({} rows) on attempt {}", partitionPath,
            rows.rowCount(), attempt);
        return new PartitionManifest.Entry(fingerprint, rows.rowCount(), finalFile,
            System.currentTimeMillis());
      } catch (IOException e) {
        last = e;
        LOGGER.warn("Attempt {}/{} to write partition {} failed: {}", attempt, writeAttempts,
            partitionPath, e.getMessage());
        discard(tempFile);
        if (Thread.currentThread().isInterrupted()) {
          break;
        }
      }
    }
    throw last;
  }

  private void discard(String tempFile) {
    try {
      storage.delete(tempFile);
    } catch (IOException e) {
      LOGGER.warn("Cannot delete temporary file {}: {}", tempFile, e.getMessage());
    }
  }

  /** Waits for writers to stop after {@link ExecutorService#shutdownNow()}. */
  private void awaitWriters(ExecutorService pool) {
    try {
      if (!pool.awaitTermination(WRITER_STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        LOGGER.warn("Partition writers of {} still running {}s after interrupt", pipelineName,
            WRITER_STOP_TIMEOUT_SECONDS);
      }
    } catch (InterruptedException e) {
      LOGGER.warn("Interrupted again while waiting for partition writers of {} to stop",
          pipelineName);
    }
  }

  private void cleanTemporary(String sink, String tempBase) {
    String tempRoot = storage.resolvePath(sink, TEMPORARY_DIRECTORY);
    try {
      storage.delete(tempBase);
      if (storage.listFiles(tempRoot, false).isEmpty()) {
        storage.delete(tempRoot);
      }
    } catch (IOException e) {
      LOGGER.warn("Cannot remove temporary directory {}: {}", tempBase, e.getMessage());
    }
  }

  @Override public String toString() {
    return "PartitionedMaterializer{pipeline=" + pipelineName + ", concurrency=" + concurrency
        + ", writeAttempts=" + writeAttempts + ", writer=" + fileWriter + "}";
  }
}
