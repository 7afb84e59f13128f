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
package org.apache.calcite.adapter.pipeline.staging;

import org.apache.calcite.adapter.pipeline.batch.RecordBatch;
import org.apache.calcite.adapter.pipeline.schema.ColumnSpec;
import org.apache.calcite.adapter.pipeline.schema.Schema;
import org.apache.calcite.adapter.pipeline.schema.SchemaException;
import org.apache.calcite.adapter.pipeline.schema.SchemaRegistry;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Reads a {@link RawSource} into the staging relation.
 *
 * <p>The source is read in chunks of {@code chunkSize} rows. Each cell is
 * parsed by the type of its raw-schema column, each chunk is checked by
 * {@link SchemaRegistry#validate} and appended to a table private to this
 * load. Once the source is exhausted that table replaces
 * {@code <pipeline>_staged}, and the returned batch is read back from it in
 * source order. A load that fails or is interrupted leaves the previous
 * {@code <pipeline>_staged} untouched.
 *
 * <p>Rows that cannot be parsed either abort the load
 * ({@link MalformedRowPolicy#FAIL_FAST}) or go to the quarantine file
 * ({@link MalformedRowPolicy#QUARANTINE}). The quarantine file of an earlier
 * load is removed when a new load starts.
 */
public class StagingLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(StagingLoader.class);

  private final SchemaRegistry registry;
  private final DuckDBStagingStore store;
  private final int chunkSize;
  private final MalformedRowPolicy policy;
  private final Path quarantineDirectory;

  public StagingLoader(SchemaRegistry registry, DuckDBStagingStore store, int chunkSize,
      MalformedRowPolicy policy, Path quarantineDirectory) {
    Preconditions.checkArgument(chunkSize > 0, "chunkSize must be positive: %s", chunkSize);
    this.registry = registry;
    this.store = store;
    this.chunkSize = chunkSize;
    this.policy = policy;
    this.quarantineDirectory = quarantineDirectory;
  }

  /** Name of the staging table for a pipeline. */
  public static String stagingTable(String pipelineName) {
    return pipelineName + "_staged";
  }

  /** Prefix of the tables that loads write to before replacing the staging table. */
  public static String attemptTablePrefix(String pipelineName) {
    return stagingTable(pipelineName) + "__attempt_";
  }

  /** Path of the quarantine file for a pipeline. */
  public Path quarantineFile(String pipelineName) {
    return quarantineDirectory.resolve(pipelineName + ".jsonl");
  }

  /**
   * Loads the source into the staging relation.
   *
   * @param source Source to read
   * @param pipelineName Name used for the staging table and quarantine file
   * @return The staged relation and row counts
   * @throws LoadException if the source is unreachable, a row is malformed
   *     under {@link MalformedRowPolicy#FAIL_FAST}, or staging fails
   * @throws InterruptedException if the loading thread was interrupted;
   *     checked before every chunk and before the staging table is replaced
   */
  public StagingResult load(RawSource source, String pipelineName)
      throws LoadException, InterruptedException {
    Schema raw = registry.raw();
    String table = stagingTable(pipelineName);
    String attemptTable = attemptTablePrefix(pipelineName)
        + UUID.randomUUID().toString().substring(0, 8);
    LOGGER.info("Staging {} into table {} (chunkSize={}, policy={})",
        source.getLocation(), table, chunkSize, policy);

    Path quarantineFile = quarantineFile(pipelineName);
    try {
      if (Files.deleteIfExists(quarantineFile)) {
        LOGGER.debug("Removed quarantine file {} of an earlier load", quarantineFile);
      }
    } catch (IOException e) {
      throw LoadException.staging(quarantineFile.toString(), e);
    }

    long rowsRead = 0;
    long quarantined;
    try (RawRowReader reader = source.open();
         QuarantineWriter quarantine = new QuarantineWriter(quarantineFile)) {
      int[] sourceIndex = mapHeader(raw, reader.getHeader());
      dropAbandoned(pipelineName);
      resetTable(attemptTable, raw);
      try {
        List<Object[]> chunk = new ArrayList<>(chunkSize);
        List<Long> chunkRowIndexes = new ArrayList<>(chunkSize);
        RawRowReader.RawRecord record;
        while ((record = reader.next()) != null) {
          rowsRead++;
          Object[] parsed;
          try {
            parsed = parse(raw, sourceIndex, reader.getHeader().size(), record);
          } catch (LoadException e) {
            if (policy == MalformedRowPolicy.FAIL_FAST) {
              throw e;
            }
            quarantine(quarantine, record, e);
            continue;
          }
          chunk.add(parsed);
          chunkRowIndexes.add(record.getRowIndex());
          if (chunk.size() >= chunkSize) {
            checkInterrupted(attemptTable);
            flush(attemptTable, raw, chunk, chunkRowIndexes);
          }
        }
        checkInterrupted(attemptTable);
        flush(attemptTable, raw, chunk, chunkRowIndexes);
        quarantined = quarantine.getCount();
        checkInterrupted(attemptTable);
        store.swap(attemptTable, table);
      } catch (SQLException e) {
        LoadException failure = LoadException.staging(table, e);
        discard(attemptTable, failure);
        throw failure;
      } catch (IOException | LoadException | InterruptedException | RuntimeException e) {
        discard(attemptTable, e);
        throw e;
      }
    } catch (IOException e) {
      throw LoadException.unreachable(source.getLocation(), e);
    }

    RecordBatch batch;
    try {
      batch = store.read(table, raw);
    } catch (SQLException e) {
      throw LoadException.staging(table, e);
    }
    if (quarantined > 0) {
      LOGGER.warn("Quarantined {} of {} rows from {}", quarantined, rowsRead,
          source.getLocation());
    }
    LOGGER.info("Staged {} rows from {} into {}", batch.rowCount(), source.getLocation(), table);
    return new StagingResult(batch, rowsRead, quarantined, table);
  }

  private static void checkInterrupted(String attemptTable) throws InterruptedException {
    if (Thread.interrupted()) {
      throw new InterruptedException("Interrupted while staging into " + attemptTable);
    }
  }

  /** Drops the table of a failed load; a failure to drop is attached to the load's error. */
  private void discard(String attemptTable, Exception failure) {
    try {
      store.drop(attemptTable);
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
    LOGGER.debug("Discarded {} after failed load: {}", attemptTable, failure.getMessage());
  }

  private static void quarantine(QuarantineWriter quarantine, RawRowReader.RawRecord record,
      LoadException error) throws LoadException {
    try {
      quarantine.write(record.getRowIndex(), error.getReason(), record.getValues());
    } catch (IOException e) {
      throw LoadException.staging(quarantine.getFile().toString(), e);
    }
    LOGGER.debug("Quarantined row {}: {}", record.getRowIndex(), error.getReason());
  }

  /** Drops tables left behind by loads of this pipeline that never finished. */
  private void dropAbandoned(String pipelineName) throws LoadException {
    String prefix = attemptTablePrefix(pipelineName);
    try {
      for (String abandoned : store.tables(prefix)) {
        LOGGER.warn("Dropping table {} of an unfinished load", abandoned);
        store.drop(abandoned);
      }
    } catch (SQLException e) {
      throw LoadException.staging(prefix + "*", e);
    }
  }

  private void resetTable(String table, Schema raw) throws LoadException {
    try {
      store.reset(table, raw);
    } catch (SQLException e) {
      throw LoadException.staging(table, e);
    }
  }

  /** Maps each raw column to its position in the source header. */
  private static int[] mapHeader(Schema raw, List<String> header) throws LoadException {
    int[] sourceIndex = new int[raw.size()];
    for (int c = 0; c < raw.size(); c++) {
      ColumnSpec column = raw.get(c);
      int index = header.indexOf(column.getName());
      if (index < 0) {
        SchemaException cause = new SchemaException(column.getName(),
            column.getType().sqlName(), "<absent>", 0);
        throw LoadException.malformed(0, "header is missing column '"
            + column.getName() + "'", cause);
      }
      sourceIndex[c] = index;
    }
    return sourceIndex;
  }

  private static Object[] parse(Schema raw, int[] sourceIndex, int width,
      RawRowReader.RawRecord record) throws LoadException {
    long rowIndex = record.getRowIndex();
    String[] values = record.getValues();
    if (values == null) {
      throw LoadException.malformed(rowIndex, "unreadable record: " + record.getError(), null);
    }
    if (values.length != width) {
      throw LoadException.malformed(rowIndex, "expected " + width + " fields, found "
          + values.length, null);
    }
    Object[] row = new Object[raw.size()];
    for (int c = 0; c < raw.size(); c++) {
      ColumnSpec column = raw.get(c);
      String text = values[sourceIndex[c]];
      Object value;
      try {
        value = column.getType().parse(text);
      } catch (IllegalArgumentException e) {
        SchemaException cause = new SchemaException(column.getName(),
            column.getType().sqlName(), "'" + text + "'", rowIndex);
        throw LoadException.malformed(rowIndex, "column '" + column.getName() + "': "
            + e.getMessage(), cause);
      }
      if (value == null && !column.isNullable()) {
        SchemaException cause = new SchemaException(column.getName(), "NOT NULL", "null",
            rowIndex);
        throw LoadException.malformed(rowIndex, "column '" + column.getName()
            + "' is null", cause);
      }
      row[c] = value;
    }
    return row;
  }

  private void flush(String table, Schema raw, List<Object[]> chunk,
      List<Long> chunkRowIndexes) throws LoadException {
    if (chunk.isEmpty()) {
      return;
    }
    RecordBatch batch;
    try {
      batch = registry.validate(RecordBatch.of(raw, chunk), raw);
    } catch (SchemaException e) {
      long rowIndex = e.getRowIndex() >= 0 ? chunkRowIndexes.get((int) e.getRowIndex()) : -1;
      throw LoadException.malformed(rowIndex, e.getMessage(), e);
    }
    long[] rowIndexes = new long[chunkRowIndexes.size()];
    for (int i = 0; i < rowIndexes.length; i++) {
      rowIndexes[i] = chunkRowIndexes.get(i);
    }
    try {
      store.append(table, batch, rowIndexes);
    } catch (SQLException e) {
      throw LoadException.staging(table, e);
    }
    LOGGER.debug("Appended chunk of {} rows to {} (last row {})", rowIndexes.length, table,
        rowIndexes[rowIndexes.length - 1]);
    chunk.clear();
    chunkRowIndexes.clear();
  }

  @Override public String toString() {
    return "StagingLoader{chunkSize=" + chunkSize + ", policy=" + policy + "}";
  }
}
