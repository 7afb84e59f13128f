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

import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Side output for rows rejected by the staging loader.
 *
 * <p>Writes JSON Lines, one object per rejected row:
 * <pre>{@code
 * {"rowIndex":17,"reason":"column 'TransactionAmt': Not a DOUBLE: 'abc'","values":["17","0",...]}
 * }</pre>
 *
 * <p>The file is created on the first rejected row, so a load without
 * rejected rows writes nothing. {@link StagingLoader} deletes the file of an
 * earlier load before it opens a writer.
 */
public class QuarantineWriter implements Closeable {
  private static final Logger LOGGER = LoggerFactory.getLogger(QuarantineWriter.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Path file;
  private @Nullable BufferedWriter writer;
  private long count;

  public QuarantineWriter(Path file) {
    this.file = file;
  }

  public Path getFile() {
    return file;
  }

  /** Number of rows written so far. */
  public long getCount() {
    return count;
  }

  /**
   * Appends one rejected row.
   *
   * @param rowIndex Data row index in the source
   * @param reason Why the row was rejected
   * @param values Raw cell values, or null when the row could not be tokenized
   */
  public void write(long rowIndex, String reason, String @Nullable [] values)
      throws IOException {
    if (writer == null) {
      Path parent = file.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
          StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
          StandardOpenOption.WRITE);
      LOGGER.info("Quarantining malformed rows to {}", file);
    }
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("rowIndex", rowIndex);
    entry.put("reason", reason);
    entry.put("values", values == null ? null : Arrays.asList(values));
    writer.write(MAPPER.writeValueAsString(entry));
    writer.newLine();
    count++;
  }

  @Override public void close() throws IOException {
    if (writer != null) {
      writer.close();
      writer = null;
    }
  }
}
