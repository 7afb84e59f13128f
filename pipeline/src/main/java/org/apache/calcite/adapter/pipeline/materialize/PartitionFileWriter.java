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

import org.apache.calcite.adapter.pipeline.batch.RecordBatch;

import java.io.IOException;
import java.util.Map;

/**
 * Writes the rows of one partition to one columnar file.
 *
 * <p>Called concurrently from the materializer's worker pool, once per
 * partition; implementations must be thread-safe.
 */
public interface PartitionFileWriter {

  /**
   * Writes a file, keeping row order.
   *
   * @param rows Rows of the partition
   * @param file Path of the file to create
   * @param metadata Key/value metadata to embed in the file
   * @throws IOException If the file cannot be written
   */
  void write(RecordBatch rows, String file, Map<String, String> metadata) throws IOException;

  /** File name used for a partition's data file. */
  default String fileName() {
    return "part-00000.parquet";
  }
}
