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

/**
 * Outcome of one staging load.
 */
public class StagingResult {
  private final RecordBatch batch;
  private final long rowsRead;
  private final long rowsQuarantined;
  private final String table;

  public StagingResult(RecordBatch batch, long rowsRead, long rowsQuarantined, String table) {
    this.batch = batch;
    this.rowsRead = rowsRead;
    this.rowsQuarantined = rowsQuarantined;
    this.table = table;
  }

  /** The staged relation, conforming to the raw schema, in source order. */
  public RecordBatch getBatch() {
    return batch;
  }

  /** Data rows read from the source, including quarantined ones. */
  public long getRowsRead() {
    return rowsRead;
  }

  public long getRowsQuarantined() {
    return rowsQuarantined;
  }

  public long getRowsStaged() {
    return batch.rowCount();
  }

  /** Name of the staging table holding the relation. */
  public String getTable() {
    return table;
  }

  @Override public String toString() {
    return "StagingResult{table=" + table + ", read=" + rowsRead
        + ", staged=" + batch.rowCount() + ", quarantined=" + rowsQuarantined + "}";
  }
}
