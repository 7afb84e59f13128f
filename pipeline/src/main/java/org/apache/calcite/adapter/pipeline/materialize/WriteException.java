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

import org.apache.calcite.adapter.pipeline.PipelineException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Materialization did not complete. Partitions listed as written were
 * promoted and stay valid; failed partitions left nothing at their final
 * path.
 */
public class WriteException extends PipelineException {
  private static final long serialVersionUID = 1L;

  private final List<String> partitionsWritten;
  private final Map<String, String> partitionsFailed;

  public WriteException(String message, List<String> partitionsWritten,
      Map<String, String> partitionsFailed, @Nullable Throwable cause) {
    super(message, cause);
    this.partitionsWritten = ImmutableList.copyOf(partitionsWritten);
    this.partitionsFailed = ImmutableMap.copyOf(partitionsFailed);
  }

  /** Paths of partitions promoted by this write. */
  public List<String> getPartitionsWritten() {
    return partitionsWritten;
  }

  /** Failed partition paths, with the error of the last attempt. */
  public Map<String, String> getPartitionsFailed() {
    return partitionsFailed;
  }

  @Override public boolean isRetryable() {
    return true;
  }
}
