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
package org.apache.calcite.adapter.pipeline.checkpoint;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Persists stage checkpoints keyed by pipeline, stage and input
 * fingerprint.
 *
 * <p>The run coordinator records a start before a stage runs and a success
 * or failure after it. On restart it looks up a successful checkpoint for
 * the stage's current input fingerprint to decide whether the stage can be
 * skipped.
 */
public interface CheckpointStore extends AutoCloseable {

  /** Store that keeps nothing; every lookup misses. */
  CheckpointStore NOOP = new CheckpointStore() {
    @Override public void recordStart(String pipeline, String stage, String inputFingerprint) {
    }

    @Override public void recordSuccess(String pipeline, String stage, String inputFingerprint,
        String outputFingerprint, @Nullable String detail) {
    }

    @Override public void recordFailure(String pipeline, String stage, String inputFingerprint,
        String detail) {
    }

    @Override public @Nullable Checkpoint find(String pipeline, String stage,
        String inputFingerprint) {
      return null;
    }

    @Override public List<Checkpoint> list(String pipeline) {
      return Collections.emptyList();
    }

    @Override public void close() {
    }
  };

  /** Marks a stage as running for an input. */
  void recordStart(String pipeline, String stage, String inputFingerprint) throws IOException;

  /** Marks a stage as succeeded for an input. */
  void recordSuccess(String pipeline, String stage, String inputFingerprint,
      String outputFingerprint, @Nullable String detail) throws IOException;

  /** Marks a stage as failed for an input, with the error detail. */
  void recordFailure(String pipeline, String stage, String inputFingerprint, String detail)
      throws IOException;

  /** Returns the checkpoint of a stage for an input, or null. */
  @Nullable Checkpoint find(String pipeline, String stage, String inputFingerprint)
      throws IOException;

  /** Returns all checkpoints of a pipeline, most recently started first. */
  List<Checkpoint> list(String pipeline) throws IOException;

  @Override void close() throws IOException;
}
