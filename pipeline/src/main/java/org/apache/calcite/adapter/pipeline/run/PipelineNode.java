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
package org.apache.calcite.adapter.pipeline.run;

import org.apache.calcite.adapter.pipeline.PipelineException;
import org.apache.calcite.adapter.pipeline.checkpoint.Checkpoint;

import java.util.List;

/**
 * A stage of the pipeline DAG.
 *
 * <p>Each node consumes the outputs of its predecessors through the
 * {@link RunContext} and publishes its own. The coordinator runs a node only
 * after all predecessors are satisfied, and may run it more than once if an
 * attempt fails with a retryable error; {@link #run} must therefore not
 * change its predecessors' outputs.
 */
public interface PipelineNode {

  /** Unique name of the node within the DAG. */
  String getName();

  /** Names of the nodes this node depends on. */
  List<String> getPredecessors();

  /**
   * Computes the fingerprint of everything the node's output depends on:
   * its predecessors' output fingerprints and its own configuration.
   */
  String inputFingerprint(RunContext context) throws PipelineException;

  /**
   * Runs the node.
   *
   * @return Fingerprint of the node's output
   * @throws PipelineException if the node fails
   * @throws InterruptedException if the attempt was interrupted by a timeout
   *     or cancellation
   */
  String run(RunContext context) throws PipelineException, InterruptedException;

  /** Whether the node can be restored from a checkpoint instead of run. */
  default boolean supportsRestore() {
    return false;
  }

  /**
   * Restores the node's output from persisted state.
   *
   * @param checkpoint Successful checkpoint for the current input fingerprint
   * @return whether the persisted output was found and matches the
   *     checkpoint; if false the node is run normally
   */
  default boolean restore(RunContext context, Checkpoint checkpoint) throws PipelineException {
    return false;
  }
}
