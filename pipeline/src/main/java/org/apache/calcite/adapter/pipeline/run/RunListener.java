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

import java.time.Duration;
import java.util.List;

/**
 * Observer of a run's progress.
 *
 * <p>Callbacks are made on the coordinator thread, in order.
 */
public interface RunListener {

  /**
   * Called before the first node starts.
   *
   * @param pipeline Pipeline name
   * @param runId Run identifier
   * @param nodes Node names in execution order
   */
  default void onRunStart(String pipeline, String runId, List<String> nodes) { }

  /** Called before each attempt of a node. */
  default void onNodeStart(String node, int attempt) { }

  /**
   * Called when an attempt failed with a retryable error and the node will be
   * attempted again after {@code backoff}.
   */
  default void onNodeRetry(String node, int attempt, Exception error, Duration backoff) { }

  /** Called when a node reaches a terminal state. */
  default void onNodeFinish(NodeState state) { }

  /** Called once the run is over. */
  default void onRunFinish(RunResult result) { }
}
