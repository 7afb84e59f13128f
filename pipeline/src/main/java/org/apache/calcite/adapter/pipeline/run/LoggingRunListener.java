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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Writes run progress to the log.
 */
public class LoggingRunListener implements RunListener {
  private static final Logger LOGGER = LoggerFactory.getLogger(LoggingRunListener.class);

  @Override public void onRunStart(String pipeline, String runId, List<String> nodes) {
    LOGGER.info("Run {} of pipeline '{}' started: {}", runId, pipeline, nodes);
  }

  @Override public void onNodeStart(String node, int attempt) {
    if (attempt == 1) {
      LOGGER.info("Node '{}' started", node);
    } else {
      LOGGER.info("Node '{}' attempt {} started", node, attempt);
    }
  }

  @Override public void onNodeRetry(String node, int attempt, Exception error,
      Duration backoff) {
    LOGGER.warn("Node '{}' attempt {} failed, retrying in {}ms: {}", node, attempt,
        backoff.toMillis(), error.getMessage());
  }

  @Override public void onNodeFinish(NodeState state) {
    switch (state.getStatus()) {
    case SUCCEEDED:
      LOGGER.info("Node '{}' succeeded in {}ms", state.getName(), state.getElapsedMs());
      break;
    case SKIPPED:
      LOGGER.info("Node '{}' skipped ({})", state.getName(), state.getSkipReason());
      break;
    case FAILED:
      LOGGER.error("Node '{}' failed after {} attempt(s)", state.getName(),
          state.getAttempts(), state.getError());
      break;
    default:
      break;
    }
  }

  @Override public void onRunFinish(RunResult result) {
    if (result.getStatus() == RunStatus.FAILED) {
      LOGGER.error("Run {} of pipeline '{}' failed at node '{}' in {}ms", result.getRunId(),
          result.getPipelineName(), result.getFailedNode(), result.getElapsedMs());
    } else {
      LOGGER.info("Run {} of pipeline '{}' finished {} in {}ms", result.getRunId(),
          result.getPipelineName(), result.getStatus(), result.getElapsedMs());
    }
  }
}
