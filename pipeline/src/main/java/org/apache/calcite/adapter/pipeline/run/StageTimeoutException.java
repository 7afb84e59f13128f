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

import java.time.Duration;

/**
 * A node attempt ran longer than the stage timeout and was interrupted.
 *
 * <p>The timeout is retryable only if the interrupted attempt actually
 * stopped. An attempt that ignores the interrupt may still be writing, so
 * no new attempt is started beside it.
 */
public class StageTimeoutException extends PipelineException {
  private static final long serialVersionUID = 1L;

  private final boolean attemptStopped;

  public StageTimeoutException(String stage, Duration timeout, boolean attemptStopped) {
    super("Stage '" + stage + "' timed out after " + timeout.toMillis() + "ms"
        + (attemptStopped ? "" : " and did not stop when interrupted"));
    this.attemptStopped = attemptStopped;
  }

  /** Whether the timed-out attempt has finished running. */
  public boolean isAttemptStopped() {
    return attemptStopped;
  }

  @Override public boolean isRetryable() {
    return attemptStopped;
  }
}
