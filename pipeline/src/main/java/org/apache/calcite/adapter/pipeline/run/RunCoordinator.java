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
import org.apache.calcite.adapter.pipeline.checkpoint.CheckpointStore;
import org.apache.calcite.adapter.pipeline.validate.ValidationReport;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Walks the pipeline DAG in topological order and runs each node.
 *
 * <p>For every node the coordinator:
 * <ol>
 *   <li>skips it if the run was cancelled or a predecessor is not satisfied</li>
 *   <li>computes its input fingerprint</li>
 *   <li>restores it from a successful checkpoint for that fingerprint, if
 *       the node supports it and its persisted output is intact</li>
 *   <li>otherwise records a start, runs it under the stage timeout, and
 *       records success or failure</li>
 * </ol>
 *
 * <p>Attempts that fail with a retryable error are repeated according to the
 * {@link RetryPolicy}. Each attempt runs on a worker thread so that a timeout
 * or {@link #cancel()} can interrupt it; the DAG itself is walked on the
 * calling thread. A retry never starts while an interrupted attempt of the
 * same node is still running.
 *
 * <p>A coordinator that has been cancelled stays cancelled.
 */
public class RunCoordinator implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(RunCoordinator.class);

  private final List<PipelineNode> nodes;
  private final CheckpointStore checkpoints;
  private final RetryPolicy retryPolicy;
  private final Duration stageTimeout;
  private final RunListener listener;
  private final ExecutorService executor;
  private final CountDownLatch cancelLatch = new CountDownLatch(1);
  private volatile boolean cancelled;
  private volatile @Nullable Future<?> current;

  public RunCoordinator(List<? extends PipelineNode> nodes, CheckpointStore checkpoints,
      RetryPolicy retryPolicy, Duration stageTimeout, RunListener listener) {
    Preconditions.checkArgument(!stageTimeout.isNegative() && !stageTimeout.isZero(),
        "stageTimeout must be positive: %s", stageTimeout);
    this.nodes = topologicalOrder(nodes);
    this.checkpoints = checkpoints;
    this.retryPolicy = retryPolicy;
    this.stageTimeout = stageTimeout;
    this.listener = listener;
    this.executor = Executors.newCachedThreadPool(
        new ThreadFactoryBuilder()
            .setNameFormat("pipeline-node-%d")
            .setDaemon(true)
            .build());
  }

  /**
   * Orders nodes so that every node follows its predecessors. Among nodes
   * that are ready at the same time, declaration order is kept.
   *
   * @throws IllegalArgumentException if a name is duplicated, a predecessor
   *     is unknown, or the graph has a cycle
   */
  static List<PipelineNode> topologicalOrder(List<? extends PipelineNode> nodes) {
    Map<String, PipelineNode> byName = new LinkedHashMap<>();
    for (PipelineNode node : nodes) {
      if (byName.put(node.getName(), node) != null) {
        throw new IllegalArgumentException("Duplicate node: " + node.getName());
      }
    }
    Map<String, Integer> inDegree = new HashMap<>();
    Map<String, List<String>> dependents = new HashMap<>();
    for (PipelineNode node : nodes) {
      inDegree.put(node.getName(), node.getPredecessors().size());
      for (String predecessor : node.getPredecessors()) {
        if (!byName.containsKey(predecessor)) {
          throw new IllegalArgumentException("Node '" + node.getName()
              + "' depends on unknown node '" + predecessor + "'");
        }
        dependents.computeIfAbsent(predecessor, k -> new ArrayList<>()).add(node.getName());
      }
    }

    List<PipelineNode> order = new ArrayList<>(nodes.size());
    Deque<String> ready = new ArrayDeque<>();
    for (PipelineNode node : nodes) {
      if (inDegree.get(node.getName()) == 0) {
        ready.add(node.getName());
      }
    }
    while (!ready.isEmpty()) {
      String name = ready.poll();
      order.add(byName.get(name));
      List<String> next = dependents.get(name);
      if (next == null) {
        continue;
      }
      // keep declaration order among newly ready nodes
      for (PipelineNode node : nodes) {
        if (next.contains(node.getName())) {
          int remaining = inDegree.merge(node.getName(), -1, Integer::sum);
          if (remaining == 0) {
            ready.add(node.getName());
          }
        }
      }
    }
    if (order.size() != nodes.size()) {
      List<String> cyclic = new ArrayList<>();
      for (PipelineNode node : nodes) {
        if (!order.contains(node)) {
          cyclic.add(node.getName());
        }
      }
      throw new IllegalArgumentException("Pipeline graph has a cycle among " + cyclic);
    }
    return ImmutableList.copyOf(order);
  }

  /** Returns the nodes in execution order. */
  public List<PipelineNode> getNodes() {
    return nodes;
  }

  /**
   * Interrupts the running node and prevents any further node from
   * starting. The interrupted node fails with {@link RunCancelledException};
   * the others are skipped.
   */
  public void cancel() {
    cancelled = true;
    cancelLatch.countDown();
    Future<?> future = current;
    if (future != null) {
      future.cancel(true);
    }
    LOGGER.info("Run cancellation requested");
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Runs the DAG.
   *
   * <p>Errors never escape: they are recorded in the result and in the
   * checkpoint store.
   */
  public RunResult run(RunContext context) {
    long start = System.currentTimeMillis();
    Map<String, NodeState> states = new LinkedHashMap<>();
    List<String> names = new ArrayList<>();
    for (PipelineNode node : nodes) {
      states.put(node.getName(), NodeState.pending(node.getName()));
      names.add(node.getName());
    }
    listener.onRunStart(context.getPipelineName(), context.getRunId(), names);

    String failedNode = null;
    StageException error = null;
    boolean interrupted = false;
    for (PipelineNode node : nodes) {
      String name = node.getName();
      NodeState state;
      if (cancelled) {
        state = states.get(name).skipped(NodeState.SkipReason.CANCELLED);
      } else if (!predecessorsSatisfied(node, states)) {
        state = states.get(name).skipped(NodeState.SkipReason.UPSTREAM_FAILED);
      } else {
        state = execute(node, context, states.get(name));
        interrupted |= Thread.interrupted();
      }
      states.put(name, state);
      listener.onNodeFinish(state);
      if (state.getStatus() == NodeStatus.FAILED && failedNode == null) {
        failedNode = name;
        error = state.getError();
      }
    }

    ValidationReport report = context.getReport();
    RunStatus status;
    if (failedNode != null || cancelled) {
      status = RunStatus.FAILED;
    } else if (report != null && report.hasWarnings()) {
      status = RunStatus.SUCCEEDED_WITH_WARNINGS;
    } else {
      status = RunStatus.SUCCEEDED;
    }
    RunResult result = RunResult.builder()
        .pipelineName(context.getPipelineName())
        .runId(context.getRunId())
        .status(status)
        .failedNode(failedNode)
        .error(error)
        .nodeStates(states)
        .report(report)
        .writeSummary(context.getWriteSummary())
        .elapsedMs(System.currentTimeMillis() - start)
        .build();
    listener.onRunFinish(result);
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    return result;
  }

  private static boolean predecessorsSatisfied(PipelineNode node, Map<String, NodeState> states) {
    for (String predecessor : node.getPredecessors()) {
      if (!states.get(predecessor).isSatisfied()) {
        return false;
      }
    }
    return true;
  }

  private NodeState execute(PipelineNode node, RunContext context, NodeState pending) {
    String name = node.getName();
    String pipeline = context.getPipelineName();
    long start = System.currentTimeMillis();
    String inputFingerprint = null;
    NodeState state = pending;
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        if (inputFingerprint == null) {
          inputFingerprint = call(name, null, () -> node.inputFingerprint(context));
          NodeState restored = tryRestore(node, context, inputFingerprint, state);
          if (restored != null) {
            return restored;
          }
        }
        state = state.running(inputFingerprint, attempt);
        listener.onNodeStart(name, attempt);
        recordStart(pipeline, name, inputFingerprint);
        String outputFingerprint = call(name, inputFingerprint, () -> node.run(context));
        context.setOutputFingerprint(name, outputFingerprint);
        recordSuccess(pipeline, name, inputFingerprint, outputFingerprint,
            "attempts=" + attempt);
        return state.succeeded(outputFingerprint, System.currentTimeMillis() - start);
      } catch (PipelineException e) {
        PipelineException failure = e;
        if (e.isRetryable() && attempt < retryPolicy.getMaxAttempts() && !cancelled) {
          Duration backoff = retryPolicy.backoff(attempt);
          listener.onNodeRetry(name, attempt, e, backoff);
          if (awaitBackoff(backoff)) {
            continue;
          }
          failure = new RunCancelledException(name);
        }
        if (state.getStatus() == NodeStatus.PENDING) {
          state = state.running(inputFingerprint, attempt);
        }
        StageException stageError = failure instanceof StageException
            ? (StageException) failure
            : new StageException(name, inputFingerprint, failure);
        if (inputFingerprint != null) {
          recordFailure(pipeline, name, inputFingerprint, describe(failure));
        }
        return state.failed(stageError, System.currentTimeMillis() - start);
      }
    }
  }

  private @Nullable NodeState tryRestore(PipelineNode node, RunContext context,
      String inputFingerprint, NodeState state) {
    if (!node.supportsRestore()) {
      return null;
    }
    String name = node.getName();
    Checkpoint checkpoint;
    try {
      checkpoint = checkpoints.find(context.getPipelineName(), name, inputFingerprint);
    } catch (IOException e) {
      LOGGER.error("Checkpoint lookup failed for node '{}'; running it", name, e);
      return null;
    }
    if (checkpoint == null || !checkpoint.isSucceeded()) {
      return null;
    }
    String outputFingerprint = checkpoint.getOutputFingerprint();
    if (outputFingerprint == null) {
      return null;
    }
    final Checkpoint found = checkpoint;
    boolean restored;
    try {
      restored = call(name, inputFingerprint, () -> node.restore(context, found));
    } catch (PipelineException e) {
      LOGGER.warn("Could not restore node '{}' from checkpoint; running it: {}", name,
          e.getMessage());
      return null;
    }
    if (!restored) {
      LOGGER.info("Checkpoint of node '{}' no longer matches its persisted output; running it",
          name);
      return null;
    }
    context.setOutputFingerprint(name, outputFingerprint);
    LOGGER.debug("Restored node '{}' for input {}", name, inputFingerprint);
    return state.restored(inputFingerprint, outputFingerprint);
  }

  /**
   * Runs a task on a worker thread under the stage timeout.
   *
   * <p>When the attempt is timed out or cancelled, waits up to another
   * {@code stageTimeout} for its worker to stop before returning. A timed-out
   * attempt that is still running after that is reported as not retryable.
   */
  private <T> T call(String name, @Nullable String inputFingerprint, Callable<T> task)
      throws PipelineException {
    Attempt<T> attempt = new Attempt<>(task);
    Future<T> future = executor.submit(attempt);
    current = future;
    if (cancelled) {
      future.cancel(true);
    }
    try {
      return future.get(stageTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      boolean stopped = awaitStop(name, attempt);
      throw new StageTimeoutException(name, stageTimeout, stopped);
    } catch (CancellationException e) {
      awaitStop(name, attempt);
      throw new RunCancelledException(name);
    } catch (InterruptedException e) {
      future.cancel(true);
      cancelled = true;
      Thread.currentThread().interrupt();
      throw new RunCancelledException(name);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof PipelineException) {
        throw (PipelineException) cause;
      }
      if (cause instanceof InterruptedException) {
        throw new RunCancelledException(name);
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new StageException(name, inputFingerprint, cause);
    } finally {
      current = null;
    }
  }

  /** Waits for an interrupted attempt to stop; returns whether it did. */
  private boolean awaitStop(String name, Attempt<?> attempt) {
    boolean stopped;
    try {
      stopped = attempt.awaitStop(stageTimeout);
    } catch (InterruptedException e) {
      cancelled = true;
      Thread.currentThread().interrupt();
      stopped = false;
    }
    if (!stopped) {
      LOGGER.error("Node '{}' is still running after being interrupted", name);
    }
    return stopped;
  }

  /** Waits out a backoff; returns false if the run was cancelled meanwhile. */
  private boolean awaitBackoff(Duration backoff) {
    try {
      return !cancelLatch.await(backoff.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      cancelled = true;
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static String describe(Throwable error) {
    return error.getClass().getSimpleName() + ": " + error.getMessage();
  }

  private void recordStart(String pipeline, String stage, String inputFingerprint) {
    try {
      checkpoints.recordStart(pipeline, stage, inputFingerprint);
    } catch (IOException e) {
      LOGGER.error("Failed to record start of node '{}'", stage, e);
    }
  }

  private void recordSuccess(String pipeline, String stage, String inputFingerprint,
      String outputFingerprint, String detail) {
    try {
      checkpoints.recordSuccess(pipeline, stage, inputFingerprint, outputFingerprint, detail);
    } catch (IOException e) {
      LOGGER.error("Failed to record success of node '{}'", stage, e);
    }
  }

  private void recordFailure(String pipeline, String stage, String inputFingerprint,
      String detail) {
    try {
      checkpoints.recordFailure(pipeline, stage, inputFingerprint, detail);
    } catch (IOException e) {
      LOGGER.error("Failed to record failure of node '{}'", stage, e);
    }
  }

  @Override public void close() {
    executor.shutdownNow();
  }

  /** Wraps a node task so that the coordinator can wait for it to stop. */
  private static class Attempt<T> implements Callable<T> {
    private final Callable<T> task;
    private final AtomicBoolean claimed = new AtomicBoolean();
    private final CountDownLatch stopped = new CountDownLatch(1);

    Attempt(Callable<T> task) {
      this.task = task;
    }

    @Override public T call() throws Exception {
      if (!claimed.compareAndSet(false, true)) {
        throw new CancellationException("Attempt abandoned before it started");
      }
      try {
        return task.call();
      } finally {
        stopped.countDown();
      }
    }

    /** Returns true once the task has finished, or if it never started. */
    boolean awaitStop(Duration timeout) throws InterruptedException {
      if (claimed.compareAndSet(false, true)) {
        return true;
      }
      return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
  }
}
