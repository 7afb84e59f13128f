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
import org.apache.calcite.adapter.pipeline.checkpoint.CheckpointStatus;
import org.apache.calcite.adapter.pipeline.checkpoint.CheckpointStore;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link RunCoordinator}.
 */
@Tag("unit")
public class RunCoordinatorTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(30);
  private static final RetryPolicy FAST_RETRY =
      new RetryPolicy(3, Duration.ofMillis(1), 1.0, Duration.ofMillis(1));

  /** Node whose behaviour is given by a body; counts its runs. */
  private static class FakeNode implements PipelineNode {
    final String name;
    final List<String> predecessors;
    final Body body;
    final AtomicInteger runs = new AtomicInteger();
    boolean restorable;
    final AtomicInteger restores = new AtomicInteger();

    FakeNode(String name, Body body, String... predecessors) {
      this.name = name;
      this.body = body;
      this.predecessors = ImmutableList.copyOf(predecessors);
    }

    FakeNode(String name, String... predecessors) {
      this(name, attempt -> name + "-out", predecessors);
    }

    @Override public String getName() {
      return name;
    }

    @Override public List<String> getPredecessors() {
      return predecessors;
    }

    @Override public String inputFingerprint(RunContext context) {
      StringBuilder sb = new StringBuilder(name);
      for (String predecessor : predecessors) {
        sb.append('|').append(context.outputFingerprint(predecessor));
      }
      return Fingerprints.of(sb.toString());
    }

    @Override public String run(RunContext context)
        throws PipelineException, InterruptedException {
      return body.run(runs.incrementAndGet());
    }

    @Override public boolean supportsRestore() {
      return restorable;
    }

    @Override public boolean restore(RunContext context, Checkpoint checkpoint) {
      restores.incrementAndGet();
      return true;
    }
  }

  /** What a fake node does on an attempt. */
  private interface Body {
    String run(int attempt) throws PipelineException, InterruptedException;
  }

  /** Error that a retry may fix. */
  private static class TransientException extends PipelineException {
    private static final long serialVersionUID = 1L;

    TransientException(String message) {
      super(message);
    }

    @Override public boolean isRetryable() {
      return true;
    }
  }

  /** Checkpoint store backed by a map. */
  private static class MemoryCheckpointStore implements CheckpointStore {
    final Map<String, Checkpoint> checkpoints = new LinkedHashMap<>();

    private static String key(String pipeline, String stage, String input) {
      return pipeline + "/" + stage + "/" + input;
    }

    @Override public void recordStart(String pipeline, String stage, String inputFingerprint) {
      checkpoints.put(key(pipeline, stage, inputFingerprint), new Checkpoint(pipeline, stage,
          inputFingerprint, null, CheckpointStatus.RUNNING, 0L, null, null));
    }

    @Override public void recordSuccess(String pipeline, String stage, String inputFingerprint,
        String outputFingerprint, @Nullable String detail) {
      checkpoints.put(key(pipeline, stage, inputFingerprint), new Checkpoint(pipeline, stage,
          inputFingerprint, outputFingerprint, CheckpointStatus.SUCCEEDED, 0L, 1L, detail));
    }

    @Override public void recordFailure(String pipeline, String stage, String inputFingerprint,
        String detail) {
      checkpoints.put(key(pipeline, stage, inputFingerprint), new Checkpoint(pipeline, stage,
          inputFingerprint, null, CheckpointStatus.FAILED, 0L, 1L, detail));
    }

    @Override public @Nullable Checkpoint find(String pipeline, String stage,
        String inputFingerprint) {
      return checkpoints.get(key(pipeline, stage, inputFingerprint));
    }

    @Override public List<Checkpoint> list(String pipeline) {
      return new ArrayList<>(checkpoints.values());
    }

    @Override public void close() {
    }
  }

  /** Listener recording events as strings. */
  private static class RecordingListener implements RunListener {
    final List<String> events = Collections.synchronizedList(new ArrayList<>());

    @Override public void onNodeStart(String node, int attempt) {
      events.add("start " + node + "#" + attempt);
    }

    @Override public void onNodeRetry(String node, int attempt, Exception error,
        Duration backoff) {
      events.add("retry " + node + "#" + attempt);
    }

    @Override public void onNodeFinish(NodeState state) {
      events.add("finish " + state.getName() + " " + state.getStatus());
    }

    @Override public void onRunFinish(RunResult result) {
      events.add("run " + result.getStatus());
    }
  }

  private static RunResult run(List<? extends PipelineNode> nodes, CheckpointStore store,
      RetryPolicy retry, Duration timeout, RunListener listener) {
    try (RunCoordinator coordinator =
             new RunCoordinator(nodes, store, retry, timeout, listener)) {
      return coordinator.run(new RunContext("txn", "run1"));
    }
  }

  private static RunResult run(List<? extends PipelineNode> nodes) {
    return run(nodes, CheckpointStore.NOOP, RetryPolicy.NONE, TIMEOUT, new RunListener() { });
  }

  private static List<String> names(List<PipelineNode> nodes) {
    List<String> names = new ArrayList<>();
    for (PipelineNode node : nodes) {
      names.add(node.getName());
    }
    return names;
  }

  @Test void testTopologicalOrderKeepsDeclarationOrder() {
    List<PipelineNode> order = RunCoordinator.topologicalOrder(ImmutableList.of(
        new FakeNode("materialize", "validate"),
        new FakeNode("validate", "transform", "schema"),
        new FakeNode("schema"),
        new FakeNode("staging", "schema"),
        new FakeNode("transform", "staging")));
    assertEquals(ImmutableList.of("schema", "staging", "transform", "validate", "materialize"),
        names(order));
  }

  @Test void testInvalidGraphsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> RunCoordinator.topologicalOrder(
        ImmutableList.of(new FakeNode("a", "b"), new FakeNode("b", "a"))));
    assertThrows(IllegalArgumentException.class, () -> RunCoordinator.topologicalOrder(
        ImmutableList.of(new FakeNode("a", "missing"))));
    assertThrows(IllegalArgumentException.class, () -> RunCoordinator.topologicalOrder(
        ImmutableList.of(new FakeNode("a"), new FakeNode("a"))));
  }

  @Test void testSuccessfulRun() {
    RecordingListener listener = new RecordingListener();
    RunResult result = run(ImmutableList.of(new FakeNode("a"), new FakeNode("b", "a")),
        CheckpointStore.NOOP, RetryPolicy.NONE, TIMEOUT, listener);

    assertEquals(RunStatus.SUCCEEDED, result.getStatus());
    assertTrue(result.isSuccessful());
    assertNull(result.getFailedNode());
    assertEquals("b-out", result.getNodeState("b").getOutputFingerprint());
    assertEquals(1, result.getNodeState("b").getAttempts());
    assertEquals(ImmutableList.of("start a#1", "finish a SUCCEEDED", "start b#1",
        "finish b SUCCEEDED", "run SUCCEEDED"), listener.events);
    assertThrows(IllegalArgumentException.class, () -> result.getNodeState("zzz"));
  }

  @Test void testRetryableErrorIsRetried() {
    FakeNode flaky = new FakeNode("a", attempt -> {
      if (attempt < 3) {
        throw new TransientException("busy " + attempt);
      }
      return "ok";
    });
    RecordingListener listener = new RecordingListener();
    RunResult result = run(ImmutableList.of(flaky), CheckpointStore.NOOP, FAST_RETRY, TIMEOUT,
        listener);

    assertEquals(RunStatus.SUCCEEDED, result.getStatus());
    assertEquals(3, flaky.runs.get());
    assertEquals(3, result.getNodeState("a").getAttempts());
    assertTrue(listener.events.contains("retry a#1"));
    assertTrue(listener.events.contains("retry a#2"));
  }

  @Test void testRetriesAreBounded() {
    FakeNode broken = new FakeNode("a", attempt -> {
      throw new TransientException("busy");
    });
    RunResult result = run(ImmutableList.of(broken), CheckpointStore.NOOP, FAST_RETRY, TIMEOUT,
        new RunListener() { });

    assertEquals(RunStatus.FAILED, result.getStatus());
    assertEquals(3, broken.runs.get());
    StageException error = result.getError();
    assertNotNull(error);
    assertEquals("a", error.getStage());
    assertInstanceOf(TransientException.class, error.getCause());
  }

  @Test void testNonRetryableErrorFailsOnceAndSkipsDownstream() {
    FakeNode bad = new FakeNode("a", attempt -> {
      throw new PipelineException("bad data");
    });
    FakeNode after = new FakeNode("b", "a");
    FakeNode independent = new FakeNode("c");
    MemoryCheckpointStore store = new MemoryCheckpointStore();
    RunResult result = run(ImmutableList.of(bad, after, independent), store, FAST_RETRY,
        TIMEOUT, new RunListener() { });

    assertEquals(RunStatus.FAILED, result.getStatus());
    assertEquals("a", result.getFailedNode());
    assertEquals(1, bad.runs.get());
    assertEquals(0, after.runs.get());
    NodeState skipped = result.getNodeState("b");
    assertEquals(NodeStatus.SKIPPED, skipped.getStatus());
    assertEquals(NodeState.SkipReason.UPSTREAM_FAILED, skipped.getSkipReason());
    assertEquals(NodeStatus.SUCCEEDED, result.getNodeState("c").getStatus());

    NodeState failed = result.getNodeState("a");
    Checkpoint checkpoint = store.find("txn", "a", failed.getInputFingerprint());
    assertNotNull(checkpoint);
    assertEquals(CheckpointStatus.FAILED, checkpoint.getStatus());
    assertTrue(checkpoint.getDetail().contains("bad data"));
  }

  @Test void testRuntimeExceptionIsWrapped() {
    FakeNode buggy = new FakeNode("a", attempt -> {
      throw new IllegalStateException("boom");
    });
    RunResult result = run(ImmutableList.of(buggy));

    StageException error = result.getError();
    assertNotNull(error);
    assertInstanceOf(IllegalStateException.class, error.getCause());
    assertFalse(error.isRetryable());
  }

  @Test void testTimeout() {
    FakeNode slow = new FakeNode("a", attempt -> {
      Thread.sleep(10_000);
      return "late";
    });
    RunResult result = run(ImmutableList.of(slow), CheckpointStore.NOOP, RetryPolicy.NONE,
        Duration.ofMillis(100), new RunListener() { });

    assertEquals(RunStatus.FAILED, result.getStatus());
    StageException error = result.getError();
    assertNotNull(error);
    assertInstanceOf(StageTimeoutException.class, error.getCause());
  }

  @Test void testRetryWaitsForTimedOutAttemptToStop() {
    List<String> events = Collections.synchronizedList(new ArrayList<>());
    AtomicInteger active = new AtomicInteger();
    AtomicInteger maxActive = new AtomicInteger();
    FakeNode stubborn = new FakeNode("a", attempt -> {
      maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
      events.add("start-" + attempt);
      try {
        if (attempt == 1) {
          busyWaitIgnoringInterrupts(750);
        }
        return "out-" + attempt;
      } finally {
        events.add("end-" + attempt);
        active.decrementAndGet();
      }
    });
    RunResult result = run(ImmutableList.of(stubborn), CheckpointStore.NOOP, FAST_RETRY,
        Duration.ofMillis(500), new RunListener() { });

    assertEquals(RunStatus.SUCCEEDED, result.getStatus());
    assertEquals(2, stubborn.runs.get());
    assertEquals(1, maxActive.get());
    assertEquals(ImmutableList.of("start-1", "end-1", "start-2", "end-2"), events);
    assertEquals("out-2", result.getNodeState("a").getOutputFingerprint());
  }

  @Test void testAttemptThatNeverStopsIsNotRetried() throws Exception {
    CountDownLatch finished = new CountDownLatch(1);
    FakeNode stuck = new FakeNode("a", attempt -> {
      try {
        busyWaitIgnoringInterrupts(1_500);
        return "late";
      } finally {
        finished.countDown();
      }
    });
    RunResult result = run(ImmutableList.of(stuck), CheckpointStore.NOOP, FAST_RETRY,
        Duration.ofMillis(100), new RunListener() { });

    assertEquals(RunStatus.FAILED, result.getStatus());
    StageException error = result.getError();
    assertNotNull(error);
    StageTimeoutException timeout =
        assertInstanceOf(StageTimeoutException.class, error.getCause());
    assertFalse(timeout.isAttemptStopped());
    assertFalse(timeout.isRetryable());

    assertTrue(finished.await(5, TimeUnit.SECONDS));
    assertEquals(1, stuck.runs.get());
  }

  /** Spins for the given time, clearing any interrupt it receives. */
  private static void busyWaitIgnoringInterrupts(long millis) {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
    while (System.nanoTime() < deadline) {
      Thread.interrupted();
    }
  }

  @Test void testCancelStopsRunningNodeAndSkipsRest() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    FakeNode blocking = new FakeNode("a", attempt -> {
      started.countDown();
      Thread.sleep(30_000);
      return "never";
    });
    FakeNode after = new FakeNode("b", "a");
    FakeNode independent = new FakeNode("c");

    RunResult result;
    try (RunCoordinator coordinator = new RunCoordinator(
        ImmutableList.of(blocking, after, independent), CheckpointStore.NOOP, FAST_RETRY,
        TIMEOUT, new RunListener() { })) {
      Thread canceller = new Thread(() -> {
        try {
          if (started.await(10, TimeUnit.SECONDS)) {
            coordinator.cancel();
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      });
      canceller.start();
      result = coordinator.run(new RunContext("txn", "run1"));
      canceller.join();
      assertTrue(coordinator.isCancelled());
    }

    assertEquals(RunStatus.FAILED, result.getStatus());
    StageException error = result.getError();
    assertNotNull(error);
    assertInstanceOf(RunCancelledException.class, error.getCause());
    assertEquals(1, blocking.runs.get());
    assertEquals(NodeState.SkipReason.CANCELLED, result.getNodeState("b").getSkipReason());
    assertEquals(NodeState.SkipReason.CANCELLED, result.getNodeState("c").getSkipReason());
  }

  @Test void testRestoreFromCheckpoint() {
    MemoryCheckpointStore store = new MemoryCheckpointStore();
    FakeNode first = new FakeNode("a");
    first.restorable = true;
    FakeNode second = new FakeNode("b", "a");
    run(ImmutableList.of(first, second), store, RetryPolicy.NONE, TIMEOUT,
        new RunListener() { });

    FakeNode firstAgain = new FakeNode("a");
    firstAgain.restorable = true;
    FakeNode secondAgain = new FakeNode("b", "a");
    RunResult result = run(ImmutableList.of(firstAgain, secondAgain), store, RetryPolicy.NONE,
        TIMEOUT, new RunListener() { });

    assertEquals(RunStatus.SUCCEEDED, result.getStatus());
    assertEquals(0, firstAgain.runs.get());
    assertEquals(1, firstAgain.restores.get());
    NodeState restored = result.getNodeState("a");
    assertEquals(NodeStatus.SKIPPED, restored.getStatus());
    assertEquals(NodeState.SkipReason.CHECKPOINT, restored.getSkipReason());
    assertTrue(restored.isSatisfied());
    assertEquals("a-out", restored.getOutputFingerprint());
    assertEquals(1, secondAgain.runs.get());
  }

  @Test void testFailedCheckpointIsNotRestored() {
    MemoryCheckpointStore store = new MemoryCheckpointStore();
    FakeNode failing = new FakeNode("a", attempt -> {
      throw new PipelineException("bad");
    });
    failing.restorable = true;
    run(ImmutableList.of(failing), store, RetryPolicy.NONE, TIMEOUT, new RunListener() { });

    FakeNode fixed = new FakeNode("a");
    fixed.restorable = true;
    RunResult result = run(ImmutableList.of(fixed), store, RetryPolicy.NONE, TIMEOUT,
        new RunListener() { });

    assertEquals(0, fixed.restores.get());
    assertEquals(1, fixed.runs.get());
    assertEquals(NodeStatus.SUCCEEDED, result.getNodeState("a").getStatus());
  }

  @Test void testBackoff() {
    RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), 2.0, Duration.ofMillis(300));
    assertEquals(Duration.ofMillis(100), policy.backoff(1));
    assertEquals(Duration.ofMillis(200), policy.backoff(2));
    assertEquals(Duration.ofMillis(300), policy.backoff(3));
    assertThrows(IllegalArgumentException.class,
        () -> new RetryPolicy(0, Duration.ZERO, 1.0, Duration.ZERO));
  }
}
