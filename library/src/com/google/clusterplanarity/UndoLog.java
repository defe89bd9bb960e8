/*
 * Copyright 2026 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.clusterplanarity;

import static com.google.clusterplanarity.Graph.NONE;

import com.google.clusterplanarity.primitives.IntPairList;
import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * An ordered stack of {@link UndoOperation}s, replayed in exactly the reverse order of recording.
 *
 * <p>A log moves through the states EMPTY → RECORDING → FROZEN → REPLAYING → EMPTY. Operations may
 * only be pushed while EMPTY or RECORDING. Once frozen, the instance is handed to a {@link
 * ReductionSolver} and nothing more is recorded. Replay is only legal from FROZEN; {@link
 * #discard()} drops all operations without replaying them, which is what happens when the solver
 * reports failure.
 */
public class UndoLog {
  private static final Logger log = Platform.getLoggerForClass(UndoLog.class);

  /** The states of an UndoLog. */
  public enum State {
    EMPTY,
    RECORDING,
    FROZEN,
    REPLAYING
  }

  private final Deque<UndoOperation> operations = new ArrayDeque<>();
  private State state = State.EMPTY;

  public State state() {
    return state;
  }

  /** Returns the number of recorded operations not yet replayed. */
  public int size() {
    return operations.size();
  }

  public boolean isEmpty() {
    return operations.isEmpty();
  }

  /** Returns the operation that would be replayed next, or null if there is none. */
  public @Nullable UndoOperation peek() {
    return operations.peekFirst();
  }

  /** Records 'op' as the most recent operation. */
  public void push(UndoOperation op) {
    Preconditions.checkState(
        state == State.EMPTY || state == State.RECORDING, "Cannot record while %s", state);
    Preconditions.checkNotNull(op);
    operations.push(op);
    state = State.RECORDING;
  }

  /** Ends recording. */
  public void freeze() {
    Preconditions.checkState(state == State.RECORDING, "Cannot freeze while %s", state);
    state = State.FROZEN;
  }

  /** Drops all operations without replaying them. */
  public void discard() {
    operations.clear();
    state = State.EMPTY;
  }

  /** Pops and replays every operation against 'plan', most recent first. */
  public void replay(SyncPlan plan) {
    Preconditions.checkState(state == State.FROZEN, "Cannot replay while %s", state);
    state = State.REPLAYING;
    while (!operations.isEmpty()) {
      UndoOperation op = operations.pop();
      log.fine("Undoing " + op);
      switch (op.kind()) {
        case RESET_INDICES:
          replayResetIndices(plan, (UndoResetIndices) op);
          break;
        case INIT_CLUSTER:
          replayInitCluster(plan, (UndoInitCluster) op);
          break;
      }
    }
    state = State.EMPTY;
  }

  private static void replayResetIndices(SyncPlan plan, UndoResetIndices op) {
    SyncPlanError error = new SyncPlanError();
    if (!ConsistencyChecks.isReset(plan.graph(), op.nodeArenaSize(), op.edgeArenaSize(), error)) {
      throw new SyncPlanException(error);
    }
    plan.graph().truncate(op.nodeArenaSize(), op.edgeArenaSize());
  }

  private static void replayInitCluster(SyncPlan plan, UndoInitCluster op) {
    ClusterGraph clusterGraph = op.clusterGraph();
    Graph graph = plan.graph();
    Preconditions.checkState(clusterGraph == plan.clusterGraph(), "Foreign cluster graph");
    IntPairList augmentation = op.augmentation();
    int[] bicomps = null;
    if (augmentation != null) {
      bicomps = new int[graph.edgeArenaSize()];
      GraphAlgorithms.biconnectedComponents(graph, bicomps);
    }

    int root = clusterGraph.rootCluster();
    clusterGraph.adjEntries(root).clear();
    for (FrozenCluster frozen : op.clusters()) {
      int c = frozen.index();
      if (c == root) {
        Preconditions.checkState(frozen.parent() == NONE, "Root snapshot has a parent");
      } else {
        Preconditions.checkState(
            clusterGraph.isClusterAlive(c) && clusterGraph.parent(c) == frozen.parent(),
            "Cluster %s no longer matches its snapshot",
            c);
        PerimeterRerouting.unflattenCluster(
            graph, clusterGraph, plan.matchings(), c, frozen.parentNode(), bicomps, augmentation);
      }
      for (int n : frozen.nodes()) {
        clusterGraph.reassignNode(n, c);
      }
    }
    clusterGraph.setAdjAvailable(true);

    if (plan.options().consistencyChecks()) {
      ConsistencyChecks.checkClusterEmbeddingOrThrow(plan);
    }
  }
}
