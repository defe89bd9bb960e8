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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * A synchronized planarity instance obtained from a clustered graph. Construction flattens the
 * cluster hierarchy of the given {@link ClusterGraph} into its graph, replacing every non-root
 * cluster by a {@link Pipe}, and records how to undo that. A {@link ReductionSolver} then decides
 * the instance and embeds it, after which {@link #embed()} replays the undo log to turn the
 * embedding of the flattened graph into a cluster-planar embedding of the original one.
 *
 * <p>Typical usage:
 *
 * <pre>{@code
 * SyncPlan plan = new SyncPlan(graph, clusterGraph, solver, SyncPlan.Options.DEFAULT);
 * if (plan.makeReduced() && plan.solveReduced()) {
 *   plan.embed();
 *   // graph now holds a cluster-planar embedding, clusterGraph the boundary of every cluster.
 * }
 * }</pre>
 *
 * <p>The graph and cluster graph are modified in place and must not be changed by anyone but the
 * solver while the plan is in use. Not thread-safe.
 */
public class SyncPlan {
  private static final Logger log = Platform.getLoggerForClass(SyncPlan.class);

  /** The lifecycle of a plan. */
  public enum State {
    /** Flattened, undo log frozen. */
    CONSTRUCTED,
    REDUCED,
    SOLVED,
    /** The undo log was replayed; the graph and cluster graph are restored. */
    EMBEDDED,
    /** The solver reported infeasibility; the undo log was discarded. */
    FAILED
  }

  private final Graph graph;
  private final ClusterGraph clusterGraph;
  private final ReductionSolver solver;
  private final Options options;
  private final PipeMatching matchings;
  private final Components components;
  private final UndoLog undoLog = new UndoLog();
  private final Int2ObjectOpenHashMap<String> nodeLabels = new Int2ObjectOpenHashMap<>();
  private final @Nullable IntPairList augmentation;
  private State state;

  /**
   * Flattens 'clusterGraph', whose graph must be 'graph', and freezes the undo log.
   *
   * @throws IllegalArgumentException if 'clusterGraph' belongs to another graph
   * @throws SyncPlanException if consistency checks are enabled and flattening left an
   *     inconsistent state
   */
  public SyncPlan(
      Graph graph, ClusterGraph clusterGraph, ReductionSolver solver, Options options) {
    Preconditions.checkArgument(
        clusterGraph.getGraph() == graph, "Cluster graph does not belong to the graph");
    this.graph = graph;
    this.clusterGraph = clusterGraph;
    this.solver = Preconditions.checkNotNull(solver);
    this.options = Preconditions.checkNotNull(options);
    this.matchings = new PipeMatching(graph);
    this.components = new Components(graph);
    this.augmentation = options.augmentation() ? new IntPairList() : null;

    undoLog.push(new UndoResetIndices(graph));
    UndoInitCluster initCluster = new UndoInitCluster(clusterGraph, augmentation);
    PerimeterRerouting.flatten(
        graph, clusterGraph, matchings, initCluster.mutableClusters(), nodeLabels);
    clusterGraph.setAdjAvailable(false);
    components.recompute();
    matchings.rebuildHeap();
    undoLog.push(initCluster);
    if (options.consistencyChecks()) {
      ConsistencyChecks.checkFlattenedOrThrow(this);
    }
    undoLog.freeze();
    state = State.CONSTRUCTED;
    log.fine(
        "Flattened "
            + (clusterGraph.numberOfClusters() - 1)
            + " clusters into "
            + matchings.getPipeCount()
            + " pipes; "
            + graph.numberOfNodes()
            + " nodes, "
            + graph.numberOfEdges()
            + " edges in "
            + components.count()
            + " components.");
  }

  /**
   * Runs {@link ReductionSolver#makeReduced}. Returns false, and moves to {@link State#FAILED}, if
   * the solver found the instance infeasible.
   */
  @CanIgnoreReturnValue
  public boolean makeReduced() {
    checkState(State.CONSTRUCTED);
    if (!solver.makeReduced(this)) {
      fail("reduction");
      return false;
    }
    state = State.REDUCED;
    return true;
  }

  /**
   * Runs {@link ReductionSolver#solveReduced}. Returns false, and moves to {@link State#FAILED}, if
   * the solver found the instance infeasible.
   */
  @CanIgnoreReturnValue
  public boolean solveReduced() {
    checkState(State.REDUCED);
    if (!solver.solveReduced(this)) {
      fail("solving");
      return false;
    }
    state = State.SOLVED;
    return true;
  }

  /**
   * Replays the undo log on the solved instance. Afterwards the graph holds a cluster-planar
   * embedding, every non-root cluster its boundary entries, and no pipe remains.
   *
   * @throws SyncPlanException if consistency checks are enabled and the result is not a planar
   *     embedding
   */
  public void embed() {
    checkState(State.SOLVED);
    replay();
    if (options.consistencyChecks()) {
      SyncPlanError error = new SyncPlanError();
      if (!ConsistencyChecks.isPlanarEmbedding(graph, error)) {
        throw new SyncPlanException(error);
      }
    }
  }

  /**
   * Replays the undo log without solving, restoring the clustered graph as it was before
   * construction, up to the rotation order around nodes the solver may have changed.
   */
  public void undoAll() {
    Preconditions.checkState(
        state == State.CONSTRUCTED || state == State.REDUCED || state == State.SOLVED,
        "Cannot undo while %s",
        state);
    replay();
  }

  private void replay() {
    log.fine("Replaying " + undoLog.size() + " undo operations");
    undoLog.replay(this);
    Preconditions.checkState(matchings.isEmpty(), "Pipes remain after replay: %s", matchings);
    matchings.detach();
    components.recompute();
    nodeLabels.clear();
    state = State.EMBEDDED;
  }

  private void fail(String step) {
    log.fine("Instance found infeasible during " + step);
    undoLog.discard();
    matchings.detach();
    state = State.FAILED;
  }

  private void checkState(State expected) {
    Preconditions.checkState(state == expected, "Expected state %s but was %s", expected, state);
  }

  public Graph graph() {
    return graph;
  }

  public ClusterGraph clusterGraph() {
    return clusterGraph;
  }

  /**
   * Returns the pipe registry. It observes the graph until the plan is embedded, undone or fails;
   * a caller that abandons the plan earlier should {@link PipeMatching#detach() detach} it.
   */
  public PipeMatching matchings() {
    return matchings;
  }

  public Components components() {
    return components;
  }

  public UndoLog undoLog() {
    return undoLog;
  }

  public State state() {
    return state;
  }

  public Options options() {
    return options;
  }

  /**
   * Returns the augmentation pairs collected by the replay, or null if {@link
   * Options#augmentation()} is not set. Each pair (a, b) are consecutive boundary entries of a
   * cluster between which the biconnected component of the flattened graph changes.
   */
  public @Nullable IntPairList augmentation() {
    return augmentation;
  }

  /** Returns 'index' if it is the handle of a live node, and NONE otherwise. */
  public int nodeFromIndex(int index) {
    return index >= 0 && index < graph.nodeArenaSize() && graph.isNodeAlive(index) ? index : NONE;
  }

  /**
   * Returns a debug label of 'node': the label recorded for pipe nodes, such as "CN 12 [3<0]" for
   * the cluster-side node of cluster 3 in the root, or the handle and degree of any other node.
   */
  public String formatNode(int node) {
    String label = nodeLabels.get(node);
    if (label != null) {
      return label;
    }
    return graph.isNodeAlive(node) ? node + " (deg " + graph.degree(node) + ")" : node + " (dead)";
  }

  @Override
  public String toString() {
    return "SyncPlan(" + state + ", " + matchings.getPipeCount() + " pipes)";
  }

  /** Options for {@link SyncPlan}. Use {@link Builder} to create an instance. */
  public static final class Options {
    /** The default value of {@link #augmentation()}. */
    public static final boolean DEFAULT_AUGMENTATION = false;

    /** An immutable instance of Options with the default values. */
    public static final Options DEFAULT = new Options();

    private boolean augmentation;
    private boolean consistencyChecks;

    /** The Options constructor initializes the default options. */
    public Options() {
      this.augmentation = DEFAULT_AUGMENTATION;
      this.consistencyChecks = defaultConsistencyChecks();
    }

    /** A copy constructor for internal use. */
    Options(Options other) {
      this.augmentation = other.augmentation;
      this.consistencyChecks = other.consistencyChecks;
    }

    /**
     * Returns whether replaying the undo log collects augmentation pairs, see {@link
     * SyncPlan#augmentation()}. Collecting them costs one biconnected components computation of
     * the flattened graph. The default is false.
     */
    public boolean augmentation() {
      return augmentation;
    }

    /**
     * Returns whether the invariants of the flattened instance and of the restored clustered
     * embedding are verified, throwing a {@link SyncPlanException} if they do not hold. The default
     * is true if and only if Java assertions are enabled for this package.
     */
    public boolean consistencyChecks() {
      return consistencyChecks;
    }

    @SuppressWarnings("AssertionSideEffect")
    private static boolean defaultConsistencyChecks() {
      boolean enabled = false;
      assert enabled = true;
      return enabled;
    }

    @Override
    public String toString() {
      return "Options(augmentation="
          + augmentation
          + ", consistencyChecks="
          + consistencyChecks
          + ")";
    }

    /** A builder of {@link Options}, starting from the defaults. */
    public static final class Builder {
      private final Options options;

      public Builder() {
        options = new Options();
      }

      public Builder(Options options) {
        this.options = new Options(options);
      }

      @CanIgnoreReturnValue
      public Builder setAugmentation(boolean augmentation) {
        options.augmentation = augmentation;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder setConsistencyChecks(boolean consistencyChecks) {
        options.consistencyChecks = consistencyChecks;
        return this;
      }

      public Options build() {
        return new Options(options);
      }
    }
  }
}
