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

import com.google.clusterplanarity.primitives.IntPairList;
import com.google.common.base.Preconditions;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Tests clustered graphs for cluster planarity and embeds them, by reduction to synchronized
 * planarity with a {@link SyncPlan} and a {@link ReductionSolver}.
 *
 * <p>Three entry points differ in what they leave behind:
 *
 * <ul>
 *   <li>{@link #isClusterPlanarDestructive} only decides; the inputs are left flattened.
 *   <li>{@link #clusterPlanarEmbedClusterPlanarGraph} embeds in place; on failure the inputs are
 *       left flattened.
 *   <li>{@link #clusterPlanarEmbed} works on a copy and only writes the embedding back on success.
 * </ul>
 */
public class SyncPlanClusterPlanarity {
  private static final Logger log = Platform.getLoggerForClass(SyncPlanClusterPlanarity.class);

  private final ReductionSolver solver;
  private final SyncPlan.Options options;
  private @Nullable IntPairList augmentation;

  public SyncPlanClusterPlanarity(ReductionSolver solver) {
    this(solver, SyncPlan.Options.DEFAULT);
  }

  public SyncPlanClusterPlanarity(ReductionSolver solver, SyncPlan.Options options) {
    this.solver = Preconditions.checkNotNull(solver);
    this.options = Preconditions.checkNotNull(options);
  }

  /**
   * Returns true if 'clusterGraph' is cluster planar. Both 'clusterGraph' and its graph 'graph' are
   * left in the state the solver leaves them in, and must not be used afterwards.
   */
  public boolean isClusterPlanarDestructive(ClusterGraph clusterGraph, Graph graph) {
    SyncPlan plan = new SyncPlan(graph, clusterGraph, solver, options);
    augmentation = null;
    try {
      boolean result = plan.makeReduced() && plan.solveReduced();
      log.fine("Cluster planarity test: " + result);
      return result;
    } finally {
      plan.matchings().detach();
    }
  }

  /**
   * Embeds 'clusterGraph' in place, if it is cluster planar. On success, 'graph' holds a
   * cluster-planar embedding and every cluster its boundary entries. On failure both are left in
   * the state the solver leaves them in.
   *
   * @return true if the clustered graph is cluster planar
   */
  public boolean clusterPlanarEmbedClusterPlanarGraph(ClusterGraph clusterGraph, Graph graph) {
    SyncPlan plan = new SyncPlan(graph, clusterGraph, solver, options);
    augmentation = null;
    try {
      if (!plan.makeReduced() || !plan.solveReduced()) {
        return false;
      }
      plan.embed();
      augmentation = plan.augmentation();
      return true;
    } finally {
      plan.matchings().detach();
    }
  }

  /**
   * Embeds 'clusterGraph' if it is cluster planar, working on a copy of it. On success, the
   * rotation of every node of 'graph', the boundary list of every cluster and the augmentation
   * pairs are taken from the embedded copy. On failure, 'graph' and 'clusterGraph' are unchanged.
   *
   * @return true if the clustered graph is cluster planar
   */
  public boolean clusterPlanarEmbed(ClusterGraph clusterGraph, Graph graph) {
    Preconditions.checkArgument(
        clusterGraph.getGraph() == graph, "Cluster graph does not belong to the graph");
    Graph graphCopy = graph.copy();
    ClusterGraph clusterGraphCopy = clusterGraph.copy(graphCopy);
    try {
      if (!clusterPlanarEmbedClusterPlanarGraph(clusterGraphCopy, graphCopy)) {
        return false;
      }
      graph.copyEmbeddingFrom(graphCopy);
      for (int c : clusterGraph.clusters()) {
        clusterGraph.adjEntries(c).clear();
        clusterGraph.adjEntries(c).addAll(clusterGraphCopy.adjEntries(c));
      }
      clusterGraph.setAdjAvailable(true);
      return true;
    } finally {
      clusterGraphCopy.detach();
    }
  }

  /**
   * Returns the augmentation pairs of the last successful embedding, or null if none were
   * collected. See {@link SyncPlan#augmentation()}.
   */
  public @Nullable IntPairList augmentation() {
    return augmentation;
  }
}
