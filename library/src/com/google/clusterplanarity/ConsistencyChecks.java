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

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * Verification of the invariants that hold between the steps of a {@link SyncPlan}. Every check
 * comes in a form that fills a {@link SyncPlanError} and returns false, and a form that throws
 * {@link SyncPlanException}. They are run when {@link SyncPlan.Options#consistencyChecks()} is set.
 */
public final class ConsistencyChecks {

  private ConsistencyChecks() {}

  /**
   * Returns true if no node or edge with a handle at or beyond the given arena sizes is alive.
   */
  public static boolean isReset(
      Graph graph, int nodeArenaSize, int edgeArenaSize, SyncPlanError error) {
    for (int n = nodeArenaSize; n < graph.nodeArenaSize(); n++) {
      if (graph.isNodeAlive(n)) {
        error.init(SyncPlanError.Code.INDICES_NOT_RESET, "Node %s is still alive", n);
        return false;
      }
    }
    for (int e = edgeArenaSize; e < graph.edgeArenaSize(); e++) {
      if (graph.isEdgeAlive(e)) {
        error.init(SyncPlanError.Code.INDICES_NOT_RESET, "Edge %s is still alive", e);
        return false;
      }
    }
    return true;
  }

  /**
   * Returns true if a freshly constructed plan is in the flattened state: the graph and pipes are
   * consistent, there is exactly one pipe per non-root cluster, and only the root has members.
   */
  public static boolean isFlattened(SyncPlan plan, SyncPlanError error) {
    if (!plan.graph().isConsistent(error)
        || !plan.clusterGraph().isConsistent(error)
        || !plan.matchings().isConsistent(error)) {
      return false;
    }
    ClusterGraph clusterGraph = plan.clusterGraph();
    int nonRoot = clusterGraph.numberOfClusters() - 1;
    if (plan.matchings().getPipeCount() != nonRoot) {
      error.init(
          SyncPlanError.Code.INTERNAL,
          "%s pipes for %s non-root clusters",
          plan.matchings().getPipeCount(),
          nonRoot);
      return false;
    }
    for (int c : clusterGraph.clusters()) {
      if (c != clusterGraph.rootCluster() && clusterGraph.numberOfNodes(c) != 0) {
        error.init(SyncPlanError.Code.INVALID_CLUSTERS, "Cluster %s still has members", c);
        return false;
      }
    }
    return true;
  }

  /** Throws a {@link SyncPlanException} unless {@link #isFlattened} holds. */
  public static void checkFlattenedOrThrow(SyncPlan plan) {
    SyncPlanError error = new SyncPlanError();
    if (!isFlattened(plan, error)) {
      throw new SyncPlanException(error);
    }
  }

  /**
   * Returns true if a plan whose undo log has been replayed is consistent: graph and cluster tree
   * are well formed, no pipes remain, and the boundary list of every non-root cluster holds exactly
   * one entry, at a node inside the cluster, for each edge leaving the cluster.
   */
  public static boolean isClusterEmbeddingConsistent(SyncPlan plan, SyncPlanError error) {
    Graph graph = plan.graph();
    ClusterGraph clusterGraph = plan.clusterGraph();
    if (!graph.isConsistent(error) || !clusterGraph.isConsistent(error)) {
      return false;
    }
    if (!plan.matchings().isEmpty()) {
      error.init(
          SyncPlanError.Code.DANGLING_PIPE,
          "%s pipes remain after replay",
          plan.matchings().getPipeCount());
      return false;
    }
    for (int c : clusterGraph.clusters()) {
      if (c == clusterGraph.rootCluster()) {
        if (!clusterGraph.adjEntries(c).isEmpty()) {
          error.init(SyncPlanError.Code.BOUNDARY_MISMATCH, "Root cluster has a boundary");
          return false;
        }
        continue;
      }
      IntOpenHashSet seen = new IntOpenHashSet();
      for (int adj : clusterGraph.adjEntries(c)) {
        if (!graph.isAdjAlive(adj)
            || !clusterGraph.isDescendant(clusterGraph.clusterOf(graph.nodeOf(adj)), c)
            || clusterGraph.isDescendant(clusterGraph.clusterOf(graph.twinNode(adj)), c)
            || !seen.add(Graph.edgeOf(adj))) {
          error.init(
              SyncPlanError.Code.BOUNDARY_MISMATCH,
              "Entry %s does not leave cluster %s exactly once",
              adj,
              c);
          return false;
        }
      }
      int crossing = crossingEdges(graph, clusterGraph, c).size();
      if (crossing != seen.size()) {
        error.init(
            SyncPlanError.Code.BOUNDARY_MISMATCH,
            "Cluster %s has %s crossing edges but %s boundary entries",
            c,
            crossing,
            seen.size());
        return false;
      }
    }
    return true;
  }

  /** Throws a {@link SyncPlanException} unless {@link #isClusterEmbeddingConsistent} holds. */
  public static void checkClusterEmbeddingOrThrow(SyncPlan plan) {
    SyncPlanError error = new SyncPlanError();
    if (!isClusterEmbeddingConsistent(plan, error)) {
      throw new SyncPlanException(error);
    }
  }

  /** Returns true if the rotation system of 'graph' is a planar embedding. */
  public static boolean isPlanarEmbedding(Graph graph, SyncPlanError error) {
    if (!GraphAlgorithms.isPlanarEmbedding(graph)) {
      error.init(
          SyncPlanError.Code.NOT_PLANAR_EMBEDDING,
          "Rotation system with %s nodes, %s edges and %s faces is not planar",
          graph.numberOfNodes(),
          graph.numberOfEdges(),
          GraphAlgorithms.numberOfFaces(graph));
      return false;
    }
    return true;
  }

  /**
   * Returns the edges with exactly one endpoint in 'cluster' or its descendants, as the entries at
   * their inside endpoint.
   */
  public static IntArrayList crossingEdges(Graph graph, ClusterGraph clusterGraph, int cluster) {
    IntArrayList result = new IntArrayList();
    for (int e : graph.edges()) {
      boolean sourceInside =
          clusterGraph.isDescendant(clusterGraph.clusterOf(graph.source(e)), cluster);
      boolean targetInside =
          clusterGraph.isDescendant(clusterGraph.clusterOf(graph.target(e)), cluster);
      if (sourceInside != targetInside) {
        result.add(sourceInside ? Graph.sourceAdj(e) : Graph.targetAdj(e));
      }
    }
    return result;
  }
}
