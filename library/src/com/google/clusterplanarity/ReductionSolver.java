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

/**
 * The synchronized planarity procedure that a {@link SyncPlan} hands its flattened instance to.
 *
 * <p>On success of both steps, the rotation system of {@link SyncPlan#graph()} must be a planar
 * embedding in which the two sides of every pipe are embedded consistently: walking one node of a
 * pipe forward visits the partners of its entries, as given by {@link
 * PipeMatching#getIncidentEdgeBijection}, in the order obtained by walking the other node backward.
 *
 * <p>The bijection is anchored to the heads of the adjacency lists, not just their cyclic orders:
 * the first entry of one pipe node is paired with the last entry of the other, the second with the
 * second to last, and so on. Rotating the list of only one node of a pipe leaves the embedding
 * unchanged but pairs different entries, and the halves joined back on replay are then the wrong
 * ones. A solver that rotates a pipe node's list must rotate its twin's list by the same number of
 * steps in the opposite direction. A solver that contracts pipes must restore them, with their
 * bijection, before returning from {@link #solveReduced}.
 */
public interface ReductionSolver {

  /**
   * Reduces the instance held by 'plan' until every pipe can be solved directly. Returns false if
   * the instance was found to be infeasible.
   */
  boolean makeReduced(SyncPlan plan);

  /**
   * Solves the reduced instance held by 'plan', leaving a consistent embedding in its graph.
   * Returns false if the instance is infeasible.
   */
  boolean solveReduced(SyncPlan plan);
}
