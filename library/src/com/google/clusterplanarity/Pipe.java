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

import com.google.common.base.Preconditions;

/**
 * An unordered pair of matched nodes standing in for a flattened cluster boundary. The incident
 * edges of the two nodes are in bijection, see {@link PipeBijection}. Pipes are created and
 * destroyed only by {@link PipeMatching}.
 */
public final class Pipe {
  private final Graph graph;
  private final int node0;
  private final int node1;

  Pipe(Graph graph, int node0, int node1) {
    this.graph = graph;
    this.node0 = node0;
    this.node1 = node1;
  }

  public int node0() {
    return node0;
  }

  public int node1() {
    return node1;
  }

  /** Returns the node of this pipe that is not 'node'. */
  public int other(int node) {
    Preconditions.checkArgument(
        node == node0 || node == node1, "Node %s is not part of pipe %s", node, this);
    return node == node0 ? node1 : node0;
  }

  /** Returns the common degree of both nodes. */
  public int degree() {
    return graph.degree(node0);
  }

  @Override
  public String toString() {
    return "Pipe(" + node0 + ", " + node1 + ")";
  }
}
