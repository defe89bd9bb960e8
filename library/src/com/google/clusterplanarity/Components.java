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

import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import java.util.ArrayList;
import java.util.List;

/**
 * Connected components of a graph, labelled by {@link FilteringBfs}. The labelling is a snapshot:
 * it is not updated when the graph changes, until {@link #recompute()} is called.
 */
public class Components {
  private final Graph graph;
  private int[] componentOfNode = new int[0];
  private final List<IntArrayList> members = new ArrayList<>();

  public Components(Graph graph) {
    this.graph = graph;
  }

  /** Relabels the components of the graph in its current state. */
  public void recompute() {
    componentOfNode = new int[graph.nodeArenaSize()];
    int count = GraphAlgorithms.connectedComponents(graph, componentOfNode);
    members.clear();
    for (int i = 0; i < count; i++) {
      members.add(new IntArrayList());
    }
    for (int n : graph.nodes()) {
      members.get(componentOfNode[n]).add(n);
    }
  }

  /** Returns the number of components found by the last {@link #recompute()}. */
  public int count() {
    return members.size();
  }

  /**
   * Returns the component of 'node', or NONE if the node was not alive when the components were
   * last computed.
   */
  public int componentOf(int node) {
    Preconditions.checkArgument(node >= 0, "Invalid node %s", node);
    return node < componentOfNode.length ? componentOfNode[node] : NONE;
  }

  /** Returns the nodes of 'component' in increasing order. */
  public IntList nodesOf(int component) {
    Preconditions.checkElementIndex(component, members.size());
    return IntLists.unmodifiable(members.get(component));
  }

  /** Returns true if 'u' and 'v' were in the same component. */
  public boolean connected(int u, int v) {
    int c = componentOf(u);
    return c != NONE && c == componentOf(v);
  }
}
