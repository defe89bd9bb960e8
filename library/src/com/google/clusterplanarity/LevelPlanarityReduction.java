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
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.Arrays;
import java.util.List;

/**
 * Reduces level planarity to cluster planarity. The levels become a chain of nested clusters, the
 * last level in the outermost cluster below the root, and every level node becomes an edge between
 * a node u inside the cluster of its level and a node v in the parent of that cluster. An edge s→t
 * of the level graph then becomes the edge v(s)→u(t).
 */
public final class LevelPlanarityReduction {

  private LevelPlanarityReduction() {}

  /**
   * Adds the clustered graph equivalent to the level graph 'levelGraph' with levels 'levels' to
   * 'graph' and 'clusterGraph'. Level edges must lead from a level to a later one.
   *
   * @return maps each new edge that stands for a level node to that node
   */
  public static Int2IntOpenHashMap reduce(
      Graph levelGraph, List<? extends IntList> levels, Graph graph, ClusterGraph clusterGraph) {
    Preconditions.checkArgument(
        clusterGraph.getGraph() == graph, "Cluster graph does not belong to the graph");
    int[] inner = new int[levelGraph.nodeArenaSize()];
    int[] outer = new int[levelGraph.nodeArenaSize()];
    Arrays.fill(inner, NONE);
    Arrays.fill(outer, NONE);
    Int2IntOpenHashMap nodeOfEdge = new Int2IntOpenHashMap();
    nodeOfEdge.defaultReturnValue(NONE);

    int parent = clusterGraph.rootCluster();
    for (int level = levels.size() - 1; level >= 0; level--) {
      int cluster = clusterGraph.newCluster(parent);
      for (int n : levels.get(level)) {
        Preconditions.checkArgument(
            levelGraph.isNodeAlive(n) && inner[n] == NONE,
            "Node %s is not a live node on a single level",
            n);
        int u = graph.newNode();
        int v = graph.newNode();
        clusterGraph.reassignNode(u, cluster);
        clusterGraph.reassignNode(v, parent);
        inner[n] = u;
        outer[n] = v;
        nodeOfEdge.put(graph.newEdge(u, v), n);
      }
      parent = cluster;
    }
    for (int e : levelGraph.edges()) {
      int s = levelGraph.source(e);
      int t = levelGraph.target(e);
      Preconditions.checkArgument(
          outer[s] != NONE && inner[t] != NONE, "Edge %s joins nodes without a level", e);
      graph.newEdge(outer[s], inner[t]);
    }
    return nodeOfEdge;
  }
}
