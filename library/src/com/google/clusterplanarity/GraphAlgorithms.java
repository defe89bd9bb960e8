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

import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.Arrays;

/** Connectivity and embedding algorithms over a {@link Graph}. */
public final class GraphAlgorithms {

  private GraphAlgorithms() {}

  /**
   * Fills 'componentOfNode', indexed by node handle and sized to the node arena, with the number of
   * the connected component of each live node; dead slots get NONE. Components are numbered from
   * zero in order of their smallest node. Returns the number of components.
   */
  public static int connectedComponents(Graph graph, int[] componentOfNode) {
    Arrays.fill(componentOfNode, NONE);
    int count = 0;
    for (int start : graph.nodes()) {
      if (componentOfNode[start] != NONE) {
        continue;
      }
      int component = count++;
      new FilteringBfs(graph, IntArrayList.of(start))
          .forEachRemaining(node -> componentOfNode[node] = component);
    }
    return count;
  }

  /**
   * Fills 'componentOfEdge', indexed by edge handle and sized to the edge arena, with the number of
   * the biconnected component of each live edge; dead slots get NONE. Every self-loop forms a
   * component of its own. Returns the number of biconnected components.
   */
  public static int biconnectedComponents(Graph graph, int[] componentOfEdge) {
    Arrays.fill(componentOfEdge, NONE);
    int arena = graph.nodeArenaSize();
    int[] discovered = new int[arena];
    int[] low = new int[arena];
    int[] parentEdge = new int[arena];
    int[] nextAdj = new int[arena];
    Arrays.fill(discovered, NONE);
    IntArrayList nodeStack = new IntArrayList();
    IntArrayList edgeStack = new IntArrayList();
    int time = 0;
    int count = 0;

    for (int root : graph.nodes()) {
      if (discovered[root] != NONE || graph.degree(root) == 0) {
        continue;
      }
      discovered[root] = low[root] = time++;
      parentEdge[root] = NONE;
      nextAdj[root] = graph.firstAdj(root);
      nodeStack.push(root);

      while (!nodeStack.isEmpty()) {
        int v = nodeStack.topInt();
        int adj = nextAdj[v];
        if (adj != NONE) {
          nextAdj[v] = graph.succ(adj);
          int edge = Graph.edgeOf(adj);
          int w = graph.twinNode(adj);
          if (w == v) {
            if (componentOfEdge[edge] == NONE) {
              componentOfEdge[edge] = count++;
            }
          } else if (edge == parentEdge[v]) {
            continue;
          } else if (discovered[w] == NONE) {
            edgeStack.push(edge);
            discovered[w] = low[w] = time++;
            parentEdge[w] = edge;
            nextAdj[w] = graph.firstAdj(w);
            nodeStack.push(w);
          } else if (discovered[w] < discovered[v]) {
            // Back edge to an ancestor.
            edgeStack.push(edge);
            low[v] = Math.min(low[v], discovered[w]);
          }
          continue;
        }

        nodeStack.popInt();
        int treeEdge = parentEdge[v];
        if (treeEdge == NONE) {
          continue;
        }
        int u = graph.opposite(treeEdge, v);
        low[u] = Math.min(low[u], low[v]);
        if (low[v] >= discovered[u]) {
          // u separates the subtree of v: everything stacked since the tree edge is one component.
          int component = count++;
          int e;
          do {
            e = edgeStack.popInt();
            componentOfEdge[e] = component;
          } while (e != treeEdge);
        }
      }
    }
    return count;
  }

  /**
   * Returns the number of faces of the rotation system of 'graph'. The face following the
   * adjacency entry 'adj' continues with the cyclic successor of its twin. Every isolated node
   * counts as a face of its own.
   */
  public static int numberOfFaces(Graph graph) {
    boolean[] seen = new boolean[2 * graph.edgeArenaSize()];
    int faces = 0;
    for (int edge : graph.edges()) {
      for (int start : new int[] {Graph.sourceAdj(edge), Graph.targetAdj(edge)}) {
        if (seen[start]) {
          continue;
        }
        faces++;
        int adj = start;
        do {
          seen[adj] = true;
          adj = graph.cyclicSucc(Graph.twin(adj));
        } while (adj != start);
      }
    }
    for (int node : graph.nodes()) {
      if (graph.degree(node) == 0) {
        faces++;
      }
    }
    return faces;
  }

  /**
   * Returns true if the rotation system of 'graph' is a planar embedding, i.e. every connected
   * component satisfies Euler's formula.
   */
  public static boolean isPlanarEmbedding(Graph graph) {
    int components = connectedComponents(graph, new int[graph.nodeArenaSize()]);
    return graph.numberOfNodes() - graph.numberOfEdges() + numberOfFaces(graph) == 2 * components;
  }
}
