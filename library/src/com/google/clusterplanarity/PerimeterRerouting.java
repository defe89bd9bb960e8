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
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Flattens a cluster hierarchy into an ordinary graph with one {@link Pipe} per non-root cluster,
 * by rerouting every edge that crosses a cluster boundary through a pair of matched nodes, and
 * provides the inverse operation that welds a pipe's edges back together.
 *
 * <p>Clusters are processed in post-order, so that when a cluster is processed all of its
 * descendants have already been replaced by the parent-side nodes of their pipes, which are members
 * of the cluster itself.
 */
public final class PerimeterRerouting {
  private static final Logger log = Platform.getLoggerForClass(PerimeterRerouting.class);

  private PerimeterRerouting() {}

  /**
   * Splits the edge of 'adj' into two halves. 'adj' lies on the foreign node x and the edge joins x
   * with some node n. Afterwards the original edge joins x with 'pn': it keeps its handle, its
   * direction and its entry (and so its position) at x, and its other end is appended to the
   * rotation of 'pn'. A new edge joins 'cn' with n; its entry at n takes the position the original
   * edge had in the rotation of n, and its entry at 'cn' is appended. The halves are directed such
   * that x→n becomes x→pn and cn→n, and n→x becomes n→cn and pn→x.
   *
   * @return the new edge between 'cn' and n
   */
  @CanIgnoreReturnValue
  public static int splitEdge(Graph graph, int adj, int pn, int cn) {
    int localAdj = Graph.twin(adj);
    int n = graph.nodeOf(localAdj);
    Preconditions.checkArgument(n != pn && n != cn, "Edge of %s is already split", adj);
    int half;
    int halfLocalAdj;
    if (Graph.isSourceEntry(adj)) {
      half = graph.newEdge(cn, n);
      halfLocalAdj = Graph.targetAdj(half);
    } else {
      half = graph.newEdge(n, cn);
      halfLocalAdj = Graph.sourceAdj(half);
    }
    graph.moveAdjBefore(halfLocalAdj, localAdj);
    graph.moveEndpoint(localAdj, pn, NONE);
    return half;
  }

  /**
   * Welds the edges of the matched nodes 't' and 'n' back together and deletes both nodes. 'bij'
   * must be the bijection of 't', pairing each entry a at 't' with an entry b at 'n'. For every
   * pair, the edge of a is kept: its end at 't' moves onto the far node of b, taking the position
   * of b's twin there, and the edge of b is deleted. Afterwards each a is the entry of the restored
   * edge at the far node of b. This exactly undoes {@link #splitEdge} for a pipe built by {@link
   * #flatten}, edge handles and directions included.
   *
   * <p>The caller must have removed the matching of 't' and 'n' already. All pairs are checked
   * before the graph is modified.
   */
  public static void join(Graph graph, int t, int n, PipeBijection bij) {
    Preconditions.checkArgument(
        bij.size() == graph.degree(t) && bij.size() == graph.degree(n),
        "Bijection of size %s does not cover nodes %s and %s",
        bij.size(),
        t,
        n);
    IntOpenHashSet seen = new IntOpenHashSet();
    for (int i = 0; i < bij.size(); i++) {
      int a = bij.getFirst(i);
      int b = bij.getSecond(i);
      Preconditions.checkArgument(graph.nodeOf(a) == t, "Entry %s is not at node %s", a, t);
      Preconditions.checkArgument(graph.nodeOf(b) == n, "Entry %s is not at node %s", b, n);
      Preconditions.checkArgument(
          Graph.isSourceEntry(a) != Graph.isSourceEntry(b),
          "Halves %s and %s would not form a directed edge",
          a,
          b);
      Preconditions.checkArgument(seen.add(a), "Entry %s is paired twice", a);
      Preconditions.checkArgument(seen.add(b), "Entry %s is paired twice", b);
    }
    for (int i = 0; i < bij.size(); i++) {
      int a = bij.getFirst(i);
      int b = bij.getSecond(i);
      int farAdj = Graph.twin(b);
      int far = graph.nodeOf(farAdj);
      graph.moveEndpoint(a, far, farAdj);
      graph.deleteEdge(Graph.edgeOf(b));
    }
    graph.deleteNode(t);
    graph.deleteNode(n);
  }

  /**
   * Reroutes the perimeter-crossing edges of every non-root cluster of 'clusterGraph' through a new
   * pipe and finally moves all nodes into the root cluster. For each cluster c with parent p, in
   * post-order:
   *
   * <ol>
   *   <li>new nodes cn (in c) and pn (in p) are created, and cn is recorded in the snapshot of c;
   *   <li>every edge from a node of c to a node outside c is split by {@link #splitEdge};
   *   <li>if any edge was split, the rotation of pn is reversed, mirroring that of cn;
   *   <li>cn and pn are matched.
   * </ol>
   *
   * <p>A cluster without crossing edges still gets a pipe, of degree zero.
   *
   * @param snapshots the frozen clusters in reverse post-order, as captured by {@link
   *     UndoInitCluster}
   * @param nodeLabels if not null, receives debug labels of the created nodes
   */
  static void flatten(
      Graph graph,
      ClusterGraph clusterGraph,
      PipeMatching matchings,
      List<FrozenCluster> snapshots,
      @Nullable Int2ObjectMap<String> nodeLabels) {
    Preconditions.checkArgument(clusterGraph.getGraph() == graph, "Cluster graph of another graph");
    int root = clusterGraph.rootCluster();
    log.fine(
        "Processing "
            + clusterGraph.numberOfClusters()
            + " clusters from "
            + clusterGraph.firstPostOrderCluster()
            + " up to, but excluding root "
            + root
            + ".");

    int snapshotIndex = snapshots.size() - 1;
    for (int c = clusterGraph.firstPostOrderCluster(); c != root;
        c = clusterGraph.postOrderSuccessor(c)) {
      int parent = clusterGraph.parent(c);
      int cn = graph.newNode();
      int pn = graph.newNode();
      clusterGraph.reassignNode(cn, c);
      clusterGraph.reassignNode(pn, parent);
      if (nodeLabels != null) {
        nodeLabels.put(cn, "CN " + cn + " [" + c + "<" + parent + "]");
        nodeLabels.put(pn, "PN " + pn + " [" + parent + ">" + c + "]");
      }

      FrozenCluster snapshot = snapshots.get(snapshotIndex--);
      Preconditions.checkState(
          snapshot.index() == c, "Snapshot %s does not match cluster %s", snapshot.index(), c);
      snapshot.setParentNode(cn);

      int count = 0;
      for (int n : clusterGraph.nodes(c)) {
        if (n == cn) {
          continue;
        }
        IntArrayList crossing = new IntArrayList();
        for (int adj = graph.firstAdj(n); adj != NONE; adj = graph.succ(adj)) {
          if (clusterGraph.clusterOf(graph.twinNode(adj)) != c) {
            crossing.add(adj);
          }
        }
        count += crossing.size();
        if (log.isLoggable(Level.FINER)) {
          log.finer(
              "Node "
                  + n
                  + " of cluster "
                  + c
                  + " has "
                  + graph.degree(n)
                  + " incident edges, of which "
                  + crossing.size()
                  + " are perimeter-crossing.");
        }
        for (int adj : crossing) {
          splitEdge(graph, Graph.twin(adj), pn, cn);
        }
      }

      if (count == 0) {
        log.finer("Cluster " + c + " has no perimeter-crossing edges.");
      } else {
        graph.reverseAdjEdges(pn);
      }
      matchings.matchNodes(cn, pn);
      log.fine(
          "Matched child node "
              + cn
              + " in cluster "
              + c
              + " with parent node "
              + pn
              + " in cluster "
              + parent
              + " over "
              + count
              + " rerouted edges.");
    }
    Preconditions.checkState(
        snapshotIndex == 0 && snapshots.get(0).index() == root,
        "Snapshots do not cover the cluster tree");

    for (int c = clusterGraph.firstPostOrderCluster(); c != root;
        c = clusterGraph.postOrderSuccessor(c)) {
      for (int n : clusterGraph.nodes(c)) {
        clusterGraph.reassignNode(n, root);
      }
    }
  }

  /**
   * Reverts the flattening of one cluster: joins the pipe whose cluster-side node is 'cn', fills
   * the boundary list of 'cluster' and, if 'augmentation' is not null, appends a (previous,
   * current) pair of boundary entries wherever the biconnected component changes along the
   * boundary.
   */
  static void unflattenCluster(
      Graph graph,
      ClusterGraph clusterGraph,
      PipeMatching matchings,
      int cluster,
      int cn,
      int @Nullable [] bicomps,
      @Nullable IntPairList augmentation) {
    int pn = matchings.getTwin(cn);
    Preconditions.checkState(pn != NONE, "Node %s of cluster %s is not matched", cn, cluster);
    log.fine(
        "Processing cluster "
            + cluster
            + " with node "
            + cn
            + " matched with "
            + pn
            + " in the parent cluster "
            + clusterGraph.parent(cluster));

    PipeBijection bij = new PipeBijection();
    matchings.getIncidentEdgeBijection(pn, bij);
    if (log.isLoggable(Level.FINER)) {
      log.finer("Bijection " + bij.format(graph));
    }
    matchings.removeMatching(cn, pn);
    join(graph, pn, cn, bij);

    IntArrayList boundary = clusterGraph.adjEntries(cluster);
    boundary.clear();
    boolean trace = augmentation != null && bicomps != null && !bij.isEmpty();
    int component = trace ? bicomps[Graph.edgeOf(bij.getFirst(0))] : NONE;
    int pred = NONE;
    for (int i = 0; i < bij.size(); i++) {
      int curr = bij.getFirst(i);
      boundary.add(curr);
      if (trace && bicomps[Graph.edgeOf(curr)] != component) {
        augmentation.add(pred, curr);
        component = bicomps[Graph.edgeOf(curr)];
      }
      pred = curr;
    }
  }
}
