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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * A rooted tree of clusters over the nodes of a {@link Graph}. Every live node of the graph belongs
 * to exactly one cluster, its innermost one. Clusters are integer handles; the root cluster always
 * has handle {@link #ROOT}.
 *
 * <p>The ClusterGraph observes its graph: nodes created after construction are placed in the root
 * cluster and deleted nodes leave their cluster. Member nodes are kept in insertion order, so that
 * reassigning nodes in a recorded order reproduces the recorded membership order.
 *
 * <p>Each cluster also has a list of boundary adjacency entries, {@link #adjEntries(int)}. After a
 * cluster-planar embedding has been computed it holds, in cyclic order, the entries at the
 * cluster's nodes of all edges leaving the cluster. The lists are only meaningful while {@link
 * #adjAvailable()} is true.
 */
public class ClusterGraph {
  /** The handle of the root cluster. */
  public static final int ROOT = 0;

  private final Graph graph;

  // Per cluster.
  private final IntArrayList parents = new IntArrayList();
  private final List<IntArrayList> children = new ArrayList<>();
  private final List<IntLinkedOpenHashSet> members = new ArrayList<>();
  private final List<IntArrayList> boundaries = new ArrayList<>();
  private final BitSet liveClusters = new BitSet();
  private int numClusters = 0;

  // Per node of the graph.
  private final IntArrayList clusterOfNode = new IntArrayList();

  private boolean adjAvailable = false;

  private final GraphObserver observer =
      new GraphObserver() {
        @Override
        public void nodeAdded(int node) {
          while (clusterOfNode.size() <= node) {
            clusterOfNode.add(NONE);
          }
          clusterOfNode.set(node, ROOT);
          members.get(ROOT).add(node);
        }

        @Override
        public void nodeDeleted(int node) {
          members.get(clusterOfNode.getInt(node)).remove(node);
          clusterOfNode.set(node, NONE);
        }

        @Override
        public void arenaTruncated(int nodeArenaSize, int edgeArenaSize) {
          clusterOfNode.size(Math.min(clusterOfNode.size(), nodeArenaSize));
        }
      };

  /** Creates a ClusterGraph over 'graph' with all of its nodes in the root cluster. */
  public ClusterGraph(Graph graph) {
    this.graph = graph;
    int root = allocateCluster(NONE);
    assert root == ROOT;
    for (int i = 0; i < graph.nodeArenaSize(); i++) {
      clusterOfNode.add(NONE);
    }
    for (int n : graph.nodes()) {
      clusterOfNode.set(n, ROOT);
      members.get(ROOT).add(n);
    }
    graph.addObserver(observer);
  }

  /** Copy constructor, see {@link #copy(Graph)}. */
  private ClusterGraph(ClusterGraph other, Graph graph) {
    this.graph = graph;
    parents.addAll(other.parents);
    for (int c = 0; c < other.children.size(); c++) {
      children.add(new IntArrayList(other.children.get(c)));
      members.add(new IntLinkedOpenHashSet(other.members.get(c)));
      boundaries.add(new IntArrayList(other.boundaries.get(c)));
    }
    liveClusters.or(other.liveClusters);
    numClusters = other.numClusters;
    clusterOfNode.addAll(other.clusterOfNode);
    adjAvailable = other.adjAvailable;
    graph.addObserver(observer);
  }

  /**
   * Returns a copy of this ClusterGraph attached to 'graphCopy', which must be a {@link
   * Graph#copy()} of this ClusterGraph's graph. Cluster handles, membership order and boundary
   * lists are identical in the copy.
   */
  public ClusterGraph copy(Graph graphCopy) {
    Preconditions.checkArgument(graphCopy != graph, "The copy needs its own graph");
    Preconditions.checkArgument(
        graphCopy.nodeArenaSize() == graph.nodeArenaSize()
            && graphCopy.numberOfNodes() == graph.numberOfNodes(),
        "Graph is not a copy of the clustered graph");
    return new ClusterGraph(this, graphCopy);
  }

  /** Returns the graph whose nodes are clustered. */
  public Graph getGraph() {
    return graph;
  }

  public int rootCluster() {
    return ROOT;
  }

  /** Returns the number of live clusters, including the root. */
  public int numberOfClusters() {
    return numClusters;
  }

  /** Returns the largest cluster handle ever handed out. */
  public int maxClusterIndex() {
    return parents.size() - 1;
  }

  public boolean isClusterAlive(int cluster) {
    return cluster >= 0 && liveClusters.get(cluster);
  }

  /** Returns the live clusters in increasing handle order. */
  public IntArrayList clusters() {
    IntArrayList result = new IntArrayList(numClusters);
    for (int c = liveClusters.nextSetBit(0); c >= 0; c = liveClusters.nextSetBit(c + 1)) {
      result.add(c);
    }
    return result;
  }

  /** Creates a new empty cluster as the last child of 'parent'. */
  @CanIgnoreReturnValue
  public int newCluster(int parent) {
    checkCluster(parent);
    int cluster = allocateCluster(parent);
    children.get(parent).add(cluster);
    return cluster;
  }

  /**
   * Deletes the non-root 'cluster'. Its member nodes and child clusters move to its parent, the
   * children taking the position of the deleted cluster among its siblings.
   */
  public void deleteCluster(int cluster) {
    checkCluster(cluster);
    Preconditions.checkArgument(cluster != ROOT, "Cannot delete the root cluster");
    int parent = parents.getInt(cluster);
    for (int n : nodes(cluster)) {
      reassignNode(n, parent);
    }
    IntArrayList siblings = children.get(parent);
    int pos = siblings.indexOf(cluster);
    siblings.removeInt(pos);
    IntArrayList orphans = children.get(cluster);
    siblings.addElements(pos, orphans.toIntArray());
    for (int child : orphans) {
      parents.set(child, parent);
    }
    orphans.clear();
    boundaries.get(cluster).clear();
    parents.set(cluster, NONE);
    liveClusters.clear(cluster);
    numClusters--;
  }

  /** Returns the parent of 'cluster', or NONE for the root. */
  public int parent(int cluster) {
    checkCluster(cluster);
    return parents.getInt(cluster);
  }

  /** Returns the children of 'cluster' in order. The list must not be modified. */
  public IntArrayList children(int cluster) {
    checkCluster(cluster);
    return children.get(cluster);
  }

  /** Returns a copy of the member nodes of 'cluster' (not of its descendants), in order. */
  public IntArrayList nodes(int cluster) {
    checkCluster(cluster);
    return new IntArrayList(members.get(cluster));
  }

  /** Returns the number of nodes directly in 'cluster'. */
  public int numberOfNodes(int cluster) {
    checkCluster(cluster);
    return members.get(cluster).size();
  }

  /** Returns the innermost cluster of 'node'. */
  public int clusterOf(int node) {
    Preconditions.checkArgument(graph.isNodeAlive(node), "Node %s is not a live node", node);
    return clusterOfNode.getInt(node);
  }

  /** Moves 'node' into 'cluster', appending it to the cluster's members. */
  public void reassignNode(int node, int cluster) {
    checkCluster(cluster);
    int old = clusterOf(node);
    if (old == cluster) {
      return;
    }
    members.get(old).remove(node);
    members.get(cluster).add(node);
    clusterOfNode.set(node, cluster);
  }

  /** Returns true if 'cluster' is 'ancestor' or lies below it. */
  public boolean isDescendant(int cluster, int ancestor) {
    checkCluster(ancestor);
    for (int c = cluster; c != NONE; c = parents.getInt(c)) {
      if (c == ancestor) {
        return true;
      }
    }
    return false;
  }

  /** Returns the first cluster of a post-order traversal, the leftmost leaf of the tree. */
  public int firstPostOrderCluster() {
    return leftmostLeaf(ROOT);
  }

  /**
   * Returns the cluster following 'cluster' in post-order, or NONE after the root. Children come
   * before their parents, and the root is always last.
   */
  public int postOrderSuccessor(int cluster) {
    checkCluster(cluster);
    int parent = parents.getInt(cluster);
    if (parent == NONE) {
      return NONE;
    }
    IntArrayList siblings = children.get(parent);
    int pos = siblings.indexOf(cluster);
    if (pos + 1 < siblings.size()) {
      return leftmostLeaf(siblings.getInt(pos + 1));
    }
    return parent;
  }

  /** Returns all clusters in post-order, ending with the root. */
  public IntArrayList postOrder() {
    IntArrayList result = new IntArrayList(numClusters);
    for (int c = firstPostOrderCluster(); c != NONE; c = postOrderSuccessor(c)) {
      result.add(c);
    }
    return result;
  }

  private int leftmostLeaf(int cluster) {
    int c = cluster;
    while (!children.get(c).isEmpty()) {
      c = children.get(c).getInt(0);
    }
    return c;
  }

  /**
   * Returns the boundary adjacency entries of 'cluster'. The list is mutable and is filled when a
   * cluster-planar embedding is reconstructed.
   */
  public IntArrayList adjEntries(int cluster) {
    checkCluster(cluster);
    return boundaries.get(cluster);
  }

  /** Returns true if the boundary lists describe the current embedding. */
  public boolean adjAvailable() {
    return adjAvailable;
  }

  public void setAdjAvailable(boolean adjAvailable) {
    this.adjAvailable = adjAvailable;
  }

  /** Detaches this ClusterGraph from its graph. It must not be used afterwards. */
  public void detach() {
    graph.removeObserver(observer);
  }

  private int allocateCluster(int parent) {
    int cluster = parents.size();
    parents.add(parent);
    children.add(new IntArrayList());
    members.add(new IntLinkedOpenHashSet());
    boundaries.add(new IntArrayList());
    liveClusters.set(cluster);
    numClusters++;
    return cluster;
  }

  private void checkCluster(int cluster) {
    Preconditions.checkArgument(
        isClusterAlive(cluster), "Cluster %s is not a live cluster", cluster);
  }

  /**
   * Returns true if the cluster tree is well formed and every live node of the graph is a member of
   * exactly the cluster recorded for it. If not, sets 'error' and returns false.
   */
  public boolean isConsistent(SyncPlanError error) {
    int memberCount = 0;
    for (int c = liveClusters.nextSetBit(0); c >= 0; c = liveClusters.nextSetBit(c + 1)) {
      int parent = parents.getInt(c);
      if ((c == ROOT) != (parent == NONE)) {
        error.init(SyncPlanError.Code.INVALID_CLUSTERS, "Cluster %s has parent %s", c, parent);
        return false;
      }
      if (parent != NONE
          && (!liveClusters.get(parent) || !children.get(parent).contains(c))) {
        error.init(
            SyncPlanError.Code.INVALID_CLUSTERS, "Cluster %s is not a child of %s", c, parent);
        return false;
      }
      for (int n : members.get(c)) {
        if (!graph.isNodeAlive(n) || clusterOfNode.getInt(n) != c) {
          error.init(
              SyncPlanError.Code.INVALID_CLUSTERS, "Node %s is listed in cluster %s", n, c);
          return false;
        }
        memberCount++;
      }
    }
    if (memberCount != graph.numberOfNodes()) {
      error.init(
          SyncPlanError.Code.INVALID_CLUSTERS,
          "%s nodes are clustered but the graph has %s",
          memberCount,
          graph.numberOfNodes());
      return false;
    }
    int reached = 0;
    for (int c = firstPostOrderCluster(); c != NONE; c = postOrderSuccessor(c)) {
      if (++reached > numClusters) {
        error.init(SyncPlanError.Code.INVALID_CLUSTERS, "Cluster tree contains a cycle");
        return false;
      }
    }
    if (reached != numClusters) {
      error.init(
          SyncPlanError.Code.INVALID_CLUSTERS,
          "Only %s of %s clusters are reachable from the root",
          reached,
          numClusters);
      return false;
    }
    return true;
  }
}
