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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * A mutable graph with a rotation system, i.e. every node keeps its incident edges in a cyclic
 * order. Nodes, edges and adjacency entries are small integer handles into arena tables owned by
 * the Graph; no other object ever owns them.
 *
 * <p>The edge with handle {@code e} has two adjacency entries: {@code 2e} at its source and {@code
 * 2e + 1} at its target, so the twin of the adjacency entry {@code a} is {@code a ^ 1}. Each node
 * keeps its adjacency entries in a doubly linked list whose order is the cyclic order of the
 * embedding.
 *
 * <p>Deleting a node or edge leaves a dead slot behind. Handles are never reused while the arena
 * grows, so the identity of a node or edge is stable across any sequence of other operations. The
 * arena may be shrunk back with {@link #truncate(int, int)} once all trailing slots are dead.
 *
 * <p>This class is not thread-safe.
 */
public class Graph {
  /** The null handle, used for "no node", "no edge" and "no adjacency entry". */
  public static final int NONE = -1;

  // Per node: first and last adjacency entry, and degree.
  private final IntArrayList firstAdj;
  private final IntArrayList lastAdj;
  private final IntArrayList degrees;
  private final BitSet liveNodes;

  // Per adjacency entry: owning node and list neighbours.
  private final IntArrayList adjNode;
  private final IntArrayList adjNext;
  private final IntArrayList adjPrev;
  private final BitSet liveEdges;

  private int numNodes = 0;
  private int numEdges = 0;

  private final List<GraphObserver> observers = new ArrayList<>();

  /** Constructs an empty graph. */
  public Graph() {
    firstAdj = new IntArrayList();
    lastAdj = new IntArrayList();
    degrees = new IntArrayList();
    liveNodes = new BitSet();
    adjNode = new IntArrayList();
    adjNext = new IntArrayList();
    adjPrev = new IntArrayList();
    liveEdges = new BitSet();
  }

  /** Copy constructor. The copy has the same handles as 'other', but no observers. */
  private Graph(Graph other) {
    firstAdj = new IntArrayList(other.firstAdj);
    lastAdj = new IntArrayList(other.lastAdj);
    degrees = new IntArrayList(other.degrees);
    liveNodes = (BitSet) other.liveNodes.clone();
    adjNode = new IntArrayList(other.adjNode);
    adjNext = new IntArrayList(other.adjNext);
    adjPrev = new IntArrayList(other.adjPrev);
    liveEdges = (BitSet) other.liveEdges.clone();
    numNodes = other.numNodes;
    numEdges = other.numEdges;
  }

  /**
   * Returns a copy of this graph in which every node, edge and adjacency entry has the same handle
   * and every rotation is the same as in this graph.
   */
  public Graph copy() {
    return new Graph(this);
  }

  /** Registers an observer that is told about node creation, deletion and arena truncation. */
  public void addObserver(GraphObserver observer) {
    observers.add(observer);
  }

  /** Unregisters an observer added with {@link #addObserver}. */
  public void removeObserver(GraphObserver observer) {
    observers.remove(observer);
  }

  @VisibleForTesting
  int numberOfObservers() {
    return observers.size();
  }

  ///////////////////////////////////////////////////////////////////////////////////////////////
  // Sizes and liveness

  /** Returns the number of live nodes. */
  public int numberOfNodes() {
    return numNodes;
  }

  /** Returns the number of live edges. */
  public int numberOfEdges() {
    return numEdges;
  }

  /** Returns one more than the largest node handle ever handed out (and not truncated). */
  public int nodeArenaSize() {
    return firstAdj.size();
  }

  /** Returns one more than the largest edge handle ever handed out (and not truncated). */
  public int edgeArenaSize() {
    return adjNode.size() / 2;
  }

  public boolean isNodeAlive(int node) {
    return node >= 0 && liveNodes.get(node);
  }

  public boolean isEdgeAlive(int edge) {
    return edge >= 0 && liveEdges.get(edge);
  }

  /** Returns true if 'adj' is an adjacency entry of a live edge. */
  public boolean isAdjAlive(int adj) {
    return adj >= 0 && liveEdges.get(adj >> 1);
  }

  /** Returns the live nodes in increasing handle order. */
  public IntArrayList nodes() {
    IntArrayList result = new IntArrayList(numNodes);
    for (int n = liveNodes.nextSetBit(0); n >= 0; n = liveNodes.nextSetBit(n + 1)) {
      result.add(n);
    }
    return result;
  }

  /** Returns the live edges in increasing handle order. */
  public IntArrayList edges() {
    IntArrayList result = new IntArrayList(numEdges);
    for (int e = liveEdges.nextSetBit(0); e >= 0; e = liveEdges.nextSetBit(e + 1)) {
      result.add(e);
    }
    return result;
  }

  ///////////////////////////////////////////////////////////////////////////////////////////////
  // Structure accessors

  public int degree(int node) {
    checkNode(node);
    return degrees.getInt(node);
  }

  /** Returns the source node of 'edge'. */
  public int source(int edge) {
    checkEdge(edge);
    return adjNode.getInt(2 * edge);
  }

  /** Returns the target node of 'edge'. */
  public int target(int edge) {
    checkEdge(edge);
    return adjNode.getInt(2 * edge + 1);
  }

  /** Returns the adjacency entry of 'edge' at its source. */
  public static int sourceAdj(int edge) {
    return 2 * edge;
  }

  /** Returns the adjacency entry of 'edge' at its target. */
  public static int targetAdj(int edge) {
    return 2 * edge + 1;
  }

  /** Returns the edge that 'adj' belongs to. */
  public static int edgeOf(int adj) {
    return adj >> 1;
  }

  /** Returns the adjacency entry at the other end of the edge of 'adj'. */
  public static int twin(int adj) {
    return adj ^ 1;
  }

  /** Returns true if 'adj' is the entry at the source of its edge. */
  public static boolean isSourceEntry(int adj) {
    return (adj & 1) == 0;
  }

  /** Returns the node that 'adj' is incident to. */
  public int nodeOf(int adj) {
    checkAdj(adj);
    return adjNode.getInt(adj);
  }

  /** Returns the node at the other end of the edge of 'adj'. */
  public int twinNode(int adj) {
    return nodeOf(twin(adj));
  }

  /** Returns the endpoint of 'edge' opposite to 'node'. */
  public int opposite(int edge, int node) {
    int s = source(edge);
    int t = target(edge);
    Preconditions.checkArgument(node == s || node == t, "Node %s is not on edge %s", node, edge);
    return node == s ? t : s;
  }

  /** Returns the first adjacency entry of 'node', or NONE if it is isolated. */
  public int firstAdj(int node) {
    checkNode(node);
    return firstAdj.getInt(node);
  }

  /** Returns the last adjacency entry of 'node', or NONE if it is isolated. */
  public int lastAdj(int node) {
    checkNode(node);
    return lastAdj.getInt(node);
  }

  /** Returns the entry after 'adj' in its node's list, or NONE if 'adj' is the last one. */
  public int succ(int adj) {
    checkAdj(adj);
    return adjNext.getInt(adj);
  }

  /** Returns the entry before 'adj' in its node's list, or NONE if 'adj' is the first one. */
  public int pred(int adj) {
    checkAdj(adj);
    return adjPrev.getInt(adj);
  }

  /** Returns the successor of 'adj' in the cyclic order around its node. */
  public int cyclicSucc(int adj) {
    int next = succ(adj);
    return next != NONE ? next : firstAdj.getInt(adjNode.getInt(adj));
  }

  /** Returns the predecessor of 'adj' in the cyclic order around its node. */
  public int cyclicPred(int adj) {
    int prev = pred(adj);
    return prev != NONE ? prev : lastAdj.getInt(adjNode.getInt(adj));
  }

  /** Returns the adjacency entries of 'node' in cyclic order, starting with the first entry. */
  public IntArrayList adjEntries(int node) {
    IntArrayList result = new IntArrayList(degree(node));
    for (int adj = firstAdj.getInt(node); adj != NONE; adj = adjNext.getInt(adj)) {
      result.add(adj);
    }
    return result;
  }

  /** Returns the neighbours of 'node' in cyclic order, with repetitions for multi-edges. */
  public IntArrayList neighbors(int node) {
    IntArrayList result = new IntArrayList(degree(node));
    for (int adj = firstAdj.getInt(node); adj != NONE; adj = adjNext.getInt(adj)) {
      result.add(adjNode.getInt(twin(adj)));
    }
    return result;
  }

  /** Returns some live edge between 'u' and 'v' in either direction, or NONE. */
  public int searchEdge(int u, int v) {
    for (int adj = firstAdj(u); adj != NONE; adj = adjNext.getInt(adj)) {
      if (adjNode.getInt(twin(adj)) == v) {
        return edgeOf(adj);
      }
    }
    return NONE;
  }

  ///////////////////////////////////////////////////////////////////////////////////////////////
  // Mutation

  /** Creates a new isolated node and returns its handle. */
  @CanIgnoreReturnValue
  public int newNode() {
    int node = firstAdj.size();
    firstAdj.add(NONE);
    lastAdj.add(NONE);
    degrees.add(0);
    liveNodes.set(node);
    numNodes++;
    for (GraphObserver observer : observers) {
      observer.nodeAdded(node);
    }
    return node;
  }

  /**
   * Creates a new edge from 'source' to 'target'. Its adjacency entries are appended at the end of
   * both rotations.
   */
  @CanIgnoreReturnValue
  public int newEdge(int source, int target) {
    checkNode(source);
    checkNode(target);
    int edge = edgeArenaSize();
    for (int i = 0; i < 2; i++) {
      adjNode.add(NONE);
      adjNext.add(NONE);
      adjPrev.add(NONE);
    }
    liveEdges.set(edge);
    numEdges++;
    link(sourceAdj(edge), source, NONE);
    link(targetAdj(edge), target, NONE);
    return edge;
  }

  /** Deletes 'edge', unlinking both of its adjacency entries. */
  public void deleteEdge(int edge) {
    checkEdge(edge);
    unlink(sourceAdj(edge));
    unlink(targetAdj(edge));
    liveEdges.clear(edge);
    numEdges--;
  }

  /** Deletes 'node' together with all of its incident edges. */
  public void deleteNode(int node) {
    checkNode(node);
    while (firstAdj.getInt(node) != NONE) {
      deleteEdge(edgeOf(firstAdj.getInt(node)));
    }
    for (GraphObserver observer : observers) {
      observer.nodeDeleted(node);
    }
    liveNodes.clear(node);
    numNodes--;
  }

  /**
   * Moves the edge end 'adj' onto 'newNode'. The entry keeps its handle, so the edge keeps its
   * direction. It is inserted before 'beforeAdj', which must be an entry of 'newNode', or appended
   * at the end of the rotation of 'newNode' if 'beforeAdj' is NONE.
   */
  public void moveEndpoint(int adj, int newNode, int beforeAdj) {
    checkAdj(adj);
    checkNode(newNode);
    Preconditions.checkArgument(adj != beforeAdj, "Cannot insert an entry before itself");
    if (beforeAdj != NONE) {
      Preconditions.checkArgument(
          nodeOf(beforeAdj) == newNode, "Entry %s is not incident to node %s", beforeAdj, newNode);
    }
    unlink(adj);
    link(adj, newNode, beforeAdj);
  }

  /** Moves 'adj' directly after 'afterAdj' within the rotation of their common node. */
  public void moveAdjAfter(int adj, int afterAdj) {
    Preconditions.checkArgument(nodeOf(adj) == nodeOf(afterAdj), "Entries on different nodes");
    if (adj == afterAdj) {
      return;
    }
    int node = adjNode.getInt(adj);
    unlink(adj);
    link(adj, node, adjNext.getInt(afterAdj));
  }

  /** Moves 'adj' directly before 'beforeAdj' within the rotation of their common node. */
  public void moveAdjBefore(int adj, int beforeAdj) {
    Preconditions.checkArgument(nodeOf(adj) == nodeOf(beforeAdj), "Entries on different nodes");
    if (adj == beforeAdj) {
      return;
    }
    int node = adjNode.getInt(adj);
    unlink(adj);
    link(adj, node, beforeAdj);
  }

  /** Reverses the rotation of 'node'. */
  public void reverseAdjEdges(int node) {
    checkNode(node);
    int adj = firstAdj.getInt(node);
    while (adj != NONE) {
      int next = adjNext.getInt(adj);
      adjNext.set(adj, adjPrev.getInt(adj));
      adjPrev.set(adj, next);
      adj = next;
    }
    int first = firstAdj.getInt(node);
    firstAdj.set(node, lastAdj.getInt(node));
    lastAdj.set(node, first);
  }

  /**
   * Replaces the rotation of 'node' by 'order', which must be a permutation of the current
   * adjacency entries of 'node'.
   */
  public void setAdjacencyOrder(int node, int[] order) {
    checkNode(node);
    Preconditions.checkArgument(
        order.length == degrees.getInt(node),
        "Order has %s entries but node %s has degree %s",
        order.length,
        node,
        degrees.getInt(node));
    BitSet seen = new BitSet();
    for (int adj : order) {
      Preconditions.checkArgument(
          nodeOf(adj) == node, "Entry %s is not incident to node %s", adj, node);
      Preconditions.checkArgument(!seen.get(adj), "Entry %s appears twice", adj);
      seen.set(adj);
    }
    int prev = NONE;
    for (int adj : order) {
      adjPrev.set(adj, prev);
      if (prev == NONE) {
        firstAdj.set(node, adj);
      } else {
        adjNext.set(prev, adj);
      }
      prev = adj;
    }
    if (prev != NONE) {
      adjNext.set(prev, NONE);
    }
    lastAdj.set(node, prev);
  }

  /**
   * Shrinks the arenas to 'nodeArenaSize' nodes and 'edgeArenaSize' edges. All nodes and edges
   * with larger handles must already be deleted.
   */
  public void truncate(int nodeArenaSize, int edgeArenaSize) {
    Preconditions.checkArgument(nodeArenaSize >= 0 && nodeArenaSize <= nodeArenaSize());
    Preconditions.checkArgument(edgeArenaSize >= 0 && edgeArenaSize <= edgeArenaSize());
    Preconditions.checkState(
        liveNodes.nextSetBit(nodeArenaSize) < 0, "Live node beyond %s", nodeArenaSize);
    Preconditions.checkState(
        liveEdges.nextSetBit(edgeArenaSize) < 0, "Live edge beyond %s", edgeArenaSize);
    firstAdj.size(nodeArenaSize);
    lastAdj.size(nodeArenaSize);
    degrees.size(nodeArenaSize);
    adjNode.size(2 * edgeArenaSize);
    adjNext.size(2 * edgeArenaSize);
    adjPrev.size(2 * edgeArenaSize);
    for (GraphObserver observer : observers) {
      observer.arenaTruncated(nodeArenaSize, edgeArenaSize);
    }
  }

  /**
   * Copies the rotation of every live node of 'other' onto the same node of this graph. Both graphs
   * must contain the same live handles, as they do after {@link #copy()}.
   */
  public void copyEmbeddingFrom(Graph other) {
    Preconditions.checkArgument(
        other.liveNodes.equals(liveNodes) && other.liveEdges.equals(liveEdges),
        "Graphs do not share their handles");
    for (int n = liveNodes.nextSetBit(0); n >= 0; n = liveNodes.nextSetBit(n + 1)) {
      setAdjacencyOrder(n, other.adjEntries(n).toIntArray());
    }
  }

  ///////////////////////////////////////////////////////////////////////////////////////////////
  // Linked list plumbing

  /** Inserts the unlinked entry 'adj' into the list of 'node' before 'beforeAdj', or at the end. */
  private void link(int adj, int node, int beforeAdj) {
    adjNode.set(adj, node);
    int prev = beforeAdj == NONE ? lastAdj.getInt(node) : adjPrev.getInt(beforeAdj);
    adjPrev.set(adj, prev);
    adjNext.set(adj, beforeAdj);
    if (prev == NONE) {
      firstAdj.set(node, adj);
    } else {
      adjNext.set(prev, adj);
    }
    if (beforeAdj == NONE) {
      lastAdj.set(node, adj);
    } else {
      adjPrev.set(beforeAdj, adj);
    }
    degrees.set(node, degrees.getInt(node) + 1);
  }

  /** Removes 'adj' from the list of its node. */
  private void unlink(int adj) {
    int node = adjNode.getInt(adj);
    int prev = adjPrev.getInt(adj);
    int next = adjNext.getInt(adj);
    if (prev == NONE) {
      firstAdj.set(node, next);
    } else {
      adjNext.set(prev, next);
    }
    if (next == NONE) {
      lastAdj.set(node, prev);
    } else {
      adjPrev.set(next, prev);
    }
    adjPrev.set(adj, NONE);
    adjNext.set(adj, NONE);
    adjNode.set(adj, NONE);
    degrees.set(node, degrees.getInt(node) - 1);
  }

  private void checkNode(int node) {
    Preconditions.checkArgument(isNodeAlive(node), "Node %s is not a live node", node);
  }

  private void checkEdge(int edge) {
    Preconditions.checkArgument(isEdgeAlive(edge), "Edge %s is not a live edge", edge);
  }

  private void checkAdj(int adj) {
    Preconditions.checkArgument(isAdjAlive(adj), "Adjacency entry %s is not live", adj);
  }

  /**
   * Returns true if the linked lists, degrees and counters are mutually consistent. If not, sets
   * 'error' and returns false.
   */
  public boolean isConsistent(SyncPlanError error) {
    int liveNodeCount = 0;
    int entryCount = 0;
    for (int n = liveNodes.nextSetBit(0); n >= 0; n = liveNodes.nextSetBit(n + 1)) {
      liveNodeCount++;
      int count = 0;
      int prev = NONE;
      for (int adj = firstAdj.getInt(n); adj != NONE; adj = adjNext.getInt(adj)) {
        if (!isAdjAlive(adj) || adjNode.getInt(adj) != n || adjPrev.getInt(adj) != prev) {
          error.init(
              SyncPlanError.Code.INVALID_GRAPH, "Broken rotation at node %s entry %s", n, adj);
          return false;
        }
        prev = adj;
        if (++count > 2 * edgeArenaSize()) {
          error.init(SyncPlanError.Code.INVALID_GRAPH, "Cyclic rotation list at node %s", n);
          return false;
        }
      }
      if (prev != lastAdj.getInt(n) || count != degrees.getInt(n)) {
        error.init(SyncPlanError.Code.INVALID_GRAPH, "Wrong degree or last entry at node %s", n);
        return false;
      }
      entryCount += count;
    }
    if (liveNodeCount != numNodes
        || liveEdges.cardinality() != numEdges
        || entryCount != 2 * numEdges) {
      error.init(
          SyncPlanError.Code.INVALID_GRAPH,
          "Counters disagree: %s nodes, %s edges, %s entries",
          liveNodeCount,
          liveEdges.cardinality(),
          entryCount);
      return false;
    }
    return true;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Graph with ").append(numNodes).append(" nodes and ");
    sb.append(numEdges).append(" edges:");
    for (int e = liveEdges.nextSetBit(0); e >= 0; e = liveEdges.nextSetBit(e + 1)) {
      sb.append(' ').append(source(e)).append("->").append(target(e));
    }
    return sb.toString();
  }
}
