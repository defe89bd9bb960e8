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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The registry of pipes. A node is part of at most one pipe at a time, and both nodes of a pipe
 * have the same degree when it is registered.
 *
 * <p>The incident edges of the two nodes of a pipe (u, v) are in bijection: walking the rotation of
 * u forward from its first entry pairs each entry with the entry reached by walking the rotation of
 * v backward from its last entry. The two sides of a cut around a cluster see the crossing edges in
 * mirrored order, which is why the directions are opposite. Code that re-embeds a pipe node must
 * rotate its twin accordingly.
 *
 * <p>The registry also keeps a processing queue of pipes, smallest degree first with ties broken by
 * the smaller node handle, for use by a {@link ReductionSolver}. The queue is rebuilt in bulk by
 * {@link #rebuildHeap()} rather than maintained incrementally; any mutation marks it stale.
 *
 * <p>All mutations check their preconditions before changing any state, and are not thread-safe.
 */
public class PipeMatching {
  /** Orders pipes by degree, then by the smaller of their node handles. */
  public static final Comparator<Pipe> SMALLEST_FIRST =
      Comparator.comparingInt(Pipe::degree)
          .thenComparingInt(pipe -> Math.min(pipe.node0(), pipe.node1()));

  private final Graph graph;
  private final Int2ObjectOpenHashMap<Pipe> pipeOfNode = new Int2ObjectOpenHashMap<>();
  private final Set<Pipe> pipes = new LinkedHashSet<>();
  private final PriorityQueue<Pipe> queue = new PriorityQueue<>(SMALLEST_FIRST);
  private boolean queueStale = true;

  private final GraphObserver observer =
      new GraphObserver() {
        @Override
        public void nodeAdded(int node) {}

        @Override
        public void nodeDeleted(int node) {
          Preconditions.checkState(
              !pipeOfNode.containsKey(node), "Node %s was deleted while matched", node);
        }
      };

  /** Creates an empty registry for pipes between nodes of 'graph'. */
  public PipeMatching(Graph graph) {
    this.graph = graph;
    graph.addObserver(observer);
  }

  /**
   * Detaches this registry from its graph. Deleting a matched node is no longer rejected, and the
   * registry must not be mutated afterwards. Detaching twice has no effect.
   */
  public void detach() {
    graph.removeObserver(observer);
  }

  /**
   * Registers the pipe (u, v) and returns it.
   *
   * @throws IllegalArgumentException if u == v, either node is already matched, or the degrees of u
   *     and v differ
   */
  @CanIgnoreReturnValue
  public Pipe matchNodes(int u, int v) {
    Preconditions.checkArgument(u != v, "Cannot match node %s with itself", u);
    Preconditions.checkArgument(!isMatched(u), "Node %s is already matched", u);
    Preconditions.checkArgument(!isMatched(v), "Node %s is already matched", v);
    Preconditions.checkArgument(
        graph.degree(u) == graph.degree(v),
        "Nodes %s and %s have different degrees %s and %s",
        u,
        v,
        graph.degree(u),
        graph.degree(v));
    Pipe pipe = new Pipe(graph, u, v);
    pipeOfNode.put(u, pipe);
    pipeOfNode.put(v, pipe);
    pipes.add(pipe);
    queueStale = true;
    return pipe;
  }

  /**
   * Unregisters the pipe (u, v). The graph is not modified.
   *
   * @throws IllegalArgumentException if (u, v) is not a current pipe
   */
  public void removeMatching(int u, int v) {
    Pipe pipe = pipeOfNode.get(u);
    Preconditions.checkArgument(
        pipe != null && pipe.other(u) == v, "Nodes %s and %s are not matched", u, v);
    pipeOfNode.remove(u);
    pipeOfNode.remove(v);
    pipes.remove(pipe);
    queueStale = true;
  }

  public boolean isMatched(int node) {
    return pipeOfNode.containsKey(node);
  }

  /** Returns the node matched with 'node', or {@link Graph#NONE} if it is unmatched. */
  public int getTwin(int node) {
    Pipe pipe = pipeOfNode.get(node);
    return pipe == null ? NONE : pipe.other(node);
  }

  /** Returns the pipe of 'node', or null if it is unmatched. */
  public @Nullable Pipe getPipe(int node) {
    return pipeOfNode.get(node);
  }

  /** Returns the adjacency entry on the twin node that is paired with 'adj'. */
  public int getTwinAdj(int adj) {
    int u = graph.nodeOf(adj);
    int v = getTwin(u);
    Preconditions.checkArgument(v != NONE, "Node %s is not matched", u);
    int twinAdj = graph.lastAdj(v);
    for (int a = graph.firstAdj(u); a != adj; a = graph.succ(a)) {
      twinAdj = graph.pred(twinAdj);
    }
    return twinAdj;
  }

  /**
   * Clears 'out' and fills it with the bijection of the pipe of 'node': pairs of (entry at 'node',
   * entry at its twin), ordered by the rotation of 'node'. The bijection of the twin contains the
   * same pairs, swapped and in reverse order.
   */
  public void getIncidentEdgeBijection(int node, PipeBijection out) {
    int twin = getTwin(node);
    Preconditions.checkArgument(twin != NONE, "Node %s is not matched", node);
    Preconditions.checkState(
        graph.degree(node) == graph.degree(twin), "Pipe of node %s lost its degree balance", node);
    out.clear();
    int twinAdj = graph.lastAdj(twin);
    for (int adj = graph.firstAdj(node); adj != NONE; adj = graph.succ(adj)) {
      out.add(adj, twinAdj);
      twinAdj = graph.pred(twinAdj);
    }
  }

  /** Rebuilds the processing queue from the current pipes. Call once after bulk registration. */
  public void rebuildHeap() {
    queue.clear();
    queue.addAll(pipes);
    queueStale = false;
  }

  /** Returns the pipe at the head of the processing queue, or null if there are no pipes. */
  public @Nullable Pipe getTopPipe() {
    Preconditions.checkState(!queueStale, "Pipe queue is stale, call rebuildHeap() first");
    return queue.peek();
  }

  /** Returns all pipes in processing order. */
  public List<Pipe> pipesInQueueOrder() {
    Preconditions.checkState(!queueStale, "Pipe queue is stale, call rebuildHeap() first");
    List<Pipe> result = new ArrayList<>(queue);
    result.sort(SMALLEST_FIRST);
    return result;
  }

  /** Returns true if the processing queue reflects the current pipes. */
  public boolean isHeapValid() {
    return !queueStale;
  }

  public int getPipeCount() {
    return pipes.size();
  }

  public boolean isEmpty() {
    return pipes.isEmpty();
  }

  /** Returns the current pipes in registration order. */
  public ImmutableList<Pipe> pipes() {
    return ImmutableList.copyOf(pipes);
  }

  /**
   * Returns true if every pipe joins two live nodes of equal degree that point back at it. If not,
   * sets 'error' and returns false.
   */
  public boolean isConsistent(SyncPlanError error) {
    for (Pipe pipe : pipes) {
      for (int node : new int[] {pipe.node0(), pipe.node1()}) {
        if (!graph.isNodeAlive(node) || pipeOfNode.get(node) != pipe) {
          error.init(SyncPlanError.Code.DANGLING_PIPE, "%s has stale node %s", pipe, node);
          return false;
        }
      }
      if (graph.degree(pipe.node0()) != graph.degree(pipe.node1())) {
        error.init(
            SyncPlanError.Code.PIPE_DEGREE_MISMATCH,
            "%s has degrees %s and %s",
            pipe,
            graph.degree(pipe.node0()),
            graph.degree(pipe.node1()));
        return false;
      }
    }
    if (pipeOfNode.size() != 2 * pipes.size()) {
      error.init(SyncPlanError.Code.DANGLING_PIPE, "Node index lists unregistered pipes");
      return false;
    }
    return true;
  }
}
