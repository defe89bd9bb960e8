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
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import java.util.BitSet;
import java.util.function.IntConsumer;
import java.util.function.IntPredicate;

/**
 * A restartable breadth-first traversal over a {@link Graph}, filtered by two predicates: {@code
 * visit(adj)} decides whether the edge of an adjacency entry may be followed at all, and {@code
 * descend(node)} decides whether the neighbours of a node are enqueued once it is processed.
 *
 * <p>Typical use:
 *
 * <pre>{@code
 * FilteringBfs bfs = new FilteringBfs(graph, IntArrayList.of(start));
 * while (bfs.valid()) {
 *   int node = bfs.current();
 *   ...
 *   bfs.next();
 * }
 * }</pre>
 *
 * <p>Each node is processed at most once, unless it is explicitly {@link #append appended} again.
 * The predicates may be replaced between calls to {@link #next()}; nodes already visited stay
 * visited.
 */
public class FilteringBfs {
  private static final IntPredicate ALWAYS = x -> true;

  private final Graph graph;
  private final IntArrayFIFOQueue pending = new IntArrayFIFOQueue();
  private final BitSet visited = new BitSet();
  private IntPredicate visit;
  private IntPredicate descend;

  /** Creates a traversal starting from 'nodes' that follows every edge. */
  public FilteringBfs(Graph graph, Iterable<Integer> nodes) {
    this(graph, nodes, ALWAYS, ALWAYS);
  }

  /**
   * Creates a traversal starting from 'nodes', in order, that only follows adjacency entries
   * accepted by 'visit' and only expands nodes accepted by 'descend'.
   */
  public FilteringBfs(
      Graph graph, Iterable<Integer> nodes, IntPredicate visit, IntPredicate descend) {
    this.graph = graph;
    this.visit = visit;
    this.descend = descend;
    for (int node : nodes) {
      Preconditions.checkArgument(graph.isNodeAlive(node), "Node %s is not a live node", node);
      pending.enqueue(node);
    }
  }

  /** Returns true while there are nodes left to process. */
  public boolean valid() {
    return !pending.isEmpty();
  }

  /** Returns the node that will be processed by the next call to {@link #next()}. */
  public int current() {
    Preconditions.checkState(valid(), "Traversal is exhausted");
    return pending.firstInt();
  }

  /**
   * Processes the current node: marks it visited and, if it may be descended from, enqueues every
   * unvisited neighbour reachable through an accepted adjacency entry.
   */
  public void next() {
    Preconditions.checkState(valid(), "Traversal is exhausted");
    int node = pending.dequeueInt();
    assert !visited.get(node);
    visited.set(node);
    if (descend.test(node)) {
      for (int adj = graph.firstAdj(node); adj != NONE; adj = graph.succ(adj)) {
        int neighbor = graph.twinNode(adj);
        if (!visited.get(neighbor) && visit.test(adj)) {
          pending.enqueue(neighbor);
        }
      }
    }
    while (!pending.isEmpty() && visited.get(pending.firstInt())) {
      pending.dequeueInt();
    }
  }

  /**
   * Adds 'node' at the end of the queue and clears its visited flag, so it will be processed again
   * even if it was processed before.
   */
  public void append(int node) {
    Preconditions.checkArgument(graph.isNodeAlive(node), "Node %s is not a live node", node);
    visited.clear(node);
    pending.enqueue(node);
  }

  /** Processes all remaining nodes, passing each to 'action' before it is expanded. */
  public void forEachRemaining(IntConsumer action) {
    while (valid()) {
      action.accept(current());
      next();
    }
  }

  public boolean hasVisited(int node) {
    return visited.get(node);
  }

  /** Returns true if the edge of 'adj' passes the visit filter. */
  public boolean willVisitTarget(int adj) {
    return visit.test(adj);
  }

  /** Returns true if the neighbours of 'node' would be enqueued once it is processed. */
  public boolean willDescendFrom(int node) {
    return descend.test(node);
  }

  public void setVisitFilter(IntPredicate visit) {
    this.visit = visit;
  }

  public void setDescendFilter(IntPredicate descend) {
    this.descend = descend;
  }

  /** Returns the number of queued entries, including not yet skipped duplicates. */
  public int pendingCount() {
    return pending.size();
  }
}
