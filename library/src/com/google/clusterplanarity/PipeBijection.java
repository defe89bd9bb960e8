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

import com.google.clusterplanarity.primitives.IntPairList;

/**
 * The bijection between the incident edges of the two nodes of a {@link Pipe}, as a list of
 * (adjacency entry at u, adjacency entry at v) pairs ordered by the cyclic position around u. It is
 * the single source of truth for how two matched nodes are welded back together by {@link
 * PerimeterRerouting#join}.
 *
 * <p>See {@link PipeMatching#getIncidentEdgeBijection} for how it is derived from the rotations.
 */
public class PipeBijection extends IntPairList {

  /** Constructs an empty bijection. */
  public PipeBijection() {}

  /** Copy constructor. */
  public PipeBijection(PipeBijection other) {
    super(other);
  }

  /** Returns the adjacency entry paired with 'adj', searching both sides, or Graph.NONE. */
  public int partnerOf(int adj) {
    int i = indexOfFirst(adj);
    if (i >= 0) {
      return getSecond(i);
    }
    i = indexOfSecond(adj);
    return i >= 0 ? getFirst(i) : Graph.NONE;
  }

  /** Returns a string listing the pairs with the edges they belong to. */
  public String format(Graph graph) {
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      int a = getFirst(i);
      int b = getSecond(i);
      sb.append(graph.twinNode(a)).append("~").append(graph.nodeOf(a)).append("=");
      sb.append(graph.nodeOf(b)).append("~").append(graph.twinNode(b));
    }
    return sb.append("]").toString();
  }
}
