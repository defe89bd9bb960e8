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

/**
 * Records the arena sizes of a graph before any synthetic nodes or edges are created. Replaying it
 * checks that everything created since is gone again and shrinks the arenas back, so that a
 * completely undone instance has exactly the handles it started with.
 */
public final class UndoResetIndices extends UndoOperation {
  private final int nodeArenaSize;
  private final int edgeArenaSize;

  UndoResetIndices(Graph graph) {
    this.nodeArenaSize = graph.nodeArenaSize();
    this.edgeArenaSize = graph.edgeArenaSize();
  }

  @Override
  public Kind kind() {
    return Kind.RESET_INDICES;
  }

  public int nodeArenaSize() {
    return nodeArenaSize;
  }

  public int edgeArenaSize() {
    return edgeArenaSize;
  }

  @Override
  public String toString() {
    return "UndoResetIndices(" + nodeArenaSize + " nodes, " + edgeArenaSize + " edges)";
  }
}
