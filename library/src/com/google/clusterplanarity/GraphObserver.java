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
 * Receives notifications about structural changes of a {@link Graph}. Used by structures that keep
 * per-node data in parallel to the graph's arena, such as {@link ClusterGraph}.
 */
public interface GraphObserver {
  /** Called after 'node' has been created. */
  void nodeAdded(int node);

  /** Called before 'node' is removed, after all of its incident edges have been deleted. */
  void nodeDeleted(int node);

  /** Called after the graph's arenas have been shrunk to the given sizes. */
  default void arenaTruncated(int nodeArenaSize, int edgeArenaSize) {}
}
