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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Records the cluster tree of a {@link ClusterGraph} before it is flattened by {@link
 * PerimeterRerouting#flatten}, as a list of {@link FrozenCluster}s in reverse post-order (the root
 * first). Replaying it joins every pipe back into the original edges, restores cluster membership
 * and fills the cluster boundary lists from the embedding.
 */
public final class UndoInitCluster extends UndoOperation {
  private final ClusterGraph clusterGraph;
  private final List<FrozenCluster> clusters;
  private final @Nullable IntPairList augmentation;

  /**
   * Snapshots the clusters of 'clusterGraph'. If 'augmentation' is not null, replaying appends the
   * augmentation pairs of every cluster boundary to it.
   */
  UndoInitCluster(ClusterGraph clusterGraph, @Nullable IntPairList augmentation) {
    this.clusterGraph = clusterGraph;
    this.augmentation = augmentation;
    List<FrozenCluster> postOrder = new ArrayList<>();
    for (int c : clusterGraph.postOrder()) {
      int parent = clusterGraph.parent(c);
      postOrder.add(new FrozenCluster(c, parent, clusterGraph.nodes(c)));
    }
    Collections.reverse(postOrder);
    this.clusters = postOrder;
  }

  @Override
  public Kind kind() {
    return Kind.INIT_CLUSTER;
  }

  public ClusterGraph clusterGraph() {
    return clusterGraph;
  }

  /** Returns the snapshots, root first. */
  public ImmutableList<FrozenCluster> clusters() {
    return ImmutableList.copyOf(clusters);
  }

  /** Mutable access for {@link PerimeterRerouting#flatten}. */
  List<FrozenCluster> mutableClusters() {
    return clusters;
  }

  public @Nullable IntPairList augmentation() {
    return augmentation;
  }

  @Override
  public String toString() {
    return "UndoInitCluster(" + clusters.size() + " clusters)";
  }
}
