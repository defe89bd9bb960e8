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

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * A snapshot of one cluster taken before flattening: its handle, its parent's handle, the node that
 * represents it in its pipe, and its member nodes in order.
 */
public final class FrozenCluster {
  private final int index;
  private final int parent;
  private int parentNode = Graph.NONE;
  private final IntArrayList nodes;

  FrozenCluster(int index, int parent, IntArrayList nodes) {
    this.index = index;
    this.parent = parent;
    this.nodes = nodes;
  }

  /** The handle of the cluster. */
  public int index() {
    return index;
  }

  /** The handle of the parent cluster, or NONE for the root. */
  public int parent() {
    return parent;
  }

  /** The cluster-side node of the cluster's pipe, or NONE for the root. */
  public int parentNode() {
    return parentNode;
  }

  void setParentNode(int parentNode) {
    this.parentNode = parentNode;
  }

  /** The member nodes of the cluster, excluding those of its descendants. */
  public IntList nodes() {
    return IntLists.unmodifiable(nodes);
  }

  @Override
  public String toString() {
    return "FrozenCluster(" + index + " < " + parent + ", node " + parentNode + ", " + nodes + ")";
  }
}
