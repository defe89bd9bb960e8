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
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class GraphAlgorithmsTest extends ClusterPlanarityTestCase {

  @Test
  public void testConnectedComponents() {
    Graph g = makeGraph(6);
    addEdges(g, 0, 3, 3, 1, 2, 4);
    g.deleteNode(5);
    int[] component = new int[g.nodeArenaSize()];
    assertEquals(2, GraphAlgorithms.connectedComponents(g, component));
    assertArrayEquals(new int[] {0, 0, 1, 0, 1, NONE}, component);
  }

  @Test
  public void testBiconnectedComponents() {
    // A triangle 0-1-2, a bridge 2-3 and a self-loop at 3.
    Graph g = makeGraph(5);
    int[] e = addEdges(g, 0, 1, 1, 2, 2, 0, 2, 3, 3, 3);
    int[] component = new int[g.edgeArenaSize()];
    assertEquals(3, GraphAlgorithms.biconnectedComponents(g, component));
    assertEquals(component[e[0]], component[e[1]]);
    assertEquals(component[e[0]], component[e[2]]);
    assertNotEquals(component[e[0]], component[e[3]]);
    assertNotEquals(component[e[3]], component[e[4]]);
    assertNotEquals(component[e[0]], component[e[4]]);
  }

  @Test
  public void testBiconnectedComponentsWithParallelEdges() {
    Graph g = makeGraph(3);
    int[] e = addEdges(g, 0, 1, 1, 0, 1, 2);
    int[] component = new int[g.edgeArenaSize()];
    assertEquals(2, GraphAlgorithms.biconnectedComponents(g, component));
    assertEquals(component[e[0]], component[e[1]]);
    assertNotEquals(component[e[0]], component[e[2]]);
  }

  @Test
  public void testFacesOfTree() {
    Graph g = makeGraph(5);
    addEdges(g, 0, 1, 0, 2, 0, 3);
    assertEquals(2, GraphAlgorithms.numberOfFaces(g));
    assertTrue(GraphAlgorithms.isPlanarEmbedding(g));
  }

  @Test
  public void testK4Embeddings() {
    Graph g = makeGraph(4);
    addEdges(g, 0, 1, 0, 2, 0, 3, 1, 2, 1, 3, 2, 3);
    assertEquals(2, GraphAlgorithms.numberOfFaces(g));
    assertFalse(GraphAlgorithms.isPlanarEmbedding(g));
    SyncPlanError error = new SyncPlanError();
    assertFalse(ConsistencyChecks.isPlanarEmbedding(g, error));
    assertEquals(SyncPlanError.Code.NOT_PLANAR_EMBEDDING, error.code());

    g.reverseAdjEdges(1);
    g.reverseAdjEdges(3);
    assertEquals(4, GraphAlgorithms.numberOfFaces(g));
    assertTrue(GraphAlgorithms.isPlanarEmbedding(g));
  }
}
