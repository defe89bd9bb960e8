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
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.clusterplanarity.primitives.IntPairList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SyncPlanTest extends ClusterPlanarityTestCase {

  @Test
  public void testTwoLevelChain() {
    // Cluster c holds the path a-b-c, and a has an edge to d in the root.
    Graph g = makeGraph(4);
    int[] e = addEdges(g, 0, 1, 1, 2, 0, 3);
    ClusterGraph cg = new ClusterGraph(g);
    int c = addCluster(cg, ClusterGraph.ROOT, 0, 1, 2);
    Snapshot before = new Snapshot(cg);

    SyncPlan plan = new SyncPlan(g, cg, ACCEPTING_SOLVER, CHECKED);
    assertEquals(SyncPlan.State.CONSTRUCTED, plan.state());
    assertEquals(1, plan.matchings().getPipeCount());
    assertEquals(IntArrayList.of(0, 1, 2, 3, 4, 5), g.nodes());
    int cn = 4;
    int pn = 5;
    assertEquals(pn, plan.matchings().getTwin(cn));
    assertEquals(1, plan.matchings().getPipe(cn).degree());
    assertEquals(NONE, g.searchEdge(0, 3));
    assertEquals(pn, g.source(e[2]));
    assertEquals(3, g.target(e[2]));
    assertNotEquals(NONE, g.searchEdge(0, cn));
    assertEquals(ClusterGraph.ROOT, cg.clusterOf(0));
    assertEquals(0, cg.numberOfNodes(c));
    assertFalse(cg.adjAvailable());
    assertEquals("CN 4 [1<0]", plan.formatNode(cn));
    assertEquals("PN 5 [0>1]", plan.formatNode(pn));
    assertEquals("3 (deg 1)", plan.formatNode(3));
    assertEquals(cn, plan.nodeFromIndex(cn));
    assertEquals(2, plan.components().count());
    assertTrue(plan.components().connected(0, cn));
    assertFalse(plan.components().connected(0, 3));

    plan.undoAll();
    assertEquals(SyncPlan.State.EMBEDDED, plan.state());
    before.assertSameAs(cg);
    assertEquals(4, g.nodeArenaSize());
    assertEquals(3, g.edgeArenaSize());
    assertEquals(0, g.source(e[2]));
    assertEquals(3, g.target(e[2]));
    assertEquals(c, cg.clusterOf(0));
    assertEquals(IntArrayList.of(Graph.sourceAdj(e[2])), cg.adjEntries(c));
    assertTrue(cg.adjAvailable());
    assertTrue(plan.matchings().isEmpty());
    assertEquals(NONE, plan.nodeFromIndex(cn));
    assertEquals(1, plan.components().count());
    assertNull(plan.augmentation());
  }

  @Test
  public void testClusterWithoutBoundaryEdges() {
    Graph g = makeGraph(3);
    int[] e = addEdges(g, 0, 1);
    ClusterGraph cg = new ClusterGraph(g);
    int c = addCluster(cg, ClusterGraph.ROOT, 0, 1);
    Snapshot before = new Snapshot(cg);

    SyncPlan plan = new SyncPlan(g, cg, ACCEPTING_SOLVER, CHECKED);
    Pipe pipe = plan.matchings().pipes().get(0);
    assertEquals(0, pipe.degree());
    PipeBijection bij = new PipeBijection();
    plan.matchings().getIncidentEdgeBijection(pipe.node0(), bij);
    assertTrue(bij.isEmpty());
    assertEquals(0, g.source(e[0]));
    assertEquals(1, g.target(e[0]));

    plan.undoAll();
    before.assertSameAs(cg);
    assertEquals(IntArrayList.of(0, 1), cg.nodes(c));
    assertTrue(cg.adjEntries(c).isEmpty());
  }

  /** Returns a graph with nested, sibling and empty clusters, self-loops and parallel edges. */
  private static ClusterGraph makeNestedClusters() {
    Graph g = makeGraph(8);
    addEdges(g, 0, 2, 2, 4, 3, 7, 1, 5, 5, 6, 6, 7, 0, 7, 3, 3, 4, 2, 2, 3, 0, 1, 2, 4);
    ClusterGraph cg = new ClusterGraph(g);
    int a = addCluster(cg, ClusterGraph.ROOT, 0, 1);
    addCluster(cg, a, 2, 3);
    addCluster(cg, ClusterGraph.ROOT, 4, 5);
    int empty = addCluster(cg, a);
    addCluster(cg, empty, 6);
    return cg;
  }

  @Test
  public void testNestedClustersRoundTrip() {
    ClusterGraph cg = makeNestedClusters();
    Graph g = cg.getGraph();
    Snapshot before = new Snapshot(cg);
    SyncPlan plan = new SyncPlan(g, cg, ACCEPTING_SOLVER, CHECKED);
    assertEquals(cg.numberOfClusters() - 1, plan.matchings().getPipeCount());
    for (int c : cg.clusters()) {
      assertEquals(c == ClusterGraph.ROOT ? g.numberOfNodes() : 0, cg.numberOfNodes(c));
    }
    assertTrue(plan.matchings().isHeapValid());

    plan.undoAll();
    before.assertSameAs(cg);
    for (int c : cg.clusters()) {
      if (c != ClusterGraph.ROOT) {
        assertEquals(
            ConsistencyChecks.crossingEdges(g, cg, c).size(), cg.adjEntries(c).size());
      }
    }
    SyncPlanError error = new SyncPlanError();
    assertTrue(error.toString(), ConsistencyChecks.isClusterEmbeddingConsistent(plan, error));
  }

  @Test
  public void testRandomRoundTrips() {
    for (int seed = 0; seed < 50; seed++) {
      Random rand = new Random(seed);
      Graph g = makeGraph(6 + rand.nextInt(10));
      for (int i = rand.nextInt(25); i > 0; i--) {
        g.newEdge(rand.nextInt(g.nodeArenaSize()), rand.nextInt(g.nodeArenaSize()));
      }
      g.deleteNode(rand.nextInt(g.nodeArenaSize()));
      ClusterGraph cg = new ClusterGraph(g);
      for (int i = rand.nextInt(6); i > 0; i--) {
        IntArrayList clusters = cg.clusters();
        cg.newCluster(clusters.getInt(rand.nextInt(clusters.size())));
      }
      IntArrayList clusters = cg.clusters();
      for (int n : g.nodes()) {
        cg.reassignNode(n, clusters.getInt(rand.nextInt(clusters.size())));
      }
      Snapshot before = new Snapshot(cg);

      SyncPlan plan =
          new SyncPlan(
              g,
              cg,
              ACCEPTING_SOLVER,
              new SyncPlan.Options.Builder(CHECKED).setAugmentation(rand.nextBoolean()).build());
      assertEquals(
          "Seed " + seed, cg.numberOfClusters() - 1, plan.matchings().getPipeCount());
      for (Pipe pipe : plan.matchings().pipes()) {
        PipeBijection forward = new PipeBijection();
        PipeBijection backward = new PipeBijection();
        plan.matchings().getIncidentEdgeBijection(pipe.node0(), forward);
        plan.matchings().getIncidentEdgeBijection(pipe.node1(), backward);
        assertEquals(forward.size(), backward.size());
        for (int i = 0; i < forward.size(); i++) {
          assertEquals(forward.getFirst(i), backward.partnerOf(forward.getSecond(i)));
        }
      }
      plan.undoAll();
      before.assertSameAs(cg);
    }
  }

  @Test
  public void testEmbedWithAcceptingSolver() {
    // A star whose center is a cluster of its own; any rotation of a tree is planar.
    Graph g = makeGraph(4);
    addEdges(g, 0, 1, 0, 2, 0, 3);
    ClusterGraph cg = new ClusterGraph(g);
    int c = addCluster(cg, ClusterGraph.ROOT, 0);
    Snapshot before = new Snapshot(cg);

    SyncPlan plan = new SyncPlan(g, cg, ACCEPTING_SOLVER, CHECKED);
    assertTrue(plan.makeReduced());
    assertEquals(SyncPlan.State.REDUCED, plan.state());
    assertTrue(plan.solveReduced());
    assertEquals(SyncPlan.State.SOLVED, plan.state());
    plan.embed();
    assertEquals(SyncPlan.State.EMBEDDED, plan.state());
    assertTrue(plan.matchings().isEmpty());
    before.assertSameAs(cg);
    assertEquals(IntArrayList.of(4, 2, 0), cg.adjEntries(c));
    assertThrows(IllegalStateException.class, plan::embed);
  }

  @Test
  public void testEmbedRejectsNonPlanarResult() {
    Graph g = makeGraph(5);
    addEdges(g, 0, 1, 0, 2, 0, 3, 1, 2, 1, 3, 2, 3, 4, 0);
    ClusterGraph cg = new ClusterGraph(g);
    addCluster(cg, ClusterGraph.ROOT, 4);
    SyncPlan plan = new SyncPlan(g, cg, ACCEPTING_SOLVER, CHECKED);
    plan.makeReduced();
    plan.solveReduced();
    SyncPlanException e = assertThrows(SyncPlanException.class, plan::embed);
    assertEquals(SyncPlanError.Code.NOT_PLANAR_EMBEDDING, e.code());
  }

  @Test
  public void testFailureDiscardsUndoLog() {
    Graph g = makeGraph(2);
    addEdges(g, 0, 1);
    ClusterGraph cg = new ClusterGraph(g);
    addCluster(cg, ClusterGraph.ROOT, 0);
    SyncPlan plan = new SyncPlan(g, cg, REJECTING_SOLVER, CHECKED);
    assertFalse(plan.makeReduced());
    assertEquals(SyncPlan.State.FAILED, plan.state());
    assertTrue(plan.undoLog().isEmpty());
    assertEquals(UndoLog.State.EMPTY, plan.undoLog().state());
    assertEquals(1, plan.matchings().getPipeCount());
    assertThrows(IllegalStateException.class, plan::solveReduced);
    assertThrows(IllegalStateException.class, plan::embed);
    assertThrows(IllegalStateException.class, plan::undoAll);

    // The failed plan no longer watches the graph, so its pipe nodes may be deleted.
    assertEquals(1, g.numberOfObservers());
    g.deleteNode(2);
    g.deleteNode(3);
    assertTrue(cg.isConsistent(new SyncPlanError()));
  }

  @Test
  public void testReplayDetachesPipeRegistry() {
    Graph g = makeGraph(3);
    addEdges(g, 0, 1, 1, 2);
    ClusterGraph cg = new ClusterGraph(g);
    addCluster(cg, ClusterGraph.ROOT, 1);
    assertEquals(1, g.numberOfObservers());

    SyncPlan plan = new SyncPlan(g, cg, ACCEPTING_SOLVER, CHECKED);
    assertEquals(2, g.numberOfObservers());
    plan.undoAll();
    assertEquals(1, g.numberOfObservers());

    plan = new SyncPlan(g, cg, ACCEPTING_SOLVER, CHECKED);
    plan.makeReduced();
    plan.solveReduced();
    plan.embed();
    assertEquals(1, g.numberOfObservers());
  }

  @Test
  public void testOppositeRotationOfPipeEndsKeepsBijection() {
    Graph g = makeGraph(4);
    addEdges(g, 0, 1, 0, 2, 0, 3);
    ClusterGraph cg = new ClusterGraph(g);
    int c = addCluster(cg, ClusterGraph.ROOT, 0);
    Snapshot before = new Snapshot(cg);
    ReductionSolver rotatingSolver =
        new ReductionSolver() {
          @Override
          public boolean makeReduced(SyncPlan plan) {
            return true;
          }

          @Override
          public boolean solveReduced(SyncPlan plan) {
            Graph graph = plan.graph();
            for (Pipe pipe : plan.matchings().pipes()) {
              int u = pipe.node0();
              int v = pipe.node1();
              graph.moveAdjAfter(graph.firstAdj(u), graph.lastAdj(u));
              graph.moveAdjBefore(graph.lastAdj(v), graph.firstAdj(v));
            }
            return true;
          }
        };

    SyncPlan plan = new SyncPlan(g, cg, rotatingSolver, CHECKED);
    plan.makeReduced();
    plan.solveReduced();
    plan.embed();
    before.assertSameAs(cg);
    // Same pairs as without rotation, listed from the rotated head of the parent-side node.
    assertEquals(IntArrayList.of(0, 4, 2), cg.adjEntries(c));
  }

  @Test
  public void testStepsMustRunInOrder() {
    Graph g = makeGraph(1);
    SyncPlan plan = new SyncPlan(g, new ClusterGraph(g), ACCEPTING_SOLVER, CHECKED);
    assertThrows(IllegalStateException.class, plan::solveReduced);
    assertThrows(IllegalStateException.class, plan::embed);
    plan.makeReduced();
    assertThrows(IllegalStateException.class, plan::makeReduced);
  }

  @Test
  public void testClusterGraphOfAnotherGraphIsRejected() {
    Graph g = makeGraph(1);
    ClusterGraph cg = new ClusterGraph(makeGraph(1));
    assertThrows(
        IllegalArgumentException.class,
        () -> new SyncPlan(g, cg, ACCEPTING_SOLVER, SyncPlan.Options.DEFAULT));
  }

  /** Cluster {a, b} with the edge a-b, and the edges a→x and b→y leaving it. */
  private static ClusterGraph makeTwoExits(boolean joinExits) {
    Graph g = makeGraph(4);
    addEdges(g, 0, 1, 0, 2, 1, 3);
    if (joinExits) {
      g.newEdge(2, 3);
    }
    ClusterGraph cg = new ClusterGraph(g);
    addCluster(cg, ClusterGraph.ROOT, 0, 1);
    return cg;
  }

  @Test
  public void testAugmentationPairsSeparateBiconnectedComponents() {
    SyncPlan.Options options = new SyncPlan.Options.Builder(CHECKED).setAugmentation(true).build();
    ClusterGraph cg = makeTwoExits(false);
    SyncPlan plan = new SyncPlan(cg.getGraph(), cg, ACCEPTING_SOLVER, options);
    assertTrue(plan.augmentation().isEmpty());
    plan.makeReduced();
    plan.solveReduced();
    plan.embed();
    // Outside the cluster the exits 1→3 and 0→2 are bridges of different components.
    assertEquals(IntPairList.of(Graph.sourceAdj(2), Graph.sourceAdj(1)), plan.augmentation());
    assertEquals(IntArrayList.of(Graph.sourceAdj(2), Graph.sourceAdj(1)), cg.adjEntries(1));

    cg = makeTwoExits(true);
    plan = new SyncPlan(cg.getGraph(), cg, ACCEPTING_SOLVER, options);
    plan.makeReduced();
    plan.solveReduced();
    plan.embed();
    assertTrue(plan.augmentation().isEmpty());
  }

  @Test
  public void testOptions() {
    SyncPlan.Options options = new SyncPlan.Options();
    assertFalse(options.augmentation());
    assertFalse(SyncPlan.Options.DEFAULT.augmentation());
    SyncPlan.Options.Builder builder = new SyncPlan.Options.Builder(CHECKED).setAugmentation(true);
    SyncPlan.Options built = builder.build();
    builder.setAugmentation(false);
    assertTrue(built.augmentation());
    assertTrue(built.consistencyChecks());
    assertFalse(
        new SyncPlan.Options.Builder().setConsistencyChecks(false).build().consistencyChecks());
  }
}
