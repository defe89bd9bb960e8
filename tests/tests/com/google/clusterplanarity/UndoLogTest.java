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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class UndoLogTest extends ClusterPlanarityTestCase {

  @Test
  public void testStateMachine() {
    Graph g = makeGraph(2);
    UndoLog log = new UndoLog();
    assertEquals(UndoLog.State.EMPTY, log.state());
    assertNull(log.peek());
    assertThrows(IllegalStateException.class, log::freeze);

    UndoOperation first = new UndoResetIndices(g);
    UndoOperation second = new UndoInitCluster(new ClusterGraph(g), null);
    log.push(first);
    assertEquals(UndoLog.State.RECORDING, log.state());
    log.push(second);
    assertSame(second, log.peek());
    assertEquals(2, log.size());

    log.freeze();
    assertEquals(UndoLog.State.FROZEN, log.state());
    assertThrows(IllegalStateException.class, () -> log.push(first));
    assertThrows(IllegalStateException.class, log::freeze);

    log.discard();
    assertEquals(UndoLog.State.EMPTY, log.state());
    assertTrue(log.isEmpty());
    log.push(first);
    assertEquals(UndoLog.State.RECORDING, log.state());
  }

  @Test
  public void testOperationKinds() {
    Graph g = makeGraph(3);
    addEdges(g, 0, 1);
    UndoResetIndices reset = new UndoResetIndices(g);
    assertEquals(UndoOperation.Kind.RESET_INDICES, reset.kind());
    assertEquals(3, reset.nodeArenaSize());
    assertEquals(1, reset.edgeArenaSize());

    ClusterGraph cg = new ClusterGraph(g);
    int a = addCluster(cg, ClusterGraph.ROOT, 1);
    int a1 = addCluster(cg, a, 2);
    UndoInitCluster init = new UndoInitCluster(cg, null);
    assertEquals(UndoOperation.Kind.INIT_CLUSTER, init.kind());
    assertSame(cg, init.clusterGraph());
    assertNull(init.augmentation());
    assertEquals(3, init.clusters().size());
    // Root first, parents before children.
    assertEquals(ClusterGraph.ROOT, init.clusters().get(0).index());
    assertEquals(a, init.clusters().get(1).index());
    assertEquals(a1, init.clusters().get(2).index());
    assertEquals(a, init.clusters().get(2).parent());
    assertEquals(2, init.clusters().get(2).nodes().getInt(0));
    assertEquals(Graph.NONE, init.clusters().get(2).parentNode());
  }

  @Test
  public void testPlanLogIsReplayedInReverse() {
    Graph g = makeGraph(2);
    addEdges(g, 0, 1);
    ClusterGraph cg = new ClusterGraph(g);
    addCluster(cg, ClusterGraph.ROOT, 0);
    SyncPlan plan = new SyncPlan(g, cg, ACCEPTING_SOLVER, CHECKED);
    UndoLog log = plan.undoLog();
    assertEquals(UndoLog.State.FROZEN, log.state());
    assertEquals(2, log.size());
    assertEquals(UndoOperation.Kind.INIT_CLUSTER, log.peek().kind());
    plan.undoAll();
    assertEquals(UndoLog.State.EMPTY, log.state());
    assertTrue(log.isEmpty());
    assertThrows(IllegalStateException.class, () -> log.replay(plan));
  }

  @Test
  public void testReplayDetectsLeakedIndices() {
    Graph g = makeGraph(2);
    addEdges(g, 0, 1);
    ClusterGraph cg = new ClusterGraph(g);
    addCluster(cg, ClusterGraph.ROOT, 1);
    SyncPlan plan = new SyncPlan(g, cg, ACCEPTING_SOLVER, CHECKED);
    g.newNode();
    SyncPlanException e = assertThrows(SyncPlanException.class, plan::undoAll);
    assertEquals(SyncPlanError.Code.INDICES_NOT_RESET, e.code());
  }
}
