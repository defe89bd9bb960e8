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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.clusterplanarity.primitives.IntPairList;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PipeMatchingTest extends ClusterPlanarityTestCase {
  private Graph g;
  private PipeMatching matchings;

  /** Two stars: 0 with leaves 2, 3, 4 and 1 with leaves 5, 6, 7, plus an isolated node 8. */
  @Before
  public void makeStars() {
    g = makeGraph(9);
    addEdges(g, 0, 2, 0, 3, 0, 4, 5, 1, 6, 1, 7, 1);
    matchings = new PipeMatching(g);
  }

  @Test
  public void testMatch() {
    Pipe pipe = matchings.matchNodes(0, 1);
    assertTrue(matchings.isMatched(0));
    assertTrue(matchings.isMatched(1));
    assertFalse(matchings.isMatched(2));
    assertEquals(1, matchings.getTwin(0));
    assertEquals(0, matchings.getTwin(1));
    assertEquals(NONE, matchings.getTwin(2));
    assertSame(pipe, matchings.getPipe(1));
    assertNull(matchings.getPipe(2));
    assertEquals(3, pipe.degree());
    assertEquals(1, matchings.getPipeCount());
    assertEquals(ImmutableList.of(pipe), matchings.pipes());
    assertTrue(matchings.isConsistent(new SyncPlanError()));
  }

  @Test
  public void testBijectionIsMirrored() {
    matchings.matchNodes(0, 1);
    PipeBijection forward = new PipeBijection();
    matchings.getIncidentEdgeBijection(0, forward);
    // Entries of 0 are 0, 2, 4; entries of 1 are 7, 9, 11.
    assertEquals(IntPairList.of(0, 11, 2, 9, 4, 7), forward);

    PipeBijection backward = new PipeBijection();
    matchings.getIncidentEdgeBijection(1, backward);
    assertEquals(g.degree(0), backward.size());
    for (int i = 0; i < forward.size(); i++) {
      int j = backward.size() - 1 - i;
      assertEquals(forward.getFirst(i), backward.getSecond(j));
      assertEquals(forward.getSecond(i), backward.getFirst(j));
    }
    assertEquals(9, matchings.getTwinAdj(2));
    assertEquals(2, matchings.getTwinAdj(9));
    assertEquals(11, forward.partnerOf(0));
    assertEquals(0, forward.partnerOf(11));
    assertEquals(NONE, forward.partnerOf(1));
  }

  @Test
  public void testInvalidMatchingsChangeNothing() {
    matchings.matchNodes(0, 1);
    assertThrows(IllegalArgumentException.class, () -> matchings.matchNodes(2, 2));
    assertThrows(IllegalArgumentException.class, () -> matchings.matchNodes(2, 0));
    assertThrows(IllegalArgumentException.class, () -> matchings.matchNodes(1, 3));
    assertThrows(IllegalArgumentException.class, () -> matchings.matchNodes(2, 8));
    assertThrows(IllegalArgumentException.class, () -> matchings.removeMatching(0, 2));
    assertThrows(IllegalArgumentException.class, () -> matchings.removeMatching(2, 3));
    assertThrows(
        IllegalArgumentException.class,
        () -> matchings.getIncidentEdgeBijection(2, new PipeBijection()));
    assertEquals(1, matchings.getPipeCount());
    assertFalse(matchings.isMatched(2));
    assertEquals(1, matchings.getTwin(0));
  }

  @Test
  public void testRemoveMatching() {
    matchings.matchNodes(0, 1);
    matchings.removeMatching(1, 0);
    assertTrue(matchings.isEmpty());
    assertFalse(matchings.isMatched(0));
    assertEquals(6, g.numberOfEdges());
    matchings.matchNodes(1, 0);
    assertEquals(0, matchings.getTwin(1));
  }

  @Test
  public void testHeapOrder() {
    Pipe big = matchings.matchNodes(0, 1);
    Pipe small = matchings.matchNodes(3, 6);
    Pipe smaller = matchings.matchNodes(5, 2);
    assertFalse(matchings.isHeapValid());
    assertThrows(IllegalStateException.class, matchings::getTopPipe);
    matchings.rebuildHeap();
    assertTrue(matchings.isHeapValid());
    assertSame(smaller, matchings.getTopPipe());
    assertEquals(ImmutableList.of(smaller, small, big), matchings.pipesInQueueOrder());
    matchings.removeMatching(2, 5);
    assertFalse(matchings.isHeapValid());
    matchings.rebuildHeap();
    assertSame(small, matchings.getTopPipe());
  }

  @Test
  public void testDeletingMatchedNodeFails() {
    matchings.matchNodes(8, g.newNode());
    assertThrows(IllegalStateException.class, () -> g.deleteNode(8));
  }

  @Test
  public void testDegreeMismatchIsReported() {
    matchings.matchNodes(0, 1);
    g.deleteEdge(0);
    SyncPlanError error = new SyncPlanError();
    assertFalse(matchings.isConsistent(error));
    assertEquals(SyncPlanError.Code.PIPE_DEGREE_MISMATCH, error.code());
  }
}
