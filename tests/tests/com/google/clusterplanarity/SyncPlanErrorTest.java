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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SyncPlanErrorTest {

  @Test
  public void testBasic() {
    SyncPlanError error = new SyncPlanError();
    assertTrue(error.ok());
    error.init(SyncPlanError.Code.DANGLING_PIPE, "Pipe %d of cluster %s", 3, 7);
    // Prepend additional context to the message.
    error.init(error.code(), "Replay: %s", error.text());
    assertFalse(error.ok());
    assertEquals(SyncPlanError.Code.DANGLING_PIPE, error.code());
    assertEquals("Replay: Pipe 3 of cluster 7", error.text());
    assertEquals("DANGLING_PIPE: Replay: Pipe 3 of cluster 7", error.toString());

    SyncPlanException e = new SyncPlanException(error);
    assertEquals(SyncPlanError.Code.DANGLING_PIPE, e.code());
    error.clear();
    assertTrue(error.ok());
    assertEquals("NO_ERROR", error.toString());
  }
}
