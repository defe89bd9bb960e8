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
 * One reversible step recorded in an {@link UndoLog}. The set of operations is closed: every
 * subclass is declared in this package and is identified by its {@link Kind}, which {@link
 * UndoLog#replay} switches on. An operation only captures state when it is created; all mutation
 * happens when it is replayed, exactly once.
 */
public abstract class UndoOperation {
  /** The kinds of reversible operations. */
  public enum Kind {
    /** See {@link UndoResetIndices}. */
    RESET_INDICES,
    /** See {@link UndoInitCluster}. */
    INIT_CLUSTER
  }

  UndoOperation() {}

  /** Returns the kind of this operation. */
  public abstract Kind kind();

  @Override
  public String toString() {
    return getClass().getSimpleName();
  }
}
