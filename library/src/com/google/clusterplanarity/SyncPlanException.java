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
 * An unchecked exception thrown when a consistency check fails. It wraps the {@link SyncPlanError}
 * describing the broken invariant. A failing check means the library itself, or a {@link
 * ReductionSolver} it was given, has corrupted the instance; it is never thrown for inputs that
 * are merely not cluster-planar.
 */
public class SyncPlanException extends RuntimeException {

  private final SyncPlanError error;

  /** Creates a new SyncPlanException wrapping the given SyncPlanError. */
  public SyncPlanException(SyncPlanError error) {
    this.error = error;
  }

  /** Returns the code of the SyncPlanError wrapped by this SyncPlanException. */
  public SyncPlanError.Code code() {
    return error.code();
  }

  @Override
  public String getMessage() {
    return error.text();
  }
}
