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

import com.google.common.base.Strings;

/**
 * An error code and text string describing the first broken invariant found by a consistency
 * check. Checks that can fail accept a SyncPlanError, return false, and describe the problem here;
 * see {@link SyncPlanException} for the throwing variants.
 */
public class SyncPlanError {
  /** Numeric values for consistency errors. */
  public enum Code {
    /** No problems detected. */
    NO_ERROR(0),

    /** Unknown error. */
    UNKNOWN(1000),
    /** Object is not in the required state. */
    FAILED_PRECONDITION(1004),
    /** An internal invariant has failed. */
    INTERNAL(1005),

    /** The rotation lists, degrees or counters of a Graph disagree. */
    INVALID_GRAPH(1),
    /** A node is in no cluster or in several, or the cluster tree is malformed. */
    INVALID_CLUSTERS(2),
    /** The two nodes of a pipe have different degrees. */
    PIPE_DEGREE_MISMATCH(3),
    /** A pipe refers to a dead node, or a node's twin does not point back. */
    DANGLING_PIPE(4),
    /** A cluster boundary entry does not leave its cluster. */
    BOUNDARY_MISMATCH(5),
    /** Nodes or edges created during flattening were still alive when indices were reset. */
    INDICES_NOT_RESET(6),
    /** The rotation system is not a planar embedding. */
    NOT_PLANAR_EMBEDDING(7);

    private final int code;

    private Code(int code) {
      this.code = code;
    }

    /** Returns the numeric value of this error code. */
    public int code() {
      return code;
    }
  }

  private Code code = Code.NO_ERROR;
  private String text = "";

  /** Prepares a SyncPlanError instance for reuse by resetting it to its original state. */
  public void clear() {
    code = Code.NO_ERROR;
    text = "";
  }

  /**
   * Sets the error code and text description, formatted with {@link Strings#lenientFormat}. May be
   * called again by outer layers to add context, e.g. {@code error.init(error.code(), "Cluster
   * %s: %s", c, error.text())}.
   */
  public void init(Code code, String format, Object... args) {
    this.code = code;
    this.text = Strings.lenientFormat(format.replace("%d", "%s"), args);
  }

  /** Returns the code of this error. */
  public Code code() {
    return code;
  }

  /** Returns true if this error's code is NO_ERROR. */
  public boolean ok() {
    return code == Code.NO_ERROR;
  }

  /** Returns the text string. */
  public String text() {
    return text;
  }

  @Override
  public String toString() {
    if (code == Code.NO_ERROR) {
      return "NO_ERROR";
    }
    return code + ": " + text;
  }
}
