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
package com.google.clusterplanarity.primitives;

import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * An IntPairList is an automatically-growing list of pairs of integers. It may be used much like a
 * {@code List<Pair<Integer, Integer>>} but avoids boxing Integers and Pairs. Pairs of adjacency
 * entry handles are the main use.
 */
public class IntPairList {
  /** Accepts a pair of ints. */
  public interface IntBiConsumer {
    void accept(int first, int second);
  }

  private final IntArrayList firsts;
  private final IntArrayList seconds;

  /** Constructs an empty IntPairList. */
  public IntPairList() {
    firsts = new IntArrayList();
    seconds = new IntArrayList();
  }

  /** Copy constructor. */
  public IntPairList(IntPairList other) {
    firsts = new IntArrayList(other.firsts);
    seconds = new IntArrayList(other.seconds);
  }

  /** Returns a new IntPairList of the given ints taken as pairs; there must be an even number. */
  public static IntPairList of(int... contents) {
    Preconditions.checkArgument(contents.length % 2 == 0);
    IntPairList result = new IntPairList();
    for (int i = 0; i < contents.length; i += 2) {
      result.add(contents[i], contents[i + 1]);
    }
    return result;
  }

  /** Adds a pair of integers to the end of this list. */
  public void add(int first, int second) {
    firsts.add(first);
    seconds.add(second);
  }

  /** Gets the first element of the pair at position 'index'. */
  public int getFirst(int index) {
    return firsts.getInt(index);
  }

  /** Gets the second element of the pair at position 'index'. */
  public int getSecond(int index) {
    return seconds.getInt(index);
  }

  /** Sets the pair at position 'index' to ('first', 'second'). */
  public void setPair(int index, int first, int second) {
    firsts.set(index, first);
    seconds.set(index, second);
  }

  /** Returns the number of pairs. */
  public int size() {
    return firsts.size();
  }

  public boolean isEmpty() {
    return firsts.isEmpty();
  }

  /** Removes all pairs. */
  public void clear() {
    firsts.clear();
    seconds.clear();
  }

  /** Returns the index of the first pair whose first element is 'first', or -1. */
  public int indexOfFirst(int first) {
    return firsts.indexOf(first);
  }

  /** Returns the index of the first pair whose second element is 'second', or -1. */
  public int indexOfSecond(int second) {
    return seconds.indexOf(second);
  }

  /** Calls the given consumer with each pair, in order. */
  public void forEach(IntBiConsumer consumer) {
    for (int i = 0; i < size(); i++) {
      consumer.accept(firsts.getInt(i), seconds.getInt(i));
    }
  }

  /** Replaces every pair (a, b) by (b, a). */
  public void swapPairs() {
    for (int i = 0; i < size(); i++) {
      int first = firsts.getInt(i);
      firsts.set(i, seconds.getInt(i));
      seconds.set(i, first);
    }
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof IntPairList)) {
      return false;
    }
    IntPairList that = (IntPairList) other;
    return firsts.equals(that.firsts) && seconds.equals(that.seconds);
  }

  @Override
  public int hashCode() {
    return 31 * firsts.hashCode() + seconds.hashCode();
  }

  // This toString implementation is intended to support debugging.
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(getClass().getSimpleName()).append(" of ").append(size()).append(" pairs: ");
    for (int i = 0; i < size() && i < 10; i++) {
      sb.append("(").append(firsts.getInt(i)).append(",").append(seconds.getInt(i)).append("), ");
    }
    if (size() > 10) {
      sb.append("...");
    }
    return sb.toString();
  }
}
