/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.searchaugment.grouping;

import org.apache.lucene.util.FixedBitSet;

/**
 * Fixed-capacity open-addressing map from a segment-local group-field ordinal
 * to the index of the owning group. Occupied slots are tracked in a bit set,
 * so every int, including the missing-value ordinal -1, is a valid key.
 */
final class GroupOrdinalMap {

  /** Returned by {@link #get(int)} when no group owns the ordinal. */
  static final int NO_GROUP = -1;

  private final int[] keys;
  private final int[] groupIndexes;
  private final FixedBitSet occupied;
  private final int mask;
  private int size;

  GroupOrdinalMap(int maxGroups) {
    // load factor <= 0.5
    int capacity = Integer.highestOneBit(Math.max(maxGroups, 1) * 2 - 1) << 1;
    keys = new int[capacity];
    groupIndexes = new int[capacity];
    occupied = new FixedBitSet(capacity);
    mask = capacity - 1;
  }

  void clear() {
    occupied.clear(0, occupied.length());
    size = 0;
  }

  /**
   * Maps <code>ord</code> to <code>groupIndex</code>. Returns false, leaving
   * the map untouched, if the ordinal is already owned.
   */
  boolean put(int ord, int groupIndex) {
    if (size >= keys.length - 1) {
      throw new IllegalStateException("map is full: " + size + " entries");
    }
    int slot = slot(ord);
    while (occupied.get(slot)) {
      if (keys[slot] == ord) {
        return false;
      }
      slot = (slot + 1) & mask;
    }
    occupied.set(slot);
    keys[slot] = ord;
    groupIndexes[slot] = groupIndex;
    size++;
    return true;
  }

  int get(int ord) {
    int slot = slot(ord);
    while (occupied.get(slot)) {
      if (keys[slot] == ord) {
        return groupIndexes[slot];
      }
      slot = (slot + 1) & mask;
    }
    return NO_GROUP;
  }

  int size() {
    return size;
  }

  private int slot(int ord) {
    int h = ord * 0x9E3779B9;
    return (h ^ (h >>> 16)) & mask;
  }
}
