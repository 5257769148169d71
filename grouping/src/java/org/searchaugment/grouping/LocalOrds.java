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

import java.util.Arrays;

import org.apache.lucene.util.ArrayUtil;

/**
 * Segment-local scratch for one group: the sorted count-field ordinals of the
 * group's known distinct values, valid only for the current segment. The
 * backing array is reused across segments.
 */
final class LocalOrds {

  private int[] ords = new int[0];
  private int size;

  /** Empties this set, keeping the backing array. */
  void clear() {
    size = 0;
  }

  /** Appends without sorting; call {@link #sort()} when done. */
  void append(int ord) {
    ords = ArrayUtil.grow(ords, size + 1);
    ords[size++] = ord;
  }

  void sort() {
    if (size > 1) {
      Arrays.sort(ords, 0, size);
    }
  }

  boolean contains(int ord) {
    if (size == 0) {
      return false;
    } else if (size == 1) {
      return ords[0] == ord;
    }
    return Arrays.binarySearch(ords, 0, size, ord) >= 0;
  }

  /** Adds a new ordinal and keeps the set sorted. */
  void insert(int ord) {
    assert contains(ord) == false;
    append(ord);
    sort();
  }

  int size() {
    return size;
  }

  int[] toArray() {
    return ArrayUtil.copyOfSubArray(ords, 0, size);
  }
}
