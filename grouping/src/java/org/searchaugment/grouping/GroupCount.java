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

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.apache.lucene.util.BytesRef;

/**
 * Holds the distinct values seen for a single group.
 * <p>
 * A <code>null</code> group value stands for documents that have no value in
 * the group field; likewise a <code>null</code> entry in
 * {@link #getUniqueValues()} stands for documents of this group without a
 * value in the count field.
 *
 * @lucene.experimental
 */
public final class GroupCount {

  private final BytesRef groupValue;
  private final Set<BytesRef> uniqueValues = new HashSet<>();

  GroupCount(BytesRef groupValue) {
    this.groupValue = groupValue;
  }

  /** The group value, or <code>null</code> for the missing-value group. */
  public BytesRef getGroupValue() {
    return groupValue;
  }

  /** Distinct count field values collected so far, across all segments. */
  public Set<BytesRef> getUniqueValues() {
    return Collections.unmodifiableSet(uniqueValues);
  }

  /** Number of distinct values, same as <code>getUniqueValues().size()</code>. */
  public int getDistinctCount() {
    return uniqueValues.size();
  }

  boolean add(BytesRef value) {
    return uniqueValues.add(value);
  }

  Set<BytesRef> values() {
    return uniqueValues;
  }

  @Override
  public String toString() {
    return "GroupCount(" + (groupValue == null ? "<missing>" : groupValue.utf8ToString())
        + ", distinct=" + uniqueValues.size() + ")";
  }
}
