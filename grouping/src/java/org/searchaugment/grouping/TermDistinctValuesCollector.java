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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.search.ScoreMode;
import org.apache.lucene.search.SimpleCollector;
import org.apache.lucene.search.grouping.SearchGroup;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.InfoStream;

/**
 * A second pass grouping collector that counts, for each of the top groups
 * found by a first pass, the distinct values of another field. Both fields
 * are read through {@link org.apache.lucene.index.SortedDocValues}.
 * <p>
 * Group and count values are resolved to segment-local ordinals once per
 * segment, so the per-document work is two ordinal reads and, for a value
 * not seen before in the group, one dictionary lookup.
 * <p>
 * Instances are single-use and must not be shared between concurrent searches.
 *
 * @lucene.experimental
 */
public class TermDistinctValuesCollector extends SimpleCollector {

  private static final String COMPONENT = "TDVC";

  private final String groupField;
  private final String countField;
  private final List<GroupCount> groups;
  private final LocalOrds[] localOrds;
  private final GroupOrdinalMap ordMap;

  private TermOrdinals groupFieldTermIndex;
  private TermOrdinals countFieldTermIndex;
  private InfoStream infoStream = InfoStream.getDefault();

  /**
   * Constructs a {@link TermDistinctValuesCollector} instance.
   *
   * @param groupField The field to group by
   * @param countField The field to count distinct values for
   * @param groups The top N groups, collected during the first phase search
   */
  public TermDistinctValuesCollector(String groupField, String countField, Collection<SearchGroup<BytesRef>> groups) {
    if (groupField == null || groupField.isEmpty()) {
      throw new IllegalArgumentException("groupField must not be null or empty");
    }
    if (countField == null || countField.isEmpty()) {
      throw new IllegalArgumentException("countField must not be null or empty");
    }
    Objects.requireNonNull(groups, "groups");
    this.groupField = groupField;
    this.countField = countField;
    this.groups = new ArrayList<>(groups.size());
    for (SearchGroup<BytesRef> group : groups) {
      this.groups.add(new GroupCount(group.groupValue));
    }
    this.localOrds = new LocalOrds[this.groups.size()];
    for (int i = 0; i < localOrds.length; i++) {
      localOrds[i] = new LocalOrds();
    }
    this.ordMap = new GroupOrdinalMap(this.groups.size());
  }

  /** Sets the {@link InfoStream} segment transitions are reported to. */
  public void setInfoStream(InfoStream infoStream) {
    this.infoStream = Objects.requireNonNull(infoStream, "infoStream");
  }

  @Override
  public void collect(int doc) throws IOException {
    int groupIndex = ordMap.get(groupFieldTermIndex.ordinalOf(doc));
    if (groupIndex == GroupOrdinalMap.NO_GROUP) {
      return;
    }

    LocalOrds ords = localOrds[groupIndex];
    int countOrd = countFieldTermIndex.ordinalOf(doc);
    if (ords.contains(countOrd) == false) {
      groups.get(groupIndex).add(countFieldTermIndex.lookupOrdinal(countOrd));
      ords.insert(countOrd);
    }
  }

  @Override
  protected void doSetNextReader(LeafReaderContext context) throws IOException {
    groupFieldTermIndex = new TermOrdinals(context.reader(), groupField);
    countFieldTermIndex = new TermOrdinals(context.reader(), countField);
    ordMap.clear();

    int resolved = 0;
    for (int i = 0; i < groups.size(); i++) {
      GroupCount group = groups.get(i);
      LocalOrds ords = localOrds[i];
      ords.clear();

      int groupOrd = groupFieldTermIndex.lookupTerm(group.getGroupValue());
      if (groupOrd < TermOrdinals.MISSING_ORD) {
        // group value is not in this segment
        continue;
      }
      if (ordMap.put(groupOrd, i) == false) {
        // duplicate group value, the first occurrence owns the ordinal
        continue;
      }
      resolved++;

      for (BytesRef value : group.values()) {
        int countOrd = countFieldTermIndex.lookupTerm(value);
        if (countOrd >= TermOrdinals.MISSING_ORD) {
          ords.append(countOrd);
        }
      }
      ords.sort();
    }

    if (infoStream.isEnabled(COMPONENT)) {
      infoStream.message(COMPONENT, "segment ord=" + context.ord + " docBase=" + context.docBase
          + ": " + resolved + " of " + groups.size() + " groups present");
    }
  }

  @Override
  public ScoreMode scoreMode() {
    return ScoreMode.COMPLETE_NO_SCORES;
  }

  /** Returns the groups in first pass order, with their distinct values. */
  public List<GroupCount> getGroups() {
    return Collections.unmodifiableList(groups);
  }

  // for testing
  int[] localOrds(int groupIndex) {
    return localOrds[groupIndex].toArray();
  }

  // for testing
  int groupIndexForOrd(int ord) {
    return ordMap.get(ord);
  }
}
