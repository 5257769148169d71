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

import org.apache.lucene.index.DocValues;
import org.apache.lucene.index.LeafReader;
import org.apache.lucene.index.SortedDocValues;
import org.apache.lucene.util.BytesRef;

/**
 * Per-segment term dictionary of a single-valued field, read through its
 * {@link SortedDocValues}. Ordinals are only meaningful within the segment;
 * {@link #MISSING_ORD} marks a document without a value.
 */
final class TermOrdinals {

  static final int MISSING_ORD = -1;

  private final SortedDocValues values;
  private int lastDoc = -1;
  private int lastOrd = MISSING_ORD;

  TermOrdinals(LeafReader reader, String field) throws IOException {
    this.values = DocValues.getSorted(reader, field);
  }

  /**
   * Ordinal of the given document, or {@link #MISSING_ORD}. Documents must be
   * requested in non-decreasing order; asking for the same document again
   * returns the ordinal read the first time.
   */
  int ordinalOf(int doc) throws IOException {
    if (doc != lastDoc) {
      lastOrd = values.advanceExact(doc) ? values.ordValue() : MISSING_ORD;
      lastDoc = doc;
    }
    return lastOrd;
  }

  /** Resolves an ordinal to a private copy of its value; the missing ordinal resolves to null. */
  BytesRef lookupOrdinal(int ord) throws IOException {
    if (ord == MISSING_ORD) {
      return null;
    }
    return BytesRef.deepCopyOf(values.lookupOrd(ord));
  }

  /**
   * Ordinal of <code>value</code> in this segment, {@link #MISSING_ORD} for a
   * null value, or a value below -1 if the segment does not contain it.
   */
  int lookupTerm(BytesRef value) throws IOException {
    if (value == null) {
      return MISSING_ORD;
    }
    int ord = values.lookupTerm(value);
    // -1 from lookupTerm means "would insert at 0", not the missing ordinal
    return ord >= 0 ? ord : Math.min(ord, -2);
  }
}
