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
package org.searchaugment.payloads;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.Term;
import org.apache.lucene.queries.spans.SpanNearQuery;
import org.apache.lucene.queries.spans.SpanQuery;
import org.apache.lucene.queries.spans.SpanTermQuery;
import org.apache.lucene.search.BooleanClause.Occur;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.DisjunctionMaxQuery;
import org.apache.lucene.search.MultiPhraseQuery;
import org.apache.lucene.search.PhraseQuery;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.WildcardQuery;
import org.apache.lucene.store.Directory;
import org.apache.lucene.tests.index.RandomIndexWriter;
import org.apache.lucene.tests.util.LuceneTestCase;
import org.apache.lucene.util.IOUtils;
import org.apache.lucene.util.InfoStream;

public class TestPayloadSpanExtractor extends LuceneTestCase {

  private static final String FIELD = "body";
  private static final String OTHER_FIELD = "title";

  private Directory dir;
  private RandomIndexWriter writer;
  private IndexReader reader;

  @Override
  public void setUp() throws Exception {
    super.setUp();
    dir = newDirectory();
    writer = new RandomIndexWriter(random(), dir, newIndexWriterConfig(new PositionPayloadAnalyzer()));
  }

  @Override
  public void tearDown() throws Exception {
    IOUtils.close(reader, writer, dir);
    super.tearDown();
  }

  public void testExactPhrase() throws Exception {
    addDoc("1", "quick fox");
    PayloadSpanExtractor extractor = openExtractor();
    Collection<byte[]> payloads = extractor.getPayloadsForQuery(new PhraseQuery(FIELD, "quick", "fox"));
    assertEquals(2, payloads.size());
    assertEquals(Arrays.asList(1, 2), sortedBytes(payloads));
  }

  public void testTermQuery() throws Exception {
    addDoc("1", "the quick brown fox");
    addDoc("2", "a fox and another fox");
    PayloadSpanExtractor extractor = openExtractor();
    assertEquals(Arrays.asList(2, 4, 5), sortedBytes(extractor.getPayloadsForQuery(new TermQuery(new Term(FIELD, "fox")))));
  }

  public void testPhraseOrderFollowsSlop() throws Exception {
    addDoc("1", "fox quick");
    PayloadSpanExtractor extractor = openExtractor();
    assertTrue(extractor.getPayloadsForQuery(new PhraseQuery(FIELD, "quick", "fox")).isEmpty());
    assertEquals(Arrays.asList(1, 2), sortedBytes(extractor.getPayloadsForQuery(new PhraseQuery(2, FIELD, "quick", "fox"))));
  }

  public void testProhibitedClauseContributesNothing() throws Exception {
    addDoc("1", "quick brown fox");
    PayloadSpanExtractor extractor = openExtractor();
    BooleanQuery query = new BooleanQuery.Builder()
        .add(new TermQuery(new Term(FIELD, "quick")), Occur.SHOULD)
        .add(new TermQuery(new Term(FIELD, "fox")), Occur.MUST_NOT)
        .build();
    assertEquals(Collections.singletonList(1), sortedBytes(extractor.getPayloadsForQuery(query)));
  }

  public void testFilterClauseContributesButDoesNotRestrict() throws Exception {
    addDoc("1", "quick brown fox");
    PayloadSpanExtractor extractor = openExtractor();
    BooleanQuery query = new BooleanQuery.Builder()
        .add(new TermQuery(new Term(FIELD, "quick")), Occur.MUST)
        .add(new TermQuery(new Term(FIELD, "fox")), Occur.FILTER)
        .build();
    assertEquals(Arrays.asList(1, 3), sortedBytes(extractor.getPayloadsForQuery(query)));

    // a filter matching nothing does not hide the other clauses
    query = new BooleanQuery.Builder()
        .add(new TermQuery(new Term(FIELD, "quick")), Occur.MUST)
        .add(new TermQuery(new Term(FIELD, "absent")), Occur.FILTER)
        .build();
    assertEquals(Collections.singletonList(1), sortedBytes(extractor.getPayloadsForQuery(query)));
  }

  public void testClausesOnDifferentFields() throws Exception {
    Document doc = new Document();
    doc.add(new TextField(FIELD, "quick brown fox", Field.Store.NO));
    doc.add(new TextField(OTHER_FIELD, "lazy dog", Field.Store.NO));
    writer.addDocument(doc);
    PayloadSpanExtractor extractor = openExtractor();
    BooleanQuery query = new BooleanQuery.Builder()
        .add(new TermQuery(new Term(FIELD, "fox")), Occur.SHOULD)
        .add(new TermQuery(new Term(OTHER_FIELD, "dog")), Occur.SHOULD)
        .build();
    assertEquals(Arrays.asList(2, 3), sortedBytes(extractor.getPayloadsForQuery(query)));
  }

  public void testDisjunctionMax() throws Exception {
    addDoc("1", "quick brown fox");
    PayloadSpanExtractor extractor = openExtractor();
    DisjunctionMaxQuery query = new DisjunctionMaxQuery(Arrays.asList(
        new TermQuery(new Term(FIELD, "quick")),
        new TermQuery(new Term(FIELD, "fox"))), 0f);
    assertEquals(Arrays.asList(1, 3), sortedBytes(extractor.getPayloadsForQuery(query)));
  }

  public void testMultiPhraseWithGap() throws Exception {
    addDoc("1", "quick brown fox");
    addDoc("2", "quick brown red fox");
    PayloadSpanExtractor extractor = openExtractor();
    MultiPhraseQuery query = new MultiPhraseQuery.Builder()
        .add(new Term[] {new Term(FIELD, "quick")}, 0)
        .add(new Term[] {new Term(FIELD, "fox")}, 2)
        .build();
    // one skipped position adds one to the slop, so only the first document matches
    assertEquals(Arrays.asList(1, 3), sortedBytes(extractor.getPayloadsForQuery(query)));
  }

  public void testSingleTermPhrase() throws Exception {
    addDoc("1", "quick brown fox");
    PayloadSpanExtractor extractor = openExtractor();
    assertEquals(Collections.singletonList(3), sortedBytes(extractor.getPayloadsForQuery(new PhraseQuery(FIELD, "fox"))));
    assertEquals(Collections.singletonList(3), sortedBytes(extractor.getPayloadsForQuery(new PhraseQuery(2, FIELD, "fox"))));
  }

  public void testMultiPhraseSinglePosition() throws Exception {
    addDoc("1", "quick brown fox");
    addDoc("2", "fast red fox");
    PayloadSpanExtractor extractor = openExtractor();
    MultiPhraseQuery synonyms = new MultiPhraseQuery.Builder()
        .add(new Term[] {new Term(FIELD, "quick"), new Term(FIELD, "fast")}, 0)
        .build();
    assertEquals(Arrays.asList(1, 1), sortedBytes(extractor.getPayloadsForQuery(synonyms)));

    MultiPhraseQuery single = new MultiPhraseQuery.Builder()
        .add(new Term[] {new Term(FIELD, "fox")}, 0)
        .build();
    assertEquals(Arrays.asList(3, 3), sortedBytes(extractor.getPayloadsForQuery(single)));
  }

  public void testMultiPhraseAlternatives() throws Exception {
    addDoc("1", "quick fox");
    addDoc("2", "slow fox");
    addDoc("3", "fast fox");
    PayloadSpanExtractor extractor = openExtractor();
    MultiPhraseQuery query = new MultiPhraseQuery.Builder()
        .add(new Term[] {new Term(FIELD, "quick"), new Term(FIELD, "slow")}, 0)
        .add(new Term[] {new Term(FIELD, "fox")}, 1)
        .build();
    assertEquals(Arrays.asList(1, 1, 2, 2), sortedBytes(extractor.getPayloadsForQuery(query)));
  }

  public void testSpanQueryAndBoost() throws Exception {
    addDoc("1", "quick brown fox");
    PayloadSpanExtractor extractor = openExtractor();
    SpanQuery near = new SpanNearQuery(new SpanQuery[] {
        new SpanTermQuery(new Term(FIELD, "quick")),
        new SpanTermQuery(new Term(FIELD, "fox"))}, 1, true);
    assertEquals(Arrays.asList(1, 3), sortedBytes(extractor.getPayloadsForQuery(near)));
    assertEquals(Arrays.asList(1, 3), sortedBytes(extractor.getPayloadsForQuery(new BoostQuery(near, 4f))));
  }

  public void testDeletedDocumentsAreSkipped() throws Exception {
    addDoc("1", "quick fox");
    addDoc("2", "brown fox");
    writer.deleteDocuments(new Term("id", "1"));
    PayloadSpanExtractor extractor = openExtractor();
    assertEquals(1, reader.numDocs());
    assertEquals(Collections.singletonList(2), sortedBytes(extractor.getPayloadsForQuery(new TermQuery(new Term(FIELD, "fox")))));
    assertTrue(extractor.getPayloadsForQuery(new TermQuery(new Term(FIELD, "quick"))).isEmpty());
  }

  public void testMultipleSegments() throws Exception {
    addDoc("1", "quick fox");
    writer.commit();
    addDoc("2", "the quick fox");
    PayloadSpanExtractor extractor = openExtractor();
    assertEquals(Arrays.asList(1, 2, 2, 3), sortedBytes(extractor.getPayloadsForQuery(new PhraseQuery(FIELD, "quick", "fox"))));
  }

  public void testFieldWithoutPayloads() throws Exception {
    Document doc = new Document();
    doc.add(new TextField(PositionPayloadAnalyzer.NO_PAYLOAD_FIELD, "quick fox", Field.Store.NO));
    writer.addDocument(doc);
    PayloadSpanExtractor extractor = openExtractor();
    Collection<byte[]> payloads = extractor.getPayloadsForQuery(
        new PhraseQuery(PositionPayloadAnalyzer.NO_PAYLOAD_FIELD, "quick", "fox"));
    assertTrue(payloads.isEmpty());
  }

  public void testUnsupportedAndMissingTerms() throws Exception {
    addDoc("1", "quick fox");
    PayloadSpanExtractor extractor = openExtractor();
    assertTrue(extractor.getPayloadsForQuery(new WildcardQuery(new Term(FIELD, "qu*"))).isEmpty());
    assertTrue(extractor.getPayloadsForQuery(new TermQuery(new Term(FIELD, "absent"))).isEmpty());
    assertTrue(extractor.getPayloadsForQuery(new TermQuery(new Term("nosuchfield", "fox"))).isEmpty());
  }

  public void testRequiresTopLevelContext() throws Exception {
    addDoc("1", "quick fox");
    openExtractor();
    expectThrows(IllegalArgumentException.class, () -> new PayloadSpanExtractor(reader.leaves().get(0)));
    expectThrows(IllegalArgumentException.class, () -> new PayloadSpanExtractor(null));
  }

  public void testInfoStream() throws Exception {
    addDoc("1", "quick fox");
    PayloadSpanExtractor extractor = openExtractor();
    final List<String> messages = new ArrayList<>();
    extractor.setInfoStream(new InfoStream() {
      @Override
      public void message(String component, String message) {
        messages.add(message);
      }

      @Override
      public boolean isEnabled(String component) {
        return "PSE".equals(component);
      }

      @Override
      public void close() {}
    });
    extractor.getPayloadsForQuery(new TermQuery(new Term(FIELD, "fox")));
    assertFalse(messages.isEmpty());
    assertTrue(messages.get(0), messages.get(0).endsWith("rewritten to 1 span queries"));
  }

  public void testRandomTermPayloads() throws Exception {
    String[] vocabulary = {"alpha", "beta", "gamma", "delta", "epsilon"};
    String target = vocabulary[random().nextInt(vocabulary.length)];
    List<Integer> expected = new ArrayList<>();
    int numDocs = atLeast(20);
    for (int i = 0; i < numDocs; i++) {
      int numTokens = 1 + random().nextInt(50);
      StringBuilder text = new StringBuilder();
      for (int position = 1; position <= numTokens; position++) {
        String token = vocabulary[random().nextInt(vocabulary.length)];
        if (token.equals(target)) {
          expected.add(position);
        }
        text.append(token).append(' ');
      }
      addDoc(Integer.toString(i), text.toString());
      if (random().nextInt(10) == 0) {
        writer.commit();
      }
    }
    Collections.sort(expected);
    PayloadSpanExtractor extractor = openExtractor();
    assertEquals(expected, sortedBytes(extractor.getPayloadsForQuery(new TermQuery(new Term(FIELD, target)))));
  }

  private void addDoc(String id, String text) throws IOException {
    Document doc = new Document();
    doc.add(new StringField("id", id, Field.Store.NO));
    doc.add(new TextField(FIELD, text, Field.Store.NO));
    writer.addDocument(doc);
  }

  private PayloadSpanExtractor openExtractor() throws IOException {
    reader = writer.getReader();
    return new PayloadSpanExtractor(reader.getContext());
  }

  private static List<Integer> sortedBytes(Collection<byte[]> payloads) {
    List<Integer> values = new ArrayList<>();
    for (byte[] payload : payloads) {
      assertEquals(1, payload.length);
      values.add((int) payload[0]);
    }
    Collections.sort(values);
    return values;
  }
}
